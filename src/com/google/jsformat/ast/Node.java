/*
 * Copyright 2026 The Closure Compiler Authors.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.google.jsformat.ast;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * A node of the syntax tree handed over by the parser.
 *
 * <p>The source range, line numbers and token of a node never change once it has been created.
 * Children are appended by the tree producer while the tree is being built and are expected to be
 * non-overlapping and sorted by source position (see {@code AstValidator}). Comments are not stored
 * on nodes; they live in a side table built by the comment attacher.
 */
public final class Node {

  /** Boolean properties a parser may set on a node. */
  public enum Prop {
    // An object literal property written as `{a}` or `{a = 1}`.
    SHORTHAND,
  }

  private final Token token;
  private final int sourceOffset;
  private final int length;
  private final int lineno;
  private final int endLineno;

  private final List<Node> children = new ArrayList<>();
  private final EnumSet<Prop> props = EnumSet.noneOf(Prop.class);
  private @Nullable Node parent;
  private @Nullable Slot slot;
  private @Nullable String str;

  private Node(Token token, int sourceOffset, int length, int lineno, int endLineno) {
    this.token = checkNotNull(token);
    this.sourceOffset = sourceOffset;
    this.length = length;
    this.lineno = lineno;
    this.endLineno = endLineno;
  }

  /**
   * Creates a node covering the source range {@code [start, end)}.
   *
   * @param lineno the 1-based line of {@code start}
   * @param endLineno the 1-based line of {@code end}
   */
  public static Node newNode(Token token, int start, int end, int lineno, int endLineno) {
    checkArgument(start >= 0 && end >= start, "bad range [%s, %s) for %s", start, end, token);
    checkArgument(
        lineno >= 1 && endLineno >= lineno, "bad lines %s-%s for %s", lineno, endLineno, token);
    return new Node(token, start, end - start, lineno, endLineno);
  }

  public static Node newString(
      Token token, String str, int start, int end, int lineno, int endLineno) {
    Node n = newNode(token, start, end, lineno, endLineno);
    n.str = checkNotNull(str);
    return n;
  }

  public Token getToken() {
    return token;
  }

  /** The offset of the first character of this node. */
  public int getSourceOffset() {
    return sourceOffset;
  }

  /** The offset just past the last character of this node. */
  public int getSourceEndOffset() {
    return sourceOffset + length;
  }

  public int getLength() {
    return length;
  }

  public int getLineno() {
    return lineno;
  }

  public int getEndLineno() {
    return endLineno;
  }

  /** Returns the name or literal text of NAME-like nodes, or null if the parser did not set one. */
  public @Nullable String getString() {
    return str;
  }

  // ---- children ----

  public void addChildToBack(Slot slot, Node child) {
    checkNotNull(slot);
    checkArgument(child.parent == null, "%s already has a parent", child);
    checkArgument(child != this, "a node cannot be its own child");
    child.parent = this;
    child.slot = slot;
    children.add(child);
  }

  /** All children in source order. */
  public List<Node> children() {
    return Collections.unmodifiableList(children);
  }

  public int getChildCount() {
    return children.size();
  }

  public @Nullable Node getFirstChild() {
    return children.isEmpty() ? null : children.get(0);
  }

  public @Nullable Node getLastChild() {
    return children.isEmpty() ? null : children.get(children.size() - 1);
  }

  public Node getChildAtIndex(int i) {
    return children.get(i);
  }

  /** Returns the first child occupying {@code slot}, or null if there is none. */
  public @Nullable Node getFirstChild(Slot slot) {
    for (Node child : children) {
      if (child.slot == slot) {
        return child;
      }
    }
    return null;
  }

  /** Returns the last child occupying {@code slot}, or null if there is none. */
  public @Nullable Node getLastChild(Slot slot) {
    Node last = null;
    for (Node child : children) {
      if (child.slot == slot) {
        last = child;
      }
    }
    return last;
  }

  /** Returns the children occupying {@code slot} in source order. */
  public ImmutableList<Node> getChildren(Slot slot) {
    ImmutableList.Builder<Node> builder = ImmutableList.builder();
    for (Node child : children) {
      if (child.slot == slot) {
        builder.add(child);
      }
    }
    return builder.build();
  }

  public boolean hasChild(Slot slot) {
    return getFirstChild(slot) != null;
  }

  /** Whether {@code child} is a direct child of this node occupying {@code slot}. */
  public boolean isChildIn(Slot slot, @Nullable Node child) {
    return child != null && child.parent == this && child.slot == slot;
  }

  public @Nullable Node getParent() {
    return parent;
  }

  /** The slot this node occupies in its parent, or null for a root. */
  public @Nullable Slot getSlot() {
    return slot;
  }

  public @Nullable Node getNext() {
    if (parent == null) {
      return null;
    }
    int index = parent.children.indexOf(this);
    return index + 1 < parent.children.size() ? parent.children.get(index + 1) : null;
  }

  public @Nullable Node getPrevious() {
    if (parent == null) {
      return null;
    }
    int index = parent.children.indexOf(this);
    return index > 0 ? parent.children.get(index - 1) : null;
  }

  // ---- properties ----

  public void putBooleanProp(Prop prop, boolean value) {
    if (value) {
      props.add(prop);
    } else {
      props.remove(prop);
    }
  }

  public boolean isShorthand() {
    return props.contains(Prop.SHORTHAND);
  }

  // ---- token predicates ----

  public boolean isScript() {
    return token == Token.SCRIPT;
  }

  public boolean isBlock() {
    return token == Token.BLOCK;
  }

  public boolean isEmpty() {
    return token == Token.EMPTY;
  }

  public boolean isIf() {
    return token == Token.IF;
  }

  public boolean isTry() {
    return token == Token.TRY;
  }

  public boolean isCatch() {
    return token == Token.CATCH;
  }

  public boolean isName() {
    return token == Token.NAME;
  }

  public boolean isDecorator() {
    return token == Token.DECORATOR;
  }

  public boolean isDefaultValue() {
    return token == Token.DEFAULT_VALUE;
  }

  public boolean isTypeParameter() {
    return token == Token.TYPE_PARAMETER;
  }

  public boolean isUnionType() {
    return token == Token.UNION_TYPE;
  }

  // ---- debugging ----

  /** The location of this node in the form {@code lineno:start-end}. */
  public String getLocation() {
    return lineno + ":" + sourceOffset + "-" + getSourceEndOffset();
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    sb.append(token);
    if (str != null) {
      sb.append(' ').append(str);
    }
    if (slot != null) {
      sb.append(" (").append(slot).append(')');
    }
    sb.append(" [").append(getLocation()).append(']');
    return sb.toString();
  }

  /** Prints this node and its descendants, one per line, indented by depth. */
  public String toStringTree() {
    StringBuilder sb = new StringBuilder();
    appendStringTree(sb, 0);
    return sb.toString();
  }

  private void appendStringTree(StringBuilder sb, int depth) {
    sb.append(Strings.repeat("    ", depth)).append(this).append('\n');
    for (Node child : children) {
      child.appendStringTree(sb, depth + 1);
    }
  }
}
