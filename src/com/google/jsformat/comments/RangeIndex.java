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

package com.google.jsformat.comments;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import com.google.jsformat.ast.Comment;
import com.google.jsformat.ast.Node;
import com.google.jsformat.ast.Slot;
import com.google.jsformat.ast.Token;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * Answers nearest-node queries over a syntax tree whose children are sorted and non-overlapping.
 *
 * <p>Queries descend from the root by binary search over the <em>comment children</em> of each
 * node: its children, with nodes that cannot own comments (empty statements, template string
 * parts) replaced by their own children. The comment children of a node are computed once and
 * cached for the lifetime of the index.
 */
public final class RangeIndex {

  private final Node root;
  private final AstValidator validator;
  private final Map<Node, ImmutableList<Node>> commentChildren = new IdentityHashMap<>();

  public RangeIndex(Node root) {
    this(root, new AstValidator());
  }

  RangeIndex(Node root, AstValidator validator) {
    this.root = checkNotNull(root);
    this.validator = checkNotNull(validator);
  }

  /** Returns the smallest node containing {@code offset}, or the root if no child does. */
  public Node enclosing(int offset) {
    return search(offset, offset, null).enclosing();
  }

  /** Returns the nearest node ending at or before {@code offset} inside {@link #enclosing}. */
  public @Nullable Node preceding(int offset) {
    return search(offset, offset, null).preceding();
  }

  /** Returns the nearest node starting at or after {@code offset} inside {@link #enclosing}. */
  public @Nullable Node following(int offset) {
    return search(offset, offset, null).following();
  }

  /** Returns the nodes around {@code comment}. */
  public NodeNeighbors locate(Comment comment) {
    return search(comment.getSourceOffset(), comment.getSourceEndOffset(), comment);
  }

  private NodeNeighbors search(int start, int end, @Nullable Comment comment) {
    Node enclosing = root;
    Node preceding = null;
    Node following = null;
    boolean descended = true;
    while (descended) {
      descended = false;
      preceding = null;
      following = null;
      List<Node> children = getCommentChildNodes(enclosing);
      int left = 0;
      int right = children.size();
      while (left < right) {
        int middle = (left + right) >>> 1;
        Node child = children.get(middle);
        int childStart = child.getSourceOffset();
        int childEnd = child.getSourceEndOffset();
        if (childStart <= start && end <= childEnd && start < childEnd) {
          enclosing = child;
          descended = true;
          break;
        } else if (childEnd <= start) {
          preceding = child;
          left = middle + 1;
        } else if (end <= childStart) {
          following = child;
          right = middle;
        } else {
          validator.reportOverlap(comment, child);
          break;
        }
      }
    }

    if (enclosing.getToken() == Token.TEMPLATELIT) {
      // Only nodes inside the same ${...} substitution relate to the comment.
      ImmutableList<Node> quasis = enclosing.getChildren(Slot.QUASI);
      int substitution = substitutionIndex(quasis, start);
      if (preceding != null
          && substitutionIndex(quasis, preceding.getSourceOffset()) != substitution) {
        preceding = null;
      }
      if (following != null
          && substitutionIndex(quasis, following.getSourceOffset()) != substitution) {
        following = null;
      }
    }
    return new NodeNeighbors(enclosing, preceding, following);
  }

  private static int substitutionIndex(List<Node> quasis, int offset) {
    int position = offset - 1;
    for (int i = 1; i < quasis.size(); i++) {
      if (position < quasis.get(i).getSourceOffset()) {
        return i - 1;
      }
    }
    return 0;
  }

  /** Returns the children of {@code n} that may own a comment, in source order. */
  ImmutableList<Node> getCommentChildNodes(Node n) {
    ImmutableList<Node> cached = commentChildren.get(n);
    if (cached != null) {
      return cached;
    }
    ImmutableList.Builder<Node> builder = ImmutableList.builder();
    Node function = n.getFirstChild(Slot.VALUE);
    if (n.getToken() == Token.MEMBER_FUNCTION_DEF && isBareMethodValue(function)) {
      // class Foo { bar() // comment
      //   {} }
      // The comment belongs to the body, not to the parameterless function value.
      builder.addAll(n.getChildren(Slot.DECORATOR));
      builder.addAll(n.getChildren(Slot.KEY));
      builder.add(function.getFirstChild(Slot.BODY));
    } else {
      for (Node child : n.children()) {
        if (child.getToken().canAttachComment()) {
          builder.add(child);
        } else {
          builder.addAll(getCommentChildNodes(child));
        }
      }
    }
    ImmutableList<Node> result = builder.build();
    commentChildren.put(n, result);
    return result;
  }

  private static boolean isBareMethodValue(@Nullable Node function) {
    return function != null
        && function.getToken() == Token.FUNCTION_EXPRESSION
        && function.hasChild(Slot.BODY)
        && !function.hasChild(Slot.PARAM)
        && !function.hasChild(Slot.RETURN_TYPE)
        && !function.hasChild(Slot.TYPE_PARAMETERS);
  }
}
