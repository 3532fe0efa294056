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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.jsformat.ast.Node;
import com.google.jsformat.ast.Slot;
import com.google.jsformat.ast.Token;
import java.util.Map;

/**
 * Comment rules for declarations, patterns, object members, module specifiers and types.
 */
final class DeclarationCommentHandlers {

  // In source order.
  private static final ImmutableMap<Slot, CommentMarker> HERITAGE_LISTS =
      ImmutableMap.of(
          Slot.EXTENDS, CommentMarker.EXTENDS,
          Slot.MIXINS, CommentMarker.MIXINS,
          Slot.IMPLEMENTS, CommentMarker.IMPLEMENTS);

  private DeclarationCommentHandlers() {}

  static boolean handleClassComments(CommentContext context) {
    Node enclosing = context.getEnclosingNode();
    Node preceding = context.getPrecedingNode();
    Node following = context.getFollowingNode();
    if (!NodeUtil.isClassLike(enclosing)) {
      return false;
    }

    ImmutableList<Node> decorators = enclosing.getChildren(Slot.DECORATOR);
    if (!decorators.isEmpty() && !(following != null && following.isDecorator())) {
      context.addTrailing(decorators.get(decorators.size() - 1));
      return true;
    }

    Node body = enclosing.getFirstChild(Slot.BODY);
    if (body != null && following == body) {
      context.addFirstInBlock(body);
      return true;
    }

    if (following == null) {
      return false;
    }

    // Leading comments on `extends`, `implements` or `mixins` entries would be printed after the
    // keyword, so they go on whatever precedes the keyword.
    Node id = enclosing.getFirstChild(Slot.ID);
    Node typeParameters = enclosing.getFirstChild(Slot.TYPE_PARAMETERS);
    Node superClass = enclosing.getFirstChild(Slot.SUPER_CLASS);
    if (superClass != null
        && following == superClass
        && preceding != null
        && (preceding == id || preceding == typeParameters)) {
      context.addTrailing(preceding);
      return true;
    }

    for (Map.Entry<Slot, CommentMarker> list : HERITAGE_LISTS.entrySet()) {
      if (following == enclosing.getFirstChild(list.getKey())) {
        if (preceding != null
            && (preceding == id || preceding == typeParameters || preceding == superClass)) {
          context.addTrailing(preceding);
        } else {
          context.addDangling(enclosing, list.getValue());
        }
        return true;
      }
    }
    return false;
  }

  static boolean handleModuleSpecifiersComments(CommentContext context) {
    Node enclosing = context.getEnclosingNode();
    Node preceding = context.getPrecedingNode();
    Token token = enclosing.getToken();
    if (token == Token.IMPORT_SPEC || token == Token.EXPORT_SPEC) {
      context.addLeading(enclosing);
      return true;
    }

    boolean isImportDeclaration =
        preceding != null && preceding.getToken() == Token.IMPORT_SPEC && token == Token.IMPORT;
    boolean isExportDeclaration =
        preceding != null && preceding.getToken() == Token.EXPORT_SPEC && token == Token.EXPORT;
    if ((isImportDeclaration || isExportDeclaration)
        && context.getText().hasNewlineAfter(context.getComment().getSourceEndOffset())) {
      context.addTrailing(preceding);
      return true;
    }
    return false;
  }

  static boolean handleUnionTypeComments(CommentContext context) {
    Node enclosing = context.getEnclosingNode();
    Node preceding = context.getPrecedingNode();
    Node following = context.getFollowingNode();
    if (enclosing.isUnionType()) {
      if (context.isIgnoreComment() && following != null) {
        context.markFormatIgnored(following);
        context.markIgnoreConsumed();
      }
      if (preceding != null) {
        context.addTrailing(preceding);
        return true;
      }
      return false;
    }

    if (following != null && following.isUnionType() && context.isIgnoreComment()) {
      Node firstMember = following.getFirstChild(Slot.TYPE);
      if (firstMember != null) {
        context.markFormatIgnored(firstMember);
        context.markIgnoreConsumed();
      }
    }
    return false;
  }

  /** An ignore directive before {@code [K in T]} disables formatting of the whole mapped type. */
  static boolean handleIgnoreComments(CommentContext context) {
    Node enclosing = context.getEnclosingNode();
    Node following = context.getFollowingNode();
    if (context.isIgnoreComment()
        && enclosing.getToken() == Token.MAPPED_TYPE
        && following != null
        && following.isTypeParameter()
        && following.hasChild(Slot.CONSTRAINT)) {
      context.markFormatIgnored(enclosing);
      context.markIgnoreConsumed();
      context.addDangling(enclosing, CommentMarker.FORMAT_IGNORE);
      return true;
    }
    return false;
  }

  static boolean handleMappedTypeComments(CommentContext context) {
    Node enclosing = context.getEnclosingNode();
    if (enclosing.getToken() != Token.MAPPED_TYPE) {
      return false;
    }

    Node following = context.getFollowingNode();
    if (following != null && following.isTypeParameter()) {
      Node name = following.getFirstChild(Slot.NAME);
      if (name != null) {
        context.addLeading(name);
        return true;
      }
    }

    Node preceding = context.getPrecedingNode();
    if (preceding != null && preceding.isTypeParameter()) {
      Node constraint = preceding.getFirstChild(Slot.CONSTRAINT);
      if (constraint != null) {
        context.addTrailing(constraint);
        return true;
      }
    }
    return false;
  }

  static boolean handleAssignmentPatternComments(CommentContext context) {
    if (context.getEnclosingNode().isDefaultValue()) {
      context.addLeading(context.getEnclosingNode());
      return true;
    }
    return false;
  }

  /**
   * In a shorthand property with a default value, {@code {a = 1}}, the default value holds the
   * name. A comment between the name and {@code =} stays with the name.
   */
  static boolean handleObjectPropertyAssignment(CommentContext context) {
    Node enclosing = context.getEnclosingNode();
    Node preceding = context.getPrecedingNode();
    Node property = enclosing.getParent();
    if (enclosing.isDefaultValue()
        && NodeUtil.isObjectProperty(property)
        && property.isShorthand()
        && enclosing.isChildIn(Slot.LEFT, preceding)) {
      context.addTrailing(preceding);
      return true;
    }
    return false;
  }

  static boolean handlePropertyComments(CommentContext context) {
    if (NodeUtil.isObjectProperty(context.getEnclosingNode())) {
      context.addLeading(context.getEnclosingNode());
      return true;
    }
    return false;
  }

  /**
   * <pre>
   * const a = // comment
   *   { b: 1 };
   * </pre>
   */
  static boolean handleVariableDeclaratorComments(CommentContext context) {
    Node following = context.getFollowingNode();
    if (NodeUtil.isAssignmentLike(context.getEnclosingNode())
        && following != null
        && (NodeUtil.isComplexExpression(following) || context.getComment().isBlockComment())) {
      context.addLeading(following);
      return true;
    }
    return false;
  }

  static boolean handleMemberExpressionComments(CommentContext context) {
    Node enclosing = context.getEnclosingNode();
    Node following = context.getFollowingNode();
    if (NodeUtil.isMemberExpression(enclosing) && following != null && following.isName()) {
      context.addLeading(enclosing);
      return true;
    }
    return false;
  }

  static boolean handleConditionalExpressionComments(CommentContext context) {
    Node enclosing = context.getEnclosingNode();
    Node preceding = context.getPrecedingNode();
    Node following = context.getFollowingNode();
    boolean isSameLineAsPreceding =
        preceding != null
            && !context
                .getText()
                .hasNewlineInRange(
                    preceding.getSourceEndOffset(), context.getComment().getSourceOffset());
    if (!isSameLineAsPreceding
        && (enclosing.getToken() == Token.HOOK || enclosing.getToken() == Token.CONDITIONAL_TYPE)
        && following != null) {
      context.addLeading(following);
      return true;
    }
    return false;
  }

  static boolean handleClosureTypeCastComments(CommentContext context) {
    Node following = context.getFollowingNode();
    if (following != null && NodeUtil.isTypeCastComment(context.getComment())) {
      context.addLeading(following, CommentMarker.TYPE_CAST);
      return true;
    }
    return false;
  }
}
