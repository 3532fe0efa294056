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
import com.google.jsformat.ast.Node;
import com.google.jsformat.ast.Slot;
import com.google.jsformat.ast.Token;

/**
 * Comment rules around functions, parameter lists, argument lists and method names. Parentheses
 * are not part of the tree, so most of these look at the character following the comment.
 */
final class FunctionCommentHandlers {

  private FunctionCommentHandlers() {}

  static boolean handleLastFunctionArgComments(CommentContext context) {
    Node enclosing = context.getEnclosingNode();
    Node preceding = context.getPrecedingNode();
    Node following = context.getFollowingNode();

    // Flow function type definitions
    if (preceding != null
        && preceding.getToken() == Token.FUNCTION_TYPE_PARAM
        && enclosing.getToken() == Token.FUNCTION_TYPE_ANNOTATION
        && (following == null || following.getToken() != Token.FUNCTION_TYPE_PARAM)) {
      context.addTrailing(preceding);
      return true;
    }

    // function f(a, b /* comment */) {}
    if (preceding != null
        && (preceding.isName() || preceding.isDefaultValue())
        && NodeUtil.isFunctionLike(enclosing)
        && context.getNextCharacter() == ')') {
      context.addTrailing(preceding);
      return true;
    }

    // function f(a, b) /* comment */ {}
    if (enclosing.getToken() == Token.FUNCTION && following != null && following.isBlock()) {
      int rightParen = getParameterListEnd(context.getText(), enclosing);
      if (rightParen != -1 && context.getComment().getSourceOffset() > rightParen) {
        context.addFirstInBlock(following);
        return true;
      }
    }
    return false;
  }

  /** Returns the offset of the {@code )} closing the parameters of {@code function}, or -1. */
  private static int getParameterListEnd(SourceText text, Node function) {
    ImmutableList<Node> params = NodeUtil.getFunctionParameters(function);
    if (!params.isEmpty()) {
      return text.nextNonSpaceNonCommentIndex(params.get(params.size() - 1).getSourceEndOffset());
    }
    Node beforeParams = function.getFirstChild(Slot.TYPE_PARAMETERS);
    if (beforeParams == null) {
      beforeParams = function.getFirstChild(Slot.ID);
    }
    int leftParen =
        beforeParams != null
            ? text.nextNonSpaceNonCommentIndex(beforeParams.getSourceEndOffset())
            : text.indexOf('(', function.getSourceOffset());
    if (leftParen == -1) {
      return -1;
    }
    return text.nextNonSpaceNonCommentIndex(leftParen + 1);
  }

  /** A comment inside empty parameter or argument parentheses dangles on the function or call. */
  static boolean handleCommentInEmptyParens(CommentContext context) {
    if (context.getNextCharacter() != ')') {
      return false;
    }
    Node enclosing = context.getEnclosingNode();
    if ((NodeUtil.isFunctionLike(enclosing)
            && NodeUtil.getFunctionParameters(enclosing).isEmpty())
        || (NodeUtil.isCallLike(enclosing) && NodeUtil.getCallArguments(enclosing).isEmpty())) {
      context.addDangling(enclosing);
      return true;
    }

    if (enclosing.getToken() == Token.MEMBER_FUNCTION_DEF
        || enclosing.getToken() == Token.ABSTRACT_METHOD) {
      Node function = enclosing.getFirstChild(Slot.VALUE);
      if (function != null && NodeUtil.getFunctionParameters(function).isEmpty()) {
        context.addDangling(function);
        return true;
      }
    }
    return false;
  }

  /**
   * A comment right before the arrow, or before the parenthesis closing the parameters of an arrow
   * function, is printed with the parameters.
   */
  static boolean handleCommentAfterArrowParams(CommentContext context) {
    Node enclosing = context.getEnclosingNode();
    if (enclosing.getToken() != Token.ARROW_FUNCTION) {
      return false;
    }
    SourceText text = context.getText();
    int index = text.nextNonSpaceNonCommentIndex(context.getComment().getSourceEndOffset());
    if (text.startsWith("=>", index)
        || (text.charAt(index) == ')'
            && text.startsWith("=>", text.nextNonSpaceNonCommentIndex(index + 1)))) {
      context.addDangling(enclosing);
      return true;
    }
    return false;
  }

  /** A comment between a function or method name and its parameters trails the name. */
  static boolean handleFunctionNameComments(CommentContext context) {
    if (context.getNextCharacter() != '(') {
      return false;
    }
    Node preceding = context.getPrecedingNode();
    if (preceding != null && NodeUtil.isNamedFunctionLike(context.getEnclosingNode())) {
      context.addTrailing(preceding);
      return true;
    }
    return false;
  }

  static boolean handleMethodNameComments(CommentContext context) {
    Node enclosing = context.getEnclosingNode();
    Node preceding = context.getPrecedingNode();
    if (preceding == null) {
      return false;
    }

    // obj = { fn /* comment */() {} };
    // but not { key: /* comment */(value) }, where the comment belongs to the value.
    Token token = enclosing.getToken();
    if ((token == Token.PROPERTY || token == Token.DECLARE_METHOD || token == Token.ABSTRACT_METHOD)
        && preceding.isName()
        && enclosing.isChildIn(Slot.KEY, preceding)
        && context.getNextCharacter() == '('
        && context.getText().nextNonSpaceNonCommentChar(preceding.getSourceEndOffset()) != ':') {
      context.addTrailing(preceding);
      return true;
    }

    // Comments between a decorator and the member it decorates stay with the decorator.
    if (preceding.isDecorator() && NodeUtil.isClassMember(enclosing)) {
      context.addTrailing(preceding);
      return true;
    }
    return false;
  }

  /** An end-of-line comment between a callee and its arguments leads the first argument. */
  static boolean handleCallExpressionComments(CommentContext context) {
    Node enclosing = context.getEnclosingNode();
    Node preceding = context.getPrecedingNode();
    if (NodeUtil.isCallExpression(enclosing) && enclosing.isChildIn(Slot.CALLEE, preceding)) {
      ImmutableList<Node> arguments = NodeUtil.getCallArguments(enclosing);
      if (!arguments.isEmpty()) {
        context.addLeading(arguments.get(0));
        return true;
      }
    }
    return false;
  }

  /** A comment before the semicolon ending a signature without a body trails the signature. */
  static boolean handleTSFunctionTrailingComments(CommentContext context) {
    Node enclosing = context.getEnclosingNode();
    Token token = enclosing.getToken();
    if (context.getFollowingNode() == null
        && (token == Token.METHOD_SIGNATURE
            || token == Token.DECLARE_FUNCTION
            || token == Token.ABSTRACT_METHOD)
        && context.getNextCharacter() == ';') {
      context.addTrailing(enclosing);
      return true;
    }
    return false;
  }
}
