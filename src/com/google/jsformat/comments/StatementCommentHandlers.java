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

import com.google.jsformat.ast.Comment;
import com.google.jsformat.ast.Node;
import com.google.jsformat.ast.Slot;
import com.google.jsformat.ast.Token;

/**
 * Comment rules for statements: conditionals, loops, try/catch, switch cases, labels, jumps and
 * scripts without statements.
 *
 * <p>A common theme is moving a comment that sits between a statement's header and its block
 * inside the block, so that the printer does not have to print it between the header and the
 * opening brace.
 */
final class StatementCommentHandlers {

  private StatementCommentHandlers() {}

  /**
   * <pre>
   * if (1) { ... }
   * // comment
   * else { ... }
   * </pre>
   *
   * would make the comment a leading comment of the else block, which prints badly. It is moved
   * inside that block instead, or kept on the consequent, depending on where it sits.
   */
  static boolean handleIfStatementComments(CommentContext context) {
    Node enclosing = context.getEnclosingNode();
    Node preceding = context.getPrecedingNode();
    Node following = context.getFollowingNode();
    if (!enclosing.isIf() || following == null) {
      return false;
    }

    // The tree does not record parentheses, so `if (a /* comment */) {}` is recognized by the next
    // character.
    if (preceding != null && context.getNextCharacter() == ')') {
      context.addTrailing(preceding);
      return true;
    }

    // Comments before `else`.
    if (enclosing.isChildIn(Slot.CONSEQUENT, preceding)
        && enclosing.isChildIn(Slot.ALTERNATE, following)) {
      Comment comment = context.getComment();
      if (preceding.isBlock() && !context.getOptions().breakBeforeElse()) {
        context.addTrailing(preceding);
      } else if (comment.isSingleLine() && comment.getLineno() == preceding.getLineno()) {
        //   if (cond1) expr1; // comment A
        //   else if (cond2) expr2; // comment A
        //   else expr3;
        context.addDangling(preceding, CommentMarker.SAME_LINE_BLOCKLESS_IF);
      } else {
        context.addDangling(enclosing);
      }
      return true;
    }

    if (following.isBlock()) {
      context.addFirstInBlock(following);
      return true;
    }

    if (following.isIf()) {
      Node consequent = following.getFirstChild(Slot.CONSEQUENT);
      if (consequent != null) {
        context.addFirstInBlockOrLeading(consequent);
        return true;
      }
      return false;
    }

    // if (a) /* comment */ b;
    if (enclosing.isChildIn(Slot.CONSEQUENT, following)) {
      context.addLeading(following);
      return true;
    }
    return false;
  }

  static boolean handleWhileComments(CommentContext context) {
    Node enclosing = context.getEnclosingNode();
    Node preceding = context.getPrecedingNode();
    Node following = context.getFollowingNode();
    if (enclosing.getToken() != Token.WHILE || following == null) {
      return false;
    }

    // while (a /* comment */) {}
    if (preceding != null && context.getNextCharacter() == ')') {
      context.addTrailing(preceding);
      return true;
    }

    if (following.isBlock()) {
      context.addFirstInBlock(following);
      return true;
    }

    if (enclosing.isChildIn(Slot.BODY, following)) {
      context.addLeading(following);
      return true;
    }
    return false;
  }

  /** Same as for if statements, for the blocks of try statements and catch clauses. */
  static boolean handleTryStatementComments(CommentContext context) {
    Node enclosing = context.getEnclosingNode();
    Node preceding = context.getPrecedingNode();
    Node following = context.getFollowingNode();
    if ((!enclosing.isTry() && !enclosing.isCatch()) || following == null) {
      return false;
    }

    // catch (e /* comment */) {}
    if (enclosing.isCatch() && preceding != null) {
      context.addTrailing(preceding);
      return true;
    }

    if (following.isBlock()) {
      context.addFirstInBlock(following);
      return true;
    }

    if (following.isTry()) {
      Node finalizer = following.getFirstChild(Slot.FINALIZER);
      if (finalizer == null) {
        return false;
      }
      context.addFirstInBlockOrLeading(finalizer);
      return true;
    }

    if (following.isCatch()) {
      Node body = following.getFirstChild(Slot.BODY);
      if (body == null) {
        return false;
      }
      context.addFirstInBlockOrLeading(body);
      return true;
    }
    return false;
  }

  static boolean handleForComments(CommentContext context) {
    Token token = context.getEnclosingNode().getToken();
    if (token == Token.FOR_IN || token == Token.FOR_OF) {
      context.addLeading(context.getEnclosingNode());
      return true;
    }
    return false;
  }

  /**
   * <pre>
   * default: // comment
   *   { stmt; }
   * </pre>
   */
  static boolean handleSwitchDefaultCaseComments(CommentContext context) {
    Node enclosing = context.getEnclosingNode();
    if (enclosing.getToken() != Token.DEFAULT_CASE) {
      return false;
    }
    Node following = context.getFollowingNode();
    if (following != null && following.isBlock() && context.getComment().isLineComment()) {
      context.addFirstInBlock(following);
    } else {
      context.addDangling(enclosing);
    }
    return true;
  }

  static boolean handleLabeledStatementComments(CommentContext context) {
    if (context.getEnclosingNode().getToken() == Token.LABEL) {
      context.addLeading(context.getEnclosingNode());
      return true;
    }
    return false;
  }

  static boolean handleBreakAndContinueStatementComments(CommentContext context) {
    Node enclosing = context.getEnclosingNode();
    if ((enclosing.getToken() == Token.BREAK || enclosing.getToken() == Token.CONTINUE)
        && !enclosing.hasChild(Slot.LABEL)) {
      context.addTrailing(enclosing);
      return true;
    }
    return false;
  }

  /** A script holding nothing but comments: they all belong to the script itself. */
  static boolean handleOnlyComments(CommentContext context) {
    Node root = context.getRoot();
    if (!root.isScript() || !NodeUtil.hasNoStatements(root)) {
      return false;
    }
    if (context.isLastComment()) {
      context.addDangling(root);
    } else {
      context.addLeading(root);
    }
    return true;
  }
}
