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

/**
 * The three ordered handler chains, one per {@link CommentPlacement}. The first handler of a chain
 * that claims a comment decides its attachment; {@link DefaultCommentPolicy} decides when none
 * does.
 */
final class CommentHandlers {

  static final ImmutableList<CommentHandler> OWN_LINE_HANDLERS =
      ImmutableList.of(
          DeclarationCommentHandlers::handleIgnoreComments,
          FunctionCommentHandlers::handleLastFunctionArgComments,
          DeclarationCommentHandlers::handleMemberExpressionComments,
          StatementCommentHandlers::handleIfStatementComments,
          StatementCommentHandlers::handleWhileComments,
          StatementCommentHandlers::handleTryStatementComments,
          DeclarationCommentHandlers::handleClassComments,
          StatementCommentHandlers::handleForComments,
          DeclarationCommentHandlers::handleUnionTypeComments,
          StatementCommentHandlers::handleOnlyComments,
          DeclarationCommentHandlers::handleModuleSpecifiersComments,
          DeclarationCommentHandlers::handleAssignmentPatternComments,
          FunctionCommentHandlers::handleMethodNameComments,
          StatementCommentHandlers::handleLabeledStatementComments,
          StatementCommentHandlers::handleBreakAndContinueStatementComments);

  static final ImmutableList<CommentHandler> END_OF_LINE_HANDLERS =
      ImmutableList.of(
          DeclarationCommentHandlers::handleClosureTypeCastComments,
          FunctionCommentHandlers::handleLastFunctionArgComments,
          DeclarationCommentHandlers::handleConditionalExpressionComments,
          DeclarationCommentHandlers::handleModuleSpecifiersComments,
          StatementCommentHandlers::handleIfStatementComments,
          StatementCommentHandlers::handleWhileComments,
          StatementCommentHandlers::handleTryStatementComments,
          DeclarationCommentHandlers::handleClassComments,
          StatementCommentHandlers::handleLabeledStatementComments,
          FunctionCommentHandlers::handleCallExpressionComments,
          DeclarationCommentHandlers::handlePropertyComments,
          StatementCommentHandlers::handleOnlyComments,
          DeclarationCommentHandlers::handleVariableDeclaratorComments,
          StatementCommentHandlers::handleBreakAndContinueStatementComments,
          StatementCommentHandlers::handleSwitchDefaultCaseComments);

  static final ImmutableList<CommentHandler> REMAINING_HANDLERS =
      ImmutableList.of(
          DeclarationCommentHandlers::handleIgnoreComments,
          StatementCommentHandlers::handleIfStatementComments,
          StatementCommentHandlers::handleWhileComments,
          DeclarationCommentHandlers::handleObjectPropertyAssignment,
          FunctionCommentHandlers::handleCommentInEmptyParens,
          FunctionCommentHandlers::handleMethodNameComments,
          StatementCommentHandlers::handleOnlyComments,
          FunctionCommentHandlers::handleCommentAfterArrowParams,
          FunctionCommentHandlers::handleFunctionNameComments,
          DeclarationCommentHandlers::handleMappedTypeComments,
          StatementCommentHandlers::handleBreakAndContinueStatementComments,
          FunctionCommentHandlers::handleTSFunctionTrailingComments,
          CommentHandlers::handleAdjacentSiblingComments);

  private CommentHandlers() {}

  static ImmutableList<CommentHandler> forPlacement(CommentPlacement placement) {
    return switch (placement) {
      case OWN_LINE -> OWN_LINE_HANDLERS;
      case END_OF_LINE -> END_OF_LINE_HANDLERS;
      case REMAINING -> REMAINING_HANDLERS;
    };
  }

  /** Runs the chain for the context's placement and returns whether a handler claimed it. */
  static boolean handle(CommentContext context) {
    for (CommentHandler handler : forPlacement(context.getPlacement())) {
      if (handler.handle(context)) {
        return true;
      }
    }
    return false;
  }

  /**
   * A comment sandwiched between two nodes leads the following node when only whitespace, opening
   * parentheses or other comments separate them, and trails the preceding node otherwise.
   */
  static boolean handleAdjacentSiblingComments(CommentContext context) {
    Node preceding = context.getPrecedingNode();
    Node following = context.getFollowingNode();
    if (preceding == null || following == null) {
      return false;
    }
    SourceText text = context.getText();
    int gapEnd = following.getSourceOffset();
    int index = text.nextNonSpaceNonCommentIndex(context.getComment().getSourceEndOffset());
    while (index < gapEnd) {
      if (text.charAt(index) != '(') {
        context.addTrailing(preceding);
        return true;
      }
      index = text.nextNonSpaceNonCommentIndex(index + 1);
    }
    context.addLeading(following);
    return true;
  }
}
