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

import com.google.jsformat.ast.Node;

/** Attaches a comment that no handler claimed, from its placement alone. Never fails. */
final class DefaultCommentPolicy {

  private DefaultCommentPolicy() {}

  static void attach(CommentContext context) {
    Node enclosing = context.getEnclosingNode();
    Node preceding = context.getPrecedingNode();
    Node following = context.getFollowingNode();
    switch (context.getPlacement()) {
      case OWN_LINE -> {
        if (following != null) {
          context.addLeading(following);
        } else if (preceding != null) {
          context.addTrailing(preceding);
        } else {
          context.addDangling(enclosing);
        }
      }
      case END_OF_LINE -> {
        if (preceding != null && endsOnCommentLine(context, preceding)) {
          context.addTrailing(preceding);
        } else if (following != null) {
          context.addLeading(following);
        } else {
          context.addDangling(enclosing);
        }
      }
      case REMAINING -> context.addDangling(enclosing);
    }
  }

  private static boolean endsOnCommentLine(CommentContext context, Node n) {
    return !context
        .getText()
        .hasNewlineInRange(n.getSourceEndOffset(), context.getComment().getSourceOffset());
  }
}
