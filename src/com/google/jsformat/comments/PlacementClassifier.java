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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.jsformat.ast.Comment;
import com.google.jsformat.ast.Node;
import java.util.List;

/**
 * Assigns each comment a {@link CommentPlacement} by looking at the text around it.
 *
 * <p>Comments next to each other on one line and between the same pair of nodes are looked through,
 * so two block comments alone on a line are both own-line comments.
 */
final class PlacementClassifier {
  private final SourceText text;
  private final List<Comment> comments;
  private final List<NodeNeighbors> neighbors;

  PlacementClassifier(SourceText text, List<Comment> comments, List<NodeNeighbors> neighbors) {
    checkArgument(comments.size() == neighbors.size(), "one set of neighbors per comment");
    this.text = checkNotNull(text);
    this.comments = comments;
    this.neighbors = neighbors;
  }

  CommentPlacement classify(int index) {
    if (isOwnLine(index)) {
      return CommentPlacement.OWN_LINE;
    } else if (isEndOfLine(index)) {
      return CommentPlacement.END_OF_LINE;
    }
    return CommentPlacement.REMAINING;
  }

  private boolean isOwnLine(int index) {
    int start = comments.get(index).getSourceOffset();
    Node preceding = neighbors.get(index).preceding();
    if (preceding != null) {
      // Find the first comment on the same line.
      for (int i = index - 1; i >= 0; i--) {
        Comment previous = comments.get(i);
        if (neighbors.get(i).preceding() != preceding
            || !text.isBlankOnOneLine(previous.getSourceEndOffset(), start)) {
          break;
        }
        start = previous.getSourceOffset();
      }
    }
    return text.hasNewlineBefore(start);
  }

  private boolean isEndOfLine(int index) {
    int end = comments.get(index).getSourceEndOffset();
    Node following = neighbors.get(index).following();
    if (following != null) {
      // Find the last comment on the same line.
      for (int i = index + 1; i < comments.size(); i++) {
        Comment next = comments.get(i);
        if (neighbors.get(i).following() != following
            || !text.isBlankOnOneLine(end, next.getSourceOffset())) {
          break;
        }
        end = next.getSourceEndOffset();
      }
    }
    return text.hasNewlineAfter(end);
  }
}
