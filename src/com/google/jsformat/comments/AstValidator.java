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

import com.google.jsformat.ast.Comment;
import com.google.jsformat.ast.Node;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * Checks the preconditions the comment attacher relies on: children of every node are sorted,
 * non-overlapping and inside their parent, and comments are sorted, non-overlapping and match the
 * source text.
 */
public final class AstValidator {

  /** Violation handler */
  public interface ViolationHandler {
    void handleViolation(DiagnosticType type, String message);
  }

  private final ViolationHandler violationHandler;

  public AstValidator(ViolationHandler handler) {
    this.violationHandler = checkNotNull(handler);
  }

  /** Creates a validator that throws a {@link MalformedInputException} on the first violation. */
  public AstValidator() {
    this(
        (type, message) -> {
          throw new MalformedInputException(type, message);
        });
  }

  public void validateTree(Node root, String text) {
    if (root.getSourceEndOffset() > text.length()) {
      violation(DiagnosticType.MALFORMED_TREE, root, "ends past the end of the text");
    }
    // Iterative, minified sources produce very deep trees.
    Deque<Node> worklist = new ArrayDeque<>();
    worklist.push(root);
    while (!worklist.isEmpty()) {
      Node n = worklist.pop();
      validateChildren(n);
      for (Node child : n.children()) {
        worklist.push(child);
      }
    }
  }

  private void validateChildren(Node parent) {
    Node previous = null;
    for (Node child : parent.children()) {
      if (child.getParent() != parent) {
        violation(DiagnosticType.MALFORMED_TREE, child, "parent link does not match " + parent);
      }
      if (child.getSourceOffset() < parent.getSourceOffset()
          || child.getSourceEndOffset() > parent.getSourceEndOffset()) {
        violation(DiagnosticType.MALFORMED_TREE, child, "lies outside its parent " + parent);
      }
      if (previous != null && child.getSourceOffset() < previous.getSourceEndOffset()) {
        violation(
            DiagnosticType.MALFORMED_TREE,
            child,
            "overlaps or precedes its previous sibling " + previous);
      }
      previous = child;
    }
  }

  public void validateComments(List<Comment> comments, String text) {
    Comment previous = null;
    for (Comment comment : comments) {
      if (comment.getSourceEndOffset() > text.length()) {
        violation(DiagnosticType.MALFORMED_COMMENT, comment, "ends past the end of the text");
      } else if (!text.startsWith(comment.getText(), comment.getSourceOffset())) {
        violation(DiagnosticType.MALFORMED_COMMENT, comment, "does not match the source text");
      }
      if (previous != null && comment.getSourceOffset() < previous.getSourceEndOffset()) {
        violation(
            DiagnosticType.MALFORMED_COMMENT,
            comment,
            "overlaps or precedes the previous comment " + previous);
      }
      previous = comment;
    }
  }

  /** Reports a comment that cuts through a node instead of lying between its children. */
  void reportOverlap(@Nullable Comment comment, Node node) {
    violation(
        DiagnosticType.MALFORMED_COMMENT, comment == null ? "query" : comment, "overlaps " + node);
  }

  private void violation(DiagnosticType type, Object subject, String detail) {
    violationHandler.handleViolation(type, type.format(subject, detail));
  }
}
