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
import org.jspecify.annotations.Nullable;

/** Everything a {@link CommentHandler} may look at for one comment, and the way to commit. */
final class CommentContext {
  private final Comment comment;
  private final NodeNeighbors neighbors;
  private final CommentPlacement placement;
  private final SourceText text;
  private final Node root;
  private final boolean isLastComment;
  private final AttachmentOptions options;
  private final CommentAttachments attachments;

  CommentContext(
      Comment comment,
      NodeNeighbors neighbors,
      CommentPlacement placement,
      SourceText text,
      Node root,
      boolean isLastComment,
      AttachmentOptions options,
      CommentAttachments attachments) {
    this.comment = checkNotNull(comment);
    this.neighbors = checkNotNull(neighbors);
    this.placement = checkNotNull(placement);
    this.text = checkNotNull(text);
    this.root = checkNotNull(root);
    this.isLastComment = isLastComment;
    this.options = checkNotNull(options);
    this.attachments = checkNotNull(attachments);
  }

  Comment getComment() {
    return comment;
  }

  @Nullable Node getPrecedingNode() {
    return neighbors.preceding();
  }

  /** The smallest node containing the comment; the root when no other node does. */
  Node getEnclosingNode() {
    return neighbors.enclosing();
  }

  @Nullable Node getFollowingNode() {
    return neighbors.following();
  }

  CommentPlacement getPlacement() {
    return placement;
  }

  SourceText getText() {
    return text;
  }

  Node getRoot() {
    return root;
  }

  boolean isLastComment() {
    return isLastComment;
  }

  AttachmentOptions getOptions() {
    return options;
  }

  /** The first character after the comment that is neither whitespace nor another comment. */
  char getNextCharacter() {
    return text.nextNonSpaceNonCommentChar(comment.getSourceEndOffset());
  }

  boolean isIgnoreComment() {
    return options.isIgnoreComment(comment);
  }

  void addLeading(Node owner) {
    attach(owner, AttachmentRole.LEADING, null);
  }

  void addTrailing(Node owner) {
    attach(owner, AttachmentRole.TRAILING, null);
  }

  void addDangling(Node owner) {
    attach(owner, AttachmentRole.DANGLING, null);
  }

  void addDangling(Node owner, CommentMarker marker) {
    attach(owner, AttachmentRole.DANGLING, checkNotNull(marker));
  }

  void addLeading(Node owner, CommentMarker marker) {
    attach(owner, AttachmentRole.LEADING, checkNotNull(marker));
  }

  /**
   * Moves the comment inside a block-like node: leading on its first non-empty statement or
   * member, dangling on the node itself when there is none.
   */
  void addFirstInBlock(Node block) {
    Node first = NodeUtil.getFirstNonEmptyChild(block);
    if (first != null) {
      addLeading(first);
    } else {
      addDangling(block);
    }
  }

  /** {@link #addFirstInBlock} for blocks, a leading comment for any other statement. */
  void addFirstInBlockOrLeading(Node n) {
    if (n.isBlock()) {
      addFirstInBlock(n);
    } else {
      addLeading(n);
    }
  }

  void markFormatIgnored(Node n) {
    attachments.markFormatIgnored(n);
  }

  void markIgnoreConsumed() {
    attachments.markIgnoreConsumed(comment);
  }

  private void attach(Node owner, AttachmentRole role, @Nullable CommentMarker marker) {
    attachments.add(new Attachment(comment, checkNotNull(owner), role, placement, marker));
  }

  @Override
  public String toString() {
    return placement + " " + comment + " in " + neighbors;
  }
}
