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

import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ListMultimap;
import com.google.common.collect.Multimaps;
import com.google.common.collect.Sets;
import com.google.jsformat.ast.Comment;
import com.google.jsformat.ast.Node;
import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.jspecify.annotations.Nullable;

/**
 * The output of the {@link CommentAttacher}: for every node, its leading, trailing and dangling
 * comments in source order, plus the format-ignore flags consumed by the printer.
 *
 * <p>Nodes and comments are keyed by identity. Instances are filled by a single attacher run and
 * are not thread-safe.
 */
public final class CommentAttachments {

  private final List<Attachment> attachments = new ArrayList<>();
  private final Map<Comment, Attachment> byComment = new IdentityHashMap<>();
  private final ListMultimap<Node, Attachment> byOwner =
      Multimaps.newListMultimap(new IdentityHashMap<>(), ArrayList::new);
  private final Set<Node> formatIgnored = Sets.newIdentityHashSet();
  private final Set<Comment> ignoreConsumed = Sets.newIdentityHashSet();

  CommentAttachments() {}

  void add(Attachment attachment) {
    Comment comment = attachment.comment();
    Attachment existing = byComment.get(comment);
    checkState(existing == null, "%s is already attached: %s", comment, existing);
    for (Attachment sibling : byOwner.get(attachment.owner())) {
      checkState(
          sibling.role() != attachment.role()
              || sibling.comment().getSourceOffset() < comment.getSourceOffset(),
          "%s attached out of source order after %s",
          comment,
          sibling.comment());
    }
    attachments.add(attachment);
    byComment.put(comment, attachment);
    byOwner.put(attachment.owner(), attachment);
  }

  void markFormatIgnored(Node n) {
    formatIgnored.add(n);
  }

  void markIgnoreConsumed(Comment comment) {
    ignoreConsumed.add(comment);
  }

  public ImmutableList<Comment> getLeading(Node n) {
    return getComments(n, AttachmentRole.LEADING);
  }

  public ImmutableList<Comment> getTrailing(Node n) {
    return getComments(n, AttachmentRole.TRAILING);
  }

  public ImmutableList<Comment> getDangling(Node n) {
    return getComments(n, AttachmentRole.DANGLING);
  }

  /** Returns the dangling comments of {@code n} tagged with {@code marker}. */
  public ImmutableList<Comment> getDangling(Node n, CommentMarker marker) {
    ImmutableList.Builder<Comment> builder = ImmutableList.builder();
    for (Attachment attachment : byOwner.get(n)) {
      if (attachment.role() == AttachmentRole.DANGLING && attachment.marker() == marker) {
        builder.add(attachment.comment());
      }
    }
    return builder.build();
  }

  public ImmutableList<Comment> getComments(Node n, AttachmentRole role) {
    ImmutableList.Builder<Comment> builder = ImmutableList.builder();
    for (Attachment attachment : byOwner.get(n)) {
      if (attachment.role() == role) {
        builder.add(attachment.comment());
      }
    }
    return builder.build();
  }

  /** All attachments owned by {@code n}, in source order. */
  public ImmutableList<Attachment> getAttachments(Node n) {
    return ImmutableList.copyOf(byOwner.get(n));
  }

  public boolean hasComments(Node n) {
    return byOwner.containsKey(n);
  }

  public @Nullable Attachment getAttachment(Comment comment) {
    return byComment.get(comment);
  }

  /** All attachments, in the source order of their comments. */
  public ImmutableList<Attachment> getAttachments() {
    return ImmutableList.copyOf(attachments);
  }

  public int size() {
    return attachments.size();
  }

  /** Whether the printer must reproduce the source of {@code n} verbatim. */
  public boolean isFormatIgnored(Node n) {
    return formatIgnored.contains(n);
  }

  /**
   * Whether the format-ignore directive in {@code comment} has already been applied to another
   * node, so that it must not also disable formatting of the comment's owner.
   */
  public boolean isIgnoreConsumed(Comment comment) {
    return ignoreConsumed.contains(comment);
  }
}
