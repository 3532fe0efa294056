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
import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.EnumMultiset;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Multiset;
import com.google.errorprone.annotations.Immutable;
import com.google.jsformat.ast.Comment;
import com.google.jsformat.ast.Node;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Decides, for every comment of a source file, which node owns it and how.
 *
 * <p>Comments are processed in source order. Each comment is located in the tree (its enclosing,
 * preceding and following nodes), classified by its position on its line, and handed to the
 * handler chain of its placement. When no handler claims it, {@link DefaultCommentPolicy} attaches
 * it from the placement alone, so every comment ends up with exactly one attachment.
 *
 * <p>The attacher itself holds no state besides its options and may be shared between threads;
 * each call to {@link #attach} builds a fresh {@link CommentAttachments}.
 */
@Immutable
public final class CommentAttacher {

  private static final Logger logger = Logger.getLogger(CommentAttacher.class.getName());

  private final AttachmentOptions options;

  public CommentAttacher(AttachmentOptions options) {
    this.options = checkNotNull(options);
  }

  public CommentAttacher() {
    this(AttachmentOptions.defaults());
  }

  /**
   * Attaches {@code comments} to the nodes of {@code root}.
   *
   * @param root the root of the tree parsed from {@code text}, usually a SCRIPT
   * @param comments the comments of {@code text}, sorted by position
   * @param text the source text
   * @throws MalformedInputException if the tree or the comments break the attacher's
   *     preconditions
   */
  public CommentAttachments attach(Node root, List<Comment> comments, String text) {
    checkNotNull(root);
    checkNotNull(text);
    ImmutableList<Comment> sortedComments = ImmutableList.copyOf(comments);

    AstValidator validator = new AstValidator();
    if (options.validateInput()) {
      validator.validateTree(root, text);
      validator.validateComments(sortedComments, text);
    }

    SourceText source = new SourceText(text);
    RangeIndex index = new RangeIndex(root, validator);
    List<NodeNeighbors> neighbors = new ArrayList<>(sortedComments.size());
    for (Comment comment : sortedComments) {
      neighbors.add(index.locate(comment));
    }

    PlacementClassifier classifier = new PlacementClassifier(source, sortedComments, neighbors);
    CommentAttachments attachments = new CommentAttachments();
    Multiset<CommentPlacement> placements = EnumMultiset.create(CommentPlacement.class);
    int defaulted = 0;
    for (int i = 0; i < sortedComments.size(); i++) {
      Comment comment = sortedComments.get(i);
      CommentPlacement placement = classifier.classify(i);
      placements.add(placement);
      CommentContext context =
          new CommentContext(
              comment,
              neighbors.get(i),
              placement,
              source,
              root,
              i == sortedComments.size() - 1,
              options,
              attachments);
      if (!CommentHandlers.handle(context)) {
        DefaultCommentPolicy.attach(context);
        defaulted++;
      }
      Attachment attachment = attachments.getAttachment(comment);
      checkState(attachment != null, "no attachment recorded for %s", context);
      if (logger.isLoggable(Level.FINEST)) {
        logger.finest("Attached " + attachment);
      }
    }

    checkState(
        attachments.size() == sortedComments.size(),
        "attached %s of %s comments",
        attachments.size(),
        sortedComments.size());
    logger.fine(
        "Attached "
            + sortedComments.size()
            + " comments "
            + placements
            + ", "
            + defaulted
            + " by default policy");
    return attachments;
  }
}
