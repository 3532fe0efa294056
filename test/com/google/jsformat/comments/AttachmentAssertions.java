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

import static com.google.common.truth.Truth.assertWithMessage;

import com.google.jsformat.ast.Comment;
import com.google.jsformat.ast.Node;
import com.google.jsformat.ast.TestAst;

/** Runs the attacher over a {@link TestAst} and checks where its comments ended up. */
final class AttachmentAssertions {

  private AttachmentAssertions() {}

  static CommentAttachments attach(TestAst ast, Node root) {
    return attach(ast, root, AttachmentOptions.defaults());
  }

  static CommentAttachments attach(TestAst ast, Node root, AttachmentOptions options) {
    return new CommentAttacher(options).attach(root, ast.comments(), ast.getSource());
  }

  static Attachment assertAttached(
      CommentAttachments attachments, Comment comment, AttachmentRole role, Node owner) {
    Attachment attachment = attachments.getAttachment(comment);
    assertWithMessage("attachment of %s", comment).that(attachment).isNotNull();
    assertWithMessage("role of %s", comment).that(attachment.role()).isEqualTo(role);
    assertWithMessage("owner of %s", comment).that(attachment.owner()).isSameInstanceAs(owner);
    return attachment;
  }

  static Attachment assertLeading(CommentAttachments attachments, Comment comment, Node owner) {
    return assertAttached(attachments, comment, AttachmentRole.LEADING, owner);
  }

  static Attachment assertTrailing(CommentAttachments attachments, Comment comment, Node owner) {
    return assertAttached(attachments, comment, AttachmentRole.TRAILING, owner);
  }

  static Attachment assertDangling(CommentAttachments attachments, Comment comment, Node owner) {
    return assertAttached(attachments, comment, AttachmentRole.DANGLING, owner);
  }
}
