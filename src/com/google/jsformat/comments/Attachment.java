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

/** The decision taken for one comment: its owner, its role and an optional marker. */
public record Attachment(
    Comment comment,
    Node owner,
    AttachmentRole role,
    CommentPlacement placement,
    @Nullable CommentMarker marker) {
  public Attachment {
    checkNotNull(comment, "comment");
    checkNotNull(owner, "owner");
    checkNotNull(role, "role");
    checkNotNull(placement, "placement");
  }

  @Override
  public String toString() {
    return comment.getText()
        + " -> "
        + role
        + " of "
        + owner
        + (marker == null ? "" : " [" + marker.getTag() + "]");
  }
}
