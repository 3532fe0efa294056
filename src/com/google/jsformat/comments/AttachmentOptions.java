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

import com.google.common.base.CharMatcher;
import com.google.common.base.MoreObjects;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import com.google.errorprone.annotations.Immutable;
import com.google.jsformat.ast.Comment;

/** Options controlling where the {@link CommentAttacher} puts comments. */
@Immutable
public final class AttachmentOptions {

  public static final String DEFAULT_IGNORE_DIRECTIVE = "prettier-ignore";

  private final boolean breakBeforeElse;
  private final String ignoreDirective;
  private final boolean validateInput;

  private AttachmentOptions(Builder builder) {
    this.breakBeforeElse = builder.breakBeforeElse;
    this.ignoreDirective = builder.ignoreDirective;
    this.validateInput = builder.validateInput;
  }

  public static AttachmentOptions defaults() {
    return builder().build();
  }

  public static Builder builder() {
    return new Builder();
  }

  public Builder toBuilder() {
    return new Builder()
        .setBreakBeforeElse(breakBeforeElse)
        .setIgnoreDirective(ignoreDirective)
        .setValidateInput(validateInput);
  }

  /**
   * Whether {@code else} is printed on its own line. When false (the default, "cuddled" else), a
   * comment between a block consequent and {@code else} stays a trailing comment of the block.
   */
  public boolean breakBeforeElse() {
    return breakBeforeElse;
  }

  /** The comment value, ignoring surrounding whitespace, that turns off formatting of a node. */
  public String getIgnoreDirective() {
    return ignoreDirective;
  }

  /** Whether the tree and comments are checked before attaching. */
  public boolean validateInput() {
    return validateInput;
  }

  /** Whether {@code comment} is a format-ignore directive. */
  public boolean isIgnoreComment(Comment comment) {
    return CharMatcher.whitespace().trimFrom(comment.getValue()).equals(ignoreDirective);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("breakBeforeElse", breakBeforeElse)
        .add("ignoreDirective", ignoreDirective)
        .add("validateInput", validateInput)
        .toString();
  }

  /** Builder for {@link AttachmentOptions}. */
  public static final class Builder {
    private boolean breakBeforeElse = false;
    private String ignoreDirective = DEFAULT_IGNORE_DIRECTIVE;
    private boolean validateInput = true;

    private Builder() {}

    @CanIgnoreReturnValue
    public Builder setBreakBeforeElse(boolean breakBeforeElse) {
      this.breakBeforeElse = breakBeforeElse;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setIgnoreDirective(String ignoreDirective) {
      checkNotNull(ignoreDirective);
      checkArgument(
          !CharMatcher.whitespace().trimFrom(ignoreDirective).isEmpty(),
          "the ignore directive must not be blank");
      this.ignoreDirective = CharMatcher.whitespace().trimFrom(ignoreDirective);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setValidateInput(boolean validateInput) {
      this.validateInput = validateInput;
      return this;
    }

    public AttachmentOptions build() {
      return new AttachmentOptions(this);
    }
  }
}
