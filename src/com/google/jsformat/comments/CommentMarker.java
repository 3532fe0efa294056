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

/** Secondary tags on an attachment that change how the printer renders the comment. */
public enum CommentMarker {
  /** Dangling on a class, before its {@code implements} list. */
  IMPLEMENTS("implements"),
  /** Dangling on a class or interface, before its {@code extends} list. */
  EXTENDS("extends"),
  /** Dangling on a Flow class declaration, before its {@code mixins} list. */
  MIXINS("mixins"),
  /**
   * Dangling on the block-less consequent of an if statement, on the consequent's line: {@code if
   * (a) b; // comment}. Keeps the comment on that line instead of moving it before {@code else}.
   */
  SAME_LINE_BLOCKLESS_IF("same-line-blockless-if"),
  /** A Closure {@code @type} annotation whose payload must be kept as is. */
  TYPE_CAST("type-cast"),
  /** A format-ignore directive that has been applied to its owner. */
  FORMAT_IGNORE("format-ignore");

  private final String tag;

  CommentMarker(String tag) {
    this.tag = tag;
  }

  /** The name the printer knows this marker by. */
  public String getTag() {
    return tag;
  }
}
