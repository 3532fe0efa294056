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

package com.google.jsformat.ast;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.errorprone.annotations.Immutable;

/**
 * Minimal class holding a comment's source location and contents, as extracted by the tokenizer.
 *
 * <p>Comments are compared by identity: two comments with the same text at different offsets are
 * different comments.
 */
@Immutable
public final class Comment {

  /** The two comment syntaxes. */
  public enum Kind {
    /** {@code // ...} up to the end of the line. */
    LINE,
    /** {@code /* ... *}{@code /}, possibly spanning several lines. */
    BLOCK
  }

  private final Kind kind;
  private final int sourceOffset;
  private final int endOffset;
  private final int lineno;
  private final int endLineno;
  private final String text;

  /**
   * @param start the offset of the first delimiter character
   * @param end the offset just past the last character of the comment
   * @param lineno the 1-based line of {@code start}
   * @param endLineno the 1-based line of the last character
   * @param text the raw comment text, delimiters included
   */
  public Comment(Kind kind, int start, int end, int lineno, int endLineno, String text) {
    this.kind = checkNotNull(kind);
    this.text = checkNotNull(text);
    checkArgument(start >= 0 && end > start, "bad comment range [%s, %s)", start, end);
    checkArgument(
        text.length() == end - start, "comment text %s does not span [%s, %s)", text, start, end);
    checkArgument(lineno >= 1 && endLineno >= lineno, "bad comment lines %s-%s", lineno, endLineno);
    checkArgument(
        kind == Kind.LINE
            ? text.startsWith("//")
            : text.length() >= 4 && text.startsWith("/*") && text.endsWith("*/"),
        "%s is not a %s comment",
        text,
        kind);
    this.sourceOffset = start;
    this.endOffset = end;
    this.lineno = lineno;
    this.endLineno = endLineno;
  }

  public boolean isLineComment() {
    return kind == Kind.LINE;
  }

  public boolean isBlockComment() {
    return kind == Kind.BLOCK;
  }

  public int getSourceOffset() {
    return sourceOffset;
  }

  public int getSourceEndOffset() {
    return endOffset;
  }

  public int getLineno() {
    return lineno;
  }

  public int getEndLineno() {
    return endLineno;
  }

  /** Whether the comment starts and ends on the same line. */
  public boolean isSingleLine() {
    return kind == Kind.LINE || lineno == endLineno;
  }

  /** The raw comment text, delimiters included. */
  public String getText() {
    return text;
  }

  /** The comment contents without the {@code //} or {@code /* *}{@code /} delimiters. */
  public String getValue() {
    if (kind == Kind.LINE) {
      return text.substring(2);
    }
    return text.substring(2, text.length() - 2);
  }

  @Override
  public String toString() {
    return kind + " " + text + " [" + lineno + ":" + sourceOffset + "-" + endOffset + "]";
  }
}
