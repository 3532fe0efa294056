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

/**
 * Character-level lookahead and lookbehind over the source text, used where the syntax tree alone
 * cannot tell where a comment sits (for instance before or after a closing parenthesis).
 */
final class SourceText {
  /** Returned by {@link #charAt} for offsets outside the text. */
  static final char NO_CHAR = '\0';

  private final String text;

  SourceText(String text) {
    this.text = checkNotNull(text);
  }

  int length() {
    return text.length();
  }

  char charAt(int index) {
    return index >= 0 && index < text.length() ? text.charAt(index) : NO_CHAR;
  }

  /** Returns the offset of {@code c} at or after {@code from}, or -1. */
  int indexOf(char c, int from) {
    return text.indexOf(c, from);
  }

  boolean startsWith(String prefix, int index) {
    return index >= 0 && text.startsWith(prefix, index);
  }

  static boolean isLineTerminator(char c) {
    return c == '\n' || c == '\r' || c == '\u2028' || c == '\u2029';
  }

  private static boolean isSpace(char c) {
    return c == ' ' || c == '\t';
  }

  /**
   * Whether only spaces and tabs separate {@code index} from the next line terminator. The end of
   * the text counts as a line end.
   */
  boolean hasNewlineAfter(int index) {
    int i = index;
    while (i < text.length() && isSpace(text.charAt(i))) {
      i++;
    }
    return i >= text.length() || isLineTerminator(text.charAt(i));
  }

  /**
   * Whether only spaces and tabs separate the previous line terminator from {@code index}. The
   * start of the text counts as a line start.
   */
  boolean hasNewlineBefore(int index) {
    int i = index - 1;
    while (i >= 0 && isSpace(text.charAt(i))) {
      i--;
    }
    return i < 0 || isLineTerminator(text.charAt(i));
  }

  boolean hasNewlineInRange(int start, int end) {
    for (int i = Math.max(start, 0); i < end && i < text.length(); i++) {
      if (isLineTerminator(text.charAt(i))) {
        return true;
      }
    }
    return false;
  }

  /** Whether {@code [start, end)} holds nothing but whitespace on a single line. */
  boolean isBlankOnOneLine(int start, int end) {
    for (int i = start; i < end; i++) {
      char c = text.charAt(i);
      if (isLineTerminator(c) || !Character.isWhitespace(c)) {
        return false;
      }
    }
    return true;
  }

  /**
   * Returns the offset of the first character at or after {@code index} that is neither
   * whitespace nor part of a comment, or {@link #length()} if there is none.
   */
  int nextNonSpaceNonCommentIndex(int index) {
    int oldIndex = -1;
    int nextIndex = index;
    while (nextIndex != oldIndex) {
      oldIndex = nextIndex;
      nextIndex = skipSpaces(nextIndex);
      nextIndex = skipBlockComment(nextIndex);
      nextIndex = skipLineComment(nextIndex);
      nextIndex = skipNewline(nextIndex);
    }
    return nextIndex;
  }

  /** Returns the character found by {@link #nextNonSpaceNonCommentIndex}. */
  char nextNonSpaceNonCommentChar(int index) {
    return charAt(nextNonSpaceNonCommentIndex(index));
  }

  private int skipSpaces(int index) {
    int i = index;
    while (i < text.length() && isSpace(text.charAt(i))) {
      i++;
    }
    return i;
  }

  private int skipBlockComment(int index) {
    if (startsWith("/*", index)) {
      int close = text.indexOf("*/", index + 2);
      if (close != -1) {
        return close + 2;
      }
    }
    return index;
  }

  private int skipLineComment(int index) {
    if (!startsWith("//", index)) {
      return index;
    }
    int i = index;
    while (i < text.length() && !isLineTerminator(text.charAt(i))) {
      i++;
    }
    return i;
  }

  private int skipNewline(int index) {
    if (startsWith("\r\n", index)) {
      return index + 2;
    }
    return isLineTerminator(charAt(index)) ? index + 1 : index;
  }

  @Override
  public String toString() {
    return text;
  }
}
