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

import com.google.errorprone.annotations.Immutable;
import java.text.MessageFormat;

/**
 * The kind of a malformed-input diagnostic. The format is a {@link MessageFormat} pattern.
 */
@Immutable
public final class DiagnosticType {

  /** A node's children overlap, are out of order, or leave the parent's range. */
  public static final DiagnosticType MALFORMED_TREE =
      new DiagnosticType("JSC_MALFORMED_TREE", "Malformed syntax tree at {0}: {1}");

  /** A comment lies outside the text, overlaps another comment or a node, or is out of order. */
  public static final DiagnosticType MALFORMED_COMMENT =
      new DiagnosticType("JSC_MALFORMED_COMMENT", "Malformed comment {0}: {1}");

  /** The identifier of this diagnostic, stable across releases. */
  public final String key;

  /** The default way to format the message. */
  public final String format;

  private DiagnosticType(String key, String format) {
    this.key = checkNotNull(key);
    this.format = checkNotNull(format);
  }

  String format(Object... arguments) {
    return MessageFormat.format(format, arguments);
  }

  @Override
  public boolean equals(Object type) {
    return type instanceof DiagnosticType && ((DiagnosticType) type).key.equals(key);
  }

  @Override
  public int hashCode() {
    return key.hashCode();
  }

  @Override
  public String toString() {
    return key + ": " + format;
  }
}
