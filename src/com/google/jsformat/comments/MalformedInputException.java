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
 * Thrown when the syntax tree or the comment list handed to the {@link CommentAttacher} breaks the
 * preconditions the attacher relies on. This always indicates a bug in the parser or tokenizer that
 * produced the input.
 */
public final class MalformedInputException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  private final DiagnosticType type;

  MalformedInputException(DiagnosticType type, String description) {
    super(type.key + ": " + description);
    this.type = checkNotNull(type);
  }

  public DiagnosticType getType() {
    return type;
  }
}
