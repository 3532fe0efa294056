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

import com.google.jsformat.ast.Node;
import org.jspecify.annotations.Nullable;

/**
 * The nodes around a source range: the smallest node enclosing it and, among that node's comment
 * children, the nearest one ending before it and the nearest one starting after it.
 */
public record NodeNeighbors(Node enclosing, @Nullable Node preceding, @Nullable Node following) {
  public NodeNeighbors {
    checkNotNull(enclosing, "enclosing");
  }
}
