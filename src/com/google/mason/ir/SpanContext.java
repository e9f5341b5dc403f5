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

package com.google.mason.ir;

import static java.util.Objects.requireNonNull;

/**
 * Correlates a node with the code generation behavior that produced its span and with the way
 * incremental edits inside the span are re-parsed.
 *
 * @param chunkGenerator What code generation produced this span.
 * @param editHandler How edits to this span are handled.
 */
public record SpanContext(ChunkGenerator chunkGenerator, EditHandler editHandler) {
  public SpanContext {
    requireNonNull(chunkGenerator, "chunkGenerator");
    requireNonNull(editHandler, "editHandler");
  }
}
