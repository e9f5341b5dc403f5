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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Strings.nullToEmpty;

import org.jspecify.annotations.Nullable;

/**
 * A range of the original template text.
 *
 * @param filePath The template the span belongs to, or null for in-memory sources.
 * @param absoluteIndex Zero-indexed offset of the first character.
 * @param lineIndex Zero-indexed line of the first character.
 * @param characterIndex Zero-indexed column of the first character.
 * @param length Number of characters covered.
 */
public record SourceSpan(
    @Nullable String filePath, int absoluteIndex, int lineIndex, int characterIndex, int length) {

  public static final SourceSpan UNDEFINED = new SourceSpan(null, -1, -1, -1, -1);

  public SourceSpan {
    checkArgument(length >= -1, "Invalid length: %s", length);
  }

  public static SourceSpan of(int absoluteIndex, int lineIndex, int characterIndex, int length) {
    return new SourceSpan(null, absoluteIndex, lineIndex, characterIndex, length);
  }

  @Override
  public String toString() {
    return "("
        + absoluteIndex
        + ":"
        + lineIndex
        + ","
        + characterIndex
        + " ["
        + length
        + "] "
        + nullToEmpty(filePath)
        + ")";
  }
}
