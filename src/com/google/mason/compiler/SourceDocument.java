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

package com.google.mason.compiler;

import static com.google.common.base.Preconditions.checkNotNull;

/** The text of a template together with the path it was read from. */
public final class SourceDocument {
  private final String filePath;
  private final String code;

  private SourceDocument(String filePath, String code) {
    this.filePath = checkNotNull(filePath);
    this.code = checkNotNull(code);
  }

  public static SourceDocument fromCode(String filePath, String code) {
    return new SourceDocument(filePath, code);
  }

  public String getFilePath() {
    return filePath;
  }

  public String getCode() {
    return code;
  }

  @Override
  public String toString() {
    return filePath;
  }
}
