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

/**
 * Describes the code generation behavior attached to a span. Instances are compared by their
 * description, which is also what snapshot dumps print.
 */
public final class ChunkGenerator {
  public static final ChunkGenerator NONE = new ChunkGenerator("None");
  public static final ChunkGenerator MARKUP = new ChunkGenerator("Markup");
  public static final ChunkGenerator EXPRESSION = new ChunkGenerator("Expr");
  public static final ChunkGenerator STATEMENT = new ChunkGenerator("Stmt");
  public static final ChunkGenerator META_CODE = new ChunkGenerator("MetaCode");

  private final String description;

  private ChunkGenerator(String description) {
    this.description = description;
  }

  /** Generator for the body of the named directive. */
  public static ChunkGenerator directive(String directiveName) {
    checkArgument(!directiveName.isEmpty(), "directive name must not be empty");
    return new ChunkGenerator("Directive:{" + directiveName + "}");
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof ChunkGenerator && ((ChunkGenerator) o).description.equals(description);
  }

  @Override
  public int hashCode() {
    return description.hashCode();
  }

  @Override
  public String toString() {
    return description;
  }
}
