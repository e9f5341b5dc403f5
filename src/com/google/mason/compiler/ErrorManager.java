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

import com.google.common.collect.ImmutableList;

/**
 * The error manager is in charge of storing, organizing and displaying diagnostics produced by
 * the parser and by template passes.
 */
public interface ErrorManager {

  /**
   * Reports a diagnostic at the given level. Diagnostics reported at {@link CheckLevel#OFF} are
   * ignored.
   */
  void report(CheckLevel level, Diagnostic diagnostic);

  /** Reports a diagnostic at its default level. */
  default void report(Diagnostic diagnostic) {
    report(diagnostic.defaultLevel(), diagnostic);
  }

  /** Writes a report to an implementation-specific medium. */
  void generateReport();

  int getErrorCount();

  int getWarningCount();

  ImmutableList<Diagnostic> getErrors();

  ImmutableList<Diagnostic> getWarnings();

  /** Whether any diagnostic reported at {@link CheckLevel#ERROR} should stop code generation. */
  default boolean hasHaltingErrors() {
    return getErrorCount() > 0;
  }
}
