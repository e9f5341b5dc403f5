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

import static java.util.Objects.requireNonNull;

import com.google.mason.ir.SourceSpan;

/**
 * A problem found while parsing or lowering a template. Diagnostics are collected on nodes and
 * documents; they are never thrown.
 *
 * @param type The type of the diagnostic, which supplies its id and default level.
 * @param span Where in the template the problem is.
 * @param message The formatted, human-readable message.
 */
public record Diagnostic(DiagnosticType type, SourceSpan span, String message) {
  public Diagnostic {
    requireNonNull(type, "type");
    requireNonNull(span, "span");
    requireNonNull(message, "message");
  }

  /**
   * Creates a diagnostic at {@code span}.
   *
   * @param type The DiagnosticType
   * @param span The offending region of the template
   * @param arguments Arguments to be incorporated into the message
   */
  public static Diagnostic make(DiagnosticType type, SourceSpan span, String... arguments) {
    return new Diagnostic(type, span, type.format(arguments));
  }

  public String id() {
    return type.key;
  }

  public CheckLevel defaultLevel() {
    return type.level;
  }

  /** The compact form used by syntax tree dumps and baseline files: the id followed by the span. */
  public String toBaselineString() {
    return id() + span;
  }

  /** Formats this diagnostic for logs and console output. */
  public String format(CheckLevel level) {
    String label = level == CheckLevel.ERROR ? "Error" : "Warning";
    return span + ": " + label + " " + id() + ": " + message;
  }
}
