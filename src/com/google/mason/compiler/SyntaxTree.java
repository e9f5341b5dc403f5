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

import com.google.common.collect.ImmutableList;
import com.google.mason.ir.Node;

/** The result of parsing a template: the root of its tree and the diagnostics found. */
public final class SyntaxTree {
  private final Node root;
  private final ImmutableList<Diagnostic> diagnostics;
  private final SourceDocument source;
  private final CompilerOptions options;

  private SyntaxTree(
      Node root,
      ImmutableList<Diagnostic> diagnostics,
      SourceDocument source,
      CompilerOptions options) {
    this.root = checkNotNull(root);
    this.diagnostics = diagnostics;
    this.source = checkNotNull(source);
    this.options = checkNotNull(options);
  }

  public static SyntaxTree create(
      Node root, Iterable<Diagnostic> diagnostics, SourceDocument source, CompilerOptions options) {
    return new SyntaxTree(root, ImmutableList.copyOf(diagnostics), source, options);
  }

  public Node getRoot() {
    return root;
  }

  /** Diagnostics reported by the parser, in the order they were found. */
  public ImmutableList<Diagnostic> getDiagnostics() {
    return diagnostics;
  }

  public SourceDocument getSource() {
    return source;
  }

  public CompilerOptions getOptions() {
    return options;
  }
}
