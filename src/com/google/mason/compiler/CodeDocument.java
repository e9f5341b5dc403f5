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
import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableList;
import com.google.mason.ir.Node;
import java.util.ArrayList;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * A template being compiled. Holds the source, the options it is compiled with, the parsed syntax
 * tree once there is one, the tree produced by the passes, and the diagnostics the passes report.
 */
public final class CodeDocument {
  private final SourceDocument source;
  private final CompilerOptions options;
  private @Nullable SyntaxTree syntaxTree;
  private @Nullable Node documentNode;
  private final List<Diagnostic> diagnostics = new ArrayList<>();

  private CodeDocument(SourceDocument source, CompilerOptions options) {
    this.source = checkNotNull(source);
    this.options = checkNotNull(options);
  }

  public static CodeDocument create(SourceDocument source, CompilerOptions options) {
    return new CodeDocument(source, options);
  }

  public SourceDocument getSource() {
    return source;
  }

  public CompilerOptions getOptions() {
    return options;
  }

  public @Nullable SyntaxTree getSyntaxTree() {
    return syntaxTree;
  }

  public void setSyntaxTree(SyntaxTree syntaxTree) {
    checkState(this.syntaxTree == null, "%s has already been parsed", source);
    this.syntaxTree = checkNotNull(syntaxTree);
  }

  /** The tree produced by the last pipeline run over this document. */
  public @Nullable Node getDocumentNode() {
    return documentNode;
  }

  public void setDocumentNode(Node documentNode) {
    this.documentNode = checkNotNull(documentNode);
  }

  public void report(Diagnostic diagnostic) {
    diagnostics.add(checkNotNull(diagnostic));
  }

  /** Diagnostics reported by passes, in the order they were reported. */
  public ImmutableList<Diagnostic> getDiagnostics() {
    return ImmutableList.copyOf(diagnostics);
  }
}
