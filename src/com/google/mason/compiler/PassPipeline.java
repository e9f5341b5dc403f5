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
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import com.google.mason.ir.Node;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.logging.Logger;
import org.jspecify.annotations.Nullable;

/**
 * Runs template passes over a document in ascending order. Passes with equal order run in the
 * order they were added. Once every pass has run, the diagnostics of the document are reported
 * to the error manager.
 */
public final class PassPipeline {
  private static final Logger logger = Logger.getLogger(PassPipeline.class.getName());

  private final ImmutableList<TemplatePass> passes;
  private final ErrorManager errorManager;

  private PassPipeline(ImmutableList<TemplatePass> passes, ErrorManager errorManager) {
    this.passes =
        ImmutableList.sortedCopyOf(Comparator.comparingInt(TemplatePass::getOrder), passes);
    this.errorManager = errorManager;
  }

  public static Builder builder(ErrorManager errorManager) {
    return new Builder(errorManager);
  }

  /** Creates the pipeline that compiles templates with {@code options}. */
  public static PassPipeline forOptions(CompilerOptions options, ErrorManager errorManager) {
    Builder builder = builder(errorManager);
    if (options.isDesignTime()) {
      builder.addPass(new DesignTimeDirectivePass());
    }
    builder.addPass(new DirectiveRemovalPass());
    return builder.build();
  }

  /** The passes of this pipeline, in the order they run. */
  public ImmutableList<TemplatePass> getPasses() {
    return passes;
  }

  public ErrorManager getErrorManager() {
    return errorManager;
  }

  /**
   * Runs every pass over the syntax tree of {@code document}. The diagnostics of the syntax tree
   * are reported along with those of the passes. The result is also stored on the document.
   */
  public Node process(CodeDocument document) {
    SyntaxTree syntaxTree = document.getSyntaxTree();
    checkState(syntaxTree != null, "%s has not been parsed", document.getSource());
    for (Diagnostic diagnostic : syntaxTree.getDiagnostics()) {
      errorManager.report(diagnostic);
    }
    Node result = execute(document, syntaxTree.getRoot());
    document.setDocumentNode(result);
    return result;
  }

  /** Runs every pass over {@code root} and returns the final tree. */
  public Node execute(CodeDocument document, Node root) {
    @Nullable SyntaxTreeVerifier verifier =
        document.getOptions().shouldVerifySyntaxTrees() ? new SyntaxTreeVerifier() : null;
    Node current = root;
    for (TemplatePass pass : passes) {
      String name = pass.getClass().getSimpleName();
      logger.fine("Running pass " + name);
      current = checkNotNull(pass.execute(document, current), "%s returned no tree", name);
      if (verifier != null) {
        verifier.verify(current);
      }
    }
    for (Diagnostic diagnostic : document.getDiagnostics()) {
      errorManager.report(diagnostic);
    }
    return current;
  }

  /** Collects the passes of a pipeline. */
  public static final class Builder {
    private final ErrorManager errorManager;
    private final List<TemplatePass> passes = new ArrayList<>();

    private Builder(ErrorManager errorManager) {
      this.errorManager = checkNotNull(errorManager);
    }

    @CanIgnoreReturnValue
    public Builder addPass(TemplatePass pass) {
      passes.add(checkNotNull(pass));
      return this;
    }

    public PassPipeline build() {
      return new PassPipeline(ImmutableList.copyOf(passes), errorManager);
    }
  }
}
