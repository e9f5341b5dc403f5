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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.mason.ir.Node;
import com.google.mason.ir.NodeKind;
import org.jspecify.annotations.Nullable;

/**
 * Removes {@link NodeKind#DIRECTIVE} nodes once the earlier passes have
 * consumed them. Diagnostics attached to a removed directive or to any of its descendants are
 * reported on the document so they are not lost with the node.
 */
public final class DirectiveRemovalPass implements TemplatePass {
  public static final int ORDER = 50;

  @Override
  public int getOrder() {
    return ORDER;
  }

  @Override
  public Node execute(CodeDocument document, Node root) {
    checkArgument(
        !root.isKind(NodeKind.DIRECTIVE), "A directive cannot be the root of a template");
    return checkNotNull(new Removal(document).visit(root));
  }

  private static final class Removal extends NodeRewriter {
    private final CodeDocument document;

    Removal(CodeDocument document) {
      this.document = document;
    }

    @Override
    public @Nullable Node visitDirective(Node node) {
      reportDiagnostics(node);
      return null;
    }

    private void reportDiagnostics(Node node) {
      for (Diagnostic diagnostic : node.getDiagnostics()) {
        document.report(diagnostic);
      }
      for (Node child : node.getChildren()) {
        reportDiagnostics(child);
      }
    }
  }
}
