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
import com.google.mason.ir.IR;
import com.google.mason.ir.Node;
import com.google.mason.ir.NodeKind;
import com.google.mason.ir.Token;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * Lowers directives for design-time compilation. Every class declaration gets two new leading
 * children: a {@link NodeKind#DESIGN_TIME_DIRECTIVE} holding the directive tokens found in the
 * class, in the order they were found, and a declaration of a field that is never read. The
 * directive tokens are removed from where they were, so the result looks like:
 *
 * <pre>
 * CLASS_DECLARATION
 *     DESIGN_TIME_DIRECTIVE
 *         DIRECTIVE_TOKEN
 *         ...
 *     CODE_FRAGMENT (static java.lang.Object __o = null;)
 *     rest of the class
 * </pre>
 *
 * <p>A directive token belongs to the innermost class declaration around it. Tokens outside any
 * class declaration are left in place. Classes that have already been lowered keep their holder;
 * directive tokens found in the rest of such a class are appended to it.
 *
 * <p>This pass must run before any other pass that looks at directive tokens.
 */
public final class DesignTimeDirectivePass implements TemplatePass {
  public static final int ORDER = -10;

  /** The reserved name of the field added to every class declaration. */
  public static final String DESIGN_TIME_VARIABLE = "__o";

  static final String FIELD_DECLARATION =
      "static java.lang.Object " + DESIGN_TIME_VARIABLE + " = null;";

  @Override
  public int getOrder() {
    return ORDER;
  }

  @Override
  public Node execute(CodeDocument document, Node root) {
    return new Lowering().visit(root);
  }

  static Node createFieldDeclaration() {
    return IR.codeFragment(FIELD_DECLARATION);
  }

  static boolean isFieldDeclaration(Node node) {
    if (!node.isKind(NodeKind.CODE_FRAGMENT) || node.getChildCount() != 1) {
      return false;
    }
    Node code = node.getChildAtIndex(0);
    return code.isKind(NodeKind.CODE) && FIELD_DECLARATION.equals(((Token) code).getContent());
  }

  /** Whether {@code classDeclaration} starts with a directive holder and the field declaration. */
  static boolean isLowered(Node classDeclaration) {
    return classDeclaration.getChildCount() >= 2
        && classDeclaration.getChildAtIndex(0).isKind(NodeKind.DESIGN_TIME_DIRECTIVE)
        && isFieldDeclaration(classDeclaration.getChildAtIndex(1));
  }

  private static final class Lowering extends NodeRewriter {
    /** Directive tokens hoisted so far, one entry per class declaration being visited. */
    private final Deque<ImmutableList.Builder<Node>> scopes = new ArrayDeque<>();

    @Override
    public Node visitClassDeclaration(Node node) {
      scopes.push(ImmutableList.builder());
      Node visited = visitDefault(node);
      ImmutableList<Node> hoisted = scopes.pop().build();

      ImmutableList.Builder<Node> children = ImmutableList.builder();
      if (isLowered(visited)) {
        if (hoisted.isEmpty()) {
          return visited;
        }
        List<Node> existing = visited.getChildren();
        Node holder = existing.get(0);
        children.add(
            IR.designTimeDirective(
                ImmutableList.<Node>builder()
                    .addAll(holder.getChildren())
                    .addAll(hoisted)
                    .build()));
        children.addAll(existing.subList(1, existing.size()));
      } else {
        children.add(IR.designTimeDirective(hoisted));
        children.add(createFieldDeclaration());
        children.addAll(visited.getChildren());
      }
      return visited.withChildren(children.build());
    }

    @Override
    public Node visitDesignTimeDirective(Node node) {
      // Already hoisted.
      return node;
    }

    @Override
    public @Nullable Node visitDirectiveToken(Token token) {
      ImmutableList.Builder<Node> scope = scopes.peek();
      if (scope == null) {
        return token;
      }
      scope.add(token);
      return null;
    }
  }
}
