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
import com.google.mason.ir.Node;
import com.google.mason.ir.NodeKind;
import com.google.mason.ir.Token;
import com.google.mason.ir.Trivia;
import java.util.ArrayList;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * NodeRewriter walks a tree in pre-order, strictly left to right, and rebuilds it from the
 * results of visiting each node.
 *
 * <p>{@link #visit(Node)} dispatches tokens to {@link #visitToken(Token)} (directive tokens go
 * through {@link #visitDirectiveToken(Token)} first), the intermediate representation kinds to
 * their own {@code visit*} method, and every other node to {@link #visitDefault(Node)}. The
 * default behavior of every leg returns the node unchanged unless one of its descendants was
 * replaced, in which case only the ancestors of the replacement are rebuilt.
 *
 * <p>Subclasses override the legs they care about. A leg returning a different node substitutes
 * it for the visited one; returning {@code null} removes the node from its parent. Replacements
 * are not validated: returning a node of a shape the parent does not allow is the subclass's
 * responsibility.
 *
 * <p>Trivia is only visited when the rewriter is created with {@code visitIntoTrivia}; otherwise
 * {@link #visitTrivia(Trivia)} is never called.
 */
public class NodeRewriter {
  private final boolean visitIntoTrivia;

  public NodeRewriter() {
    this(false);
  }

  public NodeRewriter(boolean visitIntoTrivia) {
    this.visitIntoTrivia = visitIntoTrivia;
  }

  public final boolean isVisitingIntoTrivia() {
    return visitIntoTrivia;
  }

  /** Visits {@code node}, returning its replacement, itself, or null if it should be removed. */
  public @Nullable Node visit(Node node) {
    if (node.isToken()) {
      Token token = (Token) node;
      return token.isKind(NodeKind.DIRECTIVE_TOKEN)
          ? visitDirectiveToken(token)
          : visitToken(token);
    }
    switch (node.getKind()) {
      case DOCUMENT:
        return visitDocument(node);
      case NAMESPACE_DECLARATION:
        return visitNamespaceDeclaration(node);
      case CLASS_DECLARATION:
        return visitClassDeclaration(node);
      case METHOD_DECLARATION:
        return visitMethodDeclaration(node);
      case DIRECTIVE:
        return visitDirective(node);
      case DESIGN_TIME_DIRECTIVE:
        return visitDesignTimeDirective(node);
      default:
        return visitDefault(node);
    }
  }

  public @Nullable Node visitDocument(Node node) {
    return visitDefault(node);
  }

  public @Nullable Node visitNamespaceDeclaration(Node node) {
    return visitDefault(node);
  }

  public @Nullable Node visitClassDeclaration(Node node) {
    return visitDefault(node);
  }

  public @Nullable Node visitMethodDeclaration(Node node) {
    return visitDefault(node);
  }

  public @Nullable Node visitDirective(Node node) {
    return visitDefault(node);
  }

  public @Nullable Node visitDesignTimeDirective(Node node) {
    return visitDefault(node);
  }

  public @Nullable Node visitDirectiveToken(Token token) {
    return visitToken(token);
  }

  /**
   * Visits a token. When visiting into trivia, each leading and trailing trivia is visited and
   * the token is rebuilt if any of them changed.
   */
  public @Nullable Node visitToken(Token token) {
    if (!visitIntoTrivia) {
      return token;
    }
    ImmutableList<Trivia> leading = visitTriviaList(token.getLeadingTrivia());
    ImmutableList<Trivia> trailing = visitTriviaList(token.getTrailingTrivia());
    Token result = token;
    if (leading != token.getLeadingTrivia()) {
      result = result.withLeadingTrivia(leading);
    }
    if (trailing != token.getTrailingTrivia()) {
      result = result.withTrailingTrivia(trailing);
    }
    return result;
  }

  /** Visits one piece of trivia, returning its replacement or null to drop it. */
  public @Nullable Trivia visitTrivia(Trivia trivia) {
    return trivia;
  }

  /** Rebuilds {@code node} from its visited children. */
  public Node visitDefault(Node node) {
    List<Node> children = node.getChildren();
    List<Node> rewritten = null;
    for (int i = 0; i < children.size(); i++) {
      Node child = children.get(i);
      Node result = visit(child);
      if (rewritten == null && result != child) {
        rewritten = new ArrayList<>(children.subList(0, i));
      }
      if (rewritten != null && result != null) {
        rewritten.add(result);
      }
    }
    return rewritten == null ? node : node.withChildren(rewritten);
  }

  private ImmutableList<Trivia> visitTriviaList(ImmutableList<Trivia> list) {
    ImmutableList.Builder<Trivia> rewritten = null;
    for (int i = 0; i < list.size(); i++) {
      Trivia trivia = list.get(i);
      Trivia result = visitTrivia(trivia);
      if (rewritten == null && result != trivia) {
        rewritten = ImmutableList.builder();
        rewritten.addAll(list.subList(0, i));
      }
      if (rewritten != null && result != null) {
        rewritten.add(result);
      }
    }
    return rewritten == null ? list : rewritten.build();
  }
}
