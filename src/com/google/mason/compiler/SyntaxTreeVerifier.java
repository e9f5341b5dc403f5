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

import com.google.mason.ir.Node;
import com.google.mason.ir.Token;
import com.google.mason.ir.Trivia;

/**
 * Checks that a syntax tree is well formed: every node ends where its width says it does, its
 * children follow each other without gaps or overlaps and cover it exactly, token widths match
 * their text, and only non-terminal kinds have children.
 */
public final class SyntaxTreeVerifier {

  /** Violation handler */
  public interface ViolationHandler {
    void handleViolation(String message, Node n);
  }

  private final ViolationHandler violationHandler;

  public SyntaxTreeVerifier(ViolationHandler handler) {
    this.violationHandler = handler;
  }

  public SyntaxTreeVerifier() {
    this(
        new ViolationHandler() {
          @Override
          public void handleViolation(String message, Node n) {
            throw new IllegalStateException(
                message + ". Reference node:\n" + n.toStringTree());
          }
        });
  }

  public void verify(Node root) {
    verifyNode(root);
  }

  private void verifyNode(Node n) {
    if (n.getPosition() + n.getFullWidth() != n.getEndPosition()) {
      violation("Node width does not match its range", n);
    }
    if (n.isToken()) {
      verifyToken((Token) n);
      return;
    }
    if (n.getKind().isTerminal()) {
      violation("Token kind " + n.getKind() + " used for a non-terminal", n);
    }

    int expectedPosition = n.getPosition();
    for (Node child : n.getChildren()) {
      if (child.getPosition() != expectedPosition) {
        violation(
            "Expected child "
                + child
                + " to start at "
                + expectedPosition
                + " but it starts at "
                + child.getPosition(),
            n);
      }
      verifyNode(child);
      expectedPosition += child.getFullWidth();
    }
    if (expectedPosition != n.getEndPosition()) {
      violation(
          "Children end at " + expectedPosition + " but the node ends at " + n.getEndPosition(), n);
    }
  }

  private void verifyToken(Token token) {
    if (!token.getKind().isTerminal()) {
      violation("Non-terminal kind " + token.getKind() + " used for a token", token);
    }
    if (token.hasChildren()) {
      violation("Tokens cannot have children", token);
    }
    if (token.isMissing() && !token.getContent().isEmpty()) {
      violation("Missing tokens cannot have content", token);
    }
    int width = token.getWidth();
    for (Trivia trivia : token.getLeadingTrivia()) {
      width += trivia.getFullWidth();
    }
    for (Trivia trivia : token.getTrailingTrivia()) {
      width += trivia.getFullWidth();
    }
    if (width != token.getFullWidth()) {
      violation("Token width " + token.getFullWidth() + " does not match its text", token);
    }
  }

  private void violation(String message, Node n) {
    violationHandler.handleViolation(message, n);
  }
}
