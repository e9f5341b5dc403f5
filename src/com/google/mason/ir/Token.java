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
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.errorprone.annotations.CheckReturnValue;
import com.google.mason.compiler.Diagnostic;
import java.util.List;

/**
 * A terminal node. A token either carries the literal content it was scanned from, or is a
 * zero-width <em>missing</em> token synthesized by error recovery. Leading and trailing trivia
 * are part of the token's full width but not of its content.
 */
public final class Token extends Node {
  private final String content;
  private final boolean missing;
  private final ImmutableList<Trivia> leadingTrivia;
  private final ImmutableList<Trivia> trailingTrivia;

  private Token(
      NodeKind kind,
      int position,
      String content,
      boolean missing,
      ImmutableList<Trivia> leadingTrivia,
      ImmutableList<Trivia> trailingTrivia,
      ImmutableMap<String, Annotation> annotations,
      ImmutableList<Diagnostic> diagnostics) {
    super(
        kind,
        position,
        widthOf(leadingTrivia) + content.length() + widthOf(trailingTrivia),
        ImmutableList.of(),
        annotations,
        diagnostics);
    this.content = content;
    this.missing = missing;
    this.leadingTrivia = leadingTrivia;
    this.trailingTrivia = trailingTrivia;
  }

  public static Token create(NodeKind kind, String content) {
    checkArgument(kind.isTerminal(), "%s is not a token kind", kind);
    return new Token(
        kind,
        0,
        checkNotNull(content),
        false,
        ImmutableList.of(),
        ImmutableList.of(),
        ImmutableMap.of(),
        ImmutableList.of());
  }

  /** Creates a zero-width token standing in for input the parser expected but did not find. */
  public static Token missing(NodeKind kind) {
    checkArgument(kind.isTerminal(), "%s is not a token kind", kind);
    return new Token(
        kind,
        0,
        "",
        true,
        ImmutableList.of(),
        ImmutableList.of(),
        ImmutableMap.of(),
        ImmutableList.of());
  }

  @Override
  public boolean isToken() {
    return true;
  }

  /** The literal text of this token; empty for missing tokens. */
  public String getContent() {
    return content;
  }

  public boolean isMissing() {
    return missing;
  }

  /** Width of the content alone, without trivia. */
  public int getWidth() {
    return content.length();
  }

  public ImmutableList<Trivia> getLeadingTrivia() {
    return leadingTrivia;
  }

  public ImmutableList<Trivia> getTrailingTrivia() {
    return trailingTrivia;
  }

  @CheckReturnValue
  public Token withLeadingTrivia(List<Trivia> trivia) {
    return new Token(
        getKind(),
        getPosition(),
        content,
        missing,
        ImmutableList.copyOf(trivia),
        trailingTrivia,
        annotationMap(),
        getDiagnostics());
  }

  @CheckReturnValue
  public Token withTrailingTrivia(List<Trivia> trivia) {
    return new Token(
        getKind(),
        getPosition(),
        content,
        missing,
        leadingTrivia,
        ImmutableList.copyOf(trivia),
        annotationMap(),
        getDiagnostics());
  }

  /** Tokens have no children; only an empty list is accepted. */
  @Override
  public Node withChildren(List<? extends Node> newChildren) {
    checkState(newChildren.isEmpty(), "Token %s cannot have children", getKind());
    return this;
  }

  @Override
  Node copy(
      int newPosition,
      ImmutableList<Node> newChildren,
      ImmutableMap<String, Annotation> newAnnotations,
      ImmutableList<Diagnostic> newDiagnostics) {
    return new Token(
        getKind(),
        newPosition,
        content,
        missing,
        leadingTrivia,
        trailingTrivia,
        newAnnotations,
        newDiagnostics);
  }

  @Override
  void appendFullString(StringBuilder sb) {
    for (Trivia trivia : leadingTrivia) {
      sb.append(trivia.getText());
    }
    sb.append(content);
    for (Trivia trivia : trailingTrivia) {
      sb.append(trivia.getText());
    }
  }

  @Override
  public String toString() {
    return getKind() + " " + (missing ? "<Missing>" : content) + " [" + getPosition() + ".."
        + getEndPosition() + ")";
  }

  private static int widthOf(List<Trivia> trivia) {
    int width = 0;
    for (Trivia t : trivia) {
      width += t.getFullWidth();
    }
    return width;
  }
}
