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

import com.google.common.base.Joiner;
import com.google.common.collect.Iterables;
import com.google.mason.ir.Node;
import com.google.mason.ir.SpanContext;
import com.google.mason.ir.Token;
import com.google.mason.ir.Trivia;
import java.io.IOException;
import java.io.UncheckedIOException;

/**
 * Writes a one-line description of each node it visits. The writer does not descend into
 * children: whoever drives it sets {@link #setDepth(int)} and visits each node in turn (see
 * {@link SyntaxTreeSerializer}). Nodes are returned unchanged.
 *
 * <p>A non-terminal is written as {@code KIND - [start..end) - FullWidth: n}, followed by the
 * span context if it has one. The first node written additionally gets the full text of its
 * subtree in brackets. A token is written as {@code KIND;[content];diagnostics}.
 *
 * <p>Line breaks inside written values, whether {@code \r\n}, {@code \n} or {@code \r}, are
 * replaced by {@code LF}, so the output of a node never spans more than one line.
 *
 * <p>Trivia is not supported: serializing a token that carries trivia throws {@link
 * UnsupportedOperationException}.
 */
public class SyntaxNodeWriter extends NodeRewriter {
  private static final String INDENT = "    ";
  private static final String SEPARATOR = " - ";
  private static final Joiner DIAGNOSTIC_JOINER = Joiner.on(", ");

  private final Appendable writer;
  private boolean visitedRoot;
  private int depth;

  public SyntaxNodeWriter(Appendable writer) {
    super(/* visitIntoTrivia= */ true);
    this.writer = writer;
  }

  public void setDepth(int depth) {
    this.depth = depth;
  }

  @Override
  public Node visit(Node node) {
    if (node.isToken()) {
      return visitToken((Token) node);
    }
    writeNode(node);
    return node;
  }

  @Override
  public Node visitToken(Token token) {
    writeToken(token);
    return super.visitToken(token);
  }

  @Override
  public Trivia visitTrivia(Trivia trivia) {
    writeTrivia(trivia);
    return super.visitTrivia(trivia);
  }

  private void writeNode(Node node) {
    writeIndent();
    write(node.getKind().toString());
    writeSeparator();
    write("[" + node.getPosition() + ".." + node.getEndPosition() + ")");
    writeSeparator();
    write("FullWidth: " + node.getFullWidth());

    SpanContext context = node.getSpanContext();
    if (context != null) {
      writeSpanContext(context);
    }

    if (!visitedRoot) {
      writeSeparator();
      write("[" + node.toFullString() + "]");
      visitedRoot = true;
    }
  }

  private void writeToken(Token token) {
    writeIndent();
    String content = token.isMissing() ? "<Missing>" : token.getContent();
    Iterable<String> diagnostics =
        Iterables.transform(token.getDiagnostics(), Diagnostic::toBaselineString);
    write(token.getKind() + ";[" + content + "];" + DIAGNOSTIC_JOINER.join(diagnostics));
  }

  private void writeTrivia(Trivia trivia) {
    throw new UnsupportedOperationException(
        "SyntaxNodeWriter does not support trivia, found " + trivia);
  }

  private void writeSpanContext(SpanContext context) {
    writeSeparator();
    write("Gen<" + context.chunkGenerator() + ">");
    writeSeparator();
    write(context.editHandler().toString());
  }

  protected void writeIndent() {
    for (int i = 0; i < depth; i++) {
      append(INDENT);
    }
  }

  protected void writeSeparator() {
    write(SEPARATOR);
  }

  protected void writeNewLine() {
    append("\n");
  }

  protected void write(String value) {
    append(value.replace("\r\n", "LF").replace("\n", "LF").replace("\r", "LF"));
  }

  private void append(String value) {
    try {
      writer.append(value);
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }
}
