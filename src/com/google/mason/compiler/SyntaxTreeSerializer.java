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
import java.io.UncheckedIOException;

/**
 * Renders a syntax tree as text, one line per node, pre-order and left to right. Each level of
 * nesting is indented by four spaces. The output is stable across platforms and is what syntax
 * tree baselines are compared against.
 */
public final class SyntaxTreeSerializer {

  private SyntaxTreeSerializer() {}

  public static String serialize(Node root) {
    StringBuilder sb = new StringBuilder();
    serialize(root, sb);
    return sb.toString();
  }

  /**
   * Writes {@code root} to {@code out}.
   *
   * @throws UncheckedIOException if {@code out} fails
   * @throws UnsupportedOperationException if the tree has to be serialized with its trivia
   */
  public static void serialize(Node root, Appendable out) {
    SyntaxNodeWriter writer = new SyntaxNodeWriter(out);
    serializeNode(writer, root, 0);
  }

  private static void serializeNode(SyntaxNodeWriter writer, Node node, int depth) {
    writer.setDepth(depth);
    writer.visit(node);
    writer.writeNewLine();
    for (Node child : node.getChildren()) {
      serializeNode(writer, child, depth + 1);
    }
  }
}
