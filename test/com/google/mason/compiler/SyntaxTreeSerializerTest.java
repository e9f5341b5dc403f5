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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.mason.ir.ChunkGenerator;
import com.google.mason.ir.EditHandler;
import com.google.mason.ir.EditHandler.AcceptedCharacters;
import com.google.mason.ir.IR;
import com.google.mason.ir.Node;
import com.google.mason.ir.NodeKind;
import com.google.mason.ir.SpanContext;
import com.google.mason.ir.Trivia;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class SyntaxTreeSerializerTest {

  private static Node createTree() {
    return IR.document(
        IR.markupBlock(IR.token(NodeKind.TEXT, "Hi "))
            .withSpanContext(
                new SpanContext(
                    ChunkGenerator.MARKUP, EditHandler.accepting(AcceptedCharacters.ANY))),
        IR.node(
            NodeKind.CODE_BLOCK,
            IR.token(NodeKind.TRANSITION, "@"),
            IR.node(NodeKind.CODE_EXPRESSION, IR.missing(NodeKind.IDENTIFIER))));
  }

  @Test
  public void testSerialize() {
    assertThat(SyntaxTreeSerializer.serialize(createTree()))
        .isEqualTo(
            "DOCUMENT - [0..4) - FullWidth: 4 - [Hi @]\n"
                + "    MARKUP_BLOCK - [0..3) - FullWidth: 3 - Gen<Markup>"
                + " - SpanEditHandler;Accepts:Any\n"
                + "        TEXT;[Hi ];\n"
                + "    CODE_BLOCK - [3..4) - FullWidth: 1\n"
                + "        TRANSITION;[@];\n"
                + "        CODE_EXPRESSION - [4..4) - FullWidth: 0\n"
                + "            IDENTIFIER;[<Missing>];\n");
  }

  @Test
  public void testSerializeIsDeterministic() {
    Node root = createTree();

    assertThat(SyntaxTreeSerializer.serialize(root))
        .isEqualTo(SyntaxTreeSerializer.serialize(root));
    assertThat(SyntaxTreeSerializer.serialize(root))
        .isEqualTo(SyntaxTreeSerializer.serialize(createTree()));
  }

  @Test
  public void testSerializeSubtree() {
    Node root = createTree();

    assertThat(SyntaxTreeSerializer.serialize(root.getChildAtIndex(1)))
        .isEqualTo(
            "CODE_BLOCK - [3..4) - FullWidth: 1 - [@]\n"
                + "    TRANSITION;[@];\n"
                + "    CODE_EXPRESSION - [4..4) - FullWidth: 0\n"
                + "        IDENTIFIER;[<Missing>];\n");
  }

  @Test
  public void testSerializeToken() {
    StringBuilder sb = new StringBuilder();

    SyntaxTreeSerializer.serialize(IR.token(NodeKind.TEXT, "line\n"), sb);

    assertThat(sb.toString()).isEqualTo("TEXT;[lineLF];\n");
  }

  @Test
  public void testTriviaIsUnsupported() {
    Node root =
        IR.markupBlock(
            IR.token(NodeKind.TEXT, "a")
                .withTrailingTrivia(ImmutableList.of(Trivia.whitespace("  "))));

    assertThrows(UnsupportedOperationException.class, () -> SyntaxTreeSerializer.serialize(root));
  }
}
