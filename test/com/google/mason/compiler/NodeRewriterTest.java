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

import com.google.common.collect.ImmutableList;
import com.google.mason.ir.IR;
import com.google.mason.ir.Node;
import com.google.mason.ir.NodeKind;
import com.google.mason.ir.Token;
import com.google.mason.ir.Trivia;
import java.util.ArrayList;
import java.util.List;
import org.jspecify.annotations.Nullable;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class NodeRewriterTest {

  private static Node createTree() {
    return IR.document(
        IR.markupBlock(IR.token(NodeKind.TEXT, "<p>")),
        IR.classDeclaration(
            IR.token(NodeKind.KEYWORD, "class"),
            IR.directive(IR.token(NodeKind.KEYWORD, "@inject"), IR.directiveToken("Foo a")),
            IR.methodDeclaration(IR.token(NodeKind.IDENTIFIER, "a"))),
        IR.markupBlock(IR.token(NodeKind.TEXT, "</p>")));
  }

  @Test
  public void testUnchangedTreeIsSameInstance() {
    Node root = createTree();

    assertThat(new NodeRewriter().visit(root)).isSameInstanceAs(root);
    assertThat(new NodeRewriter(true).visit(root)).isSameInstanceAs(root);
  }

  @Test
  public void testDispatchIsPreOrderLeftToRight() {
    List<String> visited = new ArrayList<>();
    NodeRewriter recorder =
        new NodeRewriter() {
          @Override
          public @Nullable Node visitDocument(Node node) {
            visited.add("document");
            return super.visitDocument(node);
          }

          @Override
          public @Nullable Node visitClassDeclaration(Node node) {
            visited.add("class");
            return super.visitClassDeclaration(node);
          }

          @Override
          public @Nullable Node visitMethodDeclaration(Node node) {
            visited.add("method");
            return super.visitMethodDeclaration(node);
          }

          @Override
          public @Nullable Node visitDirective(Node node) {
            visited.add("directive");
            return super.visitDirective(node);
          }

          @Override
          public @Nullable Node visitDirectiveToken(Token token) {
            visited.add("directive token " + token.getContent());
            return super.visitDirectiveToken(token);
          }

          @Override
          public @Nullable Node visitToken(Token token) {
            visited.add(token.getContent());
            return super.visitToken(token);
          }

          @Override
          public Node visitDefault(Node node) {
            visited.add(node.getKind().toString());
            return super.visitDefault(node);
          }
        };

    recorder.visit(createTree());

    assertThat(visited)
        .containsExactly(
            "document",
            "DOCUMENT",
            "MARKUP_BLOCK",
            "<p>",
            "class",
            "CLASS_DECLARATION",
            "class",
            "directive",
            "DIRECTIVE",
            "@inject",
            "directive token Foo a",
            "Foo a",
            "method",
            "METHOD_DECLARATION",
            "a",
            "MARKUP_BLOCK",
            "</p>")
        .inOrder();
  }

  @Test
  public void testReplacementRebuildsOnlyAncestors() {
    Node root = createTree();
    Node replacement = IR.token(NodeKind.IDENTIFIER, "renamed");
    NodeRewriter rewriter =
        new NodeRewriter() {
          @Override
          public @Nullable Node visitToken(Token token) {
            return token.getContent().equals("a") ? replacement : token;
          }
        };

    Node result = rewriter.visit(root);

    assertThat(result).isNotSameInstanceAs(root);
    // Siblings before the change keep their position and are shared.
    assertThat(result.getChildAtIndex(0)).isSameInstanceAs(root.getChildAtIndex(0));
    Node classDeclaration = result.getChildAtIndex(1);
    assertThat(classDeclaration.getChildAtIndex(1))
        .isSameInstanceAs(root.getChildAtIndex(1).getChildAtIndex(1));
    Node method = classDeclaration.getChildAtIndex(2);
    assertThat(method.getFirstChild().toFullString()).isEqualTo("renamed");
    // Siblings after the change move.
    Node last = result.getChildAtIndex(2);
    assertThat(last.getPosition()).isEqualTo(root.getChildAtIndex(2).getPosition() + 6);
    assertThat(result.toFullString()).isEqualTo("<p>class@injectFoo arenamed</p>");
    new SyntaxTreeVerifier().verify(result);
  }

  @Test
  public void testNullRemovesNode() {
    NodeRewriter rewriter =
        new NodeRewriter() {
          @Override
          public @Nullable Node visitDirective(Node node) {
            return null;
          }
        };

    Node result = rewriter.visit(createTree());

    Node classDeclaration = result.getChildAtIndex(1);
    assertThat(classDeclaration.getChildCount()).isEqualTo(2);
    assertThat(classDeclaration.getChildAtIndex(1).getKind())
        .isEqualTo(NodeKind.METHOD_DECLARATION);
    assertThat(result.toFullString()).isEqualTo("<p>classa</p>");
  }

  @Test
  public void testDirectiveTokenReachesVisitToken() {
    List<String> tokens = new ArrayList<>();
    NodeRewriter rewriter =
        new NodeRewriter() {
          @Override
          public @Nullable Node visitToken(Token token) {
            tokens.add(token.getContent());
            return token;
          }
        };

    rewriter.visit(IR.directive(IR.directiveToken("Foo a")));

    assertThat(tokens).containsExactly("Foo a");
  }

  @Test
  public void testTriviaIsNotVisitedByDefault() {
    NodeRewriter rewriter =
        new NodeRewriter() {
          @Override
          public @Nullable Trivia visitTrivia(Trivia trivia) {
            throw new AssertionError("Unexpected trivia " + trivia);
          }
        };
    Node root =
        IR.markupBlock(
            IR.token(NodeKind.TEXT, "a")
                .withLeadingTrivia(ImmutableList.of(Trivia.whitespace(" "))));

    assertThat(rewriter.isVisitingIntoTrivia()).isFalse();
    assertThat(rewriter.visit(root)).isSameInstanceAs(root);
  }

  @Test
  public void testVisitIntoTrivia() {
    NodeRewriter rewriter =
        new NodeRewriter(true) {
          @Override
          public @Nullable Trivia visitTrivia(Trivia trivia) {
            return trivia.getKind() == Trivia.Kind.COMMENT ? null : trivia;
          }
        };
    Node root =
        IR.markupBlock(
            IR.token(NodeKind.TEXT, "a")
                .withLeadingTrivia(
                    ImmutableList.of(Trivia.comment("/*x*/"), Trivia.whitespace(" ")))
                .withTrailingTrivia(ImmutableList.of(Trivia.newLine("\n"))),
            IR.token(NodeKind.TEXT, "b"));

    Node result = rewriter.visit(root);

    assertThat(result.toFullString()).isEqualTo(" a\nb");
    assertThat(result.getFullWidth()).isEqualTo(4);
    assertThat(result.getChildAtIndex(1).getPosition()).isEqualTo(3);
  }
}
