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
import static java.nio.charset.StandardCharsets.UTF_8;

import com.google.common.collect.ImmutableList;
import com.google.common.io.Files;
import com.google.mason.ir.IR;
import com.google.mason.ir.Node;
import com.google.mason.ir.NodeKind;
import com.google.mason.ir.SourceSpan;
import java.io.File;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class SyntaxTreeBaselineTest {
  private static final DiagnosticType UNEXPECTED = DiagnosticType.error("MSN0005", "{0}");

  @Rule public final TemporaryFolder folder = new TemporaryFolder();

  private static final Node ROOT = IR.markupBlock(IR.token(NodeKind.TEXT, "a"));

  @Test
  public void testWrite() throws Exception {
    File dir = folder.getRoot();
    Diagnostic diagnostic = Diagnostic.make(UNEXPECTED, SourceSpan.of(0, 0, 0, 1), "a");

    SyntaxTreeBaseline.write(dir, "Sample", ROOT, ImmutableList.of(diagnostic));

    assertThat(Files.asCharSource(new File(dir, "Sample.syntaxtree.txt"), UTF_8).read())
        .isEqualTo("MARKUP_BLOCK - [0..1) - FullWidth: 1 - [a]\n    TEXT;[a];\n");
    assertThat(SyntaxTreeBaseline.readLines(new File(dir, "Sample.diagnostics.txt")))
        .containsExactly("MSN0005(0:0,0 [1] )");
  }

  @Test
  public void testStaleDiagnosticsFileIsDeleted() throws Exception {
    File dir = folder.getRoot();
    File diagnostics = SyntaxTreeBaseline.diagnosticsFile(dir, "Sample");
    Files.asCharSink(diagnostics, UTF_8).write("MSN0005(0:0,0 [1] )\n");

    SyntaxTreeBaseline.write(dir, "Sample", ROOT, ImmutableList.of());

    assertThat(diagnostics.exists()).isFalse();
    assertThat(SyntaxTreeBaseline.syntaxTreeFile(dir, "Sample").exists()).isTrue();
  }

  @Test
  public void testNoDiagnosticsFileIsCreated() throws Exception {
    File dir = folder.getRoot();

    SyntaxTreeBaseline.write(dir, "Sample", ROOT, ImmutableList.of());

    assertThat(SyntaxTreeBaseline.diagnosticsFile(dir, "Sample").exists()).isFalse();
  }

  @Test
  public void testWrittenBaselineMatchesItsOutput() throws Exception {
    File dir = folder.getRoot();
    Node root =
        IR.markupBlock(IR.token(NodeKind.TEXT, "a\rb"), IR.token(NodeKind.NEW_LINE, "\r\n"));

    SyntaxTreeBaseline.write(dir, "Sample", root, ImmutableList.of());

    assertThat(
            SyntaxTreeBaseline.findFirstMismatch(
                SyntaxTreeBaseline.readLines(SyntaxTreeBaseline.syntaxTreeFile(dir, "Sample")),
                SyntaxTreeBaseline.toLines(SyntaxTreeSerializer.serialize(root))))
        .isNull();
  }

  @Test
  public void testMissingFileHasNoLines() throws Exception {
    assertThat(SyntaxTreeBaseline.readLines(new File(folder.getRoot(), "missing.txt"))).isEmpty();
  }

  @Test
  public void testReadLinesAcceptsWindowsLineEndings() throws Exception {
    File file = folder.newFile("crlf.txt");
    Files.asCharSink(file, UTF_8).write("a\r\nb\r\n");

    assertThat(SyntaxTreeBaseline.readLines(file)).containsExactly("a", "b").inOrder();
  }

  @Test
  public void testToLines() {
    assertThat(SyntaxTreeBaseline.toLines("")).isEmpty();
    assertThat(SyntaxTreeBaseline.toLines("a\nb\n")).containsExactly("a", "b").inOrder();
    assertThat(SyntaxTreeBaseline.toLines("a\n\nb")).containsExactly("a", "", "b").inOrder();
  }

  @Test
  public void testFindFirstMismatch() {
    assertThat(
            SyntaxTreeBaseline.findFirstMismatch(
                ImmutableList.of("a", "b"), ImmutableList.of("a", "b")))
        .isNull();
    assertThat(
            SyntaxTreeBaseline.findFirstMismatch(
                ImmutableList.of("a", "b", "c"), ImmutableList.of("a", "x", "y")))
        .isEqualTo("Line 2 differs.\nExpected:\nb\nFound:\nx");
    assertThat(
            SyntaxTreeBaseline.findFirstMismatch(ImmutableList.of("a", "b"), ImmutableList.of("a")))
        .isEqualTo("Expected 2 lines but found 1. First line missing from output:\nb");
    assertThat(
            SyntaxTreeBaseline.findFirstMismatch(ImmutableList.of(), ImmutableList.of("a")))
        .isEqualTo("Expected 0 lines but found 1. First line missing from baseline:\na");
  }
}
