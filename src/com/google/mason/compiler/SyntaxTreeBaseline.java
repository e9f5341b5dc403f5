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

import static java.nio.charset.StandardCharsets.UTF_8;

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.common.io.Files;
import com.google.mason.ir.Node;
import java.io.File;
import java.io.IOException;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * Reads and writes syntax tree baselines. A baseline named {@code foo} is made of {@code
 * foo.syntaxtree.txt}, the serialized tree, and {@code foo.diagnostics.txt}, one line per
 * diagnostic. A missing diagnostics file means there were no diagnostics.
 */
public final class SyntaxTreeBaseline {
  public static final String SYNTAX_TREE_SUFFIX = ".syntaxtree.txt";
  public static final String DIAGNOSTICS_SUFFIX = ".diagnostics.txt";

  private static final Splitter LINE_SPLITTER = Splitter.on('\n');

  private SyntaxTreeBaseline() {}

  public static File syntaxTreeFile(File directory, String baseName) {
    return new File(directory, baseName + SYNTAX_TREE_SUFFIX);
  }

  public static File diagnosticsFile(File directory, String baseName) {
    return new File(directory, baseName + DIAGNOSTICS_SUFFIX);
  }

  /**
   * Writes the baseline of {@code root}. When there are no diagnostics an existing diagnostics
   * file is deleted rather than emptied.
   */
  public static void write(
      File directory, String baseName, Node root, List<Diagnostic> diagnostics)
      throws IOException {
    Files.asCharSink(syntaxTreeFile(directory, baseName), UTF_8)
        .write(SyntaxTreeSerializer.serialize(root));

    File diagnosticsFile = diagnosticsFile(directory, baseName);
    if (diagnostics.isEmpty()) {
      if (diagnosticsFile.exists() && !diagnosticsFile.delete()) {
        throw new IOException("Unable to delete " + diagnosticsFile);
      }
      return;
    }
    Files.asCharSink(diagnosticsFile, UTF_8).write(serializeDiagnostics(diagnostics));
  }

  /** One line per diagnostic: its id followed by its span. */
  public static String serializeDiagnostics(List<Diagnostic> diagnostics) {
    StringBuilder sb = new StringBuilder();
    for (Diagnostic diagnostic : diagnostics) {
      sb.append(diagnostic.toBaselineString()).append('\n');
    }
    return sb.toString();
  }

  /** Reads the lines of {@code file}. A file that does not exist has no lines. */
  public static ImmutableList<String> readLines(File file) throws IOException {
    if (!file.exists()) {
      return ImmutableList.of();
    }
    return Files.asCharSource(file, UTF_8).readLines();
  }

  /** Splits serialized output into lines. A trailing line break does not start a new line. */
  public static ImmutableList<String> toLines(String text) {
    if (text.isEmpty()) {
      return ImmutableList.of();
    }
    String trimmed = text.endsWith("\n") ? text.substring(0, text.length() - 1) : text;
    return ImmutableList.copyOf(LINE_SPLITTER.split(trimmed));
  }

  /**
   * Describes the first line where {@code actual} differs from {@code expected}, or returns null
   * if they are the same.
   */
  public static @Nullable String findFirstMismatch(List<String> expected, List<String> actual) {
    int common = Math.min(expected.size(), actual.size());
    for (int i = 0; i < common; i++) {
      if (!expected.get(i).equals(actual.get(i))) {
        return "Line "
            + (i + 1)
            + " differs.\nExpected:\n"
            + expected.get(i)
            + "\nFound:\n"
            + actual.get(i);
      }
    }
    if (expected.size() != actual.size()) {
      return "Expected "
          + expected.size()
          + " lines but found "
          + actual.size()
          + ". First line missing from "
          + (expected.size() > actual.size() ? "output" : "baseline")
          + ":\n"
          + (expected.size() > actual.size() ? expected.get(common) : actual.get(common));
    }
    return null;
  }
}
