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
import java.util.Comparator;
import java.util.TreeSet;

/**
 * An error manager that de-duplicates and sorts the diagnostics reported to it and prints them
 * when {@link #generateReport()} is called.
 *
 * <p>This error manager does not produce any output, subclasses override {@link
 * #println(CheckLevel, Diagnostic)} and {@link #printSummary()} to generate it.
 */
public abstract class BasicErrorManager implements ErrorManager {
  private final TreeSet<DiagnosticWithLevel> messages =
      new TreeSet<>(new LeveledDiagnosticComparator());
  private int errorCount = 0;
  private int warningCount = 0;

  @Override
  public void report(CheckLevel level, Diagnostic diagnostic) {
    if (!level.isOn()) {
      return;
    }
    if (messages.add(new DiagnosticWithLevel(diagnostic, level))) {
      if (level == CheckLevel.ERROR) {
        errorCount++;
      } else {
        warningCount++;
      }
    }
  }

  @Override
  public void generateReport() {
    for (DiagnosticWithLevel message : messages) {
      println(message.level, message.diagnostic);
    }
    printSummary();
  }

  /**
   * Print a message with a trailing new line. This method is called by the {@link
   * #generateReport()} method when generating messages.
   */
  public abstract void println(CheckLevel level, Diagnostic diagnostic);

  /** Print the summary of the run: number of errors and warnings. */
  protected abstract void printSummary();

  @Override
  public int getErrorCount() {
    return errorCount;
  }

  @Override
  public int getWarningCount() {
    return warningCount;
  }

  @Override
  public ImmutableList<Diagnostic> getErrors() {
    return toList(CheckLevel.ERROR);
  }

  @Override
  public ImmutableList<Diagnostic> getWarnings() {
    return toList(CheckLevel.WARNING);
  }

  private ImmutableList<Diagnostic> toList(CheckLevel level) {
    ImmutableList.Builder<Diagnostic> diagnostics = ImmutableList.builder();
    for (DiagnosticWithLevel p : messages) {
      if (p.level == level) {
        diagnostics.add(p.diagnostic);
      }
    }
    return diagnostics.build();
  }

  /**
   * Orders diagnostics by level (errors first), file path, offset, id and finally message.
   * Diagnostics comparing equal are reported once.
   */
  static final class LeveledDiagnosticComparator implements Comparator<DiagnosticWithLevel> {
    private static final int P1_LT_P2 = -1;
    private static final int P1_GT_P2 = 1;

    @Override
    public int compare(DiagnosticWithLevel p1, DiagnosticWithLevel p2) {
      // null is the smallest value
      if (p2 == null) {
        return p1 == null ? 0 : P1_GT_P2;
      } else if (p1 == null) {
        return P1_LT_P2;
      }

      if (p1.level != p2.level) {
        return p1.level.compareTo(p2.level);
      }

      String path1 = p1.diagnostic.span().filePath();
      String path2 = p2.diagnostic.span().filePath();
      if (path1 != null && path2 != null) {
        int pathCompare = path1.compareTo(path2);
        if (pathCompare != 0) {
          return pathCompare;
        }
      } else if (path1 == null && path2 != null) {
        return P1_LT_P2;
      } else if (path1 != null) {
        return P1_GT_P2;
      }

      int index1 = p1.diagnostic.span().absoluteIndex();
      int index2 = p2.diagnostic.span().absoluteIndex();
      if (index1 != index2) {
        return Integer.compare(index1, index2);
      }

      int idCompare = p1.diagnostic.id().compareTo(p2.diagnostic.id());
      if (idCompare != 0) {
        return idCompare;
      }
      return p1.diagnostic.message().compareTo(p2.diagnostic.message());
    }
  }

  static final class DiagnosticWithLevel {
    final Diagnostic diagnostic;
    final CheckLevel level;

    DiagnosticWithLevel(Diagnostic diagnostic, CheckLevel level) {
      this.diagnostic = diagnostic;
      this.level = level;
    }
  }
}
