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

import static com.google.common.base.Preconditions.checkNotNull;

import java.util.Objects;

/**
 * Non-semantic text attached to a {@link Token}: whitespace, line breaks and comments. Trivia
 * counts towards the full width of its token but is never part of the token's content.
 */
public final class Trivia {

  /** The flavour of trivia. */
  public enum Kind {
    WHITESPACE,
    NEW_LINE,
    COMMENT
  }

  private final Kind kind;
  private final String text;

  private Trivia(Kind kind, String text) {
    this.kind = checkNotNull(kind);
    this.text = checkNotNull(text);
  }

  public static Trivia whitespace(String text) {
    return new Trivia(Kind.WHITESPACE, text);
  }

  public static Trivia newLine(String text) {
    return new Trivia(Kind.NEW_LINE, text);
  }

  public static Trivia comment(String text) {
    return new Trivia(Kind.COMMENT, text);
  }

  public Kind getKind() {
    return kind;
  }

  public String getText() {
    return text;
  }

  public int getFullWidth() {
    return text.length();
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof Trivia)) {
      return false;
    }
    Trivia that = (Trivia) o;
    return kind == that.kind && text.equals(that.text);
  }

  @Override
  public int hashCode() {
    return Objects.hash(kind, text);
  }

  @Override
  public String toString() {
    return kind + "[" + text + "]";
  }
}
