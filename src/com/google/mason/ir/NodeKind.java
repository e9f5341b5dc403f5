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

/**
 * The closed set of node kinds. Kinds created with {@code terminal = true} are only used by
 * {@link Token}s; every other kind tags a non-terminal {@link Node}.
 */
public enum NodeKind {
  // Syntax tree blocks.
  MARKUP_BLOCK,
  MARKUP_TEXT_LITERAL,
  CODE_BLOCK,
  CODE_STATEMENT,
  CODE_EXPRESSION,
  CODE_LITERAL,
  TRANSITION_BLOCK,
  TEMPLATE_DIRECTIVE,
  TEMPLATE_DIRECTIVE_BODY,
  META_CODE,

  // Intermediate representation.
  DOCUMENT,
  NAMESPACE_DECLARATION,
  CLASS_DECLARATION,
  METHOD_DECLARATION,
  DIRECTIVE,
  DESIGN_TIME_DIRECTIVE,
  CODE_FRAGMENT,
  HTML_CONTENT,

  // Terminals.
  TEXT(true),
  WHITESPACE(true),
  NEW_LINE(true),
  TRANSITION(true),
  IDENTIFIER(true),
  KEYWORD(true),
  LEFT_BRACE(true),
  RIGHT_BRACE(true),
  SEMICOLON(true),
  MARKER(true),
  CODE(true),
  HTML(true),
  DIRECTIVE_TOKEN(true);

  private final boolean terminal;

  NodeKind() {
    this(false);
  }

  NodeKind(boolean terminal) {
    this.terminal = terminal;
  }

  /** Whether nodes of this kind are leaves carrying literal content. */
  public boolean isTerminal() {
    return terminal;
  }
}
