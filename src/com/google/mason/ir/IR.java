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

import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableList;
import java.util.List;

/** A tree construction helper class. */
public class IR {

  private IR() {}

  public static Node node(NodeKind kind, Node... children) {
    return Node.create(kind, ImmutableList.copyOf(children));
  }

  public static Token token(NodeKind kind, String content) {
    return Token.create(kind, content);
  }

  public static Token missing(NodeKind kind) {
    return Token.missing(kind);
  }

  public static Node document(Node... children) {
    for (Node child : children) {
      checkState(!child.isKind(NodeKind.DOCUMENT), "Documents cannot be nested");
    }
    return node(NodeKind.DOCUMENT, children);
  }

  public static Node namespaceDeclaration(Node... children) {
    return node(NodeKind.NAMESPACE_DECLARATION, children);
  }

  public static Node classDeclaration(Node... children) {
    return classDeclaration(ImmutableList.copyOf(children));
  }

  public static Node classDeclaration(List<? extends Node> children) {
    return Node.create(NodeKind.CLASS_DECLARATION, children);
  }

  public static Node methodDeclaration(Node... children) {
    return node(NodeKind.METHOD_DECLARATION, children);
  }

  /** A directive such as {@code @inject Foo foo}, holding its directive tokens. */
  public static Node directive(Node... children) {
    return node(NodeKind.DIRECTIVE, children);
  }

  public static Token directiveToken(String content) {
    return Token.create(NodeKind.DIRECTIVE_TOKEN, content);
  }

  /** The container that design-time lowering hoists directive tokens into. */
  public static Node designTimeDirective(List<? extends Node> directiveTokens) {
    for (Node token : directiveTokens) {
      checkState(
          token.isKind(NodeKind.DIRECTIVE_TOKEN),
          "Design time directive cannot contain %s",
          token.getKind());
    }
    return Node.create(NodeKind.DESIGN_TIME_DIRECTIVE, directiveTokens);
  }

  /** A fragment of generated code held in a single {@link NodeKind#CODE} token. */
  public static Node codeFragment(String code) {
    return node(NodeKind.CODE_FRAGMENT, token(NodeKind.CODE, code));
  }

  public static Node htmlContent(String html) {
    return node(NodeKind.HTML_CONTENT, token(NodeKind.HTML, html));
  }

  public static Node markupBlock(Node... children) {
    return node(NodeKind.MARKUP_BLOCK, children);
  }
}
