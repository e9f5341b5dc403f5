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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.mason.ir.EditHandler.AcceptedCharacters;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class IRTest {

  @Test
  public void testCodeFragment() {
    Node fragment = IR.codeFragment("int x;");

    assertThat(fragment.getKind()).isEqualTo(NodeKind.CODE_FRAGMENT);
    assertThat(fragment.getChildCount()).isEqualTo(1);
    assertThat(fragment.getFirstChild().getKind()).isEqualTo(NodeKind.CODE);
    assertThat(fragment.toFullString()).isEqualTo("int x;");
  }

  @Test
  public void testHtmlContent() {
    Node html = IR.htmlContent("<b>");

    assertThat(html.getKind()).isEqualTo(NodeKind.HTML_CONTENT);
    assertThat(html.getFirstChild().getKind()).isEqualTo(NodeKind.HTML);
    assertThat(html.toFullString()).isEqualTo("<b>");
  }

  @Test
  public void testDocumentsCannotBeNested() {
    Node document = IR.document();

    assertThrows(IllegalStateException.class, () -> IR.document(document));
  }

  @Test
  public void testDesignTimeDirectiveOnlyHoldsDirectiveTokens() {
    Node holder = IR.designTimeDirective(ImmutableList.of(IR.directiveToken("Foo")));
    assertThat(holder.getChildCount()).isEqualTo(1);

    assertThrows(
        IllegalStateException.class,
        () -> IR.designTimeDirective(ImmutableList.of(IR.token(NodeKind.TEXT, "Foo"))));
  }

  @Test
  public void testDescriptors() {
    assertThat(ChunkGenerator.directive("inject").toString()).isEqualTo("Directive:{inject}");
    assertThat(ChunkGenerator.META_CODE.toString()).isEqualTo("MetaCode");
    assertThat(EditHandler.accepting(AcceptedCharacters.ANY).toString())
        .isEqualTo("SpanEditHandler;Accepts:Any");
    EditHandler autoComplete = EditHandler.autoComplete(AcceptedCharacters.NONE, "}");
    assertThat(autoComplete.toString())
        .isEqualTo("AutoCompleteEditHandler;Accepts:None,AutoComplete:[}]");
    assertThat(autoComplete.getAutoCompleteString()).isEqualTo("}");
    assertThat(autoComplete.getAcceptedCharacters()).isEqualTo(AcceptedCharacters.NONE);
  }

  @Test
  public void testSourceSpanToString() {
    assertThat(SourceSpan.of(12, 1, 4, 3).toString()).isEqualTo("(12:1,4 [3] )");
    assertThat(new SourceSpan("a.mason", 0, 0, 0, 1).toString()).isEqualTo("(0:0,0 [1] a.mason)");
  }
}
