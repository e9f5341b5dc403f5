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

import java.io.Serializable;

/** Compiler options. */
public class CompilerOptions implements Serializable {
  private static final long serialVersionUID = 1L;

  /**
   * Whether the output is meant for editor tooling rather than execution. Design-time output keeps
   * directive declarations visible to the type checker even when the types they name are absent.
   */
  private boolean designTime = false;

  /** Whether every pass's output is checked by {@link SyntaxTreeVerifier}. */
  private boolean verifySyntaxTrees = false;

  public CompilerOptions() {}

  public boolean isDesignTime() {
    return designTime;
  }

  public void setDesignTime(boolean designTime) {
    this.designTime = designTime;
  }

  public boolean shouldVerifySyntaxTrees() {
    return verifySyntaxTrees;
  }

  public void setVerifySyntaxTrees(boolean verifySyntaxTrees) {
    this.verifySyntaxTrees = verifySyntaxTrees;
  }
}
