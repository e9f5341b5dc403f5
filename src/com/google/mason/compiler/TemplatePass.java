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

import com.google.mason.ir.Node;

/**
 * A step of template compilation. Passes run in ascending {@link #getOrder()}; passes with the
 * same order run in registration order.
 *
 * <p>Passes never modify the tree they are given. Running a pass twice over the same tree gives
 * equal results.
 */
public interface TemplatePass {

  /** Where this pass runs relative to the others. Lower values run first. */
  int getOrder();

  /**
   * Transforms {@code root}.
   *
   * @param document The document being compiled, which collects the diagnostics a pass reports
   * @param root Top of the tree built so far
   * @return the transformed tree, or {@code root} itself if nothing changed
   */
  Node execute(CodeDocument document, Node root);
}
