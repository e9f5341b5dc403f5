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

import static com.google.common.base.Preconditions.checkNotNull;

import java.util.logging.Logger;

/**
 * Compiles templates: parses each source, then runs the passes selected by the options over the
 * resulting tree. Diagnostics go to the error manager; callers decide what to do with them.
 */
public class TemplateCompiler {
  private static final Logger logger = Logger.getLogger(TemplateCompiler.class.getName());

  private final TemplateParser parser;
  private final CompilerOptions options;
  private final ErrorManager errorManager;
  private final PassPipeline pipeline;

  public TemplateCompiler(
      TemplateParser parser, CompilerOptions options, ErrorManager errorManager) {
    this.parser = checkNotNull(parser);
    this.options = checkNotNull(options);
    this.errorManager = checkNotNull(errorManager);
    this.pipeline = PassPipeline.forOptions(options, errorManager);
  }

  public CompilerOptions getOptions() {
    return options;
  }

  public ErrorManager getErrorManager() {
    return errorManager;
  }

  /** Parses and lowers {@code source}. The lowered tree is the document node of the result. */
  public CodeDocument compile(SourceDocument source) {
    logger.fine("Compiling " + source);
    CodeDocument document = CodeDocument.create(source, options);
    document.setSyntaxTree(parser.parse(source, options));
    pipeline.process(document);
    return document;
  }
}
