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

import static java.util.Objects.requireNonNull;

/**
 * Auxiliary metadata attached to a {@link Node}. A node holds at most one annotation per kind.
 *
 * @param kind The key under which the annotation is stored.
 * @param data The payload, for example a {@link SpanContext}.
 */
public record Annotation(String kind, Object data) {

  /** Kind of the annotation carrying a {@link SpanContext}. */
  public static final String SPAN_CONTEXT_KIND = "SpanContext";

  public Annotation {
    requireNonNull(kind, "kind");
    requireNonNull(data, "data");
  }

  public static Annotation spanContext(SpanContext context) {
    return new Annotation(SPAN_CONTEXT_KIND, context);
  }
}
