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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.errorprone.annotations.CheckReturnValue;
import com.google.mason.compiler.Diagnostic;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * This class implements the root of the intermediate representation.
 *
 * <p>Nodes are immutable. A parent lays its children out contiguously starting at its own
 * position, so {@code getPosition() + getFullWidth() == getEndPosition()} and the children of a
 * node always cover exactly {@code [getPosition(), getEndPosition())}. All {@code with*}
 * methods return new nodes and leave the receiver untouched; a child that has to move is copied
 * at its new position, children that are already in place are shared.
 */
public class Node {
  private final NodeKind kind;
  private final int position;
  private final int fullWidth;
  private final ImmutableList<Node> children;
  private final ImmutableMap<String, Annotation> annotations;
  private final ImmutableList<Diagnostic> diagnostics;

  Node(
      NodeKind kind,
      int position,
      int fullWidth,
      ImmutableList<Node> children,
      ImmutableMap<String, Annotation> annotations,
      ImmutableList<Diagnostic> diagnostics) {
    checkArgument(position >= 0, "Negative position %s for %s", position, kind);
    this.kind = checkNotNull(kind);
    this.position = position;
    this.fullWidth = fullWidth;
    this.children = children;
    this.annotations = annotations;
    this.diagnostics = diagnostics;
  }

  /** Creates a non-terminal node at position 0. */
  public static Node create(NodeKind kind, List<? extends Node> children) {
    return create(kind, 0, children);
  }

  /** Creates a non-terminal node whose first child starts at {@code position}. */
  public static Node create(NodeKind kind, int position, List<? extends Node> children) {
    checkArgument(!kind.isTerminal(), "%s is a token kind", kind);
    ImmutableList<Node> laidOut = layout(position, children);
    return new Node(
        kind,
        position,
        widthOf(laidOut),
        laidOut,
        ImmutableMap.of(),
        ImmutableList.of());
  }

  public final NodeKind getKind() {
    return kind;
  }

  public final boolean isKind(NodeKind kind) {
    return this.kind == kind;
  }

  public boolean isToken() {
    return false;
  }

  /** Offset of the first character of this node, trivia included. */
  public final int getPosition() {
    return position;
  }

  /** Offset just past the last character of this node, trivia included. */
  public final int getEndPosition() {
    return position + fullWidth;
  }

  /** Number of characters spanned by this node, trivia included. */
  public final int getFullWidth() {
    return fullWidth;
  }

  public final ImmutableList<Node> getChildren() {
    return children;
  }

  public final boolean hasChildren() {
    return !children.isEmpty();
  }

  public final int getChildCount() {
    return children.size();
  }

  public final Node getChildAtIndex(int i) {
    return children.get(i);
  }

  public final @Nullable Node getFirstChild() {
    return children.isEmpty() ? null : children.get(0);
  }

  /** Returns every annotation on this node, in the order they were first attached. */
  public final ImmutableList<Annotation> getAnnotations() {
    return annotations.values().asList();
  }

  public final @Nullable Annotation getAnnotation(String annotationKind) {
    return annotations.get(annotationKind);
  }

  /** Returns the span context this node was annotated with, if any. */
  public final @Nullable SpanContext getSpanContext() {
    Annotation annotation = annotations.get(Annotation.SPAN_CONTEXT_KIND);
    if (annotation != null && annotation.data() instanceof SpanContext) {
      return (SpanContext) annotation.data();
    }
    return null;
  }

  public final ImmutableList<Diagnostic> getDiagnostics() {
    return diagnostics;
  }

  final ImmutableMap<String, Annotation> annotationMap() {
    return annotations;
  }

  /** Returns a copy of this node with {@code annotation} attached, replacing one of its kind. */
  @CheckReturnValue
  public final Node withAnnotation(Annotation annotation) {
    Map<String, Annotation> merged = new LinkedHashMap<>(annotations);
    merged.put(annotation.kind(), annotation);
    return copy(position, children, ImmutableMap.copyOf(merged), diagnostics);
  }

  @CheckReturnValue
  public final Node withSpanContext(SpanContext context) {
    return withAnnotation(Annotation.spanContext(context));
  }

  /** Returns a copy of this node carrying {@code additional} after its current diagnostics. */
  @CheckReturnValue
  public final Node withDiagnostics(Iterable<Diagnostic> additional) {
    ImmutableList<Diagnostic> merged =
        ImmutableSet.<Diagnostic>builder().addAll(diagnostics).addAll(additional).build().asList();
    return copy(position, children, annotations, merged);
  }

  /**
   * Returns a node of the same kind, annotations and diagnostics with {@code newChildren} laid
   * out from this node's position. Returns {@code this} if the children are the same instances.
   */
  @CheckReturnValue
  public Node withChildren(List<? extends Node> newChildren) {
    if (sameInstances(children, newChildren)) {
      return this;
    }
    return copy(position, layout(position, newChildren), annotations, diagnostics);
  }

  /** Returns this subtree moved so that it starts at {@code newPosition}. */
  @CheckReturnValue
  public final Node withPosition(int newPosition) {
    if (newPosition == position) {
      return this;
    }
    return copy(newPosition, layout(newPosition, children), annotations, diagnostics);
  }

  /**
   * Creates a node like this one from already positioned children. Subclasses carrying extra
   * state override this to preserve it.
   */
  Node copy(
      int newPosition,
      ImmutableList<Node> newChildren,
      ImmutableMap<String, Annotation> newAnnotations,
      ImmutableList<Diagnostic> newDiagnostics) {
    return new Node(
        kind, newPosition, widthOf(newChildren), newChildren, newAnnotations, newDiagnostics);
  }

  /** Reconstructs the exact text spanned by this node, trivia included. */
  public final String toFullString() {
    StringBuilder sb = new StringBuilder(fullWidth);
    appendFullString(sb);
    return sb.toString();
  }

  void appendFullString(StringBuilder sb) {
    for (Node child : children) {
      child.appendFullString(sb);
    }
  }

  @Override
  public String toString() {
    return kind + " [" + position + ".." + getEndPosition() + ")";
  }

  /** Renders this subtree one node per line, indenting four spaces per level. */
  public final String toStringTree() {
    StringBuilder sb = new StringBuilder();
    toStringTreeHelper(this, 0, sb);
    return sb.toString();
  }

  private static void toStringTreeHelper(Node n, int level, StringBuilder sb) {
    for (int i = 0; i != level; ++i) {
      sb.append("    ");
    }
    sb.append(n);
    sb.append('\n');
    for (Node child : n.children) {
      toStringTreeHelper(child, level + 1, sb);
    }
  }

  private static ImmutableList<Node> layout(int start, List<? extends Node> nodes) {
    ImmutableList.Builder<Node> builder = ImmutableList.builderWithExpectedSize(nodes.size());
    int offset = start;
    for (Node node : nodes) {
      checkNotNull(node, "null child");
      builder.add(node.withPosition(offset));
      offset += node.getFullWidth();
    }
    return builder.build();
  }

  private static int widthOf(List<Node> nodes) {
    int width = 0;
    for (Node node : nodes) {
      width += node.getFullWidth();
    }
    return width;
  }

  private static boolean sameInstances(List<Node> a, List<? extends Node> b) {
    if (a == b) {
      return true;
    }
    if (a.size() != b.size()) {
      return false;
    }
    for (int i = 0; i < a.size(); i++) {
      if (a.get(i) != b.get(i)) {
        return false;
      }
    }
    return true;
  }
}
