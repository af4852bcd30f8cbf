// Copyright 2026 The Bazel Authors. All rights reserved.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//    http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.

package net.pyast.java.syntax;

import com.google.common.base.Preconditions;

/**
 * A Node is a node in the syntax tree. Every node carries the span of source text it was built
 * from, which covers the spans of all its children.
 */
public abstract class Node implements Spanned {

  private final Span span;

  Node(Span span) {
    this.span = Preconditions.checkNotNull(span);
  }

  @Override
  public final Span getSpan() {
    return span;
  }

  /** Returns the char offset of the source position of the first character of this node. */
  public final int getStartOffset() {
    return span.getStartOffset();
  }

  /** Returns the char offset just past the last character of this node. */
  public final int getEndOffset() {
    return span.getEndOffset();
  }

  /** Returns the location of the first character of this node. */
  public final Location getStartLocation() {
    return span.start();
  }

  /** Returns the location just past the last character of this node. */
  public final Location getEndLocation() {
    return span.end();
  }

  /**
   * Implements the double dispatch by calling into the node specific <code>visit</code> method of
   * the {@link NodeVisitor}
   *
   * @param visitor the {@link NodeVisitor} instance to dispatch to.
   */
  public abstract void accept(NodeVisitor visitor);

  @Override
  public String toString() {
    return getClass().getSimpleName() + "@" + span;
  }
}
