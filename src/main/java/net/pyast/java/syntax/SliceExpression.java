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

import com.google.common.base.Joiner;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

/**
 * Syntax node for a slice expression, {@code object[slices]}, whose subscript contains at least
 * one proper slice ({@code a:b:c}) or ellipsis. Subscript components that are plain expressions
 * appear among the slices as {@link Slice.Index} values.
 */
public final class SliceExpression extends Expression {

  private final Expression object;
  private final ImmutableList<Slice> slices; // non-empty

  SliceExpression(Span span, Expression object, ImmutableList<Slice> slices) {
    super(span);
    Preconditions.checkArgument(!slices.isEmpty(), "slice expression without slices");
    this.object = Preconditions.checkNotNull(object);
    this.slices = slices;
  }

  public Expression getObject() {
    return object;
  }

  /** Returns the comma-separated components of the subscript, in source order. */
  public ImmutableList<Slice> getSlices() {
    return slices;
  }

  @Override
  public void accept(NodeVisitor visitor) {
    visitor.visit(this);
  }

  @Override
  public Kind kind() {
    return Kind.SLICE;
  }

  @Override
  public String toString() {
    return object + "[" + Joiner.on(", ").join(slices) + "]";
  }
}
