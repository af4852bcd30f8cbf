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
import com.google.common.collect.ImmutableList;

/** Syntax node for list and tuple expressions. */
public final class ListExpression extends Expression {

  private final boolean isTuple;
  private final ImmutableList<Expression> elements;

  ListExpression(Span span, boolean isTuple, ImmutableList<Expression> elements) {
    super(span);
    this.isTuple = isTuple;
    this.elements = elements;
  }

  public ImmutableList<Expression> getElements() {
    return elements;
  }

  /** Reports whether this is a tuple expression. */
  public boolean isTuple() {
    return isTuple;
  }

  @Override
  public void accept(NodeVisitor visitor) {
    visitor.visit(this);
  }

  @Override
  public Kind kind() {
    return isTuple ? Kind.TUPLE_EXPR : Kind.LIST_EXPR;
  }

  @Override
  public String toString() {
    String elems = Joiner.on(", ").join(elements);
    if (!isTuple) {
      return "[" + elems + "]";
    }
    return elements.size() == 1 ? "(" + elems + ",)" : "(" + elems + ")";
  }
}
