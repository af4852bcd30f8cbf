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

/** Syntax node for a set expression, {@code {a, b, c}}. A set display is never empty. */
public final class SetExpression extends Expression {

  private final ImmutableList<Expression> elements;

  SetExpression(Span span, ImmutableList<Expression> elements) {
    super(span);
    Preconditions.checkArgument(!elements.isEmpty(), "empty set display");
    this.elements = elements;
  }

  public ImmutableList<Expression> getElements() {
    return elements;
  }

  @Override
  public void accept(NodeVisitor visitor) {
    visitor.visit(this);
  }

  @Override
  public Kind kind() {
    return Kind.SET_EXPR;
  }

  @Override
  public String toString() {
    return "{" + Joiner.on(", ").join(elements) + "}";
  }
}
