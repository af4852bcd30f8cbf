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
 * Syntax node for a parenthesized expression, {@code (x)}. The parentheses are materialized so
 * that the node's span includes them; a parenthesized tuple or comprehension is represented by
 * its own node instead.
 */
public final class ParenExpression extends Expression {

  private final Expression x;

  ParenExpression(Span span, Expression x) {
    super(span);
    this.x = Preconditions.checkNotNull(x);
  }

  /** Returns the expression inside the parentheses. */
  public Expression getX() {
    return x;
  }

  @Override
  public void accept(NodeVisitor visitor) {
    visitor.visit(this);
  }

  @Override
  public Kind kind() {
    return Kind.PAREN;
  }

  @Override
  public String toString() {
    return "(" + x + ")";
  }
}
