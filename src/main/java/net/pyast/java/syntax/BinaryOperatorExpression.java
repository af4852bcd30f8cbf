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

/** A BinaryExpression represents a binary operator expression 'x op y'. */
public final class BinaryOperatorExpression extends Expression {

  private final Expression x;
  private final TokenKind op;
  private final Span opSpan;
  private final Expression y;

  BinaryOperatorExpression(Span span, Expression x, TokenKind op, Span opSpan, Expression y) {
    super(span);
    this.x = Preconditions.checkNotNull(x);
    this.op = Preconditions.checkNotNull(op);
    this.opSpan = opSpan;
    this.y = Preconditions.checkNotNull(y);
  }

  /** Returns the left operand. */
  public Expression getX() {
    return x;
  }

  /** Returns the operator. */
  public TokenKind getOperator() {
    return op;
  }

  /** Returns the span of the operator token. */
  public Span getOperatorSpan() {
    return opSpan;
  }

  /** Returns the right operand. */
  public Expression getY() {
    return y;
  }

  @Override
  public void accept(NodeVisitor visitor) {
    visitor.visit(this);
  }

  @Override
  public Kind kind() {
    return Kind.BINARY_OPERATOR;
  }

  @Override
  public String toString() {
    return x + " " + op + " " + y;
  }
}
