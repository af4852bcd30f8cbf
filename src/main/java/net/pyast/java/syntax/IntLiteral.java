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

/** Syntax node for an int literal. */
public final class IntLiteral extends Expression {

  private final Number value; // = Integer | Long | BigInteger

  IntLiteral(Span span, Number value) {
    super(span);
    this.value = Preconditions.checkNotNull(value);
  }

  /**
   * Returns the value denoted by this literal as an Integer, Long, or BigInteger, as decoded by the
   * lexer.
   */
  public Number getValue() {
    return value;
  }

  @Override
  public void accept(NodeVisitor visitor) {
    visitor.visit(this);
  }

  @Override
  public Kind kind() {
    return Kind.INT_LITERAL;
  }

  @Override
  public String toString() {
    return value.toString();
  }
}
