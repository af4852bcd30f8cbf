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

/** Syntax node for a function call expression, {@code f(args...)}. */
public final class CallExpression extends Expression {

  private final Expression function;
  private final ImmutableList<Argument> arguments;

  CallExpression(Span span, Expression function, ImmutableList<Argument> arguments) {
    super(span);
    this.function = Preconditions.checkNotNull(function);
    this.arguments = arguments;
  }

  /** Returns the function that is called. */
  public Expression getFunction() {
    return function;
  }

  /** Returns the arguments of the call, in source order. */
  public ImmutableList<Argument> getArguments() {
    return arguments;
  }

  @Override
  public void accept(NodeVisitor visitor) {
    visitor.visit(this);
  }

  @Override
  public Kind kind() {
    return Kind.CALL;
  }

  @Override
  public String toString() {
    return function + "(" + Joiner.on(", ").join(arguments) + ")";
  }
}
