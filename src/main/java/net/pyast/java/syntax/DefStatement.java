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
import com.google.common.collect.ImmutableList;
import javax.annotation.Nullable;

/** Syntax node for a 'def' statement, which defines a function. */
public final class DefStatement extends Statement {

  private final Identifier identifier;
  private final ImmutableList<Parameter> parameters;
  @Nullable private final Expression returnAnnotation;
  private final ImmutableList<Statement> body; // non-empty

  DefStatement(
      Span span,
      Identifier identifier,
      ImmutableList<Parameter> parameters,
      @Nullable Expression returnAnnotation,
      ImmutableList<Statement> body) {
    super(span, Kind.DEF);
    Preconditions.checkArgument(!body.isEmpty(), "function without body");
    this.identifier = Preconditions.checkNotNull(identifier);
    this.parameters = parameters;
    this.returnAnnotation = returnAnnotation;
    this.body = body;
  }

  @Override
  public String toString() {
    // "def f(...): \n"
    StringBuilder buf = new StringBuilder();
    buf.append("def ").append(identifier.getName()).append('(');
    String sep = "";
    for (Parameter param : parameters) {
      buf.append(sep).append(param);
      sep = ", ";
    }
    buf.append(')');
    if (returnAnnotation != null) {
      buf.append(" -> ").append(returnAnnotation);
    }
    return buf.append(": ...\n").toString();
  }

  public Identifier getIdentifier() {
    return identifier;
  }

  public ImmutableList<Statement> getBody() {
    return body;
  }

  /** Returns the parameters in source order. Their order has been checked. */
  public ImmutableList<Parameter> getParameters() {
    return parameters;
  }

  /** Returns the return type annotation {@code T} of {@code def f() -> T:}, if any. */
  @Nullable
  public Expression getReturnAnnotation() {
    return returnAnnotation;
  }

  @Override
  public void accept(NodeVisitor visitor) {
    visitor.visit(this);
  }
}
