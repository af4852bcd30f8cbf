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

/**
 * Syntax node for the inside of a comprehension: a body followed by one or more {@code for} and
 * {@code if} clauses, as in {@code e for x in xs if p(x)}. The body is an {@link Expression}, or
 * a {@link DictExpression.Entry} in a dict comprehension.
 *
 * <p>A Comprehension is not an expression by itself; the brackets around it determine whether it
 * becomes a list, set or dict comprehension or a generator expression (see {@link
 * ComprehensionExpression}).
 */
public final class Comprehension extends Node {

  /** A For or If clause in a comprehension. */
  public abstract static class Clause extends Node {
    Clause(Span span) {
      super(span);
    }
  }

  /** A {@code for vars in iterable} clause in a comprehension. */
  public static final class For extends Clause {
    private final Expression vars;
    private final Expression iterable;

    For(Span span, Expression vars, Expression iterable) {
      super(span);
      this.vars = Preconditions.checkNotNull(vars);
      this.iterable = Preconditions.checkNotNull(iterable);
    }

    public Expression getVars() {
      return vars;
    }

    public Expression getIterable() {
      return iterable;
    }

    @Override
    public void accept(NodeVisitor visitor) {
      visitor.visit(this);
    }

    @Override
    public String toString() {
      return "for " + vars + " in " + iterable;
    }
  }

  /** An {@code if condition} clause in a comprehension. */
  public static final class If extends Clause {
    private final Expression condition;

    If(Span span, Expression condition) {
      super(span);
      this.condition = Preconditions.checkNotNull(condition);
    }

    public Expression getCondition() {
      return condition;
    }

    @Override
    public void accept(NodeVisitor visitor) {
      visitor.visit(this);
    }

    @Override
    public String toString() {
      return "if " + condition;
    }
  }

  private final Node body; // Expression or DictExpression.Entry
  private final ImmutableList<Clause> clauses; // first clause is a For

  Comprehension(Span span, Node body, ImmutableList<Clause> clauses) {
    super(span);
    Preconditions.checkArgument(
        body instanceof Expression || body instanceof DictExpression.Entry,
        "invalid comprehension body: %s",
        body);
    Preconditions.checkArgument(
        !clauses.isEmpty() && clauses.get(0) instanceof For,
        "comprehension must begin with a for clause");
    this.body = body;
    this.clauses = clauses;
  }

  /**
   * Returns the body of the comprehension: an {@link Expression}, or a {@link
   * DictExpression.Entry} for a dict comprehension.
   */
  public Node getBody() {
    return body;
  }

  /** Returns the for and if clauses, in source order. */
  public ImmutableList<Clause> getClauses() {
    return clauses;
  }

  @Override
  public void accept(NodeVisitor visitor) {
    visitor.visit(this);
  }

  @Override
  public String toString() {
    StringBuilder buf = new StringBuilder().append(body);
    for (Clause clause : clauses) {
      buf.append(' ').append(clause);
    }
    return buf.toString();
  }
}
