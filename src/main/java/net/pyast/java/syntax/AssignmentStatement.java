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
 * Syntax node for an assignment statement, {@code a = b = value}. A chained assignment has several
 * targets, which are assigned the same value from left to right.
 */
public final class AssignmentStatement extends Statement {

  private final ImmutableList<Expression> targets; // non-empty
  private final Expression value;

  AssignmentStatement(Span span, ImmutableList<Expression> targets, Expression value) {
    super(span, Kind.ASSIGNMENT);
    Preconditions.checkArgument(!targets.isEmpty(), "assignment without targets");
    this.targets = targets;
    this.value = Preconditions.checkNotNull(value);
  }

  /** Returns the targets of the assignment, left to right. */
  public ImmutableList<Expression> getTargets() {
    return targets;
  }

  /** Returns the assigned value, the expression right of the last '='. */
  public Expression getValue() {
    return value;
  }

  @Override
  public void accept(NodeVisitor visitor) {
    visitor.visit(this);
  }

  @Override
  public String toString() {
    return Joiner.on(" = ").join(targets) + " = " + value + "\n";
  }
}
