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

/** Syntax node for a definition preceded by one or more decorators. */
public final class DecoratedStatement extends Statement {

  private final ImmutableList<Decorator> decorators; // non-empty
  private final Statement definition;

  DecoratedStatement(Span span, ImmutableList<Decorator> decorators, Statement definition) {
    super(span, Kind.DECORATED);
    Preconditions.checkArgument(!decorators.isEmpty(), "no decorators");
    this.decorators = decorators;
    this.definition = Preconditions.checkNotNull(definition);
  }

  /** Returns the decorators, in source order (the reverse of application order). */
  public ImmutableList<Decorator> getDecorators() {
    return decorators;
  }

  /** Returns the decorated definition. */
  public Statement getDefinition() {
    return definition;
  }

  @Override
  public void accept(NodeVisitor visitor) {
    visitor.visit(this);
  }

  @Override
  public String toString() {
    StringBuilder buf = new StringBuilder();
    for (Decorator decorator : decorators) {
      buf.append(decorator).append('\n');
    }
    return buf.append(definition).toString();
  }
}
