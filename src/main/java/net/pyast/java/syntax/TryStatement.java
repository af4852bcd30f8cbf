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
 * Syntax node for a try statement, with its except clauses and optional else and finally blocks.
 *
 * <pre>
 * try:
 *   body
 * except T as e:
 *   handler
 * else:
 *   elseBody
 * finally:
 *   finallyBody
 * </pre>
 */
public final class TryStatement extends Statement {

  private final ImmutableList<Statement> body;
  private final ImmutableList<ExceptHandler> handlers;
  private final ImmutableList<Statement> elseBody; // empty if absent
  private final ImmutableList<Statement> finallyBody; // empty if absent

  TryStatement(
      Span span,
      ImmutableList<Statement> body,
      ImmutableList<ExceptHandler> handlers,
      ImmutableList<Statement> elseBody,
      ImmutableList<Statement> finallyBody) {
    super(span, Kind.TRY);
    Preconditions.checkArgument(!body.isEmpty(), "try statement without body");
    this.body = body;
    this.handlers = handlers;
    this.elseBody = elseBody;
    this.finallyBody = finallyBody;
  }

  public ImmutableList<Statement> getBody() {
    return body;
  }

  public ImmutableList<ExceptHandler> getHandlers() {
    return handlers;
  }

  /** Returns the statements of the else block, or an empty list if there is none. */
  public ImmutableList<Statement> getElseBody() {
    return elseBody;
  }

  /** Returns the statements of the finally block, or an empty list if there is none. */
  public ImmutableList<Statement> getFinallyBody() {
    return finallyBody;
  }

  @Override
  public void accept(NodeVisitor visitor) {
    visitor.visit(this);
  }

  @Override
  public String toString() {
    return "try: ...\n";
  }
}
