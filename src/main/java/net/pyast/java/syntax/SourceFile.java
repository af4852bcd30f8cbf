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

import com.google.common.collect.ImmutableList;

/**
 * Syntax tree for a whole source file: its top-level statements, in source order.
 *
 * <p>The span of a file runs from its first statement through its end-of-file token, so an empty
 * file has the empty span of that token.
 */
public final class SourceFile extends Node {

  private final ImmutableList<Statement> statements;

  SourceFile(Span span, ImmutableList<Statement> statements) {
    super(span);
    this.statements = statements;
  }

  /** Returns an unmodifiable view of the list of top-level statements of this file. */
  public ImmutableList<Statement> getStatements() {
    return statements;
  }

  /** Returns the name of the file. */
  public String getName() {
    return getSpan().file();
  }

  @Override
  public void accept(NodeVisitor visitor) {
    visitor.visit(this);
  }

  @Override
  public String toString() {
    return "<SourceFile " + getName() + ">";
  }
}
