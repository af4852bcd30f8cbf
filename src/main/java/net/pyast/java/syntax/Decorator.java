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
import javax.annotation.Nullable;

/**
 * Syntax node for a decorator, {@code @a.b.c} or {@code @a.b.c(args...)}, preceding a function
 * definition.
 */
public final class Decorator extends Node {

  private final ImmutableList<Identifier> name; // dotted name, non-empty
  @Nullable private final ImmutableList<Argument> arguments; // null if not called

  Decorator(
      Span span, ImmutableList<Identifier> name, @Nullable ImmutableList<Argument> arguments) {
    super(span);
    Preconditions.checkArgument(!name.isEmpty(), "decorator without name");
    this.name = name;
    this.arguments = arguments;
  }

  /** Returns the components of the dotted name of the decorator. */
  public ImmutableList<Identifier> getName() {
    return name;
  }

  /** Returns the dotted name of the decorator as a string, such as "a.b.c". */
  public String getDottedName() {
    return Joiner.on('.').join(name);
  }

  /** Reports whether the decorator has an argument list, possibly empty. */
  public boolean isCall() {
    return arguments != null;
  }

  /** Returns the arguments of the decorator call; empty if it is not called. */
  public ImmutableList<Argument> getArguments() {
    return arguments != null ? arguments : ImmutableList.of();
  }

  @Override
  public void accept(NodeVisitor visitor) {
    visitor.visit(this);
  }

  @Override
  public String toString() {
    return "@"
        + getDottedName()
        + (arguments != null ? "(" + Joiner.on(", ").join(arguments) + ")" : "");
  }
}
