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

/** Syntax node for dict expression. */
public final class DictExpression extends Expression {

  /**
   * A DictExpression.Entry is one entry of a dict display: either a {@link Pair} {@code k: v} or an
   * {@link Unpacking} {@code **d}. It is also the body of a dict comprehension.
   */
  public abstract static class Entry extends Node {
    Entry(Span span) {
      super(span);
    }

    @Override
    public void accept(NodeVisitor visitor) {
      visitor.visit(this);
    }
  }

  /** Syntax node for a key/value entry, {@code k: v}. */
  public static final class Pair extends Entry {
    private final Expression key;
    private final Expression value;

    Pair(Span span, Expression key, Expression value) {
      super(span);
      this.key = Preconditions.checkNotNull(key);
      this.value = Preconditions.checkNotNull(value);
    }

    public Expression getKey() {
      return key;
    }

    public Expression getValue() {
      return value;
    }

    @Override
    public String toString() {
      return key + ": " + value;
    }
  }

  /** Syntax node for a dictionary unpacking entry, {@code **d}. */
  public static final class Unpacking extends Entry {
    private final Expression expr;

    Unpacking(Span span, Expression expr) {
      super(span);
      this.expr = Preconditions.checkNotNull(expr);
    }

    /** Returns the expression whose items are unpacked into the dict. */
    public Expression getExpression() {
      return expr;
    }

    @Override
    public String toString() {
      return "**" + expr;
    }
  }

  private final ImmutableList<Entry> entries;

  DictExpression(Span span, ImmutableList<Entry> entries) {
    super(span);
    this.entries = entries;
  }

  public ImmutableList<Entry> getEntries() {
    return entries;
  }

  @Override
  public void accept(NodeVisitor visitor) {
    visitor.visit(this);
  }

  @Override
  public Kind kind() {
    return Kind.DICT_EXPR;
  }

  @Override
  public String toString() {
    return "{" + Joiner.on(", ").join(entries) + "}";
  }
}
