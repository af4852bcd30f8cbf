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
import javax.annotation.Nullable;

/**
 * Syntax node for an argument to a function call.
 *
 * <p>Arguments may be of four forms, as in {@code f(expr, id=expr, *expr, **expr)}. These are
 * represented by the subclasses Positional, Keyword, Star, and StarStar.
 *
 * <p>The legal orders of these forms within one call are enforced by {@link
 * OrderingChecker#checkArguments}.
 */
public abstract class Argument extends Node {

  protected final Expression value;

  Argument(Span span, Expression value) {
    super(span);
    this.value = Preconditions.checkNotNull(value);
  }

  public final Expression getValue() {
    return value;
  }

  /** Return the name of this argument's parameter, or null if it is not a Keyword argument. */
  @Nullable
  public String getName() {
    return null;
  }

  @Override
  public void accept(NodeVisitor visitor) {
    visitor.visit(this);
  }

  /** Syntax node for a positional argument, {@code f(expr)}. */
  public static final class Positional extends Argument {
    Positional(Span span, Expression value) {
      super(span, value);
    }

    @Override
    public String toString() {
      return value.toString();
    }
  }

  /** Syntax node for a keyword argument, {@code f(id=expr)}. */
  public static final class Keyword extends Argument {

    // Unlike in Python, keyword arguments in f(x=1) are not binding occurrences of x,
    // but the identifier still carries its own span for diagnostics.
    private final Identifier id;

    Keyword(Span span, Identifier id, Expression value) {
      super(span, value);
      this.id = Preconditions.checkNotNull(id);
    }

    public Identifier getIdentifier() {
      return id;
    }

    @Override
    public String getName() {
      return id.getName();
    }

    @Override
    public String toString() {
      return id.getName() + "=" + value;
    }
  }

  /** Syntax node for an argument of the form {@code f(*expr)}. */
  public static final class Star extends Argument {
    Star(Span span, Expression value) {
      super(span, value);
    }

    @Override
    public String toString() {
      return "*" + value;
    }
  }

  /** Syntax node for an argument of the form {@code f(**expr)}. */
  public static final class StarStar extends Argument {
    StarStar(Span span, Expression value) {
      super(span, value);
    }

    @Override
    public String toString() {
      return "**" + value;
    }
  }
}
