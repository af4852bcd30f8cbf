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
 * A Trailer is one postfix operation following a primary expression: a call {@code (args)}, a
 * subscript {@code [elements]}, or an attribute selection {@code .name}.
 *
 * <p>Trailers are transient: the grammar collects the trailers of a chain such as {@code
 * f(x)[y].z} from left to right, and {@link AstBuilder#addTrailer} then folds them onto the primary
 * expression. They never appear in a finished syntax tree.
 */
public abstract class Trailer implements Spanned {

  private final Span span; // from the opening token through the closing token or name

  private Trailer(Span span) {
    this.span = Preconditions.checkNotNull(span);
  }

  @Override
  public final Span getSpan() {
    return span;
  }

  /** A call trailer, {@code (args)}. */
  public static final class Call extends Trailer {
    private final ImmutableList<Argument> arguments;

    Call(Span span, ImmutableList<Argument> arguments) {
      super(span);
      this.arguments = arguments;
    }

    public ImmutableList<Argument> getArguments() {
      return arguments;
    }
  }

  /** A subscript trailer, {@code [elements]}. */
  public static final class Subscript extends Trailer {
    private final ImmutableList<SubscriptElement> elements; // non-empty

    Subscript(Span span, ImmutableList<SubscriptElement> elements) {
      super(span);
      Preconditions.checkArgument(!elements.isEmpty(), "empty subscript");
      this.elements = elements;
    }

    public ImmutableList<SubscriptElement> getElements() {
      return elements;
    }

    /** Reports whether any element is a proper slice or an ellipsis. */
    public boolean hasProperSlice() {
      for (SubscriptElement element : elements) {
        if (element.isProperSlice()) {
          return true;
        }
      }
      return false;
    }
  }

  /** An attribute selection trailer, {@code .name}. */
  public static final class Dot extends Trailer {
    private final Span dotSpan;
    private final Identifier name;

    Dot(Span span, Span dotSpan, Identifier name) {
      super(span);
      this.dotSpan = Preconditions.checkNotNull(dotSpan);
      this.name = Preconditions.checkNotNull(name);
    }

    /** Returns the span of the '.' token. */
    public Span getDotSpan() {
      return dotSpan;
    }

    public Identifier getName() {
      return name;
    }
  }
}
