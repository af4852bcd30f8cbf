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
 * A SubscriptElement is one comma-separated component of a subscript trailer: a plain index
 * expression, a proper slice {@code lo:hi:stride}, or an ellipsis.
 *
 * <p>Like {@link Trailer}, subscript elements are transient. A subscript containing only Index
 * elements becomes an {@link IndexExpression}; any other subscript becomes a {@link
 * SliceExpression}.
 */
public abstract class SubscriptElement implements Spanned {

  private final Span span;

  private SubscriptElement(Span span) {
    this.span = Preconditions.checkNotNull(span);
  }

  @Override
  public final Span getSpan() {
    return span;
  }

  /** Reports whether this element is a proper slice or ellipsis, as opposed to an index. */
  public abstract boolean isProperSlice();

  /** Converts this element to its final form as a component of a {@link SliceExpression}. */
  abstract Slice toSlice();

  /** A plain index expression. */
  public static final class Index extends SubscriptElement {
    private final Expression expr;

    Index(Expression expr) {
      super(expr.getSpan());
      this.expr = expr;
    }

    public Expression getExpression() {
      return expr;
    }

    @Override
    public boolean isProperSlice() {
      return false;
    }

    @Override
    Slice toSlice() {
      return new Slice.Index(getSpan(), expr);
    }
  }

  /**
   * A proper slice with optional lower bound, upper bound and stride. Whether a stride colon
   * appeared is recorded separately from the stride itself, as {@code a:b:} differs from {@code
   * a:b}.
   */
  public static final class ProperSlice extends SubscriptElement {
    @Nullable private final Expression lower;
    @Nullable private final Expression upper;
    private final boolean hasStrideColon;
    @Nullable private final Expression stride;

    ProperSlice(
        Span span,
        @Nullable Expression lower,
        @Nullable Expression upper,
        boolean hasStrideColon,
        @Nullable Expression stride) {
      super(span);
      Preconditions.checkArgument(hasStrideColon || stride == null, "stride without colon");
      this.lower = lower;
      this.upper = upper;
      this.hasStrideColon = hasStrideColon;
      this.stride = stride;
    }

    @Nullable
    public Expression getLower() {
      return lower;
    }

    @Nullable
    public Expression getUpper() {
      return upper;
    }

    public boolean hasStrideColon() {
      return hasStrideColon;
    }

    @Nullable
    public Expression getStride() {
      return stride;
    }

    @Override
    public boolean isProperSlice() {
      return true;
    }

    @Override
    Slice toSlice() {
      return new Slice.Proper(getSpan(), lower, upper, hasStrideColon, stride);
    }
  }

  /** An ellipsis, {@code ...}. */
  public static final class Ellipsis extends SubscriptElement {
    Ellipsis(Span span) {
      super(span);
    }

    @Override
    public boolean isProperSlice() {
      return true;
    }

    @Override
    Slice toSlice() {
      return new Slice.Ellipsis(getSpan());
    }
  }
}
