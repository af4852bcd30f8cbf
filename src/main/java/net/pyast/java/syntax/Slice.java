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
 * Syntax node for one component of the subscript of a {@link SliceExpression}: a plain index
 * expression, a proper slice {@code lo:hi:stride}, or an ellipsis {@code ...}.
 */
public abstract class Slice extends Node {

  Slice(Span span) {
    super(span);
  }

  @Override
  public void accept(NodeVisitor visitor) {
    visitor.visit(this);
  }

  /** Syntax node for a plain expression component, {@code i} in {@code x[i, j:k]}. */
  public static final class Index extends Slice {
    private final Expression expr;

    Index(Span span, Expression expr) {
      super(span);
      this.expr = Preconditions.checkNotNull(expr);
    }

    public Expression getExpression() {
      return expr;
    }

    @Override
    public String toString() {
      return expr.toString();
    }
  }

  /**
   * Syntax node for a proper slice {@code lo:hi} or {@code lo:hi:stride}, any of whose bounds may
   * be omitted.
   */
  public static final class Proper extends Slice {
    @Nullable private final Expression lower;
    @Nullable private final Expression upper;
    private final boolean hasStrideColon;
    @Nullable private final Expression stride; // null unless hasStrideColon

    Proper(
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

    /**
     * Reports whether the slice has a second colon. This distinguishes {@code x[a:b:]}, whose
     * stride is explicitly omitted, from {@code x[a:b]}, which has no stride at all. Both have a
     * null {@link #getStride}.
     */
    public boolean hasStrideColon() {
      return hasStrideColon;
    }

    @Nullable
    public Expression getStride() {
      return stride;
    }

    @Override
    public String toString() {
      StringBuilder buf = new StringBuilder();
      if (lower != null) {
        buf.append(lower);
      }
      buf.append(':');
      if (upper != null) {
        buf.append(upper);
      }
      if (hasStrideColon) {
        buf.append(':');
        if (stride != null) {
          buf.append(stride);
        }
      }
      return buf.toString();
    }
  }

  /** Syntax node for an ellipsis component, {@code ...}. */
  public static final class Ellipsis extends Slice {
    Ellipsis(Span span) {
      super(span);
    }

    @Override
    public String toString() {
      return "...";
    }
  }
}
