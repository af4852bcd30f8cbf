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
import java.util.List;
import javax.annotation.Nullable;

/**
 * Span algebra: computes the smallest span covering a set of span-bearing operands.
 *
 * <p>Each operand may be a {@link Spanned} value (a token, node, or span), a {@link List} of such
 * values, or null. A null operand or an empty list contributes nothing. A non-empty list
 * contributes its first and last elements only, as the elements of a list are in source order.
 */
public final class Spans {

  private Spans() {}

  /** Returns the smallest span covering both operands. */
  public static Span union(@Nullable Spanned x, @Nullable Spanned y) {
    return union(new Object[] {x, y});
  }

  /**
   * Returns the smallest span covering all the operands.
   *
   * @throws IllegalArgumentException if no operand contributes a span.
   */
  public static Span union(@Nullable Object... operands) {
    Location start = null;
    Location end = null;
    for (Object operand : operands) {
      if (operand == null) {
        continue;
      }
      if (operand instanceof Spanned spanned) {
        Span span = spanned.getSpan();
        start = earlier(start, span.start());
        end = later(end, span.end());
      } else if (operand instanceof List<?> list) {
        if (list.isEmpty()) {
          continue;
        }
        Span first = spanOf(list.get(0));
        Span last = spanOf(list.get(list.size() - 1));
        start = earlier(earlier(start, first.start()), last.start());
        end = later(later(end, first.end()), last.end());
      } else {
        throw new IllegalArgumentException(
            "not a span-bearing operand: " + operand.getClass().getName());
      }
    }
    Preconditions.checkArgument(start != null, "no span-bearing operand");
    return Span.of(start, end);
  }

  /** Returns the span covering the first through the last element of a non-empty list. */
  public static Span of(List<? extends Spanned> list) {
    Preconditions.checkArgument(!list.isEmpty(), "span of empty list");
    return union(list.get(0), list.get(list.size() - 1));
  }

  private static Span spanOf(Object element) {
    Preconditions.checkArgument(
        element instanceof Spanned, "list element is not span-bearing: %s", element);
    return ((Spanned) element).getSpan();
  }

  private static Location earlier(@Nullable Location x, Location y) {
    return x == null || y.offset() < x.offset() ? y : x;
  }

  private static Location later(@Nullable Location x, Location y) {
    return x == null || y.offset() > x.offset() ? y : x;
  }
}
