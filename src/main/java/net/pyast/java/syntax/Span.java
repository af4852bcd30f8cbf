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

import com.google.auto.value.AutoValue;
import com.google.common.base.Preconditions;
import javax.annotation.concurrent.Immutable;

/**
 * A Span is the range of source text covered by a token or syntax node, from its start location
 * (inclusive) to its end location (exclusive).
 *
 * <p>Spans of composite nodes are never constructed directly; they are computed from the spans of
 * their constituents using {@link Spans#union}.
 */
@AutoValue
@Immutable
public abstract class Span implements Spanned {

  /** Returns the location of the first character of the span. */
  public abstract Location start();

  /** Returns the location just past the last character of the span. */
  public abstract Location end();

  public static Span of(Location start, Location end) {
    Preconditions.checkArgument(
        start.file().equals(end.file()), "span crosses files: %s, %s", start, end);
    Preconditions.checkArgument(
        start.offset() <= end.offset(), "span ends before it starts: %s, %s", start, end);
    return new AutoValue_Span(start, end);
  }

  @Override
  public final Span getSpan() {
    return this;
  }

  /** Returns the name of the file this span belongs to. */
  public final String file() {
    return start().file();
  }

  public final int getStartOffset() {
    return start().offset();
  }

  public final int getEndOffset() {
    return end().offset();
  }

  /** Reports whether this span covers every character of {@code that}. */
  public final boolean contains(Span that) {
    return file().equals(that.file())
        && getStartOffset() <= that.getStartOffset()
        && that.getEndOffset() <= getEndOffset();
  }

  /** Returns a string of the form "file:line:column-line:column". */
  @Override
  public final String toString() {
    return start() + "-" + end().line() + ":" + end().column();
  }
}
