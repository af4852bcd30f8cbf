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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import net.pyast.java.syntax.TestUtils.Source;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests of {@link Spans} and {@link Span}. */
@RunWith(JUnit4.class)
public final class SpansTest {

  private final Source src = new Source("f(x, y)[z]");

  @Test
  public void testUnionOfTwo() {
    assertThat(Spans.union(src.tok("f"), src.tok("]"))).isEqualTo(src.span("f(x, y)[z]"));
    assertThat(Spans.union(src.tok("x"), src.tok("y"))).isEqualTo(src.span("x, y"));
  }

  @Test
  public void testUnionIsOrderIndependent() {
    assertThat(Spans.union(src.tok("]"), src.tok("f"))).isEqualTo(src.span("f(x, y)[z]"));
    assertThat(Spans.union(src.tok("z"), src.tok("("), src.tok("y")))
        .isEqualTo(src.span("(x, y)[z"));
  }

  @Test
  public void testUnionSkipsAbsentOperands() {
    Token x = src.tok("x");
    assertThat(Spans.union(null, x)).isEqualTo(x.getSpan());
    assertThat(Spans.union(x, null)).isEqualTo(x.getSpan());
    assertThat(Spans.union(ImmutableList.of(), x, null)).isEqualTo(x.getSpan());
  }

  @Test
  public void testUnionOfList() {
    ImmutableList<Token> tokens = ImmutableList.of(src.tok("x"), src.tok(","), src.tok("y"));
    assertThat(Spans.union(tokens)).isEqualTo(src.span("x, y"));
    assertThat(Spans.of(tokens)).isEqualTo(src.span("x, y"));
    assertThat(Spans.union(src.tok("("), tokens)).isEqualTo(src.span("(x, y"));
  }

  @Test
  public void testUnionOfNothingFails() {
    assertThrows(IllegalArgumentException.class, () -> Spans.union());
    assertThrows(IllegalArgumentException.class, () -> Spans.union(ImmutableList.of(), null));
    assertThrows(IllegalArgumentException.class, () -> Spans.of(ImmutableList.<Token>of()));
  }

  @Test
  public void testUnionRejectsNonSpannedOperand() {
    assertThrows(IllegalArgumentException.class, () -> Spans.union(src.tok("x"), "y"));
    assertThrows(
        IllegalArgumentException.class, () -> Spans.union(ImmutableList.of("x", "y")));
  }

  @Test
  public void testContains() {
    Span all = src.span("f(x, y)[z]");
    Span args = src.span("x, y");
    assertThat(all.contains(args)).isTrue();
    assertThat(args.contains(all)).isFalse();
    assertThat(args.contains(args)).isTrue();
  }

  @Test
  public void testSpanAcrossFilesFails() {
    Location a = FileLocations.create("abc", "a.py").getLocation(0);
    Location b = FileLocations.create("abc", "b.py").getLocation(1);
    assertThrows(IllegalArgumentException.class, () -> Span.of(a, b));
  }

  @Test
  public void testSpanBackwardsFails() {
    FileLocations locs = FileLocations.create("abc", "a.py");
    assertThrows(
        IllegalArgumentException.class, () -> Span.of(locs.getLocation(2), locs.getLocation(1)));
  }

  @Test
  public void testToString() {
    assertThat(src.span("x, y").toString()).isEqualTo("test.py:1:3-1:7");
  }
}
