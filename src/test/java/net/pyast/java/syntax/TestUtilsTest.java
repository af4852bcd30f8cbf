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

import net.pyast.java.syntax.TestUtils.Source;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests of the {@link Source} token finder used by the other tests. */
@RunWith(JUnit4.class)
public final class TestUtilsTest {

  private static int offsetOf(Token tok) {
    return tok.getSpan().getStartOffset();
  }

  @Test
  public void testDelimitersNextToOperators() {
    Source src = new Source("f(**k, x)");
    assertThat(src.tok("(").getKind()).isEqualTo(TokenKind.LPAREN);
    assertThat(offsetOf(src.tok("("))).isEqualTo(1);
    assertThat(offsetOf(src.tok("**"))).isEqualTo(2);

    src = new Source("x[...]");
    assertThat(offsetOf(src.tok("["))).isEqualTo(1);
    assertThat(src.tok("...").getKind()).isEqualTo(TokenKind.ELLIPSIS);

    src = new Source("{**d for d in ds}");
    assertThat(offsetOf(src.tok("{"))).isEqualTo(0);
  }

  @Test
  public void testAdjacentDelimiters() {
    Source src = new Source("(a, (b, c))=d");
    assertThat(offsetOf(src.tok(")", 1))).isEqualTo(9);
    assertThat(offsetOf(src.tok(")", 2))).isEqualTo(10);
    assertThat(src.tok(")", 2).getKind()).isEqualTo(TokenKind.RPAREN);

    src = new Source("x[::2]");
    assertThat(offsetOf(src.tok(":", 1))).isEqualTo(2);
    assertThat(offsetOf(src.tok(":", 2))).isEqualTo(3);
  }

  @Test
  public void testOperatorsAreWholeTokens() {
    Source src = new Source("a * b ** c");
    assertThat(offsetOf(src.tok("*"))).isEqualTo(2);
    assertThat(src.tok("**").getKind()).isEqualTo(TokenKind.DOUBLE_STAR);
    assertThrows(IllegalArgumentException.class, () -> src.tok("*", 2));
  }

  @Test
  public void testWordsAreWholeTokens() {
    Source src = new Source("and a");
    assertThat(offsetOf(src.tok("a"))).isEqualTo(4);
    assertThat(src.tok("and").getKind()).isEqualTo(TokenKind.AND);
  }
}
