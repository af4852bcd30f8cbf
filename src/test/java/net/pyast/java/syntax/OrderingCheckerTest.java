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

import com.google.common.base.Splitter;
import com.google.common.collect.HashMultiset;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Multiset;
import com.google.testing.junit.testparameterinjector.TestParameter;
import com.google.testing.junit.testparameterinjector.TestParameterInjector;
import net.pyast.java.syntax.TestUtils.Source;
import org.junit.Test;
import org.junit.runner.RunWith;

/** Tests of the argument and parameter order checks. */
@RunWith(TestParameterInjector.class)
public final class OrderingCheckerTest {

  private final AstBuilder builder = AstBuilder.create();

  private Source src;
  private final Multiset<String> seen = HashMultiset.create();

  // Returns the next occurrence of a token, so that repeated tokens such as '*' are distinct.
  private Token next(String text) {
    seen.add(text);
    return src.tok(text, seen.count(text));
  }

  private Identifier ident(String name) {
    return builder.makeIdent(next(name));
  }

  // Builds the arguments of a call from their text, e.g. "a, b=c, *d, **e".
  private ImmutableList<Argument> arguments(String text) {
    src = new Source(text);
    ImmutableList.Builder<Argument> args = ImmutableList.builder();
    for (String arg : Splitter.on(", ").omitEmptyStrings().split(text)) {
      if (arg.startsWith("**")) {
        args.add(builder.makeStarStarArg(next("**"), ident(arg.substring(2))));
      } else if (arg.startsWith("*")) {
        args.add(builder.makeStarArg(next("*"), ident(arg.substring(1))));
      } else if (arg.contains("=")) {
        Identifier name = ident(arg.substring(0, arg.indexOf('=')));
        args.add(builder.makeKeyword(name, ident(arg.substring(arg.indexOf('=') + 1))));
      } else {
        args.add(builder.makePositional(ident(arg)));
      }
    }
    return args.build();
  }

  // Builds the parameters of a function from their text, e.g. "a, b=c, *, d, **e".
  private ImmutableList<Parameter> parameters(String text) {
    src = new Source(text);
    ImmutableList.Builder<Parameter> params = ImmutableList.builder();
    for (String param : Splitter.on(", ").omitEmptyStrings().split(text)) {
      if (param.startsWith("**")) {
        params.add(builder.makeStarStarParam(next("**"), ident(param.substring(2)), null));
      } else if (param.equals("*")) {
        params.add(builder.makeStarParam(next("*"), null, null));
      } else if (param.startsWith("*")) {
        params.add(builder.makeStarParam(next("*"), ident(param.substring(1)), null));
      } else if (param.contains("=")) {
        Identifier name = ident(param.substring(0, param.indexOf('=')));
        params.add(builder.makeParam(name, null, ident(param.substring(param.indexOf('=') + 1))));
      } else {
        params.add(builder.makeParam(ident(param), null, null));
      }
    }
    return params.build();
  }

  enum LegalArguments {
    NONE(""),
    POSITIONAL("a, b"),
    POSITIONAL_THEN_KEYWORD("a, b=c"),
    POSITIONAL_THEN_STAR("a, *b"),
    KEYWORD_AFTER_STAR("a, *b, c=d"),
    STAR_AFTER_KEYWORD("a=b, *c"),
    ALL_FORMS("a, b=c, *d, e=f, **g"),
    STAR_STAR_ONLY("**a"),
    STAR_THEN_STAR_STAR("*a, **b");

    final String text;

    LegalArguments(String text) {
      this.text = text;
    }
  }

  @Test
  public void testLegalArguments(@TestParameter LegalArguments testCase) throws Exception {
    ImmutableList<Argument> args = arguments(testCase.text);
    assertThat(OrderingChecker.checkArguments(args)).isSameInstanceAs(args);
  }

  enum IllegalArguments {
    POSITIONAL_AFTER_KEYWORD(
        "a=b, c", "c", "a positional argument must not follow a keyword argument"),
    POSITIONAL_AFTER_STAR("*a, b", "b", "a positional argument must not follow a *argument"),
    POSITIONAL_AFTER_KEYWORD_AFTER_STAR(
        "*a, b=c, d", "d", "a positional argument must not follow a *argument"),
    POSITIONAL_AFTER_STAR_AFTER_KEYWORD(
        "a=b, *c, d", "d", "a positional argument must not follow a *argument"),
    TWO_STARS("*a, *b", "*b", "there must not be two *arguments in an argument list"),
    TWO_STARS_APART("*a, b=c, *d", "*d", "there must not be two *arguments in an argument list"),
    POSITIONAL_AFTER_STAR_STAR(
        "**a, b", "b", "an **argument must not be followed by any other arguments"),
    KEYWORD_AFTER_STAR_STAR(
        "**a, b=c", "b=c", "an **argument must not be followed by any other arguments"),
    STAR_AFTER_STAR_STAR(
        "**a, *b", "*b", "an **argument must not be followed by any other arguments"),
    TWO_STAR_STARS(
        "**a, **b", "**b", "an **argument must not be followed by any other arguments");

    final String text;
    final String offending;
    final String message;

    IllegalArguments(String text, String offending, String message) {
      this.text = text;
      this.offending = offending;
      this.message = message;
    }
  }

  @Test
  public void testIllegalArguments(@TestParameter IllegalArguments testCase) {
    ImmutableList<Argument> args = arguments(testCase.text);
    SyntaxError.Exception ex =
        assertThrows(SyntaxError.Exception.class, () -> OrderingChecker.checkArguments(args));
    assertError(ex, SyntaxError.Kind.ILLEGAL_ARGUMENT_ORDER, testCase.offending, testCase.message);
  }

  enum LegalParameters {
    NONE(""),
    NAMED("a, b"),
    OPTIONAL("a, b=c"),
    ALL_FORMS("a, b=c, *d, e, **f"),
    BARE_STAR("*, a"),
    BARE_STAR_AFTER_NAMED("a, *, b=c"),
    STAR_STAR_ONLY("**a"),
    STAR_THEN_STAR_STAR("*a, **b");

    final String text;

    LegalParameters(String text) {
      this.text = text;
    }
  }

  @Test
  public void testLegalParameters(@TestParameter LegalParameters testCase) throws Exception {
    ImmutableList<Parameter> params = parameters(testCase.text);
    assertThat(OrderingChecker.checkParameters(params)).isSameInstanceAs(params);
  }

  enum IllegalParameters {
    NAMED_AFTER_STAR_STAR(
        "**a, b", "b", "a **parameter must not be followed by any other parameters"),
    STAR_AFTER_STAR_STAR(
        "**a, *b", "*b", "a **parameter must not be followed by any other parameters"),
    TWO_STAR_STARS(
        "**a, **b", "**b", "a **parameter must not be followed by any other parameters"),
    TWO_STARS("*a, *b", "*b", "there must not be two *parameters in a parameter list"),
    STAR_AFTER_BARE_STAR("*, b, *c", "*c", "there must not be two *parameters in a parameter list");

    final String text;
    final String offending;
    final String message;

    IllegalParameters(String text, String offending, String message) {
      this.text = text;
      this.offending = offending;
      this.message = message;
    }
  }

  @Test
  public void testIllegalParameters(@TestParameter IllegalParameters testCase) {
    ImmutableList<Parameter> params = parameters(testCase.text);
    SyntaxError.Exception ex =
        assertThrows(SyntaxError.Exception.class, () -> OrderingChecker.checkParameters(params));
    assertError(
        ex, SyntaxError.Kind.ILLEGAL_PARAMETER_ORDER, testCase.offending, testCase.message);
  }

  @Test
  public void testTupleParameterCountsAsNamed() throws Exception {
    src = new Source("a, (b, c), *d, (e, f)=g");
    ParamTuple first =
        builder.makeParamTuple(
            next("("),
            ImmutableList.of(
                builder.makeParamTupleName(ident("b")), builder.makeParamTupleName(ident("c"))),
            next(")"));
    ParamTuple second =
        builder.makeParamTuple(
            next("("),
            ImmutableList.of(
                builder.makeParamTupleName(ident("e")), builder.makeParamTupleName(ident("f"))),
            next(")"));
    ImmutableList<Parameter> params =
        ImmutableList.of(
            builder.makeParam(ident("a"), null, null),
            builder.makeTupleParam(first, null),
            builder.makeStarParam(next("*"), ident("d"), null),
            builder.makeTupleParam(second, ident("g")));
    OrderingChecker.checkParameters(params);
    assertThat(params.get(3).getSpan()).isEqualTo(src.span("(e, f)=g"));
  }

  @Test
  public void testFirstViolationIsReported() {
    // Both 'c' and '*e' are out of order; the checker stops at the first.
    ImmutableList<Argument> args = arguments("a=b, c, *d, *e");
    SyntaxError.Exception ex =
        assertThrows(SyntaxError.Exception.class, () -> OrderingChecker.checkArguments(args));
    assertError(
        ex,
        SyntaxError.Kind.ILLEGAL_ARGUMENT_ORDER,
        "c",
        "a positional argument must not follow a keyword argument");
  }

  private void assertError(
      SyntaxError.Exception ex, SyntaxError.Kind kind, String offending, String message) {
    SyntaxError error = ex.error();
    assertThat(error.kind()).isEqualTo(kind);
    assertThat(error.message()).isEqualTo(message);
    assertThat(error.span()).isEqualTo(src.span(offending));
    assertThat(ex).hasMessageThat().isEqualTo(error.location() + ": " + message);
  }
}
