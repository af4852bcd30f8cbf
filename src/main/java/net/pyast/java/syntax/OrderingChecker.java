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

import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.CanIgnoreReturnValue;

/**
 * OrderingChecker enforces the orderings of call arguments and function parameters that the
 * context-free grammar accepts but the language forbids.
 *
 * <p>Each check runs a small automaton over the list from left to right. The first illegal
 * transition is fatal: it throws a {@link SyntaxError.Exception} located at the offending element.
 * The automaton's state lives in a local variable of each call, so the checks are reentrant.
 */
public final class OrderingChecker {

  private OrderingChecker() {}

  /**
   * The states of the argument automaton, named for the last kind of argument seen.
   *
   * <pre>
   * arglist: (argument ',')* (argument [',']
   *                          |'*' test (',' argument)* [',' '**' test]
   *                          |'**' test)
   * </pre>
   */
  private enum ArgState {
    /** Positional arguments come first. */
    POSITIONAL,
    /** Then keyword arguments. */
    KEYWORD,
    /** Then the single star form. */
    STAR,
    /** Then more keyword arguments (but no positional arguments). */
    KEYWORD_AFTER_STAR,
    /** Then the double star form, which must be last. */
    STAR_STAR,
  }

  /**
   * The states of the parameter automaton.
   *
   * <pre>
   * parameter_list ::=  (defparameter ",")*
   *                     ( "*" [parameter] ("," defparameter)* [, "**" parameter]
   *                     | "**" parameter
   *                     | defparameter [","] )
   * </pre>
   */
  private enum ParamState {
    /** Named parameters and unpack tuples first. */
    NAMED,
    /** Then the single star, on its own or with a name. */
    STAR,
    /** Then more named parameters. */
    NAMED_AFTER_STAR,
    /** Then the double star form, which must be last. */
    STAR_STAR,
  }

  /**
   * Checks that the arguments of a call appear in a legal order, and returns them unchanged.
   *
   * <p>The legal orders are {@code positional* keyword* (*expr keyword*)? (**expr)?}.
   *
   * @throws SyntaxError.Exception at the first argument that violates the order.
   */
  @CanIgnoreReturnValue
  public static ImmutableList<Argument> checkArguments(ImmutableList<Argument> arguments)
      throws SyntaxError.Exception {
    ArgState state = ArgState.POSITIONAL;
    for (Argument arg : arguments) {
      state = next(state, arg);
    }
    return arguments;
  }

  private static ArgState next(ArgState state, Argument arg) throws SyntaxError.Exception {
    if (state == ArgState.STAR_STAR) {
      throw argumentError(arg, "an **argument must not be followed by any other arguments");
    }
    if (arg instanceof Argument.Positional) {
      switch (state) {
        case POSITIONAL:
          return state;
        case KEYWORD:
          throw argumentError(arg, "a positional argument must not follow a keyword argument");
        default:
          throw argumentError(arg, "a positional argument must not follow a *argument");
      }
    } else if (arg instanceof Argument.Keyword) {
      return state == ArgState.POSITIONAL || state == ArgState.KEYWORD
          ? ArgState.KEYWORD
          : ArgState.KEYWORD_AFTER_STAR;
    } else if (arg instanceof Argument.Star) {
      if (state == ArgState.STAR || state == ArgState.KEYWORD_AFTER_STAR) {
        throw argumentError(arg, "there must not be two *arguments in an argument list");
      }
      return ArgState.STAR;
    } else {
      // **expr
      return ArgState.STAR_STAR;
    }
  }

  /**
   * Checks that the parameters of a function appear in a legal order, and returns them unchanged.
   *
   * <p>The legal orders are {@code (named|unpack)* (("*" | "*name") named*)? ("**name")?}, where a
   * tuple-unpacking parameter counts as named.
   *
   * @throws SyntaxError.Exception at the first parameter that violates the order.
   */
  @CanIgnoreReturnValue
  public static ImmutableList<Parameter> checkParameters(ImmutableList<Parameter> parameters)
      throws SyntaxError.Exception {
    ParamState state = ParamState.NAMED;
    for (Parameter param : parameters) {
      state = next(state, param);
    }
    return parameters;
  }

  private static ParamState next(ParamState state, Parameter param) throws SyntaxError.Exception {
    if (state == ParamState.STAR_STAR) {
      throw parameterError(param, "a **parameter must not be followed by any other parameters");
    }
    if (param instanceof Parameter.Named || param instanceof Parameter.UnpackTuple) {
      // Named and UnpackTuple are treated the same.
      return state == ParamState.STAR ? ParamState.NAMED_AFTER_STAR : state;
    } else if (param instanceof Parameter.EndPositional || param instanceof Parameter.Star) {
      if (state != ParamState.NAMED) {
        throw parameterError(param, "there must not be two *parameters in a parameter list");
      }
      return ParamState.STAR;
    } else {
      // **name
      return ParamState.STAR_STAR;
    }
  }

  private static SyntaxError.Exception argumentError(Argument arg, String message) {
    return error(SyntaxError.Kind.ILLEGAL_ARGUMENT_ORDER, arg, message);
  }

  private static SyntaxError.Exception parameterError(Parameter param, String message) {
    return error(SyntaxError.Kind.ILLEGAL_PARAMETER_ORDER, param, message);
  }

  private static SyntaxError.Exception error(SyntaxError.Kind kind, Node node, String message) {
    return AstBuilder.spanError(kind, node, message);
  }
}
