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
import javax.annotation.concurrent.Immutable;

/**
 * A SyntaxError represents a fatal error detected while building a syntax tree: a token no grammar
 * rule can reduce, or a sequence of arguments or parameters in an illegal order.
 *
 * <p>Building stops at the first error, so at most one SyntaxError is reported per parse.
 */
@Immutable
public final class SyntaxError {

  /** Kind classifies syntax errors. */
  public enum Kind {
    /** A token arrived that no grammar rule can reduce. */
    UNEXPECTED_TOKEN,
    /** A call's argument list violates the argument ordering rules. */
    ILLEGAL_ARGUMENT_ORDER,
    /** A function's parameter list violates the parameter ordering rules. */
    ILLEGAL_PARAMETER_ORDER,
    /** A construct that the builder's {@link FileOptions} disallow. */
    DISALLOWED_SYNTAX,
  }

  private final Kind kind;
  private final Span span;
  private final String message;

  public SyntaxError(Kind kind, Span span, String message) {
    this.kind = Preconditions.checkNotNull(kind);
    this.span = Preconditions.checkNotNull(span);
    this.message = Preconditions.checkNotNull(message);
  }

  /** Returns the kind of the error. */
  public Kind kind() {
    return kind;
  }

  /** Returns the span of the offending token or node. */
  public Span span() {
    return span;
  }

  /** Returns the location of the start of the offending token or node. */
  public Location location() {
    return span.start();
  }

  /** Returns a description of the error. */
  public String message() {
    return message;
  }

  /** Returns a string of the form "file:line:column: message". */
  @Override
  public String toString() {
    return span.start() + ": " + message;
  }

  /** A SyntaxError.Exception is the checked exception that carries a SyntaxError out of a parse. */
  public static final class Exception extends java.lang.Exception {

    private final SyntaxError error;

    public Exception(SyntaxError error) {
      super(error.toString());
      this.error = error;
    }

    /** Returns the error that terminated the parse. */
    public SyntaxError error() {
      return error;
    }
  }
}
