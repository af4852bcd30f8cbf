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
import javax.annotation.concurrent.Immutable;

/**
 * A Token is a lexical token handed to the builder by the lexer: its kind, its value (the name of
 * an identifier, or the decoded value of a literal), and the span of its text.
 */
@Immutable
public final class Token implements Spanned {

  private final TokenKind kind;

  // String, Integer, BigInteger or Double
  @Nullable
  private final Object value;

  private final Span span;

  public Token(TokenKind kind, @Nullable Object value, Span span) {
    this.kind = Preconditions.checkNotNull(kind);
    this.value = value;
    this.span = Preconditions.checkNotNull(span);
  }

  /** Returns a token without a value, such as a keyword or punctuation. */
  public static Token of(TokenKind kind, Span span) {
    return new Token(kind, null, span);
  }

  public TokenKind getKind() {
    return kind;
  }

  @Nullable
  public Object getValue() {
    return value;
  }

  @Override
  public Span getSpan() {
    return span;
  }

  /** Returns the token's string form as used in error messages. */
  @Override
  public String toString() {
    return kind == TokenKind.STRING
        ? "\"" + value + "\""
        : value == null ? kind.toString() : value.toString();
  }
}
