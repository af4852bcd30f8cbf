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

import com.google.common.base.CharMatcher;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableSet;

/**
 * Test helpers. In place of a lexer, {@link Source} hands out tokens for the text of a small
 * program, located by their text.
 */
public final class TestUtils {

  private TestUtils() {}

  private static final ImmutableSet<TokenKind> KEYWORDS =
      ImmutableSet.of(
          TokenKind.AND,
          TokenKind.AS,
          TokenKind.BREAK,
          TokenKind.CONTINUE,
          TokenKind.DEF,
          TokenKind.ELSE,
          TokenKind.EXCEPT,
          TokenKind.FINALLY,
          TokenKind.FOR,
          TokenKind.IF,
          TokenKind.IN,
          TokenKind.IS,
          TokenKind.IS_NOT,
          TokenKind.NOT,
          TokenKind.NOT_IN,
          TokenKind.OR,
          TokenKind.PASS,
          TokenKind.RETURN,
          TokenKind.TRY);

  private static final CharMatcher WORD_CHARS =
      CharMatcher.inRange('a', 'z')
          .or(CharMatcher.inRange('A', 'Z'))
          .or(CharMatcher.inRange('0', '9'))
          .or(CharMatcher.is('_'));

  private static final CharMatcher OPERATOR_CHARS = CharMatcher.anyOf("!%&*+-./<=>@^|~");

  // Single-character tokens that never combine with their neighbours.
  private static final CharMatcher DELIMITERS = CharMatcher.anyOf("()[]{},:;");

  /**
   * The text of a program, from which tests take tokens as a lexer would produce them. A token is
   * found by its text and, if the text occurs more than once, by the number of its occurrence,
   * counting from 1. Occurrences are whole tokens: {@code a} does not occur in {@code and}, nor
   * {@code *} in {@code **}.
   */
  public static final class Source {
    private final String text;
    private final FileLocations locs;

    public Source(String text) {
      this.text = text;
      this.locs = FileLocations.create(text, "test.py");
    }

    public String text() {
      return text;
    }

    /** Returns the first occurrence of the token. */
    public Token tok(String token) {
      return tok(token, 1);
    }

    /** Returns the n'th occurrence of the token. */
    public Token tok(String token, int occurrence) {
      int start = find(token, occurrence);
      Span span = locs.getSpan(start, start + token.length());
      return new Token(kindOf(token), valueOf(token), span);
    }

    /** Returns the end-of-file token. */
    public Token eof() {
      return Token.of(TokenKind.EOF, locs.getSpan(text.length(), text.length()));
    }

    /** Returns the span of the n'th occurrence of a token sequence. */
    public Span span(String fragment, int occurrence) {
      int start = text.indexOf(fragment);
      for (int i = 1; i < occurrence; i++) {
        start = text.indexOf(fragment, start + 1);
      }
      Preconditions.checkArgument(start >= 0, "no occurrence %s of %s", occurrence, fragment);
      return locs.getSpan(start, start + fragment.length());
    }

    public Span span(String fragment) {
      return span(fragment, 1);
    }

    private int find(String token, int occurrence) {
      char first = token.charAt(0);
      CharMatcher boundary;
      if (first == '"' || (token.length() == 1 && DELIMITERS.matches(first))) {
        boundary = CharMatcher.none();
      } else if (WORD_CHARS.matches(first)) {
        boundary = WORD_CHARS;
      } else {
        boundary = OPERATOR_CHARS;
      }
      int seen = 0;
      for (int i = text.indexOf(token); i >= 0; i = text.indexOf(token, i + 1)) {
        int end = i + token.length();
        boolean whole =
            (i == 0 || !boundary.matches(text.charAt(i - 1)))
                && (end == text.length() || !boundary.matches(text.charAt(end)));
        if (whole && ++seen == occurrence) {
          return i;
        }
      }
      throw new IllegalArgumentException(
          String.format("no occurrence %d of token '%s' in '%s'", occurrence, token, text));
    }
  }

  private static TokenKind kindOf(String token) {
    char c = token.charAt(0);
    if (c == '"') {
      return TokenKind.STRING;
    }
    if (Character.isDigit(c)) {
      return token.contains(".") ? TokenKind.FLOAT : TokenKind.INT;
    }
    for (TokenKind kind : TokenKind.values()) {
      if (kind.toString().equals(token) && (KEYWORDS.contains(kind) || !WORD_CHARS.matches(c))) {
        return kind;
      }
    }
    Preconditions.checkArgument(Identifier.isValid(token), "not a token: %s", token);
    return TokenKind.IDENTIFIER;
  }

  private static Object valueOf(String token) {
    switch (kindOf(token)) {
      case STRING:
        return token.substring(1, token.length() - 1);
      case FLOAT:
        return Double.parseDouble(token);
      case INT:
        return Integer.parseInt(token);
      case IDENTIFIER:
        return token;
      default:
        return null;
    }
  }
}
