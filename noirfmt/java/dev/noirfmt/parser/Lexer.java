/*
 * Copyright 2026 The Noirfmt Authors. All rights reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package dev.noirfmt.parser;

import com.google.common.base.CharMatcher;
import com.google.common.collect.ImmutableList;
import dev.noirfmt.util.Span;

/**
 * Splits source text into {@link Token}s. Operators are emitted one character at a time (except
 * {@code ::}) so that the parser can tell {@code >>} in an expression from two closing generic
 * brackets; it joins adjacent characters where it expects an operator.
 */
public final class Lexer {
  private static final CharMatcher IDENTIFIER_START =
      CharMatcher.inRange('a', 'z').or(CharMatcher.inRange('A', 'Z')).or(CharMatcher.is('_'));
  private static final CharMatcher DIGIT = CharMatcher.inRange('0', '9');
  private static final CharMatcher IDENTIFIER_PART = IDENTIFIER_START.or(DIGIT);
  private static final CharMatcher PUNCTUATION = CharMatcher.anyOf("()[]{}<>,;:=+-*/%&|^!.#");
  private static final CharMatcher INLINE_WHITESPACE = CharMatcher.anyOf(" \t\r\f");

  private final String source;
  private int pos;
  private int newlines;

  private Lexer(String source) {
    this.source = source;
  }

  /** Returns every token of {@code source}, ending with a single {@link Token.Kind#EOF} token. */
  public static ImmutableList<Token> tokenize(String source) throws ParseException {
    return new Lexer(source).run();
  }

  private ImmutableList<Token> run() throws ParseException {
    ImmutableList.Builder<Token> tokens = ImmutableList.builder();
    while (true) {
      skipWhitespace();
      if (pos >= source.length()) {
        tokens.add(token(Token.Kind.EOF, pos));
        return tokens.build();
      }
      tokens.add(next());
    }
  }

  private void skipWhitespace() {
    while (pos < source.length()) {
      char c = source.charAt(pos);
      if (c == '\n') {
        newlines++;
      } else if (!INLINE_WHITESPACE.matches(c)) {
        return;
      }
      pos++;
    }
  }

  private Token next() throws ParseException {
    int start = pos;
    char c = source.charAt(pos);
    if (c == '/' && lookingAt("//")) {
      while (pos < source.length() && source.charAt(pos) != '\n') {
        pos++;
      }
      return token(Token.Kind.COMMENT, start);
    }
    if (c == '/' && lookingAt("/*")) {
      throw error(start, "block comments are not supported");
    }
    if (IDENTIFIER_START.matches(c)) {
      while (pos < source.length() && IDENTIFIER_PART.matches(source.charAt(pos))) {
        pos++;
      }
      return token(Token.Kind.IDENTIFIER, start);
    }
    if (DIGIT.matches(c)) {
      // Covers hex literals and type suffixes alike; the parser keeps literals verbatim.
      while (pos < source.length() && IDENTIFIER_PART.matches(source.charAt(pos))) {
        pos++;
      }
      return token(Token.Kind.INTEGER, start);
    }
    if (c == '"') {
      return string(start);
    }
    if (lookingAt("::")) {
      pos += 2;
      return token(Token.Kind.PUNCTUATION, start);
    }
    if (PUNCTUATION.matches(c)) {
      pos++;
      return token(Token.Kind.PUNCTUATION, start);
    }
    throw error(start, "unexpected character '" + c + "'");
  }

  private Token string(int start) throws ParseException {
    pos++;
    while (pos < source.length()) {
      char c = source.charAt(pos);
      if (c == '\n') {
        break;
      }
      pos++;
      if (c == '\\' && pos < source.length()) {
        pos++;
      } else if (c == '"') {
        return token(Token.Kind.STRING, start);
      }
    }
    throw error(start, "unterminated string literal");
  }

  private boolean lookingAt(String text) {
    return source.startsWith(text, pos);
  }

  private Token token(Token.Kind kind, int start) {
    String text = source.substring(start, pos);
    if (kind == Token.Kind.COMMENT) {
      text = CharMatcher.whitespace().trimTrailingFrom(text);
    }
    Token token = Token.create(kind, text, new Span(start, pos), newlines);
    newlines = 0;
    return token;
  }

  private ParseException error(int start, String message) {
    return ParseException.at(source, new Span(start, Math.max(start, pos)), message);
  }
}
