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

import com.google.auto.value.AutoValue;
import dev.noirfmt.util.Span;

/** A lexical token together with the line breaks that preceded it. */
@AutoValue
public abstract class Token {
  /** Token classes produced by the {@link Lexer}. */
  public enum Kind {
    IDENTIFIER,
    INTEGER,
    STRING,
    /** A single punctuation character, or {@code ::}. */
    PUNCTUATION,
    /** A {@code //} comment, without its line terminator or trailing whitespace. */
    COMMENT,
    EOF
  }

  static Token create(Kind kind, String text, Span span, int newlinesBefore) {
    return new AutoValue_Token(kind, text, span, newlinesBefore);
  }

  public abstract Kind kind();

  public abstract String text();

  public abstract Span span();

  /** Number of line breaks between the previous token (or the start of input) and this one. */
  public abstract int newlinesBefore();

  public boolean is(String text) {
    return kind() != Kind.STRING && kind() != Kind.COMMENT && text().equals(text);
  }

  /** Returns true if the source has at least one empty line right before this token. */
  public boolean followsBlankLine() {
    return newlinesBefore() >= 2;
  }
}
