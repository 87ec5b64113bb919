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

import dev.noirfmt.util.Span;

/** Thrown when source text is not a sequence of well-formed declarations. */
public class ParseException extends Exception {
  private final Span span;

  public ParseException(String message, Span span) {
    super(message);
    this.span = span;
  }

  /** Builds an exception whose message gives the line and column of {@code span}. */
  static ParseException at(String source, Span span, String message) {
    int line = 1;
    int lineStart = 0;
    for (int i = 0; i < span.getStart() && i < source.length(); i++) {
      if (source.charAt(i) == '\n') {
        line++;
        lineStart = i + 1;
      }
    }
    int column = span.getStart() - lineStart + 1;
    return new ParseException(String.format("%d:%d: %s", line, column, message), span);
  }

  /** The source range the error was detected at. */
  public Span getSpan() {
    return span;
  }
}
