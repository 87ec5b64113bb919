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

package dev.noirfmt.fragments;

import com.google.common.base.CharMatcher;
import com.google.common.base.Splitter;
import dev.noirfmt.chunks.ChunkGroup;
import java.util.List;
import java.util.function.Function;

/** Helpers shared by the standard fragment formatters. */
final class FragmentSupport {
  private FragmentSupport() {}

  private static final CharMatcher IDENTIFIER_START =
      CharMatcher.inRange('a', 'z').or(CharMatcher.inRange('A', 'Z')).or(CharMatcher.is('_'));
  private static final CharMatcher DIGIT = CharMatcher.inRange('0', '9');
  private static final CharMatcher IDENTIFIER_PART = IDENTIFIER_START.or(DIGIT);
  private static final Splitter PATH_SPLITTER = Splitter.on("::");

  /** Returns {@code name} if it is a well-formed identifier. */
  static String checkIdentifier(String name) {
    if (name.isEmpty()
        || !IDENTIFIER_START.matches(name.charAt(0))
        || !IDENTIFIER_PART.matchesAllOf(name)) {
      throw MalformedNodeException.create("malformed identifier: '%s'", name);
    }
    return name;
  }

  /** Accepts identifiers and the numeric fields of tuple access, as in {@code pair.0}. */
  static String checkMemberName(String name) {
    if (!name.isEmpty() && DIGIT.matchesAllOf(name)) {
      return name;
    }
    return checkIdentifier(name);
  }

  /** Returns {@code path} if every {@code ::}-separated segment is a well-formed identifier. */
  static String checkPath(String path) {
    for (String segment : PATH_SPLITTER.split(path)) {
      if (segment.isEmpty()
          || !IDENTIFIER_START.matches(segment.charAt(0))
          || !IDENTIFIER_PART.matchesAllOf(segment)) {
        throw MalformedNodeException.create("malformed path: '%s'", path);
      }
    }
    return path;
  }

  /**
   * Builds {@code open item, item close}, breaking one item per line with the closing delimiter
   * back at the group's level. A single item keeps a trailing comma when {@code singleComma} is
   * set, so that a one-element tuple stays a tuple.
   */
  static <T> ChunkGroup delimited(
      String open,
      List<T> items,
      String close,
      boolean singleComma,
      Function<? super T, ChunkGroup> formatter) {
    ChunkGroup group = new ChunkGroup().text(open);
    if (items.isEmpty()) {
      return group.text(close);
    }
    group.softLine();
    for (int i = 0; i < items.size(); i++) {
      group.group(formatter.apply(items.get(i)));
      if (i < items.size() - 1) {
        group.text(",").line();
      } else if (singleComma && items.size() == 1) {
        group.text(",");
      }
    }
    return group.closingLine().text(close);
  }
}
