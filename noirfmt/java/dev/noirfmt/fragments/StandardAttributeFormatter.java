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

import com.google.common.collect.ImmutableList;
import dev.noirfmt.ast.Attribute;
import dev.noirfmt.chunks.Chunk;

/**
 * Renders {@code #[...]} with canonical spacing between the attribute's tokens: a space after a
 * comma, around {@code =}, between two adjacent words and between tokens that would otherwise
 * start a comment, and nothing anywhere else.
 */
public class StandardAttributeFormatter implements AttributeFormatter {
  @Override
  public Chunk formatAttribute(Attribute attribute) {
    ImmutableList<String> tokens = attribute.tokens();
    StringBuilder text = new StringBuilder("#[");
    for (int i = 0; i < tokens.size(); i++) {
      String token = tokens.get(i);
      if (token.isEmpty() || token.indexOf('\n') >= 0) {
        throw MalformedNodeException.create(
            "malformed token '%s' in attribute #[%s]", token, attribute.name());
      }
      if (i > 0 && needsSpace(tokens.get(i - 1), token)) {
        text.append(' ');
      }
      text.append(token);
    }
    text.append(']');
    return Chunk.text(text.toString(), attribute.trailingComment());
  }

  private static boolean needsSpace(String previous, String next) {
    if (next.equals(",")) {
      return false;
    }
    if (previous.equals(",") || previous.equals("=") || next.equals("=")) {
      return true;
    }
    // Joined, these would read back as a comment.
    String joined = previous + next;
    if (joined.startsWith("//") || joined.startsWith("/*")) {
      return true;
    }
    return isWord(previous) && isWord(next);
  }

  private static boolean isWord(String token) {
    char c = token.charAt(0);
    return Character.isLetterOrDigit(c) || c == '_' || c == '"';
  }
}
