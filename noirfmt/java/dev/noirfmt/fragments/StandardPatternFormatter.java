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

import dev.noirfmt.ast.Pattern;
import dev.noirfmt.chunks.ChunkGroup;

/** Renders binding patterns. Tuples may break one element per line; struct patterns never break. */
public class StandardPatternFormatter implements PatternFormatter {
  @Override
  public ChunkGroup formatPattern(Pattern pattern) {
    switch (pattern.getKind()) {
      case IDENTIFIER:
        Pattern.Identifier identifier = pattern.asIdentifier();
        String name = FragmentSupport.checkIdentifier(identifier.name());
        return new ChunkGroup().text(identifier.isMut() ? "mut " + name : name);
      case MUT_WRAPPED:
        return new ChunkGroup()
            .text("mut ")
            .group(formatPattern(pattern.asMutWrapped().inner()));
      case TUPLE:
        return FragmentSupport.delimited(
            "(", pattern.asTuple().elements(), ")", true, this::formatPattern);
      case STRUCT:
        return formatStruct(pattern.asStruct());
      case PARENTHESIZED:
        return new ChunkGroup()
            .text("(")
            .group(formatPattern(pattern.asParenthesized().inner()))
            .text(")");
      case INTERNED:
        throw MalformedNodeException.create(
            "interned pattern #%d has no source form", pattern.asInterned().id());
    }
    throw new AssertionError(pattern.getKind());
  }

  private ChunkGroup formatStruct(Pattern.Struct struct) {
    ChunkGroup group = new ChunkGroup().text(FragmentSupport.checkPath(struct.typePath()));
    if (struct.fields().isEmpty()) {
      return group.text(" {}");
    }
    group.text(" { ");
    for (int i = 0; i < struct.fields().size(); i++) {
      Pattern.StructField field = struct.fields().get(i);
      if (i > 0) {
        group.text(", ");
      }
      group.text(FragmentSupport.checkIdentifier(field.name()));
      if (!field.isShorthand()) {
        group.text(": ").group(formatPattern(field.pattern()));
      }
    }
    return group.text(" }");
  }
}
