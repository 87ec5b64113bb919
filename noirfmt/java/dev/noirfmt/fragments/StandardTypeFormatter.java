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
import dev.noirfmt.ast.TypeNode;
import dev.noirfmt.chunks.ChunkGroup;

/** Renders a type on a single, unbreakable chunk: {@code [Option<Field>; 3]}. */
public class StandardTypeFormatter implements TypeFormatter {
  @Override
  public ChunkGroup formatType(TypeNode type) {
    StringBuilder text = new StringBuilder();
    appendType(text, type);
    return new ChunkGroup().text(text.toString());
  }

  private static void appendType(StringBuilder text, TypeNode type) {
    switch (type.getKind()) {
      case NAMED:
        TypeNode.Named named = (TypeNode.Named) type;
        text.append(checkNamedPath(named.path()));
        if (!named.genericArguments().isEmpty()) {
          text.append('<');
          appendList(text, named.genericArguments());
          text.append('>');
        }
        return;
      case ARRAY:
        TypeNode.Array array = (TypeNode.Array) type;
        if (array.length().isEmpty()) {
          throw new MalformedNodeException("array type without a length");
        }
        text.append('[');
        appendType(text, array.element());
        text.append("; ").append(array.length()).append(']');
        return;
      case SLICE:
        text.append('[');
        appendType(text, ((TypeNode.Slice) type).element());
        text.append(']');
        return;
      case TUPLE:
        ImmutableList<TypeNode> elements = ((TypeNode.Tuple) type).elements();
        text.append('(');
        appendList(text, elements);
        if (elements.size() == 1) {
          text.append(',');
        }
        text.append(')');
        return;
      case REFERENCE:
        TypeNode.Reference reference = (TypeNode.Reference) type;
        text.append(reference.isMut() ? "&mut " : "&");
        appendType(text, reference.element());
        return;
    }
    throw new AssertionError(type.getKind());
  }

  private static void appendList(StringBuilder text, ImmutableList<TypeNode> types) {
    for (int i = 0; i < types.size(); i++) {
      if (i > 0) {
        text.append(", ");
      }
      appendType(text, types.get(i));
    }
  }

  /** Numeric generic arguments such as the {@code 5} of {@code str<5>} are named types too. */
  private static String checkNamedPath(String path) {
    if (!path.isEmpty() && Character.isDigit(path.charAt(0))) {
      return path;
    }
    return FragmentSupport.checkPath(path);
  }
}
