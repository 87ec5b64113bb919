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

package dev.noirfmt.formatter;

import static com.google.common.base.Verify.verify;

import com.google.common.base.VerifyException;
import dev.noirfmt.ast.Keyword;
import dev.noirfmt.ast.Pattern;

/**
 * Lifts the {@code mut} of a global out of its pattern.
 *
 * <p>The parser stores {@code mut global x} as a {@link Pattern.MutWrapped} around the
 * identifier, while other producers may set {@link Pattern.Identifier#isMut()} instead. Both become
 * a single flag here, so the rest of the formatter never looks at the pattern's shape to find
 * modifiers. Shapes that a global can never have are contract violations and fail with a {@link
 * VerifyException}.
 */
public final class PatternNormalizer {
  private PatternNormalizer() {}

  /** Normalizes the pattern of a declaration introduced by {@code keyword}. */
  public static NormalizedPattern normalize(Pattern pattern, Keyword keyword) {
    switch (keyword) {
      case GLOBAL:
        return normalizeGlobal(pattern);
      case LET:
        // `mut` is part of a let pattern and any shape is legal there.
        return NormalizedPattern.create(false, pattern);
    }
    throw new AssertionError(keyword);
  }

  public static NormalizedPattern normalizeGlobal(Pattern pattern) {
    switch (pattern.getKind()) {
      case IDENTIFIER:
        Pattern.Identifier identifier = pattern.asIdentifier();
        if (identifier.isMut()) {
          return NormalizedPattern.create(true, Pattern.identifier(identifier.name()));
        }
        return NormalizedPattern.create(false, identifier);
      case MUT_WRAPPED:
        Pattern inner = pattern.asMutWrapped().inner();
        verify(
            inner.getKind() == Pattern.Kind.IDENTIFIER,
            "mut global must wrap an identifier, found %s",
            inner.getKind());
        verify(
            !inner.asIdentifier().isMut(),
            "global %s carries mut both as a wrapper and as a flag",
            inner.asIdentifier().name());
        return NormalizedPattern.create(true, inner);
      case TUPLE:
      case STRUCT:
      case PARENTHESIZED:
      case INTERNED:
        throw new VerifyException(
            "global pattern cannot be a tuple, struct, parenthesized or interned pattern: "
                + pattern.getKind());
    }
    throw new AssertionError(pattern.getKind());
  }
}
