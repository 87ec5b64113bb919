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

import com.google.common.flogger.FluentLogger;
import dev.noirfmt.ast.Attribute;
import dev.noirfmt.ast.Declaration;
import dev.noirfmt.ast.Keyword;
import dev.noirfmt.ast.Visibility;
import dev.noirfmt.chunks.ChunkGroup;
import dev.noirfmt.chunks.FormattedOutput;
import dev.noirfmt.fragments.FragmentFormatters;

/**
 * Formats a single let or global declaration:
 *
 * <pre>
 *   #[attribute]
 *   [visibility] [comptime] [mut] (global|let) pattern[: type][ = initializer];
 * </pre>
 *
 * <p>Attributes and leading comments each take a line of their own. The modifiers and the rest of
 * the statement form one group, so the line only ever breaks after the {@code =}, never inside the
 * modifier prefix. Errors from the fragment formatters are not caught here.
 */
public class DeclarationFormatter {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private final FragmentFormatters fragments;

  public DeclarationFormatter(FragmentFormatters fragments) {
    this.fragments = fragments;
  }

  /** Formats {@code declaration} and appends it to {@code output} as whole lines. */
  public void formatDeclaration(
      Declaration declaration, Keyword keyword, FormattedOutput output) {
    output.writeGroup(buildDeclaration(declaration, keyword));
  }

  /** Builds the chunk tree of {@code declaration} without rendering it. */
  public ChunkGroup buildDeclaration(Declaration declaration, Keyword keyword) {
    verify(
        keyword == Keyword.GLOBAL || declaration.visibility() == Visibility.PRIVATE,
        "a let binding cannot have visibility %s",
        declaration.visibility());
    verify(
        declaration.initializer().isPresent() || !declaration.assignmentComment().isPresent(),
        "assignment comment without an initializer");

    ChunkGroup group = new ChunkGroup();
    for (String comment : declaration.leadingComments()) {
      group.text(comment).hardBreak();
    }
    for (Attribute attribute : declaration.attributes()) {
      group.add(fragments.attributes().formatAttribute(attribute)).hardBreak();
    }

    NormalizedPattern pattern = PatternNormalizer.normalize(declaration.pattern(), keyword);
    logger.atFinest().log(
        "formatting %s declaration, mutable=%s", keyword.getText(), pattern.mutable());

    ChunkGroup statement = new ChunkGroup();
    if (declaration.visibility() != Visibility.PRIVATE) {
      statement.text(declaration.visibility().getKeyword()).space();
    }
    if (declaration.comptime()) {
      statement.text("comptime ");
    }
    if (pattern.mutable()) {
      statement.text("mut ");
    }
    statement
        .text(keyword.getText())
        .space()
        .group(fragments.patterns().formatPattern(pattern.canonical()));
    declaration
        .typeAnnotation()
        .ifPresent(type -> statement.text(": ").group(fragments.types().formatType(type)));
    declaration
        .initializer()
        .ifPresent(
            initializer ->
                statement
                    .text(" =", declaration.assignmentComment())
                    .line()
                    .group(fragments.expressions().formatExpression(initializer)));
    statement.text(";", declaration.trailingComment());

    return group.group(statement);
  }
}
