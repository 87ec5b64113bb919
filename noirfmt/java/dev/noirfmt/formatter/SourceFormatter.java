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

import com.google.common.flogger.FluentLogger;
import dev.noirfmt.ast.SourceFile;
import dev.noirfmt.chunks.FormattedOutput;
import dev.noirfmt.chunks.GroupRenderer;
import dev.noirfmt.common.FormatterConfig;
import dev.noirfmt.fragments.FragmentFormatters;
import dev.noirfmt.parser.DeclarationParser;
import dev.noirfmt.parser.ParseException;

/**
 * Formats every declaration of a file, in source order, into a fresh {@link FormattedOutput}.
 *
 * <p>The result is returned only once the whole file has been formatted: a syntax error, a node a
 * fragment formatter cannot render or a contract violation aborts the pass and nothing is
 * produced. Blank lines between declarations are collapsed to one.
 */
public class SourceFormatter {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private final GroupRenderer renderer;
  private final DeclarationFormatter declarations;

  public SourceFormatter(FormatterConfig config) {
    this(config, FragmentFormatters.standard());
  }

  public SourceFormatter(FormatterConfig config, FragmentFormatters fragments) {
    this.renderer = new GroupRenderer(config);
    this.declarations = new DeclarationFormatter(fragments);
  }

  /** Parses and formats {@code source}. */
  public String format(String source) throws ParseException {
    return format(DeclarationParser.parseFile(source));
  }

  public String format(SourceFile file) {
    FormattedOutput output = new FormattedOutput(renderer);
    for (SourceFile.Entry entry : file.entries()) {
      if (entry.precededByBlankLine()) {
        output.writeBlankLine();
      }
      declarations.formatDeclaration(entry.declaration(), entry.keyword(), output);
    }
    for (String comment : file.trailingComments()) {
      output.writeLine(comment);
    }
    logger.atFine().log("formatted %d declarations", file.entries().size());
    return output.contents();
  }
}
