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

package dev.noirfmt.chunks;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.auto.value.AutoValue;
import java.util.Optional;

/** The smallest piece of formatted output: a run of text or a layout separator. */
@AutoValue
public abstract class Chunk implements Fragment {
  /** What a {@link Chunk} contributes to the rendered text. */
  public enum Kind {
    /** Literal text on the current line. */
    TEXT,
    /** A space when its group is flat, otherwise a newline one level deeper. */
    LINE,
    /** Nothing when its group is flat, otherwise a newline one level deeper. */
    SOFT_LINE,
    /** Nothing when its group is flat, otherwise a newline at the group's own level. */
    CLOSING_LINE,
    /** Always a newline at the group's own level. Forces the group to break. */
    HARD_BREAK
  }

  public abstract Kind kind();

  public abstract String text();

  /** A line comment that must follow this chunk on the same line, including its {@code //}. */
  public abstract Optional<String> trailingComment();

  public static Chunk text(String text) {
    return text(text, Optional.empty());
  }

  public static Chunk text(String text, Optional<String> trailingComment) {
    checkArgument(text.indexOf('\n') < 0, "chunk text must not contain a newline: %s", text);
    trailingComment.ifPresent(
        comment ->
            checkArgument(
                comment.startsWith("//") && comment.indexOf('\n') < 0,
                "not a line comment: %s",
                comment));
    return create(Kind.TEXT, text, trailingComment);
  }

  public static Chunk line() {
    return separator(Kind.LINE);
  }

  public static Chunk softLine() {
    return separator(Kind.SOFT_LINE);
  }

  public static Chunk closingLine() {
    return separator(Kind.CLOSING_LINE);
  }

  public static Chunk hardBreak() {
    return separator(Kind.HARD_BREAK);
  }

  private static Chunk separator(Kind kind) {
    return create(kind, "", Optional.empty());
  }

  private static Chunk create(Kind kind, String text, Optional<String> trailingComment) {
    return new AutoValue_Chunk(kind, text, trailingComment);
  }

  public boolean isHardBreak() {
    return kind() == Kind.HARD_BREAK;
  }

  /** Returns true for every kind other than {@link Kind#TEXT}. */
  public boolean isSeparator() {
    return kind() != Kind.TEXT;
  }

  public boolean hasTrailingComment() {
    return trailingComment().isPresent();
  }

  /** Comments are not counted. */
  @Override
  public int flatWidth() {
    switch (kind()) {
      case TEXT:
        return text().codePointCount(0, text().length());
      case LINE:
        return 1;
      case SOFT_LINE:
      case CLOSING_LINE:
      case HARD_BREAK:
        return 0;
    }
    throw new AssertionError(kind());
  }

  @Override
  public boolean containsForcedBreak() {
    return isHardBreak();
  }

  @Override
  public boolean endsWithComment() {
    return hasTrailingComment();
  }
}
