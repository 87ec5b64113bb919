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

package dev.noirfmt.ast;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;

/** The declarations of one source file, in source order. */
@AutoValue
public abstract class SourceFile {
  public static SourceFile create(Iterable<Entry> entries, Iterable<String> trailingComments) {
    return new AutoValue_SourceFile(
        ImmutableList.copyOf(entries), ImmutableList.copyOf(trailingComments));
  }

  public abstract ImmutableList<Entry> entries();

  /** Whole-line comments after the last declaration. */
  public abstract ImmutableList<String> trailingComments();

  /** A declaration together with the keyword that introduced it. */
  @AutoValue
  public abstract static class Entry {
    public static Entry create(
        Keyword keyword, Declaration declaration, boolean precededByBlankLine) {
      return new AutoValue_SourceFile_Entry(keyword, declaration, precededByBlankLine);
    }

    public abstract Keyword keyword();

    public abstract Declaration declaration();

    /** Whether the source had at least one empty line before this entry. */
    public abstract boolean precededByBlankLine();
  }
}
