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
import static com.google.common.base.Preconditions.checkState;

/**
 * The text produced by one formatting pass, together with the current indentation level.
 *
 * <p>An instance belongs to a single pass and is handed explicitly to everything that writes into
 * it. Groups are rendered completely before any of their text is appended, so a failure while
 * rendering leaves the buffer as it was.
 */
public final class FormattedOutput {
  private final GroupRenderer renderer;
  private final StringBuilder buffer = new StringBuilder();
  private int indent;

  public FormattedOutput(GroupRenderer renderer) {
    this.renderer = renderer;
  }

  public int getIndent() {
    return indent;
  }

  public void increaseIndentation() {
    indent++;
  }

  public void decreaseIndentation() {
    checkState(indent > 0, "indentation is already at the top level");
    indent--;
  }

  /** Renders {@code group} at the current indentation and appends it as whole lines. */
  public void writeGroup(ChunkGroup group) {
    String text = renderer.render(group, indent);
    buffer.append(text).append('\n');
  }

  /** Appends {@code text} as one line at the current indentation. */
  public void writeLine(String text) {
    checkArgument(text.indexOf('\n') < 0, "not a single line: %s", text);
    buffer.append(renderer.indentation(indent)).append(text).append('\n');
  }

  /** Appends an empty line, unless the output is empty or already ends with one. */
  public void writeBlankLine() {
    int length = buffer.length();
    if (length == 0 || (length >= 2 && buffer.charAt(length - 2) == '\n')) {
      return;
    }
    buffer.append('\n');
  }

  public String contents() {
    return buffer.toString();
  }
}
