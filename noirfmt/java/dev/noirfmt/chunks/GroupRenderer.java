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

import com.google.common.base.Strings;
import com.google.common.flogger.FluentLogger;
import dev.noirfmt.common.FormatterConfig;
import java.util.List;

/**
 * Lays out a {@link ChunkGroup} against a maximum line width.
 *
 * <p>Each group is either flat, with every separator rendered inline, or broken, with every
 * separator turned into a newline. The decision is taken per group, outermost first: a group is
 * flat when it contains no forced break and fits in the rest of the line, counting the text that
 * follows it up to the enclosing group's next separator. A group that fits exactly is flat.
 */
public class GroupRenderer {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private final int maxWidth;
  private final int tabSpaces;

  public GroupRenderer(FormatterConfig config) {
    this(config.getMaxWidth(), config.getTabSpaces());
  }

  public GroupRenderer(int maxWidth, int tabSpaces) {
    checkArgument(maxWidth > 0, "maxWidth must be positive: %s", maxWidth);
    checkArgument(tabSpaces > 0, "tabSpaces must be positive: %s", tabSpaces);
    this.maxWidth = maxWidth;
    this.tabSpaces = tabSpaces;
  }

  /** Returns the whitespace that starts a line at indentation level {@code indent}. */
  public String indentation(int indent) {
    return Strings.repeat(" ", indent * tabSpaces);
  }

  /**
   * Renders {@code group} as if it started a line at indentation level {@code indent}. The result
   * begins with that indentation and has no trailing newline.
   */
  public String render(ChunkGroup group, int indent) {
    checkArgument(indent >= 0, "negative indentation: %s", indent);
    RenderState state = new RenderState();
    state.startLine(indent);
    state.renderGroup(group, indent, 0);
    return state.out.toString();
  }

  private class RenderState {
    private final StringBuilder out = new StringBuilder();
    private int column;
    private int lineIndent;
    /** Set after a trailing comment: the next text has to go on a fresh line. */
    private boolean pendingNewline;

    void renderGroup(ChunkGroup group, int indent, int trailingWidth) {
      int flatWidth = group.flatWidth();
      boolean flat =
          !group.containsForcedBreak() && column + flatWidth + trailingWidth <= maxWidth;
      logger.atFinest().log(
          "group at column %d with width %d (+%d trailing) is %s",
          column, flatWidth, trailingWidth, flat ? "flat" : "broken");

      List<Fragment> members = group.getMembers();
      for (int i = 0; i < members.size(); i++) {
        Fragment member = members.get(i);
        if (member instanceof ChunkGroup) {
          renderGroup(
              (ChunkGroup) member, lineIndent, widthUntilBreak(members, i + 1, trailingWidth));
        } else {
          renderChunk((Chunk) member, indent, flat);
        }
      }
    }

    private void renderChunk(Chunk chunk, int indent, boolean flat) {
      switch (chunk.kind()) {
        case TEXT:
          write(chunk.text());
          if (chunk.hasTrailingComment()) {
            out.append(' ').append(chunk.trailingComment().get());
            pendingNewline = true;
          }
          break;
        case LINE:
          if (flat && !pendingNewline) {
            write(" ");
          } else {
            newline(indent + 1);
          }
          break;
        case SOFT_LINE:
          if (!flat) {
            newline(indent + 1);
          }
          break;
        case CLOSING_LINE:
          if (!flat) {
            newline(indent);
          }
          break;
        case HARD_BREAK:
          newline(indent);
          break;
      }
    }

    /**
     * Sums the widths of {@code members} from {@code from} up to the first separator, which is
     * where the line can end. Reaching the end of the group adds the enclosing group's trailing
     * width.
     */
    private int widthUntilBreak(List<Fragment> members, int from, int enclosingTrailingWidth) {
      int width = 0;
      for (int i = from; i < members.size(); i++) {
        Fragment member = members.get(i);
        if (member instanceof Chunk && ((Chunk) member).isSeparator()) {
          return width;
        }
        width += member.flatWidth();
        if (member.endsWithComment()) {
          return width;
        }
      }
      return width + enclosingTrailingWidth;
    }

    private void write(String text) {
      if (pendingNewline) {
        newline(lineIndent);
      }
      out.append(text);
      column += text.codePointCount(0, text.length());
    }

    private void newline(int indent) {
      int end = out.length();
      while (end > 0 && out.charAt(end - 1) == ' ') {
        end--;
      }
      out.setLength(end);
      out.append('\n');
      startLine(indent);
    }

    void startLine(int indent) {
      out.append(indentation(indent));
      column = indent * tabSpaces;
      lineIndent = indent;
      pendingNewline = false;
    }
  }
}
