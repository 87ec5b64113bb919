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

import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * An ordered run of {@link Chunk}s and nested groups that a {@link GroupRenderer} lays out either
 * entirely on one line or broken at each of its separators.
 *
 * <p>A group owns its members and is meant to be built, rendered once and dropped.
 */
public final class ChunkGroup implements Fragment {
  private final List<Fragment> members = new ArrayList<>();

  @CanIgnoreReturnValue
  public ChunkGroup text(String text) {
    return add(Chunk.text(text));
  }

  @CanIgnoreReturnValue
  public ChunkGroup text(String text, Optional<String> trailingComment) {
    return add(Chunk.text(text, trailingComment));
  }

  @CanIgnoreReturnValue
  public ChunkGroup space() {
    return text(" ");
  }

  @CanIgnoreReturnValue
  public ChunkGroup line() {
    return add(Chunk.line());
  }

  @CanIgnoreReturnValue
  public ChunkGroup softLine() {
    return add(Chunk.softLine());
  }

  @CanIgnoreReturnValue
  public ChunkGroup closingLine() {
    return add(Chunk.closingLine());
  }

  @CanIgnoreReturnValue
  public ChunkGroup hardBreak() {
    return add(Chunk.hardBreak());
  }

  /** Nests {@code group}, which is laid out by its own flat/broken decision. */
  @CanIgnoreReturnValue
  public ChunkGroup group(ChunkGroup group) {
    return add(group);
  }

  @CanIgnoreReturnValue
  public ChunkGroup add(Fragment fragment) {
    if (fragment == this) {
      throw new IllegalArgumentException("a group cannot contain itself");
    }
    members.add(fragment);
    return this;
  }

  public ImmutableList<Fragment> getMembers() {
    return ImmutableList.copyOf(members);
  }

  @Override
  public int flatWidth() {
    int width = 0;
    for (Fragment member : members) {
      width += member.flatWidth();
    }
    return width;
  }

  /**
   * A group is forced to break if any member contains a hard break, or if a line comment is
   * followed by more content of the group.
   */
  @Override
  public boolean containsForcedBreak() {
    for (int i = 0; i < members.size(); i++) {
      Fragment member = members.get(i);
      if (member.containsForcedBreak()) {
        return true;
      }
      if (i < members.size() - 1 && member.endsWithComment()) {
        return true;
      }
    }
    return false;
  }

  @Override
  public boolean endsWithComment() {
    return !members.isEmpty() && members.get(members.size() - 1).endsWithComment();
  }

  @Override
  public String toString() {
    return "ChunkGroup" + members;
  }
}
