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

package dev.noirfmt.util;

import static com.google.common.base.Preconditions.checkArgument;

import java.util.Objects;

/** Half-open range of character offsets into a source text. */
public final class Span {
  private final int start;
  private final int end;

  public Span(int startOffset, int endOffset) {
    checkArgument(
        startOffset >= 0 && startOffset <= endOffset,
        "invalid span [%s, %s)",
        startOffset,
        endOffset);
    this.start = startOffset;
    this.end = endOffset;
  }

  public int getStart() {
    return start;
  }

  public int getEnd() {
    return end;
  }

  public int length() {
    return end - start;
  }

  /** Returns true if {@code other} begins exactly where {@code this} ends. */
  public boolean isFollowedBy(Span other) {
    return end == other.start;
  }

  @Override
  public String toString() {
    return String.format("Span{%d, %d}", start, end);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    Span span = (Span) o;
    return start == span.start && end == span.end;
  }

  @Override
  public int hashCode() {
    return Objects.hash(start, end);
  }
}
