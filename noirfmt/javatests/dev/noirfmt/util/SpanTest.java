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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import junit.framework.TestCase;

/** Unit tests for {@link Span}. */
public final class SpanTest extends TestCase {

  public void testAccessors() {
    Span span = new Span(3, 7);
    assertThat(span.getStart()).isEqualTo(3);
    assertThat(span.getEnd()).isEqualTo(7);
    assertThat(span.length()).isEqualTo(4);
    assertThat(span.toString()).isEqualTo("Span{3, 7}");
  }

  public void testEmptySpan() {
    assertThat(new Span(5, 5).length()).isEqualTo(0);
  }

  public void testInvalid() {
    assertThrows(IllegalArgumentException.class, () -> new Span(-1, 2));
    assertThrows(IllegalArgumentException.class, () -> new Span(4, 2));
  }

  public void testIsFollowedBy() {
    assertThat(new Span(0, 2).isFollowedBy(new Span(2, 3))).isTrue();
    assertThat(new Span(0, 2).isFollowedBy(new Span(3, 4))).isFalse();
  }

  public void testEquality() {
    assertThat(new Span(1, 2)).isEqualTo(new Span(1, 2));
    assertThat(new Span(1, 2)).isNotEqualTo(new Span(1, 3));
    assertThat(new Span(1, 2).hashCode()).isEqualTo(new Span(1, 2).hashCode());
  }
}
