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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import java.util.Optional;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests {@link GroupRenderer}. */
@RunWith(JUnit4.class)
public class GroupRendererTest {

  private static String render(ChunkGroup group, int maxWidth) {
    return new GroupRenderer(maxWidth, 4).render(group, 0);
  }

  private static ChunkGroup assignment() {
    return new ChunkGroup().text("let x =").line().text("1;");
  }

  /** {@code [1, 2]} as built by the fragment formatters. */
  private static ChunkGroup array() {
    return new ChunkGroup()
        .text("[")
        .softLine()
        .text("1")
        .text(",")
        .line()
        .text("2")
        .closingLine()
        .text("]");
  }

  @Test
  public void testFlat() {
    assertThat(render(assignment(), 100)).isEqualTo("let x = 1;");
  }

  @Test
  public void testExactWidthIsFlat() {
    assertThat(render(assignment(), 10)).isEqualTo("let x = 1;");
    assertThat(render(assignment(), 9)).isEqualTo("let x =\n    1;");
  }

  @Test
  public void testNestedGroupDecidesIndependently() {
    ChunkGroup group = new ChunkGroup().text("global x =").line().group(array()).text(";");
    assertThat(render(group, 100)).isEqualTo("global x = [1, 2];");
    assertThat(render(group, 12)).isEqualTo("global x =\n    [1, 2];");
    assertThat(render(group, 10)).isEqualTo("global x =\n    [\n        1,\n        2\n    ];");
  }

  @Test
  public void testTrailingTextCountsTowardsNestedGroup() {
    ChunkGroup group = new ChunkGroup().text("x = ").group(array()).text(";");
    assertThat(render(group, 11)).isEqualTo("x = [1, 2];");
    assertThat(render(group, 10)).isEqualTo("x = [\n    1,\n    2\n];");
  }

  @Test
  public void testHardBreakForcesBrokenLayout() {
    ChunkGroup group = new ChunkGroup().text("#[attr]").hardBreak().group(assignment());
    assertThat(render(group, 100)).isEqualTo("#[attr]\nlet x = 1;");
  }

  @Test
  public void testHardBreakInNestedGroupBreaksParent() {
    ChunkGroup inner = new ChunkGroup().text("a").hardBreak().text("b");
    ChunkGroup group = new ChunkGroup().text("x =").line().group(inner);
    assertThat(render(group, 100)).isEqualTo("x =\n    a\n    b");
  }

  @Test
  public void testCommentFollowedByContentBreaks() {
    ChunkGroup group = new ChunkGroup().text("x =", Optional.of("// why")).line().text("1;");
    assertThat(render(group, 100)).isEqualTo("x = // why\n    1;");
  }

  @Test
  public void testTrailingCommentDoesNotBreakOrCount() {
    ChunkGroup group =
        new ChunkGroup().text("x =").line().text("1;", Optional.of("// a long comment"));
    assertThat(render(group, 6)).isEqualTo("x = 1; // a long comment");
  }

  @Test
  public void testTextAfterCommentStartsNewLine() {
    ChunkGroup inner = new ChunkGroup().text("a", Optional.of("// c"));
    ChunkGroup group = new ChunkGroup().text("x = ").group(inner).text(";");
    assertThat(render(group, 100)).isEqualTo("x = a // c\n;");
  }

  @Test
  public void testIndentation() {
    GroupRenderer renderer = new GroupRenderer(12, 4);
    ChunkGroup group = new ChunkGroup().text("abc =").line().text("d;");
    assertThat(renderer.render(group, 1)).isEqualTo("    abc = d;");
    assertThat(new GroupRenderer(11, 4).render(group, 1)).isEqualTo("    abc =\n        d;");
    assertThat(new GroupRenderer(100, 2).render(group, 2)).isEqualTo("    abc = d;");
  }

  @Test
  public void testWidthInCodePoints() {
    ChunkGroup group = new ChunkGroup().text("s =").line().text("\"😀\";");
    assertThat(render(group, 8)).isEqualTo("s = \"😀\";");
    assertThat(render(group, 7)).isEqualTo("s =\n    \"😀\";");
  }

  @Test
  public void testNoTrailingWhitespace() {
    ChunkGroup group = new ChunkGroup().text("x = ").line().text("1;");
    assertThat(render(group, 3)).isEqualTo("x =\n    1;");
  }

  @Test
  public void testRejectsBadSettings() {
    assertThrows(IllegalArgumentException.class, () -> new GroupRenderer(0, 4));
    assertThrows(IllegalArgumentException.class, () -> new GroupRenderer(100, 0));
    assertThrows(
        IllegalArgumentException.class, () -> new GroupRenderer(100, 4).render(assignment(), -1));
  }
}
