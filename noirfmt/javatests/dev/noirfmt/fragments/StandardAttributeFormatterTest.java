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

package dev.noirfmt.fragments;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import dev.noirfmt.ast.Attribute;
import dev.noirfmt.chunks.Chunk;
import java.util.Optional;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Unit tests for {@link StandardAttributeFormatter}. */
@RunWith(JUnit4.class)
public final class StandardAttributeFormatterTest {

  private static String format(String... tokens) {
    return new StandardAttributeFormatter()
        .formatAttribute(Attribute.create(ImmutableList.copyOf(tokens)))
        .text();
  }

  @Test
  public void testSingleWord() {
    assertThat(format("test")).isEqualTo("#[test]");
  }

  @Test
  public void testArguments() {
    assertThat(format("abi", "(", "foo", ")")).isEqualTo("#[abi(foo)]");
    assertThat(format("oracle", "(", "get", ",", "x", ")")).isEqualTo("#[oracle(get, x)]");
  }

  @Test
  public void testAssignment() {
    assertThat(format("deprecated", "=", "\"use bar\"")).isEqualTo("#[deprecated = \"use bar\"]");
  }

  @Test
  public void testAdjacentWords() {
    assertThat(format("test", "should_fail")).isEqualTo("#[test should_fail]");
  }

  @Test
  public void testSlashesDoNotJoinIntoComments() {
    assertThat(format("foo", "(", "a", "/", "/", "b", ")")).isEqualTo("#[foo(a/ /b)]");
    assertThat(format("foo", "(", "/", "*", ")")).isEqualTo("#[foo(/ *)]");
    assertThat(format("foo", "(", "a", "/", "b", ")")).isEqualTo("#[foo(a/b)]");
  }

  @Test
  public void testKeepsTrailingComment() {
    Chunk chunk =
        new StandardAttributeFormatter()
            .formatAttribute(
                Attribute.create(ImmutableList.of("abi", "(", "foo", ")"), Optional.of("// x")));
    assertThat(chunk.text()).isEqualTo("#[abi(foo)]");
    assertThat(chunk.trailingComment()).hasValue("// x");
  }

  @Test
  public void testMalformedToken() {
    assertThrows(MalformedNodeException.class, () -> format("a", ""));
    assertThrows(MalformedNodeException.class, () -> format("a", "b\nc"));
  }

  @Test
  public void testEmptyAttribute() {
    assertThrows(IllegalArgumentException.class, () -> format());
  }
}
