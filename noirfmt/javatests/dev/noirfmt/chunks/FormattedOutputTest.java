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

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests {@link FormattedOutput}. */
@RunWith(JUnit4.class)
public class FormattedOutputTest {
  private final FormattedOutput output = new FormattedOutput(new GroupRenderer(100, 4));

  @Test
  public void testWriteGroupAppendsWholeLines() {
    output.writeGroup(new ChunkGroup().text("global a = 1;"));
    output.writeGroup(new ChunkGroup().text("global b = 2;"));
    assertThat(output.contents()).isEqualTo("global a = 1;\nglobal b = 2;\n");
  }

  @Test
  public void testIndentation() {
    output.increaseIndentation();
    assertThat(output.getIndent()).isEqualTo(1);
    output.writeGroup(new ChunkGroup().text("let x = 1;"));
    output.writeLine("// done");
    output.decreaseIndentation();
    output.writeLine("}");
    assertThat(output.contents()).isEqualTo("    let x = 1;\n    // done\n}\n");
  }

  @Test
  public void testDecreaseBelowTopLevel() {
    assertThrows(IllegalStateException.class, output::decreaseIndentation);
  }

  @Test
  public void testBlankLines() {
    output.writeBlankLine();
    assertThat(output.contents()).isEmpty();
    output.writeLine("a");
    output.writeBlankLine();
    output.writeBlankLine();
    output.writeLine("b");
    assertThat(output.contents()).isEqualTo("a\n\nb\n");
  }

  @Test
  public void testWriteLineRejectsNewlines() {
    assertThrows(IllegalArgumentException.class, () -> output.writeLine("a\nb"));
  }
}
