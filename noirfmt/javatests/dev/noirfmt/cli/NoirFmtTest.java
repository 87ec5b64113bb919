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

package dev.noirfmt.cli;

import static com.google.common.truth.Truth.assertThat;
import static java.nio.charset.StandardCharsets.UTF_8;
import static org.junit.Assert.assertThrows;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.file.Files;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests the {@link NoirFmt} binary against files in a temporary directory. */
@RunWith(JUnit4.class)
public class NoirFmtTest {
  private static final String MESSY = "pub  global  x  =  1  ;";
  private static final String FORMATTED = "pub global x = 1;\n";

  @Rule public TemporaryFolder tmp = new TemporaryFolder();

  private final ByteArrayOutputStream stdout = new ByteArrayOutputStream();

  private int run(InputStream stdin, String... args) throws IOException {
    NoirFmt.StandaloneConfig config = new NoirFmt.StandaloneConfig();
    config.parseCommandLine(args);
    return NoirFmt.run(config, stdin, new PrintStream(stdout, true, "UTF-8"));
  }

  private int run(String... args) throws IOException {
    return run(new ByteArrayInputStream(new byte[0]), args);
  }

  private File file(String name, String contents) throws IOException {
    File file = tmp.newFile(name);
    Files.write(file.toPath(), contents.getBytes(UTF_8));
    return file;
  }

  private static String read(File file) throws IOException {
    return new String(Files.readAllBytes(file.toPath()), UTF_8);
  }

  private String stdout() {
    return new String(stdout.toByteArray(), UTF_8);
  }

  @Test
  public void testStdin() throws IOException {
    assertThat(run(new ByteArrayInputStream(MESSY.getBytes(UTF_8)))).isEqualTo(NoirFmt.SUCCESS);
    assertThat(stdout()).isEqualTo(FORMATTED);
  }

  @Test
  public void testStdinFailure() throws IOException {
    assertThat(run(new ByteArrayInputStream("global x = ;".getBytes(UTF_8))))
        .isEqualTo(NoirFmt.FAILURE);
    assertThat(stdout()).isEmpty();
  }

  @Test
  public void testPrintsFiles() throws IOException {
    File file = file("a.nr", MESSY);
    assertThat(run(file.getPath())).isEqualTo(NoirFmt.SUCCESS);
    assertThat(stdout()).isEqualTo(FORMATTED);
    assertThat(read(file)).isEqualTo(MESSY);
  }

  @Test
  public void testMaxWidthFlag() throws IOException {
    File file = file("a.nr", MESSY);
    assertThat(run("--max_width=12", file.getPath())).isEqualTo(NoirFmt.SUCCESS);
    assertThat(stdout()).isEqualTo("pub global x =\n    1;\n");
  }

  @Test
  public void testCheck() throws IOException {
    File messy = file("messy.nr", MESSY);
    File clean = file("clean.nr", FORMATTED);
    assertThat(run("--check", messy.getPath(), clean.getPath())).isEqualTo(NoirFmt.UNFORMATTED);
    assertThat(stdout()).isEqualTo(messy.getPath() + System.lineSeparator());
    assertThat(read(messy)).isEqualTo(MESSY);
  }

  @Test
  public void testCheckFormatted() throws IOException {
    File clean = file("clean.nr", FORMATTED);
    assertThat(run("--check", clean.getPath())).isEqualTo(NoirFmt.SUCCESS);
    assertThat(stdout()).isEmpty();
  }

  @Test
  public void testWrite() throws IOException {
    File messy = file("messy.nr", MESSY);
    assertThat(run("--write", messy.getPath())).isEqualTo(NoirFmt.SUCCESS);
    assertThat(read(messy)).isEqualTo(FORMATTED);
    assertThat(stdout()).isEmpty();
  }

  @Test
  public void testFailureLeavesFileUntouched() throws IOException {
    String broken = "global (a, b) = 1;\n";
    File bad = file("bad.nr", broken);
    File messy = file("messy.nr", MESSY);
    assertThat(run("--write", bad.getPath(), messy.getPath())).isEqualTo(NoirFmt.FAILURE);
    assertThat(read(bad)).isEqualTo(broken);
    assertThat(read(messy)).isEqualTo(FORMATTED);
  }

  @Test
  public void testMalformedUtf8LeavesFileUntouched() throws IOException {
    byte[] contents = {
      'g', 'l', 'o', 'b', 'a', 'l', ' ', ' ', 'x', '=', '1', ';', ' ', '/', '/', ' ', (byte) 0xC3,
      '(', '\n'
    };
    File bad = tmp.newFile("bad.nr");
    Files.write(bad.toPath(), contents);
    File messy = file("messy.nr", MESSY);
    assertThat(run("--write", bad.getPath(), messy.getPath())).isEqualTo(NoirFmt.FAILURE);
    assertThat(Files.readAllBytes(bad.toPath())).isEqualTo(contents);
    assertThat(read(messy)).isEqualTo(FORMATTED);
  }

  @Test
  public void testMalformedUtf8OnStdin() throws IOException {
    byte[] contents = {'g', 'l', 'o', 'b', 'a', 'l', ' ', 'x', '=', '"', (byte) 0xFF, '"', ';'};
    assertThat(run(new ByteArrayInputStream(contents))).isEqualTo(NoirFmt.FAILURE);
    assertThat(stdout()).isEmpty();
  }

  @Test
  public void testMissingFileDoesNotStopTheRun() throws IOException {
    File missing = new File(tmp.getRoot(), "missing.nr");
    File messy = file("messy.nr", MESSY);
    assertThat(run("--write", missing.getPath(), messy.getPath())).isEqualTo(NoirFmt.FAILURE);
    assertThat(missing.exists()).isFalse();
    assertThat(read(messy)).isEqualTo(FORMATTED);
  }

  @Test
  public void testCheckAndWriteAreExclusive() {
    assertThrows(IllegalArgumentException.class, () -> run("--check", "--write", "a.nr"));
  }
}
