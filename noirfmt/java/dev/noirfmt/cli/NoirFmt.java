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

import static java.nio.charset.StandardCharsets.UTF_8;

import com.beust.jcommander.Parameter;
import com.google.common.base.VerifyException;
import com.google.common.flogger.FluentLogger;
import com.google.common.io.ByteStreams;
import dev.noirfmt.common.FormatterConfig;
import dev.noirfmt.formatter.SourceFormatter;
import dev.noirfmt.fragments.MalformedNodeException;
import dev.noirfmt.parser.ParseException;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Binary to format let and global declarations in one or more files, or in STDIN when no file is
 * given.
 *
 * <p>A file that fails to format is reported and left untouched; the other files are still
 * processed and the exit code is non-zero.
 */
public class NoirFmt {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  /** Exit code when every input was formatted (and, with --check, already was). */
  public static final int SUCCESS = 0;
  /** Exit code when --check found a file whose formatting would change. */
  public static final int UNFORMATTED = 1;
  /** Exit code when at least one input could not be formatted. */
  public static final int FAILURE = 2;

  private NoirFmt() {}

  public static void main(String[] args) {
    StandaloneConfig config = new StandaloneConfig();
    config.parseCommandLine(args);
    if (config.getVerboseLogging()) {
      Logger.getLogger("").setLevel(Level.FINE);
    }
    System.exit(run(config, System.in, System.out));
  }

  /** Formats the inputs named by {@code config} and returns the process exit code. */
  public static int run(StandaloneConfig config, InputStream stdin, PrintStream stdout) {
    if (config.getCheck() && config.getWrite()) {
      throw new IllegalArgumentException("--check and --write are mutually exclusive");
    }
    SourceFormatter formatter = new SourceFormatter(config);

    if (config.getFiles().isEmpty()) {
      try {
        String source = decode(ByteStreams.toByteArray(stdin));
        stdout.print(formatter.format(source));
        return SUCCESS;
      } catch (IOException | ParseException | MalformedNodeException | VerifyException e) {
        logger.atSevere().withCause(e).log("Failed to format <stdin>");
        return FAILURE;
      }
    }

    int exitCode = SUCCESS;
    for (String file : config.getFiles()) {
      Path path = Paths.get(file);
      String source;
      String formatted;
      try {
        source = decode(Files.readAllBytes(path));
        formatted = formatter.format(source);
      } catch (IOException | ParseException | MalformedNodeException | VerifyException e) {
        logger.atSevere().withCause(e).log("Failed to format %s; leaving it untouched", path);
        exitCode = FAILURE;
        continue;
      }

      boolean changed = !formatted.equals(source);
      if (config.getCheck()) {
        if (changed) {
          stdout.println(path);
          exitCode = Math.max(exitCode, UNFORMATTED);
        }
      } else if (config.getWrite()) {
        if (changed) {
          try {
            Files.write(path, formatted.getBytes(UTF_8));
            logger.atInfo().log("Formatted %s", path);
          } catch (IOException e) {
            logger.atSevere().withCause(e).log("Failed to write %s", path);
            exitCode = FAILURE;
          }
        }
      } else {
        stdout.print(formatted);
      }
    }
    return exitCode;
  }

  /** Decodes {@code bytes} as UTF-8, failing on malformed input instead of replacing it. */
  private static String decode(byte[] bytes) throws CharacterCodingException {
    return UTF_8
        .newDecoder()
        .onMalformedInput(CodingErrorAction.REPORT)
        .onUnmappableCharacter(CodingErrorAction.REPORT)
        .decode(ByteBuffer.wrap(bytes))
        .toString();
  }

  /** Command line of the {@code noirfmt} binary. */
  public static class StandaloneConfig extends FormatterConfig {
    @Parameter(description = "<files to format>")
    private List<String> files = new ArrayList<>();

    @Parameter(
        names = "--check",
        description = "List files whose formatting would change and exit 1 if there are any")
    private boolean check;

    @Parameter(names = "--write", description = "Rewrite files in place instead of printing them")
    private boolean write;

    public StandaloneConfig() {
      super("noirfmt");
    }

    public final List<String> getFiles() {
      return files;
    }

    public final boolean getCheck() {
      return check;
    }

    public final boolean getWrite() {
      return write;
    }
  }
}
