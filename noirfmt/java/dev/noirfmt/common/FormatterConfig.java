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

package dev.noirfmt.common;

import static com.google.common.base.Preconditions.checkArgument;

import com.beust.jcommander.JCommander;
import com.beust.jcommander.Parameter;
import com.beust.jcommander.Parameters;

/** Layout settings shared by every formatting pass, settable from code or the command line. */
@Parameters(separators = "=")
public class FormatterConfig {
  public static final int DEFAULT_MAX_WIDTH = 100;
  public static final int DEFAULT_TAB_SPACES = 4;

  @Parameter(
      names = {"--help", "-h"},
      description = "Help requested",
      help = true)
  private boolean help;

  @Parameter(
      names = "--verbose",
      description = "Determines whether the formatter should emit verbose logging messages.")
  private boolean verboseLogging;

  @Parameter(
      names = "--max_width",
      description = "Maximum width of a formatted line, indentation included.")
  private int maxWidth = DEFAULT_MAX_WIDTH;

  @Parameter(names = "--tab_spaces", description = "Number of spaces per indentation level.")
  private int tabSpaces = DEFAULT_TAB_SPACES;

  private final JCommander jc;

  public FormatterConfig() {
    this("noirfmt");
  }

  public FormatterConfig(String programName) {
    jc = new JCommander(this);
    jc.setProgramName(programName);
  }

  /**
   * Parses the given command-line arguments, setting each known flag. If --help is requested, the
   * binary's usage message will be printed and the program will exit with non-zero code.
   */
  public final void parseCommandLine(String[] args) {
    jc.parse(args);
    if (getHelp()) {
      showHelpAndExit();
    }
    validate();
  }

  /** Print the binary's usage message, and exit with a non-zero code. */
  public void showHelpAndExit() {
    jc.usage();
    System.exit(1);
  }

  /** Checks the settings that cannot be expressed as flag types. */
  public void validate() {
    checkArgument(maxWidth > 0, "--max_width must be positive: %s", maxWidth);
    checkArgument(tabSpaces > 0, "--tab_spaces must be positive: %s", tabSpaces);
  }

  public final boolean getHelp() {
    return help;
  }

  public final boolean getVerboseLogging() {
    return verboseLogging;
  }

  public final int getMaxWidth() {
    return maxWidth;
  }

  public final int getTabSpaces() {
    return tabSpaces;
  }

  public FormatterConfig setVerboseLogging(boolean verboseLogging) {
    this.verboseLogging = verboseLogging;
    return this;
  }

  public FormatterConfig setMaxWidth(int maxWidth) {
    checkArgument(maxWidth > 0, "max width must be positive: %s", maxWidth);
    this.maxWidth = maxWidth;
    return this;
  }

  public FormatterConfig setTabSpaces(int tabSpaces) {
    checkArgument(tabSpaces > 0, "tab spaces must be positive: %s", tabSpaces);
    this.tabSpaces = tabSpaces;
    return this;
  }
}
