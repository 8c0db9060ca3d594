/*
 * Copyright 2026 The PySymphony Authors.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.google.pysymphony;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ImmutableSet;
import com.google.pysymphony.audit.AuditResult;
import com.google.pysymphony.audit.Auditor;
import com.google.pysymphony.linker.CheckLevel;
import com.google.pysymphony.linker.DiagnosticType;
import com.google.pysymphony.linker.ErrorManager;
import com.google.pysymphony.linker.JsonErrorReportGenerator;
import com.google.pysymphony.linker.MergeException;
import com.google.pysymphony.linker.MergeOptions;
import com.google.pysymphony.linker.PyError;
import com.google.pysymphony.linker.PyMerger;
import com.google.pysymphony.linker.SortingErrorManager;
import com.google.pysymphony.linker.TextErrorReportGenerator;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.jspecify.annotations.Nullable;
import org.kohsuke.args4j.Argument;
import org.kohsuke.args4j.CmdLineException;
import org.kohsuke.args4j.CmdLineParser;
import org.kohsuke.args4j.Option;
import org.kohsuke.args4j.OptionDef;
import org.kohsuke.args4j.spi.OptionHandler;
import org.kohsuke.args4j.spi.Parameters;
import org.kohsuke.args4j.spi.Setter;

/**
 * Command line entry point: {@code pysymphony [flags] ENTRY_SCRIPT PROJECT_ROOT}.
 *
 * <p>Merges the entry script and writes the result next to it as {@code <entry>_merged.py}
 * unless {@code --output} names another file, then audits the written program. The exit status
 * is 0 when a program was written and 1 otherwise; audit findings are reported but do not change
 * it.
 */
public final class CommandLineRunner {

  private static final Logger logger = Logger.getLogger(CommandLineRunner.class.getName());

  // Held so that the configured level is not lost when the logger is collected.
  private static final Logger rootLogger = Logger.getLogger("com.google.pysymphony");

  /** How diagnostics are printed. */
  public enum ErrorFormat {
    TEXT,
    JSON
  }

  private static class Flags {
    @Option(
        name = "--help",
        handler = BooleanOptionHandler.class,
        usage = "Displays this message on stdout and exit")
    private boolean displayHelp = false;

    @Option(
        name = "--output",
        usage = "The file the merged program is written to. Defaults to <entry>_merged.py next to"
            + " the entry script")
    private String output = "";

    @Option(
        name = "--verify",
        handler = BooleanOptionHandler.class,
        usage = "Audits the merged program after writing it")
    private boolean verify = true;

    @Option(
        name = "--emit_source_comments",
        handler = BooleanOptionHandler.class,
        usage = "Precedes every definition with a comment naming the file it comes from")
    private boolean emitSourceComments = true;

    @Option(
        name = "--error_format",
        usage = "Specifies the format for diagnostics: TEXT or JSON")
    private ErrorFormat errorFormat = ErrorFormat.TEXT;

    @Option(
        name = "--logging_level",
        usage = "The logging level (standard java.util.logging.Level values) for merge progress."
            + " Does not control diagnostics about the merged code")
    private String loggingLevel = Level.WARNING.getName();

    @Option(
        name = "--diag_error",
        usage = "Reports the diagnostic with the given key as an error. May be repeated")
    private List<String> diagError = new ArrayList<>();

    @Option(
        name = "--diag_warning",
        usage = "Reports the diagnostic with the given key as a warning. May be repeated")
    private List<String> diagWarning = new ArrayList<>();

    @Option(
        name = "--diag_off",
        usage = "Turns off the diagnostic with the given key. May be repeated")
    private List<String> diagOff = new ArrayList<>();

    @Argument(metaVar = "ENTRY_SCRIPT PROJECT_ROOT")
    private List<String> arguments = new ArrayList<>();

    private final CmdLineParser parser;

    Flags() {
      parser = new CmdLineParser(this);
    }

    private void parse(String[] args) throws CmdLineException {
      parser.parseArgument(args);
      if (!displayHelp && arguments.size() != 2) {
        throw new CmdLineException(
            parser,
            "Expected ENTRY_SCRIPT and PROJECT_ROOT, got " + arguments.size() + " arguments");
      }
    }

    private void printUsage(PrintStream ps) {
      ps.println("Usage: pysymphony [flags] ENTRY_SCRIPT PROJECT_ROOT");
      parser.printUsage(ps);
    }
  }

  /**
   * A boolean flag that may be followed by an explicit value, as in {@code --verify false}. A
   * bare flag, or one followed by anything else, means true.
   */
  public static class BooleanOptionHandler extends OptionHandler<Boolean> {
    private static final ImmutableSet<String> TRUES = ImmutableSet.of("true", "on", "yes", "1");
    private static final ImmutableSet<String> FALSES =
        ImmutableSet.of("false", "off", "no", "0");

    public BooleanOptionHandler(
        CmdLineParser parser, OptionDef option, Setter<? super Boolean> setter) {
      super(parser, option, setter);
    }

    @Override
    public int parseArguments(Parameters params) throws CmdLineException {
      if (params.size() == 0) {
        setter.addValue(true);
        return 0;
      }
      String value = params.getParameter(0).toLowerCase(Locale.ROOT);
      if (TRUES.contains(value)) {
        setter.addValue(true);
      } else if (FALSES.contains(value)) {
        setter.addValue(false);
      } else {
        setter.addValue(true);
        return 0;
      }
      return 1;
    }

    @Override
    public @Nullable String getDefaultMetaVariable() {
      return null;
    }
  }

  private final Flags flags = new Flags();
  private final PrintStream out;
  private final PrintStream err;
  private final boolean flagsValid;
  private @Nullable Path writtenOutput;

  @VisibleForTesting
  CommandLineRunner(String[] args, PrintStream out, PrintStream err) {
    this.out = out;
    this.err = err;
    boolean valid;
    try {
      flags.parse(args);
      valid = true;
    } catch (CmdLineException e) {
      err.println(e.getMessage());
      flags.printUsage(err);
      valid = false;
    }
    this.flagsValid = valid;
  }

  /** Runs the merge and returns the process exit status. */
  public int run() {
    if (!flagsValid) {
      return 1;
    }
    if (flags.displayHelp) {
      flags.printUsage(out);
      return 0;
    }
    try {
      rootLogger.setLevel(Level.parse(flags.loggingLevel));
    } catch (IllegalArgumentException e) {
      err.println("Bad value for --logging_level: " + flags.loggingLevel);
      return 1;
    }

    MergeOptions options = new MergeOptions();
    if (!setDiagnosticLevels(options, flags.diagError, CheckLevel.ERROR)
        || !setDiagnosticLevels(options, flags.diagWarning, CheckLevel.WARNING)
        || !setDiagnosticLevels(options, flags.diagOff, CheckLevel.OFF)) {
      return 1;
    }

    ErrorManager errorManager = createErrorManager();
    options.setEmitSourceComments(flags.emitSourceComments);
    PyMerger merger = new PyMerger(options, errorManager);

    Path entry = Paths.get(flags.arguments.get(0));
    Path root = Paths.get(flags.arguments.get(1));
    Path output = flags.output.isEmpty() ? defaultOutput(entry) : Paths.get(flags.output);
    int status = 0;
    try {
      String merged = merger.merge(entry, root);
      Files.writeString(output, merged, StandardCharsets.UTF_8);
      writtenOutput = output;
      logger.info(() -> "Wrote " + output);
      if (flags.verify) {
        AuditResult result = new Auditor().audit(output.toString(), merged);
        for (PyError diagnostic : result.diagnostics()) {
          CheckLevel level = options.getWarningLevel(diagnostic.type());
          errorManager.report(level != null ? level : CheckLevel.WARNING, diagnostic);
        }
      }
    } catch (MergeException e) {
      errorManager.report(CheckLevel.ERROR, e.getError());
      status = 1;
    } catch (IOException e) {
      err.println("ERROR - " + e);
      status = 1;
    }
    errorManager.generateReport();
    return status;
  }

  /** The file the last successful run wrote, or null. */
  @VisibleForTesting
  @Nullable Path getWrittenOutput() {
    return writtenOutput;
  }

  /** Applies {@code level} to each key, or prints the first unknown key and returns false. */
  private boolean setDiagnosticLevels(MergeOptions options, List<String> keys, CheckLevel level) {
    for (String key : keys) {
      DiagnosticType type = KnownDiagnostics.forKey(key);
      if (type == null) {
        err.println("Unknown diagnostic: " + key);
        err.println("Known diagnostics: " + String.join(", ", KnownDiagnostics.keys()));
        return false;
      }
      options.setWarningLevel(type, level);
    }
    return true;
  }

  static Path defaultOutput(Path entry) {
    String fileName = entry.getFileName().toString();
    String stem =
        fileName.endsWith(".py") ? fileName.substring(0, fileName.length() - 3) : fileName;
    Path parent = entry.toAbsolutePath().getParent();
    return parent.resolve(stem + "_merged.py");
  }

  private ErrorManager createErrorManager() {
    switch (flags.errorFormat) {
      case JSON:
        return new SortingErrorManager(ImmutableSet.of(new JsonErrorReportGenerator(err)));
      case TEXT:
      default:
        return TextErrorReportGenerator.forStream(err).newErrorManager();
    }
  }

  public static void main(String[] args) {
    CommandLineRunner runner = new CommandLineRunner(args, System.out, System.err);
    System.exit(runner.run());
  }
}
