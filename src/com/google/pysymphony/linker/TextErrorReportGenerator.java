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

package com.google.pysymphony.linker;

import com.google.common.collect.ImmutableSet;
import com.google.pysymphony.linker.SortingErrorManager.ErrorReportGenerator;
import com.google.pysymphony.linker.SortingErrorManager.Reported;
import java.io.PrintStream;
import java.util.function.BiConsumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Writes one line per diagnostic, in the form {@code file:line:column: LEVEL - [KEY] message},
 * followed by a count of errors and warnings. Nothing is written for a clean run.
 */
public final class TextErrorReportGenerator implements ErrorReportGenerator {
  private final BiConsumer<CheckLevel, String> sink;

  private TextErrorReportGenerator(BiConsumer<CheckLevel, String> sink) {
    this.sink = sink;
  }

  /** Prints to {@code stream}, which is not closed. */
  public static TextErrorReportGenerator forStream(PrintStream stream) {
    return new TextErrorReportGenerator((level, line) -> stream.println(line));
  }

  /** Logs errors as SEVERE and everything else as WARNING. */
  public static TextErrorReportGenerator forLogger(Logger logger) {
    return new TextErrorReportGenerator(
        (level, line) ->
            logger.log(level == CheckLevel.ERROR ? Level.SEVERE : Level.WARNING, line));
  }

  /** An error manager that reports through this generator. */
  public SortingErrorManager newErrorManager() {
    return new SortingErrorManager(ImmutableSet.of(this));
  }

  @Override
  public void generateReport(SortingErrorManager manager) {
    for (Reported reported : manager.getDiagnostics()) {
      sink.accept(reported.level(), reported.error().format(reported.level()));
    }
    int errors = manager.getErrorCount();
    int warnings = manager.getWarningCount();
    if (errors + warnings > 0) {
      sink.accept(
          errors > 0 ? CheckLevel.ERROR : CheckLevel.WARNING,
          String.format("%d error(s), %d warning(s)", errors, warnings));
    }
  }
}
