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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.util.Comparator;
import java.util.Set;
import java.util.TreeSet;

/**
 * Collects diagnostics in a stable order and hands them to report generators at the end of a run.
 *
 * <p>Errors come before warnings. Within a level, diagnostics are ordered by file, position and
 * description. A diagnostic reported twice at the same level and position is kept once.
 */
public class SortingErrorManager implements ErrorManager {

  /** A diagnostic with the level it was reported at. */
  public record Reported(PyError error, CheckLevel level) {}

  private static final Comparator<Reported> ORDER =
      Comparator.comparing(Reported::level)
          .thenComparing(r -> r.error().sourceName(), Comparator.nullsFirst(String::compareTo))
          .thenComparingInt(r -> r.error().lineno())
          .thenComparingInt(r -> r.error().charno())
          .thenComparing(r -> r.error().description());

  private final TreeSet<Reported> diagnostics = new TreeSet<>(ORDER);
  private final ImmutableSet<ErrorReportGenerator> generators;

  public SortingErrorManager(Set<ErrorReportGenerator> generators) {
    this.generators = ImmutableSet.copyOf(generators);
  }

  @Override
  public void report(CheckLevel level, PyError error) {
    if (level.isOn()) {
      diagnostics.add(new Reported(error, level));
    }
  }

  @Override
  public int getErrorCount() {
    return collect(CheckLevel.ERROR).size();
  }

  @Override
  public int getWarningCount() {
    return collect(CheckLevel.WARNING).size();
  }

  @Override
  public ImmutableList<PyError> getErrors() {
    return collect(CheckLevel.ERROR);
  }

  @Override
  public ImmutableList<PyError> getWarnings() {
    return collect(CheckLevel.WARNING);
  }

  /** Everything reported so far, errors first. */
  public ImmutableList<Reported> getDiagnostics() {
    return ImmutableList.copyOf(diagnostics);
  }

  private ImmutableList<PyError> collect(CheckLevel level) {
    return diagnostics.stream()
        .filter(r -> r.level() == level)
        .map(Reported::error)
        .collect(ImmutableList.toImmutableList());
  }

  @Override
  public void generateReport() {
    for (ErrorReportGenerator generator : generators) {
      generator.generateReport(this);
    }
  }

  /** Writes the collected diagnostics somewhere. */
  public interface ErrorReportGenerator {
    void generateReport(SortingErrorManager manager);
  }
}
