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

import static com.google.common.truth.Truth.assertThat;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.pysymphony.linker.SortingErrorManager.ErrorReportGenerator;
import com.google.pysymphony.linker.SortingErrorManager.Reported;
import java.util.ArrayList;
import java.util.List;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class SortingErrorManagerTest {
  private final SortingErrorManager manager = new SortingErrorManager(ImmutableSet.of());

  private static PyError duplicate(String file, int line) {
    return PyError.make(file, line, 0, ScopeBuilder.DUPLICATE_SYMBOL, "f", "m");
  }

  @Test
  public void testErrorsComeFirstThenPositionOrder() {
    PyError late = duplicate("b.py", 3);
    PyError wildcard = PyError.make("b.py", 5, 0, ModuleLoader.WILDCARD_IMPORT, "utils");
    PyError early = duplicate("a.py", 7);
    PyError unplaced = PyError.make(ScopeBuilder.DUPLICATE_SYMBOL, "g", "m");

    manager.report(CheckLevel.WARNING, late);
    manager.report(CheckLevel.ERROR, wildcard);
    manager.report(CheckLevel.WARNING, early);
    manager.report(CheckLevel.WARNING, unplaced);

    List<PyError> order = new ArrayList<>();
    for (Reported reported : manager.getDiagnostics()) {
      order.add(reported.error());
    }
    assertThat(order).containsExactly(wildcard, unplaced, early, late).inOrder();
    assertThat(manager.getErrors()).containsExactly(wildcard);
    assertThat(manager.getWarnings()).containsExactly(unplaced, early, late).inOrder();
  }

  @Test
  public void testSameDiagnosticIsCountedOnce() {
    manager.report(CheckLevel.WARNING, duplicate("a.py", 2));
    manager.report(CheckLevel.WARNING, duplicate("a.py", 2));

    assertThat(manager.getWarningCount()).isEqualTo(1);
    assertThat(manager.getErrorCount()).isEqualTo(0);
  }

  @Test
  public void testLevelIsTheReportedOne() {
    manager.report(CheckLevel.ERROR, duplicate("a.py", 2));
    manager.report(CheckLevel.OFF, duplicate("a.py", 4));

    assertThat(manager.getErrorCount()).isEqualTo(1);
    assertThat(manager.getWarningCount()).isEqualTo(0);
    assertThat(manager.getDiagnostics()).hasSize(1);
  }

  @Test
  public void testGeneratorsSeeEverything() {
    List<Integer> seen = new ArrayList<>();
    ErrorReportGenerator generator = m -> seen.add(m.getDiagnostics().size());
    SortingErrorManager reporting = new SortingErrorManager(ImmutableSet.of(generator));
    reporting.report(CheckLevel.WARNING, duplicate("a.py", 2));
    reporting.report(CheckLevel.ERROR, duplicate("a.py", 3));

    reporting.generateReport();

    assertThat(seen).isEqualTo(ImmutableList.of(2));
  }
}
