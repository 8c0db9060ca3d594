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

package com.google.pysymphony.audit;

import static com.google.common.truth.Truth.assertThat;

import com.google.common.base.Joiner;
import com.google.pysymphony.linker.PyError;
import com.google.pysymphony.linker.ScopeBuilder;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class AuditorTest {

  private final Auditor auditor = new Auditor();

  private static String lines(String... lines) {
    return Joiner.on('\n').join(lines) + "\n";
  }

  @Test
  public void testCleanProgram() {
    AuditResult result =
        auditor.audit(
            lines(
                "import os as os__mod",
                "",
                "def helper(values):",
                "    return [v * 2 for v in values if v]",
                "",
                "class Box:",
                "    size = 1",
                "    def grow(self):",
                "        return helper([self.size])",
                "",
                "if __name__ == '__main__':",
                "    print(Box().grow(), os__mod.sep, len([]))"));

    assertThat(result.ok()).isTrue();
    assertThat(result.diagnostics()).isEmpty();
  }

  @Test
  public void testUndefinedReference() {
    AuditResult result =
        auditor.audit(lines("def f():", "    return missing()", "", "print(f(), other)"));

    assertThat(result.ok()).isFalse();
    assertThat(result.diagnostics()).hasSize(2);
    PyError first = result.diagnostics().get(0);
    assertThat(first.type()).isEqualTo(Auditor.UNDEFINED_REFERENCE);
    assertThat(first.description()).isEqualTo("missing is not defined");
    assertThat(first.sourceName()).isEqualTo("<merged>");
    assertThat(first.lineno()).isEqualTo(2);
    assertThat(result.diagnostics().get(1).description()).isEqualTo("other is not defined");
  }

  @Test
  public void testDuplicateTopLevelDefinition() {
    AuditResult result =
        auditor.audit(lines("def process():", "    return 1", "def process():", "    return 2"));

    assertThat(result.diagnostics()).hasSize(1);
    assertThat(result.diagnostics().get(0).type()).isEqualTo(ScopeBuilder.DUPLICATE_SYMBOL);
    assertThat(result.diagnostics().get(0).lineno()).isEqualTo(3);
  }

  @Test
  public void testTopLevelImportRebindingName() {
    AuditResult result =
        auditor.audit(
            lines(
                "import json",
                "def loads(text):",
                "    return json.loads(text)",
                "from pickle import loads",
                "print(loads)"));

    assertThat(result.ok()).isFalse();
    assertThat(result.diagnostics()).hasSize(1);
    PyError error = result.diagnostics().get(0);
    assertThat(error.type()).isEqualTo(Auditor.DUPLICATE_IMPORT);
    assertThat(error.lineno()).isEqualTo(4);
    assertThat(error.description())
        .isEqualTo("Top-level import rebinds loads, already bound on line 2");
  }

  @Test
  public void testRepeatedImportIsReported() {
    AuditResult result = auditor.audit(lines("import os", "import sys as os", "print(os)"));

    assertThat(result.diagnostics()).hasSize(1);
    assertThat(result.diagnostics().get(0).type()).isEqualTo(Auditor.DUPLICATE_IMPORT);
    assertThat(result.diagnostics().get(0).lineno()).isEqualTo(2);
  }

  @Test
  public void testImportsOfFallbackNamesAreNotReported() {
    AuditResult result =
        auditor.audit(
            lines(
                "try:",
                "    import simplejson as json",
                "except ImportError:",
                "    json = None",
                "import json",
                "print(json)"));

    assertThat(result.ok()).isTrue();
  }

  @Test
  public void testMultipleMainGuards() {
    AuditResult result =
        auditor.audit(
            lines(
                "if __name__ == '__main__':",
                "    print(1)",
                "if '__main__' == __name__:",
                "    print(2)",
                "if __name__ == \"__main__\":",
                "    print(3)"));

    assertThat(result.diagnostics()).hasSize(2);
    assertThat(result.diagnostics().get(0).type()).isEqualTo(Auditor.MULTIPLE_MAIN_GUARDS);
    assertThat(result.diagnostics().get(0).lineno()).isEqualTo(3);
    assertThat(result.diagnostics().get(1).description())
        .isEqualTo("Program entry guard number 3, only one is expected");
  }

  @Test
  public void testSyntaxError() {
    AuditResult result = auditor.audit("bundle.py", "def broken(:\n    pass\n");

    assertThat(result.ok()).isFalse();
    assertThat(result.diagnostics()).hasSize(1);
    PyError error = result.diagnostics().get(0);
    assertThat(error.type()).isEqualTo(Auditor.AUDIT_SYNTAX_ERROR);
    assertThat(error.sourceName()).isEqualTo("bundle.py");
    assertThat(error.lineno()).isEqualTo(1);
  }

  @Test
  public void testDiagnosticsAreSortedByPosition() {
    AuditResult result =
        auditor.audit(lines("print(b)", "def f():", "    pass", "def f():", "    return a"));

    assertThat(result.diagnostics()).hasSize(3);
    assertThat(result.diagnostics().get(0).lineno()).isEqualTo(1);
    assertThat(result.diagnostics().get(1).type()).isEqualTo(ScopeBuilder.DUPLICATE_SYMBOL);
    assertThat(result.diagnostics().get(2).description()).isEqualTo("a is not defined");
  }
}
