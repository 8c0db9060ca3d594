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

import com.google.pysymphony.ast.Node;
import com.google.pysymphony.parsing.Parser;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class NodeUtilTest {

  private static Node statement(String... lines) {
    return Parser.parse("test.py", ProjectFixture.lines(lines)).getFirstChild();
  }

  @Test
  public void testMainGuard() {
    assertThat(NodeUtil.isMainGuard(statement("if __name__ == '__main__':", "    run()")))
        .isTrue();
    assertThat(NodeUtil.isMainGuard(statement("if \"__main__\" == __name__:", "    run()")))
        .isTrue();
    assertThat(NodeUtil.isMainGuard(statement("if __name__ != '__main__':", "    run()")))
        .isFalse();
    assertThat(NodeUtil.isMainGuard(statement("if debug:", "    run()"))).isFalse();
  }

  @Test
  public void testFallbackImportBlock() {
    assertThat(
            NodeUtil.isFallbackImportBlock(
                statement("try:", "    import ujson", "except ImportError:", "    ujson = None")))
        .isTrue();
    assertThat(
            NodeUtil.isFallbackImportBlock(
                statement(
                    "try:",
                    "    import ujson",
                    "except (ValueError, ModuleNotFoundError):",
                    "    ujson = None")))
        .isTrue();
    assertThat(
            NodeUtil.isFallbackImportBlock(
                statement("try:", "    run()", "except ValueError:", "    pass")))
        .isFalse();
  }

  @Test
  public void testImportAssignment() {
    Node built = NodeUtil.newImportAssignment("os__mod", "os.path");
    assertThat(NodeUtil.isImportAssignment(built)).isTrue();
    assertThat(NodeUtil.isDefinitionStatement(built)).isFalse();
    assertThat(CodePrinter.printExpression(built.getLastChild()))
        .isEqualTo("__import__('os.path')");

    assertThat(NodeUtil.isImportAssignment(statement("m = __import__('json')"))).isTrue();
    assertThat(NodeUtil.isImportAssignment(statement("m = load('json')"))).isFalse();
  }

  @Test
  public void testDefinitionStatements() {
    assertThat(NodeUtil.isDefinitionStatement(statement("def f():", "    pass"))).isTrue();
    assertThat(NodeUtil.isDefinitionStatement(statement("class C:", "    pass"))).isTrue();
    assertThat(NodeUtil.isDefinitionStatement(statement("a, (b, *c) = values"))).isTrue();
    assertThat(NodeUtil.isDefinitionStatement(statement("limit: int = 3"))).isTrue();
    assertThat(NodeUtil.isDefinitionStatement(statement("limit: int"))).isFalse();
    assertThat(NodeUtil.isDefinitionStatement(statement("obj.attr = 1"))).isFalse();
    assertThat(NodeUtil.isDefinitionStatement(statement("items[0] = 1"))).isFalse();
    assertThat(NodeUtil.isDefinitionStatement(statement("total += 1"))).isFalse();
  }

  @Test
  public void testInitStatements() {
    Node module =
        Parser.parse(
            "test.py",
            ProjectFixture.lines(
                "\"\"\"Doc.\"\"\"",
                "import os",
                "x = 1",
                "print(x)",
                "if __name__ == '__main__':",
                "    print(2)"));
    Node docstring = module.getChildAtIndex(0);
    assertThat(NodeUtil.getDocstring(module)).isSameInstanceAs(docstring);
    assertThat(NodeUtil.isInitStatement(docstring, false)).isFalse();
    assertThat(NodeUtil.isInitStatement(module.getChildAtIndex(1), false)).isFalse();
    assertThat(NodeUtil.isInitStatement(module.getChildAtIndex(2), false)).isFalse();
    assertThat(NodeUtil.isInitStatement(module.getChildAtIndex(3), false)).isTrue();
    assertThat(NodeUtil.isInitStatement(module.getChildAtIndex(4), false)).isFalse();
    assertThat(NodeUtil.isInitStatement(module.getChildAtIndex(4), true)).isTrue();
  }

  @Test
  public void testFutureImport() {
    assertThat(NodeUtil.isFutureImport(statement("from __future__ import annotations")))
        .isTrue();
    assertThat(NodeUtil.isFutureImport(statement("from .__future__ import x"))).isFalse();
    assertThat(NodeUtil.isFutureImport(statement("import __future__"))).isFalse();
  }
}
