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
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class DependencyOrdererTest {
  @Rule public final TemporaryFolder folder = new TemporaryFolder();

  private ProjectFixture project;

  @Before
  public void setUp() {
    project = new ProjectFixture(folder);
  }

  private ImmutableList<String> order(String entry) throws Exception {
    MergeContext context = project.analyze(entry);
    ImmutableList<Symbol> order =
        new DependencyOrderer(context).order(new SymbolClosure(context).computeFromEntry());
    ImmutableList.Builder<String> names = ImmutableList.builder();
    for (Symbol symbol : order) {
      names.add(symbol.getQualifiedName());
    }
    return names.build();
  }

  @Test
  public void testDeclarationOrderWithoutDependencies() throws Exception {
    project.write("main.py", "def b():", "    pass", "def a():", "    pass", "a()", "b()");

    assertThat(order("main.py")).containsExactly("main.b", "main.a").inOrder();
  }

  @Test
  public void testDependenciesComeFirst() throws Exception {
    project.write(
        "main.py",
        "def report():",
        "    return format_total(TOTAL)",
        "def format_total(n):",
        "    return str(n)",
        "TOTAL = compute()",
        "def compute():",
        "    return 1",
        "report()");

    assertThat(order("main.py"))
        .containsExactly("main.format_total", "main.compute", "main.TOTAL", "main.report")
        .inOrder();
  }

  @Test
  public void testImportedDefinitionsPrecedeTheirUsers() throws Exception {
    project.write("base.py", "class Base:", "    pass");
    project.write(
        "derived.py", "from base import Base", "class Derived(Base):", "    pass");
    project.write("main.py", "from derived import Derived", "Derived()");

    assertThat(order("main.py")).containsExactly("base.Base", "derived.Derived").inOrder();
  }

  @Test
  public void testMethodDependenciesPrecedeTheirClass() throws Exception {
    project.write(
        "main.py",
        "class Greeter:",
        "    def greet(self):",
        "        return template()",
        "def template():",
        "    return 'hi'",
        "Greeter().greet()");

    ImmutableList<String> order = order("main.py");
    assertThat(order)
        .containsExactly("main.template", "main.Greeter", "main.Greeter.greet")
        .inOrder();
  }

  @Test
  public void testMutualRecursionIsACycle() throws Exception {
    project.write(
        "main.py",
        "def is_even(n):",
        "    return True if n == 0 else is_odd(n - 1)",
        "def is_odd(n):",
        "    return False if n == 0 else is_even(n - 1)",
        "print(is_even(4))");

    CircularDependencyException e =
        assertThrows(CircularDependencyException.class, () -> order("main.py"));
    assertThat(e.getCycles()).containsExactly(ImmutableList.of("main.is_even", "main.is_odd"));
    assertThat(e.getMessage()).contains("main.is_even -> main.is_odd");
  }

  @Test
  public void testCycleAcrossModules() throws Exception {
    project.write("a.py", "from b import g", "def f():", "    return g()");
    project.write("b.py", "from a import f", "def g():", "    return f()");
    project.write("main.py", "from a import f", "f()");

    CircularDependencyException e =
        assertThrows(CircularDependencyException.class, () -> order("main.py"));
    assertThat(e.getCycles()).containsExactly(ImmutableList.of("a.f", "b.g"));
  }

  @Test
  public void testSelfRecursionIsAllowed() throws Exception {
    project.write(
        "main.py",
        "def fact(n):",
        "    return 1 if n <= 1 else n * fact(n - 1)",
        "print(fact(5))");

    assertThat(order("main.py")).containsExactly("main.fact");
  }
}
