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
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class SymbolClosureTest {
  @Rule public final TemporaryFolder folder = new TemporaryFolder();

  private ProjectFixture project;

  @Before
  public void setUp() {
    project = new ProjectFixture(folder);
  }

  private static ImmutableList<String> names(ImmutableSet<Symbol> symbols) {
    ImmutableList.Builder<String> names = ImmutableList.builder();
    for (Symbol symbol : symbols) {
      names.add(symbol.getQualifiedName());
    }
    return names.build();
  }

  @Test
  public void testKeepsOnlyReachableDefinitions() throws Exception {
    project.write(
        "utils.py",
        "def used():",
        "    return helper()",
        "def helper():",
        "    return 1",
        "def unused():",
        "    return helper()");
    project.write("other.py", "def never():", "    return 0");
    project.write("main.py", "from utils import used", "print(used())");

    ImmutableSet<Symbol> closure = new SymbolClosure(project.analyze("main.py")).computeFromEntry();

    assertThat(names(closure)).containsAtLeast("main.used", "utils.used", "utils.helper");
    assertThat(names(closure)).containsAtLeast("main.<init>", "utils.<init>");
    assertThat(names(closure)).doesNotContain("utils.unused");
    assertThat(names(closure)).doesNotContain("other.never");
  }

  @Test
  public void testClassKeepsAllMethods() throws Exception {
    project.write(
        "shapes.py",
        "def area(w, h):",
        "    return w * h",
        "class Rect:",
        "    def area(self):",
        "        return area(self.w, self.h)",
        "    def unused_method(self):",
        "        return 0");
    project.write("main.py", "from shapes import Rect", "Rect()");

    ImmutableSet<Symbol> closure = new SymbolClosure(project.analyze("main.py")).computeFromEntry();

    assertThat(names(closure))
        .containsAtLeast(
            "shapes.Rect", "shapes.Rect.area", "shapes.Rect.unused_method", "shapes.area");
  }

  @Test
  public void testImportedPackageInitializationIsKept() throws Exception {
    project.write("pkg/__init__.py", "print('loading pkg')");
    project.write("pkg/mod.py", "def f():", "    return 1");
    project.write("main.py", "from pkg.mod import f", "f()");

    ImmutableSet<Symbol> closure = new SymbolClosure(project.analyze("main.py")).computeFromEntry();

    assertThat(names(closure)).containsAtLeast("pkg.<init>", "pkg.mod.<init>", "pkg.mod.f");
  }

  @Test
  public void testFallbackArmsAreKeptTogether() throws Exception {
    project.write(
        "compat.py",
        "try:",
        "    from fast import dumps, loads",
        "except ImportError:",
        "    from slow import dumps");
    project.write(
        "fast.py", "def dumps(x):", "    return x", "def loads(x):", "    return x");
    project.write("slow.py", "def dumps(x):", "    return x");
    project.write("main.py", "from compat import dumps", "dumps(1)");

    ImmutableSet<Symbol> closure = new SymbolClosure(project.analyze("main.py")).computeFromEntry();

    assertThat(names(closure))
        .containsAtLeast("compat.dumps", "compat.loads", "fast.dumps", "fast.loads", "slow.dumps");
  }

  @Test
  public void testUnusedFallbackBlockIsNotExpanded() throws Exception {
    project.write(
        "compat.py",
        "try:",
        "    from fast import dumps",
        "except ImportError:",
        "    from slow import dumps",
        "def other():",
        "    return 0");
    project.write("fast.py", "def dumps(x):", "    return x");
    project.write("slow.py", "def dumps(x):", "    return x");
    project.write("main.py", "from compat import other", "print(other())");

    ImmutableSet<Symbol> closure = new SymbolClosure(project.analyze("main.py")).computeFromEntry();

    assertThat(names(closure)).contains("compat.other");
    assertThat(names(closure)).containsNoneOf("compat.dumps", "fast.dumps", "slow.dumps");
  }
}
