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
import com.google.common.collect.ImmutableMap;
import com.google.pysymphony.ast.Node;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class NameResolverTest {
  @Rule public final TemporaryFolder folder = new TemporaryFolder();

  private ProjectFixture project;
  private MergeContext context;

  @Before
  public void setUp() {
    project = new ProjectFixture(folder);
  }

  /** Resolves names for every top-level statement of every loaded module. */
  private NameMapping resolve(String entry) throws Exception {
    context = project.analyze(entry);
    ImmutableMap.Builder<Node, ModuleRecord> statements = ImmutableMap.builder();
    for (ModuleRecord module : context.getModules()) {
      for (Node statement : module.getRoot().children()) {
        statements.put(statement, module);
      }
    }
    return new NameResolver(context, statements.buildOrThrow(), ImmutableList.of())
        .resolve();
  }

  private Symbol slot(String module, String name) {
    return context.getModule(module).getScope().getSlot(name);
  }

  @Test
  public void testModuleKey() {
    assertThat(NameResolver.moduleKey("utils")).isEqualTo("utils");
    assertThat(NameResolver.moduleKey("pkg.sub")).isEqualTo("pkg_sub");
    assertThat(NameResolver.moduleKey("my-pkg.v2")).isEqualTo("my_pkg_v2");
    assertThat(NameResolver.moduleKey("")).isEqualTo("root");
  }

  @Test
  public void testUniqueNamesAreKept() throws Exception {
    project.write("utils.py", "def helper():", "    return 1");
    project.write("main.py", "from utils import helper", "total = helper()");

    NameMapping mapping = resolve("main.py");

    assertThat(mapping.getName(slot("utils", "helper"))).isEqualTo("helper");
    assertThat(mapping.getName(slot("main", "total"))).isEqualTo("total");
    assertThat(mapping.asMap()).doesNotContainKey(slot("main", "helper"));
  }

  @Test
  public void testImportSuffixesNeverMatchProjectNames() throws Exception {
    project.write(
        "helper.py",
        "import os",
        "try:",
        "    import ujson as json",
        "except ImportError:",
        "    import json",
        "",
        "def dump(value):",
        "    return json.dumps(value) + os.sep");
    project.write(
        "main.py",
        "from helper import dump",
        "json__rt = 1",
        "os__mod = 2",
        "print(dump(json__rt + os__mod))");

    NameMapping mapping = resolve("main.py");

    assertThat(mapping.getName(slot("helper", "json"))).isEqualTo("helper_json__rt");
    assertThat(mapping.getName(slot("helper", "os"))).isEqualTo("helper_os__mod");
    assertThat(mapping.getName(slot("main", "json__rt"))).isEqualTo("main_json__rt");
    assertThat(mapping.getName(slot("main", "os__mod"))).isEqualTo("main_os__mod");
    assertThat(mapping.getName(slot("helper", "dump"))).isEqualTo("dump");
  }

  @Test
  public void testTakenQualifiedNameGetsNumericSuffix() throws Exception {
    project.write("a.py", "def process():", "    return 'A'");
    project.write("b.py", "def process():", "    return 'B'");
    project.write(
        "main.py",
        "import a",
        "import b",
        "a_process = 0",
        "print(a.process(), b.process(), a_process)");

    NameMapping mapping = resolve("main.py");

    assertThat(mapping.getName(slot("main", "a_process"))).isEqualTo("a_process");
    assertThat(mapping.getName(slot("a", "process"))).isEqualTo("a_process_2");
    assertThat(mapping.getName(slot("b", "process"))).isEqualTo("b_process");
  }

  @Test
  public void testNameShadowedByLocalIsQualifiedFurther() throws Exception {
    project.write("a.py", "def process():", "    return 1");
    project.write("b.py", "def process():", "    return 2");
    project.write(
        "main.py",
        "import a",
        "import b",
        "",
        "def run():",
        "    a_process = 10",
        "    return a.process() + b.process() + a_process",
        "",
        "print(run())");

    NameMapping mapping = resolve("main.py");

    assertThat(mapping.getName(slot("a", "process"))).isEqualTo("a_process_2");
    assertThat(mapping.getName(slot("b", "process"))).isEqualTo("b_process");
    assertThat(mapping.getName(slot("main", "run"))).isEqualTo("run");
  }

  @Test
  public void testLocalShadowingUnrelatedNameChangesNothing() throws Exception {
    project.write("utils.py", "def helper():", "    return 1");
    project.write(
        "main.py",
        "from utils import helper",
        "",
        "def run():",
        "    total = 2",
        "    return helper() + total",
        "",
        "total = run()");

    NameMapping mapping = resolve("main.py");

    assertThat(mapping.getName(slot("utils", "helper"))).isEqualTo("helper");
    assertThat(mapping.getName(slot("main", "total"))).isEqualTo("total");
  }
}
