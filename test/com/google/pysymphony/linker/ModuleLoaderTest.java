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
import com.google.common.collect.ImmutableSet;
import java.nio.file.NoSuchFileException;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class ModuleLoaderTest {
  @Rule public final TemporaryFolder folder = new TemporaryFolder();

  private ProjectFixture project;

  @Before
  public void setUp() {
    project = new ProjectFixture(folder);
  }

  private ModuleLoader newLoader() {
    return new ModuleLoader(
        new MergeContext(
            project.root(), new MergeOptions(), new SortingErrorManager(ImmutableSet.of())));
  }

  private static ImmutableList<String> moduleNames(MergeContext context) {
    ImmutableList.Builder<String> names = ImmutableList.builder();
    for (ModuleRecord module : context.getModules()) {
      names.add(module.getName());
    }
    return names.build();
  }

  @Test
  public void testModuleNames() throws Exception {
    ModuleLoader loader = newLoader();
    assertThat(loader.moduleNameOf(project.path("main.py"))).isEqualTo("main");
    assertThat(loader.moduleNameOf(project.path("pkg/__init__.py"))).isEqualTo("pkg");
    assertThat(loader.moduleNameOf(project.path("pkg/sub/mod.py"))).isEqualTo("pkg.sub.mod");
    assertThat(loader.moduleNameOf(project.path("__init__.py"))).isEmpty();
  }

  @Test
  public void testResolve() throws Exception {
    project.write("pkg/__init__.py");
    project.write("pkg/core.py");
    project.write("pkg/api.py");
    project.write("tools.py");
    ModuleLoader loader = newLoader();

    assertThat(loader.resolve("core", 1, project.path("pkg/api.py")))
        .isEqualTo(project.path("pkg/core.py"));
    assertThat(loader.resolve("pkg", 0, project.path("tools.py")))
        .isEqualTo(project.path("pkg/__init__.py"));
    assertThat(loader.resolve("tools", 2, project.path("pkg/api.py")))
        .isEqualTo(project.path("tools.py"));
    assertThat(loader.resolve("json", 0, project.path("tools.py"))).isNull();
  }

  @Test
  public void testLoadsImportedModulesTransitively() throws Exception {
    project.write("pkg/__init__.py");
    project.write("pkg/core.py", "import json", "def base():", "    return 1");
    project.write("pkg/api.py", "from .core import base");
    project.write("unused.py", "x = 1");
    project.write("main.py", "import pkg.api", "import os");

    MergeContext context = project.load("main.py");

    assertThat(moduleNames(context))
        .containsExactly("pkg", "pkg.core", "pkg.api", "main")
        .inOrder();
    assertThat(context.getEntryModule().getName()).isEqualTo("main");
    assertThat(context.getModule("pkg.api").getRelativePath()).isEqualTo("pkg/api.py");
    assertThat(context.getModule("pkg").isPackage()).isTrue();
    assertThat(context.getModule("pkg.core").getPackageName()).isEqualTo("pkg");
    assertThat(context.isKnownModule("unused")).isFalse();
    assertThat(context.isKnownModule("json")).isFalse();
  }

  @Test
  public void testImportCycleLoadsEachModuleOnce() throws Exception {
    project.write("a.py", "from b import g", "def f():", "    return g()");
    project.write("b.py", "from a import f", "def g():", "    return 1");
    project.write("main.py", "from a import f");

    MergeContext context = project.load("main.py");

    assertThat(moduleNames(context)).containsExactly("b", "a", "main").inOrder();
    Symbol alias = context.getModule("b").getScope().getSlot("f");
    assertThat(alias.getAliasTarget()).isEqualTo(context.getModule("a").getScope().getSlot("f"));
  }

  @Test
  public void testLinkBindsFromImportsToTheirTargets() throws Exception {
    project.write("utils.py", "def add(a, b):", "    return a + b");
    project.write("reexport.py", "from utils import add");
    project.write("main.py", "from reexport import add as plus", "import json");

    MergeContext context = project.load("main.py");
    Scope main = context.getEntryModule().getScope();
    Symbol original = context.getModule("utils").getScope().getSlot("add");

    Symbol plus = main.getSlot("plus");
    assertThat(plus.getAliasTarget())
        .isEqualTo(context.getModule("reexport").getScope().getSlot("add"));
    assertThat(context.getSymbolTable().getTerminalTarget(plus)).isEqualTo(original);
    assertThat(plus.getImportBinding().isInternal()).isTrue();
    assertThat(plus.isExternalAlias()).isFalse();

    Symbol json = main.getSlot("json");
    assertThat(json.getImportBinding().isInternal()).isFalse();
    assertThat(json.isExternalAlias()).isTrue();
  }

  @Test
  public void testModuleImportsRecordTheirTargetModule() throws Exception {
    project.write("pkg/__init__.py");
    project.write("pkg/sub.py", "x = 1");
    project.write("main.py", "import pkg.sub", "import pkg.sub as s", "from pkg import sub");

    MergeContext context = project.load("main.py");
    Scope main = context.getEntryModule().getScope();

    assertThat(main.getSlot("pkg").getTargetModule()).isEqualTo("pkg");
    assertThat(main.getSlot("s").getTargetModule()).isEqualTo("pkg.sub");
    assertThat(main.getSlot("sub").getTargetModule()).isEqualTo("pkg.sub");
  }

  @Test
  public void testFutureFeaturesAreRecorded() throws Exception {
    project.write("main.py", "from __future__ import annotations, division");

    MergeContext context = project.load("main.py");

    assertThat(context.getEntryModule().getFutureFeatures())
        .containsExactly("annotations", "division");
  }

  @Test
  public void testMissingNameIsReported() throws Exception {
    project.write("utils.py", "x = 1");
    project.write("main.py", "from utils import missing");
    SortingErrorManager errorManager = new SortingErrorManager(ImmutableSet.of());

    project.load("main.py", errorManager);

    assertThat(errorManager.getWarnings()).hasSize(1);
    assertThat(errorManager.getWarnings().get(0).type())
        .isEqualTo(ModuleLoader.UNRESOLVED_IMPORT_NAME);
    assertThat(errorManager.getWarnings().get(0).description())
        .isEqualTo("Module utils defines no top-level name missing");
  }

  @Test
  public void testRelativeImportBeyondRoot() throws Exception {
    project.write("main.py", "from .. import x");

    ModuleResolutionException e =
        assertThrows(ModuleResolutionException.class, () -> project.load("main.py"));
    assertThat(e.getError().type()).isEqualTo(ModuleLoader.RELATIVE_IMPORT_BEYOND_ROOT);
    assertThat(e.getError().lineno()).isEqualTo(1);
  }

  @Test
  public void testUnresolvedRelativeImport() throws Exception {
    project.write("pkg/__init__.py");
    project.write("pkg/main.py", "from .missing import x");

    ModuleResolutionException e =
        assertThrows(ModuleResolutionException.class, () -> project.load("pkg/main.py"));
    assertThat(e.getError().type()).isEqualTo(ModuleLoader.UNRESOLVED_RELATIVE_IMPORT);
  }

  @Test
  public void testUnresolvedRelativeImportInFallbackBlockIsTolerated() throws Exception {
    project.write("pkg/__init__.py");
    project.write(
        "pkg/main.py",
        "try:",
        "    from .speedups import fast",
        "except ImportError:",
        "    fast = None");

    MergeContext context = project.load("pkg/main.py");

    assertThat(context.getEntryModule().getFallbackBlocks()).hasSize(1);
  }

  @Test
  public void testMissingFile() {
    assertThrows(NoSuchFileException.class, () -> project.load("main.py"));
  }

  @Test
  public void testParseError() throws Exception {
    project.write("main.py", "x = (1,");

    MergeException e = assertThrows(MergeException.class, () -> project.load("main.py"));
    assertThat(e.getError().type()).isEqualTo(ModuleLoader.PARSE_ERROR);
    assertThat(e.getError().sourceName()).isEqualTo("main.py");
  }
}
