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
import static com.google.pysymphony.linker.ProjectFixture.lines;

import com.google.pysymphony.ast.Node;
import com.google.pysymphony.parsing.Parser;
import java.util.ArrayList;
import java.util.List;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class ScopeBuilderTest {

  private SymbolTable table;
  private ScopeBuilder builder;
  private final List<PyError> errors = new ArrayList<>();
  private final List<String> imports = new ArrayList<>();
  private final List<String> wildcards = new ArrayList<>();
  private final List<String> futures = new ArrayList<>();

  private final ScopeBuilder.ImportHandler recorder =
      new ScopeBuilder.ImportHandler() {
        @Override
        public void onImport(Node alias, Symbol symbol, boolean inFallbackBlock) {
          imports.add(symbol.getQualifiedName() + (inFallbackBlock ? " (fallback)" : ""));
        }

        @Override
        public void onWildcardImport(Node alias) {
          wildcards.add(alias.getParent().getString());
        }

        @Override
        public void onFutureImport(Node importFrom) {
          for (Node alias : importFrom.children()) {
            futures.add(alias.getString());
          }
        }
      };

  @Before
  public void setUp() {
    table = new SymbolTable();
  }

  private Scope build(String moduleName, String source) {
    Node root = Parser.parse(moduleName + ".py", source);
    builder = new ScopeBuilder(table, moduleName, recorder, errors::add);
    return builder.build(root);
  }

  @Test
  public void testTopLevelDeclarations() {
    Scope scope =
        build(
            "pkg.mod",
            lines(
                "def f(a, *rest, **options):",
                "    local = a",
                "    for item in rest:",
                "        pass",
                "class C:",
                "    def m(self):",
                "        pass",
                "x = 1",
                "async def g():",
                "    pass"));

    assertThat(scope.isModuleScope()).isTrue();
    assertThat(scope.getSlot("f").getQualifiedName()).isEqualTo("pkg.mod.f");
    assertThat(scope.getSlot("f").getKind()).isEqualTo(SymbolKind.FUNCTION);
    assertThat(scope.getSlot("C").getKind()).isEqualTo(SymbolKind.CLASS);
    assertThat(scope.getSlot("x").getKind()).isEqualTo(SymbolKind.MODULE_VARIABLE);
    assertThat(scope.getSlot("g").getKind()).isEqualTo(SymbolKind.ASYNC_FUNCTION);
    assertThat(scope.hasSlot("local")).isFalse();

    Scope function = table.getScopeForRoot(scope.getSlot("f").getDeclarationNode());
    assertThat(function.isFunctionScope()).isTrue();
    assertThat(function.getSlot("a").getKind()).isEqualTo(SymbolKind.PARAMETER);
    assertThat(function.getSlot("rest").getKind()).isEqualTo(SymbolKind.PARAMETER);
    assertThat(function.getSlot("options").getKind()).isEqualTo(SymbolKind.PARAMETER);
    assertThat(function.getSlot("local").getKind()).isEqualTo(SymbolKind.LOCAL_VAR);
    assertThat(function.getSlot("local").getQualifiedName()).isEqualTo("pkg.mod.f.local");
    assertThat(function.getSlot("item").getKind()).isEqualTo(SymbolKind.LOOP_VAR);
    assertThat(function.getSlot("item").isNested()).isTrue();

    Scope classScope = table.getScopeForRoot(scope.getSlot("C").getDeclarationNode());
    assertThat(classScope.isClassScope()).isTrue();
    assertThat(classScope.getSlot("m").getQualifiedName()).isEqualTo("pkg.mod.C.m");
    assertThat(table.getOwnerSymbol(classScope)).isEqualTo(scope.getSlot("C"));
  }

  @Test
  public void testRootModuleNamesAreUnqualified() {
    Scope scope = build("", "def f():\n    pass\n");
    assertThat(scope.getSlot("f").getQualifiedName()).isEqualTo("f");
  }

  @Test
  public void testGlobalStatementBindsModuleName() {
    Scope scope = build("main", lines("def f():", "    global counter", "    counter = 1"));

    Symbol counter = scope.getSlot("counter");
    assertThat(counter).isNotNull();
    assertThat(counter.getKind()).isEqualTo(SymbolKind.MODULE_VARIABLE);
    Scope function = table.getScopeForRoot(scope.getSlot("f").getDeclarationNode());
    assertThat(function.hasSlot("counter")).isFalse();
    assertThat(table.lookup(function, "counter")).isEqualTo(counter);
  }

  @Test
  public void testNonlocalBindsEnclosingFunction() {
    Scope scope =
        build(
            "main",
            lines(
                "def outer():",
                "    total = 0",
                "    def inner():",
                "        nonlocal total",
                "        total = 1",
                "    return inner"));

    Scope outer = table.getScopeForRoot(scope.getSlot("outer").getDeclarationNode());
    Scope inner = table.getScopeForRoot(outer.getSlot("inner").getDeclarationNode());
    assertThat(inner.hasSlot("total")).isFalse();
    assertThat(table.findDeclaringScope(inner, "total")).isEqualTo(outer);
  }

  @Test
  public void testClassScopeIsSkippedByNestedFunctions() {
    Scope scope =
        build(
            "main",
            lines("x = 1", "class C:", "    x = 2", "    def m(self):", "        return x"));

    Scope classScope = table.getScopeForRoot(scope.getSlot("C").getDeclarationNode());
    Scope method = table.getScopeForRoot(classScope.getSlot("m").getDeclarationNode());
    assertThat(table.lookup(method, "x")).isEqualTo(scope.getSlot("x"));
    assertThat(table.lookup(classScope, "x")).isEqualTo(classScope.getSlot("x"));
  }

  @Test
  public void testComprehensionVariablesAreLocal() {
    Scope scope = build("main", "squares = [n * n for n in range(3)]\n");
    assertThat(scope.hasSlot("n")).isFalse();
    assertThat(scope.hasSlot("squares")).isTrue();
  }

  @Test
  public void testWalrusInComprehensionBindsEnclosingScope() {
    Scope scope = build("main", "hits = [y for x in data if (y := x * 2)]\n");

    assertThat(scope.hasSlot("x")).isFalse();
    assertThat(scope.hasSlot("y")).isTrue();
    assertThat(scope.getSlot("y").getKind()).isEqualTo(SymbolKind.MODULE_VARIABLE);
    assertThat(scope.getSlot("y").getQualifiedName()).isEqualTo("main.y");
  }

  @Test
  public void testWalrusInNestedComprehensionBindsFunctionScope() {
    Scope scope =
        build(
            "main",
            lines(
                "def f(rows):",
                "    cells = [[c for c in row if (last := c)] for row in rows]",
                "    return last"));

    Scope function = table.getScopeForRoot(scope.getSlot("f").getDeclarationNode());
    assertThat(function.hasSlot("last")).isTrue();
    assertThat(function.getSlot("last").getKind()).isEqualTo(SymbolKind.LOCAL_VAR);
    assertThat(function.hasSlot("c")).isFalse();
    assertThat(scope.hasSlot("last")).isFalse();
  }

  @Test
  public void testImportsAreReported() {
    Scope scope =
        build(
            "main",
            lines(
                "from __future__ import annotations",
                "import os.path",
                "import json as j",
                "from utils import helper",
                "from star import *"));

    assertThat(imports).containsExactly("main.os", "main.j", "main.helper").inOrder();
    assertThat(wildcards).containsExactly("star");
    assertThat(futures).containsExactly("annotations");
    assertThat(scope.getSlot("os").getKind()).isEqualTo(SymbolKind.IMPORT_ALIAS);
    assertThat(scope.hasSlot("annotations")).isFalse();
  }

  @Test
  public void testFallbackBlock() {
    Scope scope =
        build(
            "main",
            lines(
                "try:",
                "    import ujson as json",
                "except ImportError:",
                "    import json",
                "try:",
                "    value = compute()",
                "except ValueError:",
                "    value = None"));

    assertThat(imports).containsExactly("main.json (fallback)", "main.json (fallback)");
    assertThat(builder.getFallbackBlocks()).hasSize(1);
    FallbackBlock block = builder.getFallbackBlocks().get(0);
    assertThat(block.isTopLevel()).isTrue();
    assertThat(block.getAliases()).hasSize(2);
    assertThat(scope.getSlot("json").isInFallbackBlock()).isTrue();
    assertThat(scope.getSlot("json").getFallbackBlock()).isSameInstanceAs(block);
    assertThat(scope.getSlot("value").isInFallbackBlock()).isFalse();
  }

  @Test
  public void testRedefinitionIsReported() {
    build("main", lines("def f():", "    return 1", "def f():", "    return 2"));

    assertThat(errors).hasSize(1);
    assertThat(errors.get(0).type()).isEqualTo(ScopeBuilder.DUPLICATE_SYMBOL);
    assertThat(errors.get(0).lineno()).isEqualTo(3);
  }

  @Test
  public void testConditionalRedefinitionIsNotReported() {
    build(
        "main",
        lines(
            "def f():",
            "    return 1",
            "if flag:",
            "    def f():",
            "        return 2",
            "x = 1",
            "x = 2"));

    assertThat(errors).isEmpty();
  }

  @Test
  public void testInstancesAccumulate() {
    Scope scope = build("main", lines("x = 1", "x = x + 1"));

    Symbol x = scope.getSlot("x");
    assertThat(table.getInstances(x)).hasSize(2);
    assertThat(table.getDefinitionStatements(x)).hasSize(2);
  }
}
