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

import static com.google.common.base.Preconditions.checkState;

import com.google.common.base.CharMatcher;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.LinkedHashMultimap;
import com.google.common.collect.SetMultimap;
import com.google.pysymphony.ast.Node;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Chooses the names that module-level bindings receive once every module shares a single
 * namespace.
 *
 * <p>A binding keeps its name when no other emitted binding uses it. Otherwise it is qualified
 * with its module, as in {@code utils_process}, plus a numeric suffix if even that is taken.
 * Library imports are renamed to {@code name__mod} and names bound in fallback-import blocks to
 * {@code name__rt}, so that they cannot clash with project definitions. Two imports of the same
 * name share it when they import the same thing.
 *
 * <p>Names are then checked against every place they are read: a name that a local binding would
 * shadow at some reference, or that would hide a builtin used elsewhere, is qualified further
 * until no reference changes meaning.
 */
final class NameResolver {

  private static final Logger logger = Logger.getLogger(NameResolver.class.getName());

  static final String LIBRARY_SUFFIX = "__mod";
  static final String FALLBACK_SUFFIX = "__rt";

  private static final int MAX_ROUNDS = 64;

  private static final CharMatcher IDENTIFIER_CHARS =
      CharMatcher.inRange('a', 'z')
          .or(CharMatcher.inRange('A', 'Z'))
          .or(CharMatcher.inRange('0', '9'))
          .or(CharMatcher.is('_'));

  private final MergeContext context;
  private final SymbolTable table;
  private final ImmutableMap<Node, ModuleRecord> statements;
  private final ImmutableList<Symbol> bindings;
  private final Map<Symbol, Object> keys = new HashMap<>();
  private final Map<Object, String> bases = new HashMap<>();
  private final SetMultimap<String, Object> keysByBase = LinkedHashMultimap.create();

  /**
   * @param statements every top-level statement that will be emitted, with its module
   * @param hoistedAliases module-level library aliases whose imports are emitted separately
   */
  NameResolver(
      MergeContext context,
      ImmutableMap<Node, ModuleRecord> statements,
      List<Symbol> hoistedAliases) {
    this.context = context;
    this.table = context.getSymbolTable();
    this.statements = statements;
    this.bindings = collectBindings(hoistedAliases);
    for (Symbol binding : bindings) {
      Object key = keyOf(binding);
      keys.put(binding, key);
      keysByBase.put(bases.get(key), key);
    }
  }

  /** The module-level symbols bound by the emitted code, in declaration order. */
  ImmutableList<Symbol> getBindings() {
    return bindings;
  }

  NameMapping resolve() {
    Map<Object, Integer> forced = new HashMap<>();
    for (int round = 0; round < MAX_ROUNDS; round++) {
      NameMapping mapping = assign(forced);
      ReferenceRewriter.Captures captures = new ReferenceRewriter.Captures();
      ReferenceRewriter scanner = new ReferenceRewriter(context, mapping);
      statements.forEach((statement, module) -> scanner.scan(statement, module, captures));

      Set<Object> escalate = new LinkedHashSet<>();
      for (Symbol symbol : captures.getCaptured()) {
        Object key = keys.get(symbol);
        if (key != null) {
          escalate.add(key);
        }
      }
      for (Symbol binding : bindings) {
        if (captures.getUsedBuiltins().contains(mapping.getName(binding))) {
          escalate.add(keys.get(binding));
        }
      }
      if (escalate.isEmpty()) {
        return mapping;
      }
      for (Object key : escalate) {
        logger.fine(() -> "Qualifying " + bases.get(key) + " to avoid capture");
        forced.merge(key, 1, Integer::sum);
      }
    }
    throw new IllegalStateException("No capture-free naming found after " + MAX_ROUNDS + " rounds");
  }

  private ImmutableList<Symbol> collectBindings(List<Symbol> hoistedAliases) {
    Set<Symbol> found = new LinkedHashSet<>(hoistedAliases);
    for (Node statement : statements.keySet()) {
      collectDeclared(statement, found);
    }
    List<Symbol> sorted = new ArrayList<>(found);
    sorted.sort(Comparator.comparingInt((Symbol symbol) -> firstDeclarationIndex(symbol)));
    return ImmutableList.copyOf(sorted);
  }

  private void collectDeclared(Node n, Set<Symbol> found) {
    Symbol symbol = table.getDeclaredSymbol(n);
    if (symbol != null
        && table.getScopeOf(symbol).isModuleScope()
        && !ReferenceRewriter.isCollapsed(symbol)) {
      found.add(symbol);
    }
    for (Node child : n.children()) {
      collectDeclared(child, found);
    }
  }

  private int firstDeclarationIndex(Symbol symbol) {
    return table.getInstances(symbol).get(0).getDeclarationIndex();
  }

  /**
   * Bindings with equal keys denote the same thing and share a name: a project definition is its
   * own key, a library import is keyed by what it imports.
   */
  private Object keyOf(Symbol symbol) {
    Symbol alias = null;
    for (Symbol instance : table.getInstances(symbol)) {
      if (instance.isImportAlias() && !ReferenceRewriter.isCollapsed(instance)) {
        if (instance.isInFallbackBlock()) {
          alias = instance;
          break;
        }
        if (alias == null) {
          alias = instance;
        }
      }
    }
    Object key;
    String base;
    if (alias == null) {
      key = symbol;
      base = symbol.getName();
    } else if (alias.isInFallbackBlock()) {
      key = "rt|" + symbol.getModuleName() + "|" + symbol.getName();
      base = withSuffix(symbol.getName(), FALLBACK_SUFFIX);
    } else {
      key = "mod|" + symbol.getName() + "|" + describe(alias);
      base = withSuffix(symbol.getName(), LIBRARY_SUFFIX);
    }
    bases.put(key, base);
    return key;
  }

  private static String describe(Symbol alias) {
    ImportBinding binding = alias.getImportBinding();
    return binding == null ? alias.getModuleName() : binding.describe();
  }

  private static String withSuffix(String name, String suffix) {
    return name.endsWith(suffix) ? name : name + suffix;
  }

  static String moduleKey(String moduleName) {
    return moduleName.isEmpty() ? "root" : IDENTIFIER_CHARS.negate().replaceFrom(moduleName, '_');
  }

  private NameMapping assign(Map<Object, Integer> forced) {
    Map<Object, Symbol> firstByKey = new LinkedHashMap<>();
    for (Symbol binding : bindings) {
      firstByKey.putIfAbsent(keys.get(binding), binding);
    }
    Map<Object, String> names = new HashMap<>();
    Set<String> taken = new HashSet<>();
    List<Object> qualified = new ArrayList<>();
    for (Object key : firstByKey.keySet()) {
      String base = bases.get(key);
      if (keysByBase.get(base).size() == 1 && !forced.containsKey(key)) {
        names.put(key, base);
        taken.add(base);
      } else {
        qualified.add(key);
      }
    }
    for (Object key : qualified) {
      Symbol first = firstByKey.get(key);
      String name = moduleKey(first.getModuleName()) + "_" + bases.get(key);
      int level = forced.getOrDefault(key, 0);
      if (level > 1) {
        name += "_" + level;
      }
      String candidate = name;
      for (int i = 2; !taken.add(candidate); i++) {
        candidate = name + "_" + i;
      }
      names.put(key, candidate);
    }
    ImmutableMap.Builder<Symbol, String> mapping = ImmutableMap.builder();
    for (Symbol binding : bindings) {
      mapping.put(binding, names.get(keys.get(binding)));
    }
    return new NameMapping(mapping.buildOrThrow());
  }
}
