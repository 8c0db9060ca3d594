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

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.LinkedHashMultimap;
import com.google.common.collect.SetMultimap;
import com.google.pysymphony.ast.Node;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;
import org.jspecify.annotations.Nullable;

/**
 * Finds the project modules that are only ever loaded from an arm of a module level fallback
 * import block.
 *
 * <p>Loading such a module may fail, and the failure selects another arm at runtime. Its code is
 * therefore emitted inside the arm, in front of the import statement that loads it, rather than
 * at the top level of the output. A module qualifies when every import that loads it sits in a
 * module level fallback block, or at module level in another qualifying module. The entry script
 * never qualifies.
 */
final class GuardedModules {
  private static final Logger logger = Logger.getLogger(GuardedModules.class.getName());

  private final MergeContext context;
  private final SymbolTable table;

  /** The import aliases that load each module, as declared instances. */
  private final SetMultimap<ModuleRecord, Symbol> loaders = LinkedHashMultimap.create();

  GuardedModules(MergeContext context) {
    this.context = context;
    this.table = context.getSymbolTable();
  }

  /**
   * Maps every guarded module to the import statement its code is emitted in front of. A module
   * loaded by several arms goes in front of the first one.
   */
  ImmutableMap<ModuleRecord, Node> find(Set<Symbol> included) {
    collectLoaders(included);
    Set<ModuleRecord> excluded = new HashSet<>();
    while (true) {
      Set<ModuleRecord> guarded = computeGuarded(excluded);
      Map<ModuleRecord, Node> hosts = assignHosts(guarded);
      if (hosts.size() == guarded.size()) {
        logger.fine(() -> "Modules emitted inside fallback arms: " + hosts.keySet());
        return ImmutableMap.copyOf(hosts);
      }
      for (ModuleRecord module : guarded) {
        if (!hosts.containsKey(module)) {
          excluded.add(module);
        }
      }
    }
  }

  private void collectLoaders(Set<Symbol> included) {
    for (Symbol symbol : included) {
      if (!symbol.isImportAlias()) {
        continue;
      }
      for (Symbol instance : table.getInstances(symbol)) {
        ImportBinding binding = instance.getImportBinding();
        if (binding == null || !binding.isInternal()) {
          continue;
        }
        addLoader(binding.resolvedModule(), instance);
        if (instance.getTargetModule() != null) {
          addLoader(instance.getTargetModule(), instance);
        }
      }
    }
  }

  /** Records {@code alias} as loading {@code moduleName} and every package above it. */
  private void addLoader(String moduleName, Symbol alias) {
    ModuleRecord module = context.getModule(moduleName);
    if (module != null) {
      loaders.put(module, alias);
    }
    int dot = moduleName.lastIndexOf('.');
    if (dot > 0) {
      addLoader(moduleName.substring(0, dot), alias);
    }
  }

  /** The greatest set of modules whose loaders all sit in fallback arms or guarded modules. */
  private Set<ModuleRecord> computeGuarded(Set<ModuleRecord> excluded) {
    Set<ModuleRecord> guarded = new LinkedHashSet<>();
    for (ModuleRecord module : context.getModules()) {
      if (module != context.getEntryModule()
          && !excluded.contains(module)
          && loaders.containsKey(module)) {
        guarded.add(module);
      }
    }
    boolean changed = true;
    while (changed) {
      changed = false;
      for (ModuleRecord module : new LinkedHashSet<>(guarded)) {
        for (Symbol alias : loaders.get(module)) {
          if (!isGuardedFallback(alias) && !isTopLevelIn(alias, guarded)) {
            guarded.remove(module);
            changed = true;
            break;
          }
        }
      }
    }
    return guarded;
  }

  private static boolean isGuardedFallback(Symbol alias) {
    FallbackBlock block = alias.getFallbackBlock();
    return alias.isInFallbackBlock() && block != null && block.isTopLevel();
  }

  private boolean isTopLevelIn(Symbol alias, Set<ModuleRecord> guarded) {
    ModuleRecord owner = context.getModuleOf(alias);
    return owner != null
        && guarded.contains(owner)
        && table.getScopeOf(alias).isModuleScope()
        && !alias.isInFallbackBlock();
  }

  /**
   * Picks the import statement each guarded module is emitted in front of: its first fallback
   * import, or else the statement chosen for the guarded module that imports it.
   */
  private Map<ModuleRecord, Node> assignHosts(Set<ModuleRecord> guarded) {
    Map<ModuleRecord, Node> hosts = new LinkedHashMap<>();
    boolean changed = true;
    while (changed) {
      changed = false;
      for (ModuleRecord module : guarded) {
        if (hosts.containsKey(module)) {
          continue;
        }
        Node host = findHost(module, hosts);
        if (host != null) {
          hosts.put(module, host);
          changed = true;
        }
      }
    }
    return hosts;
  }

  private @Nullable Node findHost(ModuleRecord module, Map<ModuleRecord, Node> hosts) {
    for (Symbol alias : loaders.get(module)) {
      if (isGuardedFallback(alias)) {
        return alias.getDeclarationNode().getParent();
      }
    }
    for (Symbol alias : loaders.get(module)) {
      ModuleRecord owner = context.getModuleOf(alias);
      if (owner != null && hosts.containsKey(owner)) {
        return hosts.get(owner);
      }
    }
    return null;
  }
}
