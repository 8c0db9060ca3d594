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

import com.google.common.collect.ImmutableSet;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Computes the symbols reachable from a set of roots.
 *
 * <p>Besides following dependency edges, including a class includes its members and including a
 * member includes its class. Including any symbol of a module includes the module's
 * initialization, as does including an alias of a project module. Fallback import blocks are then
 * rescanned: once one alias of a reachable block is included, every alias of every arm is.
 */
public final class SymbolClosure {
  private static final Logger logger = Logger.getLogger(SymbolClosure.class.getName());

  private final MergeContext context;
  private final SymbolTable table;
  private final Set<Symbol> included = new LinkedHashSet<>();
  private final Deque<Symbol> queue = new ArrayDeque<>();

  public SymbolClosure(MergeContext context) {
    this.context = context;
    this.table = context.getSymbolTable();
  }

  /** The closure rooted at everything the entry script defines and runs. */
  public ImmutableSet<Symbol> computeFromEntry() {
    ModuleRecord entry = context.getEntryModule();
    List<Symbol> roots = new ArrayList<>(entry.getScope().getSymbols());
    roots.add(entry.getInitSymbol());
    return closure(roots);
  }

  public ImmutableSet<Symbol> closure(Collection<Symbol> roots) {
    included.clear();
    queue.addAll(roots);
    drain();
    while (includeFallbackArms()) {
      drain();
    }
    logger.fine(
        () ->
            "Reachability closure kept "
                + included.size()
                + " of "
                + table.getSymbols().size()
                + " symbols");
    return ImmutableSet.copyOf(included);
  }

  private void drain() {
    while (!queue.isEmpty()) {
      Symbol symbol = queue.poll();
      if (included.add(symbol)) {
        expand(symbol);
      }
    }
  }

  private void expand(Symbol symbol) {
    for (Symbol instance : table.getInstances(symbol)) {
      queue.addAll(instance.getDependencies());
      if (instance.getKind() == SymbolKind.CLASS) {
        Scope body = table.getScopeForRoot(instance.getDeclarationNode());
        for (Symbol member : body.getSymbols()) {
          if (member.getKind().isDefinition()) {
            queue.add(member);
          }
        }
      }
      ImportBinding binding = instance.getImportBinding();
      if (binding != null && binding.isInternal()) {
        enqueueInits(binding.resolvedModule());
        if (instance.getTargetModule() != null) {
          enqueueInits(instance.getTargetModule());
        }
      }
    }
    Scope scope = table.getScopeOf(symbol);
    if (scope.isClassScope()) {
      queue.add(scope.getOwner());
    }
    if (symbol.getKind() != SymbolKind.MODULE_INIT) {
      ModuleRecord module = context.getModuleOf(symbol);
      if (module != null) {
        queue.add(module.getInitSymbol());
      }
    }
  }

  /** Enqueues the initialization of a module and of every package above it. */
  private void enqueueInits(String moduleName) {
    ModuleRecord module = context.getModule(moduleName);
    if (module != null) {
      queue.add(module.getInitSymbol());
    }
    int dot = moduleName.lastIndexOf('.');
    if (dot > 0) {
      enqueueInits(moduleName.substring(0, dot));
    }
  }

  /** Enqueues the other arms of every reachable fallback block already partly included. */
  private boolean includeFallbackArms() {
    boolean changed = false;
    for (ModuleRecord module : context.getModules()) {
      for (FallbackBlock block : module.getFallbackBlocks()) {
        if (!isReachable(module, block) || !anyIncluded(block)) {
          continue;
        }
        for (Symbol alias : block.getAliases()) {
          if (!included.contains(alias)) {
            queue.add(alias);
            changed = true;
          }
        }
      }
    }
    return changed;
  }

  private boolean isReachable(ModuleRecord module, FallbackBlock block) {
    Symbol enclosing = block.getEnclosingSymbol();
    return enclosing == null
        ? included.contains(module.getInitSymbol())
        : included.contains(enclosing);
  }

  private boolean anyIncluded(FallbackBlock block) {
    for (Symbol alias : block.getAliases()) {
      if (included.contains(alias)) {
        return true;
      }
    }
    return false;
  }
}
