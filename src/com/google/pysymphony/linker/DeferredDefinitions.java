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

import com.google.common.collect.Sets;
import com.google.pysymphony.ast.Node;
import com.google.pysymphony.ast.Token;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Finds the module variable assignments that read, when they run, a name bound by
 * initialization code.
 *
 * <p>Definitions are emitted ahead of all initialization code, so such an assignment would see
 * the name unbound or holding an earlier value. It stays in its module's initialization sequence
 * instead, at its source position. Whatever it binds is then treated the same way, so an
 * assignment in another module that reads it stays behind too. Class bases and decorators are not
 * examined.
 */
final class DeferredDefinitions {
  private static final Logger logger = Logger.getLogger(DeferredDefinitions.class.getName());

  private final MergeContext context;
  private final SymbolTable table;

  DeferredDefinitions(MergeContext context) {
    this.context = context;
    this.table = context.getSymbolTable();
  }

  /** The deferred statements among the modules whose initialization is in {@code included}. */
  Set<Node> find(Set<Symbol> included) {
    Set<Symbol> lateBound = new HashSet<>();
    Map<Node, List<Symbol>> candidates = new LinkedHashMap<>();
    ModuleRecord entry = context.getEntryModule();
    for (ModuleRecord module : context.getModules()) {
      boolean isEntry = module == entry;
      if (!isEntry && !included.contains(module.getInitSymbol())) {
        continue;
      }
      for (Node statement : module.getRoot().children()) {
        if (NodeUtil.isInitStatement(statement, isEntry)) {
          lateBound.addAll(bindings(statement));
          lateBound.addAll(rebindings(statement, module.getScope()));
        } else if (isVariableDefinition(statement)) {
          List<Symbol> bound = bindings(statement);
          if (bound.stream().anyMatch(included::contains)) {
            candidates.put(statement, bound);
          }
        }
      }
    }

    Set<Node> deferred = Sets.newIdentityHashSet();
    boolean changed = true;
    while (changed) {
      changed = false;
      for (Map.Entry<Node, List<Symbol>> candidate : candidates.entrySet()) {
        if (!deferred.contains(candidate.getKey()) && readsAny(candidate.getValue(), lateBound)) {
          deferred.add(candidate.getKey());
          lateBound.addAll(candidate.getValue());
          changed = true;
        }
      }
    }
    logger.fine(() -> deferred.size() + " assignments kept with initialization code");
    return deferred;
  }

  private static boolean isVariableDefinition(Node statement) {
    return (statement.getToken() == Token.ASSIGN || statement.getToken() == Token.ANN_ASSIGN)
        && NodeUtil.isDefinitionStatement(statement);
  }

  /** Whether any of the statement's bindings reads a late bound name. */
  private boolean readsAny(List<Symbol> bound, Set<Symbol> lateBound) {
    for (Symbol instance : bound) {
      for (Symbol read : instance.getDependencies()) {
        if (lateBound.contains(read) || lateBound.contains(table.getTerminalTarget(read))) {
          return true;
        }
      }
    }
    return false;
  }

  /**
   * The module variables an initialization statement assigns to without declaring them again,
   * such as the target of {@code x += 1}. Function and class bodies are not searched.
   */
  private static List<Symbol> rebindings(Node statement, Scope moduleScope) {
    List<Symbol> written = new ArrayList<>();
    List<Node> pending = new ArrayList<>();
    pending.add(statement);
    while (!pending.isEmpty()) {
      Node n = pending.remove(pending.size() - 1);
      switch (n.getToken()) {
        case FUNCTION_DEF:
        case CLASS_DEF:
        case LAMBDA:
          continue;
        case NAME:
          {
            Symbol slot = moduleScope.getSlot(n.getString());
            if (slot != null && n.getBooleanProp(Node.Prop.STORE)) {
              written.add(slot);
            }
            break;
          }
        default:
          break;
      }
      pending.addAll(n.children());
    }
    return written;
  }

  /** The module scope instances declared by a top-level statement, outside fallback blocks. */
  private List<Symbol> bindings(Node statement) {
    List<Symbol> bound = new ArrayList<>();
    List<Node> pending = new ArrayList<>();
    pending.add(statement);
    while (!pending.isEmpty()) {
      Node n = pending.remove(pending.size() - 1);
      Symbol symbol = table.getDeclaredSymbol(n);
      if (symbol != null
          && table.getScopeOf(symbol).isModuleScope()
          && !symbol.isInFallbackBlock()) {
        bound.add(symbol);
      }
      pending.addAll(n.children());
    }
    return bound;
  }
}
