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

import com.google.common.collect.ImmutableList;
import com.google.common.graph.GraphBuilder;
import com.google.common.graph.MutableGraph;
import com.google.pysymphony.ast.Node;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;
import java.util.Set;
import java.util.logging.Logger;
import org.jspecify.annotations.Nullable;

/**
 * Orders the emittable units of a closure so that every unit follows the units it depends on.
 *
 * <p>Units are top-level definitions and the members of top-level classes. Since a member is
 * emitted inside its class, anything a member depends on must also precede the class. Ties are
 * broken by declaration order. When the units cannot be ordered, each strongly connected component
 * of the remaining graph is reported by the qualified names of its members.
 */
public final class DependencyOrderer {
  private static final Logger logger = Logger.getLogger(DependencyOrderer.class.getName());

  private final SymbolTable table;

  public DependencyOrderer(MergeContext context) {
    this.table = context.getSymbolTable();
  }

  /**
   * Returns the units of {@code symbols} in dependency order.
   *
   * @throws CircularDependencyException if the units depend on each other in a cycle
   */
  public ImmutableList<Symbol> order(Set<Symbol> symbols) {
    Map<Symbol, Integer> units = findUnits(symbols);
    MutableGraph<Symbol> graph = GraphBuilder.directed().allowsSelfLoops(false).build();
    for (Symbol unit : units.keySet()) {
      graph.addNode(unit);
    }
    for (Symbol symbol : symbols) {
      Symbol unit = unitOf(symbol, units);
      if (unit == null) {
        continue;
      }
      Symbol topLevel = topLevelUnitOf(unit, units);
      for (Symbol instance : emittedInstances(symbol)) {
        for (Symbol dependency : instance.getDependencies()) {
          Symbol dependencyUnit = unitOf(dependency, units);
          if (dependencyUnit == null || dependencyUnit.equals(unit)) {
            continue;
          }
          graph.putEdge(dependencyUnit, unit);
          Symbol dependencyTopLevel = topLevelUnitOf(dependencyUnit, units);
          if (!dependencyTopLevel.equals(topLevel)) {
            graph.putEdge(dependencyUnit, topLevel);
          }
        }
      }
      Scope scope = table.getScopeOf(unit);
      if (scope.isClassScope()) {
        graph.putEdge(scope.getOwner(), unit);
      }
    }
    ImmutableList<Symbol> sorted = sort(graph, units);
    logger.fine(() -> "Ordered " + sorted.size() + " units");
    return sorted;
  }

  /**
   * The units among {@code symbols}, mapped to the declaration index that breaks ties between
   * them. A unit is a module scope symbol bound by a definition statement, or a function or class
   * declared directly in the body of a unit class.
   */
  private Map<Symbol, Integer> findUnits(Set<Symbol> symbols) {
    List<Symbol> candidates = new ArrayList<>(symbols);
    candidates.sort(Comparator.comparingInt(this::firstDeclarationIndex));
    Map<Symbol, Integer> units = new LinkedHashMap<>();
    for (Symbol symbol : candidates) {
      Scope scope = table.getScopeOf(symbol);
      boolean isUnit;
      if (scope.isModuleScope()) {
        isUnit =
            symbol.getKind() != SymbolKind.IMPORT_ALIAS
                && symbol.getKind() != SymbolKind.MODULE_INIT
                && !table.getDefinitionStatements(symbol).isEmpty();
      } else {
        isUnit =
            scope.isClassScope()
                && symbol.getKind().isDefinition()
                && units.containsKey(scope.getOwner());
      }
      if (isUnit) {
        units.put(symbol, firstDeclarationIndex(symbol));
      }
    }
    return units;
  }

  private int firstDeclarationIndex(Symbol symbol) {
    return table.getInstances(symbol).get(0).getDeclarationIndex();
  }

  /** The instances of a symbol whose bindings are emitted as part of its unit. */
  private List<Symbol> emittedInstances(Symbol symbol) {
    if (!table.getScopeOf(symbol).isModuleScope()) {
      return table.getInstances(symbol);
    }
    List<Symbol> instances = new ArrayList<>();
    List<Node> statements = table.getDefinitionStatements(symbol);
    for (Symbol instance : table.getInstances(symbol)) {
      if (statements.contains(instance.getStatement())) {
        instances.add(instance);
      }
    }
    return instances;
  }

  /** The unit whose emitted text contains the declaration of {@code symbol}, if any. */
  private @Nullable Symbol unitOf(Symbol symbol, Map<Symbol, Integer> units) {
    Symbol current = symbol;
    while (current != null) {
      if (units.containsKey(current)) {
        return current;
      }
      Scope scope = table.getScopeOf(current);
      if (scope.isModuleScope()) {
        return null;
      }
      current = table.getOwnerSymbol(scope);
    }
    return null;
  }

  private Symbol topLevelUnitOf(Symbol unit, Map<Symbol, Integer> units) {
    Symbol current = unit;
    while (!table.getScopeOf(current).isModuleScope()) {
      current = table.getScopeOf(current).getOwner();
    }
    checkState(units.containsKey(current), "%s is not inside a unit", unit);
    return current;
  }

  /** Kahn's algorithm, taking the ready unit declared first at each step. */
  private ImmutableList<Symbol> sort(MutableGraph<Symbol> graph, Map<Symbol, Integer> units) {
    Map<Symbol, Integer> inDegree = new HashMap<>();
    PriorityQueue<Symbol> ready =
        new PriorityQueue<>(Comparator.comparing((Symbol symbol) -> units.get(symbol)));
    for (Symbol unit : graph.nodes()) {
      int degree = graph.inDegree(unit);
      inDegree.put(unit, degree);
      if (degree == 0) {
        ready.add(unit);
      }
    }
    ImmutableList.Builder<Symbol> sorted = ImmutableList.builder();
    int count = 0;
    while (!ready.isEmpty()) {
      Symbol unit = ready.poll();
      sorted.add(unit);
      count++;
      for (Symbol successor : graph.successors(unit)) {
        int degree = inDegree.merge(successor, -1, Integer::sum);
        if (degree == 0) {
          ready.add(successor);
        }
      }
    }
    if (count < graph.nodes().size()) {
      Set<Symbol> remaining = new LinkedHashSet<>();
      for (Symbol unit : graph.nodes()) {
        if (inDegree.get(unit) > 0) {
          remaining.add(unit);
        }
      }
      throw new CircularDependencyException(new CycleFinder(graph, remaining).findCycles());
    }
    return sorted.build();
  }

  /**
   * Tarjan's strongly connected components algorithm, restricted to the units that Kahn's
   * algorithm could not place.
   */
  private static final class CycleFinder {
    private final MutableGraph<Symbol> graph;
    private final Set<Symbol> remaining;
    private final Map<Symbol, Integer> preorderNumbers = new HashMap<>();
    private final Map<Symbol, Integer> lowLinks = new HashMap<>();
    private final Deque<Symbol> componentContents = new ArrayDeque<>();
    private final Set<Symbol> onStack = new LinkedHashSet<>();
    private final List<ImmutableList<String>> cycles = new ArrayList<>();
    private int preorderCounter = 0;

    CycleFinder(MutableGraph<Symbol> graph, Set<Symbol> remaining) {
      this.graph = graph;
      this.remaining = remaining;
    }

    ImmutableList<ImmutableList<String>> findCycles() {
      for (Symbol unit : remaining) {
        if (!preorderNumbers.containsKey(unit)) {
          visit(unit);
        }
      }
      cycles.sort(Comparator.comparing((ImmutableList<String> cycle) -> cycle.get(0)));
      return ImmutableList.copyOf(cycles);
    }

    private void visit(Symbol unit) {
      int number = preorderCounter++;
      preorderNumbers.put(unit, number);
      lowLinks.put(unit, number);
      componentContents.push(unit);
      onStack.add(unit);
      for (Symbol successor : graph.successors(unit)) {
        if (!remaining.contains(successor)) {
          continue;
        }
        if (!preorderNumbers.containsKey(successor)) {
          visit(successor);
          lowLinks.put(unit, Math.min(lowLinks.get(unit), lowLinks.get(successor)));
        } else if (onStack.contains(successor)) {
          lowLinks.put(unit, Math.min(lowLinks.get(unit), preorderNumbers.get(successor)));
        }
      }
      if (lowLinks.get(unit).equals(preorderNumbers.get(unit))) {
        // The unit is the root of a component; everything above it on the stack belongs to it.
        List<String> names = new ArrayList<>();
        Symbol member;
        do {
          member = componentContents.pop();
          onStack.remove(member);
          names.add(member.getQualifiedName());
        } while (!member.equals(unit));
        if (names.size() > 1) {
          names.sort(Comparator.naturalOrder());
          cycles.add(ImmutableList.copyOf(names));
        }
      }
    }
  }
}
