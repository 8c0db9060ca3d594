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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.pysymphony.ast.Node;
import com.google.pysymphony.ast.Token;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.logging.Logger;
import org.jspecify.annotations.Nullable;

/**
 * Computes the dependency set of every symbol: the linkable symbols its body reads.
 *
 * <p>Names are resolved the way the runtime would resolve them: the local scope, enclosing
 * function scopes, the module scope, then the builtins. Builtins never produce an edge. Nested
 * function and class definitions are not entered; the nested symbol is recorded instead and gets
 * its own dependency set. Members of a class are not dependencies of the class.
 */
public final class DependencyAnalyzer {
  private static final Logger logger = Logger.getLogger(DependencyAnalyzer.class.getName());

  public static final DiagnosticType UNRESOLVED_REFERENCE =
      DiagnosticType.disabled("PYS_UNRESOLVED_REFERENCE", "{0} is not defined");

  private final MergeContext context;
  private final SymbolTable table;

  public DependencyAnalyzer(MergeContext context) {
    this.context = context;
    this.table = context.getSymbolTable();
  }

  /** Populates the dependency set of every symbol in the table. */
  public void analyze() {
    int edges = 0;
    for (Symbol symbol : table.getSymbols()) {
      symbol.addDependencies(computeDependencies(symbol));
      edges += symbol.getDependencies().size();
    }
    int count = edges;
    logger.fine(() -> "Found " + count + " dependency edges");
  }

  private Set<Symbol> computeDependencies(Symbol symbol) {
    switch (symbol.getKind()) {
      case FUNCTION:
      case ASYNC_FUNCTION:
      case CLASS:
        return dependenciesOf(symbol.getDeclarationNode(), table.getScopeOf(symbol));
      case MODULE_VARIABLE:
        return variableDependencies(symbol);
      case IMPORT_ALIAS:
        return aliasDependencies(symbol);
      case MODULE_INIT:
        return initDependencies(symbol);
      default:
        return ImmutableSet.of();
    }
  }

  private Set<Symbol> variableDependencies(Symbol symbol) {
    Scope scope = table.getScopeOf(symbol);
    Node statement = symbol.getStatement();
    if (!scope.isModuleScope() || statement == null) {
      return ImmutableSet.of();
    }
    if (symbol.isInFallbackBlock()) {
      Node binding = NodeUtil.getEnclosingStatement(symbol.getDeclarationNode());
      return binding == null ? ImmutableSet.of() : dependenciesOf(binding, scope);
    }
    if (NodeUtil.isDefinitionStatement(statement)) {
      return dependenciesOf(statement, scope);
    }
    // Bound by an initialization statement, whose references belong to the module init.
    return ImmutableSet.of();
  }

  private Set<Symbol> aliasDependencies(Symbol alias) {
    Symbol target = alias.getAliasTarget();
    if (target == null) {
      return ImmutableSet.of();
    }
    Set<Symbol> dependencies = new LinkedHashSet<>();
    dependencies.add(target);
    dependencies.add(table.getTerminalTarget(target));
    return dependencies;
  }

  private Set<Symbol> initDependencies(Symbol init) {
    ModuleRecord record = context.getModule(init.getModuleName());
    boolean isEntry = record == context.getEntryModule();
    Set<Symbol> dependencies = new LinkedHashSet<>();
    for (Node statement : record.getRoot().children()) {
      if (NodeUtil.isInitStatement(statement, isEntry)) {
        dependencies.addAll(dependenciesOf(statement, record.getScope()));
      }
    }
    return dependencies;
  }

  /**
   * The linkable symbols read by {@code root}, which is evaluated in {@code scope}. When {@code
   * root} is a definition, its decorators, defaults and body are all included.
   */
  public ImmutableSet<Symbol> dependenciesOf(Node root, Scope scope) {
    Collector collector = new Collector(root);
    NodeTraversal.traverse(table, root, scope, collector);
    return ImmutableSet.copyOf(collector.dependencies);
  }

  /** Whether a NAME is read. The target of an augmented assignment is both read and written. */
  public static boolean isLoad(Node name, @Nullable Node parent) {
    if (parent != null
        && parent.getToken() == Token.AUG_ASSIGN
        && parent.getFirstChild() == name) {
      return true;
    }
    return !name.getBooleanProp(Node.Prop.STORE) && !name.getBooleanProp(Node.Prop.DELETE);
  }

  private final class Collector implements NodeTraversal.Callback {
    private final Node root;
    private final Set<Symbol> dependencies = new LinkedHashSet<>();

    Collector(Node root) {
      this.root = root;
    }

    @Override
    public boolean shouldTraverse(NodeTraversal t, Node n, @Nullable Node parent) {
      switch (n.getToken()) {
        case FUNCTION_DEF:
        case CLASS_DEF:
          if (n == root) {
            return true;
          }
          if (!t.getScope().isClassScope()) {
            add(table.getDeclaredSymbol(n));
          }
          return false;
        case IMPORT:
        case IMPORT_FROM:
        case GLOBAL:
        case NONLOCAL:
          return false;
        case GETATTR:
          return !(NodeUtil.isOutermostGetattr(n) && visitModuleChain(t.getScope(), n));
        default:
          return true;
      }
    }

    @Override
    public void visit(NodeTraversal t, Node n, @Nullable Node parent) {
      if (!n.isName() || !isLoad(n, parent)) {
        return;
      }
      String name = n.getString();
      Symbol symbol = table.lookup(t.getScope(), name);
      if (symbol == null) {
        if (!BuiltinNames.isBuiltin(name)) {
          context.report(PyError.make(n, UNRESOLVED_REFERENCE, name));
        }
        return;
      }
      if (table.getScopeOf(symbol).isClassScope()) {
        return;
      }
      add(symbol);
      if (symbol.isImportAlias()) {
        add(table.getTerminalTarget(symbol));
      }
    }

    /** Records the symbols along a chain rooted at a project module alias. */
    private boolean visitModuleChain(Scope scope, Node getattr) {
      ImmutableList<String> chain = NodeUtil.getAttributeChain(getattr);
      if (chain == null) {
        return false;
      }
      Symbol rootSymbol = table.lookup(scope, chain.get(0));
      if (rootSymbol == null || !rootSymbol.isImportAlias()) {
        return false;
      }
      AttributeChains.Resolution resolution =
          AttributeChains.resolve(context, rootSymbol, chain);
      if (resolution == null) {
        return false;
      }
      for (Symbol symbol : resolution.symbols()) {
        add(symbol);
      }
      return true;
    }

    private void add(@Nullable Symbol symbol) {
      if (symbol != null && symbol.getKind().isLinkable()) {
        dependencies.add(symbol);
      }
    }
  }
}
