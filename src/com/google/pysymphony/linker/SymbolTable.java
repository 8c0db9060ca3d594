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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ListMultimap;
import com.google.common.collect.MultimapBuilder;
import com.google.pysymphony.ast.Node;
import com.google.pysymphony.ast.Token;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.jspecify.annotations.Nullable;

/**
 * The arena that owns every {@link Scope} and {@link Symbol} of one merge.
 *
 * <p>Lookup follows the nearest enclosing scope first. Class scopes are only visible from their
 * own body, never from nested functions or comprehensions. {@code global} declarations send
 * lookup straight to the module scope and {@code nonlocal} declarations skip the current scope.
 */
public final class SymbolTable {
  private final List<Scope> scopes = new ArrayList<>();
  private final List<Symbol> symbols = new ArrayList<>();
  private final Map<Node, Scope> scopesByRoot = new IdentityHashMap<>();
  private final Map<Node, Symbol> symbolsByDeclaration = new IdentityHashMap<>();
  // Every declaration of a name in a scope, keyed by the (equal) symbols they produced.
  private final ListMultimap<Symbol, Symbol> instances =
      MultimapBuilder.linkedHashKeys().arrayListValues().build();

  Scope createScope(
      ScopeKind kind,
      Node root,
      @Nullable Scope parent,
      String moduleName,
      String qualifiedName,
      @Nullable Symbol owner) {
    checkArgument((parent == null) == (kind == ScopeKind.MODULE), "module scopes are roots");
    Scope scope =
        new Scope(
            scopes.size(),
            parent == null ? -1 : parent.getIndex(),
            kind,
            root,
            moduleName,
            qualifiedName,
            owner);
    scopes.add(scope);
    scopesByRoot.put(root, scope);
    return scope;
  }

  /**
   * Declares {@code name} in {@code scope}, replacing any earlier binding of the same name.
   *
   * @param statement for module scope symbols, the top-level statement that binds the name
   */
  Symbol declare(
      Scope scope,
      String name,
      SymbolKind kind,
      Node declaration,
      boolean inFallbackBlock,
      @Nullable Node statement) {
    Symbol symbol =
        new Symbol(
            name,
            qualify(scope.getQualifiedName(), name),
            kind,
            declaration,
            scope.getIndex(),
            scope.getModuleName(),
            symbols.size(),
            inFallbackBlock,
            isInsideFunction(scope),
            statement);
    symbols.add(symbol);
    symbolsByDeclaration.put(declaration, symbol);
    scope.setSlot(symbol);
    instances.put(symbol, symbol);
    return symbol;
  }

  /** Creates the symbol that stands for the non-definition top-level statements of a module. */
  Symbol declareModuleInit(Scope moduleScope) {
    checkState(moduleScope.isModuleScope());
    Symbol symbol =
        new Symbol(
            "<init>",
            qualify(moduleScope.getQualifiedName(), "<init>"),
            SymbolKind.MODULE_INIT,
            moduleScope.getRootNode(),
            moduleScope.getIndex(),
            moduleScope.getModuleName(),
            symbols.size(),
            false,
            false,
            null);
    symbols.add(symbol);
    instances.put(symbol, symbol);
    return symbol;
  }

  static String qualify(String prefix, String name) {
    return prefix.isEmpty() ? name : prefix + "." + name;
  }

  private boolean isInsideFunction(Scope scope) {
    for (Scope s = scope; s != null; s = getParent(s)) {
      if (s.isFunctionScope()) {
        return true;
      }
    }
    return false;
  }

  public Scope getScope(int index) {
    return scopes.get(index);
  }

  public @Nullable Scope getParent(Scope scope) {
    return scope.getParentIndex() < 0 ? null : scopes.get(scope.getParentIndex());
  }

  public Scope getScopeOf(Symbol symbol) {
    return scopes.get(symbol.getScopeIndex());
  }

  /** The scope opened by a MODULE, FUNCTION_DEF, LAMBDA, CLASS_DEF or comprehension node. */
  public @Nullable Scope getScopeForRoot(Node root) {
    return scopesByRoot.get(root);
  }

  public Scope getModuleScope(Scope scope) {
    Scope s = scope;
    while (!s.isModuleScope()) {
      s = scopes.get(s.getParentIndex());
    }
    return s;
  }

  /** The symbol created by a declaring node, even if a later binding replaced it in its scope. */
  public @Nullable Symbol getDeclaredSymbol(Node declaration) {
    return symbolsByDeclaration.get(declaration);
  }

  /** All declarations of the name that {@code symbol} binds in its scope, in source order. */
  public ImmutableList<Symbol> getInstances(Symbol symbol) {
    return ImmutableList.copyOf(instances.get(symbol));
  }

  /**
   * The top-level definition statements that bind a module scope symbol and survive later
   * bindings: a function or class definition discards every earlier definition of the name,
   * while plain assignments accumulate. Bindings in fallback blocks are not included.
   */
  public ImmutableList<Node> getDefinitionStatements(Symbol symbol) {
    List<Node> statements = new ArrayList<>();
    for (Symbol instance : getInstances(symbol)) {
      Node statement = instance.getStatement();
      if (statement == null
          || instance.isInFallbackBlock()
          || !NodeUtil.isDefinitionStatement(statement)
          || statements.contains(statement)) {
        continue;
      }
      if (statement.getToken() == Token.FUNCTION_DEF || statement.getToken() == Token.CLASS_DEF) {
        statements.clear();
      }
      statements.add(statement);
    }
    return ImmutableList.copyOf(statements);
  }

  public ImmutableList<Symbol> getSymbols() {
    return ImmutableList.copyOf(symbols);
  }

  public ImmutableList<Scope> getScopes() {
    return ImmutableList.copyOf(scopes);
  }

  /**
   * The nearest function or class symbol whose body contains {@code scope}, looking through
   * lambdas and comprehensions. Null at module level.
   */
  public @Nullable Symbol getOwnerSymbol(Scope scope) {
    for (Scope s = scope; s != null; s = getParent(s)) {
      if (s.getOwner() != null) {
        return s.getOwner();
      }
    }
    return null;
  }

  /**
   * Follows project from-import aliases to the symbol they finally denote. Stops at aliases of
   * modules, of external libraries and at aliases bound in fallback blocks.
   */
  public Symbol getTerminalTarget(Symbol symbol) {
    Symbol current = symbol;
    Set<Symbol> seen = new HashSet<>();
    while (current.isImportAlias()
        && !current.isInFallbackBlock()
        && current.getAliasTarget() != null
        && seen.add(current)) {
      current = current.getAliasTarget();
    }
    return current;
  }

  /** Resolves a name as it would be resolved at runtime when read from {@code from}. */
  public @Nullable Symbol lookup(Scope from, String name) {
    Scope declaring = findDeclaringScope(from, name);
    return declaring == null ? null : declaring.getSlot(name);
  }

  /** The scope whose binding of {@code name} is visible from {@code from}, or null. */
  public @Nullable Scope findDeclaringScope(Scope from, String name) {
    Scope moduleScope = getModuleScope(from);
    if (from.isGlobal(name)) {
      return moduleScope.hasSlot(name) ? moduleScope : null;
    }
    Scope s = from.isNonlocal(name) ? getParent(from) : from;
    for (; s != null; s = getParent(s)) {
      if (s.isClassScope() && s != from) {
        continue;
      }
      if (s.hasSlot(name)) {
        return s;
      }
      if (s != from && s.isGlobal(name)) {
        return moduleScope.hasSlot(name) ? moduleScope : null;
      }
    }
    return null;
  }
}
