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
import com.google.pysymphony.ast.Node;
import com.google.pysymphony.ast.Token;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.function.Consumer;
import java.util.logging.Logger;
import org.jspecify.annotations.Nullable;

/**
 * Builds the scope tree of one module and declares every name bound in it.
 *
 * <p>Loop, {@code with}, exception handler and walrus targets bind in the nearest scope that is
 * not a comprehension. Names marked {@code global} bind in the module scope and names marked
 * {@code nonlocal} are not declared at all. Import aliases are handed to an {@link ImportHandler}
 * as soon as they are declared.
 */
public final class ScopeBuilder implements NodeTraversal.Callback, NodeTraversal.ScopeCreator {
  private static final Logger logger = Logger.getLogger(ScopeBuilder.class.getName());

  public static final DiagnosticType DUPLICATE_SYMBOL =
      DiagnosticType.warning(
          "PYS_DUPLICATE_SYMBOL", "{0} is already defined at the top level of {1}");

  /** Receives the imports found while building a module scope. */
  public interface ImportHandler {
    /** Called once the alias symbol of an IMPORT_ALIAS has been declared. */
    void onImport(Node alias, Symbol symbol, boolean inFallbackBlock);

    /** Called for {@code from ... import *}. */
    void onWildcardImport(Node alias);

    /** Called for {@code from __future__ import ...}. */
    void onFutureImport(Node importFrom);
  }

  private final SymbolTable table;
  private final String moduleName;
  private final ImportHandler importHandler;
  private final Consumer<PyError> reporter;
  private final Deque<FallbackBlock> fallbackBlocks = new ArrayDeque<>();
  private final List<FallbackBlock> allFallbackBlocks = new ArrayList<>();

  public ScopeBuilder(
      SymbolTable table,
      String moduleName,
      ImportHandler importHandler,
      Consumer<PyError> reporter) {
    this.table = table;
    this.moduleName = moduleName;
    this.importHandler = importHandler;
    this.reporter = reporter;
  }

  /** Creates the module scope for {@code root} and everything nested in it. */
  public Scope build(Node root) {
    Scope moduleScope =
        table.createScope(ScopeKind.MODULE, root, null, moduleName, moduleName, null);
    NodeTraversal.traverse(root, moduleScope, this, this);
    logger.fine(
        () ->
            "Built scope of "
                + (moduleName.isEmpty() ? "<root>" : moduleName)
                + " with "
                + moduleScope.getSymbols().size()
                + " module level names");
    return moduleScope;
  }

  /** Every fallback import block found by {@link #build}, in source order. */
  public ImmutableList<FallbackBlock> getFallbackBlocks() {
    return ImmutableList.copyOf(allFallbackBlocks);
  }

  @Override
  public Scope createScope(Node root, Scope outer) {
    Scope scope;
    switch (root.getToken()) {
      case FUNCTION_DEF:
        {
          Symbol owner = table.getDeclaredSymbol(root);
          scope =
              table.createScope(
                  ScopeKind.FUNCTION, root, outer, moduleName, owner.getQualifiedName(), owner);
          declareParameters(scope, root.getSecondChild());
          collectGlobalsAndNonlocals(scope, root.getLastChild());
          break;
        }
      case CLASS_DEF:
        {
          Symbol owner = table.getDeclaredSymbol(root);
          scope =
              table.createScope(
                  ScopeKind.CLASS, root, outer, moduleName, owner.getQualifiedName(), owner);
          collectGlobalsAndNonlocals(scope, root.getLastChild());
          break;
        }
      case LAMBDA:
        scope =
            table.createScope(
                ScopeKind.FUNCTION,
                root,
                outer,
                moduleName,
                SymbolTable.qualify(outer.getQualifiedName(), "<lambda>"),
                null);
        declareParameters(scope, root.getFirstChild());
        break;
      default:
        scope =
            table.createScope(
                ScopeKind.COMPREHENSION,
                root,
                outer,
                moduleName,
                SymbolTable.qualify(outer.getQualifiedName(), "<comprehension>"),
                null);
        break;
    }
    return scope;
  }

  private void declareParameters(Scope scope, Node paramList) {
    for (Node param : paramList.children()) {
      String name = param.getStringOrNull();
      if (name != null) {
        declare(scope, name, SymbolKind.PARAMETER, param);
      }
    }
  }

  /** Records the global and nonlocal statements of a body, not looking into nested scopes. */
  private void collectGlobalsAndNonlocals(Scope scope, Node n) {
    for (Node child : n.children()) {
      switch (child.getToken()) {
        case GLOBAL:
          for (Node id : child.children()) {
            scope.declareGlobal(id.getString());
          }
          break;
        case NONLOCAL:
          for (Node id : child.children()) {
            scope.declareNonlocal(id.getString());
          }
          break;
        case FUNCTION_DEF:
        case CLASS_DEF:
          // Decorators and defaults belong to this scope, bodies do not.
          for (int i = 0; i < child.getChildCount() - 1; i++) {
            collectGlobalsAndNonlocals(scope, child.getChildAtIndex(i));
          }
          break;
        case LAMBDA:
        case LIST_COMP:
        case SET_COMP:
        case DICT_COMP:
        case GENERATOR_EXP:
          break;
        default:
          collectGlobalsAndNonlocals(scope, child);
          break;
      }
    }
  }

  @Override
  public boolean shouldTraverse(NodeTraversal t, Node n, @Nullable Node parent) {
    Scope scope = t.getScope();
    switch (n.getToken()) {
      case FUNCTION_DEF:
        declareDefinition(
            scope,
            n,
            n.getBooleanProp(Node.Prop.ASYNC) ? SymbolKind.ASYNC_FUNCTION : SymbolKind.FUNCTION);
        return true;
      case CLASS_DEF:
        declareDefinition(scope, n, SymbolKind.CLASS);
        return true;
      case TRY:
        if (NodeUtil.isFallbackImportBlock(n)) {
          FallbackBlock block = new FallbackBlock(n, moduleName, table.getOwnerSymbol(scope));
          fallbackBlocks.push(block);
          allFallbackBlocks.add(block);
        }
        return true;
      case IMPORT:
      case IMPORT_FROM:
        declareImports(scope, n);
        return false;
      case GLOBAL:
      case NONLOCAL:
        return false;
      case EXCEPT:
        if (n.getStringOrNull() != null) {
          declareVariable(scope, n.getString(), n, false);
        }
        return true;
      case NAME:
        if (n.getBooleanProp(Node.Prop.STORE)) {
          declareTarget(scope, n, parent);
        }
        return true;
      default:
        return true;
    }
  }

  @Override
  public void visit(NodeTraversal t, Node n, @Nullable Node parent) {
    if (n.getToken() == Token.TRY
        && !fallbackBlocks.isEmpty()
        && fallbackBlocks.peek().getTryNode() == n) {
      fallbackBlocks.pop();
    }
  }

  private void declareDefinition(Scope scope, Node n, SymbolKind kind) {
    String name = n.getString();
    if (scope.isModuleScope()) {
      checkDuplicate(scope, name, n);
    }
    if (!scope.isModuleScope() && scope.isGlobal(name)) {
      table.declare(table.getModuleScope(scope), name, kind, n, inFallbackBlock(), null);
      return;
    }
    declare(scope, name, kind, n);
  }

  private void checkDuplicate(Scope scope, String name, Node n) {
    Symbol existing = scope.getSlot(name);
    if (existing == null
        || !fallbackBlocks.isEmpty()
        || existing.isInFallbackBlock()
        || n.getParent().getToken() != Token.MODULE) {
      return;
    }
    Node previous = existing.getStatement();
    if (previous != null && NodeUtil.isDefinitionStatement(previous)) {
      reporter.accept(
          PyError.make(
              n, DUPLICATE_SYMBOL, name, moduleName.isEmpty() ? "<root>" : moduleName));
    }
  }

  private void declareImports(Scope scope, Node statement) {
    if (NodeUtil.isFutureImport(statement)) {
      importHandler.onFutureImport(statement);
      return;
    }
    for (Node alias : statement.children()) {
      if (alias.getString().equals("*")) {
        importHandler.onWildcardImport(alias);
        continue;
      }
      Symbol symbol =
          declare(scope, NodeUtil.getBoundName(alias), SymbolKind.IMPORT_ALIAS, alias);
      if (!fallbackBlocks.isEmpty()) {
        FallbackBlock block = fallbackBlocks.peek();
        block.addAlias(symbol);
        symbol.setFallbackBlock(block);
      }
      importHandler.onImport(alias, symbol, !fallbackBlocks.isEmpty());
    }
  }

  /** Declares a NAME marked as an assignment target. */
  private void declareTarget(Scope scope, Node name, @Nullable Node parent) {
    Scope target = scope;
    if (parent != null && parent.getToken() == Token.NAMED_EXPR) {
      while (target.isComprehensionScope()) {
        target = table.getParent(target);
      }
    }
    Node context = getTargetContext(name);
    if (context.getToken() == Token.AUG_ASSIGN && findBinding(target, name.getString())) {
      return;
    }
    boolean isLoopTarget =
        context.getToken() == Token.FOR || context.getToken() == Token.COMP_FOR;
    declareVariable(target, name.getString(), name, isLoopTarget);
  }

  private boolean findBinding(Scope scope, String name) {
    return scope.hasSlot(name) || scope.isGlobal(name) || scope.isNonlocal(name);
  }

  /** The nearest ancestor of a target that is not part of a destructuring pattern. */
  private static Node getTargetContext(Node name) {
    Node context = name.getParent();
    while (context.getToken() == Token.TUPLE
        || context.getToken() == Token.LIST
        || context.getToken() == Token.STARRED) {
      context = context.getParent();
    }
    return context;
  }

  private void declareVariable(Scope scope, String name, Node declaration, boolean isLoopTarget) {
    if (scope.isNonlocal(name)) {
      return;
    }
    if (scope.isGlobal(name) && !scope.isModuleScope()) {
      Scope moduleScope = table.getModuleScope(scope);
      if (!moduleScope.hasSlot(name)) {
        table.declare(
            moduleScope, name, SymbolKind.MODULE_VARIABLE, declaration, inFallbackBlock(), null);
      }
      return;
    }
    SymbolKind kind;
    if (scope.isModuleScope()) {
      kind = SymbolKind.MODULE_VARIABLE;
    } else if (isLoopTarget) {
      kind = SymbolKind.LOOP_VAR;
    } else {
      kind = SymbolKind.LOCAL_VAR;
    }
    declare(scope, name, kind, declaration);
  }

  private Symbol declare(Scope scope, String name, SymbolKind kind, Node declaration) {
    Node statement = scope.isModuleScope() ? NodeUtil.getTopLevelStatement(declaration) : null;
    return table.declare(scope, name, kind, declaration, inFallbackBlock(), statement);
  }

  private boolean inFallbackBlock() {
    return !fallbackBlocks.isEmpty();
  }
}
