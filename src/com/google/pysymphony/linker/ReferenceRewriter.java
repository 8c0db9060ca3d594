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
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.logging.Logger;
import org.jspecify.annotations.Nullable;

/**
 * Rewrites the statements that go into the merged output so that every reference uses the name
 * its target receives there.
 *
 * <p>Module-level bindings are renamed according to a {@link NameMapping}. Project imports are
 * removed and references through them, including dotted chains such as {@code pkg.util.helper},
 * collapse to the emitted name of the definition they denote. Library imports stay in place,
 * renamed when they are bound at module level.
 *
 * <p>The same walk can run without changing anything to find references that a local binding
 * would capture under the proposed names.
 */
final class ReferenceRewriter {

  private static final Logger logger = Logger.getLogger(ReferenceRewriter.class.getName());

  /** What a scan found: symbols whose emitted name is shadowed somewhere it is read. */
  static final class Captures {
    private final Set<Symbol> captured = new LinkedHashSet<>();
    private final Set<String> usedBuiltins = new TreeSet<>();

    ImmutableSet<Symbol> getCaptured() {
      return ImmutableSet.copyOf(captured);
    }

    /** Builtin names read anywhere in the scanned code. */
    ImmutableSet<String> getUsedBuiltins() {
      return ImmutableSet.copyOf(usedBuiltins);
    }
  }

  private final MergeContext context;
  private final SymbolTable table;
  private final NameMapping mapping;

  ReferenceRewriter(MergeContext context, NameMapping mapping) {
    this.context = context;
    this.table = context.getSymbolTable();
    this.mapping = mapping;
  }

  /** Rewrites a top-level statement of {@code module} in place. */
  void rewrite(Node statement, ModuleRecord module) {
    NodeTraversal.traverse(table, statement, module.getScope(), new Rewriter(module, null));
  }

  /** Checks a top-level statement of {@code module} against the mapping without changing it. */
  void scan(Node statement, ModuleRecord module, Captures captures) {
    NodeTraversal.traverse(table, statement, module.getScope(), new Rewriter(module, captures));
  }

  /** The statements that import a single module-level library alias under its emitted name. */
  ImmutableList<Node> rewriteHoistedImport(Node alias) {
    return rewriteImportAliases(alias.getParent(), ImmutableList.of(alias), true);
  }

  /**
   * Whether references to {@code symbol} are replaced by references to what it imports: true for
   * project imports outside fallback blocks.
   */
  static boolean isCollapsed(Symbol symbol) {
    ImportBinding binding = symbol.getImportBinding();
    return symbol.isImportAlias()
        && !symbol.isInFallbackBlock()
        && binding != null
        && binding.isInternal();
  }

  /**
   * The module-level symbol whose emitted name replaces a reference to {@code symbol}, or null if
   * the reference is left alone.
   */
  @Nullable Symbol resolveTarget(Symbol symbol) {
    if (isCollapsed(symbol)) {
      Symbol terminal = table.getTerminalTarget(symbol);
      if (terminal == symbol || isCollapsed(terminal)) {
        // An alias of a module object, or of a name the module never defines.
        return null;
      }
      return resolveTarget(terminal);
    }
    return table.getScopeOf(symbol).isModuleScope() ? symbol : null;
  }

  private ImmutableList<Node> rewriteImportAliases(
      Node statement, List<Node> aliases, boolean moduleLevel) {
    ImmutableList.Builder<Node> replacement = ImmutableList.builder();
    Node pending = null;
    for (Node alias : aliases) {
      Symbol symbol = table.getDeclaredSymbol(alias);
      if (symbol == null) {
        pending = appendAlias(replacement, pending, statement, alias.cloneTree());
        continue;
      }
      if (isCollapsed(symbol)) {
        continue;
      }
      String boundName = moduleLevel ? mapping.getName(symbol) : symbol.getName();
      Symbol aliasTarget = symbol.getAliasTarget();
      Symbol target = aliasTarget == null ? null : resolveTarget(aliasTarget);
      if (target != null) {
        pending = flush(replacement, pending);
        replacement.add(
            new Node(
                    Token.ASSIGN,
                    Node.newName(boundName).putBooleanProp(Node.Prop.STORE, true),
                    Node.newName(mapping.getName(target)))
                .srcref(alias));
        continue;
      }
      if (boundName.equals(symbol.getName())) {
        pending = appendAlias(replacement, pending, statement, alias.cloneTree());
      } else if (statement.getToken() == Token.IMPORT
          && alias.getAlias() == null
          && alias.getString().contains(".")) {
        pending = flush(replacement, pending);
        replacement.add(NodeUtil.newImportAssignment(boundName, alias.getString()).srcref(alias));
      } else {
        Node renamed = alias.cloneTree();
        renamed.setAlias(boundName);
        pending = appendAlias(replacement, pending, statement, renamed);
      }
    }
    flush(replacement, pending);
    return replacement.build();
  }

  private static Node appendAlias(
      ImmutableList.Builder<Node> replacement,
      @Nullable Node pending,
      Node statement,
      Node alias) {
    Node target = pending;
    if (target == null) {
      target = new Node(statement.getToken()).srcref(statement);
      target.setString(statement.getStringOrNull());
      target.setIntValue(statement.getIntValue());
    }
    target.addChildToBack(alias);
    return target;
  }

  private static @Nullable Node flush(
      ImmutableList.Builder<Node> replacement, @Nullable Node pending) {
    if (pending != null) {
      replacement.add(pending);
    }
    return null;
  }

  private static boolean isAssignmentTarget(Node n) {
    Node parent = n.getParent();
    if (parent == null) {
      return false;
    }
    switch (parent.getToken()) {
      case ASSIGN:
        return parent.getLastChild() != n;
      case AUG_ASSIGN:
      case ANN_ASSIGN:
      case FOR:
        return parent.getFirstChild() == n;
      case DEL:
        return true;
      default:
        return false;
    }
  }

  private final class Rewriter implements NodeTraversal.Callback {
    private final ModuleRecord module;
    private final @Nullable Captures captures;

    Rewriter(ModuleRecord module, @Nullable Captures captures) {
      this.module = module;
      this.captures = captures;
    }

    @Override
    public boolean shouldTraverse(NodeTraversal t, Node n, @Nullable Node parent) {
      switch (n.getToken()) {
        case IMPORT:
        case IMPORT_FROM:
          if (captures == null && !NodeUtil.isFutureImport(n)) {
            rewriteImport(t.getScope(), n);
          }
          return false;
        case GLOBAL:
          for (Node identifier : n.children()) {
            renameGlobal(t.getScope(), identifier);
          }
          return false;
        case NONLOCAL:
          return false;
        case FUNCTION_DEF:
        case CLASS_DEF:
        case EXCEPT:
          renameDeclaration(n);
          return true;
        case GETATTR:
          return !(NodeUtil.isOutermostGetattr(n) && collapseChain(t.getScope(), n));
        case NAME:
          renameReference(t.getScope(), n, parent);
          return true;
        case ASSIGN:
          if (captures == null
              && parent != null
              && parent.getToken() == Token.MODULE
              && module == context.getEntryModule()
              && n.getChildCount() == 2
              && n.getFirstChild().isName()
              && n.getFirstChild().getString().equals("__all__")) {
            rewriteExportList(n.getLastChild());
          }
          return true;
        default:
          return true;
      }
    }

    @Override
    public void visit(NodeTraversal t, Node n, @Nullable Node parent) {}

    private void rewriteImport(Scope scope, Node n) {
      ImmutableList<Node> replacement =
          rewriteImportAliases(n, n.children(), scope.isModuleScope());
      Node parent = n.getParent();
      for (Node statement : replacement) {
        parent.addChildBefore(statement, n);
      }
      n.detach();
      if (parent.getToken() == Token.SUITE && !parent.hasChildren()) {
        parent.addChildToBack(NodeUtil.newPass().srcref(n));
      }
    }

    private void renameGlobal(Scope scope, Node identifier) {
      Symbol symbol = table.getModuleScope(scope).getSlot(identifier.getString());
      Symbol target = symbol == null ? null : resolveTarget(symbol);
      if (target != null && captures == null) {
        identifier.setString(mapping.getName(target));
      }
    }

    private void renameDeclaration(Node n) {
      Symbol symbol = table.getDeclaredSymbol(n);
      if (symbol == null || !table.getScopeOf(symbol).isModuleScope() || captures != null) {
        return;
      }
      n.setString(mapping.getName(symbol));
    }

    private void renameReference(Scope scope, Node n, @Nullable Node parent) {
      String name = n.getString();
      Symbol symbol = table.lookup(scope, name);
      if (symbol == null) {
        if (captures != null
            && BuiltinNames.isBuiltin(name)
            && DependencyAnalyzer.isLoad(n, parent)) {
          captures.usedBuiltins.add(name);
        }
        return;
      }
      Symbol target = resolveTarget(symbol);
      if (target == null) {
        return;
      }
      replaceName(scope, n, target);
    }

    private void replaceName(Scope scope, Node n, Symbol target) {
      String emitted = mapping.getName(target);
      if (captures != null) {
        Scope declaring = table.findDeclaringScope(scope, emitted);
        if (declaring != null && !declaring.isModuleScope()) {
          logger.fine(() -> "Reference to " + emitted + " captured in " + scope);
          captures.captured.add(target);
        }
      } else if (!emitted.equals(n.getString())) {
        n.setString(emitted);
      }
    }

    /** Returns whether the chain was replaced by a plain name. */
    private boolean collapseChain(Scope scope, Node n) {
      List<String> chain = NodeUtil.getAttributeChain(n);
      if (chain == null) {
        return false;
      }
      Symbol root = table.lookup(scope, chain.get(0));
      if (root == null || !root.isImportAlias()) {
        return false;
      }
      AttributeChains.Resolution resolution = AttributeChains.resolve(context, root, chain);
      if (resolution == null || resolution.target() == null) {
        return false;
      }
      Symbol target = resolveTarget(resolution.target());
      if (target == null
          || (resolution.length() == chain.size() && isAssignmentTarget(n))) {
        return false;
      }
      Node prefix = NodeUtil.getChainPrefix(n, resolution.length());
      if (captures != null) {
        replaceName(scope, prefix, target);
        return true;
      }
      Node name = Node.newName(mapping.getName(target)).srcref(prefix);
      if (prefix.isParenthesized()) {
        name.putBooleanProp(Node.Prop.PARENTHESIZED, true);
      }
      prefix.replaceWith(name);
      return true;
    }

    private void rewriteExportList(Node value) {
      if (value.getToken() != Token.LIST && value.getToken() != Token.TUPLE) {
        return;
      }
      for (Node element : value.children()) {
        if (element.getToken() != Token.STRING) {
          continue;
        }
        String literal = element.getString();
        char quote = literal.charAt(0);
        if ((quote != '\'' && quote != '"') || literal.length() < 2) {
          continue;
        }
        Symbol symbol = module.getScope().getSlot(literal.substring(1, literal.length() - 1));
        Symbol target = symbol == null ? null : resolveTarget(symbol);
        if (target != null) {
          element.setString(quote + mapping.getName(target) + quote);
        }
      }
    }
  }
}
