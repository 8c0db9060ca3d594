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

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.pysymphony.ast.Node;
import com.google.pysymphony.ast.Token;
import org.jspecify.annotations.Nullable;

/**
 * Walks a syntax tree while tracking the scope each node is evaluated in.
 *
 * <p>Decorators, base classes, parameter defaults and annotations of a definition are evaluated in
 * the enclosing scope and its body in the definition's own scope. The first iterable of a
 * comprehension is evaluated in the enclosing scope and the rest of the comprehension in its own
 * scope.
 */
public final class NodeTraversal {
  private final Callback callback;
  private final ScopeCreator scopeCreator;
  private Scope scope;

  /** Callback for tree-based traversals */
  public interface Callback {
    /**
     * Visits a node in preorder (before its children) and decides whether the node and its
     * children should be traversed.
     *
     * <p>If this method returns false, neither the node nor its subtree is visited by {@link
     * #visit}. Implementations may modify the tree below {@code n}.
     */
    boolean shouldTraverse(NodeTraversal t, Node n, @Nullable Node parent);

    /** Visits a node in postorder (after its children). */
    void visit(NodeTraversal t, Node n, @Nullable Node parent);
  }

  /** Abstract callback to visit all nodes in postorder. */
  public abstract static class AbstractPostOrderCallback implements Callback {
    @Override
    public final boolean shouldTraverse(NodeTraversal t, Node n, @Nullable Node parent) {
      return true;
    }
  }

  /** Provides the scope opened by a definition, lambda or comprehension node. */
  public interface ScopeCreator {
    Scope createScope(Node root, Scope outer);
  }

  private NodeTraversal(Callback callback, ScopeCreator scopeCreator, Scope scope) {
    this.callback = callback;
    this.scopeCreator = scopeCreator;
    this.scope = scope;
  }

  /** Traverses {@code root}, which is evaluated in {@code scope}, using already built scopes. */
  public static void traverse(SymbolTable table, Node root, Scope scope, Callback callback) {
    ScopeCreator lookup =
        (n, outer) -> checkNotNull(table.getScopeForRoot(n), "no scope for %s", n);
    traverse(root, scope, callback, lookup);
  }

  public static void traverse(
      Node root, Scope scope, Callback callback, ScopeCreator scopeCreator) {
    new NodeTraversal(callback, scopeCreator, scope).traverseBranch(root, root.getParent());
  }

  /** The scope the node currently being visited is evaluated in. */
  public Scope getScope() {
    return scope;
  }

  private void traverseBranch(Node n, @Nullable Node parent) {
    if (!callback.shouldTraverse(this, n, parent)) {
      return;
    }
    switch (n.getToken()) {
      case FUNCTION_DEF:
        traverseFunction(n);
        break;
      case CLASS_DEF:
        traverseClass(n);
        break;
      case LAMBDA:
        traverseLambda(n);
        break;
      case LIST_COMP:
      case SET_COMP:
      case DICT_COMP:
      case GENERATOR_EXP:
        traverseComprehension(n);
        break;
      default:
        traverseChildren(n);
        break;
    }
    callback.visit(this, n, parent);
  }

  private void traverseChildren(Node n) {
    for (Node child : n.childrenSnapshot()) {
      traverseBranch(child, n);
    }
  }

  private void traverseFunction(Node n) {
    Scope outer = scope;
    Scope inner = scopeCreator.createScope(n, outer);
    // Decorators, parameter list and return annotation.
    for (int i = 0; i < 3; i++) {
      traverseBranch(n.getChildAtIndex(i), n);
    }
    scope = inner;
    traverseBranch(n.getLastChild(), n);
    scope = outer;
  }

  private void traverseClass(Node n) {
    Scope outer = scope;
    Scope inner = scopeCreator.createScope(n, outer);
    traverseBranch(n.getFirstChild(), n);
    traverseBranch(n.getSecondChild(), n);
    scope = inner;
    traverseBranch(n.getLastChild(), n);
    scope = outer;
  }

  private void traverseLambda(Node n) {
    Scope outer = scope;
    Scope inner = scopeCreator.createScope(n, outer);
    traverseBranch(n.getFirstChild(), n);
    scope = inner;
    traverseBranch(n.getLastChild(), n);
    scope = outer;
  }

  private void traverseComprehension(Node n) {
    Scope outer = scope;
    Scope inner = scopeCreator.createScope(n, outer);
    scope = inner;
    boolean first = true;
    for (Node child : n.childrenSnapshot()) {
      if (first && child.getToken() == Token.COMP_FOR) {
        first = false;
        traverseFirstFor(child, n, outer);
      } else {
        traverseBranch(child, n);
      }
    }
    scope = outer;
  }

  private void traverseFirstFor(Node compFor, Node parent, Scope outer) {
    if (!callback.shouldTraverse(this, compFor, parent)) {
      return;
    }
    Scope inner = scope;
    for (Node child : compFor.childrenSnapshot()) {
      if (child == compFor.getSecondChild()) {
        scope = outer;
        traverseBranch(child, compFor);
        scope = inner;
      } else {
        traverseBranch(child, compFor);
      }
    }
    callback.visit(this, compFor, parent);
  }
}
