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
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import org.jspecify.annotations.Nullable;

/**
 * A lexical scope. Scopes are allocated in a {@link SymbolTable} and refer to their parent by
 * index, so the tree has no object cycles.
 */
public final class Scope {
  private final int index;
  private final int parentIndex;
  private final ScopeKind kind;
  private final Node rootNode;
  private final String moduleName;
  private final String qualifiedName;
  private final @Nullable Symbol owner;
  private final Map<String, Symbol> slots = new LinkedHashMap<>();
  private final Set<String> nonlocalNames = new LinkedHashSet<>();
  private final Set<String> globalNames = new LinkedHashSet<>();

  Scope(
      int index,
      int parentIndex,
      ScopeKind kind,
      Node rootNode,
      String moduleName,
      String qualifiedName,
      @Nullable Symbol owner) {
    this.index = index;
    this.parentIndex = parentIndex;
    this.kind = kind;
    this.rootNode = rootNode;
    this.moduleName = moduleName;
    this.qualifiedName = qualifiedName;
    this.owner = owner;
  }

  public int getIndex() {
    return index;
  }

  /** The index of the enclosing scope, or -1 for a module scope. */
  public int getParentIndex() {
    return parentIndex;
  }

  public ScopeKind getKind() {
    return kind;
  }

  public boolean isModuleScope() {
    return kind == ScopeKind.MODULE;
  }

  public boolean isClassScope() {
    return kind == ScopeKind.CLASS;
  }

  public boolean isFunctionScope() {
    return kind == ScopeKind.FUNCTION;
  }

  public boolean isComprehensionScope() {
    return kind == ScopeKind.COMPREHENSION;
  }

  /** The MODULE, FUNCTION_DEF, LAMBDA, CLASS_DEF or comprehension node that opens the scope. */
  public Node getRootNode() {
    return rootNode;
  }

  public String getModuleName() {
    return moduleName;
  }

  /** The prefix of the qualified names of symbols declared here. */
  public String getQualifiedName() {
    return qualifiedName;
  }

  /** The function or class whose body this is, null for modules, lambdas and comprehensions. */
  public @Nullable Symbol getOwner() {
    return owner;
  }

  public @Nullable Symbol getSlot(String name) {
    return slots.get(name);
  }

  public boolean hasSlot(String name) {
    return slots.containsKey(name);
  }

  public ImmutableList<Symbol> getSymbols() {
    return ImmutableList.copyOf(slots.values());
  }

  void setSlot(Symbol symbol) {
    slots.put(symbol.getName(), symbol);
  }

  void declareNonlocal(String name) {
    nonlocalNames.add(name);
  }

  void declareGlobal(String name) {
    globalNames.add(name);
  }

  public boolean isNonlocal(String name) {
    return nonlocalNames.contains(name);
  }

  public boolean isGlobal(String name) {
    return globalNames.contains(name);
  }

  @Override
  public String toString() {
    return "Scope(" + kind + " " + (qualifiedName.isEmpty() ? "<root>" : qualifiedName) + ")";
  }
}
