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
import com.google.pysymphony.ast.Node;
import java.util.LinkedHashSet;
import java.util.Set;
import org.jspecify.annotations.Nullable;

/**
 * A named binding in a {@link Scope}. Two symbols are equal when they have the same qualified
 * name and live in the same scope, so a redefinition replaces the earlier binding.
 */
public final class Symbol {
  private final String name;
  private final String qualifiedName;
  private final SymbolKind kind;
  private final Node declarationNode;
  private final int scopeIndex;
  private final String moduleName;
  private final int declarationIndex;
  private final boolean inFallbackBlock;
  private final boolean nested;
  private final @Nullable Node statement;

  private @Nullable ImportBinding importBinding;
  private @Nullable FallbackBlock fallbackBlock;
  private @Nullable Symbol aliasTarget;
  private @Nullable String targetModule;
  private final Set<Symbol> dependencies = new LinkedHashSet<>();

  Symbol(
      String name,
      String qualifiedName,
      SymbolKind kind,
      Node declarationNode,
      int scopeIndex,
      String moduleName,
      int declarationIndex,
      boolean inFallbackBlock,
      boolean nested,
      @Nullable Node statement) {
    this.name = name;
    this.qualifiedName = qualifiedName;
    this.kind = kind;
    this.declarationNode = declarationNode;
    this.scopeIndex = scopeIndex;
    this.moduleName = moduleName;
    this.declarationIndex = declarationIndex;
    this.inFallbackBlock = inFallbackBlock;
    this.nested = nested;
    this.statement = statement;
  }

  public String getName() {
    return name;
  }

  public String getQualifiedName() {
    return qualifiedName;
  }

  public SymbolKind getKind() {
    return kind;
  }

  /**
   * The node that declares the symbol: the FUNCTION_DEF or CLASS_DEF, the IMPORT_ALIAS, the PARAM,
   * the bound NAME, or the MODULE for a module init symbol.
   */
  public Node getDeclarationNode() {
    return declarationNode;
  }

  public int getScopeIndex() {
    return scopeIndex;
  }

  public String getModuleName() {
    return moduleName;
  }

  /** A counter that orders symbols by the time they were declared, across all modules. */
  public int getDeclarationIndex() {
    return declarationIndex;
  }

  /** Whether the symbol was bound inside a try/except that guards an ImportError. */
  public boolean isInFallbackBlock() {
    return inFallbackBlock;
  }

  /** Whether the symbol is declared inside a function body. */
  public boolean isNested() {
    return nested;
  }

  /** For module scope symbols, the top-level statement that binds the symbol. */
  public @Nullable Node getStatement() {
    return statement;
  }

  public @Nullable ImportBinding getImportBinding() {
    return importBinding;
  }

  void setImportBinding(ImportBinding importBinding) {
    this.importBinding = importBinding;
  }

  public @Nullable FallbackBlock getFallbackBlock() {
    return fallbackBlock;
  }

  void setFallbackBlock(FallbackBlock fallbackBlock) {
    this.fallbackBlock = fallbackBlock;
  }

  /** For a {@code from} import of a project symbol, the symbol it imports. */
  public @Nullable Symbol getAliasTarget() {
    return aliasTarget;
  }

  void setAliasTarget(Symbol aliasTarget) {
    this.aliasTarget = aliasTarget;
  }

  /** For an alias bound to a project module object, the qualified name of that module. */
  public @Nullable String getTargetModule() {
    return targetModule;
  }

  void setTargetModule(String targetModule) {
    this.targetModule = targetModule;
  }

  public boolean isImportAlias() {
    return kind == SymbolKind.IMPORT_ALIAS;
  }

  /** Whether this alias binds a library that stays an import statement in the output. */
  public boolean isExternalAlias() {
    return importBinding != null && importBinding.isExternal();
  }

  public ImmutableSet<Symbol> getDependencies() {
    return ImmutableSet.copyOf(dependencies);
  }

  void addDependencies(Set<Symbol> symbols) {
    for (Symbol symbol : symbols) {
      if (!symbol.equals(this)) {
        dependencies.add(symbol);
      }
    }
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof Symbol)) {
      return false;
    }
    Symbol other = (Symbol) o;
    return scopeIndex == other.scopeIndex && qualifiedName.equals(other.qualifiedName);
  }

  @Override
  public int hashCode() {
    return 31 * qualifiedName.hashCode() + scopeIndex;
  }

  @Override
  public String toString() {
    return kind + " " + qualifiedName;
  }
}
