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
import java.util.ArrayList;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * A try statement whose handler catches {@code ImportError} or {@code ModuleNotFoundError}. The
 * arms of the statement bind the same names in different ways, and which arm wins is only known
 * at runtime, so the statement is emitted with its control structure intact.
 */
public final class FallbackBlock {
  private final Node tryNode;
  private final String moduleName;
  private final @Nullable Symbol enclosingSymbol;
  private final List<Symbol> aliases = new ArrayList<>();

  FallbackBlock(Node tryNode, String moduleName, @Nullable Symbol enclosingSymbol) {
    this.tryNode = tryNode;
    this.moduleName = moduleName;
    this.enclosingSymbol = enclosingSymbol;
  }

  public Node getTryNode() {
    return tryNode;
  }

  public String getModuleName() {
    return moduleName;
  }

  /** The function or class whose body contains the block, or null for a module level block. */
  public @Nullable Symbol getEnclosingSymbol() {
    return enclosingSymbol;
  }

  /** Whether the block is a statement of its module rather than part of a definition. */
  public boolean isTopLevel() {
    Node parent = tryNode.getParent();
    return parent != null && parent.getToken() == Token.MODULE;
  }

  /** The import aliases bound by every arm of the block, in source order. */
  public ImmutableList<Symbol> getAliases() {
    return ImmutableList.copyOf(aliases);
  }

  void addAlias(Symbol alias) {
    aliases.add(alias);
  }

  @Override
  public String toString() {
    return "FallbackBlock(" + tryNode.getSourceFileName() + ":" + tryNode.getLineno() + ")";
  }
}
