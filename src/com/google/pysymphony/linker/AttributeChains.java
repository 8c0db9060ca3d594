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
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * Resolves dotted attribute chains such as {@code pkg.sub.Thing} that start at an alias of a
 * project module, walking through module names until a symbol is reached.
 */
final class AttributeChains {

  /**
   * The outcome of walking a chain.
   *
   * @param symbols every alias and symbol passed on the way, including the root alias
   * @param target the symbol the chain prefix of {@code length} segments denotes, or null if the
   *     chain ends at a module or at a name the module does not define
   * @param length the number of leading segments that denote {@code target}
   */
  record Resolution(ImmutableList<Symbol> symbols, @Nullable Symbol target, int length) {}

  private AttributeChains() {}

  /**
   * Walks {@code chain}, whose first segment resolved to {@code root}. Returns null if {@code root}
   * does not denote a project module.
   */
  static @Nullable Resolution resolve(MergeContext context, Symbol root, List<String> chain) {
    SymbolTable table = context.getSymbolTable();
    ImmutableList.Builder<Symbol> symbols = ImmutableList.builder();
    symbols.add(root);
    Symbol terminal = table.getTerminalTarget(root);
    if (terminal != root) {
      symbols.add(terminal);
    }
    String module = terminal.getTargetModule();
    if (module == null || terminal.isInFallbackBlock()) {
      return null;
    }
    for (int i = 1; i < chain.size(); i++) {
      String segment = chain.get(i);
      ModuleRecord record = context.getModule(module);
      Symbol slot = record == null ? null : record.getScope().getSlot(segment);
      if (slot == null) {
        String submodule = SymbolTable.qualify(module, segment);
        if (context.isKnownModule(submodule)) {
          module = submodule;
          continue;
        }
        return new Resolution(symbols.build(), null, i);
      }
      symbols.add(slot);
      Symbol next = table.getTerminalTarget(slot);
      if (next != slot) {
        symbols.add(next);
      }
      if (next.getTargetModule() == null || next.isInFallbackBlock()) {
        return new Resolution(symbols.build(), next, i + 1);
      }
      module = next.getTargetModule();
    }
    return new Resolution(symbols.build(), null, chain.size());
  }
}
