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

import com.google.common.collect.ImmutableMap;

/**
 * The names module-level bindings receive in the merged output. Symbols without an entry keep
 * their original name.
 */
public final class NameMapping {

  private final ImmutableMap<Symbol, String> names;

  NameMapping(ImmutableMap<Symbol, String> names) {
    this.names = names;
  }

  public String getName(Symbol symbol) {
    return names.getOrDefault(symbol, symbol.getName());
  }

  public boolean isRenamed(Symbol symbol) {
    return !getName(symbol).equals(symbol.getName());
  }

  public ImmutableMap<Symbol, String> asMap() {
    return names;
  }

  @Override
  public String toString() {
    return names.toString();
  }
}
