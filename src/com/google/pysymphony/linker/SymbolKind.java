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

/** What kind of binding a {@link Symbol} is. */
public enum SymbolKind {
  FUNCTION,
  ASYNC_FUNCTION,
  CLASS,
  MODULE_VARIABLE,
  IMPORT_ALIAS,
  PARAMETER,
  LOOP_VAR,
  LOCAL_VAR,
  /** The top-level statements of a module that are not definitions. One per module. */
  MODULE_INIT;

  /** Whether a symbol of this kind can appear in a dependency set. */
  public boolean isLinkable() {
    switch (this) {
      case FUNCTION:
      case ASYNC_FUNCTION:
      case CLASS:
      case MODULE_VARIABLE:
      case IMPORT_ALIAS:
        return true;
      default:
        return false;
    }
  }

  public boolean isFunction() {
    return this == FUNCTION || this == ASYNC_FUNCTION;
  }

  /** Functions and classes, which are emitted as a unit with their whole body. */
  public boolean isDefinition() {
    return isFunction() || this == CLASS;
  }
}
