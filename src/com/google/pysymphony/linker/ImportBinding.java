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

import org.jspecify.annotations.Nullable;

/**
 * Where an import alias points, as written and as resolved against the project tree.
 *
 * @param moduleName The module as written: the dotted name of an {@code import}, or the source
 *     module of a {@code from} import, possibly empty for {@code from . import x}.
 * @param level The number of leading dots of a relative import.
 * @param importedName The name after {@code import} in a {@code from} import, null otherwise.
 * @param resolvedModule The qualified name of the project module the import resolved to, or null
 *     when it is a library import or could not be resolved.
 * @param missing Whether the import is relative or otherwise known to be a project import but no
 *     file could be found. Only tolerated inside a fallback-import block.
 */
public record ImportBinding(
    String moduleName,
    int level,
    @Nullable String importedName,
    @Nullable String resolvedModule,
    boolean missing) {

  public boolean isFromImport() {
    return importedName != null;
  }

  public boolean isInternal() {
    return resolvedModule != null;
  }

  public boolean isExternal() {
    return resolvedModule == null && !missing;
  }

  /** The import as source text, used to tell apart aliases that share a name. */
  public String describe() {
    String module = ".".repeat(level) + moduleName;
    return importedName == null ? "import " + module : "from " + module + " import " + importedName;
  }
}
