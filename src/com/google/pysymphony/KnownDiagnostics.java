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

package com.google.pysymphony;

import com.google.common.collect.ImmutableSortedMap;
import com.google.pysymphony.audit.Auditor;
import com.google.pysymphony.linker.CircularDependencyException;
import com.google.pysymphony.linker.DependencyAnalyzer;
import com.google.pysymphony.linker.DiagnosticType;
import com.google.pysymphony.linker.ModuleLoader;
import com.google.pysymphony.linker.PyMerger;
import com.google.pysymphony.linker.ScopeBuilder;
import java.util.Set;
import org.jspecify.annotations.Nullable;

/** The diagnostics whose level can be changed from the command line, by key. */
final class KnownDiagnostics {

  private static final ImmutableSortedMap<String, DiagnosticType> BY_KEY =
      index(
          PyMerger.ENTRY_OUTSIDE_ROOT,
          ModuleLoader.WILDCARD_IMPORT,
          ModuleLoader.RELATIVE_IMPORT_BEYOND_ROOT,
          ModuleLoader.UNRESOLVED_RELATIVE_IMPORT,
          ModuleLoader.UNRESOLVED_IMPORT_NAME,
          ModuleLoader.PARSE_ERROR,
          ScopeBuilder.DUPLICATE_SYMBOL,
          DependencyAnalyzer.UNRESOLVED_REFERENCE,
          CircularDependencyException.CIRCULAR_DEPENDENCY,
          Auditor.UNDEFINED_REFERENCE,
          Auditor.MULTIPLE_MAIN_GUARDS,
          Auditor.DUPLICATE_IMPORT,
          Auditor.AUDIT_SYNTAX_ERROR);

  private KnownDiagnostics() {}

  private static ImmutableSortedMap<String, DiagnosticType> index(DiagnosticType... types) {
    ImmutableSortedMap.Builder<String, DiagnosticType> builder = ImmutableSortedMap.naturalOrder();
    for (DiagnosticType type : types) {
      builder.put(type.key(), type);
    }
    return builder.buildOrThrow();
  }

  static @Nullable DiagnosticType forKey(String key) {
    return BY_KEY.get(key);
  }

  static Set<String> keys() {
    return BY_KEY.keySet();
  }
}
