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

/**
 * Thrown when the definitions to emit cannot be ordered. Each cycle is a strongly connected
 * component of the dependency graph, listed by fully qualified name.
 */
public final class CircularDependencyException extends MergeException {
  private static final long serialVersionUID = 1L;

  public static final DiagnosticType CIRCULAR_DEPENDENCY =
      DiagnosticType.error(
          "PYS_CIRCULAR_DEPENDENCY", "Circular dependency detected among symbols: {0}");

  private final ImmutableList<ImmutableList<String>> cycles;

  public CircularDependencyException(ImmutableList<ImmutableList<String>> cycles) {
    super(PyError.make(CIRCULAR_DEPENDENCY, describe(cycles)));
    this.cycles = cycles;
  }

  /** The strongly connected components, each sorted by qualified name. */
  public ImmutableList<ImmutableList<String>> getCycles() {
    return cycles;
  }

  private static String describe(ImmutableList<ImmutableList<String>> cycles) {
    StringBuilder sb = new StringBuilder();
    for (ImmutableList<String> cycle : cycles) {
      if (sb.length() > 0) {
        sb.append("; ");
      }
      sb.append(String.join(" -> ", cycle));
    }
    return sb.toString();
  }
}
