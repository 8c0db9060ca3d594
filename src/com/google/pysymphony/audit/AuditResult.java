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

package com.google.pysymphony.audit;

import com.google.common.collect.ImmutableList;
import com.google.pysymphony.linker.PyError;

/**
 * The findings of an audit.
 *
 * @param ok whether the program passed every check
 * @param diagnostics every finding, in source order
 */
public record AuditResult(boolean ok, ImmutableList<PyError> diagnostics) {

  static AuditResult of(ImmutableList<PyError> diagnostics) {
    return new AuditResult(diagnostics.isEmpty(), diagnostics);
  }
}
