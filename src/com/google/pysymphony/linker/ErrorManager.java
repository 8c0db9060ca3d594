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

/** The error handler used while linking. */
public interface ErrorManager {

  /**
   * Reports an error. The level is the effective level after option overrides have been applied.
   */
  void report(CheckLevel level, PyError error);

  /** Writes a report of all the diagnostics reported so far. */
  void generateReport();

  int getErrorCount();

  int getWarningCount();

  ImmutableList<PyError> getErrors();

  ImmutableList<PyError> getWarnings();
}
