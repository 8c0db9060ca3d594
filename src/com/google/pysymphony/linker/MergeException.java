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

/**
 * Thrown when linking cannot continue. The diagnostic that caused the abort is attached so that
 * callers can report it through their {@link ErrorManager}.
 */
public class MergeException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  private final transient PyError error;

  public MergeException(PyError error) {
    super(error.format(CheckLevel.ERROR));
    this.error = error;
  }

  public PyError getError() {
    return error;
  }
}
