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
 * The level a diagnostic is reported at. Options can move any {@link DiagnosticType} between
 * levels without touching the pass that reports it.
 */
public enum CheckLevel {
  ERROR("error"),
  WARNING("warning"),
  OFF("off");

  private final String label;

  CheckLevel(String label) {
    this.label = label;
  }

  /** The lower case name used on the command line and in JSON reports. */
  public String label() {
    return label;
  }

  boolean isOn() {
    return this != OFF;
  }
}
