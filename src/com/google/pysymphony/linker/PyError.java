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

import static com.google.common.base.Strings.emptyToNull;
import static java.util.Objects.requireNonNull;

import com.google.pysymphony.ast.Node;
import org.jspecify.annotations.Nullable;

/**
 * A diagnostic with its source location.
 *
 * @param type A type of the error.
 * @param description Description of the error.
 * @param sourceName Name of the source
 * @param lineno One-indexed line number of the error location.
 * @param charno Zero-indexed character number of the error location.
 * @param node Node where the diagnostic occurred.
 * @param defaultLevel The default level, before any option overrides are applied.
 */
public record PyError(
    DiagnosticType type,
    String description,
    @Nullable String sourceName,
    int lineno,
    int charno,
    @Nullable Node node,
    CheckLevel defaultLevel) {
  public PyError {
    requireNonNull(type, "type");
    requireNonNull(description, "description");
    requireNonNull(defaultLevel, "defaultLevel");
  }

  /**
   * Creates a PyError with no source information
   *
   * @param type The DiagnosticType
   * @param arguments Arguments to be incorporated into the message
   */
  public static PyError make(DiagnosticType type, String... arguments) {
    return new PyError(type, type.format(arguments), null, -1, -1, null, type.level());
  }

  /**
   * Creates a PyError at a given source location
   *
   * @param sourceName The source file name
   * @param lineno Line number with source file, or -1 if unknown
   * @param charno Column number within line, or -1 for whole line.
   * @param type The DiagnosticType
   * @param arguments Arguments to be incorporated into the message
   */
  public static PyError make(
      String sourceName, int lineno, int charno, DiagnosticType type, String... arguments) {
    return new PyError(
        type, type.format(arguments), sourceName, lineno, charno, null, type.level());
  }

  /**
   * Creates a PyError from a file and Node position.
   *
   * @param n Determines the line and char position and source file name
   * @param type The DiagnosticType
   * @param arguments Arguments to be incorporated into the message
   */
  public static PyError make(Node n, DiagnosticType type, String... arguments) {
    return new PyError(
        type,
        type.format(arguments),
        n.getSourceFileName(),
        n.getLineno(),
        n.getCharno(),
        n,
        type.level());
  }

  /** Renders the diagnostic the way the command line prints it. */
  public String format(CheckLevel level) {
    StringBuilder sb = new StringBuilder();
    if (sourceName != null) {
      sb.append(sourceName);
      if (lineno > 0) {
        sb.append(':').append(lineno);
        if (charno >= 0) {
          sb.append(':').append(charno);
        }
      }
      sb.append(": ");
    }
    return sb.append(level)
        .append(" - [")
        .append(type.key())
        .append("] ")
        .append(description)
        .toString();
  }

  /** @return the default rendering of an error as text. */
  @Override
  public String toString() {
    String source = emptyToNull(sourceName) != null ? sourceName : "(unknown source)";
    String line = lineno != -1 ? String.valueOf(lineno) : "(unknown line)";
    String column = charno != -1 ? String.valueOf(charno) : "(unknown column)";
    return type.key() + ". " + description + " at " + source + " line " + line + " : "
        + column;
  }
}
