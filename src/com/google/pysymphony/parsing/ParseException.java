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

package com.google.pysymphony.parsing;

/** Thrown when a source file cannot be tokenized or parsed. */
public class ParseException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  private final String detail;
  private final String sourceName;
  private final int lineNumber;
  private final int columnNumber;

  public ParseException(String detail, String sourceName, int lineNumber, int columnNumber) {
    super(sourceName + ":" + lineNumber + ":" + columnNumber + ": " + detail);
    this.detail = detail;
    this.sourceName = sourceName;
    this.lineNumber = lineNumber;
    this.columnNumber = columnNumber;
  }

  /** The message without the location prefix. */
  public String getDetail() {
    return detail;
  }

  public String getSourceName() {
    return sourceName;
  }

  public int getLineNumber() {
    return lineNumber;
  }

  public int getColumnNumber() {
    return columnNumber;
  }
}
