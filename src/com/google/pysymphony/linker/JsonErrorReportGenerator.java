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

import com.google.gson.stream.JsonWriter;
import com.google.pysymphony.linker.SortingErrorManager.ErrorReportGenerator;
import com.google.pysymphony.linker.SortingErrorManager.Reported;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

/**
 * An error report generator that prints error and warning data to the print stream as an array of
 * JSON objects.
 */
public class JsonErrorReportGenerator implements ErrorReportGenerator {
  private final PrintStream stream;

  /**
   * @param stream the stream on which the errors and warnings should be printed. This class does
   *     not close the stream
   */
  public JsonErrorReportGenerator(PrintStream stream) {
    this.stream = stream;
  }

  @Override
  public void generateReport(SortingErrorManager manager) {
    ByteArrayOutputStream bufferedStream = new ByteArrayOutputStream();
    try (JsonWriter jsonWriter =
        new JsonWriter(new OutputStreamWriter(bufferedStream, StandardCharsets.UTF_8))) {
      jsonWriter.beginArray();
      for (Reported reported : manager.getDiagnostics()) {
        PyError error = reported.error();
        jsonWriter.beginObject();
        jsonWriter.name("level").value(reported.level().label());
        jsonWriter.name("description").value(error.description());
        jsonWriter.name("key").value(error.type().key());
        jsonWriter.name("source").value(error.sourceName());
        jsonWriter.name("line").value(error.lineno());
        jsonWriter.name("column").value(error.charno());
        jsonWriter.endObject();
      }

      jsonWriter.beginObject();
      jsonWriter.name("level").value("info");
      jsonWriter
          .name("description")
          .value(
              String.format(
                  "%d error(s), %d warning(s)",
                  manager.getErrorCount(), manager.getWarningCount()));
      jsonWriter.endObject();

      jsonWriter.endArray();
      jsonWriter.flush();
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
    stream.append(bufferedStream.toString(StandardCharsets.UTF_8));
  }
}
