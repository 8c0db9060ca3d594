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

import com.google.common.collect.ImmutableMap;
import java.io.Serializable;
import java.util.LinkedHashMap;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/** Options for a single merge. */
public class MergeOptions implements Serializable {
  private static final long serialVersionUID = 1L;

  /** Whether each emitted definition is preceded by a comment naming its source file. */
  private boolean emitSourceComments = true;

  /** Whether the docstring of the entry script is kept at the top of the bundle. */
  private boolean preserveEntryDocstring = true;

  private final Map<DiagnosticType, CheckLevel> warningLevels = new LinkedHashMap<>();

  public MergeOptions() {}

  public boolean shouldEmitSourceComments() {
    return emitSourceComments;
  }

  public void setEmitSourceComments(boolean emitSourceComments) {
    this.emitSourceComments = emitSourceComments;
  }

  public boolean shouldPreserveEntryDocstring() {
    return preserveEntryDocstring;
  }

  public void setPreserveEntryDocstring(boolean preserveEntryDocstring) {
    this.preserveEntryDocstring = preserveEntryDocstring;
  }

  /** Overrides the default level of a diagnostic. {@link CheckLevel#OFF} silences it. */
  public void setWarningLevel(DiagnosticType type, CheckLevel level) {
    warningLevels.put(type, level);
  }

  public @Nullable CheckLevel getWarningLevel(DiagnosticType type) {
    return warningLevels.get(type);
  }

  public ImmutableMap<DiagnosticType, CheckLevel> getWarningLevels() {
    return ImmutableMap.copyOf(warningLevels);
  }

  @Override
  public String toString() {
    return "MergeOptions{emitSourceComments="
        + emitSourceComments
        + ", preserveEntryDocstring="
        + preserveEntryDocstring
        + ", warningLevels="
        + warningLevels
        + "}";
  }
}
