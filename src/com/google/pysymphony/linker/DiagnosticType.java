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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.base.CharMatcher;
import java.io.Serializable;
import java.text.MessageFormat;

/**
 * A kind of diagnostic. Two types are the same type when their keys match, so a level override
 * can be looked up by key alone.
 *
 * <p>Keys start with {@code PYS_} and use upper case letters and underscores. The description is
 * a {@link MessageFormat} pattern filled in with the arguments given when the diagnostic is made.
 */
public final class DiagnosticType implements Serializable {
  private static final long serialVersionUID = 2;

  private static final String KEY_PREFIX = "PYS_";
  private static final CharMatcher KEY_CHARS =
      CharMatcher.inRange('A', 'Z').or(CharMatcher.is('_')).or(CharMatcher.inRange('0', '9'));

  private final String key;
  private final CheckLevel level;
  private final String descriptionFormat;

  public static DiagnosticType error(String key, String descriptionFormat) {
    return new DiagnosticType(key, CheckLevel.ERROR, descriptionFormat);
  }

  public static DiagnosticType warning(String key, String descriptionFormat) {
    return new DiagnosticType(key, CheckLevel.WARNING, descriptionFormat);
  }

  /** A diagnostic that is only reported when an option turns it on. */
  public static DiagnosticType disabled(String key, String descriptionFormat) {
    return new DiagnosticType(key, CheckLevel.OFF, descriptionFormat);
  }

  private DiagnosticType(String key, CheckLevel level, String descriptionFormat) {
    checkArgument(
        key.startsWith(KEY_PREFIX) && KEY_CHARS.matchesAllOf(key), "Bad diagnostic key: %s", key);
    this.key = key;
    this.level = level;
    this.descriptionFormat = descriptionFormat;
  }

  /** The stable identifier, such as {@code PYS_DUPLICATE_SYMBOL}. */
  public String key() {
    return key;
  }

  /** The level used when no option overrides it. */
  public CheckLevel level() {
    return level;
  }

  String format(String... arguments) {
    return new MessageFormat(descriptionFormat).format(arguments);
  }

  @Override
  public boolean equals(Object other) {
    return other instanceof DiagnosticType && ((DiagnosticType) other).key.equals(key);
  }

  @Override
  public int hashCode() {
    return key.hashCode();
  }

  @Override
  public String toString() {
    return key + ": " + descriptionFormat;
  }
}
