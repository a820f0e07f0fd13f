/*
 * Copyright 2024 The Nullflow Authors.
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

package com.nullflow.flow;

import static com.google.common.base.Preconditions.checkNotNull;

import java.text.MessageFormat;
import org.jspecify.annotations.Nullable;

/**
 * A kind of finding the flow analysis can report: the key that options refer to, the message
 * pattern and the level it is reported at unless overridden.
 */
public final class DiagnosticType implements Comparable<DiagnosticType> {

  /** For example {@code NULLFLOW_MISSING_RETURN}. */
  public final String key;

  /** A {@link MessageFormat} pattern; the arguments are supplied where the finding is made. */
  public final String format;

  public final CheckLevel level;

  /** A finding that is reported as an error by default. */
  public static DiagnosticType error(String key, String format) {
    return make(key, CheckLevel.ERROR, format);
  }

  /** An advisory finding. */
  public static DiagnosticType warning(String key, String format) {
    return make(key, CheckLevel.WARNING, format);
  }

  public static DiagnosticType make(String key, CheckLevel level, String format) {
    return new DiagnosticType(key, level, format);
  }

  private DiagnosticType(String key, CheckLevel level, String format) {
    this.key = checkNotNull(key);
    this.level = checkNotNull(level);
    this.format = checkNotNull(format);
  }

  /** The message for one finding. */
  String format(Object... arguments) {
    return new MessageFormat(format).format(arguments);
  }

  /** Diagnostic types are identified by their key. */
  @Override
  public boolean equals(@Nullable Object other) {
    return other instanceof DiagnosticType && ((DiagnosticType) other).key.equals(key);
  }

  @Override
  public int hashCode() {
    return key.hashCode();
  }

  @Override
  public int compareTo(DiagnosticType other) {
    return key.compareTo(other.key);
  }

  @Override
  public String toString() {
    return key + ": " + format;
  }
}
