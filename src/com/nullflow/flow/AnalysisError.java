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

import static java.util.Objects.requireNonNull;

import com.nullflow.syntax.Node;
import org.jspecify.annotations.Nullable;

/**
 * A finding of the flow analysis.
 *
 * @param type The type of the finding.
 * @param description The formatted message.
 * @param node Node where the finding occurred, if any.
 * @param lineno One-indexed line number of the location, or -1.
 * @param charno Zero-indexed character number of the location, or -1.
 * @param defaultLevel The level of {@code type}, before any options are applied.
 */
public record AnalysisError(
    DiagnosticType type,
    String description,
    @Nullable Node node,
    int lineno,
    int charno,
    CheckLevel defaultLevel) {
  public AnalysisError {
    requireNonNull(type, "type");
    requireNonNull(description, "description");
    requireNonNull(defaultLevel, "defaultLevel");
  }

  /**
   * Creates an AnalysisError with no source information
   *
   * @param type The DiagnosticType
   * @param arguments Arguments to be incorporated into the message
   */
  public static AnalysisError make(DiagnosticType type, String... arguments) {
    return new AnalysisError(type, type.format((Object[]) arguments), null, -1, -1, type.level);
  }

  /**
   * Creates an AnalysisError at the position of a node.
   *
   * @param n Determines the line and char position
   * @param type The DiagnosticType
   * @param arguments Arguments to be incorporated into the message
   */
  public static AnalysisError make(Node n, DiagnosticType type, String... arguments) {
    return new AnalysisError(
        type, type.format((Object[]) arguments), n, n.getLineno(), n.getCharno(), type.level);
  }

  @Override
  public String toString() {
    return type.key + ". " + description + " at " + (lineno < 0 ? "(unknown line)" : lineno);
  }
}
