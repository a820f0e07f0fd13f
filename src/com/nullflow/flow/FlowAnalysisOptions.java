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

import java.util.HashMap;
import java.util.Map;

/** Options for {@link FlowAnalysisPass}. */
public class FlowAnalysisOptions {

  /** Levels that override the default level of a diagnostic, by key. */
  private final Map<String, CheckLevel> warningLevels = new HashMap<>();

  /** Whether to report statements the analysis finds unreachable. */
  boolean checkUnreachableCode = true;

  /** Whether to report functions that can complete without returning a value. */
  boolean checkMissingReturn = true;

  private ExpressionTyper expressionTyper = ExpressionTyper.FROM_ANNOTATIONS;

  public FlowAnalysisOptions() {}

  public void setWarningLevel(DiagnosticType type, CheckLevel level) {
    warningLevels.put(type.key, checkNotNull(level));
  }

  /** The level {@code error} is reported at. */
  public CheckLevel getLevel(AnalysisError error) {
    CheckLevel level = warningLevels.get(error.type().key);
    return level != null ? level : error.defaultLevel();
  }

  public void setCheckUnreachableCode(boolean checkUnreachableCode) {
    this.checkUnreachableCode = checkUnreachableCode;
  }

  public boolean getCheckUnreachableCode() {
    return checkUnreachableCode;
  }

  public void setCheckMissingReturn(boolean checkMissingReturn) {
    this.checkMissingReturn = checkMissingReturn;
  }

  public boolean getCheckMissingReturn() {
    return checkMissingReturn;
  }

  /** Sets where the analysis gets the static types of expressions from. */
  public void setExpressionTyper(ExpressionTyper expressionTyper) {
    this.expressionTyper = checkNotNull(expressionTyper);
  }

  public ExpressionTyper getExpressionTyper() {
    return expressionTyper;
  }
}
