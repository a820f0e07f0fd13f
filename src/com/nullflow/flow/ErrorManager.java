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

import com.google.common.collect.ImmutableList;

/**
 * The error manager is in charge of storing the findings of one or more analysis runs and of
 * generating a report at the end.
 */
public interface ErrorManager extends ErrorHandler {

  /** Writes a report of the findings reported so far. */
  void generateReport();

  int getErrorCount();

  int getWarningCount();

  ImmutableList<AnalysisError> getErrors();

  ImmutableList<AnalysisError> getWarnings();

  /** Whether a finding whose default level is ERROR was reported. */
  boolean hasHaltingErrors();
}
