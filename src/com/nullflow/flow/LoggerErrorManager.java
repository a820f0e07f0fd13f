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

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * An error manager that logs errors and warnings using a logger in addition to collecting them in
 * memory. Errors are logged at the SEVERE level and warnings are logged at the WARNING level.
 */
public class LoggerErrorManager extends BasicErrorManager {
  private final Logger logger;

  public LoggerErrorManager(Logger logger) {
    this.logger = checkNotNull(logger);
  }

  @Override
  public void println(CheckLevel level, AnalysisError error) {
    switch (level) {
      case ERROR:
        logger.severe(format(level, error));
        break;
      case WARNING:
        logger.warning(format(level, error));
        break;
      case OFF:
        break;
    }
  }

  static String format(CheckLevel level, AnalysisError error) {
    StringBuilder sb = new StringBuilder();
    if (error.lineno() > 0) {
      sb.append(error.lineno()).append(':').append(Math.max(error.charno(), 0)).append(": ");
    }
    sb.append(level).append(" - [").append(error.type().key).append("] ");
    sb.append(error.description());
    return sb.toString();
  }

  @Override
  protected void printSummary() {
    Level level = (getErrorCount() + getWarningCount() == 0) ? Level.INFO : Level.WARNING;
    logger.log(
        level, "{0} error(s), {1} warning(s)", new Object[] {getErrorCount(), getWarningCount()});
  }
}
