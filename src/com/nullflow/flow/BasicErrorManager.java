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
import java.util.Comparator;
import java.util.Objects;
import java.util.TreeSet;
import org.jspecify.annotations.Nullable;

/**
 * An error manager that sorts and de-duplicates the findings reported to it and generates a
 * sorted report when the {@link #generateReport()} method is called.
 *
 * <p>This error manager does not produce any output, subclasses override the {@link
 * #println(CheckLevel, AnalysisError)} and {@link #printSummary()} methods to generate it.
 */
public abstract class BasicErrorManager implements ErrorManager {

  private final TreeSet<ErrorWithLevel> messages = new TreeSet<>(new LeveledErrorComparator());
  private int originalErrorCount = 0;
  private int promotedErrorCount = 0;
  private int warningCount = 0;

  @Override
  public void report(CheckLevel level, AnalysisError error) {
    ErrorWithLevel e = new ErrorWithLevel(error, level);
    if (messages.add(e)) {
      if (level == CheckLevel.ERROR) {
        if (error.type().level == CheckLevel.ERROR) {
          originalErrorCount++;
        } else {
          promotedErrorCount++;
        }
      } else if (level == CheckLevel.WARNING) {
        warningCount++;
      }
    }
  }

  @Override
  public boolean hasHaltingErrors() {
    return originalErrorCount != 0;
  }

  @Override
  public int getErrorCount() {
    return originalErrorCount + promotedErrorCount;
  }

  @Override
  public int getWarningCount() {
    return warningCount;
  }

  @Override
  public ImmutableList<AnalysisError> getErrors() {
    return toList(CheckLevel.ERROR);
  }

  @Override
  public ImmutableList<AnalysisError> getWarnings() {
    return toList(CheckLevel.WARNING);
  }

  private ImmutableList<AnalysisError> toList(CheckLevel level) {
    ImmutableList.Builder<AnalysisError> errors = ImmutableList.builder();
    for (ErrorWithLevel p : messages) {
      if (p.level == level) {
        errors.add(p.error);
      }
    }
    return errors.build();
  }

  @Override
  public void generateReport() {
    for (ErrorWithLevel message : ImmutableList.copyOf(messages)) {
      println(message.level, message.error);
    }
    printSummary();
  }

  /**
   * Print a message with a trailing new line. This method is called by the
   * {@link #generateReport()} method when generating messages.
   */
  public abstract void println(CheckLevel level, AnalysisError error);

  /**
   * Print the summary of the analysis - number of errors and warnings.
   */
  protected abstract void printSummary();

  /**
   * Comparator of {@link AnalysisError} with an associated {@link CheckLevel}. The ordering is
   * the lexical ordering on the quadruple (line number, {@link CheckLevel}, character number,
   * description), so findings come out in source order.
   */
  static final class LeveledErrorComparator implements Comparator<ErrorWithLevel> {
    private static final int P1_LT_P2 = -1;
    private static final int P1_GT_P2 = 1;

    @Override
    public int compare(ErrorWithLevel p1, ErrorWithLevel p2) {
      // lineno comparison
      int lineno1 = p1.error.lineno();
      int lineno2 = p2.error.lineno();
      if (lineno1 != lineno2) {
        return lineno1 < lineno2 ? P1_LT_P2 : P1_GT_P2;
      }
      // check level
      if (p1.level != p2.level) {
        return p1.level.compareTo(p2.level);
      }
      // charno comparison
      int charno1 = p1.error.charno();
      int charno2 = p2.error.charno();
      if (charno1 != charno2) {
        return charno1 < charno2 ? P1_LT_P2 : P1_GT_P2;
      }
      // description
      return p1.error.description().compareTo(p2.error.description());
    }
  }

  static final class ErrorWithLevel {
    final AnalysisError error;
    final CheckLevel level;

    ErrorWithLevel(AnalysisError error, CheckLevel level) {
      this.error = error;
      this.level = level;
    }

    @Override
    public int hashCode() {
      return Objects.hash(level, error.description(), error.lineno(), error.charno());
    }

    @Override
    public boolean equals(@Nullable Object obj) {
      if (!(obj instanceof ErrorWithLevel)) {
        return false;
      }
      ErrorWithLevel e = (ErrorWithLevel) obj;
      return level == e.level
          && error.description().equals(e.error.description())
          && error.lineno() == e.error.lineno()
          && error.charno() == e.error.charno();
    }
  }
}
