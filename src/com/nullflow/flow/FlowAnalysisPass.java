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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.nullflow.syntax.Node;
import com.nullflow.syntax.types.TypeOperations;
import java.util.logging.Logger;

/**
 * Runs the flow analysis over a function: the assigned variables pre-pass, then the analysis of
 * the body, then the checks that read its results. Findings are reported to the
 * {@link ErrorHandler} at the level the options give them, and are also kept in the returned
 * {@link FlowResult} at their default level.
 *
 * <p>A pass holds no state between runs and may be reused for any number of functions.
 */
public final class FlowAnalysisPass {

  private static final Logger logger = Logger.getLogger(FlowAnalysisPass.class.getName());

  private final TypeOperations types;
  private final FlowAnalysisOptions options;
  private final ErrorHandler errorHandler;

  public FlowAnalysisPass(
      TypeOperations types, FlowAnalysisOptions options, ErrorHandler errorHandler) {
    this.types = checkNotNull(types);
    this.options = checkNotNull(options);
    this.errorHandler = checkNotNull(errorHandler);
  }

  /** Analyzes {@code function}, closures included. */
  public FlowResult analyze(Node function) {
    checkArgument(function.isFunction(), "Expected a function, got %s", function);
    logger.fine("Computing assigned variables");
    AssignedVariables assignedVariables = AssignedVariables.compute(function);

    logger.fine("Analyzing function body");
    FlowResult result =
        new FlowAnalysis(
                function,
                new PromotionPolicy(types),
                options.getExpressionTyper(),
                assignedVariables)
            .analyze();

    if (options.checkMissingReturn) {
      new CheckMissingReturn(types).process(result);
    }
    if (options.checkUnreachableCode) {
      new CheckUnreachableCode().process(result);
    }

    for (AnalysisError error : result.getErrors()) {
      CheckLevel level = options.getLevel(error);
      if (level.isOn()) {
        errorHandler.report(level, error);
      }
    }
    logger.fine(
        "Analyzed " + result.getFunctions().size() + " function(s), "
            + result.getErrors().size() + " finding(s)");
    return result;
  }
}
