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

import com.nullflow.syntax.Node;
import com.nullflow.syntax.types.Type;
import com.nullflow.syntax.types.TypeOperations;
import org.jspecify.annotations.Nullable;

/**
 * Checks functions for missing return statements. A return is only expected from a function
 * whose declared return type excludes {@code null}; the end of the body must then be unreachable.
 * Generators and functions without a declared return type are ignored.
 */
final class CheckMissingReturn {

  static final DiagnosticType MISSING_RETURN_STATEMENT =
      DiagnosticType.error(
          "NULLFLOW_MISSING_RETURN",
          "Missing return statement. Function expected to return {0}.");

  private final TypeOperations types;

  CheckMissingReturn(TypeOperations types) {
    this.types = checkNotNull(types);
  }

  void process(FlowResult result) {
    for (Node function : result.getFunctions()) {
      Type returnType = explicitReturnExpected(function);
      if (returnType != null && result.getExitModel(function).isReachable()) {
        result.recordError(
            AnalysisError.make(function, MISSING_RETURN_STATEMENT, returnType.toString()));
      }
    }
  }

  /**
   * Returns the declared return type of {@code function} if falling off its end is an error, or
   * null otherwise.
   */
  private @Nullable Type explicitReturnExpected(Node function) {
    Type returnType = function.getReturnType();
    if (returnType == null || function.getFunctionKind().isGenerator()) {
      return null;
    }
    Type valueType = returnType;
    if (function.getFunctionKind().isAsync()) {
      // An async function completes its future with null when it falls off the end.
      Type futureValueType = types.getFutureValueType(returnType);
      if (futureValueType != null) {
        valueType = futureValueType;
      }
    }
    return types.isNullable(valueType) ? null : returnType;
  }
}
