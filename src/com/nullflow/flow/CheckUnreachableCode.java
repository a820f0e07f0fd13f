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

import com.nullflow.syntax.Node;

/**
 * Uses the reachability computed by {@link FlowAnalysis} to inform the user about unreachable
 * code. Only the first statement of a run of unreachable statements is reported.
 */
final class CheckUnreachableCode {

  static final DiagnosticType UNREACHABLE_CODE =
      DiagnosticType.warning("NULLFLOW_UNREACHABLE_CODE", "unreachable code");

  void process(FlowResult result) {
    visitChildren(result, result.getRoot());
  }

  private void visitChildren(FlowResult result, Node parent) {
    boolean inUnreachableRun = false;
    for (Node child : parent.children()) {
      if (isUnreachableStatement(result, child)) {
        if (!inUnreachableRun && !isSpurious(child)) {
          result.recordError(AnalysisError.make(child, UNREACHABLE_CODE));
          // Everything after it is part of the same run, so the children are skipped too.
          inUnreachableRun = true;
        }
        continue;
      }
      inUnreachableRun = false;
      visitChildren(result, child);
    }
  }

  private static boolean isUnreachableStatement(FlowResult result, Node n) {
    return n.isStatement()
        && result.isAnalyzed(n)
        && !result.getBefore(n).isReachable();
  }

  /** Allow spurious semicolons, breaks and empty blocks. */
  private static boolean isSpurious(Node n) {
    return n.isEmpty() || n.isBreak() || (n.isBlock() && !n.hasChildren());
  }
}
