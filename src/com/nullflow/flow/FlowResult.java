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
import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableList;
import com.nullflow.syntax.Node;
import com.nullflow.syntax.Var;
import com.nullflow.syntax.types.Type;
import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * The flow models computed by one analysis run, keyed by node identity.
 *
 * <p>The tables fill up as the analysis proceeds, so an {@link ExpressionTyper} consulted during
 * the run sees the models of everything analyzed before the expression it is asked about.
 */
public final class FlowResult {

  private final Node root;
  private final Map<Node, FlowModel> before = new IdentityHashMap<>();
  private final Map<Node, FlowModel> after = new IdentityHashMap<>();
  private final Map<Node, ExpressionInfo> expressions = new IdentityHashMap<>();
  private final Map<Node, Type> staticTypes = new IdentityHashMap<>();
  private final Map<Node, FlowModel> breakModels = new IdentityHashMap<>();
  private final Map<Node, FlowModel> continueModels = new IdentityHashMap<>();
  // Functions in the order their analysis completed, innermost first.
  private final Map<Node, FlowModel> functionExits = new LinkedHashMap<>();
  private final List<ExitPoint> exitPoints = new ArrayList<>();
  private final List<AnalysisError> errors = new ArrayList<>();

  FlowResult(Node root) {
    this.root = checkNotNull(root);
  }

  /** The FUNCTION the analysis ran on. */
  public Node getRoot() {
    return root;
  }

  public boolean isAnalyzed(Node n) {
    return before.containsKey(n);
  }

  /** Whether {@code n} was analyzed as an expression. */
  public boolean isExpression(Node n) {
    return expressions.containsKey(n);
  }

  public FlowModel getBefore(Node n) {
    FlowModel model = before.get(n);
    checkArgument(model != null, "%s was not analyzed", n);
    return model;
  }

  public FlowModel getAfter(Node n) {
    ExpressionInfo info = expressions.get(n);
    if (info != null) {
      return info.getAfter();
    }
    FlowModel model = after.get(n);
    checkArgument(model != null, "%s was not analyzed", n);
    return model;
  }

  public ExpressionInfo getExpressionInfo(Node n) {
    ExpressionInfo info = expressions.get(n);
    checkArgument(info != null, "%s was not analyzed as an expression", n);
    return info;
  }

  public FlowModel getWhenTrue(Node n) {
    return getExpressionInfo(n).getWhenTrue();
  }

  public FlowModel getWhenFalse(Node n) {
    return getExpressionInfo(n).getWhenFalse();
  }

  public FlowModel getWhenNull(Node n) {
    return getExpressionInfo(n).getWhenNull();
  }

  public FlowModel getWhenNotNull(Node n) {
    return getExpressionInfo(n).getWhenNotNull();
  }

  /** The static type the analysis used for the expression {@code n}. */
  public Type getStaticType(Node n) {
    Type type = staticTypes.get(n);
    checkArgument(type != null, "%s has no static type yet", n);
    return type;
  }

  /**
   * The join of the models at every {@code break} that targets {@code n}, at the split level of
   * the body of {@code n}, or null if nothing breaks out of {@code n}.
   */
  public @Nullable FlowModel getBreakModel(Node n) {
    return breakModels.get(n);
  }

  /** Like {@link #getBreakModel} for {@code continue}. */
  public @Nullable FlowModel getContinueModel(Node n) {
    return continueModels.get(n);
  }

  /** The model at the end of the body of {@code function}, where control falls off. */
  public FlowModel getExitModel(Node function) {
    FlowModel model = functionExits.get(function);
    checkArgument(model != null, "%s was not analyzed", function);
    return model;
  }

  /** Whether control can fall off the end of the analyzed function. */
  public boolean isExitReachable() {
    return getExitModel(root).isReachable();
  }

  /** The analyzed functions, the root and every closure inside it. */
  public ImmutableList<Node> getFunctions() {
    return ImmutableList.copyOf(functionExits.keySet());
  }

  /** Every return and yield, in source order, closures included. */
  public ImmutableList<ExitPoint> getExitPoints() {
    return ImmutableList.copyOf(exitPoints);
  }

  public ImmutableList<ExitPoint> getExitPoints(Node function) {
    ImmutableList.Builder<ExitPoint> points = ImmutableList.builder();
    for (ExitPoint point : exitPoints) {
      if (point.function() == function) {
        points.add(point);
      }
    }
    return points.build();
  }

  /** The findings of the run, at their default levels. */
  public ImmutableList<AnalysisError> getErrors() {
    return ImmutableList.copyOf(errors);
  }

  /** The promoted type of {@code var} just before {@code n}, or null if it is not promoted. */
  public @Nullable Type getPromotedType(Node n, Var var) {
    return getBefore(n).getPromotedType(var);
  }

  public boolean isDefinitelyAssigned(Node n, Var var) {
    return getBefore(n).isDefinitelyAssigned(var);
  }

  public boolean isWriteCaptured(Node n, Var var) {
    return getBefore(n).isWriteCaptured(var);
  }

  void recordBefore(Node n, FlowModel model) {
    checkState(before.put(n, model) == null, "%s analyzed twice", n);
  }

  void recordAfter(Node n, FlowModel model) {
    after.put(n, model);
  }

  void recordExpression(Node n, ExpressionInfo info) {
    expressions.put(n, info);
  }

  void recordStaticType(Node n, Type type) {
    staticTypes.put(n, type);
  }

  void recordBreakModel(Node target, FlowModel model) {
    breakModels.put(target, model);
  }

  void recordContinueModel(Node target, FlowModel model) {
    continueModels.put(target, model);
  }

  void recordFunctionExit(Node function, FlowModel model) {
    functionExits.put(function, model);
  }

  void recordExitPoint(ExitPoint point) {
    exitPoints.add(point);
  }

  void recordError(AnalysisError error) {
    errors.add(error);
  }
}
