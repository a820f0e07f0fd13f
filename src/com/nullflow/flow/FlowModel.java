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

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.errorprone.annotations.Immutable;
import com.nullflow.syntax.Var;
import com.nullflow.syntax.types.Type;
import com.nullflow.syntax.types.TypeOperations;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.jspecify.annotations.Nullable;

/**
 * What is known at one program point: the reachability stack and a {@link VariableModel} for
 * every variable in scope.
 *
 * <p>Flow models are immutable; every operation returns a new model (or this one, when nothing
 * changes). Two kinds of joins exist. {@link #merge} combines models at the same split level,
 * {@link #join} additionally closes the innermost split. Both keep only the variables known on
 * every path that contributes.
 *
 * <p>A path contributes its variable knowledge only if it is alive. This is what keeps promotions
 * precise inside code that is already unreachable: a branch that cannot be taken from its own
 * split is ignored, even when the whole construct is dead.
 */
@Immutable
@SuppressWarnings("Immutable") // Var is compared by identity
public final class FlowModel {

  private static final FlowModel INITIAL = new FlowModel(Reachability.initial(), ImmutableMap.of());

  private final Reachability reachability;
  private final ImmutableMap<Var, VariableModel> variableInfo;

  private FlowModel(Reachability reachability, ImmutableMap<Var, VariableModel> variableInfo) {
    this.reachability = checkNotNull(reachability);
    this.variableInfo = checkNotNull(variableInfo);
  }

  /** The model at function entry, before any variable is in scope. */
  public static FlowModel initial() {
    return INITIAL;
  }

  public Reachability getReachability() {
    return reachability;
  }

  public boolean isReachable() {
    return reachability.isReachable();
  }

  public ImmutableMap<Var, VariableModel> getVariableInfo() {
    return variableInfo;
  }

  /** The model of {@code var}, or null if the variable is not in scope here. */
  public @Nullable VariableModel getVariableModel(Var var) {
    return variableInfo.get(var);
  }

  /** The current (possibly promoted) type of {@code var}. */
  public Type getType(Var var) {
    return checkInScope(var).getCurrentType();
  }

  /** The promoted type of {@code var}, or null if it is not promoted. */
  public @Nullable Type getPromotedType(Var var) {
    VariableModel model = checkInScope(var);
    return model.isPromoted() ? model.getCurrentType() : null;
  }

  public boolean isDefinitelyAssigned(Var var) {
    return checkInScope(var).isAssigned();
  }

  public boolean isDefinitelyUnassigned(Var var) {
    return checkInScope(var).isUnassigned();
  }

  public boolean isWriteCaptured(Var var) {
    return checkInScope(var).isWriteCaptured();
  }

  private VariableModel checkInScope(Var var) {
    VariableModel model = variableInfo.get(var);
    checkArgument(model != null, "%s is not in scope", var);
    return model;
  }

  /** Brings {@code var} into scope. */
  FlowModel declare(Var var, Type declaredType, boolean initialized) {
    checkArgument(!variableInfo.containsKey(var), "%s is already in scope", var);
    return withVariable(var, VariableModel.initial(declaredType, initialized));
  }

  /** Takes {@code var} out of scope. */
  FlowModel remove(Var var) {
    if (!variableInfo.containsKey(var)) {
      return this;
    }
    ImmutableMap.Builder<Var, VariableModel> builder =
        ImmutableMap.builderWithExpectedSize(variableInfo.size() - 1);
    for (Map.Entry<Var, VariableModel> entry : variableInfo.entrySet()) {
      if (entry.getKey() != var) {
        builder.put(entry);
      }
    }
    return new FlowModel(reachability, builder.buildOrThrow());
  }

  FlowModel withVariable(Var var, VariableModel model) {
    if (model.equals(variableInfo.get(var))) {
      return this;
    }
    ImmutableMap.Builder<Var, VariableModel> builder =
        ImmutableMap.builderWithExpectedSize(variableInfo.size() + 1);
    boolean replaced = false;
    for (Map.Entry<Var, VariableModel> entry : variableInfo.entrySet()) {
      if (entry.getKey() == var) {
        builder.put(var, model);
        replaced = true;
      } else {
        builder.put(entry);
      }
    }
    if (!replaced) {
      builder.put(var, model);
    }
    return new FlowModel(reachability, builder.buildOrThrow());
  }

  FlowModel withReachability(Reachability newReachability) {
    return newReachability.equals(reachability)
        ? this
        : new FlowModel(newReachability, variableInfo);
  }

  /** Opens a split: pushes a fresh {@code true}. */
  FlowModel split() {
    return new FlowModel(reachability.split(), variableInfo);
  }

  /** Closes the innermost split. Equivalent to {@code join(this, this)}. */
  FlowModel drop() {
    return withReachability(reachability.drop());
  }

  /** This point cannot be reached from the innermost split. */
  FlowModel exit() {
    return withReachability(reachability.setTop(false));
  }

  /**
   * Records a write of a value of type {@code type} to {@code var}, promoting or demoting it as
   * {@code policy} decides.
   */
  FlowModel assign(Var var, Type type, PromotionPolicy policy) {
    return withVariable(var, policy.assign(var, checkInScope(var), type));
  }

  /**
   * The model at the head of a loop or the start of a catch or finally block, where control may
   * arrive after any of the writes in the region: variables in {@code assigned} lose their
   * promotions and definite unassignment, variables in {@code captured} become write captured.
   */
  FlowModel conservativeJoin(Set<Var> assigned, Set<Var> captured) {
    FlowModel result = this;
    for (Map.Entry<Var, VariableModel> entry : variableInfo.entrySet()) {
      Var var = entry.getKey();
      VariableModel model = entry.getValue();
      if (captured.contains(var)) {
        model = model.markWriteCaptured();
      }
      if (assigned.contains(var)) {
        model = model.markPossiblyAssigned(true);
      }
      result = result.withVariable(var, model);
    }
    return result;
  }

  /**
   * Combines two models at the same split level. The stacks below the top must agree. The result
   * is reachable from the split if either side is; its variables come from the sides that are,
   * or from both sides when neither is.
   */
  static FlowModel merge(FlowModel a, FlowModel b) {
    return mergeAll(ImmutableList.of(a, b));
  }

  static FlowModel mergeAll(List<FlowModel> models) {
    checkArgument(!models.isEmpty());
    @Nullable Reachability tail = models.get(0).reachability.tail();
    List<FlowModel> alive = new ArrayList<>();
    for (FlowModel model : models) {
      checkSameTail(tail, model.reachability.tail());
      if (model.reachability.getTop()) {
        alive.add(model);
      }
    }
    return new FlowModel(
        Reachability.push(tail, !alive.isEmpty()),
        joinVariables(alive.isEmpty() ? models : alive));
  }

  /**
   * Joins two models and closes the split they were analyzed under. Equivalent to {@code
   * drop(merge(a, b))} when both sides split from the same point.
   */
  static FlowModel join(FlowModel a, FlowModel b) {
    return joinAll(ImmutableList.of(a, b));
  }

  /**
   * Joins the models of the branches of an n-ary construct and closes the split. Each branch was
   * split from its own entry model (the true and false models of a condition, the breaks of a
   * loop); entries may differ in the reachability of the enclosing level.
   *
   * <p>The result is reachable if some branch was entered reachably and is itself alive. A branch
   * is alive if it is reachable from its split and its entry was reachable, or if no entry was
   * reachable at all, in which case the analysis is in dead code and judges branches by their own
   * splits only.
   */
  static FlowModel joinAll(List<FlowModel> models) {
    checkArgument(!models.isEmpty());
    @Nullable Reachability outerTail = models.get(0).reachability.pop().tail();
    boolean incoming = false;
    for (FlowModel model : models) {
      Reachability entry = model.reachability.pop();
      checkSameTail(outerTail, entry.tail());
      incoming |= entry.getTop();
    }
    List<FlowModel> alive = new ArrayList<>();
    for (FlowModel model : models) {
      Reachability entry = model.reachability.pop();
      if (model.reachability.getTop() && (entry.getTop() || !incoming)) {
        alive.add(model);
      }
    }
    return new FlowModel(
        Reachability.push(outerTail, incoming && !alive.isEmpty()),
        joinVariables(alive.isEmpty() ? models : alive));
  }

  private static void checkSameTail(
      @Nullable Reachability expected, @Nullable Reachability actual) {
    checkState(
        Objects.equals(expected, actual),
        "joining models of different splits: %s and %s",
        expected,
        actual);
  }

  /** Key-wise join over the variables every model knows. */
  private static ImmutableMap<Var, VariableModel> joinVariables(List<FlowModel> models) {
    ImmutableMap<Var, VariableModel> first = models.get(0).variableInfo;
    if (models.size() == 1) {
      return first;
    }
    ImmutableMap.Builder<Var, VariableModel> result = ImmutableMap.builder();
    List<VariableModel> values = new ArrayList<>(models.size());
    outer:
    for (Map.Entry<Var, VariableModel> entry : first.entrySet()) {
      values.clear();
      for (FlowModel model : models) {
        VariableModel value = model.variableInfo.get(entry.getKey());
        if (value == null) {
          continue outer;
        }
        values.add(value);
      }
      result.put(entry.getKey(), VariableModel.JOIN.apply(values));
    }
    return result.buildOrThrow();
  }

  /**
   * The model after a {@code try} statement with a {@code finally} block. {@code afterFinally} is
   * the model at the end of the finally block, which assumed nothing about the try and catch
   * blocks; {@code afterTryCatch} is the model at the end of the try and catch blocks. Knowledge
   * from the try and catch blocks survives unless the finally block wrote the variable.
   */
  static FlowModel restrict(
      FlowModel afterFinally,
      FlowModel afterTryCatch,
      Set<Var> assignedInFinally,
      TypeOperations types) {
    Reachability finallyReachability = afterFinally.reachability;
    checkSameTail(finallyReachability.tail(), afterTryCatch.reachability.tail());
    Reachability reachability =
        finallyReachability.setTop(
            finallyReachability.getTop() && afterTryCatch.reachability.getTop());

    ImmutableMap.Builder<Var, VariableModel> result = ImmutableMap.builder();
    for (Map.Entry<Var, VariableModel> entry : afterFinally.variableInfo.entrySet()) {
      Var var = entry.getKey();
      VariableModel finallyModel = entry.getValue();
      VariableModel tryModel = afterTryCatch.variableInfo.get(var);
      if (tryModel == null) {
        continue;
      }
      result.put(var, restrict(finallyModel, tryModel, assignedInFinally.contains(var), types));
    }
    return new FlowModel(reachability, result.buildOrThrow());
  }

  private static VariableModel restrict(
      VariableModel finallyModel,
      VariableModel tryModel,
      boolean assignedInFinally,
      TypeOperations types) {
    boolean writeCaptured = finallyModel.isWriteCaptured() || tryModel.isWriteCaptured();
    ImmutableList<Type> promotedTypes;
    if (writeCaptured) {
      promotedTypes = ImmutableList.of();
    } else if (assignedInFinally) {
      promotedTypes = finallyModel.getPromotedTypes();
    } else {
      ImmutableList.Builder<Type> chain = ImmutableList.builder();
      chain.addAll(tryModel.getPromotedTypes());
      Type current = tryModel.getCurrentType();
      for (Type type : finallyModel.getPromotedTypes()) {
        if (types.isSubtypeOf(type, current) && !types.isSubtypeOf(current, type)) {
          chain.add(type);
          current = type;
        }
      }
      promotedTypes = chain.build();
    }
    ImmutableSet<Type> tested =
        ImmutableSet.<Type>builder()
            .addAll(tryModel.getTested())
            .addAll(finallyModel.getTested())
            .build();
    return new VariableModel(
        finallyModel.getDeclaredType(),
        promotedTypes,
        tested,
        finallyModel.isAssigned() || tryModel.isAssigned(),
        finallyModel.isUnassigned() && tryModel.isUnassigned(),
        writeCaptured);
  }

  @Override
  public boolean equals(@Nullable Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof FlowModel)) {
      return false;
    }
    FlowModel that = (FlowModel) o;
    return reachability.equals(that.reachability) && variableInfo.equals(that.variableInfo);
  }

  @Override
  public int hashCode() {
    return Objects.hash(reachability, variableInfo);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("reachable", reachability)
        .add("variables", variableInfo)
        .toString();
  }
}
