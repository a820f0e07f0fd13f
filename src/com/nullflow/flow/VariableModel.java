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

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Sets;
import com.google.errorprone.annotations.Immutable;
import com.nullflow.syntax.types.Type;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * What is known about one local variable at one program point.
 *
 * <p>The promotion chain is ordered from widest to narrowest and the current type is its last
 * entry, or the declared type when the chain is empty. {@code assigned} and {@code unassigned} are
 * never both true; both false means nothing is known. A write captured variable is never promoted.
 */
@Immutable
public final class VariableModel {

  /** Joins variable models at a control flow merge. */
  static final JoinOp<VariableModel> JOIN =
      new JoinOp.BinaryJoinOp<VariableModel>() {
        @Override
        VariableModel join(VariableModel first, VariableModel second) {
          return VariableModel.join(first, second);
        }
      };

  private final Type declaredType;
  private final ImmutableList<Type> promotedTypes;
  private final ImmutableSet<Type> tested;
  private final boolean assigned;
  private final boolean unassigned;
  private final boolean writeCaptured;

  VariableModel(
      Type declaredType,
      ImmutableList<Type> promotedTypes,
      ImmutableSet<Type> tested,
      boolean assigned,
      boolean unassigned,
      boolean writeCaptured) {
    checkArgument(!(assigned && unassigned), "both assigned and unassigned");
    checkArgument(!writeCaptured || promotedTypes.isEmpty(), "write captured and promoted");
    this.declaredType = checkNotNull(declaredType);
    this.promotedTypes = promotedTypes;
    this.tested = tested;
    this.assigned = assigned;
    this.unassigned = unassigned;
    this.writeCaptured = writeCaptured;
  }

  /** A variable entering scope, initialized or not. */
  static VariableModel initial(Type declaredType, boolean assigned) {
    return new VariableModel(
        declaredType, ImmutableList.of(), ImmutableSet.of(), assigned, !assigned, false);
  }

  public Type getDeclaredType() {
    return declaredType;
  }

  public ImmutableList<Type> getPromotedTypes() {
    return promotedTypes;
  }

  /** The narrowest type known for the variable. */
  public Type getCurrentType() {
    return promotedTypes.isEmpty() ? declaredType : promotedTypes.get(promotedTypes.size() - 1);
  }

  public boolean isPromoted() {
    return !promotedTypes.isEmpty();
  }

  /** The types of interest: types the variable has been tested against on some path. */
  public ImmutableSet<Type> getTested() {
    return tested;
  }

  public boolean isAssigned() {
    return assigned;
  }

  public boolean isUnassigned() {
    return unassigned;
  }

  public boolean isWriteCaptured() {
    return writeCaptured;
  }

  VariableModel withPromotedTypes(ImmutableList<Type> newPromotedTypes) {
    if (newPromotedTypes.equals(promotedTypes)) {
      return this;
    }
    return new VariableModel(
        declaredType, newPromotedTypes, tested, assigned, unassigned, writeCaptured);
  }

  VariableModel withTested(Type type) {
    if (tested.contains(type)) {
      return this;
    }
    ImmutableSet<Type> newTested =
        ImmutableSet.<Type>builderWithExpectedSize(tested.size() + 1)
            .addAll(tested)
            .add(type)
            .build();
    return new VariableModel(
        declaredType, promotedTypes, newTested, assigned, unassigned, writeCaptured);
  }

  /** Records a write: definitely assigned from here on. */
  VariableModel markAssigned() {
    if (assigned && !unassigned) {
      return this;
    }
    return new VariableModel(declaredType, promotedTypes, tested, true, false, writeCaptured);
  }

  /** Loses definite unassignment, and the promotions too when {@code dropPromotions}. */
  VariableModel markPossiblyAssigned(boolean dropPromotions) {
    ImmutableList<Type> newPromotedTypes = dropPromotions ? ImmutableList.of() : promotedTypes;
    if (!unassigned && newPromotedTypes.equals(promotedTypes)) {
      return this;
    }
    return new VariableModel(
        declaredType, newPromotedTypes, tested, assigned, false, writeCaptured);
  }

  VariableModel markWriteCaptured() {
    if (writeCaptured) {
      return this;
    }
    return new VariableModel(declaredType, ImmutableList.of(), tested, assigned, false, true);
  }

  /**
   * Joins the knowledge of two paths: the promotion chain keeps the entries both chains have, in
   * order; tested types are united; definite (un)assignment needs both paths; a capture on either
   * path sticks.
   */
  static VariableModel join(VariableModel a, VariableModel b) {
    if (a.equals(b)) {
      return a;
    }
    checkArgument(
        a.declaredType.equals(b.declaredType),
        "declared types differ: %s and %s",
        a.declaredType,
        b.declaredType);
    boolean writeCaptured = a.writeCaptured || b.writeCaptured;
    ImmutableList<Type> promotedTypes;
    if (writeCaptured) {
      promotedTypes = ImmutableList.of();
    } else {
      ImmutableSet<Type> other = ImmutableSet.copyOf(b.promotedTypes);
      ImmutableList.Builder<Type> common = ImmutableList.builder();
      for (Type type : a.promotedTypes) {
        if (other.contains(type)) {
          common.add(type);
        }
      }
      promotedTypes = common.build();
    }
    return new VariableModel(
        a.declaredType,
        promotedTypes,
        Sets.union(a.tested, b.tested).immutableCopy(),
        a.assigned && b.assigned,
        a.unassigned && b.unassigned,
        writeCaptured);
  }

  @Override
  public boolean equals(@Nullable Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof VariableModel)) {
      return false;
    }
    VariableModel that = (VariableModel) o;
    return assigned == that.assigned
        && unassigned == that.unassigned
        && writeCaptured == that.writeCaptured
        && declaredType.equals(that.declaredType)
        && promotedTypes.equals(that.promotedTypes)
        && tested.equals(that.tested);
  }

  @Override
  public int hashCode() {
    return Objects.hash(
        declaredType, promotedTypes, tested, assigned, unassigned, writeCaptured);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("declaredType", declaredType)
        .add("promotedTypes", promotedTypes)
        .add("tested", tested)
        .add("assigned", assigned)
        .add("unassigned", unassigned)
        .add("writeCaptured", writeCaptured)
        .toString();
  }
}
