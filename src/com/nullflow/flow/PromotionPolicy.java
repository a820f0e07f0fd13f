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

import com.google.common.collect.ImmutableList;
import com.nullflow.syntax.Var;
import com.nullflow.syntax.types.Type;
import com.nullflow.syntax.types.Type.PromotedTypeVariable;
import com.nullflow.syntax.types.Type.TypeVariable;
import com.nullflow.syntax.types.TypeOperations;
import org.jspecify.annotations.Nullable;

/**
 * Decides how type tests and writes change what is known about a variable's type.
 *
 * <p>A test promotes a variable to the tested type when that type is strictly narrower than its
 * current type. A write first demotes the variable to the widest promotion that still holds for
 * the written value, then promotes it again if the written type is one of its types of interest.
 * A variable declared without a type and not yet tested takes the type of its first write.
 * Write captured variables are never promoted.
 */
public final class PromotionPolicy {

  private final TypeOperations types;

  public PromotionPolicy(TypeOperations types) {
    this.types = checkNotNull(types);
  }

  TypeOperations getTypes() {
    return types;
  }

  /** Whether {@code a} is a subtype of {@code b} but not the other way around. */
  boolean isStrictSubtype(Type a, Type b) {
    return types.isSubtypeOf(a, b) && !types.isSubtypeOf(b, a);
  }

  /**
   * Returns the type a variable of type {@code from} is promoted to when it is known to be a
   * {@code to}, or null if that is no promotion. A type variable is promoted by intersecting it
   * with the narrower type.
   */
  @Nullable Type tryPromoteToType(Type to, Type from) {
    if (types.isSubtypeOf(from, to)) {
      // Nothing to narrow, and X & X is just X.
      return null;
    }
    if (types.isSubtypeOf(to, from)) {
      return to;
    }
    if (from.getKind() == Type.Kind.TYPE_VARIABLE) {
      TypeVariable variable = (TypeVariable) from;
      if (isStrictSubtype(to, variable.getBound())) {
        return Type.promotedTypeVariable(variable, to);
      }
    } else if (from.getKind() == Type.Kind.PROMOTED_TYPE_VARIABLE) {
      PromotedTypeVariable promoted = (PromotedTypeVariable) from;
      if (isStrictSubtype(to, promoted.getPromotedBound())) {
        return Type.promotedTypeVariable(promoted.getVariable(), to);
      }
    }
    return null;
  }

  /** The type {@code type} without {@code null}. */
  public Type nonNull(Type type) {
    switch (type.getKind()) {
      case NULLABLE:
        return nonNull(type.getInnerType());
      case LEGACY:
        return type.getInnerType();
      case NULL:
        return Type.NEVER;
      case FUTURE_OR:
        return Type.futureOr(nonNull(type.getInnerType()));
      case TYPE_VARIABLE:
        {
          TypeVariable variable = (TypeVariable) type;
          if (types.isNullable(variable.getBound())) {
            return Type.promotedTypeVariable(variable, nonNull(variable.getBound()));
          }
          return type;
        }
      case PROMOTED_TYPE_VARIABLE:
        {
          PromotedTypeVariable promoted = (PromotedTypeVariable) type;
          return Type.promotedTypeVariable(
              promoted.getVariable(), nonNull(promoted.getPromotedBound()));
        }
      default:
        return type;
    }
  }

  /**
   * The type of a value of type {@code from} known not to be a {@code tested}: {@code Never} if
   * every value is one, the non-null part of a nullable type when {@code tested} covers
   * {@code null}, {@code Null} when it covers the rest.
   */
  Type factor(Type from, Type tested) {
    if (types.isSubtypeOf(from, tested)) {
      return Type.NEVER;
    }
    if (from.getKind() == Type.Kind.NULLABLE) {
      Type nonNullPart = from.getInnerType();
      if (types.isNullable(tested)) {
        return factor(nonNullPart, tested);
      }
      if (types.isSubtypeOf(nonNullPart, tested)) {
        return Type.NULL;
      }
    }
    return from;
  }

  /** Records a test against {@code tested} and promotes if the test narrows the type. */
  VariableModel promoteByTest(VariableModel model, Type tested) {
    return promote(model.withTested(tested), tested);
  }

  /** The model on the false branch of a test against {@code tested}. */
  VariableModel demoteByFailedTest(VariableModel model, Type tested) {
    VariableModel withTest = model.withTested(tested);
    return promote(withTest, factor(withTest.getCurrentType(), tested));
  }

  /** The model once the variable is known not to be null. */
  VariableModel promoteToNonNull(VariableModel model) {
    Type nonNull = nonNull(model.getCurrentType());
    return promote(model.withTested(nonNull), nonNull);
  }

  private VariableModel promote(VariableModel model, Type to) {
    if (model.isWriteCaptured()) {
      return model;
    }
    Type promoted = tryPromoteToType(to, model.getCurrentType());
    if (promoted == null) {
      return model;
    }
    return model.withPromotedTypes(
        ImmutableList.<Type>builder().addAll(model.getPromotedTypes()).add(promoted).build());
  }

  /** The model of {@code var} after a write of a value of type {@code type}. */
  VariableModel assign(Var var, VariableModel model, Type type) {
    VariableModel assigned = model.markAssigned();
    if (model.isWriteCaptured()) {
      return assigned;
    }
    if (isInitialization(var, model, type)) {
      Type promoted = tryPromoteToType(type, model.getDeclaredType());
      return promoted == null
          ? assigned
          : assigned.withPromotedTypes(ImmutableList.of(promoted));
    }

    ImmutableList<Type> chain = model.getPromotedTypes();
    int kept = 0;
    while (kept < chain.size() && types.isSubtypeOf(type, chain.get(kept))) {
      kept++;
    }
    VariableModel demoted = assigned.withPromotedTypes(chain.subList(0, kept));
    for (Type interesting : model.getTested()) {
      if (types.isSameType(interesting, type)
          && isStrictSubtype(interesting, demoted.getCurrentType())) {
        return demoted.withPromotedTypes(
            ImmutableList.<Type>builder()
                .addAll(demoted.getPromotedTypes())
                .add(interesting)
                .build());
      }
    }
    return demoted;
  }

  /**
   * Whether a write is the initialization of a variable declared without a type. A variable that
   * has been tested is governed by test promotion instead.
   */
  private boolean isInitialization(Var var, VariableModel model, Type type) {
    return var.hasImplicitType()
        && model.isUnassigned()
        && !model.isPromoted()
        && model.getTested().isEmpty()
        && !type.isDynamic()
        && !type.isNullType();
  }
}
