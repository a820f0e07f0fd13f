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

package com.nullflow.syntax.types;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import com.nullflow.syntax.types.Type.FunctionType;
import com.nullflow.syntax.types.Type.InterfaceType;
import com.nullflow.syntax.types.Type.PromotedTypeVariable;
import com.nullflow.syntax.types.Type.TypeVariable;

/**
 * A {@link TypeOperations} implementing null safe subtyping over a {@link ClassHierarchy}.
 *
 * <p>The rules are tried in a fixed order: reflexivity, top on the right, bottom on the left,
 * legacy types, {@code Null}, {@code FutureOr} and nullable types on the left, then promoted type
 * variables, {@code FutureOr} and nullable types on the right, and finally type variables,
 * function types and interface types. Generic classes are covariant in their type arguments.
 */
public final class StandardTypeOperations implements TypeOperations {

  private final ClassHierarchy hierarchy;

  public StandardTypeOperations(ClassHierarchy hierarchy) {
    this.hierarchy = checkNotNull(hierarchy);
  }

  /** Type operations over {@link ClassHierarchy#standard()}. */
  public static StandardTypeOperations create() {
    return new StandardTypeOperations(ClassHierarchy.standard());
  }

  @Override
  public boolean isSubtypeOf(Type s, Type t) {
    if (s.equals(t) || t.isTop() || s.isNever()) {
      return true;
    }
    if (s.getKind() == Type.Kind.LEGACY) {
      return isSubtypeOf(s.getInnerType(), t);
    }
    if (t.getKind() == Type.Kind.LEGACY) {
      return isSubtypeOf(s, Type.nullable(t.getInnerType()));
    }
    if (s.isTop()) {
      return false;
    }

    switch (s.getKind()) {
      case NULL:
        return isNullSubtypeOf(t);
      case FUTURE_OR:
        {
          Type valueType = s.getInnerType();
          return isSubtypeOf(futureType(valueType), t) && isSubtypeOf(valueType, t);
        }
      case NULLABLE:
        return isSubtypeOf(s.getInnerType(), t) && isNullSubtypeOf(t);
      default:
        break;
    }

    // s is an interface, function, type variable or promoted type variable.
    switch (t.getKind()) {
      case PROMOTED_TYPE_VARIABLE:
        {
          PromotedTypeVariable promoted = (PromotedTypeVariable) t;
          return isSubtypeOf(s, promoted.getVariable())
              && isSubtypeOf(s, promoted.getPromotedBound());
        }
      case FUTURE_OR:
        {
          Type valueType = t.getInnerType();
          return isSubtypeOf(s, futureType(valueType))
              || isSubtypeOf(s, valueType)
              || isBoundSubtypeOf(s, t);
        }
      case NULLABLE:
        return isSubtypeOf(s, t.getInnerType()) || isBoundSubtypeOf(s, t);
      default:
        break;
    }

    switch (s.getKind()) {
      case TYPE_VARIABLE:
        return isSubtypeOf(((TypeVariable) s).getBound(), t);
      case PROMOTED_TYPE_VARIABLE:
        {
          PromotedTypeVariable promoted = (PromotedTypeVariable) s;
          return isSubtypeOf(promoted.getVariable(), t)
              || isSubtypeOf(promoted.getPromotedBound(), t);
        }
      case FUNCTION:
        return isFunctionSubtypeOf((FunctionType) s, t);
      case INTERFACE:
        return isInterfaceSubtypeOf((InterfaceType) s, t);
      default:
        throw new IllegalStateException("unexpected type " + s);
    }
  }

  private boolean isNullSubtypeOf(Type t) {
    switch (t.getKind()) {
      case NULL:
      case NULLABLE:
      case LEGACY:
      case DYNAMIC:
      case VOID:
        return true;
      case FUTURE_OR:
        return isNullSubtypeOf(t.getInnerType());
      default:
        return false;
    }
  }

  /** The type variable cases of the nullable and {@code FutureOr} rules on the right. */
  private boolean isBoundSubtypeOf(Type s, Type t) {
    if (s.getKind() == Type.Kind.TYPE_VARIABLE) {
      return isSubtypeOf(((TypeVariable) s).getBound(), t);
    }
    if (s.getKind() == Type.Kind.PROMOTED_TYPE_VARIABLE) {
      return isSubtypeOf(((PromotedTypeVariable) s).getPromotedBound(), t);
    }
    return false;
  }

  private boolean isFunctionSubtypeOf(FunctionType s, Type t) {
    if (t.getKind() == Type.Kind.INTERFACE) {
      String name = ((InterfaceType) t).getName();
      return name.equals("Function") || name.equals(Type.OBJECT.getName());
    }
    if (t.getKind() != Type.Kind.FUNCTION) {
      return false;
    }
    FunctionType that = (FunctionType) t;
    ImmutableList<Type> sParameters = s.getParameterTypes();
    ImmutableList<Type> tParameters = that.getParameterTypes();
    if (sParameters.size() != tParameters.size()) {
      return false;
    }
    for (int i = 0; i < sParameters.size(); i++) {
      if (!isSubtypeOf(tParameters.get(i), sParameters.get(i))) {
        return false;
      }
    }
    return isSubtypeOf(s.getReturnType(), that.getReturnType());
  }

  private boolean isInterfaceSubtypeOf(InterfaceType s, Type t) {
    if (t.getKind() != Type.Kind.INTERFACE) {
      return false;
    }
    InterfaceType target = (InterfaceType) t;
    InterfaceType instance = hierarchy.asInstanceOf(s, target.getName());
    if (instance == null) {
      return false;
    }
    ImmutableList<Type> actual = instance.getTypeArguments();
    ImmutableList<Type> expected = target.getTypeArguments();
    if (actual.isEmpty() || expected.isEmpty()) {
      // Raw types.
      return true;
    }
    if (actual.size() != expected.size()) {
      return false;
    }
    for (int i = 0; i < actual.size(); i++) {
      if (!isSubtypeOf(actual.get(i), expected.get(i))) {
        return false;
      }
    }
    return true;
  }
}
