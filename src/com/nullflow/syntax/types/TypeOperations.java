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

import org.jspecify.annotations.Nullable;

/**
 * The type oracle the flow analysis consults. It answers subtype questions and knows the handful
 * of types the analysis treats specially. Implementations must be deterministic: the same
 * question always gets the same answer.
 */
public interface TypeOperations {

  /** Whether {@code subtype} is a subtype of {@code supertype}. */
  boolean isSubtypeOf(Type subtype, Type supertype);

  /** Whether {@code a} and {@code b} are mutual subtypes. */
  default boolean isSameType(Type a, Type b) {
    return a.equals(b) || (isSubtypeOf(a, b) && isSubtypeOf(b, a));
  }

  /** Whether {@code null} is a value of {@code type}. */
  default boolean isNullable(Type type) {
    return isSubtypeOf(Type.NULL, type);
  }

  /**
   * Whether {@code type} excludes {@code null}, that is whether it is a subtype of {@code Object}.
   * A type variable with a nullable bound is neither nullable nor non-nullable, and so are legacy
   * types.
   */
  default boolean isNonNullable(Type type) {
    return type.getKind() != Type.Kind.LEGACY && isSubtypeOf(type, objectType());
  }

  default Type objectType() {
    return Type.OBJECT;
  }

  default Type nullableObjectType() {
    return Type.nullable(Type.OBJECT);
  }

  default Type nullType() {
    return Type.NULL;
  }

  default Type neverType() {
    return Type.NEVER;
  }

  default Type dynamicType() {
    return Type.DYNAMIC;
  }

  /** The type of booleans, used for conditions whose type has not been recorded. */
  default Type boolType() {
    return Type.interfaceType("bool");
  }

  /** {@code Future<T>}. */
  default Type futureType(Type valueType) {
    return Type.interfaceType("Future", valueType);
  }

  default Type futureOrType(Type valueType) {
    return Type.futureOr(valueType);
  }

  /**
   * The value type {@code T} of {@code Future<T>}, {@code FutureOr<T>} or their nullable
   * versions, or null if {@code type} is not one of those.
   */
  default @Nullable Type getFutureValueType(Type type) {
    switch (type.getKind()) {
      case FUTURE_OR:
        return type.getInnerType();
      case NULLABLE:
      case LEGACY:
        return getFutureValueType(type.getInnerType());
      case INTERFACE:
        Type.InterfaceType interfaceType = (Type.InterfaceType) type;
        if (interfaceType.getName().equals("Future")
            && interfaceType.getTypeArguments().size() == 1) {
          return interfaceType.getTypeArguments().get(0);
        }
        return null;
      default:
        return null;
    }
  }

  /**
   * The type of {@code await e} where {@code e} has static type {@code type}: the value type of a
   * future, the type itself otherwise.
   */
  default Type flatten(Type type) {
    Type valueType = getFutureValueType(type);
    if (valueType == null) {
      return type;
    }
    return type.isNullable() && type.getKind() != Type.Kind.FUTURE_OR
        ? Type.nullable(valueType)
        : valueType;
  }
}
