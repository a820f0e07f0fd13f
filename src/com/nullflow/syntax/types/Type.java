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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.errorprone.annotations.Immutable;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * A static type of the analyzed language. The set of type forms is closed: every type is one of
 * the nested subclasses below and carries the matching {@link Kind}, so code that has to handle
 * each form can switch on {@link #getKind()}.
 *
 * <p>Types are immutable values with structural equality. The factory methods normalize, so that
 * for example {@code nullable(nullable(int))} and {@code nullable(int)} are equal, and
 * {@code nullable(Never)} is {@code Null}.
 */
@Immutable
public abstract class Type {

  /** The forms a type can take. */
  public enum Kind {
    /** A class or interface type, possibly generic: {@code int}, {@code List<String>}. */
    INTERFACE,
    /** {@code R Function(P1, ..., Pn)}. */
    FUNCTION,
    /** A type parameter {@code X} with its bound. */
    TYPE_VARIABLE,
    /** A type parameter promoted within its bound: {@code X & T}. */
    PROMOTED_TYPE_VARIABLE,
    /** {@code T?}. */
    NULLABLE,
    /** {@code T*}: a type from a library that predates null safety. */
    LEGACY,
    NEVER,
    NULL,
    DYNAMIC,
    VOID,
    /** {@code FutureOr<T>}. */
    FUTURE_OR
  }

  public static final Type NEVER = new SpecialType(Kind.NEVER, "Never");
  public static final Type NULL = new SpecialType(Kind.NULL, "Null");
  public static final Type DYNAMIC = new SpecialType(Kind.DYNAMIC, "dynamic");
  public static final Type VOID = new SpecialType(Kind.VOID, "void");

  private final Kind kind;

  private Type(Kind kind) {
    this.kind = kind;
  }

  public final Kind getKind() {
    return kind;
  }

  public static InterfaceType interfaceType(String name, Type... typeArguments) {
    return new InterfaceType(name, ImmutableList.copyOf(typeArguments));
  }

  public static InterfaceType interfaceType(String name, ImmutableList<Type> typeArguments) {
    return new InterfaceType(name, typeArguments);
  }

  public static FunctionType functionType(Type returnType, Type... parameterTypes) {
    return new FunctionType(returnType, ImmutableList.copyOf(parameterTypes));
  }

  /** A type parameter bounded by {@code bound}; pass {@code Object?} for an unbounded one. */
  public static TypeVariable typeVariable(String name, Type bound) {
    return new TypeVariable(name, bound);
  }

  /** {@code X & bound}; {@code X & X} and {@code (X & A) & B} normalize. */
  public static Type promotedTypeVariable(TypeVariable variable, Type promotedBound) {
    if (promotedBound.equals(variable)) {
      return variable;
    }
    if (promotedBound instanceof PromotedTypeVariable) {
      PromotedTypeVariable other = (PromotedTypeVariable) promotedBound;
      checkArgument(other.variable.equals(variable), "%s is not a bound of %s", other, variable);
      return other;
    }
    return new PromotedTypeVariable(variable, promotedBound);
  }

  /** {@code T?}. */
  public static Type nullable(Type type) {
    switch (type.kind) {
      case NULLABLE:
      case NULL:
      case DYNAMIC:
      case VOID:
        return type;
      case NEVER:
        return NULL;
      case LEGACY:
        return nullable(((WrapperType) type).inner);
      case FUTURE_OR:
        {
          Type argument = ((WrapperType) type).inner;
          if (argument.isNullable()) {
            return type;
          }
          return new WrapperType(Kind.NULLABLE, type);
        }
      default:
        return new WrapperType(Kind.NULLABLE, type);
    }
  }

  /** {@code T*}. */
  public static Type legacy(Type type) {
    switch (type.kind) {
      case NULLABLE:
      case LEGACY:
      case NULL:
      case DYNAMIC:
      case VOID:
        return type;
      case NEVER:
        return NULL;
      default:
        return new WrapperType(Kind.LEGACY, type);
    }
  }

  public static Type futureOr(Type type) {
    return new WrapperType(Kind.FUTURE_OR, type);
  }

  /**
   * Whether {@code null} is syntactically a value of this type. This does not consult any type
   * hierarchy: a type variable with a nullable bound is not nullable.
   */
  public boolean isNullable() {
    return false;
  }

  public boolean isTop() {
    return false;
  }

  public final boolean isNever() {
    return kind == Kind.NEVER;
  }

  public final boolean isNullType() {
    return kind == Kind.NULL;
  }

  public final boolean isDynamic() {
    return kind == Kind.DYNAMIC;
  }

  public final boolean isVoid() {
    return kind == Kind.VOID;
  }

  public final boolean isTypeVariable() {
    return kind == Kind.TYPE_VARIABLE;
  }

  /** The wrapped type of {@code T?}, {@code T*} or {@code FutureOr<T>}. */
  public Type getInnerType() {
    throw new IllegalStateException(this + " does not wrap a type");
  }

  /** Replaces the type variables in {@code substitution} throughout this type. */
  public abstract Type substitute(ImmutableMap<TypeVariable, Type> substitution);

  @Override
  public abstract boolean equals(@Nullable Object other);

  @Override
  public abstract int hashCode();

  /** {@code Never}, {@code Null}, {@code dynamic} and {@code void}. */
  private static final class SpecialType extends Type {
    private final String name;

    SpecialType(Kind kind, String name) {
      super(kind);
      this.name = name;
    }

    @Override
    public boolean isNullable() {
      return getKind() != Kind.NEVER;
    }

    @Override
    public boolean isTop() {
      return getKind() == Kind.DYNAMIC || getKind() == Kind.VOID;
    }

    @Override
    public Type substitute(ImmutableMap<TypeVariable, Type> substitution) {
      return this;
    }

    @Override
    public boolean equals(@Nullable Object other) {
      return this == other;
    }

    @Override
    public int hashCode() {
      return getKind().hashCode();
    }

    @Override
    public String toString() {
      return name;
    }
  }

  /** {@code T?}, {@code T*} and {@code FutureOr<T>}. */
  private static final class WrapperType extends Type {
    private final Type inner;

    WrapperType(Kind kind, Type inner) {
      super(kind);
      this.inner = checkNotNull(inner);
    }

    @Override
    public Type getInnerType() {
      return inner;
    }

    @Override
    public boolean isNullable() {
      return getKind() != Kind.FUTURE_OR || inner.isNullable();
    }

    @Override
    public boolean isTop() {
      switch (getKind()) {
        case NULLABLE:
        case LEGACY:
          return inner.isTop() || inner.equals(OBJECT);
        default:
          return inner.isTop();
      }
    }

    @Override
    public Type substitute(ImmutableMap<TypeVariable, Type> substitution) {
      Type newInner = inner.substitute(substitution);
      if (newInner == inner) {
        return this;
      }
      switch (getKind()) {
        case NULLABLE:
          return nullable(newInner);
        case LEGACY:
          return legacy(newInner);
        default:
          return futureOr(newInner);
      }
    }

    @Override
    public boolean equals(@Nullable Object other) {
      if (!(other instanceof WrapperType)) {
        return false;
      }
      WrapperType that = (WrapperType) other;
      return getKind() == that.getKind() && inner.equals(that.inner);
    }

    @Override
    public int hashCode() {
      return Objects.hash(getKind(), inner);
    }

    @Override
    public String toString() {
      switch (getKind()) {
        case NULLABLE:
          return parenthesizeFunction(inner) + "?";
        case LEGACY:
          return parenthesizeFunction(inner) + "*";
        default:
          return "FutureOr<" + inner + ">";
      }
    }

    private static String parenthesizeFunction(Type type) {
      return type.getKind() == Kind.FUNCTION || type.getKind() == Kind.PROMOTED_TYPE_VARIABLE
          ? "(" + type + ")"
          : type.toString();
    }
  }

  /** A class or interface type. */
  public static final class InterfaceType extends Type {
    private final String name;
    private final ImmutableList<Type> typeArguments;

    private InterfaceType(String name, ImmutableList<Type> typeArguments) {
      super(Kind.INTERFACE);
      checkArgument(!name.isEmpty());
      this.name = name;
      this.typeArguments = typeArguments;
    }

    public String getName() {
      return name;
    }

    public ImmutableList<Type> getTypeArguments() {
      return typeArguments;
    }

    @Override
    public Type substitute(ImmutableMap<TypeVariable, Type> substitution) {
      if (typeArguments.isEmpty()) {
        return this;
      }
      ImmutableList.Builder<Type> newArguments = ImmutableList.builder();
      for (Type argument : typeArguments) {
        newArguments.add(argument.substitute(substitution));
      }
      return new InterfaceType(name, newArguments.build());
    }

    @Override
    public boolean equals(@Nullable Object other) {
      if (!(other instanceof InterfaceType)) {
        return false;
      }
      InterfaceType that = (InterfaceType) other;
      return name.equals(that.name) && typeArguments.equals(that.typeArguments);
    }

    @Override
    public int hashCode() {
      return Objects.hash(name, typeArguments);
    }

    @Override
    public String toString() {
      if (typeArguments.isEmpty()) {
        return name;
      }
      return name + "<" + Joiner.on(", ").join(typeArguments) + ">";
    }
  }

  /** {@code Object}, the root of the non-nullable class hierarchy. */
  public static final InterfaceType OBJECT = interfaceType("Object");

  /** A function type with positional parameters. */
  public static final class FunctionType extends Type {
    private final Type returnType;
    private final ImmutableList<Type> parameterTypes;

    private FunctionType(Type returnType, ImmutableList<Type> parameterTypes) {
      super(Kind.FUNCTION);
      this.returnType = checkNotNull(returnType);
      this.parameterTypes = parameterTypes;
    }

    public Type getReturnType() {
      return returnType;
    }

    public ImmutableList<Type> getParameterTypes() {
      return parameterTypes;
    }

    @Override
    public Type substitute(ImmutableMap<TypeVariable, Type> substitution) {
      ImmutableList.Builder<Type> newParameters = ImmutableList.builder();
      for (Type parameter : parameterTypes) {
        newParameters.add(parameter.substitute(substitution));
      }
      return new FunctionType(returnType.substitute(substitution), newParameters.build());
    }

    @Override
    public boolean equals(@Nullable Object other) {
      if (!(other instanceof FunctionType)) {
        return false;
      }
      FunctionType that = (FunctionType) other;
      return returnType.equals(that.returnType) && parameterTypes.equals(that.parameterTypes);
    }

    @Override
    public int hashCode() {
      return Objects.hash(returnType, parameterTypes);
    }

    @Override
    public String toString() {
      return returnType + " Function(" + Joiner.on(", ").join(parameterTypes) + ")";
    }
  }

  /**
   * A type parameter. Type variables are identified by name; the bound is not part of equality so
   * that F-bounded variables such as {@code T extends Comparable<T>} can be compared.
   */
  public static final class TypeVariable extends Type {
    private final String name;
    private final Type bound;

    private TypeVariable(String name, Type bound) {
      super(Kind.TYPE_VARIABLE);
      this.name = checkNotNull(name);
      this.bound = checkNotNull(bound);
    }

    public String getName() {
      return name;
    }

    public Type getBound() {
      return bound;
    }

    @Override
    public Type substitute(ImmutableMap<TypeVariable, Type> substitution) {
      Type replacement = substitution.get(this);
      return replacement != null ? replacement : this;
    }

    @Override
    public boolean equals(@Nullable Object other) {
      return other instanceof TypeVariable && name.equals(((TypeVariable) other).name);
    }

    @Override
    public int hashCode() {
      return name.hashCode();
    }

    @Override
    public String toString() {
      return name;
    }
  }

  /** {@code X & T}: a type variable known to also be a {@code T}. */
  public static final class PromotedTypeVariable extends Type {
    private final TypeVariable variable;
    private final Type promotedBound;

    private PromotedTypeVariable(TypeVariable variable, Type promotedBound) {
      super(Kind.PROMOTED_TYPE_VARIABLE);
      this.variable = checkNotNull(variable);
      this.promotedBound = checkNotNull(promotedBound);
    }

    public TypeVariable getVariable() {
      return variable;
    }

    public Type getPromotedBound() {
      return promotedBound;
    }

    @Override
    public Type substitute(ImmutableMap<TypeVariable, Type> substitution) {
      Type replacement = substitution.get(variable);
      if (replacement == null) {
        return new PromotedTypeVariable(variable, promotedBound.substitute(substitution));
      }
      // Once the variable is instantiated only the promoted bound says anything new.
      return promotedBound.substitute(substitution);
    }

    @Override
    public boolean equals(@Nullable Object other) {
      if (!(other instanceof PromotedTypeVariable)) {
        return false;
      }
      PromotedTypeVariable that = (PromotedTypeVariable) other;
      return variable.equals(that.variable) && promotedBound.equals(that.promotedBound);
    }

    @Override
    public int hashCode() {
      return Objects.hash(variable, promotedBound);
    }

    @Override
    public String toString() {
      return variable + " & " + promotedBound;
    }
  }
}
