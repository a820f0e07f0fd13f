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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import com.google.errorprone.annotations.Immutable;
import com.nullflow.syntax.types.Type.InterfaceType;
import com.nullflow.syntax.types.Type.TypeVariable;
import java.util.LinkedHashMap;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * The declared classes known to {@link StandardTypeOperations}, with their type parameters and
 * direct supertypes. Every class implicitly extends {@code Object}.
 */
@Immutable
public final class ClassHierarchy {

  private final ImmutableMap<String, ClassDeclaration> classes;

  private ClassHierarchy(ImmutableMap<String, ClassDeclaration> classes) {
    this.classes = classes;
  }

  /** One class declaration: {@code class Name<T1, ..., Tn> implements S1, ..., Sm}. */
  @Immutable
  private static final class ClassDeclaration {
    final ImmutableList<TypeVariable> typeParameters;
    final ImmutableList<InterfaceType> supertypes;

    ClassDeclaration(
        ImmutableList<TypeVariable> typeParameters, ImmutableList<InterfaceType> supertypes) {
      this.typeParameters = typeParameters;
      this.supertypes = supertypes;
    }
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * The core library classes: {@code num}, {@code int}, {@code double}, {@code String},
   * {@code bool}, {@code Function}, {@code Comparable<T>}, {@code Iterable<E>}, {@code List<E>}
   * and {@code Future<T>}.
   */
  public static ClassHierarchy standard() {
    TypeVariable t = Type.typeVariable("T", Type.nullable(Type.OBJECT));
    TypeVariable e = Type.typeVariable("E", Type.nullable(Type.OBJECT));
    InterfaceType num = Type.interfaceType("num");
    return builder()
        .addGenericClass("Comparable", ImmutableList.of(t))
        .addClass("num", Type.interfaceType("Comparable", num))
        .addClass("int", num)
        .addClass("double", num)
        .addClass("String", Type.interfaceType("Comparable", Type.interfaceType("String")))
        .addClass("bool")
        .addClass("Function")
        .addGenericClass("Iterable", ImmutableList.of(e))
        .addGenericClass("List", ImmutableList.of(e), Type.interfaceType("Iterable", e))
        .addGenericClass("Future", ImmutableList.of(t))
        .build();
  }

  public boolean isDeclared(String className) {
    return className.equals(Type.OBJECT.getName()) || classes.containsKey(className);
  }

  /**
   * Returns {@code type} viewed as an instance of the class {@code superclassName}, with the type
   * arguments that follow from the supertype declarations, or null if that class is not a
   * supertype. Unknown classes only have {@code Object} as a supertype.
   */
  public @Nullable InterfaceType asInstanceOf(InterfaceType type, String superclassName) {
    if (type.getName().equals(superclassName)) {
      return type;
    }
    if (superclassName.equals(Type.OBJECT.getName())) {
      return Type.OBJECT;
    }
    ClassDeclaration declaration = classes.get(type.getName());
    if (declaration == null) {
      return null;
    }
    ImmutableMap<TypeVariable, Type> substitution = bindTypeArguments(declaration, type);
    for (InterfaceType supertype : declaration.supertypes) {
      InterfaceType found =
          asInstanceOf((InterfaceType) supertype.substitute(substitution), superclassName);
      if (found != null) {
        return found;
      }
    }
    return null;
  }

  /** A raw reference binds every type parameter to {@code dynamic}. */
  private static ImmutableMap<TypeVariable, Type> bindTypeArguments(
      ClassDeclaration declaration, InterfaceType type) {
    ImmutableMap.Builder<TypeVariable, Type> substitution = ImmutableMap.builder();
    ImmutableList<Type> arguments = type.getTypeArguments();
    for (int i = 0; i < declaration.typeParameters.size(); i++) {
      substitution.put(
          declaration.typeParameters.get(i),
          i < arguments.size() ? arguments.get(i) : Type.DYNAMIC);
    }
    return substitution.buildOrThrow();
  }

  /** Builds a {@link ClassHierarchy}. Supertypes must be declared before their subclasses. */
  public static final class Builder {
    private final Map<String, ClassDeclaration> classes = new LinkedHashMap<>();

    private Builder() {}

    @CanIgnoreReturnValue
    public Builder addClass(String name, InterfaceType... supertypes) {
      return addGenericClass(name, ImmutableList.of(), supertypes);
    }

    @CanIgnoreReturnValue
    public Builder addGenericClass(
        String name, ImmutableList<TypeVariable> typeParameters, InterfaceType... supertypes) {
      checkNotNull(name);
      checkArgument(!name.equals(Type.OBJECT.getName()), "Object is implicitly declared");
      checkArgument(!classes.containsKey(name), "duplicate class %s", name);
      for (InterfaceType supertype : supertypes) {
        checkArgument(
            supertype.equals(Type.OBJECT) || classes.containsKey(supertype.getName()),
            "supertype %s of %s is not declared",
            supertype,
            name);
      }
      classes.put(
          name, new ClassDeclaration(typeParameters, ImmutableList.copyOf(supertypes)));
      return this;
    }

    public ClassHierarchy build() {
      return new ClassHierarchy(ImmutableMap.copyOf(classes));
    }
  }
}
