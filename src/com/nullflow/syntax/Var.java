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

package com.nullflow.syntax;

import static com.google.common.base.Preconditions.checkNotNull;

import com.nullflow.syntax.types.Type;
import org.jspecify.annotations.Nullable;

/**
 * A local variable or parameter. Identifier resolution happens before the flow analysis runs,
 * so every {@link Token#NAME} node that refers to a local carries its {@code Var}. Vars compare by
 * identity: two declarations with the same name are different variables.
 */
public final class Var {

  private final String name;
  private final @Nullable Type declaredType;
  private final boolean isFinal;
  private @Nullable Node nameNode;

  private Var(String name, @Nullable Type declaredType, boolean isFinal) {
    this.name = checkNotNull(name);
    this.declaredType = declaredType;
    this.isFinal = isFinal;
  }

  /** A variable with an explicit type annotation, e.g. {@code String? s;}. */
  public static Var declared(String name, Type declaredType) {
    return new Var(name, checkNotNull(declaredType), false);
  }

  /** A variable without a type annotation, e.g. {@code var x;}. */
  public static Var untyped(String name) {
    return new Var(name, null, false);
  }

  /** A {@code final} variable; the declared type may be absent. */
  public static Var finalVar(String name, @Nullable Type declaredType) {
    return new Var(name, declaredType, true);
  }

  public String getName() {
    return name;
  }

  /** The declared type, or null when the type is implicit and has to be inferred. */
  public @Nullable Type getDeclaredType() {
    return declaredType;
  }

  public boolean hasImplicitType() {
    return declaredType == null;
  }

  public boolean isFinal() {
    return isFinal;
  }

  /** The NAME node of the declaration, once the declaration has been built. */
  public @Nullable Node getNameNode() {
    return nameNode;
  }

  void setNameNode(Node nameNode) {
    this.nameNode = nameNode;
  }

  @Override
  public String toString() {
    return "Var " + name;
  }
}
