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

import com.google.common.base.MoreObjects;
import com.google.errorprone.annotations.Immutable;
import com.nullflow.syntax.types.Type;
import com.nullflow.syntax.types.TypeOperations;

/**
 * The flow models after an expression: unconditionally, and given that its value is true, false,
 * null or not null. All five models are at the split level of the model before the expression.
 */
@Immutable
public final class ExpressionInfo {

  private final FlowModel after;
  private final FlowModel whenTrue;
  private final FlowModel whenFalse;
  private final FlowModel whenNull;
  private final FlowModel whenNotNull;

  ExpressionInfo(
      FlowModel after,
      FlowModel whenTrue,
      FlowModel whenFalse,
      FlowModel whenNull,
      FlowModel whenNotNull) {
    this.after = checkNotNull(after);
    this.whenTrue = checkNotNull(whenTrue);
    this.whenFalse = checkNotNull(whenFalse);
    this.whenNull = checkNotNull(whenNull);
    this.whenNotNull = checkNotNull(whenNotNull);
  }

  /**
   * The info of an expression that only has an after model, sharpened by its static type: a
   * {@code Never} expression does not complete, a non-nullable one is never null and one of type
   * {@code Null} is never anything else.
   */
  static ExpressionInfo simple(FlowModel after, Type staticType, TypeOperations types) {
    if (staticType.isNever()) {
      after = after.exit();
    }
    FlowModel whenNull = types.isNonNullable(staticType) ? after.exit() : after;
    FlowModel whenNotNull = staticType.isNullType() ? after.exit() : after;
    return new ExpressionInfo(after, after, after, whenNull, whenNotNull);
  }

  /** The info of a condition, from the models given its outcome. */
  static ExpressionInfo condition(FlowModel whenTrue, FlowModel whenFalse) {
    FlowModel after = FlowModel.merge(whenTrue, whenFalse);
    return new ExpressionInfo(after, whenTrue, whenFalse, after.exit(), after);
  }

  /** The info of an expression whose null and non-null outcomes are known. */
  static ExpressionInfo nullability(FlowModel after, FlowModel whenNull, FlowModel whenNotNull) {
    return new ExpressionInfo(after, after, after, whenNull, whenNotNull);
  }

  public FlowModel getAfter() {
    return after;
  }

  public FlowModel getWhenTrue() {
    return whenTrue;
  }

  public FlowModel getWhenFalse() {
    return whenFalse;
  }

  public FlowModel getWhenNull() {
    return whenNull;
  }

  public FlowModel getWhenNotNull() {
    return whenNotNull;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("after", after)
        .add("whenTrue", whenTrue)
        .add("whenFalse", whenFalse)
        .add("whenNull", whenNull)
        .add("whenNotNull", whenNotNull)
        .toString();
  }
}
