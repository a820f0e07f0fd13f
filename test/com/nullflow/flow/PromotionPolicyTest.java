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

import static com.google.common.truth.Truth.assertThat;

import com.google.common.collect.ImmutableList;
import com.nullflow.syntax.Var;
import com.nullflow.syntax.types.Type;
import com.nullflow.syntax.types.Type.TypeVariable;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests for {@link PromotionPolicy}. */
@RunWith(JUnit4.class)
public final class PromotionPolicyTest extends FlowTestCase {

  private static final TypeVariable T = Type.typeVariable("T", NULLABLE_OBJECT);
  private static final TypeVariable N = Type.typeVariable("N", NUM);

  private static VariableModel model(Type declaredType, Type... chain) {
    return VariableModel.initial(declaredType, true).withPromotedTypes(ImmutableList.copyOf(chain));
  }

  @Test
  public void testTryPromoteToType() {
    assertThat(policy.tryPromoteToType(INT, NULLABLE_INT)).isEqualTo(INT);
    assertThat(policy.tryPromoteToType(INT, NUM)).isEqualTo(INT);
    assertThat(policy.tryPromoteToType(NUM, INT)).isNull();
    assertThat(policy.tryPromoteToType(INT, INT)).isNull();
    assertThat(policy.tryPromoteToType(STRING, NUM)).isNull();
    assertThat(policy.tryPromoteToType(INT, Type.DYNAMIC)).isEqualTo(INT);
  }

  @Test
  public void testTryPromoteTypeVariable() {
    assertThat(policy.tryPromoteToType(INT, T)).isEqualTo(Type.promotedTypeVariable(T, INT));
    assertThat(policy.tryPromoteToType(T, T)).isNull();
    assertThat(policy.tryPromoteToType(NUM, N)).isNull();
    assertThat(policy.tryPromoteToType(INT, N)).isEqualTo(Type.promotedTypeVariable(N, INT));
    Type promoted = Type.promotedTypeVariable(T, NUM);
    assertThat(policy.tryPromoteToType(INT, promoted)).isEqualTo(Type.promotedTypeVariable(T, INT));
  }

  @Test
  public void testNonNull() {
    assertThat(policy.nonNull(NULLABLE_INT)).isEqualTo(INT);
    assertThat(policy.nonNull(INT)).isEqualTo(INT);
    assertThat(policy.nonNull(Type.legacy(INT))).isEqualTo(INT);
    assertThat(policy.nonNull(Type.NULL)).isEqualTo(Type.NEVER);
    assertThat(policy.nonNull(Type.futureOr(NULLABLE_INT))).isEqualTo(Type.futureOr(INT));
    assertThat(policy.nonNull(T)).isEqualTo(Type.promotedTypeVariable(T, OBJECT));
    assertThat(policy.nonNull(N)).isEqualTo(N);
  }

  @Test
  public void testFactor() {
    assertThat(policy.factor(NULLABLE_INT, Type.NULL)).isEqualTo(INT);
    assertThat(policy.factor(NULLABLE_INT, INT)).isEqualTo(Type.NULL);
    assertThat(policy.factor(INT, NUM)).isEqualTo(Type.NEVER);
    assertThat(policy.factor(NULLABLE_NUM, INT)).isEqualTo(NULLABLE_NUM);
    assertThat(policy.factor(NULLABLE_INT, NULLABLE_NUM)).isEqualTo(Type.NEVER);
  }

  @Test
  public void testPromoteByTestRecordsTypeOfInterest() {
    VariableModel promoted = policy.promoteByTest(model(NULLABLE_NUM), INT);
    assertThat(promoted.getPromotedTypes()).containsExactly(INT);
    assertThat(promoted.getTested()).containsExactly(INT);

    VariableModel notPromoted = policy.promoteByTest(model(INT), NUM);
    assertThat(notPromoted.isPromoted()).isFalse();
    assertThat(notPromoted.getTested()).containsExactly(NUM);
  }

  @Test
  public void testPromotionChainOnlyNarrows() {
    VariableModel model = model(NULLABLE_OBJECT);
    model = policy.promoteByTest(model, NUM);
    model = policy.promoteByTest(model, OBJECT);
    model = policy.promoteByTest(model, INT);
    model = policy.promoteToNonNull(model);
    assertThat(model.getPromotedTypes()).containsExactly(NUM, INT).inOrder();
    for (int i = 1; i < model.getPromotedTypes().size(); i++) {
      Type previous = model.getPromotedTypes().get(i - 1);
      assertThat(types.isSubtypeOf(model.getPromotedTypes().get(i), previous)).isTrue();
    }
  }

  @Test
  public void testDemoteByFailedTest() {
    assertThat(policy.demoteByFailedTest(model(NULLABLE_INT), Type.NULL).getCurrentType())
        .isEqualTo(INT);
    assertThat(policy.demoteByFailedTest(model(NULLABLE_NUM), INT).isPromoted()).isFalse();
  }

  @Test
  public void testWriteCapturedIsNeverPromoted() {
    VariableModel captured = model(NULLABLE_INT).markWriteCaptured();
    assertThat(policy.promoteToNonNull(captured).isPromoted()).isFalse();
    assertThat(policy.promoteByTest(captured, INT).getTested()).containsExactly(INT);

    Var x = Var.declared("x", NULLABLE_INT);
    VariableModel assigned = policy.assign(x, captured.withTested(INT), INT);
    assertThat(assigned.isPromoted()).isFalse();
    assertThat(assigned.isAssigned()).isTrue();
  }

  @Test
  public void testAssignDemotesToLongestValidPrefix() {
    Var x = Var.declared("x", NULLABLE_OBJECT);
    VariableModel model = model(NULLABLE_OBJECT, OBJECT, NUM, INT);

    assertThat(policy.assign(x, model, INT).getPromotedTypes())
        .containsExactly(OBJECT, NUM, INT)
        .inOrder();
    assertThat(policy.assign(x, model, NUM).getPromotedTypes())
        .containsExactly(OBJECT, NUM)
        .inOrder();
    assertThat(policy.assign(x, model, DOUBLE).getPromotedTypes())
        .containsExactly(OBJECT, NUM)
        .inOrder();
    assertThat(policy.assign(x, model, Type.NULL).getPromotedTypes()).isEmpty();
  }

  @Test
  public void testAssignPromotesToTypeOfInterest() {
    Var x = Var.declared("x", NULLABLE_NUM);
    VariableModel tested = model(NULLABLE_NUM).withTested(INT);
    assertThat(policy.assign(x, tested, INT).getCurrentType()).isEqualTo(INT);
    assertThat(policy.assign(x, model(NULLABLE_NUM), INT).isPromoted()).isFalse();
    // Only an exact match counts.
    assertThat(policy.assign(x, model(NULLABLE_NUM).withTested(NUM), INT).isPromoted())
        .isFalse();
  }

  @Test
  public void testInitializationPromotion() {
    Var x = Var.untyped("x");
    VariableModel unassigned = VariableModel.initial(Type.DYNAMIC, false);

    VariableModel initialized = policy.assign(x, unassigned, INT);
    assertThat(initialized.getPromotedTypes()).containsExactly(INT);
    assertThat(initialized.isAssigned()).isTrue();
    assertThat(initialized.isUnassigned()).isFalse();

    // A second write is an ordinary assignment.
    assertThat(policy.assign(x, initialized, STRING).isPromoted()).isFalse();
    assertThat(policy.assign(x, unassigned, Type.NULL).isPromoted()).isFalse();
    assertThat(policy.assign(x, unassigned, Type.DYNAMIC).isPromoted()).isFalse();
  }

  @Test
  public void testInitializationNeedsImplicitType() {
    Var x = Var.declared("x", NULLABLE_NUM);
    VariableModel unassigned = VariableModel.initial(NULLABLE_NUM, false);
    assertThat(policy.assign(x, unassigned, INT).isPromoted()).isFalse();
  }

  @Test
  public void testTypeTestWinsOverInitialization() {
    // var x; if (x is String) { x = 1; }
    Var x = Var.untyped("x");
    VariableModel unassigned = VariableModel.initial(Type.DYNAMIC, false);
    VariableModel tested = policy.promoteByTest(unassigned, STRING);
    assertThat(tested.getCurrentType()).isEqualTo(STRING);

    VariableModel assigned = policy.assign(x, tested, INT);
    assertThat(assigned.isPromoted()).isFalse();
    assertThat(assigned.getCurrentType()).isEqualTo(Type.DYNAMIC);

    // A failed test also counts as a test.
    VariableModel failed = policy.demoteByFailedTest(unassigned, STRING);
    assertThat(policy.assign(x, failed, INT).isPromoted()).isFalse();
    assertThat(policy.assign(x, failed, STRING).getCurrentType()).isEqualTo(STRING);
  }
}
