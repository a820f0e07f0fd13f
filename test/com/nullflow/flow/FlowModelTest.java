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
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.nullflow.syntax.Var;
import com.nullflow.syntax.types.Type;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests for the lattice operations of {@link FlowModel}. */
@RunWith(JUnit4.class)
public final class FlowModelTest extends FlowTestCase {

  private final Var x = Var.declared("x", NULLABLE_INT);
  private final Var y = Var.untyped("y");
  private final Var z = Var.declared("z", NULLABLE_NUM);

  private FlowModel entry;

  @Override
  @Before
  public void setUp() throws Exception {
    super.setUp();
    entry =
        FlowModel.initial()
            .declare(x, NULLABLE_INT, true)
            .declare(y, OBJECT, false)
            .declare(z, NULLABLE_NUM, true);
  }

  private FlowModel promoteToNonNull(FlowModel model, Var var) {
    return model.withVariable(var, policy.promoteToNonNull(model.getVariableModel(var)));
  }

  private FlowModel testIs(FlowModel model, Var var, Type type) {
    return model.withVariable(var, policy.promoteByTest(model.getVariableModel(var), type));
  }

  /** Three branches of the same split, each knowing something different. */
  private ImmutableList<FlowModel> branches() {
    FlowModel split = entry.split();
    return ImmutableList.of(
        promoteToNonNull(split, x),
        testIs(split.assign(y, STRING, policy), z, INT),
        promoteToNonNull(testIs(split, z, INT), x));
  }

  @Test
  public void testMergeIsCommutative() {
    ImmutableList<FlowModel> b = branches();
    for (FlowModel m1 : b) {
      for (FlowModel m2 : b) {
        assertThat(FlowModel.merge(m1, m2)).isEqualTo(FlowModel.merge(m2, m1));
      }
    }
  }

  @Test
  public void testMergeIsAssociative() {
    ImmutableList<FlowModel> b = branches();
    FlowModel m1 = b.get(0);
    FlowModel m2 = b.get(1);
    FlowModel m3 = b.get(2);
    assertThat(FlowModel.merge(FlowModel.merge(m1, m2), m3))
        .isEqualTo(FlowModel.merge(m1, FlowModel.merge(m2, m3)));
    FlowModel dead = m2.exit();
    assertThat(FlowModel.merge(FlowModel.merge(m1, dead), m3))
        .isEqualTo(FlowModel.merge(m1, FlowModel.merge(dead, m3)));
  }

  @Test
  public void testJoinIsCommutative() {
    ImmutableList<FlowModel> b = branches();
    for (FlowModel m1 : b) {
      for (FlowModel m2 : b) {
        assertThat(FlowModel.join(m1, m2)).isEqualTo(FlowModel.join(m2, m1));
        assertThat(FlowModel.join(m1, m2.exit())).isEqualTo(FlowModel.join(m2.exit(), m1));
      }
    }
  }

  @Test
  public void testJoinIsAssociativeOverBranches() {
    ImmutableList<FlowModel> b = branches();
    FlowModel m1 = b.get(0);
    FlowModel m2 = b.get(1);
    FlowModel m3 = b.get(2);
    // join closes the split, so nesting goes through merge.
    assertThat(FlowModel.joinAll(ImmutableList.of(m1, m2, m3)))
        .isEqualTo(FlowModel.merge(FlowModel.merge(m1, m2), m3).drop());
    assertThat(FlowModel.joinAll(ImmutableList.of(m1, m2, m3)))
        .isEqualTo(FlowModel.joinAll(ImmutableList.of(m3, m1, m2)));
  }

  @Test
  public void testDropIsJoinWithItself() {
    for (FlowModel m : branches()) {
      assertThat(FlowModel.join(m, m)).isEqualTo(m.drop());
      assertThat(FlowModel.join(m.exit(), m.exit())).isEqualTo(m.exit().drop());
    }
  }

  @Test
  public void testJoinIgnoresUnreachableBranch() {
    FlowModel split = entry.split();
    FlowModel promoted = promoteToNonNull(split, x);
    FlowModel joined = FlowModel.join(promoted, split.exit());
    assertThat(joined.isReachable()).isTrue();
    assertThat(joined.getPromotedType(x)).isEqualTo(INT);
    assertThat(joined.getReachability().getDepth()).isEqualTo(1);
  }

  @Test
  public void testJoinOfTwoReachableBranches() {
    FlowModel split = entry.split();
    FlowModel joined =
        FlowModel.join(promoteToNonNull(split, x), split.assign(y, INT, policy));
    assertThat(joined.getPromotedType(x)).isNull();
    assertThat(joined.isDefinitelyAssigned(y)).isFalse();
    assertThat(joined.isDefinitelyUnassigned(y)).isFalse();
  }

  @Test
  public void testJoinInDeadCodeKeepsPromotions() {
    FlowModel dead = entry.exit();
    FlowModel promoted = promoteToNonNull(dead.split(), x);
    FlowModel joined = FlowModel.join(promoted, dead.split().exit());
    assertThat(joined.isReachable()).isFalse();
    assertThat(joined.getPromotedType(x)).isEqualTo(INT);
  }

  @Test
  public void testJoinDropsVariablesOutOfScope() {
    Var local = Var.untyped("local");
    FlowModel split = entry.split();
    FlowModel joined = FlowModel.join(split.declare(local, INT, true), split);
    assertThat(joined.getVariableModel(local)).isNull();
    assertThat(joined.getVariableModel(x)).isNotNull();
  }

  @Test
  public void testJoinOfDifferentSplitsFails() {
    FlowModel split = entry.split();
    assertThrows(
        IllegalStateException.class, () -> FlowModel.join(split.split(), split));
    assertThrows(IllegalStateException.class, () -> FlowModel.merge(split, split.split()));
  }

  @Test
  public void testExitMakesUnreachable() {
    assertThat(entry.isReachable()).isTrue();
    assertThat(entry.exit().isReachable()).isFalse();
    assertThat(entry.exit().split().isReachable()).isFalse();
    assertThat(entry.exit().getVariableInfo()).isEqualTo(entry.getVariableInfo());
  }

  @Test
  public void testAssignMarksAssigned() {
    FlowModel assigned = entry.assign(y, INT, policy);
    assertThat(assigned.isDefinitelyAssigned(y)).isTrue();
    assertThat(assigned.isDefinitelyUnassigned(y)).isFalse();
  }

  @Test
  public void testConservativeJoin() {
    FlowModel promoted = promoteToNonNull(promoteToNonNull(entry, x), z);
    FlowModel head = promoted.conservativeJoin(ImmutableSet.of(x, y), ImmutableSet.of(z));
    assertThat(head.getPromotedType(x)).isNull();
    assertThat(head.isDefinitelyAssigned(x)).isTrue();
    assertThat(head.isDefinitelyUnassigned(y)).isFalse();
    assertThat(head.isWriteCaptured(z)).isTrue();
    assertThat(head.getPromotedType(z)).isNull();
    assertThat(promoted.conservativeJoin(ImmutableSet.of(), ImmutableSet.of()))
        .isSameInstanceAs(promoted);
  }

  @Test
  public void testRestrictKeepsTryPromotionsUnlessFinallyAssigns() {
    FlowModel afterTry = promoteToNonNull(promoteToNonNull(entry, x), z);
    FlowModel afterFinally = entry.assign(y, STRING, policy);

    FlowModel restricted =
        FlowModel.restrict(afterFinally, afterTry, ImmutableSet.of(y), types);
    assertThat(restricted.getPromotedType(x)).isEqualTo(INT);
    assertThat(restricted.getPromotedType(z)).isEqualTo(NUM);
    assertThat(restricted.isDefinitelyAssigned(y)).isTrue();

    FlowModel finallyAssignsX = entry.assign(x, NULLABLE_INT, policy);
    restricted = FlowModel.restrict(finallyAssignsX, afterTry, ImmutableSet.of(x), types);
    assertThat(restricted.getPromotedType(x)).isNull();
  }

  @Test
  public void testRestrictAddsNarrowerFinallyPromotions() {
    FlowModel afterTry = testIs(entry, z, NUM);
    FlowModel afterFinally = testIs(entry, z, INT);
    FlowModel restricted =
        FlowModel.restrict(afterFinally, afterTry, ImmutableSet.of(), types);
    assertThat(restricted.getVariableModel(z).getPromotedTypes())
        .containsExactly(NUM, INT)
        .inOrder();
  }

  @Test
  public void testRestrictReachability() {
    FlowModel restricted = FlowModel.restrict(entry, entry.exit(), ImmutableSet.of(), types);
    assertThat(restricted.isReachable()).isFalse();
  }

  @Test
  public void testRemove() {
    FlowModel removed = entry.remove(y);
    assertThat(removed.getVariableModel(y)).isNull();
    assertThat(removed.remove(y)).isSameInstanceAs(removed);
    assertThrows(IllegalArgumentException.class, () -> removed.isDefinitelyAssigned(y));
  }

  @Test
  public void testDeclareTwiceFails() {
    assertThrows(IllegalArgumentException.class, () -> entry.declare(x, INT, true));
  }
}
