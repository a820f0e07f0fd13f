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

import com.nullflow.syntax.IR;
import com.nullflow.syntax.Node;
import com.nullflow.syntax.Var;
import com.nullflow.syntax.types.Type;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests for {@link AssignedVariables}. */
@RunWith(JUnit4.class)
public final class AssignedVariablesTest {

  private static final Type INT = Type.interfaceType("int");

  private final Var x = Var.declared("x", INT);
  private final Var y = Var.declared("y", INT);

  @Test
  public void testAssignedIn() {
    Node assignX = IR.exprResult(IR.assign(x, IR.number(1)));
    Node loop = IR.whileNode(IR.trueNode(), IR.block(assignX));
    Node readY = IR.exprResult(IR.name(y));
    Node fn = IR.function(null, IR.paramList(), IR.block(IR.var(x), IR.var(y), loop, readY));

    AssignedVariables assigned = AssignedVariables.compute(fn);

    assertThat(assigned.assignedIn(loop)).containsExactly(x);
    assertThat(assigned.isAssignedIn(loop, x)).isTrue();
    assertThat(assigned.isAssignedIn(loop, y)).isFalse();
    assertThat(assigned.assignedIn(readY)).isEmpty();
    assertThat(assigned.assignedIn(fn)).containsExactly(x);
  }

  @Test
  public void testInitializerIsNotAWrite() {
    Node decl = IR.var(x, IR.number(1));
    Node fn = IR.function(null, IR.paramList(), IR.block(decl));

    AssignedVariables assigned = AssignedVariables.compute(fn);

    assertThat(assigned.assignedIn(decl)).isEmpty();
  }

  @Test
  public void testUnreachableWritesCount() {
    Node write = IR.exprResult(IR.assign(x, IR.number(1)));
    Node body = IR.block(IR.var(x), IR.returnNode(), write);
    Node fn = IR.function(null, IR.paramList(), body);

    assertThat(AssignedVariables.compute(fn).assignedIn(body)).containsExactly(x);
  }

  @Test
  public void testForInNameTargetIsWritten() {
    Node loop = IR.forIn(IR.name(x), IR.name("items"), IR.block());
    Node fn = IR.function(null, IR.paramList(), IR.block(IR.var(x), loop));

    assertThat(AssignedVariables.compute(fn).assignedIn(loop)).containsExactly(x);
  }

  @Test
  public void testForInDeclarationIsNotAWrite() {
    Node loop = IR.forIn(IR.var(x), IR.name("items"), IR.block());
    Node fn = IR.function(null, IR.paramList(), IR.block(loop));

    assertThat(AssignedVariables.compute(fn).assignedIn(loop)).isEmpty();
  }

  @Test
  public void testCapturedIn() {
    Var local = Var.declared("local", INT);
    Node closure =
        IR.function(
            null,
            IR.paramList(),
            IR.block(
                IR.var(local),
                IR.exprResult(IR.assign(local, IR.number(1))),
                IR.exprResult(IR.assign(x, IR.number(2)))));
    Node call = IR.exprResult(IR.call(IR.name("run"), closure));
    Node other = IR.exprResult(IR.assign(y, IR.number(3)));
    Node fn =
        IR.function(null, IR.paramList(), IR.block(IR.var(x), IR.var(y), call, other));

    AssignedVariables assigned = AssignedVariables.compute(fn);

    assertThat(assigned.capturedIn(closure)).containsExactly(x);
    assertThat(assigned.capturedIn(call)).containsExactly(x);
    assertThat(assigned.capturedIn(other)).isEmpty();
    assertThat(assigned.assignedIn(closure)).containsExactly(local, x);
    assertThat(assigned.assignedIn(fn)).containsExactly(local, x, y);
  }

  @Test
  public void testParameterWrittenByItsOwnFunctionIsNotCaptured() {
    Var p = Var.declared("p", INT);
    Node inner =
        IR.function(
            null, IR.paramList(p), IR.block(IR.exprResult(IR.assign(p, IR.number(1)))));
    Node fn = IR.function(null, IR.paramList(), IR.block(IR.exprResult(inner)));

    assertThat(AssignedVariables.compute(fn).capturedIn(inner)).isEmpty();
  }

  @Test
  public void testCaptureThroughNestedClosures() {
    Node innermost =
        IR.function(null, IR.paramList(), IR.block(IR.exprResult(IR.assign(x, IR.number(1)))));
    Node middle = IR.function(null, IR.paramList(), IR.block(IR.exprResult(innermost)));
    Node fn = IR.function(null, IR.paramList(), IR.block(IR.var(x), IR.exprResult(middle)));

    AssignedVariables assigned = AssignedVariables.compute(fn);

    assertThat(assigned.capturedIn(innermost)).containsExactly(x);
    assertThat(assigned.capturedIn(middle)).containsExactly(x);
  }

  @Test
  public void testNodeOutsideTheTreeIsRejected() {
    Node fn = IR.function(null, IR.paramList(), IR.block());
    AssignedVariables assigned = AssignedVariables.compute(fn);

    assertThrows(IllegalArgumentException.class, () -> assigned.assignedIn(IR.empty()));
    assertThrows(IllegalArgumentException.class, () -> assigned.capturedIn(IR.empty()));
  }
}
