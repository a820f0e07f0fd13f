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

import com.nullflow.syntax.IR;
import com.nullflow.syntax.Node;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests for {@link CheckUnreachableCode}. */
@RunWith(JUnit4.class)
public final class CheckUnreachableCodeTest extends FlowTestCase {

  private void assertReportedAt(Node... nodes) {
    assertThat(reportedKeys()).hasSize(nodes.length);
    for (int i = 0; i < nodes.length; i++) {
      assertThat(reported.get(i).type()).isEqualTo(CheckUnreachableCode.UNREACHABLE_CODE);
      assertThat(reported.get(i).node()).isSameInstanceAs(nodes[i]);
    }
  }

  @Test
  public void testAfterReturn() {
    Node dead = probe();
    analyzeBody(IR.returnNode(), dead);
    assertReportedAt(dead);
  }

  @Test
  public void testOnlyFirstOfARunIsReported() {
    Node first = probe();
    analyzeBody(IR.returnNode(), first, probe(), probe());
    assertReportedAt(first);
  }

  @Test
  public void testChildrenOfReportedStatementAreSkipped() {
    Node deadIf = IR.ifNode(cond(), IR.block(probe()), IR.block(probe()));
    analyzeBody(IR.returnNode(), deadIf);
    assertReportedAt(deadIf);
  }

  @Test
  public void testSpuriousStatements() {
    analyzeBody(IR.returnNode(), IR.empty());
    assertNoFindings();

    analyzeBody(IR.returnNode(), IR.block());
    assertNoFindings();
  }

  @Test
  public void testBreakAfterReturnInSwitch() {
    Node body =
        IR.switchNode(
            IR.name("v"),
            IR.caseNode(IR.number(1), IR.block(IR.returnNode(), IR.breakNode())),
            IR.defaultCase(IR.block(probe())));
    analyzeBody(body);
    assertNoFindings();
  }

  @Test
  public void testSpuriousStatementDoesNotHideTheNext() {
    Node dead = probe();
    analyzeBody(IR.returnNode(), IR.empty(), dead);
    assertReportedAt(dead);
  }

  @Test
  public void testSeparateRuns() {
    Node firstDead = probe();
    Node secondDead = probe();
    Node loop = IR.whileNode(cond(), IR.block(IR.continueNode(), firstDead));
    analyzeBody(loop, probe(), IR.returnNode(), secondDead);
    assertReportedAt(firstDead, secondDead);
  }

  @Test
  public void testDeadBranch() {
    Node dead = IR.block(probe());
    analyzeBody(IR.ifNode(IR.trueNode(), IR.block(probe()), dead));
    assertReportedAt(dead);
  }

  @Test
  public void testAfterThrow() {
    Node dead = probe();
    analyzeBody(IR.exprResult(IR.throwNode(IR.string("boom"))), dead);
    assertReportedAt(dead);
  }

  @Test
  public void testAfterInfiniteLoop() {
    Node dead = probe();
    analyzeBody(IR.doNode(IR.block(probe()), IR.trueNode()), dead);
    assertReportedAt(dead);
  }

  @Test
  public void testInsideClosure() {
    Node dead = probe();
    Node closure = IR.function(null, IR.paramList(), IR.block(IR.returnNode(), dead));
    analyzeBody(IR.exprResult(IR.call(IR.name("run"), closure)), probe());
    assertReportedAt(dead);
  }

  @Test
  public void testDisabled() {
    options.setCheckUnreachableCode(false);
    analyzeBody(IR.returnNode(), probe());
    assertNoFindings();
  }
}
