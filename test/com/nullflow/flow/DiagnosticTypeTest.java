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

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests for {@link DiagnosticType}. */
@RunWith(JUnit4.class)
public final class DiagnosticTypeTest {

  @Test
  public void testFactoriesSetDefaultLevel() {
    assertThat(DiagnosticType.error("TEST_E", "e").level).isEqualTo(CheckLevel.ERROR);
    assertThat(DiagnosticType.warning("TEST_W", "w").level).isEqualTo(CheckLevel.WARNING);
    assertThat(DiagnosticType.make("TEST_OFF", CheckLevel.OFF, "o").level)
        .isEqualTo(CheckLevel.OFF);
    assertThat(CheckLevel.OFF.isOn()).isFalse();
    assertThat(CheckLevel.WARNING.isOn()).isTrue();
  }

  @Test
  public void testIdentifiedByKey() {
    DiagnosticType first = DiagnosticType.error("TEST_KEY", "first");
    DiagnosticType second = DiagnosticType.warning("TEST_KEY", "second");

    assertThat(first).isEqualTo(second);
    assertThat(first.hashCode()).isEqualTo(second.hashCode());
    assertThat(first).isNotEqualTo(DiagnosticType.error("TEST_OTHER", "first"));
    assertThat(first.compareTo(DiagnosticType.error("TEST_LATER", "x"))).isLessThan(0);
  }

  @Test
  public void testFormat() {
    DiagnosticType type = DiagnosticType.error("TEST_FORMAT", "Variable {0} in {1}.");

    assertThat(type.format("x", "f")).isEqualTo("Variable x in f.");
    assertThat(type.toString()).isEqualTo("TEST_FORMAT: Variable {0} in {1}.");
  }
}
