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

import com.nullflow.syntax.Node;
import com.nullflow.syntax.Token;
import com.nullflow.syntax.types.Type;
import org.jspecify.annotations.Nullable;

/**
 * A point where a function produces a result: a {@code return} or, in a generator, a
 * {@code yield}. Generators keep running after a yield.
 *
 * @param node The RETURN or YIELD statement.
 * @param function The FUNCTION the statement belongs to.
 * @param valueType The static type of the produced value, or null for a bare {@code return}.
 * @param reachable Whether the statement is reachable.
 */
public record ExitPoint(Node node, Node function, @Nullable Type valueType, boolean reachable) {

  public boolean isYield() {
    return node.getToken() == Token.YIELD;
  }
}
