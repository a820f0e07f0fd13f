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
import com.nullflow.syntax.types.Type;
import org.jspecify.annotations.Nullable;

/**
 * Supplies the static types of expressions. The flow analysis calls it for each expression after
 * the expression's operands have been analyzed, so an implementation can look at the flow models
 * computed so far, for example to type a variable read with its promoted type.
 */
@FunctionalInterface
public interface ExpressionTyper {

  /**
   * Returns the static type of {@code expression}, or null to let the analysis use its own
   * default for the kind of expression.
   */
  @Nullable Type getStaticType(Node expression, FlowResult results);

  /** Uses the types recorded on the nodes with {@link Node#setStaticType}. */
  ExpressionTyper FROM_ANNOTATIONS = (expression, results) -> expression.getStaticType();
}
