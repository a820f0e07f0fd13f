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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.base.Function;
import java.util.List;

/** Joins the values that reach a control flow merge point, one per incoming edge. */
interface JoinOp<L> extends Function<List<L>, L> {

  /**
   * Builds an n-ary join from a binary one, pairwise in a balanced tree. The binary join must be
   * commutative and associative.
   */
  abstract static class BinaryJoinOp<L> implements JoinOp<L> {
    @Override
    public final L apply(List<L> values) {
      checkArgument(!values.isEmpty(), "nothing to join");
      switch (values.size()) {
        case 1:
          return values.get(0);
        case 2:
          return join(values.get(0), values.get(1));
        default:
          int half = values.size() / 2;
          return join(apply(values.subList(0, half)), apply(values.subList(half, values.size())));
      }
    }

    /** The join of the values on two incoming edges. */
    abstract L join(L first, L second);
  }
}
