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

import static com.google.common.base.Preconditions.checkState;

import com.google.errorprone.annotations.Immutable;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * The reachability stack of a {@link FlowModel}: one boolean per open control flow split, the
 * innermost split on top and function entry at the bottom. A program point is reachable when
 * every element is true.
 *
 * <p>Stacks are persistent linked lists, so pushing and popping share the tail.
 */
@Immutable
public final class Reachability {

  private static final Reachability INITIAL = new Reachability(true, null);

  private final boolean top;
  private final @Nullable Reachability parent;
  private final int depth;
  private final boolean overallReachable;

  private Reachability(boolean top, @Nullable Reachability parent) {
    this.top = top;
    this.parent = parent;
    this.depth = parent == null ? 1 : parent.depth + 1;
    this.overallReachable = top && (parent == null || parent.overallReachable);
  }

  /** The stack at function entry: a single {@code true}. */
  public static Reachability initial() {
    return INITIAL;
  }

  /** Whether the point is reachable from the innermost open split. */
  public boolean getTop() {
    return top;
  }

  public boolean isReachable() {
    return overallReachable;
  }

  public int getDepth() {
    return depth;
  }

  /** The stack below the top. */
  public Reachability pop() {
    checkState(parent != null, "cannot pop the function entry");
    return parent;
  }

  /** The stack below the top, or null at function entry level. */
  @Nullable Reachability tail() {
    return parent;
  }

  Reachability split() {
    return new Reachability(true, this);
  }

  Reachability setTop(boolean newTop) {
    return newTop == top ? this : new Reachability(newTop, parent);
  }

  /** Closes the innermost split, folding its reachability into the enclosing one. */
  Reachability drop() {
    Reachability tail = pop();
    return tail.setTop(tail.top && top);
  }

  /** Pushes {@code newTop} onto {@code tail}. */
  static Reachability push(@Nullable Reachability tail, boolean newTop) {
    return new Reachability(newTop, tail);
  }

  @Override
  public boolean equals(@Nullable Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Reachability)) {
      return false;
    }
    Reachability that = (Reachability) o;
    return top == that.top && depth == that.depth && Objects.equals(parent, that.parent);
  }

  @Override
  public int hashCode() {
    return Objects.hash(top, depth, parent);
  }

  /** Bottom first, e.g. {@code [true, false]}. */
  @Override
  public String toString() {
    Deque<Boolean> elements = new ArrayDeque<>();
    for (Reachability r = this; r != null; r = r.parent) {
      elements.addFirst(r.top);
    }
    return elements.toString();
  }
}
