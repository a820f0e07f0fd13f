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

package com.nullflow.syntax;

/**
 * How a function body produces its result. Generators produce their values through
 * {@link Token#YIELD} and never need an explicit return.
 */
public enum FunctionKind {
  SYNC,
  ASYNC,
  SYNC_STAR,
  ASYNC_STAR;

  public boolean isGenerator() {
    return this == SYNC_STAR || this == ASYNC_STAR;
  }

  public boolean isAsync() {
    return this == ASYNC || this == ASYNC_STAR;
  }
}
