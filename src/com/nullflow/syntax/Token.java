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
 * Node kinds of the function bodies consumed by the flow analysis.
 */
public enum Token {
  // Declarations and structure.
  FUNCTION,
  PARAM_LIST,
  VAR,
  LABEL,
  LABEL_NAME,

  // Statements.
  BLOCK,
  EMPTY,
  EXPR_RESULT,
  IF,
  WHILE,
  DO,
  FOR,
  FOR_IN,
  BREAK,
  CONTINUE,
  SWITCH,
  CASE,
  DEFAULT_CASE,
  RETURN,
  YIELD,
  TRY,
  CATCH,

  // Expressions.
  NAME,
  NULL,
  TRUE,
  FALSE,
  NUMBER,
  STRINGLIT,
  THIS,
  ASSIGN, // simple assignment to a local variable (=)
  NOT,
  AND,
  OR,
  COALESCE, // if-null (??)
  HOOK, // conditional (?:)
  EQ,
  NE,
  IS,
  IS_NOT, // negated type test (is!)
  AS,
  NON_NULL, // null assertion (e!)
  CALL,
  THROW,
  AWAIT;

  /** Whether nodes of this kind appear in statement position. */
  public boolean isStatement() {
    switch (this) {
      case BLOCK:
      case EMPTY:
      case EXPR_RESULT:
      case VAR:
      case IF:
      case WHILE:
      case DO:
      case FOR:
      case FOR_IN:
      case BREAK:
      case CONTINUE:
      case LABEL:
      case SWITCH:
      case RETURN:
      case YIELD:
      case TRY:
        return true;
      default:
        return false;
    }
  }

  /** Whether nodes of this kind are loops, i.e. valid targets of a continue. */
  public boolean isLoop() {
    return this == WHILE || this == DO || this == FOR || this == FOR_IN;
  }
}
