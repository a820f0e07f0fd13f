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

import static com.google.common.base.Preconditions.checkState;

import com.nullflow.syntax.types.Type;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * An AST construction helper class. Front ends (and tests) build function bodies with it; the
 * shape checks here are the contract the flow analysis relies on.
 */
public class IR {

  private IR() {}

  public static Node function(@Nullable Type returnType, Node params, Node body) {
    checkState(params.getToken() == Token.PARAM_LIST);
    checkState(body.isBlock());
    Node fn = new Node(Token.FUNCTION, params, body);
    fn.setReturnType(returnType);
    return fn;
  }

  /** A function with an expression body, {@code (params) => expr}. */
  public static Node arrowFunction(@Nullable Type returnType, Node params, Node expr) {
    checkState(params.getToken() == Token.PARAM_LIST);
    checkState(mayBeExpression(expr), expr);
    Node fn = new Node(Token.FUNCTION, params, expr);
    fn.setReturnType(returnType);
    return fn;
  }

  public static Node paramList(Var... params) {
    Node paramList = new Node(Token.PARAM_LIST);
    for (Var param : params) {
      paramList.addChildToBack(declarationName(param));
    }
    return paramList;
  }

  public static Node block() {
    return new Node(Token.BLOCK);
  }

  public static Node block(Node... stmts) {
    Node block = block();
    for (Node stmt : stmts) {
      checkState(mayBeStatement(stmt), "Block node cannot contain %s", stmt.getToken());
      block.addChildToBack(stmt);
    }
    return block;
  }

  public static Node block(List<Node> stmts) {
    Node block = block();
    for (Node stmt : stmts) {
      checkState(mayBeStatement(stmt), "Block node cannot contain %s", stmt.getToken());
      block.addChildToBack(stmt);
    }
    return block;
  }

  public static Node empty() {
    return new Node(Token.EMPTY);
  }

  /** Declares {@code var} without an initializer. */
  public static Node var(Var var) {
    return new Node(Token.VAR, declarationName(var));
  }

  public static Node var(Var var, Node value) {
    checkState(mayBeExpression(value), value);
    return new Node(Token.VAR, declarationName(var), value);
  }

  private static Node declarationName(Var var) {
    Node nameNode = Node.newString(Token.NAME, var.getName());
    nameNode.setVar(var);
    var.setNameNode(nameNode);
    return nameNode;
  }

  public static Node exprResult(Node expr) {
    checkState(mayBeExpression(expr), expr);
    return new Node(Token.EXPR_RESULT, expr);
  }

  public static Node returnNode() {
    return new Node(Token.RETURN);
  }

  public static Node returnNode(Node expr) {
    checkState(mayBeExpression(expr));
    return new Node(Token.RETURN, expr);
  }

  public static Node yield(Node expr) {
    checkState(mayBeExpression(expr));
    return new Node(Token.YIELD, expr);
  }

  public static Node ifNode(Node cond, Node then) {
    checkState(mayBeExpression(cond));
    checkState(then.isBlock());
    return new Node(Token.IF, cond, then);
  }

  public static Node ifNode(Node cond, Node then, Node elseNode) {
    checkState(mayBeExpression(cond));
    checkState(then.isBlock());
    checkState(elseNode.isBlock());
    return new Node(Token.IF, cond, then, elseNode);
  }

  public static Node whileNode(Node cond, Node body) {
    checkState(body.isBlock());
    checkState(mayBeExpression(cond));
    return new Node(Token.WHILE, cond, body);
  }

  public static Node doNode(Node body, Node cond) {
    checkState(body.isBlock());
    checkState(mayBeExpression(cond));
    return new Node(Token.DO, body, cond);
  }

  /** A C style for loop; missing parts are {@link #empty()}. */
  public static Node forNode(Node init, Node cond, Node incr, Node body) {
    checkState(init.isVar() || mayBeExpressionOrEmpty(init));
    checkState(mayBeExpressionOrEmpty(cond));
    checkState(mayBeExpressionOrEmpty(incr));
    checkState(body.isBlock());
    return new Node(Token.FOR, init, cond, incr, body);
  }

  /** {@code for (target in iterable) body}; the target is a VAR or a NAME. */
  public static Node forIn(Node target, Node iterable, Node body) {
    checkState(target.isVar() || target.isName());
    checkState(!target.isVar() || target.getChildCount() == 1, "loop variable has initializer");
    checkState(mayBeExpression(iterable));
    checkState(body.isBlock());
    return new Node(Token.FOR_IN, target, iterable, body);
  }

  public static Node switchNode(Node cond, Node... cases) {
    checkState(mayBeExpression(cond));
    Node switchNode = new Node(Token.SWITCH, cond);
    for (Node caseNode : cases) {
      checkState(
          caseNode.getToken() == Token.CASE || caseNode.getToken() == Token.DEFAULT_CASE);
      switchNode.addChildToBack(caseNode);
    }
    return switchNode;
  }

  public static Node caseNode(Node expr, Node body) {
    checkState(mayBeExpression(expr));
    checkState(body.isBlock());
    return new Node(Token.CASE, expr, body);
  }

  public static Node defaultCase(Node body) {
    checkState(body.isBlock());
    return new Node(Token.DEFAULT_CASE, body);
  }

  public static Node label(String name, Node stmt) {
    checkState(mayBeStatement(stmt));
    return new Node(Token.LABEL, labelName(name), stmt);
  }

  private static Node labelName(String name) {
    checkState(!name.isEmpty());
    return Node.newString(Token.LABEL_NAME, name);
  }

  public static Node breakNode() {
    return new Node(Token.BREAK);
  }

  public static Node breakNode(String label) {
    return new Node(Token.BREAK, labelName(label));
  }

  public static Node continueNode() {
    return new Node(Token.CONTINUE);
  }

  public static Node continueNode(String label) {
    return new Node(Token.CONTINUE, labelName(label));
  }

  public static Node tryCatch(Node tryBody, Node catchNode) {
    checkState(tryBody.isBlock());
    checkState(catchNode.isCatch());
    return new Node(Token.TRY, tryBody, new Node(Token.BLOCK, catchNode));
  }

  public static Node tryFinally(Node tryBody, Node finallyBody) {
    checkState(tryBody.isBlock());
    checkState(finallyBody.isBlock());
    return new Node(Token.TRY, tryBody, block(), finallyBody);
  }

  public static Node tryCatchFinally(Node tryBody, Node catchNode, Node finallyBody) {
    checkState(finallyBody.isBlock());
    Node tryNode = tryCatch(tryBody, catchNode);
    tryNode.addChildToBack(finallyBody);
    return tryNode;
  }

  /** A catch clause; {@code exception} is null for {@code on T catch}-less clauses. */
  public static Node catchNode(@Nullable Var exception, Node body) {
    checkState(body.isBlock());
    Node binding = exception != null ? declarationName(exception) : empty();
    return new Node(Token.CATCH, binding, body);
  }

  public static Node name(Var var) {
    Node name = Node.newString(Token.NAME, var.getName());
    name.setVar(var);
    return name;
  }

  /** A reference to something that is not a tracked local, such as a top level function. */
  public static Node name(String name) {
    return Node.newString(Token.NAME, name);
  }

  public static Node assign(Var target, Node expr) {
    checkState(mayBeExpression(expr));
    return new Node(Token.ASSIGN, name(target), expr);
  }

  public static Node nullNode() {
    return new Node(Token.NULL);
  }

  public static Node trueNode() {
    return new Node(Token.TRUE);
  }

  public static Node falseNode() {
    return new Node(Token.FALSE);
  }

  public static Node number(double d) {
    return Node.newNumber(d);
  }

  public static Node string(String s) {
    return Node.newString(Token.STRINGLIT, s);
  }

  public static Node thisNode() {
    return new Node(Token.THIS);
  }

  public static Node not(Node expr) {
    return unaryOp(Token.NOT, expr);
  }

  public static Node and(Node expr1, Node expr2) {
    return binaryOp(Token.AND, expr1, expr2);
  }

  public static Node or(Node expr1, Node expr2) {
    return binaryOp(Token.OR, expr1, expr2);
  }

  public static Node coalesce(Node expr1, Node expr2) {
    return binaryOp(Token.COALESCE, expr1, expr2);
  }

  public static Node hook(Node cond, Node trueval, Node falseval) {
    checkState(mayBeExpression(cond));
    checkState(mayBeExpression(trueval));
    checkState(mayBeExpression(falseval));
    return new Node(Token.HOOK, cond, trueval, falseval);
  }

  public static Node eq(Node expr1, Node expr2) {
    return binaryOp(Token.EQ, expr1, expr2);
  }

  public static Node ne(Node expr1, Node expr2) {
    return binaryOp(Token.NE, expr1, expr2);
  }

  public static Node is(Node expr, Type type) {
    return typeTest(Token.IS, expr, type);
  }

  public static Node isNot(Node expr, Type type) {
    return typeTest(Token.IS_NOT, expr, type);
  }

  public static Node as(Node expr, Type type) {
    return typeTest(Token.AS, expr, type);
  }

  private static Node typeTest(Token token, Node expr, Type type) {
    checkState(mayBeExpression(expr));
    Node n = new Node(token, expr);
    n.setTypeOperand(type);
    return n;
  }

  public static Node nonNull(Node expr) {
    return unaryOp(Token.NON_NULL, expr);
  }

  public static Node call(Node target, Node... args) {
    checkState(mayBeExpression(target));
    Node call = new Node(Token.CALL, target);
    for (Node arg : args) {
      checkState(mayBeExpression(arg), arg);
      call.addChildToBack(arg);
    }
    return call;
  }

  public static Node throwNode(Node expr) {
    return unaryOp(Token.THROW, expr);
  }

  public static Node await(Node expr) {
    return unaryOp(Token.AWAIT, expr);
  }

  private static Node unaryOp(Token token, Node expr) {
    checkState(mayBeExpression(expr), expr);
    return new Node(token, expr);
  }

  private static Node binaryOp(Token token, Node expr1, Node expr2) {
    checkState(mayBeExpression(expr1), expr1);
    checkState(mayBeExpression(expr2), expr2);
    return new Node(token, expr1, expr2);
  }

  private static boolean mayBeExpressionOrEmpty(Node n) {
    return n.isEmpty() || mayBeExpression(n);
  }

  /** Whether the node may be used as a statement; FUNCTION doubles as a local declaration. */
  public static boolean mayBeStatement(Node n) {
    return n.isStatement() || n.isFunction();
  }

  public static boolean mayBeExpression(Node n) {
    switch (n.getToken()) {
      case FUNCTION:
      case NAME:
      case NULL:
      case TRUE:
      case FALSE:
      case NUMBER:
      case STRINGLIT:
      case THIS:
      case ASSIGN:
      case NOT:
      case AND:
      case OR:
      case COALESCE:
      case HOOK:
      case EQ:
      case NE:
      case IS:
      case IS_NOT:
      case AS:
      case NON_NULL:
      case CALL:
      case THROW:
      case AWAIT:
        return true;
      default:
        return false;
    }
  }
}
