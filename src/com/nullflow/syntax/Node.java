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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import com.nullflow.syntax.types.Type;
import java.util.ArrayList;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * This class implements the root of the intermediate representation.
 *
 * <p>Nodes compare by identity; the flow analysis keys its per-node results on them. Properties
 * that only make sense for some kinds of nodes (the variable of a NAME, the tested type of an IS,
 * the return type of a FUNCTION) are checked against the token when read.
 */
public class Node {

  private final Token token;
  private final List<Node> children = new ArrayList<>();
  private @Nullable Node parent;

  private @Nullable String string;
  private double number;
  private @Nullable Var var;
  private @Nullable Type typeOperand;
  private @Nullable Type staticType;
  private @Nullable Type returnType;
  private FunctionKind functionKind = FunctionKind.SYNC;
  private boolean exhaustive;

  private int lineno = -1;
  private int charno = -1;

  public Node(Token token) {
    this.token = checkNotNull(token);
  }

  public Node(Token token, Node... children) {
    this(token);
    for (Node child : children) {
      addChildToBack(child);
    }
  }

  static Node newString(Token token, String str) {
    Node n = new Node(token);
    n.string = checkNotNull(str);
    return n;
  }

  static Node newNumber(double number) {
    Node n = new Node(Token.NUMBER);
    n.number = number;
    return n;
  }

  public Token getToken() {
    return token;
  }

  public @Nullable Node getParent() {
    return parent;
  }

  public ImmutableList<Node> children() {
    return ImmutableList.copyOf(children);
  }

  public int getChildCount() {
    return children.size();
  }

  public boolean hasChildren() {
    return !children.isEmpty();
  }

  public Node getChildAtIndex(int i) {
    return children.get(i);
  }

  public @Nullable Node getFirstChild() {
    return children.isEmpty() ? null : children.get(0);
  }

  public @Nullable Node getSecondChild() {
    return children.size() < 2 ? null : children.get(1);
  }

  public @Nullable Node getLastChild() {
    return children.isEmpty() ? null : children.get(children.size() - 1);
  }

  /** Returns the next sibling, or null if this is the last child or has no parent. */
  public @Nullable Node getNext() {
    if (parent == null) {
      return null;
    }
    int index = indexOfIdentity(parent.children, this);
    return index + 1 < parent.children.size() ? parent.children.get(index + 1) : null;
  }

  @CanIgnoreReturnValue
  public Node addChildToBack(Node child) {
    checkArgument(child.parent == null, "new child has existing parent: %s", child);
    child.parent = this;
    children.add(child);
    return this;
  }

  private static int indexOfIdentity(List<Node> nodes, Node node) {
    for (int i = 0; i < nodes.size(); i++) {
      if (nodes.get(i) == node) {
        return i;
      }
    }
    throw new IllegalStateException("not a child of its parent: " + node);
  }

  /** The identifier of a NAME, the value of a STRINGLIT or the name of a label. */
  public String getString() {
    checkState(string != null, "%s has no string value", token);
    return string;
  }

  public double getDouble() {
    checkState(token == Token.NUMBER, "%s is not a number", token);
    return number;
  }

  /** The local variable a NAME node refers to, or null for names the analysis does not track. */
  public @Nullable Var getVar() {
    checkState(token == Token.NAME, "%s has no variable", token);
    return var;
  }

  void setVar(Var var) {
    checkState(token == Token.NAME);
    this.var = var;
  }

  /** The type on the right hand side of {@code is}, {@code is!} and {@code as}. */
  public Type getTypeOperand() {
    checkState(typeOperand != null, "%s has no type operand", token);
    return typeOperand;
  }

  void setTypeOperand(Type type) {
    this.typeOperand = checkNotNull(type);
  }

  /**
   * The static type recorded by the type inferencer for this expression, or null if it has not
   * been recorded.
   */
  public final @Nullable Type getStaticType() {
    return staticType;
  }

  @CanIgnoreReturnValue
  public final Node setStaticType(@Nullable Type type) {
    this.staticType = type;
    return this;
  }

  /** The declared return type of a FUNCTION; null means the return type is {@code dynamic}. */
  public @Nullable Type getReturnType() {
    checkState(isFunction(), "%s is not a function", token);
    return returnType;
  }

  void setReturnType(@Nullable Type returnType) {
    this.returnType = returnType;
  }

  public FunctionKind getFunctionKind() {
    checkState(isFunction(), "%s is not a function", token);
    return functionKind;
  }

  @CanIgnoreReturnValue
  public Node setFunctionKind(FunctionKind kind) {
    checkState(isFunction(), "%s is not a function", token);
    this.functionKind = checkNotNull(kind);
    return this;
  }

  /**
   * Whether the cases of a SWITCH cover every value of the scrutinee. Decided by the
   * exhaustiveness checker and recorded here before the flow analysis runs.
   */
  public boolean isExhaustive() {
    checkState(token == Token.SWITCH, "%s is not a switch", token);
    return exhaustive;
  }

  @CanIgnoreReturnValue
  public Node setExhaustive(boolean exhaustive) {
    checkState(token == Token.SWITCH, "%s is not a switch", token);
    this.exhaustive = exhaustive;
    return this;
  }

  public int getLineno() {
    return lineno;
  }

  public int getCharno() {
    return charno;
  }

  @CanIgnoreReturnValue
  public Node setLinenoCharno(int lineno, int charno) {
    this.lineno = lineno;
    this.charno = charno;
    return this;
  }

  public boolean isFunction() {
    return token == Token.FUNCTION;
  }

  public boolean isName() {
    return token == Token.NAME;
  }

  public boolean isBlock() {
    return token == Token.BLOCK;
  }

  public boolean isEmpty() {
    return token == Token.EMPTY;
  }

  public boolean isNull() {
    return token == Token.NULL;
  }

  public boolean isVar() {
    return token == Token.VAR;
  }

  public boolean isLabel() {
    return token == Token.LABEL;
  }

  public boolean isBreak() {
    return token == Token.BREAK;
  }

  public boolean isCatch() {
    return token == Token.CATCH;
  }

  public boolean isStatement() {
    return token.isStatement();
  }

  /** The variable if this is a NAME that refers to a tracked local, otherwise null. */
  public @Nullable Var getVarIfLocal() {
    return token == Token.NAME ? var : null;
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder(token.name());
    if (string != null) {
      sb.append(' ').append(string);
    } else if (token == Token.NUMBER) {
      sb.append(' ').append(number);
    }
    if (typeOperand != null) {
      sb.append(' ').append(typeOperand);
    }
    if (lineno != -1) {
      sb.append(" [").append(lineno).append(':').append(charno).append(']');
    }
    return sb.toString();
  }
}
