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
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Sets;
import com.nullflow.syntax.Node;
import com.nullflow.syntax.Token;
import com.nullflow.syntax.Var;
import com.nullflow.syntax.types.Type;
import com.nullflow.syntax.types.TypeOperations;
import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.jspecify.annotations.Nullable;

/**
 * Computes the flow models of every statement and expression of one function body, closures
 * included, by recursive descent. Each {@code traverse} method gets the model before its node and
 * returns the model (or, for expressions, the {@link ExpressionInfo}) after it.
 *
 * <p>A construct that branches opens a split for each branch and closes it when the branches
 * join again. Jumps are collected per target and joined in when the target completes. Loops,
 * catch and finally blocks start from a conservative model that forgets what the region may
 * invalidate, so no fixed point iteration is needed.
 *
 * <p>One instance analyzes one function once.
 */
final class FlowAnalysis {

  static final DiagnosticType POSSIBLY_UNASSIGNED =
      DiagnosticType.error(
          "NULLFLOW_POSSIBLY_UNASSIGNED",
          "Variable {0} must be assigned before it can be used.");

  static final DiagnosticType FINAL_POSSIBLY_ASSIGNED =
      DiagnosticType.error(
          "NULLFLOW_FINAL_POSSIBLY_ASSIGNED",
          "Final variable {0} might already have been assigned.");

  private static final Type BOOL = Type.interfaceType("bool");
  private static final Type INT = Type.interfaceType("int");
  private static final Type DOUBLE = Type.interfaceType("double");
  private static final Type STRING = Type.interfaceType("String");
  private static final Type FUNCTION = Type.interfaceType("Function");

  private final Node root;
  private final TypeOperations types;
  private final PromotionPolicy policy;
  private final ExpressionTyper typer;
  private final AssignedVariables assignedVariables;
  private final FlowResult result;

  // Models at the jumps to each pending target, as recorded.
  private final Map<Node, List<FlowModel>> pendingBreaks = new IdentityHashMap<>();
  private final Map<Node, List<FlowModel>> pendingContinues = new IdentityHashMap<>();

  private @Nullable Node currentFunction;
  private boolean analyzed = false;

  FlowAnalysis(
      Node root,
      PromotionPolicy policy,
      ExpressionTyper typer,
      AssignedVariables assignedVariables) {
    checkArgument(root.isFunction(), "not a function: %s", root);
    this.root = root;
    this.policy = checkNotNull(policy);
    this.types = policy.getTypes();
    this.typer = checkNotNull(typer);
    this.assignedVariables = checkNotNull(assignedVariables);
    this.result = new FlowResult(root);
  }

  FlowResult analyze() {
    checkState(!analyzed, "FlowAnalysis instances are single use");
    analyzed = true;
    analyzeFunctionBody(root, FlowModel.initial());
    return result;
  }

  /** Declares the parameters, then analyzes the body of {@code function}. */
  private void analyzeFunctionBody(Node function, FlowModel entry) {
    Node enclosingFunction = currentFunction;
    currentFunction = function;

    Node params = function.getFirstChild();
    checkState(params.getToken() == Token.PARAM_LIST, params);
    FlowModel model = entry;
    for (Node param : params.children()) {
      Var var = checkNotNull(param.getVar(), "untracked parameter %s", param);
      model = model.declare(var, declaredTypeOf(var), true);
    }

    Node body = function.getLastChild();
    FlowModel exit;
    if (body.isBlock()) {
      exit = analyzeStatement(body, model);
    } else {
      // An expression body behaves like { return body; }.
      ExpressionInfo info = analyzeExpression(body, model);
      recordExitPoint(body, result.getStaticType(body), model);
      exit = info.getAfter().exit();
    }
    result.recordFunctionExit(function, exit);
    currentFunction = enclosingFunction;
  }

  private FlowModel analyzeStatement(Node n, FlowModel before) {
    if (n.isFunction()) {
      // A local function declaration.
      return analyzeExpression(n, before).getAfter();
    }
    result.recordBefore(n, before);
    FlowModel after = traverseStatement(n, before);
    checkState(
        after.getReachability().getDepth() == before.getReachability().getDepth(),
        "split level changed across %s",
        n);
    result.recordAfter(n, after);
    return after;
  }

  private FlowModel traverseStatement(Node n, FlowModel before) {
    switch (n.getToken()) {
      case BLOCK:
        return traverseBlock(n, before);

      case EMPTY:
        return before;

      case EXPR_RESULT:
        return analyzeExpression(n.getFirstChild(), before).getAfter();

      case VAR:
        return traverseVar(n, before);

      case IF:
        return traverseIf(n, before);

      case WHILE:
        return traverseWhile(n, before);

      case DO:
        return traverseDo(n, before);

      case FOR:
        return traverseFor(n, before);

      case FOR_IN:
        return traverseForIn(n, before);

      case LABEL:
        return traverseLabel(n, before);

      case BREAK:
        return traverseJump(n, before, pendingBreaks);

      case CONTINUE:
        return traverseJump(n, before, pendingContinues);

      case SWITCH:
        return traverseSwitch(n, before);

      case TRY:
        return traverseTry(n, before);

      case CATCH:
        return traverseCatch(n, before);

      case RETURN:
        return traverseReturn(n, before);

      case YIELD:
        return traverseYield(n, before);

      default:
        throw new IllegalStateException("Unexpected statement " + n);
    }
  }

  private FlowModel traverseBlock(Node n, FlowModel before) {
    FlowModel model = before;
    for (Node child : n.children()) {
      model = analyzeStatement(child, model);
    }
    for (Node child : n.children()) {
      if (child.isVar()) {
        model = model.remove(child.getFirstChild().getVar());
      }
    }
    return model;
  }

  private FlowModel traverseVar(Node n, FlowModel before) {
    Node name = n.getFirstChild();
    Var var = checkNotNull(name.getVar(), "untracked declaration %s", name);
    Node initializer = name.getNext();
    if (initializer == null) {
      return before.declare(var, declaredTypeOf(var), false);
    }

    FlowModel afterInitializer = analyzeExpression(initializer, before).getAfter();
    Type declaredType = var.getDeclaredType();
    if (declaredType == null) {
      Type initializerType = result.getStaticType(initializer);
      declaredType = initializerType.isNullType() ? Type.DYNAMIC : initializerType;
    }
    return afterInitializer.declare(var, declaredType, true);
  }

  private FlowModel traverseIf(Node n, FlowModel before) {
    Node condition = n.getFirstChild();
    Node thenBranch = condition.getNext();
    Node elseBranch = thenBranch.getNext();

    ExpressionInfo info = analyzeExpression(condition, before);
    FlowModel afterThen = analyzeStatement(thenBranch, info.getWhenTrue().split());
    FlowModel afterElse =
        elseBranch == null
            ? info.getWhenFalse().split()
            : analyzeStatement(elseBranch, info.getWhenFalse().split());
    return FlowModel.join(afterThen, afterElse);
  }

  private FlowModel traverseWhile(Node n, FlowModel before) {
    Node condition = n.getFirstChild();
    Node body = n.getLastChild();

    FlowModel head =
        before.conservativeJoin(
            assignedVariables.assignedIn(n), assignedVariables.capturedIn(n));
    ExpressionInfo info = analyzeExpression(condition, head);
    enterJumpTarget(n, true);
    analyzeStatement(body, info.getWhenTrue().split());
    int bodyDepth = head.getReachability().getDepth() + 1;
    publishContinues(n, bodyDepth);
    return joinWithBreaks(n, bodyDepth, ImmutableList.of(info.getWhenFalse().split()));
  }

  private FlowModel traverseDo(Node n, FlowModel before) {
    Node body = n.getFirstChild();
    Node condition = n.getLastChild();

    FlowModel head =
        before.conservativeJoin(
            assignedVariables.assignedIn(n), assignedVariables.capturedIn(n));
    enterJumpTarget(n, true);
    FlowModel afterBody = analyzeStatement(body, head.split());
    int bodyDepth = afterBody.getReachability().getDepth();
    FlowModel conditionEntry = mergeWithContinues(n, bodyDepth, afterBody);
    ExpressionInfo info = analyzeExpression(condition, conditionEntry);
    return joinWithBreaks(n, bodyDepth, ImmutableList.of(info.getWhenFalse()));
  }

  private FlowModel traverseFor(Node n, FlowModel before) {
    Node initializer = n.getFirstChild();
    Node condition = initializer.getNext();
    Node update = condition.getNext();
    Node body = update.getNext();

    FlowModel model =
        initializer.isVar() || initializer.isEmpty()
            ? analyzeStatement(initializer, before)
            : analyzeExpression(initializer, before).getAfter();

    Set<Var> assigned =
        Sets.union(
            assignedVariables.assignedIn(condition),
            Sets.union(assignedVariables.assignedIn(update), assignedVariables.assignedIn(body)));
    Set<Var> captured =
        Sets.union(
            assignedVariables.capturedIn(condition),
            Sets.union(assignedVariables.capturedIn(update), assignedVariables.capturedIn(body)));
    FlowModel head = model.conservativeJoin(assigned, captured);

    FlowModel whenTrue;
    FlowModel whenFalse;
    if (condition.isEmpty()) {
      // for (;;) loops until something breaks out.
      analyzeStatement(condition, head);
      whenTrue = head;
      whenFalse = head.exit();
    } else {
      ExpressionInfo info = analyzeExpression(condition, head);
      whenTrue = info.getWhenTrue();
      whenFalse = info.getWhenFalse();
    }

    enterJumpTarget(n, true);
    FlowModel afterBody = analyzeStatement(body, whenTrue.split());
    int bodyDepth = afterBody.getReachability().getDepth();
    FlowModel updateEntry = mergeWithContinues(n, bodyDepth, afterBody);
    if (update.isEmpty()) {
      analyzeStatement(update, updateEntry);
    } else {
      analyzeExpression(update, updateEntry);
    }

    FlowModel after = joinWithBreaks(n, bodyDepth, ImmutableList.of(whenFalse.split()));
    if (initializer.isVar()) {
      after = after.remove(initializer.getFirstChild().getVar());
    }
    return after;
  }

  private FlowModel traverseForIn(Node n, FlowModel before) {
    Node target = n.getFirstChild();
    Node iterable = target.getNext();
    Node body = iterable.getNext();

    FlowModel afterIterable = analyzeExpression(iterable, before).getAfter();
    Var loopVar;
    Set<Var> assigned;
    if (target.isVar()) {
      loopVar = checkNotNull(target.getFirstChild().getVar());
      assigned = assignedVariables.assignedIn(body);
    } else {
      loopVar = checkNotNull(target.getVar(), "untracked loop variable %s", target);
      assigned = Sets.union(assignedVariables.assignedIn(body), ImmutableSet.of(loopVar));
    }
    FlowModel head = afterIterable.conservativeJoin(assigned, assignedVariables.capturedIn(body));

    FlowModel bodyEntry = head.split();
    result.recordBefore(target, bodyEntry);
    if (target.isVar()) {
      Type elementType = loopVar.getDeclaredType();
      if (elementType == null) {
        elementType = typeOf(target.getFirstChild(), Type.DYNAMIC);
      }
      bodyEntry = bodyEntry.declare(loopVar, elementType, true);
    } else {
      Type elementType = typeOf(target, declaredTypeOf(loopVar));
      bodyEntry = bodyEntry.assign(loopVar, elementType, policy);
    }
    result.recordAfter(target, bodyEntry);

    enterJumpTarget(n, true);
    analyzeStatement(body, bodyEntry);
    int bodyDepth = bodyEntry.getReachability().getDepth();
    publishContinues(n, bodyDepth);
    FlowModel after = joinWithBreaks(n, bodyDepth, ImmutableList.of(head.split()));
    return target.isVar() ? after.remove(loopVar) : after;
  }

  private FlowModel traverseLabel(Node n, FlowModel before) {
    Node statement = n.getLastChild();
    if (statement.getToken().isLoop()) {
      // Jumps to the label target the loop itself.
      return analyzeStatement(statement, before);
    }
    enterJumpTarget(n, false);
    FlowModel afterStatement = analyzeStatement(statement, before.split());
    FlowModel after =
        joinWithBreaks(
            n, afterStatement.getReachability().getDepth(), ImmutableList.of(afterStatement));
    // A labeled declaration goes out of scope with the label.
    return statement.isVar() ? after.remove(statement.getFirstChild().getVar()) : after;
  }

  private FlowModel traverseSwitch(Node n, FlowModel before) {
    Node scrutinee = n.getFirstChild();
    FlowModel entry = analyzeExpression(scrutinee, before).getAfter();
    enterJumpTarget(n, false);

    List<FlowModel> exits = new ArrayList<>();
    boolean hasDefault = false;
    // The model at the end of an empty case, which falls through to the next case.
    FlowModel fallthrough = null;
    for (Node caseNode = scrutinee.getNext(); caseNode != null; caseNode = caseNode.getNext()) {
      FlowModel caseEntry = entry.split();
      result.recordBefore(caseNode, caseEntry);
      Node body;
      if (caseNode.getToken() == Token.CASE) {
        caseEntry = analyzeExpression(caseNode.getFirstChild(), caseEntry).getAfter();
        body = caseNode.getLastChild();
      } else {
        checkState(!hasDefault, "more than one default in %s", n);
        hasDefault = true;
        body = caseNode.getFirstChild();
      }
      if (fallthrough != null) {
        caseEntry = FlowModel.merge(fallthrough, caseEntry);
        fallthrough = null;
      }
      FlowModel afterCase = analyzeStatement(body, caseEntry);
      result.recordAfter(caseNode, afterCase);
      if (!body.hasChildren() && caseNode.getNext() != null) {
        fallthrough = afterCase;
      } else {
        // Non-empty cases do not fall through.
        exits.add(afterCase);
      }
    }
    if (!hasDefault && !n.isExhaustive()) {
      exits.add(entry.split());
    }
    return joinWithBreaks(n, entry.getReachability().getDepth() + 1, exits);
  }

  private FlowModel traverseTry(Node n, FlowModel before) {
    Node tryBlock = n.getFirstChild();
    Node catchBlock = tryBlock.getNext();
    Node finallyBlock = catchBlock.getNext();

    FlowModel afterTry = analyzeStatement(tryBlock, before.split());
    FlowModel afterTryCatch;
    if (catchBlock.hasChildren()) {
      // An exception may be thrown after any of the writes in the try block.
      FlowModel catchEntry =
          before
              .conservativeJoin(
                  assignedVariables.assignedIn(tryBlock), assignedVariables.capturedIn(tryBlock))
              .split();
      FlowModel afterCatch = analyzeStatement(catchBlock, catchEntry);
      afterTryCatch = FlowModel.join(afterTry, afterCatch);
    } else {
      afterTryCatch = afterTry.drop();
    }
    if (finallyBlock == null) {
      return afterTryCatch;
    }

    FlowModel finallyEntry =
        before.conservativeJoin(
            Sets.union(
                assignedVariables.assignedIn(tryBlock), assignedVariables.assignedIn(catchBlock)),
            Sets.union(
                assignedVariables.capturedIn(tryBlock), assignedVariables.capturedIn(catchBlock)));
    FlowModel afterFinally = analyzeStatement(finallyBlock, finallyEntry);
    return FlowModel.restrict(
        afterFinally, afterTryCatch, assignedVariables.assignedIn(finallyBlock), types);
  }

  private FlowModel traverseCatch(Node n, FlowModel before) {
    Node binding = n.getFirstChild();
    Node body = n.getLastChild();
    Var exception = binding.isName() ? binding.getVar() : null;
    FlowModel model = before;
    if (exception != null) {
      Type exceptionType = exception.getDeclaredType();
      if (exceptionType == null) {
        exceptionType = types.objectType();
      }
      model = model.declare(exception, exceptionType, true);
    }
    FlowModel after = analyzeStatement(body, model);
    return exception != null ? after.remove(exception) : after;
  }

  private FlowModel traverseReturn(Node n, FlowModel before) {
    Node value = n.getFirstChild();
    FlowModel model = before;
    Type valueType = null;
    if (value != null) {
      model = analyzeExpression(value, before).getAfter();
      valueType = result.getStaticType(value);
    }
    recordExitPoint(n, valueType, before);
    return model.exit();
  }

  private FlowModel traverseYield(Node n, FlowModel before) {
    checkState(
        currentFunction != null && currentFunction.getFunctionKind().isGenerator(),
        "yield outside a generator: %s",
        n);
    Node value = n.getFirstChild();
    FlowModel after = analyzeExpression(value, before).getAfter();
    recordExitPoint(n, result.getStaticType(value), before);
    return after;
  }

  private void recordExitPoint(Node n, @Nullable Type valueType, FlowModel before) {
    result.recordExitPoint(
        new ExitPoint(n, checkNotNull(currentFunction), valueType, before.isReachable()));
  }

  private FlowModel traverseJump(
      Node n, FlowModel before, Map<Node, List<FlowModel>> pendingJumps) {
    Node target = getJumpTarget(n);
    List<FlowModel> jumps = pendingJumps.get(target);
    checkState(jumps != null, "%s cannot jump to %s", n, target);
    jumps.add(before);
    return before.exit();
  }

  /**
   * Returns the statement {@code jump} leaves or continues: the labeled statement, or the
   * innermost enclosing loop (or switch, for a break).
   */
  private static Node getJumpTarget(Node jump) {
    Node label = jump.getFirstChild();
    for (Node parent = jump.getParent();
        parent != null && !parent.isFunction();
        parent = parent.getParent()) {
      if (label == null) {
        if (parent.getToken().isLoop()
            || (jump.isBreak() && parent.getToken() == Token.SWITCH)) {
          return parent;
        }
      } else if (parent.isLabel()
          && parent.getFirstChild().getString().equals(label.getString())) {
        Node statement = parent.getLastChild();
        if (statement.getToken().isLoop()) {
          return statement;
        }
        checkState(jump.isBreak(), "continue to %s, which is not a loop", label.getString());
        return parent;
      }
    }
    throw new IllegalStateException("No target for " + jump);
  }

  private void enterJumpTarget(Node target, boolean isLoop) {
    pendingBreaks.put(target, new ArrayList<>());
    if (isLoop) {
      pendingContinues.put(target, new ArrayList<>());
    }
  }

  /**
   * Closes the jump target {@code n}: joins the normal ways out of it with the breaks, all at
   * the split level {@code depth} of its body. A construct nothing leaves is unreachable after.
   */
  private FlowModel joinWithBreaks(Node n, int depth, List<FlowModel> normalExits) {
    List<FlowModel> breaks = normalize(pendingBreaks.remove(n), depth);
    if (!breaks.isEmpty()) {
      result.recordBreakModel(n, FlowModel.mergeAll(breaks));
    }
    List<FlowModel> exits = new ArrayList<>(normalExits);
    exits.addAll(breaks);
    if (exits.isEmpty()) {
      // Only an exhaustive switch without cases gets here.
      return result.getAfter(n.getFirstChild()).exit();
    }
    return FlowModel.joinAll(exits);
  }

  private void publishContinues(Node loop, int depth) {
    List<FlowModel> continues = normalize(pendingContinues.remove(loop), depth);
    if (!continues.isEmpty()) {
      result.recordContinueModel(loop, FlowModel.mergeAll(continues));
    }
  }

  /** The model at the end of an iteration: the end of the body merged with the continues. */
  private FlowModel mergeWithContinues(Node loop, int depth, FlowModel afterBody) {
    List<FlowModel> continues = normalize(pendingContinues.remove(loop), depth);
    if (continues.isEmpty()) {
      return afterBody;
    }
    result.recordContinueModel(loop, FlowModel.mergeAll(continues));
    List<FlowModel> models = new ArrayList<>();
    models.add(afterBody);
    models.addAll(continues);
    return FlowModel.mergeAll(models);
  }

  /** Closes the splits opened between the jump target's body and each jump. */
  private static List<FlowModel> normalize(List<FlowModel> jumps, int depth) {
    checkNotNull(jumps);
    List<FlowModel> normalized = new ArrayList<>(jumps.size());
    for (FlowModel jump : jumps) {
      checkState(jump.getReachability().getDepth() >= depth, "jump above its target");
      while (jump.getReachability().getDepth() > depth) {
        jump = jump.drop();
      }
      normalized.add(jump);
    }
    return normalized;
  }

  private ExpressionInfo analyzeExpression(Node n, FlowModel before) {
    result.recordBefore(n, before);
    ExpressionInfo info = traverse(n, before);
    checkState(
        info.getAfter().getReachability().getDepth() == before.getReachability().getDepth(),
        "split level changed across %s",
        n);
    result.recordExpression(n, info);
    return info;
  }

  private ExpressionInfo traverse(Node n, FlowModel before) {
    switch (n.getToken()) {
      case NAME:
        return traverseName(n, before);

      case NULL:
        return ExpressionInfo.simple(before, typeOf(n, Type.NULL), types);

      case TRUE:
        typeOf(n, BOOL);
        return ExpressionInfo.condition(before, before.exit());

      case FALSE:
        typeOf(n, BOOL);
        return ExpressionInfo.condition(before.exit(), before);

      case NUMBER:
        {
          double value = n.getDouble();
          Type defaultType = value == Math.rint(value) ? INT : DOUBLE;
          return ExpressionInfo.simple(before, typeOf(n, defaultType), types);
        }

      case STRINGLIT:
        return ExpressionInfo.simple(before, typeOf(n, STRING), types);

      case THIS:
        return ExpressionInfo.simple(before, typeOf(n, types.objectType()), types);

      case ASSIGN:
        return traverseAssign(n, before);

      case NOT:
        {
          ExpressionInfo operand = analyzeExpression(n.getFirstChild(), before);
          typeOf(n, BOOL);
          return ExpressionInfo.condition(operand.getWhenFalse(), operand.getWhenTrue());
        }

      case AND:
        return traverseAnd(n, before);

      case OR:
        return traverseOr(n, before);

      case COALESCE:
        return traverseNullishCoalesce(n, before);

      case HOOK:
        return traverseHook(n, before);

      case EQ:
      case NE:
        return traverseEquality(n, before);

      case IS:
      case IS_NOT:
        return traverseTypeTest(n, before);

      case AS:
        return traverseCast(n, before);

      case NON_NULL:
        {
          Node operand = n.getFirstChild();
          ExpressionInfo info = analyzeExpression(operand, before);
          Type type = typeOf(n, policy.nonNull(result.getStaticType(operand)));
          return ExpressionInfo.simple(info.getWhenNotNull(), type, types);
        }

      case CALL:
        return traverseCall(n, before);

      case THROW:
        {
          FlowModel after = analyzeExpression(n.getFirstChild(), before).getAfter();
          return ExpressionInfo.simple(after.exit(), typeOf(n, Type.NEVER), types);
        }

      case AWAIT:
        {
          Node operand = n.getFirstChild();
          FlowModel after = analyzeExpression(operand, before).getAfter();
          Type type = typeOf(n, types.flatten(result.getStaticType(operand)));
          return ExpressionInfo.simple(after, type, types);
        }

      case FUNCTION:
        return traverseFunction(n, before);

      default:
        throw new IllegalStateException("Unexpected expression " + n);
    }
  }

  private ExpressionInfo traverseName(Node n, FlowModel before) {
    Var var = n.getVar();
    if (var == null) {
      return ExpressionInfo.simple(before, typeOf(n, Type.DYNAMIC), types);
    }
    VariableModel model = before.getVariableModel(var);
    checkState(model != null, "%s is not in scope at %s", var, n);
    if (!model.isAssigned() && before.isReachable()) {
      report(n, POSSIBLY_UNASSIGNED, var.getName());
    }

    Type type = typeOf(n, model.getCurrentType());
    ExpressionInfo info = ExpressionInfo.simple(before, type, types);
    if (types.isNonNullable(model.getCurrentType())) {
      return info;
    }
    FlowModel whenNotNull = info.getAfter().withVariable(var, policy.promoteToNonNull(model));
    if (!info.getWhenNotNull().getReachability().getTop()) {
      whenNotNull = whenNotNull.exit();
    }
    return ExpressionInfo.nullability(info.getAfter(), info.getWhenNull(), whenNotNull);
  }

  private ExpressionInfo traverseAssign(Node n, FlowModel before) {
    Node target = n.getFirstChild();
    Node value = n.getLastChild();
    Var var = checkNotNull(target.getVar(), "assignment to untracked %s", target);

    ExpressionInfo info = analyzeExpression(value, before);
    Type valueType = result.getStaticType(value);
    FlowModel afterValue = info.getAfter();
    if (var.isFinal() && !afterValue.isDefinitelyUnassigned(var) && afterValue.isReachable()) {
      report(n, FINAL_POSSIBLY_ASSIGNED, var.getName());
    }
    typeOf(n, valueType);
    return new ExpressionInfo(
        afterValue.assign(var, valueType, policy),
        info.getWhenTrue().assign(var, valueType, policy),
        info.getWhenFalse().assign(var, valueType, policy),
        info.getWhenNull().assign(var, valueType, policy),
        info.getWhenNotNull().assign(var, valueType, policy));
  }

  private ExpressionInfo traverseAnd(Node n, FlowModel before) {
    Node left = n.getFirstChild();
    Node right = n.getLastChild();
    ExpressionInfo leftInfo = analyzeExpression(left, before);
    // The right operand only runs when the left one is true.
    ExpressionInfo rightInfo = analyzeExpression(right, leftInfo.getWhenTrue().split());
    typeOf(n, BOOL);
    return ExpressionInfo.condition(
        rightInfo.getWhenTrue().drop(),
        FlowModel.join(leftInfo.getWhenFalse().split(), rightInfo.getWhenFalse()));
  }

  private ExpressionInfo traverseOr(Node n, FlowModel before) {
    Node left = n.getFirstChild();
    Node right = n.getLastChild();
    ExpressionInfo leftInfo = analyzeExpression(left, before);
    ExpressionInfo rightInfo = analyzeExpression(right, leftInfo.getWhenFalse().split());
    typeOf(n, BOOL);
    return ExpressionInfo.condition(
        FlowModel.join(leftInfo.getWhenTrue().split(), rightInfo.getWhenTrue()),
        rightInfo.getWhenFalse().drop());
  }

  private ExpressionInfo traverseNullishCoalesce(Node n, FlowModel before) {
    Node left = n.getFirstChild();
    Node right = n.getLastChild();
    ExpressionInfo leftInfo = analyzeExpression(left, before);
    ExpressionInfo rightInfo = analyzeExpression(right, leftInfo.getWhenNull().split());

    Type leftType = policy.nonNull(result.getStaticType(left));
    typeOf(n, upperBound(leftType, result.getStaticType(right)));
    FlowModel leftNotNull = leftInfo.getWhenNotNull().split();
    return ExpressionInfo.nullability(
        FlowModel.join(leftNotNull, rightInfo.getAfter()),
        rightInfo.getWhenNull().drop(),
        FlowModel.join(leftNotNull, rightInfo.getWhenNotNull()));
  }

  private ExpressionInfo traverseHook(Node n, FlowModel before) {
    Node condition = n.getFirstChild();
    Node trueNode = condition.getNext();
    Node falseNode = n.getLastChild();

    ExpressionInfo conditionInfo = analyzeExpression(condition, before);
    ExpressionInfo trueInfo = analyzeExpression(trueNode, conditionInfo.getWhenTrue().split());
    ExpressionInfo falseInfo = analyzeExpression(falseNode, conditionInfo.getWhenFalse().split());

    typeOf(n, upperBound(result.getStaticType(trueNode), result.getStaticType(falseNode)));
    return new ExpressionInfo(
        FlowModel.join(trueInfo.getAfter(), falseInfo.getAfter()),
        FlowModel.join(trueInfo.getWhenTrue(), falseInfo.getWhenTrue()),
        FlowModel.join(trueInfo.getWhenFalse(), falseInfo.getWhenFalse()),
        FlowModel.join(trueInfo.getWhenNull(), falseInfo.getWhenNull()),
        FlowModel.join(trueInfo.getWhenNotNull(), falseInfo.getWhenNotNull()));
  }

  /** {@code e == null} and {@code e != null} tell whether {@code e} is null. */
  private ExpressionInfo traverseEquality(Node n, FlowModel before) {
    Node left = n.getFirstChild();
    Node right = n.getLastChild();
    ExpressionInfo leftInfo = analyzeExpression(left, before);
    ExpressionInfo rightInfo = analyzeExpression(right, leftInfo.getAfter());
    typeOf(n, BOOL);

    FlowModel whenEqual;
    FlowModel whenNotEqual;
    if (left.isNull() && right.isNull()) {
      whenEqual = rightInfo.getAfter();
      whenNotEqual = rightInfo.getAfter().exit();
    } else if (right.isNull()) {
      whenEqual = leftInfo.getWhenNull();
      whenNotEqual = leftInfo.getWhenNotNull();
    } else if (left.isNull()) {
      whenEqual = rightInfo.getWhenNull();
      whenNotEqual = rightInfo.getWhenNotNull();
    } else {
      whenEqual = rightInfo.getAfter();
      whenNotEqual = rightInfo.getAfter();
    }
    return n.getToken() == Token.EQ
        ? ExpressionInfo.condition(whenEqual, whenNotEqual)
        : ExpressionInfo.condition(whenNotEqual, whenEqual);
  }

  private ExpressionInfo traverseTypeTest(Node n, FlowModel before) {
    Node operand = n.getFirstChild();
    Type tested = n.getTypeOperand();
    FlowModel after = analyzeExpression(operand, before).getAfter();
    typeOf(n, BOOL);

    FlowModel whenIs = after;
    FlowModel whenIsNot = after;
    Var var = operand.getVarIfLocal();
    if (var != null) {
      VariableModel model = checkNotNull(after.getVariableModel(var));
      whenIs = after.withVariable(var, policy.promoteByTest(model, tested));
      whenIsNot = after.withVariable(var, policy.demoteByFailedTest(model, tested));
    }
    return n.getToken() == Token.IS
        ? ExpressionInfo.condition(whenIs, whenIsNot)
        : ExpressionInfo.condition(whenIsNot, whenIs);
  }

  private ExpressionInfo traverseCast(Node n, FlowModel before) {
    Node operand = n.getFirstChild();
    Type castType = n.getTypeOperand();
    FlowModel after = analyzeExpression(operand, before).getAfter();
    Var var = operand.getVarIfLocal();
    if (var != null) {
      VariableModel model = checkNotNull(after.getVariableModel(var));
      after = after.withVariable(var, policy.promoteByTest(model, castType));
    }
    return ExpressionInfo.simple(after, typeOf(n, castType), types);
  }

  /** The callee, then the arguments from left to right. */
  private ExpressionInfo traverseCall(Node n, FlowModel before) {
    FlowModel model = before;
    for (Node child : n.children()) {
      model = analyzeExpression(child, model).getAfter();
    }
    return ExpressionInfo.simple(model, typeOf(n, Type.DYNAMIC), types);
  }

  /**
   * A closure. Its body is analyzed right away, from a model where the enclosing variables may
   * have been written at any time: only promotions of variables nothing ever writes survive.
   * After the closure its writes can happen at any time, so the variables it writes become write
   * captured.
   */
  private ExpressionInfo traverseFunction(Node n, FlowModel before) {
    ImmutableSet<Var> writtenAnywhere = assignedVariables.assignedIn(root);
    FlowModel entry =
        FlowModel.initial()
            .withReachability(Reachability.initial().setTop(before.isReachable()));
    for (Map.Entry<Var, VariableModel> e : before.getVariableInfo().entrySet()) {
      VariableModel model = e.getValue();
      entry =
          entry.withVariable(
              e.getKey(),
              model.markPossiblyAssigned(
                  writtenAnywhere.contains(e.getKey()) || model.isWriteCaptured()));
    }
    analyzeFunctionBody(n, entry);

    FlowModel after = before;
    for (Var var : assignedVariables.capturedIn(n)) {
      VariableModel model = after.getVariableModel(var);
      if (model != null) {
        after = after.withVariable(var, model.markWriteCaptured());
      }
    }
    return ExpressionInfo.simple(after, typeOf(n, FUNCTION), types);
  }

  /** The static type of {@code n} from the typer, or {@code defaultType}. */
  private Type typeOf(Node n, Type defaultType) {
    Type type = typer.getStaticType(n, result);
    if (type == null) {
      type = defaultType;
    }
    result.recordStaticType(n, type);
    return type;
  }

  /** The wider of two types if one contains the other, {@code dynamic} otherwise. */
  private Type upperBound(Type a, Type b) {
    if (types.isSubtypeOf(a, b)) {
      return b;
    }
    if (types.isSubtypeOf(b, a)) {
      return a;
    }
    return Type.DYNAMIC;
  }

  private static Type declaredTypeOf(Var var) {
    Type declaredType = var.getDeclaredType();
    return declaredType != null ? declaredType : Type.DYNAMIC;
  }

  private void report(Node n, DiagnosticType type, String... arguments) {
    result.recordError(AnalysisError.make(n, type, arguments));
  }
}
