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

import com.google.common.collect.ImmutableSet;
import com.nullflow.syntax.Node;
import com.nullflow.syntax.Token;
import com.nullflow.syntax.Var;
import java.util.IdentityHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * For every node of a function, the local variables written somewhere inside it and the
 * variables written by a closure inside it that belong to an enclosing scope.
 *
 * <p>Writes are collected lexically, whether or not they are reachable, and include writes in
 * nested functions. Computed once, before the flow analysis, which only reads it.
 */
public final class AssignedVariables {

  private final Map<Node, ImmutableSet<Var>> assigned = new IdentityHashMap<>();
  private final Map<Node, ImmutableSet<Var>> captured = new IdentityHashMap<>();

  private AssignedVariables() {}

  /** Indexes the tree rooted at {@code root}, typically a FUNCTION. */
  public static AssignedVariables compute(Node root) {
    AssignedVariables result = new AssignedVariables();
    result.visit(root);
    return result;
  }

  /** The variables written in the subtree rooted at {@code n}. */
  public ImmutableSet<Var> assignedIn(Node n) {
    ImmutableSet<Var> vars = assigned.get(n);
    checkArgument(vars != null, "%s was not indexed", n);
    return vars;
  }

  public boolean isAssignedIn(Node n, Var var) {
    return assignedIn(n).contains(var);
  }

  /**
   * The variables written by a function in the subtree rooted at {@code n} (or by {@code n}
   * itself, if it is a function) that are declared outside that function.
   */
  public ImmutableSet<Var> capturedIn(Node n) {
    ImmutableSet<Var> vars = captured.get(n);
    checkArgument(vars != null, "%s was not indexed", n);
    return vars;
  }

  /** What one subtree writes, captures and declares. */
  private static final class Summary {
    final Set<Var> assigned = new LinkedHashSet<>();
    final Set<Var> captured = new LinkedHashSet<>();
    final Set<Var> declared = new LinkedHashSet<>();

    void addAll(Summary other) {
      assigned.addAll(other.assigned);
      captured.addAll(other.captured);
      declared.addAll(other.declared);
    }
  }

  private Summary visit(Node n) {
    Summary summary = new Summary();
    for (Node child : n.children()) {
      summary.addAll(visit(child));
    }

    switch (n.getToken()) {
      case ASSIGN:
        addIfLocal(summary.assigned, n.getFirstChild());
        break;
      case FOR_IN:
        Node target = n.getFirstChild();
        if (target.isName()) {
          addIfLocal(summary.assigned, target);
        } else {
          addIfLocal(summary.declared, target.getFirstChild());
        }
        break;
      case VAR:
        addIfLocal(summary.declared, n.getFirstChild());
        break;
      case CATCH:
        addIfLocal(summary.declared, n.getFirstChild());
        break;
      case PARAM_LIST:
        for (Node param : n.children()) {
          addIfLocal(summary.declared, param);
        }
        break;
      case FUNCTION:
        for (Var var : summary.assigned) {
          if (!summary.declared.contains(var)) {
            summary.captured.add(var);
          }
        }
        break;
      default:
        break;
    }

    assigned.put(n, ImmutableSet.copyOf(summary.assigned));
    captured.put(n, ImmutableSet.copyOf(summary.captured));
    return summary;
  }

  private static void addIfLocal(Set<Var> vars, Node n) {
    if (n.getToken() == Token.NAME && n.getVar() != null) {
      vars.add(n.getVar());
    }
  }
}
