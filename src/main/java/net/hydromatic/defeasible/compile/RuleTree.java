/*
 * Licensed to Julian Hyde under one or more contributor license
 * agreements.  See the NOTICE file distributed with this work
 * for additional information regarding copyright ownership.
 * Julian Hyde licenses this file to you under the Apache
 * License, Version 2.0 (the "License"); you may not use this
 * file except in compliance with the License.  You may obtain a
 * copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND,
 * either express or implied.  See the License for the specific
 * language governing permissions and limitations under the
 * License.
 */
package net.hydromatic.defeasible.compile;

import static net.hydromatic.defeasible.util.Static.transformEager;

import com.google.common.collect.ImmutableList;
import java.util.List;
import net.hydromatic.defeasible.ast.Desugared;

/**
 * Tree of rules ordered by priority.
 *
 * <p>The rules at the root of a tree apply unless one of its sub-trees, its
 * exceptions, applies.
 */
public abstract class RuleTree {
  /** The rules of this level, which have the same priority. */
  public final ImmutableList<Desugared.Rule> rules;

  private RuleTree(List<Desugared.Rule> rules) {
    this.rules = ImmutableList.copyOf(rules);
  }

  /** Creates a tree that has no exceptions. */
  public static Leaf leaf(List<Desugared.Rule> rules) {
    return new Leaf(rules);
  }

  /** Creates a tree whose rules yield to some exceptions. */
  public static Node node(List<RuleTree> exceptions,
      List<Desugared.Rule> rules) {
    return new Node(exceptions, rules);
  }

  /** Returns one tree for each base case of an exception graph. */
  public static List<RuleTree> forest(ExceptionGraph graph) {
    return transformEager(graph.baseCases(), group -> tree(graph, group));
  }

  private static RuleTree tree(ExceptionGraph graph,
      ExceptionGraph.RuleGroup group) {
    final List<ExceptionGraph.RuleGroup> exceptions =
        graph.exceptionsTo(group);
    if (exceptions.isEmpty()) {
      return leaf(graph.rules(group));
    }
    return node(transformEager(exceptions, e -> tree(graph, e)),
        graph.rules(group));
  }

  @Override
  public String toString() {
    return unparse(new StringBuilder()).toString();
  }

  abstract StringBuilder unparse(StringBuilder b);

  StringBuilder unparseRules(StringBuilder b) {
    b.append('[');
    for (int i = 0; i < rules.size(); i++) {
      b.append(i == 0 ? "" : ", ").append(rules.get(i).id);
    }
    return b.append(']');
  }

  /** Tree that has no exceptions. */
  public static class Leaf extends RuleTree {
    Leaf(List<Desugared.Rule> rules) {
      super(rules);
    }

    @Override
    StringBuilder unparse(StringBuilder b) {
      return unparseRules(b);
    }
  }

  /** Tree whose rules yield to exceptions. */
  public static class Node extends RuleTree {
    public final ImmutableList<RuleTree> exceptions;

    Node(List<RuleTree> exceptions, List<Desugared.Rule> rules) {
      super(rules);
      this.exceptions = ImmutableList.copyOf(exceptions);
    }

    @Override
    StringBuilder unparse(StringBuilder b) {
      unparseRules(b).append(" <- (");
      for (int i = 0; i < exceptions.size(); i++) {
        exceptions.get(i).unparse(b.append(i == 0 ? "" : ", "));
      }
      return b.append(')');
    }
  }
}

// End RuleTree.java
