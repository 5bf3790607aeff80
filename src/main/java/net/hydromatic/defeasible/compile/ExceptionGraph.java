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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import net.hydromatic.defeasible.ast.Desugared;
import net.hydromatic.defeasible.ast.Pos;
import net.hydromatic.defeasible.ast.Uid;
import net.hydromatic.defeasible.util.Digraph;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Graph of exceptions between the rules that define one variable.
 *
 * <p>A vertex is a group of rules. Rules that are together the target of an
 * exception form one group; every other rule is a group on its own. There is
 * an edge from group A to group B if a rule of A is an exception to B.
 *
 * <p>The graph is acyclic, or {@link #build} would have thrown.
 */
public class ExceptionGraph {
  public final Desugared.ScopeDefKey key;
  private final ImmutableMap<Uid.RuleName, Desugared.Rule> rules;
  private final Digraph<RuleGroup> graph;

  private ExceptionGraph(Desugared.ScopeDefKey key,
      ImmutableMap<Uid.RuleName, Desugared.Rule> rules,
      Digraph<RuleGroup> graph) {
    this.key = requireNonNull(key);
    this.rules = requireNonNull(rules);
    this.graph = requireNonNull(graph);
  }

  /**
   * Builds the exception graph of the rules of a definition.
   *
   * @throws CompileException if groups overlap, or if there is a cycle of
   *   exceptions
   */
  public static ExceptionGraph build(Desugared.ScopeDefKey key,
      Map<Uid.RuleName, Desugared.Rule> ruleMap) {
    final ImmutableMap<Uid.RuleName, Desugared.Rule> rules =
        ImmutableMap.copyOf(ruleMap);

    // Each distinct target of an exception is a group. Two groups must not
    // share a rule.
    final Map<Uid.RuleName, RuleGroup> groupOfRule = new LinkedHashMap<>();
    for (Desugared.Rule rule : rules.values()) {
      if (rule.exceptionTo.isEmpty()) {
        continue;
      }
      final RuleGroup group = new RuleGroup(rule.exceptionTo);
      for (Uid.RuleName name : rule.exceptionTo) {
        checkArgument(rules.containsKey(name),
            "rule %s is an exception to unknown rule %s", rule.id, name);
        final RuleGroup previous = groupOfRule.get(name);
        if (previous != null && !previous.equals(group)) {
          throw overlap(rules, previous, group);
        }
        groupOfRule.put(name, group);
      }
    }

    // Vertices, in the order of the first rule of each group
    final Digraph<RuleGroup> graph = new Digraph<>();
    for (Desugared.Rule rule : rules.values()) {
      graph.addVertex(groupOf(groupOfRule, rule.id));
    }
    for (Desugared.Rule rule : rules.values()) {
      if (!rule.exceptionTo.isEmpty()) {
        graph.addEdge(groupOf(groupOfRule, rule.id),
            new RuleGroup(rule.exceptionTo), rule.pos());
      }
    }

    final ExceptionGraph exceptionGraph =
        new ExceptionGraph(key, rules, graph);
    exceptionGraph.checkAcyclic();
    return exceptionGraph;
  }

  private static RuleGroup groupOf(Map<Uid.RuleName, RuleGroup> groupOfRule,
      Uid.RuleName name) {
    final RuleGroup group = groupOfRule.get(name);
    return group != null ? group : new RuleGroup(ImmutableSet.of(name));
  }

  private static CompileException overlap(
      Map<Uid.RuleName, Desugared.Rule> rules, RuleGroup group0,
      RuleGroup group1) {
    final List<CompileException.Span> spans = new ArrayList<>();
    for (RuleGroup group : ImmutableList.of(group0, group1)) {
      for (Uid.RuleName name : group.rules) {
        spans.add(
            new CompileException.Span("Rule or definition from the group:",
                requireNonNull(rules.get(name)).pos()));
      }
    }
    return new CompileException("Definitions or rules grouped by different "
        + "labels overlap, whereas these groups shall be disjoint", spans);
  }

  private void checkAcyclic() {
    final @Nullable List<RuleGroup> cycle = graph.findCycle();
    if (cycle == null) {
      return;
    }
    final List<CompileException.Span> spans = new ArrayList<>();
    for (int i = 0; i < cycle.size(); i++) {
      final RuleGroup group = cycle.get(i);
      final RuleGroup next = cycle.get((i + 1) % cycle.size());
      for (Uid.RuleName name : group.rules) {
        spans.add(
            new CompileException.Span("Cyclic exception for definition of "
                + "variable \"" + key + "\", declared here:", pos(name)));
      }
      final Pos edgePos = requireNonNull(graph.edgePos(group, next));
      spans.add(
          new CompileException.Span("Used here in the definition of another "
              + "cyclic exception for defining \"" + key + "\":", edgePos));
    }
    throw new CompileException("Exception cycle detected when defining "
        + key, spans);
  }

  private Pos pos(Uid.RuleName name) {
    return requireNonNull(rules.get(name)).pos();
  }

  /** Returns the groups that are not exceptions to any group, in
   * declaration order. */
  public List<RuleGroup> baseCases() {
    final ImmutableList.Builder<RuleGroup> b = ImmutableList.builder();
    for (RuleGroup group : graph.vertices()) {
      if (graph.outDegree(group) == 0) {
        b.add(group);
      }
    }
    return b.build();
  }

  /** Returns the groups that are immediate exceptions to a group, in
   * declaration order. */
  public List<RuleGroup> exceptionsTo(RuleGroup group) {
    return graph.predecessors(group);
  }

  /** Returns the rules of a group, in declaration order. */
  public List<Desugared.Rule> rules(RuleGroup group) {
    final ImmutableList.Builder<Desugared.Rule> b = ImmutableList.builder();
    rules.forEach((name, rule) -> {
      if (group.rules.contains(name)) {
        b.add(rule);
      }
    });
    return b.build();
  }

  @Override
  public String toString() {
    return graph.toString();
  }

  /** Set of rules that is a vertex of the graph. */
  public static class RuleGroup {
    public final ImmutableSet<Uid.RuleName> rules;

    RuleGroup(Set<Uid.RuleName> rules) {
      this.rules = ImmutableSet.copyOf(rules);
      checkArgument(!this.rules.isEmpty());
    }

    @Override
    public int hashCode() {
      return rules.hashCode();
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof RuleGroup
              && ((RuleGroup) o).rules.equals(rules);
    }

    @Override
    public String toString() {
      return rules.toString();
    }
  }
}

// End ExceptionGraph.java
