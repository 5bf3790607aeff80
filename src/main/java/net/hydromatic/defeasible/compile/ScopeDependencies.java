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

import static java.util.Objects.requireNonNull;
import static net.hydromatic.defeasible.util.Static.last;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import net.hydromatic.defeasible.ast.Desugared;
import net.hydromatic.defeasible.ast.Pos;
import net.hydromatic.defeasible.ast.Uid;
import net.hydromatic.defeasible.ast.Visitor;
import net.hydromatic.defeasible.util.Digraph;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Graph of the dependencies between the definitions of a scope.
 *
 * <p>A vertex is a variable (or one state of a variable) or a call to a
 * subscope. There is an edge from A to B if the definition of B reads A;
 * the redefinitions of the inputs of a subscope belong to the vertex of its
 * call. The edge is labelled with the position of the read.
 */
public class ScopeDependencies {
  public final Desugared.Scope scope;
  private final Digraph<Vertex> graph;

  private ScopeDependencies(Desugared.Scope scope, Digraph<Vertex> graph) {
    this.scope = requireNonNull(scope);
    this.graph = requireNonNull(graph);
  }

  /** Builds the dependency graph of a scope. */
  public static ScopeDependencies build(Desugared.Scope scope) {
    final Digraph<Vertex> graph = new Digraph<>();
    scope.vars.forEach((var, states) -> {
      if (states.isEmpty()) {
        graph.addVertex(Vertex.var(var, null));
      } else {
        states.forEach(state -> graph.addVertex(Vertex.var(var, state)));
      }
    });
    scope.subScopes.keySet().forEach(subScope ->
        graph.addVertex(Vertex.subScopeCall(subScope)));

    scope.defs.forEach((key, def) -> {
      final Vertex dependent;
      if (key instanceof Desugared.ScopeDefKey.Var) {
        final Desugared.ScopeDefKey.Var varKey =
            (Desugared.ScopeDefKey.Var) key;
        dependent = Vertex.var(varKey.var, varKey.state);
      } else {
        dependent =
            Vertex.subScopeCall(
                ((Desugared.ScopeDefKey.SubScopeVar) key).subScope);
      }
      final Visitor visitor = new Visitor() {
        @Override
        protected void visit(Desugared.ScopeVarLocation location) {
          final Vertex dependency = Vertex.var(location.var,
              resolveState(scope, location.var, location.state));
          graph.addEdge(dependency, dependent, location.pos);
        }

        @Override
        protected void visit(Desugared.SubScopeVarLocation location) {
          graph.addEdge(Vertex.subScopeCall(location.subScope), dependent,
              location.pos);
        }
      };
      def.rules.values().forEach(rule -> {
        rule.justification.accept(visitor);
        rule.consequence.accept(visitor);
      });
    });
    return new ScopeDependencies(scope, graph);
  }

  /** Returns the state that a read of a variable refers to: the given
   * state, or if none, the last state, or null if the variable has a single
   * state. */
  private static Uid.@Nullable StateName resolveState(Desugared.Scope scope,
      Uid.ScopeVar var, Uid.@Nullable StateName state) {
    if (state != null) {
      return state;
    }
    final List<Uid.StateName> states = scope.vars.get(var);
    if (states == null) {
      throw new IllegalStateException("variable " + var
          + " is not declared in scope " + scope.name);
    }
    return states.isEmpty() ? null : last(states);
  }

  /**
   * Checks that there is no cycle.
   *
   * @throws CompileException if a variable depends on itself, directly or
   *   through other variables and subscope calls
   */
  public void checkAcyclic() {
    final @Nullable List<Vertex> cycle = graph.findCycle();
    if (cycle == null) {
      return;
    }
    final List<CompileException.Span> spans = new ArrayList<>();
    for (int i = 0; i < cycle.size(); i++) {
      final Vertex vertex = cycle.get(i);
      final Vertex next = cycle.get((i + 1) % cycle.size());
      spans.add(
          new CompileException.Span("Cycle variable " + vertex
              + ", declared:", vertex.pos()));
      spans.add(
          new CompileException.Span("Used here in the definition of another "
              + "cycle variable " + next + ":",
              requireNonNull(graph.edgePos(vertex, next))));
    }
    throw new CompileException("Cyclic dependency detected between "
        + "variables of scope " + scope.name + "!", spans);
  }

  /** Returns the vertices in an order in which they can be computed: each
   * after the vertices it depends on. Among vertices that are ready, the
   * first declared comes first. */
  public List<Vertex> order() {
    checkAcyclic();
    return graph.topologicalOrder();
  }

  /** Returns the vertices that a vertex depends on. */
  public List<Vertex> dependencies(Vertex vertex) {
    return graph.predecessors(vertex);
  }

  public List<Vertex> vertices() {
    return graph.vertices();
  }

  @Override
  public String toString() {
    return graph.toString();
  }

  /** Vertex of the dependency graph. */
  public abstract static class Vertex {
    private Vertex() {}

    /** Creates a vertex for a variable; {@code state} is null if the
     * variable has a single state. */
    public static VarVertex var(Uid.ScopeVar var,
        Uid.@Nullable StateName state) {
      return new VarVertex(var, state);
    }

    /** Creates a vertex for the call of a subscope. */
    public static SubScopeCall subScopeCall(Uid.SubScopeName subScope) {
      return new SubScopeCall(subScope);
    }

    /** Position of the declaration. */
    public abstract Pos pos();
  }

  /** Vertex for a variable, or one state of a variable. */
  public static class VarVertex extends Vertex {
    public final Uid.ScopeVar var;
    public final Uid.@Nullable StateName state;

    VarVertex(Uid.ScopeVar var, Uid.@Nullable StateName state) {
      this.var = requireNonNull(var);
      this.state = state;
    }

    @Override
    public Pos pos() {
      return state == null ? var.pos : state.pos;
    }

    @Override
    public int hashCode() {
      return Objects.hash(var, state);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof VarVertex
              && ((VarVertex) o).var.equals(var)
              && Objects.equals(((VarVertex) o).state, state);
    }

    @Override
    public String toString() {
      return state == null ? var.toString() : var + "@" + state;
    }
  }

  /** Vertex for the call of a subscope. */
  public static class SubScopeCall extends Vertex {
    public final Uid.SubScopeName subScope;

    SubScopeCall(Uid.SubScopeName subScope) {
      this.subScope = requireNonNull(subScope);
    }

    @Override
    public Pos pos() {
      return subScope.pos;
    }

    @Override
    public int hashCode() {
      return subScope.hashCode();
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof SubScopeCall
              && ((SubScopeCall) o).subScope.equals(subScope);
    }

    @Override
    public String toString() {
      return "call " + subScope;
    }
  }
}

// End ScopeDependencies.java
