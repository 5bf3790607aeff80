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
import static net.hydromatic.defeasible.ast.ScopelangBuilder.scopelang;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.defeasible.ast.Desugared;
import net.hydromatic.defeasible.ast.Io;
import net.hydromatic.defeasible.ast.Pos;
import net.hydromatic.defeasible.ast.Scopelang;
import net.hydromatic.defeasible.ast.Uid;

/**
 * Compiles a desugared scope into a lowered scope.
 *
 * <p>The statements are in the order of the scope's dependency graph. A
 * variable becomes a definition; a subscope call becomes the redefinitions of
 * the subscope's inputs followed by the call. Assertions come last.
 */
public class ScopeCompiler {
  private final ExpTranslator translator;
  private final DefinitionCompiler definitionCompiler;
  private final Tracer tracer;

  private ScopeCompiler(ExpTranslator translator, Map<Prop, Object> map,
      Tracer tracer) {
    this.translator = requireNonNull(translator);
    this.definitionCompiler =
        DefinitionCompiler.create(translator, map, tracer);
    this.tracer = requireNonNull(tracer);
  }

  public static ScopeCompiler create(ExpTranslator translator,
      Map<Prop, Object> map, Tracer tracer) {
    return new ScopeCompiler(translator, map, tracer);
  }

  /**
   * Compiles a scope.
   *
   * @throws CompileException if the variables of the scope depend on each
   *   other in a cycle, or if a variable is defined where it may not be
   */
  public Scopelang.ScopeDecl compile(Desugared.Scope scope) {
    final ScopeDependencies dependencies = ScopeDependencies.build(scope);
    final List<ScopeDependencies.Vertex> order = dependencies.order();
    tracer.onOrder(scope.name, order);

    final List<Scopelang.Statement> statements = new ArrayList<>();
    for (ScopeDependencies.Vertex vertex : order) {
      if (vertex instanceof ScopeDependencies.VarVertex) {
        compileVar(scope, (ScopeDependencies.VarVertex) vertex, statements);
      } else {
        compileCall(scope, (ScopeDependencies.SubScopeCall) vertex,
            statements);
      }
    }
    for (Desugared.Exp assertion : scope.assertions) {
      statements.add(
          scopelang.assertion(assertion.pos,
              translator.translate(assertion)));
    }

    final Scopelang.ScopeDecl decl =
        new Scopelang.ScopeDecl(scope.name, signature(scope), statements);
    tracer.onScopeDecl(decl);
    return decl;
  }

  private void compileVar(Desugared.Scope scope,
      ScopeDependencies.VarVertex vertex,
      List<Scopelang.Statement> statements) {
    final Desugared.ScopeDefKey key =
        Desugared.ScopeDefKey.of(vertex.var, vertex.state);
    final Desugared.ScopeDef def = scope.def(key);
    if (def.io.input == Io.Input.ONLY_INPUT) {
      if (!def.rules.isEmpty()) {
        final List<CompileException.Span> spans = new ArrayList<>();
        spans.add(
            new CompileException.Span("Incriminated variable:",
                vertex.var.pos));
        def.rules.keySet().forEach(rule ->
            spans.add(
                new CompileException.Span(
                    "Incriminated variable definition:", rule.pos)));
        throw new CompileException("It is impossible to give a definition "
            + "to a scope variable tagged as input.", spans);
      }
      // The caller defines an input-only variable
      return;
    }
    final Scopelang.Exp exp = definitionCompiler.compile(key, def, false);
    final Uid.ScopeVar var =
        translator.stateChain(vertex.var).get(vertex.state);
    statements.add(
        scopelang.definition(var.pos, scopelang.scopeVar(var.pos, var),
            def.type, def.io, exp));
  }

  private void compileCall(Desugared.Scope scope,
      ScopeDependencies.SubScopeCall vertex,
      List<Scopelang.Statement> statements) {
    final Uid.SubScopeName subScope = vertex.subScope;
    final Uid.ScopeName calleeName =
        requireNonNull(scope.subScopes.get(subScope));
    scope.defs.forEach((key, def) -> {
      if (!(key instanceof Desugared.ScopeDefKey.SubScopeVar)
          || !((Desugared.ScopeDefKey.SubScopeVar) key).subScope
              .equals(subScope)) {
        return;
      }
      if (def.io.input == Io.Input.NO_INPUT && def.rules.isEmpty()) {
        // Not visible to the caller, and not redefined
        return;
      }
      final Desugared.ScopeDefKey.SubScopeVar subScopeKey =
          (Desugared.ScopeDefKey.SubScopeVar) key;
      checkRedefinition(subScopeKey, def);
      final Scopelang.Exp exp = definitionCompiler.compile(key, def, true);
      // A caller defines the first state of a variable of the subscope
      final Uid.ScopeVar var =
          translator.stateChain(subScopeKey.var).first();
      final Pos pos = key.pos();
      statements.add(
          scopelang.definition(pos,
              scopelang.subScopeVar(pos, calleeName, subScope, var),
              def.type, def.io, exp));
    });
    statements.add(scopelang.call(subScope.pos, calleeName, subScope));
  }

  /** Checks that the io of a variable of a subscope allows its
   * redefinition by the caller. */
  private static void checkRedefinition(
      Desugared.ScopeDefKey.SubScopeVar key, Desugared.ScopeDef def) {
    switch (def.io.input) {
    case NO_INPUT:
      final List<CompileException.Span> spans = new ArrayList<>();
      spans.add(
          new CompileException.Span("Incriminated subscope:",
              key.subScope.pos));
      spans.add(new CompileException.Span("Incriminated variable:", key.pos()));
      def.rules.keySet().forEach(rule ->
          spans.add(
              new CompileException.Span(
                  "Incriminated subscope variable definition:", rule.pos)));
      throw new CompileException("It is impossible to give a definition to "
          + "a subscope variable not tagged as input or context.", spans);
    case ONLY_INPUT:
      if (def.rules.isEmpty() && !def.isCondition) {
        throw new CompileException("This subscope variable is a mandatory "
            + "input but no definition was provided.",
            ImmutableList.of(
                new CompileException.Span("Incriminated subscope:",
                    key.subScope.pos),
                new CompileException.Span("Incriminated variable:",
                    key.pos())));
      }
      break;
    default:
      break;
    }
  }

  /** Returns the signature of a scope: one entry for each lowered
   * variable. */
  private ImmutableMap<Uid.ScopeVar, Scopelang.SigEntry> signature(
      Desugared.Scope scope) {
    final Map<Uid.ScopeVar, Scopelang.SigEntry> signature =
        new LinkedHashMap<>();
    scope.vars.forEach((var, states) -> {
      final StateChain chain = translator.stateChain(var);
      if (states.isEmpty()) {
        final Desugared.ScopeDef def =
            scope.def(Desugared.ScopeDefKey.of(var, null));
        signature.put(chain.get(null),
            new Scopelang.SigEntry(def.type, def.io));
      } else {
        for (Uid.StateName state : states) {
          final Desugared.ScopeDef def =
              scope.def(Desugared.ScopeDefKey.of(var, state));
          signature.put(chain.get(state),
              new Scopelang.SigEntry(def.type, def.io));
        }
      }
    });
    return ImmutableMap.copyOf(signature);
  }
}

// End ScopeCompiler.java
