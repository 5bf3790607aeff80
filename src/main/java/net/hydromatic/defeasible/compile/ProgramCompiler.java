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

import com.google.common.collect.ImmutableMap;
import java.util.LinkedHashMap;
import java.util.Map;
import net.hydromatic.defeasible.ast.Desugared;
import net.hydromatic.defeasible.ast.Scopelang;
import net.hydromatic.defeasible.ast.Uid;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Compiles a desugared program into the scope language.
 *
 * <p>First gives every variable of every scope its lowered variables (one per
 * state), then compiles each scope.
 */
public class ProgramCompiler {
  private final NameGenerator nameGenerator;
  private final ImmutableMap<Prop, Object> map;
  private final Tracer tracer;

  private ProgramCompiler(NameGenerator nameGenerator, Map<Prop, Object> map,
      Tracer tracer) {
    this.nameGenerator = requireNonNull(nameGenerator);
    this.map = ImmutableMap.copyOf(map);
    this.tracer = requireNonNull(tracer);
  }

  /**
   * Creates a compiler.
   *
   * @param nameGenerator Generator of identifiers; should be the one that
   *   generated the identifiers of the programs to be compiled
   * @param map Properties
   * @param tracer Receives events during compilation
   */
  public static ProgramCompiler create(NameGenerator nameGenerator,
      Map<Prop, Object> map, Tracer tracer) {
    return new ProgramCompiler(nameGenerator, map, tracer);
  }

  /**
   * Compiles a program.
   *
   * <p>If compilation fails, offers the exception to the tracer; returns
   * null if the tracer handled it, otherwise throws.
   *
   * @throws CompileException if compilation fails and the tracer does not
   *   handle the exception
   */
  public Scopelang.@Nullable Program compile(Desugared.Program program) {
    try {
      final ExpTranslator translator =
          ExpTranslator.of(nameGenerator, stateChains(program));
      final ScopeCompiler scopeCompiler =
          ScopeCompiler.create(translator, map, tracer);
      final Map<Uid.ScopeName, Scopelang.ScopeDecl> scopes =
          new LinkedHashMap<>();
      program.scopes.forEach((name, scope) ->
          scopes.put(name, scopeCompiler.compile(scope)));
      tracer.handleCompileException(null);
      return new Scopelang.Program(scopes, program.declContext);
    } catch (CompileException e) {
      if (!tracer.handleCompileException(e)) {
        throw e;
      }
      return null;
    }
  }

  /** Creates the lowered variables of each variable of each scope. */
  private ImmutableMap<Uid.ScopeVar, StateChain> stateChains(
      Desugared.Program program) {
    final String separator = Prop.STATE_SEPARATOR.stringValue(map);
    final ImmutableMap.Builder<Uid.ScopeVar, StateChain> b =
        ImmutableMap.builder();
    program.scopes.values().forEach(scope ->
        scope.vars.forEach((var, states) -> {
          if (states.isEmpty()) {
            b.put(var, StateChain.whole(nameGenerator.scopeVar(var.name,
                var.pos)));
          } else {
            final Map<Uid.StateName, Uid.ScopeVar> vars =
                new LinkedHashMap<>();
            for (Uid.StateName state : states) {
              vars.put(state,
                  nameGenerator.scopeVar(var.name + separator + state.name,
                      state.pos));
            }
            b.put(var, StateChain.states(vars));
          }
        }));
    return b.build();
  }
}

// End ProgramCompiler.java
