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
package net.hydromatic.defeasible;

import static net.hydromatic.defeasible.ast.DesugaredBuilder.desugared;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import net.hydromatic.defeasible.ast.DeclContext;
import net.hydromatic.defeasible.ast.Desugared;
import net.hydromatic.defeasible.ast.Operator;
import net.hydromatic.defeasible.ast.Pos;
import net.hydromatic.defeasible.ast.Scopelang;
import net.hydromatic.defeasible.ast.Uid;
import net.hydromatic.defeasible.compile.NameGenerator;
import net.hydromatic.defeasible.compile.ProgramCompiler;
import net.hydromatic.defeasible.compile.Prop;
import net.hydromatic.defeasible.compile.Tracer;
import net.hydromatic.defeasible.compile.Tracers;
import net.hydromatic.defeasible.type.Type;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Builds identifiers, expressions and rules for tests, and compiles
 * programs.
 *
 * <p>Every identifier comes from the same {@link NameGenerator}, and every
 * call to {@link #pos()} returns a position on a new line, so that
 * diagnostics can be checked by position.
 */
public class Fixture {
  public final NameGenerator names = new NameGenerator();
  private final Map<Prop, Object> propMap = new HashMap<>();
  private Tracer tracer = Tracers.empty();
  private int line = 0;

  /** Returns a position on a new line. */
  public Pos pos() {
    ++line;
    return Pos.of("test", line, 1, 10);
  }

  /** Sets a property for subsequent compilations. */
  @CanIgnoreReturnValue
  public Fixture with(Prop prop, Object value) {
    prop.set(propMap, value);
    return this;
  }

  /** Sets the tracer for subsequent compilations. */
  @CanIgnoreReturnValue
  public Fixture withTracer(Tracer tracer) {
    this.tracer = tracer;
    return this;
  }

  public Map<Prop, Object> props() {
    return ImmutableMap.copyOf(propMap);
  }

  public Uid.ScopeName scopeName(String name) {
    return names.scopeName(name, pos());
  }

  public Uid.ScopeVar var(String name) {
    return names.scopeVar(name, pos());
  }

  public Uid.StateName state(String name) {
    return names.stateName(name, pos());
  }

  public Uid.SubScopeName subScope(String name) {
    return names.subScopeName(name, pos());
  }

  public Uid.Var param(String name) {
    return names.var(name, pos());
  }

  public Desugared.Literal bool(boolean b) {
    return desugared.boolLiteral(pos(), b);
  }

  public Desugared.Literal integer(long i) {
    return desugared.intLiteral(pos(), i);
  }

  public Desugared.Exp ref(Uid.ScopeVar var) {
    return desugared.scopeVar(pos(), var);
  }

  public Desugared.Exp ref(Uid.ScopeVar var, Uid.StateName state) {
    return desugared.scopeVar(pos(), var, state);
  }

  public Desugared.Exp ref(Uid.Var var) {
    return desugared.id(pos(), var);
  }

  public Desugared.Exp ref(Uid.ScopeName scope, Uid.SubScopeName subScope,
      Uid.ScopeVar var) {
    return desugared.subScopeVar(pos(), scope, subScope, var);
  }

  public Desugared.Exp call(Operator operator, Desugared.Exp... args) {
    return desugared.call(pos(), operator, args);
  }

  /** Creates a rule that is not an exception and has no parameter. */
  public Desugared.Rule rule(String name, Desugared.Exp justification,
      Desugared.Exp consequence) {
    return rule(name, justification, consequence, new Uid.RuleName[0]);
  }

  /** Creates a rule that is an exception to the given rules. */
  public Desugared.Rule rule(String name, Desugared.Exp justification,
      Desugared.Exp consequence, Uid.RuleName... exceptionTo) {
    return new Desugared.Rule(names.ruleName(name, pos()), justification,
        consequence, null, ImmutableSet.copyOf(exceptionTo));
  }

  /** Creates a rule of a function definition. */
  public Desugared.Rule fnRule(String name, Uid.Var param, Type paramType,
      Desugared.Exp justification, Desugared.Exp consequence,
      Uid.RuleName... exceptionTo) {
    return new Desugared.Rule(names.ruleName(name, pos()), justification,
        consequence, new Desugared.Param(param, paramType),
        ImmutableSet.copyOf(exceptionTo));
  }

  /** Creates a definition that consists of the given rules. */
  public Map<Uid.RuleName, Desugared.Rule> ruleMap(Desugared.Rule... rules) {
    final Map<Uid.RuleName, Desugared.Rule> map = new LinkedHashMap<>();
    Arrays.asList(rules).forEach(rule -> map.put(rule.id, rule));
    return map;
  }

  public Desugared.Program program(Desugared.Scope... scopes) {
    final Map<Uid.ScopeName, Desugared.Scope> map = new LinkedHashMap<>();
    for (Desugared.Scope scope : scopes) {
      map.put(scope.name, scope);
    }
    return new Desugared.Program(map, DeclContext.EMPTY);
  }

  /** Compiles a program; returns null if the tracer handled an error. */
  public Scopelang.@Nullable Program compile(Desugared.Program program) {
    return ProgramCompiler.create(names, propMap, tracer).compile(program);
  }

  /** Compiles a program that consists of the given scopes. */
  public Scopelang.@Nullable Program compile(Desugared.Scope... scopes) {
    return compile(program(scopes));
  }

  /** Compiles and evaluates. */
  public Evaluator evaluator(Desugared.Scope... scopes) {
    final Scopelang.Program program = compile(scopes);
    if (program == null) {
      throw new AssertionError("compilation failed");
    }
    return new Evaluator(program);
  }
}

// End Fixture.java
