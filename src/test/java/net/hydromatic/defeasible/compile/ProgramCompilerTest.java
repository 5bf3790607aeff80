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

import static net.hydromatic.defeasible.Matchers.throwsA;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.hasToString;
import static org.hamcrest.Matchers.notNullValue;
import static org.hamcrest.Matchers.nullValue;
import static org.hamcrest.core.Is.is;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import net.hydromatic.defeasible.Fixture;
import net.hydromatic.defeasible.ast.DeclContext;
import net.hydromatic.defeasible.ast.Desugared;
import net.hydromatic.defeasible.ast.Io;
import net.hydromatic.defeasible.ast.ScopeBuilder;
import net.hydromatic.defeasible.ast.Scopelang;
import net.hydromatic.defeasible.ast.Uid;
import net.hydromatic.defeasible.type.PrimitiveType;
import org.junit.jupiter.api.Test;

/** Tests for {@link ProgramCompiler}. */
public class ProgramCompilerTest {
  private static Desugared.Scope statefulScope(Fixture f) {
    final Uid.ScopeVar x = f.var("x");
    final Uid.StateName before = f.state("before");
    final Uid.StateName after = f.state("after");
    return ScopeBuilder.create(f.scopeName("S"))
        .var(x, PrimitiveType.INTEGER, Io.OUTPUT, false,
            ImmutableList.of(before, after))
        .rule(Desugared.ScopeDefKey.of(x, before),
            f.rule("r1", f.bool(true), f.integer(1)))
        .rule(Desugared.ScopeDefKey.of(x, after),
            f.rule("r2", f.bool(true), f.ref(x, before)))
        .build();
  }

  /** Each state of a variable has its own lowered variable, named after the
   * variable and the state. */
  @Test void testStateNames() {
    final Fixture f = new Fixture().with(Prop.LOG_RULE_DECISIONS, false);
    final Scopelang.Program program = f.compile(statefulScope(f));
    assertThat(program, notNullValue());
    final Scopelang.ScopeDecl decl =
        program.scopes.values().iterator().next();
    assertThat(decl.signature.keySet(),
        hasToString("[x_before, x_after]"));
    assertThat(decl.statements,
        hasToString("[let x_before: integer = 1, "
            + "let x_after: integer = x_before]"));
    assertThat(program.declContext, is(DeclContext.EMPTY));
  }

  @Test void testStateSeparator() {
    final Fixture f = new Fixture()
        .with(Prop.LOG_RULE_DECISIONS, false)
        .with(Prop.STATE_SEPARATOR, "#");
    final Scopelang.Program program = f.compile(statefulScope(f));
    assertThat(program, notNullValue());
    assertThat(program.scopes.values().iterator().next().signature.keySet(),
        hasToString("[x#before, x#after]"));
  }

  /** The tracer sees the rule trees, the order and the lowered scope. */
  @Test void testTracer() {
    final List<String> events = new ArrayList<>();
    Tracer tracer = Tracers.empty();
    tracer = Tracers.withOnRuleTree(tracer, (key, forest) ->
        events.add("tree " + key + " " + forest));
    tracer = Tracers.withOnOrder(tracer, (scope, order) ->
        events.add("order " + scope + " " + order));
    tracer = Tracers.withOnScopeDecl(tracer, decl ->
        events.add("decl " + decl.name));
    final Fixture f = new Fixture().withTracer(tracer);
    assertThat(f.compile(statefulScope(f)), notNullValue());
    assertThat(events,
        hasToString("[order S [x@before, x@after], "
            + "tree x@before [[r1]], "
            + "tree x@after [[r2]], "
            + "decl S]"));
  }

  /** If the tracer handles an error, compilation returns null. */
  @Test void testHandledError() {
    final List<CompileException> errors = new ArrayList<>();
    final Fixture f = new Fixture();
    f.withTracer(Tracers.withOnCompileException(Tracers.empty(), errors::add));
    final Uid.ScopeVar a = f.var("a");
    final Desugared.Scope scope =
        ScopeBuilder.create(f.scopeName("S"))
            .var(a, PrimitiveType.INTEGER, Io.OUTPUT)
            .rule(Desugared.ScopeDefKey.of(a, null),
                f.rule("ra", f.bool(true), f.ref(a)))
            .build();
    assertThat(f.compile(scope), nullValue());
    assertThat(errors, hasSize(1));
    assertThat(errors.get(0),
        throwsA("Cyclic dependency detected between variables of scope S!"));

    // After a successful compilation, the handler is not called
    assertThat(f.compile(statefulScope(f)), notNullValue());
    assertThat(errors, hasSize(1));
  }
}

// End ProgramCompilerTest.java
