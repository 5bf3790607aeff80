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
import static net.hydromatic.defeasible.ast.DesugaredBuilder.desugared;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasToString;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import net.hydromatic.defeasible.Fixture;
import net.hydromatic.defeasible.ast.Desugared;
import net.hydromatic.defeasible.ast.Operator;
import net.hydromatic.defeasible.ast.Uid;
import net.hydromatic.defeasible.type.PrimitiveType;
import net.hydromatic.defeasible.type.Type;
import org.junit.jupiter.api.Test;

/** Tests for {@link ExpTranslator}. */
public class ExpTranslatorTest {
  /** Reads of a variable go to its lowered variables: the given state, or
   * the last. */
  @Test void testScopeVars() {
    final Fixture f = new Fixture();
    final Uid.ScopeVar x = f.var("x");
    final Uid.StateName s1 = f.state("s1");
    final Uid.StateName s2 = f.state("s2");
    final Uid.ScopeVar y = f.var("y");
    final ExpTranslator translator =
        ExpTranslator.of(f.names,
            ImmutableMap.of(
                x, StateChain.states(
                    ImmutableMap.of(s1, f.var("x_s1"), s2, f.var("x_s2"))),
                y, StateChain.whole(f.var("y_lowered"))));
    assertThat(translator.translate(f.ref(x, s1)), hasToString("x_s1"));
    assertThat(translator.translate(f.ref(x)), hasToString("x_s2"));
    assertThat(
        translator.translate(
            f.call(Operator.PLUS, f.ref(y), f.ref(x, s2))),
        hasToString("(y_lowered + x_s2)"));

    // A variable of a subscope is read at its last state
    final Uid.ScopeName callee = f.scopeName("Callee");
    final Uid.SubScopeName sub = f.subScope("sub");
    assertThat(translator.translate(f.ref(callee, sub, x)),
        hasToString("sub.x_s2"));

    final Uid.ScopeVar z = f.var("z");
    final IllegalStateException e =
        assertThrows(IllegalStateException.class,
            () -> translator.translate(f.ref(z)));
    assertThat(e, throwsA("no lowered variable for z"));
  }

  /** A function gets fresh parameters, and its body refers to them. */
  @Test void testFn() {
    final Fixture f = new Fixture();
    final ExpTranslator translator = ExpTranslator.of(f.names,
        ImmutableMap.of());
    final Uid.Var p = f.param("p");
    final Desugared.Exp fn =
        desugared.fn(f.pos(), ImmutableList.of(p),
            ImmutableList.<Type>of(PrimitiveType.INTEGER),
            f.call(Operator.TIMES, f.ref(p), f.integer(2)));
    assertThat(translator.translate(fn),
        hasToString("fun (p_1: integer) -> (p_1 * 2)"));
    // Each translation gets new parameters
    assertThat(translator.translate(fn),
        hasToString("fun (p_2: integer) -> (p_2 * 2)"));
  }

  /** A bound variable that is not in scope is an error. */
  @Test void testUnboundVar() {
    final Fixture f = new Fixture();
    final ExpTranslator translator = ExpTranslator.of(f.names,
        ImmutableMap.of());
    final Uid.Var p = f.param("p");
    final IllegalStateException e =
        assertThrows(IllegalStateException.class,
            () -> translator.translate(f.ref(p)));
    assertThat(e, throwsA("unbound variable p"));
    assertThat(translator.withVar(p, f.param("q")).translate(f.ref(p)),
        hasToString("q"));
  }

  /** Structures, enumerations and conditionals keep their shape. */
  @Test void testShapes() {
    final Fixture f = new Fixture();
    final ExpTranslator translator = ExpTranslator.of(f.names,
        ImmutableMap.of());
    final Uid.StructName point = f.names.structName("Point", f.pos());
    final Uid.FieldName fx = f.names.fieldName("fx", f.pos());
    final Uid.FieldName fy = f.names.fieldName("fy", f.pos());
    final Desugared.Exp struct =
        desugared.struct(f.pos(), point,
            ImmutableMap.<Uid.FieldName, Desugared.Exp>of(fx, f.integer(1),
                fy, f.integer(2)));
    assertThat(translator.translate(struct),
        hasToString("Point {fx = 1; fy = 2}"));
    assertThat(
        translator.translate(
            desugared.structAccess(f.pos(), struct, point, fy)),
        hasToString("Point {fx = 1; fy = 2}.fy"));
    assertThat(
        translator.translate(
            desugared.ifThenElse(f.pos(), f.bool(true),
                desugared.array(f.pos(),
                    ImmutableList.of(f.integer(1), f.integer(2))),
                desugared.array(f.pos(), ImmutableList.of()))),
        hasToString("if true then [1; 2] else []"));
    assertThat(
        translator.translate(
            desugared.defaultExp(f.pos(), ImmutableList.of(),
                f.bool(false), desugared.emptyLiteral(f.pos()))),
        hasToString("<false :- empty>"));
  }
}

// End ExpTranslatorTest.java
