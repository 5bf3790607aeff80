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
package net.hydromatic.defeasible.ast;

import static net.hydromatic.defeasible.ast.ScopelangBuilder.scopelang;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasToString;
import static org.hamcrest.Matchers.nullValue;
import static org.hamcrest.Matchers.sameInstance;
import static org.hamcrest.core.Is.is;

import com.google.common.collect.ImmutableList;
import java.math.BigInteger;
import net.hydromatic.defeasible.type.PrimitiveType;
import org.junit.jupiter.api.Test;

/** Tests for {@link ScopelangBuilder}, in particular the simplification
 * of default terms. */
public class ScopelangBuilderTest {
  private static final Pos POS = Pos.of("test", 1, 1, 2);

  private static Scopelang.Exp integer(long i) {
    return scopelang.literal(POS, Op.INT_LITERAL, BigInteger.valueOf(i));
  }

  private static Scopelang.Exp bool(boolean b) {
    return scopelang.boolLiteral(POS, b);
  }

  private static Scopelang.Exp var(String name) {
    return scopelang.scopeVar(POS, new Uid.ScopeVar(name, 0, POS));
  }

  /** A default with no exceptions and a justification that is true is its
   * consequence. */
  @Test void testTrueWithoutExceptions() {
    final Scopelang.Exp consequence = integer(42);
    assertThat(
        scopelang.simplifiedDefault(POS, ImmutableList.of(), bool(true),
            consequence),
        sameInstance(consequence));
  }

  /** A default whose justification is true absorbs a consequence that is a
   * default without exceptions. */
  @Test void testTrueAbsorbsInner() {
    final Scopelang.Exp inner =
        scopelang.defaultExp(POS, ImmutableList.of(), var("c"), integer(1));
    assertThat(
        scopelang.simplifiedDefault(POS, ImmutableList.of(var("e")),
            bool(true), inner),
        hasToString("<e | c :- 1>"));
  }

  /** A default with one exception and a justification that is false is that
   * exception. */
  @Test void testFalseWithOneException() {
    final Scopelang.Exp exception =
        scopelang.defaultExp(POS, ImmutableList.of(), var("c"), integer(1));
    assertThat(
        scopelang.simplifiedDefault(POS, ImmutableList.of(exception),
            bool(false), scopelang.emptyLiteral(POS)),
        sameInstance(exception));
    // Not with two exceptions
    assertThat(
        scopelang.simplifiedDefault(POS,
            ImmutableList.of(exception, integer(2)), bool(false),
            scopelang.emptyLiteral(POS)),
        hasToString("<<c :- 1>, 2 | false :- empty>"));
  }

  /** A justification that is not a literal is never simplified. */
  @Test void testUnknownJustification() {
    assertThat(
        scopelang.simplifiedDefault(POS, ImmutableList.of(), var("c"),
            integer(1)),
        hasToString("<c :- 1>"));
  }

  /** Log events are transparent, except the one that records which rule
   * applied. */
  @Test void testBoolValue() {
    assertThat(scopelang.boolValue(bool(true)), is(true));
    assertThat(scopelang.boolValue(bool(false)), is(false));
    assertThat(scopelang.boolValue(var("c")), nullValue());
    assertThat(
        scopelang.boolValue(
            scopelang.log(POS, Operator.LogEntry.VAR_DEF, bool(true))),
        is(true));
    final Scopelang.Exp recorded =
        scopelang.log(POS, Operator.LogEntry.POS_RECORD_IF_TRUE_BOOL,
            bool(true));
    assertThat(scopelang.boolValue(recorded), nullValue());
    assertThat(recorded,
        hasToString("log[pos_record_if_true_bool](true)"));
    assertThat(
        scopelang.simplifiedDefault(POS, ImmutableList.of(), recorded,
            integer(1)),
        hasToString("<log[pos_record_if_true_bool](true) :- 1>"));
  }

  @Test void testStatements() {
    final Uid.ScopeName scope = new Uid.ScopeName("Tax", 0, POS);
    final Uid.SubScopeName sub = new Uid.SubScopeName("sub", 0, POS);
    final Uid.ScopeVar income = new Uid.ScopeVar("income", 0, POS);
    final Scopelang.Statement definition =
        scopelang.definition(POS,
            scopelang.subScopeVar(POS, scope, sub, income),
            PrimitiveType.INTEGER, Io.INPUT,
            integer(3));
    assertThat(definition, hasToString("let sub.income: integer = 3"));
    assertThat(scopelang.call(POS, scope, sub), hasToString("call Tax[sub]"));
    assertThat(scopelang.assertion(POS, bool(true)),
        hasToString("assert true"));
  }
}

// End ScopelangBuilderTest.java
