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

import static net.hydromatic.defeasible.Matchers.hasSpanPositions;
import static net.hydromatic.defeasible.Matchers.throwsA;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasToString;
import static org.hamcrest.Matchers.lessThan;
import static org.hamcrest.core.Is.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import java.util.List;
import net.hydromatic.defeasible.Fixture;
import net.hydromatic.defeasible.ast.Desugared;
import net.hydromatic.defeasible.ast.Io;
import net.hydromatic.defeasible.ast.Operator;
import net.hydromatic.defeasible.ast.ScopeBuilder;
import net.hydromatic.defeasible.ast.Uid;
import net.hydromatic.defeasible.type.PrimitiveType;
import org.junit.jupiter.api.Test;

/** Tests for {@link ScopeDependencies}. */
public class ScopeDependenciesTest {
  /** Variables come after the variables they read, whatever the order in
   * which they are declared. */
  @Test void testOrder() {
    final Fixture f = new Fixture();
    final Uid.ScopeVar c = f.var("c");
    final Uid.ScopeVar b = f.var("b");
    final Uid.ScopeVar a = f.var("a");
    final Uid.ScopeVar d = f.var("d");
    final Desugared.Scope scope =
        ScopeBuilder.create(f.scopeName("S"))
            .var(c, PrimitiveType.INTEGER, Io.OUTPUT)
            .var(b, PrimitiveType.INTEGER, Io.INTERNAL)
            .var(a, PrimitiveType.INTEGER, Io.INTERNAL)
            .var(d, PrimitiveType.INTEGER, Io.INTERNAL)
            .rule(Desugared.ScopeDefKey.of(c, null),
                f.rule("rc", f.bool(true),
                    f.call(Operator.PLUS, f.ref(b), f.ref(d))))
            .rule(Desugared.ScopeDefKey.of(b, null),
                f.rule("rb", f.bool(true),
                    f.call(Operator.PLUS, f.ref(a), f.integer(1))))
            .rule(Desugared.ScopeDefKey.of(a, null),
                f.rule("ra", f.bool(true), f.integer(1)))
            .rule(Desugared.ScopeDefKey.of(d, null),
                f.rule("rd", f.bool(true), f.integer(2)))
            .build();
    final ScopeDependencies dependencies = ScopeDependencies.build(scope);
    final List<ScopeDependencies.Vertex> order = dependencies.order();
    // Among vertices that are ready, the first declared comes first
    assertThat(order, hasToString("[a, b, d, c]"));
    for (ScopeDependencies.Vertex vertex : dependencies.vertices()) {
      for (ScopeDependencies.Vertex dependency
          : dependencies.dependencies(vertex)) {
        assertThat(order.indexOf(dependency), lessThan(order.indexOf(vertex)));
      }
    }
    assertThat(
        dependencies.dependencies(ScopeDependencies.Vertex.var(c, null)),
        hasToString("[b, d]"));
  }

  /** A subscope is called after the variables that its inputs read, and
   * before the variables that read its outputs. */
  @Test void testSubScope() {
    final Fixture f = new Fixture();
    final Uid.ScopeName calleeName = f.scopeName("Callee");
    final Uid.ScopeVar in = f.var("in");
    final Uid.ScopeVar out = f.var("out");
    final Desugared.Scope callee =
        ScopeBuilder.create(calleeName)
            .var(in, PrimitiveType.INTEGER, Io.INPUT)
            .var(out, PrimitiveType.INTEGER, Io.OUTPUT)
            .build();
    final Uid.ScopeVar result = f.var("result");
    final Uid.ScopeVar arg = f.var("arg");
    final Uid.SubScopeName sub = f.subScope("sub");
    final Desugared.Scope scope =
        ScopeBuilder.create(f.scopeName("Caller"))
            .var(result, PrimitiveType.INTEGER, Io.OUTPUT)
            .var(arg, PrimitiveType.INTEGER, Io.INTERNAL)
            .subScope(sub, callee)
            .rule(Desugared.ScopeDefKey.of(result, null),
                f.rule("r1", f.bool(true), f.ref(calleeName, sub, out)))
            .rule(Desugared.ScopeDefKey.of(sub, in, f.pos()),
                f.rule("r2", f.bool(true), f.ref(arg)))
            .rule(Desugared.ScopeDefKey.of(arg, null),
                f.rule("r3", f.bool(true), f.integer(7)))
            .build();
    final ScopeDependencies dependencies = ScopeDependencies.build(scope);
    assertThat(dependencies.order(), hasToString("[arg, call sub, result]"));
  }

  /** States of a variable are distinct vertices; a state may read an
   * earlier one. */
  @Test void testStates() {
    final Fixture f = new Fixture();
    final Uid.ScopeVar x = f.var("x");
    final Uid.StateName s1 = f.state("s1");
    final Uid.StateName s2 = f.state("s2");
    final Uid.ScopeVar y = f.var("y");
    final Desugared.Scope scope =
        ScopeBuilder.create(f.scopeName("S"))
            .var(y, PrimitiveType.INTEGER, Io.OUTPUT)
            .var(x, PrimitiveType.INTEGER, Io.INTERNAL, false,
                ImmutableList.of(s1, s2))
            .rule(Desugared.ScopeDefKey.of(y, null),
                f.rule("ry", f.bool(true), f.ref(x)))
            .rule(Desugared.ScopeDefKey.of(x, s2),
                f.rule("r2", f.bool(true), f.ref(x, s1)))
            .rule(Desugared.ScopeDefKey.of(x, s1),
                f.rule("r1", f.bool(true), f.integer(1)))
            .build();
    final ScopeDependencies dependencies = ScopeDependencies.build(scope);
    assertThat(dependencies.order(), hasToString("[x@s1, x@s2, y]"));
    // A read without a state depends on the last state
    assertThat(
        dependencies.dependencies(ScopeDependencies.Vertex.var(y, null)),
        hasToString("[x@s2]"));
  }

  /** Variables that read each other are a cycle; the error points to each
   * variable and each read. */
  @Test void testCycle() {
    final Fixture f = new Fixture();
    final Uid.ScopeVar a = f.var("a");
    final Uid.ScopeVar b = f.var("b");
    final Desugared.Exp readB = f.ref(b);
    final Desugared.Exp readA = f.ref(a);
    final Desugared.Scope scope =
        ScopeBuilder.create(f.scopeName("S"))
            .var(a, PrimitiveType.INTEGER, Io.OUTPUT)
            .var(b, PrimitiveType.INTEGER, Io.OUTPUT)
            .rule(Desugared.ScopeDefKey.of(a, null),
                f.rule("ra", f.bool(true), readB))
            .rule(Desugared.ScopeDefKey.of(b, null),
                f.rule("rb", f.bool(true), readA))
            .build();
    final ScopeDependencies dependencies = ScopeDependencies.build(scope);
    final CompileException e =
        assertThrows(CompileException.class, dependencies::order);
    assertThat(e,
        throwsA("Cyclic dependency detected between variables of scope S!"));
    assertThat(e,
        hasSpanPositions(
            ImmutableList.of(a.pos, readA.pos, b.pos, readB.pos)));
    assertThat(e.spans.get(0).label, is("Cycle variable a, declared:"));
    assertThat(e.spans.get(1).label,
        is("Used here in the definition of another cycle variable b:"));
  }

  /** A variable that reads itself is a cycle. */
  @Test void testSelfCycle() {
    final Fixture f = new Fixture();
    final Uid.ScopeVar a = f.var("a");
    final Desugared.Scope scope =
        ScopeBuilder.create(f.scopeName("S"))
            .var(a, PrimitiveType.INTEGER, Io.OUTPUT)
            .rule(Desugared.ScopeDefKey.of(a, null),
                f.rule("ra", f.bool(true), f.ref(a)))
            .build();
    final CompileException e =
        assertThrows(CompileException.class,
            () -> ScopeDependencies.build(scope).checkAcyclic());
    assertThat(e,
        throwsA("Cyclic dependency detected between variables of scope S!"));
  }
}

// End ScopeDependenciesTest.java
