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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.defeasible.type.PrimitiveType;
import net.hydromatic.defeasible.type.Type;

/**
 * Builds a {@link Desugared.Scope}.
 *
 * <p>Declaring a variable creates an empty definition for it (one per
 * state); declaring a subscope creates an empty definition for each
 * variable of the called scope, through which the caller may redefine it.
 * Rules are then added to these definitions.
 */
public class ScopeBuilder {
  private final Uid.ScopeName name;
  private final Map<Uid.ScopeVar, ImmutableList<Uid.StateName>> vars =
      new LinkedHashMap<>();
  private final Map<Uid.SubScopeName, Uid.ScopeName> subScopes =
      new LinkedHashMap<>();
  private final Map<Desugared.ScopeDefKey, Desugared.ScopeDef> defs =
      new LinkedHashMap<>();
  private final List<Desugared.Exp> assertions = new ArrayList<>();

  private ScopeBuilder(Uid.ScopeName name) {
    this.name = requireNonNull(name);
  }

  /** Creates a builder for a scope with a given name. */
  public static ScopeBuilder create(Uid.ScopeName name) {
    return new ScopeBuilder(name);
  }

  /** Declares a variable that has a single state. */
  @CanIgnoreReturnValue
  public ScopeBuilder var(Uid.ScopeVar var, Type type, Io io) {
    return var(var, type, io, false, ImmutableList.of());
  }

  /** Declares a condition: a boolean variable that is false unless a rule
   * proves it true. */
  @CanIgnoreReturnValue
  public ScopeBuilder condition(Uid.ScopeVar var, Io io) {
    return var(var, PrimitiveType.BOOL, io, true, ImmutableList.of());
  }

  /** Declares a variable; if {@code states} is empty, the variable has a
   * single state. */
  @CanIgnoreReturnValue
  public ScopeBuilder var(Uid.ScopeVar var, Type type, Io io,
      boolean isCondition, List<Uid.StateName> states) {
    checkArgument(!vars.containsKey(var), "duplicate variable %s", var);
    vars.put(var, ImmutableList.copyOf(states));
    if (states.isEmpty()) {
      defs.put(Desugared.ScopeDefKey.of(var, null),
          new Desugared.ScopeDef(ImmutableMap.of(), type, io, isCondition));
    } else {
      for (Uid.StateName state : states) {
        defs.put(Desugared.ScopeDefKey.of(var, state),
            new Desugared.ScopeDef(ImmutableMap.of(), type, io, isCondition));
      }
    }
    return this;
  }

  /** Declares a call to another scope. */
  @CanIgnoreReturnValue
  public ScopeBuilder subScope(Uid.SubScopeName subScope,
      Desugared.Scope callee) {
    checkArgument(!subScopes.containsKey(subScope), "duplicate subscope %s",
        subScope);
    subScopes.put(subScope, callee.name);
    callee.vars.forEach((var, states) -> {
      final Desugared.ScopeDef calleeDef =
          callee.def(
              Desugared.ScopeDefKey.of(var,
                  states.isEmpty() ? null : states.get(0)));
      defs.put(Desugared.ScopeDefKey.of(subScope, var, subScope.pos),
          new Desugared.ScopeDef(ImmutableMap.of(), calleeDef.type,
              calleeDef.io, calleeDef.isCondition));
    });
    return this;
  }

  /** Adds a rule to the definition of a variable (or of one of its
   * states). */
  @CanIgnoreReturnValue
  public ScopeBuilder rule(Desugared.ScopeDefKey key, Desugared.Rule rule) {
    final Desugared.ScopeDef def = defs.get(key);
    checkArgument(def != null, "unknown definition %s", key);
    defs.put(key, def.plus(rule));
    return this;
  }

  /** Adds an assertion. */
  @CanIgnoreReturnValue
  public ScopeBuilder assertion(Desugared.Exp exp) {
    assertions.add(exp);
    return this;
  }

  public Desugared.Scope build() {
    return new Desugared.Scope(name, vars, subScopes, defs, assertions);
  }
}

// End ScopeBuilder.java
