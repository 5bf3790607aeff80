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
import java.util.Map;
import net.hydromatic.defeasible.ast.Uid;
import net.hydromatic.defeasible.util.Static;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * The lowered variables of a scope variable.
 *
 * <p>A variable that has a single state is lowered to one variable; a
 * variable that has several states is lowered to one variable per state.
 */
public abstract class StateChain {
  private StateChain() {}

  /** Creates a chain for a variable that has a single state. */
  public static StateChain whole(Uid.ScopeVar var) {
    return new WholeVar(var);
  }

  /** Creates a chain for a variable that has several states; the map must
   * be in the order of the states. */
  public static StateChain states(Map<Uid.StateName, Uid.ScopeVar> vars) {
    return new States(vars);
  }

  /** Returns the lowered variable of a given state; if {@code state} is
   * null, of the last state. */
  public abstract Uid.ScopeVar get(Uid.@Nullable StateName state);

  /** Returns the lowered variable that holds the final value. */
  public Uid.ScopeVar last() {
    return get(null);
  }

  /** Returns the lowered variable that a caller defines. */
  public abstract Uid.ScopeVar first();

  /** Chain of a variable that has a single state. */
  public static class WholeVar extends StateChain {
    public final Uid.ScopeVar var;

    WholeVar(Uid.ScopeVar var) {
      this.var = requireNonNull(var);
    }

    @Override
    public Uid.ScopeVar get(Uid.@Nullable StateName state) {
      if (state != null) {
        throw new IllegalStateException("variable " + var
            + " has no state " + state);
      }
      return var;
    }

    @Override
    public Uid.ScopeVar first() {
      return var;
    }

    @Override
    public String toString() {
      return var.toString();
    }
  }

  /** Chain of a variable that has several states. */
  public static class States extends StateChain {
    public final ImmutableMap<Uid.StateName, Uid.ScopeVar> vars;

    States(Map<Uid.StateName, Uid.ScopeVar> vars) {
      this.vars = ImmutableMap.copyOf(vars);
      if (this.vars.isEmpty()) {
        throw new IllegalArgumentException("no states");
      }
    }

    @Override
    public Uid.ScopeVar get(Uid.@Nullable StateName state) {
      if (state == null) {
        return Static.last(vars.values().asList());
      }
      final Uid.ScopeVar var = vars.get(state);
      if (var == null) {
        throw new IllegalStateException("unknown state " + state);
      }
      return var;
    }

    @Override
    public Uid.ScopeVar first() {
      return vars.values().asList().get(0);
    }

    @Override
    public String toString() {
      return vars.toString();
    }
  }
}

// End StateChain.java
