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
import com.google.common.collect.ImmutableSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import net.hydromatic.defeasible.type.Type;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Desugared programs: scopes whose variables are defined by many
 * prioritized rules.
 *
 * <p>This is the input of the lowering. Expressions can refer to a given
 * state of a scope variable; rules carry their own justification, consequence
 * and the set of rules they are exceptions to.
 *
 * <p>This class functions as a namespace, so that we can keep the class names
 * short.
 */
public class Desugared {
  private Desugared() {}

  /** Base class of desugared expressions. */
  public abstract static class Exp extends AstNode {
    Exp(Pos pos, Op op) {
      super(pos, op);
    }

    /** Accepts a visitor, calling the {@link Visitor#visit} method
     * appropriate to the type of this node. */
    public abstract void accept(Visitor visitor);
  }

  /** Literal, including the empty value. */
  public static class Literal extends Exp {
    public final @Nullable Object value;

    Literal(Pos pos, Op op, @Nullable Object value) {
      super(pos, op);
      checkArgument(op.isLiteral());
      this.value = value;
    }

    @Override
    AstWriter unparse(AstWriter w) {
      return w.literal(op, value);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Reference to a variable of the current scope, optionally at a given
   * state. */
  public static class ScopeVarLocation extends Exp {
    public final Uid.ScopeVar var;
    public final Uid.@Nullable StateName state;

    ScopeVarLocation(Pos pos, Uid.ScopeVar var,
        Uid.@Nullable StateName state) {
      super(pos, Op.SCOPE_VAR_LOCATION);
      this.var = requireNonNull(var);
      this.state = state;
    }

    @Override
    AstWriter unparse(AstWriter w) {
      w.id(var);
      return state == null ? w : w.append("@").id(state);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Reference to a variable of a subscope (an output of the call). */
  public static class SubScopeVarLocation extends Exp {
    public final Uid.ScopeName scope;
    public final Uid.SubScopeName subScope;
    public final Uid.ScopeVar var;

    SubScopeVarLocation(Pos pos, Uid.ScopeName scope,
        Uid.SubScopeName subScope, Uid.ScopeVar var) {
      super(pos, Op.SUB_SCOPE_VAR_LOCATION);
      this.scope = requireNonNull(scope);
      this.subScope = requireNonNull(subScope);
      this.var = requireNonNull(var);
    }

    @Override
    AstWriter unparse(AstWriter w) {
      return w.id(subScope).append(".").id(var);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Reference to a bound variable. */
  public static class Id extends Exp {
    public final Uid.Var var;

    Id(Pos pos, Uid.Var var) {
      super(pos, Op.VAR);
      this.var = requireNonNull(var);
    }

    @Override
    AstWriter unparse(AstWriter w) {
      return w.id(var);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Structure value, e.g. "{@code Person {age = 3; name = "x"}}". */
  public static class Struct extends Exp {
    public final Uid.StructName name;
    public final ImmutableMap<Uid.FieldName, Exp> fields;

    Struct(Pos pos, Uid.StructName name, Map<Uid.FieldName, Exp> fields) {
      super(pos, Op.STRUCT);
      this.name = requireNonNull(name);
      this.fields = ImmutableMap.copyOf(fields);
    }

    @Override
    AstWriter unparse(AstWriter w) {
      return w.id(name).append(" {").map(fields, " = ", "; ").append("}");
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Access to a field of a structure. */
  public static class StructAccess extends Exp {
    public final Exp exp;
    public final Uid.StructName name;
    public final Uid.FieldName field;

    StructAccess(Pos pos, Exp exp, Uid.StructName name,
        Uid.FieldName field) {
      super(pos, Op.STRUCT_ACCESS);
      this.exp = requireNonNull(exp);
      this.name = requireNonNull(name);
      this.field = requireNonNull(field);
    }

    @Override
    AstWriter unparse(AstWriter w) {
      return w.append(exp).append(".").id(field);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Injection of a value into a constructor of an enumeration. */
  public static class EnumInj extends Exp {
    public final Exp exp;
    public final Uid.EnumName name;
    public final Uid.ConstructorName constructor;

    EnumInj(Pos pos, Exp exp, Uid.EnumName name,
        Uid.ConstructorName constructor) {
      super(pos, Op.ENUM_INJ);
      this.exp = requireNonNull(exp);
      this.name = requireNonNull(name);
      this.constructor = requireNonNull(constructor);
    }

    @Override
    AstWriter unparse(AstWriter w) {
      return w.id(constructor).append(" ").append(exp);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Pattern match on an enumeration; each arm is a function of the
   * constructor's payload. */
  public static class Match extends Exp {
    public final Exp exp;
    public final Uid.EnumName name;
    public final ImmutableMap<Uid.ConstructorName, Exp> arms;

    Match(Pos pos, Exp exp, Uid.EnumName name,
        Map<Uid.ConstructorName, Exp> arms) {
      super(pos, Op.MATCH);
      this.exp = requireNonNull(exp);
      this.name = requireNonNull(name);
      this.arms = ImmutableMap.copyOf(arms);
    }

    @Override
    AstWriter unparse(AstWriter w) {
      return w.append("match ").append(exp).append(" with ")
          .map(arms, " -> ", " | ");
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Function abstraction. */
  public static class Fn extends Exp {
    public final ImmutableList<Uid.Var> params;
    public final ImmutableList<Type> paramTypes;
    public final Exp body;

    Fn(Pos pos, List<Uid.Var> params, List<Type> paramTypes, Exp body) {
      super(pos, Op.FN);
      this.params = ImmutableList.copyOf(params);
      this.paramTypes = ImmutableList.copyOf(paramTypes);
      this.body = requireNonNull(body);
      checkArgument(this.params.size() == this.paramTypes.size());
    }

    @Override
    AstWriter unparse(AstWriter w) {
      w.append("fun (");
      for (int i = 0; i < params.size(); i++) {
        w.append(i == 0 ? "" : ", ").id(params.get(i)).append(": ")
            .append(paramTypes.get(i).description());
      }
      return w.append(") -> ").append(body);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Function application. */
  public static class Apply extends Exp {
    public final Exp fn;
    public final ImmutableList<Exp> args;

    Apply(Pos pos, Exp fn, List<Exp> args) {
      super(pos, Op.APPLY);
      this.fn = requireNonNull(fn);
      this.args = ImmutableList.copyOf(args);
    }

    @Override
    AstWriter unparse(AstWriter w) {
      return w.apply(fn, args);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Reference to a built-in operator. */
  public static class OperatorRef extends Exp {
    public final Operator operator;
    public final Operator.@Nullable LogEntry logEntry;

    OperatorRef(Pos pos, Operator operator,
        Operator.@Nullable LogEntry logEntry) {
      super(pos, Op.OPERATOR);
      this.operator = requireNonNull(operator);
      this.logEntry = logEntry;
      checkArgument((operator == Operator.LOG) == (logEntry != null));
    }

    @Override
    AstWriter unparse(AstWriter w) {
      return w.operator(operator, logEntry);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Default term, written in the source language as a nested expression. */
  public static class Default extends Exp {
    public final ImmutableList<Exp> exceptions;
    public final Exp justification;
    public final Exp consequence;

    Default(Pos pos, List<Exp> exceptions, Exp justification,
        Exp consequence) {
      super(pos, Op.DEFAULT);
      this.exceptions = ImmutableList.copyOf(exceptions);
      this.justification = requireNonNull(justification);
      this.consequence = requireNonNull(consequence);
    }

    @Override
    AstWriter unparse(AstWriter w) {
      return w.defaultTerm(exceptions, justification, consequence);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** "If ... then ... else ..." expression. */
  public static class If extends Exp {
    public final Exp condition;
    public final Exp ifTrue;
    public final Exp ifFalse;

    If(Pos pos, Exp condition, Exp ifTrue, Exp ifFalse) {
      super(pos, Op.IF);
      this.condition = requireNonNull(condition);
      this.ifTrue = requireNonNull(ifTrue);
      this.ifFalse = requireNonNull(ifFalse);
    }

    @Override
    AstWriter unparse(AstWriter w) {
      return w.append("if ").append(condition).append(" then ")
          .append(ifTrue).append(" else ").append(ifFalse);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Array value. */
  public static class Array extends Exp {
    public final ImmutableList<Exp> elements;

    Array(Pos pos, List<Exp> elements) {
      super(pos, Op.ARRAY);
      this.elements = ImmutableList.copyOf(elements);
    }

    @Override
    AstWriter unparse(AstWriter w) {
      return w.append("[").list(elements, "; ").append("]");
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Raises "no value provided" if its argument is empty. */
  public static class ErrorOnEmpty extends Exp {
    public final Exp exp;

    ErrorOnEmpty(Pos pos, Exp exp) {
      super(pos, Op.ERROR_ON_EMPTY);
      this.exp = requireNonNull(exp);
    }

    @Override
    AstWriter unparse(AstWriter w) {
      return w.append("error_on_empty(").append(exp).append(")");
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Parameter of a rule that defines a function. */
  public static class Param {
    public final Uid.Var var;
    public final Type type;

    public Param(Uid.Var var, Type type) {
      this.var = requireNonNull(var);
      this.type = requireNonNull(type);
    }

    @Override
    public String toString() {
      return var + ": " + type;
    }
  }

  /**
   * Rule: one definition of a scope variable.
   *
   * <p>The consequence applies if the justification holds, unless a rule
   * that is an exception to this rule applies.
   */
  public static class Rule {
    public final Uid.RuleName id;
    public final Exp justification;
    public final Exp consequence;
    public final @Nullable Param parameter;
    /** Rules that this rule is an exception to; empty if it is not an
     * exception. */
    public final ImmutableSet<Uid.RuleName> exceptionTo;

    public Rule(Uid.RuleName id, Exp justification, Exp consequence,
        @Nullable Param parameter, Set<Uid.RuleName> exceptionTo) {
      this.id = requireNonNull(id);
      this.justification = requireNonNull(justification);
      this.consequence = requireNonNull(consequence);
      this.parameter = parameter;
      this.exceptionTo = ImmutableSet.copyOf(exceptionTo);
    }

    /** Where the rule is declared. */
    public Pos pos() {
      return id.pos;
    }

    @Override
    public String toString() {
      return id + (parameter == null ? "" : " (" + parameter + ")")
          + ": " + justification + " => " + consequence
          + (exceptionTo.isEmpty() ? "" : " exception to " + exceptionTo);
    }
  }

  /** Key of a {@link ScopeDef}: what a set of rules defines. */
  public abstract static class ScopeDefKey {
    private ScopeDefKey() {}

    /** Returns the position of the defined variable. */
    public abstract Pos pos();

    /** Creates a key for a variable of this scope, optionally at a given
     * state. */
    public static Var of(Uid.ScopeVar var, Uid.@Nullable StateName state) {
      return new Var(var, state);
    }

    /** Creates a key for a variable of a subscope. */
    public static SubScopeVar of(Uid.SubScopeName subScope,
        Uid.ScopeVar var, Pos pos) {
      return new SubScopeVar(subScope, var, pos);
    }

    /** Definition of a variable (or of one state of a variable) of the
     * scope. */
    public static class Var extends ScopeDefKey {
      public final Uid.ScopeVar var;
      public final Uid.@Nullable StateName state;

      Var(Uid.ScopeVar var, Uid.@Nullable StateName state) {
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
            || o instanceof Var
                && ((Var) o).var.equals(var)
                && Objects.equals(((Var) o).state, state);
      }

      @Override
      public String toString() {
        return state == null ? var.toString() : var + "@" + state;
      }
    }

    /** Redefinition by the caller of a variable of a subscope. */
    public static class SubScopeVar extends ScopeDefKey {
      public final Uid.SubScopeName subScope;
      public final Uid.ScopeVar var;
      private final Pos pos;

      SubScopeVar(Uid.SubScopeName subScope, Uid.ScopeVar var, Pos pos) {
        this.subScope = requireNonNull(subScope);
        this.var = requireNonNull(var);
        this.pos = requireNonNull(pos);
      }

      @Override
      public Pos pos() {
        return pos;
      }

      @Override
      public int hashCode() {
        return Objects.hash(subScope, var);
      }

      @Override
      public boolean equals(Object o) {
        return o == this
            || o instanceof SubScopeVar
                && ((SubScopeVar) o).subScope.equals(subScope)
                && ((SubScopeVar) o).var.equals(var);
      }

      @Override
      public String toString() {
        return subScope + "." + var;
      }
    }
  }

  /** All the rules that define one {@link ScopeDefKey}, with the type, io
   * and kind of the defined variable. */
  public static class ScopeDef {
    /** Rules, in declaration order. May be empty. */
    public final ImmutableMap<Uid.RuleName, Rule> rules;
    public final Type type;
    public final Io io;
    /** Whether the variable is a condition: a boolean that is false unless
     * a rule proves it true. */
    public final boolean isCondition;

    public ScopeDef(Map<Uid.RuleName, Rule> rules, Type type, Io io,
        boolean isCondition) {
      this.rules = ImmutableMap.copyOf(rules);
      this.type = requireNonNull(type);
      this.io = requireNonNull(io);
      this.isCondition = isCondition;
    }

    /** Returns a copy of this definition with one more rule. */
    public ScopeDef plus(Rule rule) {
      checkArgument(!rules.containsKey(rule.id), "duplicate rule %s", rule.id);
      return new ScopeDef(
          ImmutableMap.<Uid.RuleName, Rule>builder().putAll(rules)
              .put(rule.id, rule).build(),
          type, io, isCondition);
    }
  }

  /** Scope: a named unit of computation. */
  public static class Scope {
    public final Uid.ScopeName name;
    /**
     * Variables of the scope, in declaration order, each with its states in
     * order. The list of states is empty if the variable has a single
     * state.
     */
    public final ImmutableMap<Uid.ScopeVar, ImmutableList<Uid.StateName>>
        vars;
    /** Subscopes, in declaration order, and the scope each one calls. */
    public final ImmutableMap<Uid.SubScopeName, Uid.ScopeName> subScopes;
    public final ImmutableMap<ScopeDefKey, ScopeDef> defs;
    public final ImmutableList<Exp> assertions;

    public Scope(Uid.ScopeName name,
        Map<Uid.ScopeVar, ImmutableList<Uid.StateName>> vars,
        Map<Uid.SubScopeName, Uid.ScopeName> subScopes,
        Map<ScopeDefKey, ScopeDef> defs, List<Exp> assertions) {
      this.name = requireNonNull(name);
      this.vars = ImmutableMap.copyOf(vars);
      this.subScopes = ImmutableMap.copyOf(subScopes);
      this.defs = ImmutableMap.copyOf(defs);
      this.assertions = ImmutableList.copyOf(assertions);
    }

    /** Returns the definition with a given key; throws if not found. */
    public ScopeDef def(ScopeDefKey key) {
      final ScopeDef def = defs.get(key);
      if (def == null) {
        throw new IllegalArgumentException("no definition " + key
            + " in scope " + name);
      }
      return def;
    }
  }

  /** Desugared program. */
  public static class Program {
    /** Scopes, in declaration order. */
    public final ImmutableMap<Uid.ScopeName, Scope> scopes;
    public final DeclContext declContext;

    public Program(Map<Uid.ScopeName, Scope> scopes,
        DeclContext declContext) {
      this.scopes = ImmutableMap.copyOf(scopes);
      this.declContext = requireNonNull(declContext);
    }
  }
}

// End Desugared.java
