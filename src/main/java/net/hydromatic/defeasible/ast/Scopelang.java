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
import java.util.List;
import java.util.Map;
import java.util.Objects;
import net.hydromatic.defeasible.type.Type;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Scope language: the lowered calculus.
 *
 * <p>Every variable of a scope has exactly one definition, whose priorities
 * are expressed by nested {@link Default} terms. A scope is a list of
 * statements in execution order.
 *
 * <p>This class functions as a namespace, so that we can keep the class names
 * short.
 */
public class Scopelang {
  private Scopelang() {}

  /** Base class of lowered expressions. */
  public abstract static class Exp extends AstNode {
    Exp(Pos pos, Op op) {
      super(pos, op);
    }
  }

  /** Location of a lowered variable; the target of a {@link Definition}. */
  public abstract static class Location extends Exp {
    public final Uid.ScopeVar var;

    Location(Pos pos, Op op, Uid.ScopeVar var) {
      super(pos, op);
      this.var = requireNonNull(var);
    }
  }

  /** Variable of the current scope. */
  public static class ScopeVarLocation extends Location {
    ScopeVarLocation(Pos pos, Uid.ScopeVar var) {
      super(pos, Op.SCOPE_VAR_LOCATION, var);
    }

    @Override
    AstWriter unparse(AstWriter w) {
      return w.id(var);
    }

    @Override
    public int hashCode() {
      return var.hashCode();
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof ScopeVarLocation
              && ((ScopeVarLocation) o).var.equals(var);
    }
  }

  /** Variable of a subscope; {@link #var} is a lowered variable of the
   * called scope. */
  public static class SubScopeVarLocation extends Location {
    public final Uid.ScopeName scope;
    public final Uid.SubScopeName subScope;

    SubScopeVarLocation(Pos pos, Uid.ScopeName scope,
        Uid.SubScopeName subScope, Uid.ScopeVar var) {
      super(pos, Op.SUB_SCOPE_VAR_LOCATION, var);
      this.scope = requireNonNull(scope);
      this.subScope = requireNonNull(subScope);
    }

    @Override
    AstWriter unparse(AstWriter w) {
      return w.id(subScope).append(".").id(var);
    }

    @Override
    public int hashCode() {
      return Objects.hash(subScope, var);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof SubScopeVarLocation
              && ((SubScopeVarLocation) o).subScope.equals(subScope)
              && ((SubScopeVarLocation) o).var.equals(var);
    }
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
  }

  /** Default term: the only way the lowered calculus expresses priority. */
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
  }

  /** Statement of a lowered scope. */
  public abstract static class Statement extends AstNode {
    Statement(Pos pos, Op op) {
      super(pos, op);
    }
  }

  /** Assigns the value of an expression to a location. */
  public static class Definition extends Statement {
    public final Location location;
    public final Type type;
    public final Io io;
    public final Exp exp;

    Definition(Pos pos, Location location, Type type, Io io, Exp exp) {
      super(pos, Op.DEFINITION);
      this.location = requireNonNull(location);
      this.type = requireNonNull(type);
      this.io = requireNonNull(io);
      this.exp = requireNonNull(exp);
    }

    @Override
    AstWriter unparse(AstWriter w) {
      return w.append("let ").append(location).append(": ")
          .append(type.description()).append(" = ").append(exp);
    }
  }

  /** Calls a subscope, after its inputs have been defined. */
  public static class Call extends Statement {
    public final Uid.ScopeName scope;
    public final Uid.SubScopeName subScope;

    Call(Pos pos, Uid.ScopeName scope, Uid.SubScopeName subScope) {
      super(pos, Op.CALL);
      this.scope = requireNonNull(scope);
      this.subScope = requireNonNull(subScope);
    }

    @Override
    AstWriter unparse(AstWriter w) {
      return w.append("call ").id(scope).append("[").id(subScope)
          .append("]");
    }
  }

  /** Boolean expression that must hold after the scope has executed. */
  public static class Assertion extends Statement {
    public final Exp exp;

    Assertion(Pos pos, Exp exp) {
      super(pos, Op.ASSERTION);
      this.exp = requireNonNull(exp);
    }

    @Override
    AstWriter unparse(AstWriter w) {
      return w.append("assert ").append(exp);
    }
  }

  /** Type and io of a variable in the signature of a scope. */
  public static class SigEntry {
    public final Type type;
    public final Io io;

    public SigEntry(Type type, Io io) {
      this.type = requireNonNull(type);
      this.io = requireNonNull(io);
    }

    @Override
    public int hashCode() {
      return Objects.hash(type, io);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof SigEntry
              && ((SigEntry) o).type.equals(type)
              && ((SigEntry) o).io.equals(io);
    }

    @Override
    public String toString() {
      return type.description() + " (" + io + ")";
    }
  }

  /** Lowered scope. */
  public static class ScopeDecl {
    public final Uid.ScopeName name;
    /** Lowered variables, one per state, in declaration order. */
    public final ImmutableMap<Uid.ScopeVar, SigEntry> signature;
    /** Statements in execution order; assertions come last. */
    public final ImmutableList<Statement> statements;

    public ScopeDecl(Uid.ScopeName name,
        Map<Uid.ScopeVar, SigEntry> signature, List<Statement> statements) {
      this.name = requireNonNull(name);
      this.signature = ImmutableMap.copyOf(signature);
      this.statements = ImmutableList.copyOf(statements);
    }

    @Override
    public String toString() {
      final StringBuilder b = new StringBuilder();
      b.append("scope ").append(name).append(" {\n");
      signature.forEach((var, entry) ->
          b.append("  ").append(var).append(": ").append(entry).append('\n'));
      statements.forEach(statement ->
          b.append("  ").append(statement).append('\n'));
      return b.append('}').toString();
    }
  }

  /** Lowered program. */
  public static class Program {
    /** Scopes, in the order of the desugared program. */
    public final ImmutableMap<Uid.ScopeName, ScopeDecl> scopes;
    public final DeclContext declContext;

    public Program(Map<Uid.ScopeName, ScopeDecl> scopes,
        DeclContext declContext) {
      this.scopes = ImmutableMap.copyOf(scopes);
      this.declContext = requireNonNull(declContext);
    }
  }
}

// End Scopelang.java
