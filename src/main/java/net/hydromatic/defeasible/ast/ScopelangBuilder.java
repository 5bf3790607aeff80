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

import static com.google.common.collect.Iterables.getOnlyElement;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Map;
import net.hydromatic.defeasible.type.Type;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Builds lowered expressions and statements. */
public enum ScopelangBuilder {
  /** The singleton instance of the scope language builder.
   * The short name is convenient for use via 'import static',
   * but checkstyle does not approve. */
  // CHECKSTYLE: IGNORE 1
  scopelang;

  /** Creates a literal of a given kind. */
  public Scopelang.Literal literal(Pos pos, Op op, @Nullable Object value) {
    return new Scopelang.Literal(pos, op, value);
  }

  /** Creates a {@code boolean} literal. */
  public Scopelang.Literal boolLiteral(Pos pos, boolean b) {
    return literal(pos, Op.BOOL_LITERAL, b);
  }

  /** Creates the empty value. */
  public Scopelang.Literal emptyLiteral(Pos pos) {
    return literal(pos, Op.EMPTY_LITERAL, null);
  }

  /** Creates a reference to a lowered variable of the current scope. */
  public Scopelang.ScopeVarLocation scopeVar(Pos pos, Uid.ScopeVar var) {
    return new Scopelang.ScopeVarLocation(pos, var);
  }

  /** Creates a reference to a lowered variable of a subscope. */
  public Scopelang.SubScopeVarLocation subScopeVar(Pos pos,
      Uid.ScopeName scope, Uid.SubScopeName subScope, Uid.ScopeVar var) {
    return new Scopelang.SubScopeVarLocation(pos, scope, subScope, var);
  }

  /** Creates a reference to a bound variable. */
  public Scopelang.Id id(Pos pos, Uid.Var var) {
    return new Scopelang.Id(pos, var);
  }

  /** Creates a structure value. */
  public Scopelang.Struct struct(Pos pos, Uid.StructName name,
      Map<Uid.FieldName, Scopelang.Exp> fields) {
    return new Scopelang.Struct(pos, name, fields);
  }

  /** Creates an access to a field of a structure. */
  public Scopelang.StructAccess structAccess(Pos pos, Scopelang.Exp exp,
      Uid.StructName name, Uid.FieldName field) {
    return new Scopelang.StructAccess(pos, exp, name, field);
  }

  /** Creates an injection into an enumeration. */
  public Scopelang.EnumInj enumInj(Pos pos, Scopelang.Exp exp,
      Uid.EnumName name, Uid.ConstructorName constructor) {
    return new Scopelang.EnumInj(pos, exp, name, constructor);
  }

  /** Creates a pattern match. */
  public Scopelang.Match match(Pos pos, Scopelang.Exp exp, Uid.EnumName name,
      Map<Uid.ConstructorName, Scopelang.Exp> arms) {
    return new Scopelang.Match(pos, exp, name, arms);
  }

  /** Creates a function of one or more parameters. */
  public Scopelang.Fn fn(Pos pos, List<Uid.Var> params, List<Type> paramTypes,
      Scopelang.Exp body) {
    return new Scopelang.Fn(pos, params, paramTypes, body);
  }

  /** Creates a function of one parameter. */
  public Scopelang.Fn fn(Pos pos, Uid.Var param, Type paramType,
      Scopelang.Exp body) {
    return fn(pos, ImmutableList.of(param), ImmutableList.of(paramType), body);
  }

  /** Creates a function application. */
  public Scopelang.Apply apply(Pos pos, Scopelang.Exp fn,
      List<Scopelang.Exp> args) {
    return new Scopelang.Apply(pos, fn, args);
  }

  /** Creates a reference to an operator; {@code logEntry} is not null if
   * and only if the operator is {@link Operator#LOG}. */
  public Scopelang.OperatorRef operator(Pos pos, Operator operator,
      Operator.@Nullable LogEntry logEntry) {
    return new Scopelang.OperatorRef(pos, operator, logEntry);
  }

  /** Wraps an expression in a log event. */
  public Scopelang.Apply log(Pos pos, Operator.LogEntry entry,
      Scopelang.Exp arg) {
    return apply(pos, operator(pos, Operator.LOG, entry),
        ImmutableList.of(arg));
  }

  /** Creates a default term, exactly as given. */
  public Scopelang.Default defaultExp(Pos pos,
      List<Scopelang.Exp> exceptions, Scopelang.Exp justification,
      Scopelang.Exp consequence) {
    return new Scopelang.Default(pos, exceptions, justification,
        consequence);
  }

  /**
   * Creates a default term, simplifying it if possible.
   *
   * <ul>
   *   <li>{@code <true :- c>} becomes {@code c};
   *   <li>{@code <es | true :- <j :- c>>} becomes {@code <es | j :- c>};
   *   <li>{@code <e | false :- c>} becomes {@code e}.
   * </ul>
   *
   * <p>The rewrites do not change the value of the term, nor whether it
   * fails.
   */
  public Scopelang.Exp simplifiedDefault(Pos pos,
      List<Scopelang.Exp> exceptions, Scopelang.Exp justification,
      Scopelang.Exp consequence) {
    final Boolean b = boolValue(justification);
    if (b == Boolean.TRUE) {
      if (exceptions.isEmpty()) {
        return consequence;
      }
      if (consequence instanceof Scopelang.Default
          && ((Scopelang.Default) consequence).exceptions.isEmpty()) {
        final Scopelang.Default inner = (Scopelang.Default) consequence;
        return defaultExp(pos, exceptions, inner.justification,
            inner.consequence);
      }
    }
    if (b == Boolean.FALSE && exceptions.size() == 1) {
      return getOnlyElement(exceptions);
    }
    return defaultExp(pos, exceptions, justification, consequence);
  }

  /** Returns the value of an expression if it is a boolean literal,
   * possibly wrapped in log events; otherwise null.
   *
   * <p>Does not look through a
   * {@link Operator.LogEntry#POS_RECORD_IF_TRUE_BOOL} event, so that such
   * events are never removed. */
  public @Nullable Boolean boolValue(Scopelang.Exp exp) {
    switch (exp.op) {
    case BOOL_LITERAL:
      return (Boolean) ((Scopelang.Literal) exp).value;
    case APPLY:
      final Scopelang.Apply apply = (Scopelang.Apply) exp;
      if (apply.fn.op == Op.OPERATOR && apply.args.size() == 1) {
        final Scopelang.OperatorRef ref = (Scopelang.OperatorRef) apply.fn;
        if (ref.operator == Operator.LOG
            && ref.logEntry != Operator.LogEntry.POS_RECORD_IF_TRUE_BOOL) {
          return boolValue(apply.args.get(0));
        }
      }
      return null;
    default:
      return null;
    }
  }

  /** Creates an if-then-else expression. */
  public Scopelang.If ifThenElse(Pos pos, Scopelang.Exp condition,
      Scopelang.Exp ifTrue, Scopelang.Exp ifFalse) {
    return new Scopelang.If(pos, condition, ifTrue, ifFalse);
  }

  /** Creates an array. */
  public Scopelang.Array array(Pos pos, List<Scopelang.Exp> elements) {
    return new Scopelang.Array(pos, elements);
  }

  /** Creates an expression that fails if its argument is empty. */
  public Scopelang.ErrorOnEmpty errorOnEmpty(Pos pos, Scopelang.Exp exp) {
    return new Scopelang.ErrorOnEmpty(pos, exp);
  }

  /** Creates a definition statement. */
  public Scopelang.Definition definition(Pos pos,
      Scopelang.Location location, Type type, Io io, Scopelang.Exp exp) {
    return new Scopelang.Definition(pos, location, type, io, exp);
  }

  /** Creates a statement that calls a subscope. */
  public Scopelang.Call call(Pos pos, Uid.ScopeName scope,
      Uid.SubScopeName subScope) {
    return new Scopelang.Call(pos, scope, subScope);
  }

  /** Creates an assertion statement. */
  public Scopelang.Assertion assertion(Pos pos, Scopelang.Exp exp) {
    return new Scopelang.Assertion(pos, exp);
  }
}

// End ScopelangBuilder.java
