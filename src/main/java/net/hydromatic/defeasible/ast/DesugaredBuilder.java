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

import com.google.common.collect.ImmutableList;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.LocalDate;
import java.time.Period;
import java.util.List;
import java.util.Map;
import net.hydromatic.defeasible.type.Type;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Builds desugared expressions. */
public enum DesugaredBuilder {
  /** The singleton instance of the desugared builder.
   * The short name is convenient for use via 'import static',
   * but checkstyle does not approve. */
  // CHECKSTYLE: IGNORE 1
  desugared;

  /** Creates a {@code boolean} literal. */
  public Desugared.Literal boolLiteral(Pos pos, boolean b) {
    return new Desugared.Literal(pos, Op.BOOL_LITERAL, b);
  }

  /** Creates an integer literal. */
  public Desugared.Literal intLiteral(Pos pos, long value) {
    return intLiteral(pos, BigInteger.valueOf(value));
  }

  /** Creates an integer literal. */
  public Desugared.Literal intLiteral(Pos pos, BigInteger value) {
    return new Desugared.Literal(pos, Op.INT_LITERAL, value);
  }

  /** Creates a decimal literal. */
  public Desugared.Literal decimalLiteral(Pos pos, BigDecimal value) {
    return new Desugared.Literal(pos, Op.DECIMAL_LITERAL, value);
  }

  /** Creates a money literal. */
  public Desugared.Literal moneyLiteral(Pos pos, BigDecimal value) {
    return new Desugared.Literal(pos, Op.MONEY_LITERAL, value);
  }

  /** Creates a date literal. */
  public Desugared.Literal dateLiteral(Pos pos, LocalDate value) {
    return new Desugared.Literal(pos, Op.DATE_LITERAL, value);
  }

  /** Creates a duration literal. */
  public Desugared.Literal durationLiteral(Pos pos, Period value) {
    return new Desugared.Literal(pos, Op.DURATION_LITERAL, value);
  }

  /** Creates a unit literal. */
  public Desugared.Literal unitLiteral(Pos pos) {
    return new Desugared.Literal(pos, Op.UNIT_LITERAL, null);
  }

  /** Creates the empty value. */
  public Desugared.Literal emptyLiteral(Pos pos) {
    return new Desugared.Literal(pos, Op.EMPTY_LITERAL, null);
  }

  /** Creates a reference to a variable of the current scope; if
   * {@code state} is null and the variable has states, the reference is to
   * its last state. */
  public Desugared.ScopeVarLocation scopeVar(Pos pos, Uid.ScopeVar var,
      Uid.@Nullable StateName state) {
    return new Desugared.ScopeVarLocation(pos, var, state);
  }

  /** Creates a reference to a variable of the current scope. */
  public Desugared.ScopeVarLocation scopeVar(Pos pos, Uid.ScopeVar var) {
    return scopeVar(pos, var, null);
  }

  /** Creates a reference to a variable of a subscope. */
  public Desugared.SubScopeVarLocation subScopeVar(Pos pos,
      Uid.ScopeName scope, Uid.SubScopeName subScope, Uid.ScopeVar var) {
    return new Desugared.SubScopeVarLocation(pos, scope, subScope, var);
  }

  /** Creates a reference to a bound variable. */
  public Desugared.Id id(Pos pos, Uid.Var var) {
    return new Desugared.Id(pos, var);
  }

  /** Creates a structure value. */
  public Desugared.Struct struct(Pos pos, Uid.StructName name,
      Map<Uid.FieldName, Desugared.Exp> fields) {
    return new Desugared.Struct(pos, name, fields);
  }

  /** Creates an access to a field of a structure. */
  public Desugared.StructAccess structAccess(Pos pos, Desugared.Exp exp,
      Uid.StructName name, Uid.FieldName field) {
    return new Desugared.StructAccess(pos, exp, name, field);
  }

  /** Creates an injection into an enumeration. */
  public Desugared.EnumInj enumInj(Pos pos, Desugared.Exp exp,
      Uid.EnumName name, Uid.ConstructorName constructor) {
    return new Desugared.EnumInj(pos, exp, name, constructor);
  }

  /** Creates a pattern match. */
  public Desugared.Match match(Pos pos, Desugared.Exp exp, Uid.EnumName name,
      Map<Uid.ConstructorName, Desugared.Exp> arms) {
    return new Desugared.Match(pos, exp, name, arms);
  }

  /** Creates a function of one or more parameters. */
  public Desugared.Fn fn(Pos pos, List<Uid.Var> params, List<Type> paramTypes,
      Desugared.Exp body) {
    return new Desugared.Fn(pos, params, paramTypes, body);
  }

  /** Creates a function application. */
  public Desugared.Apply apply(Pos pos, Desugared.Exp fn,
      List<Desugared.Exp> args) {
    return new Desugared.Apply(pos, fn, args);
  }

  /** Creates a reference to an operator. */
  public Desugared.OperatorRef operator(Pos pos, Operator operator) {
    return new Desugared.OperatorRef(pos, operator, null);
  }

  /** Creates an application of an operator. */
  public Desugared.Apply call(Pos pos, Operator operator,
      Desugared.Exp... args) {
    return apply(pos, operator(pos, operator), ImmutableList.copyOf(args));
  }

  /** Wraps an expression in a log event. */
  public Desugared.Apply log(Pos pos, Operator.LogEntry entry,
      Desugared.Exp arg) {
    return apply(pos, new Desugared.OperatorRef(pos, Operator.LOG, entry),
        ImmutableList.of(arg));
  }

  /** Creates a default term. */
  public Desugared.Default defaultExp(Pos pos,
      List<Desugared.Exp> exceptions, Desugared.Exp justification,
      Desugared.Exp consequence) {
    return new Desugared.Default(pos, exceptions, justification, consequence);
  }

  /** Creates an if-then-else expression. */
  public Desugared.If ifThenElse(Pos pos, Desugared.Exp condition,
      Desugared.Exp ifTrue, Desugared.Exp ifFalse) {
    return new Desugared.If(pos, condition, ifTrue, ifFalse);
  }

  /** Creates an array. */
  public Desugared.Array array(Pos pos, List<Desugared.Exp> elements) {
    return new Desugared.Array(pos, elements);
  }

  /** Creates an expression that fails if its argument is empty. */
  public Desugared.ErrorOnEmpty errorOnEmpty(Pos pos, Desugared.Exp exp) {
    return new Desugared.ErrorOnEmpty(pos, exp);
  }
}

// End DesugaredBuilder.java
