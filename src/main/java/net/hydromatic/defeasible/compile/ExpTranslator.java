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
import static net.hydromatic.defeasible.ast.ScopelangBuilder.scopelang;
import static net.hydromatic.defeasible.util.Static.plus;
import static net.hydromatic.defeasible.util.Static.transformEager;
import static net.hydromatic.defeasible.util.Static.transformValuesEager;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.Map;
import net.hydromatic.defeasible.ast.Desugared;
import net.hydromatic.defeasible.ast.Scopelang;
import net.hydromatic.defeasible.ast.Uid;

/**
 * Converts desugared expressions to scope language expressions.
 *
 * <p>References to scope variables are replaced by references to their
 * lowered variables; references to bound variables are replaced according to
 * a map. Translators are immutable; {@link #withVar} returns a translator
 * with one more variable in its map.
 */
public class ExpTranslator {
  final NameGenerator nameGenerator;
  private final ImmutableMap<Uid.ScopeVar, StateChain> stateChains;
  private final ImmutableMap<Uid.Var, Uid.Var> varMap;

  private ExpTranslator(NameGenerator nameGenerator,
      ImmutableMap<Uid.ScopeVar, StateChain> stateChains,
      ImmutableMap<Uid.Var, Uid.Var> varMap) {
    this.nameGenerator = requireNonNull(nameGenerator);
    this.stateChains = requireNonNull(stateChains);
    this.varMap = requireNonNull(varMap);
  }

  /** Creates a translator with an empty variable map. */
  public static ExpTranslator of(NameGenerator nameGenerator,
      Map<Uid.ScopeVar, StateChain> stateChains) {
    return new ExpTranslator(nameGenerator, ImmutableMap.copyOf(stateChains),
        ImmutableMap.of());
  }

  /** Returns a translator that maps bound variable {@code from} to
   * {@code to}. */
  public ExpTranslator withVar(Uid.Var from, Uid.Var to) {
    return new ExpTranslator(nameGenerator, stateChains,
        plus(varMap, from, to));
  }

  /** Returns the lowered variables of a scope variable. */
  public StateChain stateChain(Uid.ScopeVar var) {
    final StateChain chain = stateChains.get(var);
    if (chain == null) {
      throw new IllegalStateException("no lowered variable for " + var);
    }
    return chain;
  }

  /** Translates an expression. */
  public Scopelang.Exp translate(Desugared.Exp exp) {
    switch (exp.op) {
    case BOOL_LITERAL:
    case INT_LITERAL:
    case DECIMAL_LITERAL:
    case MONEY_LITERAL:
    case DATE_LITERAL:
    case DURATION_LITERAL:
    case UNIT_LITERAL:
    case EMPTY_LITERAL:
      return scopelang.literal(exp.pos, exp.op,
          ((Desugared.Literal) exp).value);
    case SCOPE_VAR_LOCATION:
      return translate((Desugared.ScopeVarLocation) exp);
    case SUB_SCOPE_VAR_LOCATION:
      return translate((Desugared.SubScopeVarLocation) exp);
    case VAR:
      return translate((Desugared.Id) exp);
    case STRUCT:
      return translate((Desugared.Struct) exp);
    case STRUCT_ACCESS:
      return translate((Desugared.StructAccess) exp);
    case ENUM_INJ:
      return translate((Desugared.EnumInj) exp);
    case MATCH:
      return translate((Desugared.Match) exp);
    case FN:
      return translate((Desugared.Fn) exp);
    case APPLY:
      return translate((Desugared.Apply) exp);
    case OPERATOR:
      return translate((Desugared.OperatorRef) exp);
    case DEFAULT:
      return translate((Desugared.Default) exp);
    case IF:
      return translate((Desugared.If) exp);
    case ARRAY:
      return scopelang.array(exp.pos,
          transformEager(((Desugared.Array) exp).elements, this::translate));
    case ERROR_ON_EMPTY:
      return scopelang.errorOnEmpty(exp.pos,
          translate(((Desugared.ErrorOnEmpty) exp).exp));
    default:
      throw new AssertionError("unknown op " + exp.op);
    }
  }

  private Scopelang.Exp translate(Desugared.ScopeVarLocation location) {
    return scopelang.scopeVar(location.pos,
        stateChain(location.var).get(location.state));
  }

  private Scopelang.Exp translate(Desugared.SubScopeVarLocation location) {
    // A caller sees the final state of a variable of the subscope
    return scopelang.subScopeVar(location.pos, location.scope,
        location.subScope, stateChain(location.var).last());
  }

  private Scopelang.Exp translate(Desugared.Id id) {
    final Uid.Var var = varMap.get(id.var);
    if (var == null) {
      throw new IllegalStateException("unbound variable " + id.var);
    }
    return scopelang.id(id.pos, var);
  }

  private Scopelang.Exp translate(Desugared.Struct struct) {
    return scopelang.struct(struct.pos, struct.name,
        transformValuesEager(struct.fields, this::translate));
  }

  private Scopelang.Exp translate(Desugared.StructAccess structAccess) {
    return scopelang.structAccess(structAccess.pos,
        translate(structAccess.exp), structAccess.name, structAccess.field);
  }

  private Scopelang.Exp translate(Desugared.EnumInj enumInj) {
    return scopelang.enumInj(enumInj.pos, translate(enumInj.exp),
        enumInj.name, enumInj.constructor);
  }

  private Scopelang.Exp translate(Desugared.Match match) {
    return scopelang.match(match.pos, translate(match.exp), match.name,
        transformValuesEager(match.arms, this::translate));
  }

  private Scopelang.Exp translate(Desugared.Fn fn) {
    final ImmutableList<Uid.Var> params =
        transformEager(fn.params, nameGenerator::fresh);
    ExpTranslator translator = this;
    for (int i = 0; i < params.size(); i++) {
      translator = translator.withVar(fn.params.get(i), params.get(i));
    }
    return scopelang.fn(fn.pos, params, fn.paramTypes,
        translator.translate(fn.body));
  }

  private Scopelang.Exp translate(Desugared.Apply apply) {
    return scopelang.apply(apply.pos, translate(apply.fn),
        transformEager(apply.args, this::translate));
  }

  private Scopelang.Exp translate(Desugared.OperatorRef operatorRef) {
    return scopelang.operator(operatorRef.pos, operatorRef.operator,
        operatorRef.logEntry);
  }

  private Scopelang.Exp translate(Desugared.Default aDefault) {
    return scopelang.defaultExp(aDefault.pos,
        transformEager(aDefault.exceptions, this::translate),
        translate(aDefault.justification),
        translate(aDefault.consequence));
  }

  private Scopelang.Exp translate(Desugared.If anIf) {
    return scopelang.ifThenElse(anIf.pos, translate(anIf.condition),
        translate(anIf.ifTrue), translate(anIf.ifFalse));
  }
}

// End ExpTranslator.java
