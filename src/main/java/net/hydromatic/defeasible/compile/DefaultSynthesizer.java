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

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Map;
import net.hydromatic.defeasible.ast.Desugared;
import net.hydromatic.defeasible.ast.Operator;
import net.hydromatic.defeasible.ast.Pos;
import net.hydromatic.defeasible.ast.Scopelang;
import net.hydromatic.defeasible.ast.Uid;
import net.hydromatic.defeasible.type.Type;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Converts a {@link RuleTree} into a default term.
 *
 * <p>For a tree whose root has rules {@code r1 ... rn} and whose exceptions
 * are trees {@code t1 ... tm}, the term is
 *
 * <blockquote><pre>
 * &lt;t1, ..., tm | true :-
 *   &lt;&lt;j1 :- c1&gt;, ..., &lt;jn :- cn&gt; | false :- empty&gt;&gt;
 * </pre></blockquote>
 *
 * <p>An exception that applies wins over the rules of the root; if two
 * exceptions, or two rules of the root, apply at the same time, evaluation
 * fails with a conflict.
 *
 * <p>If the definition is a function, every rule has its own parameter; each
 * is renamed to the single parameter of the lowered function.
 */
public class DefaultSynthesizer {
  private final ExpTranslator translator;
  private final Pos defPos;
  private final Uid.@Nullable Var param;
  private final @Nullable Type paramType;
  private final boolean logRuleDecisions;
  private final boolean simplify;

  private DefaultSynthesizer(ExpTranslator translator, Pos defPos,
      Uid.@Nullable Var param, @Nullable Type paramType,
      boolean logRuleDecisions, boolean simplify) {
    this.translator = requireNonNull(translator);
    this.defPos = requireNonNull(defPos);
    this.param = param;
    this.paramType = paramType;
    this.logRuleDecisions = logRuleDecisions;
    this.simplify = simplify;
    if ((param == null) != (paramType == null)) {
      throw new IllegalArgumentException("parameter and its type must be "
          + "both present or both absent");
    }
  }

  /**
   * Creates a synthesizer for one definition.
   *
   * @param translator Translator for the bodies of rules
   * @param map Properties
   * @param defPos Position of the defined variable
   * @param param Parameter of the lowered function, or null if the
   *   definition is not a function
   * @param paramType Type of the parameter, or null
   */
  public static DefaultSynthesizer create(ExpTranslator translator,
      Map<Prop, Object> map, Pos defPos, Uid.@Nullable Var param,
      @Nullable Type paramType) {
    return new DefaultSynthesizer(translator, defPos, param, paramType,
        Prop.LOG_RULE_DECISIONS.booleanValue(map),
        Prop.SIMPLIFY_DEFAULTS.booleanValue(map));
  }

  /** Converts the tree that defines a variable. If the definition is a
   * function, the result is a function whose body fails if the default is
   * empty. */
  public Scopelang.Exp toplevel(RuleTree tree) {
    final Scopelang.Exp exp = synthesize(tree);
    if (param == null) {
      return exp;
    }
    return scopelang.fn(defPos, param, requireNonNull(paramType),
        scopelang.errorOnEmpty(defPos, exp));
  }

  /** Converts a tree into a default term. */
  public Scopelang.Exp synthesize(RuleTree tree) {
    final List<Scopelang.Exp> exceptions;
    if (tree instanceof RuleTree.Node) {
      final ImmutableList.Builder<Scopelang.Exp> b = ImmutableList.builder();
      for (RuleTree exception : ((RuleTree.Node) tree).exceptions) {
        b.add(synthesize(exception));
      }
      exceptions = b.build();
    } else {
      exceptions = ImmutableList.of();
    }

    final ImmutableList.Builder<Scopelang.Exp> bases = ImmutableList.builder();
    for (Desugared.Rule rule : tree.rules) {
      final ExpTranslator ruleTranslator = bind(rule);
      Scopelang.Exp justification =
          ruleTranslator.translate(rule.justification);
      if (logRuleDecisions) {
        justification =
            scopelang.log(justification.pos,
                Operator.LogEntry.POS_RECORD_IF_TRUE_BOOL, justification);
      }
      bases.add(
          makeDefault(ImmutableList.of(), justification,
              ruleTranslator.translate(rule.consequence)));
    }
    final Scopelang.Exp baseTier =
        makeDefault(bases.build(), scopelang.boolLiteral(defPos, false),
            scopelang.emptyLiteral(defPos));
    return makeDefault(exceptions, scopelang.boolLiteral(defPos, true),
        baseTier);
  }

  /** Returns a translator in which the parameter of a rule is the parameter
   * of the lowered function. */
  private ExpTranslator bind(Desugared.Rule rule) {
    if (param == null && rule.parameter == null) {
      return translator;
    }
    if (param != null && rule.parameter != null) {
      return translator.withVar(rule.parameter.var, param);
    }
    throw new IllegalStateException("rule " + rule.id
        + (param == null ? " has a parameter but the definition is not a "
            + "function" : " has no parameter but the definition is a "
            + "function"));
  }

  private Scopelang.Exp makeDefault(List<Scopelang.Exp> exceptions,
      Scopelang.Exp justification, Scopelang.Exp consequence) {
    return simplify
        ? scopelang.simplifiedDefault(defPos, exceptions, justification,
            consequence)
        : scopelang.defaultExp(defPos, exceptions, justification,
            consequence);
  }
}

// End DefaultSynthesizer.java
