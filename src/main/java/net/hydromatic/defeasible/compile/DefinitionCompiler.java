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
import static net.hydromatic.defeasible.ast.DesugaredBuilder.desugared;
import static net.hydromatic.defeasible.ast.ScopelangBuilder.scopelang;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import net.hydromatic.defeasible.ast.Desugared;
import net.hydromatic.defeasible.ast.Io;
import net.hydromatic.defeasible.ast.Pos;
import net.hydromatic.defeasible.ast.Scopelang;
import net.hydromatic.defeasible.ast.Uid;
import net.hydromatic.defeasible.type.FnType;
import net.hydromatic.defeasible.type.Type;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Compiles the rules that define a variable into one expression.
 *
 * <p>Arranges the rules into trees by their exceptions, adds the implicit
 * rules (a condition is false unless proven true; a variable without rules
 * is empty), and converts the result into a default term.
 */
public class DefinitionCompiler {
  private final ExpTranslator translator;
  private final Map<Prop, Object> map;
  private final Tracer tracer;

  private DefinitionCompiler(ExpTranslator translator, Map<Prop, Object> map,
      Tracer tracer) {
    this.translator = requireNonNull(translator);
    this.map = ImmutableMap.copyOf(map);
    this.tracer = requireNonNull(tracer);
  }

  public static DefinitionCompiler create(ExpTranslator translator,
      Map<Prop, Object> map, Tracer tracer) {
    return new DefinitionCompiler(translator, map, tracer);
  }

  /**
   * Compiles a definition.
   *
   * @param key What is defined
   * @param def Rules, type and io of the definition
   * @param isSubScopeVar Whether the definition is a redefinition, by the
   *   caller, of a variable of a subscope
   */
  public Scopelang.Exp compile(Desugared.ScopeDefKey key,
      Desugared.ScopeDef def, boolean isSubScopeVar) {
    final Pos pos = key.pos();
    final @Nullable Type paramType = paramType(key, def);
    final boolean isInput = def.io.input == Io.Input.ONLY_INPUT;

    // A condition is false unless proven true. For an input of a subscope,
    // the caller provides that value.
    final Desugared.@Nullable Rule fallback =
        def.isCondition && (!isSubScopeVar || isInput)
            ? alwaysFalseRule(pos, paramType)
            : null;

    if (def.rules.isEmpty()
        && isSubScopeVar
        && !(def.isCondition && isInput)) {
      // The subscope must see that the caller gave no value, even for a
      // function, whose lowered form would otherwise never be empty.
      return scopelang.emptyLiteral(pos);
    }

    final ExceptionGraph graph = ExceptionGraph.build(key, def.rules);
    final List<RuleTree> forest = RuleTree.forest(graph);
    tracer.onRuleTree(key, forest);

    final RuleTree tree;
    if (forest.isEmpty()) {
      tree = RuleTree.leaf(
          ImmutableList.of(fallback != null ? fallback
              : emptyRule(pos, paramType)));
    } else if (fallback != null) {
      tree = RuleTree.node(forest, ImmutableList.of(fallback));
    } else if (forest.size() == 1) {
      tree = forest.get(0);
    } else {
      tree = RuleTree.node(forest,
          ImmutableList.of(emptyRule(pos, paramType)));
    }

    final Uid.@Nullable Var param =
        paramType == null
            ? null
            : translator.nameGenerator.var(
                Prop.FUNCTION_PARAMETER_NAME.stringValue(map), pos);
    return DefaultSynthesizer.create(translator, map, pos, param, paramType)
        .toplevel(tree);
  }

  /** Returns the parameter type if the definition is a function, null if it
   * is not; throws if its rules disagree. */
  private static @Nullable Type paramType(Desugared.ScopeDefKey key,
      Desugared.ScopeDef def) {
    final boolean allFunctions =
        def.rules.values().stream().allMatch(r -> r.parameter != null);
    final boolean noFunctions =
        def.rules.values().stream().allMatch(r -> r.parameter == null);
    if (def.type instanceof FnType && allFunctions) {
      return ((FnType) def.type).paramType;
    }
    if (!def.type.isFunction() && noFunctions) {
      return null;
    }
    final List<CompileException.Span> spans = new ArrayList<>();
    def.rules.values().forEach(rule -> {
      if (rule.parameter != null) {
        spans.add(
            new CompileException.Span("This definition is a function:",
                rule.consequence.pos));
      }
    });
    def.rules.values().forEach(rule -> {
      if (rule.parameter == null) {
        spans.add(
            new CompileException.Span("This definition is not a function:",
                rule.consequence.pos));
      }
    });
    if (spans.isEmpty()) {
      spans.add(new CompileException.Span(null, key.pos()));
    }
    throw new CompileException("Some definitions of the same variable are "
        + "functions while others aren't", spans);
  }

  /** Creates a rule that always applies and has value false. */
  private Desugared.Rule alwaysFalseRule(Pos pos,
      @Nullable Type paramType) {
    return new Desugared.Rule(
        translator.nameGenerator.ruleName("always_false", pos),
        desugared.boolLiteral(pos, true), desugared.boolLiteral(pos, false),
        param(pos, paramType), ImmutableSet.of());
  }

  /** Creates a rule that never applies. */
  private Desugared.Rule emptyRule(Pos pos, @Nullable Type paramType) {
    return new Desugared.Rule(translator.nameGenerator.ruleName("empty", pos),
        desugared.boolLiteral(pos, false), desugared.emptyLiteral(pos),
        param(pos, paramType), ImmutableSet.of());
  }

  private Desugared.@Nullable Param param(Pos pos,
      @Nullable Type paramType) {
    return paramType == null
        ? null
        : new Desugared.Param(translator.nameGenerator.var("_", pos),
            paramType);
  }
}

// End DefinitionCompiler.java
