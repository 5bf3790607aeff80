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

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;
import java.util.Map;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Context for writing an AST out as a string. */
public class AstWriter {
  private final StringBuilder b = new StringBuilder();

  /** Appends a string to the output. */
  public AstWriter append(String s) {
    b.append(s);
    return this;
  }

  /** Appends a node to the output. */
  public AstWriter append(AstNode node) {
    return node.unparse(this);
  }

  /** Appends an identifier to the output. */
  public AstWriter id(Uid id) {
    return append(id.toString());
  }

  /** Appends a list of nodes, separated by a given string. */
  public AstWriter list(List<? extends AstNode> nodes, String sep) {
    for (int i = 0; i < nodes.size(); i++) {
      if (i > 0) {
        append(sep);
      }
      append(nodes.get(i));
    }
    return this;
  }

  /** Appends a map of nodes, e.g. "{a = 1; b = 2}" or "A x | B y". */
  public AstWriter map(Map<? extends Uid, ? extends AstNode> nodes,
      String mid, String sep) {
    int i = 0;
    for (Map.Entry<? extends Uid, ? extends AstNode> e : nodes.entrySet()) {
      if (i++ > 0) {
        append(sep);
      }
      id(e.getKey()).append(mid).append(e.getValue());
    }
    return this;
  }

  /** Appends a call to an operator, or to a function. */
  public AstWriter apply(AstNode fn, List<? extends AstNode> args) {
    if (fn.op == Op.OPERATOR && args.size() == 2) {
      final Operator operator = operator(fn);
      if (operator.isInfix()) {
        return append("(").append(args.get(0)).append(operator.padded)
            .append(args.get(1)).append(")");
      }
    }
    return append(fn).append("(").list(args, ", ").append(")");
  }

  /**
   * Appends a default term.
   *
   * <p>Written {@code <e1, e2 | just :- cons>}, or {@code <just :- cons>} if
   * there are no exceptions.
   */
  public AstWriter defaultTerm(List<? extends AstNode> exceptions,
      AstNode justification, AstNode consequence) {
    append("<");
    if (!exceptions.isEmpty()) {
      list(exceptions, ", ").append(" | ");
    }
    return append(justification).append(" :- ").append(consequence)
        .append(">");
  }

  /** Appends a literal value. */
  public AstWriter literal(Op op, @Nullable Object value) {
    switch (op) {
    case UNIT_LITERAL:
      return append("()");
    case EMPTY_LITERAL:
      return append("empty");
    case DECIMAL_LITERAL:
      return append(((BigDecimal) value).toPlainString());
    case MONEY_LITERAL:
      return append("$")
          .append(((BigDecimal) value).setScale(2, RoundingMode.HALF_EVEN)
              .toPlainString());
    case DATE_LITERAL:
      return append("|").append(String.valueOf(value)).append("|");
    default:
      return append(String.valueOf(value));
    }
  }

  /** Appends an operator reference. */
  public AstWriter operator(Operator operator,
      Operator.@Nullable LogEntry logEntry) {
    if (operator == Operator.LOG && logEntry != null) {
      return append("log[").append(logEntry.moniker).append("]");
    }
    return append(operator.isInfix() ? "op" + operator.padded.trim()
        : operator.padded);
  }

  private static Operator operator(AstNode node) {
    if (node instanceof Desugared.OperatorRef) {
      return ((Desugared.OperatorRef) node).operator;
    }
    return ((Scopelang.OperatorRef) node).operator;
  }

  @Override
  public String toString() {
    return b.toString();
  }
}

// End AstWriter.java
