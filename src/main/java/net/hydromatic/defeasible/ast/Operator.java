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

import java.util.Locale;

/**
 * Built-in operators of the rules language.
 *
 * <p>Operators are overloaded on numeric kinds (integer, decimal, money, date,
 * duration); the kind is recovered from the types of the arguments by later
 * passes, so it is not part of the operator.
 */
public enum Operator {
  NOT("not", 1),
  NEGATE("~", 1),
  AND(" && ", 2),
  OR(" || ", 2),
  XOR(" xor ", 2),
  PLUS(" + ", 2),
  MINUS(" - ", 2),
  TIMES(" * ", 2),
  DIVIDE(" / ", 2),
  LT(" < ", 2),
  LE(" <= ", 2),
  GT(" > ", 2),
  GE(" >= ", 2),
  EQ(" = ", 2),
  NE(" <> ", 2),
  CONCAT(" ++ ", 2),
  MAP("map", 2),
  FILTER("filter", 2),
  FOLD("fold", 3),
  LENGTH("length", 1),
  INT_TO_RAT("decimal_of_integer", 1),
  MONEY_TO_RAT("decimal_of_money", 1),
  RAT_TO_MONEY("money_of_decimal", 1),
  GET_DAY("get_day", 1),
  GET_MONTH("get_month", 1),
  GET_YEAR("get_year", 1),
  FIRST_DAY_OF_MONTH("first_day_of_month", 1),
  LAST_DAY_OF_MONTH("last_day_of_month", 1),
  ROUND_MONEY("round_money", 1),
  ROUND_DECIMAL("round_decimal", 1),

  /**
   * Identity function that records an event for the trace of a computation.
   * Always carries a {@link LogEntry}.
   */
  LOG("log", 1);

  /** How the operator is written; padded with spaces if it is infix. */
  public final String padded;

  /** Number of arguments. */
  public final int arity;

  Operator(String padded, int arity) {
    this.padded = padded;
    this.arity = arity;
  }

  /** Returns whether the operator is written between its two arguments. */
  public boolean isInfix() {
    return padded.startsWith(" ");
  }

  /** Kinds of event that a {@link #LOG} operator records. */
  public enum LogEntry {
    /** Definition of a variable. */
    VAR_DEF,
    /** Start of a call to a subscope. */
    BEGIN_CALL,
    /** End of a call to a subscope. */
    END_CALL,
    /**
     * Records the position of the rule whose justification it wraps, if the
     * justification evaluates to true. Used to explain which rule decided the
     * value of a variable; never removed by simplification.
     */
    POS_RECORD_IF_TRUE_BOOL;

    /** Name used when printing, e.g. "pos_record_if_true_bool". */
    public final String moniker = name().toLowerCase(Locale.ROOT);
  }
}

// End Operator.java
