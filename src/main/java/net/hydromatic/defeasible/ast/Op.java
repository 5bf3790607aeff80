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

/** Sub-types of {@link AstNode}. */
public enum Op {
  // literals
  BOOL_LITERAL(true),
  INT_LITERAL(true),
  DECIMAL_LITERAL(true),
  MONEY_LITERAL(true),
  DATE_LITERAL(true),
  DURATION_LITERAL(true),
  UNIT_LITERAL(true),
  /**
   * The empty value of default logic; occurs in both calculi, and is
   * eliminated by later passes.
   */
  EMPTY_LITERAL(true),

  // locations
  SCOPE_VAR_LOCATION(true),
  SUB_SCOPE_VAR_LOCATION(true),

  // expressions
  VAR(true),
  STRUCT,
  STRUCT_ACCESS,
  ENUM_INJ,
  MATCH,
  FN,
  APPLY,
  OPERATOR(true),
  DEFAULT,
  IF,
  ARRAY,
  ERROR_ON_EMPTY,

  // statements of a lowered scope
  DEFINITION,
  CALL,
  ASSERTION;

  /** Whether the node is a leaf: it has no sub-expressions. */
  public final boolean leaf;

  Op() {
    this(false);
  }

  Op(boolean leaf) {
    this.leaf = leaf;
  }

  /** Returns whether this is the op of a literal. */
  public boolean isLiteral() {
    return ordinal() <= EMPTY_LITERAL.ordinal();
  }
}

// End Op.java
