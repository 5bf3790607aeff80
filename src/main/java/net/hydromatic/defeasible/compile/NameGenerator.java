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

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import net.hydromatic.defeasible.ast.Pos;
import net.hydromatic.defeasible.ast.Uid;

/**
 * Generates unique identifiers.
 *
 * <p>Keeps track of how many times each name has been used, so that a new
 * occurrence of a name is given a fresh ordinal. Identifiers of a program
 * should all come from the same generator.
 */
public class NameGenerator {
  private final Map<String, AtomicInteger> nameCounts = new HashMap<>();

  /** Returns the number of times that "name" has been used. */
  public int inc(String name) {
    return nameCounts.computeIfAbsent(name, n -> new AtomicInteger(0))
        .getAndIncrement();
  }

  public Uid.ScopeName scopeName(String name, Pos pos) {
    return new Uid.ScopeName(name, inc(name), pos);
  }

  public Uid.ScopeVar scopeVar(String name, Pos pos) {
    return new Uid.ScopeVar(name, inc(name), pos);
  }

  public Uid.SubScopeName subScopeName(String name, Pos pos) {
    return new Uid.SubScopeName(name, inc(name), pos);
  }

  public Uid.StateName stateName(String name, Pos pos) {
    return new Uid.StateName(name, inc(name), pos);
  }

  public Uid.RuleName ruleName(String name, Pos pos) {
    return new Uid.RuleName(name, inc(name), pos);
  }

  public Uid.StructName structName(String name, Pos pos) {
    return new Uid.StructName(name, inc(name), pos);
  }

  public Uid.FieldName fieldName(String name, Pos pos) {
    return new Uid.FieldName(name, inc(name), pos);
  }

  public Uid.EnumName enumName(String name, Pos pos) {
    return new Uid.EnumName(name, inc(name), pos);
  }

  public Uid.ConstructorName constructorName(String name, Pos pos) {
    return new Uid.ConstructorName(name, inc(name), pos);
  }

  /** Generates a bound variable. */
  public Uid.Var var(String name, Pos pos) {
    return new Uid.Var(name, inc(name), pos);
  }

  /** Generates a bound variable with the same name as another. */
  public Uid.Var fresh(Uid.Var var) {
    return var(var.name, var.pos);
  }
}

// End NameGenerator.java
