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

/** Visits desugared expression trees. */
public class Visitor {

  /** For use as a method reference. */
  protected <E extends Desugared.Exp> void accept(E e) {
    e.accept(this);
  }

  // leaves

  protected void visit(Desugared.Literal literal) {}

  protected void visit(Desugared.ScopeVarLocation location) {}

  protected void visit(Desugared.SubScopeVarLocation location) {}

  protected void visit(Desugared.Id id) {}

  protected void visit(Desugared.OperatorRef operatorRef) {}

  // data

  protected void visit(Desugared.Struct struct) {
    struct.fields.values().forEach(this::accept);
  }

  protected void visit(Desugared.StructAccess structAccess) {
    structAccess.exp.accept(this);
  }

  protected void visit(Desugared.EnumInj enumInj) {
    enumInj.exp.accept(this);
  }

  protected void visit(Desugared.Match match) {
    match.exp.accept(this);
    match.arms.values().forEach(this::accept);
  }

  protected void visit(Desugared.Array array) {
    array.elements.forEach(this::accept);
  }

  // control

  protected void visit(Desugared.Fn fn) {
    fn.body.accept(this);
  }

  protected void visit(Desugared.Apply apply) {
    apply.fn.accept(this);
    apply.args.forEach(this::accept);
  }

  protected void visit(Desugared.Default aDefault) {
    aDefault.exceptions.forEach(this::accept);
    aDefault.justification.accept(this);
    aDefault.consequence.accept(this);
  }

  protected void visit(Desugared.If anIf) {
    anIf.condition.accept(this);
    anIf.ifTrue.accept(this);
    anIf.ifFalse.accept(this);
  }

  protected void visit(Desugared.ErrorOnEmpty errorOnEmpty) {
    errorOnEmpty.exp.accept(this);
  }
}

// End Visitor.java
