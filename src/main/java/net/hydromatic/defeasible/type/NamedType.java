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
package net.hydromatic.defeasible.type;

import static java.util.Objects.requireNonNull;

import net.hydromatic.defeasible.ast.Uid;

/**
 * Type of a structure or enumeration declared in the
 * {@link net.hydromatic.defeasible.ast.DeclContext}.
 */
public class NamedType extends BaseType {
  public final Uid name;

  NamedType(Uid name) {
    this.name = requireNonNull(name);
  }

  /** Returns whether this is the type of a structure. */
  public boolean isStruct() {
    return name instanceof Uid.StructName;
  }

  @Override
  public String description() {
    return name.toString();
  }
}

// End NamedType.java
