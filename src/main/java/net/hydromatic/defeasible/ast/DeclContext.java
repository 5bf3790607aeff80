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

import com.google.common.collect.ImmutableMap;
import java.util.Map;
import net.hydromatic.defeasible.type.Type;

/**
 * Declarations of structures and enumerations that are shared by all scopes
 * of a program.
 *
 * <p>The lowering does not look inside; it hands the context unchanged to
 * later passes.
 */
public class DeclContext {
  public static final DeclContext EMPTY =
      new DeclContext(ImmutableMap.of(), ImmutableMap.of());

  /** Fields of each structure, in declaration order. */
  public final ImmutableMap<Uid.StructName, ImmutableMap<Uid.FieldName, Type>>
      structs;

  /** Constructors of each enumeration and the type of their payload, in
   * declaration order. */
  public final ImmutableMap<Uid.EnumName,
      ImmutableMap<Uid.ConstructorName, Type>> enums;

  public DeclContext(
      Map<Uid.StructName, ImmutableMap<Uid.FieldName, Type>> structs,
      Map<Uid.EnumName, ImmutableMap<Uid.ConstructorName, Type>> enums) {
    this.structs = ImmutableMap.copyOf(structs);
    this.enums = ImmutableMap.copyOf(enums);
  }
}

// End DeclContext.java
