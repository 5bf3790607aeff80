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

import com.google.common.collect.ImmutableList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.defeasible.ast.Uid;

/**
 * Creates and caches types.
 *
 * <p>Structurally equal types are the same object if both were created by
 * the same type system.
 */
public class TypeSystem {
  private final Map<String, Type> typeByDescription = new HashMap<>();

  /** Creates a TypeSystem. */
  public TypeSystem() {
    for (PrimitiveType primitiveType : PrimitiveType.values()) {
      typeByDescription.put(primitiveType.moniker, primitiveType);
    }
  }

  @SuppressWarnings("unchecked")
  private <T extends Type> T intern(T type) {
    return (T) typeByDescription.computeIfAbsent(type.description(),
        d -> type);
  }

  /** Creates a function type. */
  public FnType fnType(Type paramType, Type resultType) {
    return intern(new FnType(paramType, resultType));
  }

  /** Creates a tuple type. */
  public TupleType tupleType(List<? extends Type> argTypes) {
    return intern(new TupleType(argTypes));
  }

  /** Creates a tuple type from an array of types. */
  public TupleType tupleType(Type argType0, Type argType1,
      Type... argTypes) {
    return tupleType(
        ImmutableList.<Type>builder().add(argType0).add(argType1)
            .add(argTypes).build());
  }

  /** Creates an array type, e.g. "{@code integer collection}". */
  public CollectionType arrayType(Type elementType) {
    return intern(
        new CollectionType(CollectionType.Kind.ARRAY, elementType));
  }

  /** Creates an option type, e.g. "{@code integer option}". */
  public CollectionType optionType(Type elementType) {
    return intern(
        new CollectionType(CollectionType.Kind.OPTION, elementType));
  }

  /** Creates the type of a structure. */
  public NamedType structType(Uid.StructName name) {
    return intern(new NamedType(name));
  }

  /** Creates the type of an enumeration. */
  public NamedType enumType(Uid.EnumName name) {
    return intern(new NamedType(name));
  }
}

// End TypeSystem.java
