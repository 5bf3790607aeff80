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

/**
 * Type that wraps one element type: an array ("{@code integer collection}")
 * or an option ("{@code integer option}").
 */
public class CollectionType extends BaseType {
  public final Kind kind;
  public final Type elementType;

  CollectionType(Kind kind, Type elementType) {
    this.kind = requireNonNull(kind);
    this.elementType = requireNonNull(elementType);
  }

  @Override
  public String description() {
    final String element = elementType.description();
    return (element.contains(" ") ? "(" + element + ")" : element)
        + " " + kind.moniker;
  }

  /** Kind of collection. */
  public enum Kind {
    ARRAY("collection"),
    OPTION("option");

    public final String moniker;

    Kind(String moniker) {
      this.moniker = moniker;
    }
  }
}

// End CollectionType.java
