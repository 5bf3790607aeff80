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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

/**
 * Unique identifiers.
 *
 * <p>An identifier is a name plus an ordinal; the ordinal distinguishes
 * declarations with the same name elsewhere in the program. The position is
 * where the identifier was declared, and does not take part in equality.
 *
 * <p>This class functions as a namespace, so that we can keep the class names
 * short.
 */
public abstract class Uid implements Comparable<Uid> {
  public final String name;
  public final int i;
  public final Pos pos;

  Uid(String name, int i, Pos pos) {
    this.name = requireNonNull(name, "name");
    this.i = i;
    this.pos = requireNonNull(pos, "pos");
    checkArgument(!name.isEmpty(), "empty name");
    checkArgument(i >= 0, "negative ordinal");
  }

  @Override
  public int hashCode() {
    return name.hashCode() * 31 + i;
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o != null
            && o.getClass() == getClass()
            && ((Uid) o).name.equals(name)
            && ((Uid) o).i == i;
  }

  /** {@inheritDoc}
   *
   * <p>Collate first on name, then on ordinal. */
  @Override
  public int compareTo(Uid o) {
    int c = name.compareTo(o.name);
    if (c != 0) {
      return c;
    }
    return Integer.compare(i, o.i);
  }

  @Override
  public String toString() {
    return i == 0 ? name : name + "_" + i;
  }

  /** Name of a scope. */
  public static class ScopeName extends Uid {
    public ScopeName(String name, int i, Pos pos) {
      super(name, i, pos);
    }
  }

  /** Variable of a scope. */
  public static class ScopeVar extends Uid {
    public ScopeVar(String name, int i, Pos pos) {
      super(name, i, pos);
    }
  }

  /** Name under which a scope calls another scope. */
  public static class SubScopeName extends Uid {
    public SubScopeName(String name, int i, Pos pos) {
      super(name, i, pos);
    }
  }

  /** State of a variable that is refined in several stages. */
  public static class StateName extends Uid {
    public StateName(String name, int i, Pos pos) {
      super(name, i, pos);
    }
  }

  /** Identifier of a rule. */
  public static class RuleName extends Uid {
    public RuleName(String name, int i, Pos pos) {
      super(name, i, pos);
    }
  }

  /** Name of a structure type. */
  public static class StructName extends Uid {
    public StructName(String name, int i, Pos pos) {
      super(name, i, pos);
    }
  }

  /** Name of a field of a structure. */
  public static class FieldName extends Uid {
    public FieldName(String name, int i, Pos pos) {
      super(name, i, pos);
    }
  }

  /** Name of an enumeration type. */
  public static class EnumName extends Uid {
    public EnumName(String name, int i, Pos pos) {
      super(name, i, pos);
    }
  }

  /** Constructor of an enumeration. */
  public static class ConstructorName extends Uid {
    public ConstructorName(String name, int i, Pos pos) {
      super(name, i, pos);
    }
  }

  /** Variable bound by an abstraction, or the parameter of a rule. */
  public static class Var extends Uid {
    public Var(String name, int i, Pos pos) {
      super(name, i, pos);
    }
  }
}

// End Uid.java
