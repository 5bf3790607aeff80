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

import static java.util.Objects.requireNonNull;

import java.util.Objects;

/** How a scope variable is visible to the callers of its scope. */
public class Io {
  /** Internal variable: neither input nor output. */
  public static final Io INTERNAL = new Io(Input.NO_INPUT, false);

  /** Output-only variable. */
  public static final Io OUTPUT = new Io(Input.NO_INPUT, true);

  /** Input-only variable: the caller must define it; the scope may not. */
  public static final Io INPUT = new Io(Input.ONLY_INPUT, false);

  /** Context variable: the scope defines it, the caller may override it. */
  public static final Io CONTEXT = new Io(Input.REUSABLE, false);

  public final Input input;
  public final boolean output;

  public Io(Input input, boolean output) {
    this.input = requireNonNull(input);
    this.output = output;
  }

  /** Returns a copy of this with a given output flag. */
  public Io withOutput(boolean output) {
    return output == this.output ? this : new Io(input, output);
  }

  @Override
  public int hashCode() {
    return Objects.hash(input, output);
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof Io
            && ((Io) o).input == input
            && ((Io) o).output == output;
  }

  @Override
  public String toString() {
    return input.moniker + (output ? " output" : "");
  }

  /** Input mode of a variable. */
  public enum Input {
    /** Cannot be defined by a caller. */
    NO_INPUT("internal"),
    /** Must be defined by the caller, and only by the caller. */
    ONLY_INPUT("input"),
    /** May be redefined by the caller; otherwise the scope's own definition
     * applies. */
    REUSABLE("context");

    public final String moniker;

    Input(String moniker) {
      this.moniker = moniker;
    }
  }
}

// End Io.java
