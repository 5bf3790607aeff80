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

/** Type of a value of the rules language. */
public interface Type {
  /**
   * Description of the type, e.g. "{@code integer}", "{@code integer ->
   * money}", "{@code Household}".
   *
   * <p>Two types are equal if and only if their descriptions are equal.
   */
  String description();

  /** Returns whether values of this type are functions. */
  default boolean isFunction() {
    return false;
  }
}

// End Type.java
