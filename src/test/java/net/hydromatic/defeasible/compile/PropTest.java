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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.core.Is.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

/** Tests for {@link Prop}. */
public class PropTest {
  @Test void testDefaults() {
    final Map<Prop, Object> map = new HashMap<>();
    assertThat(Prop.LOG_RULE_DECISIONS.booleanValue(map), is(true));
    assertThat(Prop.SIMPLIFY_DEFAULTS.booleanValue(map), is(true));
    assertThat(Prop.STATE_SEPARATOR.stringValue(map), is("_"));
    assertThat(Prop.FUNCTION_PARAMETER_NAME.stringValue(map), is("param"));
  }

  @Test void testLookup() {
    assertThat(Prop.lookup("stateSeparator"), is(Prop.STATE_SEPARATOR));
    assertThat(Prop.lookup("STATE_SEPARATOR"), is(Prop.STATE_SEPARATOR));
    assertThrows(IllegalArgumentException.class,
        () -> Prop.lookup("noSuchProperty"));
  }

  @Test void testSet() {
    final Map<Prop, Object> map = new HashMap<>();
    Prop.SIMPLIFY_DEFAULTS.setLenient(map, "false");
    assertThat(Prop.SIMPLIFY_DEFAULTS.booleanValue(map), is(false));
    Prop.STATE_SEPARATOR.set(map, ".");
    assertThat(Prop.STATE_SEPARATOR.stringValue(map), is("."));

    // Wrong type
    assertThrows(IllegalArgumentException.class,
        () -> Prop.STATE_SEPARATOR.set(map, true));
    assertThrows(IllegalArgumentException.class,
        () -> Prop.STATE_SEPARATOR.booleanValue(map));
    // Required
    assertThrows(IllegalArgumentException.class,
        () -> Prop.STATE_SEPARATOR.set(map, null));
  }
}

// End PropTest.java
