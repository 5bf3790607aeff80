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
package net.hydromatic.defeasible.util;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasToString;
import static org.hamcrest.core.Is.is;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

/** Tests for {@link Static}. */
public class StaticTest {
  @Test void testPlus() {
    final Map<String, Integer> map = ImmutableMap.of("a", 1, "b", 2);
    assertThat(Static.plus(map, "c", 3), hasToString("{a=1, b=2, c=3}"));
    // A new value for an existing key replaces the old one
    final Map<String, Integer> map2 = Static.plus(map, "a", 4);
    assertThat(map2.get("a"), is(4));
    assertThat(map2.size(), is(2));
    assertThat(map, hasToString("{a=1, b=2}"));
  }

  @Test void testTransform() {
    assertThat(Static.transformEager(ImmutableList.of(1, 2, 3), i -> i * 2),
        hasToString("[2, 4, 6]"));
    assertThat(
        Static.transformValuesEager(ImmutableMap.of("a", 1), i -> i + 1),
        hasToString("{a=2}"));
    assertThat(Static.last(ImmutableList.of("x", "y")), is("y"));
  }
}

// End StaticTest.java
