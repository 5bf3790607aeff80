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
import static org.hamcrest.Matchers.nullValue;
import static org.hamcrest.core.Is.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

import net.hydromatic.defeasible.ast.Pos;
import org.junit.jupiter.api.Test;

/** Tests for {@link Digraph}. */
public class DigraphTest {
  private static Pos pos(int line) {
    return Pos.of("test", line, 1, 2);
  }

  private static Digraph<String> graph(String... vertices) {
    final Digraph<String> graph = new Digraph<>();
    for (String vertex : vertices) {
      graph.addVertex(vertex);
    }
    return graph;
  }

  @Test void testAdjacency() {
    final Digraph<String> graph = graph("a", "b", "c");
    graph.addEdge("c", "a", pos(1))
        .addEdge("b", "a", pos(2))
        .addEdge("b", "a", pos(3));
    assertThat(graph.vertices(), hasToString("[a, b, c]"));
    // Predecessors are in the order the vertices were added
    assertThat(graph.predecessors("a"), hasToString("[b, c]"));
    assertThat(graph.successors("b"), hasToString("[a]"));
    assertThat(graph.inDegree("a"), is(2));
    assertThat(graph.outDegree("a"), is(0));
    // The first position of an edge is kept
    assertThat(graph.edgePos("b", "a"), is(pos(2)));
    assertThat(graph.edgePos("a", "b"), nullValue());
    assertThat(graph, hasToString("{a -> [], b -> [a], c -> [a]}"));
    assertThrows(IllegalArgumentException.class,
        () -> graph.addEdge("a", "z", pos(4)));
  }

  @Test void testTopologicalOrder() {
    final Digraph<String> graph = graph("d", "c", "b", "a");
    graph.addEdge("a", "b", pos(1))
        .addEdge("b", "c", pos(2))
        .addEdge("a", "d", pos(3));
    assertThat(graph.findCycle(), nullValue());
    // "d" becomes ready after "a", and was added before "b"
    assertThat(graph.topologicalOrder(), hasToString("[a, d, b, c]"));
  }

  @Test void testCycle() {
    final Digraph<String> graph = graph("a", "b", "c", "d");
    graph.addEdge("a", "b", pos(1))
        .addEdge("b", "c", pos(2))
        .addEdge("c", "b", pos(3))
        .addEdge("c", "d", pos(4));
    assertThat(graph.findCycle(), hasToString("[b, c]"));
    assertThrows(IllegalStateException.class, graph::topologicalOrder);
  }

  @Test void testSelfLoop() {
    final Digraph<String> graph = graph("a", "b");
    graph.addEdge("a", "b", pos(1))
        .addEdge("b", "b", pos(2));
    assertThat(graph.findCycle(), hasToString("[b]"));
  }
}

// End DigraphTest.java
