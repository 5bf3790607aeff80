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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;
import java.util.Set;
import net.hydromatic.defeasible.ast.Pos;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Directed graph whose edges are labelled with a source position.
 *
 * <p>Vertices are kept in the order in which they were added; that order
 * breaks ties wherever an algorithm has a choice, so results are
 * deterministic.
 *
 * @param <V> Vertex type
 */
public class Digraph<V> {
  private final Map<V, Integer> ordinals = new HashMap<>();
  private final Map<V, Map<V, Pos>> successors = new LinkedHashMap<>();
  private final Map<V, Map<V, Pos>> predecessors = new LinkedHashMap<>();

  /** Adds a vertex, if it is not present. */
  @CanIgnoreReturnValue
  public Digraph<V> addVertex(V v) {
    if (!ordinals.containsKey(v)) {
      ordinals.put(v, ordinals.size());
      successors.put(v, new LinkedHashMap<>());
      predecessors.put(v, new LinkedHashMap<>());
    }
    return this;
  }

  /** Adds an edge; both vertices must be present. If there is already an edge
   * between the vertices, keeps its position. */
  @CanIgnoreReturnValue
  public Digraph<V> addEdge(V from, V to, Pos pos) {
    checkArgument(ordinals.containsKey(from), "unknown vertex %s", from);
    checkArgument(ordinals.containsKey(to), "unknown vertex %s", to);
    requireNonNull(successors.get(from)).putIfAbsent(to, pos);
    requireNonNull(predecessors.get(to)).putIfAbsent(from, pos);
    return this;
  }

  /** Returns the vertices, in the order they were added. */
  public List<V> vertices() {
    return ImmutableList.copyOf(successors.keySet());
  }

  public boolean containsVertex(V v) {
    return ordinals.containsKey(v);
  }

  /** Returns the vertices that a vertex has an edge to, in the order they
   * were added to the graph. */
  public List<V> successors(V v) {
    return sorted(adjacent(successors, v).keySet());
  }

  /** Returns the vertices that have an edge to a vertex, in the order they
   * were added to the graph. */
  public List<V> predecessors(V v) {
    return sorted(adjacent(predecessors, v).keySet());
  }

  public int outDegree(V v) {
    return adjacent(successors, v).size();
  }

  public int inDegree(V v) {
    return adjacent(predecessors, v).size();
  }

  /** Returns the position of an edge, or null if there is no such edge. */
  public @Nullable Pos edgePos(V from, V to) {
    return adjacent(successors, from).get(to);
  }

  private Map<V, Pos> adjacent(Map<V, Map<V, Pos>> map, V v) {
    final Map<V, Pos> adjacent = map.get(v);
    checkArgument(adjacent != null, "unknown vertex %s", v);
    return adjacent;
  }

  private List<V> sorted(Set<V> vertices) {
    final List<V> list = new ArrayList<>(vertices);
    list.sort((v0, v1) ->
        Integer.compare(requireNonNull(ordinals.get(v0)),
            requireNonNull(ordinals.get(v1))));
    return ImmutableList.copyOf(list);
  }

  /**
   * Returns a cycle, or null if the graph is acyclic.
   *
   * <p>The cycle is a list of vertices {@code [v0, ..., vn]} such that there
   * is an edge from each vertex to the next, and from {@code vn} to
   * {@code v0}. A vertex with an edge to itself is a cycle of one vertex.
   *
   * <p>Uses a depth-first search, starting from each unvisited vertex in
   * order, and coloring vertices white (not visited), gray (on the current
   * path) and black (finished).
   */
  public @Nullable List<V> findCycle() {
    final Map<V, Color> colors = new HashMap<>();
    for (V start : successors.keySet()) {
      if (colors.containsKey(start)) {
        continue;
      }
      final Deque<V> path = new ArrayDeque<>();
      final Deque<Iterator<V>> iterators = new ArrayDeque<>();
      colors.put(start, Color.GRAY);
      path.addLast(start);
      iterators.addLast(successors(start).iterator());
      while (!path.isEmpty()) {
        final Iterator<V> iterator = iterators.getLast();
        if (!iterator.hasNext()) {
          colors.put(path.removeLast(), Color.BLACK);
          iterators.removeLast();
          continue;
        }
        final V next = iterator.next();
        final Color color = colors.get(next);
        if (color == Color.GRAY) {
          // "next" is on the current path; the cycle is the path from there
          final List<V> cycle = new ArrayList<>();
          final Iterator<V> descending = path.descendingIterator();
          for (;;) {
            final V v = descending.next();
            cycle.add(v);
            if (v.equals(next)) {
              break;
            }
          }
          Collections.reverse(cycle);
          return ImmutableList.copyOf(cycle);
        }
        if (color == null) {
          colors.put(next, Color.GRAY);
          path.addLast(next);
          iterators.addLast(successors(next).iterator());
        }
      }
    }
    return null;
  }

  /**
   * Returns the vertices in topological order: every vertex comes after all
   * of its predecessors.
   *
   * <p>Among the vertices whose predecessors have all been emitted, the one
   * added to the graph first is emitted first.
   *
   * @throws IllegalStateException if the graph has a cycle
   */
  public List<V> topologicalOrder() {
    final Map<V, Integer> inDegrees = new HashMap<>();
    final PriorityQueue<V> ready =
        new PriorityQueue<>((v0, v1) ->
            Integer.compare(requireNonNull(ordinals.get(v0)),
                requireNonNull(ordinals.get(v1))));
    predecessors.forEach((v, preds) -> {
      inDegrees.put(v, preds.size());
      if (preds.isEmpty()) {
        ready.add(v);
      }
    });
    final ImmutableList.Builder<V> order = ImmutableList.builder();
    int count = 0;
    while (!ready.isEmpty()) {
      final V v = ready.remove();
      order.add(v);
      ++count;
      for (V next : successors(v)) {
        final int inDegree = requireNonNull(inDegrees.get(next)) - 1;
        inDegrees.put(next, inDegree);
        if (inDegree == 0) {
          ready.add(next);
        }
      }
    }
    if (count < ordinals.size()) {
      throw new IllegalStateException("graph has a cycle");
    }
    return order.build();
  }

  @Override
  public String toString() {
    final StringBuilder b = new StringBuilder("{");
    successors.forEach((v, succs) -> {
      if (b.length() > 1) {
        b.append(", ");
      }
      b.append(v).append(" -> ").append(sorted(succs.keySet()));
    });
    return b.append('}').toString();
  }

  /** State of a vertex during depth-first search. */
  private enum Color {
    GRAY, BLACK
  }
}

// End Digraph.java
