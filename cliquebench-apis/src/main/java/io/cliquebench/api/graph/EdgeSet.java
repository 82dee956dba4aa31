package io.cliquebench.api.graph;

/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

import java.util.ArrayList;
import java.util.Collection;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Predicate;
import java.util.stream.Stream;

/// Canonical container for undirected edges while a graph is being built.
///
/// Edges are kept in insertion order, without duplicates and without self-loops. Iteration
/// order only depends on the order of calls to [#add(int, int)], never on hashing, so anything
/// derived from an edge set built from a seeded stream is reproducible.
///
/// The set only grows during generation and only shrinks during trimming; freeze it into an
/// immutable [Graph] when done.
public class EdgeSet implements Iterable<Edge> {

  private final LinkedHashSet<Edge> edges;

  public EdgeSet() {
    this.edges = new LinkedHashSet<>();
  }

  public EdgeSet(Collection<Edge> initial) {
    this.edges = new LinkedHashSet<>(initial);
  }

  /// Adds the edge between `a` and `b` in canonical form.
  /// @return true if the edge was not already present
  /// @throws IllegalArgumentException for self-loops or negative ids
  public boolean add(int a, int b) {
    return edges.add(Edge.of(a, b));
  }

  /// @return true if the edge was not already present
  public boolean add(Edge edge) {
    return edges.add(edge);
  }

  public boolean contains(int a, int b) {
    return a != b && a >= 0 && b >= 0 && edges.contains(Edge.of(a, b));
  }

  public boolean contains(Edge edge) {
    return edges.contains(edge);
  }

  public int size() {
    return edges.size();
  }

  public boolean isEmpty() {
    return edges.isEmpty();
  }

  /// Removes every edge matching the filter.
  /// @return the number of removed edges
  public int removeIf(Predicate<Edge> filter) {
    int before = edges.size();
    edges.removeIf(filter);
    return before - edges.size();
  }

  /// Keeps only the edges contained in `keep`, preserving the current order.
  /// @return the number of removed edges
  public int retainAll(Collection<Edge> keep) {
    int before = edges.size();
    edges.retainAll(keep instanceof Set ? keep : new LinkedHashSet<>(keep));
    return before - edges.size();
  }

  /// @return the edges in canonical `(u, v)` order
  public List<Edge> sorted() {
    List<Edge> list = new ArrayList<>(edges);
    list.sort(null);
    return list;
  }

  /// @return a snapshot of the edges in insertion order
  public List<Edge> toList() {
    return new ArrayList<>(edges);
  }

  public Stream<Edge> stream() {
    return edges.stream();
  }

  @Override
  public Iterator<Edge> iterator() {
    return edges.iterator();
  }

  @Override
  public String toString() {
    return "EdgeSet{" + edges.size() + " edges}";
  }
}
