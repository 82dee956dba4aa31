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
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.OptionalInt;
import java.util.Set;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Immutable undirected simple graph: a vertex count plus a set of canonical edges.
 *
 * <p>There are two ways to build one:
 * <ul>
 *   <li>{@link #dense(int, Iterable)} for graphs indexed over {@code [0, n)}. Every endpoint
 *   must be below the vertex count. All generators produce graphs this way.</li>
 *   <li>{@link #referencing(Iterable)} for graphs read from an edge list, where the vertex
 *   count is the number of distinct ids referenced by the edges. Ids may start at 0 or 1, and
 *   isolated vertices are not represented.</li>
 * </ul>
 *
 * <p>Edge iteration order is the order the edges were supplied in.
 */
public final class Graph {

  private final int vertexCount;
  private final Set<Edge> edges;

  private Graph(int vertexCount, Set<Edge> edges) {
    this.vertexCount = vertexCount;
    this.edges = Collections.unmodifiableSet(edges);
  }

  /**
   * Builds a graph over {@code [0, vertexCount)}.
   *
   * @param vertexCount number of vertices, at least 0
   * @param edges edges whose endpoints are all below {@code vertexCount}
   * @return the graph
   * @throws IllegalArgumentException if an endpoint is out of range
   */
  public static Graph dense(int vertexCount, Iterable<Edge> edges) {
    if (vertexCount < 0) {
      throw new IllegalArgumentException("Vertex count must be non-negative: " + vertexCount);
    }
    LinkedHashSet<Edge> copy = new LinkedHashSet<>();
    for (Edge edge : edges) {
      if (edge.v() >= vertexCount) {
        throw new IllegalArgumentException(
            "Edge " + edge + " references a vertex outside [0, " + vertexCount + ")");
      }
      copy.add(edge);
    }
    return new Graph(vertexCount, copy);
  }

  /**
   * Builds a graph whose vertex count is the number of distinct ids referenced by the edges.
   *
   * @param edges the edges
   * @return the graph
   */
  public static Graph referencing(Iterable<Edge> edges) {
    LinkedHashSet<Edge> copy = new LinkedHashSet<>();
    Set<Integer> ids = new TreeSet<>();
    for (Edge edge : edges) {
      copy.add(edge);
      ids.add(edge.u());
      ids.add(edge.v());
    }
    return new Graph(ids.size(), copy);
  }

  /**
   * Builds a graph with a declared vertex count, without range checks. Used for formats that
   * carry an explicit vertex count, such as the DIMACS problem line.
   *
   * @param vertexCount the declared vertex count
   * @param edges the edges
   * @return the graph
   */
  public static Graph declared(int vertexCount, Iterable<Edge> edges) {
    if (vertexCount < 0) {
      throw new IllegalArgumentException("Vertex count must be non-negative: " + vertexCount);
    }
    LinkedHashSet<Edge> copy = new LinkedHashSet<>();
    edges.forEach(copy::add);
    return new Graph(vertexCount, copy);
  }

  public int vertexCount() {
    return vertexCount;
  }

  public int edgeCount() {
    return edges.size();
  }

  /** @return the edges, unmodifiable, in construction order */
  public Set<Edge> edges() {
    return edges;
  }

  /** @return the edges sorted by {@code (u, v)} */
  public List<Edge> sortedEdges() {
    List<Edge> sorted = new ArrayList<>(edges);
    sorted.sort(null);
    return sorted;
  }

  public boolean hasEdge(int a, int b) {
    return a != b && a >= 0 && b >= 0 && edges.contains(Edge.of(a, b));
  }

  /**
   * Checks that every pair of the given vertices is joined by an edge.
   *
   * @param vertices candidate clique members; duplicates are ignored
   * @return true if the vertices form a clique
   */
  public boolean isClique(Collection<Integer> vertices) {
    List<Integer> members = new ArrayList<>(new LinkedHashSet<>(vertices));
    for (int i = 0; i < members.size(); i++) {
      for (int j = i + 1; j < members.size(); j++) {
        if (!hasEdge(members.get(i), members.get(j))) {
          return false;
        }
      }
    }
    return true;
  }

  /** @return the ids appearing as an endpoint of at least one edge, ascending */
  public SortedSet<Integer> referencedVertices() {
    SortedSet<Integer> ids = new TreeSet<>();
    for (Edge edge : edges) {
      ids.add(edge.u());
      ids.add(edge.v());
    }
    return ids;
  }

  public OptionalInt minVertex() {
    return edges.stream().mapToInt(Edge::u).min();
  }

  public OptionalInt maxVertex() {
    return edges.stream().mapToInt(Edge::v).max();
  }

  /** @return degree per referenced vertex, keyed by ascending id */
  public SortedMap<Integer, Integer> degrees() {
    SortedMap<Integer, Integer> degrees = new TreeMap<>();
    for (Edge edge : edges) {
      degrees.merge(edge.u(), 1, Integer::sum);
      degrees.merge(edge.v(), 1, Integer::sum);
    }
    return degrees;
  }

  /** @return {@code 2m / (n (n - 1))}, or 0 for fewer than two vertices */
  public double density() {
    if (vertexCount < 2) {
      return 0.0d;
    }
    return (2.0d * edges.size()) / ((double) vertexCount * (vertexCount - 1));
  }

  /**
   * @param offset added to every endpoint, typically {@code +1} or {@code -1}
   * @return a graph with the same vertex count and shifted ids
   */
  public Graph shifted(int offset) {
    if (offset == 0) {
      return this;
    }
    LinkedHashSet<Edge> moved = new LinkedHashSet<>();
    for (Edge edge : edges) {
      moved.add(edge.shifted(offset));
    }
    return new Graph(vertexCount, moved);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Graph)) {
      return false;
    }
    Graph graph = (Graph) o;
    return vertexCount == graph.vertexCount && edges.equals(graph.edges);
  }

  @Override
  public int hashCode() {
    return Objects.hash(vertexCount, edges);
  }

  @Override
  public String toString() {
    return "Graph{vertices=" + vertexCount + ", edges=" + edges.size() + "}";
  }
}
