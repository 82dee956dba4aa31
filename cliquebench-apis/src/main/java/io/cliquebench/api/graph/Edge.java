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

/// An undirected edge in canonical form, with `u < v`.
///
/// Use [#of(int, int)] to build an edge from endpoints in either order.
///
/// @param u the smaller endpoint
/// @param v the larger endpoint
public record Edge(int u, int v) implements Comparable<Edge> {

  /// Canonical constructor; rejects self-loops, negative ids and non-canonical order.
  public Edge {
    if (u < 0 || v < 0) {
      throw new IllegalArgumentException("Vertex ids must be non-negative: (" + u + ", " + v + ")");
    }
    if (u == v) {
      throw new IllegalArgumentException("Self-loop is not a valid edge: (" + u + ", " + v + ")");
    }
    if (u > v) {
      throw new IllegalArgumentException(
          "Edge must be canonical (u < v), use Edge.of: (" + u + ", " + v + ")");
    }
  }

  /// Builds the canonical edge for two endpoints given in any order.
  /// @param a one endpoint
  /// @param b the other endpoint
  /// @return the edge `(min(a,b), max(a,b))`
  public static Edge of(int a, int b) {
    return new Edge(Math.min(a, b), Math.max(a, b));
  }

  /// @param vertex a vertex id
  /// @return true if the vertex is one of this edge's endpoints
  public boolean touches(int vertex) {
    return u == vertex || v == vertex;
  }

  /// @param offset amount added to both endpoints
  /// @return the shifted edge
  public Edge shifted(int offset) {
    return new Edge(u + offset, v + offset);
  }

  @Override
  public int compareTo(Edge o) {
    int c = Integer.compare(u, o.u);
    return c != 0 ? c : Integer.compare(v, o.v);
  }

  @Override
  public String toString() {
    return "(" + u + "," + v + ")";
  }
}
