package io.cliquebench.generators.sat;

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

import io.cliquebench.api.graph.Graph;
import io.cliquebench.api.sat.CNFFormula;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/// The graph produced by [CNFReduction], together with the literal occurrence behind each
/// vertex.
///
/// Vertices are numbered in clause order and, within a clause, in literal order. Partition `i`
/// holds the vertices of clause `i`; partitions are disjoint, cover every vertex and contain no
/// edge.
public final class ReducedGraph {
  private final CNFFormula formula;
  private final Graph graph;
  private final List<List<Integer>> partitions;
  private final int[] clauseOf;
  private final int[] literalOf;

  ReducedGraph(CNFFormula formula, Graph graph, List<List<Integer>> partitions, int[] clauseOf,
               int[] literalOf) {
    this.formula = formula;
    this.graph = graph;
    List<List<Integer>> copy = new ArrayList<>(partitions.size());
    for (List<Integer> partition : partitions) {
      copy.add(List.copyOf(partition));
    }
    this.partitions = Collections.unmodifiableList(copy);
    this.clauseOf = clauseOf;
    this.literalOf = literalOf;
  }

  public CNFFormula formula() {
    return formula;
  }

  public Graph graph() {
    return graph;
  }

  /// @return one vertex list per clause, in clause order
  public List<List<Integer>> partitions() {
    return partitions;
  }

  public int partitionCount() {
    return partitions.size();
  }

  /// @return the index of the clause the vertex was created for
  public int clauseOf(int vertex) {
    return clauseOf[vertex];
  }

  /// @return the literal occurrence the vertex stands for
  public int literalOf(int vertex) {
    return literalOf[vertex];
  }

  /// Picks, for every clause, the first vertex whose literal is true under the assignment.
  ///
  /// For a satisfying assignment the result is a clique with one vertex per partition: two
  /// true literals can never be complementary.
  ///
  /// @param assignment truth values indexed by variable id, `assignment[0]` unused
  /// @return the chosen vertices, one per clause
  /// @throws IllegalArgumentException if some clause has no true literal
  public List<Integer> witnessClique(boolean[] assignment) {
    List<Integer> clique = new ArrayList<>(partitions.size());
    for (int i = 0; i < partitions.size(); i++) {
      Integer chosen = null;
      for (int vertex : partitions.get(i)) {
        if (CNFFormula.isTrue(literalOf[vertex], assignment)) {
          chosen = vertex;
          break;
        }
      }
      if (chosen == null) {
        throw new IllegalArgumentException("Assignment leaves clause " + i + " unsatisfied: "
            + formula.clause(i));
      }
      clique.add(chosen);
    }
    return clique;
  }

  @Override
  public String toString() {
    return "ReducedGraph{clauses=" + partitions.size() + ", " + graph + "}";
  }
}
