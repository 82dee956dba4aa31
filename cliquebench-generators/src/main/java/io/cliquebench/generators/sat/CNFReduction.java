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

import io.cliquebench.api.graph.Edge;
import io.cliquebench.api.graph.EdgeSet;
import io.cliquebench.api.graph.Graph;
import io.cliquebench.api.sat.CNFFormula;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;

/**
 * Reduces a CNF formula to a k-partite graph whose maximum clique size equals the number of
 * clauses exactly when the formula is satisfiable.
 *
 * <p>Every literal occurrence becomes a vertex. Two vertices are adjacent iff they belong to
 * different clauses and their literals are not complementary ({@code l1 != -l2}). A k-clique
 * therefore picks one literal per clause without picking both {@code x} and {@code -x}, which
 * is a satisfying assignment.
 *
 * <p>The graph has {@code L} vertices for {@code L} literal occurrences and is built by a
 * single pass over all vertex pairs.
 */
public final class CNFReduction {
  private static final Logger logger = LogManager.getLogger(CNFReduction.class);

  private CNFReduction() {
  }

  /**
   * Builds the clause-literal graph for a formula.
   *
   * @param formula a formula with at least one clause and no empty clause
   * @return the graph with its partitions
   */
  public static ReducedGraph reduce(CNFFormula formula) {
    int vertexCount = formula.literalCount();
    int[] clauseOf = new int[vertexCount];
    int[] literalOf = new int[vertexCount];
    List<List<Integer>> partitions = new ArrayList<>(formula.clauseCount());

    int vertex = 0;
    for (int i = 0; i < formula.clauseCount(); i++) {
      List<Integer> partition = new ArrayList<>();
      for (int literal : formula.clause(i)) {
        clauseOf[vertex] = i;
        literalOf[vertex] = literal;
        partition.add(vertex);
        vertex++;
      }
      partitions.add(partition);
    }

    EdgeSet edges = new EdgeSet();
    for (int u = 0; u < vertexCount; u++) {
      for (int v = u + 1; v < vertexCount; v++) {
        if (clauseOf[u] != clauseOf[v] && literalOf[u] != -literalOf[v]) {
          edges.add(new Edge(u, v));
        }
      }
    }

    Graph graph = Graph.dense(vertexCount, edges);
    logger.debug("Reduced {} clauses over {} variables to {}", formula.clauseCount(),
        formula.numVariables(), graph);
    return new ReducedGraph(formula, graph, partitions, clauseOf, literalOf);
  }

  /**
   * Convenience overload validating raw clauses first.
   *
   * @param clauses clauses as lists of non-zero literals
   * @return the graph with its partitions
   * @throws io.cliquebench.api.errors.GraphConfigurationException for no clauses, an empty
   *     clause or a zero literal
   */
  public static ReducedGraph reduce(List<? extends List<Integer>> clauses) {
    return reduce(CNFFormula.of(clauses));
  }

  /// Comment lines describing a reduction, used as the header of written graph files.
  public static List<String> describe(ReducedGraph reduced) {
    CNFFormula formula = reduced.formula();
    Graph graph = reduced.graph();
    int k = reduced.partitionCount();
    return List.of(
        " SAT-to-Clique reduction graph",
        " Original SAT: " + formula.clauseCount() + " clauses, " + formula.numVariables()
            + " variables",
        " Graph: " + graph.vertexCount() + " vertices, " + graph.edgeCount() + " edges",
        " Structure: " + k + "-partite graph",
        " Maximum clique size: " + k + " if satisfiable (one vertex per partition)");
  }
}
