package io.cliquebench.generators.sat3;

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

import io.cliquebench.api.errors.GraphConfigurationException;
import io.cliquebench.api.graph.Edge;
import io.cliquebench.api.graph.EdgeSet;
import io.cliquebench.api.graph.Graph;
import io.cliquebench.api.sat.CNFFormula;
import io.cliquebench.generators.random.RandomGenerators;
import org.apache.commons.rng.UniformRandomProvider;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.HashSet;
import java.util.List;

/**
 * Builds a literal-conflict graph from a synthetic 3-SAT instance whose clauses come from
 * {@link ClauseHasher}.
 *
 * <ol>
 *   <li>The vertex target is capped at {@link HashedSAT3Options#vertexCap()}; then
 *   {@code nVars = target / 2} and {@code nClauses = 2 * nVars}.</li>
 *   <li>Variable {@code x} owns vertex {@code 2(x-1)} for {@code x} and {@code 2(x-1)+1} for
 *   {@code -x}. The two literals of every variable are always connected.</li>
 *   <li>Each literal pair of each clause, in order (0,1), (0,2), (1,2), is connected with the
 *   configured conflict probability.</li>
 *   <li>If the graph has more than {@code round(C(n, 2) * density)} edges, a uniform random
 *   subset of exactly that many is kept. Edges are never added, so the density argument is an
 *   upper bound.</li>
 * </ol>
 *
 * <p>All draws come from one generator seeded per call; the clauses themselves are not random.
 */
public class HashedSAT3Builder {
  private static final Logger logger = LogManager.getLogger(HashedSAT3Builder.class);

  /// Smallest vertex target: three variables.
  public static final int MIN_VERTICES = 2 * ClauseHasher.MIN_VARIABLES;

  private final HashedSAT3Options options;

  public HashedSAT3Builder() {
    this(HashedSAT3Options.defaults());
  }

  public HashedSAT3Builder(HashedSAT3Options options) {
    this.options = options;
  }

  public HashedSAT3Options options() {
    return options;
  }

  /// The hashed formula as a [CNFFormula], clause `i` being `ClauseHasher.clause(i, nVars)`.
  /// @param nVars number of variables, at least 3
  /// @param nClauses number of clauses, at least 1
  /// @return the formula
  public static CNFFormula formula(int nVars, int nClauses) {
    if (nClauses < 1) {
      throw new GraphConfigurationException("clause count must be positive, got " + nClauses);
    }
    int[][] clauses = new int[nClauses][];
    for (int i = 0; i < nClauses; i++) {
      clauses[i] = ClauseHasher.clause(i, nVars);
    }
    return CNFFormula.of(clauses);
  }

  /// @param vertexTarget requested vertex count, at least 6; capped by the options
  /// @param densityTarget maximum density in `[0, 1]`
  /// @param seed seed for the conflict and trimming draws
  /// @return a graph with at most `min(vertexTarget, cap)` vertices
  public Graph build(int vertexTarget, double densityTarget, long seed) {
    if (!(densityTarget >= 0.0d && densityTarget <= 1.0d)) {
      throw new GraphConfigurationException("density must be in [0, 1], got " + densityTarget);
    }
    if (vertexTarget < MIN_VERTICES) {
      throw new GraphConfigurationException(
          "vertex target must be at least " + MIN_VERTICES + ", got " + vertexTarget);
    }
    int target = Math.min(vertexTarget, options.vertexCap());
    if (target < vertexTarget) {
      logger.info("Vertex target {} capped at {}", vertexTarget, target);
    }
    int nVars = target / 2;
    int nClauses = 2 * nVars;
    CNFFormula formula = formula(nVars, nClauses);
    UniformRandomProvider rng = RandomGenerators.create(options.algorithm(), seed);

    EdgeSet edges = new EdgeSet();
    for (int x = 1; x <= nVars; x++) {
      edges.add(vertexOf(x), vertexOf(-x));
    }
    double p = options.conflictProbability();
    for (List<Integer> clause : formula.clauses()) {
      for (int i = 0; i < clause.size(); i++) {
        for (int j = i + 1; j < clause.size(); j++) {
          if (rng.nextDouble() < p) {
            edges.add(vertexOf(clause.get(i)), vertexOf(clause.get(j)));
          }
        }
      }
    }

    int nFinal = Math.min(2 * nVars, target);
    edges.removeIf(e -> e.v() >= nFinal);

    long targetEdges = Math.round((double) nFinal * (nFinal - 1) / 2.0d * densityTarget);
    if (edges.size() > targetEdges) {
      List<Edge> kept = RandomGenerators.sample(edges.sorted(), (int) targetEdges, rng);
      int removed = edges.retainAll(new HashSet<>(kept));
      logger.debug("Trimmed {} edges to reach density {}", removed, densityTarget);
    } else {
      logger.debug("{} edges already within the target of {}", edges.size(), targetEdges);
    }

    Graph graph = Graph.dense(nFinal, edges);
    logger.debug("Hashed 3-SAT graph: {} variables, {} clauses, {} (seed {})", nVars, nClauses,
        graph, seed);
    return graph;
  }

  /// Vertex id of a literal in the literal-conflict graph.
  static int vertexOf(int literal) {
    int base = 2 * (Math.abs(literal) - 1);
    return literal > 0 ? base : base + 1;
  }
}
