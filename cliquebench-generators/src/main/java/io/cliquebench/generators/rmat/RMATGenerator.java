package io.cliquebench.generators.rmat;

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

import io.cliquebench.api.graph.EdgeSet;
import io.cliquebench.api.graph.Graph;
import io.cliquebench.generators.random.RandomGenerators;
import org.apache.commons.rng.UniformRandomProvider;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Recursive-matrix (R-MAT) random graph generator.
 *
 * <p>Each edge is a walk down {@code ceil(log2(vertexCount))} levels of the adjacency matrix.
 * At each level one uniform draw picks a quadrant using the cumulative thresholds
 * {@code a}, {@code a+b}, {@code a+b+c}; the quadrant's row and column bits are appended to
 * the two endpoints. Endpoints are then reduced modulo the vertex count, self-loops are
 * dropped and repeated edges collapse.
 *
 * <p>Generation stops once {@code edgeCount} unique edges exist or after
 * {@value #ATTEMPTS_PER_EDGE} draws per requested edge. Hitting the draw budget is not an
 * error: the smaller graph is returned, the shortfall is logged, and
 * {@link RMATResult#isComplete()} is false.
 *
 * <pre>{@code
 * RMATResult result = new RMATGenerator().run(RMATParams.of(RMATPreset.SKEWED_1, 200, 2500, 44L));
 * Graph graph = result.graph();
 * }</pre>
 */
public class RMATGenerator {
  private static final Logger logger = LogManager.getLogger(RMATGenerator.class);

  /// Draws allowed per requested edge before giving up.
  public static final int ATTEMPTS_PER_EDGE = 10;

  private final RandomGenerators.Algorithm algorithm;

  public RMATGenerator() {
    this(RandomGenerators.Algorithm.XO_SHI_RO_256_PP);
  }

  public RMATGenerator(RandomGenerators.Algorithm algorithm) {
    this.algorithm = algorithm;
  }

  /// Generates a graph, discarding run statistics.
  /// @param params validated parameters
  /// @return the graph, possibly with fewer edges than requested
  public Graph generate(RMATParams params) {
    return run(params).graph();
  }

  /// Generates a graph and reports how the run went.
  /// @param params validated parameters
  /// @return the graph with attempt count, seed and completeness
  public RMATResult run(RMATParams params) {
    long seed = params.seed() != null ? params.seed() : RandomGenerators.randomSeed();
    int vertexCount = params.vertexCount();
    int requested = params.edgeCount();

    if (vertexCount == 1) {
      logger.debug("R-MAT with a single vertex has no edges");
      return new RMATResult(Graph.dense(1, new EdgeSet()), requested, 0, seed);
    }

    UniformRandomProvider rng = RandomGenerators.create(algorithm, seed);
    int levels = 32 - Integer.numberOfLeadingZeros(vertexCount - 1);
    double ab = params.a() + params.b();
    double abc = ab + params.c();
    long budget = (long) ATTEMPTS_PER_EDGE * requested;

    EdgeSet edges = new EdgeSet();
    long attempts = 0;
    while (edges.size() < requested && attempts < budget) {
      long u = 0;
      long v = 0;
      for (int level = 0; level < levels; level++) {
        double r = rng.nextDouble();
        int rowBit;
        int colBit;
        if (r < params.a()) {
          rowBit = 0;
          colBit = 0;
        } else if (r < ab) {
          rowBit = 0;
          colBit = 1;
        } else if (r < abc) {
          rowBit = 1;
          colBit = 0;
        } else {
          rowBit = 1;
          colBit = 1;
        }
        u = (u << 1) | rowBit;
        v = (v << 1) | colBit;
      }
      attempts++;
      int source = (int) (u % vertexCount);
      int target = (int) (v % vertexCount);
      if (source != target) {
        edges.add(source, target);
      }
    }

    RMATResult result = new RMATResult(Graph.dense(vertexCount, edges), requested, attempts, seed);
    if (!result.isComplete()) {
      logger.warn("R-MAT stopped after {} attempts with {} of {} requested edges (seed {})",
          attempts, edges.size(), requested, seed);
    } else {
      logger.debug("R-MAT generated {} edges on {} vertices in {} attempts (seed {})",
          edges.size(), vertexCount, attempts, seed);
    }
    return result;
  }
}
