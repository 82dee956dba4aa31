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

import io.cliquebench.api.errors.GraphConfigurationException;

/// Parameters of one R-MAT run.
///
/// The four quadrant probabilities must be non-negative and sum to 1 within `1e-6`. Both counts
/// must be positive. A `null` seed asks the generator to pick one; the seed actually used is
/// reported in [RMATResult#seed()].
///
/// @param a probability of the top-left quadrant `(0,0)`
/// @param b probability of the top-right quadrant `(0,1)`
/// @param c probability of the bottom-left quadrant `(1,0)`
/// @param d probability of the bottom-right quadrant `(1,1)`
/// @param vertexCount number of vertices; ids are in `[0, vertexCount)`
/// @param edgeCount number of unique undirected edges requested
/// @param seed PRNG seed, or null for a random one
public record RMATParams(double a, double b, double c, double d, int vertexCount, int edgeCount,
                         Long seed) {

  /// Tolerance on the probability sum.
  public static final double SUM_TOLERANCE = 1e-6;

  public RMATParams {
    if (a < 0 || b < 0 || c < 0 || d < 0 || Double.isNaN(a + b + c + d)) {
      throw new GraphConfigurationException(
          "R-MAT probabilities must be non-negative: a=" + a + " b=" + b + " c=" + c + " d=" + d);
    }
    double sum = a + b + c + d;
    if (Math.abs(sum - 1.0d) > SUM_TOLERANCE) {
      throw new GraphConfigurationException("R-MAT probabilities must sum to 1, got " + sum);
    }
    if (vertexCount <= 0) {
      throw new GraphConfigurationException("vertex count must be positive, got " + vertexCount);
    }
    if (edgeCount <= 0) {
      throw new GraphConfigurationException("edge count must be positive, got " + edgeCount);
    }
  }

  /// Builds parameters from a preset.
  public static RMATParams of(RMATPreset preset, int vertexCount, int edgeCount, Long seed) {
    return new RMATParams(preset.a(), preset.b(), preset.c(), preset.d(), vertexCount, edgeCount,
        seed);
  }

  public RMATParams withSeed(Long seed) {
    return new RMATParams(a, b, c, d, vertexCount, edgeCount, seed);
  }
}
