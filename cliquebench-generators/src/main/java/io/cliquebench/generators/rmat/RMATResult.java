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

import io.cliquebench.api.graph.Graph;

/// Outcome of an R-MAT run.
///
/// @param graph the generated graph
/// @param requestedEdges the edge count that was asked for
/// @param attempts number of quadrant walks drawn
/// @param seed the seed the run actually used
public record RMATResult(Graph graph, int requestedEdges, long attempts, long seed) {

  /// @return true if the requested number of unique edges was reached before the attempt budget
  public boolean isComplete() {
    return graph.edgeCount() >= requestedEdges;
  }

  /// @return how many requested edges are missing, 0 when complete
  public int shortfall() {
    return Math.max(0, requestedEdges - graph.edgeCount());
  }
}
