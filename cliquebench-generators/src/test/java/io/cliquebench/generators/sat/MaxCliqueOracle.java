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

import java.util.ArrayList;
import java.util.List;

/// Exhaustive maximum-clique search for the small graphs used in tests.
final class MaxCliqueOracle {

  private MaxCliqueOracle() {
  }

  static int maxCliqueSize(Graph graph) {
    List<Integer> vertices = new ArrayList<>(graph.referencedVertices());
    if (vertices.isEmpty()) {
      return graph.vertexCount() > 0 ? 1 : 0;
    }
    return extend(graph, new ArrayList<>(), vertices, 0);
  }

  private static int extend(Graph graph, List<Integer> clique, List<Integer> candidates, int best) {
    if (candidates.isEmpty()) {
      return Math.max(best, clique.size());
    }
    for (int i = 0; i < candidates.size(); i++) {
      if (clique.size() + candidates.size() - i <= best) {
        break;
      }
      int v = candidates.get(i);
      List<Integer> next = new ArrayList<>();
      for (int j = i + 1; j < candidates.size(); j++) {
        if (graph.hasEdge(v, candidates.get(j))) {
          next.add(candidates.get(j));
        }
      }
      clique.add(v);
      best = extend(graph, clique, next, best);
      clique.remove(clique.size() - 1);
    }
    return Math.max(best, clique.size());
  }
}
