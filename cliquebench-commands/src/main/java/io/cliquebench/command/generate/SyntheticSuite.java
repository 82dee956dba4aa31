package io.cliquebench.command.generate;

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
import io.cliquebench.generators.rmat.RMATGenerator;
import io.cliquebench.generators.rmat.RMATParams;
import io.cliquebench.generators.rmat.RMATPreset;
import io.cliquebench.generators.rmat.RMATResult;
import io.cliquebench.generators.sat3.HashedSAT3Builder;

import java.util.List;

/// The standard synthetic benchmark set: six R-MAT graphs over three presets in a small and a
/// large size, and two hashed 3-SAT graphs. Each entry has a fixed seed, so the set is the same
/// on every run.
public final class SyntheticSuite {

  /// Header lines written above the edges of every suite file.
  public static List<String> header(Graph graph) {
    return List.of(
        " Synthetic graph for maximum clique benchmarking",
        " Vertices: " + graph.vertexCount(),
        " Edges: " + graph.edgeCount(),
        " Undirected graph (each edge listed once)");
  }

  /// One graph of the suite.
  public interface Entry {
    /// @return the file name stem, e.g. `rmat_sd1_small`
    String name();

    /// @return the generated graph and whether it reached its requested size
    Generated generate();
  }

  /// @param graph the graph
  /// @param complete false when an R-MAT run stopped short of its edge count
  public record Generated(Graph graph, boolean complete) {
  }

  /// @param name file name stem
  /// @param params R-MAT parameters with a fixed seed
  public record RMATEntry(String name, RMATParams params) implements Entry {
    @Override
    public Generated generate() {
      RMATResult result = new RMATGenerator().run(params);
      return new Generated(result.graph(), result.isComplete());
    }
  }

  /// @param name file name stem
  /// @param vertices vertex target
  /// @param density maximum density
  /// @param seed fixed seed
  public record SAT3Entry(String name, int vertices, double density, long seed) implements Entry {
    @Override
    public Generated generate() {
      return new Generated(new HashedSAT3Builder().build(vertices, density, seed), true);
    }
  }

  private static final List<Entry> STANDARD = List.of(
      rmat(RMATPreset.ERDOS_RENYI, "small", 200, 2000, 42L),
      rmat(RMATPreset.ERDOS_RENYI, "large", 500, 8000, 43L),
      rmat(RMATPreset.SKEWED_1, "small", 200, 2500, 44L),
      rmat(RMATPreset.SKEWED_1, "large", 500, 10000, 45L),
      rmat(RMATPreset.SKEWED_2, "small", 200, 2500, 46L),
      rmat(RMATPreset.SKEWED_2, "large", 500, 10000, 47L),
      new SAT3Entry("sat3_small", 150, 0.08d, 48L),
      new SAT3Entry("sat3_large", 300, 0.12d, 49L));

  private SyntheticSuite() {
  }

  /// @return the eight standard entries in generation order
  public static List<Entry> standard() {
    return STANDARD;
  }

  private static Entry rmat(RMATPreset preset, String size, int vertices, int edges, long seed) {
    return new RMATEntry("rmat_" + preset.shortName() + "_" + size,
        RMATParams.of(preset, vertices, edges, seed));
  }
}
