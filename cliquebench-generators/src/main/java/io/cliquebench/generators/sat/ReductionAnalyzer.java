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
import io.cliquebench.generators.random.RandomGenerators;
import org.apache.commons.rng.UniformRandomProvider;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/// Structural report on a reduced graph, with a seeded clique-sampling test.
///
/// The sampling test picks `size` distinct partitions at random, takes one random vertex from
/// each and checks whether the picks form a clique. It runs for sizes `min(5,k)`,
/// `min(10,k)`, `min(20,k)` and `min(30,k)`, where `k` is the partition count.
public final class ReductionAnalyzer {

  /// Trials per sample size.
  public static final int DEFAULT_TRIALS = 100;

  private static final int[] SAMPLE_SIZES = {5, 10, 20, 30};

  private ReductionAnalyzer() {
  }

  /// One row of the sampling table.
  /// @param size vertices per sample
  /// @param trials number of samples drawn
  /// @param cliques number of samples that were cliques
  public record CliqueSample(int size, int trials, int cliques) {
    public double fraction() {
      return trials == 0 ? 0.0d : (double) cliques / trials;
    }
  }

  /// The analysis result.
  public record Report(int vertices, long maxPossibleEdges, int actualEdges, double density,
                       int partitionCount, double averagePartitionSize,
                       List<CliqueSample> samples) {
    public Report {
      samples = List.copyOf(samples);
    }

    /// @return the report as printable lines
    public List<String> lines() {
      List<String> lines = new ArrayList<>();
      lines.add("=== GRAPH PROPERTIES ===");
      lines.add("Vertices: " + vertices);
      lines.add("Max possible edges: " + maxPossibleEdges);
      lines.add("Actual edges: " + actualEdges);
      lines.add(String.format(Locale.ROOT, "Density: %.4f", density));
      lines.add("k-partite with k=" + partitionCount);
      lines.add(String.format(Locale.ROOT, "Avg partition size: %.2f", averagePartitionSize));
      lines.add("=== CLIQUE SAMPLING TEST ===");
      for (CliqueSample sample : samples) {
        lines.add(String.format(Locale.ROOT, "Size %2d: %3d/%d random samples are cliques (%5.1f%%)",
            sample.size(), sample.cliques(), sample.trials(), sample.fraction() * 100));
      }
      return lines;
    }
  }

  public static Report analyze(ReducedGraph reduced, long seed) {
    return analyze(reduced, DEFAULT_TRIALS, RandomGenerators.create(seed));
  }

  /// @param reduced the reduction to analyze
  /// @param trials samples per size
  /// @param rng source of the sampling draws
  /// @return the report
  public static Report analyze(ReducedGraph reduced, int trials, UniformRandomProvider rng) {
    Graph graph = reduced.graph();
    int n = graph.vertexCount();
    int k = reduced.partitionCount();
    long maxEdges = (long) n * (n - 1) / 2;

    List<CliqueSample> samples = new ArrayList<>();
    for (int wanted : SAMPLE_SIZES) {
      int size = Math.min(wanted, k);
      if (size <= 0) {
        continue;
      }
      int cliques = 0;
      for (int t = 0; t < trials; t++) {
        List<Integer> picks = new ArrayList<>(size);
        for (List<Integer> partition : RandomGenerators.sample(reduced.partitions(), size, rng)) {
          picks.add(partition.get(rng.nextInt(partition.size())));
        }
        if (graph.isClique(picks)) {
          cliques++;
        }
      }
      samples.add(new CliqueSample(size, trials, cliques));
    }

    return new Report(n, maxEdges, graph.edgeCount(), graph.density(), k, (double) n / k, samples);
  }
}
