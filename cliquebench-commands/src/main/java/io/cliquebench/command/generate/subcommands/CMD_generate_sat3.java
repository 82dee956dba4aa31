package io.cliquebench.command.generate.subcommands;

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
import io.cliquebench.api.graph.Graph;
import io.cliquebench.command.common.GraphFormatOption;
import io.cliquebench.command.common.OutputFileOption;
import io.cliquebench.command.common.RandomSeedOption;
import io.cliquebench.generators.random.RandomGenerators;
import io.cliquebench.generators.sat3.HashedSAT3Builder;
import io.cliquebench.generators.sat3.HashedSAT3Options;
import io.cliquebench.io.text.GraphDocument;
import io.cliquebench.io.text.GraphFileIO;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.Callable;

/// Generate a literal-conflict graph from a hash-derived 3-SAT formula
@CommandLine.Command(name = "sat3",
    header = "Generate a hashed 3-SAT literal-conflict graph",
    description = "Clauses are derived from SHA-256 of their index; conflict edges and the final\n" +
        "density trim are drawn from the seeded generator. Density is an upper bound.",
    exitCodeListHeading = "Exit Codes:%n",
    exitCodeList = {"0: success", "1: warning", "2: error"})
public class CMD_generate_sat3 implements Callable<Integer> {
  private static final Logger logger = LogManager.getLogger(CMD_generate_sat3.class);

  private static final int EXIT_SUCCESS = 0;
  private static final int EXIT_WARNING = 1;
  private static final int EXIT_ERROR = 2;

  @CommandLine.Mixin
  private OutputFileOption outputFileOption = new OutputFileOption();

  @CommandLine.Mixin
  private RandomSeedOption randomSeedOption = new RandomSeedOption();

  @CommandLine.Mixin
  private GraphFormatOption graphFormatOption = new GraphFormatOption();

  @CommandLine.Option(names = {"-n", "--vertices"}, required = true,
      description = "Target vertex count, at least " + HashedSAT3Builder.MIN_VERTICES)
  private int vertices;

  @CommandLine.Option(names = {"--density"}, required = true,
      description = "Maximum edge density in [0, 1]")
  private double density;

  @CommandLine.Option(names = {"--conflict-probability"},
      description = "Probability of connecting two literals of a clause (default: ${DEFAULT-VALUE})",
      defaultValue = "0.3")
  private double conflictProbability = HashedSAT3Options.DEFAULT_CONFLICT_PROBABILITY;

  @CommandLine.Option(names = {"--cap"},
      description = "Upper bound applied to the vertex target (default: ${DEFAULT-VALUE})",
      defaultValue = "500")
  private int cap = HashedSAT3Options.DEFAULT_VERTEX_CAP;

  @CommandLine.Option(names = {"--algorithm"},
      description = "PRNG algorithm (${COMPLETION-CANDIDATES})",
      defaultValue = "XO_SHI_RO_256_PP")
  private RandomGenerators.Algorithm algorithm = RandomGenerators.Algorithm.XO_SHI_RO_256_PP;

  @Override
  public Integer call() {
    if (outputFileOption.outputExistsWithoutForce()) {
      logger.error("Output file already exists: {}. Use --force to overwrite.",
          outputFileOption.getOutputPath());
      return EXIT_WARNING;
    }
    try {
      HashedSAT3Options options = HashedSAT3Options.builder()
          .conflictProbability(conflictProbability)
          .vertexCap(cap)
          .algorithm(algorithm)
          .build();
      long seed = randomSeedOption.getSeed();
      Graph graph = new HashedSAT3Builder(options).build(vertices, density, seed);

      List<String> header = List.of(
          " Hashed 3-SAT literal-conflict graph for maximum clique benchmarking",
          String.format(Locale.ROOT, " Target density: %s, conflict probability: %s, seed=%d",
              density, conflictProbability, seed),
          " Vertices: " + graph.vertexCount(),
          " Edges: " + graph.edgeCount(),
          " Undirected graph (each edge listed once)");
      Path output = outputFileOption.getNormalizedOutputPath();
      GraphFileIO.write(output, GraphDocument.of(graph, header), graphFormatOption.getFormat());
      System.out.println("Wrote " + graph + " to " + output + " (seed " + seed + ")");
      return EXIT_SUCCESS;
    } catch (GraphConfigurationException e) {
      logger.error("Invalid 3-SAT configuration: {}", e.getMessage());
      return EXIT_ERROR;
    } catch (IOException e) {
      logger.error("Error writing 3-SAT graph: {}", e.getMessage(), e);
      return EXIT_ERROR;
    }
  }
}
