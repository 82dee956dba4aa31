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
import io.cliquebench.generators.rmat.RMATConfig;
import io.cliquebench.generators.rmat.RMATGenerator;
import io.cliquebench.generators.rmat.RMATParams;
import io.cliquebench.generators.rmat.RMATPreset;
import io.cliquebench.generators.rmat.RMATResult;
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

/// Generate an R-MAT graph
///
/// Parameters come from `--preset`, from explicit `-a -b -c -d` probabilities, or from a JSON
/// file given with `--config`. Without any of these the uniform (Erdos-Renyi) preset is used.
/// When the attempt budget runs out before the requested edge count is reached, the smaller
/// graph is still written and the exit code is 1.
@CommandLine.Command(name = "rmat",
    header = "Generate an R-MAT graph",
    description = "Samples edges by recursive quadrant descent over the adjacency matrix.",
    exitCodeListHeading = "Exit Codes:%n",
    exitCodeList = {"0: success", "1: warning", "2: error"})
public class CMD_generate_rmat implements Callable<Integer> {
  private static final Logger logger = LogManager.getLogger(CMD_generate_rmat.class);

  private static final int EXIT_SUCCESS = 0;
  private static final int EXIT_WARNING = 1;
  private static final int EXIT_ERROR = 2;

  @CommandLine.Mixin
  private OutputFileOption outputFileOption = new OutputFileOption();

  @CommandLine.Mixin
  private RandomSeedOption randomSeedOption = new RandomSeedOption();

  @CommandLine.Mixin
  private GraphFormatOption graphFormatOption = new GraphFormatOption();

  @CommandLine.Option(names = {"-n", "--vertices"}, description = "Number of vertices")
  private Integer vertices;

  @CommandLine.Option(names = {"-m", "--edges"}, description = "Number of unique edges requested")
  private Integer edges;

  @CommandLine.Option(names = {"-a"}, description = "Probability of the top-left quadrant")
  private Double a;

  @CommandLine.Option(names = {"-b"}, description = "Probability of the top-right quadrant")
  private Double b;

  @CommandLine.Option(names = {"-c"}, description = "Probability of the bottom-left quadrant")
  private Double c;

  @CommandLine.Option(names = {"-d"}, description = "Probability of the bottom-right quadrant")
  private Double d;

  @CommandLine.Option(names = {"--preset"},
      description = "Named parameter set: er, sd1, sd2 (or ERDOS_RENYI, SKEWED_1, SKEWED_2)")
  private String preset;

  @CommandLine.Option(names = {"--config"},
      description = "JSON file with vertex_count, edge_count, seed and a..d or preset")
  private Path config;

  @CommandLine.Option(names = {"--save-config"},
      description = "Write the effective parameters, including the seed, to this JSON file")
  private Path saveConfig;

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
      RMATParams params = resolveParams();
      RMATResult result = new RMATGenerator(algorithm).run(params);
      Graph graph = result.graph();

      List<String> header = List.of(
          " R-MAT graph for maximum clique benchmarking",
          String.format(Locale.ROOT, " a=%s, b=%s, c=%s, d=%s, seed=%d",
              params.a(), params.b(), params.c(), params.d(), result.seed()),
          " Vertices: " + graph.vertexCount(),
          " Edges: " + graph.edgeCount(),
          " Undirected graph (each edge listed once)");
      Path output = outputFileOption.getNormalizedOutputPath();
      GraphFileIO.write(output, GraphDocument.of(graph, header), graphFormatOption.getFormat());
      if (saveConfig != null) {
        RMATConfig.saveToFile(params.withSeed(result.seed()), saveConfig);
      }
      System.out.println("Wrote " + graph + " to " + output + " (seed " + result.seed() + ")");

      if (!result.isComplete()) {
        logger.warn("Requested {} edges but produced {} after {} attempts",
            result.requestedEdges(), graph.edgeCount(), result.attempts());
        return EXIT_WARNING;
      }
      return EXIT_SUCCESS;
    } catch (GraphConfigurationException | IllegalArgumentException e) {
      logger.error("Invalid R-MAT configuration: {}", e.getMessage());
      return EXIT_ERROR;
    } catch (IOException e) {
      logger.error("Error writing R-MAT graph: {}", e.getMessage(), e);
      return EXIT_ERROR;
    }
  }

  private RMATParams resolveParams() throws IOException {
    boolean anyProbability = a != null || b != null || c != null || d != null;
    if (config != null) {
      if (vertices != null || edges != null || preset != null || anyProbability) {
        throw new GraphConfigurationException(
            "--config cannot be combined with --vertices, --edges, --preset or -a/-b/-c/-d");
      }
      RMATParams loaded = RMATConfig.loadFromFile(config);
      if (randomSeedOption.isSeedSpecified() || loaded.seed() == null) {
        loaded = loaded.withSeed(randomSeedOption.getSeed());
      }
      logger.info("Loaded R-MAT parameters from {}", config);
      return loaded;
    }
    if (vertices == null || edges == null) {
      throw new GraphConfigurationException("--vertices and --edges are required without --config");
    }
    Long seed = randomSeedOption.getSeed();
    if (preset != null) {
      if (anyProbability) {
        throw new GraphConfigurationException("use either --preset or -a/-b/-c/-d, not both");
      }
      return RMATParams.of(RMATPreset.fromName(preset), vertices, edges, seed);
    }
    if (!anyProbability) {
      return RMATParams.of(RMATPreset.ERDOS_RENYI, vertices, edges, seed);
    }
    if (a == null || b == null || c == null || d == null) {
      throw new GraphConfigurationException("all four of -a, -b, -c and -d are required");
    }
    return new RMATParams(a, b, c, d, vertices, edges, seed);
  }
}
