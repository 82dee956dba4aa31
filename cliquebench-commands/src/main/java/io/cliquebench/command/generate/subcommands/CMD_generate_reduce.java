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
import io.cliquebench.api.sat.CNFFormula;
import io.cliquebench.command.common.GraphFormatOption;
import io.cliquebench.command.common.OutputFileOption;
import io.cliquebench.command.common.RandomSeedOption;
import io.cliquebench.generators.random.RandomGenerators;
import io.cliquebench.generators.sat.CNFReduction;
import io.cliquebench.generators.sat.ReducedGraph;
import io.cliquebench.generators.sat.ReductionAnalyzer;
import io.cliquebench.generators.sat.families.CNFFamily;
import io.cliquebench.generators.sat.families.FamilyOptions;
import io.cliquebench.generators.sat.families.GeneratedFormula;
import io.cliquebench.io.cnf.CnfCodec;
import io.cliquebench.io.text.GraphDocument;
import io.cliquebench.io.text.GraphFileIO;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.stream.Collectors;

/// Reduce a SAT formula to a clique instance
///
/// The formula is read from a DIMACS CNF file (`--cnf`) or generated from a named family
/// (`--family`). The written graph is `k`-partite for `k` clauses and has a `k`-clique exactly
/// when the formula is satisfiable.
@CommandLine.Command(name = "reduce",
    header = "Reduce a SAT formula to a maximum-clique instance",
    description = "One vertex per literal occurrence; literals of different clauses are\n" +
        "connected unless they are complementary.",
    exitCodeListHeading = "Exit Codes:%n",
    exitCodeList = {"0: success", "1: warning", "2: error"})
public class CMD_generate_reduce implements Callable<Integer> {
  private static final Logger logger = LogManager.getLogger(CMD_generate_reduce.class);

  private static final int EXIT_SUCCESS = 0;
  private static final int EXIT_WARNING = 1;
  private static final int EXIT_ERROR = 2;

  @CommandLine.Mixin
  private OutputFileOption outputFileOption = new OutputFileOption();

  @CommandLine.Mixin
  private RandomSeedOption randomSeedOption = new RandomSeedOption();

  @CommandLine.Mixin
  private GraphFormatOption graphFormatOption = new GraphFormatOption();

  @CommandLine.Option(names = {"--cnf"}, description = "DIMACS CNF input file")
  private Path cnf;

  @CommandLine.Option(names = {"--family"},
      description = "Generated formula family: random-3sat, planted-3sat, crypto-like, "
          + "graph-coloring, example-3sat",
      converter = FamilyConverter.class)
  private CNFFamily family;

  @CommandLine.Option(names = {"--variables"}, description = "Variables of a generated formula")
  private Integer variables;

  @CommandLine.Option(names = {"--clauses"}, description = "Clauses of a generated formula")
  private Integer clauses;

  @CommandLine.Option(names = {"--vertices"},
      description = "Vertices of the random graph to color (graph-coloring)")
  private Integer vertices;

  @CommandLine.Option(names = {"--colors"}, description = "Colors available (graph-coloring)")
  private Integer colors;

  @CommandLine.Option(names = {"--edge-density"},
      description = "Edge density of the random graph to color (graph-coloring)")
  private Double edgeDensity;

  @CommandLine.Option(names = {"--save-cnf"},
      description = "Also write the formula as DIMACS CNF to this file")
  private Path saveCnf;

  @CommandLine.Option(names = {"--analyze"},
      description = "Print graph properties and a random clique sampling table")
  private boolean analyze;

  @CommandLine.Option(names = {"--trials"},
      description = "Samples per size for --analyze (default: ${DEFAULT-VALUE})",
      defaultValue = "100")
  private int trials = ReductionAnalyzer.DEFAULT_TRIALS;

  /// Picocli type converter accepting dashed or enum-style family names.
  public static class FamilyConverter implements CommandLine.ITypeConverter<CNFFamily> {
    @Override
    public CNFFamily convert(String value) {
      try {
        return CNFFamily.fromName(value);
      } catch (IllegalArgumentException e) {
        throw new CommandLine.TypeConversionException("Unknown SAT family: " + value);
      }
    }
  }

  @Override
  public Integer call() {
    if (outputFileOption.outputExistsWithoutForce()) {
      logger.error("Output file already exists: {}. Use --force to overwrite.",
          outputFileOption.getOutputPath());
      return EXIT_WARNING;
    }
    if ((cnf == null) == (family == null)) {
      logger.error("Exactly one of --cnf or --family is required");
      return EXIT_ERROR;
    }
    try {
      boolean warned = false;
      List<String> header = new ArrayList<>();
      CNFFormula formula;
      if (cnf != null) {
        CnfCodec.CnfDocument document = CnfCodec.read(cnf);
        formula = document.formula();
        warned = !document.warnings().isEmpty();
        header.add(" Source: " + cnf.getFileName());
      } else {
        GeneratedFormula generated = family.generate(familyOptions());
        formula = generated.formula();
        header.add(" Source: " + generated.description());
      }

      ReducedGraph reduced = CNFReduction.reduce(formula);
      List<String> comments = new ArrayList<>(CNFReduction.describe(reduced));
      comments.addAll(header);

      Path output = outputFileOption.getNormalizedOutputPath();
      GraphFileIO.write(output, GraphDocument.of(reduced.graph(), comments),
          graphFormatOption.getFormat());
      if (saveCnf != null) {
        CnfCodec.write(saveCnf, formula,
            header.stream().map(String::strip).collect(Collectors.toList()));
      }
      System.out.println("Wrote " + reduced + " to " + output);

      if (analyze) {
        long seed = randomSeedOption.getSeed();
        ReductionAnalyzer.Report report = ReductionAnalyzer.analyze(reduced, trials,
            RandomGenerators.create(seed));
        report.lines().forEach(System.out::println);
      }
      return warned ? EXIT_WARNING : EXIT_SUCCESS;
    } catch (GraphConfigurationException e) {
      logger.error("Invalid SAT input: {}", e.getMessage());
      return EXIT_ERROR;
    } catch (IOException e) {
      logger.error("Error during reduction: {}", e.getMessage(), e);
      return EXIT_ERROR;
    }
  }

  private FamilyOptions familyOptions() {
    FamilyOptions.Builder builder = FamilyOptions.builder()
        .variables(variables)
        .clauses(clauses)
        .vertices(vertices)
        .colors(colors)
        .edgeDensity(edgeDensity);
    if (randomSeedOption.isSeedSpecified()) {
      builder.seed(randomSeedOption.getSeed());
    }
    return builder.build();
  }
}
