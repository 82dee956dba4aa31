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

import io.cliquebench.api.graph.Graph;
import io.cliquebench.api.services.GraphFormat;
import io.cliquebench.command.common.GraphFormatOption;
import io.cliquebench.command.generate.SyntheticSuite;
import io.cliquebench.io.text.GraphDocument;
import io.cliquebench.io.text.GraphFileIO;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/// Write the standard synthetic benchmark set into a directory
///
/// Files are named `<entry>.txt` and list their edges in sorted order. Existing files are left alone unless `--force` is given;
/// a skipped file or an incomplete R-MAT graph makes the exit code 1.
@CommandLine.Command(name = "suite",
    header = "Write the standard synthetic benchmark graphs",
    description = "Six R-MAT graphs (er, sd1, sd2 presets; small and large) and two hashed\n" +
        "3-SAT graphs, each with a fixed seed.",
    exitCodeListHeading = "Exit Codes:%n",
    exitCodeList = {"0: success", "1: warning", "2: error"})
public class CMD_generate_suite implements Callable<Integer> {
  private static final Logger logger = LogManager.getLogger(CMD_generate_suite.class);

  private static final int EXIT_SUCCESS = 0;
  private static final int EXIT_WARNING = 1;
  private static final int EXIT_ERROR = 2;

  @CommandLine.Option(names = {"-o", "--output-dir"},
      description = "Directory to write into (default: ${DEFAULT-VALUE})",
      defaultValue = "datasets")
  private Path outputDir;

  @CommandLine.Option(names = {"-f", "--force"},
      description = "Overwrite files that already exist")
  private boolean force;

  @CommandLine.Mixin
  private GraphFormatOption graphFormatOption = new GraphFormatOption();

  @Override
  public Integer call() {
    GraphFormat format = graphFormatOption.getFormat();
    int exitCode = EXIT_SUCCESS;
    try {
      Files.createDirectories(outputDir);
      for (SyntheticSuite.Entry entry : SyntheticSuite.standard()) {
        Path file = outputDir.resolve(entry.name() + ".txt");
        if (Files.exists(file) && !force) {
          logger.warn("Skipping {}: file exists. Use --force to overwrite.", file);
          exitCode = EXIT_WARNING;
          continue;
        }
        SyntheticSuite.Generated generated = entry.generate();
        if (!generated.complete()) {
          exitCode = EXIT_WARNING;
        }
        Graph graph = Graph.dense(generated.graph().vertexCount(), generated.graph().sortedEdges());
        GraphFileIO.write(file, GraphDocument.of(graph, SyntheticSuite.header(graph)), format);
        System.out.println("Generated " + file + ": " + graph.vertexCount() + " vertices, "
            + graph.edgeCount() + " edges");
      }
      return exitCode;
    } catch (IOException e) {
      logger.error("Error writing suite to {}: {}", outputDir, e.getMessage(), e);
      return EXIT_ERROR;
    }
  }
}
