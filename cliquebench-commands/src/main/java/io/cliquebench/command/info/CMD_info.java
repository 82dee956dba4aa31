package io.cliquebench.command.info;

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

import io.cliquebench.api.errors.ParseWarning;
import io.cliquebench.api.graph.Graph;
import io.cliquebench.api.services.BundledCommand;
import io.cliquebench.api.services.GraphFormat;
import io.cliquebench.api.services.Selector;
import io.cliquebench.command.common.GraphFormatOption;
import io.cliquebench.command.common.InputFileOption;
import io.cliquebench.io.text.GraphDocument;
import io.cliquebench.io.text.GraphFileIO;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.IntSummaryStatistics;
import java.util.Locale;
import java.util.concurrent.Callable;

/// Summarize a graph file
///
/// Prints the detected format, the vertex and edge counts, the density and the degree range.
/// Lines the parser skipped are listed with `--verbose` and make the exit code 1.
@Selector("info")
@CommandLine.Command(name = "info",
    header = "Show the size, density and degree range of a graph file",
    exitCodeListHeading = "Exit Codes:%n",
    exitCodeList = {"0: success", "1: warning", "2: error"})
public class CMD_info implements Callable<Integer>, BundledCommand {
  private static final Logger logger = LogManager.getLogger(CMD_info.class);

  private static final int EXIT_SUCCESS = 0;
  private static final int EXIT_WARNING = 1;
  private static final int EXIT_ERROR = 2;

  @CommandLine.Mixin
  private InputFileOption inputFileOption = new InputFileOption();

  @CommandLine.Option(names = {"--from"},
      description = "Input format: snap or dimacs (default: detected)",
      converter = GraphFormatOption.GraphFormatConverter.class)
  private GraphFormat from;

  @CommandLine.Option(names = {"-v", "--verbose"}, description = "List skipped lines")
  private boolean verbose;

  @Override
  public Integer call() {
    try {
      inputFileOption.validate();
      Path input = inputFileOption.getInputPath();
      GraphFormat format = from != null ? from : GraphFileIO.detect(input);
      GraphDocument document = GraphFileIO.read(input, format);
      print(input, format, document, System.out);
      return document.hasWarnings() ? EXIT_WARNING : EXIT_SUCCESS;
    } catch (IllegalStateException e) {
      logger.error(e.getMessage());
      return EXIT_ERROR;
    } catch (IOException e) {
      logger.error("Error reading graph: {}", e.getMessage(), e);
      return EXIT_ERROR;
    }
  }

  private void print(Path input, GraphFormat format, GraphDocument document, PrintStream out) {
    Graph graph = document.graph();
    IntSummaryStatistics degrees = graph.degrees().values().stream()
        .mapToInt(Integer::intValue)
        .summaryStatistics();
    out.println("File: " + input);
    out.println("Format: " + format);
    out.println("Vertices: " + graph.vertexCount());
    out.println("Referenced vertices: " + graph.referencedVertices().size());
    out.println("Edges: " + graph.edgeCount());
    out.println(String.format(Locale.ROOT, "Density: %.4f", graph.density()));
    if (degrees.getCount() > 0) {
      out.println(String.format(Locale.ROOT, "Degree: min %d, max %d, avg %.2f",
          degrees.getMin(), degrees.getMax(), degrees.getAverage()));
      out.println("Id range: " + graph.minVertex().getAsInt() + ".." + graph.maxVertex().getAsInt());
    }
    out.println("Comments: " + document.comments().size());
    out.println("Skipped lines: " + document.warnings().size());
    if (verbose) {
      for (ParseWarning warning : document.warnings()) {
        out.println("  " + warning);
      }
    }
  }
}
