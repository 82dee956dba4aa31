package io.cliquebench.command.convert.subcommands;

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
import io.cliquebench.api.services.GraphFormat;
import io.cliquebench.command.common.GraphFormatOption;
import io.cliquebench.command.common.InputFileOption;
import io.cliquebench.command.common.OutputFileOption;
import io.cliquebench.command.convert.GraphConverter;
import io.cliquebench.io.text.GraphDocument;
import io.cliquebench.io.text.GraphFileIO;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

import java.io.IOException;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * Subcommand for file-to-file graph format conversion.
 * The input format is detected from the content unless given with {@code --from}; the output
 * format defaults to the other one.
 */
@CommandLine.Command(name = "file",
    header = "Convert a graph file between SNAP and DIMACS",
    description = "Reads one graph file and writes it in the requested format.",
    exitCodeListHeading = "Exit Codes:%n",
    exitCodeList = {"0: success", "1: warning", "2: error"})
public class CMD_convert_file implements Callable<Integer> {
    private static final Logger logger = LogManager.getLogger(CMD_convert_file.class);

    private static final int EXIT_SUCCESS = 0;
    private static final int EXIT_WARNING = 1;
    private static final int EXIT_ERROR = 2;

    @CommandLine.Mixin
    private InputFileOption inputFileOption = new InputFileOption();

    @CommandLine.Mixin
    private OutputFileOption outputFileOption = new OutputFileOption();

    @CommandLine.Option(names = {"--from"},
        description = "Input format: snap or dimacs (default: detected)",
        converter = GraphFormatOption.GraphFormatConverter.class)
    private GraphFormat from;

    @CommandLine.Option(names = {"--to"},
        description = "Output format: snap or dimacs (default: the other format)",
        converter = GraphFormatOption.GraphFormatConverter.class)
    private GraphFormat to;

    @CommandLine.Option(names = {"--zero-based"},
        description = "For SNAP output, renumber ids so the smallest is 0")
    private boolean zeroBased;

    @Override
    public Integer call() {
        if (outputFileOption.outputExistsWithoutForce()) {
            logger.error("Output file already exists: {}. Use --force to overwrite.",
                outputFileOption.getOutputPath());
            return EXIT_WARNING;
        }
        try {
            inputFileOption.validate();
            Path input = inputFileOption.getInputPath();
            GraphFormat inputFormat = from != null ? from : GraphFileIO.detect(input);
            GraphFormat outputFormat = to != null ? to
                : (inputFormat == GraphFormat.snap ? GraphFormat.dimacs : GraphFormat.snap);
            if (zeroBased && outputFormat == GraphFormat.dimacs) {
                logger.warn("--zero-based has no effect on DIMACS output, which is always 1-based");
            }

            GraphDocument document = GraphFileIO.read(input, inputFormat);
            GraphDocument converted =
                GraphConverter.convert(document, inputFormat, outputFormat, zeroBased);
            Path output = outputFileOption.getNormalizedOutputPath();
            GraphFileIO.write(output, converted, outputFormat);

            System.out.println("Converted " + input + " (" + inputFormat + ") to " + output
                + " (" + outputFormat + "): " + converted.graph());
            if (document.hasWarnings()) {
                logger.warn("{} line(s) of {} were skipped", document.warnings().size(), input);
                return EXIT_WARNING;
            }
            return EXIT_SUCCESS;
        } catch (IllegalStateException | GraphConfigurationException e) {
            logger.error(e.getMessage());
            return EXIT_ERROR;
        } catch (IOException e) {
            logger.error("Error during conversion: {}", e.getMessage(), e);
            return EXIT_ERROR;
        }
    }
}
