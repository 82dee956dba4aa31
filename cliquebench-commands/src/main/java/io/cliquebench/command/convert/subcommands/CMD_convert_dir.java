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
import io.cliquebench.command.convert.GraphConverter;
import io.cliquebench.io.text.GraphDocument;
import io.cliquebench.io.text.GraphFileIO;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Converts every SNAP {@code *.txt} file of one or more directories to DIMACS, in place.
 * Files that already contain a DIMACS problem line are skipped; missing directories are
 * reported and skipped.
 */
@CommandLine.Command(name = "dir",
    header = "Convert all SNAP files of directories to DIMACS in place",
    description = "Each *.txt file is replaced by its DIMACS form. Files already in DIMACS\n" +
        "format are left alone.",
    exitCodeListHeading = "Exit Codes:%n",
    exitCodeList = {"0: success", "1: warning", "2: error"})
public class CMD_convert_dir implements Callable<Integer> {
    private static final Logger logger = LogManager.getLogger(CMD_convert_dir.class);

    private static final int EXIT_SUCCESS = 0;
    private static final int EXIT_WARNING = 1;
    private static final int EXIT_ERROR = 2;

    @CommandLine.Parameters(arity = "1..*", paramLabel = "DIR",
        description = "Directories holding *.txt graph files")
    private List<Path> directories;

    @Override
    public Integer call() {
        int exitCode = EXIT_SUCCESS;
        int converted = 0;
        int skipped = 0;
        for (Path directory : directories) {
            if (!Files.isDirectory(directory)) {
                logger.warn("Directory '{}' not found, skipping", directory);
                exitCode = EXIT_WARNING;
                continue;
            }
            List<Path> files;
            try (Stream<Path> listing = Files.list(directory)) {
                files = listing
                    .filter(p -> p.getFileName().toString().endsWith(".txt"))
                    .filter(Files::isRegularFile)
                    .sorted()
                    .collect(Collectors.toList());
            } catch (IOException e) {
                logger.error("Error listing {}: {}", directory, e.getMessage(), e);
                return EXIT_ERROR;
            }
            if (files.isEmpty()) {
                logger.info("No .txt files found in '{}'", directory);
                continue;
            }

            for (Path file : files) {
                try {
                    if (GraphFileIO.detect(file) == GraphFormat.dimacs) {
                        logger.info("{} is already in DIMACS format, skipping", file);
                        skipped++;
                        continue;
                    }
                    GraphDocument document = GraphFileIO.read(file, GraphFormat.snap);
                    GraphDocument dimacs = GraphConverter.convert(
                        document, GraphFormat.snap, GraphFormat.dimacs, false);
                    GraphFileIO.replace(file, dimacs, GraphFormat.dimacs);
                    converted++;
                    System.out.println("Converted " + file + ": " + dimacs.graph());
                    if (document.hasWarnings()) {
                        exitCode = EXIT_WARNING;
                    }
                } catch (GraphConfigurationException e) {
                    logger.error("Cannot convert {}: {}", file, e.getMessage());
                    return EXIT_ERROR;
                } catch (IOException e) {
                    logger.error("Error converting {}: {}", file, e.getMessage(), e);
                    return EXIT_ERROR;
                }
            }
        }
        System.out.println("Converted " + converted + " file(s), skipped " + skipped);
        return exitCode;
    }
}
