package io.cliquebench.command.common;

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

import picocli.CommandLine;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Shared input file option for graph and CNF inputs.
 */
public class InputFileOption {

    /**
     * Immutable input file specification.
     *
     * @param path the input file path (never null)
     */
    public record InputFile(Path path) {

        public InputFile {
            if (path == null) {
                throw new IllegalArgumentException("Input path cannot be null");
            }
        }

        public Path normalizedPath() {
            return path.normalize().toAbsolutePath();
        }

        public boolean exists() {
            return Files.isRegularFile(path);
        }

        /**
         * @throws IllegalStateException if the file does not exist
         */
        public void validate() {
            if (!exists()) {
                throw new IllegalStateException("Input file does not exist: " + path);
            }
        }

        @Override
        public String toString() {
            return path.toString();
        }
    }

    /**
     * Picocli type converter for {@link InputFile} specifications.
     */
    public static class InputFileConverter implements CommandLine.ITypeConverter<InputFile> {

        @Override
        public InputFile convert(String value) {
            if (value == null || value.trim().isEmpty()) {
                throw new IllegalArgumentException("Input file path cannot be empty");
            }
            return new InputFile(Paths.get(value.trim()));
        }
    }

    @CommandLine.Option(
        names = {"-i", "--input"},
        description = "The input graph file path",
        required = true,
        converter = InputFileConverter.class
    )
    private InputFile inputFile;

    public InputFile getInputFile() {
        return inputFile;
    }

    public Path getInputPath() {
        return inputFile != null ? inputFile.path() : null;
    }

    /**
     * Validates the input file exists.
     */
    public void validate() {
        if (inputFile == null) {
            throw new IllegalStateException("Input file is required");
        }
        inputFile.validate();
    }

    @Override
    public String toString() {
        return inputFile != null ? inputFile.toString() : "null";
    }
}
