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

/**
 * Shared output file option with force overwrite flag.
 */
public class OutputFileOption {

    /**
     * Immutable output file specification with force-overwrite flag.
     *
     * @param path  the output file path (never null)
     * @param force whether to overwrite an existing file
     */
    public record OutputFile(Path path, boolean force) {

        public OutputFile {
            if (path == null) {
                throw new IllegalArgumentException("Output path cannot be null");
            }
        }

        public OutputFile(Path path) {
            this(path, false);
        }

        /**
         * Gets the normalized absolute path.
         */
        public Path normalizedPath() {
            return path.normalize().toAbsolutePath();
        }

        /**
         * Checks if the output file exists and force is not set.
         */
        public boolean existsWithoutForce() {
            return Files.exists(path) && !force;
        }

        @Override
        public String toString() {
            if (force) {
                return path + " (force)";
            }
            return path.toString();
        }
    }

    @CommandLine.Option(
        names = {"-o", "--output"},
        description = "The output graph file path",
        required = true
    )
    private Path outputPath;

    @CommandLine.Option(
        names = {"-f", "--force"},
        description = "Force overwrite if output file already exists"
    )
    private boolean force = false;

    public OutputFile getOutputFile() {
        return new OutputFile(outputPath, force);
    }

    public Path getOutputPath() {
        return outputPath;
    }

    public Path getNormalizedOutputPath() {
        return outputPath != null ? outputPath.normalize() : null;
    }

    public boolean isForce() {
        return force;
    }

    /**
     * Checks if the output file already exists and force is not enabled.
     */
    public boolean outputExistsWithoutForce() {
        return getOutputFile().existsWithoutForce();
    }

    /**
     * @throws IllegalStateException if the output file exists and force is not set
     */
    public void validate() {
        if (outputExistsWithoutForce()) {
            throw new IllegalStateException(
                "Output file already exists: " + outputPath + ". Use --force to overwrite."
            );
        }
    }

    @Override
    public String toString() {
        return getOutputFile().toString();
    }
}
