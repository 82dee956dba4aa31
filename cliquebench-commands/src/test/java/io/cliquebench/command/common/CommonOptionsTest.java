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

import io.cliquebench.api.services.GraphFormat;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CommonOptionsTest {

    @TempDir
    Path tempDir;

    @CommandLine.Command(name = "holder")
    static class Holder {
        @CommandLine.Mixin
        RandomSeedOption seed = new RandomSeedOption();

        @CommandLine.Mixin
        GraphFormatOption format = new GraphFormatOption();

        @CommandLine.Mixin
        OutputFileOption output = new OutputFileOption();
    }

    @Test
    void testExplicitSeed() {
        Holder holder = new Holder();
        new CommandLine(holder).parseArgs("-s", "7", "-o", "x.txt");

        assertThat(holder.seed.isSeedSpecified()).isTrue();
        assertThat(holder.seed.getSeed()).isEqualTo(7L);
        assertThat(holder.seed.getExplicitSeed()).isEqualTo(7L);
    }

    @Test
    void testUnspecifiedSeedIsStable() {
        Holder holder = new Holder();
        new CommandLine(holder).parseArgs("-o", "x.txt");

        assertThat(holder.seed.isSeedSpecified()).isFalse();
        assertThat(holder.seed.getExplicitSeed()).isNull();
        assertThat(holder.seed.getSeed()).isEqualTo(holder.seed.getSeed());
    }

    @Test
    void testBadSeedRejected() {
        Holder holder = new Holder();
        assertThatThrownBy(() -> new CommandLine(holder).parseArgs("-s", "abc", "-o", "x.txt"))
            .isInstanceOf(CommandLine.ParameterException.class);
    }

    @Test
    void testFormatAliases() {
        Holder holder = new Holder();
        new CommandLine(holder).parseArgs("--format", "clq", "-o", "x.txt");
        assertThat(holder.format.getFormat()).isEqualTo(GraphFormat.dimacs);

        Holder defaults = new Holder();
        new CommandLine(defaults).parseArgs("-o", "x.txt");
        assertThat(defaults.format.getFormat()).isEqualTo(GraphFormat.snap);
    }

    @Test
    void testOutputExistsWithoutForce() throws IOException {
        Path existing = Files.writeString(tempDir.resolve("exists.txt"), "0 1\n");

        Holder plain = new Holder();
        new CommandLine(plain).parseArgs("-o", existing.toString());
        assertThat(plain.output.outputExistsWithoutForce()).isTrue();
        assertThatThrownBy(plain.output::validate).isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("--force");

        Holder forced = new Holder();
        new CommandLine(forced).parseArgs("-o", existing.toString(), "-f");
        assertThat(forced.output.outputExistsWithoutForce()).isFalse();
    }

    @Test
    void testInputFileRecord() throws IOException {
        Path file = Files.writeString(tempDir.resolve("in.txt"), "0 1\n");
        InputFileOption.InputFile present = new InputFileOption.InputFileConverter()
            .convert(file.toString());
        present.validate();
        assertThat(present.normalizedPath()).isAbsolute();

        InputFileOption.InputFile missing = new InputFileOption.InputFile(tempDir.resolve("no.txt"));
        assertThat(missing.exists()).isFalse();
        assertThatThrownBy(missing::validate).isInstanceOf(IllegalStateException.class);
    }
}
