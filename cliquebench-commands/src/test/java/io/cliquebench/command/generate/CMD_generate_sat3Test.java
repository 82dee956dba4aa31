package io.cliquebench.command.generate;

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
import io.cliquebench.command.TestUtils;
import io.cliquebench.command.generate.subcommands.CMD_generate_sat3;
import io.cliquebench.generators.sat3.HashedSAT3Builder;
import io.cliquebench.io.text.GraphFileIO;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class CMD_generate_sat3Test {

    @TempDir
    Path tempDir;

    @Test
    void testMatchesLibraryBuild() throws IOException {
        Path out = tempDir.resolve("sat3.txt");

        TestUtils.Run run = TestUtils.run(new CMD_generate_sat3(),
            "-n", "60", "--density", "0.1", "-s", "48", "-o", out.toString());

        assertThat(run.exitCode()).isZero();
        Graph expected = new HashedSAT3Builder().build(60, 0.1, 48L);
        assertThat(GraphFileIO.read(out).graph().edges()).isEqualTo(expected.edges());
    }

    @Test
    void testCapAndDensityBound() throws IOException {
        Path out = tempDir.resolve("capped.txt");

        TestUtils.Run run = TestUtils.run(new CMD_generate_sat3(),
            "-n", "400", "--cap", "40", "--density", "0.2", "--conflict-probability", "0.9",
            "-s", "2", "-o", out.toString());

        assertThat(run.exitCode()).isZero();
        Graph graph = GraphFileIO.read(out).graph();
        assertThat(graph.maxVertex().getAsInt()).isLessThan(40);
        assertThat((long) graph.edgeCount()).isLessThanOrEqualTo(Math.round(40 * 39 / 2.0 * 0.2));
    }

    @Test
    void testTooFewVerticesIsError() {
        TestUtils.Run run = TestUtils.run(new CMD_generate_sat3(),
            "-n", "4", "--density", "0.5", "-o", tempDir.resolve("x.txt").toString());

        assertThat(run.exitCode()).isEqualTo(2);
    }

    @Test
    void testDensityOutOfRangeIsError() {
        TestUtils.Run run = TestUtils.run(new CMD_generate_sat3(),
            "-n", "20", "--density", "1.5", "-o", tempDir.resolve("x.txt").toString());

        assertThat(run.exitCode()).isEqualTo(2);
    }
}
