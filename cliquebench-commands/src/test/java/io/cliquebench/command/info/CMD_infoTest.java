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

import io.cliquebench.command.TestUtils;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class CMD_infoTest {

    @TempDir
    Path tempDir;

    @Test
    void testSnapSummary() throws IOException {
        Path graph = Files.writeString(tempDir.resolve("star.txt"), "# star\n0 1\n0 2\n0 3\n");

        TestUtils.Run run = TestUtils.run(new CMD_info(), "-i", graph.toString());

        assertThat(run.exitCode()).isZero();
        assertThat(run.stdout())
            .contains("Format: snap")
            .contains("Vertices: 4")
            .contains("Edges: 3")
            .contains("Density: 0.5000")
            .contains("Degree: min 1, max 3, avg 1.50")
            .contains("Comments: 1");
    }

    @Test
    void testDimacsDeclaredCount() throws IOException {
        Path graph = Files.writeString(tempDir.resolve("g.clq"), "p edge 5 1\ne 1 2\n");

        TestUtils.Run run = TestUtils.run(new CMD_info(), "-i", graph.toString());

        assertThat(run.exitCode()).isZero();
        assertThat(run.stdout()).contains("Format: dimacs").contains("Vertices: 5")
            .contains("Referenced vertices: 2");
    }

    @Test
    void testSkippedLinesListedAndWarned() throws IOException {
        Path graph = Files.writeString(tempDir.resolve("bad.txt"), "0 1\n2 2\n");

        TestUtils.Run run = TestUtils.run(new CMD_info(), "-i", graph.toString(), "--verbose");

        assertThat(run.exitCode()).isEqualTo(1);
        assertThat(run.stdout()).contains("Skipped lines: 1").contains("line 2: self-loop");
    }

    @Test
    void testMissingFileIsError() {
        TestUtils.Run run = TestUtils.run(new CMD_info(), "-i", tempDir.resolve("no").toString());

        assertThat(run.exitCode()).isEqualTo(2);
    }

    @Test
    void testInvalidUtf8IsError() throws IOException {
        Path graph = Files.write(tempDir.resolve("latin1.txt"), new byte[] {(byte) 0xC3, 0x28, '\n'});

        TestUtils.Run run = TestUtils.run(new CMD_info(), "-i", graph.toString());

        assertThat(run.exitCode()).isEqualTo(2);
    }
}
