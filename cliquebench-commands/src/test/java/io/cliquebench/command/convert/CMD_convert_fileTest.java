package io.cliquebench.command.convert;

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
import io.cliquebench.command.convert.subcommands.CMD_convert_file;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class CMD_convert_fileTest {

    @TempDir
    Path tempDir;

    @Test
    void testSnapToDimacsByDefault() throws IOException {
        Path in = Files.writeString(tempDir.resolve("g.txt"), "0 1\n1 2\n");
        Path out = tempDir.resolve("g.clq");

        TestUtils.Run run = TestUtils.run(new CMD_convert_file(),
            "-i", in.toString(), "-o", out.toString());

        assertThat(run.exitCode()).isZero();
        assertThat(Files.readString(out)).isEqualTo(
            "c Converted from SNAP format\n"
                + "c Vertices: 3, Edges: 2\n"
                + "p edge 3 2\n"
                + "e 1 2\n"
                + "e 2 3\n");
    }

    @Test
    void testSnapCommentsKept() throws IOException {
        Path in = Files.writeString(tempDir.resolve("c.txt"), "# Nodes: 3 Edges: 1\n5 7\n");
        Path out = tempDir.resolve("c.clq");

        TestUtils.Run run = TestUtils.run(new CMD_convert_file(),
            "-i", in.toString(), "-o", out.toString(), "--to", "dimacs");

        assertThat(run.exitCode()).isZero();
        assertThat(Files.readString(out)).isEqualTo(
            "c Nodes: 3 Edges: 1\nc Vertices: 2, Edges: 1\np edge 2 1\ne 5 7\n");
    }

    @Test
    void testDimacsToZeroBasedSnap() throws IOException {
        Path in = Files.writeString(tempDir.resolve("g.clq"), "p edge 3 2\ne 1 2\ne 3 2\n");
        Path out = tempDir.resolve("g.txt");

        TestUtils.Run run = TestUtils.run(new CMD_convert_file(),
            "-i", in.toString(), "-o", out.toString(), "--zero-based");

        assertThat(run.exitCode()).isZero();
        assertThat(Files.readString(out)).isEqualTo(
            "# Converted from DIMACS format\n# Vertices: 3, Edges: 2\n0 1\n1 2\n");
    }

    @Test
    void testExplicitFromOverridesDetection() throws IOException {
        Path in = Files.writeString(tempDir.resolve("odd.txt"), "1 2\n2 3\n");
        Path out = tempDir.resolve("odd.out");

        TestUtils.Run run = TestUtils.run(new CMD_convert_file(),
            "-i", in.toString(), "-o", out.toString(), "--from", "snap", "--to", "snap");

        assertThat(run.exitCode()).isZero();
        assertThat(Files.readString(out)).endsWith("1 2\n2 3\n");
    }

    @Test
    void testSkippedLinesGiveWarningExit() throws IOException {
        Path in = Files.writeString(tempDir.resolve("bad.txt"), "0 1\nx y\n");

        TestUtils.Run run = TestUtils.run(new CMD_convert_file(),
            "-i", in.toString(), "-o", tempDir.resolve("bad.clq").toString());

        assertThat(run.exitCode()).isEqualTo(1);
        assertThat(tempDir.resolve("bad.clq")).exists();
    }

    @Test
    void testMissingInputIsError() {
        TestUtils.Run run = TestUtils.run(new CMD_convert_file(),
            "-i", tempDir.resolve("none.txt").toString(), "-o", tempDir.resolve("o").toString());

        assertThat(run.exitCode()).isEqualTo(2);
    }

    @Test
    void testExistingOutputNeedsForce() throws IOException {
        Path in = Files.writeString(tempDir.resolve("g.txt"), "0 1\n");
        Path out = Files.writeString(tempDir.resolve("o.clq"), "keep\n");

        assertThat(TestUtils.run(new CMD_convert_file(),
            "-i", in.toString(), "-o", out.toString()).exitCode()).isEqualTo(1);
        assertThat(Files.readString(out)).isEqualTo("keep\n");

        assertThat(TestUtils.run(new CMD_convert_file(),
            "-i", in.toString(), "-o", out.toString(), "-f").exitCode()).isZero();
        assertThat(Files.readString(out)).contains("p edge 2 1");
    }

    @Test
    void testInvalidUtf8InputIsError() throws IOException {
        Path in = Files.write(tempDir.resolve("latin1.txt"), new byte[] {(byte) 0xC3, 0x28, '\n'});
        Path out = tempDir.resolve("latin1.clq");

        TestUtils.Run run = TestUtils.run(new CMD_convert_file(),
            "-i", in.toString(), "-o", out.toString());

        assertThat(run.exitCode()).isEqualTo(2);
        assertThat(out).doesNotExist();
    }

    @Test
    void testMaxIntSnapIdSkippedWithWarning() throws IOException {
        Path in = Files.writeString(tempDir.resolve("max.txt"), "0 2147483647\n0 1\n");
        Path out = tempDir.resolve("max.clq");

        TestUtils.Run run = TestUtils.run(new CMD_convert_file(),
            "-i", in.toString(), "-o", out.toString());

        assertThat(run.exitCode()).isEqualTo(1);
        assertThat(Files.readString(out)).endsWith("p edge 2 1\ne 1 2\n");
    }
}
