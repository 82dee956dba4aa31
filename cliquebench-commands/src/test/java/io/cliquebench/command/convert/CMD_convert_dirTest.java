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

import io.cliquebench.api.services.GraphFormat;
import io.cliquebench.command.TestUtils;
import io.cliquebench.command.convert.subcommands.CMD_convert_dir;
import io.cliquebench.io.text.GraphFileIO;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class CMD_convert_dirTest {

    @TempDir
    Path tempDir;

    @Test
    void testConvertsSnapInPlaceAndSkipsDimacs() throws IOException {
        Path dir = Files.createDirectories(tempDir.resolve("synthetic"));
        Path snap = Files.writeString(dir.resolve("a.txt"), "# Synthetic\n0 1\n1 2\n");
        String dimacsText = "c done\np edge 2 1\ne 1 2\n";
        Path dimacs = Files.writeString(dir.resolve("b.txt"), dimacsText);
        Path other = Files.writeString(dir.resolve("c.csv"), "0,1\n");

        TestUtils.Run run = TestUtils.run(new CMD_convert_dir(), dir.toString());

        assertThat(run.exitCode()).isZero();
        assertThat(GraphFileIO.detect(snap)).isEqualTo(GraphFormat.dimacs);
        assertThat(Files.readString(snap)).isEqualTo(
            "c Synthetic\nc Vertices: 3, Edges: 2\np edge 3 2\ne 1 2\ne 2 3\n");
        assertThat(Files.readString(dimacs)).isEqualTo(dimacsText);
        assertThat(Files.readString(other)).isEqualTo("0,1\n");
        assertThat(dir.resolve("a.txt.tmp")).doesNotExist();
        assertThat(run.stdout()).contains("Converted 1 file(s), skipped 1");
    }

    @Test
    void testSecondRunIsNoOp() throws IOException {
        Path dir = Files.createDirectories(tempDir.resolve("real_world"));
        Path snap = Files.writeString(dir.resolve("g.txt"), "0 1\n");

        TestUtils.run(new CMD_convert_dir(), dir.toString());
        String once = Files.readString(snap);
        TestUtils.Run again = TestUtils.run(new CMD_convert_dir(), dir.toString());

        assertThat(again.exitCode()).isZero();
        assertThat(Files.readString(snap)).isEqualTo(once);
    }

    @Test
    void testMissingDirectoryIsWarning() throws IOException {
        Path dir = Files.createDirectories(tempDir.resolve("present"));
        Files.writeString(dir.resolve("g.txt"), "0 1\n");

        TestUtils.Run run = TestUtils.run(new CMD_convert_dir(),
            tempDir.resolve("absent").toString(), dir.toString());

        assertThat(run.exitCode()).isEqualTo(1);
        assertThat(GraphFileIO.detect(dir.resolve("g.txt"))).isEqualTo(GraphFormat.dimacs);
    }
}
