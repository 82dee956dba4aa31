package io.cliquebench.io.text;

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
import io.cliquebench.api.graph.Edge;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.StringReader;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;

class SnapCodecTest {

    @Test
    void testCommentsAndBlankLines() throws IOException {
        GraphDocument doc = SnapCodec.read(new StringReader("""
            # Directed graph: example.txt
            # FromNodeId\tToNodeId

            0\t1
            1\t2
            """));

        assertThat(doc.comments()).containsExactly(" Directed graph: example.txt", " FromNodeId\tToNodeId");
        assertThat(doc.graph().edges()).containsExactly(new Edge(0, 1), new Edge(1, 2));
        assertThat(doc.graph().vertexCount()).isEqualTo(3);
        assertThat(doc.hasWarnings()).isFalse();
    }

    @Test
    void testExtraColumnsIgnored() throws IOException {
        GraphDocument doc = SnapCodec.read(new StringReader("5 7 0.25 label\n7 9 1.0\n"));

        assertThat(doc.graph().edges()).containsExactly(new Edge(5, 7), new Edge(7, 9));
    }

    @Test
    void testMalformedLinesSkippedNotFatal() throws IOException {
        GraphDocument doc = SnapCodec.read(new StringReader("""
            0 1
            a b
            2
            3 3
            -1 4
            1 x
            1 2
            """));

        assertThat(doc.graph().edges()).containsExactly(new Edge(0, 1), new Edge(1, 2));
        assertThat(doc.warnings()).extracting(ParseWarning::lineNumber).containsExactly(2L, 3L, 4L, 5L, 6L);
        assertThat(doc.warnings().get(2).reason()).isEqualTo("self-loop");
    }

    @Test
    void testReversedAndRepeatedPairsCollapse() throws IOException {
        GraphDocument doc = SnapCodec.read(new StringReader("1 0\n0 1\n0 1\n2 0\n"));

        assertThat(doc.graph().edges()).containsExactly(new Edge(0, 1), new Edge(0, 2));
        assertEquals(2, doc.graph().edgeCount());
    }

    @Test
    void testCommentKeepsTrailingWhitespace() throws IOException {
        GraphDocument doc = SnapCodec.read(new StringReader("# trailing  \n#\t\n0 1\n"));

        assertThat(doc.comments()).containsExactly(" trailing  ", "\t");
    }

    @Test
    void testMaxIntIdSkippedWithWarning() throws IOException {
        GraphDocument doc = SnapCodec.read(new StringReader("0 2147483647\n0 1\n"));

        assertThat(doc.graph().edges()).containsExactly(new Edge(0, 1));
        assertThat(doc.warnings()).hasSize(1);
        assertEquals(1L, doc.warnings().get(0).lineNumber());
        assertEquals("vertex id has no 1-based equivalent", doc.warnings().get(0).reason());
        assertEquals("p edge 2 1\ne 1 2\n", FormatCodec.toDimacs(doc.graph()));
    }
}
