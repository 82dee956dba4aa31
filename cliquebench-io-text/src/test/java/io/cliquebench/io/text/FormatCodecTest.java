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

import io.cliquebench.api.graph.Edge;
import io.cliquebench.api.graph.Graph;
import io.cliquebench.api.services.GraphFormat;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Random;
import java.util.Set;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;

@Tag("unit")
class FormatCodecTest {

    @Test
    void testSnapToDimacsShiftsZeroBasedIds() {
        Graph graph = FormatCodec.parseSnap("0 1\n1 2\n# comment\n");

        assertEquals("p edge 3 2\ne 1 2\ne 2 3\n", FormatCodec.toDimacs(graph));
    }

    @Test
    void testCommentsCarriedIntoDimacs() {
        GraphDocument doc = FormatCodec.readSnap("0 1\n1 2\n# comment\n");

        assertEquals("c comment\np edge 3 2\ne 1 2\ne 2 3\n", FormatCodec.toDimacs(doc));
    }

    @Test
    void testOneBasedSnapIsNotShifted() {
        Graph graph = FormatCodec.parseSnap("1 2\n2 3\n3 1\n");

        assertEquals("p edge 3 3\ne 1 2\ne 2 3\ne 1 3\n", FormatCodec.toDimacs(graph));
    }

    @Test
    void testSnapOutputPreservesBase() {
        Graph zeroBased = FormatCodec.parseSnap("0 1\n2 1\n");
        assertEquals("0 1\n1 2\n", FormatCodec.toSnap(zeroBased));

        Graph oneBased = FormatCodec.parseDimacs("p edge 3 2\ne 1 2\ne 3 2\n");
        assertEquals("1 2\n2 3\n", FormatCodec.toSnap(oneBased));
    }

    @Test
    void testDimacsCommentsBecomeSnapComments() {
        GraphDocument doc = FormatCodec.readDimacs("c made by hand\np edge 2 1\ne 1 2\n");

        assertEquals("# made by hand\n1 2\n", FormatCodec.toSnap(doc));
    }

    @Test
    void testSnapThroughDimacsMatchesDirectParse() {
        String snap = "# Undirected\n0 4\n4 2\n2 0\n3 1\n0 4\n";
        Graph direct = FormatCodec.parseSnap(snap);

        Graph viaDimacs = FormatCodec.parseDimacs(FormatCodec.toDimacs(direct));

        assertThat(viaDimacs.shifted(-1).edges()).isEqualTo(direct.edges());
        assertThat(viaDimacs.edgeCount()).isEqualTo(4);
    }

    @Test
    void testDimacsRoundTripOnRandomGraphs() {
        Random random = new Random(7L);
        for (int trial = 0; trial < 25; trial++) {
            int n = 2 + random.nextInt(40);
            List<Edge> edges = random.ints(3L * n, 0, n * n)
                .filter(x -> x / n != x % n)
                .mapToObj(x -> Edge.of(x / n, x % n))
                .collect(Collectors.toList());
            Graph original = Graph.dense(n, edges);

            Graph parsed = FormatCodec.parseDimacs(FormatCodec.toDimacs(original));
            Graph restored = original.minVertex().orElse(1) == 0 ? parsed.shifted(-1) : parsed;

            assertThat(restored.edges()).isEqualTo(original.edges());
        }
    }

    @Test
    void testReadDispatchesOnFormat() {
        String text = "c x\np edge 2 1\ne 1 2\n";
        assertThat(GraphFormat.detect(text)).isEqualTo(GraphFormat.dimacs);
        assertThat(GraphFormat.detect("0 1\n")).isEqualTo(GraphFormat.snap);

        GraphDocument doc = FormatCodec.read(text, GraphFormat.detect(text));
        assertThat(doc.graph().edges()).isEqualTo(Set.of(new Edge(1, 2)));
    }
}
