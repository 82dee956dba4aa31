package io.cliquebench.generators.sat3;

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
import io.cliquebench.api.graph.Edge;
import io.cliquebench.api.graph.Graph;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

@Tag("unit")
class HashedSAT3BuilderTest {

  private final HashedSAT3Builder builder = new HashedSAT3Builder();

  @Test
  void testSameSeedSameGraph() {
    Graph first = builder.build(150, 0.08, 48L);
    Graph second = builder.build(150, 0.08, 48L);

    assertEquals(first, second);
    assertThat(first.edges()).containsExactlyElementsOf(second.edges());
  }

  @Test
  void testVertexCountAndVariableEdges() {
    Graph graph = builder.build(151, 1.0, 3L);

    assertEquals(150, graph.vertexCount());
    for (int x = 1; x <= 75; x++) {
      assertTrue(graph.hasEdge(2 * (x - 1), 2 * (x - 1) + 1), "variable " + x);
    }
  }

  @Test
  void testDensityIsAnUpperBound() {
    Graph sparse = builder.build(150, 0.08, 48L);
    long target = Math.round(150 * 149 / 2.0 * 0.08);

    assertThat((long) sparse.edgeCount()).isLessThanOrEqualTo(target);
    assertThat(sparse.density()).isLessThanOrEqualTo(0.08 + 1e-9);
  }

  @Test
  void testTrimmingHitsRoundedTarget() {
    // C(60,2) * 0.01 = 17.7, rounded to 18, well below the 30 variable edges
    Graph graph = builder.build(60, 0.01, 1L);

    assertEquals(18, graph.edgeCount());
    assertEquals(graph, builder.build(60, 0.01, 1L));

    Graph empty = builder.build(60, 0.0, 1L);
    assertEquals(0, empty.edgeCount());
    assertEquals(60, empty.vertexCount());
  }

  @Test
  void testConflictProbabilityExtremes() {
    Graph none = new HashedSAT3Builder(HashedSAT3Options.builder().conflictProbability(0.0).build())
        .build(20, 1.0, 1L);
    assertEquals(10, none.edgeCount());

    Graph all = new HashedSAT3Builder(HashedSAT3Options.builder().conflictProbability(1.0).build())
        .build(20, 1.0, 1L);
    for (List<Integer> clause : HashedSAT3Builder.formula(10, 20).clauses()) {
      assertTrue(all.hasEdge(HashedSAT3Builder.vertexOf(clause.get(0)), HashedSAT3Builder.vertexOf(clause.get(1))));
      assertTrue(all.hasEdge(HashedSAT3Builder.vertexOf(clause.get(0)), HashedSAT3Builder.vertexOf(clause.get(2))));
      assertTrue(all.hasEdge(HashedSAT3Builder.vertexOf(clause.get(1)), HashedSAT3Builder.vertexOf(clause.get(2))));
    }
  }

  @Test
  void testVertexCap() {
    assertEquals(500, builder.build(1000, 0.01, 1L).vertexCount());

    HashedSAT3Builder small = new HashedSAT3Builder(HashedSAT3Options.builder().vertexCap(40).build());
    Graph graph = small.build(300, 0.5, 1L);
    assertEquals(40, graph.vertexCount());
    for (Edge edge : graph.edges()) {
      assertThat(edge.v()).isLessThan(40);
    }
  }

  @Test
  void testLiteralVertexNumbering() {
    assertEquals(0, HashedSAT3Builder.vertexOf(1));
    assertEquals(1, HashedSAT3Builder.vertexOf(-1));
    assertEquals(8, HashedSAT3Builder.vertexOf(5));
    assertEquals(9, HashedSAT3Builder.vertexOf(-5));
  }

  @Test
  void testInvalidArguments() {
    assertThatThrownBy(() -> builder.build(5, 0.1, 1L)).isInstanceOf(GraphConfigurationException.class);
    assertThatThrownBy(() -> builder.build(100, 1.2, 1L)).isInstanceOf(GraphConfigurationException.class);
    assertThatThrownBy(() -> builder.build(100, -0.1, 1L)).isInstanceOf(GraphConfigurationException.class);
    assertThatThrownBy(() -> HashedSAT3Options.builder().conflictProbability(1.1))
        .isInstanceOf(GraphConfigurationException.class);
    assertThatThrownBy(() -> HashedSAT3Options.builder().vertexCap(4))
        .isInstanceOf(GraphConfigurationException.class);
  }
}
