package io.cliquebench.generators.rmat;

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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

@Tag("unit")
class RMATGeneratorTest {

  private final RMATGenerator generator = new RMATGenerator();

  @Test
  void testSameSeedSameGraph() {
    RMATParams params = RMATParams.of(RMATPreset.ERDOS_RENYI, 8, 1000, 1L);

    Graph first = generator.generate(params);
    Graph second = generator.generate(params);

    assertThat(first.edges()).containsExactlyElementsOf(second.edges());
  }

  @Test
  void testBudgetExhaustionReturnsPartialGraph() {
    // 8 vertices admit only 28 distinct edges
    RMATResult result = generator.run(RMATParams.of(RMATPreset.ERDOS_RENYI, 8, 1000, 1L));

    assertFalse(result.isComplete());
    assertEquals(10_000L, result.attempts());
    assertThat(result.graph().edgeCount()).isLessThanOrEqualTo(28);
    assertEquals(1000 - result.graph().edgeCount(), result.shortfall());
  }

  @Test
  void testEdgesAreCanonicalAndInRange() {
    Graph graph = generator.generate(RMATParams.of(RMATPreset.SKEWED_2, 37, 300, 9L));

    assertEquals(37, graph.vertexCount());
    for (Edge edge : graph.edges()) {
      assertThat(edge.u()).isLessThan(edge.v());
      assertThat(edge.v()).isLessThan(37);
    }
  }

  @Test
  void testSuiteSizedRunCompletes() {
    RMATResult result = generator.run(RMATParams.of(RMATPreset.ERDOS_RENYI, 200, 2000, 42L));

    assertTrue(result.isComplete());
    assertEquals(2000, result.graph().edgeCount());
    assertEquals(42L, result.seed());
    assertThat(result.attempts()).isBetween(2000L, 20_000L);
  }

  @Test
  void testSingleVertexHasNoEdges() {
    RMATResult result = generator.run(RMATParams.of(RMATPreset.SKEWED_1, 1, 5, 3L));

    assertEquals(0, result.graph().edgeCount());
    assertEquals(1, result.graph().vertexCount());
    assertEquals(0L, result.attempts());
  }

  @Test
  void testRandomSeedIsReportedAndReproducible() {
    RMATParams unseeded = RMATParams.of(RMATPreset.SKEWED_1, 64, 100, null);
    RMATResult result = generator.run(unseeded);

    Graph again = generator.generate(unseeded.withSeed(result.seed()));

    assertThat(again.edges()).containsExactlyElementsOf(result.graph().edges());
  }

  @Test
  void testInvalidParameters() {
    assertThatThrownBy(() -> new RMATParams(0.3, 0.3, 0.3, 0.3, 10, 10, 1L))
        .isInstanceOf(GraphConfigurationException.class)
        .hasMessageContaining("sum to 1");
    assertThatThrownBy(() -> new RMATParams(-0.1, 0.5, 0.3, 0.3, 10, 10, 1L))
        .isInstanceOf(GraphConfigurationException.class);
    assertThatThrownBy(() -> RMATParams.of(RMATPreset.ERDOS_RENYI, 0, 10, 1L))
        .isInstanceOf(GraphConfigurationException.class);
    assertThatThrownBy(() -> RMATParams.of(RMATPreset.ERDOS_RENYI, 10, 0, 1L))
        .isInstanceOf(GraphConfigurationException.class);
    // within tolerance
    new RMATParams(0.25, 0.25, 0.25, 0.2500005, 10, 10, 1L);
  }

  @Test
  void testPresetNames() {
    assertEquals(RMATPreset.SKEWED_1, RMATPreset.fromName("sd1"));
    assertEquals(RMATPreset.ERDOS_RENYI, RMATPreset.fromName("erdos-renyi"));
    assertEquals(RMATPreset.SKEWED_2, RMATPreset.fromName("SKEWED_2"));
    assertThatThrownBy(() -> RMATPreset.fromName("kronecker")).isInstanceOf(IllegalArgumentException.class);
  }
}
