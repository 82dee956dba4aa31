package io.cliquebench.generators.random;

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


import org.apache.commons.rng.RestorableUniformRandomProvider;
import org.apache.commons.rng.UniformRandomProvider;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.HashSet;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;

/**
 * Test class for RandomGenerators utility
 */
class RandomGeneratorsTest {

    @Test
    void testCreateWithAlgorithm() {
        // Different algorithms should produce different sequences even with same seed
        long seed = 12345L;
        RestorableUniformRandomProvider rng1 = RandomGenerators.create(RandomGenerators.Algorithm.XO_SHI_RO_256_PP, seed);
        RestorableUniformRandomProvider rng2 = RandomGenerators.create(RandomGenerators.Algorithm.XO_SHI_RO_128_PP, seed);

        assertNotEquals(rng1.nextLong(), rng2.nextLong());
    }

    @Test
    void testCreateDefaultAlgorithm() {
        long seed = 54321L;
        RestorableUniformRandomProvider rng1 = RandomGenerators.create(seed);
        RestorableUniformRandomProvider rng2 = RandomGenerators.create(RandomGenerators.Algorithm.XO_SHI_RO_256_PP, seed);

        assertEquals(rng1.nextInt(), rng2.nextInt());
        assertEquals(rng1.nextInt(), rng2.nextInt());
        assertEquals(rng1.nextInt(), rng2.nextInt());
    }

    @Test
    void testAlgorithmNames() {
        assertEquals(RandomGenerators.Algorithm.XO_SHI_RO_256_PP, RandomGenerators.Algorithm.fromName("xo-shi-ro-256-pp"));
        assertEquals(RandomGenerators.Algorithm.MT, RandomGenerators.Algorithm.fromName("mt"));
        assertThatThrownBy(() -> RandomGenerators.Algorithm.fromName("lcg")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void testSampleWithoutReplacement() {
        List<String> items = Arrays.asList("A", "B", "C", "D", "E", "F", "G");
        UniformRandomProvider rng = RandomGenerators.create(789L);

        List<String> chosen = RandomGenerators.sample(items, 4, rng);

        assertThat(chosen).hasSize(4).doesNotHaveDuplicates();
        assertThat(items).containsAll(chosen);
        assertThat(items).containsExactly("A", "B", "C", "D", "E", "F", "G");
        assertThat(RandomGenerators.sample(items, 7, rng)).containsExactlyInAnyOrderElementsOf(items);
        assertThat(RandomGenerators.sample(items, 0, rng)).isEmpty();
        assertThatThrownBy(() -> RandomGenerators.sample(items, 8, rng)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void testSampleIsRoughlyUniform() {
        // Each of 5 items should be picked about 2/5 of the time when drawing 2
        List<Integer> items = List.of(0, 1, 2, 3, 4);
        UniformRandomProvider rng = RandomGenerators.create(101L);
        int[] counts = new int[5];
        for (int i = 0; i < 5000; i++) {
            for (int picked : RandomGenerators.sample(items, 2, rng)) {
                counts[picked]++;
            }
        }
        for (int count : counts) {
            assertThat(count).isBetween(1800, 2200);
        }
    }

    @Test
    void testDistinct() {
        int[] values = RandomGenerators.distinct(RandomGenerators.create(7L), 10, 3);

        assertThat(values).hasSize(3);
        assertThat(new HashSet<>(Arrays.asList(values[0], values[1], values[2]))).hasSize(3);
        for (int v : values) {
            assertThat(v).isBetween(0, 9);
        }
    }
}
