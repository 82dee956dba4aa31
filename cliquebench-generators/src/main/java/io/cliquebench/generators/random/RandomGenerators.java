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
import org.apache.commons.rng.sampling.PermutationSampler;
import org.apache.commons.rng.simple.RandomSource;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Seeded pseudo-random generators for the graph generators.
 * Every generator call creates its own provider from an explicit seed, so two calls with the
 * same seed draw identical sequences and no state is shared between calls.
 */
public class RandomGenerators {

    /**
     * Available PRNG algorithms. XO_SHI_RO_256_PP is the default.
     */
    public enum Algorithm {
        /**
         * XorShiro256++ algorithm - 256-bit state, fast with excellent statistical properties
         * Period: 2^256 - 1
         */
        XO_SHI_RO_256_PP(RandomSource.XO_SHI_RO_256_PP),

        /**
         * XorShiro128++ algorithm - 128-bit state
         * Period: 2^128 - 1
         */
        XO_SHI_RO_128_PP(RandomSource.XO_SHI_RO_128_PP),

        /**
         * SplitMix64 algorithm - 64-bit state
         * Period: 2^64
         */
        SPLIT_MIX_64(RandomSource.SPLIT_MIX_64),

        /**
         * Mersenne Twister, 19937-bit state
         */
        MT(RandomSource.MT);

        private final RandomSource source;

        Algorithm(RandomSource source) {
            this.source = source;
        }

        RandomSource getSource() {
            return source;
        }

        /**
         * Case-insensitive lookup, accepting dashes for underscores.
         *
         * @param name an algorithm name such as {@code xo-shi-ro-256-pp} or {@code MT}
         * @return the algorithm
         * @throws IllegalArgumentException if no algorithm has that name
         */
        public static Algorithm fromName(String name) {
            return valueOf(name.trim().replace('-', '_').toUpperCase(Locale.ROOT));
        }
    }

    private RandomGenerators() {
    }

    /**
     * Creates a new random number generator with the specified algorithm and seed.
     *
     * @param algorithm The PRNG algorithm to use
     * @param seed The seed for deterministic random generation
     * @return A uniform random provider
     */
    public static RestorableUniformRandomProvider create(Algorithm algorithm, long seed) {
        return algorithm.getSource().create(seed);
    }

    /**
     * Creates a new random number generator with the default algorithm and specified seed.
     *
     * @param seed The seed for deterministic random generation
     * @return A uniform random provider
     */
    public static RestorableUniformRandomProvider create(long seed) {
        return create(Algorithm.XO_SHI_RO_256_PP, seed);
    }

    /**
     * @return a fresh seed from the platform's entropy, for callers that did not supply one
     */
    public static long randomSeed() {
        return RandomSource.createLong();
    }

    /**
     * Draws a uniform random subset of {@code count} elements without replacement. The source
     * is not modified; the result lists the chosen elements in draw order.
     *
     * <p>This is a partial Fisher-Yates pass over a copy of the source, so the result depends
     * only on the source order and the generator state.
     *
     * @param <T> element type
     * @param source elements to choose from
     * @param count number of elements to choose, between 0 and {@code source.size()}
     * @param rng The random number generator
     * @return the chosen elements
     */
    public static <T> List<T> sample(List<T> source, int count, UniformRandomProvider rng) {
        if (count < 0 || count > source.size()) {
            throw new IllegalArgumentException(
                "Cannot sample " + count + " of " + source.size() + " elements");
        }
        List<T> pool = new ArrayList<>(source);
        int size = pool.size();
        for (int i = 0; i < count; i++) {
            int j = i + rng.nextInt(size - i);
            T temp = pool.get(i);
            pool.set(i, pool.get(j));
            pool.set(j, temp);
        }
        return new ArrayList<>(pool.subList(0, count));
    }

    /**
     * Draws {@code count} distinct integers from {@code [0, range)}.
     *
     * @param rng The random number generator
     * @param range exclusive upper bound
     * @param count how many to draw, at most {@code range}
     * @return the drawn values in draw order
     */
    public static int[] distinct(UniformRandomProvider rng, int range, int count) {
        return new PermutationSampler(rng, range, count).sample();
    }
}
