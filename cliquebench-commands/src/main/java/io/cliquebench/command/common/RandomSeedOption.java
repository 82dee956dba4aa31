package io.cliquebench.command.common;

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

import io.cliquebench.generators.random.RandomGenerators;
import picocli.CommandLine;

/**
 * Shared random seed option using {@link Seed} record with automatic parsing.
 * An unspecified seed is drawn once from system entropy and then reused, so a run can be
 * reproduced from the seed it logs.
 */
public class RandomSeedOption {

    /**
     * Immutable random seed specification.
     *
     * @param value the seed value, or null for an entropy-derived seed
     */
    public record Seed(Long value) {

        public Seed(long value) {
            this(Long.valueOf(value));
        }

        public Seed() {
            this((Long) null);
        }

        public boolean isExplicit() {
            return value != null;
        }

        @Override
        public String toString() {
            return value != null ? String.valueOf(value) : "auto (entropy)";
        }
    }

    /**
     * Picocli type converter for {@link Seed} specifications.
     */
    public static class SeedConverter implements CommandLine.ITypeConverter<Seed> {

        @Override
        public Seed convert(String value) {
            if (value == null || value.trim().isEmpty()) {
                return new Seed();
            }

            try {
                return new Seed(Long.parseLong(value.trim()));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException(
                    "Invalid seed value: " + value + ". Must be a valid long integer."
                );
            }
        }
    }

    @CommandLine.Option(
        names = {"-s", "--seed"},
        description = "Random seed for generation (default: drawn from system entropy)",
        converter = SeedConverter.class
    )
    private Seed seed;

    private Long resolved;

    public Seed getSeedRecord() {
        return seed != null ? seed : new Seed();
    }

    /**
     * Gets the effective seed value. Repeated calls return the same value.
     */
    public long getSeed() {
        if (resolved == null) {
            Seed record = getSeedRecord();
            resolved = record.isExplicit() ? record.value() : RandomGenerators.randomSeed();
        }
        return resolved;
    }

    /**
     * @return the explicit seed, or null when none was given
     */
    public Long getExplicitSeed() {
        return isSeedSpecified() ? seed.value() : null;
    }

    public boolean isSeedSpecified() {
        return seed != null && seed.isExplicit();
    }

    @Override
    public String toString() {
        return getSeedRecord().toString();
    }
}
