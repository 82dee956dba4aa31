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
import io.cliquebench.generators.random.RandomGenerators;

/// Options for [HashedSAT3Builder].
///
/// ```java
/// HashedSAT3Options options = HashedSAT3Options.builder()
///     .conflictProbability(0.25)
///     .vertexCap(1000)
///     .build();
/// ```
public final class HashedSAT3Options {

  /// Probability of connecting a pair of literals that share a clause.
  public static final double DEFAULT_CONFLICT_PROBABILITY = 0.3d;

  /// Largest vertex count the builder produces.
  public static final int DEFAULT_VERTEX_CAP = 500;

  private final double conflictProbability;
  private final int vertexCap;
  private final RandomGenerators.Algorithm algorithm;

  private HashedSAT3Options(Builder builder) {
    this.conflictProbability = builder.conflictProbability;
    this.vertexCap = builder.vertexCap;
    this.algorithm = builder.algorithm;
  }

  public double conflictProbability() {
    return conflictProbability;
  }

  public int vertexCap() {
    return vertexCap;
  }

  public RandomGenerators.Algorithm algorithm() {
    return algorithm;
  }

  /// Defaults: conflict probability 0.3, vertex cap 500, XoShiRo256++.
  public static HashedSAT3Options defaults() {
    return new Builder().build();
  }

  public static Builder builder() {
    return new Builder();
  }

  public Builder toBuilder() {
    return new Builder()
        .conflictProbability(conflictProbability)
        .vertexCap(vertexCap)
        .algorithm(algorithm);
  }

  @Override
  public String toString() {
    return "HashedSAT3Options{" +
        "conflictProbability=" + conflictProbability +
        ", vertexCap=" + vertexCap +
        ", algorithm=" + algorithm +
        '}';
  }

  /// Builder for HashedSAT3Options.
  public static final class Builder {
    private double conflictProbability = DEFAULT_CONFLICT_PROBABILITY;
    private int vertexCap = DEFAULT_VERTEX_CAP;
    private RandomGenerators.Algorithm algorithm = RandomGenerators.Algorithm.XO_SHI_RO_256_PP;

    Builder() {
    }

    /// @param probability in `[0, 1]`
    /// @throws GraphConfigurationException if out of range
    public Builder conflictProbability(double probability) {
      if (!(probability >= 0.0d && probability <= 1.0d)) {
        throw new GraphConfigurationException(
            "conflict probability must be in [0, 1], got " + probability);
      }
      this.conflictProbability = probability;
      return this;
    }

    /// @param cap at least 6, the size of the smallest hashed instance
    /// @throws GraphConfigurationException if below 6
    public Builder vertexCap(int cap) {
      if (cap < HashedSAT3Builder.MIN_VERTICES) {
        throw new GraphConfigurationException(
            "vertex cap must be at least " + HashedSAT3Builder.MIN_VERTICES + ", got " + cap);
      }
      this.vertexCap = cap;
      return this;
    }

    public Builder algorithm(RandomGenerators.Algorithm algorithm) {
      this.algorithm = algorithm;
      return this;
    }

    public HashedSAT3Options build() {
      return new HashedSAT3Options(this);
    }
  }
}
