package io.cliquebench.generators.sat.families;

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

/// Parameters for [CNFFamily#generate(FamilyOptions)].
///
/// Unset sizes fall back to the family's own defaults. Only the sizes a family uses are read:
/// `variables` and `clauses` by the SAT families, `vertices`, `colors` and `edgeDensity` by
/// [CNFFamily#GRAPH_COLORING].
public final class FamilyOptions {

  private final Integer variables;
  private final Integer clauses;
  private final Integer vertices;
  private final Integer colors;
  private final Double edgeDensity;
  private final long seed;
  private final RandomGenerators.Algorithm algorithm;

  private FamilyOptions(Builder builder) {
    this.variables = builder.variables;
    this.clauses = builder.clauses;
    this.vertices = builder.vertices;
    this.colors = builder.colors;
    this.edgeDensity = builder.edgeDensity;
    this.seed = builder.seed;
    this.algorithm = builder.algorithm;
  }

  int variablesOr(int fallback) {
    return variables != null ? variables : fallback;
  }

  int clausesOr(int fallback) {
    return clauses != null ? clauses : fallback;
  }

  int verticesOr(int fallback) {
    return vertices != null ? vertices : fallback;
  }

  int colorsOr(int fallback) {
    return colors != null ? colors : fallback;
  }

  double edgeDensityOr(double fallback) {
    return edgeDensity != null ? edgeDensity : fallback;
  }

  public long seed() {
    return seed;
  }

  public RandomGenerators.Algorithm algorithm() {
    return algorithm;
  }

  public static Builder builder() {
    return new Builder();
  }

  @Override
  public String toString() {
    return "FamilyOptions{" +
        "variables=" + variables +
        ", clauses=" + clauses +
        ", vertices=" + vertices +
        ", colors=" + colors +
        ", edgeDensity=" + edgeDensity +
        ", seed=" + seed +
        '}';
  }

  public static final class Builder {
    private Integer variables;
    private Integer clauses;
    private Integer vertices;
    private Integer colors;
    private Double edgeDensity;
    private long seed = 42L;
    private RandomGenerators.Algorithm algorithm = RandomGenerators.Algorithm.XO_SHI_RO_256_PP;

    Builder() {
    }

    public Builder variables(Integer variables) {
      this.variables = positive("variables", variables);
      return this;
    }

    public Builder clauses(Integer clauses) {
      this.clauses = positive("clauses", clauses);
      return this;
    }

    public Builder vertices(Integer vertices) {
      this.vertices = positive("vertices", vertices);
      return this;
    }

    public Builder colors(Integer colors) {
      this.colors = positive("colors", colors);
      return this;
    }

    public Builder edgeDensity(Double edgeDensity) {
      if (edgeDensity != null && !(edgeDensity >= 0.0d && edgeDensity <= 1.0d)) {
        throw new GraphConfigurationException("edge density must be in [0, 1], got " + edgeDensity);
      }
      this.edgeDensity = edgeDensity;
      return this;
    }

    public Builder seed(long seed) {
      this.seed = seed;
      return this;
    }

    public Builder algorithm(RandomGenerators.Algorithm algorithm) {
      this.algorithm = algorithm;
      return this;
    }

    public FamilyOptions build() {
      return new FamilyOptions(this);
    }

    private static Integer positive(String name, Integer value) {
      if (value != null && value < 1) {
        throw new GraphConfigurationException(name + " must be positive, got " + value);
      }
      return value;
    }
  }
}
