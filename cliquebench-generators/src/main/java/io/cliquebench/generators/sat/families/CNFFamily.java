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

import io.cliquebench.api.sat.CNFFormula;
import io.cliquebench.generators.random.RandomGenerators;
import org.apache.commons.rng.UniformRandomProvider;

import java.util.Locale;

/// Named CNF instance families for the clique reduction.
///
/// ```java
/// GeneratedFormula planted = CNFFamily.PLANTED_3SAT.generate(
///     FamilyOptions.builder().variables(30).clauses(120).seed(7L).build());
/// ReducedGraph reduced = CNFReduction.reduce(planted.formula());
/// ```
public enum CNFFamily {

  /// Uniform random 3-SAT: three distinct variables per clause, fair polarity.
  RANDOM_3SAT {
    @Override
    public GeneratedFormula generate(FamilyOptions options) {
      int vars = options.variablesOr(20);
      int clauses = options.clausesOr(80);
      CNFFormula formula = CNFFamilies.random3Sat(vars, clauses, rng(options));
      return new GeneratedFormula(this, formula, null,
          "random 3-SAT, " + vars + " variables, " + clauses + " clauses");
    }
  },

  /// Random 3-SAT built around a hidden assignment that satisfies every clause.
  PLANTED_3SAT {
    @Override
    public GeneratedFormula generate(FamilyOptions options) {
      int vars = options.variablesOr(30);
      int clauses = options.clausesOr(120);
      UniformRandomProvider rng = rng(options);
      boolean[] assignment = CNFFamilies.randomAssignment(vars, rng);
      CNFFormula formula = CNFFamilies.planted3Sat(assignment, clauses, rng);
      return new GeneratedFormula(this, formula, assignment,
          "planted 3-SAT, " + vars + " variables, " + clauses + " clauses, satisfiable");
    }
  },

  /// Mixed-width clauses resembling encodings of cryptographic circuits.
  CRYPTO_LIKE {
    @Override
    public GeneratedFormula generate(FamilyOptions options) {
      int vars = options.variablesOr(256);
      int clauses = options.clausesOr(5000);
      CNFFormula formula = CNFFamilies.cryptoLike(vars, clauses, rng(options));
      return new GeneratedFormula(this, formula, null,
          "crypto-like SAT, " + vars + " variables, " + clauses + " clauses");
    }
  },

  /// Coloring constraints of a random graph.
  GRAPH_COLORING {
    @Override
    public GeneratedFormula generate(FamilyOptions options) {
      int vertices = options.verticesOr(15);
      int colors = options.colorsOr(4);
      double density = options.edgeDensityOr(0.5d);
      CNFFormula formula = CNFFamilies.graphColoring(vertices, colors, density, rng(options));
      return new GeneratedFormula(this, formula, null,
          "graph coloring, " + vertices + " vertices, " + colors + " colors");
    }
  },

  /// The fixed 8-clause, 4-variable example.
  EXAMPLE_3SAT {
    @Override
    public GeneratedFormula generate(FamilyOptions options) {
      return new GeneratedFormula(this, CNFFamilies.example3Sat(), null,
          "simple 3-SAT, 8 clauses, 4 variables");
    }
  };

  /// @param options sizes and seed; unset sizes use the family default
  /// @return the generated formula
  public abstract GeneratedFormula generate(FamilyOptions options);

  private static UniformRandomProvider rng(FamilyOptions options) {
    return RandomGenerators.create(options.algorithm(), options.seed());
  }

  /// Lenient lookup, e.g. `planted-3sat` or `PLANTED_3SAT`.
  public static CNFFamily fromName(String name) {
    return valueOf(name.trim().replace('-', '_').toUpperCase(Locale.ROOT));
  }
}
