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
import io.cliquebench.api.sat.CNFFormula;
import io.cliquebench.generators.random.RandomGenerators;
import org.apache.commons.rng.UniformRandomProvider;

import java.util.ArrayList;
import java.util.List;

/// Clause generators behind [CNFFamily]. Each takes the generator to draw from, so a family
/// run is reproducible from its seed.
public final class CNFFamilies {

  /// Clause widths for crypto-like formulas; width 3 is three times as likely.
  static final int[] CRYPTO_WIDTHS = {2, 3, 3, 3, 4};

  /// Chance of leaving a planted clause position to a free literal.
  static final double PLANTED_FREE_LITERAL = 0.3d;

  private CNFFamilies() {
  }

  public static CNFFormula random3Sat(int vars, int clauses, UniformRandomProvider rng) {
    requirePositive(vars, clauses);
    List<List<Integer>> cnf = new ArrayList<>(clauses);
    for (int i = 0; i < clauses; i++) {
      cnf.add(randomClause(vars, Math.min(3, vars), rng));
    }
    return CNFFormula.of(cnf);
  }

  /// @param vars number of variables
  /// @param rng generator
  /// @return a uniformly random assignment, index 0 unused
  public static boolean[] randomAssignment(int vars, UniformRandomProvider rng) {
    boolean[] assignment = new boolean[vars + 1];
    for (int x = 1; x <= vars; x++) {
      assignment[x] = rng.nextBoolean();
    }
    return assignment;
  }

  /// Builds clauses that the assignment satisfies. Per clause, the first variable drawn above
  /// [#PLANTED_FREE_LITERAL] takes its true literal and the others take a random polarity; a
  /// clause still left unsatisfied gets its first literal forced true.
  ///
  /// @param assignment truth values indexed by variable id, index 0 unused
  /// @param clauses number of clauses
  /// @param rng generator
  /// @return a formula satisfied by `assignment`
  public static CNFFormula planted3Sat(boolean[] assignment, int clauses,
                                       UniformRandomProvider rng) {
    int vars = assignment.length - 1;
    requirePositive(vars, clauses);
    List<List<Integer>> cnf = new ArrayList<>(clauses);
    for (int i = 0; i < clauses; i++) {
      int[] chosen = distinctVariables(vars, Math.min(3, vars), rng);
      List<Integer> clause = new ArrayList<>(chosen.length);
      boolean satisfied = false;
      for (int x : chosen) {
        if (rng.nextDouble() > PLANTED_FREE_LITERAL && !satisfied) {
          clause.add(assignment[x] ? x : -x);
          satisfied = true;
        } else {
          clause.add(rng.nextDouble() > 0.5d ? x : -x);
        }
      }
      if (clause.stream().noneMatch(literal -> CNFFormula.isTrue(literal, assignment))) {
        int x = chosen[0];
        clause.set(0, assignment[x] ? x : -x);
      }
      cnf.add(clause);
    }
    return CNFFormula.of(cnf);
  }

  public static CNFFormula cryptoLike(int vars, int clauses, UniformRandomProvider rng) {
    requirePositive(vars, clauses);
    List<List<Integer>> cnf = new ArrayList<>(clauses);
    for (int i = 0; i < clauses; i++) {
      int width = CRYPTO_WIDTHS[rng.nextInt(CRYPTO_WIDTHS.length)];
      cnf.add(randomClause(vars, Math.min(width, vars), rng));
    }
    return CNFFormula.of(cnf);
  }

  /// Standard coloring encoding. Variable `v*colors + c + 1` means vertex `v` has color `c`.
  /// One clause per vertex requires some color; for every edge of a random graph with the
  /// given edge density, one clause per color forbids both endpoints taking it.
  public static CNFFormula graphColoring(int vertices, int colors, double edgeDensity,
                                         UniformRandomProvider rng) {
    if (vertices < 1 || colors < 1) {
      throw new GraphConfigurationException(
          "vertices and colors must be positive, got " + vertices + " and " + colors);
    }
    if (!(edgeDensity >= 0.0d && edgeDensity <= 1.0d)) {
      throw new GraphConfigurationException("edge density must be in [0, 1], got " + edgeDensity);
    }
    List<int[]> edges = new ArrayList<>();
    for (int i = 0; i < vertices; i++) {
      for (int j = i + 1; j < vertices; j++) {
        if (rng.nextDouble() < edgeDensity) {
          edges.add(new int[] {i, j});
        }
      }
    }

    List<List<Integer>> cnf = new ArrayList<>();
    for (int v = 0; v < vertices; v++) {
      List<Integer> clause = new ArrayList<>(colors);
      for (int c = 0; c < colors; c++) {
        clause.add(v * colors + c + 1);
      }
      cnf.add(clause);
    }
    for (int[] edge : edges) {
      for (int c = 0; c < colors; c++) {
        cnf.add(List.of(-(edge[0] * colors + c + 1), -(edge[1] * colors + c + 1)));
      }
    }
    return CNFFormula.of(cnf);
  }

  public static CNFFormula example3Sat() {
    return CNFFormula.of(new int[][] {
        {1, 2, 3},
        {-1, -2, 4},
        {2, -3, -4},
        {1, 3, 4},
        {-1, 2, -4},
        {3, -2, 1},
        {-3, 4, -1},
        {2, 3, -4}
    });
  }

  private static List<Integer> randomClause(int vars, int width, UniformRandomProvider rng) {
    List<Integer> clause = new ArrayList<>(width);
    for (int x : distinctVariables(vars, width, rng)) {
      clause.add(rng.nextDouble() > 0.5d ? x : -x);
    }
    return clause;
  }

  private static int[] distinctVariables(int vars, int count, UniformRandomProvider rng) {
    int[] chosen = RandomGenerators.distinct(rng, vars, count);
    for (int i = 0; i < chosen.length; i++) {
      chosen[i]++;
    }
    return chosen;
  }

  private static void requirePositive(int vars, int clauses) {
    if (vars < 1 || clauses < 1) {
      throw new GraphConfigurationException(
          "variables and clauses must be positive, got " + vars + " and " + clauses);
    }
  }
}
