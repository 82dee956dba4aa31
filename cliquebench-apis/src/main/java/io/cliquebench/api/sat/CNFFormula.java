package io.cliquebench.api.sat;

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

import java.util.ArrayList;
import java.util.List;

/// A formula in conjunctive normal form.
///
/// Clauses and the literals inside them keep their given order. Literal `k` is variable `k`,
/// literal `-k` its negation; `0` is never a literal. The variable count is the largest
/// absolute literal.
///
/// ```java
/// CNFFormula f = CNFFormula.of(List.of(List.of(1, 2, 3), List.of(-1, -2, 4)));
/// f.clauseCount();   // 2
/// f.numVariables();  // 4
/// ```
public final class CNFFormula {

  private final List<List<Integer>> clauses;
  private final int numVariables;
  private final int literalCount;

  private CNFFormula(List<List<Integer>> clauses, int numVariables, int literalCount) {
    this.clauses = clauses;
    this.numVariables = numVariables;
    this.literalCount = literalCount;
  }

  /// Validates and copies the clauses.
  /// @param clauses the clauses, outer and inner order preserved
  /// @return the formula
  /// @throws GraphConfigurationException if there are no clauses, a clause is empty, or a
  ///     literal is `0`
  public static CNFFormula of(List<? extends List<Integer>> clauses) {
    if (clauses == null || clauses.isEmpty()) {
      throw new GraphConfigurationException("CNF formula must contain at least one clause");
    }
    List<List<Integer>> copy = new ArrayList<>(clauses.size());
    int maxVar = 0;
    int literals = 0;
    for (int i = 0; i < clauses.size(); i++) {
      List<Integer> clause = clauses.get(i);
      if (clause == null || clause.isEmpty()) {
        throw new GraphConfigurationException("Clause " + i + " is empty");
      }
      for (Integer literal : clause) {
        if (literal == null || literal == 0) {
          throw new GraphConfigurationException("Clause " + i + " contains literal 0: " + clause);
        }
        maxVar = Math.max(maxVar, Math.abs(literal));
      }
      literals += clause.size();
      copy.add(List.copyOf(clause));
    }
    return new CNFFormula(List.copyOf(copy), maxVar, literals);
  }

  /// Convenience for literal arrays, e.g. `CNFFormula.of(new int[][]{{1, 2}, {-1, 3}})`.
  public static CNFFormula of(int[][] clauses) {
    List<List<Integer>> lists = new ArrayList<>();
    if (clauses != null) {
      for (int[] clause : clauses) {
        List<Integer> literals = new ArrayList<>();
        if (clause != null) {
          for (int literal : clause) {
            literals.add(literal);
          }
        }
        lists.add(literals);
      }
    }
    return of(lists);
  }

  public List<List<Integer>> clauses() {
    return clauses;
  }

  public List<Integer> clause(int index) {
    return clauses.get(index);
  }

  public int clauseCount() {
    return clauses.size();
  }

  public int numVariables() {
    return numVariables;
  }

  /// @return total number of literal occurrences over all clauses
  public int literalCount() {
    return literalCount;
  }

  /// Evaluates a literal under an assignment indexed by variable id; index 0 is unused.
  public static boolean isTrue(int literal, boolean[] assignment) {
    boolean value = assignment[Math.abs(literal)];
    return literal > 0 ? value : !value;
  }

  /// @param assignment truth values indexed by variable id (`assignment[0]` is ignored), at
  ///     least `numVariables() + 1` long
  /// @return true if every clause has a true literal
  public boolean isSatisfiedBy(boolean[] assignment) {
    if (assignment.length <= numVariables) {
      throw new IllegalArgumentException(
          "Assignment covers " + (assignment.length - 1) + " variables, formula has " + numVariables);
    }
    for (List<Integer> clause : clauses) {
      boolean satisfied = false;
      for (int literal : clause) {
        if (isTrue(literal, assignment)) {
          satisfied = true;
          break;
        }
      }
      if (!satisfied) {
        return false;
      }
    }
    return true;
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof CNFFormula && clauses.equals(((CNFFormula) o).clauses);
  }

  @Override
  public int hashCode() {
    return clauses.hashCode();
  }

  @Override
  public String toString() {
    return "CNFFormula{clauses=" + clauses.size() + ", variables=" + numVariables + "}";
  }
}
