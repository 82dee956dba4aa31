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

import java.util.Optional;

/// A formula produced by a [CNFFamily], with the planted assignment when the family has one.
///
/// @param family the family that produced the formula
/// @param formula the clauses
/// @param plantedAssignment truth values indexed by variable id, or null
/// @param description one-line summary used in file headers
public record GeneratedFormula(CNFFamily family, CNFFormula formula, boolean[] plantedAssignment,
                               String description) {

  /// @return the assignment the formula was built to satisfy, if any
  public Optional<boolean[]> planted() {
    return Optional.ofNullable(plantedAssignment == null ? null : plantedAssignment.clone());
  }
}
