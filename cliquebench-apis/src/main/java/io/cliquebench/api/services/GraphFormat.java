package io.cliquebench.api.services;

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

import java.util.Locale;

/// A canonical name for a textual graph encoding
public enum GraphFormat {
  /// SNAP edge list: `#` comments, `u v` lines, no header, ids in any base
  snap,
  /// DIMACS edge format: `c` comments, one `p edge N M` line, `e u v` lines, 1-based ids
  dimacs;

  /// Picks the format of a text by looking for a DIMACS problem line.
  /// @param text the whole input
  /// @return [#dimacs] if any line starts with `p edge` or `p col`, otherwise [#snap]
  public static GraphFormat detect(CharSequence text) {
    return text.toString().lines().anyMatch(GraphFormat::isDimacsProblemLine) ? dimacs : snap;
  }

  /// @param line a single line of input
  /// @return true for a DIMACS `p edge` or `p col` line
  public static boolean isDimacsProblemLine(String line) {
    String trimmed = line.trim();
    return trimmed.startsWith("p edge") || trimmed.startsWith("p col");
  }

  /// Lenient lookup by name, e.g. from a file extension or a command line value.
  /// @param name `snap`, `dimacs`, `txt`, `edges`, `clq`, `col`, case insensitive
  /// @return the format
  /// @throws IllegalArgumentException if the name is not recognized
  public static GraphFormat fromName(String name) {
    String lower = name.trim().toLowerCase(Locale.ROOT);
    switch (lower) {
      case "snap":
      case "txt":
      case "edges":
        return snap;
      case "dimacs":
      case "clq":
      case "col":
        return dimacs;
      default:
        throw new IllegalArgumentException("Unknown graph format: " + name);
    }
  }
}
