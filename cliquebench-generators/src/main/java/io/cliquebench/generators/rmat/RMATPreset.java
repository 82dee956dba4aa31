package io.cliquebench.generators.rmat;

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

/// Named quadrant probabilities used by the standard benchmark suite.
public enum RMATPreset {
  /// Uniform quadrants, an Erdos-Renyi-like graph.
  ERDOS_RENYI(0.25, 0.25, 0.25, 0.25, "er"),
  /// Moderately skewed degree distribution.
  SKEWED_1(0.45, 0.15, 0.15, 0.25, "sd1"),
  /// Strongly skewed degree distribution.
  SKEWED_2(0.55, 0.15, 0.15, 0.15, "sd2");

  private final double a;
  private final double b;
  private final double c;
  private final double d;
  private final String shortName;

  RMATPreset(double a, double b, double c, double d, String shortName) {
    this.a = a;
    this.b = b;
    this.c = c;
    this.d = d;
    this.shortName = shortName;
  }

  public double a() {
    return a;
  }

  public double b() {
    return b;
  }

  public double c() {
    return c;
  }

  public double d() {
    return d;
  }

  /// @return the short name used in suite file names, e.g. `sd1`
  public String shortName() {
    return shortName;
  }

  /// Lenient lookup by enum name, dashed name or short name.
  /// @param name e.g. `SKEWED_1`, `skewed-1` or `sd1`
  /// @return the preset
  /// @throws IllegalArgumentException if no preset matches
  public static RMATPreset fromName(String name) {
    String normalized = name.trim().replace('-', '_').toUpperCase(Locale.ROOT);
    for (RMATPreset preset : values()) {
      if (preset.name().equals(normalized) || preset.shortName.equalsIgnoreCase(name.trim())) {
        return preset;
      }
    }
    throw new IllegalArgumentException("Unknown R-MAT preset: " + name);
  }
}
