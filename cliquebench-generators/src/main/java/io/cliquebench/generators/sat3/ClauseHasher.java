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

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/// Derives 3-literal clauses from SHA-256 digests.
///
/// Clause `i` over `nVars` variables is computed from the digest of the UTF-8 string
/// `clause_<i>_<nVars>`:
/// - variable `k` (for `k` in 0..2) is the big-endian unsigned 16-bit value of digest bytes
///   `2k` and `2k+1`, reduced to `value % nVars + 1`;
/// - a repeated variable is moved to `v % nVars + 1` until all three differ;
/// - literal `k` is positive iff digest byte `6+k` is even.
///
/// The result depends only on `(i, nVars)`.
public final class ClauseHasher {

  /// Smallest variable count that admits three distinct variables.
  public static final int MIN_VARIABLES = 3;

  private ClauseHasher() {
  }

  /// @param index clause index, from 0
  /// @param nVars number of variables, at least 3
  /// @return three literals over distinct variables in `[1, nVars]`
  public static int[] clause(int index, int nVars) {
    if (nVars < MIN_VARIABLES) {
      throw new GraphConfigurationException(
          "hashed clauses need at least " + MIN_VARIABLES + " variables, got " + nVars);
    }
    byte[] digest = sha256().digest(("clause_" + index + "_" + nVars).getBytes(StandardCharsets.UTF_8));

    int var1 = variable(digest, 0, nVars);
    int var2 = variable(digest, 1, nVars);
    int var3 = variable(digest, 2, nVars);
    while (var2 == var1) {
      var2 = var2 % nVars + 1;
    }
    while (var3 == var1 || var3 == var2) {
      var3 = var3 % nVars + 1;
    }

    return new int[] {
        polarity(digest, 0) * var1,
        polarity(digest, 1) * var2,
        polarity(digest, 2) * var3
    };
  }

  private static int variable(byte[] digest, int k, int nVars) {
    int value = ((digest[2 * k] & 0xff) << 8) | (digest[2 * k + 1] & 0xff);
    return value % nVars + 1;
  }

  private static int polarity(byte[] digest, int k) {
    return (digest[6 + k] & 1) == 0 ? 1 : -1;
  }

  private static MessageDigest sha256() {
    try {
      return MessageDigest.getInstance("SHA-256");
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 is required by every Java platform", e);
    }
  }
}
