package io.cliquebench.api.errors;

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

/// A skipped input line. Benchmark corpora are rarely pristine, so parsers record one of these
/// and keep going instead of failing the whole read.
///
/// @param lineNumber 1-based line number in the input
/// @param line the offending line, as read
/// @param reason why it was skipped
public record ParseWarning(long lineNumber, String line, String reason) {

    @Override
    public String toString() {
        return "line " + lineNumber + ": " + reason + " [" + line + "]";
    }
}
