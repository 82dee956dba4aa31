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

/// Thrown when a generator or reduction is called with parameters it cannot honor: quadrant
/// probabilities that do not sum to one, malformed CNF, non-positive vertex or edge counts.
///
/// This is always fatal to the single call. Nothing is silently corrected.
public class GraphConfigurationException extends RuntimeException {

    public GraphConfigurationException(String message) {
        super(message);
    }

    public GraphConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
