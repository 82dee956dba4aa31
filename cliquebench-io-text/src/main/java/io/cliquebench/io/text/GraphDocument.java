package io.cliquebench.io.text;

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

import io.cliquebench.api.errors.ParseWarning;
import io.cliquebench.api.graph.Graph;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/// A graph together with the comment lines and parse warnings of the text it came from.
///
/// Comment text is stored without its format marker (`#` or `c`), so the same comments can be
/// written back in either format.
///
/// @param graph the parsed graph
/// @param comments comment texts in input order, marker stripped
/// @param warnings lines skipped while parsing
public record GraphDocument(Graph graph, List<String> comments, List<ParseWarning> warnings) {

  public GraphDocument {
    Objects.requireNonNull(graph, "graph");
    comments = List.copyOf(comments);
    warnings = List.copyOf(warnings);
  }

  /// A document for a freshly generated graph: no comments, no warnings.
  public static GraphDocument of(Graph graph) {
    return new GraphDocument(graph, List.of(), List.of());
  }

  /// A document for a generated graph with header comments.
  public static GraphDocument of(Graph graph, List<String> comments) {
    return new GraphDocument(graph, comments, List.of());
  }

  /// @param more comment texts appended after the existing ones
  /// @return a copy with the extra comments
  public GraphDocument withComments(List<String> more) {
    List<String> all = new ArrayList<>(comments);
    all.addAll(more);
    return new GraphDocument(graph, all, warnings);
  }

  /// @param replacement the graph to carry
  /// @return a copy holding another graph, with the same comments and warnings
  public GraphDocument withGraph(Graph replacement) {
    return new GraphDocument(replacement, comments, warnings);
  }

  public boolean hasWarnings() {
    return !warnings.isEmpty();
  }
}
