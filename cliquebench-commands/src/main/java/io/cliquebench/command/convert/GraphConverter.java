package io.cliquebench.command.convert;

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

import io.cliquebench.api.graph.Graph;
import io.cliquebench.api.services.GraphFormat;
import io.cliquebench.io.text.GraphDocument;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Prepares a parsed document for writing in another format.
 *
 * <p>Comments of the input are kept. An input without comments gets a
 * {@code Converted from <FORMAT> format} line, and a converted document always ends its header
 * with {@code Vertices: N, Edges: M}, where {@code N} counts the distinct ids the edges reference.
 */
public final class GraphConverter {

  private GraphConverter() {
  }

  /**
   * @param document the parsed input
   * @param from the input format
   * @param to the output format
   * @param zeroBased for SNAP output, shift a 1-based graph down so ids start at 0
   * @return the document to write
   */
  public static GraphDocument convert(GraphDocument document, GraphFormat from, GraphFormat to,
                                      boolean zeroBased) {
    Graph graph = document.graph();
    if (to == GraphFormat.snap && zeroBased && graph.minVertex().orElse(0) > 0) {
      graph = graph.shifted(-graph.minVertex().getAsInt());
    }
    List<String> comments = new ArrayList<>(document.comments());
    if (comments.isEmpty()) {
      comments.add(" Converted from " + from.name().toUpperCase(Locale.ROOT) + " format");
    }
    comments.add(" Vertices: " + graph.referencedVertices().size() + ", Edges: "
        + graph.edgeCount());
    return new GraphDocument(graph, comments, document.warnings());
  }
}
