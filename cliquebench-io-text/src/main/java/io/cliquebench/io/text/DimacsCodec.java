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

import io.cliquebench.api.errors.GraphConfigurationException;
import io.cliquebench.api.errors.ParseWarning;
import io.cliquebench.api.graph.Edge;
import io.cliquebench.api.graph.EdgeSet;
import io.cliquebench.api.graph.Graph;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.util.ArrayList;
import java.util.List;

/**
 * Reader and writer for the DIMACS edge format used by clique benchmarks.
 *
 * <pre>{@code
 * c brock200_1
 * p edge 200 14834
 * e 1 2
 * e 1 3
 * }</pre>
 *
 * <p>Reading: {@code c} lines are comments, the first {@code p edge N M} (or {@code p col})
 * line declares the vertex count, and {@code e u v} lines add edges. Edge lines ahead of the
 * problem line, repeated problem lines, unparseable lines and ids below 1 are skipped with a
 * {@link ParseWarning}. Ids above the declared count are kept, since this codec's own writer
 * declares the number of distinct ids rather than the largest one, and a warning records how
 * many edges did so.
 *
 * <p>Writing always produces 1-based ids: if the smallest referenced id is 0, every id is
 * shifted up by one.
 */
public final class DimacsCodec {
  private static final Logger logger = LogManager.getLogger(DimacsCodec.class);

  private DimacsCodec() {
  }

  /**
   * Parses a DIMACS edge file.
   *
   * @param reader the source, read to the end but not closed
   * @return the graph, 1-based as read, with its comments and warnings
   * @throws IOException if the reader fails
   */
  public static GraphDocument read(Reader reader) throws IOException {
    BufferedReader lines = reader instanceof BufferedReader ? (BufferedReader) reader
        : new BufferedReader(reader);
    EdgeSet edges = new EdgeSet();
    List<String> comments = new ArrayList<>();
    List<ParseWarning> warnings = new ArrayList<>();

    int declaredVertices = -1;
    long declaredEdges = -1;
    long problemLine = 0;
    long beyondDeclared = 0;

    long lineNumber = 0;
    String raw;
    while ((raw = lines.readLine()) != null) {
      lineNumber++;
      String line = raw.strip();
      if (line.isEmpty()) {
        continue;
      }
      char kind = line.charAt(0);
      if (kind == 'c' && (line.length() == 1 || Character.isWhitespace(line.charAt(1)))) {
        comments.add(line.substring(1));
        continue;
      }
      String[] parts = SnapCodec.WHITESPACE.split(line);
      if (kind == 'p' && parts[0].equals("p")) {
        if (declaredVertices >= 0) {
          warnings.add(new ParseWarning(lineNumber, raw, "repeated problem line ignored"));
          continue;
        }
        if (parts.length < 4 || !(parts[1].equals("edge") || parts[1].equals("col"))) {
          warnings.add(new ParseWarning(lineNumber, raw, "expected 'p edge <vertices> <edges>'"));
          continue;
        }
        try {
          int n = Integer.parseInt(parts[2]);
          long m = Long.parseLong(parts[3]);
          if (n < 0 || m < 0) {
            warnings.add(new ParseWarning(lineNumber, raw, "negative count in problem line"));
            continue;
          }
          declaredVertices = n;
          declaredEdges = m;
          problemLine = lineNumber;
        } catch (NumberFormatException e) {
          warnings.add(new ParseWarning(lineNumber, raw, "non-integer count in problem line"));
        }
        continue;
      }
      if (kind == 'e' && parts[0].equals("e")) {
        if (declaredVertices < 0) {
          warnings.add(new ParseWarning(lineNumber, raw, "edge before problem line"));
          continue;
        }
        if (parts.length < 3) {
          warnings.add(new ParseWarning(lineNumber, raw, "expected 'e <u> <v>'"));
          continue;
        }
        int u;
        int v;
        try {
          u = Integer.parseInt(parts[1]);
          v = Integer.parseInt(parts[2]);
        } catch (NumberFormatException e) {
          warnings.add(new ParseWarning(lineNumber, raw, "non-integer vertex id"));
          continue;
        }
        if (u < 1 || v < 1) {
          warnings.add(new ParseWarning(lineNumber, raw, "vertex id below 1"));
          continue;
        }
        if (u == v) {
          warnings.add(new ParseWarning(lineNumber, raw, "self-loop"));
          continue;
        }
        if (u > declaredVertices || v > declaredVertices) {
          beyondDeclared++;
        }
        edges.add(u, v);
        continue;
      }
      warnings.add(new ParseWarning(lineNumber, raw, "unrecognized line"));
    }

    if (declaredVertices < 0) {
      warnings.add(new ParseWarning(0, "", "no problem line found"));
      declaredVertices = 0;
    } else if (declaredEdges != edges.size()) {
      warnings.add(new ParseWarning(problemLine, "p edge " + declaredVertices + " " + declaredEdges,
          "problem line declares " + declaredEdges + " edges, found " + edges.size()));
    }
    if (beyondDeclared > 0) {
      warnings.add(new ParseWarning(problemLine, "p edge " + declaredVertices + " " + declaredEdges,
          beyondDeclared + " edge(s) reference ids above the declared vertex count"));
    }

    if (!warnings.isEmpty()) {
      logger.warn("DIMACS input produced {} warning(s), first: {}", warnings.size(), warnings.get(0));
    }
    logger.debug("Read DIMACS graph: {} declared vertices, {} edges", declaredVertices, edges.size());
    return new GraphDocument(Graph.declared(declaredVertices, edges), comments, warnings);
  }

  /**
   * Writes {@code c<text>} comment lines, the {@code p edge} line, and one {@code e u v} line
   * per edge. The declared vertex count is the number of distinct ids the edges reference.
   *
   * @param document the graph and comments to write
   * @param writer the target, not closed
   * @throws IOException if the writer fails
   */
  public static void write(GraphDocument document, Writer writer) throws IOException {
    Graph graph = oneBased(document.graph());
    for (String comment : document.comments()) {
      writer.write('c');
      writer.write(comment);
      writer.write('\n');
    }
    writer.write("p edge " + graph.referencedVertices().size() + " " + graph.edgeCount() + "\n");
    for (Edge edge : graph.edges()) {
      writer.write("e ");
      writer.write(Integer.toString(edge.u()));
      writer.write(' ');
      writer.write(Integer.toString(edge.v()));
      writer.write('\n');
    }
    writer.flush();
  }

  /**
   * @param graph any graph
   * @return the graph shifted up by one if its smallest referenced id is 0, otherwise itself
   * @throws GraphConfigurationException if a shift is needed and an id is already
   *     {@link Integer#MAX_VALUE}
   */
  public static Graph oneBased(Graph graph) {
    if (graph.minVertex().orElse(1) != 0) {
      return graph;
    }
    if (graph.maxVertex().getAsInt() == Integer.MAX_VALUE) {
      throw new GraphConfigurationException(
          "vertex id " + Integer.MAX_VALUE + " cannot be shifted to a 1-based DIMACS id");
    }
    return graph.shifted(1);
  }
}
