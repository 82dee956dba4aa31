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
import java.util.regex.Pattern;

/**
 * Reader and writer for the SNAP edge list format.
 *
 * <pre>{@code
 * # Directed graph (each unordered pair of nodes is saved once)
 * # FromNodeId	ToNodeId
 * 0	1
 * 0	2
 * }</pre>
 *
 * <p>Blank lines are skipped and {@code #} lines are comments. Any other line must start with
 * two integer ids; further columns are ignored. Lines that do not parse, that name a negative
 * id or {@link Integer#MAX_VALUE} (which has no 1-based DIMACS equivalent), or that describe a
 * self-loop are skipped and reported as {@link ParseWarning}s. Comment text is everything after
 * the {@code #}, trailing blanks included. Reversed
 * and repeated pairs collapse into one canonical edge.
 *
 * <p>Ids are kept exactly as read, so a 0-based file stays 0-based in memory.
 */
public final class SnapCodec {
  private static final Logger logger = LogManager.getLogger(SnapCodec.class);

  static final Pattern WHITESPACE = Pattern.compile("\\s+");

  private SnapCodec() {
  }

  /**
   * Parses a SNAP edge list.
   *
   * @param reader the source, read to the end but not closed
   * @return the graph with its comments and warnings
   * @throws IOException if the reader fails
   */
  public static GraphDocument read(Reader reader) throws IOException {
    BufferedReader lines = reader instanceof BufferedReader ? (BufferedReader) reader
        : new BufferedReader(reader);
    EdgeSet edges = new EdgeSet();
    List<String> comments = new ArrayList<>();
    List<ParseWarning> warnings = new ArrayList<>();

    long lineNumber = 0;
    String raw;
    while ((raw = lines.readLine()) != null) {
      lineNumber++;
      String line = raw.strip();
      if (line.isEmpty()) {
        continue;
      }
      if (line.startsWith("#")) {
        comments.add(raw.substring(raw.indexOf('#') + 1));
        continue;
      }
      String[] parts = WHITESPACE.split(line);
      if (parts.length < 2) {
        warnings.add(new ParseWarning(lineNumber, raw, "expected two vertex ids"));
        continue;
      }
      int u;
      int v;
      try {
        u = Integer.parseInt(parts[0]);
        v = Integer.parseInt(parts[1]);
      } catch (NumberFormatException e) {
        warnings.add(new ParseWarning(lineNumber, raw, "non-integer vertex id"));
        continue;
      }
      if (u < 0 || v < 0) {
        warnings.add(new ParseWarning(lineNumber, raw, "negative vertex id"));
        continue;
      }
      if (u == Integer.MAX_VALUE || v == Integer.MAX_VALUE) {
        warnings.add(new ParseWarning(lineNumber, raw, "vertex id has no 1-based equivalent"));
        continue;
      }
      if (u == v) {
        warnings.add(new ParseWarning(lineNumber, raw, "self-loop"));
        continue;
      }
      edges.add(u, v);
    }

    if (!warnings.isEmpty()) {
      logger.warn("Skipped {} malformed SNAP line(s), first at {}", warnings.size(), warnings.get(0));
    }
    logger.debug("Read SNAP edge list: {} edges, {} comments", edges.size(), comments.size());
    return new GraphDocument(Graph.referencing(edges), comments, warnings);
  }

  /**
   * Writes comments as {@code #<text>} lines followed by one {@code u v} line per edge, in the
   * graph's edge order and in its own index base.
   *
   * @param document the graph and comments to write
   * @param writer the target, not closed
   * @throws IOException if the writer fails
   */
  public static void write(GraphDocument document, Writer writer) throws IOException {
    for (String comment : document.comments()) {
      writer.write('#');
      writer.write(comment);
      writer.write('\n');
    }
    for (Edge edge : document.graph().edges()) {
      writer.write(Integer.toString(edge.u()));
      writer.write(' ');
      writer.write(Integer.toString(edge.v()));
      writer.write('\n');
    }
    writer.flush();
  }
}
