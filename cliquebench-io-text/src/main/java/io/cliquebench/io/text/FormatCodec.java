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

import io.cliquebench.api.graph.Graph;
import io.cliquebench.api.services.GraphFormat;

import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.io.Writer;

/// String-level entry points for the two edge list formats.
///
/// # Usage
///
/// ```java
/// Graph g = FormatCodec.parseSnap("0 1\n1 2\n# comment\n");
/// String dimacs = FormatCodec.toDimacs(g);   // "p edge 3 2\ne 1 2\ne 2 3\n"
///
/// GraphDocument doc = FormatCodec.read(reader, GraphFormat.snap);
/// FormatCodec.write(doc, writer, GraphFormat.dimacs);  // comments come out as "c ..." lines
/// ```
///
/// Index normalization happens on DIMACS output only; see [DimacsCodec].
public final class FormatCodec {

  private FormatCodec() {
  }

  public static Graph parseSnap(CharSequence text) {
    return readSnap(text).graph();
  }

  public static Graph parseDimacs(CharSequence text) {
    return readDimacs(text).graph();
  }

  public static GraphDocument readSnap(CharSequence text) {
    return read(text, GraphFormat.snap);
  }

  public static GraphDocument readDimacs(CharSequence text) {
    return read(text, GraphFormat.dimacs);
  }

  /// @return the document parsed from in-memory text
  public static GraphDocument read(CharSequence text, GraphFormat format) {
    try (StringReader reader = new StringReader(text.toString())) {
      return read(reader, format);
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }

  public static GraphDocument read(Reader reader, GraphFormat format) throws IOException {
    switch (format) {
      case snap:
        return SnapCodec.read(reader);
      case dimacs:
        return DimacsCodec.read(reader);
      default:
        throw new IllegalArgumentException("Unsupported format: " + format);
    }
  }

  public static void write(GraphDocument document, Writer writer, GraphFormat format)
      throws IOException {
    switch (format) {
      case snap:
        SnapCodec.write(document, writer);
        break;
      case dimacs:
        DimacsCodec.write(document, writer);
        break;
      default:
        throw new IllegalArgumentException("Unsupported format: " + format);
    }
  }

  public static String toSnap(Graph graph) {
    return toSnap(GraphDocument.of(graph));
  }

  public static String toDimacs(Graph graph) {
    return toDimacs(GraphDocument.of(graph));
  }

  public static String toSnap(GraphDocument document) {
    return format(document, GraphFormat.snap);
  }

  public static String toDimacs(GraphDocument document) {
    return format(document, GraphFormat.dimacs);
  }

  /// @return the document rendered in the given format
  public static String format(GraphDocument document, GraphFormat format) {
    StringWriter out = new StringWriter();
    try {
      write(document, out, format);
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
    return out.toString();
  }
}
