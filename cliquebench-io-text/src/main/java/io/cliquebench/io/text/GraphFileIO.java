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

import io.cliquebench.api.services.GraphFormat;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/// File level reading and writing of graph documents. All files are UTF-8.
public final class GraphFileIO {
  private static final Logger logger = LogManager.getLogger(GraphFileIO.class);

  private GraphFileIO() {
  }

  /// Detects the format of a file: DIMACS if any line is a `p edge` problem line.
  /// @param path the file to inspect
  /// @return the detected format
  /// @throws IOException if the file cannot be read or is not valid UTF-8
  public static GraphFormat detect(Path path) throws IOException {
    try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      String line;
      while ((line = reader.readLine()) != null) {
        if (GraphFormat.isDimacsProblemLine(line)) {
          return GraphFormat.dimacs;
        }
      }
      return GraphFormat.snap;
    }
  }

  /// Reads a file, detecting its format from its content.
  public static GraphDocument read(Path path) throws IOException {
    return read(path, detect(path));
  }

  public static GraphDocument read(Path path, GraphFormat format) throws IOException {
    try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      GraphDocument document = FormatCodec.read(reader, format);
      logger.debug("Read {} as {}: {}", path, format, document.graph());
      return document;
    }
  }

  /// Writes a document, creating parent directories as needed and replacing an existing file.
  public static void write(Path path, GraphDocument document, GraphFormat format)
      throws IOException {
    Path parent = path.toAbsolutePath().getParent();
    if (parent != null) {
      Files.createDirectories(parent);
    }
    try (BufferedWriter writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
      FormatCodec.write(document, writer, format);
    }
    logger.debug("Wrote {} as {}: {}", path, format, document.graph());
  }

  /// Writes to a temporary sibling first and then moves it over the target, so a failed write
  /// never leaves a half-converted file behind. Used for in-place conversion.
  public static void replace(Path path, GraphDocument document, GraphFormat format)
      throws IOException {
    Path target = path.toAbsolutePath();
    Path temp = target.resolveSibling(target.getFileName() + ".tmp");
    try {
      write(temp, document, format);
      try {
        Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
      } catch (AtomicMoveNotSupportedException e) {
        Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
      }
    } finally {
      Files.deleteIfExists(temp);
    }
  }
}
