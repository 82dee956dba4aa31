package io.cliquebench.io.cnf;

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
import io.cliquebench.api.sat.CNFFormula;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Reader and writer for DIMACS CNF files, the usual interchange format for SAT instances.
 *
 * <pre>{@code
 * c simple 3-SAT
 * p cnf 4 2
 * 1 2 3 0
 * -1 -2 4 0
 * }</pre>
 *
 * <p>Clauses end with {@code 0} and may span lines. A {@code %} line ends the input, as in the
 * SATLIB benchmark files. Unparseable tokens and a clause left open at the end of input are
 * reported as {@link ParseWarning}s; count mismatches with the problem line are warnings too.
 * An input without any clause is a {@link GraphConfigurationException}, as for any empty
 * formula.
 */
public final class CnfCodec {
  private static final Logger logger = LogManager.getLogger(CnfCodec.class);
  private static final Pattern WHITESPACE = Pattern.compile("\\s+");

  private CnfCodec() {
  }

  /**
   * A parsed CNF file.
   *
   * @param formula the clauses
   * @param comments comment texts without the leading {@code c} and surrounding blanks
   * @param warnings skipped tokens and count mismatches
   */
  public record CnfDocument(CNFFormula formula, List<String> comments, List<ParseWarning> warnings) {
    public CnfDocument {
      comments = List.copyOf(comments);
      warnings = List.copyOf(warnings);
    }
  }

  public static CnfDocument read(Path path) throws IOException {
    try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      return read(reader);
    }
  }

  public static CnfDocument read(Reader reader) throws IOException {
    BufferedReader lines = reader instanceof BufferedReader ? (BufferedReader) reader
        : new BufferedReader(reader);
    List<List<Integer>> clauses = new ArrayList<>();
    List<String> comments = new ArrayList<>();
    List<ParseWarning> warnings = new ArrayList<>();
    List<Integer> open = new ArrayList<>();
    long declaredVariables = -1;
    long declaredClauses = -1;

    long lineNumber = 0;
    String raw;
    while ((raw = lines.readLine()) != null) {
      lineNumber++;
      String line = raw.strip();
      if (line.isEmpty()) {
        continue;
      }
      if (line.startsWith("%")) {
        break;
      }
      if (line.charAt(0) == 'c' && (line.length() == 1 || Character.isWhitespace(line.charAt(1)))) {
        comments.add(line.substring(1).strip());
        continue;
      }
      String[] parts = WHITESPACE.split(line);
      if (parts[0].equals("p")) {
        if (parts.length < 4 || !parts[1].equals("cnf")) {
          warnings.add(new ParseWarning(lineNumber, raw, "expected 'p cnf <variables> <clauses>'"));
          continue;
        }
        try {
          declaredVariables = Long.parseLong(parts[2]);
          declaredClauses = Long.parseLong(parts[3]);
        } catch (NumberFormatException e) {
          warnings.add(new ParseWarning(lineNumber, raw, "non-integer count in problem line"));
        }
        continue;
      }
      for (String token : parts) {
        int literal;
        try {
          literal = Integer.parseInt(token);
        } catch (NumberFormatException e) {
          warnings.add(new ParseWarning(lineNumber, raw, "non-integer literal '" + token + "'"));
          continue;
        }
        if (literal == 0) {
          if (open.isEmpty()) {
            warnings.add(new ParseWarning(lineNumber, raw, "empty clause skipped"));
          } else {
            clauses.add(open);
            open = new ArrayList<>();
          }
        } else {
          open.add(literal);
        }
      }
    }
    if (!open.isEmpty()) {
      warnings.add(new ParseWarning(lineNumber, "", "last clause not terminated by 0"));
      clauses.add(open);
    }
    if (clauses.isEmpty()) {
      throw new GraphConfigurationException("CNF input contains no clauses");
    }

    CNFFormula formula = CNFFormula.of(clauses);
    if (declaredClauses >= 0 && declaredClauses != formula.clauseCount()) {
      warnings.add(new ParseWarning(0, "", "problem line declares " + declaredClauses
          + " clauses, found " + formula.clauseCount()));
    }
    if (declaredVariables >= 0 && formula.numVariables() > declaredVariables) {
      warnings.add(new ParseWarning(0, "", "problem line declares " + declaredVariables
          + " variables, literals reach " + formula.numVariables()));
    }
    if (!warnings.isEmpty()) {
      logger.warn("CNF input produced {} warning(s), first: {}", warnings.size(), warnings.get(0));
    }
    return new CnfDocument(formula, comments, warnings);
  }

  public static void write(Path path, CNFFormula formula, List<String> comments) throws IOException {
    Path parent = path.toAbsolutePath().getParent();
    if (parent != null) {
      Files.createDirectories(parent);
    }
    try (BufferedWriter writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
      write(formula, comments, writer);
    }
  }

  /**
   * Writes comments as {@code c <text>} lines, the {@code p cnf} line, and one zero-terminated
   * clause per line.
   */
  public static void write(CNFFormula formula, List<String> comments, Writer writer)
      throws IOException {
    for (String comment : comments) {
      writer.write("c " + comment + "\n");
    }
    writer.write("p cnf " + formula.numVariables() + " " + formula.clauseCount() + "\n");
    StringBuilder sb = new StringBuilder();
    for (List<Integer> clause : formula.clauses()) {
      sb.setLength(0);
      for (int literal : clause) {
        sb.append(literal).append(' ');
      }
      sb.append("0\n");
      writer.write(sb.toString());
    }
    writer.flush();
  }
}
