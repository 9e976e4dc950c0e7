// Copyright 2010-2021 Google LLC
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//     http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.

package com.thesisalloc.io;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Minimal RFC 4180 reader and writer: comma separated, double-quoted fields may hold commas,
 * quotes (doubled) and line breaks. Header names are normalised on read.
 */
final class CsvTable {
  /** A data record keyed by normalised header, with the line it starts on. */
  static final class Row {
    private final Map<String, String> cells;
    private final int line;

    Row(Map<String, String> cells, int line) {
      this.cells = cells;
      this.line = line;
    }

    /** Trimmed cell value, empty if the column is missing. */
    String get(String column) {
      String value = cells.get(column);
      return value == null ? "" : value.trim();
    }

    int getLine() {
      return line;
    }
  }

  private final String name;
  private final List<String> header;
  private final List<Row> rows;

  private CsvTable(String name, List<String> header, List<Row> rows) {
    this.name = name;
    this.header = header;
    this.rows = rows;
  }

  static CsvTable read(Path path) throws IOException {
    try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      return read(path.getFileName().toString(), reader);
    }
  }

  static CsvTable read(String name, Reader reader) throws IOException {
    List<String> header = null;
    List<Row> rows = new ArrayList<>();
    int line = 1;
    List<String> record = new ArrayList<>();
    StringBuilder field = new StringBuilder();
    boolean quoted = false;
    boolean atFieldStart = true;
    int recordLine = 1;
    int c = reader.read();
    if (c == '\uFEFF') {
      c = reader.read();
    }
    while (c != -1) {
      char ch = (char) c;
      if (quoted) {
        if (ch == '"') {
          int peek = reader.read();
          if (peek == '"') {
            field.append('"');
          } else {
            quoted = false;
            c = peek;
            continue;
          }
        } else {
          if (ch == '\n') {
            line++;
          }
          field.append(ch);
        }
      } else if (ch == '"' && atFieldStart) {
        quoted = true;
        atFieldStart = false;
      } else if (ch == ',') {
        record.add(field.toString());
        field.setLength(0);
        atFieldStart = true;
      } else if (ch == '\n' || ch == '\r') {
        if (ch == '\r') {
          int peek = reader.read();
          if (peek != '\n') {
            c = peek;
            header = endRecord(name, record, field, header, rows, recordLine);
            line++;
            recordLine = line;
            atFieldStart = true;
            continue;
          }
        }
        header = endRecord(name, record, field, header, rows, recordLine);
        line++;
        recordLine = line;
        atFieldStart = true;
      } else {
        field.append(ch);
        atFieldStart = false;
      }
      c = reader.read();
    }
    if (quoted) {
      throw new DataFormatException(name, recordLine, "unterminated quoted field");
    }
    if (!record.isEmpty() || field.length() > 0) {
      header = endRecord(name, record, field, header, rows, recordLine);
    }
    if (header == null) {
      header = Collections.emptyList();
    }
    return new CsvTable(name, header, rows);
  }

  /** Finishes one record; returns the header, which is the first non-blank record. */
  private static List<String> endRecord(
      String name,
      List<String> record,
      StringBuilder field,
      List<String> header,
      List<Row> rows,
      int line) {
    record.add(field.toString());
    field.setLength(0);
    List<String> values = new ArrayList<>(record);
    record.clear();
    if (values.size() == 1 && values.get(0).trim().isEmpty()) {
      return header;
    }
    if (header == null) {
      List<String> normalised = new ArrayList<>(values.size());
      for (String value : values) {
        normalised.add(normalizeHeader(value));
      }
      return normalised;
    }
    if (values.size() > header.size()) {
      throw new DataFormatException(
          name, line, "expected at most " + header.size() + " fields, got " + values.size());
    }
    Map<String, String> cells = new LinkedHashMap<>();
    for (int i = 0; i < values.size(); ++i) {
      cells.put(header.get(i), values.get(i));
    }
    rows.add(new Row(cells, line));
    return header;
  }

  /** Lowercases and collapses every run of non-alphanumerics into one underscore. */
  static String normalizeHeader(String header) {
    String normalised =
        header.trim().toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]+", "_");
    int start = 0;
    int end = normalised.length();
    while (start < end && normalised.charAt(start) == '_') {
      start++;
    }
    while (end > start && normalised.charAt(end - 1) == '_') {
      end--;
    }
    return normalised.substring(start, end);
  }

  /** Splits a pipe-separated cell, dropping blank entries. */
  static List<String> splitPipe(String cell) {
    List<String> parts = new ArrayList<>();
    for (String part : cell.split("\\|")) {
      if (!part.trim().isEmpty()) {
        parts.add(part.trim());
      }
    }
    return parts;
  }

  String getName() {
    return name;
  }

  List<String> getHeader() {
    return header;
  }

  List<Row> getRows() {
    return rows;
  }

  static void writeRecord(Writer writer, Object... values) throws IOException {
    for (int i = 0; i < values.length; ++i) {
      if (i > 0) {
        writer.write(',');
      }
      writer.write(quote(String.valueOf(values[i])));
    }
    writer.write("\r\n");
  }

  private static String quote(String value) {
    if (value.indexOf(',') < 0
        && value.indexOf('"') < 0
        && value.indexOf('\n') < 0
        && value.indexOf('\r') < 0) {
      return value;
    }
    return '"' + value.replace("\"", "\"\"") + '"';
  }
}
