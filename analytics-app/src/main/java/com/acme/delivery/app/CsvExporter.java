/*
 * Copyright (C) 2026 ACME Delivery Services
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.acme.delivery.app;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes report rows as RFC 4180 CSV. The header comes from the keys of the first row.
 */
public final class CsvExporter {

  private static final Logger LOG = LoggerFactory.getLogger(CsvExporter.class);
  private static final String LINE_END = "\r\n";

  /**
   * Writes {@code rows} to {@code file}, replacing its content.
   *
   * @return the number of data rows written; zero when {@code rows} is empty, in which case
   *   no file is touched
   */
  public int export(List<Map<String, Object>> rows, Path file) throws IOException {
    Objects.requireNonNull(file, "file");
    if (rows == null || rows.isEmpty()) {
      LOG.warn("No data to export");
      return 0;
    }
    List<String> header = new ArrayList<>(rows.get(0).keySet());
    try (Writer out = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
      writeLine(out, header);
      for (Map<String, Object> row : rows) {
        List<String> values = new ArrayList<>(header.size());
        for (String column : header) {
          Object value = row.get(column);
          values.add(value == null ? "" : value.toString());
        }
        writeLine(out, values);
      }
    } catch (IOException e) {
      LOG.error("Error exporting to CSV: {}", e.getMessage());
      throw e;
    }
    LOG.info("Successfully exported {} records to {}", rows.size(), file);
    return rows.size();
  }

  private static void writeLine(Writer out, List<String> values) throws IOException {
    for (int i = 0; i < values.size(); i++) {
      if (i > 0) {
        out.write(',');
      }
      out.write(escape(values.get(i)));
    }
    out.write(LINE_END);
  }

  static String escape(String value) {
    boolean quote = value.indexOf(',') >= 0
      || value.indexOf('"') >= 0
      || value.indexOf('\n') >= 0
      || value.indexOf('\r') >= 0;
    if (!quote) {
      return value;
    }
    return '"' + value.replace("\"", "\"\"") + '"';
  }
}
