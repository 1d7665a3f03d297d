/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to you under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.vehicletrends.etl;

import com.opencsv.CSVWriter;
import com.opencsv.ICSVWriter;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Writer;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Writes a {@link TabularResult} as a comma-separated file with a header.
 *
 * <p>Null cells are written as empty fields. Parent directories are created
 * as needed.
 */
public class CsvTableWriter {

  private static final Logger LOGGER = LoggerFactory.getLogger(CsvTableWriter.class);

  /**
   * Writes a table to a file, replacing any existing file.
   */
  public void write(TabularResult table, Path path) throws IOException {
    Path parent = path.toAbsolutePath().getParent();
    if (parent != null) {
      Files.createDirectories(parent);
    }
    try (Writer writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
      write(table, writer);
    }
    LOGGER.info("Wrote {} rows to {}", table.getRowCount(), path);
  }

  /**
   * Writes a table to a writer. The caller owns and closes the writer.
   */
  public void write(TabularResult table, Writer target) throws IOException {
    ICSVWriter csvWriter = new CSVWriter(target, ICSVWriter.DEFAULT_SEPARATOR,
        ICSVWriter.DEFAULT_QUOTE_CHARACTER, ICSVWriter.DEFAULT_ESCAPE_CHARACTER,
        "\n");
    List<String> columns = table.getColumnNames();
    csvWriter.writeNext(columns.toArray(new String[0]), false);
    for (List<?> row : table.getRows()) {
      String[] cells = new String[columns.size()];
      for (int i = 0; i < cells.length; i++) {
        Object value = i < row.size() ? row.get(i) : null;
        cells[i] = format(value);
      }
      csvWriter.writeNext(cells, false);
    }
    csvWriter.flush();
    if (csvWriter.checkError()) {
      throw new IOException("Failed writing CSV rows");
    }
  }

  private static String format(Object value) {
    if (value == null) {
      return "";
    }
    if (value instanceof Double) {
      double d = (Double) value;
      if (Double.isNaN(d) || Double.isInfinite(d)) {
        return "";
      }
      // plain notation, e.g. 15000000 rather than 1.5E7
      return BigDecimal.valueOf(d).toPlainString();
    }
    return value.toString();
  }
}
