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

import com.opencsv.CSVParserBuilder;
import com.opencsv.CSVReader;
import com.opencsv.CSVReaderBuilder;
import com.opencsv.exceptions.CsvValidationException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads a delimited text file into a {@link RawTable}.
 *
 * <p>The first record is the header. Header names are trimmed, a leading
 * byte-order mark is removed, and inner whitespace is kept as is (the EPA
 * file has a {@code "Co2  Tailpipe For Fuel Type1"} column with two spaces).
 * Short rows are padded with blanks; extra cells are ignored.
 *
 * <h3>Usage Example</h3>
 * <pre>{@code
 * RawTable epa = new CsvTableReader(';').read(Paths.get("all-vehicles-model.csv"));
 * }</pre>
 */
public class CsvTableReader {

  private static final Logger LOGGER = LoggerFactory.getLogger(CsvTableReader.class);

  private final char separator;

  /**
   * Creates a reader for comma-separated files.
   */
  public CsvTableReader() {
    this(',');
  }

  /**
   * Creates a reader with the given field separator.
   */
  public CsvTableReader(char separator) {
    this.separator = separator;
  }

  /**
   * Reads a file. The table is named after the file.
   */
  public RawTable read(Path path) throws IOException {
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      return read(reader, path.getFileName().toString());
    }
  }

  /**
   * Reads from a reader. The caller owns and closes the reader.
   */
  public RawTable read(Reader source, String tableName) throws IOException {
    CSVReader csvReader = new CSVReaderBuilder(source)
        .withCSVParser(new CSVParserBuilder().withSeparator(separator).build())
        .build();
    try {
      String[] header = csvReader.readNext();
      if (header == null) {
        LOGGER.warn("Table '{}' is empty", tableName);
        return new RawTable(tableName, new ArrayList<String>(), new ArrayList<RawRow>());
      }
      List<String> columns = new ArrayList<String>(header.length);
      for (int i = 0; i < header.length; i++) {
        String name = header[i] == null ? "" : header[i].trim();
        if (i == 0 && name.startsWith("\uFEFF")) {
          name = name.substring(1);
        }
        columns.add(name);
      }

      List<RawRow> rows = new ArrayList<RawRow>();
      String[] cells;
      while ((cells = csvReader.readNext()) != null) {
        if (cells.length == 1 && cells[0].trim().isEmpty()) {
          continue;
        }
        Map<String, String> values = new LinkedHashMap<String, String>();
        for (int i = 0; i < columns.size() && i < cells.length; i++) {
          values.put(columns.get(i), cells[i]);
        }
        rows.add(new RawRow(csvReader.getLinesRead(), values));
      }
      LOGGER.info("Read {} rows with {} columns from '{}'", rows.size(), columns.size(),
          tableName);
      return new RawTable(tableName, columns, rows);
    } catch (CsvValidationException e) {
      throw new IOException("Malformed CSV in '" + tableName + "' near line "
          + csvReader.getLinesRead() + ": " + e.getMessage(), e);
    }
  }
}
