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

import com.google.common.collect.ImmutableList;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.StringReader;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for CsvTableReader and CsvTableWriter.
 */
@Tag("unit")
public class CsvTableRoundTripTest {

  @TempDir
  Path tempDir;

  @Test void testReadSemicolonSeparatedWithQuotedCells() throws IOException {
    String csv = "Make;Model;Year;Co2  Tailpipe For Fuel Type1\n"
        + "BMW;\"M3; Competition\";2015;350\n"
        + "Toyota;Camry;2015\n"
        + "\n";
    RawTable table = new CsvTableReader(';').read(new StringReader(csv), "epa");

    assertEquals(Arrays.asList("Make", "Model", "Year", "Co2  Tailpipe For Fuel Type1"),
        table.getColumns());
    assertEquals(2, table.size());
    assertEquals("M3; Competition", table.getRows().get(0).get("Model"));
    assertNull(table.getRows().get(1).get("Co2  Tailpipe For Fuel Type1"));
  }

  @Test void testByteOrderMarkIsRemovedFromHeader() throws IOException {
    String csv = "\uFEFFCar Make,Year\nFerrari,2020\n";
    RawTable table = new CsvTableReader().read(new StringReader(csv), "sports");
    assertTrue(table.hasColumn("Car Make"));
  }

  @Test void testEmptyInput() throws IOException {
    RawTable table = new CsvTableReader().read(new StringReader(""), "empty");
    assertEquals(0, table.size());
    assertTrue(table.getColumns().isEmpty());
  }

  @Test void testWriteFormatsNullsAndDoubles() throws IOException {
    TabularResult result = table(Arrays.asList("year", "price"),
        ImmutableList.of(
            Arrays.<Object>asList(2020, 120000.0),
            Arrays.<Object>asList(2021, null),
            Arrays.<Object>asList(2022, 15000000.0)));
    StringWriter out = new StringWriter();
    new CsvTableWriter().write(result, out);

    assertEquals("year,price\n2020,120000.0\n2021,\n2022,15000000\n", out.toString());
  }

  @Test void testWriteThenReadFile() throws IOException {
    TabularResult result = table(Arrays.asList("make", "model"),
        ImmutableList.of(Arrays.<Object>asList("Aston Martin", "DB11, V12")));
    Path file = tempDir.resolve("out/nested/sports.csv");
    new CsvTableWriter().write(result, file);

    assertTrue(Files.exists(file));
    RawTable read = new CsvTableReader().read(file);
    assertEquals("sports.csv", read.getName());
    assertEquals("DB11, V12", read.getRows().get(0).get("model"));
    assertTrue(new String(Files.readAllBytes(file), StandardCharsets.UTF_8)
        .contains("\"DB11, V12\""));
  }

  private static TabularResult table(List<String> columns, List<List<Object>> rows) {
    return new TabularResult() {
      @Override public List<String> getColumnNames() {
        return columns;
      }

      @Override public List<List<Object>> getRows() {
        return rows;
      }
    };
  }
}
