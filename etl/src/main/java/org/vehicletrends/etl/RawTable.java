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

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * An immutable, parsed but untyped table: an ordered header and its rows.
 *
 * <p>This is the boundary between file parsing and the pipeline. Readers
 * produce RawTables; record parsers consume them. A RawTable may lack columns
 * the pipeline treats as optional; {@link #requireColumns(String...)} is how
 * callers turn the absence of a mandatory column into a {@link SchemaException}.
 */
public final class RawTable {

  private final String name;
  private final ImmutableList<String> columns;
  private final ImmutableList<RawRow> rows;

  public RawTable(String name, List<String> columns, List<RawRow> rows) {
    this.name = name;
    this.columns = ImmutableList.copyOf(columns);
    this.rows = ImmutableList.copyOf(rows);
  }

  /**
   * Creates a table from in-memory rows. Column order follows first appearance.
   */
  public static RawTable of(String name, List<Map<String, String>> rows) {
    List<String> columns = new ArrayList<String>();
    List<RawRow> rawRows = new ArrayList<RawRow>();
    long line = 1;
    for (Map<String, String> row : rows) {
      for (String column : row.keySet()) {
        if (!columns.contains(column)) {
          columns.add(column);
        }
      }
      rawRows.add(new RawRow(++line, row));
    }
    return new RawTable(name, columns, rawRows);
  }

  public String getName() {
    return name;
  }

  public List<String> getColumns() {
    return columns;
  }

  public List<RawRow> getRows() {
    return rows;
  }

  public int size() {
    return rows.size();
  }

  public boolean hasColumn(String column) {
    return columns.contains(column);
  }

  /**
   * Fails if any of the given columns is absent from the header.
   *
   * @throws SchemaException listing every missing column
   */
  public void requireColumns(String... required) {
    List<String> missing = new ArrayList<String>();
    for (String column : required) {
      if (!hasColumn(column)) {
        missing.add(column);
      }
    }
    if (!missing.isEmpty()) {
      throw new SchemaException(name, missing);
    }
  }

  /**
   * Returns a copy of this table with header and row keys renamed.
   *
   * <p>When two source columns map to the same target, the one appearing
   * later in the header wins for a given row.
   */
  public RawTable renameColumns(Map<String, String> renames) {
    Map<String, Boolean> renamed = new LinkedHashMap<String, Boolean>();
    for (String column : columns) {
      renamed.put(renames.getOrDefault(column, column), Boolean.TRUE);
    }
    List<RawRow> renamedRows = new ArrayList<RawRow>(rows.size());
    for (RawRow row : rows) {
      renamedRows.add(row.rename(renames));
    }
    return new RawTable(name, new ArrayList<String>(renamed.keySet()), renamedRows);
  }

  @Override public String toString() {
    return "RawTable{name='" + name + "', columns=" + columns + ", rows=" + rows.size() + "}";
  }
}
