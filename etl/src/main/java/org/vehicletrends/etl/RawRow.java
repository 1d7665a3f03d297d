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

import com.google.common.collect.ImmutableMap;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.Map;

/**
 * One parsed row of a {@link RawTable}: column name to raw text.
 *
 * <p>Cells that are empty in the source are absent from the map, so
 * {@link #get(String)} returns null for both blank cells and columns the
 * table does not have. Use {@link RawTable#hasColumn(String)} to tell the two
 * apart.
 */
public final class RawRow {

  private final long lineNumber;
  private final ImmutableMap<String, String> values;

  public RawRow(long lineNumber, Map<String, String> values) {
    this.lineNumber = lineNumber;
    ImmutableMap.Builder<String, String> builder = ImmutableMap.builder();
    for (Map.Entry<String, String> entry : values.entrySet()) {
      String value = entry.getValue();
      if (value != null && !value.trim().isEmpty()) {
        builder.put(entry.getKey(), value.trim());
      }
    }
    this.values = builder.build();
  }

  /**
   * Returns the 1-based source line number, or 0 for rows built in memory.
   */
  public long getLineNumber() {
    return lineNumber;
  }

  /**
   * Returns the trimmed value of a column, or null if blank or absent.
   */
  public @Nullable String get(String column) {
    return values.get(column);
  }

  public boolean isBlank(String column) {
    return !values.containsKey(column);
  }

  /**
   * Returns a copy of this row with columns renamed.
   * Columns without an entry in {@code renames} keep their name.
   */
  public RawRow rename(Map<String, String> renames) {
    ImmutableMap.Builder<String, String> builder = ImmutableMap.builder();
    for (Map.Entry<String, String> entry : values.entrySet()) {
      builder.put(renames.getOrDefault(entry.getKey(), entry.getKey()), entry.getValue());
    }
    return new RawRow(lineNumber, builder.buildKeepingLast());
  }

  @Override public String toString() {
    return "RawRow{line=" + lineNumber + ", " + values + "}";
  }
}
