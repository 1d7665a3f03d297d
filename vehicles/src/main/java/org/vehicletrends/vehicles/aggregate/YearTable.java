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
package org.vehicletrends.vehicles.aggregate;

import org.vehicletrends.etl.TabularResult;

import com.google.common.collect.ImmutableList;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Table keyed by strictly ascending model year with one nullable numeric
 * column per series.
 *
 * <p>As a {@link TabularResult} the first column is {@code year}, followed
 * by the series columns in their given order.
 */
public abstract class YearTable implements TabularResult {

  /** Name of the leading year column. */
  public static final String YEAR_COLUMN = "year";

  private final ImmutableList<Integer> years;
  private final Map<String, List<@Nullable Double>> series;

  /**
   * Creates a table.
   *
   * @param years Strictly ascending years
   * @param series Values per column name, each aligned with {@code years}
   * @throws IllegalArgumentException if years are not strictly ascending or a
   *     series has the wrong length
   */
  protected YearTable(List<Integer> years, Map<String, ? extends List<@Nullable Double>> series) {
    this.years = ImmutableList.copyOf(years);
    for (int i = 1; i < this.years.size(); i++) {
      if (this.years.get(i) <= this.years.get(i - 1)) {
        throw new IllegalArgumentException("Years must be strictly ascending: " + years);
      }
    }
    Map<String, List<@Nullable Double>> copy = new LinkedHashMap<String, List<@Nullable Double>>();
    for (Map.Entry<String, ? extends List<@Nullable Double>> entry : series.entrySet()) {
      if (entry.getValue().size() != this.years.size()) {
        throw new IllegalArgumentException("Column '" + entry.getKey() + "' has "
            + entry.getValue().size() + " values for " + this.years.size() + " years");
      }
      copy.put(entry.getKey(),
          Collections.unmodifiableList(new ArrayList<@Nullable Double>(entry.getValue())));
    }
    this.series = Collections.unmodifiableMap(copy);
  }

  public List<Integer> getYears() {
    return years;
  }

  /**
   * Returns the series column names, without the year column.
   */
  public List<String> getSeriesNames() {
    return ImmutableList.copyOf(series.keySet());
  }

  public boolean hasSeries(String name) {
    return series.containsKey(name);
  }

  /**
   * Returns one column's values, aligned with {@link #getYears()}.
   *
   * @throws IllegalArgumentException if there is no such column
   */
  public List<@Nullable Double> getSeries(String name) {
    if (!hasSeries(name)) {
      throw new IllegalArgumentException("No column '" + name + "'; columns are "
          + series.keySet());
    }
    return series.get(name);
  }

  /**
   * Returns the value at a year, or null if the year has no row or the cell
   * is null.
   */
  public @Nullable Double getValue(int year, String name) {
    int index = Collections.binarySearch(years, year);
    return index < 0 ? null : getSeries(name).get(index);
  }

  @Override public List<String> getColumnNames() {
    return ImmutableList.<String>builder().add(YEAR_COLUMN).addAll(series.keySet()).build();
  }

  @Override public List<List<@Nullable Object>> getRows() {
    List<List<@Nullable Object>> rows = new ArrayList<List<@Nullable Object>>(years.size());
    for (int i = 0; i < years.size(); i++) {
      List<@Nullable Object> row = new ArrayList<@Nullable Object>(series.size() + 1);
      row.add(years.get(i));
      for (List<@Nullable Double> values : series.values()) {
        row.add(cell(values.get(i)));
      }
      rows.add(Collections.unmodifiableList(row));
    }
    return Collections.unmodifiableList(rows);
  }

  /**
   * Converts a stored value into the cell exposed by {@link #getRows()}.
   */
  protected @Nullable Object cell(@Nullable Double value) {
    return value;
  }

  @Override public String toString() {
    StringBuilder sb = new StringBuilder(getClass().getSimpleName()).append("{");
    sb.append(getColumnNames());
    for (List<@Nullable Object> row : getRows()) {
      sb.append(", ").append(row);
    }
    return sb.append("}").toString();
  }
}
