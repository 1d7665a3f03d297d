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

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Named, typed columns over a record class.
 *
 * <p>Records are strongly typed, but aggregation requests and output files
 * address fields by column name. A RecordSchema is the bridge: it maps each
 * column name to an accessor and a kind, and turns requests for unknown
 * columns into a {@link SchemaException}.
 *
 * <h3>Usage Example</h3>
 * <pre>{@code
 * RecordSchema<SportsRecord> schema = RecordSchema.<SportsRecord>builder("sports")
 *     .text("make", SportsRecord::getMake)
 *     .integer("year", SportsRecord::getYear)
 *     .numeric("price", SportsRecord::getPrice)
 *     .build();
 * }</pre>
 *
 * @param <T> Record type
 */
public final class RecordSchema<T> {

  /**
   * Kind of value a column holds.
   */
  public enum Kind {
    /** Free or categorical text. */
    TEXT,
    /** Whole number, e.g. the model year. */
    INTEGER,
    /** Floating-point measurement; null when absent. */
    NUMERIC
  }

  private final String name;
  private final Map<String, Kind> kinds;
  private final Map<String, Function<T, ?>> accessors;

  private RecordSchema(Builder<T> builder) {
    this.name = builder.name;
    this.kinds = new LinkedHashMap<String, Kind>(builder.kinds);
    this.accessors = new LinkedHashMap<String, Function<T, ?>>(builder.accessors);
  }

  public String getName() {
    return name;
  }

  /**
   * Returns all column names in declaration order.
   */
  public List<String> getColumnNames() {
    return ImmutableList.copyOf(kinds.keySet());
  }

  public boolean hasColumn(String column) {
    return kinds.containsKey(column);
  }

  public @Nullable Kind getKind(String column) {
    return kinds.get(column);
  }

  /**
   * Fails unless every column exists and is of the given kind.
   *
   * @throws SchemaException listing every column that is missing or of
   *     another kind
   */
  public void requireColumns(Collection<String> columns, Kind kind) {
    List<String> missing = new ArrayList<String>();
    for (String column : columns) {
      if (kinds.get(column) != kind) {
        missing.add(column);
      }
    }
    if (!missing.isEmpty()) {
      throw new SchemaException(name, missing);
    }
  }

  /**
   * Returns the accessor of a numeric column.
   *
   * @throws SchemaException if there is no such numeric column
   */
  @SuppressWarnings("unchecked")
  public Function<T, @Nullable Double> numeric(String column) {
    requireColumns(Arrays.asList(column), Kind.NUMERIC);
    return (Function<T, @Nullable Double>) accessors.get(column);
  }

  /**
   * Returns the accessor of a text column.
   *
   * @throws SchemaException if there is no such text column
   */
  @SuppressWarnings("unchecked")
  public Function<T, @Nullable String> text(String column) {
    requireColumns(Arrays.asList(column), Kind.TEXT);
    return (Function<T, @Nullable String>) accessors.get(column);
  }

  /**
   * Returns the accessor of an integer column.
   *
   * @throws SchemaException if there is no such integer column
   */
  @SuppressWarnings("unchecked")
  public Function<T, Integer> integer(String column) {
    requireColumns(Arrays.asList(column), Kind.INTEGER);
    return (Function<T, Integer>) accessors.get(column);
  }

  /**
   * Returns the value of any column of a record.
   */
  public @Nullable Object get(T record, String column) {
    Function<T, ?> accessor = accessors.get(column);
    if (accessor == null) {
      throw new SchemaException(name, Arrays.asList(column));
    }
    return accessor.apply(record);
  }

  /**
   * Lays records out as a rectangular table with one column per schema column.
   */
  public TabularResult toTable(List<? extends T> records) {
    List<List<@Nullable Object>> rows = new ArrayList<List<@Nullable Object>>(records.size());
    for (T record : records) {
      List<@Nullable Object> row = new ArrayList<@Nullable Object>(accessors.size());
      for (Function<T, ?> accessor : accessors.values()) {
        row.add(accessor.apply(record));
      }
      rows.add(row);
    }
    return new RowTable(getColumnNames(), rows);
  }

  @Override public String toString() {
    return "RecordSchema{" + name + ", " + kinds + "}";
  }

  public static <T> Builder<T> builder(String name) {
    return new Builder<T>(name);
  }

  /**
   * Builder for RecordSchema.
   *
   * @param <T> Record type
   */
  public static class Builder<T> {
    private final String name;
    private final Map<String, Kind> kinds = new LinkedHashMap<String, Kind>();
    private final Map<String, Function<T, ?>> accessors =
        new LinkedHashMap<String, Function<T, ?>>();

    private Builder(String name) {
      this.name = name;
    }

    public Builder<T> text(String column, Function<T, @Nullable String> accessor) {
      return add(column, Kind.TEXT, accessor);
    }

    public Builder<T> integer(String column, Function<T, Integer> accessor) {
      return add(column, Kind.INTEGER, accessor);
    }

    public Builder<T> numeric(String column, Function<T, @Nullable Double> accessor) {
      return add(column, Kind.NUMERIC, accessor);
    }

    private Builder<T> add(String column, Kind kind, Function<T, ?> accessor) {
      if (kinds.containsKey(column)) {
        throw new IllegalArgumentException("Duplicate column: " + column);
      }
      kinds.put(column, kind);
      accessors.put(column, accessor);
      return this;
    }

    public RecordSchema<T> build() {
      if (kinds.isEmpty()) {
        throw new IllegalArgumentException("Schema '" + name + "' has no columns");
      }
      return new RecordSchema<T>(this);
    }
  }
}
