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

import org.vehicletrends.etl.RecordSchema;
import org.vehicletrends.etl.SchemaException;
import org.vehicletrends.vehicles.VehicleColumns;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.Function;

/**
 * Computes per-year means of numeric columns over a record collection.
 *
 * <h3>Usage Example</h3>
 * <pre>{@code
 * YearlyAggregate trend = new YearlyAggregator().aggregate(
 *     records, VehicleColumns.MAINSTREAM, 2000, 2020,
 *     Arrays.asList("combined_efficiency", "tailpipe_emissions"),
 *     CategoryFilter.of("fuel_type", "Regular", "Premium"));
 * }</pre>
 */
public class YearlyAggregator {

  private static final Logger LOGGER = LoggerFactory.getLogger(YearlyAggregator.class);

  /**
   * Aggregates records per model year.
   *
   * @param records Records to aggregate
   * @param schema Schema naming the record columns
   * @param yearMin Lowest year, inclusive
   * @param yearMax Highest year, inclusive
   * @param metrics Numeric columns to average
   * @param filter Optional category restriction
   * @param <T> Record type
   * @return one row per year with at least one matching record, ascending
   * @throws SchemaException naming every unknown metric or filter column
   * @throws IllegalArgumentException if {@code yearMin > yearMax}
   */
  public <T> YearlyAggregate aggregate(List<? extends T> records, RecordSchema<T> schema,
      int yearMin, int yearMax, List<String> metrics, @Nullable CategoryFilter filter) {
    if (yearMin > yearMax) {
      throw new IllegalArgumentException("yearMin " + yearMin + " is after yearMax " + yearMax);
    }
    checkColumns(schema, metrics, filter);

    Function<T, Integer> yearOf = schema.integer(VehicleColumns.YEAR);
    Function<T, @Nullable String> categoryOf =
        filter == null || filter.isEmpty() ? null : schema.text(filter.getColumn());
    List<Function<T, @Nullable Double>> accessors = new ArrayList<Function<T, @Nullable Double>>();
    for (String metric : metrics) {
      accessors.add(schema.numeric(metric));
    }

    // year -> per-metric [sum, count]
    TreeMap<Integer, double[][]> sums = new TreeMap<Integer, double[][]>();
    for (T record : records) {
      int year = yearOf.apply(record);
      if (year < yearMin || year > yearMax) {
        continue;
      }
      if (categoryOf != null && !filter.accepts(categoryOf.apply(record))) {
        continue;
      }
      double[][] acc = sums.get(year);
      if (acc == null) {
        acc = new double[metrics.size()][2];
        sums.put(year, acc);
      }
      for (int m = 0; m < accessors.size(); m++) {
        Double value = accessors.get(m).apply(record);
        if (value != null && !value.isNaN()) {
          acc[m][0] += value;
          acc[m][1]++;
        }
      }
    }

    List<Integer> years = new ArrayList<Integer>(sums.keySet());
    Map<String, List<@Nullable Double>> means = new LinkedHashMap<String, List<@Nullable Double>>();
    for (int m = 0; m < metrics.size(); m++) {
      List<@Nullable Double> column = new ArrayList<@Nullable Double>(years.size());
      for (double[][] acc : sums.values()) {
        column.add(acc[m][1] == 0 ? null : acc[m][0] / acc[m][1]);
      }
      means.put(metrics.get(m), column);
    }
    if (years.isEmpty()) {
      LOGGER.info("No {} records in {}..{}{}", schema.getName(), yearMin, yearMax,
          filter == null || filter.isEmpty() ? "" : " where " + filter);
    } else {
      LOGGER.debug("Aggregated {} {} over {} years", metrics, schema.getName(), years.size());
    }
    return new YearlyAggregate(years, means);
  }

  private static void checkColumns(RecordSchema<?> schema, List<String> metrics,
      @Nullable CategoryFilter filter) {
    List<String> missing = new ArrayList<String>();
    for (String metric : metrics) {
      if (schema.getKind(metric) != RecordSchema.Kind.NUMERIC) {
        missing.add(metric);
      }
    }
    if (filter != null && !filter.isEmpty()
        && schema.getKind(filter.getColumn()) != RecordSchema.Kind.TEXT) {
      missing.add(filter.getColumn());
    }
    if (!missing.isEmpty()) {
      throw new SchemaException(schema.getName(), missing);
    }
  }
}
