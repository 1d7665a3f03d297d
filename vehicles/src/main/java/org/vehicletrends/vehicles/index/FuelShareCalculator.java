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
package org.vehicletrends.vehicles.index;

import org.vehicletrends.vehicles.model.VehicleRecord;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Pivots EPA records into a year by fuel category table.
 */
public class FuelShareCalculator {

  private static final Logger LOGGER = LoggerFactory.getLogger(FuelShareCalculator.class);

  /**
   * Counts records per year and fuel category.
   *
   * @param records EPA records
   * @param yearMin Lowest year, inclusive
   * @param yearMax Highest year, inclusive
   * @param categoryMap Raw fuel type to category mapping
   * @param usePercent Whether to express each row as percentages summing to 100
   * @return the share table; empty if nothing matched
   * @throws IllegalArgumentException if {@code yearMin > yearMax}
   */
  public FuelShareTable fuelShare(List<VehicleRecord> records, int yearMin, int yearMax,
      FuelCategoryMap categoryMap, boolean usePercent) {
    if (yearMin > yearMax) {
      throw new IllegalArgumentException("yearMin " + yearMin + " is after yearMax " + yearMax);
    }
    TreeMap<Integer, Map<String, Long>> counts = new TreeMap<Integer, Map<String, Long>>();
    TreeSet<String> categories = new TreeSet<String>();
    long excluded = 0;
    for (VehicleRecord record : records) {
      int year = record.getYear();
      if (year < yearMin || year > yearMax) {
        continue;
      }
      String category = categoryMap.categorize(record.getFuelType());
      if (category == null) {
        excluded++;
        continue;
      }
      categories.add(category);
      Map<String, Long> row = counts.get(year);
      if (row == null) {
        row = new LinkedHashMap<String, Long>();
        counts.put(year, row);
      }
      row.merge(category, 1L, Long::sum);
    }
    if (excluded > 0) {
      LOGGER.info("Excluded {} records without fuel type from fuel share {}..{}",
          excluded, yearMin, yearMax);
    }

    Map<String, List<@Nullable Double>> columns =
        new LinkedHashMap<String, List<@Nullable Double>>();
    for (String category : categories) {
      columns.put(category, new ArrayList<@Nullable Double>(counts.size()));
    }
    for (Map<String, Long> row : counts.values()) {
      long total = 0;
      for (long count : row.values()) {
        total += count;
      }
      double divisor = total == 0 ? 1 : total;
      for (String category : categories) {
        long count = row.getOrDefault(category, 0L);
        columns.get(category).add(usePercent ? count * 100.0 / divisor : (double) count);
      }
    }
    return new FuelShareTable(new ArrayList<Integer>(counts.keySet()), columns, usePercent,
        excluded);
  }
}
