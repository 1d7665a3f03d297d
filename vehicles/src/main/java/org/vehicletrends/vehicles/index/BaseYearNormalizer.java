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

import org.vehicletrends.vehicles.aggregate.YearTable;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Rescales each column of a year table to an index with base 100.
 *
 * <p>The base of a column is its first non-null value in year order. Every
 * value becomes {@code 100 * value / base}; nulls stay null. A column with no
 * non-null value, or whose base is zero, becomes 100.0 in every row, so the
 * result never holds NaN or infinity.
 */
public class BaseYearNormalizer {

  private static final Logger LOGGER = LoggerFactory.getLogger(BaseYearNormalizer.class);

  /** Index value at the base year. */
  public static final double BASE = 100.0;

  public NormalizedIndexSeries normalize(YearTable table) {
    List<Integer> years = table.getYears();
    Map<String, List<@Nullable Double>> indexed =
        new LinkedHashMap<String, List<@Nullable Double>>();
    Map<String, @Nullable Integer> baseYears = new LinkedHashMap<String, @Nullable Integer>();
    for (String column : table.getSeriesNames()) {
      List<@Nullable Double> values = table.getSeries(column);
      int baseIndex = firstNonNull(values);
      double base = baseIndex < 0 ? 0 : values.get(baseIndex);
      List<@Nullable Double> index = new ArrayList<@Nullable Double>(values.size());
      if (base == 0 || Double.isNaN(base) || Double.isInfinite(base)) {
        LOGGER.debug("Column '{}' has no usable base value; indexing flat at {}", column, BASE);
        for (int i = 0; i < values.size(); i++) {
          index.add(BASE);
        }
        baseYears.put(column, null);
      } else {
        for (Double value : values) {
          index.add(value == null ? null : BASE * value / base);
        }
        baseYears.put(column, years.get(baseIndex));
      }
      indexed.put(column, index);
    }
    return new NormalizedIndexSeries(years, indexed, baseYears);
  }

  private static int firstNonNull(List<@Nullable Double> values) {
    for (int i = 0; i < values.size(); i++) {
      if (values.get(i) != null) {
        return i;
      }
    }
    return -1;
  }
}
