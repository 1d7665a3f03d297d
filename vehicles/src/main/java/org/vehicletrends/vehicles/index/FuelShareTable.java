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

import java.util.List;
import java.util.Map;

/**
 * Records per fuel category and year, as counts or as row percentages.
 *
 * <p>Columns are the categories observed in range, sorted by label. Rows
 * exist only for years with at least one categorized record; a category
 * absent in a year is 0, never null. Count tables expose whole numbers as
 * {@link Long} cells.
 */
public final class FuelShareTable extends YearTable {

  private final boolean percent;
  private final long excludedRecords;

  public FuelShareTable(List<Integer> years, Map<String, ? extends List<@Nullable Double>> shares,
      boolean percent, long excludedRecords) {
    super(years, shares);
    this.percent = percent;
    this.excludedRecords = excludedRecords;
  }

  /**
   * Returns whether cells are percentages of the row total rather than counts.
   */
  public boolean isPercent() {
    return percent;
  }

  /**
   * Returns the category labels in column order.
   */
  public List<String> getCategories() {
    return getSeriesNames();
  }

  /**
   * Returns how many in-range records had no fuel type and were left out.
   */
  public long getExcludedRecords() {
    return excludedRecords;
  }

  @Override protected @Nullable Object cell(@Nullable Double value) {
    if (percent || value == null) {
      return value;
    }
    return value.longValue();
  }
}
