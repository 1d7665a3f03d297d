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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Index series where each column equals 100 at its base year.
 *
 * <p>A column whose base year is null had no usable base (no values, or a
 * zero base) and is 100.0 in every row.
 */
public final class NormalizedIndexSeries extends YearTable {

  private final Map<String, @Nullable Integer> baseYears;

  public NormalizedIndexSeries(List<Integer> years,
      Map<String, ? extends List<@Nullable Double>> series,
      Map<String, @Nullable Integer> baseYears) {
    super(years, series);
    this.baseYears =
        Collections.unmodifiableMap(new LinkedHashMap<String, @Nullable Integer>(baseYears));
  }

  /**
   * Returns the year a column is indexed against, or null if the column had
   * no usable base.
   */
  public @Nullable Integer getBaseYear(String column) {
    getSeries(column);
    return baseYears.get(column);
  }

  public Map<String, @Nullable Integer> getBaseYears() {
    return baseYears;
  }
}
