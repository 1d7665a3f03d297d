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

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.List;
import java.util.Map;

/**
 * Mean of each requested metric per model year.
 *
 * <p>Only years with at least one contributing record have a row. A metric
 * with no non-null value in a year is null in that row.
 */
public final class YearlyAggregate extends YearTable {

  public YearlyAggregate(List<Integer> years, Map<String, ? extends List<@Nullable Double>> means) {
    super(years, means);
  }

  /**
   * Returns the metric column names.
   */
  public List<String> getMetrics() {
    return getSeriesNames();
  }
}
