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

import org.vehicletrends.vehicles.VehicleColumns;
import org.vehicletrends.vehicles.aggregate.CategoryFilter;
import org.vehicletrends.vehicles.aggregate.YearlyAggregate;
import org.vehicletrends.vehicles.aggregate.YearlyAggregator;
import org.vehicletrends.vehicles.model.SportsRecord;
import org.vehicletrends.vehicles.model.VehicleRecord;

import com.google.common.collect.ImmutableList;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * Builds horsepower and efficiency indices that compare market segments.
 *
 * <p>For every segment the mean horsepower and mean combined efficiency are
 * aggregated per year, then indexed to the segment's own first year. The
 * segment columns are joined on year.
 */
public class SegmentIndexBuilder {

  private static final Logger LOGGER = LoggerFactory.getLogger(SegmentIndexBuilder.class);

  private final List<MarketSegment> segments;
  private final YearlyAggregator aggregator;
  private final BaseYearNormalizer normalizer;

  public SegmentIndexBuilder() {
    this(MarketSegment.defaults());
  }

  public SegmentIndexBuilder(List<MarketSegment> segments) {
    this(segments, new YearlyAggregator(), new BaseYearNormalizer());
  }

  public SegmentIndexBuilder(List<MarketSegment> segments, YearlyAggregator aggregator,
      BaseYearNormalizer normalizer) {
    if (segments.isEmpty()) {
      throw new IllegalArgumentException("At least one market segment is required");
    }
    this.segments = ImmutableList.copyOf(segments);
    this.aggregator = aggregator;
    this.normalizer = normalizer;
  }

  public List<MarketSegment> getSegments() {
    return segments;
  }

  /**
   * Builds the segment indices.
   *
   * @param mainstream Cleaned EPA records (fuel segments select from these)
   * @param sports Merged sports records
   * @param yearMin Lowest year, inclusive
   * @param yearMax Highest year, inclusive
   */
  public SegmentIndexReport build(List<VehicleRecord> mainstream, List<SportsRecord> sports,
      int yearMin, int yearMax) {
    Map<String, NormalizedIndexSeries> bySegment =
        new LinkedHashMap<String, NormalizedIndexSeries>();
    for (MarketSegment segment : segments) {
      YearlyAggregate aggregate;
      String horsepower;
      if (segment.isSports()) {
        horsepower = VehicleColumns.HORSEPOWER;
        aggregate = aggregator.aggregate(sports, VehicleColumns.SPORTS, yearMin, yearMax,
            ImmutableList.of(horsepower, VehicleColumns.COMBINED_EFFICIENCY), null);
      } else {
        horsepower = VehicleColumns.HORSEPOWER_EST;
        aggregate = aggregator.aggregate(mainstream, VehicleColumns.MAINSTREAM, yearMin, yearMax,
            ImmutableList.of(horsepower, VehicleColumns.COMBINED_EFFICIENCY),
            CategoryFilter.of(VehicleColumns.FUEL_TYPE, segment.getFuelTypes()));
      }
      NormalizedIndexSeries index = normalizer.normalize(aggregate);
      bySegment.put(segment.getName(), index);
      LOGGER.debug("Segment {}: {} years, horsepower base {}, efficiency base {}",
          segment.getName(), index.getYears().size(), index.getBaseYears().get(horsepower),
          index.getBaseYears().get(VehicleColumns.COMBINED_EFFICIENCY));
    }
    return new SegmentIndexReport(join(bySegment, 0), join(bySegment, 1));
  }

  private static NormalizedIndexSeries join(Map<String, NormalizedIndexSeries> bySegment,
      int metricIndex) {
    TreeSet<Integer> years = new TreeSet<Integer>();
    for (NormalizedIndexSeries series : bySegment.values()) {
      years.addAll(series.getYears());
    }
    Map<String, List<@Nullable Double>> columns =
        new LinkedHashMap<String, List<@Nullable Double>>();
    Map<String, @Nullable Integer> baseYears = new LinkedHashMap<String, @Nullable Integer>();
    for (Map.Entry<String, NormalizedIndexSeries> entry : bySegment.entrySet()) {
      NormalizedIndexSeries series = entry.getValue();
      // each segment series holds the horsepower column first, efficiency second
      String metric = series.getSeriesNames().get(metricIndex);
      List<@Nullable Double> column = new ArrayList<@Nullable Double>(years.size());
      for (int year : years) {
        column.add(series.getValue(year, metric));
      }
      columns.put(entry.getKey(), column);
      baseYears.put(entry.getKey(), series.getBaseYear(metric));
    }
    return new NormalizedIndexSeries(new ArrayList<Integer>(years), columns, baseYears);
  }
}
