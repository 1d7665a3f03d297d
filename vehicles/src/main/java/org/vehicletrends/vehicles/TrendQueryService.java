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
package org.vehicletrends.vehicles;

import org.vehicletrends.vehicles.aggregate.YearTable;
import org.vehicletrends.vehicles.aggregate.YearlyAggregate;
import org.vehicletrends.vehicles.aggregate.YearlyAggregator;
import org.vehicletrends.vehicles.index.BaseYearNormalizer;
import org.vehicletrends.vehicles.index.FuelCategoryMap;
import org.vehicletrends.vehicles.index.FuelShareCalculator;
import org.vehicletrends.vehicles.index.FuelShareTable;
import org.vehicletrends.vehicles.index.SegmentIndexBuilder;
import org.vehicletrends.vehicles.index.SegmentIndexReport;
import org.vehicletrends.vehicles.model.SportsRecord;
import org.vehicletrends.vehicles.model.VehicleRecord;

import com.google.common.collect.ImmutableList;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Answers trend queries over the clean collections of a pipeline run.
 *
 * <p>This is the surface a dashboard or report talks to: every method
 * returns a {@link org.vehicletrends.etl.TabularResult} ready to display or
 * write as CSV.
 */
public class TrendQueryService {

  private static final Logger LOGGER = LoggerFactory.getLogger(TrendQueryService.class);

  /** Metrics charted for EPA vehicles when a query names none. */
  public static final List<String> DEFAULT_MAINSTREAM_METRICS = ImmutableList.of(
      VehicleColumns.COMBINED_EFFICIENCY,
      VehicleColumns.TAILPIPE_EMISSIONS,
      VehicleColumns.ENGINE_DISPLACEMENT);

  /** Metrics charted for sports vehicles when a query names none. */
  public static final List<String> DEFAULT_SPORTS_METRICS = ImmutableList.of(
      VehicleColumns.HORSEPOWER,
      VehicleColumns.ENGINE_SIZE,
      VehicleColumns.PRICE,
      VehicleColumns.ZERO_TO_SIXTY);

  private final List<VehicleRecord> mainstream;
  private final List<SportsRecord> sports;
  private final FuelCategoryMap fuelCategories;
  private final SegmentIndexBuilder segmentIndexBuilder;
  private final YearlyAggregator aggregator = new YearlyAggregator();
  private final BaseYearNormalizer normalizer = new BaseYearNormalizer();
  private final FuelShareCalculator fuelShareCalculator = new FuelShareCalculator();

  public TrendQueryService(PipelineResult result, VehicleTrendsConfig config) {
    this(result.getMainstream(), result.getSports(), config.getFuelCategories(),
        new SegmentIndexBuilder(config.getSegments()));
  }

  public TrendQueryService(List<VehicleRecord> mainstream, List<SportsRecord> sports,
      FuelCategoryMap fuelCategories, SegmentIndexBuilder segmentIndexBuilder) {
    this.mainstream = ImmutableList.copyOf(mainstream);
    this.sports = ImmutableList.copyOf(sports);
    this.fuelCategories = fuelCategories;
    this.segmentIndexBuilder = segmentIndexBuilder;
  }

  /**
   * Returns yearly means of EPA metrics, optionally indexed to base 100.
   * A filter typically restricts {@code fuel_type}.
   */
  public YearTable mainstreamTrends(TrendQuery query) {
    LOGGER.debug("Mainstream trends: {}", query);
    List<String> metrics =
        query.getMetrics().isEmpty() ? DEFAULT_MAINSTREAM_METRICS : query.getMetrics();
    YearlyAggregate aggregate = aggregator.aggregate(mainstream, VehicleColumns.MAINSTREAM,
        query.getYearMin(), query.getYearMax(), metrics, query.getFilter());
    return query.isNormalize() ? normalizer.normalize(aggregate) : aggregate;
  }

  /**
   * Returns yearly means of sports metrics, optionally indexed to base 100.
   * A filter typically restricts {@code make} to chosen brands.
   */
  public YearTable sportsTrends(TrendQuery query) {
    LOGGER.debug("Sports trends: {}", query);
    List<String> metrics =
        query.getMetrics().isEmpty() ? DEFAULT_SPORTS_METRICS : query.getMetrics();
    YearlyAggregate aggregate = aggregator.aggregate(sports, VehicleColumns.SPORTS,
        query.getYearMin(), query.getYearMax(), metrics, query.getFilter());
    return query.isNormalize() ? normalizer.normalize(aggregate) : aggregate;
  }

  /**
   * Returns EPA records per fuel category and year.
   */
  public FuelShareTable fuelShare(TrendQuery query) {
    LOGGER.debug("Fuel share: {}", query);
    return fuelShareCalculator.fuelShare(mainstream, query.getYearMin(), query.getYearMax(),
        fuelCategories, query.isPercent());
  }

  /**
   * Returns horsepower and efficiency indices per market segment.
   */
  public SegmentIndexReport segmentIndices(int yearMin, int yearMax) {
    LOGGER.debug("Segment indices: {}..{}", yearMin, yearMax);
    return segmentIndexBuilder.build(mainstream, sports, yearMin, yearMax);
  }
}
