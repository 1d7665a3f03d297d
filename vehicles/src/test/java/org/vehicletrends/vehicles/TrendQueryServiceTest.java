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

import org.vehicletrends.etl.SchemaException;
import org.vehicletrends.vehicles.aggregate.CategoryFilter;
import org.vehicletrends.vehicles.aggregate.YearTable;
import org.vehicletrends.vehicles.index.FuelShareTable;
import org.vehicletrends.vehicles.index.NormalizedIndexSeries;
import org.vehicletrends.vehicles.index.SegmentIndexReport;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for TrendQueryService over the fixture pipeline result.
 */
@Tag("unit")
public class TrendQueryServiceTest {

  private TrendQueryService service;

  @BeforeEach void setUp() throws IOException {
    PipelineResult result = VehicleTrendPipelineTest.runFixtures();
    service = new TrendQueryService(result, VehicleTrendsConfig.builder().build());
  }

  @Test void testMainstreamDefaultMetrics() {
    YearTable trends = service.mainstreamTrends(TrendQuery.builder(2010, 2025).build());

    assertEquals(Arrays.asList("year", "combined_efficiency", "tailpipe_emissions",
        "engine_displacement"), trends.getColumnNames());
    assertEquals(Arrays.asList(2015, 2020), trends.getYears());
    assertEquals(28.0, trends.getValue(2015, "combined_efficiency"));
    assertEquals(98.5, trends.getValue(2020, "combined_efficiency"), 1e-9);
    // the Tesla has no displacement
    assertEquals(1.8, trends.getValue(2020, "engine_displacement"), 1e-9);
  }

  @Test void testMainstreamFuelFilterAndNormalization() {
    YearTable trends = service.mainstreamTrends(TrendQuery.builder(2010, 2025)
        .metrics("combined_efficiency")
        .filter(CategoryFilter.of("fuel_type", "Regular"))
        .normalize(true)
        .build());

    assertTrue(trends instanceof NormalizedIndexSeries);
    assertEquals(100.0, trends.getValue(2015, "combined_efficiency"), 1e-9);
    assertEquals(200.0, trends.getValue(2020, "combined_efficiency"), 1e-9);
  }

  @Test void testSportsBrandFilter() {
    YearTable trends = service.sportsTrends(TrendQuery.builder(2000, 2025)
        .filter(CategoryFilter.of("make", "Ferrari"))
        .build());

    assertEquals(Arrays.asList(2016), trends.getYears());
    assertEquals(262000.0, trends.getValue(2016, "price"));
    assertEquals(661.0, trends.getValue(2016, "horsepower"));
  }

  @Test void testUnknownMetric() {
    assertThrows(SchemaException.class, () -> service.sportsTrends(
        TrendQuery.builder(2000, 2025).metrics("tailpipe_emissions").build()));
  }

  @Test void testFuelSharePercent() {
    FuelShareTable share =
        service.fuelShare(TrendQuery.builder(2000, 2025).percent(true).build());

    assertEquals(Arrays.asList("electric", "gas"), share.getCategories());
    assertEquals(50.0, share.getValue(2020, "electric"), 1e-9);
    assertEquals(100.0, share.getValue(2015, "gas"), 1e-9);
  }

  @Test void testSegmentIndices() {
    SegmentIndexReport report = service.segmentIndices(2000, 2025);

    NormalizedIndexSeries performance = report.getPerformance();
    assertEquals(Arrays.asList("year", "gas", "sports", "electric"),
        performance.getColumnNames());
    assertEquals(Integer.valueOf(2014), performance.getBaseYear("sports"));
    assertEquals(100.0, performance.getValue(2015, "gas"), 1e-9);
  }

  @Test void testInvertedQueryRange() {
    assertThrows(IllegalArgumentException.class,
        () -> TrendQuery.builder(2025, 2000).build());
  }
}
