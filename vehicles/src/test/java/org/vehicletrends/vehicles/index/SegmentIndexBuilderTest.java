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

import org.vehicletrends.vehicles.model.SportsRecord;
import org.vehicletrends.vehicles.model.VehicleRecord;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Tests for SegmentIndexBuilder and MarketSegment.
 */
@Tag("unit")
public class SegmentIndexBuilderTest {

  private static final List<VehicleRecord> MAINSTREAM = ImmutableList.of(
      epa(2020, "Regular", 200.0, 30.0),
      epa(2021, "Premium", 220.0, 33.0),
      epa(2021, "Electricity", 300.0, 100.0),
      epa(2022, "Electricity", 330.0, null),
      epa(2022, "Hydrogen", 150.0, 60.0));

  private static final List<SportsRecord> SPORTS = ImmutableList.of(
      SportsRecord.builder().make("Ferrari").model("F8").year(2020).horsepower(500.0).build());

  @Test void testEachSegmentIsIndexedToItsOwnFirstYear() {
    SegmentIndexReport report =
        new SegmentIndexBuilder().build(MAINSTREAM, SPORTS, 2000, 2025);

    NormalizedIndexSeries performance = report.getPerformance();
    assertEquals(Arrays.asList("year", "gas", "sports", "electric"),
        performance.getColumnNames());
    assertEquals(Arrays.asList(2020, 2021, 2022), performance.getYears());
    assertEquals(100.0, performance.getValue(2020, "gas"), 1e-9);
    assertEquals(110.0, performance.getValue(2021, "gas"), 1e-9);
    assertNull(performance.getValue(2022, "gas"));
    assertEquals(100.0, performance.getValue(2020, "sports"), 1e-9);
    assertNull(performance.getValue(2021, "sports"));
    assertNull(performance.getValue(2020, "electric"));
    assertEquals(100.0, performance.getValue(2021, "electric"), 1e-9);
    assertEquals(110.0, performance.getValue(2022, "electric"), 1e-9);
    assertEquals(Integer.valueOf(2021), performance.getBaseYear("electric"));
  }

  @Test void testEfficiencyIndex() {
    NormalizedIndexSeries efficiency =
        new SegmentIndexBuilder().build(MAINSTREAM, SPORTS, 2000, 2025).getEfficiency();

    assertEquals(110.0, efficiency.getValue(2021, "gas"), 1e-9);
    assertEquals(100.0, efficiency.getValue(2021, "electric"), 1e-9);
    assertNull(efficiency.getValue(2022, "electric"));
    // no sports efficiency data at all: flat
    assertEquals(100.0, efficiency.getValue(2020, "sports"), 1e-9);
    assertNull(efficiency.getBaseYear("sports"));
  }

  @Test void testYearRangeLimitsEverySegment() {
    NormalizedIndexSeries performance =
        new SegmentIndexBuilder().build(MAINSTREAM, SPORTS, 2021, 2022).getPerformance();

    assertEquals(Arrays.asList(2021, 2022), performance.getYears());
    assertEquals(100.0, performance.getValue(2021, "gas"), 1e-9);
    assertNull(performance.getValue(2021, "sports"));
  }

  @Test void testSegmentsFromConfiguration() {
    List<MarketSegment> segments = MarketSegment.fromMap(ImmutableMap.<String, Object>of(
        "hydrogen", Arrays.asList("Hydrogen"),
        "performance", "sports"));

    SegmentIndexReport report =
        new SegmentIndexBuilder(segments).build(MAINSTREAM, SPORTS, 2000, 2025);

    assertEquals(Arrays.asList("year", "hydrogen", "performance"),
        report.getPerformance().getColumnNames());
    assertEquals(100.0, report.getPerformance().getValue(2022, "hydrogen"), 1e-9);
  }

  @Test void testInvalidSegmentDefinition() {
    assertThrows(IllegalArgumentException.class,
        () -> MarketSegment.fromMap(ImmutableMap.<String, Object>of("gas", 42)));
    assertThrows(IllegalArgumentException.class,
        () -> MarketSegment.ofFuelTypes("empty", ImmutableList.<String>of()));
  }

  private static VehicleRecord epa(int year, String fuelType, Double hp, Double mpg) {
    return VehicleRecord.builder().make("Ford").model("Focus").year(year)
        .fuelType(fuelType).horsepowerEst(hp).combinedEfficiency(mpg).build();
  }
}
