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

import org.vehicletrends.etl.SchemaException;
import org.vehicletrends.vehicles.VehicleColumns;
import org.vehicletrends.vehicles.model.SportsRecord;
import org.vehicletrends.vehicles.model.VehicleRecord;

import com.google.common.collect.ImmutableList;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for YearlyAggregator.
 */
@Tag("unit")
public class YearlyAggregatorTest {

  private static final List<String> MPG = ImmutableList.of(VehicleColumns.COMBINED_EFFICIENCY);

  private final YearlyAggregator aggregator = new YearlyAggregator();

  @Test void testMeanIgnoresNulls() {
    List<VehicleRecord> records = ImmutableList.of(
        epa(2020, "Regular", 10.0),
        epa(2020, "Regular", 20.0),
        epa(2020, "Regular", null));

    YearlyAggregate result =
        aggregator.aggregate(records, VehicleColumns.MAINSTREAM, 2000, 2025, MPG, null);

    assertEquals(Arrays.asList(2020), result.getYears());
    assertEquals(15.0, result.getValue(2020, VehicleColumns.COMBINED_EFFICIENCY));
    assertTrue(result.hasSeries(VehicleColumns.COMBINED_EFFICIENCY));
    assertFalse(result.hasSeries(VehicleColumns.TAILPIPE_EMISSIONS));
    assertThrows(IllegalArgumentException.class,
        () -> result.getSeries(VehicleColumns.TAILPIPE_EMISSIONS));
  }

  @Test void testYearWithOnlyNullsHoldsNull() {
    List<VehicleRecord> records = ImmutableList.of(
        epa(2019, "Regular", null),
        epa(2020, "Regular", 25.0));

    YearlyAggregate result =
        aggregator.aggregate(records, VehicleColumns.MAINSTREAM, 2000, 2025, MPG, null);

    assertEquals(Arrays.asList(2019, 2020), result.getYears());
    assertNull(result.getValue(2019, VehicleColumns.COMBINED_EFFICIENCY));
  }

  @Test void testBoundsAreInclusiveAndRowsAscending() {
    List<VehicleRecord> records = ImmutableList.of(
        epa(2012, "Regular", 30.0),
        epa(2009, "Regular", 20.0),
        epa(2010, "Regular", 22.0),
        epa(2013, "Regular", 40.0),
        epa(2011, "Regular", 24.0));

    YearlyAggregate result =
        aggregator.aggregate(records, VehicleColumns.MAINSTREAM, 2010, 2012, MPG, null);

    assertEquals(Arrays.asList(2010, 2011, 2012), result.getYears());
    assertEquals(Arrays.asList("year", "combined_efficiency"), result.getColumnNames());
    assertEquals(Arrays.asList(2010, 22.0), result.getRows().get(0));
  }

  @Test void testCategoryFilter() {
    List<VehicleRecord> records = ImmutableList.of(
        epa(2020, "Regular", 30.0),
        epa(2020, "Electricity", 110.0),
        epa(2020, null, 50.0));

    YearlyAggregate gas = aggregator.aggregate(records, VehicleColumns.MAINSTREAM, 2020, 2020,
        MPG, CategoryFilter.of(VehicleColumns.FUEL_TYPE, "Regular", "Premium"));
    YearlyAggregate all = aggregator.aggregate(records, VehicleColumns.MAINSTREAM, 2020, 2020,
        MPG, CategoryFilter.of(VehicleColumns.FUEL_TYPE, ImmutableList.<String>of()));

    assertEquals(30.0, gas.getValue(2020, VehicleColumns.COMBINED_EFFICIENCY));
    assertEquals(190.0 / 3, all.getValue(2020, VehicleColumns.COMBINED_EFFICIENCY), 1e-9);
  }

  @Test void testNullFilterValueIsRejected() {
    IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
        () -> CategoryFilter.of(VehicleColumns.FUEL_TYPE, Arrays.asList("Regular", null)));
    assertTrue(e.getMessage().contains(VehicleColumns.FUEL_TYPE));
    assertTrue(CategoryFilter.of(VehicleColumns.FUEL_TYPE, (List<String>) null).isEmpty());
  }

  @Test void testBrandFilterOnSports() {
    List<SportsRecord> records = ImmutableList.of(
        SportsRecord.builder().make("Porsche").model("911").year(2020).horsepower(443.0).build(),
        SportsRecord.builder().make("Ferrari").model("F8").year(2020).horsepower(710.0).build());

    YearlyAggregate result = aggregator.aggregate(records, VehicleColumns.SPORTS, 2020, 2020,
        ImmutableList.of(VehicleColumns.HORSEPOWER, VehicleColumns.PRICE),
        CategoryFilter.of(VehicleColumns.MAKE, "Ferrari"));

    assertEquals(710.0, result.getValue(2020, VehicleColumns.HORSEPOWER));
    assertNull(result.getValue(2020, VehicleColumns.PRICE));
  }

  @Test void testNoMatchesGivesEmptyWellFormedResult() {
    YearlyAggregate result = aggregator.aggregate(ImmutableList.of(epa(1995, "Regular", 20.0)),
        VehicleColumns.MAINSTREAM, 2000, 2025, MPG, null);

    assertTrue(result.isEmpty());
    assertEquals(Arrays.asList("year", "combined_efficiency"), result.getColumnNames());
    assertEquals(0, result.getRowCount());
  }

  @Test void testUnknownColumnsAreAllReported() {
    SchemaException e = assertThrows(SchemaException.class,
        () -> aggregator.aggregate(ImmutableList.<VehicleRecord>of(), VehicleColumns.MAINSTREAM,
            2000, 2025, Arrays.asList("price", "combined_efficiency", "torque"),
            CategoryFilter.of("brand", "BMW")));
    assertEquals(Arrays.asList("price", "torque", "brand"), e.getMissingColumns());
  }

  @Test void testTextColumnIsNotAMetric() {
    assertThrows(SchemaException.class,
        () -> aggregator.aggregate(ImmutableList.<VehicleRecord>of(), VehicleColumns.MAINSTREAM,
            2000, 2025, Arrays.asList("fuel_type"), null));
  }

  @Test void testInvertedYearRange() {
    assertThrows(IllegalArgumentException.class,
        () -> aggregator.aggregate(ImmutableList.<VehicleRecord>of(), VehicleColumns.MAINSTREAM,
            2025, 2000, MPG, null));
  }

  private static VehicleRecord epa(int year, String fuelType, Double mpg) {
    return VehicleRecord.builder().make("Toyota").model("Camry").year(year)
        .fuelType(fuelType).combinedEfficiency(mpg).build();
  }
}
