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
package org.vehicletrends.vehicles.clean;

import org.vehicletrends.etl.RawTable;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Tests for ColumnAliasResolver.
 */
@Tag("unit")
public class ColumnAliasResolverTest {

  private final ColumnAliasResolver resolver = new ColumnAliasResolver();

  @Test void testEpaHeadersMapToCanonicalNames() {
    RawTable raw = new RawTable("epa", Arrays.asList("Make", "Model", "Year", "Fuel Type",
        "Combined Mpg For Fuel Type1", "Co2  Tailpipe For Fuel Type1", "Engine displacement",
        "Horsepower (est)", "0-60 time (est)", "Drive"), Collections.emptyList());

    RawTable resolved = resolver.resolve(raw, "mainstream");

    assertEquals(Arrays.asList("make", "model", "year", "fuel_type", "combined_efficiency",
        "tailpipe_emissions", "engine_displacement", "horsepower_est", "zero_to_sixty_est",
        "Drive"), resolved.getColumns());
  }

  @Test void testSportsHeadersMapToCanonicalNames() {
    RawTable raw = new RawTable("sports", Arrays.asList("Car Make", "Car Model", "Year",
        "Engine Size (L)", "Horsepower", "Torque (lb-ft)", "0-60 MPH Time (seconds)",
        "Price (in USD)", "MPG"), Collections.emptyList());

    RawTable resolved = resolver.resolve(raw, "sports");

    assertEquals(Arrays.asList("make", "model", "year", "engine_size", "horsepower", "torque",
        "zero_to_sixty", "price", "combined_efficiency"), resolved.getColumns());
  }

  @Test void testMatchingIgnoresCaseAndWhitespace() {
    RawTable raw = new RawTable("epa", Arrays.asList("MAKE", " model ",
        "combined mpg  for fuel type1"), Collections.emptyList());

    RawTable resolved = resolver.resolve(raw, "mainstream");

    assertEquals(Arrays.asList("make", "model", "combined_efficiency"), resolved.getColumns());
  }

  @Test void testCanonicalHeaderWinsOverAlias() {
    RawTable raw = RawTable.of("epa", ImmutableList.<Map<String, String>>of(
        ImmutableMap.of("make", "Toyota", "Make", "Ignored")));

    RawTable resolved = resolver.resolve(raw, "mainstream");

    assertEquals(Arrays.asList("make", "Make"), resolved.getColumns());
    assertEquals("Toyota", resolved.getRows().get(0).get("make"));
  }

  @Test void testCustomAliases() {
    Map<String, Map<String, List<String>>> aliases = ImmutableMap.of("custom",
        ImmutableMap.<String, List<String>>of("year", Arrays.asList("Model Year")));
    RawTable raw = new RawTable("t", Arrays.asList("Model Year"), Collections.emptyList());

    assertEquals(Arrays.asList("year"),
        new ColumnAliasResolver(aliases).resolve(raw, "custom").getColumns());
  }

  @Test void testUnknownDataset() {
    RawTable raw = new RawTable("t", Arrays.asList("Make"), Collections.emptyList());
    assertThrows(IllegalArgumentException.class, () -> resolver.resolve(raw, "trucks"));
  }
}
