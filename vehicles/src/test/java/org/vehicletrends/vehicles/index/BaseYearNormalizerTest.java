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

import org.vehicletrends.vehicles.aggregate.YearlyAggregate;

import com.google.common.collect.ImmutableMap;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for BaseYearNormalizer.
 */
@Tag("unit")
public class BaseYearNormalizerTest {

  private final BaseYearNormalizer normalizer = new BaseYearNormalizer();

  @Test void testFirstYearIsTheBase() {
    NormalizedIndexSeries index = normalizer.normalize(aggregate("mpg", 40.0, 44.0, 48.0));

    assertSeries(index.getSeries("mpg"), 100.0, 110.0, 120.0);
    assertEquals(Integer.valueOf(2010), index.getBaseYear("mpg"));
  }

  @Test void testLeadingNullsMoveTheBase() {
    NormalizedIndexSeries index = normalizer.normalize(aggregate("hp", null, 50.0, null, 60.0));

    List<Double> series = index.getSeries("hp");
    assertNull(series.get(0));
    assertEquals(100.0, series.get(1), 1e-9);
    assertNull(series.get(2));
    assertEquals(120.0, series.get(3), 1e-9);
    assertEquals(Integer.valueOf(2011), index.getBaseYear("hp"));
  }

  @Test void testZeroBaseIsFlat() {
    NormalizedIndexSeries index = normalizer.normalize(aggregate("price", 0.0, 10.0, null));

    assertSeries(index.getSeries("price"), 100.0, 100.0, 100.0);
    assertNull(index.getBaseYear("price"));
  }

  @Test void testAllNullIsFlat() {
    NormalizedIndexSeries index = normalizer.normalize(aggregate("torque", null, null));

    assertSeries(index.getSeries("torque"), 100.0, 100.0);
  }

  @Test void testColumnsAreIndependent() {
    YearlyAggregate aggregate = new YearlyAggregate(Arrays.asList(2000, 2001),
        ImmutableMap.of("a", Arrays.asList(2.0, 3.0), "b", Arrays.asList(10.0, 5.0)));

    NormalizedIndexSeries index = normalizer.normalize(aggregate);

    assertEquals(Arrays.asList("year", "a", "b"), index.getColumnNames());
    assertSeries(index.getSeries("a"), 100.0, 150.0);
    assertSeries(index.getSeries("b"), 100.0, 50.0);
  }

  @Test void testEmptyAggregate() {
    NormalizedIndexSeries index = normalizer.normalize(new YearlyAggregate(
        Arrays.<Integer>asList(), ImmutableMap.of("mpg", Arrays.<Double>asList())));
    assertTrue(index.isEmpty());
    assertEquals(Arrays.asList("year", "mpg"), index.getColumnNames());
  }

  private static YearlyAggregate aggregate(String metric, Double... values) {
    Integer[] years = new Integer[values.length];
    for (int i = 0; i < values.length; i++) {
      years[i] = 2010 + i;
    }
    return new YearlyAggregate(Arrays.asList(years),
        ImmutableMap.of(metric, Arrays.asList(values)));
  }

  private static void assertSeries(List<Double> actual, double... expected) {
    assertEquals(expected.length, actual.size());
    for (int i = 0; i < expected.length; i++) {
      assertEquals(expected[i], actual.get(i), 1e-9, "index " + i);
    }
  }
}
