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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * A named slice of the market tracked as one index column.
 *
 * <p>A fuel segment selects mainstream (EPA) vehicles by fuel type; the
 * sports segment covers the whole merged sports collection.
 */
public final class MarketSegment {

  /** EPA fuel types counted as conventional combustion. */
  public static final List<String> GAS_FUEL_TYPES = ImmutableList.of(
      "Regular", "Premium", "Midgrade", "Gasoline or E85", "Premium or E85", "Diesel",
      "Gasoline or natural gas", "CNG");

  /** EPA fuel types counted as electric or plug-in hybrid. */
  public static final List<String> ELECTRIC_FUEL_TYPES = ImmutableList.of(
      "Electricity", "Regular Gas and Electricity", "Premium Gas or Electricity",
      "Premium and Electricity", "Regular Gas or Electricity");

  private final String name;
  private final boolean sports;
  private final ImmutableSet<String> fuelTypes;

  private MarketSegment(String name, boolean sports, Collection<String> fuelTypes) {
    if (name == null || name.isEmpty()) {
      throw new IllegalArgumentException("Segment name is required");
    }
    this.name = name;
    this.sports = sports;
    this.fuelTypes = ImmutableSet.copyOf(fuelTypes);
  }

  /**
   * Creates a segment of EPA vehicles with one of the given fuel types.
   */
  public static MarketSegment ofFuelTypes(String name, Collection<String> fuelTypes) {
    if (fuelTypes.isEmpty()) {
      throw new IllegalArgumentException("Segment '" + name + "' has no fuel types");
    }
    return new MarketSegment(name, false, fuelTypes);
  }

  /**
   * Creates the segment covering the sports collection.
   */
  public static MarketSegment sports(String name) {
    return new MarketSegment(name, true, ImmutableSet.<String>of());
  }

  /**
   * Returns the default segments: gas, sports and electric.
   */
  public static List<MarketSegment> defaults() {
    return ImmutableList.of(
        ofFuelTypes("gas", GAS_FUEL_TYPES),
        sports("sports"),
        ofFuelTypes("electric", ELECTRIC_FUEL_TYPES));
  }

  /**
   * Reads segments from a map of segment name to fuel type list; the value
   * {@code sports} (a string rather than a list) marks the sports segment.
   *
   * <pre>{@code
   * segments:
   *   gas: [Regular, Premium]
   *   sports: sports
   *   electric: [Electricity]
   * }</pre>
   */
  public static List<MarketSegment> fromMap(@Nullable Map<String, Object> map) {
    if (map == null || map.isEmpty()) {
      return defaults();
    }
    List<MarketSegment> segments = new ArrayList<MarketSegment>();
    for (Map.Entry<String, Object> entry : map.entrySet()) {
      Object value = entry.getValue();
      if ("sports".equals(value)) {
        segments.add(sports(entry.getKey()));
      } else if (value instanceof Collection) {
        List<String> fuelTypes = new ArrayList<String>();
        for (Object fuelType : (Collection<?>) value) {
          fuelTypes.add(String.valueOf(fuelType));
        }
        segments.add(ofFuelTypes(entry.getKey(), fuelTypes));
      } else {
        throw new IllegalArgumentException("Segment '" + entry.getKey()
            + "' must list fuel types or be 'sports', got: " + value);
      }
    }
    return segments;
  }

  public String getName() {
    return name;
  }

  public boolean isSports() {
    return sports;
  }

  public Set<String> getFuelTypes() {
    return fuelTypes;
  }

  @Override public String toString() {
    return sports ? name + "(sports)" : name + fuelTypes;
  }
}
