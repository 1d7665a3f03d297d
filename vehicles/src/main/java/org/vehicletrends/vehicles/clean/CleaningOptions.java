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

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.Map;

/**
 * Row filters applied while cleaning a source table.
 *
 * <p>Year bounds are inclusive; a null bound means unbounded. When
 * {@code requirePositiveEfficiency} is set, mainstream rows without a
 * combined efficiency greater than zero are filtered out, since the EPA
 * file lists some configurations with no measured MPG.
 */
public final class CleaningOptions {

  private static final CleaningOptions NONE = builder().build();

  private final @Nullable Integer yearMin;
  private final @Nullable Integer yearMax;
  private final boolean requirePositiveEfficiency;

  private CleaningOptions(Builder builder) {
    this.yearMin = builder.yearMin;
    this.yearMax = builder.yearMax;
    this.requirePositiveEfficiency = builder.requirePositiveEfficiency;
  }

  /**
   * Returns options that keep every valid row.
   */
  public static CleaningOptions none() {
    return NONE;
  }

  public @Nullable Integer getYearMin() {
    return yearMin;
  }

  public @Nullable Integer getYearMax() {
    return yearMax;
  }

  public boolean isRequirePositiveEfficiency() {
    return requirePositiveEfficiency;
  }

  /**
   * Returns whether a year lies within the configured bounds.
   */
  public boolean acceptsYear(int year) {
    return (yearMin == null || year >= yearMin) && (yearMax == null || year <= yearMax);
  }

  /**
   * Creates options from a configuration map with optional keys
   * {@code yearMin}, {@code yearMax} and {@code requirePositiveEfficiency}.
   */
  public static CleaningOptions fromMap(@Nullable Map<String, Object> map) {
    Builder builder = builder();
    if (map == null) {
      return builder.build();
    }
    Object min = map.get("yearMin");
    if (min instanceof Number) {
      builder.yearMin(((Number) min).intValue());
    }
    Object max = map.get("yearMax");
    if (max instanceof Number) {
      builder.yearMax(((Number) max).intValue());
    }
    Object efficiency = map.get("requirePositiveEfficiency");
    if (efficiency instanceof Boolean) {
      builder.requirePositiveEfficiency((Boolean) efficiency);
    }
    return builder.build();
  }

  @Override public String toString() {
    return "CleaningOptions{years=" + (yearMin == null ? "*" : yearMin) + ".."
        + (yearMax == null ? "*" : yearMax)
        + ", requirePositiveEfficiency=" + requirePositiveEfficiency + "}";
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Builder for CleaningOptions.
   */
  public static class Builder {
    private Integer yearMin;
    private Integer yearMax;
    private boolean requirePositiveEfficiency;

    public Builder yearMin(@Nullable Integer yearMin) {
      this.yearMin = yearMin;
      return this;
    }

    public Builder yearMax(@Nullable Integer yearMax) {
      this.yearMax = yearMax;
      return this;
    }

    public Builder yearRange(int yearMin, int yearMax) {
      this.yearMin = yearMin;
      this.yearMax = yearMax;
      return this;
    }

    public Builder requirePositiveEfficiency(boolean requirePositiveEfficiency) {
      this.requirePositiveEfficiency = requirePositiveEfficiency;
      return this;
    }

    public CleaningOptions build() {
      if (yearMin != null && yearMax != null && yearMin > yearMax) {
        throw new IllegalArgumentException("yearMin " + yearMin + " is after yearMax " + yearMax);
      }
      return new CleaningOptions(this);
    }
  }
}
