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

import org.vehicletrends.vehicles.aggregate.CategoryFilter;

import com.google.common.collect.ImmutableList;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.Arrays;
import java.util.List;

/**
 * Parameters of one trend request: year range, metrics, optional category
 * filter, and presentation flags.
 *
 * <p>An empty metric list means the default metrics of the dataset queried.
 */
public final class TrendQuery {

  private final int yearMin;
  private final int yearMax;
  private final ImmutableList<String> metrics;
  private final @Nullable CategoryFilter filter;
  private final boolean normalize;
  private final boolean percent;

  private TrendQuery(Builder builder) {
    this.yearMin = builder.yearMin;
    this.yearMax = builder.yearMax;
    this.metrics = ImmutableList.copyOf(builder.metrics);
    this.filter = builder.filter;
    this.normalize = builder.normalize;
    this.percent = builder.percent;
  }

  public int getYearMin() {
    return yearMin;
  }

  public int getYearMax() {
    return yearMax;
  }

  public List<String> getMetrics() {
    return metrics;
  }

  public @Nullable CategoryFilter getFilter() {
    return filter;
  }

  /** Whether metrics are indexed to their base year. */
  public boolean isNormalize() {
    return normalize;
  }

  /** Whether fuel shares are percentages rather than counts. */
  public boolean isPercent() {
    return percent;
  }

  @Override public String toString() {
    return "TrendQuery{" + yearMin + ".." + yearMax
        + ", metrics=" + metrics
        + (filter == null ? "" : ", filter=" + filter)
        + (normalize ? ", normalized" : "")
        + (percent ? ", percent" : "")
        + "}";
  }

  /**
   * Returns a builder for a query over the given years.
   */
  public static Builder builder(int yearMin, int yearMax) {
    return new Builder(yearMin, yearMax);
  }

  /**
   * Builder for TrendQuery.
   */
  public static class Builder {
    private final int yearMin;
    private final int yearMax;
    private List<String> metrics = ImmutableList.of();
    private CategoryFilter filter;
    private boolean normalize;
    private boolean percent;

    private Builder(int yearMin, int yearMax) {
      this.yearMin = yearMin;
      this.yearMax = yearMax;
    }

    public Builder metrics(List<String> metrics) {
      this.metrics = metrics;
      return this;
    }

    public Builder metrics(String... metrics) {
      return metrics(Arrays.asList(metrics));
    }

    public Builder filter(@Nullable CategoryFilter filter) {
      this.filter = filter;
      return this;
    }

    public Builder normalize(boolean normalize) {
      this.normalize = normalize;
      return this;
    }

    public Builder percent(boolean percent) {
      this.percent = percent;
      return this;
    }

    public TrendQuery build() {
      if (yearMin > yearMax) {
        throw new IllegalArgumentException("yearMin " + yearMin + " is after yearMax " + yearMax);
      }
      return new TrendQuery(this);
    }
  }
}
