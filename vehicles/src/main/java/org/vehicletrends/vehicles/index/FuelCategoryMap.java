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

import com.google.common.collect.ImmutableMap;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Maps raw EPA fuel type labels to share categories.
 *
 * <p>A fuel type with no mapping keeps its raw label, unless a default label
 * is configured, in which case it falls into that category.
 */
public final class FuelCategoryMap {

  private static final FuelCategoryMap IDENTITY = builder().build();

  private final ImmutableMap<String, String> categories;
  private final @Nullable String defaultLabel;

  private FuelCategoryMap(Builder builder) {
    this.categories = ImmutableMap.copyOf(builder.categories);
    this.defaultLabel = builder.defaultLabel;
  }

  /**
   * Returns a map under which every fuel type is its own category.
   */
  public static FuelCategoryMap identity() {
    return IDENTITY;
  }

  /**
   * Returns a map with one category per fuel segment, named after the
   * segment. The sports segment is skipped.
   */
  public static FuelCategoryMap fromSegments(List<MarketSegment> segments,
      @Nullable String defaultLabel) {
    Builder builder = builder().defaultLabel(defaultLabel);
    for (MarketSegment segment : segments) {
      if (!segment.isSports()) {
        builder.category(segment.getName(), segment.getFuelTypes());
      }
    }
    return builder.build();
  }

  /**
   * Creates a map from configuration.
   *
   * <pre>{@code
   * fuelCategories:
   *   categories:
   *     gas: [Regular, Premium]
   *     electric: [Electricity]
   *   defaultLabel: other
   * }</pre>
   */
  public static FuelCategoryMap fromMap(@Nullable Map<String, Object> map) {
    if (map == null) {
      return identity();
    }
    Builder builder = builder();
    Object categories = map.get("categories");
    if (categories instanceof Map) {
      for (Map.Entry<?, ?> entry : ((Map<?, ?>) categories).entrySet()) {
        if (!(entry.getValue() instanceof Collection)) {
          throw new IllegalArgumentException("Fuel category '" + entry.getKey()
              + "' must list fuel types");
        }
        for (Object fuelType : (Collection<?>) entry.getValue()) {
          builder.map(String.valueOf(fuelType), String.valueOf(entry.getKey()));
        }
      }
    }
    Object defaultLabel = map.get("defaultLabel");
    if (defaultLabel != null) {
      builder.defaultLabel(defaultLabel.toString());
    }
    return builder.build();
  }

  /**
   * Returns the category of a fuel type, or null for a null fuel type.
   */
  public @Nullable String categorize(@Nullable String fuelType) {
    if (fuelType == null) {
      return null;
    }
    String category = categories.get(fuelType);
    if (category != null) {
      return category;
    }
    return defaultLabel != null ? defaultLabel : fuelType;
  }

  public Map<String, String> getCategories() {
    return categories;
  }

  public @Nullable String getDefaultLabel() {
    return defaultLabel;
  }

  @Override public String toString() {
    return "FuelCategoryMap{" + categories + ", default=" + defaultLabel + "}";
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Builder for FuelCategoryMap.
   */
  public static class Builder {
    private final Map<String, String> categories = new LinkedHashMap<String, String>();
    private String defaultLabel;

    public Builder map(String fuelType, String category) {
      String previous = categories.put(fuelType, category);
      if (previous != null && !previous.equals(category)) {
        throw new IllegalArgumentException("Fuel type '" + fuelType + "' is mapped to both '"
            + previous + "' and '" + category + "'");
      }
      return this;
    }

    public Builder category(String category, Collection<String> fuelTypes) {
      for (String fuelType : fuelTypes) {
        map(fuelType, category);
      }
      return this;
    }

    public Builder defaultLabel(@Nullable String defaultLabel) {
      this.defaultLabel = defaultLabel;
      return this;
    }

    public FuelCategoryMap build() {
      return new FuelCategoryMap(this);
    }
  }
}
