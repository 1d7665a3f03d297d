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

import org.vehicletrends.vehicles.classify.ClassifierConfig;
import org.vehicletrends.vehicles.clean.CleaningOptions;
import org.vehicletrends.vehicles.index.FuelCategoryMap;
import org.vehicletrends.vehicles.index.MarketSegment;

import com.google.common.collect.ImmutableList;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Settings of the whole vehicle trends pipeline.
 *
 * <p>Loaded from {@code vehicle-trends.yaml} (bundled defaults) or any YAML
 * or JSON file with the same layout. String values may use
 * {@code ${ENV_VAR:default}} placeholders. The year range can be overridden
 * with the {@code VEHICLE_TRENDS_START_YEAR} and
 * {@code VEHICLE_TRENDS_END_YEAR} environment variables (or system
 * properties of the same name).
 */
public final class VehicleTrendsConfig {

  private static final Logger LOGGER = LoggerFactory.getLogger(VehicleTrendsConfig.class);

  /** Classpath location of the bundled defaults. */
  public static final String DEFAULT_RESOURCE = "vehicle-trends.yaml";

  public static final String START_YEAR_ENV = "VEHICLE_TRENDS_START_YEAR";
  public static final String END_YEAR_ENV = "VEHICLE_TRENDS_END_YEAR";

  static final int DEFAULT_START_YEAR = 2000;
  static final int DEFAULT_END_YEAR = 2025;

  private final int startYear;
  private final int endYear;
  private final char mainstreamSeparator;
  private final char sportsSeparator;
  private final boolean requirePositiveEfficiency;
  private final ClassifierConfig classifier;
  private final ImmutableList<MarketSegment> segments;
  private final FuelCategoryMap fuelCategories;

  private VehicleTrendsConfig(Builder builder) {
    this.startYear = builder.startYear;
    this.endYear = builder.endYear;
    this.mainstreamSeparator = builder.mainstreamSeparator;
    this.sportsSeparator = builder.sportsSeparator;
    this.requirePositiveEfficiency = builder.requirePositiveEfficiency;
    this.classifier = builder.classifier != null ? builder.classifier : ClassifierConfig.defaults();
    this.segments = ImmutableList.copyOf(builder.segments);
    this.fuelCategories = builder.fuelCategories != null
        ? builder.fuelCategories
        : FuelCategoryMap.fromSegments(segments, null);
  }

  /**
   * Loads the bundled defaults, applying environment overrides.
   */
  public static VehicleTrendsConfig load() {
    return fromMap(ConfigFiles.loadResource(DEFAULT_RESOURCE));
  }

  /**
   * Loads a configuration file, applying environment overrides.
   */
  public static VehicleTrendsConfig load(Path path) throws IOException {
    return fromMap(ConfigFiles.loadFile(path));
  }

  @SuppressWarnings("unchecked")
  public static VehicleTrendsConfig fromMap(@Nullable Map<String, Object> map) {
    Builder builder = builder();
    if (map != null) {
      builder.startYear(intValue(map.get("startYear"), DEFAULT_START_YEAR));
      builder.endYear(intValue(map.get("endYear"), DEFAULT_END_YEAR));
      Object mainstream = map.get("mainstream");
      if (mainstream instanceof Map) {
        Map<String, Object> section = (Map<String, Object>) mainstream;
        builder.mainstreamSeparator(separator(section.get("separator"), ';'));
        Object efficiency = section.get("requirePositiveEfficiency");
        if (efficiency instanceof Boolean) {
          builder.requirePositiveEfficiency((Boolean) efficiency);
        }
      }
      Object sports = map.get("sports");
      if (sports instanceof Map) {
        builder.sportsSeparator(separator(((Map<String, Object>) sports).get("separator"), ','));
      }
      Object classifier = map.get("classifier");
      if (classifier instanceof Map) {
        builder.classifier(ClassifierConfig.fromMap((Map<String, Object>) classifier));
      }
      Object segments = map.get("segments");
      if (segments instanceof Map) {
        builder.segments(MarketSegment.fromMap((Map<String, Object>) segments));
      }
      Object fuelCategories = map.get("fuelCategories");
      if (fuelCategories instanceof Map) {
        builder.fuelCategories(FuelCategoryMap.fromMap((Map<String, Object>) fuelCategories));
      }
    }
    Integer envStart = envYear(START_YEAR_ENV);
    if (envStart != null) {
      builder.startYear(envStart);
    }
    Integer envEnd = envYear(END_YEAR_ENV);
    if (envEnd != null) {
      builder.endYear(envEnd);
    }
    return builder.build();
  }

  private static int intValue(@Nullable Object value, int defaultValue) {
    if (value instanceof Number) {
      return ((Number) value).intValue();
    }
    if (value instanceof String) {
      String resolved = ConfigFiles.resolveEnvVar((String) value);
      if (resolved != null) {
        try {
          return Integer.parseInt(resolved.trim());
        } catch (NumberFormatException e) {
          LOGGER.warn("Invalid year '{}', using {}", value, defaultValue);
        }
      }
    }
    return defaultValue;
  }

  private static char separator(@Nullable Object value, char defaultValue) {
    if (value == null) {
      return defaultValue;
    }
    String text = ConfigFiles.resolveEnvVar(value.toString());
    if (text == null || text.length() != 1) {
      throw new IllegalArgumentException("Separator must be a single character: '" + value + "'");
    }
    return text.charAt(0);
  }

  private static @Nullable Integer envYear(String name) {
    String value = System.getenv(name);
    if (value == null) {
      value = System.getProperty(name);
    }
    if (value == null) {
      return null;
    }
    try {
      return Integer.parseInt(value.trim());
    } catch (NumberFormatException e) {
      LOGGER.warn("Invalid {}: {}", name, value);
      return null;
    }
  }

  public int getStartYear() {
    return startYear;
  }

  public int getEndYear() {
    return endYear;
  }

  public char getMainstreamSeparator() {
    return mainstreamSeparator;
  }

  public char getSportsSeparator() {
    return sportsSeparator;
  }

  public boolean isRequirePositiveEfficiency() {
    return requirePositiveEfficiency;
  }

  public ClassifierConfig getClassifier() {
    return classifier;
  }

  public List<MarketSegment> getSegments() {
    return segments;
  }

  public FuelCategoryMap getFuelCategories() {
    return fuelCategories;
  }

  /**
   * Returns cleaning options for the EPA table over the configured years.
   */
  public CleaningOptions mainstreamCleaning() {
    return CleaningOptions.builder()
        .yearRange(startYear, endYear)
        .requirePositiveEfficiency(requirePositiveEfficiency)
        .build();
  }

  /**
   * Returns cleaning options for the sports table over the configured years.
   */
  public CleaningOptions sportsCleaning() {
    return CleaningOptions.builder().yearRange(startYear, endYear).build();
  }

  @Override public String toString() {
    return "VehicleTrendsConfig{years=" + startYear + ".." + endYear
        + ", mainstreamSeparator='" + mainstreamSeparator + "'"
        + ", sportsSeparator='" + sportsSeparator + "'"
        + ", requirePositiveEfficiency=" + requirePositiveEfficiency
        + ", " + classifier
        + ", segments=" + segments
        + "}";
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Builder for VehicleTrendsConfig.
   */
  public static class Builder {
    private int startYear = DEFAULT_START_YEAR;
    private int endYear = DEFAULT_END_YEAR;
    private char mainstreamSeparator = ';';
    private char sportsSeparator = ',';
    private boolean requirePositiveEfficiency = true;
    private ClassifierConfig classifier;
    private List<MarketSegment> segments = MarketSegment.defaults();
    private FuelCategoryMap fuelCategories;

    public Builder startYear(int startYear) {
      this.startYear = startYear;
      return this;
    }

    public Builder endYear(int endYear) {
      this.endYear = endYear;
      return this;
    }

    public Builder mainstreamSeparator(char mainstreamSeparator) {
      this.mainstreamSeparator = mainstreamSeparator;
      return this;
    }

    public Builder sportsSeparator(char sportsSeparator) {
      this.sportsSeparator = sportsSeparator;
      return this;
    }

    public Builder requirePositiveEfficiency(boolean requirePositiveEfficiency) {
      this.requirePositiveEfficiency = requirePositiveEfficiency;
      return this;
    }

    public Builder classifier(ClassifierConfig classifier) {
      this.classifier = classifier;
      return this;
    }

    public Builder segments(List<MarketSegment> segments) {
      this.segments = segments;
      return this;
    }

    public Builder fuelCategories(FuelCategoryMap fuelCategories) {
      this.fuelCategories = fuelCategories;
      return this;
    }

    public VehicleTrendsConfig build() {
      if (startYear > endYear) {
        throw new IllegalArgumentException("startYear " + startYear
            + " is after endYear " + endYear);
      }
      return new VehicleTrendsConfig(this);
    }
  }
}
