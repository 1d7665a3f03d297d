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
package org.vehicletrends.vehicles.classify;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.Locale;

/**
 * Decides whether a make/model pair is a performance (sports) vehicle.
 *
 * <p>A vehicle is performance if its make is on the brand allowlist (exact,
 * case-sensitive), or otherwise if its model name contains any keyword
 * (case-insensitive substring). Substring matching is deliberately loose:
 * short keywords such as "86" or "S4" also match models that merely contain
 * those characters.
 *
 * <p>Instances are immutable and safe to share.
 */
public class PerformanceClassifier {

  /**
   * Which rule matched a vehicle.
   */
  public enum Match {
    /** Make is an allowlisted sports/luxury brand. */
    BRAND,
    /** Model name contains a performance keyword. */
    KEYWORD,
    /** Neither rule matched. */
    NONE
  }

  private final ImmutableSet<String> brands;
  private final ImmutableList<String> keywords;
  private final ImmutableList<String> lowerKeywords;

  public PerformanceClassifier(ClassifierConfig config) {
    this.brands = ImmutableSet.copyOf(config.getBrands());
    this.keywords = ImmutableList.copyOf(config.getKeywords());
    ImmutableList.Builder<String> lower = ImmutableList.builder();
    for (String keyword : keywords) {
      lower.add(keyword.toLowerCase(Locale.ROOT));
    }
    this.lowerKeywords = lower.build();
  }

  /**
   * Creates a classifier over the bundled default lists.
   */
  public static PerformanceClassifier withDefaults() {
    return new PerformanceClassifier(ClassifierConfig.defaults());
  }

  public boolean isPerformance(@Nullable String make, @Nullable String model) {
    return classify(make, model) != Match.NONE;
  }

  /**
   * Returns the rule that classifies a vehicle as performance, brand first.
   */
  public Match classify(@Nullable String make, @Nullable String model) {
    if (make != null && brands.contains(make)) {
      return Match.BRAND;
    }
    return matchingKeyword(model) != null ? Match.KEYWORD : Match.NONE;
  }

  /**
   * Returns the first configured keyword contained in the model name.
   */
  public @Nullable String matchingKeyword(@Nullable String model) {
    if (model == null) {
      return null;
    }
    String lowerModel = model.toLowerCase(Locale.ROOT);
    for (int i = 0; i < lowerKeywords.size(); i++) {
      if (lowerModel.contains(lowerKeywords.get(i))) {
        return keywords.get(i);
      }
    }
    return null;
  }

  @Override public String toString() {
    return "PerformanceClassifier{brands=" + brands.size() + ", keywords=" + keywords.size() + "}";
  }
}
