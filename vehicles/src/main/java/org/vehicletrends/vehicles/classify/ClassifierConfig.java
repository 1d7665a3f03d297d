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

import org.vehicletrends.etl.EtlException;
import org.vehicletrends.vehicles.ConfigFiles;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Brand allowlist and model keywords used by {@link PerformanceClassifier}.
 *
 * <p>The lists are data: the bundled defaults live in
 * {@code classifier-defaults.yaml} and any caller may supply its own.
 *
 * <h3>Configuration</h3>
 * <pre>{@code
 * classifier:
 *   brands: [Porsche, Ferrari]
 *   keywords: [M3, Corvette]
 *   extraKeywords: [Civic Si]     # appended to the keywords
 * }</pre>
 */
public final class ClassifierConfig {

  /** Classpath location of the bundled lists. */
  public static final String DEFAULT_RESOURCE = "classifier-defaults.yaml";

  private final ImmutableSet<String> brands;
  private final ImmutableList<String> keywords;

  private ClassifierConfig(Builder builder) {
    this.brands = ImmutableSet.copyOf(builder.brands);
    this.keywords = ImmutableList.copyOf(builder.keywords);
  }

  /**
   * Returns the sports/luxury brands, matched exactly against the make.
   */
  public Set<String> getBrands() {
    return brands;
  }

  /**
   * Returns the performance keywords, matched as case-insensitive
   * substrings of the model name, in configured order.
   */
  public List<String> getKeywords() {
    return keywords;
  }

  /**
   * Loads the bundled default lists.
   */
  public static ClassifierConfig defaults() {
    Map<String, Object> map = ConfigFiles.loadResource(DEFAULT_RESOURCE);
    List<String> brands = stringList(map.get("brands"));
    List<String> keywords = stringList(map.get("keywords"));
    if (brands == null || keywords == null) {
      throw new EtlException(DEFAULT_RESOURCE + " must define brands and keywords");
    }
    return builder().brands(brands).keywords(keywords).build();
  }

  /**
   * Creates a configuration from a map with {@code brands},
   * {@code keywords}, {@code extraBrands} and {@code extraKeywords} lists.
   * Missing {@code brands} or {@code keywords} fall back to the defaults.
   */
  public static ClassifierConfig fromMap(@Nullable Map<String, Object> map) {
    if (map == null) {
      return defaults();
    }
    List<String> brands = stringList(map.get("brands"));
    List<String> keywords = stringList(map.get("keywords"));
    Builder builder = brands == null || keywords == null
        ? defaults().toBuilder()
        : builder();
    if (brands != null) {
      builder.brands(brands);
    }
    if (keywords != null) {
      builder.keywords(keywords);
    }
    List<String> extraBrands = stringList(map.get("extraBrands"));
    if (extraBrands != null) {
      builder.addBrands(extraBrands);
    }
    List<String> extraKeywords = stringList(map.get("extraKeywords"));
    if (extraKeywords != null) {
      builder.addKeywords(extraKeywords);
    }
    return builder.build();
  }

  private static @Nullable List<String> stringList(@Nullable Object value) {
    if (!(value instanceof Collection)) {
      return null;
    }
    List<String> result = new ArrayList<String>();
    for (Object item : (Collection<?>) value) {
      if (item != null && !item.toString().trim().isEmpty()) {
        result.add(item.toString().trim());
      }
    }
    return result;
  }

  @Override public String toString() {
    return "ClassifierConfig{brands=" + brands.size() + ", keywords=" + keywords.size() + "}";
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Returns a builder pre-filled with this configuration.
   */
  public Builder toBuilder() {
    return builder().brands(brands).keywords(keywords);
  }

  /**
   * Builder for ClassifierConfig.
   */
  public static class Builder {
    private final List<String> brands = new ArrayList<String>();
    private final List<String> keywords = new ArrayList<String>();

    public Builder brands(Collection<String> brands) {
      this.brands.clear();
      this.brands.addAll(brands);
      return this;
    }

    public Builder keywords(Collection<String> keywords) {
      this.keywords.clear();
      this.keywords.addAll(keywords);
      return this;
    }

    public Builder addBrands(Collection<String> brands) {
      this.brands.addAll(brands);
      return this;
    }

    public Builder addKeywords(Collection<String> keywords) {
      this.keywords.addAll(keywords);
      return this;
    }

    public ClassifierConfig build() {
      for (String keyword : keywords) {
        if (keyword.isEmpty()) {
          throw new IllegalArgumentException("Empty keyword would match every model");
        }
      }
      return new ClassifierConfig(this);
    }
  }
}
