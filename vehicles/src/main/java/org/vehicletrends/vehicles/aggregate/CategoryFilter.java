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

import com.google.common.collect.ImmutableSet;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.Arrays;
import java.util.Collection;
import java.util.Set;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Restricts an aggregation to records whose categorical column holds one of
 * a set of values, e.g. {@code fuel_type in (Regular, Premium)} or
 * {@code make in (Porsche, Ferrari)}.
 *
 * <p>An empty value set accepts every record.
 */
public final class CategoryFilter {

  private final String column;
  private final ImmutableSet<String> values;

  private CategoryFilter(String column, Collection<String> values) {
    this.column = column;
    for (String value : values) {
      checkArgument(value != null, "Null value in filter on '%s': %s", column, values);
    }
    this.values = ImmutableSet.copyOf(values);
  }

  /**
   * Creates a filter.
   *
   * @throws IllegalArgumentException if {@code values} contains null
   */
  public static CategoryFilter of(String column, @Nullable Collection<String> values) {
    return new CategoryFilter(column, values == null ? ImmutableSet.<String>of() : values);
  }

  public static CategoryFilter of(String column, String... values) {
    return of(column, Arrays.asList(values));
  }

  public String getColumn() {
    return column;
  }

  public Set<String> getValues() {
    return values;
  }

  /**
   * Returns whether this filter lets every record through.
   */
  public boolean isEmpty() {
    return values.isEmpty();
  }

  public boolean accepts(@Nullable String value) {
    return values.isEmpty() || value != null && values.contains(value);
  }

  @Override public String toString() {
    return column + " in " + values;
  }
}
