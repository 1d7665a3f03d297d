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
package org.vehicletrends.vehicles.model;

import java.util.Objects;

/**
 * The (make, model, year) tuple identifying one logical vehicle across
 * datasets. Comparison is exact: "Porsche 911" and "porsche 911" are
 * different keys.
 */
public final class NaturalKey {

  private final String make;
  private final String model;
  private final int year;

  public NaturalKey(String make, String model, int year) {
    this.make = Objects.requireNonNull(make, "make");
    this.model = Objects.requireNonNull(model, "model");
    this.year = year;
  }

  public String getMake() {
    return make;
  }

  public String getModel() {
    return model;
  }

  public int getYear() {
    return year;
  }

  @Override public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof NaturalKey)) {
      return false;
    }
    NaturalKey that = (NaturalKey) o;
    return year == that.year && make.equals(that.make) && model.equals(that.model);
  }

  @Override public int hashCode() {
    return Objects.hash(make, model, year);
  }

  @Override public String toString() {
    return make + " " + model + " " + year;
  }
}
