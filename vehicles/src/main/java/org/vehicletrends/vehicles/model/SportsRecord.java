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

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.Objects;

/**
 * One sports or performance vehicle, either from the curated sports dataset
 * or reclassified out of the EPA dataset.
 *
 * <p>Records reclassified from the EPA dataset never carry torque or price.
 */
public final class SportsRecord {

  private final String make;
  private final String model;
  private final int year;
  private final @Nullable Double engineSize;
  private final @Nullable Double horsepower;
  private final @Nullable Double torque;
  private final @Nullable Double zeroToSixty;
  private final @Nullable Double price;
  private final @Nullable Double combinedEfficiency;
  private final RecordSource source;

  private SportsRecord(Builder builder) {
    this.make = Objects.requireNonNull(builder.make, "make");
    this.model = Objects.requireNonNull(builder.model, "model");
    this.year = builder.year;
    this.engineSize = builder.engineSize;
    this.horsepower = builder.horsepower;
    this.torque = builder.torque;
    this.zeroToSixty = builder.zeroToSixty;
    this.price = builder.price;
    this.combinedEfficiency = builder.combinedEfficiency;
    this.source = builder.source;
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

  /** Engine size in liters. */
  public @Nullable Double getEngineSize() {
    return engineSize;
  }

  public @Nullable Double getHorsepower() {
    return horsepower;
  }

  /** Torque in lb-ft. */
  public @Nullable Double getTorque() {
    return torque;
  }

  /** 0-60 mph time in seconds. */
  public @Nullable Double getZeroToSixty() {
    return zeroToSixty;
  }

  /** Price in USD. */
  public @Nullable Double getPrice() {
    return price;
  }

  public boolean hasPrice() {
    return price != null;
  }

  public @Nullable Double getCombinedEfficiency() {
    return combinedEfficiency;
  }

  public RecordSource getSource() {
    return source;
  }

  public NaturalKey getNaturalKey() {
    return new NaturalKey(make, model, year);
  }

  @Override public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof SportsRecord)) {
      return false;
    }
    SportsRecord that = (SportsRecord) o;
    return year == that.year
        && make.equals(that.make)
        && model.equals(that.model)
        && Objects.equals(engineSize, that.engineSize)
        && Objects.equals(horsepower, that.horsepower)
        && Objects.equals(torque, that.torque)
        && Objects.equals(zeroToSixty, that.zeroToSixty)
        && Objects.equals(price, that.price)
        && Objects.equals(combinedEfficiency, that.combinedEfficiency)
        && source == that.source;
  }

  @Override public int hashCode() {
    return Objects.hash(make, model, year, engineSize, horsepower, torque, zeroToSixty, price,
        combinedEfficiency, source);
  }

  @Override public String toString() {
    return "SportsRecord{" + make + " " + model + " " + year
        + ", hp=" + horsepower
        + ", price=" + price
        + ", source=" + source
        + "}";
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Builder for SportsRecord. The source defaults to
   * {@link RecordSource#SPORTS_DATASET}.
   */
  public static class Builder {
    private String make;
    private String model;
    private Integer year;
    private Double engineSize;
    private Double horsepower;
    private Double torque;
    private Double zeroToSixty;
    private Double price;
    private Double combinedEfficiency;
    private RecordSource source = RecordSource.SPORTS_DATASET;

    public Builder make(String make) {
      this.make = make;
      return this;
    }

    public Builder model(String model) {
      this.model = model;
      return this;
    }

    public Builder year(int year) {
      this.year = year;
      return this;
    }

    public Builder engineSize(@Nullable Double engineSize) {
      this.engineSize = engineSize;
      return this;
    }

    public Builder horsepower(@Nullable Double horsepower) {
      this.horsepower = horsepower;
      return this;
    }

    public Builder torque(@Nullable Double torque) {
      this.torque = torque;
      return this;
    }

    public Builder zeroToSixty(@Nullable Double zeroToSixty) {
      this.zeroToSixty = zeroToSixty;
      return this;
    }

    public Builder price(@Nullable Double price) {
      this.price = price;
      return this;
    }

    public Builder combinedEfficiency(@Nullable Double combinedEfficiency) {
      this.combinedEfficiency = combinedEfficiency;
      return this;
    }

    public Builder source(RecordSource source) {
      this.source = Objects.requireNonNull(source, "source");
      return this;
    }

    public SportsRecord build() {
      if (make == null || make.isEmpty() || model == null || model.isEmpty()) {
        throw new IllegalArgumentException("make and model are required");
      }
      if (year == null) {
        throw new IllegalArgumentException("year is required for " + make + " " + model);
      }
      return new SportsRecord(this);
    }
  }
}
