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
 * One cleaned row of the EPA fuel-economy dataset.
 *
 * <p>Instances are immutable. Every measurement is optional and null when
 * the source cell was blank or unparsable.
 */
public final class VehicleRecord {

  private final String make;
  private final String model;
  private final int year;
  private final @Nullable String fuelType;
  private final @Nullable Double combinedEfficiency;
  private final @Nullable Double tailpipeEmissions;
  private final @Nullable Double engineDisplacement;
  private final @Nullable Double horsepowerEst;
  private final @Nullable Double zeroToSixtyEst;

  private VehicleRecord(Builder builder) {
    this.make = Objects.requireNonNull(builder.make, "make");
    this.model = Objects.requireNonNull(builder.model, "model");
    this.year = builder.year;
    this.fuelType = builder.fuelType;
    this.combinedEfficiency = builder.combinedEfficiency;
    this.tailpipeEmissions = builder.tailpipeEmissions;
    this.engineDisplacement = builder.engineDisplacement;
    this.horsepowerEst = builder.horsepowerEst;
    this.zeroToSixtyEst = builder.zeroToSixtyEst;
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

  /**
   * Returns the EPA fuel type label, e.g. "Regular" or "Electricity".
   */
  public @Nullable String getFuelType() {
    return fuelType;
  }

  /**
   * Returns combined miles per gallon (or MPGe for electric vehicles).
   */
  public @Nullable Double getCombinedEfficiency() {
    return combinedEfficiency;
  }

  /**
   * Returns tailpipe CO2 in grams per mile.
   */
  public @Nullable Double getTailpipeEmissions() {
    return tailpipeEmissions;
  }

  /**
   * Returns engine displacement in liters.
   */
  public @Nullable Double getEngineDisplacement() {
    return engineDisplacement;
  }

  public @Nullable Double getHorsepowerEst() {
    return horsepowerEst;
  }

  /**
   * Returns the estimated 0-60 mph time in seconds.
   */
  public @Nullable Double getZeroToSixtyEst() {
    return zeroToSixtyEst;
  }

  public NaturalKey getNaturalKey() {
    return new NaturalKey(make, model, year);
  }

  @Override public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof VehicleRecord)) {
      return false;
    }
    VehicleRecord that = (VehicleRecord) o;
    return year == that.year
        && make.equals(that.make)
        && model.equals(that.model)
        && Objects.equals(fuelType, that.fuelType)
        && Objects.equals(combinedEfficiency, that.combinedEfficiency)
        && Objects.equals(tailpipeEmissions, that.tailpipeEmissions)
        && Objects.equals(engineDisplacement, that.engineDisplacement)
        && Objects.equals(horsepowerEst, that.horsepowerEst)
        && Objects.equals(zeroToSixtyEst, that.zeroToSixtyEst);
  }

  @Override public int hashCode() {
    return Objects.hash(make, model, year, fuelType, combinedEfficiency, tailpipeEmissions,
        engineDisplacement, horsepowerEst, zeroToSixtyEst);
  }

  @Override public String toString() {
    return "VehicleRecord{" + make + " " + model + " " + year
        + ", fuelType=" + fuelType
        + ", mpg=" + combinedEfficiency
        + ", co2=" + tailpipeEmissions
        + ", displacement=" + engineDisplacement
        + ", hp=" + horsepowerEst
        + ", zeroToSixty=" + zeroToSixtyEst
        + "}";
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Builder for VehicleRecord.
   */
  public static class Builder {
    private String make;
    private String model;
    private Integer year;
    private String fuelType;
    private Double combinedEfficiency;
    private Double tailpipeEmissions;
    private Double engineDisplacement;
    private Double horsepowerEst;
    private Double zeroToSixtyEst;

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

    public Builder fuelType(@Nullable String fuelType) {
      this.fuelType = fuelType;
      return this;
    }

    public Builder combinedEfficiency(@Nullable Double combinedEfficiency) {
      this.combinedEfficiency = combinedEfficiency;
      return this;
    }

    public Builder tailpipeEmissions(@Nullable Double tailpipeEmissions) {
      this.tailpipeEmissions = tailpipeEmissions;
      return this;
    }

    public Builder engineDisplacement(@Nullable Double engineDisplacement) {
      this.engineDisplacement = engineDisplacement;
      return this;
    }

    public Builder horsepowerEst(@Nullable Double horsepowerEst) {
      this.horsepowerEst = horsepowerEst;
      return this;
    }

    public Builder zeroToSixtyEst(@Nullable Double zeroToSixtyEst) {
      this.zeroToSixtyEst = zeroToSixtyEst;
      return this;
    }

    public VehicleRecord build() {
      if (make == null || make.isEmpty() || model == null || model.isEmpty()) {
        throw new IllegalArgumentException("make and model are required");
      }
      if (year == null) {
        throw new IllegalArgumentException("year is required for " + make + " " + model);
      }
      return new VehicleRecord(this);
    }
  }
}
