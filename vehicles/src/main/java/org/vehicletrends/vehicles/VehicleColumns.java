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

import org.vehicletrends.etl.RecordSchema;
import org.vehicletrends.vehicles.model.SportsRecord;
import org.vehicletrends.vehicles.model.VehicleRecord;

/**
 * Canonical column names of the two cleaned datasets and their schemas.
 *
 * <p>Raw source headers ("Combined Mpg For Fuel Type1", "Car Make", ...) are
 * mapped onto these names by
 * {@link org.vehicletrends.vehicles.clean.ColumnAliasResolver}.
 */
public final class VehicleColumns {

  public static final String MAKE = "make";
  public static final String MODEL = "model";
  public static final String YEAR = "year";

  // mainstream (EPA) columns
  public static final String FUEL_TYPE = "fuel_type";
  public static final String COMBINED_EFFICIENCY = "combined_efficiency";
  public static final String TAILPIPE_EMISSIONS = "tailpipe_emissions";
  public static final String ENGINE_DISPLACEMENT = "engine_displacement";
  public static final String HORSEPOWER_EST = "horsepower_est";
  public static final String ZERO_TO_SIXTY_EST = "zero_to_sixty_est";

  // sports columns
  public static final String ENGINE_SIZE = "engine_size";
  public static final String HORSEPOWER = "horsepower";
  public static final String TORQUE = "torque";
  public static final String ZERO_TO_SIXTY = "zero_to_sixty";
  public static final String PRICE = "price";
  public static final String SOURCE = "source";

  /** Schema of cleaned EPA records. */
  public static final RecordSchema<VehicleRecord> MAINSTREAM =
      RecordSchema.<VehicleRecord>builder("mainstream")
          .text(MAKE, VehicleRecord::getMake)
          .text(MODEL, VehicleRecord::getModel)
          .integer(YEAR, VehicleRecord::getYear)
          .text(FUEL_TYPE, VehicleRecord::getFuelType)
          .numeric(COMBINED_EFFICIENCY, VehicleRecord::getCombinedEfficiency)
          .numeric(TAILPIPE_EMISSIONS, VehicleRecord::getTailpipeEmissions)
          .numeric(ENGINE_DISPLACEMENT, VehicleRecord::getEngineDisplacement)
          .numeric(HORSEPOWER_EST, VehicleRecord::getHorsepowerEst)
          .numeric(ZERO_TO_SIXTY_EST, VehicleRecord::getZeroToSixtyEst)
          .build();

  /** Schema of cleaned and merged sports records. */
  public static final RecordSchema<SportsRecord> SPORTS =
      RecordSchema.<SportsRecord>builder("sports")
          .text(MAKE, SportsRecord::getMake)
          .text(MODEL, SportsRecord::getModel)
          .integer(YEAR, SportsRecord::getYear)
          .numeric(ENGINE_SIZE, SportsRecord::getEngineSize)
          .numeric(HORSEPOWER, SportsRecord::getHorsepower)
          .numeric(TORQUE, SportsRecord::getTorque)
          .numeric(ZERO_TO_SIXTY, SportsRecord::getZeroToSixty)
          .numeric(PRICE, SportsRecord::getPrice)
          .numeric(COMBINED_EFFICIENCY, SportsRecord::getCombinedEfficiency)
          .text(SOURCE, r -> r.getSource().name())
          .build();

  private VehicleColumns() {
  }
}
