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
package org.vehicletrends.vehicles.clean;

import org.vehicletrends.etl.RawRow;
import org.vehicletrends.etl.Validator;
import org.vehicletrends.vehicles.model.VehicleRecord;

import com.google.common.collect.ImmutableList;

import java.util.Collections;
import java.util.List;

import static org.vehicletrends.vehicles.VehicleColumns.COMBINED_EFFICIENCY;
import static org.vehicletrends.vehicles.VehicleColumns.ENGINE_DISPLACEMENT;
import static org.vehicletrends.vehicles.VehicleColumns.FUEL_TYPE;
import static org.vehicletrends.vehicles.VehicleColumns.HORSEPOWER_EST;
import static org.vehicletrends.vehicles.VehicleColumns.MAKE;
import static org.vehicletrends.vehicles.VehicleColumns.MODEL;
import static org.vehicletrends.vehicles.VehicleColumns.TAILPIPE_EMISSIONS;
import static org.vehicletrends.vehicles.VehicleColumns.ZERO_TO_SIXTY_EST;

/**
 * Parses the EPA fuel-economy table into {@link VehicleRecord}s.
 */
public class MainstreamRecordParser extends AbstractRecordParser<VehicleRecord> {

  private static final List<String> NUMERIC_COLUMNS = ImmutableList.of(
      COMBINED_EFFICIENCY,
      TAILPIPE_EMISSIONS,
      ENGINE_DISPLACEMENT,
      HORSEPOWER_EST,
      ZERO_TO_SIXTY_EST);

  public MainstreamRecordParser() {
    this(Collections.<Validator>emptyList());
  }

  public MainstreamRecordParser(List<Validator> extraValidators) {
    super("clean-mainstream", extraValidators);
  }

  @Override protected List<String> numericColumns() {
    return NUMERIC_COLUMNS;
  }

  @Override protected VehicleRecord build(RawRow row, int year, FieldReader fields) {
    return VehicleRecord.builder()
        .make(row.get(MAKE))
        .model(row.get(MODEL))
        .year(year)
        .fuelType(fields.text(FUEL_TYPE))
        .combinedEfficiency(fields.number(COMBINED_EFFICIENCY))
        .tailpipeEmissions(fields.number(TAILPIPE_EMISSIONS))
        .engineDisplacement(fields.number(ENGINE_DISPLACEMENT))
        .horsepowerEst(fields.number(HORSEPOWER_EST))
        .zeroToSixtyEst(fields.number(ZERO_TO_SIXTY_EST))
        .build();
  }

  @Override protected boolean accept(VehicleRecord record, CleaningOptions options) {
    if (!options.isRequirePositiveEfficiency()) {
      return true;
    }
    Double efficiency = record.getCombinedEfficiency();
    return efficiency != null && efficiency > 0;
  }
}
