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
import org.vehicletrends.vehicles.model.RecordSource;
import org.vehicletrends.vehicles.model.SportsRecord;

import com.google.common.collect.ImmutableList;

import java.util.Collections;
import java.util.List;

import static org.vehicletrends.vehicles.VehicleColumns.COMBINED_EFFICIENCY;
import static org.vehicletrends.vehicles.VehicleColumns.ENGINE_SIZE;
import static org.vehicletrends.vehicles.VehicleColumns.HORSEPOWER;
import static org.vehicletrends.vehicles.VehicleColumns.MAKE;
import static org.vehicletrends.vehicles.VehicleColumns.MODEL;
import static org.vehicletrends.vehicles.VehicleColumns.PRICE;
import static org.vehicletrends.vehicles.VehicleColumns.TORQUE;
import static org.vehicletrends.vehicles.VehicleColumns.ZERO_TO_SIXTY;

/**
 * Parses the sports-car table into {@link SportsRecord}s.
 *
 * <p>The sports file stores numbers as display text ({@code "1,500"},
 * {@code "$2,000,000"}, {@code "2.5"} with stray suffixes); every numeric
 * column goes through the field normalizer. Duplicates are not removed here;
 * see {@link org.vehicletrends.vehicles.reconcile.DatasetReconciler}.
 */
public class SportsRecordParser extends AbstractRecordParser<SportsRecord> {

  private static final List<String> NUMERIC_COLUMNS = ImmutableList.of(
      ENGINE_SIZE,
      HORSEPOWER,
      TORQUE,
      ZERO_TO_SIXTY,
      PRICE,
      COMBINED_EFFICIENCY);

  public SportsRecordParser() {
    this(Collections.<Validator>emptyList());
  }

  public SportsRecordParser(List<Validator> extraValidators) {
    super("clean-sports", extraValidators);
  }

  @Override protected List<String> numericColumns() {
    return NUMERIC_COLUMNS;
  }

  @Override protected SportsRecord build(RawRow row, int year, FieldReader fields) {
    return SportsRecord.builder()
        .make(row.get(MAKE))
        .model(row.get(MODEL))
        .year(year)
        .engineSize(fields.number(ENGINE_SIZE))
        .horsepower(fields.number(HORSEPOWER))
        .torque(fields.number(TORQUE))
        .zeroToSixty(fields.number(ZERO_TO_SIXTY))
        .price(fields.number(PRICE))
        .combinedEfficiency(fields.number(COMBINED_EFFICIENCY))
        .source(RecordSource.SPORTS_DATASET)
        .build();
  }
}
