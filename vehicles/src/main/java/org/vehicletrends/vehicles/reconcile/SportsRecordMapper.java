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
package org.vehicletrends.vehicles.reconcile;

import org.vehicletrends.vehicles.model.RecordSource;
import org.vehicletrends.vehicles.model.SportsRecord;
import org.vehicletrends.vehicles.model.VehicleRecord;

import java.util.ArrayList;
import java.util.List;

/**
 * Maps EPA performance vehicles onto the sports schema.
 *
 * <table>
 *   <caption>Field mapping</caption>
 *   <tr><th>EPA</th><th>sports</th></tr>
 *   <tr><td>engine_displacement</td><td>engine_size</td></tr>
 *   <tr><td>horsepower_est</td><td>horsepower</td></tr>
 *   <tr><td>zero_to_sixty_est</td><td>zero_to_sixty</td></tr>
 *   <tr><td>combined_efficiency</td><td>combined_efficiency</td></tr>
 * </table>
 *
 * <p>The EPA file has no torque or price, so both are null; the source is
 * {@link RecordSource#MAINSTREAM_DERIVED}.
 */
public class SportsRecordMapper {

  public SportsRecord map(VehicleRecord record) {
    return SportsRecord.builder()
        .make(record.getMake())
        .model(record.getModel())
        .year(record.getYear())
        .engineSize(record.getEngineDisplacement())
        .horsepower(record.getHorsepowerEst())
        .zeroToSixty(record.getZeroToSixtyEst())
        .combinedEfficiency(record.getCombinedEfficiency())
        .torque(null)
        .price(null)
        .source(RecordSource.MAINSTREAM_DERIVED)
        .build();
  }

  public List<SportsRecord> mapAll(List<VehicleRecord> records) {
    List<SportsRecord> mapped = new ArrayList<SportsRecord>(records.size());
    for (VehicleRecord record : records) {
      mapped.add(map(record));
    }
    return mapped;
  }
}
