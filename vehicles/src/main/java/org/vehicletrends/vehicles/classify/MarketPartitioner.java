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

import org.vehicletrends.vehicles.model.VehicleRecord;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Separates performance vehicles out of the EPA collection.
 */
public class MarketPartitioner {

  private static final Logger LOGGER = LoggerFactory.getLogger(MarketPartitioner.class);

  private final PerformanceClassifier classifier;

  public MarketPartitioner(PerformanceClassifier classifier) {
    this.classifier = classifier;
  }

  public MarketPartition partition(List<VehicleRecord> records) {
    List<VehicleRecord> mainstream = new ArrayList<VehicleRecord>();
    List<VehicleRecord> performance = new ArrayList<VehicleRecord>();
    for (VehicleRecord record : records) {
      if (classifier.isPerformance(record.getMake(), record.getModel())) {
        performance.add(record);
      } else {
        mainstream.add(record);
      }
    }
    LOGGER.info("Classified {} EPA records: {} mainstream, {} performance",
        records.size(), mainstream.size(), performance.size());
    return new MarketPartition(mainstream, performance);
  }
}
