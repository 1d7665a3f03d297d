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

import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * A mainstream collection split into mainstream and performance vehicles.
 * Both lists keep the input order.
 */
public final class MarketPartition {

  private final ImmutableList<VehicleRecord> mainstream;
  private final ImmutableList<VehicleRecord> performance;

  public MarketPartition(List<VehicleRecord> mainstream, List<VehicleRecord> performance) {
    this.mainstream = ImmutableList.copyOf(mainstream);
    this.performance = ImmutableList.copyOf(performance);
  }

  public List<VehicleRecord> getMainstream() {
    return mainstream;
  }

  public List<VehicleRecord> getPerformance() {
    return performance;
  }

  @Override public String toString() {
    return "MarketPartition{mainstream=" + mainstream.size()
        + ", performance=" + performance.size() + "}";
  }
}
