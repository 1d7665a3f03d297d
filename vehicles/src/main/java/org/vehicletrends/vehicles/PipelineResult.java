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

import org.vehicletrends.etl.DataQualityReport;
import org.vehicletrends.vehicles.model.SportsRecord;
import org.vehicletrends.vehicles.model.VehicleRecord;
import org.vehicletrends.vehicles.reconcile.ReconcileResult;

import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * Clean collections produced by {@link VehicleTrendPipeline}, with the data
 * quality of each stage.
 */
public final class PipelineResult {

  private final ImmutableList<VehicleRecord> mainstream;
  private final ImmutableList<SportsRecord> sports;
  private final DataQualityReport mainstreamReport;
  private final DataQualityReport sportsReport;
  private final int performanceReclassified;
  private final ReconcileResult reconcileResult;
  private final long elapsedMillis;

  private PipelineResult(Builder builder) {
    this.mainstream = ImmutableList.copyOf(builder.mainstream);
    this.sports = ImmutableList.copyOf(builder.reconcileResult.getRecords());
    this.mainstreamReport = builder.mainstreamReport;
    this.sportsReport = builder.sportsReport;
    this.performanceReclassified = builder.performanceReclassified;
    this.reconcileResult = builder.reconcileResult;
    this.elapsedMillis = builder.elapsedMillis;
  }

  /**
   * Returns EPA records with performance vehicles removed.
   */
  public List<VehicleRecord> getMainstream() {
    return mainstream;
  }

  /**
   * Returns the sports dataset merged with EPA performance vehicles.
   */
  public List<SportsRecord> getSports() {
    return sports;
  }

  public DataQualityReport getMainstreamReport() {
    return mainstreamReport;
  }

  public DataQualityReport getSportsReport() {
    return sportsReport;
  }

  /**
   * Returns how many EPA records were classified as performance vehicles.
   */
  public int getPerformanceReclassified() {
    return performanceReclassified;
  }

  public ReconcileResult getReconcileResult() {
    return reconcileResult;
  }

  public long getElapsedMillis() {
    return elapsedMillis;
  }

  @Override public String toString() {
    return "PipelineResult{"
        + "mainstream=" + mainstream.size()
        + ", sports=" + sports.size()
        + ", performanceReclassified=" + performanceReclassified
        + ", " + reconcileResult
        + ", elapsed=" + elapsedMillis + "ms"
        + "}";
  }

  static Builder builder() {
    return new Builder();
  }

  /**
   * Builder for PipelineResult.
   */
  static class Builder {
    private List<VehicleRecord> mainstream = ImmutableList.of();
    private DataQualityReport mainstreamReport;
    private DataQualityReport sportsReport;
    private int performanceReclassified;
    private ReconcileResult reconcileResult;
    private long elapsedMillis;

    Builder mainstream(List<VehicleRecord> mainstream) {
      this.mainstream = mainstream;
      return this;
    }

    Builder mainstreamReport(DataQualityReport mainstreamReport) {
      this.mainstreamReport = mainstreamReport;
      return this;
    }

    Builder sportsReport(DataQualityReport sportsReport) {
      this.sportsReport = sportsReport;
      return this;
    }

    Builder performanceReclassified(int performanceReclassified) {
      this.performanceReclassified = performanceReclassified;
      return this;
    }

    Builder reconcileResult(ReconcileResult reconcileResult) {
      this.reconcileResult = reconcileResult;
      return this;
    }

    Builder elapsedMillis(long elapsedMillis) {
      this.elapsedMillis = elapsedMillis;
      return this;
    }

    PipelineResult build() {
      return new PipelineResult(this);
    }
  }
}
