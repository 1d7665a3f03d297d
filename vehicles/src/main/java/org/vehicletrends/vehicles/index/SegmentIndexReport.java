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
package org.vehicletrends.vehicles.index;

/**
 * Performance and efficiency indices per market segment.
 *
 * <p>Both series have one column per segment, each indexed to 100 at that
 * segment's own first year with data. A year in which a segment has no
 * records is null in its column.
 */
public final class SegmentIndexReport {

  private final NormalizedIndexSeries performance;
  private final NormalizedIndexSeries efficiency;

  public SegmentIndexReport(NormalizedIndexSeries performance, NormalizedIndexSeries efficiency) {
    this.performance = performance;
    this.efficiency = efficiency;
  }

  /** Mean horsepower index per segment. */
  public NormalizedIndexSeries getPerformance() {
    return performance;
  }

  /** Mean combined efficiency index per segment. */
  public NormalizedIndexSeries getEfficiency() {
    return efficiency;
  }

  @Override public String toString() {
    return "SegmentIndexReport{performance=" + performance + ", efficiency=" + efficiency + "}";
  }
}
