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
package org.vehicletrends.etl;

import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * Typed records produced by one load or clean stage, with the data-quality
 * report of that stage.
 *
 * @param <T> Record type
 */
public final class LoadResult<T> {

  private final ImmutableList<T> records;
  private final DataQualityReport report;

  public LoadResult(List<T> records, DataQualityReport report) {
    this.records = ImmutableList.copyOf(records);
    this.report = report;
  }

  public List<T> getRecords() {
    return records;
  }

  public DataQualityReport getReport() {
    return report;
  }

  @Override public String toString() {
    return "LoadResult{records=" + records.size() + ", " + report + "}";
  }
}
