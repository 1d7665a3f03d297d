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
import com.google.common.collect.ImmutableMap;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Summary of the data-quality issues absorbed by one pipeline stage.
 *
 * <p>Record-level problems never raise exceptions. They are counted here:
 * <ul>
 *   <li>missing values - optional cells that were blank</li>
 *   <li>unparsable values - non-blank cells that did not yield a number;
 *       these are treated as missing for the record</li>
 *   <li>dropped rows - rows excluded by validation (e.g. no year)</li>
 * </ul>
 *
 * <p>Rows excluded by a query predicate such as the year range are counted
 * separately as filtered rows; they are not a quality problem.
 */
public final class DataQualityReport {

  private final String stage;
  private final long rowsRead;
  private final long rowsKept;
  private final long droppedRows;
  private final long filteredRows;
  private final ImmutableMap<String, Long> missingByColumn;
  private final ImmutableMap<String, Long> unparsableByColumn;
  private final ImmutableList<String> warnings;

  private DataQualityReport(Builder builder) {
    this.stage = builder.stage;
    this.rowsRead = builder.rowsRead;
    this.rowsKept = builder.rowsKept;
    this.droppedRows = builder.droppedRows;
    this.filteredRows = builder.filteredRows;
    this.missingByColumn = ImmutableMap.copyOf(builder.missingByColumn);
    this.unparsableByColumn = ImmutableMap.copyOf(builder.unparsableByColumn);
    this.warnings = ImmutableList.copyOf(builder.warnings);
  }

  public String getStage() {
    return stage;
  }

  public long getRowsRead() {
    return rowsRead;
  }

  public long getRowsKept() {
    return rowsKept;
  }

  public long getDroppedRows() {
    return droppedRows;
  }

  public long getFilteredRows() {
    return filteredRows;
  }

  /**
   * Returns blank-cell counts per column, sorted by column name.
   */
  public Map<String, Long> getMissingByColumn() {
    return missingByColumn;
  }

  /**
   * Returns unparsable-cell counts per column, sorted by column name.
   */
  public Map<String, Long> getUnparsableByColumn() {
    return unparsableByColumn;
  }

  public long getMissingCount(String column) {
    return missingByColumn.getOrDefault(column, 0L);
  }

  public long getUnparsableCount(String column) {
    return unparsableByColumn.getOrDefault(column, 0L);
  }

  /**
   * Returns the total of missing and unparsable cells over all columns.
   * Unparsable cells count as missing for the record that carries them.
   */
  public long getTotalMissingFields() {
    long total = 0;
    for (long count : missingByColumn.values()) {
      total += count;
    }
    for (long count : unparsableByColumn.values()) {
      total += count;
    }
    return total;
  }

  public List<String> getWarnings() {
    return warnings;
  }

  @Override public String toString() {
    return "DataQualityReport{stage='" + stage + "'"
        + ", read=" + rowsRead
        + ", kept=" + rowsKept
        + ", dropped=" + droppedRows
        + ", filtered=" + filteredRows
        + ", missing=" + missingByColumn
        + ", unparsable=" + unparsableByColumn
        + "}";
  }

  public static Builder builder(String stage) {
    return new Builder(stage);
  }

  /**
   * Mutable accumulator used while a stage runs.
   */
  public static class Builder {
    private final String stage;
    private long rowsRead;
    private long rowsKept;
    private long droppedRows;
    private long filteredRows;
    private final Map<String, Long> missingByColumn = new TreeMap<String, Long>();
    private final Map<String, Long> unparsableByColumn = new TreeMap<String, Long>();
    private final List<String> warnings = new ArrayList<String>();

    private Builder(String stage) {
      this.stage = stage;
    }

    public Builder rowRead() {
      rowsRead++;
      return this;
    }

    public Builder rowKept() {
      rowsKept++;
      return this;
    }

    public Builder rowDropped() {
      droppedRows++;
      return this;
    }

    public Builder rowFiltered() {
      filteredRows++;
      return this;
    }

    public Builder missing(String column) {
      missingByColumn.merge(column, 1L, Long::sum);
      return this;
    }

    public Builder unparsable(String column) {
      unparsableByColumn.merge(column, 1L, Long::sum);
      return this;
    }

    public Builder warning(String message) {
      warnings.add(message);
      return this;
    }

    public DataQualityReport build() {
      return new DataQualityReport(this);
    }
  }
}
