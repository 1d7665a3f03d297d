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

import org.vehicletrends.vehicles.model.SportsRecord;

import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * Merged sports collection plus the counts of what the merge did.
 */
public final class ReconcileResult {

  private final ImmutableList<SportsRecord> records;
  private final int droppedMissingKey;
  private final int duplicatesResolved;
  private final int addedFromMainstream;

  public ReconcileResult(List<SportsRecord> records, int droppedMissingKey,
      int duplicatesResolved, int addedFromMainstream) {
    this.records = ImmutableList.copyOf(records);
    this.droppedMissingKey = droppedMissingKey;
    this.duplicatesResolved = duplicatesResolved;
    this.addedFromMainstream = addedFromMainstream;
  }

  /**
   * Returns the merged records, unique by natural key, in first-seen key
   * order.
   */
  public List<SportsRecord> getRecords() {
    return records;
  }

  /** Records dropped because they had no valid make, model or year. */
  public int getDroppedMissingKey() {
    return droppedMissingKey;
  }

  /** Records discarded because another record with the same key won. */
  public int getDuplicatesResolved() {
    return duplicatesResolved;
  }

  /** Keys that exist only in the EPA-derived input. */
  public int getAddedFromMainstream() {
    return addedFromMainstream;
  }

  @Override public String toString() {
    return "ReconcileResult{records=" + records.size()
        + ", droppedMissingKey=" + droppedMissingKey
        + ", duplicatesResolved=" + duplicatesResolved
        + ", addedFromMainstream=" + addedFromMainstream
        + "}";
  }
}
