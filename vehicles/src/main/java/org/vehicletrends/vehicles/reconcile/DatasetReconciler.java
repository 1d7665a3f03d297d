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

import org.vehicletrends.vehicles.clean.AbstractRecordParser;
import org.vehicletrends.vehicles.model.NaturalKey;
import org.vehicletrends.vehicles.model.RecordSource;
import org.vehicletrends.vehicles.model.SportsRecord;
import org.vehicletrends.vehicles.model.VehicleRecord;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Merges the sports dataset with performance vehicles found in the EPA data
 * so that each (make, model, year) appears once.
 *
 * <p>When two records share a natural key the winner is chosen by
 * {@link #PREFERENCE}:
 * <ol>
 *   <li>a record with a price beats one without;</li>
 *   <li>between two priced records the higher price wins;</li>
 *   <li>a {@link RecordSource#SPORTS_DATASET} record beats a
 *       {@link RecordSource#MAINSTREAM_DERIVED} one;</li>
 *   <li>otherwise the record seen first is kept.</li>
 * </ol>
 * Sports records are seen before EPA-derived records. The output lists keys
 * in the order they were first seen. Duplicates within the sports dataset
 * itself are resolved by the same rule.
 */
public class DatasetReconciler {

  private static final Logger LOGGER = LoggerFactory.getLogger(DatasetReconciler.class);

  /**
   * Orders two records with the same key; a positive result means the first
   * is preferred. Ties return 0 and keep the incumbent.
   */
  static final Comparator<SportsRecord> PREFERENCE = (a, b) -> {
    if (a.hasPrice() != b.hasPrice()) {
      return a.hasPrice() ? 1 : -1;
    }
    if (a.hasPrice()) {
      int byPrice = Double.compare(a.getPrice(), b.getPrice());
      if (byPrice != 0) {
        return byPrice;
      }
    }
    if (a.getSource() != b.getSource()) {
      return a.getSource() == RecordSource.SPORTS_DATASET ? 1 : -1;
    }
    return 0;
  };

  private final SportsRecordMapper mapper;

  public DatasetReconciler() {
    this(new SportsRecordMapper());
  }

  public DatasetReconciler(SportsRecordMapper mapper) {
    this.mapper = mapper;
  }

  /**
   * Maps EPA performance vehicles to the sports schema and merges them into
   * the sports dataset.
   */
  public ReconcileResult merge(List<SportsRecord> sports, List<VehicleRecord> performance) {
    return reconcile(sports, mapper.mapAll(performance));
  }

  /**
   * Merges two sports-schema collections.
   *
   * @param sports Records from the sports dataset
   * @param mainstreamDerived Records mapped from EPA performance vehicles
   * @return records unique by natural key
   */
  public ReconcileResult reconcile(List<SportsRecord> sports,
      List<SportsRecord> mainstreamDerived) {
    Merge merge = new Merge();
    merge.offerAll(sports);
    int sportsKeys = merge.winners.size();
    merge.offerAll(mainstreamDerived);

    int added = merge.winners.size() - sportsKeys;
    ReconcileResult result = new ReconcileResult(
        new ArrayList<SportsRecord>(merge.winners.values()), merge.dropped, merge.duplicates,
        added);
    LOGGER.info("Reconciled {} sports and {} EPA-derived records into {} "
            + "({} added from EPA, {} duplicates resolved, {} dropped without key)",
        sports.size(), mainstreamDerived.size(), result.getRecords().size(), added,
        merge.duplicates, merge.dropped);
    return result;
  }

  /** Running state of one reconciliation. */
  private static final class Merge {
    private final Map<NaturalKey, SportsRecord> winners =
        new LinkedHashMap<NaturalKey, SportsRecord>();
    private int dropped;
    private int duplicates;

    void offerAll(List<SportsRecord> records) {
      for (SportsRecord record : records) {
        if (!hasValidKey(record)) {
          LOGGER.debug("Dropping record without a valid key: {}", record);
          dropped++;
          continue;
        }
        NaturalKey key = record.getNaturalKey();
        SportsRecord incumbent = winners.get(key);
        if (incumbent == null) {
          winners.put(key, record);
          continue;
        }
        duplicates++;
        if (PREFERENCE.compare(record, incumbent) > 0) {
          LOGGER.debug("{}: {} replaces {}", key, record, incumbent);
          winners.put(key, record);
        }
      }
    }
  }

  private static boolean hasValidKey(SportsRecord record) {
    return !record.getMake().trim().isEmpty()
        && !record.getModel().trim().isEmpty()
        && record.getYear() >= AbstractRecordParser.MIN_YEAR
        && record.getYear() <= AbstractRecordParser.MAX_YEAR;
  }
}
