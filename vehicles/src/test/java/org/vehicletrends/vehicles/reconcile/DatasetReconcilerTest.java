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

import org.vehicletrends.vehicles.model.NaturalKey;
import org.vehicletrends.vehicles.model.RecordSource;
import org.vehicletrends.vehicles.model.SportsRecord;
import org.vehicletrends.vehicles.model.VehicleRecord;

import com.google.common.collect.ImmutableList;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for DatasetReconciler and SportsRecordMapper.
 */
@Tag("unit")
public class DatasetReconcilerTest {

  private final DatasetReconciler reconciler = new DatasetReconciler();

  @Test void testMapperCopiesPerformanceFields() {
    VehicleRecord epa = VehicleRecord.builder()
        .make("Porsche").model("911 Carrera").year(2020)
        .fuelType("Premium")
        .engineDisplacement(3.0)
        .horsepowerEst(379.0)
        .zeroToSixtyEst(4.0)
        .combinedEfficiency(20.0)
        .build();

    SportsRecord mapped = new SportsRecordMapper().map(epa);

    assertEquals(new NaturalKey("Porsche", "911 Carrera", 2020), mapped.getNaturalKey());
    assertEquals(3.0, mapped.getEngineSize());
    assertEquals(379.0, mapped.getHorsepower());
    assertEquals(4.0, mapped.getZeroToSixty());
    assertEquals(20.0, mapped.getCombinedEfficiency());
    assertNull(mapped.getTorque());
    assertNull(mapped.getPrice());
    assertEquals(RecordSource.MAINSTREAM_DERIVED, mapped.getSource());
  }

  @Test void testSportsRecordBeatsDerivedRecordWithSameKey() {
    SportsRecord sportsM3 = sports("BMW", "M3", 2015, 70000.0);
    SportsRecord derivedM3 = derived("BMW", "M3", 2015);
    SportsRecord derived911 = derived("Porsche", "911", 2020);

    ReconcileResult result = reconciler.reconcile(ImmutableList.of(sportsM3),
        ImmutableList.of(derivedM3, derived911));

    assertEquals(ImmutableList.of(sportsM3, derived911), result.getRecords());
    assertEquals(1, result.getDuplicatesResolved());
    assertEquals(1, result.getAddedFromMainstream());
    assertEquals(0, result.getDroppedMissingKey());
  }

  @Test void testPricedRecordBeatsUnpricedRegardlessOfSource() {
    SportsRecord unpriced = sports("Lotus", "Evora", 2018, null);
    SportsRecord priced = sports("Lotus", "Evora", 2018, 96000.0);

    List<SportsRecord> records =
        reconciler.reconcile(ImmutableList.of(unpriced, priced), ImmutableList.of()).getRecords();

    assertEquals(1, records.size());
    assertSame(priced, records.get(0));
  }

  @Test void testHigherPriceWins() {
    SportsRecord cheaper = sports("Ferrari", "F8", 2021, 276000.0);
    SportsRecord dearer = sports("Ferrari", "F8", 2021, 300000.0);

    assertSame(dearer,
        reconciler.reconcile(ImmutableList.of(cheaper, dearer), ImmutableList.of())
            .getRecords().get(0));
    assertSame(dearer,
        reconciler.reconcile(ImmutableList.of(dearer, cheaper), ImmutableList.of())
            .getRecords().get(0));
  }

  @Test void testUnpricedSportsRecordBeatsDerivedRecord() {
    SportsRecord sportsRecord = sports("Nissan", "GT-R", 2017, null);
    SportsRecord derivedRecord = derived("Nissan", "GT-R", 2017);

    ReconcileResult result =
        reconciler.reconcile(ImmutableList.of(sportsRecord), ImmutableList.of(derivedRecord));

    assertSame(sportsRecord, result.getRecords().get(0));
    assertEquals(0, result.getAddedFromMainstream());
  }

  @Test void testFirstSeenWinsFullTie() {
    SportsRecord first = SportsRecord.builder().make("Lotus").model("Exige").year(2012)
        .horsepower(345.0).build();
    SportsRecord second = SportsRecord.builder().make("Lotus").model("Exige").year(2012)
        .horsepower(350.0).build();

    assertSame(first,
        reconciler.reconcile(ImmutableList.of(first, second), ImmutableList.of())
            .getRecords().get(0));
  }

  @Test void testRecordWithoutYearCannotBeBuilt() {
    IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
        () -> SportsRecord.builder().make("TVR").model("Griffith").build());
    assertTrue(e.getMessage().contains("year"));
    assertThrows(IllegalArgumentException.class,
        () -> VehicleRecord.builder().make("Toyota").model("Camry").build());
  }

  @Test void testRecordsWithoutValidYearAreDropped() {
    SportsRecord outOfRange = sports("TVR", "Griffith", 1850, null);

    ReconcileResult result = reconciler.reconcile(ImmutableList.of(outOfRange),
        ImmutableList.of(derived("TVR", "Griffith", 2019)));

    assertEquals(1, result.getDroppedMissingKey());
    assertEquals(1, result.getRecords().size());
    assertEquals(2019, result.getRecords().get(0).getYear());
  }

  @Test void testOutputHasUniqueKeysInFirstSeenOrder() {
    List<SportsRecord> sportsInput = ImmutableList.of(
        sports("McLaren", "720S", 2019, 299000.0),
        sports("Audi", "R8", 2019, 169900.0),
        sports("McLaren", "720S", 2019, 310000.0));
    List<SportsRecord> derivedInput = ImmutableList.of(
        derived("Chevrolet", "Corvette", 2019),
        derived("Audi", "R8", 2019),
        derived("Chevrolet", "Corvette", 2019));

    ReconcileResult result = reconciler.reconcile(sportsInput, derivedInput);

    Set<NaturalKey> keys = new HashSet<NaturalKey>();
    for (SportsRecord record : result.getRecords()) {
      assertTrue(keys.add(record.getNaturalKey()), "duplicate " + record.getNaturalKey());
    }
    assertEquals("720S", result.getRecords().get(0).getModel());
    assertEquals(310000.0, result.getRecords().get(0).getPrice());
    assertEquals("R8", result.getRecords().get(1).getModel());
    assertEquals("Corvette", result.getRecords().get(2).getModel());
    assertEquals(3, result.getDuplicatesResolved());
    assertEquals(1, result.getAddedFromMainstream());
  }

  @Test void testMergeMapsPerformanceVehicles() {
    VehicleRecord epa = VehicleRecord.builder().make("Subaru").model("WRX STI").year(2018)
        .horsepowerEst(305.0).build();

    ReconcileResult result = reconciler.merge(ImmutableList.of(), ImmutableList.of(epa));

    assertEquals(305.0, result.getRecords().get(0).getHorsepower());
    assertEquals(RecordSource.MAINSTREAM_DERIVED, result.getRecords().get(0).getSource());
  }

  private static SportsRecord sports(String make, String model, int year, Double price) {
    return SportsRecord.builder().make(make).model(model).year(year).price(price).build();
  }

  private static SportsRecord derived(String make, String model, int year) {
    return SportsRecord.builder().make(make).model(model).year(year)
        .source(RecordSource.MAINSTREAM_DERIVED).build();
  }
}
