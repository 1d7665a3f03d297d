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

import org.vehicletrends.etl.CsvTableReader;
import org.vehicletrends.etl.EtlException;
import org.vehicletrends.etl.RawTable;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Runs CleanDatasetsJob over the fixture files.
 */
@Tag("integration")
public class CleanDatasetsJobTest {

  @TempDir
  Path tempDir;

  @Test void testWritesCleanedDatasetsAndTrends() throws IOException {
    Path out = tempDir.resolve("processed");
    new CleanDatasetsJob(VehicleTrendsConfig.builder().build()).run(
        VehicleTrendPipelineTest.fixture("epa-sample.csv"),
        VehicleTrendPipelineTest.fixture("sports-sample.csv"), out);

    for (String name : Arrays.asList(CleanDatasetsJob.EPA_CLEAN, CleanDatasetsJob.SPORTS_CLEAN,
        CleanDatasetsJob.EPA_YEARLY, CleanDatasetsJob.SPORTS_YEARLY, CleanDatasetsJob.FUEL_SHARE,
        CleanDatasetsJob.SEGMENT_PERFORMANCE, CleanDatasetsJob.SEGMENT_EFFICIENCY,
        CleanDatasetsJob.DATA_QUALITY)) {
      assertTrue(Files.exists(out.resolve(name)), name);
    }

    CsvTableReader reader = new CsvTableReader();
    RawTable epa = reader.read(out.resolve(CleanDatasetsJob.EPA_CLEAN));
    assertEquals(VehicleColumns.MAINSTREAM.getColumnNames(), epa.getColumns());
    assertEquals(3, epa.size());
    assertEquals("Camry", epa.getRows().get(0).get("model"));
    assertEquals("28.0", epa.getRows().get(0).get("combined_efficiency"));

    RawTable sports = reader.read(out.resolve(CleanDatasetsJob.SPORTS_CLEAN));
    assertEquals(4, sports.size());
    assertEquals("MAINSTREAM_DERIVED", sports.getRows().get(3).get("source"));

    RawTable share = reader.read(out.resolve(CleanDatasetsJob.FUEL_SHARE));
    assertEquals(Arrays.asList("year", "electric", "gas"), share.getColumns());
    assertEquals("1", share.getRows().get(1).get("electric"));

    Map<String, Object> quality = ConfigFiles.loadFile(out.resolve(CleanDatasetsJob.DATA_QUALITY));
    Map<?, ?> mainstream = (Map<?, ?>) quality.get("mainstream");
    assertEquals(8, ((Number) mainstream.get("rowsRead")).intValue());
    Map<?, ?> reconcile = (Map<?, ?>) quality.get("reconcile");
    assertEquals(1, ((Number) reconcile.get("addedFromMainstream")).intValue());
  }

  @Test void testMissingInputIsWrapped() {
    EtlException e = assertThrows(EtlException.class,
        () -> new CleanDatasetsJob(VehicleTrendsConfig.builder().build()).run(
            tempDir.resolve("missing.csv"), tempDir.resolve("missing-sports.csv"),
            tempDir.resolve("out")));
    assertTrue(e.getCause() instanceof IOException);
  }
}
