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
import org.vehicletrends.etl.LoadResult;
import org.vehicletrends.etl.RawTable;
import org.vehicletrends.vehicles.classify.MarketPartition;
import org.vehicletrends.vehicles.classify.MarketPartitioner;
import org.vehicletrends.vehicles.classify.PerformanceClassifier;
import org.vehicletrends.vehicles.clean.ColumnAliasResolver;
import org.vehicletrends.vehicles.clean.MainstreamRecordParser;
import org.vehicletrends.vehicles.clean.SportsRecordParser;
import org.vehicletrends.vehicles.model.SportsRecord;
import org.vehicletrends.vehicles.model.VehicleRecord;
import org.vehicletrends.vehicles.reconcile.DatasetReconciler;
import org.vehicletrends.vehicles.reconcile.ReconcileResult;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Cleans the EPA and sports datasets into the two collections the trend
 * queries run on.
 *
 * <p>Execution flow:
 * <ol>
 *   <li>Map raw headers onto canonical column names</li>
 *   <li>Parse both tables into typed records, normalizing numeric cells</li>
 *   <li>Split performance vehicles out of the EPA records</li>
 *   <li>Merge those performance vehicles into the sports dataset</li>
 * </ol>
 *
 * <h3>Usage Example</h3>
 * <pre>{@code
 * VehicleTrendPipeline pipeline = new VehicleTrendPipeline(VehicleTrendsConfig.load());
 * PipelineResult result = pipeline.run(Paths.get("all-vehicles-model.csv"),
 *     Paths.get("Sport car price.csv"));
 * }</pre>
 */
public class VehicleTrendPipeline {

  private static final Logger LOGGER = LoggerFactory.getLogger(VehicleTrendPipeline.class);

  /** Alias-map dataset name of the EPA table. */
  public static final String MAINSTREAM_DATASET = "mainstream";

  /** Alias-map dataset name of the sports table. */
  public static final String SPORTS_DATASET = "sports";

  private final VehicleTrendsConfig config;
  private final ColumnAliasResolver aliasResolver;
  private final MarketPartitioner partitioner;
  private final DatasetReconciler reconciler;

  public VehicleTrendPipeline(VehicleTrendsConfig config) {
    this(config, new ColumnAliasResolver());
  }

  public VehicleTrendPipeline(VehicleTrendsConfig config, ColumnAliasResolver aliasResolver) {
    this.config = config;
    this.aliasResolver = aliasResolver;
    this.partitioner = new MarketPartitioner(new PerformanceClassifier(config.getClassifier()));
    this.reconciler = new DatasetReconciler();
  }

  public VehicleTrendsConfig getConfig() {
    return config;
  }

  /**
   * Reads both CSV files and runs the pipeline.
   *
   * @throws IOException if either file cannot be read
   */
  public PipelineResult run(Path mainstreamCsv, Path sportsCsv) throws IOException {
    LOGGER.info("Reading {} and {}", mainstreamCsv, sportsCsv);
    RawTable mainstream = new CsvTableReader(config.getMainstreamSeparator()).read(mainstreamCsv);
    RawTable sports = new CsvTableReader(config.getSportsSeparator()).read(sportsCsv);
    return execute(mainstream, sports);
  }

  /**
   * Runs the pipeline over already-read tables.
   *
   * @throws org.vehicletrends.etl.SchemaException if a table lacks make,
   *     model or year
   */
  public PipelineResult execute(RawTable mainstreamTable, RawTable sportsTable) {
    long startTime = System.currentTimeMillis();
    LOGGER.info("Starting vehicle trend pipeline for {}..{}", config.getStartYear(),
        config.getEndYear());

    // Phase 1: Resolve column aliases
    LOGGER.info("Phase 1: Resolving column names");
    RawTable mainstreamCanonical = aliasResolver.resolve(mainstreamTable, MAINSTREAM_DATASET);
    RawTable sportsCanonical = aliasResolver.resolve(sportsTable, SPORTS_DATASET);

    // Phase 2: Parse typed records
    LOGGER.info("Phase 2: Cleaning {} EPA rows and {} sports rows", mainstreamCanonical.size(),
        sportsCanonical.size());
    LoadResult<VehicleRecord> mainstream =
        new MainstreamRecordParser().parse(mainstreamCanonical, config.mainstreamCleaning());
    LoadResult<SportsRecord> sports =
        new SportsRecordParser().parse(sportsCanonical, config.sportsCleaning());

    // Phase 3: Classify
    LOGGER.info("Phase 3: Classifying EPA records");
    MarketPartition partition = partitioner.partition(mainstream.getRecords());

    // Phase 4: Reconcile
    LOGGER.info("Phase 4: Merging {} performance vehicles into the sports dataset",
        partition.getPerformance().size());
    ReconcileResult reconciled =
        reconciler.merge(sports.getRecords(), partition.getPerformance());

    PipelineResult result = PipelineResult.builder()
        .mainstream(partition.getMainstream())
        .mainstreamReport(mainstream.getReport())
        .sportsReport(sports.getReport())
        .performanceReclassified(partition.getPerformance().size())
        .reconcileResult(reconciled)
        .elapsedMillis(System.currentTimeMillis() - startTime)
        .build();
    LOGGER.info("Vehicle trend pipeline complete: {} mainstream, {} sports records in {}ms",
        result.getMainstream().size(), result.getSports().size(), result.getElapsedMillis());
    return result;
  }
}
