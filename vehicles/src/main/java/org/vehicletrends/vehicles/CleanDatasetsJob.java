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

import org.vehicletrends.etl.CsvTableWriter;
import org.vehicletrends.etl.DataQualityReport;
import org.vehicletrends.etl.EtlException;
import org.vehicletrends.etl.TabularResult;
import org.vehicletrends.vehicles.index.SegmentIndexReport;
import org.vehicletrends.vehicles.reconcile.ReconcileResult;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Batch job that cleans both datasets and writes them, together with the
 * yearly aggregates and indices, as CSV files.
 *
 * <pre>
 * CleanDatasetsJob &lt;epa.csv&gt; &lt;sports.csv&gt; &lt;output-dir&gt; [config.yaml]
 * </pre>
 *
 * <p>Files written to the output directory:
 * <ul>
 *   <li>{@code epa_clean.csv}, {@code sports_clean.csv}</li>
 *   <li>{@code epa_yearly_aggregates.csv}, {@code sports_yearly_aggregates.csv}</li>
 *   <li>{@code fuel_share.csv}</li>
 *   <li>{@code segment_performance_index.csv}, {@code segment_efficiency_index.csv}</li>
 *   <li>{@code data_quality.yaml}: row and field counts of every stage</li>
 * </ul>
 */
public class CleanDatasetsJob {

  private static final Logger LOGGER = LoggerFactory.getLogger(CleanDatasetsJob.class);

  public static final String EPA_CLEAN = "epa_clean.csv";
  public static final String SPORTS_CLEAN = "sports_clean.csv";
  public static final String EPA_YEARLY = "epa_yearly_aggregates.csv";
  public static final String SPORTS_YEARLY = "sports_yearly_aggregates.csv";
  public static final String FUEL_SHARE = "fuel_share.csv";
  public static final String SEGMENT_PERFORMANCE = "segment_performance_index.csv";
  public static final String SEGMENT_EFFICIENCY = "segment_efficiency_index.csv";
  public static final String DATA_QUALITY = "data_quality.yaml";

  private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

  private final VehicleTrendsConfig config;
  private final CsvTableWriter writer = new CsvTableWriter();

  public CleanDatasetsJob(VehicleTrendsConfig config) {
    this.config = config;
  }

  /**
   * Runs the job.
   *
   * @return the pipeline result
   * @throws EtlException if an input cannot be read or an output written
   */
  public PipelineResult run(Path epaCsv, Path sportsCsv, Path outputDir) {
    PipelineResult result;
    try {
      result = new VehicleTrendPipeline(config).run(epaCsv, sportsCsv);
    } catch (IOException e) {
      throw new EtlException("Failed to read input datasets " + epaCsv + ", " + sportsCsv, e);
    }

    TrendQueryService service = new TrendQueryService(result, config);
    TrendQuery query = TrendQuery.builder(config.getStartYear(), config.getEndYear()).build();
    SegmentIndexReport segments =
        service.segmentIndices(config.getStartYear(), config.getEndYear());

    write(VehicleColumns.MAINSTREAM.toTable(result.getMainstream()), outputDir.resolve(EPA_CLEAN));
    write(VehicleColumns.SPORTS.toTable(result.getSports()), outputDir.resolve(SPORTS_CLEAN));
    write(service.mainstreamTrends(query), outputDir.resolve(EPA_YEARLY));
    write(service.sportsTrends(query), outputDir.resolve(SPORTS_YEARLY));
    write(service.fuelShare(query), outputDir.resolve(FUEL_SHARE));
    write(segments.getPerformance(), outputDir.resolve(SEGMENT_PERFORMANCE));
    write(segments.getEfficiency(), outputDir.resolve(SEGMENT_EFFICIENCY));
    writeQuality(result, outputDir.resolve(DATA_QUALITY));
    LOGGER.info("Wrote cleaned datasets and trends to {}", outputDir);
    return result;
  }

  private void write(TabularResult table, Path path) {
    try {
      writer.write(table, path);
      LOGGER.debug("Wrote {} rows to {}", table.getRowCount(), path);
    } catch (IOException e) {
      throw new EtlException("Failed to write " + path, e);
    }
  }

  private static void writeQuality(PipelineResult result, Path path) {
    Map<String, Object> summary = new LinkedHashMap<String, Object>();
    summary.put("mainstream", quality(result.getMainstreamReport()));
    summary.put("sports", quality(result.getSportsReport()));
    ReconcileResult reconciled = result.getReconcileResult();
    Map<String, Object> merge = new LinkedHashMap<String, Object>();
    merge.put("performanceReclassified", result.getPerformanceReclassified());
    merge.put("addedFromMainstream", reconciled.getAddedFromMainstream());
    merge.put("duplicatesResolved", reconciled.getDuplicatesResolved());
    merge.put("droppedMissingKey", reconciled.getDroppedMissingKey());
    merge.put("records", reconciled.getRecords().size());
    summary.put("reconcile", merge);
    try {
      Files.createDirectories(path.toAbsolutePath().getParent());
      YAML_MAPPER.writeValue(path.toFile(), summary);
    } catch (IOException e) {
      throw new EtlException("Failed to write " + path, e);
    }
  }

  private static Map<String, Object> quality(DataQualityReport report) {
    Map<String, Object> map = new LinkedHashMap<String, Object>();
    map.put("stage", report.getStage());
    map.put("rowsRead", report.getRowsRead());
    map.put("rowsKept", report.getRowsKept());
    map.put("droppedRows", report.getDroppedRows());
    map.put("filteredRows", report.getFilteredRows());
    map.put("missingByColumn", report.getMissingByColumn());
    map.put("unparsableByColumn", report.getUnparsableByColumn());
    map.put("warnings", report.getWarnings());
    return map;
  }

  public static void main(String[] args) throws IOException {
    if (args.length < 3 || args.length > 4) {
      System.err.println(
          "Usage: CleanDatasetsJob <epa.csv> <sports.csv> <output-dir> [config.yaml]");
      System.exit(2);
    }
    VehicleTrendsConfig config = args.length == 4
        ? VehicleTrendsConfig.load(Paths.get(args[3]))
        : VehicleTrendsConfig.load();
    LOGGER.info("Using {}", config);
    PipelineResult result = new CleanDatasetsJob(config)
        .run(Paths.get(args[0]), Paths.get(args[1]), Paths.get(args[2]));
    LOGGER.info("{}", result);
  }
}
