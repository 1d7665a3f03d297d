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
package org.vehicletrends.vehicles.clean;

import org.vehicletrends.etl.EtlException;
import org.vehicletrends.etl.RawTable;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Maps source-specific column headers to canonical column names.
 *
 * <p>The EPA and sports-car files name the same concepts differently
 * ({@code "Make"} vs {@code "Car Make"}) and some headers have changed
 * between releases of the same file. The alias file lists, per dataset, the
 * headers that mean each canonical column:
 * <pre>{@code
 * {
 *   "datasets": {
 *     "sports": {
 *       "price": { "description": "Price in USD", "aliases": ["Price (in USD)"] }
 *     }
 *   }
 * }
 * }</pre>
 *
 * <p>Matching tries the exact header first, then a case-insensitive match
 * with collapsed whitespace. A header that already is a canonical name is
 * kept. Unknown headers are kept unchanged.
 */
public class ColumnAliasResolver {

  private static final Logger LOGGER = LoggerFactory.getLogger(ColumnAliasResolver.class);

  private static final ObjectMapper MAPPER = new ObjectMapper();

  /** Classpath location of the bundled alias file. */
  public static final String DEFAULT_RESOURCE = "column-aliases.json";

  /** dataset -> canonical column -> aliases. */
  private final Map<String, Map<String, List<String>>> aliases;

  /**
   * Creates a resolver from the bundled alias file.
   */
  public ColumnAliasResolver() {
    this(DEFAULT_RESOURCE);
  }

  /**
   * Creates a resolver from a classpath alias file.
   */
  public ColumnAliasResolver(String resource) {
    this(loadAliasFile(resource));
  }

  /**
   * Creates a resolver from an in-memory alias map.
   *
   * @param aliases dataset name to (canonical column to source headers)
   */
  public ColumnAliasResolver(Map<String, Map<String, List<String>>> aliases) {
    this.aliases = new LinkedHashMap<String, Map<String, List<String>>>(aliases);
  }

  private static Map<String, Map<String, List<String>>> loadAliasFile(String resource) {
    try (InputStream is = ColumnAliasResolver.class.getClassLoader()
        .getResourceAsStream(resource)) {
      if (is == null) {
        throw new IOException("Alias file not found: " + resource);
      }
      JsonNode datasets = MAPPER.readTree(is).path("datasets");
      Map<String, Map<String, List<String>>> result =
          new LinkedHashMap<String, Map<String, List<String>>>();
      Iterator<Map.Entry<String, JsonNode>> datasetIt = datasets.fields();
      while (datasetIt.hasNext()) {
        Map.Entry<String, JsonNode> dataset = datasetIt.next();
        Map<String, List<String>> columns = new LinkedHashMap<String, List<String>>();
        Iterator<Map.Entry<String, JsonNode>> columnIt = dataset.getValue().fields();
        while (columnIt.hasNext()) {
          Map.Entry<String, JsonNode> column = columnIt.next();
          List<String> names = new ArrayList<String>();
          for (JsonNode alias : column.getValue().path("aliases")) {
            names.add(alias.asText());
          }
          columns.put(column.getKey(), names);
        }
        result.put(dataset.getKey(), columns);
      }
      LOGGER.info("Loaded column aliases from {} for datasets {}", resource, result.keySet());
      return result;
    } catch (IOException e) {
      throw new EtlException("Failed to load column alias file: " + resource, e);
    }
  }

  /**
   * Renames the columns of a table to canonical names.
   *
   * @param table Raw table as read from the source file
   * @param dataset Dataset name, e.g. "mainstream" or "sports"
   * @return a table whose known headers carry canonical names
   */
  public RawTable resolve(RawTable table, String dataset) {
    Map<String, List<String>> columns = aliases.get(dataset);
    if (columns == null) {
      throw new IllegalArgumentException("No column aliases for dataset '" + dataset
          + "'; known datasets: " + aliases.keySet());
    }

    Map<String, String> renames = new HashMap<String, String>();
    Map<String, String> claimedBy = new HashMap<String, String>();
    for (String header : table.getColumns()) {
      if (columns.containsKey(header)) {
        claimedBy.put(header, header);
      }
    }
    for (String header : table.getColumns()) {
      if (columns.containsKey(header)) {
        continue;
      }
      String canonical = canonicalName(columns, header);
      if (canonical == null) {
        continue;
      }
      String previous = claimedBy.get(canonical);
      if (previous != null) {
        LOGGER.warn("Table '{}': header '{}' also maps to '{}' (already taken by '{}'); "
            + "ignoring it", table.getName(), header, canonical, previous);
        continue;
      }
      claimedBy.put(canonical, header);
      renames.put(header, canonical);
    }

    if (LOGGER.isDebugEnabled()) {
      LOGGER.debug("Table '{}' column renames: {}", table.getName(), renames);
    }
    return renames.isEmpty() ? table : table.renameColumns(renames);
  }

  private static String canonicalName(Map<String, List<String>> columns, String header) {
    for (Map.Entry<String, List<String>> entry : columns.entrySet()) {
      if (entry.getValue().contains(header)) {
        return entry.getKey();
      }
    }
    String folded = fold(header);
    for (Map.Entry<String, List<String>> entry : columns.entrySet()) {
      for (String alias : entry.getValue()) {
        if (fold(alias).equals(folded)) {
          return entry.getKey();
        }
      }
    }
    return null;
  }

  private static String fold(String header) {
    return header.trim().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
  }
}
