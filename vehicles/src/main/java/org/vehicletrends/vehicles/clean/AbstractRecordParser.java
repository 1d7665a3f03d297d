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

import org.vehicletrends.etl.DataQualityReport;
import org.vehicletrends.etl.EtlException;
import org.vehicletrends.etl.LoadResult;
import org.vehicletrends.etl.NumericFieldParser;
import org.vehicletrends.etl.RawRow;
import org.vehicletrends.etl.RawTable;
import org.vehicletrends.etl.ValidationResult;
import org.vehicletrends.etl.Validator;

import com.google.common.collect.ImmutableList;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import static org.vehicletrends.vehicles.VehicleColumns.MAKE;
import static org.vehicletrends.vehicles.VehicleColumns.MODEL;
import static org.vehicletrends.vehicles.VehicleColumns.YEAR;

/**
 * Base class for turning a canonical-named {@link RawTable} into typed
 * records.
 *
 * <p>Every parser follows the same steps for each row:
 * <ol>
 *   <li>validate: rows without make, model or a usable year are dropped</li>
 *   <li>filter: rows outside the configured year range are skipped</li>
 *   <li>build: numeric cells are normalized; blank and unparsable cells
 *       become null and are counted</li>
 *   <li>accept: subclass-specific filters on the built record</li>
 * </ol>
 *
 * <p>Optional columns that the table lacks entirely are skipped; a missing
 * {@code make}, {@code model} or {@code year} column fails the whole load
 * with a {@link org.vehicletrends.etl.SchemaException}.
 *
 * @param <T> Record type
 */
public abstract class AbstractRecordParser<T> {

  private static final Logger LOGGER = LoggerFactory.getLogger(AbstractRecordParser.class);

  /** Lowest model year accepted as valid data. */
  public static final int MIN_YEAR = 1900;

  /** Highest model year accepted as valid data. */
  public static final int MAX_YEAR = 2100;

  private static final Validator KEY_PRESENT = row -> {
    if (row.isBlank(MAKE) || row.isBlank(MODEL)) {
      return ValidationResult.drop("Missing make or model");
    }
    return ValidationResult.valid();
  };

  private static final Validator YEAR_VALID = row -> {
    if (row.isBlank(YEAR)) {
      return ValidationResult.drop("Missing year");
    }
    if (parseYear(row.get(YEAR)) == null) {
      return ValidationResult.drop("Invalid year '" + row.get(YEAR) + "'");
    }
    return ValidationResult.valid();
  };

  private final String stage;
  private final ImmutableList<Validator> validators;

  protected AbstractRecordParser(String stage, List<Validator> extraValidators) {
    this.stage = stage;
    this.validators = ImmutableList.<Validator>builder()
        .add(KEY_PRESENT)
        .add(YEAR_VALID)
        .addAll(extraValidators)
        .build();
  }

  /**
   * Returns the numeric columns this parser reads, in canonical names.
   */
  protected abstract List<String> numericColumns();

  /**
   * Builds a record from a validated row.
   *
   * @param row Validated row
   * @param year Parsed model year
   * @param fields Reader for numeric cells that tracks data quality
   */
  protected abstract T build(RawRow row, int year, FieldReader fields);

  /**
   * Returns whether a built record passes the subclass filters.
   */
  protected boolean accept(T record, CleaningOptions options) {
    return true;
  }

  /**
   * Parses all rows of a table.
   *
   * @param table Table with canonical column names
   * @param options Row filters
   * @return the records and the data-quality report of this stage
   * @throws org.vehicletrends.etl.SchemaException if make, model or year
   *     columns are absent
   * @throws EtlException if a validator fails the load
   */
  public LoadResult<T> parse(RawTable table, CleaningOptions options) {
    table.requireColumns(MAKE, MODEL, YEAR);
    DataQualityReport.Builder report = DataQualityReport.builder(stage);
    FieldReader fields = new FieldReader(table, numericColumns(), report);

    List<T> records = new ArrayList<T>();
    for (RawRow row : table.getRows()) {
      report.rowRead();
      ValidationResult result = validate(row);
      switch (result.getAction()) {
        case FAIL:
          throw new EtlException("Table '" + table.getName() + "' line " + row.getLineNumber()
              + ": " + result.getMessage());
        case DROP:
          LOGGER.debug("{}: dropping line {}: {}", stage, row.getLineNumber(),
              result.getMessage());
          report.rowDropped();
          continue;
        case WARN:
          LOGGER.warn("{}: line {}: {}", stage, row.getLineNumber(), result.getMessage());
          report.warning("line " + row.getLineNumber() + ": " + result.getMessage());
          break;
        default:
          break;
      }

      int year = parseYear(row.get(YEAR));
      if (!options.acceptsYear(year)) {
        report.rowFiltered();
        continue;
      }
      T record = build(row, year, fields.at(row));
      if (!accept(record, options)) {
        report.rowFiltered();
        continue;
      }
      records.add(record);
      report.rowKept();
    }

    DataQualityReport built = report.build();
    LOGGER.info("{}: kept {} of {} rows ({} dropped, {} filtered, {} missing or unparsable fields)",
        stage, built.getRowsKept(), built.getRowsRead(), built.getDroppedRows(),
        built.getFilteredRows(), built.getTotalMissingFields());
    return new LoadResult<T>(records, built);
  }

  private ValidationResult validate(RawRow row) {
    ValidationResult result = ValidationResult.valid();
    for (Validator validator : validators) {
      result = result.and(validator.validate(row));
      if (!result.shouldInclude()) {
        break;
      }
    }
    return result;
  }

  /**
   * Parses a model year such as "2015" or "2015.0".
   *
   * @return the year, or null if absent, fractional, or outside
   *     [{@link #MIN_YEAR}, {@link #MAX_YEAR}]
   */
  static @Nullable Integer parseYear(@Nullable String raw) {
    Optional<Double> value = NumericFieldParser.parse(raw);
    if (!value.isPresent()) {
      return null;
    }
    double year = value.get();
    if (year != Math.rint(year) || year < MIN_YEAR || year > MAX_YEAR) {
      return null;
    }
    return (int) year;
  }

  /**
   * Reads numeric and text cells of one row, skipping columns the table
   * lacks and counting blank or unparsable cells.
   */
  protected static final class FieldReader {
    private final RawTable table;
    private final Set<String> presentNumeric;
    private final DataQualityReport.Builder report;
    private RawRow row;

    FieldReader(RawTable table, List<String> numericColumns, DataQualityReport.Builder report) {
      this.table = table;
      this.presentNumeric =
          new HashSet<String>(NumericFieldParser.presentColumns(table, numericColumns));
      this.report = report;
    }

    FieldReader at(RawRow row) {
      this.row = row;
      return this;
    }

    /**
     * Returns the normalized number in a column, or null.
     */
    public @Nullable Double number(String column) {
      if (!presentNumeric.contains(column)) {
        return null;
      }
      return NumericFieldParser.parseField(row, column, report);
    }

    /**
     * Returns the trimmed text in a column, or null.
     */
    public @Nullable String text(String column) {
      if (!table.hasColumn(column)) {
        return null;
      }
      String value = row.get(column);
      if (value == null) {
        report.missing(column);
      }
      return value;
    }
  }
}
