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

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Converts loosely formatted numeric text into doubles.
 *
 * <p>Source datasets carry numbers such as {@code "$1,234 or more"},
 * {@code "12,345.6 USD"} or {@code "3.5L"}. Normalization:
 * <ol>
 *   <li>remove thousands separators and currency symbols</li>
 *   <li>take the first maximal run of digits with at most one decimal point</li>
 *   <li>parse it as a double</li>
 * </ol>
 *
 * <p>A value without any digits is <em>missing</em>, reported as
 * {@link Optional#empty()}; it is never turned into zero and never throws.
 * Signs are not part of the extracted run, so {@code "-5"} parses as 5.
 */
public final class NumericFieldParser {

  private static final Logger LOGGER = LoggerFactory.getLogger(NumericFieldParser.class);

  private static final Pattern SEPARATORS_AND_CURRENCY = Pattern.compile("[,$€£]");
  private static final Pattern NUMBER = Pattern.compile("\\d+(?:\\.\\d*)?|\\.\\d+");

  /**
   * Classification of one raw value.
   */
  public enum Status {
    /** A number was extracted. */
    PARSED,
    /** The value was null or blank. */
    MISSING,
    /** The value was present but held no number. */
    UNPARSABLE
  }

  /**
   * Outcome of normalizing one value.
   */
  public static final class Outcome {
    private static final Outcome MISSING = new Outcome(Status.MISSING, null);
    private static final Outcome UNPARSABLE = new Outcome(Status.UNPARSABLE, null);

    private final Status status;
    private final @Nullable Double value;

    private Outcome(Status status, @Nullable Double value) {
      this.status = status;
      this.value = value;
    }

    public Status getStatus() {
      return status;
    }

    public Optional<Double> getValue() {
      return Optional.ofNullable(value);
    }

    @Override public String toString() {
      return status == Status.PARSED ? "PARSED(" + value + ")" : status.name();
    }
  }

  private NumericFieldParser() {
  }

  /**
   * Normalizes a value, returning empty when no number can be extracted.
   *
   * @param raw A string, a {@link Number}, or null
   */
  public static Optional<Double> parse(@Nullable Object raw) {
    return classify(raw).getValue();
  }

  /**
   * Normalizes a value and reports why it did or did not yield a number.
   */
  public static Outcome classify(@Nullable Object raw) {
    if (raw == null) {
      return Outcome.MISSING;
    }
    if (raw instanceof Number) {
      double d = ((Number) raw).doubleValue();
      if (Double.isNaN(d) || Double.isInfinite(d)) {
        return Outcome.MISSING;
      }
      return new Outcome(Status.PARSED, d);
    }
    String text = raw.toString().trim();
    if (text.isEmpty()) {
      return Outcome.MISSING;
    }
    String stripped = SEPARATORS_AND_CURRENCY.matcher(text).replaceAll("");
    Matcher matcher = NUMBER.matcher(stripped);
    if (!matcher.find()) {
      return Outcome.UNPARSABLE;
    }
    try {
      return new Outcome(Status.PARSED, Double.parseDouble(matcher.group()));
    } catch (NumberFormatException e) {
      // NUMBER only matches digit runs, so this means an absurdly long literal
      LOGGER.debug("Could not parse numeric text '{}': {}", text, e.getMessage());
      return Outcome.UNPARSABLE;
    }
  }

  /**
   * Normalizes one cell of a row and records the outcome in a report.
   *
   * @param row Source row
   * @param column Column to read
   * @param report Accumulator for missing and unparsable counts
   * @return the number, or null if missing or unparsable
   */
  public static @Nullable Double parseField(RawRow row, String column,
      DataQualityReport.Builder report) {
    Outcome outcome = classify(row.get(column));
    switch (outcome.getStatus()) {
      case PARSED:
        return outcome.value;
      case UNPARSABLE:
        LOGGER.debug("Line {}: unparsable {} value '{}'", row.getLineNumber(), column,
            row.get(column));
        report.unparsable(column);
        return null;
      default:
        report.missing(column);
        return null;
    }
  }

  /**
   * Normalizes every cell of one column.
   *
   * <p>A column the table does not have yields a null for every row and
   * adds nothing to the report.
   *
   * @return one value per row, null where missing or unparsable
   */
  public static List<@Nullable Double> parseColumn(RawTable table, String column,
      DataQualityReport.Builder report) {
    List<@Nullable Double> values = new ArrayList<@Nullable Double>(table.size());
    boolean present = table.hasColumn(column);
    if (!present) {
      LOGGER.debug("Table '{}' has no '{}' column; skipping it", table.getName(), column);
    }
    for (RawRow row : table.getRows()) {
      values.add(present ? parseField(row, column, report) : null);
    }
    return values;
  }

  /**
   * Returns the subset of {@code columns} present in the table.
   *
   * <p>Some source files lack some optional columns; those are skipped
   * rather than treated as an error, and every cell is left null.
   */
  public static List<String> presentColumns(RawTable table, Collection<String> columns) {
    List<String> present = new ArrayList<String>();
    for (String column : columns) {
      if (table.hasColumn(column)) {
        present.add(column);
      } else {
        LOGGER.debug("Table '{}' has no '{}' column; skipping it", table.getName(), column);
      }
    }
    return present;
  }
}
