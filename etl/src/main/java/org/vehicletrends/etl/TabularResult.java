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

import java.util.List;

/**
 * A rectangular result handed to the presentation layer or written to CSV.
 *
 * <p>Every row has exactly {@link #getColumnNames()}{@code .size()} cells.
 * Cells may be null where the producer defines "no data".
 */
public interface TabularResult {

  /**
   * Returns the ordered column names.
   */
  List<String> getColumnNames();

  /**
   * Returns the rows, each aligned with {@link #getColumnNames()}.
   */
  List<List<@Nullable Object>> getRows();

  /**
   * Returns the number of rows.
   */
  default int getRowCount() {
    return getRows().size();
  }

  /**
   * Returns whether the result has no rows.
   */
  default boolean isEmpty() {
    return getRows().isEmpty();
  }
}
