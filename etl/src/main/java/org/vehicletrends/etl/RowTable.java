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

import com.google.common.collect.ImmutableList;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Plain immutable {@link TabularResult} backed by row lists.
 *
 * <p>Cells may be null, so rows are copied into unmodifiable lists rather
 * than Guava immutable lists.
 */
public final class RowTable implements TabularResult {

  private final ImmutableList<String> columnNames;
  private final List<List<@Nullable Object>> rows;

  public RowTable(List<String> columnNames, List<? extends List<?>> rows) {
    this.columnNames = ImmutableList.copyOf(columnNames);
    List<List<@Nullable Object>> copy = new ArrayList<List<@Nullable Object>>(rows.size());
    for (List<?> row : rows) {
      if (row.size() != columnNames.size()) {
        throw new IllegalArgumentException("Row has " + row.size() + " cells but table has "
            + columnNames.size() + " columns: " + row);
      }
      copy.add(Collections.unmodifiableList(new ArrayList<Object>(row)));
    }
    this.rows = Collections.unmodifiableList(copy);
  }

  @Override public List<String> getColumnNames() {
    return columnNames;
  }

  @Override public List<List<@Nullable Object>> getRows() {
    return rows;
  }

  @Override public String toString() {
    return "RowTable{columns=" + columnNames + ", rows=" + rows.size() + "}";
  }
}
