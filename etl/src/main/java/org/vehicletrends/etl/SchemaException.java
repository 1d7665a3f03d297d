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

import java.util.List;

/**
 * Thrown when an input table or a request is structurally unanswerable
 * because one or more columns are wholly absent.
 *
 * <p>Examples: a mainstream table without a {@code year} column, or an
 * aggregation asking for a {@code price} metric over mainstream records.
 */
public class SchemaException extends EtlException {

  private final String tableName;
  private final ImmutableList<String> missingColumns;

  public SchemaException(String tableName, List<String> missingColumns) {
    super("Table '" + tableName + "' is missing required columns: " + missingColumns);
    this.tableName = tableName;
    this.missingColumns = ImmutableList.copyOf(missingColumns);
  }

  /** Returns the name of the table or schema that was checked. */
  public String getTableName() {
    return tableName;
  }

  /** Returns the columns that were requested but not found. */
  public List<String> getMissingColumns() {
    return missingColumns;
  }
}
