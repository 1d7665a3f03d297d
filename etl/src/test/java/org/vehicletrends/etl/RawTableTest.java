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

import com.google.common.collect.ImmutableMap;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for RawTable and RawRow.
 */
@Tag("unit")
public class RawTableTest {

  private final RawTable table = RawTable.of("epa", Arrays.asList(
      ImmutableMap.of("Make", "BMW", "Model", "M3", "Year", "2015"),
      ImmutableMap.of("Make", "Toyota", "Model", "Camry", "Year", " ")));

  @Test void testColumnsFollowFirstAppearance() {
    assertEquals(Arrays.asList("Make", "Model", "Year"), table.getColumns());
    assertEquals(2, table.size());
  }

  @Test void testBlankCellsReadAsNull() {
    assertNull(table.getRows().get(1).get("Year"));
    assertTrue(table.getRows().get(1).isBlank("Year"));
    assertFalse(table.getRows().get(0).isBlank("Year"));
  }

  @Test void testRequireColumnsListsEveryMissingColumn() {
    SchemaException e = assertThrows(SchemaException.class,
        () -> table.requireColumns("Make", "Fuel Type", "Price"));
    assertEquals(Arrays.asList("Fuel Type", "Price"), e.getMissingColumns());
    assertEquals("epa", e.getTableName());
    assertTrue(e.getMessage().contains("Fuel Type"));
  }

  @Test void testRenameColumns() {
    RawTable renamed = table.renameColumns(ImmutableMap.of("Make", "make", "Year", "year"));
    assertEquals(Arrays.asList("make", "Model", "year"), renamed.getColumns());
    assertEquals("BMW", renamed.getRows().get(0).get("make"));
    assertEquals("2015", renamed.getRows().get(0).get("year"));
    assertEquals(table.getRows().get(0).getLineNumber(),
        renamed.getRows().get(0).getLineNumber());
  }
}
