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

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for ValidationResult.
 */
@Tag("unit")
public class ValidationResultTest {

  @Test void testValidResultIsShared() {
    ValidationResult result = ValidationResult.valid();
    assertSame(result, ValidationResult.valid());
    assertTrue(result.isValid());
    assertTrue(result.shouldInclude());
    assertNull(result.getMessage());
  }

  @Test void testDropExcludesButContinues() {
    ValidationResult result = ValidationResult.drop("Missing year");
    assertEquals(ValidationResult.Action.DROP, result.getAction());
    assertFalse(result.shouldInclude());
    assertTrue(result.shouldContinue());
    assertTrue(result.toString().contains("Missing year"));
  }

  @Test void testWarnIncludes() {
    ValidationResult result = ValidationResult.warn("Year outside 2011-2024");
    assertTrue(result.shouldInclude());
    assertFalse(result.isValid());
  }

  @Test void testFailStops() {
    ValidationResult result = ValidationResult.fail("Corrupt header");
    assertFalse(result.shouldContinue());
    assertFalse(result.shouldInclude());
  }

  @Test void testAndKeepsMostSevere() {
    ValidationResult warn = ValidationResult.warn("w");
    ValidationResult drop = ValidationResult.drop("d");
    ValidationResult fail = ValidationResult.fail("f");

    assertSame(warn, ValidationResult.valid().and(warn));
    assertSame(drop, warn.and(drop));
    assertSame(drop, drop.and(warn));
    assertSame(fail, drop.and(fail));
    assertSame(ValidationResult.valid(), ValidationResult.valid().and(ValidationResult.valid()));
  }
}
