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

/**
 * Result of validating one raw row with a {@link Validator}.
 *
 * <p>The action decides what happens to the row:
 * <ul>
 *   <li>{@link Action#VALID} - keep the row</li>
 *   <li>{@link Action#DROP} - exclude the row and count it as dropped</li>
 *   <li>{@link Action#WARN} - keep the row and log the message</li>
 *   <li>{@link Action#FAIL} - stop the load with an {@link EtlException}</li>
 * </ul>
 *
 * <h3>Usage Example</h3>
 * <pre>{@code
 * Validator yearPresent = row -> {
 *   if (row.isBlank("year")) {
 *     return ValidationResult.drop("Missing year");
 *   }
 *   return ValidationResult.valid();
 * };
 * }</pre>
 *
 * @see Validator
 */
public final class ValidationResult {

  /**
   * What to do with a row after validation.
   */
  public enum Action {
    /** Row is valid. */
    VALID,
    /** Row is excluded from the output. */
    DROP,
    /** Row is kept but a warning is logged. */
    WARN,
    /** The whole load fails. */
    FAIL
  }

  private static final ValidationResult VALID_RESULT = new ValidationResult(Action.VALID, null);

  private final Action action;
  private final @Nullable String message;

  private ValidationResult(Action action, @Nullable String message) {
    this.action = action;
    this.message = message;
  }

  public static ValidationResult valid() {
    return VALID_RESULT;
  }

  public static ValidationResult drop(@Nullable String message) {
    return new ValidationResult(Action.DROP, message);
  }

  public static ValidationResult warn(@Nullable String message) {
    return new ValidationResult(Action.WARN, message);
  }

  public static ValidationResult fail(@Nullable String message) {
    return new ValidationResult(Action.FAIL, message);
  }

  public Action getAction() {
    return action;
  }

  /**
   * Returns the validation message, or null for valid results.
   */
  public @Nullable String getMessage() {
    return message;
  }

  public boolean isValid() {
    return action == Action.VALID;
  }

  /**
   * Returns whether loading may continue after this result.
   */
  public boolean shouldContinue() {
    return action != Action.FAIL;
  }

  /**
   * Returns whether the row belongs in the output.
   */
  public boolean shouldInclude() {
    return action == Action.VALID || action == Action.WARN;
  }

  /**
   * Combines two results, keeping the more severe one.
   * Severity order is VALID, WARN, DROP, FAIL.
   */
  public ValidationResult and(ValidationResult other) {
    return severity(other.action) > severity(action) ? other : this;
  }

  private static int severity(Action action) {
    switch (action) {
      case WARN:
        return 1;
      case DROP:
        return 2;
      case FAIL:
        return 3;
      default:
        return 0;
    }
  }

  @Override public String toString() {
    if (action == Action.VALID) {
      return "ValidationResult{VALID}";
    }
    return "ValidationResult{" + action + ", message='" + message + "'}";
  }
}
