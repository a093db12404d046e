/*
 * Licensed to Julian Hyde under one or more contributor license
 * agreements.  See the NOTICE file distributed with this work
 * for additional information regarding copyright ownership.
 * Julian Hyde licenses this file to you under the Apache
 * License, Version 2.0 (the "License"); you may not use this
 * file except in compliance with the License.  You may obtain a
 * copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND,
 * either express or implied.  See the License for the specific
 * language governing permissions and limitations under the
 * License.
 */
package net.hydromatic.kleis.type;

import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Error that occurs when two dimensions, such as the row counts of two
 * matrices, should be equal but are not.
 */
public class DimensionMismatchError extends TypeError {
  public final int expected;
  public final int found;
  /** Name of the structure parameter, e.g. "m", or null if not known. */
  public final @Nullable String parameter;

  public DimensionMismatchError(
      int expected,
      int found,
      @Nullable String parameter,
      String message,
      @Nullable String suggestion) {
    super(Kind.DIMENSION_MISMATCH, message, suggestion);
    this.expected = expected;
    this.found = found;
    this.parameter = parameter;
  }

  /** Returns a copy of this error that names a parameter. */
  public DimensionMismatchError withParameter(
      @Nullable String parameter, String message) {
    return new DimensionMismatchError(
        expected, found, parameter, message, suggestion());
  }

  @Override
  public DimensionMismatchError withSuggestion(@Nullable String suggestion) {
    return new DimensionMismatchError(
        expected, found, parameter, getMessage(), suggestion);
  }

  @Override
  public DimensionMismatchError withMessage(String message) {
    return new DimensionMismatchError(
        expected, found, parameter, message, suggestion());
  }
}

// End DimensionMismatchError.java
