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

import static java.util.Objects.requireNonNull;

import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.List;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Error that occurs while inferring a type.
 *
 * <p>Every error has a {@link Kind}, a message, and optionally a suggestion
 * telling the user how to fix it.
 */
public class TypeError extends RuntimeException {
  public final Kind kind;
  private final @Nullable String suggestion;

  public TypeError(Kind kind, String message, @Nullable String suggestion) {
    super(message);
    this.kind = requireNonNull(kind);
    this.suggestion = suggestion;
  }

  /** Returns a human-readable remediation hint, or null. */
  public @Nullable String suggestion() {
    return suggestion;
  }

  /** Returns a copy of this error with a given suggestion. */
  public TypeError withSuggestion(@Nullable String suggestion) {
    return new TypeError(kind, getMessage(), suggestion);
  }

  /** Returns a copy of this error with a given message. */
  public TypeError withMessage(String message) {
    return new TypeError(kind, message, suggestion);
  }

  @CanIgnoreReturnValue
  public StringBuilder describeTo(StringBuilder buf) {
    buf.append("Error: ").append(getMessage());
    if (suggestion != null) {
      buf.append(" (").append(suggestion).append(')');
    }
    return buf;
  }

  /** Creates an error for two types that cannot be unified. */
  public static TypeError typeMismatch(Type expected, Type found) {
    return new TypeError(
        Kind.TYPE_MISMATCH,
        "type mismatch: expected " + expected + ", found " + found,
        null);
  }

  /** Creates an error for two dimensions that are not equal. */
  public static DimensionMismatchError dimensionMismatch(
      int expected, int found) {
    return new DimensionMismatchError(
        expected,
        found,
        null,
        "dimension mismatch: expected " + expected + ", found " + found,
        null);
  }

  /** Creates an error for a variable that would have an infinite type. */
  public static TypeError occursCheck(TypeVar typeVar, Type type) {
    return new TypeError(
        Kind.OCCURS_CHECK_FAILURE,
        "occurs check failed: " + typeVar + " occurs in " + type,
        null);
  }

  public static TypeError arityMismatch(
      String operation, int expected, int found) {
    return new TypeError(
        Kind.ARITY_MISMATCH,
        "operation " + operation + " expects " + expected
            + " argument" + (expected == 1 ? "" : "s") + ", found " + found,
        null);
  }

  /** Error when a type constructor has the wrong number of arguments. */
  public static TypeError typeArityMismatch(
      String constructor, int expected, int found) {
    return new TypeError(
        Kind.ARITY_MISMATCH,
        "type " + constructor + " expects " + expected
            + " argument" + (expected == 1 ? "" : "s") + ", found " + found,
        null);
  }

  /**
   * Error when an argument of a type constructor is a type where a dimension
   * is required, or vice versa.
   */
  public static TypeError kindMismatch(
      String constructor, int ordinal, String expected, Type found) {
    return new TypeError(
        Kind.TYPE_MISMATCH,
        "argument " + (ordinal + 1) + " of " + constructor + " must be "
            + expected + ", found " + found,
        null);
  }

  public static TypeError unboundOperation(String operation, int arity) {
    return new TypeError(
        Kind.UNBOUND_OPERATION,
        "unknown operation " + operation + " with " + arity
            + " argument" + (arity == 1 ? "" : "s"),
        null);
  }

  public static TypeError noMatchingImplementation(
      String operation, List<? extends Type> argTypes) {
    return new TypeError(
        Kind.NO_MATCHING_IMPLEMENTATION,
        "no implementation of " + operation + " for argument types "
            + argTypes,
        null);
  }

  public static TypeError unresolvedTypeParameter(
      String structureName, String paramName, String operation) {
    return new TypeError(
        Kind.UNRESOLVED_TYPE_PARAMETER,
        "cannot determine parameter " + paramName + " of structure "
            + structureName + " from call to " + operation,
        null);
  }

  public static TypeError cyclicDependency(List<String> path) {
    return new TypeError(
        Kind.CYCLIC_DEPENDENCY,
        "cyclic dependency between structures: " + String.join(" → ", path),
        null);
  }

  /** Creates an error for a name that is declared twice. */
  public static TypeError duplicateName(String what, String name) {
    return new TypeError(
        Kind.DUPLICATE_NAME, "duplicate " + what + " " + name, null);
  }

  /** Kind of type error. */
  public enum Kind {
    /** No structure declares an operation of the given name and arity. */
    UNBOUND_OPERATION,
    /** Candidates exist, but none accepts the argument types. */
    NO_MATCHING_IMPLEMENTATION,
    ARITY_MISMATCH,
    /** Two dimensions that should be equal are not. */
    DIMENSION_MISMATCH,
    TYPE_MISMATCH,
    /** A variable would be bound to a type that contains it. */
    OCCURS_CHECK_FAILURE,
    /** A parameter of a structure could not be determined at a call site. */
    UNRESOLVED_TYPE_PARAMETER,
    CYCLIC_DEPENDENCY,
    DUPLICATE_NAME
  }
}

// End TypeError.java
