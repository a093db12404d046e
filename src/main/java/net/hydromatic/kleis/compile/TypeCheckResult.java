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
package net.hydromatic.kleis.compile;

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Objects;
import net.hydromatic.kleis.type.Type;
import net.hydromatic.kleis.type.TypeError;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Result of checking an expression.
 *
 * <p>There are exactly three kinds of result: {@link Success} (the type is
 * fully known), {@link Error} (the expression is not well-typed), and {@link
 * Polymorphic} (the expression is well-typed, but its type still contains a
 * type variable). Switch on {@link #outcome} to tell them apart.
 */
public abstract class TypeCheckResult {
  public final Outcome outcome;

  private TypeCheckResult(Outcome outcome) {
    this.outcome = requireNonNull(outcome);
  }

  public static Success success(Type type) {
    return new Success(type);
  }

  public static Error error(TypeError e) {
    return new Error(e.kind, e.getMessage(), e.suggestion());
  }

  public static Polymorphic polymorphic(
      Type type, List<String> availableTypes) {
    return new Polymorphic(type, availableTypes);
  }

  /** Returns whether this is a {@link Success}. */
  public boolean isSuccess() {
    return outcome == Outcome.SUCCESS;
  }

  /** Returns whether this is an {@link Error}. */
  public boolean isError() {
    return outcome == Outcome.ERROR;
  }

  /** Returns whether this is a {@link Polymorphic}. */
  public boolean isPolymorphic() {
    return outcome == Outcome.POLYMORPHIC;
  }

  /** The kinds of result. */
  public enum Outcome {
    SUCCESS,
    ERROR,
    POLYMORPHIC
  }

  /** Result of an expression whose type contains no type variables. */
  public static class Success extends TypeCheckResult {
    public final Type type;

    private Success(Type type) {
      super(Outcome.SUCCESS);
      this.type = requireNonNull(type);
    }

    @Override
    public String toString() {
      return "Success(" + type + ")";
    }

    @Override
    public int hashCode() {
      return type.hashCode();
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Success && type.equals(((Success) o).type);
    }
  }

  /** Result of an expression that is not well-typed. */
  public static class Error extends TypeCheckResult {
    public final TypeError.Kind kind;
    public final String message;
    public final @Nullable String suggestion;

    private Error(
        TypeError.Kind kind, String message, @Nullable String suggestion) {
      super(Outcome.ERROR);
      this.kind = requireNonNull(kind);
      this.message = requireNonNull(message);
      this.suggestion = suggestion;
    }

    @Override
    public String toString() {
      return suggestion == null
          ? "Error(" + kind + ": " + message + ")"
          : "Error(" + kind + ": " + message + "; " + suggestion + ")";
    }

    @Override
    public int hashCode() {
      return Objects.hash(kind, message, suggestion);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Error
              && kind == ((Error) o).kind
              && message.equals(((Error) o).message)
              && Objects.equals(suggestion, ((Error) o).suggestion);
    }
  }

  /**
   * Result of an expression that is well-typed but whose type is not yet
   * determined, such as "abs(x)" where nothing is known about "x".
   *
   * <p>This is not an error.
   */
  public static class Polymorphic extends TypeCheckResult {
    /** The type, which contains at least one type variable. */
    public final Type type;
    /**
     * Types that could make the enclosing operations well-typed, for
     * example ["ℝ", "ℂ"] for "abs(x)". May be empty.
     */
    public final List<String> availableTypes;

    private Polymorphic(Type type, List<String> availableTypes) {
      super(Outcome.POLYMORPHIC);
      this.type = requireNonNull(type);
      this.availableTypes = ImmutableList.copyOf(availableTypes);
    }

    @Override
    public String toString() {
      return "Polymorphic(" + type + ", " + availableTypes + ")";
    }

    @Override
    public int hashCode() {
      return Objects.hash(type, availableTypes);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Polymorphic
              && type.equals(((Polymorphic) o).type)
              && availableTypes.equals(((Polymorphic) o).availableTypes);
    }
  }
}

// End TypeCheckResult.java
