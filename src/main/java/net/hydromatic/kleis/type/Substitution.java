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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableMap;
import java.util.Map;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Mapping from type variables to types.
 *
 * <p>A substitution is immutable and idempotent: no type it maps to contains
 * a variable that it binds, so applying it twice gives the same result as
 * applying it once.
 */
public class Substitution {
  /** The substitution that binds no variables. */
  public static final Substitution EMPTY = new Substitution(ImmutableMap.of());

  private final ImmutableMap<TypeVar, Type> map;

  private Substitution(ImmutableMap<TypeVar, Type> map) {
    this.map = map;
  }

  /** Creates a substitution with a single binding. */
  public static Substitution of(TypeVar typeVar, Type type) {
    return EMPTY.bind(typeVar, type);
  }

  @Override
  public int hashCode() {
    return map.hashCode();
  }

  @Override
  public boolean equals(Object obj) {
    return obj == this
        || obj instanceof Substitution && map.equals(((Substitution) obj).map);
  }

  /** Returns a string such as "[ℝ/'a, Matrix(2, 3, ℝ)/'b]". */
  @Override
  public String toString() {
    final StringBuilder buf = new StringBuilder("[");
    map.forEach(
        (typeVar, type) -> {
          if (buf.length() > 1) {
            buf.append(", ");
          }
          type.describe(buf).append('/').append(typeVar);
        });
    return buf.append(']').toString();
  }

  public boolean isEmpty() {
    return map.isEmpty();
  }

  public int size() {
    return map.size();
  }

  /** Returns the bindings, in the order they were made. */
  public Map<TypeVar, Type> asMap() {
    return map;
  }

  /** Returns the type that a variable is bound to, or null. */
  public @Nullable Type get(TypeVar typeVar) {
    return map.get(typeVar);
  }

  /** Returns whether a variable is bound. */
  public boolean binds(TypeVar typeVar) {
    return map.containsKey(typeVar);
  }

  /**
   * Applies this substitution to a type, replacing each bound variable with
   * its binding.
   *
   * <p>Call this on every type before returning it to a caller.
   */
  public Type apply(Type type) {
    if (map.isEmpty()) {
      return type;
    }
    return type.copy(
        t -> {
          final Type t2 = map.get((TypeVar) t);
          return t2 == null ? t : t2;
        });
  }

  /**
   * Returns a substitution that also binds {@code typeVar} to {@code type}.
   *
   * <p>The binding is applied to the existing bindings, so that the result is
   * idempotent. The variable must not already be bound.
   *
   * @throws TypeError if {@code typeVar} occurs in {@code type} after this
   *     substitution has been applied to it
   */
  public Substitution bind(TypeVar typeVar, Type type) {
    checkArgument(!map.containsKey(typeVar), "already bound: %s", typeVar);
    final Type type2 = apply(type);
    if (type2.contains(typeVar)) {
      throw TypeError.occursCheck(typeVar, type2);
    }
    final Substitution single =
        new Substitution(ImmutableMap.of(typeVar, type2));
    final ImmutableMap.Builder<TypeVar, Type> b =
        ImmutableMap.builderWithExpectedSize(map.size() + 1);
    map.forEach((v, t) -> b.put(v, single.apply(t)));
    b.put(typeVar, type2);
    return new Substitution(b.build());
  }

  /**
   * Composes this substitution with newer bindings.
   *
   * <p>The result has the bindings of both, and remains idempotent: the newer
   * bindings are applied to the existing ones, and the existing bindings to
   * the newer ones. If both bind a variable, the two bindings are unified.
   *
   * @throws TypeError if the bindings of a variable cannot be unified, or if
   *     a variable would occur in its own binding
   */
  public Substitution compose(Substitution newer) {
    Substitution s = this;
    for (Map.Entry<TypeVar, Type> e : newer.map.entrySet()) {
      if (s.binds(e.getKey())) {
        s = TypeUnifier.unify(e.getKey(), e.getValue(), s);
        continue;
      }
      final Type type = s.apply(e.getValue());
      if (!type.equals(e.getKey())) {
        s = s.bind(e.getKey(), type);
      }
    }
    return s;
  }
}

// End Substitution.java
