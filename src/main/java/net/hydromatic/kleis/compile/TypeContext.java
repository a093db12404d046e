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

import com.google.common.collect.ImmutableMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import net.hydromatic.kleis.type.Type;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Types of named objects, such as "x : ℝ".
 *
 * <p>Immutable; {@link #bind} returns a new context.
 *
 * <p>Type variables in a context are not shared with any inference session.
 * Each session that reads a context replaces them with fresh variables, so a
 * context that maps "v" to {@code Vector(n, 'a)} can be used by any number of
 * sessions.
 */
public class TypeContext {
  /** Context that binds no names. */
  public static final TypeContext EMPTY = new TypeContext(ImmutableMap.of());

  private final ImmutableMap<String, Type> map;

  private TypeContext(ImmutableMap<String, Type> map) {
    this.map = map;
  }

  /** Creates a context from a map. */
  public static TypeContext of(Map<String, ? extends Type> map) {
    return new TypeContext(ImmutableMap.copyOf(map));
  }

  /**
   * Returns a context that has the same bindings as this, plus a binding of
   * {@code name} to {@code type}, replacing any existing binding of that name.
   */
  public TypeContext bind(String name, Type type) {
    final Map<String, Type> map2 = new LinkedHashMap<>(map);
    map2.put(requireNonNull(name), requireNonNull(type));
    return new TypeContext(ImmutableMap.copyOf(map2));
  }

  /** Returns the type of a name, or null if it is not bound. */
  public @Nullable Type getOpt(String name) {
    return map.get(name);
  }

  /** Returns the bound names, in the order they were bound. */
  public Set<String> names() {
    return map.keySet();
  }

  @Override
  public String toString() {
    return map.toString();
  }
}

// End TypeContext.java
