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
package net.hydromatic.kleis.util;

import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Function;
import java.util.function.Predicate;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Utilities. */
public class Static {
  private Static() {}

  /** Returns all but the first {@code count} elements of a list. */
  public static <E> List<E> skip(List<E> list, int count) {
    return list.subList(count, list.size());
  }

  /** Returns whether a predicate is true for at least one element of a list. */
  public static <E> boolean anyMatch(
      Iterable<? extends E> iterable, Predicate<E> predicate) {
    for (E e : iterable) {
      if (predicate.test(e)) {
        return true;
      }
    }
    return false;
  }

  /**
   * Eagerly converts a Collection to an ImmutableList, applying a mapping
   * function to each element.
   */
  public static <E, T> ImmutableList<T> transformEager(
      Collection<? extends E> elements, Function<E, T> mapper) {
    if (elements.isEmpty()) {
      // Save ourselves the effort of creating a Builder.
      return ImmutableList.of();
    }

    // Optimize by making the builder the same size as the collection.
    final ImmutableList.Builder<T> b =
        ImmutableList.builderWithExpectedSize(elements.size());
    elements.forEach(e -> b.add(mapper.apply(e)));
    return b.build();
  }

  /**
   * Returns the first element that occurs more than once in a list, or null
   * if all elements are distinct.
   */
  public static <E> @Nullable E firstDuplicate(Iterable<? extends E> elements) {
    final Set<E> seen = new HashSet<>();
    for (E e : elements) {
      if (!seen.add(e)) {
        return e;
      }
    }
    return null;
  }

  /**
   * Appends a list of objects to a builder, separated by commas. Each element
   * is converted using {@link Object#toString()}.
   */
  @CanIgnoreReturnValue
  public static StringBuilder appendAll(
      StringBuilder buf, String sep, Iterable<?> elements) {
    int i = 0;
    for (Object e : elements) {
      if (i++ > 0) {
        buf.append(sep);
      }
      buf.append(e);
    }
    return buf;
  }

  /** Converts a StringBuilder to a String and clears it. */
  public static String str(StringBuilder b) {
    final String s = b.toString();
    b.setLength(0);
    return s;
  }
}

// End Static.java
