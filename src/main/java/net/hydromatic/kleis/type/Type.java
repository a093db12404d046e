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

import java.util.LinkedHashSet;
import java.util.Set;
import java.util.function.UnaryOperator;
import net.hydromatic.kleis.ast.Op;

/** Type. */
public interface Type {
  /** Type operator. */
  Op op();

  /**
   * Name of the type as shown to the user, e.g. "{@code ℝ}", "{@code
   * Matrix(2, 3, ℝ)}".
   */
  default String moniker() {
    return toString();
  }

  /**
   * Returns the {@code i}th type argument. Throws for types except {@link
   * DataType}.
   */
  default Type arg(int i) {
    throw new UnsupportedOperationException();
  }

  /**
   * Copies this type, applying a given transform to type variables, and
   * returning the original type if the component types are unchanged.
   */
  Type copy(UnaryOperator<Type> transform);

  <R> R accept(TypeVisitor<R> typeVisitor);

  /** Writes a description of this type to a builder. */
  StringBuilder describe(StringBuilder buf);

  /** Returns the type variables in this type, in order of occurrence. */
  default Set<TypeVar> typeVars() {
    final Set<TypeVar> typeVars = new LinkedHashSet<>();
    accept(
        new TypeVisitor<Void>() {
          @Override
          public Void visit(TypeVar typeVar) {
            typeVars.add(typeVar);
            return null;
          }
        });
    return typeVars;
  }

  /** Returns whether a type variable occurs in this type. */
  default boolean contains(TypeVar typeVar) {
    return typeVars().contains(typeVar);
  }

  /** Returns whether this type contains no type variables. */
  default boolean isConcrete() {
    return typeVars().isEmpty();
  }
}

// End Type.java
