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

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.nullValue;
import static org.hamcrest.CoreMatchers.sameInstance;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasToString;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import net.hydromatic.kleis.ast.Ast;
import org.junit.jupiter.api.Test;

/** Tests for types and the type system. */
public class TypeTest {
  final TypeSystem typeSystem = new TypeSystem();

  @Test
  void testTypeVarNames() {
    assertThat(TypeVar.name(0), is("'a"));
    assertThat(TypeVar.name(1), is("'b"));
    assertThat(TypeVar.name(25), is("'z"));
    assertThat(TypeVar.name(26), is("'ba"));
    assertThat(TypeVar.name(27), is("'bb"));
    assertThat(new TypeVar(2), hasToString("'c"));

    // Equality depends on the ordinal only.
    final TypeVar m = new TypeVar(3, Ast.TypeParam.Kind.NAT, "m");
    assertThat(m.equals(new TypeVar(3)), is(true));
    assertThat(m.isNat(), is(true));
    assertThat(new TypeVar(3).isNat(), is(false));
    assertThrows(IllegalArgumentException.class, () -> new TypeVar(-1));
  }

  @Test
  void testDescribe() {
    assertThat(TypeSystem.SCALAR, hasToString("ℝ"));
    assertThat(TypeSystem.COMPLEX, hasToString("ℂ"));
    assertThat(TypeSystem.INT, hasToString("ℤ"));
    assertThat(TypeSystem.RATIONAL, hasToString("ℚ"));
    assertThat(PrimitiveType.NAT, hasToString("ℕ"));
    assertThat(
        typeSystem.matrix(2, 3, TypeSystem.SCALAR),
        hasToString("Matrix(2, 3, ℝ)"));
    assertThat(
        typeSystem.tensor(0, 2, 4, TypeSystem.SCALAR),
        hasToString("Tensor(0, 2, 4, ℝ)"));
    assertThat(
        typeSystem.vector(3, new TypeVar(0)), hasToString("Vector(3, 'a)"));
    assertThat(
        typeSystem.list(typeSystem.set(TypeSystem.INT)),
        hasToString("List(Set(ℤ))"));

    final Type r = TypeSystem.SCALAR;
    assertThat(typeSystem.fnType(r, r, r), hasToString("ℝ → ℝ → ℝ"));
    assertThat(
        typeSystem.fnType(typeSystem.fnType(r, r), r),
        hasToString("(ℝ → ℝ) → ℝ"));
    assertThat(
        typeSystem.productType(r, TypeSystem.COMPLEX), hasToString("ℝ × ℂ"));
    assertThat(
        typeSystem.productType(
            typeSystem.productType(r, r), typeSystem.fnType(r, r)),
        hasToString("(ℝ × ℝ) × (ℝ → ℝ)"));
  }

  @Test
  void testLookup() {
    assertThat(typeSystem.lookup("ℝ"), sameInstance(TypeSystem.SCALAR));
    assertThat(typeSystem.lookup("Real"), sameInstance(TypeSystem.SCALAR));
    assertThat(typeSystem.lookup("Scalar"), sameInstance(TypeSystem.SCALAR));
    assertThat(typeSystem.lookup("Integer"), sameInstance(TypeSystem.INT));
    assertThat(typeSystem.lookup("Nat"), sameInstance(PrimitiveType.NAT));
    assertThat(typeSystem.lookup("𝔹"), sameInstance(PrimitiveType.BOOL));
    assertThat(typeSystem.lookupOpt("Matrix"), nullValue());
    assertThrows(
        IllegalArgumentException.class, () -> typeSystem.lookup("Matrix"));

    // A nullary built-in constructor gives the canonical instance.
    assertThat(
        typeSystem.dataType("Complex"), sameInstance(TypeSystem.COMPLEX));
    assertThat(
        typeSystem.dataType("Complex", ImmutableList.of()),
        sameInstance(TypeSystem.COMPLEX));
  }

  @Test
  void testTypeVars() {
    final TypeVar a = new TypeVar(0);
    final TypeVar b = new TypeVar(1);
    final Type type =
        typeSystem.fnType(
            typeSystem.matrix(typeSystem.nat(2), b, a),
            typeSystem.list(a));
    assertThat(
        ImmutableList.copyOf(type.typeVars()), is(ImmutableList.of(b, a)));
    assertThat(type.contains(a), is(true));
    assertThat(type.contains(new TypeVar(2)), is(false));
    assertThat(type.isConcrete(), is(false));
    assertThat(
        typeSystem.matrix(2, 2, TypeSystem.SCALAR).isConcrete(), is(true));
  }

  @Test
  void testCopy() {
    final TypeVar a = new TypeVar(0);
    final Type matrix = typeSystem.matrix(2, 2, TypeSystem.SCALAR);
    // A type with no variables is returned unchanged.
    assertThat(matrix.copy(t -> TypeSystem.INT), sameInstance(matrix));

    final Type type = typeSystem.fnType(a, typeSystem.vector(3, a));
    assertThat(
        type.copy(t -> TypeSystem.COMPLEX), hasToString("ℂ → Vector(3, ℂ)"));
    assertThat(type.copy(t -> t), sameInstance(type));
  }

  @Test
  void testProductNeedsTwoElements() {
    assertThrows(
        IllegalArgumentException.class,
        () -> typeSystem.productType(TypeSystem.SCALAR));
  }

  @Test
  void testTypeError() {
    final TypeError e =
        TypeError.arityMismatch("plus", 2, 1)
            .withSuggestion("plus takes 2 arguments");
    assertThat(e.kind, is(TypeError.Kind.ARITY_MISMATCH));
    assertThat(
        e.describeTo(new StringBuilder()),
        hasToString(
            "Error: operation plus expects 2 arguments, found 1"
                + " (plus takes 2 arguments)"));
    assertThat(
        TypeError.unboundOperation("frobnicate", 1).getMessage(),
        is("unknown operation frobnicate with 1 argument"));
    assertThat(
        TypeError.cyclicDependency(ImmutableList.of("A", "B", "A"))
            .getMessage(),
        is("cyclic dependency between structures: A → B → A"));

    final DimensionMismatchError d =
        TypeError.dimensionMismatch(2, 4).withParameter("m", "bad m");
    assertThat(d.kind, is(TypeError.Kind.DIMENSION_MISMATCH));
    assertThat(d.parameter, is("m"));
    assertThat(d.getMessage(), is("bad m"));
    assertThat(d.withSuggestion("fix it").expected, is(2));
    assertThat(d.withSuggestion("fix it").found, is(4));
  }
}

// End TypeTest.java
