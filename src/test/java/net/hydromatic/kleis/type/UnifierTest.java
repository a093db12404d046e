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

import static net.hydromatic.kleis.Matchers.isDimensionMismatch;
import static org.hamcrest.CoreMatchers.instanceOf;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.sameInstance;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasToString;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import net.hydromatic.kleis.ast.Ast;
import org.junit.jupiter.api.Test;

/** Tests for {@link TypeUnifier}. */
public class UnifierTest {
  final TypeSystem typeSystem = new TypeSystem();
  final Type r = TypeSystem.SCALAR;
  final Type c = TypeSystem.COMPLEX;
  // CHECKSTYLE: IGNORE 4
  final TypeVar a = new TypeVar(0);
  final TypeVar b = new TypeVar(1);
  final TypeVar m = new TypeVar(2, Ast.TypeParam.Kind.NAT, "m");
  final TypeVar n = new TypeVar(3, Ast.TypeParam.Kind.NAT, "n");

  private Substitution unify(Type t1, Type t2) {
    return TypeUnifier.unify(t1, t2, Substitution.EMPTY);
  }

  private TypeError unifyFails(Type t1, Type t2) {
    return assertThrows(TypeError.class, () -> unify(t1, t2));
  }

  @Test
  void testVar() {
    final Substitution s = unify(a, r);
    assertThat(s, hasToString("[ℝ/'a]"));
    assertThat(unify(r, a), is(s));
    assertThat(unify(a, a).isEmpty(), is(true));
    assertThat(unify(a, b), hasToString("['b/'a]"));
  }

  @Test
  void testDataType() {
    final Type m23 = typeSystem.matrix(2, 3, r);
    assertThat(unify(m23, m23).isEmpty(), is(true));
    assertThat(
        unify(typeSystem.matrix(m, n, a), m23),
        hasToString("[2/'c, 3/'d, ℝ/'a]"));

    // Different constructors, or different numbers of arguments
    assertThat(
        unifyFails(m23, typeSystem.vector(2, r)).kind,
        is(TypeError.Kind.TYPE_MISMATCH));
    assertThat(
        unifyFails(typeSystem.dataType("Pair", r), typeSystem.dataType("Pair"))
            .kind,
        is(TypeError.Kind.TYPE_MISMATCH));
    final TypeError e = unifyFails(r, c);
    assertThat(e.getMessage(), is("type mismatch: expected ℝ, found ℂ"));
  }

  /** Dimensions unify only if they are equal. */
  @Test
  void testDimension() {
    assertThat(unify(typeSystem.nat(2), typeSystem.nat(2)).isEmpty(), is(true));
    final TypeError e = unifyFails(typeSystem.nat(2), typeSystem.nat(3));
    assertThat(e, isDimensionMismatch(2, 3));
    assertThat(e.kind, is(TypeError.Kind.DIMENSION_MISMATCH));

    final TypeError e2 =
        unifyFails(typeSystem.matrix(2, 3, r), typeSystem.matrix(4, 5, r));
    assertThat(e2, isDimensionMismatch(2, 4));

    // A dimension variable cannot stand for a type.
    assertThat(unifyFails(m, r).kind, is(TypeError.Kind.TYPE_MISMATCH));
    assertThat(unify(m, typeSystem.nat(7)), hasToString("[7/'c]"));
  }

  /** Binding a dimension variable to a type variable keeps the dimension. */
  @Test
  void testDimensionVarWithTypeVar() {
    final Substitution s = unify(m, a);
    assertThat(s.get(a), is((Type) m));
    assertThat(s.binds(m), is(false));
    final Substitution s2 = unify(a, m);
    assertThat(s2.get(a), is((Type) m));
  }

  /** Earlier bindings constrain later arguments. */
  @Test
  void testThreading() {
    final Type declared = typeSystem.dataType("Pair", a, a);
    final Substitution s =
        unify(declared, typeSystem.dataType("Pair", r, b));
    assertThat(s.apply(b), is(r));
    final TypeError e =
        unifyFails(declared, typeSystem.dataType("Pair", r, c));
    assertThat(e.kind, is(TypeError.Kind.TYPE_MISMATCH));
  }

  @Test
  void testOccursCheck() {
    final TypeError e = unifyFails(a, typeSystem.list(a));
    assertThat(e.kind, is(TypeError.Kind.OCCURS_CHECK_FAILURE));
    assertThat(
        e.getMessage(), is("occurs check failed: 'a occurs in List('a)"));
    assertThat(
        unifyFails(typeSystem.list(a), a).kind,
        is(TypeError.Kind.OCCURS_CHECK_FAILURE));
  }

  @Test
  void testFunctionAndProduct() {
    final Substitution s =
        unify(typeSystem.fnType(a, b), typeSystem.fnType(r, c));
    assertThat(s.apply(typeSystem.productType(a, b)), hasToString("ℝ × ℂ"));
    assertThat(
        unifyFails(
                typeSystem.productType(a, b), typeSystem.productType(r, r, r))
            .kind,
        is(TypeError.Kind.TYPE_MISMATCH));
    assertThat(
        unifyFails(typeSystem.fnType(r, r), typeSystem.productType(r, r))
            .kind,
        is(TypeError.Kind.TYPE_MISMATCH));
    assertThat(
        unify(PrimitiveType.BOOL, PrimitiveType.BOOL).isEmpty(), is(true));
    assertThat(
        unifyFails(PrimitiveType.BOOL, PrimitiveType.NAT).kind,
        is(TypeError.Kind.TYPE_MISMATCH));
  }

  /** Unifying in either order succeeds or fails together. */
  @Test
  void testSymmetry() {
    final List<Type> types =
        ImmutableList.of(
            a,
            r,
            c,
            typeSystem.matrix(2, 3, r),
            typeSystem.matrix(m, n, a),
            typeSystem.matrix(2, 2, b),
            typeSystem.list(a),
            typeSystem.fnType(a, r),
            typeSystem.fnType(c, b));
    for (Type t1 : types) {
      for (Type t2 : types) {
        final boolean forward = succeeds(t1, t2);
        final boolean backward = succeeds(t2, t1);
        assertThat(t1 + " vs " + t2, forward, is(backward));
        if (forward) {
          final Substitution s = unify(t1, t2);
          assertThat(s.apply(t1), is(s.apply(t2)));
        }
      }
    }
  }

  private boolean succeeds(Type t1, Type t2) {
    try {
      unify(t1, t2);
      return true;
    } catch (TypeError e) {
      return false;
    }
  }

  /** A failed unification leaves the caller's substitution unchanged. */
  @Test
  void testFailureLeavesSubstitution() {
    final Substitution s = Substitution.of(b, c);
    assertThrows(
        TypeError.class,
        () ->
            TypeUnifier.unify(
                typeSystem.dataType("Pair", a, b),
                typeSystem.dataType("Pair", r, r),
                s));
    assertThat(s, hasToString("[ℂ/'b]"));
  }

  @Test
  void testUnifyAll() {
    final Substitution s =
        TypeUnifier.unifyAll(
            ImmutableList.of(a, b),
            ImmutableList.of(r, typeSystem.list(a)),
            Substitution.EMPTY,
            new RecordingTracer());
    assertThat(s.apply(b), hasToString("List(ℝ)"));
    assertThrows(
        IllegalArgumentException.class,
        () ->
            TypeUnifier.unifyAll(
                ImmutableList.of(a),
                ImmutableList.of(),
                Substitution.EMPTY,
                new RecordingTracer()));
  }

  @Test
  void testTracer() {
    final RecordingTracer tracer = new RecordingTracer();
    TypeUnifier.unify(
        typeSystem.matrix(m, n, a),
        typeSystem.matrix(2, 3, r),
        Substitution.EMPTY,
        tracer);
    assertThat(tracer.events, hasToString("[bind 'c 2, bind 'd 3, bind 'a ℝ]"));

    final RecordingTracer tracer2 = new RecordingTracer();
    final TypeError e =
        assertThrows(
            TypeError.class,
            () ->
                TypeUnifier.unify(
                    typeSystem.matrix(2, 3, r),
                    typeSystem.matrix(4, 3, r),
                    Substitution.EMPTY,
                    tracer2));
    assertThat(e, instanceOf(DimensionMismatchError.class));
    assertThat(tracer2.events, hasToString("[conflict 2 4]"));
    assertThat(tracer2.lastError, sameInstance(e));
  }

  /** Tracer that records events. */
  private static class RecordingTracer implements TypeUnifier.Tracer {
    final List<String> events = new ArrayList<>();
    TypeError lastError;

    @Override
    public void onBind(TypeVar typeVar, Type type) {
      events.add("bind " + typeVar + " " + type);
    }

    @Override
    public void onConflict(Type left, Type right, TypeError e) {
      events.add("conflict " + left + " " + right);
      lastError = e;
    }
  }
}

// End UnifierTest.java
