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
import java.util.List;
import org.junit.jupiter.api.Test;

/** Tests for {@link Substitution}. */
public class SubstitutionTest {
  final TypeSystem typeSystem = new TypeSystem();
  // CHECKSTYLE: IGNORE 3
  final TypeVar a = new TypeVar(0);
  final TypeVar b = new TypeVar(1);
  final TypeVar c = new TypeVar(2);

  @Test
  void testEmpty() {
    final Type type = typeSystem.list(a);
    assertThat(Substitution.EMPTY.apply(type), sameInstance(type));
    assertThat(Substitution.EMPTY.isEmpty(), is(true));
    assertThat(Substitution.EMPTY, hasToString("[]"));
    assertThat(Substitution.EMPTY.get(a), nullValue());
  }

  /** A new binding is applied to the existing bindings. */
  @Test
  void testBindClosesExistingBindings() {
    final Substitution s =
        Substitution.of(a, typeSystem.list(b)).bind(b, TypeSystem.SCALAR);
    assertThat(s, hasToString("[List(ℝ)/'a, ℝ/'b]"));
    assertThat(s.size(), is(2));
    assertThat(s.apply(typeSystem.fnType(a, b)), hasToString("List(ℝ) → ℝ"));
  }

  /** Existing bindings are applied to a new binding. */
  @Test
  void testBindAppliesExistingBindings() {
    final Substitution s =
        Substitution.of(b, TypeSystem.INT).bind(a, typeSystem.set(b));
    assertThat(s.get(a), hasToString("Set(ℤ)"));
  }

  @Test
  void testBindPreconditions() {
    final Substitution s = Substitution.of(a, TypeSystem.SCALAR);
    assertThrows(
        IllegalArgumentException.class, () -> s.bind(a, TypeSystem.INT));
    final TypeError e =
        assertThrows(
            TypeError.class, () -> Substitution.of(b, typeSystem.list(b)));
    assertThat(e.kind, is(TypeError.Kind.OCCURS_CHECK_FAILURE));
    assertThat(
        e.getMessage(), is("occurs check failed: 'b occurs in List('b)"));
    // 'c is not bound, but becomes List('c) once 'b is applied
    final Substitution s2 = Substitution.of(b, typeSystem.list(c));
    final TypeError e2 = assertThrows(TypeError.class, () -> s2.bind(c, b));
    assertThat(e2.kind, is(TypeError.Kind.OCCURS_CHECK_FAILURE));
  }

  /** Applying a substitution twice is the same as applying it once. */
  @Test
  void testIdempotent() {
    final Substitution s =
        Substitution.EMPTY
            .bind(a, typeSystem.vector(3, b))
            .bind(b, typeSystem.dataType("Pair", c, TypeSystem.COMPLEX))
            .bind(c, TypeSystem.RATIONAL);
    final List<Type> types =
        ImmutableList.of(
            a,
            b,
            c,
            new TypeVar(3),
            typeSystem.fnType(a, typeSystem.productType(b, c)),
            typeSystem.matrix(typeSystem.nat(2), typeSystem.nat(2), a));
    for (Type type : types) {
      final Type once = s.apply(type);
      assertThat(s.apply(once), is(once));
    }
    assertThat(s.apply(a), hasToString("Vector(3, Pair(ℚ, ℂ))"));
    for (Type type : s.asMap().values()) {
      assertThat(type.isConcrete(), is(true));
    }
  }

  @Test
  void testCompose() {
    final Substitution s1 = Substitution.of(a, typeSystem.list(b));
    final Substitution s2 =
        Substitution.of(b, TypeSystem.SCALAR).bind(c, TypeSystem.COMPLEX);
    final Substitution s = s1.compose(s2);
    assertThat(s, hasToString("[List(ℝ)/'a, ℝ/'b, ℂ/'c]"));
    assertThat(s.apply(s.apply(a)), is(s.apply(a)));

    // A variable bound by both has its bindings unified.
    final Substitution s3 =
        Substitution.of(a, typeSystem.list(TypeSystem.INT)).compose(s1);
    assertThat(s3, hasToString("[List(ℤ)/'a, ℤ/'b]"));

    // A binding that becomes an identity is skipped.
    final Substitution s4 =
        Substitution.of(a, b).compose(Substitution.of(b, a));
    assertThat(s4, hasToString("['b/'a]"));
  }

  /** Composing bindings that conflict fails, rather than dropping one. */
  @Test
  void testComposeConflict() {
    final Substitution s1 = Substitution.of(a, TypeSystem.SCALAR);
    final Substitution s2 = Substitution.of(a, TypeSystem.COMPLEX);
    final TypeError e = assertThrows(TypeError.class, () -> s1.compose(s2));
    assertThat(e.kind, is(TypeError.Kind.TYPE_MISMATCH));
    assertThat(e.getMessage(), is("type mismatch: expected ℝ, found ℂ"));
    assertThat(s1.compose(s1), is(s1));
  }

  /** Composing bindings in which a variable contains itself fails. */
  @Test
  void testComposeOccursCheck() {
    final TypeError e =
        assertThrows(
            TypeError.class,
            () ->
                Substitution.of(a, b)
                    .compose(Substitution.of(b, typeSystem.list(a))));
    assertThat(e.kind, is(TypeError.Kind.OCCURS_CHECK_FAILURE));
    assertThat(
        e.getMessage(), is("occurs check failed: 'b occurs in List('b)"));
  }
}

// End SubstitutionTest.java
