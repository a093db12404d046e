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

import static net.hydromatic.kleis.ast.AstBuilder.ast;
import static org.hamcrest.CoreMatchers.instanceOf;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasToString;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import java.util.List;
import net.hydromatic.kleis.ast.Ast;
import net.hydromatic.kleis.type.DimensionMismatchError;
import net.hydromatic.kleis.type.PrimitiveType;
import net.hydromatic.kleis.type.Substitution;
import net.hydromatic.kleis.type.Type;
import net.hydromatic.kleis.type.TypeError;
import net.hydromatic.kleis.type.TypeSystem;
import net.hydromatic.kleis.type.TypeVar;
import org.junit.jupiter.api.Test;

/** Tests for {@link SignatureInterpreter}. */
public class SignatureInterpreterTest {
  final TypeSystem typeSystem = new TypeSystem();
  final StructureRegistry registry = new StructureRegistry();
  final SignatureInterpreter interpreter =
      new SignatureInterpreter(typeSystem, registry, Tracers.empty());
  final Type r = TypeSystem.SCALAR;

  /** Variables created by the interpreter start at 'k, so that they do not
   * clash with the variables that tests create. */
  private int varCount = 10;

  SignatureInterpreterTest() {
    StandardLibrary.declarations().forEach(registry::registerDecl);
  }

  private TypeVar newVar(Ast.TypeParam.Kind kind, String hint) {
    return new TypeVar(varCount++, kind, hint);
  }

  /** Returns the {@code i}th candidate for an operation. */
  private OperationSignature candidate(String name, int arity, int i) {
    return registry.signaturesFor(name, arity).get(i);
  }

  private SignatureInterpreter.Match interpret(
      OperationSignature candidate, Type... argTypes) {
    return interpreter.interpret(
        candidate, ImmutableList.copyOf(argTypes), Substitution.EMPTY,
        this::newVar);
  }

  private TypeError interpretFails(
      OperationSignature candidate, Type... argTypes) {
    return assertThrows(
        TypeError.class, () -> interpret(candidate, argTypes));
  }

  @Test
  void testMatrixAdd() {
    final OperationSignature matrixAdd = candidate("matrix_add", 2, 0);
    final Type m23 = typeSystem.matrix(2, 3, r);
    assertThat(interpret(matrixAdd, m23, m23).type, is(m23));

    // The element type of the second argument is inferred from the first.
    final TypeVar a = new TypeVar(0);
    final SignatureInterpreter.Match match =
        interpret(matrixAdd, m23, typeSystem.matrix(2, 3, a));
    assertThat(match.type, is(m23));
    assertThat(match.substitution.apply(a), is(r));
  }

  /** A dimension mismatch names the argument and the parameter. */
  @Test
  void testMatrixAddDimensionMismatch() {
    final TypeError e =
        interpretFails(
            candidate("matrix_add", 2, 0),
            typeSystem.matrix(2, 3, r),
            typeSystem.matrix(4, 5, r));
    assertThat(e, instanceOf(DimensionMismatchError.class));
    final DimensionMismatchError d = (DimensionMismatchError) e;
    assertThat(d.expected, is(2));
    assertThat(d.found, is(4));
    assertThat(d.parameter, is("m"));
    assertThat(
        d.getMessage(),
        is(
            "dimension mismatch in argument 2 of matrix_add: parameter m"
                + " expected 2, found 4 (Matrix(2, 3, ℝ) vs Matrix(4, 5, ℝ))"));
    assertThat(
        d.suggestion(),
        is("argument 2 of matrix_add must have type Matrix(2, 3, ℝ)"));
  }

  @Test
  void testMultiply() {
    final OperationSignature multiply = candidate("multiply", 2, 0);
    final Type m23 = typeSystem.matrix(2, 3, r);
    assertThat(
        interpret(multiply, m23, typeSystem.matrix(3, 4, r)).type,
        hasToString("Matrix(2, 4, ℝ)"));

    final TypeError e =
        interpretFails(multiply, m23, typeSystem.matrix(5, 6, r));
    final DimensionMismatchError d = (DimensionMismatchError) e;
    assertThat(d.parameter, is("n"));
    assertThat(d.expected, is(3));
    assertThat(d.found, is(5));
  }

  @Test
  void testTranspose() {
    assertThat(
        interpret(candidate("transpose", 1, 0), typeSystem.matrix(2, 3, r))
            .type,
        hasToString("Matrix(3, 2, ℝ)"));
    assertThat(
        interpret(
                candidate("det", 1, 0),
                typeSystem.matrix(3, 3, TypeSystem.COMPLEX))
            .type,
        is(TypeSystem.COMPLEX));
    final TypeError e =
        interpretFails(candidate("det", 1, 0), typeSystem.matrix(2, 3, r));
    assertThat(e.kind, is(TypeError.Kind.DIMENSION_MISMATCH));
  }

  @Test
  void testArityMismatch() {
    final TypeError e = interpretFails(candidate("abs", 1, 0), r, r);
    assertThat(e.kind, is(TypeError.Kind.ARITY_MISMATCH));
    assertThat(e.getMessage(), is("operation abs expects 1 argument, found 2"));
  }

  /** A candidate from an implementation accepts only its own type. */
  @Test
  void testImplementation() {
    final OperationSignature absReal = candidate("abs", 1, 1);
    assertThat(absReal.owner(), is("Numeric(ℝ)"));
    assertThat(interpret(absReal, r).type, is(r));
    assertThat(
        interpretFails(absReal, TypeSystem.COMPLEX).kind,
        is(TypeError.Kind.TYPE_MISMATCH));

    // An unconstrained argument is bound to the implementation's type.
    final TypeVar a = new TypeVar(0);
    final SignatureInterpreter.Match match = interpret(absReal, a);
    assertThat(match.type, is(r));
    assertThat(match.substitution.apply(a), is(r));
  }

  /** Names in an implementation's type arguments are local variables. */
  @Test
  void testImplementationWithVariables() {
    final OperationSignature scale = candidate("scale", 2, 1);
    assertThat(scale.owner(), is("VectorSpace(Vector(n, T))"));
    assertThat(
        interpret(scale, r, typeSystem.vector(3, r)).type,
        hasToString("Vector(3, ℝ)"));
    assertThat(
        interpretFails(scale, r, typeSystem.matrix(3, 3, r)).kind,
        is(TypeError.Kind.TYPE_MISMATCH));

    final OperationSignature card = candidate("card", 1, 1);
    assertThat(
        interpret(card, typeSystem.set(TypeSystem.INT)).type,
        hasToString("ℕ"));
  }

  @Test
  void testGenericCandidate() {
    final TypeVar a = new TypeVar(0);
    final SignatureInterpreter.Match match =
        interpret(candidate("abs", 1, 0), a);
    assertThat(match.type, is(a));
    assertThat(match.specificity, is(0));
    assertThat(interpret(candidate("abs", 1, 1), a).specificity, is(1));
  }

  /** A concrete result type does not depend on the arguments. */
  @Test
  void testConcreteResult() {
    final List<OperationSignature> candidates =
        registry.signaturesFor("einstein", 3);
    final Type type =
        interpret(
                candidates.get(0),
                new TypeVar(0),
                new TypeVar(1),
                new TypeVar(2))
            .type;
    assertThat(type, hasToString("Tensor(0, 2, 4, ℝ)"));
    assertThat(
        interpret(candidate("metric", 0, 0)).type,
        is(typeSystem.tensor(0, 2, 4, r)));
  }

  /** A parameter that appears only in the result cannot be determined. */
  @Test
  void testUnresolvedTypeParameter() {
    final StructureRegistry registry2 = new StructureRegistry();
    registry2.register(
        ast.structure(
            "Pointed",
            ImmutableList.of(ast.typeParam("T")),
            ImmutableList.of(
                ast.operationMember("point", ast.named("T")),
                ast.operationMember(
                    "size", ast.fn(ast.named("T"), ast.named("ℕ"))))));
    final TypeError e =
        interpretFails(registry2.signaturesFor("point", 0).get(0));
    assertThat(e.kind, is(TypeError.Kind.UNRESOLVED_TYPE_PARAMETER));
    assertThat(
        e.getMessage(),
        is("cannot determine parameter T of structure Pointed"
            + " from call to point"));

    // A parameter that appears only in the arguments is fine.
    assertThat(
        interpret(registry2.signaturesFor("size", 1).get(0), r).type,
        is(PrimitiveType.NAT));
  }

  @Test
  void testResolve() {
    final int[] ordinal = {0};
    final SignatureInterpreter.VarFactory varFactory =
        (kind, hint) -> new TypeVar(ordinal[0]++, kind, hint);
    assertThat(
        interpreter.resolve(
            ast.parametric("Vector", ast.named("n"), ast.named("Real")),
            varFactory),
        hasToString("Vector('a, ℝ)"));
    assertThat(
        interpreter.resolve(
            ast.fn(ast.named("x"), ast.named("x"), ast.var("i")), varFactory),
        hasToString("'b → 'b → 'c"));
    assertThat(
        interpreter.resolve(ast.named("Quaternion"), varFactory),
        hasToString("Quaternion"));
    assertThat(
        interpreter.resolve(
            ast.product(ast.nat(3), ast.named("Bool")), varFactory),
        hasToString("3 × Bool"));
  }

  @Test
  void testConcreteness() {
    assertThat(
        SignatureInterpreter.concreteness(
            typeSystem.matrix(typeSystem.nat(2), new TypeVar(0), r)),
        is(3));
    assertThat(SignatureInterpreter.concreteness(new TypeVar(0)), is(0));
    assertThat(
        SignatureInterpreter.concreteness(typeSystem.fnType(r, r)), is(3));
  }
}

// End SignatureInterpreterTest.java
