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
package net.hydromatic.kleis.ast;

import static net.hydromatic.kleis.Matchers.hasStrings;
import static net.hydromatic.kleis.ast.AstBuilder.ast;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.nullValue;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasToString;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.OptionalInt;
import org.junit.jupiter.api.Test;

/** Tests for {@link Ast} and {@link AstBuilder}. */
public class AstTest {
  @Test
  void testUnparseExpressions() {
    final Ast.Exp exp =
        ast.operation(
            "plus",
            ast.constant(1),
            ast.operation("times", ast.id("x"), ast.placeholder(0, "y")));
    assertThat(exp, hasToString("plus(1, times(x, □0:y))"));
    assertThat(ast.placeholder(3), hasToString("□3"));
    assertThat(
        ast.list(ast.constant("2.5"), ast.id("z")), hasToString("[2.5, z]"));
    assertThat(
        ast.matrix(1, 2, ast.id("a"), ast.id("b")),
        hasToString("Matrix(1, 2, a, b)"));
  }

  @Test
  void testNaturalValue() {
    assertThat(ast.constant(4).naturalValue(), is(OptionalInt.of(4)));
    assertThat(ast.constant("3.14").naturalValue(), is(OptionalInt.empty()));
    assertThat(ast.constant("-1").naturalValue(), is(OptionalInt.empty()));
    assertThat(
        ast.constant("99999999999").naturalValue(), is(OptionalInt.empty()));
  }

  @Test
  void testPlaceholders() {
    final Ast.Exp exp =
        ast.operation(
            "einstein",
            ast.placeholder(5),
            ast.list(ast.placeholder(1), ast.constant(2)),
            ast.operation("hat", ast.placeholder(3)));
    assertThat(exp.findPlaceholders(), hasStrings("□5", "□1", "□3"));
    assertThat(exp.nextPlaceholder(1), is(OptionalInt.of(3)));
    assertThat(exp.nextPlaceholder(3), is(OptionalInt.of(5)));
    assertThat(exp.nextPlaceholder(5), is(OptionalInt.empty()));
    assertThat(exp.prevPlaceholder(5), is(OptionalInt.of(3)));
    assertThat(exp.prevPlaceholder(1), is(OptionalInt.empty()));
    assertThat(ast.constant(1).findPlaceholders().isEmpty(), is(true));
  }

  @Test
  void testTypeExpressions() {
    final Ast.TypeExpr r = ast.named("ℝ");
    assertThat(ast.fn(r, r, r), hasToString("ℝ → ℝ → ℝ"));
    assertThat(ast.fn(ast.fn(r, r), r), hasToString("(ℝ → ℝ) → ℝ"));
    assertThat(ast.fn(r), hasToString("ℝ"));
    assertThat(
        ast.parametric("Matrix", "m", "3", "T"),
        hasToString("Matrix(m, 3, T)"));
    assertThat(
        ast.parametric("Matrix", "m", "3", "T").args.get(1).op,
        is(Op.NAT_TYPE_EXPR));
    assertThat(ast.product(r, ast.var("i")), hasToString("ℝ × 'i"));

    final Ast.FunctionTypeExpr signature =
        (Ast.FunctionTypeExpr)
            ast.fn(ast.parametric("Matrix", "m", "n", "T"), r, ast.named("T"));
    assertThat(signature.parameterTypes(), hasStrings("Matrix(m, n, T)", "ℝ"));
    assertThat(signature.resultType(), hasToString("T"));
    assertThat(signature.mentions("n"), is(true));
    assertThat(signature.mentions("p"), is(false));
  }

  @Test
  void testStructure() {
    final Ast.TypeExpr r = ast.named("R");
    final Ast.StructureDef ring =
        ast.structure(
            "Ring",
            ImmutableList.of(ast.typeParam("R")),
            ImmutableList.of(
                ast.operationMember("times", ast.fn(r, r, r)),
                ast.nested(
                    "additive",
                    ast.parametric("AbelianGroup", r),
                    ImmutableList.of(
                        ast.operationMember("add_inverse", ast.fn(r, r)),
                        ast.axiom(
                            "inverse",
                            ast.operation(
                                "equals", ast.id("x"), ast.id("x"))))),
                ast.element("one", r)));
    assertThat(
        ring,
        hasToString(
            "structure Ring(R) {"
                + " operation times : R → R → R;"
                + " structure additive : AbelianGroup(R) {"
                + " operation add_inverse : R → R;"
                + " axiom inverse : equals(x, x) };"
                + " element one : R }"));
    assertThat(
        ring.operations(),
        hasStrings(
            "operation times : R → R → R", "operation add_inverse : R → R"));
    assertThat(ring.operations().get(0).arity(), is(2));
    assertThat(ring.axioms().size(), is(1));
    assertThat(ring.paramOpt("R"), hasToString("R"));
    assertThat(ring.paramOpt("S"), nullValue());

    final Ast.StructureDef matrix =
        ast.structure(
            "Matrix",
            ImmutableList.of(ast.natParam("m"), ast.typeParam("T")),
            ImmutableList.of(),
            null,
            ast.parametric("Field", "T"));
    assertThat(
        matrix, hasToString("structure Matrix(m: Nat, T) over Field(T) {}"));
    assertThat(
        ast.operationDecl("metric", ast.parametric("Tensor", "0", "2")),
        hasToString("operation metric : Tensor(0, 2)"));
    assertThat(
        ast.operationDecl("metric", ast.named("ℝ")).member.arity(), is(0));
  }

  @Test
  void testImplements() {
    final Ast.ImplementsDef numeric =
        ast.implementsDef(
            "Numeric", ImmutableList.of(ast.named("ℝ")), "abs", "sqrt");
    assertThat(
        numeric,
        hasToString(
            "implements Numeric(ℝ) {"
                + " operation abs = builtin_abs;"
                + " operation sqrt = builtin_sqrt; }"));
    assertThat(numeric.typeId(), is("ℝ"));

    final Ast.ImplementsDef vectorSpace =
        ast.implementsDef(
            "VectorSpace",
            ImmutableList.of(ast.parametric("Vector", "n", "T")),
            ImmutableMap.of("scale", "builtin_vector_scale"),
            ImmutableMap.of(),
            ast.parametric("Field", "T"),
            ImmutableList.of(ast.where("Field", ast.named("T"))));
    assertThat(vectorSpace.typeId(), is("Vector(n, T)"));
    assertThat(
        vectorSpace,
        hasToString(
            "implements VectorSpace(Vector(n, T)) over Field(T)"
                + " where Field(T)"
                + " { operation scale = builtin_vector_scale; }"));
  }

  @Test
  void testDataDef() {
    final Ast.DataDef vec =
        ast.dataDef(
            "Vec",
            ImmutableList.of(ast.natParam("n"), ast.typeParam("T")),
            ast.variant("Nil"),
            ast.variant(
                "Cons", ast.named("T"), ast.parametric("Vec", "n", "T")));
    assertThat(
        vec, hasToString("data Vec(n: Nat, T) = Nil | Cons(T, Vec(n, T))"));
    assertThat(vec.op, is(Op.DATA_DECL));
    assertThat(
        vec.kinds(),
        is(ImmutableList.of(Ast.TypeParam.Kind.NAT, Ast.TypeParam.Kind.TYPE)));
    assertThat(
        ast.dataDef("Bool2", ImmutableList.of(), ast.variant("T"),
            ast.variant("F")),
        hasToString("data Bool2 = T | F"));
  }
}

// End AstTest.java
