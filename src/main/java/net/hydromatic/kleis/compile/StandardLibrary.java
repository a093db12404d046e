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

import com.google.common.base.Suppliers;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.List;
import java.util.function.Supplier;
import net.hydromatic.kleis.ast.Ast;

/**
 * Structures, implementations and operations that every checker created by
 * {@link TypeChecker#withStandardLibrary()} knows about.
 *
 * <p>Declarations are in dependency order; for example, {@code Equatable}
 * precedes {@code Ordered}, which extends it.
 */
public abstract class StandardLibrary {
  private static final Supplier<List<Ast.Decl>> DECLARATIONS =
      Suppliers.memoize(StandardLibrary::build);

  private StandardLibrary() {}

  /** Returns the declarations of the standard library. */
  public static List<Ast.Decl> declarations() {
    return DECLARATIONS.get();
  }

  private static List<Ast.Decl> build() {
    final ImmutableList.Builder<Ast.Decl> b = ImmutableList.builder();
    addPrelude(b);
    addAlgebra(b);
    addMatrices(b);
    addTensors(b);
    return b.build();
  }

  private static void addPrelude(ImmutableList.Builder<Ast.Decl> b) {
    final Ast.TypeExpr t = ast.named("T");
    final Ast.TypeExpr binary = ast.fn(t, t, t);
    final Ast.TypeExpr unary = ast.fn(t, t);
    final Ast.TypeExpr predicate = ast.fn(t, t, ast.named("Bool"));

    b.add(
        ast.structure(
            "Arithmetic",
            ImmutableList.of(ast.typeParam("T")),
            ImmutableList.of(
                ast.operationMember("plus", binary),
                ast.operationMember("minus", binary),
                ast.operationMember("times", binary),
                ast.operationMember("divide", binary),
                ast.operationMember("negate", unary))));
    for (String type : new String[] {"ℝ", "ℂ", "ℤ", "ℚ"}) {
      b.add(
          ast.implementsDef(
              "Arithmetic",
              ImmutableList.of(ast.named(type)),
              "plus", "minus", "times", "divide", "negate"));
    }

    final Ast.TypeExpr n = ast.named("N");
    b.add(
        ast.structure(
            "Numeric",
            ImmutableList.of(ast.typeParam("N")),
            ImmutableList.of(
                ast.operationMember("abs", ast.fn(n, n)),
                ast.operationMember("sqrt", ast.fn(n, n)))));
    for (String type : new String[] {"ℝ", "ℂ"}) {
      b.add(
          ast.implementsDef(
              "Numeric", ImmutableList.of(ast.named(type)), "abs", "sqrt"));
    }

    b.add(
        ast.structure(
            "Transcendental",
            ImmutableList.of(ast.typeParam("T")),
            ImmutableList.of(
                ast.operationMember("sin", unary),
                ast.operationMember("cos", unary),
                ast.operationMember("exp", unary),
                ast.operationMember("ln", unary))));
    for (String type : new String[] {"ℝ", "ℂ"}) {
      b.add(
          ast.implementsDef(
              "Transcendental",
              ImmutableList.of(ast.named(type)),
              "sin", "cos", "exp", "ln"));
    }

    b.add(
        ast.structure(
            "Equatable",
            ImmutableList.of(ast.typeParam("T")),
            ImmutableList.of(
                ast.operationMember("equals", predicate),
                ast.operationMember("not_equals", predicate))));
    for (String type : new String[] {"ℂ", "Bool"}) {
      b.add(
          ast.implementsDef(
              "Equatable",
              ImmutableList.of(ast.named(type)),
              "equals", "not_equals"));
    }

    b.add(
        ast.structure(
            "Ordered",
            ImmutableList.of(ast.typeParam("T")),
            ImmutableList.of(
                ast.operationMember("less_than", predicate),
                ast.operationMember("greater_than", predicate),
                ast.operationMember("less_equal", predicate),
                ast.operationMember("greater_equal", predicate)),
            ast.parametric("Equatable", t),
            null));
    for (String type : new String[] {"ℝ", "ℤ", "ℚ"}) {
      b.add(
          ast.implementsDef(
              "Ordered",
              ImmutableList.of(ast.named(type)),
              "less_than", "greater_than", "less_equal", "greater_equal"));
    }

    // Accents and indices on a symbol, e.g. "x̂" and "x_i".
    final Ast.TypeExpr withIndex = ast.fn(t, ast.var("i"), t);
    b.add(
        ast.structure(
            "Decorated",
            ImmutableList.of(ast.typeParam("T")),
            ImmutableList.of(
                ast.operationMember("hat", unary),
                ast.operationMember("bar", unary),
                ast.operationMember("tilde", unary),
                ast.operationMember("dot", unary),
                ast.operationMember("ddot", unary),
                ast.operationMember("sub", withIndex),
                ast.operationMember("sup", withIndex))));

    final Ast.TypeExpr c = ast.named("C");
    b.add(
        ast.structure(
            "Finite",
            ImmutableList.of(ast.typeParam("C")),
            ImmutableList.of(
                ast.operationMember("card", ast.fn(c, ast.named("ℕ"))))));
    b.add(
        ast.implementsDef(
            "Finite", ImmutableList.of(ast.parametric("Set", "T")), "card"));
  }

  private static void addAlgebra(ImmutableList.Builder<Ast.Decl> b) {
    final Ast.TypeExpr r = ast.named("R");
    final Ast.Id x = ast.id("x");
    final Ast.Id y = ast.id("y");
    final Ast.Id z = ast.id("z");
    b.add(
        ast.structure(
            "Ring",
            ImmutableList.of(ast.typeParam("R")),
            ImmutableList.of(
                ast.nested(
                    "additive",
                    ast.parametric("AbelianGroup", r),
                    ImmutableList.of(
                        ast.operationMember("add_inverse", ast.fn(r, r)),
                        ast.element("zero", r))),
                ast.nested(
                    "multiplicative",
                    ast.parametric("Monoid", r),
                    ImmutableList.of(ast.element("one", r))),
                ast.axiom(
                    "commutativity",
                    ast.operation(
                        "equals",
                        ast.operation("plus", x, y),
                        ast.operation("plus", y, x))),
                ast.axiom(
                    "distributivity",
                    ast.operation(
                        "equals",
                        ast.operation("times", x, ast.operation("plus", y, z)),
                        ast.operation(
                            "plus",
                            ast.operation("times", x, y),
                            ast.operation("times", x, z)))))));

    final Ast.TypeExpr f = ast.named("F");
    b.add(
        ast.structure(
            "Field",
            ImmutableList.of(ast.typeParam("F")),
            ImmutableList.of(
                ast.operationMember("inverse", ast.fn(f, f)),
                ast.axiom(
                    "multiplicative_inverse",
                    ast.operation(
                        "equals",
                        ast.operation("times", x, ast.operation("inverse", x)),
                        ast.id("one")))),
            ast.parametric("Ring", f),
            null));
    for (String type : new String[] {"ℝ", "ℂ"}) {
      b.add(
          ast.implementsDef(
              "Field",
              ImmutableList.of(ast.named(type)),
              ImmutableMap.of(
                  "inverse", "builtin_inverse",
                  "add_inverse", "builtin_negate"),
              ImmutableMap.<String, Ast.Exp>of(
                  "zero", ast.constant(0), "one", ast.constant(1)),
              null,
              ImmutableList.of()));
    }

    final Ast.TypeExpr v = ast.named("V");
    b.add(
        ast.structure(
            "VectorSpace",
            ImmutableList.of(ast.typeParam("V")),
            ImmutableList.of(
                ast.operationMember("vector_add", ast.fn(v, v, v)),
                ast.operationMember("scale", ast.fn(f, v, v))),
            null,
            ast.parametric("Field", f)));
    b.add(
        ast.implementsDef(
            "VectorSpace",
            ImmutableList.of(ast.parametric("Vector", "n", "T")),
            ImmutableMap.of(
                "vector_add", "builtin_vector_add",
                "scale", "builtin_vector_scale"),
            ImmutableMap.of(),
            ast.parametric("Field", "T"),
            ImmutableList.of(ast.where("Field", ast.named("T")))));
  }

  private static void addMatrices(ImmutableList.Builder<Ast.Decl> b) {
    final Ast.TypeExpr mn = ast.parametric("Matrix", "m", "n", "T");
    b.add(
        ast.structure(
            "Matrix",
            ImmutableList.of(
                ast.natParam("m"), ast.natParam("n"), ast.typeParam("T")),
            ImmutableList.of(
                ast.operationMember(
                    "transpose",
                    ast.fn(mn, ast.parametric("Matrix", "n", "m", "T"))))));
    b.add(
        ast.structure(
            "MatrixAddable",
            ImmutableList.of(
                ast.natParam("m"), ast.natParam("n"), ast.typeParam("T")),
            ImmutableList.of(
                ast.operationMember("matrix_add", ast.fn(mn, mn, mn)))));
    b.add(
        ast.structure(
            "MatrixMultipliable",
            ImmutableList.of(
                ast.natParam("m"),
                ast.natParam("n"),
                ast.natParam("p"),
                ast.typeParam("T")),
            ImmutableList.of(
                ast.operationMember(
                    "multiply",
                    ast.fn(
                        mn,
                        ast.parametric("Matrix", "n", "p", "T"),
                        ast.parametric("Matrix", "m", "p", "T"))))));
    final Ast.TypeExpr square = ast.parametric("Matrix", "n", "n", "T");
    b.add(
        ast.structure(
            "SquareMatrix",
            ImmutableList.of(ast.natParam("n"), ast.typeParam("T")),
            ImmutableList.of(
                ast.operationMember("det", ast.fn(square, ast.named("T"))),
                ast.operationMember(
                    "trace", ast.fn(square, ast.named("T"))))));
  }

  private static void addTensors(ImmutableList.Builder<Ast.Decl> b) {
    b.add(
        ast.structure(
            "TensorAlgebra",
            ImmutableList.of(ast.natParam("dim"), ast.typeParam("T")),
            ImmutableList.of(
                ast.operationMember(
                    "contract",
                    ast.fn(
                        ast.parametric(
                            "Tensor",
                            ast.nat(1),
                            ast.nat(1),
                            ast.named("dim"),
                            ast.named("T")),
                        ast.named("T"))))));

    // Operations of general relativity, on 4-dimensional real tensors.
    final Ast.TypeExpr metric = ast.parametric("Tensor", "0", "2", "4", "ℝ");
    final Ast.TypeExpr riemann = ast.parametric("Tensor", "1", "3", "4", "ℝ");
    b.add(
        ast.operationDecl(
            "einstein", ast.fn(metric, ast.named("ℝ"), metric, metric)));
    b.add(ast.operationDecl("ricci", ast.fn(riemann, metric)));
    b.add(ast.operationDecl("metric", metric));
  }
}

// End StandardLibrary.java
