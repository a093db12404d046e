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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Builds parse tree nodes. */
public enum AstBuilder {
  /**
   * The singleton instance of the AST builder. The short name is convenient for
   * use via 'import static', but checkstyle does not approve.
   */
  // CHECKSTYLE: IGNORE 1
  ast;

  // Expressions

  /** Creates a numeric constant. */
  public Ast.Const constant(String text) {
    return new Ast.Const(text);
  }

  /** Creates a numeric constant from an integer. */
  public Ast.Const constant(int value) {
    return new Ast.Const(Integer.toString(value));
  }

  /** Creates a reference to a named object. */
  public Ast.Id id(String name) {
    return new Ast.Id(name);
  }

  /** Creates a placeholder with no hint. */
  public Ast.Placeholder placeholder(int id) {
    return new Ast.Placeholder(id, "");
  }

  public Ast.Placeholder placeholder(int id, String hint) {
    return new Ast.Placeholder(id, hint);
  }

  /** Creates an application of an operation. */
  public Ast.Operation operation(String name, List<? extends Ast.Exp> args) {
    return new Ast.Operation(name, args);
  }

  public Ast.Operation operation(String name, Ast.Exp... args) {
    return new Ast.Operation(name, Arrays.asList(args));
  }

  public Ast.ListExp list(List<? extends Ast.Exp> items) {
    return new Ast.ListExp(items);
  }

  public Ast.ListExp list(Ast.Exp... items) {
    return new Ast.ListExp(Arrays.asList(items));
  }

  /**
   * Creates a matrix literal, e.g. {@code matrix(2, 2, a, b, c, d)} for
   * "Matrix(2, 2, a, b, c, d)".
   */
  public Ast.Operation matrix(int rows, int cols, Ast.Exp... elements) {
    final ImmutableList.Builder<Ast.Exp> args = ImmutableList.builder();
    args.add(constant(rows), constant(cols));
    args.add(elements);
    return operation("Matrix", args.build());
  }

  // Type expressions

  /** Creates a named type, e.g. "ℝ" or "T". */
  public Ast.NamedTypeExpr named(String name) {
    return new Ast.NamedTypeExpr(name);
  }

  /** Creates a parametric type, e.g. "Matrix(m, n, T)". */
  public Ast.ParametricTypeExpr parametric(
      String name, List<? extends Ast.TypeExpr> args) {
    return new Ast.ParametricTypeExpr(name, args);
  }

  public Ast.ParametricTypeExpr parametric(String name, Ast.TypeExpr... args) {
    return new Ast.ParametricTypeExpr(name, Arrays.asList(args));
  }

  /**
   * Creates a parametric type whose arguments are given as strings; an
   * argument consisting only of digits becomes a natural number literal, any
   * other argument a named type.
   */
  public Ast.ParametricTypeExpr parametric(String name, String... args) {
    final ImmutableList.Builder<Ast.TypeExpr> b = ImmutableList.builder();
    for (String arg : args) {
      b.add(typeArg(arg));
    }
    return new Ast.ParametricTypeExpr(name, b.build());
  }

  private Ast.TypeExpr typeArg(String arg) {
    if (!arg.isEmpty() && arg.chars().allMatch(Character::isDigit)) {
      return nat(Integer.parseInt(arg));
    }
    return named(arg);
  }

  /**
   * Creates a curried function type. {@code fn(a, b, c)} is "a → b → c",
   * which is "a → (b → c)".
   */
  public Ast.TypeExpr fn(Ast.TypeExpr first, Ast.TypeExpr... rest) {
    if (rest.length == 0) {
      return first;
    }
    Ast.TypeExpr t = rest[rest.length - 1];
    for (int i = rest.length - 2; i >= 0; i--) {
      t = new Ast.FunctionTypeExpr(rest[i], t);
    }
    return new Ast.FunctionTypeExpr(first, t);
  }

  public Ast.ProductTypeExpr product(List<? extends Ast.TypeExpr> elements) {
    checkArgument(elements.size() >= 2, "product needs two or more elements");
    return new Ast.ProductTypeExpr(elements);
  }

  public Ast.ProductTypeExpr product(Ast.TypeExpr... elements) {
    return product(Arrays.asList(elements));
  }

  public Ast.NatTypeExpr nat(int value) {
    return new Ast.NatTypeExpr(value);
  }

  public Ast.VarTypeExpr var(String name) {
    return new Ast.VarTypeExpr(name);
  }

  // Declarations

  /** Creates a type parameter, e.g. "T". */
  public Ast.TypeParam typeParam(String name) {
    return new Ast.TypeParam(name, Ast.TypeParam.Kind.TYPE);
  }

  /** Creates a dimension parameter, e.g. "m: Nat". */
  public Ast.TypeParam natParam(String name) {
    return new Ast.TypeParam(name, Ast.TypeParam.Kind.NAT);
  }

  public Ast.OperationMember operationMember(
      String name, Ast.TypeExpr signature) {
    return new Ast.OperationMember(name, signature);
  }

  public Ast.ElementMember element(String name, Ast.TypeExpr type) {
    return new Ast.ElementMember(name, type);
  }

  public Ast.AxiomMember axiom(String name, Ast.Exp proposition) {
    return new Ast.AxiomMember(name, proposition);
  }

  public Ast.NestedStructure nested(
      String name,
      Ast.TypeExpr structureType,
      List<? extends Ast.Member> members) {
    return new Ast.NestedStructure(name, structureType, members);
  }

  /** Creates a structure declaration. */
  public Ast.StructureDef structure(
      String name,
      List<Ast.TypeParam> typeParams,
      List<? extends Ast.Member> members,
      Ast.@Nullable TypeExpr extendsClause,
      Ast.@Nullable TypeExpr overClause) {
    return new Ast.StructureDef(
        name, typeParams, members, extendsClause, overClause);
  }

  /** Creates a structure declaration with no "extends" or "over" clause. */
  public Ast.StructureDef structure(
      String name,
      List<Ast.TypeParam> typeParams,
      List<? extends Ast.Member> members) {
    return structure(name, typeParams, members, null, null);
  }

  /** Creates an implementation. */
  public Ast.ImplementsDef implementsDef(
      String structureName,
      List<? extends Ast.TypeExpr> typeArgs,
      Map<String, String> operations,
      Map<String, Ast.Exp> elements,
      Ast.@Nullable TypeExpr overClause,
      List<Ast.WhereConstraint> whereConstraints) {
    return new Ast.ImplementsDef(
        structureName,
        typeArgs,
        operations,
        elements,
        overClause,
        whereConstraints);
  }

  /**
   * Creates an implementation that maps each operation to a built-in of the
   * same name, e.g. "operation abs = builtin_abs".
   */
  public Ast.ImplementsDef implementsDef(
      String structureName, List<? extends Ast.TypeExpr> typeArgs,
      String... operationNames) {
    final ImmutableMap.Builder<String, String> operations =
        ImmutableMap.builder();
    for (String operationName : operationNames) {
      operations.put(operationName, "builtin_" + operationName);
    }
    return implementsDef(
        structureName,
        typeArgs,
        operations.build(),
        ImmutableMap.of(),
        null,
        ImmutableList.of());
  }

  public Ast.WhereConstraint where(
      String structureName, Ast.TypeExpr... typeArgs) {
    return new Ast.WhereConstraint(structureName, Arrays.asList(typeArgs));
  }

  /** Creates a top-level operation declaration. */
  public Ast.OperationDecl operationDecl(String name, Ast.TypeExpr signature) {
    return new Ast.OperationDecl(new Ast.OperationMember(name, signature));
  }

  /** Creates a data type declaration. */
  public Ast.DataDef dataDef(String name, List<Ast.TypeParam> typeParams,
      Ast.DataVariant... variants) {
    return new Ast.DataDef(name, typeParams, Arrays.asList(variants));
  }

  /** Creates a constructor of a data type. */
  public Ast.DataVariant variant(String name, Ast.TypeExpr... fields) {
    return new Ast.DataVariant(name, Arrays.asList(fields));
  }
}

// End AstBuilder.java
