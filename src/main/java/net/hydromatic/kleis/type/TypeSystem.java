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

import static com.google.common.base.Preconditions.checkArgument;
import static net.hydromatic.kleis.ast.Ast.TypeParam.Kind.NAT;
import static net.hydromatic.kleis.ast.Ast.TypeParam.Kind.TYPE;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import net.hydromatic.kleis.ast.Ast;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A collection of types.
 *
 * <p>Creates types, and resolves the names that may appear in a type
 * expression ("ℝ", "Real", "Bool", ...) to built-in types.
 */
public class TypeSystem {
  public static final DataType SCALAR = builtIn("Scalar");
  public static final DataType COMPLEX = builtIn("Complex");
  public static final DataType INT = builtIn("Int");
  public static final DataType RATIONAL = builtIn("Rational");

  /** Kinds of the arguments of each built-in type constructor. */
  private static final Map<String, List<Ast.TypeParam.Kind>> BUILT_IN_KINDS =
      ImmutableMap.<String, List<Ast.TypeParam.Kind>>builder()
          .put("Matrix", kinds(NAT, NAT, TYPE))
          .put("Tensor", kinds(NAT, NAT, NAT, TYPE))
          .put("Vector", kinds(NAT, TYPE))
          .put("List", kinds(TYPE))
          .put("Set", kinds(TYPE))
          .build();

  /** Built-in types by name, including aliases. */
  private final Map<String, Type> typeByName;

  public TypeSystem() {
    this.typeByName =
        ImmutableMap.<String, Type>builder()
            .put("ℝ", SCALAR)
            .put("Real", SCALAR)
            .put("Scalar", SCALAR)
            .put("ℂ", COMPLEX)
            .put("Complex", COMPLEX)
            .put("ℤ", INT)
            .put("Int", INT)
            .put("Integer", INT)
            .put("ℚ", RATIONAL)
            .put("Rational", RATIONAL)
            .put("ℕ", PrimitiveType.NAT)
            .put("Nat", PrimitiveType.NAT)
            .put("Bool", PrimitiveType.BOOL)
            .put("𝔹", PrimitiveType.BOOL)
            .put("String", PrimitiveType.STRING)
            .put("Unit", PrimitiveType.UNIT)
            .build();
  }

  private static DataType builtIn(String constructor) {
    return new DataType("Type", constructor, ImmutableList.of());
  }

  private static List<Ast.TypeParam.Kind> kinds(Ast.TypeParam.Kind... kinds) {
    return ImmutableList.copyOf(kinds);
  }

  /** Returns whether a name denotes a built-in type or type constructor. */
  public boolean isBuiltIn(String name) {
    return typeByName.containsKey(name) || BUILT_IN_KINDS.containsKey(name);
  }

  /**
   * Returns the kinds of the arguments of a built-in type constructor, e.g.
   * [NAT, NAT, TYPE] for "Matrix"; null if the name is not a built-in
   * constructor.
   */
  public @Nullable List<Ast.TypeParam.Kind> parameterKindsOpt(String name) {
    return BUILT_IN_KINDS.get(name);
  }

  /** Returns the built-in type with a given name, or null. */
  public @Nullable Type lookupOpt(String name) {
    return typeByName.get(name);
  }

  /** Returns the built-in type with a given name, or throws. */
  public Type lookup(String name) {
    final Type type = lookupOpt(name);
    if (type == null) {
      throw new IllegalArgumentException("unknown type " + name);
    }
    return type;
  }

  /** Creates a constructed type, e.g. "Matrix(2, 3, ℝ)". */
  public DataType dataType(String constructor, List<? extends Type> args) {
    if (args.isEmpty()) {
      // Return the canonical instance, so that "Scalar" is ℝ.
      final Type type = typeByName.get(constructor);
      if (type instanceof DataType) {
        return (DataType) type;
      }
    }
    return new DataType("Type", constructor, args);
  }

  public DataType dataType(String constructor, Type... args) {
    return dataType(constructor, Arrays.asList(args));
  }

  /**
   * Creates an instance of a user-declared data type, e.g. "Option(ℝ)".
   * Unlike the built-in types, which are all constructors of the family
   * "Type", a declared type is its own family.
   */
  public DataType declaredType(String name, List<? extends Type> args) {
    return new DataType(name, name, args);
  }

  /** Creates a dimension. */
  public NatValue nat(int value) {
    return new NatValue(value);
  }

  /** Creates a function type. */
  public FnType fnType(Type paramType, Type resultType) {
    return new FnType(paramType, resultType);
  }

  /**
   * Creates a curried function type. {@code fnType(a, b, c)} is "a → b → c",
   * which is "a → (b → c)".
   */
  public FnType fnType(Type paramType, Type type1, Type... types) {
    Type t = types.length == 0 ? type1 : types[types.length - 1];
    for (int i = types.length - 2; i >= -1; i--) {
      t = new FnType(i < 0 ? type1 : types[i], t);
    }
    return new FnType(paramType, t);
  }

  /** Creates a product type. */
  public ProductType productType(List<? extends Type> elementTypes) {
    checkArgument(elementTypes.size() >= 2, "product needs two or more types");
    return new ProductType(elementTypes);
  }

  public ProductType productType(Type... elementTypes) {
    return productType(Arrays.asList(elementTypes));
  }

  /** Creates a matrix type, "Matrix(rows, cols, elementType)". */
  public DataType matrix(Type rows, Type cols, Type elementType) {
    return dataType("Matrix", rows, cols, elementType);
  }

  public DataType matrix(int rows, int cols, Type elementType) {
    return matrix(nat(rows), nat(cols), elementType);
  }

  /** Creates a tensor type, "Tensor(upper, lower, dim, elementType)". */
  public DataType tensor(int upper, int lower, int dim, Type elementType) {
    return dataType("Tensor", nat(upper), nat(lower), nat(dim), elementType);
  }

  /** Creates a vector type, "Vector(n, elementType)". */
  public DataType vector(int n, Type elementType) {
    return dataType("Vector", nat(n), elementType);
  }

  /** Creates a list type, "List(elementType)". */
  public DataType list(Type elementType) {
    return dataType("List", elementType);
  }

  /** Creates a set type, "Set(elementType)". */
  public DataType set(Type elementType) {
    return dataType("Set", elementType);
  }
}

// End TypeSystem.java
