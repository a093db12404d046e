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

import static java.util.Objects.requireNonNull;
import static net.hydromatic.kleis.util.Static.transformEager;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.UnaryOperator;
import net.hydromatic.kleis.ast.Op;

/**
 * Constructed type, such as {@code Scalar}, {@code Matrix(2, 3, ℝ)} or {@code
 * Tensor(0, 2, 4, ℝ)}.
 *
 * <p>Arguments may be types, {@link NatValue dimensions}, or type variables.
 */
public class DataType extends BaseType {
  /** Symbols for constructors that have one, e.g. "ℝ" for "Scalar". */
  private static final Map<String, String> SYMBOLS =
      ImmutableMap.of(
          "Scalar", "ℝ",
          "Complex", "ℂ",
          "Int", "ℤ",
          "Rational", "ℚ");

  /**
   * Name of the family of types. Built-in types such as "Matrix" are all
   * constructors of the family "Type"; a declared data type such as
   * "Option" is its own family.
   */
  public final String typeName;
  /** Name of the constructor, e.g. "Matrix". */
  public final String constructor;

  public final List<Type> args;

  DataType(String typeName, String constructor, List<? extends Type> args) {
    super(Op.DATA_TYPE);
    this.typeName = requireNonNull(typeName);
    this.constructor = requireNonNull(constructor);
    this.args = ImmutableList.copyOf(args);
  }

  @Override
  public int hashCode() {
    return Objects.hash(typeName, constructor, args);
  }

  @Override
  public boolean equals(Object obj) {
    return obj == this
        || obj instanceof DataType
            && typeName.equals(((DataType) obj).typeName)
            && constructor.equals(((DataType) obj).constructor)
            && args.equals(((DataType) obj).args);
  }

  @Override
  public StringBuilder describe(StringBuilder buf) {
    if (args.isEmpty()) {
      return buf.append(SYMBOLS.getOrDefault(constructor, constructor));
    }
    buf.append(constructor).append('(');
    for (int i = 0; i < args.size(); i++) {
      if (i > 0) {
        buf.append(", ");
      }
      args.get(i).describe(buf);
    }
    return buf.append(')');
  }

  @Override
  public Type arg(int i) {
    return args.get(i);
  }

  @Override
  public <R> R accept(TypeVisitor<R> typeVisitor) {
    return typeVisitor.visit(this);
  }

  @Override
  public DataType copy(UnaryOperator<Type> transform) {
    final List<Type> args2 = transformEager(args, t -> t.copy(transform));
    return args2.equals(args)
        ? this
        : new DataType(typeName, constructor, args2);
  }
}

// End DataType.java
