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

import static java.util.Objects.requireNonNull;
import static net.hydromatic.kleis.util.Static.transformEager;

import com.google.common.collect.ImmutableList;
import java.util.List;
import net.hydromatic.kleis.ast.Ast;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Declaration of an operation that is a candidate for a call.
 *
 * <p>The signature is expressed in terms of the parameters of the owning
 * structure. If the candidate comes from an implementation, the structure's
 * parameters are bound to the implementation's type arguments. If the
 * operation is declared outside any structure, there is no owner.
 */
public class OperationSignature {
  public final Ast.OperationMember operation;
  public final Ast.@Nullable StructureDef structure;
  public final Ast.@Nullable ImplementsDef implementation;

  OperationSignature(
      Ast.OperationMember operation,
      Ast.@Nullable StructureDef structure,
      Ast.@Nullable ImplementsDef implementation) {
    this.operation = requireNonNull(operation);
    this.structure = structure;
    this.implementation = implementation;
  }

  /** Returns the name of the operation. */
  public String name() {
    return operation.name;
  }

  /** Returns the number of arguments. */
  public int arity() {
    return operation.arity();
  }

  /** Returns the declared parameter types. */
  public List<Ast.TypeExpr> parameterTypes() {
    return operation.signature instanceof Ast.FunctionTypeExpr
        ? ((Ast.FunctionTypeExpr) operation.signature).parameterTypes()
        : ImmutableList.of();
  }

  /** Returns the declared return type. */
  public Ast.TypeExpr resultType() {
    return operation.signature instanceof Ast.FunctionTypeExpr
        ? ((Ast.FunctionTypeExpr) operation.signature).resultType()
        : operation.signature;
  }

  /** Returns the parameters of the owning structure; empty if none. */
  public List<Ast.TypeParam> typeParams() {
    return structure == null ? ImmutableList.of() : structure.typeParams;
  }

  /**
   * Returns a description of where the candidate comes from, e.g.
   * "Numeric(N)", "Numeric(ℝ)", or "top-level".
   */
  public String owner() {
    if (implementation != null) {
      return implementation.structureName
          + "("
          + implementation.typeId()
          + ")";
    }
    if (structure != null) {
      final StringBuilder buf = new StringBuilder(structure.name);
      if (!structure.typeParams.isEmpty()) {
        buf.append('(')
            .append(
                String.join(
                    ", ", transformEager(structure.typeParams, p -> p.name)))
            .append(')');
      }
      return buf.toString();
    }
    return "top-level";
  }

  @Override
  public String toString() {
    return owner() + "." + operation.name + " : " + operation.signature;
  }
}

// End OperationSignature.java
