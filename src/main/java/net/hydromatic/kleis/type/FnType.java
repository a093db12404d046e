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

import java.util.Objects;
import java.util.function.UnaryOperator;
import net.hydromatic.kleis.ast.Op;

/** The type of a function value. */
public class FnType extends BaseType {
  public final Type paramType;
  public final Type resultType;

  FnType(Type paramType, Type resultType) {
    super(Op.FUNCTION_TYPE);
    this.paramType = requireNonNull(paramType);
    this.resultType = requireNonNull(resultType);
  }

  @Override
  public int hashCode() {
    return Objects.hash(paramType, resultType);
  }

  @Override
  public boolean equals(Object obj) {
    return obj == this
        || obj instanceof FnType
            && paramType.equals(((FnType) obj).paramType)
            && resultType.equals(((FnType) obj).resultType);
  }

  @Override
  public StringBuilder describe(StringBuilder buf) {
    describeOperand(buf, paramType, op).append(op.padded);
    return resultType.describe(buf);
  }

  @Override
  public <R> R accept(TypeVisitor<R> typeVisitor) {
    return typeVisitor.visit(this);
  }

  @Override
  public FnType copy(UnaryOperator<Type> transform) {
    final Type paramType2 = paramType.copy(transform);
    final Type resultType2 = resultType.copy(transform);
    return paramType2.equals(paramType) && resultType2.equals(resultType)
        ? this
        : new FnType(paramType2, resultType2);
  }
}

// End FnType.java
