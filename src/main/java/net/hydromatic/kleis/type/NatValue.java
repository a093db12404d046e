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

import java.util.function.UnaryOperator;
import net.hydromatic.kleis.ast.Op;

/**
 * Natural number in a type argument position, such as the "2" and "3" in
 * {@code Matrix(2, 3, ℝ)}.
 *
 * <p>Unifies only with an equal value or with a type variable.
 */
public class NatValue extends BaseType {
  public final int value;

  NatValue(int value) {
    super(Op.NAT_VALUE);
    checkArgument(value >= 0, "dimension must be non-negative: %s", value);
    this.value = value;
  }

  @Override
  public int hashCode() {
    return value + 1279;
  }

  @Override
  public boolean equals(Object obj) {
    return obj == this
        || obj instanceof NatValue && value == ((NatValue) obj).value;
  }

  @Override
  public StringBuilder describe(StringBuilder buf) {
    return buf.append(value);
  }

  @Override
  public <R> R accept(TypeVisitor<R> typeVisitor) {
    return typeVisitor.visit(this);
  }

  @Override
  public NatValue copy(UnaryOperator<Type> transform) {
    return this;
  }
}

// End NatValue.java
