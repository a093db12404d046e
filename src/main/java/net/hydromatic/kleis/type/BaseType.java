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

import net.hydromatic.kleis.ast.Op;

/** Abstract implementation of {@link Type}. */
abstract class BaseType implements Type {
  public final Op op;

  protected BaseType(Op op) {
    this.op = requireNonNull(op);
  }

  @Override
  public Op op() {
    return op;
  }

  @Override
  public String toString() {
    return describe(new StringBuilder()).toString();
  }

  /**
   * Writes a component type, wrapping it in parentheses if it binds less
   * tightly than {@code op}.
   */
  static StringBuilder describeOperand(StringBuilder buf, Type type, Op op) {
    final boolean paren =
        type.op() == Op.FUNCTION_TYPE
            || type.op() == Op.PRODUCT_TYPE && op == Op.PRODUCT_TYPE;
    if (paren) {
      buf.append('(');
    }
    type.describe(buf);
    if (paren) {
      buf.append(')');
    }
    return buf;
  }
}

// End BaseType.java
