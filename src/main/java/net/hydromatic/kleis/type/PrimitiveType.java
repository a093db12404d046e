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

import java.util.function.UnaryOperator;
import net.hydromatic.kleis.ast.Op;

/** Primitive type. */
public enum PrimitiveType implements Type {
  BOOL("Bool"),
  NAT("ℕ"),
  STRING("String"),
  UNIT("Unit");

  /** The name in the language, e.g. {@code Bool}. */
  public final String moniker;

  PrimitiveType(String moniker) {
    this.moniker = moniker;
  }

  @Override
  public String toString() {
    return moniker;
  }

  @Override
  public String moniker() {
    return moniker;
  }

  @Override
  public StringBuilder describe(StringBuilder buf) {
    return buf.append(moniker);
  }

  @Override
  public Op op() {
    return Op.PRIMITIVE_TYPE;
  }

  @Override
  public <R> R accept(TypeVisitor<R> typeVisitor) {
    return typeVisitor.visit(this);
  }

  @Override
  public PrimitiveType copy(UnaryOperator<Type> transform) {
    return this;
  }
}

// End PrimitiveType.java
