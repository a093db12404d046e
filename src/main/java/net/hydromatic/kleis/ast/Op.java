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

import java.util.Locale;

/**
 * Sub-types of {@link Ast.Node} and of {@link net.hydromatic.kleis.type.Type}.
 */
public enum Op {
  // expressions
  CONST,
  ID,
  PLACEHOLDER,
  OPERATION,
  LIST,

  // type expressions, as written in structure declarations
  NAMED_TYPE_EXPR,
  PARAMETRIC_TYPE_EXPR,
  FUNCTION_TYPE_EXPR(" → "),
  PRODUCT_TYPE_EXPR(" × "),
  NAT_TYPE_EXPR,
  VAR_TYPE_EXPR,

  // structure members
  OPERATION_MEMBER,
  ELEMENT_MEMBER,
  AXIOM_MEMBER,
  NESTED_STRUCTURE,

  // declarations
  STRUCTURE_DECL,
  IMPLEMENTS_DECL,
  OPERATION_DECL,
  DATA_DECL,

  // types
  TY_VAR,
  DATA_TYPE,
  NAT_VALUE,
  FUNCTION_TYPE(" → "),
  PRODUCT_TYPE(" × "),
  PRIMITIVE_TYPE;

  /** Separator when this operator is printed between its operands, or null. */
  public final String padded;

  Op() {
    this(null);
  }

  Op(String padded) {
    this.padded = padded;
  }

  /** Returns the name in lower-case, e.g. "placeholder". */
  public String lowerName() {
    return name().toLowerCase(Locale.ROOT);
  }
}

// End Op.java
