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
import static net.hydromatic.kleis.util.Static.transformEager;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.function.UnaryOperator;
import net.hydromatic.kleis.ast.Op;

/** Product type, such as {@code ℝ × ℝ}. */
public class ProductType extends BaseType {
  public final List<Type> elementTypes;

  ProductType(List<? extends Type> elementTypes) {
    super(Op.PRODUCT_TYPE);
    this.elementTypes = ImmutableList.copyOf(elementTypes);
    checkArgument(this.elementTypes.size() >= 2);
  }

  @Override
  public int hashCode() {
    return elementTypes.hashCode() + 7;
  }

  @Override
  public boolean equals(Object obj) {
    return obj == this
        || obj instanceof ProductType
            && elementTypes.equals(((ProductType) obj).elementTypes);
  }

  @Override
  public StringBuilder describe(StringBuilder buf) {
    for (int i = 0; i < elementTypes.size(); i++) {
      if (i > 0) {
        buf.append(op.padded);
      }
      describeOperand(buf, elementTypes.get(i), op);
    }
    return buf;
  }

  @Override
  public <R> R accept(TypeVisitor<R> typeVisitor) {
    return typeVisitor.visit(this);
  }

  @Override
  public ProductType copy(UnaryOperator<Type> transform) {
    final List<Type> elementTypes2 =
        transformEager(elementTypes, t -> t.copy(transform));
    return elementTypes2.equals(elementTypes)
        ? this
        : new ProductType(elementTypes2);
  }
}

// End ProductType.java
