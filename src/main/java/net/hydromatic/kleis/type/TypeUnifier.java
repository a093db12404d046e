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
import static java.util.Objects.requireNonNull;

import java.util.List;
import net.hydromatic.kleis.ast.Op;

/**
 * Unifies two types, extending a {@link Substitution}.
 *
 * <p>Each call works on a copy: if unification fails, the caller's
 * substitution is unchanged and a {@link TypeError} is thrown.
 */
public class TypeUnifier {
  private final Tracer tracer;
  private Substitution substitution;

  private TypeUnifier(Substitution substitution, Tracer tracer) {
    this.substitution = requireNonNull(substitution);
    this.tracer = requireNonNull(tracer);
  }

  /** Unifies two types, with no tracing. */
  public static Substitution unify(
      Type type1, Type type2, Substitution substitution) {
    return unify(type1, type2, substitution, NullTracer.INSTANCE);
  }

  /**
   * Unifies two types, returning a substitution that extends {@code
   * substitution} and makes them equal.
   *
   * <p>If two dimensions conflict, {@link DimensionMismatchError#expected} is
   * the dimension from {@code type1}.
   *
   * @throws TypeError if the types cannot be unified
   */
  public static Substitution unify(
      Type type1, Type type2, Substitution substitution, Tracer tracer) {
    final TypeUnifier unifier = new TypeUnifier(substitution, tracer);
    unifier.unify(type1, type2);
    return unifier.substitution;
  }

  /** Unifies two lists of types pairwise, left to right. */
  public static Substitution unifyAll(
      List<? extends Type> types1,
      List<? extends Type> types2,
      Substitution substitution,
      Tracer tracer) {
    checkArgument(types1.size() == types2.size(), "lists differ in length");
    final TypeUnifier unifier = new TypeUnifier(substitution, tracer);
    unifier.unifyList(types1, types2);
    return unifier.substitution;
  }

  private void unify(Type type1, Type type2) {
    final Type t1 = substitution.apply(type1);
    final Type t2 = substitution.apply(type2);
    if (t1.op() == Op.TY_VAR) {
      bindVar((TypeVar) t1, t2, false);
      return;
    }
    if (t2.op() == Op.TY_VAR) {
      bindVar((TypeVar) t2, t1, true);
      return;
    }
    if (t1.op() != t2.op()) {
      throw conflict(t1, t2, TypeError.typeMismatch(t1, t2));
    }
    switch (t1.op()) {
      case DATA_TYPE:
        final DataType dataType1 = (DataType) t1;
        final DataType dataType2 = (DataType) t2;
        if (!dataType1.constructor.equals(dataType2.constructor)
            || dataType1.args.size() != dataType2.args.size()) {
          throw conflict(t1, t2, TypeError.typeMismatch(t1, t2));
        }
        unifyList(dataType1.args, dataType2.args);
        return;

      case NAT_VALUE:
        final NatValue nat1 = (NatValue) t1;
        final NatValue nat2 = (NatValue) t2;
        if (nat1.value != nat2.value) {
          throw conflict(
              t1, t2, TypeError.dimensionMismatch(nat1.value, nat2.value));
        }
        return;

      case FUNCTION_TYPE:
        final FnType fnType1 = (FnType) t1;
        final FnType fnType2 = (FnType) t2;
        unify(fnType1.paramType, fnType2.paramType);
        unify(fnType1.resultType, fnType2.resultType);
        return;

      case PRODUCT_TYPE:
        final ProductType product1 = (ProductType) t1;
        final ProductType product2 = (ProductType) t2;
        if (product1.elementTypes.size() != product2.elementTypes.size()) {
          throw conflict(t1, t2, TypeError.typeMismatch(t1, t2));
        }
        unifyList(product1.elementTypes, product2.elementTypes);
        return;

      case PRIMITIVE_TYPE:
        if (t1 != t2) {
          throw conflict(t1, t2, TypeError.typeMismatch(t1, t2));
        }
        return;

      default:
        throw new AssertionError("unknown type " + t1);
    }
  }

  /** Unifies lists of equal length; later pairs see earlier bindings. */
  private void unifyList(
      List<? extends Type> types1, List<? extends Type> types2) {
    for (int i = 0; i < types1.size(); i++) {
      unify(types1.get(i), types2.get(i));
    }
  }

  /**
   * Binds a variable to a type. Both have had the current substitution
   * applied. If {@code swapped}, the variable came from the second type, and
   * errors must report the types in their original order.
   */
  private void bindVar(TypeVar typeVar, Type type, boolean swapped) {
    if (type.equals(typeVar)) {
      return;
    }
    if (type.op() == Op.TY_VAR) {
      final TypeVar typeVar2 = (TypeVar) type;
      if (typeVar.isNat() && !typeVar2.isNat()) {
        // Keep the dimension variable, so that its kind is not lost.
        bind(typeVar2, typeVar);
      } else {
        bind(typeVar, typeVar2);
      }
      return;
    }
    final Type left = swapped ? type : typeVar;
    final Type right = swapped ? typeVar : type;
    if (typeVar.isNat() && type.op() != Op.NAT_VALUE) {
      throw conflict(left, right, TypeError.typeMismatch(left, right));
    }
    if (type.contains(typeVar)) {
      throw conflict(left, right, TypeError.occursCheck(typeVar, type));
    }
    bind(typeVar, type);
  }

  private void bind(TypeVar typeVar, Type type) {
    tracer.onBind(typeVar, type);
    substitution = substitution.bind(typeVar, type);
  }

  private TypeError conflict(Type left, Type right, TypeError e) {
    tracer.onConflict(left, right, e);
    return e;
  }

  /** Called by the unifier as it binds variables and hits conflicts. */
  public interface Tracer {
    /** Called when a variable is bound. */
    void onBind(TypeVar typeVar, Type type);

    /** Called when two types cannot be unified. */
    void onConflict(Type left, Type right, TypeError e);
  }

  /** Tracer that does nothing. */
  private enum NullTracer implements Tracer {
    INSTANCE;

    @Override
    public void onBind(TypeVar typeVar, Type type) {}

    @Override
    public void onConflict(Type left, Type right, TypeError e) {}
  }
}

// End TypeUnifier.java
