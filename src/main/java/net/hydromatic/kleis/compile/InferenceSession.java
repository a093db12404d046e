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

import com.google.common.collect.ImmutableMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import net.hydromatic.kleis.ast.Ast;
import net.hydromatic.kleis.type.Substitution;
import net.hydromatic.kleis.type.Type;
import net.hydromatic.kleis.type.TypeUnifier;
import net.hydromatic.kleis.type.TypeVar;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * State of one call to infer the type of an expression.
 *
 * <p>Owns the counter that allocates type variables, the substitution built
 * up so far, and the types assigned to identifiers. A session is created at
 * the start of a call and discarded at the end; it is never shared between
 * calls or threads.
 */
public class InferenceSession implements SignatureInterpreter.VarFactory {
  private final TypeContext context;
  private final TypeUnifier.Tracer tracer;
  /** Types of identifiers seen so far, in order of first occurrence. */
  private final Map<String, Type> identifiers = new LinkedHashMap<>();
  /** Fresh variables that stand for the variables in {@link #context}. */
  private final Map<TypeVar, TypeVar> contextVars = new HashMap<>();
  private int varCount = 0;
  private Substitution substitution = Substitution.EMPTY;

  InferenceSession(TypeContext context, TypeUnifier.Tracer tracer) {
    this.context = requireNonNull(context);
    this.tracer = requireNonNull(tracer);
  }

  /** Creates a type variable that stands for a type. */
  public TypeVar newVar() {
    return newVar(Ast.TypeParam.Kind.TYPE, null);
  }

  @Override
  public TypeVar newVar(Ast.TypeParam.Kind kind, @Nullable String hint) {
    return new TypeVar(varCount++, kind, hint);
  }

  /** Returns the number of variables created so far. */
  public int varCount() {
    return varCount;
  }

  public Substitution substitution() {
    return substitution;
  }

  void setSubstitution(Substitution substitution) {
    this.substitution = requireNonNull(substitution);
  }

  /** Applies the current substitution to a type. */
  public Type apply(Type type) {
    return substitution.apply(type);
  }

  /**
   * Unifies two types, extending the current substitution.
   *
   * @throws net.hydromatic.kleis.type.TypeError if they do not unify
   */
  void unify(Type expected, Type actual) {
    substitution = TypeUnifier.unify(expected, actual, substitution, tracer);
  }

  /**
   * Returns the type of an identifier.
   *
   * <p>If the context binds the identifier, uses that type; otherwise assigns
   * a fresh variable. Either way, later occurrences of the identifier in this
   * session get the same type.
   */
  public Type lookupIdentifier(String name) {
    final Type type = identifiers.get(name);
    if (type != null) {
      return type;
    }
    final Type contextType = context.getOpt(name);
    final Type type2 =
        contextType == null
            ? newVar(Ast.TypeParam.Kind.TYPE, name)
            : contextType.copy(
                t ->
                    contextVars.computeIfAbsent(
                        (TypeVar) t,
                        v -> newVar(v.kind, v.hint)));
    identifiers.put(name, type2);
    return type2;
  }

  /**
   * Returns the types of the identifiers seen so far, with the current
   * substitution applied.
   */
  public Map<String, Type> identifierTypes() {
    final ImmutableMap.Builder<String, Type> b = ImmutableMap.builder();
    identifiers.forEach((name, type) -> b.put(name, apply(type)));
    return b.build();
  }
}

// End InferenceSession.java
