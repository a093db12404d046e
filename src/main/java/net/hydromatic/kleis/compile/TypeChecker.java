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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.kleis.ast.Ast;
import net.hydromatic.kleis.type.Type;
import net.hydromatic.kleis.type.TypeError;
import net.hydromatic.kleis.type.TypeSystem;
import net.hydromatic.kleis.type.TypeVar;

/**
 * Checks the types of expressions against a collection of structures.
 *
 * <p>A checker is immutable. {@link #load}, {@link #bind} and the other
 * {@code withXxx} methods return a new checker, and never modify the
 * registry of an existing checker, so one checker may be used by several
 * threads at once.
 *
 * <p>For example,
 *
 * <pre>{@code
 * TypeChecker checker = new TypeChecker().withStandardLibrary();
 * TypeCheckResult result =
 *     checker.check(ast.operation("plus", ast.constant(1), ast.constant(2)));
 * // result is Success(ℝ)
 * }</pre>
 */
public class TypeChecker {
  private final StructureRegistry registry;
  private final TypeSystem typeSystem;
  private final ImmutableMap<Prop, Object> props;
  private final Tracer tracer;
  private final TypeContext context;

  /** Creates a checker with no structures, default properties, no tracing. */
  public TypeChecker() {
    this(
        new StructureRegistry(),
        new TypeSystem(),
        ImmutableMap.of(),
        Tracers.empty(),
        TypeContext.EMPTY);
  }

  private TypeChecker(
      StructureRegistry registry,
      TypeSystem typeSystem,
      Map<Prop, Object> props,
      Tracer tracer,
      TypeContext context) {
    this.registry = requireNonNull(registry);
    this.typeSystem = requireNonNull(typeSystem);
    this.props = ImmutableMap.copyOf(props);
    this.tracer = requireNonNull(tracer);
    this.context = requireNonNull(context);
  }

  /** Creates a checker with no structures. */
  public static TypeChecker create(Map<Prop, Object> props, Tracer tracer) {
    return new TypeChecker(
        new StructureRegistry(),
        new TypeSystem(),
        props,
        tracer,
        TypeContext.EMPTY);
  }

  /** Returns a checker that has the structures of the standard library. */
  public TypeChecker withStandardLibrary() {
    return load(StandardLibrary.declarations());
  }

  /**
   * Returns a checker that has this checker's structures plus the given
   * declarations. Declarations may refer to structures loaded earlier.
   *
   * @throws TypeError if a name is declared twice, if the structures
   *     depend on each other in a cycle, or if a signature applies a type
   *     constructor to the wrong number or kind of arguments
   */
  public TypeChecker load(List<? extends Ast.Decl> decls) {
    final StructureRegistry registry2 = registry.copy();
    for (Ast.Decl decl : decls) {
      registry2.registerDecl(decl);
    }
    registry2.validate();
    final SignatureInterpreter interpreter =
        new SignatureInterpreter(typeSystem, registry2, tracer);
    for (Ast.Decl decl : decls) {
      checkDecl(interpreter, decl);
    }
    return new TypeChecker(registry2, typeSystem, props, tracer, context);
  }

  /** Checks the type expressions in a declaration. */
  private void checkDecl(SignatureInterpreter interpreter, Ast.Decl decl) {
    final int[] ordinal = {0};
    final SignatureInterpreter.VarFactory varFactory =
        (kind, hint) -> new TypeVar(ordinal[0]++, kind, hint);
    switch (decl.op) {
      case STRUCTURE_DECL:
        final Ast.StructureDef structure = (Ast.StructureDef) decl;
        for (Ast.OperationMember member : structure.operations()) {
          interpreter.checkSignature(structure.typeParams,
              ImmutableList.of(member.signature), varFactory);
        }
        break;
      case OPERATION_DECL:
        interpreter.checkSignature(ImmutableList.of(),
            ImmutableList.of(((Ast.OperationDecl) decl).member.signature),
            varFactory);
        break;
      case DATA_DECL:
        final Ast.DataDef dataDef = (Ast.DataDef) decl;
        if (typeSystem.isBuiltIn(dataDef.name)) {
          throw TypeError.duplicateName("data type", dataDef.name);
        }
        for (Ast.DataVariant variant : dataDef.variants) {
          interpreter.checkSignature(
              dataDef.typeParams, variant.fields, varFactory);
        }
        break;
      default:
        break;
    }
  }

  /** Returns a checker with a given value of a property. */
  public TypeChecker withProp(Prop prop, Object value) {
    final Map<Prop, Object> props2 = new LinkedHashMap<>(props);
    prop.setLenient(props2, value);
    return new TypeChecker(registry, typeSystem, props2, tracer, context);
  }

  /** Returns a checker with a given tracer. */
  public TypeChecker withTracer(Tracer tracer) {
    return new TypeChecker(registry, typeSystem, props, tracer, context);
  }

  /** Returns a checker that knows the type of an identifier. */
  public TypeChecker bind(String name, Type type) {
    return new TypeChecker(
        registry, typeSystem, props, tracer, context.bind(name, type));
  }

  /**
   * Returns a checker that knows the type of an identifier, given as a type
   * expression such as "Matrix(2, 3, ℝ)". Single-letter names that are not
   * types, such as "n" in "Vector(n, ℝ)", become type variables.
   */
  public TypeChecker bind(String name, Ast.TypeExpr typeExpr) {
    final int[] ordinal = {nextOrdinal()};
    final SignatureInterpreter interpreter =
        new SignatureInterpreter(typeSystem, registry, tracer);
    final Type type =
        interpreter.resolve(
            typeExpr, (kind, hint) -> new TypeVar(ordinal[0]++, kind, hint));
    return bind(name, type);
  }

  /** Returns an ordinal greater than that of any variable in the context. */
  private int nextOrdinal() {
    int ordinal = 0;
    for (String name : context.names()) {
      for (TypeVar typeVar : requireNonNull(context.getOpt(name)).typeVars()) {
        ordinal = Math.max(ordinal, typeVar.ordinal + 1);
      }
    }
    return ordinal;
  }

  /**
   * Checks an expression.
   *
   * <p>Never throws {@link TypeError}; errors are returned as {@link
   * TypeCheckResult.Error}.
   */
  public TypeCheckResult check(Ast.Exp exp) {
    return check(exp, TypeContext.EMPTY);
  }

  /**
   * Checks an expression in a context. Bindings in {@code context} take
   * precedence over those made by {@link #bind}.
   */
  public TypeCheckResult check(Ast.Exp exp, TypeContext context) {
    TypeCheckResult result;
    try {
      final TypeResolver.Resolved resolved = resolve(exp, context);
      result =
          resolved.type.isConcrete()
              ? TypeCheckResult.success(resolved.type)
              : TypeCheckResult.polymorphic(
                  resolved.type, resolved.availableTypes);
    } catch (TypeError e) {
      result = TypeCheckResult.error(e);
    }
    tracer.onResult(result);
    return result;
  }

  /**
   * Deduces the type of an expression. The type may contain type variables.
   *
   * @throws TypeError if the expression is not well-typed
   */
  public Type infer(Ast.Exp exp) {
    return infer(exp, TypeContext.EMPTY);
  }

  public Type infer(Ast.Exp exp, TypeContext context) {
    return resolve(exp, context).type;
  }

  /**
   * Deduces the type of an expression, and also returns the types of its
   * identifiers.
   */
  public TypeResolver.Resolved resolve(Ast.Exp exp, TypeContext context) {
    TypeContext context2 = this.context;
    for (String name : context.names()) {
      context2 = context2.bind(name, requireNonNull(context.getOpt(name)));
    }
    return new TypeResolver(registry, typeSystem, props, tracer)
        .resolve(exp, context2);
  }

  /**
   * Returns the types that support an operation.
   *
   * @see StructureRegistry#typesSupporting(String)
   */
  public List<String> typesSupporting(String operationName) {
    return registry.typesSupporting(operationName);
  }

  public boolean supportsOperation(String typeId, String operationName) {
    return registry.supportsOperation(typeId, operationName);
  }

  /**
   * Returns a copy of this checker's registry. Changes to the copy do not
   * affect this checker; to add declarations, call {@link #load}.
   */
  public StructureRegistry registry() {
    return registry.copy();
  }

  public TypeSystem typeSystem() {
    return typeSystem;
  }
}

// End TypeChecker.java
