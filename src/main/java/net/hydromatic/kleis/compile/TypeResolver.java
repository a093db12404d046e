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

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;
import static net.hydromatic.kleis.util.Static.anyMatch;
import static net.hydromatic.kleis.util.Static.skip;
import static net.hydromatic.kleis.util.Static.transformEager;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;
import java.util.Set;
import net.hydromatic.kleis.ast.Ast;
import net.hydromatic.kleis.type.DimensionMismatchError;
import net.hydromatic.kleis.type.Substitution;
import net.hydromatic.kleis.type.Type;
import net.hydromatic.kleis.type.TypeError;
import net.hydromatic.kleis.type.TypeSystem;
import net.hydromatic.kleis.type.TypeVar;

/**
 * Deduces the type of an expression.
 *
 * <p>Walks the expression depth-first, left to right. Constants get the
 * default literal type, identifiers and placeholders get type variables, and
 * each operation is dispatched to the first (or, under {@link
 * Prop.DispatchPolicy#MOST_SPECIFIC}, the most specific) declaration that
 * accepts its argument types. The first error stops the walk.
 */
public class TypeResolver {
  /** Names of operations that are typed as matrix literals. */
  private static final Set<String> MATRIX_CONSTRUCTORS =
      ImmutableSet.of("Matrix", "PMatrix", "VMatrix", "BMatrix");

  private final StructureRegistry registry;
  private final TypeSystem typeSystem;
  private final Map<Prop, Object> props;
  private final Tracer tracer;
  private final SignatureInterpreter interpreter;

  public TypeResolver(
      StructureRegistry registry,
      TypeSystem typeSystem,
      Map<Prop, Object> props,
      Tracer tracer) {
    this.registry = requireNonNull(registry);
    this.typeSystem = requireNonNull(typeSystem);
    this.props = ImmutableMap.copyOf(props);
    this.tracer = requireNonNull(tracer);
    this.interpreter =
        new SignatureInterpreter(typeSystem, registry, tracer);
  }

  /**
   * Deduces the type of an expression.
   *
   * @throws TypeError if the expression is not well-typed
   */
  public Resolved resolve(Ast.Exp exp, TypeContext context) {
    final InferenceSession session = new InferenceSession(context, tracer);
    final List<Call> calls = new ArrayList<>();
    final Type type = deduceType(session, exp, calls);

    // Bindings made after an operation was typed may refine its result, so
    // apply the final substitution once more.
    final Type resolvedType = session.apply(type);
    final Set<String> availableTypes = new LinkedHashSet<>();
    if (!resolvedType.isConcrete()) {
      for (Call call : calls) {
        if (!session.apply(call.type).isConcrete()) {
          availableTypes.addAll(registry.typesSupporting(call.operationName));
        }
      }
    }
    return new Resolved(
        exp,
        resolvedType,
        session.substitution(),
        session.identifierTypes(),
        ImmutableList.copyOf(availableTypes));
  }

  private Type deduceType(
      InferenceSession session, Ast.Exp exp, List<Call> calls) {
    switch (exp.op) {
      case CONST:
        return literalType();

      case ID:
        return session.lookupIdentifier(((Ast.Id) exp).name);

      case PLACEHOLDER:
        final Ast.Placeholder placeholder = (Ast.Placeholder) exp;
        return session.newVar(
            Ast.TypeParam.Kind.TYPE,
            placeholder.hint.isEmpty() ? null : placeholder.hint);

      case LIST:
        final Ast.ListExp list = (Ast.ListExp) exp;
        final TypeVar elementType = session.newVar();
        for (Ast.Exp item : list.items) {
          session.unify(elementType, deduceType(session, item, calls));
        }
        return typeSystem.list(session.apply(elementType));

      case OPERATION:
        final Ast.Operation operation = (Ast.Operation) exp;
        if (Prop.MATRIX_LITERALS.booleanValue(props)
            && MATRIX_CONSTRUCTORS.contains(operation.name)) {
          return deduceMatrixType(session, operation, calls);
        }
        return deduceOperationType(session, operation, calls);

      default:
        throw new AssertionError("cannot deduce type for " + exp.op);
    }
  }

  /** Returns the type of a numeric constant. */
  private Type literalType() {
    final String name = Prop.DEFAULT_LITERAL_TYPE.stringValue(props);
    final Type type = typeSystem.lookupOpt(name);
    return type != null ? type : typeSystem.dataType(name);
  }

  private Type deduceOperationType(
      InferenceSession session, Ast.Operation operation, List<Call> calls) {
    final List<Type> argTypes = new ArrayList<>();
    for (Ast.Exp arg : operation.args) {
      argTypes.add(deduceType(session, arg, calls));
    }
    final List<Type> appliedArgTypes = transformEager(argTypes, session::apply);

    final List<OperationSignature> candidates =
        registry.signaturesFor(operation.name, operation.args.size());
    if (candidates.isEmpty()) {
      throw unbound(operation);
    }

    final Prop.DispatchPolicy policy =
        Prop.DISPATCH_POLICY.enumValue(props, Prop.DispatchPolicy.class);
    final List<TypeError> failures = new ArrayList<>();
    SignatureInterpreter.Match best = null;
    OperationSignature bestCandidate = null;
    for (OperationSignature candidate : candidates) {
      tracer.onCandidate(candidate, appliedArgTypes);
      final SignatureInterpreter.Match match;
      try {
        match =
            interpreter.interpret(
                candidate, appliedArgTypes, session.substitution(), session);
      } catch (TypeError e) {
        tracer.onCandidateRejected(candidate, e);
        failures.add(e);
        continue;
      }
      if (best == null || match.specificity > best.specificity) {
        best = match;
        bestCandidate = candidate;
      }
      if (policy == Prop.DispatchPolicy.FIRST_MATCH) {
        break;
      }
    }
    if (best == null) {
      throw noMatch(operation.name, appliedArgTypes, failures);
    }
    session.setSubstitution(best.substitution);
    tracer.onCandidateSelected(requireNonNull(bestCandidate), best.type);
    calls.add(new Call(operation.name, best.type));
    return best.type;
  }

  private TypeError unbound(Ast.Operation operation) {
    final TypeError e =
        TypeError.unboundOperation(operation.name, operation.args.size());
    final Set<Integer> arities = registry.aritiesOf(operation.name);
    if (arities.isEmpty()) {
      return e;
    }
    final String arityList =
        String.join(" or ", transformEager(arities, Object::toString));
    return e.withSuggestion(
        "operation " + operation.name + " takes " + arityList + " argument"
            + (arities.equals(ImmutableSet.of(1)) ? "" : "s"));
  }

  /**
   * Chooses the error to report when no candidate accepts the arguments.
   *
   * <p>A dimension mismatch is the most precise, so it wins. If every
   * candidate failed for the same reason, that reason is reported. Otherwise,
   * the error lists the argument types and the types that support the
   * operation.
   */
  private TypeError noMatch(
      String operationName, List<Type> argTypes, List<TypeError> failures) {
    for (TypeError failure : failures) {
      if (failure instanceof DimensionMismatchError) {
        return failure;
      }
    }
    final TypeError first = failures.get(0);
    if (first.kind != TypeError.Kind.TYPE_MISMATCH
        && !anyMatch(failures, e -> e.kind != first.kind)) {
      return first;
    }
    final StringBuilder buf =
        new StringBuilder("attempted argument types ").append(argTypes);
    final List<String> types = registry.typesSupporting(operationName);
    if (!types.isEmpty()) {
      buf.append("; operation ")
          .append(operationName)
          .append(" is available for types: ")
          .append(String.join(", ", types));
    } else {
      final String structureName =
          registry.structureForOperation(operationName);
      if (structureName != null) {
        buf.append("; operation ")
            .append(operationName)
            .append(" is declared in structure ")
            .append(structureName)
            .append(" but no type implements it yet");
      }
    }
    return TypeError.noMatchingImplementation(operationName, argTypes)
        .withSuggestion(buf.toString());
  }

  /** Deduces the type of a matrix literal, "Matrix(rows, cols, e...)". */
  private Type deduceMatrixType(
      InferenceSession session, Ast.Operation operation, List<Call> calls) {
    if (operation.args.size() < 2) {
      throw TypeError.arityMismatch(operation.name, 2, operation.args.size());
    }
    final int rows = dimension(operation, operation.args.get(0));
    final int cols = dimension(operation, operation.args.get(1));
    final List<Ast.Exp> elements = skip(operation.args, 2);
    final long count = (long) rows * cols;
    if (elements.size() != count) {
      throw new TypeError(
          TypeError.Kind.ARITY_MISMATCH,
          format(
              "%s(%d, %d) expects %d elements, found %d",
              operation.name, rows, cols, count, elements.size()),
          format("give %d elements, row by row", count));
    }
    final TypeVar elementType = session.newVar();
    for (Ast.Exp element : elements) {
      session.unify(elementType, deduceType(session, element, calls));
    }
    return typeSystem.matrix(rows, cols, session.apply(elementType));
  }

  private static int dimension(Ast.Operation operation, Ast.Exp arg) {
    if (arg instanceof Ast.Const) {
      final OptionalInt value = ((Ast.Const) arg).naturalValue();
      if (value.isPresent()) {
        return value.getAsInt();
      }
    }
    throw new TypeError(
        TypeError.Kind.TYPE_MISMATCH,
        "dimension of " + operation.name
            + " must be a natural number literal, found " + arg,
        null);
  }

  /** An operation that has been typed, and its result type. */
  private static class Call {
    final String operationName;
    final Type type;

    Call(String operationName, Type type) {
      this.operationName = operationName;
      this.type = type;
    }
  }

  /** Result of deducing the type of an expression. */
  public static class Resolved {
    public final Ast.Exp exp;
    /** Type of the expression, with the final substitution applied. */
    public final Type type;
    public final Substitution substitution;
    /** Types of the identifiers in the expression. */
    public final Map<String, Type> identifierTypes;
    /**
     * Types that support the operations whose result is still a variable;
     * empty if {@link #type} is concrete.
     */
    public final List<String> availableTypes;

    Resolved(
        Ast.Exp exp,
        Type type,
        Substitution substitution,
        Map<String, Type> identifierTypes,
        List<String> availableTypes) {
      this.exp = requireNonNull(exp);
      this.type = requireNonNull(type);
      this.substitution = requireNonNull(substitution);
      this.identifierTypes = ImmutableMap.copyOf(identifierTypes);
      this.availableTypes = ImmutableList.copyOf(availableTypes);
    }
  }
}

// End TypeResolver.java
