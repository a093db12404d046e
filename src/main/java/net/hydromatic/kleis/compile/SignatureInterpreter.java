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
import static net.hydromatic.kleis.util.Static.transformEager;

import com.google.common.collect.ImmutableList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import net.hydromatic.kleis.ast.Ast;
import net.hydromatic.kleis.ast.Op;
import net.hydromatic.kleis.type.DataType;
import net.hydromatic.kleis.type.DimensionMismatchError;
import net.hydromatic.kleis.type.FnType;
import net.hydromatic.kleis.type.NatValue;
import net.hydromatic.kleis.type.PrimitiveType;
import net.hydromatic.kleis.type.ProductType;
import net.hydromatic.kleis.type.Substitution;
import net.hydromatic.kleis.type.Type;
import net.hydromatic.kleis.type.TypeError;
import net.hydromatic.kleis.type.TypeSystem;
import net.hydromatic.kleis.type.TypeUnifier;
import net.hydromatic.kleis.type.TypeVar;
import net.hydromatic.kleis.type.TypeVisitor;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Computes the result type of a call to an operation, given one candidate
 * declaration of the operation and the types of the arguments.
 *
 * <p>Each interpretation gives the owning structure's parameters fresh type
 * variables, then unifies the declared parameter types with the argument
 * types. This binds the structure's parameters (such as {@code m}, {@code n}
 * and {@code T} in {@code Matrix(m, n, T)}) and may also bind variables in the
 * argument types.
 */
public class SignatureInterpreter {
  private final TypeSystem typeSystem;
  private final StructureRegistry registry;
  private final TypeUnifier.Tracer tracer;

  public SignatureInterpreter(TypeSystem typeSystem,
      StructureRegistry registry, TypeUnifier.Tracer tracer) {
    this.typeSystem = requireNonNull(typeSystem);
    this.registry = requireNonNull(registry);
    this.tracer = requireNonNull(tracer);
  }

  /**
   * Interprets a candidate signature for given argument types.
   *
   * @param candidate Declaration of the operation
   * @param argTypes Types of the arguments, with {@code substitution} applied
   * @param substitution Substitution so far
   * @param varFactory Creates fresh type variables
   * @return Result type and the extended substitution
   * @throws TypeError if the candidate does not accept the arguments
   */
  public Match interpret(
      OperationSignature candidate,
      List<Type> argTypes,
      Substitution substitution,
      VarFactory varFactory) {
    final List<Ast.TypeExpr> paramExprs = candidate.parameterTypes();
    if (paramExprs.size() != argTypes.size()) {
      throw TypeError.arityMismatch(
          candidate.name(), paramExprs.size(), argTypes.size());
    }

    // Give each parameter of the structure a fresh variable.
    final Scope scope = new Scope(varFactory);
    final Map<String, TypeVar> paramVars = new LinkedHashMap<>();
    for (Ast.TypeParam typeParam : candidate.typeParams()) {
      final TypeVar typeVar = varFactory.newVar(typeParam.kind, typeParam.name);
      paramVars.put(typeParam.name, typeVar);
      scope.bind(typeParam.name, typeVar);
    }

    // If the candidate comes from an implementation, bind the parameters to
    // its type arguments. Names in the type arguments that are not types,
    // such as "T" in "Set(T)", are local to the implementation.
    Substitution s = substitution;
    if (candidate.implementation != null) {
      final Scope implementationScope = new Scope(varFactory);
      final List<Ast.TypeExpr> typeArgs = candidate.implementation.typeArgs;
      int i = 0;
      for (TypeVar typeVar : paramVars.values()) {
        if (i >= typeArgs.size()) {
          break;
        }
        final Type typeArg = implementationScope.resolve(typeArgs.get(i++));
        s = TypeUnifier.unify(typeVar, typeArg, s, tracer);
      }
    }

    final List<Type> declaredTypes = transformEager(paramExprs, scope::resolve);
    final Type resultType = scope.resolve(candidate.resultType());
    int specificity = 0;
    for (Type declaredType : declaredTypes) {
      specificity += concreteness(s.apply(declaredType));
    }

    for (int i = 0; i < declaredTypes.size(); i++) {
      try {
        s = TypeUnifier.unify(declaredTypes.get(i), argTypes.get(i), s, tracer);
      } catch (DimensionMismatchError e) {
        throw describe(
            e, candidate, i, paramExprs.get(i), declaredTypes.get(i),
            argTypes.get(i), s, scope);
      }
    }

    checkResolved(candidate, paramVars, argTypes, s);
    return new Match(s.apply(resultType), s, specificity);
  }

  /**
   * Checks that every parameter of the structure that occurs in the result
   * type is determined by the arguments. A parameter is determined if the
   * variables it is bound to all occur in the argument types.
   */
  private static void checkResolved(
      OperationSignature candidate,
      Map<String, TypeVar> paramVars,
      List<Type> argTypes,
      Substitution s) {
    final Set<TypeVar> argVars = new HashSet<>();
    for (Type argType : argTypes) {
      argVars.addAll(s.apply(argType).typeVars());
    }
    final Ast.TypeExpr resultExpr = candidate.resultType();
    paramVars.forEach(
        (name, typeVar) -> {
          if (!resultExpr.mentions(name)) {
            return;
          }
          for (TypeVar v : s.apply(typeVar).typeVars()) {
            if (!argVars.contains(v)) {
              throw TypeError.unresolvedTypeParameter(
                  requireNonNull(candidate.structure).name,
                  name,
                  candidate.name());
            }
          }
        });
  }

  /**
   * Rewrites a dimension mismatch so that it names the operation, the
   * argument, and the structure parameter whose values conflict.
   */
  private DimensionMismatchError describe(
      DimensionMismatchError e,
      OperationSignature candidate,
      int ordinal,
      Ast.TypeExpr paramExpr,
      Type declaredType,
      Type argType,
      Substitution s,
      Scope scope) {
    String parameter = findParameter(paramExpr, argType, e, scope, s, true);
    if (parameter == null) {
      parameter = findParameter(paramExpr, argType, e, scope, s, false);
    }
    final Type expectedType = s.apply(declaredType);
    final String argument = "argument " + (ordinal + 1);
    final StringBuilder buf =
        new StringBuilder("dimension mismatch in ")
            .append(argument)
            .append(" of ")
            .append(candidate.name())
            .append(": ");
    if (parameter != null) {
      buf.append("parameter ").append(parameter).append(' ');
    }
    buf.append("expected ")
        .append(e.expected)
        .append(", found ")
        .append(e.found)
        .append(" (")
        .append(expectedType)
        .append(" vs ")
        .append(argType)
        .append(')');
    return e.withParameter(parameter, buf.toString())
        .withSuggestion(
            argument + " of " + candidate.name() + " must have type "
                + expectedType);
  }

  /**
   * Finds the name in a declared type that sits at the same position as the
   * conflicting dimension in the argument type. If {@code strict}, the name
   * must also be bound to the expected dimension.
   */
  private @Nullable String findParameter(
      Ast.TypeExpr typeExpr,
      Type argType,
      DimensionMismatchError e,
      Scope scope,
      Substitution s,
      boolean strict) {
    switch (typeExpr.op) {
      case NAMED_TYPE_EXPR:
        final String name = ((Ast.NamedTypeExpr) typeExpr).name;
        if (!(argType instanceof NatValue)
            || ((NatValue) argType).value != e.found) {
          return null;
        }
        final Type bound = scope.getOpt(name);
        if (bound == null) {
          return null;
        }
        if (strict && !s.apply(bound).equals(typeSystem.nat(e.expected))) {
          return null;
        }
        return name;

      case PARAMETRIC_TYPE_EXPR:
        final Ast.ParametricTypeExpr parametric =
            (Ast.ParametricTypeExpr) typeExpr;
        if (!(argType instanceof DataType)
            || ((DataType) argType).args.size() != parametric.args.size()) {
          return null;
        }
        return findParameter(
            parametric.args, ((DataType) argType).args, e, scope, s, strict);

      case FUNCTION_TYPE_EXPR:
        final Ast.FunctionTypeExpr function = (Ast.FunctionTypeExpr) typeExpr;
        if (!(argType instanceof FnType)) {
          return null;
        }
        final FnType fnType = (FnType) argType;
        final String p =
            findParameter(function.from, fnType.paramType, e, scope, s, strict);
        if (p != null) {
          return p;
        }
        return findParameter(
            function.to, fnType.resultType, e, scope, s, strict);

      case PRODUCT_TYPE_EXPR:
        final Ast.ProductTypeExpr product = (Ast.ProductTypeExpr) typeExpr;
        if (!(argType instanceof ProductType)
            || ((ProductType) argType).elementTypes.size()
                != product.elements.size()) {
          return null;
        }
        return findParameter(
            product.elements,
            ((ProductType) argType).elementTypes,
            e, scope, s, strict);

      default:
        return null;
    }
  }

  private @Nullable String findParameter(
      List<Ast.TypeExpr> typeExprs,
      List<Type> argTypes,
      DimensionMismatchError e,
      Scope scope,
      Substitution s,
      boolean strict) {
    for (int i = 0; i < typeExprs.size(); i++) {
      final String p =
          findParameter(typeExprs.get(i), argTypes.get(i), e, scope, s, strict);
      if (p != null) {
        return p;
      }
    }
    return null;
  }

  /**
   * Converts a type expression to a type. Names that are not types become
   * type variables, one per distinct name.
   */
  public Type resolve(Ast.TypeExpr typeExpr, VarFactory varFactory) {
    return new Scope(varFactory).resolve(typeExpr);
  }

  /**
   * Checks that the type expressions in a declared signature apply each type
   * constructor to the right number and kind of arguments.
   *
   * @param typeParams Parameters of the structure that owns the signature
   * @param typeExprs Parameter and result types of the signature
   * @throws TypeError if a constructor is misapplied
   */
  public void checkSignature(List<Ast.TypeParam> typeParams,
      List<Ast.TypeExpr> typeExprs, VarFactory varFactory) {
    final Scope scope = new Scope(varFactory);
    for (Ast.TypeParam typeParam : typeParams) {
      scope.bind(typeParam.name,
          varFactory.newVar(typeParam.kind, typeParam.name));
    }
    typeExprs.forEach(scope::resolve);
  }

  /** Returns the number of nodes in a type that are not type variables. */
  static int concreteness(Type type) {
    final int[] count = {0};
    type.accept(
        new TypeVisitor<Void>() {
          @Override
          public Void visit(DataType dataType) {
            ++count[0];
            return super.visit(dataType);
          }

          @Override
          public Void visit(NatValue natValue) {
            ++count[0];
            return null;
          }

          @Override
          public Void visit(FnType fnType) {
            ++count[0];
            return super.visit(fnType);
          }

          @Override
          public Void visit(ProductType productType) {
            ++count[0];
            return super.visit(productType);
          }

          @Override
          public Void visit(PrimitiveType primitiveType) {
            ++count[0];
            return null;
          }
        });
    return count[0];
  }

  /** Returns whether a name that is not a type denotes a type variable. */
  private static boolean isVariableName(String name) {
    return name.codePointCount(0, name.length()) == 1
        && Character.isLetter(name.codePointAt(0));
  }

  /** Creates type variables. */
  @FunctionalInterface
  public interface VarFactory {
    /** Creates a type variable, unique within its inference session. */
    TypeVar newVar(Ast.TypeParam.Kind kind, @Nullable String hint);
  }

  /** Result of a successful interpretation. */
  public static class Match {
    /** Result type, with the substitution applied. */
    public final Type type;
    public final Substitution substitution;
    /**
     * Number of concrete nodes in the candidate's parameter types before
     * unification with the arguments; higher is more specific.
     */
    public final int specificity;

    Match(Type type, Substitution substitution, int specificity) {
      this.type = requireNonNull(type);
      this.substitution = requireNonNull(substitution);
      this.specificity = specificity;
    }
  }

  /** Names in scope while resolving the type expressions of a signature. */
  private class Scope {
    private final VarFactory varFactory;
    private final Map<String, Type> map = new HashMap<>();

    Scope(VarFactory varFactory) {
      this.varFactory = requireNonNull(varFactory);
    }

    void bind(String name, Type type) {
      map.put(name, type);
    }

    @Nullable Type getOpt(String name) {
      return map.get(name);
    }

    Type resolve(Ast.TypeExpr typeExpr) {
      switch (typeExpr.op) {
        case NAMED_TYPE_EXPR:
          return resolveName(((Ast.NamedTypeExpr) typeExpr).name);

        case PARAMETRIC_TYPE_EXPR:
          return resolveParametric((Ast.ParametricTypeExpr) typeExpr);

        case FUNCTION_TYPE_EXPR:
          final Ast.FunctionTypeExpr function = (Ast.FunctionTypeExpr) typeExpr;
          return typeSystem.fnType(
              resolve(function.from), resolve(function.to));

        case PRODUCT_TYPE_EXPR:
          final Ast.ProductTypeExpr product = (Ast.ProductTypeExpr) typeExpr;
          return typeSystem.productType(
              transformEager(product.elements, this::resolve));

        case NAT_TYPE_EXPR:
          return typeSystem.nat(((Ast.NatTypeExpr) typeExpr).value);

        case VAR_TYPE_EXPR:
          final String varName = "'" + ((Ast.VarTypeExpr) typeExpr).name;
          return map.computeIfAbsent(
              varName, n -> varFactory.newVar(Ast.TypeParam.Kind.TYPE, n));

        default:
          throw new AssertionError("unknown type expression " + typeExpr);
      }
    }

    /**
     * Resolves a constructor applied to arguments, e.g. "Matrix(m, n, ℝ)".
     * If the constructor is a declared data type or a built-in, checks the
     * number of arguments and that each has the kind of its parameter.
     */
    private Type resolveParametric(Ast.ParametricTypeExpr parametric) {
      final String name = parametric.name;
      final Ast.@Nullable DataDef dataDef = registry.dataTypeOpt(name);
      final @Nullable List<Ast.TypeParam.Kind> kinds =
          dataDef != null ? dataDef.kinds()
              : typeSystem.parameterKindsOpt(name);
      if (kinds == null) {
        return typeSystem.dataType(
            name, transformEager(parametric.args, this::resolve));
      }
      if (kinds.size() != parametric.args.size()) {
        throw TypeError.typeArityMismatch(
            name, kinds.size(), parametric.args.size());
      }
      final ImmutableList.Builder<Type> args = ImmutableList.builder();
      for (int i = 0; i < kinds.size(); i++) {
        args.add(resolveArg(name, i, kinds.get(i), parametric.args.get(i)));
      }
      return dataDef != null
          ? typeSystem.declaredType(name, args.build())
          : typeSystem.dataType(name, args.build());
    }

    private Type resolveArg(String constructor, int ordinal,
        Ast.TypeParam.Kind kind, Ast.TypeExpr arg) {
      if (kind == Ast.TypeParam.Kind.NAT
          && arg.op == Op.NAMED_TYPE_EXPR) {
        // An unknown name in a dimension position is a dimension variable,
        // e.g. "n" in "Vector(n, ℝ)".
        final String name = ((Ast.NamedTypeExpr) arg).name;
        if (!map.containsKey(name)
            && !typeSystem.isBuiltIn(name)
            && registry.dataTypeOpt(name) == null) {
          final TypeVar typeVar = varFactory.newVar(kind, name);
          map.put(name, typeVar);
          return typeVar;
        }
      }
      final Type type = resolve(arg);
      switch (kind) {
        case NAT:
          if (!(type instanceof NatValue) && !(type instanceof TypeVar)) {
            throw TypeError.kindMismatch(
                constructor, ordinal, "a dimension", type);
          }
          return type;
        default:
          if (type instanceof NatValue) {
            throw TypeError.kindMismatch(constructor, ordinal, "a type", type);
          }
          return type;
      }
    }

    private Type resolveName(String name) {
      final Type bound = map.get(name);
      if (bound != null) {
        return bound;
      }
      final Type builtIn = typeSystem.lookupOpt(name);
      if (builtIn != null) {
        return builtIn;
      }
      final Ast.@Nullable DataDef dataDef = registry.dataTypeOpt(name);
      if (dataDef != null) {
        if (!dataDef.typeParams.isEmpty()) {
          throw TypeError.typeArityMismatch(
              name, dataDef.typeParams.size(), 0);
        }
        return typeSystem.declaredType(name, ImmutableList.of());
      }
      if (isVariableName(name)) {
        final TypeVar typeVar =
            varFactory.newVar(Ast.TypeParam.Kind.TYPE, name);
        map.put(name, typeVar);
        return typeVar;
      }
      return typeSystem.dataType(name);
    }
  }
}

// End SignatureInterpreter.java
