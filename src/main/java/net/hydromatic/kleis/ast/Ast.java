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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;
import static net.hydromatic.kleis.util.Static.appendAll;
import static net.hydromatic.kleis.util.Static.transformEager;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalInt;
import java.util.function.Consumer;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Various sub-classes of AST nodes.
 *
 * <p>There are two families. Expressions ({@link Exp}) are the mathematical
 * notation being type-checked. Declarations ({@link Decl}), with their type
 * expressions ({@link TypeExpr}) and members ({@link Member}), describe the
 * algebraic structures that give operations their meaning.
 *
 * <p>Nodes are created by a parser, or via {@link AstBuilder#ast}; they are
 * immutable.
 */
public class Ast {
  private Ast() {}

  /** Base class of all AST nodes. */
  public abstract static class Node {
    public final Op op;

    Node(Op op) {
      this.op = requireNonNull(op);
    }

    @Override
    public final String toString() {
      return unparse(new StringBuilder()).toString();
    }

    /** Writes this node to a builder. */
    public abstract StringBuilder unparse(StringBuilder buf);
  }

  // ---------------------------------------------------------------------------
  // Expressions

  /** Base class for an expression. */
  public abstract static class Exp extends Node {
    Exp(Op op) {
      super(op);
    }

    /** Calls a consumer for each immediate sub-expression. */
    public void forEachArg(Consumer<Exp> consumer) {}

    /** Returns all placeholders in this expression, in tree order. */
    public List<Placeholder> findPlaceholders() {
      final List<Placeholder> list = new ArrayList<>();
      collectPlaceholders(list);
      return ImmutableList.copyOf(list);
    }

    void collectPlaceholders(List<Placeholder> list) {
      forEachArg(arg -> arg.collectPlaceholders(list));
    }

    /**
     * Returns the smallest placeholder id greater than {@code id}, or empty if
     * there is none.
     */
    public OptionalInt nextPlaceholder(int id) {
      return findPlaceholders().stream()
          .mapToInt(p -> p.id)
          .filter(i -> i > id)
          .min();
    }

    /**
     * Returns the largest placeholder id less than {@code id}, or empty if
     * there is none.
     */
    public OptionalInt prevPlaceholder(int id) {
      return findPlaceholders().stream()
          .mapToInt(p -> p.id)
          .filter(i -> i < id)
          .max();
    }
  }

  /** Numeric constant, e.g. "1", "3.14". */
  public static class Const extends Exp {
    public final String text;

    Const(String text) {
      super(Op.CONST);
      this.text = requireNonNull(text);
    }

    /**
     * Returns the value of this constant as a natural number, or empty if it
     * is not one.
     */
    public OptionalInt naturalValue() {
      if (text.isEmpty() || !text.chars().allMatch(Character::isDigit)) {
        return OptionalInt.empty();
      }
      try {
        return OptionalInt.of(Integer.parseInt(text));
      } catch (NumberFormatException e) {
        // Too many digits to be a dimension.
        return OptionalInt.empty();
      }
    }

    @Override
    public StringBuilder unparse(StringBuilder buf) {
      return buf.append(text);
    }

    @Override
    public int hashCode() {
      return text.hashCode();
    }

    @Override
    public boolean equals(Object o) {
      return o == this || o instanceof Const && text.equals(((Const) o).text);
    }
  }

  /** Named object, e.g. "x", "\alpha". */
  public static class Id extends Exp {
    public final String name;

    Id(String name) {
      super(Op.ID);
      this.name = requireNonNull(name);
    }

    @Override
    public StringBuilder unparse(StringBuilder buf) {
      return buf.append(name);
    }

    @Override
    public int hashCode() {
      return name.hashCode() + 17;
    }

    @Override
    public boolean equals(Object o) {
      return o == this || o instanceof Id && name.equals(((Id) o).name);
    }
  }

  /** Empty slot that the user has not yet filled in. */
  public static class Placeholder extends Exp {
    public final int id;
    public final String hint;

    Placeholder(int id, String hint) {
      super(Op.PLACEHOLDER);
      checkArgument(id >= 0, "placeholder id must be non-negative: %s", id);
      this.id = id;
      this.hint = requireNonNull(hint);
    }

    @Override
    void collectPlaceholders(List<Placeholder> list) {
      list.add(this);
    }

    @Override
    public StringBuilder unparse(StringBuilder buf) {
      buf.append('□').append(id);
      if (!hint.isEmpty()) {
        buf.append(':').append(hint);
      }
      return buf;
    }

    @Override
    public int hashCode() {
      return Objects.hash(id, hint);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Placeholder
              && id == ((Placeholder) o).id
              && hint.equals(((Placeholder) o).hint);
    }
  }

  /** Application of a named operation to arguments, e.g. "plus(x, 1)". */
  public static class Operation extends Exp {
    public final String name;
    public final List<Exp> args;

    Operation(String name, List<? extends Exp> args) {
      super(Op.OPERATION);
      this.name = requireNonNull(name);
      this.args = ImmutableList.copyOf(args);
    }

    @Override
    public void forEachArg(Consumer<Exp> consumer) {
      args.forEach(consumer);
    }

    @Override
    public StringBuilder unparse(StringBuilder buf) {
      buf.append(name).append('(');
      for (int i = 0; i < args.size(); i++) {
        if (i > 0) {
          buf.append(", ");
        }
        args.get(i).unparse(buf);
      }
      return buf.append(')');
    }

    @Override
    public int hashCode() {
      return Objects.hash(name, args);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Operation
              && name.equals(((Operation) o).name)
              && args.equals(((Operation) o).args);
    }
  }

  /** List of expressions, e.g. "[1, 2, x]". */
  public static class ListExp extends Exp {
    public final List<Exp> items;

    ListExp(List<? extends Exp> items) {
      super(Op.LIST);
      this.items = ImmutableList.copyOf(items);
    }

    @Override
    public void forEachArg(Consumer<Exp> consumer) {
      items.forEach(consumer);
    }

    @Override
    public StringBuilder unparse(StringBuilder buf) {
      return appendAll(buf.append('['), ", ", items).append(']');
    }

    @Override
    public int hashCode() {
      return items.hashCode() + 31;
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof ListExp && items.equals(((ListExp) o).items);
    }
  }

  // ---------------------------------------------------------------------------
  // Type expressions

  /**
   * Type as written in a declaration, e.g. "Matrix(m, n, T) → Matrix(n, m,
   * T)".
   *
   * <p>Names are resolved into {@link net.hydromatic.kleis.type.Type} objects
   * only when a signature is interpreted.
   */
  public abstract static class TypeExpr extends Node {
    TypeExpr(Op op) {
      super(op);
    }

    /** Calls a consumer for each name that occurs in this type expression. */
    public abstract void forEachName(Consumer<String> consumer);

    /** Returns whether a name occurs in this type expression. */
    public boolean mentions(String name) {
      final boolean[] found = {false};
      forEachName(n -> found[0] |= n.equals(name));
      return found[0];
    }
  }

  /** Type expression consisting of a name, e.g. "ℝ" or "T". */
  public static class NamedTypeExpr extends TypeExpr {
    public final String name;

    NamedTypeExpr(String name) {
      super(Op.NAMED_TYPE_EXPR);
      this.name = requireNonNull(name);
    }

    @Override
    public void forEachName(Consumer<String> consumer) {
      consumer.accept(name);
    }

    @Override
    public StringBuilder unparse(StringBuilder buf) {
      return buf.append(name);
    }

    @Override
    public int hashCode() {
      return name.hashCode();
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof NamedTypeExpr
              && name.equals(((NamedTypeExpr) o).name);
    }
  }

  /** Type constructor applied to arguments, e.g. "Matrix(m, n, T)". */
  public static class ParametricTypeExpr extends TypeExpr {
    public final String name;
    public final List<TypeExpr> args;

    ParametricTypeExpr(String name, List<? extends TypeExpr> args) {
      super(Op.PARAMETRIC_TYPE_EXPR);
      this.name = requireNonNull(name);
      this.args = ImmutableList.copyOf(args);
    }

    @Override
    public void forEachName(Consumer<String> consumer) {
      consumer.accept(name);
      args.forEach(arg -> arg.forEachName(consumer));
    }

    @Override
    public StringBuilder unparse(StringBuilder buf) {
      return appendAll(buf.append(name).append('('), ", ", args).append(')');
    }

    @Override
    public int hashCode() {
      return Objects.hash(name, args);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof ParametricTypeExpr
              && name.equals(((ParametricTypeExpr) o).name)
              && args.equals(((ParametricTypeExpr) o).args);
    }
  }

  /** Function type expression, e.g. "T → T". */
  public static class FunctionTypeExpr extends TypeExpr {
    public final TypeExpr from;
    public final TypeExpr to;

    FunctionTypeExpr(TypeExpr from, TypeExpr to) {
      super(Op.FUNCTION_TYPE_EXPR);
      this.from = requireNonNull(from);
      this.to = requireNonNull(to);
    }

    /**
     * Returns the parameter types of a curried signature. For "A → B → C",
     * returns [A, B].
     */
    public List<TypeExpr> parameterTypes() {
      final ImmutableList.Builder<TypeExpr> b = ImmutableList.builder();
      TypeExpr t = this;
      while (t instanceof FunctionTypeExpr) {
        b.add(((FunctionTypeExpr) t).from);
        t = ((FunctionTypeExpr) t).to;
      }
      return b.build();
    }

    /** Returns the final result type of a curried signature. */
    public TypeExpr resultType() {
      TypeExpr t = this;
      while (t instanceof FunctionTypeExpr) {
        t = ((FunctionTypeExpr) t).to;
      }
      return t;
    }

    @Override
    public void forEachName(Consumer<String> consumer) {
      from.forEachName(consumer);
      to.forEachName(consumer);
    }

    @Override
    public StringBuilder unparse(StringBuilder buf) {
      if (from instanceof FunctionTypeExpr) {
        from.unparse(buf.append('(')).append(')');
      } else {
        from.unparse(buf);
      }
      return to.unparse(buf.append(op.padded));
    }

    @Override
    public int hashCode() {
      return Objects.hash(from, to);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof FunctionTypeExpr
              && from.equals(((FunctionTypeExpr) o).from)
              && to.equals(((FunctionTypeExpr) o).to);
    }
  }

  /** Product type expression, e.g. "ℝ × ℝ". */
  public static class ProductTypeExpr extends TypeExpr {
    public final List<TypeExpr> elements;

    ProductTypeExpr(List<? extends TypeExpr> elements) {
      super(Op.PRODUCT_TYPE_EXPR);
      this.elements = ImmutableList.copyOf(elements);
    }

    @Override
    public void forEachName(Consumer<String> consumer) {
      elements.forEach(e -> e.forEachName(consumer));
    }

    @Override
    public StringBuilder unparse(StringBuilder buf) {
      return appendAll(buf, op.padded, elements);
    }

    @Override
    public int hashCode() {
      return elements.hashCode();
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof ProductTypeExpr
              && elements.equals(((ProductTypeExpr) o).elements);
    }
  }

  /**
   * Natural number in a type argument position, e.g. "4" in "Tensor(0, 2, 4,
   * ℝ)".
   */
  public static class NatTypeExpr extends TypeExpr {
    public final int value;

    NatTypeExpr(int value) {
      super(Op.NAT_TYPE_EXPR);
      checkArgument(value >= 0, "dimension must be non-negative: %s", value);
      this.value = value;
    }

    @Override
    public void forEachName(Consumer<String> consumer) {}

    @Override
    public StringBuilder unparse(StringBuilder buf) {
      return buf.append(value);
    }

    @Override
    public int hashCode() {
      return value;
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof NatTypeExpr && value == ((NatTypeExpr) o).value;
    }
  }

  /**
   * Explicit type variable, e.g. "'a". Each distinct name denotes one variable
   * per interpretation of the enclosing signature.
   */
  public static class VarTypeExpr extends TypeExpr {
    public final String name;

    VarTypeExpr(String name) {
      super(Op.VAR_TYPE_EXPR);
      this.name = requireNonNull(name);
    }

    @Override
    public void forEachName(Consumer<String> consumer) {
      consumer.accept(name);
    }

    @Override
    public StringBuilder unparse(StringBuilder buf) {
      return buf.append('\'').append(name);
    }

    @Override
    public int hashCode() {
      return name.hashCode() + 3;
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof VarTypeExpr && name.equals(((VarTypeExpr) o).name);
    }
  }

  // ---------------------------------------------------------------------------
  // Declarations

  /** Parameter of a structure, e.g. "m: Nat" or "T". */
  public static class TypeParam {
    public final String name;
    public final Kind kind;

    TypeParam(String name, Kind kind) {
      this.name = requireNonNull(name);
      this.kind = requireNonNull(kind);
    }

    @Override
    public String toString() {
      return kind == Kind.NAT ? name + ": Nat" : name;
    }

    @Override
    public int hashCode() {
      return Objects.hash(name, kind);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof TypeParam
              && name.equals(((TypeParam) o).name)
              && kind == ((TypeParam) o).kind;
    }

    /** Whether a parameter ranges over types or over natural numbers. */
    public enum Kind {
      TYPE,
      NAT
    }
  }

  /** Member of a structure. */
  public abstract static class Member extends Node {
    public final String name;

    Member(Op op, String name) {
      super(op);
      this.name = requireNonNull(name);
    }
  }

  /** Operation declared by a structure, e.g. "operation abs : N → N". */
  public static class OperationMember extends Member {
    public final TypeExpr signature;

    OperationMember(String name, TypeExpr signature) {
      super(Op.OPERATION_MEMBER, name);
      this.signature = requireNonNull(signature);
    }

    /** Returns the number of arguments the operation takes. */
    public int arity() {
      return signature instanceof FunctionTypeExpr
          ? ((FunctionTypeExpr) signature).parameterTypes().size()
          : 0;
    }

    @Override
    public StringBuilder unparse(StringBuilder buf) {
      return signature.unparse(
          buf.append("operation ").append(name).append(" : "));
    }
  }

  /** Named element of a structure, e.g. "element zero : R". */
  public static class ElementMember extends Member {
    public final TypeExpr type;

    ElementMember(String name, TypeExpr type) {
      super(Op.ELEMENT_MEMBER, name);
      this.type = requireNonNull(type);
    }

    @Override
    public StringBuilder unparse(StringBuilder buf) {
      return type.unparse(buf.append("element ").append(name).append(" : "));
    }
  }

  /** Axiom of a structure, e.g. "axiom commutativity : ∀(x y : R). ...". */
  public static class AxiomMember extends Member {
    public final Exp proposition;

    AxiomMember(String name, Exp proposition) {
      super(Op.AXIOM_MEMBER, name);
      this.proposition = requireNonNull(proposition);
    }

    @Override
    public StringBuilder unparse(StringBuilder buf) {
      return proposition.unparse(
          buf.append("axiom ").append(name).append(" : "));
    }
  }

  /**
   * Sub-structure declared inside a structure, e.g. "structure additive :
   * AbelianGroup(R) { ... }".
   */
  public static class NestedStructure extends Member {
    public final TypeExpr structureType;
    public final List<Member> members;

    NestedStructure(
        String name, TypeExpr structureType, List<? extends Member> members) {
      super(Op.NESTED_STRUCTURE, name);
      this.structureType = requireNonNull(structureType);
      this.members = ImmutableList.copyOf(members);
    }

    @Override
    public StringBuilder unparse(StringBuilder buf) {
      structureType.unparse(
          buf.append("structure ").append(name).append(" : "));
      return unparseMembers(buf, members);
    }
  }

  /** Base class for a top-level declaration. */
  public abstract static class Decl extends Node {
    Decl(Op op) {
      super(op);
    }
  }

  /**
   * Declaration of a structure, e.g.
   *
   * <pre>{@code
   * structure MatrixMultipliable(m: Nat, n: Nat, p: Nat, T) {
   *   operation multiply : Matrix(m, n, T) → Matrix(n, p, T) → Matrix(m, p, T)
   * }
   * }</pre>
   */
  public static class StructureDef extends Decl {
    public final String name;
    public final List<TypeParam> typeParams;
    public final List<Member> members;
    public final @Nullable TypeExpr extendsClause;
    public final @Nullable TypeExpr overClause;

    StructureDef(
        String name,
        List<TypeParam> typeParams,
        List<? extends Member> members,
        @Nullable TypeExpr extendsClause,
        @Nullable TypeExpr overClause) {
      super(Op.STRUCTURE_DECL);
      this.name = requireNonNull(name);
      this.typeParams = ImmutableList.copyOf(typeParams);
      this.members = ImmutableList.copyOf(members);
      this.extendsClause = extendsClause;
      this.overClause = overClause;
    }

    /**
     * Returns the operations declared by this structure, including those
     * declared in nested structures, in declaration order.
     */
    public List<OperationMember> operations() {
      final ImmutableList.Builder<OperationMember> b = ImmutableList.builder();
      collectOperations(members, b);
      return b.build();
    }

    private static void collectOperations(
        List<Member> members, ImmutableList.Builder<OperationMember> b) {
      for (Member member : members) {
        switch (member.op) {
          case OPERATION_MEMBER:
            b.add((OperationMember) member);
            break;
          case NESTED_STRUCTURE:
            collectOperations(((NestedStructure) member).members, b);
            break;
          default:
            break;
        }
      }
    }

    /** Returns the axioms of this structure, including nested ones. */
    public List<AxiomMember> axioms() {
      final ImmutableList.Builder<AxiomMember> b = ImmutableList.builder();
      collectAxioms(members, b);
      return b.build();
    }

    private static void collectAxioms(
        List<Member> members, ImmutableList.Builder<AxiomMember> b) {
      for (Member member : members) {
        if (member instanceof AxiomMember) {
          b.add((AxiomMember) member);
        } else if (member instanceof NestedStructure) {
          collectAxioms(((NestedStructure) member).members, b);
        }
      }
    }

    /** Returns the parameter with a given name, or null. */
    public @Nullable TypeParam paramOpt(String paramName) {
      for (TypeParam typeParam : typeParams) {
        if (typeParam.name.equals(paramName)) {
          return typeParam;
        }
      }
      return null;
    }

    @Override
    public StringBuilder unparse(StringBuilder buf) {
      buf.append("structure ").append(name);
      if (!typeParams.isEmpty()) {
        appendAll(buf.append('('), ", ", typeParams).append(')');
      }
      if (extendsClause != null) {
        extendsClause.unparse(buf.append(" extends "));
      }
      if (overClause != null) {
        overClause.unparse(buf.append(" over "));
      }
      return unparseMembers(buf, members);
    }
  }

  private static StringBuilder unparseMembers(
      StringBuilder buf, List<Member> members) {
    buf.append(" {");
    for (int i = 0; i < members.size(); i++) {
      members.get(i).unparse(buf.append(i > 0 ? "; " : " "));
    }
    return buf.append(members.isEmpty() ? "}" : " }");
  }

  /**
   * Constraint on an implementation, e.g. "where Field(T)" in "implements
   * VectorSpace(Vector(n, T)) where Field(T)".
   */
  public static class WhereConstraint {
    public final String structureName;
    public final List<TypeExpr> typeArgs;

    WhereConstraint(String structureName, List<? extends TypeExpr> typeArgs) {
      this.structureName = requireNonNull(structureName);
      this.typeArgs = ImmutableList.copyOf(typeArgs);
    }

    @Override
    public String toString() {
      return appendAll(
              new StringBuilder(structureName).append('('), ", ", typeArgs)
          .append(')')
          .toString();
    }
  }

  /**
   * Binding of a structure to concrete type arguments, e.g.
   *
   * <pre>{@code
   * implements Numeric(ℝ) {
   *   operation abs = builtin_abs
   * }
   * }</pre>
   */
  public static class ImplementsDef extends Decl {
    public final String structureName;
    public final List<TypeExpr> typeArgs;
    /** Maps operation name to the implementation tag, e.g. "builtin_abs". */
    public final Map<String, String> operations;
    /** Maps element name to its defining expression. */
    public final Map<String, Exp> elements;
    public final @Nullable TypeExpr overClause;
    public final List<WhereConstraint> whereConstraints;

    ImplementsDef(
        String structureName,
        List<? extends TypeExpr> typeArgs,
        Map<String, String> operations,
        Map<String, Exp> elements,
        @Nullable TypeExpr overClause,
        List<WhereConstraint> whereConstraints) {
      super(Op.IMPLEMENTS_DECL);
      this.structureName = requireNonNull(structureName);
      this.typeArgs = ImmutableList.copyOf(typeArgs);
      this.operations = ImmutableMap.copyOf(operations);
      this.elements = ImmutableMap.copyOf(elements);
      this.overClause = overClause;
      this.whereConstraints = ImmutableList.copyOf(whereConstraints);
    }

    /**
     * Returns the identifier of the implementing type, e.g. "ℝ" or "Set(T)";
     * for several type arguments, e.g. "ℝ, ℂ".
     */
    public String typeId() {
      return appendAll(new StringBuilder(), ", ", typeArgs).toString();
    }

    @Override
    public StringBuilder unparse(StringBuilder buf) {
      buf.append("implements ").append(structureName);
      appendAll(buf.append('('), ", ", typeArgs).append(')');
      if (overClause != null) {
        overClause.unparse(buf.append(" over "));
      }
      if (!whereConstraints.isEmpty()) {
        appendAll(buf.append(" where "), ", ", whereConstraints);
      }
      buf.append(" {");
      operations.forEach(
          (name, impl) ->
              buf.append(" operation ")
                  .append(name)
                  .append(" = ")
                  .append(impl)
                  .append(';'));
      elements.forEach(
          (name, exp) ->
              exp.unparse(buf.append(" element ").append(name).append(" = "))
                  .append(';'));
      return buf.append(" }");
    }
  }

  /**
   * Operation declared outside any structure, e.g. "operation sin : ℝ → ℝ".
   */
  public static class OperationDecl extends Decl {
    public final OperationMember member;

    OperationDecl(OperationMember member) {
      super(Op.OPERATION_DECL);
      this.member = requireNonNull(member);
    }

    @Override
    public StringBuilder unparse(StringBuilder buf) {
      return member.unparse(buf);
    }
  }

  /**
   * Declaration of a data type, e.g.
   *
   * <pre>{@code
   * data Option(T) = None | Some(T)
   * }</pre>
   *
   * <p>The parameters say which arguments of the type are dimensions; in
   * {@code data Vec(n: Nat, T)}, the first argument of "Vec" must be a
   * natural number.
   */
  public static class DataDef extends Decl {
    public final String name;
    public final List<TypeParam> typeParams;
    public final List<DataVariant> variants;

    DataDef(
        String name,
        List<TypeParam> typeParams,
        List<? extends DataVariant> variants) {
      super(Op.DATA_DECL);
      this.name = requireNonNull(name);
      this.typeParams = ImmutableList.copyOf(typeParams);
      this.variants = ImmutableList.copyOf(variants);
    }

    /** Returns the kind of each parameter, in order. */
    public List<TypeParam.Kind> kinds() {
      return transformEager(typeParams, p -> p.kind);
    }

    @Override
    public StringBuilder unparse(StringBuilder buf) {
      buf.append("data ").append(name);
      if (!typeParams.isEmpty()) {
        appendAll(buf.append('('), ", ", typeParams).append(')');
      }
      return appendAll(buf.append(" = "), " | ", variants);
    }
  }

  /** Constructor of a data type, e.g. "Some(T)" in "data Option(T)". */
  public static class DataVariant {
    public final String name;
    public final List<TypeExpr> fields;

    DataVariant(String name, List<? extends TypeExpr> fields) {
      this.name = requireNonNull(name);
      this.fields = ImmutableList.copyOf(fields);
    }

    @Override
    public String toString() {
      if (fields.isEmpty()) {
        return name;
      }
      return appendAll(new StringBuilder(name).append('('), ", ", fields)
          .append(')')
          .toString();
    }
  }
}

// End Ast.java
