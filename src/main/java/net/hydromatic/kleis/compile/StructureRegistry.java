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
import static net.hydromatic.kleis.util.Static.firstDuplicate;
import static net.hydromatic.kleis.util.Static.transformEager;

import com.google.common.collect.ArrayListMultimap;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.ListMultimap;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import net.hydromatic.kleis.ast.Ast;
import net.hydromatic.kleis.type.TypeError;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Registry of structures, their implementations, and operations declared
 * outside any structure.
 *
 * <p>A registry is populated during a load phase, and is read-only
 * afterwards. It is not thread-safe while being loaded; once loaded, any
 * number of inference sessions may read it concurrently. To add declarations
 * after checking has started, {@link #copy()} the registry and load into the
 * copy.
 */
public class StructureRegistry {
  private final Map<String, Ast.StructureDef> structures;
  private final ListMultimap<String, Ast.ImplementsDef> implementations;
  /** All implementations, in registration order. */
  private final List<Ast.ImplementsDef> implementationList;
  private final List<Ast.OperationDecl> operationDecls;
  private final Map<String, Ast.DataDef> dataTypes;
  /** Maps each variant name to the data type that declares it. */
  private final Map<String, Ast.DataDef> variants;

  /** Creates an empty registry. */
  public StructureRegistry() {
    this(
        new LinkedHashMap<>(),
        ArrayListMultimap.create(),
        new ArrayList<>(),
        new ArrayList<>(),
        new LinkedHashMap<>(),
        new LinkedHashMap<>());
  }

  private StructureRegistry(
      Map<String, Ast.StructureDef> structures,
      ListMultimap<String, Ast.ImplementsDef> implementations,
      List<Ast.ImplementsDef> implementationList,
      List<Ast.OperationDecl> operationDecls,
      Map<String, Ast.DataDef> dataTypes,
      Map<String, Ast.DataDef> variants) {
    this.structures = structures;
    this.implementations = implementations;
    this.implementationList = implementationList;
    this.operationDecls = operationDecls;
    this.dataTypes = dataTypes;
    this.variants = variants;
  }

  /** Returns a copy of this registry that can be loaded independently. */
  public StructureRegistry copy() {
    return new StructureRegistry(
        new LinkedHashMap<>(structures),
        ArrayListMultimap.create(implementations),
        new ArrayList<>(implementationList),
        new ArrayList<>(operationDecls),
        new LinkedHashMap<>(dataTypes),
        new LinkedHashMap<>(variants));
  }

  // Registration

  /** Registers a declaration of any kind. */
  public void registerDecl(Ast.Decl decl) {
    switch (decl.op) {
      case STRUCTURE_DECL:
        register((Ast.StructureDef) decl);
        break;
      case IMPLEMENTS_DECL:
        registerImplements((Ast.ImplementsDef) decl);
        break;
      case OPERATION_DECL:
        registerOperation((Ast.OperationDecl) decl);
        break;
      case DATA_DECL:
        registerData((Ast.DataDef) decl);
        break;
      default:
        throw new AssertionError("unknown declaration " + decl.op);
    }
  }

  /**
   * Registers a structure.
   *
   * @throws TypeError if a structure with the same name is already
   *     registered, or if two of its parameters have the same name
   */
  public void register(Ast.StructureDef structure) {
    if (structures.containsKey(structure.name)) {
      throw TypeError.duplicateName("structure", structure.name);
    }
    final String duplicate =
        firstDuplicate(transformEager(structure.typeParams, p -> p.name));
    if (duplicate != null) {
      throw TypeError.duplicateName(
          "parameter", duplicate + " in structure " + structure.name);
    }
    structures.put(structure.name, structure);
  }

  /**
   * Registers an implementation.
   *
   * <p>The structure need not be registered yet.
   *
   * @throws TypeError if the structure already has an implementation with the
   *     same type arguments
   */
  public void registerImplements(Ast.ImplementsDef implementation) {
    for (Ast.ImplementsDef existing :
        implementations.get(implementation.structureName)) {
      if (existing.typeArgs.equals(implementation.typeArgs)) {
        throw TypeError.duplicateName(
            "implementation",
            implementation.structureName
                + "(" + implementation.typeId() + ")");
      }
    }
    implementations.put(implementation.structureName, implementation);
    implementationList.add(implementation);
  }

  /**
   * Registers an operation that belongs to no structure.
   *
   * @throws TypeError if a top-level operation with the same name and arity
   *     is already registered
   */
  public void registerOperation(Ast.OperationDecl decl) {
    for (Ast.OperationDecl existing : operationDecls) {
      if (existing.member.name.equals(decl.member.name)
          && existing.member.arity() == decl.member.arity()) {
        throw TypeError.duplicateName("operation", decl.member.name);
      }
    }
    operationDecls.add(decl);
  }

  /**
   * Registers a data type.
   *
   * @throws TypeError if a data type with the same name is already
   *     registered, if two of its parameters have the same name, or if one
   *     of its variants has the same name as a variant already registered
   */
  public void registerData(Ast.DataDef dataDef) {
    if (dataTypes.containsKey(dataDef.name)) {
      throw TypeError.duplicateName("data type", dataDef.name);
    }
    final String duplicate =
        firstDuplicate(transformEager(dataDef.typeParams, p -> p.name));
    if (duplicate != null) {
      throw TypeError.duplicateName(
          "parameter", duplicate + " in data type " + dataDef.name);
    }
    final Set<String> names = new HashSet<>();
    for (Ast.DataVariant variant : dataDef.variants) {
      final Ast.@Nullable DataDef existing = variants.get(variant.name);
      if (existing != null || !names.add(variant.name)) {
        throw TypeError.duplicateName("variant",
            variant.name + " in data type "
                + (existing != null ? existing.name : dataDef.name));
      }
    }
    dataTypes.put(dataDef.name, dataDef);
    for (Ast.DataVariant variant : dataDef.variants) {
      variants.put(variant.name, dataDef);
    }
  }

  // Lookup

  /** Returns the structure with a given name, or null. */
  public Ast.@Nullable StructureDef getOpt(String name) {
    return structures.get(name);
  }

  /** Returns the data type with a given name, or null. */
  public Ast.@Nullable DataDef dataTypeOpt(String name) {
    return dataTypes.get(name);
  }

  /** Returns the data type that declares a given variant, or null. */
  public Ast.@Nullable DataDef variantOpt(String variantName) {
    return variants.get(variantName);
  }

  /** Returns the names of all data types, in registration order. */
  public List<String> dataTypeNames() {
    return ImmutableList.copyOf(dataTypes.keySet());
  }

  /** Returns the names of all structures, in registration order. */
  public List<String> structureNames() {
    return ImmutableList.copyOf(structures.keySet());
  }

  public int structureCount() {
    return structures.size();
  }

  /** Returns the number of top-level operations. */
  public int operationCount() {
    return operationDecls.size();
  }

  /** Returns the implementations of a structure, in registration order. */
  public List<Ast.ImplementsDef> implementations(String structureName) {
    return ImmutableList.copyOf(implementations.get(structureName));
  }

  /** Returns the operations declared by a structure; empty if unknown. */
  public List<Ast.OperationMember> operationsForStructure(
      String structureName) {
    final Ast.StructureDef structure = structures.get(structureName);
    return structure == null ? ImmutableList.of() : structure.operations();
  }

  /**
   * Returns the declarations of an operation that accept a given number of
   * arguments, in order of preference.
   *
   * <p>For each structure, in registration order, the structure's own
   * declaration comes first, followed by one candidate for each of its
   * implementations. Operations declared outside any structure come last.
   */
  public List<OperationSignature> signaturesFor(String name, int arity) {
    final ImmutableList.Builder<OperationSignature> b =
        ImmutableList.builder();
    for (Ast.StructureDef structure : structures.values()) {
      for (Ast.OperationMember operation : structure.operations()) {
        if (operation.name.equals(name) && operation.arity() == arity) {
          b.add(new OperationSignature(operation, structure, null));
          for (Ast.ImplementsDef implementation
              : implementations.get(structure.name)) {
            b.add(new OperationSignature(operation, structure, implementation));
          }
        }
      }
    }
    for (Ast.OperationDecl decl : operationDecls) {
      if (decl.member.name.equals(name) && decl.member.arity() == arity) {
        b.add(new OperationSignature(decl.member, null, null));
      }
    }
    return b.build();
  }

  /**
   * Returns the numbers of arguments with which an operation is declared, in
   * ascending order; empty if the operation is not declared.
   */
  public Set<Integer> aritiesOf(String name) {
    final Set<Integer> arities = new TreeSet<>();
    for (Ast.StructureDef structure : structures.values()) {
      for (Ast.OperationMember operation : structure.operations()) {
        if (operation.name.equals(name)) {
          arities.add(operation.arity());
        }
      }
    }
    for (Ast.OperationDecl decl : operationDecls) {
      if (decl.member.name.equals(name)) {
        arities.add(decl.member.arity());
      }
    }
    return ImmutableSet.copyOf(arities);
  }

  /**
   * Returns the signature of the first declaration of an operation, in a
   * structure or at top level, or null.
   */
  public Ast.@Nullable TypeExpr operationSignatureOpt(String name) {
    for (Ast.StructureDef structure : structures.values()) {
      for (Ast.OperationMember operation : structure.operations()) {
        if (operation.name.equals(name)) {
          return operation.signature;
        }
      }
    }
    for (Ast.OperationDecl decl : operationDecls) {
      if (decl.member.name.equals(name)) {
        return decl.member.signature;
      }
    }
    return null;
  }

  /** Returns the names of the structures that declare an operation. */
  public List<String> operationOwners(String operationName) {
    final ImmutableList.Builder<String> b = ImmutableList.builder();
    structures
        .values()
        .forEach(
            structure -> {
              if (declares(structure, operationName)) {
                b.add(structure.name);
              }
            });
    return b.build();
  }

  /** Returns the first structure that declares an operation, or null. */
  public @Nullable String structureForOperation(String operationName) {
    final List<String> owners = operationOwners(operationName);
    return owners.isEmpty() ? null : owners.get(0);
  }

  private static boolean declares(
      Ast.StructureDef structure, String operationName) {
    for (Ast.OperationMember operation : structure.operations()) {
      if (operation.name.equals(operationName)) {
        return true;
      }
    }
    return false;
  }

  // Dependencies

  /**
   * Returns a structure followed by the structures it depends on via
   * "extends" and "over" clauses, transitively, each once, in depth-first
   * order. References to unknown structures are ignored; an unknown name
   * gives an empty list.
   *
   * @throws TypeError if the dependencies contain a cycle
   */
  public List<Ast.StructureDef> dependencyClosure(String structureName) {
    return closure(structureName, true);
  }

  /** Returns a structure followed by the structures it extends. */
  private List<Ast.StructureDef> extendsClosure(String structureName) {
    return closure(structureName, false);
  }

  private List<Ast.StructureDef> closure(
      String structureName, boolean includeOver) {
    final Map<String, Ast.StructureDef> closure = new LinkedHashMap<>();
    final Deque<String> path = new ArrayDeque<>();
    closeOver(structureName, closure, path, includeOver);
    return ImmutableList.copyOf(closure.values());
  }

  private void closeOver(
      String name,
      Map<String, Ast.StructureDef> closure,
      Deque<String> path,
      boolean includeOver) {
    if (path.contains(name)) {
      final List<String> cycle = new ArrayList<>();
      // The path is a stack; the oldest entry is at the end.
      path.descendingIterator().forEachRemaining(cycle::add);
      cycle.subList(0, cycle.indexOf(name)).clear();
      cycle.add(name);
      throw TypeError.cyclicDependency(cycle);
    }
    final Ast.StructureDef structure = structures.get(name);
    if (structure == null || closure.containsKey(name)) {
      return;
    }
    closure.put(name, structure);
    path.push(name);
    for (String parent : parents(structure, includeOver)) {
      closeOver(parent, closure, path, includeOver);
    }
    path.pop();
  }

  /**
   * Returns the names of the structures that a structure refers to in its
   * "extends" and (optionally) "over" clauses.
   */
  private static List<String> parents(
      Ast.StructureDef structure, boolean includeOver) {
    final ImmutableList.Builder<String> b = ImmutableList.builder();
    final @Nullable String extendsName = headName(structure.extendsClause);
    if (extendsName != null) {
      b.add(extendsName);
    }
    if (includeOver) {
      final @Nullable String overName = headName(structure.overClause);
      if (overName != null) {
        b.add(overName);
      }
    }
    return b.build();
  }

  /** Returns the name at the head of a clause, e.g. "Ring" for "Ring(R)". */
  private static @Nullable String headName(Ast.@Nullable TypeExpr typeExpr) {
    if (typeExpr == null) {
      return null;
    }
    switch (typeExpr.op) {
      case NAMED_TYPE_EXPR:
        return ((Ast.NamedTypeExpr) typeExpr).name;
      case PARAMETRIC_TYPE_EXPR:
        return ((Ast.ParametricTypeExpr) typeExpr).name;
      default:
        return null;
    }
  }

  /**
   * Returns whether {@code child} extends {@code ancestor}, directly or
   * indirectly. A structure does not extend itself.
   */
  public boolean extendsStructure(String child, String ancestor) {
    final Set<String> visited = new HashSet<>();
    String name = child;
    while (visited.add(name)) {
      final Ast.StructureDef structure = structures.get(name);
      if (structure == null) {
        return false;
      }
      final List<String> parents = parents(structure, false);
      if (parents.isEmpty()) {
        return false;
      }
      name = parents.get(0);
      if (name.equals(ancestor)) {
        return true;
      }
    }
    return false;
  }

  /**
   * Checks every structure's dependencies.
   *
   * @throws TypeError if there is a cycle
   */
  public void validate() {
    for (String name : structures.keySet()) {
      dependencyClosure(name);
    }
  }

  // Queries by type

  /**
   * Returns the identifiers of the types that support an operation, in
   * registration order of their implementations; for example, ["ℝ", "ℂ"] for
   * "abs".
   *
   * <p>A type supports an operation if it implements a structure that
   * declares the operation, or that extends one that does. A structure
   * defined "over" another does not make the other's operations available.
   */
  public List<String> typesSupporting(String operationName) {
    final Set<String> types = new LinkedHashSet<>();
    for (Ast.ImplementsDef implementation : implementationList) {
      if (closureDeclares(implementation.structureName, operationName)) {
        types.add(implementation.typeId());
      }
    }
    return ImmutableList.copyOf(types);
  }

  /** Returns whether a type supports an operation. */
  public boolean supportsOperation(String typeId, String operationName) {
    for (Ast.ImplementsDef implementation : implementationList) {
      if (implementation.typeId().equals(typeId)
          && closureDeclares(implementation.structureName, operationName)) {
        return true;
      }
    }
    return false;
  }

  /** Returns whether a type implements at least one structure. */
  public boolean supportsAnyOperation(String typeId) {
    for (Ast.ImplementsDef implementation : implementationList) {
      if (implementation.typeId().equals(typeId)) {
        return true;
      }
    }
    return false;
  }

  /**
   * Returns the names of the operations available for a type via the
   * structures it implements, without duplicates.
   */
  public List<String> operationsForType(String typeId) {
    final Set<String> names = new LinkedHashSet<>();
    for (Ast.ImplementsDef implementation : implementationList) {
      if (implementation.typeId().equals(typeId)) {
        for (Ast.StructureDef structure
            : extendsClosure(implementation.structureName)) {
          structure.operations().forEach(op -> names.add(op.name));
        }
      }
    }
    return ImmutableList.copyOf(names);
  }

  private boolean closureDeclares(String structureName, String operationName) {
    for (Ast.StructureDef structure : extendsClosure(structureName)) {
      if (declares(structure, operationName)) {
        return true;
      }
    }
    return false;
  }

  // Axioms and constraints

  /** Returns the axioms of a structure; empty if unknown. */
  public List<Ast.AxiomMember> axioms(String structureName) {
    final Ast.StructureDef structure = structures.get(structureName);
    return structure == null ? ImmutableList.of() : structure.axioms();
  }

  public boolean hasAxiom(String structureName, String axiomName) {
    return axioms(structureName).stream()
        .anyMatch(axiom -> axiom.name.equals(axiomName));
  }

  /** Returns the names of the structures that have at least one axiom. */
  public List<String> structuresWithAxioms() {
    final ImmutableList.Builder<String> b = ImmutableList.builder();
    structures.forEach(
        (name, structure) -> {
          if (!structure.axioms().isEmpty()) {
            b.add(name);
          }
        });
    return b.build();
  }

  /**
   * Returns the "where" constraints of all implementations of a structure,
   * e.g. "Semiring(T)" for "implements MatrixMultipliable(m, n, p, T) where
   * Semiring(T)".
   */
  public List<Ast.WhereConstraint> whereConstraints(String structureName) {
    final ImmutableList.Builder<Ast.WhereConstraint> b =
        ImmutableList.builder();
    for (Ast.ImplementsDef implementation
        : implementations.get(requireNonNull(structureName))) {
      b.addAll(implementation.whereConstraints);
    }
    return b.build();
  }
}

// End StructureRegistry.java
