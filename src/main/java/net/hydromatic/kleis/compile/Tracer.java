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

import java.util.List;
import net.hydromatic.kleis.type.Type;
import net.hydromatic.kleis.type.TypeError;
import net.hydromatic.kleis.type.TypeUnifier;

/** Called on various events during type checking. */
public interface Tracer extends TypeUnifier.Tracer {
  /** Called before a candidate declaration of an operation is tried. */
  void onCandidate(OperationSignature candidate, List<Type> argTypes);

  /** Called when a candidate does not accept the argument types. */
  void onCandidateRejected(OperationSignature candidate, TypeError e);

  /** Called when a candidate is chosen; {@code type} is its result type. */
  void onCandidateSelected(OperationSignature candidate, Type type);

  /** Called with the result of a check. */
  void onResult(TypeCheckResult result);
}

// End Tracer.java
