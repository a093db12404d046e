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
import static net.hydromatic.kleis.util.Static.str;

import java.io.PrintWriter;
import java.util.List;
import java.util.function.BiConsumer;
import java.util.function.Consumer;
import net.hydromatic.kleis.type.Type;
import net.hydromatic.kleis.type.TypeError;
import net.hydromatic.kleis.type.TypeVar;

/** Utilities for {@link Tracer}. */
public abstract class Tracers {
  private Tracers() {}

  /** Returns a tracer that does nothing. */
  public static Tracer empty() {
    return EmptyTracer.INSTANCE;
  }

  /** Returns a tracer that writes a line for each event to a writer. */
  public static Tracer printTracer(PrintWriter w) {
    return new PrintTracer(w);
  }

  /**
   * Returns a tracer that performs the given action when a variable is bound,
   * then calls the underlying tracer.
   */
  public static Tracer withOnBind(
      Tracer tracer, BiConsumer<TypeVar, Type> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onBind(TypeVar typeVar, Type type) {
        consumer.accept(typeVar, type);
        super.onBind(typeVar, type);
      }
    };
  }

  /**
   * Returns a tracer that performs the given action when two types conflict,
   * then calls the underlying tracer.
   */
  public static Tracer withOnConflict(
      Tracer tracer, Consumer<TypeError> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onConflict(Type left, Type right, TypeError e) {
        consumer.accept(e);
        super.onConflict(left, right, e);
      }
    };
  }

  /**
   * Returns a tracer that performs the given action when a candidate is
   * rejected, then calls the underlying tracer.
   */
  public static Tracer withOnCandidateRejected(
      Tracer tracer, BiConsumer<OperationSignature, TypeError> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onCandidateRejected(
          OperationSignature candidate, TypeError e) {
        consumer.accept(candidate, e);
        super.onCandidateRejected(candidate, e);
      }
    };
  }

  /**
   * Returns a tracer that performs the given action when a candidate is
   * selected, then calls the underlying tracer.
   */
  public static Tracer withOnCandidateSelected(
      Tracer tracer, BiConsumer<OperationSignature, Type> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onCandidateSelected(OperationSignature candidate, Type type) {
        consumer.accept(candidate, type);
        super.onCandidateSelected(candidate, type);
      }
    };
  }

  /**
   * Returns a tracer that performs the given action on the result of a check,
   * then calls the underlying tracer.
   */
  public static Tracer withOnResult(
      Tracer tracer, Consumer<TypeCheckResult> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onResult(TypeCheckResult result) {
        consumer.accept(result);
        super.onResult(result);
      }
    };
  }

  /** Tracer that does nothing. */
  private static class EmptyTracer implements Tracer {
    static final Tracer INSTANCE = new EmptyTracer();

    @Override
    public void onBind(TypeVar typeVar, Type type) {}

    @Override
    public void onConflict(Type left, Type right, TypeError e) {}

    @Override
    public void onCandidate(
        OperationSignature candidate, List<Type> argTypes) {}

    @Override
    public void onCandidateRejected(
        OperationSignature candidate, TypeError e) {}

    @Override
    public void onCandidateSelected(OperationSignature candidate, Type type) {}

    @Override
    public void onResult(TypeCheckResult result) {}
  }

  /** Tracer that delegates to an underlying tracer. */
  private static class DelegatingTracer implements Tracer {
    final Tracer tracer;

    DelegatingTracer(Tracer tracer) {
      this.tracer = requireNonNull(tracer);
    }

    @Override
    public void onBind(TypeVar typeVar, Type type) {
      tracer.onBind(typeVar, type);
    }

    @Override
    public void onConflict(Type left, Type right, TypeError e) {
      tracer.onConflict(left, right, e);
    }

    @Override
    public void onCandidate(OperationSignature candidate, List<Type> argTypes) {
      tracer.onCandidate(candidate, argTypes);
    }

    @Override
    public void onCandidateRejected(OperationSignature candidate, TypeError e) {
      tracer.onCandidateRejected(candidate, e);
    }

    @Override
    public void onCandidateSelected(OperationSignature candidate, Type type) {
      tracer.onCandidateSelected(candidate, type);
    }

    @Override
    public void onResult(TypeCheckResult result) {
      tracer.onResult(result);
    }
  }

  /** Tracer that writes to a given {@link PrintWriter}. */
  private static class PrintTracer implements Tracer {
    private final StringBuilder b = new StringBuilder();
    private final PrintWriter w;

    PrintTracer(PrintWriter w) {
      this.w = requireNonNull(w);
    }

    private void flush() {
      w.println(str(b));
      w.flush();
    }

    @Override
    public void onBind(TypeVar typeVar, Type type) {
      b.append("bind ").append(typeVar).append(" := ").append(type);
      flush();
    }

    @Override
    public void onConflict(Type left, Type right, TypeError e) {
      b.append("conflict ").append(left).append(' ').append(right);
      flush();
    }

    @Override
    public void onCandidate(OperationSignature candidate, List<Type> argTypes) {
      b.append("try ").append(candidate).append(" with ").append(argTypes);
      flush();
    }

    @Override
    public void onCandidateRejected(OperationSignature candidate, TypeError e) {
      b.append("reject ")
          .append(candidate.owner())
          .append(": ")
          .append(e.getMessage());
      flush();
    }

    @Override
    public void onCandidateSelected(OperationSignature candidate, Type type) {
      b.append("select ")
          .append(candidate.owner())
          .append(" → ")
          .append(type);
      flush();
    }

    @Override
    public void onResult(TypeCheckResult result) {
      b.append("result ").append(result);
      flush();
    }
  }
}

// End Tracers.java
