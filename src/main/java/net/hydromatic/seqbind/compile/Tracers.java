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
package net.hydromatic.seqbind.compile;

import java.util.function.BiConsumer;
import java.util.function.Consumer;
import net.hydromatic.seqbind.ast.Ast;

/** Utilities for {@link Tracer}. */
public abstract class Tracers {
  private Tracers() {}

  /** Returns a tracer that does nothing. */
  public static Tracer empty() {
    return EmptyTracer.INSTANCE;
  }

  /** Returns a tracer that performs the given action on each rewritten
   * function, then calls the underlying tracer. */
  public static Tracer withOnRewrite(Tracer tracer,
      Consumer<DebugInfo> consumer) {
    return new DelegatingTracer(tracer) {
      @Override public void onRewrite(DebugInfo debugInfo) {
        consumer.accept(debugInfo);
        super.onRewrite(debugInfo);
      }
    };
  }

  /** Returns a tracer that performs the given action on each rewritten
   * unit, then calls the underlying tracer. */
  public static Tracer withOnUnit(Tracer tracer,
      BiConsumer<Ast.Module, Ast.Module> consumer) {
    return new DelegatingTracer(tracer) {
      @Override public void onUnit(Ast.Module before, Ast.Module after) {
        consumer.accept(before, after);
        super.onUnit(before, after);
      }
    };
  }

  /** Returns a tracer that handles each compile exception by performing the
   * given action. */
  public static Tracer withOnCompileException(Tracer tracer,
      Consumer<CompileException> consumer) {
    return new DelegatingTracer(tracer) {
      @Override public boolean handleCompileException(CompileException e) {
        consumer.accept(e);
        super.handleCompileException(e);
        return true;
      }
    };
  }

  /** Tracer that does nothing. */
  private static class EmptyTracer implements Tracer {
    static final Tracer INSTANCE = new EmptyTracer();

    @Override public void onRewrite(DebugInfo debugInfo) {
    }

    @Override public void onUnit(Ast.Module before, Ast.Module after) {
    }

    @Override public boolean handleCompileException(CompileException e) {
      return false;
    }
  }

  /** Tracer that delegates to an underlying tracer. */
  private static class DelegatingTracer implements Tracer {
    final Tracer tracer;

    DelegatingTracer(Tracer tracer) {
      this.tracer = tracer;
    }

    @Override public void onRewrite(DebugInfo debugInfo) {
      tracer.onRewrite(debugInfo);
    }

    @Override public void onUnit(Ast.Module before, Ast.Module after) {
      tracer.onUnit(before, after);
    }

    @Override public boolean handleCompileException(CompileException e) {
      return tracer.handleCompileException(e);
    }
  }
}

// End Tracers.java
