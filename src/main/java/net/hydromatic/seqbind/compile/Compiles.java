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

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Map;
import net.hydromatic.seqbind.ast.Ast;

/** Helpers for rewriting several compilation units. */
public abstract class Compiles {
  private Compiles() {}

  /**
   * Rewrites a list of compilation units, each independently of the others.
   *
   * <p>If a unit fails, its exception is offered to
   * {@link Tracer#handleCompileException}; if the tracer handles it, the
   * unit is left out of the result and the next unit is rewritten,
   * otherwise the exception is rethrown.
   *
   * @return Results of the units that were rewritten, in order
   */
  public static ImmutableList<SeqBind.Result> rewriteAll(
      List<Ast.Module> modules, Map<Prop, Object> propMap, Tracer tracer) {
    final ImmutableList.Builder<SeqBind.Result> results =
        ImmutableList.builder();
    for (Ast.Module module : modules) {
      try {
        results.add(SeqBind.rewrite(module, propMap, tracer));
      } catch (CompileException e) {
        if (!tracer.handleCompileException(e)) {
          throw e;
        }
      }
    }
    return results.build();
  }
}

// End Compiles.java
