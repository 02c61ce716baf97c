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

import static java.util.Objects.requireNonNull;
import static net.hydromatic.seqbind.ast.AstBuilder.ast;

import java.util.IdentityHashMap;
import java.util.Map;
import net.hydromatic.seqbind.ast.Ast;
import net.hydromatic.seqbind.ast.Shuttle;

/**
 * Writes a rewritten function, replacing each resolved variable with its
 * versioned name.
 *
 * <p>The replacement variable has the same position as the original. Every
 * other node is reused if none of its descendants changed, or copied with
 * the same children otherwise; so the output has the same shape as the
 * input.
 */
class Synthesizer extends Shuttle {
  private final Resolution resolution;
  private final Map<Ast.Var, Resolution.Entry> output =
      new IdentityHashMap<>();

  Synthesizer(Resolution resolution) {
    this.resolution = requireNonNull(resolution);
  }

  /** Rewrites a function, returning its debug information. */
  static DebugInfo synthesize(FunctionId id, Ast.Function function,
      Resolution resolution) {
    final Synthesizer synthesizer = new Synthesizer(resolution);
    final Ast.Function rewritten = function.accept(synthesizer);
    return new DebugInfo(id, function, rewritten, synthesizer.output);
  }

  @Override protected Ast.Exp visit(Ast.Var var) {
    final Resolution.Entry entry = resolution.get(var);
    if (entry == null) {
      return var;
    }
    final Ast.Var var2 = ast.var(var.pos, entry.name.name());
    output.put(var2, entry);
    return var2;
  }
}

// End Synthesizer.java
