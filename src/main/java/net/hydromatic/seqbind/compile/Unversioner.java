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

import net.hydromatic.seqbind.ast.Ast;
import net.hydromatic.seqbind.ast.Shuttle;

/**
 * Restores the original spelling of the variables of a rewritten function.
 *
 * <p>Each renamed variable goes back to its marked name ("Req@1" becomes
 * "Req@"), or to its base name if it was an unmarked match. The result has
 * the same shape and positions as the function before rewriting.
 */
public class Unversioner extends Shuttle {
  private final DebugInfo debugInfo;

  private Unversioner(DebugInfo debugInfo) {
    this.debugInfo = requireNonNull(debugInfo);
  }

  /** Returns the function that {@link DebugInfo#rewritten} was rewritten
   * from, as far as spelling goes. */
  public static Ast.Function restore(DebugInfo debugInfo) {
    return debugInfo.rewritten.accept(new Unversioner(debugInfo));
  }

  @Override protected Ast.Exp visit(Ast.Var var) {
    final Resolution.Entry entry = debugInfo.occurrence(var);
    if (entry == null) {
      return var;
    }
    return ast.var(var.pos, entry.originalName());
  }
}

// End Unversioner.java
