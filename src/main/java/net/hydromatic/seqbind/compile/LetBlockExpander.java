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

import net.hydromatic.seqbind.ast.Ast;

/**
 * Expands let-blocks.
 *
 * <p>A let-block is the call "{@code seqbind:'let'(E1, ..., En)}", usually
 * written via a macro. Its value is the value of {@code En}. Versions bound
 * by {@code E1} to {@code En} are visible to later expressions in the block
 * but not after it: after the block, a sequential variable resolves to the
 * version it had before the block.
 *
 * <p>Expansion changes only how names are resolved; the call stays in the
 * tree.
 */
class LetBlockExpander {
  private final FunctionId function;
  private final ScopeStack scopes;

  LetBlockExpander(FunctionId function, ScopeStack scopes) {
    this.function = requireNonNull(function);
    this.scopes = requireNonNull(scopes);
  }

  /** Returns whether a call is a let-block. */
  static boolean isLetBlock(Ast.Call call) {
    return call.module instanceof Ast.Literal
        && ((Ast.Literal) call.module).isAtom(SeqNames.LET_MODULE)
        && call.fn instanceof Ast.Literal
        && ((Ast.Literal) call.fn).isAtom(SeqNames.LET_FUNCTION);
  }

  /** Walks the expressions of a let-block in a frame of their own. */
  void expand(Ast.Call call, Position position, Renamer renamer) {
    if (position.pattern) {
      throw CompileException.malformedLetBlock("is not allowed in a pattern",
          function, call.pos);
    }
    if (position == Position.GUARD) {
      throw CompileException.malformedLetBlock("is not allowed in a guard",
          function, call.pos);
    }
    if (call.args.isEmpty()) {
      throw CompileException.malformedLetBlock("has no expressions",
          function, call.pos);
    }
    scopes.push();
    renamer.walkBody(call.args);
    scopes.pop();
  }
}

// End LetBlockExpander.java
