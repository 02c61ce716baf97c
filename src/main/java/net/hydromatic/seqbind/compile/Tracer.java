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

import net.hydromatic.seqbind.ast.Ast;

/** Called on various events during rewriting. */
public interface Tracer {
  /** Called when a function has been rewritten. */
  void onRewrite(DebugInfo debugInfo);

  /** Called when a compilation unit has been rewritten; {@code after} is
   * the same object as {@code before} if nothing changed. */
  void onUnit(Ast.Module before, Ast.Module after);

  /**
   * Called with the exception thrown while rewriting a unit. Returns whether
   * a handler was found; if not, the caller rethrows.
   */
  boolean handleCompileException(CompileException e);
}

// End Tracer.java
