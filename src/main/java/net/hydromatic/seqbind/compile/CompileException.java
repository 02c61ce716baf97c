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

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

import net.hydromatic.seqbind.ast.Pos;
import net.hydromatic.seqbind.util.SeqBindException;
import org.checkerframework.checker.nullness.qual.Nullable;

/** An error occurred while rewriting a compilation unit.
 *
 * <p>Every error is fatal to the unit that contains it; the unit produces no
 * output. */
public class CompileException extends RuntimeException
    implements SeqBindException {
  public final Kind kind;
  public final FunctionId function;
  /** Base name of the offending variable, or null if the error is not about
   * a variable. */
  public final @Nullable String baseName;
  private final Pos pos;

  CompileException(Kind kind, String message, FunctionId function,
      @Nullable String baseName, Pos pos) {
    super(message);
    this.kind = requireNonNull(kind);
    this.function = requireNonNull(function);
    this.baseName = baseName;
    this.pos = requireNonNull(pos);
  }

  /** Creates an exception for a reference to a sequential variable that
   * has no version in scope. */
  static CompileException unbound(String baseName, FunctionId function,
      Pos pos) {
    final String message =
        format("sequential variable '%s' is unbound in %s",
            SeqNames.marked(baseName), function);
    return new CompileException(Kind.UNBOUND_SEQUENTIAL_VARIABLE, message,
        function, baseName, pos);
  }

  /** Creates an exception for an unmarked variable in a pattern that
   * matches a sequential variable that has no version in scope. */
  static CompileException unboundBareMatch(String baseName,
      FunctionId function, Pos pos) {
    final String message =
        format("variable '%s' matches sequential variable '%s', "
                + "which is unbound in %s",
            baseName, SeqNames.marked(baseName), function);
    return new CompileException(Kind.UNBOUND_SEQUENTIAL_VARIABLE, message,
        function, baseName, pos);
  }

  /** Creates an exception for a let-block that is empty or is not in a
   * position that computes a value. */
  static CompileException malformedLetBlock(String reason,
      FunctionId function, Pos pos) {
    final String message =
        format("let-block %s:'%s' %s in %s", SeqNames.LET_MODULE,
            SeqNames.LET_FUNCTION, reason, function);
    return new CompileException(Kind.MALFORMED_LET_BLOCK, message, function,
        null, pos);
  }

  /** Creates an exception for an unmarked variable that would bind afresh
   * a name that is sequential in the same function. */
  static CompileException conflictingRedeclaration(String baseName,
      FunctionId function, Pos pos) {
    final String message =
        format("variable '%s' is a fresh binding of sequential variable "
                + "'%s' in %s; did you mean '%s'?",
            baseName, SeqNames.marked(baseName), function,
            SeqNames.marked(baseName));
    return new CompileException(Kind.CONFLICTING_REDECLARATION, message,
        function, baseName, pos);
  }

  static CompileException versionCollision(String name, String baseName,
      FunctionId function, Pos pos) {
    final String message =
        format("variable '%s' has the spelling of a version of sequential "
                + "variable '%s' in %s",
            name, SeqNames.marked(baseName), function);
    return new CompileException(Kind.CONFLICTING_REDECLARATION, message,
        function, baseName, pos);
  }

  @Override public String toString() {
    return super.toString() + " at " + pos;
  }

  @Override public Pos pos() {
    return pos;
  }

  @Override public StringBuilder describeTo(StringBuilder buf) {
    return pos.describeTo(buf)
        .append(" Error: ")
        .append(getMessage());
  }

  /** Kind of error. */
  public enum Kind {
    /** A reference, or an unmarked match, has no version in scope. */
    UNBOUND_SEQUENTIAL_VARIABLE,
    /** A let-block has no expressions, or is not in a value position. */
    MALFORMED_LET_BLOCK,
    /** An unmarked variable re-declares a sequential variable in a position
     * that requires a fresh binding, or an explicitly versioned name such as
     * {@code Req@0} is written in a clause that also marks {@code Req@}. */
    CONFLICTING_REDECLARATION
  }
}

// End CompileException.java
