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
package net.hydromatic.seqbind.ast;

import com.google.common.collect.ImmutableMap;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Sub-types of {@link AstNode}. */
public enum Op {
  // forms
  MODULE,
  ATTRIBUTE,
  FUNCTION,

  // clauses
  FUNCTION_CLAUSE,
  FUN_CLAUSE,
  CASE_CLAUSE,
  IF_CLAUSE,
  CATCH_CLAUSE,

  // variables
  VAR(true),

  // literals
  ATOM(true),
  CHAR_LITERAL(true),
  INT_LITERAL(true),
  FLOAT_LITERAL(true),
  STRING_LITERAL(true),

  // value constructors
  TUPLE(true),
  LIST(true),
  RECORD(true),
  RECORD_ACCESS(true),
  MAP(true),
  MAP_ENTRY,
  FUN_REF(true),
  FN(true),
  LIST_COMP(true),
  GENERATOR(" <- "),

  /** Construct that the rewriter does not model; passed through as is. */
  OPAQUE(true),

  // calls
  CALL(true),

  // prefix operators
  NEGATE("-", 8),
  POSITIVE("+", 8),
  BNOT("bnot ", 8),
  NOT("not ", 8),

  // infix operators, tightest first
  TIMES(" * ", 7),
  DIVIDE(" / ", 7),
  DIV(" div ", 7),
  REM(" rem ", 7),
  BAND(" band ", 7),
  AND(" and ", 7),
  PLUS(" + ", 6),
  MINUS(" - ", 6),
  BOR(" bor ", 6),
  BXOR(" bxor ", 6),
  BSL(" bsl ", 6),
  BSR(" bsr ", 6),
  OR(" or ", 6),
  XOR(" xor ", 6),
  APPEND(" ++ ", 5, false),
  SUBTRACT(" -- ", 5, false),
  EQ(" == ", 4),
  NE(" /= ", 4),
  LE(" =< ", 4),
  LT(" < ", 4),
  GE(" >= ", 4),
  GT(" > ", 4),
  EXACT_EQ(" =:= ", 4),
  EXACT_NE(" =/= ", 4),
  ANDALSO(" andalso ", 3),
  ORELSE(" orelse ", 2),
  SEND(" ! ", 1, false),
  MATCH(" = ", 1, false),

  // control
  BLOCK(true),
  CATCH("catch ", 0),
  CASE(true),
  IF(true),
  RECEIVE(true),
  TRY(true);

  /** Padded name, e.g. " + ". */
  public final @Nullable String padded;
  /** Left precedence */
  public final int left;
  /** Right precedence */
  public final int right;
  /** Operator token, e.g. "+" or "andalso"; null if not an operator. */
  public final @Nullable String opName;

  /** Infix operators, keyed by token. */
  public static final ImmutableMap<String, Op> BY_INFIX_NAME;

  /** Prefix operators, keyed by token. */
  public static final ImmutableMap<String, Op> BY_PREFIX_NAME;

  static {
    final ImmutableMap.Builder<String, Op> infix = ImmutableMap.builder();
    final ImmutableMap.Builder<String, Op> prefix = ImmutableMap.builder();
    for (Op op : values()) {
      if (op.opName == null || op == MATCH || op == GENERATOR) {
        continue;
      }
      if (op.isPrefix()) {
        prefix.put(op.opName, op);
      } else if (op.isInfix()) {
        infix.put(op.opName, op);
      }
    }
    BY_INFIX_NAME = infix.build();
    BY_PREFIX_NAME = prefix.build();
  }

  Op() {
    this(null, 0, 0);
  }

  Op(boolean atom) {
    this("", 99);
    assert atom;
  }

  Op(String padded) {
    this(padded, 0, 0);
  }

  Op(String padded, int precedence) {
    this(padded, precedence, true);
  }

  Op(String padded, int precedence, boolean leftAssociative) {
    this(padded,
        precedence * 2 + (leftAssociative ? 0 : 1),
        precedence * 2 + (leftAssociative ? 1 : 0));
  }

  Op(@Nullable String padded, int left, int right) {
    this.padded = padded;
    this.left = left;
    this.right = right;
    this.opName = padded == null || padded.equals("")
        ? null
        : padded.trim();
  }

  /** Returns whether this is a prefix operator such as "not" or unary
   * minus. */
  public boolean isPrefix() {
    return compareTo(NEGATE) >= 0 && compareTo(NOT) <= 0;
  }

  /** Returns whether this is an infix operator, including
   * {@link #MATCH}. */
  public boolean isInfix() {
    return compareTo(TIMES) >= 0 && compareTo(MATCH) <= 0;
  }

  /** Looks up an infix operator by its token. Throws if not found. */
  public static Op infix(String opName) {
    final Op op = BY_INFIX_NAME.get(opName);
    if (op == null) {
      throw new IllegalArgumentException("unknown infix operator " + opName);
    }
    return op;
  }

  /** Looks up a prefix operator by its token. Throws if not found. */
  public static Op prefix(String opName) {
    final Op op = BY_PREFIX_NAME.get(opName);
    if (op == null) {
      throw new IllegalArgumentException("unknown prefix operator " + opName);
    }
    return op;
  }
}

// End Op.java
