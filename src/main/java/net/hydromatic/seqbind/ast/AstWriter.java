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

import com.google.common.collect.ImmutableSet;
import java.util.List;
import java.util.regex.Pattern;

/** Context for writing an AST out as a string. */
public class AstWriter {
  private static final Pattern BARE_ATOM =
      Pattern.compile("[a-z][a-zA-Z0-9_@]*");

  /** Words that must be quoted when used as atoms. */
  private static final ImmutableSet<String> RESERVED =
      ImmutableSet.of("after", "and", "andalso", "band", "begin", "bnot",
          "bor", "bsl", "bsr", "bxor", "case", "catch", "cond", "div", "else",
          "end", "fun", "if", "let", "maybe", "not", "of", "or", "orelse",
          "receive", "rem", "try", "when", "xor");

  private final StringBuilder b = new StringBuilder();

  /** Appends a string to the output. */
  public AstWriter append(String s) {
    b.append(s);
    return this;
  }

  /** Appends a node, at a given precedence. */
  public AstWriter append(AstNode node, int left, int right) {
    return node.unparse(this, left, right);
  }

  /** Appends a list of nodes, separated by a given string. */
  public AstWriter appendAll(List<? extends AstNode> nodes, String sep) {
    for (int i = 0; i < nodes.size(); i++) {
      if (i > 0) {
        append(sep);
      }
      append(nodes.get(i), 0, 0);
    }
    return this;
  }

  /** Appends a call to an infix operator. */
  public AstWriter infix(int left, AstNode a0, Op op, AstNode a1, int right) {
    if (left > op.left || op.right < right) {
      return append("(").infix(0, a0, op, a1, 0).append(")");
    }
    a0.unparse(this, left, op.left);
    append(op.padded);
    a1.unparse(this, op.right, right);
    return this;
  }

  /** Appends a call to a prefix operator. */
  public AstWriter prefix(int left, Op op, AstNode a, int right) {
    if (left > op.left || op.right < right) {
      return append("(").prefix(0, op, a, 0).append(")");
    }
    append(op.padded);
    a.unparse(this, op.right, right);
    return this;
  }

  /** Appends an atom, quoting it if necessary. */
  public AstWriter atom(String name) {
    if (BARE_ATOM.matcher(name).matches() && !RESERVED.contains(name)) {
      return append(name);
    }
    return append("'")
        .append(name.replace("\\", "\\\\").replace("'", "\\'"))
        .append("'");
  }

  /** Appends the value of a literal. */
  public AstWriter appendLiteral(Op op, Comparable<?> value) {
    switch (op) {
    case ATOM:
      return atom((String) value);
    case STRING_LITERAL:
      return append("\"")
          .append(((String) value).replace("\\", "\\\\")
              .replace("\"", "\\\"")
              .replace("\n", "\\n"))
          .append("\"");
    case CHAR_LITERAL:
      final char c = (Character) value;
      return append("$").append(c == ' ' ? "\\s"
          : c == '\n' ? "\\n"
          : c == '\\' ? "\\\\"
          : String.valueOf(c));
    default:
      return append(value.toString());
    }
  }

  /** Appends a guard sequence, preceded by " when ", if it is not empty. */
  public AstWriter guards(List<? extends List<? extends AstNode>> guards) {
    for (int i = 0; i < guards.size(); i++) {
      append(i == 0 ? " when " : "; ");
      appendAll(guards.get(i), ", ");
    }
    return this;
  }

  @Override public String toString() {
    return b.toString();
  }
}

// End AstWriter.java
