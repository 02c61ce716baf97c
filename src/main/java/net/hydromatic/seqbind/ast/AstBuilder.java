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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.math.BigInteger;
import java.util.List;
import java.util.Map;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Builds parse tree nodes. */
public enum AstBuilder {
  /**
   * The singleton instance of the AST builder. The short name is convenient for
   * use via 'import static', but checkstyle does not approve.
   */
  // CHECKSTYLE: IGNORE 1
  ast;

  // forms

  public Ast.Module module(Pos pos, String name,
      List<? extends Ast.Form> forms) {
    return new Ast.Module(pos, name, ImmutableList.copyOf(forms));
  }

  public Ast.Attribute attribute(Pos pos, String name, Ast.Exp value) {
    return new Ast.Attribute(pos, name, value);
  }

  /** Creates a function; its arity is the number of patterns of its first
   * clause. */
  public Ast.Function function(Pos pos, String name,
      List<Ast.Clause> clauses) {
    checkArgument(!clauses.isEmpty(), "function %s has no clauses", name);
    return new Ast.Function(pos, name, clauses.get(0).patterns.size(),
        ImmutableList.copyOf(clauses));
  }

  public Ast.Function function(Pos pos, String name, Ast.Clause... clauses) {
    return function(pos, name, ImmutableList.copyOf(clauses));
  }

  // clauses

  public Ast.Clause clause(Pos pos, Op op, List<? extends Ast.Exp> patterns,
      List<? extends List<? extends Ast.Exp>> guards,
      List<? extends Ast.Exp> body) {
    final ImmutableList.Builder<List<Ast.Exp>> guardList =
        ImmutableList.builder();
    for (List<? extends Ast.Exp> guard : guards) {
      checkArgument(!guard.isEmpty(), "empty guard");
      guardList.add(ImmutableList.copyOf(guard));
    }
    return new Ast.Clause(pos, op, ImmutableList.copyOf(patterns),
        guardList.build(), ImmutableList.copyOf(body));
  }

  public Ast.Clause functionClause(Pos pos, List<? extends Ast.Exp> patterns,
      List<? extends List<? extends Ast.Exp>> guards,
      List<? extends Ast.Exp> body) {
    return clause(pos, Op.FUNCTION_CLAUSE, patterns, guards, body);
  }

  public Ast.Clause funClause(Pos pos, List<? extends Ast.Exp> patterns,
      List<? extends List<? extends Ast.Exp>> guards,
      List<? extends Ast.Exp> body) {
    return clause(pos, Op.FUN_CLAUSE, patterns, guards, body);
  }

  public Ast.Clause caseClause(Pos pos, Ast.Exp pattern,
      List<? extends List<? extends Ast.Exp>> guards,
      List<? extends Ast.Exp> body) {
    return clause(pos, Op.CASE_CLAUSE, ImmutableList.of(pattern), guards,
        body);
  }

  public Ast.Clause ifClause(Pos pos,
      List<? extends List<? extends Ast.Exp>> guards,
      List<? extends Ast.Exp> body) {
    return clause(pos, Op.IF_CLAUSE, ImmutableList.of(), guards, body);
  }

  /** Creates a clause of a try's catch section, "{@code Class:Reason}" or
   * "{@code Class:Reason:Stack}" if {@code stack} is not null. */
  public Ast.Clause catchClause(Pos pos, Ast.Exp errorClass, Ast.Exp reason,
      Ast.@Nullable Exp stack, List<? extends List<? extends Ast.Exp>> guards,
      List<? extends Ast.Exp> body) {
    final List<Ast.Exp> patterns = stack == null
        ? ImmutableList.of(errorClass, reason)
        : ImmutableList.of(errorClass, reason, stack);
    return clause(pos, Op.CATCH_CLAUSE, patterns, guards, body);
  }

  // variables and literals

  public Ast.Var var(Pos pos, String name) {
    return new Ast.Var(pos, name);
  }

  public Ast.Literal atom(Pos pos, String name) {
    return new Ast.Literal(pos, Op.ATOM, name);
  }

  public Ast.Literal intLiteral(Pos pos, BigInteger value) {
    return new Ast.Literal(pos, Op.INT_LITERAL, value);
  }

  public Ast.Literal intLiteral(Pos pos, long value) {
    return intLiteral(pos, BigInteger.valueOf(value));
  }

  public Ast.Literal floatLiteral(Pos pos, double value) {
    return new Ast.Literal(pos, Op.FLOAT_LITERAL, value);
  }

  public Ast.Literal stringLiteral(Pos pos, String value) {
    return new Ast.Literal(pos, Op.STRING_LITERAL, value);
  }

  public Ast.Literal charLiteral(Pos pos, char value) {
    return new Ast.Literal(pos, Op.CHAR_LITERAL, value);
  }

  // value constructors

  public Ast.Tuple tuple(Pos pos, List<? extends Ast.Exp> args) {
    return new Ast.Tuple(pos, ImmutableList.copyOf(args));
  }

  public Ast.ListExp list(Pos pos, List<? extends Ast.Exp> args) {
    return cons(pos, args, null);
  }

  public Ast.ListExp cons(Pos pos, List<? extends Ast.Exp> args,
      Ast.@Nullable Exp tail) {
    return new Ast.ListExp(pos, ImmutableList.copyOf(args), tail);
  }

  public Ast.Record record(Pos pos, Ast.@Nullable Exp base, String name,
      Map<String, ? extends Ast.Exp> fields) {
    return new Ast.Record(pos, base, name, ImmutableMap.copyOf(fields));
  }

  public Ast.RecordAccess recordAccess(Pos pos, Ast.Exp exp, String name,
      String field) {
    return new Ast.RecordAccess(pos, exp, name, field);
  }

  public Ast.MapExp map(Pos pos, Ast.@Nullable Exp base,
      List<Ast.MapEntry> entries) {
    return new Ast.MapExp(pos, base, ImmutableList.copyOf(entries));
  }

  public Ast.MapEntry mapEntry(Pos pos, Ast.Exp key, Ast.Exp value,
      boolean exact) {
    return new Ast.MapEntry(pos, key, value, exact);
  }

  public Ast.FunRef funRef(Pos pos, @Nullable String module, String name,
      int arity) {
    return new Ast.FunRef(pos, module, name, arity);
  }

  public Ast.Fn fn(Pos pos, List<Ast.Clause> clauses) {
    return new Ast.Fn(pos, ImmutableList.copyOf(clauses));
  }

  public Ast.ListComp listComp(Pos pos, Ast.Exp template,
      List<? extends Ast.Exp> qualifiers) {
    return new Ast.ListComp(pos, template, ImmutableList.copyOf(qualifiers));
  }

  public Ast.Generator generator(Pos pos, Ast.Exp pat, Ast.Exp exp) {
    return new Ast.Generator(pos, pat, exp);
  }

  public Ast.Opaque opaque(Pos pos, String text) {
    return new Ast.Opaque(pos, text);
  }

  // calls

  public Ast.Call call(Pos pos, Ast.@Nullable Exp module, Ast.Exp fn,
      List<? extends Ast.Exp> args) {
    return new Ast.Call(pos, module, fn, ImmutableList.copyOf(args));
  }

  /** Creates a call to a function in the same module, "{@code f(A, B)}". */
  public Ast.Call localCall(Pos pos, String name,
      List<? extends Ast.Exp> args) {
    return call(pos, null, atom(pos, name), args);
  }

  /** Creates a call to a function in another module,
   * "{@code m:f(A, B)}". */
  public Ast.Call remoteCall(Pos pos, String module, String name,
      List<? extends Ast.Exp> args) {
    return call(pos, atom(pos, module), atom(pos, name), args);
  }

  public Ast.InfixCall infixCall(Pos pos, Op op, Ast.Exp a0, Ast.Exp a1) {
    return new Ast.InfixCall(pos, op, a0, a1);
  }

  /** Creates a call to an infix operator given its token, e.g. "+". */
  public Ast.InfixCall infixCall(Pos pos, String opName, Ast.Exp a0,
      Ast.Exp a1) {
    return infixCall(pos, Op.infix(opName), a0, a1);
  }

  public Ast.PrefixCall prefixCall(Pos pos, Op op, Ast.Exp a) {
    return new Ast.PrefixCall(pos, op, a);
  }

  public Ast.Match match(Pos pos, Ast.Exp pat, Ast.Exp exp) {
    return new Ast.Match(pos, pat, exp);
  }

  // control

  public Ast.Block block(Pos pos, List<? extends Ast.Exp> body) {
    return new Ast.Block(pos, ImmutableList.copyOf(body));
  }

  public Ast.Catch catchExp(Pos pos, Ast.Exp exp) {
    return new Ast.Catch(pos, exp);
  }

  public Ast.Case caseOf(Pos pos, Ast.Exp exp, List<Ast.Clause> clauses) {
    return new Ast.Case(pos, exp, ImmutableList.copyOf(clauses));
  }

  public Ast.If ifThen(Pos pos, List<Ast.Clause> clauses) {
    return new Ast.If(pos, ImmutableList.copyOf(clauses));
  }

  public Ast.Receive receive(Pos pos, List<Ast.Clause> clauses,
      Ast.@Nullable Exp after, List<? extends Ast.Exp> afterBody) {
    return new Ast.Receive(pos, ImmutableList.copyOf(clauses), after,
        ImmutableList.copyOf(afterBody));
  }

  public Ast.Try tryCatch(Pos pos, List<? extends Ast.Exp> body,
      List<Ast.Clause> clauses, List<Ast.Clause> catchClauses,
      List<? extends Ast.Exp> afterBody) {
    return new Ast.Try(pos, ImmutableList.copyOf(body),
        ImmutableList.copyOf(clauses), ImmutableList.copyOf(catchClauses),
        ImmutableList.copyOf(afterBody));
  }
}

// End AstBuilder.java
