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

import java.util.List;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Visits syntax trees. */
public class Visitor {

  /** For use as a method reference. */
  protected <E extends AstNode> void accept(E e) {
    e.accept(this);
  }

  protected <E extends AstNode> void acceptOpt(@Nullable E e) {
    if (e != null) {
      e.accept(this);
    }
  }

  protected void acceptGuards(List<List<Ast.Exp>> guards) {
    guards.forEach(guard -> guard.forEach(this::accept));
  }

  // forms

  protected void visit(Ast.Module module) {
    module.forms.forEach(this::accept);
  }

  protected void visit(Ast.Attribute attribute) {}

  protected void visit(Ast.Function function) {
    function.clauses.forEach(this::accept);
  }

  protected void visit(Ast.Clause clause) {
    clause.patterns.forEach(this::accept);
    acceptGuards(clause.guards);
    clause.body.forEach(this::accept);
  }

  // leaves

  protected void visit(Ast.Var var) {}

  protected void visit(Ast.Literal literal) {}

  protected void visit(Ast.FunRef funRef) {}

  protected void visit(Ast.Opaque opaque) {}

  // value constructors

  protected void visit(Ast.Tuple tuple) {
    tuple.args.forEach(this::accept);
  }

  protected void visit(Ast.ListExp list) {
    list.args.forEach(this::accept);
    acceptOpt(list.tail);
  }

  protected void visit(Ast.Record record) {
    acceptOpt(record.base);
    record.fields.values().forEach(this::accept);
  }

  protected void visit(Ast.RecordAccess recordAccess) {
    recordAccess.exp.accept(this);
  }

  protected void visit(Ast.MapExp map) {
    acceptOpt(map.base);
    map.entries.forEach(this::accept);
  }

  protected void visit(Ast.MapEntry entry) {
    entry.key.accept(this);
    entry.value.accept(this);
  }

  protected void visit(Ast.Fn fn) {
    fn.clauses.forEach(this::accept);
  }

  protected void visit(Ast.ListComp listComp) {
    listComp.template.accept(this);
    listComp.qualifiers.forEach(this::accept);
  }

  protected void visit(Ast.Generator generator) {
    generator.pat.accept(this);
    generator.exp.accept(this);
  }

  // calls

  protected void visit(Ast.Call call) {
    acceptOpt(call.module);
    call.fn.accept(this);
    call.args.forEach(this::accept);
  }

  protected void visit(Ast.InfixCall infixCall) {
    infixCall.a0.accept(this);
    infixCall.a1.accept(this);
  }

  protected void visit(Ast.PrefixCall prefixCall) {
    prefixCall.a.accept(this);
  }

  protected void visit(Ast.Match match) {
    match.pat.accept(this);
    match.exp.accept(this);
  }

  // control

  protected void visit(Ast.Block block) {
    block.body.forEach(this::accept);
  }

  protected void visit(Ast.Catch catchExp) {
    catchExp.exp.accept(this);
  }

  protected void visit(Ast.Case caseOf) {
    caseOf.exp.accept(this);
    caseOf.clauses.forEach(this::accept);
  }

  protected void visit(Ast.If ifThen) {
    ifThen.clauses.forEach(this::accept);
  }

  protected void visit(Ast.Receive receive) {
    receive.clauses.forEach(this::accept);
    acceptOpt(receive.after);
    receive.afterBody.forEach(this::accept);
  }

  protected void visit(Ast.Try tryCatch) {
    tryCatch.body.forEach(this::accept);
    tryCatch.clauses.forEach(this::accept);
    tryCatch.catchClauses.forEach(this::accept);
    tryCatch.afterBody.forEach(this::accept);
  }
}

// End Visitor.java
