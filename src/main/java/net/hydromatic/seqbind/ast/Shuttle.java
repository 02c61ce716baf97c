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

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Visits and transforms syntax trees.
 *
 * <p>Each {@code visit} method returns the node itself if none of its
 * children changed, so a shuttle that changes nothing returns the same tree,
 * and a shuttle that changes leaves returns a tree of the same shape. */
public class Shuttle {
  /** Creates a Shuttle. */
  public Shuttle() {
  }

  protected <E extends AstNode> List<E> visitList(List<E> nodes) {
    final List<E> list = new ArrayList<>();
    for (E node : nodes) {
      //noinspection unchecked
      list.add((E) node.accept(this));
    }
    return list;
  }

  protected <K, E extends AstNode> Map<K, E> visitMap(Map<K, E> nodes) {
    final Map<K, E> map = new LinkedHashMap<>();
    //noinspection unchecked
    nodes.forEach((k, v) -> map.put(k, (E) v.accept(this)));
    return map;
  }

  protected List<List<Ast.Exp>> visitGuards(List<List<Ast.Exp>> guards) {
    final List<List<Ast.Exp>> list = new ArrayList<>();
    for (List<Ast.Exp> guard : guards) {
      list.add(visitList(guard));
    }
    return list;
  }

  protected <E extends AstNode> @Nullable E visitOpt(@Nullable E node) {
    //noinspection unchecked
    return node == null ? null : (E) node.accept(this);
  }

  // forms

  protected Ast.Module visit(Ast.Module module) {
    return module.copy(visitList(module.forms));
  }

  protected Ast.Form visit(Ast.Attribute attribute) {
    return attribute; // attributes are never rewritten
  }

  protected Ast.Function visit(Ast.Function function) {
    return function.copy(visitList(function.clauses));
  }

  protected Ast.Clause visit(Ast.Clause clause) {
    return clause.copy(visitList(clause.patterns),
        visitGuards(clause.guards), visitList(clause.body));
  }

  // leaves

  protected Ast.Exp visit(Ast.Var var) {
    return var; // leaf
  }

  protected Ast.Exp visit(Ast.Literal literal) {
    return literal; // leaf
  }

  protected Ast.Exp visit(Ast.FunRef funRef) {
    return funRef; // leaf
  }

  protected Ast.Exp visit(Ast.Opaque opaque) {
    return opaque; // leaf
  }

  // value constructors

  protected Ast.Exp visit(Ast.Tuple tuple) {
    return tuple.copy(visitList(tuple.args));
  }

  protected Ast.Exp visit(Ast.ListExp list) {
    return list.copy(visitList(list.args), visitOpt(list.tail));
  }

  protected Ast.Exp visit(Ast.Record record) {
    return record.copy(visitOpt(record.base), visitMap(record.fields));
  }

  protected Ast.Exp visit(Ast.RecordAccess recordAccess) {
    return recordAccess.copy(recordAccess.exp.accept(this));
  }

  protected Ast.Exp visit(Ast.MapExp map) {
    return map.copy(visitOpt(map.base), visitList(map.entries));
  }

  protected Ast.MapEntry visit(Ast.MapEntry entry) {
    return entry.copy(entry.key.accept(this), entry.value.accept(this));
  }

  protected Ast.Exp visit(Ast.Fn fn) {
    return fn.copy(visitList(fn.clauses));
  }

  protected Ast.Exp visit(Ast.ListComp listComp) {
    return listComp.copy(listComp.template.accept(this),
        visitList(listComp.qualifiers));
  }

  protected Ast.Exp visit(Ast.Generator generator) {
    return generator.copy(generator.pat.accept(this),
        generator.exp.accept(this));
  }

  // calls

  protected Ast.Exp visit(Ast.Call call) {
    return call.copy(visitOpt(call.module), call.fn.accept(this),
        visitList(call.args));
  }

  protected Ast.Exp visit(Ast.InfixCall infixCall) {
    return infixCall.copy(infixCall.a0.accept(this),
        infixCall.a1.accept(this));
  }

  protected Ast.Exp visit(Ast.PrefixCall prefixCall) {
    return prefixCall.copy(prefixCall.a.accept(this));
  }

  protected Ast.Exp visit(Ast.Match match) {
    return match.copy(match.pat.accept(this), match.exp.accept(this));
  }

  // control

  protected Ast.Exp visit(Ast.Block block) {
    return block.copy(visitList(block.body));
  }

  protected Ast.Exp visit(Ast.Catch catchExp) {
    return catchExp.copy(catchExp.exp.accept(this));
  }

  protected Ast.Exp visit(Ast.Case caseOf) {
    return caseOf.copy(caseOf.exp.accept(this), visitList(caseOf.clauses));
  }

  protected Ast.Exp visit(Ast.If ifThen) {
    return ifThen.copy(visitList(ifThen.clauses));
  }

  protected Ast.Exp visit(Ast.Receive receive) {
    return receive.copy(visitList(receive.clauses), visitOpt(receive.after),
        visitList(receive.afterBody));
  }

  protected Ast.Exp visit(Ast.Try tryCatch) {
    return tryCatch.copy(visitList(tryCatch.body),
        visitList(tryCatch.clauses), visitList(tryCatch.catchClauses),
        visitList(tryCatch.afterBody));
  }
}

// End Shuttle.java
