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

import com.google.common.collect.ImmutableSet;
import java.util.List;
import net.hydromatic.seqbind.ast.Ast;
import net.hydromatic.seqbind.ast.Op;

/**
 * Walks a function in evaluation order, assigning a version to every
 * occurrence of a sequential variable.
 *
 * <p>The walk does not build a tree; it fills a {@link Resolution}, which
 * {@link Synthesizer} then applies.
 *
 * <p>Every clause-like construct (function clause, fun clause, clause of
 * case, if, receive and try, let-block) is walked in a frame of its own, so
 * versions bound inside it are forgotten afterwards. Sibling clauses do not
 * see each other's versions.
 *
 * <p>A renamer walks one function, once.
 */
public class Renamer {
  private final FunctionId function;
  /** Classifies variables of the clause being walked; replaced on entry to
   * each function clause and, for its head, each fun clause. */
  private OccurrenceClassifier classifier;
  private final ScopeStack scopes = new ScopeStack();
  private final LetBlockExpander letBlockExpander;
  private final Resolution resolution = new Resolution();

  private Renamer(FunctionId function) {
    this.function = requireNonNull(function);
    this.classifier = OccurrenceClassifier.of(ImmutableSet.of());
    this.letBlockExpander = new LetBlockExpander(function, scopes);
  }

  /** Assigns versions to the sequential variables of a function.
   *
   * @throws CompileException if a variable cannot be resolved, or a
   * let-block is malformed */
  public static Resolution resolve(FunctionId id, Ast.Function function) {
    final Renamer renamer = new Renamer(id);
    renamer.walkFunction(function);
    return renamer.resolution;
  }

  private void walkFunction(Ast.Function function) {
    for (Ast.Clause clause : function.clauses) {
      classifier = OccurrenceClassifier.of(clause);
      scopes.push();
      walkClause(clause, Position.ARGUMENT);
      scopes.pop();
    }
  }

  /** Walks each clause in a frame of its own. */
  private void walkClauses(List<Ast.Clause> clauses, Position position) {
    for (Ast.Clause clause : clauses) {
      scopes.push();
      walkClause(clause, position);
      scopes.pop();
    }
  }

  /** Walks a clause in the current frame: patterns, then guards, then
   * body.
   *
   * <p>The head of a fun clause is classified against the names marked in
   * that fun clause only; its guards and body see the enclosing clause's
   * names as well. */
  private void walkClause(Ast.Clause clause, Position position) {
    final OccurrenceClassifier outer = classifier;
    if (clause.op == Op.FUN_CLAUSE) {
      classifier = OccurrenceClassifier.of(clause);
    }
    try {
      for (Ast.Exp pattern : clause.patterns) {
        walk(pattern, position);
      }
    } finally {
      classifier = outer;
    }
    for (List<Ast.Exp> guard : clause.guards) {
      for (Ast.Exp test : guard) {
        walk(test, Position.GUARD);
      }
    }
    walkBody(clause.body);
  }

  /** Walks a sequence of expressions in the current frame. */
  void walkBody(List<Ast.Exp> body) {
    for (Ast.Exp exp : body) {
      walk(exp, Position.VALUE);
    }
  }

  private void walkScopedBody(List<Ast.Exp> body) {
    scopes.push();
    walkBody(body);
    scopes.pop();
  }

  /** Walks an expression or pattern. */
  void walk(Ast.Exp exp, Position position) {
    switch (exp.op) {
    case VAR:
      walkVar((Ast.Var) exp, position);
      return;

    case TUPLE:
      for (Ast.Exp arg : ((Ast.Tuple) exp).args) {
        walk(arg, position);
      }
      return;

    case LIST:
      final Ast.ListExp list = (Ast.ListExp) exp;
      for (Ast.Exp arg : list.args) {
        walk(arg, position);
      }
      if (list.tail != null) {
        walk(list.tail, position);
      }
      return;

    case RECORD:
      final Ast.Record record = (Ast.Record) exp;
      if (record.base != null) {
        walk(record.base, position.valueOf());
      }
      for (Ast.Exp value : record.fields.values()) {
        walk(value, position);
      }
      return;

    case RECORD_ACCESS:
      walk(((Ast.RecordAccess) exp).exp, position.valueOf());
      return;

    case MAP:
      final Ast.MapExp map = (Ast.MapExp) exp;
      if (map.base != null) {
        walk(map.base, position.valueOf());
      }
      for (Ast.MapEntry entry : map.entries) {
        // In a pattern, a key is an expression; only the value is a pattern
        walk(entry.key, position.valueOf());
        walk(entry.value, position);
      }
      return;

    case CALL:
      final Ast.Call call = (Ast.Call) exp;
      if (LetBlockExpander.isLetBlock(call)) {
        letBlockExpander.expand(call, position, this);
        return;
      }
      if (call.module != null) {
        walk(call.module, position.valueOf());
      }
      walk(call.fn, position.valueOf());
      for (Ast.Exp arg : call.args) {
        walk(arg, position.valueOf());
      }
      return;

    case MATCH:
      final Ast.Match match = (Ast.Match) exp;
      if (position.pattern) {
        // Alias pattern; both sides are patterns
        walk(match.pat, position);
        walk(match.exp, position);
      } else {
        // The value is evaluated before the pattern binds
        walk(match.exp, position);
        walk(match.pat, Position.PATTERN);
      }
      return;

    case BLOCK:
      walkBody(((Ast.Block) exp).body);
      return;

    case CATCH:
      walk(((Ast.Catch) exp).exp, position);
      return;

    case CASE:
      final Ast.Case caseOf = (Ast.Case) exp;
      walk(caseOf.exp, Position.DISCRIMINANT);
      walkClauses(caseOf.clauses, Position.PATTERN);
      return;

    case IF:
      walkClauses(((Ast.If) exp).clauses, Position.PATTERN);
      return;

    case RECEIVE:
      final Ast.Receive receive = (Ast.Receive) exp;
      walkClauses(receive.clauses, Position.PATTERN);
      if (receive.after != null) {
        walk(receive.after, Position.VALUE);
        walkScopedBody(receive.afterBody);
      }
      return;

    case TRY:
      walkTry((Ast.Try) exp);
      return;

    case FN:
      walkClauses(((Ast.Fn) exp).clauses, Position.ARGUMENT);
      return;

    case LIST_COMP:
      final Ast.ListComp listComp = (Ast.ListComp) exp;
      scopes.push();
      for (Ast.Exp qualifier : listComp.qualifiers) {
        if (qualifier instanceof Ast.Generator) {
          final Ast.Generator generator = (Ast.Generator) qualifier;
          walk(generator.exp, Position.VALUE);
          walk(generator.pat, Position.GENERATOR);
        } else {
          walk(qualifier, Position.VALUE);
        }
      }
      walk(listComp.template, Position.VALUE);
      scopes.pop();
      return;

    default:
      if (exp instanceof Ast.InfixCall) {
        final Ast.InfixCall infixCall = (Ast.InfixCall) exp;
        walk(infixCall.a0, position);
        walk(infixCall.a1, position);
      } else if (exp instanceof Ast.PrefixCall) {
        walk(((Ast.PrefixCall) exp).a, position);
      }
      // Literals, function references and opaque nodes have no variables
    }
  }

  /** Walks a try. The "of" clauses see versions bound in the body; the
   * catch clauses and the after section do not. */
  private void walkTry(Ast.Try tryCatch) {
    scopes.push();
    walkBody(tryCatch.body);
    walkClauses(tryCatch.clauses, Position.PATTERN);
    scopes.pop();
    walkClauses(tryCatch.catchClauses, Position.PATTERN);
    if (!tryCatch.afterBody.isEmpty()) {
      walkScopedBody(tryCatch.afterBody);
    }
  }

  private void walkVar(Ast.Var var, Position position) {
    final Occurrence occurrence = classifier.classify(var.name, position);
    switch (occurrence) {
    case BINDING:
      final String base = SeqNames.baseName(var.name);
      resolution.put(var, VersionedName.of(base, scopes.bind(base)),
          occurrence);
      return;

    case REFERENCE:
      final String refBase = SeqNames.baseName(var.name);
      final Integer counter = scopes.lookupOpt(refBase);
      if (counter == null) {
        throw CompileException.unbound(refBase, function, var.pos);
      }
      resolution.put(var, VersionedName.of(refBase, counter), occurrence);
      return;

    case BARE_MATCH:
      final Integer current = scopes.lookupOpt(var.name);
      if (current == null) {
        throw CompileException.unboundBareMatch(var.name, function, var.pos);
      }
      resolution.put(var, VersionedName.of(var.name, current), occurrence);
      return;

    case REDECLARATION:
      throw CompileException.conflictingRedeclaration(var.name, function,
          var.pos);

    default:
      final VersionedName versioned = SeqNames.parseVersioned(var.name);
      if (versioned != null
          && classifier.sequentialNames().contains(versioned.base)) {
        throw CompileException.versionCollision(var.name, versioned.base,
            function, var.pos);
      }
      // not a sequential variable
    }
  }
}

// End Renamer.java
