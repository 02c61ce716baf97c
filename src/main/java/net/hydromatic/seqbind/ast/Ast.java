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
import static java.util.Objects.requireNonNull;
import static net.hydromatic.seqbind.ast.AstBuilder.ast;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Various sub-classes of AST nodes.
 *
 * <p>As in the host language's abstract format, patterns and expressions
 * share node types. Whether {@code {A, B}} is a pattern or a value depends
 * on where it occurs, not on its class.
 *
 * <p>Nodes do not override {@link Object#equals(Object)}, except for
 * {@link Literal}; two occurrences of the same variable are different
 * nodes. */
public class Ast {
  private Ast() {}

  /** Compilation unit: the module name and its forms. */
  public static class Module extends AstNode {
    public final String name;
    public final List<Form> forms;

    Module(Pos pos, String name, ImmutableList<Form> forms) {
      super(pos, Op.MODULE);
      this.name = requireNonNull(name);
      this.forms = requireNonNull(forms);
    }

    @Override public Module accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      return w.appendAll(forms, "\n");
    }

    /** Returns the value of the last attribute with a given name, or null. */
    public @Nullable Exp attributeValue(String name) {
      Exp value = null;
      for (Form form : forms) {
        if (form instanceof Attribute
            && ((Attribute) form).name.equals(name)) {
          value = ((Attribute) form).value;
        }
      }
      return value;
    }

    /** Creates a copy of this {@code Module} with given forms,
     * or {@code this} if the forms are the same. */
    public Module copy(List<Form> forms) {
      return this.forms.equals(forms)
          ? this
          : ast.module(pos, name, forms);
    }
  }

  /** Top-level declaration in a module. */
  public abstract static class Form extends AstNode {
    Form(Pos pos, Op op) {
      super(pos, op);
    }

    @Override public abstract Form accept(Shuttle shuttle);
  }

  /** Module attribute.
   *
   * <p>For example, "{@code -export([start/1]).}". */
  public static class Attribute extends Form {
    public final String name;
    public final Exp value;

    Attribute(Pos pos, String name, Exp value) {
      super(pos, Op.ATTRIBUTE);
      this.name = requireNonNull(name);
      this.value = requireNonNull(value);
    }

    @Override public Form accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      return w.append("-").atom(name).append("(")
          .append(value, 0, 0).append(").");
    }
  }

  /** Function definition, one or more clauses of the same arity. */
  public static class Function extends Form {
    public final String name;
    public final int arity;
    public final List<Clause> clauses;

    Function(Pos pos, String name, int arity, ImmutableList<Clause> clauses) {
      super(pos, Op.FUNCTION);
      this.name = requireNonNull(name);
      this.arity = arity;
      this.clauses = requireNonNull(clauses);
      checkArgument(!clauses.isEmpty(), "function %s has no clauses", name);
      for (Clause clause : clauses) {
        checkArgument(clause.op == Op.FUNCTION_CLAUSE,
            "not a function clause: %s", clause);
        checkArgument(clause.patterns.size() == arity,
            "clause of %s/%s has %s patterns", name, arity,
            clause.patterns.size());
      }
    }

    @Override public Function accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      for (int i = 0; i < clauses.size(); i++) {
        w.append(i == 0 ? "" : "; ").atom(name).append(clauses.get(i), 0, 0);
      }
      return w.append(".");
    }

    /** Creates a copy of this {@code Function} with given clauses,
     * or {@code this} if the clauses are the same. */
    public Function copy(List<Clause> clauses) {
      return this.clauses.equals(clauses)
          ? this
          : ast.function(pos, name, clauses);
    }
  }

  /** Clause of a function, fun, case, if, receive or try.
   *
   * <p>The {@link #op} says which: {@link Op#FUNCTION_CLAUSE},
   * {@link Op#FUN_CLAUSE}, {@link Op#CASE_CLAUSE} (also used by receive and
   * the "of" section of try), {@link Op#IF_CLAUSE} (no patterns) or
   * {@link Op#CATCH_CLAUSE} (patterns are class, reason and optional
   * stack trace).
   *
   * <p>{@link #guards} is a guard sequence: a list of alternatives
   * (separated by ";" in source), each a list of tests (separated by ","). */
  public static class Clause extends AstNode {
    public final List<Exp> patterns;
    public final List<List<Exp>> guards;
    public final List<Exp> body;

    Clause(Pos pos, Op op, ImmutableList<Exp> patterns,
        ImmutableList<List<Exp>> guards, ImmutableList<Exp> body) {
      super(pos, op);
      this.patterns = requireNonNull(patterns);
      this.guards = requireNonNull(guards);
      this.body = requireNonNull(body);
      checkArgument(!body.isEmpty(), "clause has empty body");
      switch (op) {
      case FUNCTION_CLAUSE:
      case FUN_CLAUSE:
        break;
      case CASE_CLAUSE:
        checkArgument(patterns.size() == 1, "case clause needs one pattern");
        break;
      case IF_CLAUSE:
        checkArgument(patterns.isEmpty(), "if clause has no patterns");
        checkArgument(!guards.isEmpty(), "if clause needs a guard");
        break;
      case CATCH_CLAUSE:
        checkArgument(patterns.size() == 2 || patterns.size() == 3,
            "catch clause needs class, reason and optional stack trace");
        break;
      default:
        throw new IllegalArgumentException("not a clause: " + op);
      }
    }

    @Override public Clause accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      switch (op) {
      case FUNCTION_CLAUSE:
      case FUN_CLAUSE:
        w.append("(").appendAll(patterns, ", ").append(")").guards(guards);
        break;
      case CASE_CLAUSE:
        w.appendAll(patterns, ", ").guards(guards);
        break;
      case IF_CLAUSE:
        for (int i = 0; i < guards.size(); i++) {
          w.append(i == 0 ? "" : "; ").appendAll(guards.get(i), ", ");
        }
        break;
      default:
        w.appendAll(patterns, ":").guards(guards);
      }
      return w.append(" -> ").appendAll(body, ", ");
    }

    /** Creates a copy of this {@code Clause} with given contents,
     * or {@code this} if the contents are the same. */
    public Clause copy(List<Exp> patterns, List<List<Exp>> guards,
        List<Exp> body) {
      return this.patterns.equals(patterns)
          && this.guards.equals(guards)
          && this.body.equals(body)
          ? this
          : ast.clause(pos, op, patterns, guards, body);
    }
  }

  /** Base class for an expression; also used for patterns. */
  public abstract static class Exp extends AstNode {
    Exp(Pos pos, Op op) {
      super(pos, op);
    }

    @Override public abstract Exp accept(Shuttle shuttle);
  }

  /** Variable, in a pattern or an expression.
   *
   * <p>For example, "Req@" in "{@code f(Req@) -> Req@.}". */
  public static class Var extends Exp {
    public final String name;

    Var(Pos pos, String name) {
      super(pos, Op.VAR);
      this.name = requireNonNull(name);
    }

    @Override public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      return w.append(name);
    }
  }

  /** Literal: atom, integer, float, string or character. */
  public static class Literal extends Exp {
    public final Comparable<?> value;

    Literal(Pos pos, Op op, Comparable<?> value) {
      super(pos, op);
      this.value = requireNonNull(value);
      checkArgument(op == Op.ATOM
          || op == Op.CHAR_LITERAL
          || op == Op.INT_LITERAL
          || op == Op.FLOAT_LITERAL
          || op == Op.STRING_LITERAL);
    }

    @Override public int hashCode() {
      return Objects.hash(op, value);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof Literal
          && this.op == ((Literal) o).op
          && this.value.equals(((Literal) o).value);
    }

    /** Returns whether this is the atom with a given name. */
    public boolean isAtom(String name) {
      return op == Op.ATOM && value.equals(name);
    }

    @Override public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      return w.appendLiteral(op, value);
    }
  }

  /** Tuple.
   *
   * <p>For example, "{@code {A, Req@}}". */
  public static class Tuple extends Exp {
    public final List<Exp> args;

    Tuple(Pos pos, ImmutableList<Exp> args) {
      super(pos, Op.TUPLE);
      this.args = requireNonNull(args);
    }

    @Override public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      return w.append("{").appendAll(args, ", ").append("}");
    }

    public Tuple copy(List<Exp> args) {
      return this.args.equals(args) ? this : ast.tuple(pos, args);
    }
  }

  /** List, with an optional tail.
   *
   * <p>For example, "{@code []}", "{@code [A, B]}" and
   * "{@code [H | T]}". */
  public static class ListExp extends Exp {
    public final List<Exp> args;
    public final @Nullable Exp tail;

    ListExp(Pos pos, ImmutableList<Exp> args, @Nullable Exp tail) {
      super(pos, Op.LIST);
      this.args = requireNonNull(args);
      this.tail = tail;
      checkArgument(tail == null || !args.isEmpty(),
          "list with tail must have at least one element");
    }

    @Override public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      w.append("[").appendAll(args, ", ");
      if (tail != null) {
        w.append(" | ").append(tail, 0, 0);
      }
      return w.append("]");
    }

    public ListExp copy(List<Exp> args, @Nullable Exp tail) {
      return this.args.equals(args) && this.tail == tail
          ? this
          : ast.cons(pos, args, tail);
    }
  }

  /** Record construction, update or pattern.
   *
   * <p>For example, "{@code #state{count = 0}}" and
   * "{@code S#state{count = N}}". */
  public static class Record extends Exp {
    public final @Nullable Exp base;
    public final String name;
    public final Map<String, Exp> fields;

    Record(Pos pos, @Nullable Exp base, String name,
        ImmutableMap<String, Exp> fields) {
      super(pos, Op.RECORD);
      this.base = base;
      this.name = requireNonNull(name);
      this.fields = requireNonNull(fields);
    }

    @Override public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      if (base != null) {
        w.append(base, left, op.left);
      }
      w.append("#").atom(name).append("{");
      final int[] i = {0};
      fields.forEach((field, value) ->
          w.append(i[0]++ == 0 ? "" : ", ").atom(field).append(" = ")
              .append(value, 0, 0));
      return w.append("}");
    }

    public Record copy(@Nullable Exp base, Map<String, Exp> fields) {
      return this.base == base && this.fields.equals(fields)
          ? this
          : ast.record(pos, base, name, fields);
    }
  }

  /** Access to a record field.
   *
   * <p>For example, "{@code S#state.count}". */
  public static class RecordAccess extends Exp {
    public final Exp exp;
    public final String name;
    public final String field;

    RecordAccess(Pos pos, Exp exp, String name, String field) {
      super(pos, Op.RECORD_ACCESS);
      this.exp = requireNonNull(exp);
      this.name = requireNonNull(name);
      this.field = requireNonNull(field);
    }

    @Override public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      return w.append(exp, left, op.left).append("#").atom(name)
          .append(".").atom(field);
    }

    public RecordAccess copy(Exp exp) {
      return this.exp == exp
          ? this
          : ast.recordAccess(pos, exp, name, field);
    }
  }

  /** Map construction, update or pattern.
   *
   * <p>For example, "{@code #{a => 1}}" and "{@code M#{a := X}}". */
  public static class MapExp extends Exp {
    public final @Nullable Exp base;
    public final List<MapEntry> entries;

    MapExp(Pos pos, @Nullable Exp base, ImmutableList<MapEntry> entries) {
      super(pos, Op.MAP);
      this.base = base;
      this.entries = requireNonNull(entries);
    }

    @Override public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      if (base != null) {
        w.append(base, left, op.left);
      }
      return w.append("#{").appendAll(entries, ", ").append("}");
    }

    public MapExp copy(@Nullable Exp base, List<MapEntry> entries) {
      return this.base == base && this.entries.equals(entries)
          ? this
          : ast.map(pos, base, entries);
    }
  }

  /** Entry in a map, "{@code K => V}" or (if exact) "{@code K := V}". */
  public static class MapEntry extends AstNode {
    public final Exp key;
    public final Exp value;
    public final boolean exact;

    MapEntry(Pos pos, Exp key, Exp value, boolean exact) {
      super(pos, Op.MAP_ENTRY);
      this.key = requireNonNull(key);
      this.value = requireNonNull(value);
      this.exact = exact;
    }

    @Override public MapEntry accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      return w.append(key, 0, 0).append(exact ? " := " : " => ")
          .append(value, 0, 0);
    }

    public MapEntry copy(Exp key, Exp value) {
      return this.key == key && this.value == value
          ? this
          : ast.mapEntry(pos, key, value, exact);
    }
  }

  /** Reference to a named function.
   *
   * <p>For example, "{@code fun handle/2}" and
   * "{@code fun lists:map/2}". */
  public static class FunRef extends Exp {
    public final @Nullable String module;
    public final String name;
    public final int arity;

    FunRef(Pos pos, @Nullable String module, String name, int arity) {
      super(pos, Op.FUN_REF);
      this.module = module;
      this.name = requireNonNull(name);
      this.arity = arity;
    }

    @Override public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      w.append("fun ");
      if (module != null) {
        w.atom(module).append(":");
      }
      return w.atom(name).append("/").append(Integer.toString(arity));
    }
  }

  /** Function call, local ("{@code get(a, Req@)}") or remote
   * ("{@code lists:reverse(L)}"). */
  public static class Call extends Exp {
    public final @Nullable Exp module;
    public final Exp fn;
    public final List<Exp> args;

    Call(Pos pos, @Nullable Exp module, Exp fn, ImmutableList<Exp> args) {
      super(pos, Op.CALL);
      this.module = module;
      this.fn = requireNonNull(fn);
      this.args = requireNonNull(args);
    }

    @Override public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      if (module != null) {
        w.append(module, 0, op.left).append(":");
      }
      return w.append(fn, 0, op.left)
          .append("(").appendAll(args, ", ").append(")");
    }

    public Call copy(@Nullable Exp module, Exp fn, List<Exp> args) {
      return this.module == module
          && this.fn == fn
          && this.args.equals(args)
          ? this
          : ast.call(pos, module, fn, args);
    }
  }

  /** Call to an infix operator.
   *
   * <p>For example, "{@code N + 1}" and "{@code Pid ! Msg}". */
  public static class InfixCall extends Exp {
    public final Exp a0;
    public final Exp a1;

    InfixCall(Pos pos, Op op, Exp a0, Exp a1) {
      super(pos, op);
      this.a0 = requireNonNull(a0);
      this.a1 = requireNonNull(a1);
      checkArgument(op.isInfix() && op != Op.MATCH, "not infix: %s", op);
    }

    @Override public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      return w.infix(left, a0, op, a1, right);
    }

    public InfixCall copy(Exp a0, Exp a1) {
      return this.a0 == a0 && this.a1 == a1
          ? this
          : ast.infixCall(pos, op, a0, a1);
    }
  }

  /** Call to a prefix operator.
   *
   * <p>For example, "{@code not Done}" and "{@code -N}". */
  public static class PrefixCall extends Exp {
    public final Exp a;

    PrefixCall(Pos pos, Op op, Exp a) {
      super(pos, op);
      this.a = requireNonNull(a);
      checkArgument(op.isPrefix(), "not prefix: %s", op);
    }

    @Override public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      return w.prefix(left, op, a, right);
    }

    public PrefixCall copy(Exp a) {
      return this.a == a ? this : ast.prefixCall(pos, op, a);
    }
  }

  /** Match expression, "{@code Pat = Exp}".
   *
   * <p>Inside a pattern, the same syntax is an alias pattern, and both sides
   * are patterns. */
  public static class Match extends Exp {
    public final Exp pat;
    public final Exp exp;

    Match(Pos pos, Exp pat, Exp exp) {
      super(pos, Op.MATCH);
      this.pat = requireNonNull(pat);
      this.exp = requireNonNull(exp);
    }

    @Override public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      return w.infix(left, pat, op, exp, right);
    }

    /** Creates a copy of this {@code Match} with given contents,
     * or {@code this} if the contents are the same. */
    public Match copy(Exp pat, Exp exp) {
      return this.pat == pat && this.exp == exp
          ? this
          : ast.match(pos, pat, exp);
    }
  }

  /** Block, "{@code begin E1, ..., En end}". */
  public static class Block extends Exp {
    public final List<Exp> body;

    Block(Pos pos, ImmutableList<Exp> body) {
      super(pos, Op.BLOCK);
      this.body = requireNonNull(body);
      checkArgument(!body.isEmpty(), "empty block");
    }

    @Override public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      return w.append("begin ").appendAll(body, ", ").append(" end");
    }

    public Block copy(List<Exp> body) {
      return this.body.equals(body) ? this : ast.block(pos, body);
    }
  }

  /** Catch expression, "{@code catch E}". */
  public static class Catch extends Exp {
    public final Exp exp;

    Catch(Pos pos, Exp exp) {
      super(pos, Op.CATCH);
      this.exp = requireNonNull(exp);
    }

    @Override public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      return w.prefix(left, op, exp, right);
    }

    public Catch copy(Exp exp) {
      return this.exp == exp ? this : ast.catchExp(pos, exp);
    }
  }

  /** Case expression, "{@code case E of P1 -> B1; P2 -> B2 end}". */
  public static class Case extends Exp {
    public final Exp exp;
    public final List<Clause> clauses;

    Case(Pos pos, Exp exp, ImmutableList<Clause> clauses) {
      super(pos, Op.CASE);
      this.exp = requireNonNull(exp);
      this.clauses = requireNonNull(clauses);
      checkArgument(!clauses.isEmpty(), "case has no clauses");
      checkClauses(clauses, Op.CASE_CLAUSE);
    }

    @Override public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      return w.append("case ").append(exp, 0, 0).append(" of ")
          .appendAll(clauses, "; ").append(" end");
    }

    public Case copy(Exp exp, List<Clause> clauses) {
      return this.exp == exp && this.clauses.equals(clauses)
          ? this
          : ast.caseOf(pos, exp, clauses);
    }
  }

  /** If expression, "{@code if G1 -> B1; G2 -> B2 end}". */
  public static class If extends Exp {
    public final List<Clause> clauses;

    If(Pos pos, ImmutableList<Clause> clauses) {
      super(pos, Op.IF);
      this.clauses = requireNonNull(clauses);
      checkArgument(!clauses.isEmpty(), "if has no clauses");
      checkClauses(clauses, Op.IF_CLAUSE);
    }

    @Override public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      return w.append("if ").appendAll(clauses, "; ").append(" end");
    }

    public If copy(List<Clause> clauses) {
      return this.clauses.equals(clauses) ? this : ast.ifThen(pos, clauses);
    }
  }

  /** Receive expression, with optional "after" section.
   *
   * <p>For example,
   * "{@code receive {ok, X} -> X after 1000 -> timeout end}". */
  public static class Receive extends Exp {
    public final List<Clause> clauses;
    public final @Nullable Exp after;
    public final List<Exp> afterBody;

    Receive(Pos pos, ImmutableList<Clause> clauses, @Nullable Exp after,
        ImmutableList<Exp> afterBody) {
      super(pos, Op.RECEIVE);
      this.clauses = requireNonNull(clauses);
      this.after = after;
      this.afterBody = requireNonNull(afterBody);
      checkArgument((after == null) == afterBody.isEmpty(),
          "after timeout and after body must both be present or absent");
      checkArgument(!clauses.isEmpty() || after != null, "empty receive");
      checkClauses(clauses, Op.CASE_CLAUSE);
    }

    @Override public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      w.append("receive");
      if (!clauses.isEmpty()) {
        w.append(" ").appendAll(clauses, "; ");
      }
      if (after != null) {
        w.append(" after ").append(after, 0, 0).append(" -> ")
            .appendAll(afterBody, ", ");
      }
      return w.append(" end");
    }

    public Receive copy(List<Clause> clauses, @Nullable Exp after,
        List<Exp> afterBody) {
      return this.clauses.equals(clauses)
          && this.after == after
          && this.afterBody.equals(afterBody)
          ? this
          : ast.receive(pos, clauses, after, afterBody);
    }
  }

  /** Try expression.
   *
   * <p>For example,
   * "{@code try f(X) of ok -> 1 catch error:E -> E after done() end}". */
  public static class Try extends Exp {
    public final List<Exp> body;
    public final List<Clause> clauses;
    public final List<Clause> catchClauses;
    public final List<Exp> afterBody;

    Try(Pos pos, ImmutableList<Exp> body, ImmutableList<Clause> clauses,
        ImmutableList<Clause> catchClauses, ImmutableList<Exp> afterBody) {
      super(pos, Op.TRY);
      this.body = requireNonNull(body);
      this.clauses = requireNonNull(clauses);
      this.catchClauses = requireNonNull(catchClauses);
      this.afterBody = requireNonNull(afterBody);
      checkArgument(!body.isEmpty(), "try has empty body");
      checkArgument(!catchClauses.isEmpty() || !afterBody.isEmpty(),
          "try needs catch or after");
      checkClauses(clauses, Op.CASE_CLAUSE);
      checkClauses(catchClauses, Op.CATCH_CLAUSE);
    }

    @Override public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      w.append("try ").appendAll(body, ", ");
      if (!clauses.isEmpty()) {
        w.append(" of ").appendAll(clauses, "; ");
      }
      if (!catchClauses.isEmpty()) {
        w.append(" catch ").appendAll(catchClauses, "; ");
      }
      if (!afterBody.isEmpty()) {
        w.append(" after ").appendAll(afterBody, ", ");
      }
      return w.append(" end");
    }

    public Try copy(List<Exp> body, List<Clause> clauses,
        List<Clause> catchClauses, List<Exp> afterBody) {
      return this.body.equals(body)
          && this.clauses.equals(clauses)
          && this.catchClauses.equals(catchClauses)
          && this.afterBody.equals(afterBody)
          ? this
          : ast.tryCatch(pos, body, clauses, catchClauses, afterBody);
    }
  }

  /** Anonymous function literal, "{@code fun (X) -> X + 1 end}". */
  public static class Fn extends Exp {
    public final List<Clause> clauses;

    Fn(Pos pos, ImmutableList<Clause> clauses) {
      super(pos, Op.FN);
      this.clauses = requireNonNull(clauses);
      checkArgument(!clauses.isEmpty(), "fun has no clauses");
      checkClauses(clauses, Op.FUN_CLAUSE);
    }

    @Override public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      return w.append("fun ").appendAll(clauses, "; ").append(" end");
    }

    public Fn copy(List<Clause> clauses) {
      return this.clauses.equals(clauses) ? this : ast.fn(pos, clauses);
    }
  }

  /** List comprehension, "{@code [X * 2 || X <- L, X > 0]}".
   *
   * <p>Each qualifier is either a {@link Generator} or a filter
   * expression. */
  public static class ListComp extends Exp {
    public final Exp template;
    public final List<Exp> qualifiers;

    ListComp(Pos pos, Exp template, ImmutableList<Exp> qualifiers) {
      super(pos, Op.LIST_COMP);
      this.template = requireNonNull(template);
      this.qualifiers = requireNonNull(qualifiers);
    }

    @Override public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      return w.append("[").append(template, 0, 0).append(" || ")
          .appendAll(qualifiers, ", ").append("]");
    }

    public ListComp copy(Exp template, List<Exp> qualifiers) {
      return this.template == template && this.qualifiers.equals(qualifiers)
          ? this
          : ast.listComp(pos, template, qualifiers);
    }
  }

  /** Generator in a list comprehension, "{@code P <- L}". */
  public static class Generator extends Exp {
    public final Exp pat;
    public final Exp exp;

    Generator(Pos pos, Exp pat, Exp exp) {
      super(pos, Op.GENERATOR);
      this.pat = requireNonNull(pat);
      this.exp = requireNonNull(exp);
    }

    @Override public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      return w.append(pat, 0, 0).append(op.padded).append(exp, 0, 0);
    }

    public Generator copy(Exp pat, Exp exp) {
      return this.pat == pat && this.exp == exp
          ? this
          : ast.generator(pos, pat, exp);
    }
  }

  /** Construct that is not modeled, such as a binary; it is kept as
   * source text and never rewritten. */
  public static class Opaque extends Exp {
    public final String text;

    Opaque(Pos pos, String text) {
      super(pos, Op.OPAQUE);
      this.text = requireNonNull(text);
    }

    @Override public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      return w.append(text);
    }
  }

  private static void checkClauses(List<Clause> clauses, Op op) {
    for (Clause clause : clauses) {
      checkArgument(clause.op == op, "expected %s, got %s", op, clause.op);
    }
  }
}

// End Ast.java
