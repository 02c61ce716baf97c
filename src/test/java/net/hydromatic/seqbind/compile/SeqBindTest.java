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

import static net.hydromatic.seqbind.Trees.POS;
import static net.hydromatic.seqbind.Trees.a;
import static net.hydromatic.seqbind.Trees.args;
import static net.hydromatic.seqbind.Trees.call;
import static net.hydromatic.seqbind.Trees.caseClause;
import static net.hydromatic.seqbind.Trees.clause;
import static net.hydromatic.seqbind.Trees.fn;
import static net.hydromatic.seqbind.Trees.function;
import static net.hydromatic.seqbind.Trees.guarded;
import static net.hydromatic.seqbind.Trees.i;
import static net.hydromatic.seqbind.Trees.let;
import static net.hydromatic.seqbind.Trees.line;
import static net.hydromatic.seqbind.Trees.list;
import static net.hydromatic.seqbind.Trees.match;
import static net.hydromatic.seqbind.Trees.module;
import static net.hydromatic.seqbind.Trees.op;
import static net.hydromatic.seqbind.Trees.tuple;
import static net.hydromatic.seqbind.Trees.v;
import static net.hydromatic.seqbind.ast.AstBuilder.ast;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.nullValue;
import static org.hamcrest.CoreMatchers.sameInstance;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasToString;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.seqbind.ast.Ast;
import org.junit.jupiter.api.Test;

/** Tests for {@link SeqBind}, the rewrite of sequential variables. */
public class SeqBindTest {
  /** Rewrites a function in module "m" and checks the result. */
  private static DebugInfo check(Ast.Function function, String expected) {
    final SeqBind.Result result = SeqBind.rewrite(module("m", function));
    final DebugInfo debugInfo = result.debugInfo(function.name,
        function.arity);
    assertThat(debugInfo.rewritten, hasToString(expected));
    assertThat(result.module.forms.get(0), sameInstance(debugInfo.rewritten));
    return debugInfo;
  }

  /** Rewrites a function in module "m" and checks that it fails. */
  private static CompileException checkError(Ast.Function function,
      CompileException.Kind kind, String message) {
    final CompileException e =
        assertThrows(CompileException.class,
            () -> SeqBind.rewrite(module("m", function)));
    assertThat(e.kind, is(kind));
    assertThat(e.getMessage(), is(message));
    assertThat(e.function, is(FunctionId.of("m", function.name,
        function.arity)));
    return e;
  }

  /** A variable bound in a clause head, then rebound by two matches. */
  @Test void testSequentialRebinding() {
    final Ast.Function f =
        function("f",
            clause(args(v("Req@")),
                match(tuple(v("A"), v("Req@")),
                    call("get", a("a"), v("Req@"))),
                match(tuple(v("B"), v("Req@")),
                    call("get", a("b"), v("Req@"))),
                tuple(v("A"), v("B"), v("Req@"))));
    assertThat(f,
        hasToString("f(Req@) -> {A, Req@} = get(a, Req@), "
            + "{B, Req@} = get(b, Req@), {A, B, Req@}."));
    check(f,
        "f(Req@0) -> {A, Req@1} = get(a, Req@0), "
            + "{B, Req@2} = get(b, Req@1), {A, B, Req@2}.");
  }

  /** Versions bound in one clause of a case are not seen by the other clause
   * or after the case. */
  @Test void testClauseIsolation() {
    final Ast.Function f =
        function("f",
            clause(args(),
                match(v("A@"), i(1)),
                ast.caseOf(POS, call("g"),
                    ImmutableList.of(
                        caseClause(i(1), match(v("A@"), i(2)), v("A@")),
                        caseClause(v("_"), v("A@")))),
                v("A@")));
    check(f,
        "f() -> A@0 = 1, "
            + "case g() of 1 -> A@1 = 2, A@1; _ -> A@0 end, A@0.");
  }

  /** After a case, a new binding starts again from the version visible
   * before the case; the version bound inside the case is reused. */
  @Test void testBindingAfterCase() {
    final Ast.Function f =
        function("f",
            clause(args(v("A@")),
                ast.caseOf(POS, v("A@"),
                    ImmutableList.of(
                        caseClause(v("_"), match(v("A@"), i(2)), v("A@")))),
                match(v("A@"), i(3)),
                v("A@")));
    check(f,
        "f(A@0) -> case A@0 of _ -> A@1 = 2, A@1 end, A@1 = 3, A@1.");
  }

  /** Each clause of a function starts with no versions. */
  @Test void testFunctionClauses() {
    final Ast.Function f =
        function("f",
            clause(args(a("a"), v("X@")),
                match(v("X@"), op(v("X@"), "+", i(1))), v("X@")),
            clause(args(v("_"), v("X@")), v("X@")));
    check(f,
        "f(a, X@0) -> X@1 = X@0 + 1, X@1; f(_, X@0) -> X@0.");
  }

  @Test void testGuard() {
    final Ast.Function f =
        function("f",
            guarded(args(v("X@")), args(op(v("X@"), ">", i(0))),
                v("X@")));
    check(f, "f(X@0) when X@0 > 0 -> X@0.");
  }

  /** A marked variable aliased to a record pattern in a clause head binds;
   * aliased in a body, it is read. */
  @Test void testRecordAlias() {
    final Ast.Function f =
        function("f",
            clause(
                args(match(ast.record(POS, null, "state", ImmutableMap.of()),
                    v("S@"))),
                match(ast.record(POS, null, "state",
                        ImmutableMap.of("count", v("N"))),
                    v("S@")),
                match(v("S@"),
                    ast.record(POS, v("S@"), "state",
                        ImmutableMap.of("count", op(v("N"), "+", i(1))))),
                v("S@")));
    check(f,
        "f(#state{} = S@0) -> #state{count = N} = S@0, "
            + "S@1 = S@0#state{count = N + 1}, S@1.");
  }

  /** Nested let-blocks; versions bound inside a let-block are not visible
   * after it. */
  @Test void testNestedLetBlocks() {
    final Ast.Function f =
        function("f",
            clause(args(v("X@")),
                match(v("Y"),
                    let(match(v("X@"), op(v("X@"), "+", i(1))),
                        let(match(v("X@"), op(v("X@"), "*", i(2))),
                            v("X@")))),
                tuple(v("X@"), v("Y"))));
    check(f,
        "f(X@0) -> Y = seqbind:'let'(X@1 = X@0 + 1, "
            + "seqbind:'let'(X@2 = X@1 * 2, X@2)), {X@0, Y}.");
  }

  /** A let-block inside a case clause. */
  @Test void testLetBlockInClause() {
    final Ast.Function f =
        function("f",
            clause(args(v("X@")),
                ast.caseOf(POS, v("X@"),
                    ImmutableList.of(
                        caseClause(i(0),
                            match(v("X@"), i(1)),
                            let(match(v("X@"), i(2)), v("X@")),
                            v("X@")))),
                v("X@")));
    check(f,
        "f(X@0) -> case X@0 of 0 -> X@1 = 1, "
            + "seqbind:'let'(X@2 = 2, X@2), X@1 end, X@0.");
  }

  /** Tuple elements are read left to right. */
  @Test void testLeftToRight() {
    final Ast.Function f =
        function("f",
            clause(args(v("X@")),
                tuple(v("X@"), match(v("X@"), i(1)), v("X@"))));
    check(f, "f(X@0) -> {X@0, X@1 = 1, X@1}.");
  }

  @Test void testTry() {
    final Ast.Function f =
        function("f",
            clause(args(v("X@")),
                ast.tryCatch(POS,
                    args(match(v("X@"), call("g", v("X@")))),
                    ImmutableList.of(caseClause(a("ok"), v("X@"))),
                    ImmutableList.of(
                        ast.catchClause(POS, a("error"), v("E"), null,
                            ImmutableList.of(), args(v("X@")))),
                    args(call("h", v("X@"))))));
    check(f,
        "f(X@0) -> try X@1 = g(X@0) of ok -> X@1 "
            + "catch error:E -> X@0 after h(X@0) end.");
  }

  @Test void testReceive() {
    final Ast.Function f =
        function("f",
            clause(args(v("S@")),
                ast.receive(POS,
                    ImmutableList.of(
                        caseClause(tuple(a("add"), v("N")),
                            match(v("S@"), op(v("S@"), "+", v("N"))),
                            v("S@")),
                        caseClause(a("stop"), v("S@"))),
                    i(1000), args(v("S@")))));
    check(f,
        "f(S@0) -> receive {add, N} -> S@1 = S@0 + N, S@1; "
            + "stop -> S@0 after 1000 -> S@0 end.");
  }

  /** The head of an anonymous function binds a new version, visible only in
   * its body. */
  @Test void testFun() {
    final Ast.Function f =
        function("f",
            clause(args(v("X@")),
                match(v("F"),
                    fn(args(v("X@")), op(v("X@"), "+", i(1)))),
                tuple(ast.call(POS, null, v("F"), args(v("X@"))), v("X@"))));
    check(f,
        "f(X@0) -> F = fun (X@1) -> X@1 + 1 end, {F(X@0), X@0}.");
  }

  @Test void testListComprehension() {
    final Ast.Function f =
        function("f",
            clause(args(v("L@")),
                ast.listComp(POS, op(v("X@"), "*", i(2)),
                    args(ast.generator(POS, v("X@"), v("L@")),
                        op(v("X@"), ">", i(0)))),
                v("L@")));
    check(f, "f(L@0) -> [X@0 * 2 || X@0 <- L@0, X@0 > 0], L@0.");
  }

  /** In a map pattern, keys are read and values bind. */
  @Test void testMapPattern() {
    final Ast.Function f =
        function("f",
            clause(args(v("K@"), v("M")),
                match(
                    ast.map(POS, null,
                        ImmutableList.of(
                            ast.mapEntry(POS, v("K@"), v("V@"), true))),
                    v("M")),
                v("V@")));
    check(f, "f(K@0, M) -> #{K@0 := V@0} = M, V@0.");
  }

  /** An unmarked variable with the same name as a sequential variable, in a
   * pattern, is an equality test against the current version. */
  @Test void testBareMatch() {
    final Ast.Function f =
        function("f",
            clause(args(v("Req@")),
                match(tuple(a("ok"), v("Req")), call("g")),
                v("Req@")));
    final DebugInfo debugInfo =
        check(f, "f(Req@0) -> {ok, Req@0} = g(), Req@0.");
    assertThat(Unversioner.restore(debugInfo), hasToString(f.toString()));
  }

  @Test void testBareMatchUnbound() {
    final Ast.Function f =
        function("f",
            clause(args(),
                match(tuple(v("Req")), call("g")),
                match(v("Req@"), i(1))));
    checkError(f, CompileException.Kind.UNBOUND_SEQUENTIAL_VARIABLE,
        "variable 'Req' matches sequential variable 'Req@', "
            + "which is unbound in m:f/0");
  }

  @Test void testUnbound() {
    final Ast.Function f =
        function("f", clause(args(v("X")), v("X"), v("Req@")));
    final CompileException e =
        checkError(f, CompileException.Kind.UNBOUND_SEQUENTIAL_VARIABLE,
            "sequential variable 'Req@' is unbound in m:f/1");
    assertThat(e.baseName, is("Req"));
  }

  /** A version bound in one clause of a case cannot be read after it. */
  @Test void testUnboundAfterCase() {
    final Ast.Function f =
        function("f",
            clause(args(),
                ast.caseOf(POS, call("g"),
                    ImmutableList.of(caseClause(v("A@"), v("A@")))),
                v("A@")));
    checkError(f, CompileException.Kind.UNBOUND_SEQUENTIAL_VARIABLE,
        "sequential variable 'A@' is unbound in m:f/0");
  }

  @Test void testEmptyLetBlock() {
    final Ast.Function f = function("f", clause(args(), let()));
    final CompileException e =
        checkError(f, CompileException.Kind.MALFORMED_LET_BLOCK,
            "let-block seqbind:'let' has no expressions in m:f/0");
    assertThat(e.baseName, nullValue());
  }

  @Test void testLetBlockInPattern() {
    final Ast.Function f =
        function("f", clause(args(), match(let(i(1)), call("g"))));
    checkError(f, CompileException.Kind.MALFORMED_LET_BLOCK,
        "let-block seqbind:'let' is not allowed in a pattern in m:f/0");
  }

  @Test void testLetBlockInGuard() {
    final Ast.Function f =
        function("f", guarded(args(v("X")), args(let(v("X"))), v("X")));
    checkError(f, CompileException.Kind.MALFORMED_LET_BLOCK,
        "let-block seqbind:'let' is not allowed in a guard in m:f/1");
  }

  /** An unmarked variable in the head of a fun would bind afresh a name
   * that is sequential. */
  @Test void testConflictingRedeclaration() {
    final Ast.Function f =
        function("f",
            clause(args(v("Req@")),
                match(v("F"), fn(args(v("Req")), v("Req@"))),
                ast.call(POS, null, v("F"), args(v("Req@")))));
    checkError(f, CompileException.Kind.CONFLICTING_REDECLARATION,
        "variable 'Req' is a fresh binding of sequential variable 'Req@' "
            + "in m:f/1; did you mean 'Req@'?");
  }

  /** A clause that never uses the marker may use the same name as a
   * plain variable, even as an argument. */
  @Test void testSiblingClauseBareHead() {
    final Ast.Function f =
        function("handle",
            clause(args(a("inc"), v("State@")),
                match(v("State@"), op(v("State@"), "+", i(1))),
                v("State@")),
            clause(args(a("stop"), v("State")), v("State")));
    check(f,
        "handle(inc, State@0) -> State@1 = State@0 + 1, State@1; "
            + "handle(stop, State) -> State.");
  }

  @Test void testSiblingClauseBareMatch() {
    final Ast.Function f =
        function("h",
            clause(args(v("X@"), a("a")), v("X@")),
            clause(args(v("Y"), a("b")),
                match(tuple(v("X")), v("Y")), v("X")));
    check(f, "h(X@0, a) -> X@0; h(Y, b) -> {X} = Y, X.");
  }

  /** The head of a fun that never uses the marker introduces a plain
   * variable that shadows nothing sequential. */
  @Test void testFunHeadPlain() {
    final Ast.Function f =
        function("f",
            clause(args(v("Req@")),
                match(v("F"), fn(args(v("Req")), v("Req"))),
                ast.call(POS, null, v("F"), args(v("Req@")))));
    check(f, "f(Req@0) -> F = fun (Req) -> Req end, F(Req@0).");
  }

  /** Matching one marked variable against another binds the left and
   * references the right. */
  @Test void testMarkedToMarkedMatch() {
    final Ast.Function f =
        function("f",
            clause(args(v("A@"), v("B@")),
                match(v("A@"), v("B@")), v("A@")));
    check(f, "f(A@0, B@0) -> A@1 = B@0, A@1.");
  }

  @Test void testVersionCollision() {
    final Ast.Function f =
        function("f", clause(args(v("Req@")), v("Req@0")));
    checkError(f, CompileException.Kind.CONFLICTING_REDECLARATION,
        "variable 'Req@0' has the spelling of a version of sequential "
            + "variable 'Req@' in m:f/1");
  }

  @Test void testConflictingRedeclarationInGenerator() {
    final Ast.Function f =
        function("f",
            clause(args(v("X@"), v("L")),
                ast.listComp(POS, v("X"),
                    args(ast.generator(POS, v("X"), v("L"))))));
    checkError(f, CompileException.Kind.CONFLICTING_REDECLARATION,
        "variable 'X' is a fresh binding of sequential variable 'X@' "
            + "in m:f/2; did you mean 'X@'?");
  }

  /** The error reports the position of the offending variable. */
  @Test void testErrorPosition() {
    final Ast.Function f =
        function("f", clause(args(v(1, "A")), v(2, "A"), v(3, "B@")));
    final CompileException e =
        assertThrows(CompileException.class,
            () -> SeqBind.rewrite(module("m", f)));
    assertThat(e.pos(), is(line(3)));
    assertThat(e.describeTo(new StringBuilder()),
        hasToString("m.erl:3.1 Error: sequential variable 'B@' is unbound "
            + "in m:f/1"));
  }

  /** A function without sequential variables comes back as the same
   * object. */
  @Test void testUnchanged() {
    final Ast.Function f =
        function("f",
            clause(args(v("X")), match(v("Y"), op(v("X"), "+", i(1))),
                v("Y")));
    final DebugInfo debugInfo = check(f, "f(X) -> Y = X + 1, Y.");
    assertThat(debugInfo.rewritten, sameInstance(f));
    assertThat(debugInfo.reverseMap.isEmpty(), is(true));
  }

  /** A versioned name written in the source is not marked, and is left
   * alone. */
  @Test void testExplicitVersion() {
    final Ast.Function f =
        function("f", clause(args(v("Req@3")), v("Req@3")));
    final DebugInfo debugInfo = check(f, "f(Req@3) -> Req@3.");
    assertThat(debugInfo.rewritten, sameInstance(f));
  }

  /** The anonymous variable with a marker is not sequential. */
  @Test void testAnonymousMarker() {
    final Ast.Function f =
        function("f", clause(args(v("_@")), a("ok")));
    check(f, "f(_@) -> ok.");
  }

  /** Constructs that are not modeled pass through unchanged. */
  @Test void testOpaque() {
    final Ast.Exp binary = ast.opaque(POS, "<<1, 2>>");
    final Ast.Function f =
        function("f",
            clause(args(v("B@")),
                match(v("X"), binary),
                tuple(v("X"), v("B@"))));
    final DebugInfo debugInfo =
        check(f, "f(B@0) -> X = <<1, 2>>, {X, B@0}.");
    final Ast.Match match =
        (Ast.Match) debugInfo.rewritten.clauses.get(0).body.get(0);
    assertThat(match, sameInstance(f.clauses.get(0).body.get(0)));
    assertThat(match.exp, sameInstance(binary));
  }

  /** Nodes that contain no sequential variable are shared between input and
   * output. */
  @Test void testSharesUnchangedNodes() {
    final Ast.Exp unchanged = tuple(v("A"), list(a("x"), i(2)));
    final Ast.Function f =
        function("f", clause(args(v("S@")), unchanged, v("S@")));
    final DebugInfo debugInfo = check(f, "f(S@0) -> {A, [x, 2]}, S@0.");
    assertThat(debugInfo.rewritten.clauses.get(0).body.get(0),
        sameInstance(unchanged));
  }

  /** The same variable node in two places that resolve differently is an
   * invalid tree. */
  @Test void testSharedVariableNode() {
    final Ast.Var x = v("X@");
    final Ast.Function f = function("f", clause(args(x), x));
    assertThrows(IllegalArgumentException.class,
        () -> SeqBind.rewrite(module("m", f)));
  }

  @Test void testModule() {
    final Ast.Function f = function("f", clause(args(v("X@")), v("X@")));
    final Ast.Function g = function("g", clause(args(v("Y")), v("Y")));
    final Ast.Module m =
        module("m", ast.attribute(POS, "export", list()), f, g);
    final SeqBind.Result result = SeqBind.rewrite(m);
    assertThat(result.module,
        hasToString("-export([]).\nf(X@0) -> X@0.\ng(Y) -> Y."));
    assertThat(result.module.forms.get(0), sameInstance(m.forms.get(0)));
    assertThat(result.module.forms.get(2), sameInstance(g));
    assertThat(result.debugInfos.size(), is(2));
    assertThat(result.debugInfo(FunctionId.of("m", "f", 1)).rewritten,
        hasToString("f(X@0) -> X@0."));
    assertThat(result.debugInfo(FunctionId.of("m", "h", 1)), nullValue());
  }

  /** A module without sequential variables comes back as the same
   * object. */
  @Test void testModuleUnchanged() {
    final Ast.Module m =
        module("m", function("g", clause(args(v("Y")), v("Y"))));
    assertThat(SeqBind.rewrite(m).module, sameInstance(m));
  }

  @Test void testDisabled() {
    final Ast.Module m =
        module("m", function("f", clause(args(v("X@")), v("X@"))));
    final Map<Prop, Object> propMap = new EnumMap<>(Prop.class);
    Prop.ENABLED.set(propMap, false);
    final SeqBind.Result result =
        SeqBind.rewrite(m, propMap, Tracers.empty());
    assertThat(result.module, sameInstance(m));
    assertThat(result.debugInfos.isEmpty(), is(true));
  }

  /** The "seqbind" attribute overrides the "enabled" property. */
  @Test void testAttributeOverridesProperty() {
    final Ast.Function f = function("f", clause(args(v("X@")), v("X@")));
    final Map<Prop, Object> disabled = new EnumMap<>(Prop.class);
    Prop.ENABLED.set(disabled, false);

    final Ast.Module on =
        module("m", ast.attribute(POS, "seqbind", a("true")), f);
    assertThat(SeqBind.rewrite(on, disabled, Tracers.empty()).module,
        hasToString("-seqbind(true).\nf(X@0) -> X@0."));

    final Ast.Module off =
        module("m", ast.attribute(POS, "seqbind", a("false")), f);
    assertThat(SeqBind.rewrite(off).module, sameInstance(off));

    // A value other than true or false does not override
    final Ast.Module other =
        module("m", ast.attribute(POS, "seqbind", a("yes")), f);
    assertThat(SeqBind.rewrite(other).module,
        hasToString("-seqbind(yes).\nf(X@0) -> X@0."));
  }

  /** The tracer sees each rewritten function, then the unit; if the unit
   * fails, it sees nothing. */
  @Test void testTracer() {
    final List<String> events = new ArrayList<>();
    Tracer tracer = Tracers.empty();
    tracer = Tracers.withOnRewrite(tracer, d -> events.add("rewrite " + d));
    tracer =
        Tracers.withOnUnit(tracer, (before, after) ->
            events.add("unit " + before.name + " " + (before == after)));

    final Ast.Function f = function("f", clause(args(v("X@")), v("X@")));
    final Ast.Function g = function("g", clause(args(v("Y")), v("Y")));
    SeqBind.rewrite(module("m", f, g), ImmutableMap.of(), tracer);
    assertThat(events,
        hasToString("[rewrite m:f/1 [X@0], rewrite m:g/1 [], "
            + "unit m false]"));

    events.clear();
    final Ast.Function bad = function("h", clause(args(), v("Z@")));
    final Tracer tracer2 = tracer;
    assertThrows(CompileException.class,
        () -> SeqBind.rewrite(module("m", f, bad), ImmutableMap.of(),
            tracer2));
    assertThat(events.isEmpty(), is(true));
  }
}

// End SeqBindTest.java
