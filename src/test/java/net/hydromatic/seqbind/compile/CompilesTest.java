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

import static net.hydromatic.seqbind.Trees.args;
import static net.hydromatic.seqbind.Trees.clause;
import static net.hydromatic.seqbind.Trees.function;
import static net.hydromatic.seqbind.Trees.module;
import static net.hydromatic.seqbind.Trees.v;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasToString;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.List;
import net.hydromatic.seqbind.ast.Ast;
import org.junit.jupiter.api.Test;

/** Tests for {@link Compiles}, the rewrite of several units. */
public class CompilesTest {
  private static final Ast.Module GOOD1 =
      module("a", function("f", clause(args(v("X@")), v("X@"))));
  private static final Ast.Module BAD =
      module("b", function("g", clause(args(), v("Y@"))));
  private static final Ast.Module GOOD2 =
      module("c", function("h", clause(args(v("Z@")), v("Z@"))));

  /** A unit that fails does not prevent the other units from being
   * rewritten, if the tracer handles its error. */
  @Test void testIsolation() {
    final List<String> errors = new ArrayList<>();
    final Tracer tracer =
        Tracers.withOnCompileException(Tracers.empty(),
            e -> errors.add(e.function + ": " + e.kind));
    final ImmutableList<SeqBind.Result> results =
        Compiles.rewriteAll(ImmutableList.of(GOOD1, BAD, GOOD2),
            ImmutableMap.of(), tracer);
    assertThat(results.size(), is(2));
    assertThat(results.get(0).module, hasToString("f(X@0) -> X@0."));
    assertThat(results.get(1).module, hasToString("h(Z@0) -> Z@0."));
    assertThat(errors,
        hasToString("[b:g/0: UNBOUND_SEQUENTIAL_VARIABLE]"));
  }

  /** If the tracer does not handle the error, it is rethrown. */
  @Test void testUnhandled() {
    final List<String> units = new ArrayList<>();
    final Tracer tracer =
        Tracers.withOnUnit(Tracers.empty(),
            (before, after) -> units.add(before.name));
    final CompileException e =
        assertThrows(CompileException.class,
            () -> Compiles.rewriteAll(ImmutableList.of(GOOD1, BAD, GOOD2),
                ImmutableMap.of(), tracer));
    assertThat(e.getMessage(),
        is("sequential variable 'Y@' is unbound in b:g/0"));
    assertThat(units, hasToString("[a]"));
  }
}

// End CompilesTest.java
