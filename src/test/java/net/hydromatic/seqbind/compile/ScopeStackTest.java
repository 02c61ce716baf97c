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

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.nullValue;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasToString;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

/** Tests for {@link ScopeStack}. */
public class ScopeStackTest {
  @Test void testBind() {
    final ScopeStack scopes = new ScopeStack();
    assertThat(scopes.lookupOpt("Req"), nullValue());
    assertThat(scopes.bind("Req"), is(0));
    assertThat(scopes.bind("Req"), is(1));
    assertThat(scopes.bind("A"), is(0));
    assertThat(scopes.lookupOpt("Req"), is(1));
    assertThat(scopes.visible(), hasToString("{A=0, Req=1}"));
  }

  /** A child frame sees its parent's counters, and its own bindings are
   * forgotten when it is popped. */
  @Test void testPushPop() {
    final ScopeStack scopes = new ScopeStack();
    scopes.bind("A");
    assertThat(scopes.depth(), is(0));

    scopes.push();
    assertThat(scopes.depth(), is(1));
    assertThat(scopes.lookupOpt("A"), is(0));
    assertThat(scopes.bind("A"), is(1));
    assertThat(scopes.bind("B"), is(0));
    assertThat(scopes.visible(), hasToString("{A=1, B=0}"));

    scopes.pop();
    assertThat(scopes.depth(), is(0));
    assertThat(scopes.lookupOpt("A"), is(0));
    assertThat(scopes.lookupOpt("B"), nullValue());

    // A sibling frame starts from the parent's counters again
    scopes.push();
    assertThat(scopes.bind("A"), is(1));
    scopes.pop();

    // So does a binding in the parent after the child is gone
    assertThat(scopes.bind("A"), is(1));
  }

  @Test void testPopRoot() {
    final ScopeStack scopes = new ScopeStack();
    scopes.push();
    scopes.pop();
    final IllegalStateException e =
        assertThrows(IllegalStateException.class, scopes::pop);
    assertThat(e.getMessage(), is("cannot pop the root frame"));
  }
}

// End ScopeStackTest.java
