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
/**
 * Rewriting of sequential variables.
 *
 * <p>A sequential variable is a variable whose name ends with "@", such as
 * {@code Req@}. Each time it is bound it gets a new version ({@code Req@0},
 * {@code Req@1}, ...) and each read sees the latest version in scope, so
 * that a single-assignment language can be written as if variables could be
 * reassigned.
 *
 * <h2>Key Classes</h2>
 *
 * <ul>
 *   <li>{@link net.hydromatic.seqbind.compile.SeqBind} - Main entry point.
 *       Rewrites a compilation unit, function by function: resolve &rarr;
 *       synthesize.
 *   <li>{@link net.hydromatic.seqbind.compile.Compiles} - Rewrites several
 *       units; a unit that fails does not stop the others.
 *   <li>{@link net.hydromatic.seqbind.compile.OccurrenceClassifier} - Decides
 *       whether an occurrence binds or reads, from its name and
 *       {@link net.hydromatic.seqbind.compile.Position}.
 *   <li>{@link net.hydromatic.seqbind.compile.ScopeStack} - Counters of the
 *       base names visible at a point in the walk.
 *   <li>{@link net.hydromatic.seqbind.compile.Renamer} - Walks a function in
 *       evaluation order and fills a
 *       {@link net.hydromatic.seqbind.compile.Resolution}.
 *   <li>{@code LetBlockExpander} - Scopes the bindings of a let-block,
 *       {@code seqbind:'let'(E1, ..., En)}.
 *   <li>{@code Synthesizer} - Writes the rewritten tree, keeping the shape
 *       and positions of the input.
 *   <li>{@link net.hydromatic.seqbind.compile.DebugInfo} and
 *       {@link net.hydromatic.seqbind.compile.Unversioner} - Map versioned
 *       names back to the source.
 *   <li>{@link net.hydromatic.seqbind.compile.CompileException} - Unchecked
 *       exception for all errors; every error is fatal to its unit.
 * </ul>
 *
 * <h2>Scoping</h2>
 *
 * <p>Every clause (of a function, fun, case, if, receive or try) and every
 * let-block is walked in a frame of its own. Versions bound inside are
 * forgotten when the frame is popped, so sibling clauses do not see each
 * other's versions, and code after a case sees the versions from before
 * it.
 *
 * <h2>Configuration</h2>
 *
 * <p>{@link net.hydromatic.seqbind.compile.Prop#ENABLED} turns the rewrite
 * on or off; a unit may override it with the attribute
 * {@code -seqbind(true).} or {@code -seqbind(false).}. Callers observe the
 * rewrite through a {@link net.hydromatic.seqbind.compile.Tracer}.
 */
package net.hydromatic.seqbind.compile;

// End package-info.java
