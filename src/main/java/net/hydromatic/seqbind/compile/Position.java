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

/** Syntactic position in which the {@link Renamer} walks a node. */
public enum Position {
  /** Head of a function clause or a fun clause. A fresh binding in the host
   * language. */
  ARGUMENT(true),

  /** Left side of a match, pattern of a case, receive or try clause, or of
   * a catch clause. A bound variable here is an equality test. */
  PATTERN(true),

  /** Pattern of a list-comprehension generator. A fresh binding, like
   * {@link #ARGUMENT}. */
  GENERATOR(true),

  /** Expression whose value is computed: body, call argument, right side of
   * a match. */
  VALUE(false),

  /** Guard test. */
  GUARD(false),

  /** Expression that a case switches on. */
  DISCRIMINANT(false);

  /** Whether variables in this position are patterns. */
  public final boolean pattern;

  Position(boolean pattern) {
    this.pattern = pattern;
  }

  /** Returns the position of an expression nested inside a node in this
   * position that must be a value even if the node is a pattern, such as a
   * map key. */
  public Position valueOf() {
    return pattern ? VALUE : this;
  }
}

// End Position.java
