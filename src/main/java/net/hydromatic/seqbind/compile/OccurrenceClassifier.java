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

import com.google.common.collect.ImmutableSortedSet;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;
import net.hydromatic.seqbind.ast.Ast;
import net.hydromatic.seqbind.ast.AstNode;
import net.hydromatic.seqbind.ast.Visitor;

/**
 * Decides whether an occurrence of a variable binds or reads a sequential
 * variable.
 *
 * <p>The decision is purely syntactic; it depends on the variable's name and
 * the {@link Position} in which it occurs:
 *
 * <ul>
 *   <li>a marked variable in a pattern position ({@link Position#ARGUMENT},
 *       {@link Position#PATTERN}, {@link Position#GENERATOR}) is a
 *       {@link Occurrence#BINDING}; this includes a marked variable aliased
 *       to a record pattern in a function head, as in
 *       "{@code f(#state{} = S@)}";
 *   <li>a marked variable anywhere else is a {@link Occurrence#REFERENCE};
 *       so is the value side of a match, as in "{@code #state{} = S@}" in a
 *       body;
 *   <li>an unmarked variable whose name is a base name used with the marker
 *       elsewhere in the same clause is a {@link Occurrence#BARE_MATCH} in a
 *       match or clause pattern, a {@link Occurrence#REDECLARATION} in a
 *       position that always binds afresh, and {@link Occurrence#PLAIN}
 *       elsewhere;
 *   <li>everything else, including explicit versions such as "Req@3", is
 *       {@link Occurrence#PLAIN}.
 * </ul>
 */
public class OccurrenceClassifier {
  private final ImmutableSortedSet<String> sequentialNames;

  private OccurrenceClassifier(Set<String> sequentialNames) {
    this.sequentialNames = ImmutableSortedSet.copyOf(sequentialNames);
  }

  /** Creates a classifier given the set of base names that are marked
   * somewhere in the clause being classified. */
  public static OccurrenceClassifier of(Set<String> sequentialNames) {
    return new OccurrenceClassifier(sequentialNames);
  }

  /** Creates a classifier for a function clause, a fun clause, or any other
   * node; its sequential names are those marked somewhere inside the
   * node. */
  public static OccurrenceClassifier of(AstNode node) {
    final SortedSet<String> names = new TreeSet<>();
    node.accept(
        new Visitor() {
          @Override protected void visit(Ast.Var var) {
            if (SeqNames.isMarked(var.name)) {
              names.add(SeqNames.baseName(var.name));
            }
          }
        });
    return of(names);
  }

  /** Returns the base names that are sequential in this clause. */
  public ImmutableSortedSet<String> sequentialNames() {
    return sequentialNames;
  }

  /** Classifies an occurrence of a variable. */
  public Occurrence classify(String name, Position position) {
    if (SeqNames.isMarked(name)) {
      return position.pattern ? Occurrence.BINDING : Occurrence.REFERENCE;
    }
    if (!sequentialNames.contains(name)) {
      return Occurrence.PLAIN;
    }
    switch (position) {
    case PATTERN:
      return Occurrence.BARE_MATCH;
    case ARGUMENT:
    case GENERATOR:
      return Occurrence.REDECLARATION;
    default:
      return Occurrence.PLAIN;
    }
  }
}

// End OccurrenceClassifier.java
