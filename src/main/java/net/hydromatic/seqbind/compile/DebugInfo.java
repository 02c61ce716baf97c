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

import com.google.common.collect.ImmutableSortedMap;
import com.google.common.collect.ImmutableSortedSet;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Map;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.function.BiConsumer;
import net.hydromatic.seqbind.ast.Ast;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Information about a rewritten function, for debugging tools.
 *
 * <p>Contains the function before and after rewriting; every node of the
 * rewritten function has the position of the node it came from. Also maps
 * each versioned name back to its base name and counter, and each renamed
 * variable node to the role it had.
 */
public class DebugInfo {
  public final FunctionId id;
  public final Ast.Function original;
  public final Ast.Function rewritten;
  /** Versioned names, keyed by spelling, e.g. "Req@1". */
  public final ImmutableSortedMap<String, VersionedName> reverseMap;
  private final Map<Ast.Var, Resolution.Entry> occurrences;

  DebugInfo(FunctionId id, Ast.Function original, Ast.Function rewritten,
      Map<Ast.Var, Resolution.Entry> occurrences) {
    this.id = requireNonNull(id);
    this.original = requireNonNull(original);
    this.rewritten = requireNonNull(rewritten);
    this.occurrences =
        Collections.unmodifiableMap(new IdentityHashMap<>(occurrences));
    final SortedMap<String, VersionedName> map = new TreeMap<>();
    occurrences.values().forEach(entry ->
        map.put(entry.name.name(), entry.name));
    this.reverseMap = ImmutableSortedMap.copyOfSorted(map);
  }

  /** Returns the entry of a variable node in {@link #rewritten}, or null if
   * the node was not renamed. */
  public Resolution.@Nullable Entry occurrence(Ast.Var var) {
    return occurrences.get(var);
  }

  /** Calls an action for each renamed variable node in
   * {@link #rewritten}. */
  public void forEachOccurrence(BiConsumer<Ast.Var, Resolution.Entry> action) {
    occurrences.forEach(action);
  }

  /** Returns the base name and counter of a versioned name, or null if this
   * function has no such name. */
  public @Nullable VersionedName resolve(String versionedName) {
    return reverseMap.get(versionedName);
  }

  /** Returns the source lines on which a versioned name occurs. */
  public ImmutableSortedSet<Integer> lines(String versionedName) {
    final SortedSet<Integer> lines = new TreeSet<>();
    occurrences.forEach((var, entry) -> {
      if (entry.name.name().equals(versionedName)) {
        lines.add(var.pos.startLine);
      }
    });
    return ImmutableSortedSet.copyOfSorted(lines);
  }

  @Override public String toString() {
    return id + " " + reverseMap.keySet();
  }
}

// End DebugInfo.java
