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

import java.util.IdentityHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.function.BiConsumer;
import net.hydromatic.seqbind.ast.Ast;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Versioned names assigned to the variable occurrences of one function.
 *
 * <p>Occurrences are keyed by node identity, not by name: the same
 * variable name has different versions at different places in the tree.
 * Variables that are not renamed have no entry.
 */
public class Resolution {
  private final Map<Ast.Var, Entry> map = new IdentityHashMap<>();

  /** Records the versioned name of an occurrence.
   *
   * @throws IllegalArgumentException if the same node was already resolved
   * to a different name, which happens only if the tree shares a variable
   * node between two places */
  void put(Ast.Var var, VersionedName name, Occurrence occurrence) {
    final Entry entry = new Entry(name, occurrence);
    final Entry previous = map.put(var, entry);
    if (previous != null && !previous.equals(entry)) {
      throw new IllegalArgumentException("variable node " + var.name
          + " at " + var.pos + " occurs more than once in the tree");
    }
  }

  /** Returns the entry of an occurrence, or null if it is not renamed. */
  public @Nullable Entry get(Ast.Var var) {
    return map.get(var);
  }

  /** Returns the number of renamed occurrences. */
  public int size() {
    return map.size();
  }

  /** Calls an action for each renamed occurrence. */
  public void forEach(BiConsumer<Ast.Var, Entry> action) {
    map.forEach(action);
  }

  /** Versioned name and role of one occurrence. */
  public static final class Entry {
    public final VersionedName name;
    public final Occurrence occurrence;

    Entry(VersionedName name, Occurrence occurrence) {
      this.name = requireNonNull(name);
      this.occurrence = requireNonNull(occurrence);
    }

    /** Returns the spelling that this occurrence had before rewriting:
     * "Req@" for a marked variable, "Req" for an unmarked match. */
    public String originalName() {
      return occurrence == Occurrence.BARE_MATCH
          ? name.base
          : name.markedName();
    }

    @Override public int hashCode() {
      return Objects.hash(name, occurrence);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof Entry
          && name.equals(((Entry) o).name)
          && occurrence == ((Entry) o).occurrence;
    }

    @Override public String toString() {
      return name + " (" + occurrence + ")";
    }
  }
}

// End Resolution.java
