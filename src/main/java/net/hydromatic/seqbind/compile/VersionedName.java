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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import java.util.Objects;

/** Base name plus a counter; spelled "{@code Base@N}" in the rewritten
 * tree.
 *
 * <p>Versioned names sort by base name, then by counter. */
public final class VersionedName implements Comparable<VersionedName> {
  public final String base;
  public final int counter;

  private VersionedName(String base, int counter) {
    this.base = requireNonNull(base);
    this.counter = counter;
    checkArgument(!base.isEmpty(), "empty base name");
    checkArgument(counter >= 0, "negative counter %s", counter);
  }

  /** Creates a VersionedName. */
  public static VersionedName of(String base, int counter) {
    return new VersionedName(base, counter);
  }

  /** Returns the spelling of this name in the rewritten tree,
   * e.g. "Req@2". */
  public String name() {
    return SeqNames.versioned(base, counter);
  }

  /** Returns the spelling of the marked name that this version replaces,
   * e.g. "Req@". */
  public String markedName() {
    return SeqNames.marked(base);
  }

  @Override public int compareTo(VersionedName o) {
    final int c = base.compareTo(o.base);
    return c != 0 ? c : Integer.compare(counter, o.counter);
  }

  @Override public int hashCode() {
    return Objects.hash(base, counter);
  }

  @Override public boolean equals(Object o) {
    return o == this
        || o instanceof VersionedName
        && base.equals(((VersionedName) o).base)
        && counter == ((VersionedName) o).counter;
  }

  @Override public String toString() {
    return name();
  }
}

// End VersionedName.java
