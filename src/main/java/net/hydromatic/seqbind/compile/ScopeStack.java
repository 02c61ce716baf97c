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

import com.google.common.collect.ImmutableSortedMap;
import java.util.HashMap;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Stack of scope frames, each mapping base names to their current counter.
 *
 * <p>A frame sees the counters of all of its ancestors, as they were when
 * it was pushed; the ancestors cannot change while it is on top. Bindings
 * made in a frame are recorded in that frame only, and are forgotten when it
 * is popped.
 *
 * <p>A stack belongs to a single traversal, and is not thread-safe.
 */
public class ScopeStack {
  private Frame top = new Frame(null);
  private int depth = 0;

  /** Pushes a new frame. */
  public void push() {
    top = new Frame(top);
    ++depth;
  }

  /** Pops the top frame, discarding its bindings. */
  public void pop() {
    if (top.parent == null) {
      throw new IllegalStateException("cannot pop the root frame");
    }
    top = top.parent;
    --depth;
  }

  /** Returns the number of frames pushed and not yet popped. */
  public int depth() {
    return depth;
  }

  /** Allocates a new counter for a base name in the top frame: one more than
   * its current counter, or 0 if the name has no counter. */
  public int bind(String baseName) {
    final Integer current = lookupOpt(baseName);
    final int counter = current == null ? 0 : current + 1;
    top.counters.put(baseName, counter);
    return counter;
  }

  /** Returns the current counter of a base name, searching the top frame and
   * then its ancestors; or null if the name has not been bound. */
  public @Nullable Integer lookupOpt(String baseName) {
    for (Frame frame = top; frame != null; frame = frame.parent) {
      final Integer counter = frame.counters.get(baseName);
      if (counter != null) {
        return counter;
      }
    }
    return null;
  }

  /** Returns the counters visible from the top frame. */
  public ImmutableSortedMap<String, Integer> visible() {
    final SortedMap<String, Integer> map = new TreeMap<>();
    for (Frame frame = top; frame != null; frame = frame.parent) {
      frame.counters.forEach(map::putIfAbsent);
    }
    return ImmutableSortedMap.copyOfSorted(map);
  }

  /** Scope frame. */
  private static class Frame {
    final @Nullable Frame parent;
    final Map<String, Integer> counters = new HashMap<>();

    Frame(@Nullable Frame parent) {
      this.parent = parent;
    }
  }
}

// End ScopeStack.java
