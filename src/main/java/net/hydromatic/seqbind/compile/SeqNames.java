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

import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Spelling rules for sequential variables.
 *
 * <p>A variable is <em>marked</em> if its name ends with {@link #MARKER}, for
 * example "Req@"; its <em>base name</em> is "Req". The rewriter replaces it
 * with a versioned name such as "Req@0". A versioned name written directly
 * in the source (a debugging aid) is not marked, and is left alone. */
public abstract class SeqNames {
  private SeqNames() {}

  /** Suffix that marks a variable as sequential. */
  public static final String MARKER = "@";

  /** Module of the let-block form, "{@code seqbind:'let'(E1, ..., En)}". */
  public static final String LET_MODULE = "seqbind";

  /** Function of the let-block form. */
  public static final String LET_FUNCTION = "let";

  private static final Pattern VERSIONED =
      Pattern.compile("([A-Z_][A-Za-z0-9_]*)@([0-9]+)");

  /** Returns whether a variable name is marked, e.g. "Req@". The anonymous
   * variable "_@" is not marked. */
  public static boolean isMarked(String name) {
    return name.length() > 1
        && name.endsWith(MARKER)
        && !name.equals("_" + MARKER);
  }

  /** Returns the base name of a marked variable, e.g. "Req" for "Req@". */
  public static String baseName(String markedName) {
    checkArgument(isMarked(markedName), "not marked: %s", markedName);
    return markedName.substring(0, markedName.length() - MARKER.length());
  }

  /** Returns the marked name for a base name, e.g. "Req@" for "Req". */
  public static String marked(String baseName) {
    return baseName + MARKER;
  }

  /** Returns the versioned name for a base name and counter,
   * e.g. "Req@2". */
  public static String versioned(String baseName, int counter) {
    return baseName + MARKER + counter;
  }

  /** Parses a versioned name such as "Req@2"; returns null if the name is
   * not of that form. */
  public static @Nullable VersionedName parseVersioned(String name) {
    final Matcher matcher = VERSIONED.matcher(name);
    if (!matcher.matches()) {
      return null;
    }
    try {
      return VersionedName.of(matcher.group(1),
          Integer.parseInt(matcher.group(2)));
    } catch (NumberFormatException e) {
      // Too many digits to be a counter that we generated
      return null;
    }
  }
}

// End SeqNames.java
