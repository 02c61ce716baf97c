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

/** Role of a variable occurrence, as decided by
 * {@link OccurrenceClassifier}. */
public enum Occurrence {
  /** Marked variable that introduces a new version of its base name. */
  BINDING,

  /** Marked variable that reads the current version of its base name. */
  REFERENCE,

  /** Unmarked variable in a pattern whose name is the base name of a
   * sequential variable; matches against the current version. */
  BARE_MATCH,

  /** Unmarked variable in a position that always binds afresh, whose name
   * is the base name of a sequential variable. An error. */
  REDECLARATION,

  /** Any other variable; not renamed. */
  PLAIN
}

// End Occurrence.java
