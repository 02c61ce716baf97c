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

import java.util.Objects;
import net.hydromatic.seqbind.ast.Ast;

/** Identifies a function: module, name and arity. Printed as
 * "{@code module:name/arity}". */
public final class FunctionId {
  public final String module;
  public final String name;
  public final int arity;

  private FunctionId(String module, String name, int arity) {
    this.module = requireNonNull(module);
    this.name = requireNonNull(name);
    this.arity = arity;
  }

  /** Creates a FunctionId. */
  public static FunctionId of(String module, String name, int arity) {
    return new FunctionId(module, name, arity);
  }

  /** Creates the FunctionId of a function in a module. */
  public static FunctionId of(Ast.Module module, Ast.Function function) {
    return of(module.name, function.name, function.arity);
  }

  @Override public int hashCode() {
    return Objects.hash(module, name, arity);
  }

  @Override public boolean equals(Object o) {
    return o == this
        || o instanceof FunctionId
        && module.equals(((FunctionId) o).module)
        && name.equals(((FunctionId) o).name)
        && arity == ((FunctionId) o).arity;
  }

  @Override public String toString() {
    return module + ":" + name + "/" + arity;
  }
}

// End FunctionId.java
