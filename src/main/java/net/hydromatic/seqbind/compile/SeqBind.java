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

import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.seqbind.ast.Ast;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Rewrites the sequential variables of a compilation unit.
 *
 * <p>This is the entry point that a compiler plugin calls. It is a function
 * from a module to a module: each function is resolved by a {@link Renamer}
 * and written by a {@link Synthesizer}; other forms are unchanged. The
 * rewrite either succeeds for the whole unit or throws
 * {@link CompileException}.
 */
public abstract class SeqBind {
  private SeqBind() {}

  /** Name of the attribute that enables or disables the rewrite of a
   * unit, as in "{@code -seqbind(false).}". */
  public static final String ATTRIBUTE = "seqbind";

  /** Rewrites a module with default properties. */
  public static Result rewrite(Ast.Module module) {
    return rewrite(module, ImmutableMap.of(), Tracers.empty());
  }

  /** Rewrites a module.
   *
   * @param module Compilation unit
   * @param propMap Properties; see {@link Prop}
   * @param tracer Receives the debug information of each function and the
   *               rewritten unit, if the rewrite succeeds
   * @throws CompileException if any function of the unit is invalid
   */
  public static Result rewrite(Ast.Module module, Map<Prop, Object> propMap,
      Tracer tracer) {
    if (!isEnabled(module, propMap)) {
      tracer.onUnit(module, module);
      return new Result(module, ImmutableMap.of());
    }
    final Map<FunctionId, DebugInfo> debugInfos = new LinkedHashMap<>();
    final List<Ast.Form> forms = new ArrayList<>();
    for (Ast.Form form : module.forms) {
      if (form instanceof Ast.Function) {
        final Ast.Function function = (Ast.Function) form;
        final DebugInfo debugInfo =
            rewrite(FunctionId.of(module, function), function);
        debugInfos.put(debugInfo.id, debugInfo);
        forms.add(debugInfo.rewritten);
      } else {
        forms.add(form);
      }
    }
    final Ast.Module module2 = module.copy(forms);
    debugInfos.values().forEach(tracer::onRewrite);
    tracer.onUnit(module, module2);
    return new Result(module2, ImmutableMap.copyOf(debugInfos));
  }

  /** Rewrites a function. */
  public static DebugInfo rewrite(FunctionId id, Ast.Function function) {
    final Resolution resolution = Renamer.resolve(id, function);
    return Synthesizer.synthesize(id, function, resolution);
  }

  /** Returns whether a module is to be rewritten. Its
   * {@link #ATTRIBUTE} attribute, if it is "true" or "false", overrides the
   * {@link Prop#ENABLED} property. */
  static boolean isEnabled(Ast.Module module, Map<Prop, Object> propMap) {
    final Ast.Exp value = module.attributeValue(ATTRIBUTE);
    if (value instanceof Ast.Literal) {
      if (((Ast.Literal) value).isAtom("true")) {
        return true;
      }
      if (((Ast.Literal) value).isAtom("false")) {
        return false;
      }
    }
    return Prop.ENABLED.booleanValue(propMap);
  }

  /** Result of rewriting a module. */
  public static class Result {
    public final Ast.Module module;
    public final ImmutableMap<FunctionId, DebugInfo> debugInfos;

    Result(Ast.Module module, ImmutableMap<FunctionId, DebugInfo> debugInfos) {
      this.module = requireNonNull(module);
      this.debugInfos = requireNonNull(debugInfos);
    }

    /** Returns the debug information of a function, or null if the function
     * does not exist or the module was not rewritten. */
    public @Nullable DebugInfo debugInfo(FunctionId id) {
      return debugInfos.get(id);
    }

    /** Returns the debug information of a function in this module. Throws if
     * not found. */
    public DebugInfo debugInfo(String name, int arity) {
      final FunctionId id = FunctionId.of(module.name, name, arity);
      final DebugInfo debugInfo = debugInfos.get(id);
      if (debugInfo == null) {
        throw new IllegalArgumentException("no debug info for " + id);
      }
      return debugInfo;
    }
  }
}

// End SeqBind.java
