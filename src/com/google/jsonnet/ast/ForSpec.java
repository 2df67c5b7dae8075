/*
 * Copyright 2024 The Closure Compiler Authors.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.google.jsonnet.ast;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import org.jspecify.annotations.Nullable;

/**
 * A {@code for x in expr} clause of a comprehension together with the {@code if} clauses that
 * follow it. Nested clauses are chained innermost-first through {@link #getOuter()}, so the
 * textually first clause is the one reached last.
 */
public final class ForSpec {
  private final Fodder forFodder;
  private final Fodder varFodder;
  private final String varName;
  private final Fodder inFodder;
  private final Node expr;
  private final ImmutableList<IfSpec> conditions;
  private final @Nullable ForSpec outer;

  public ForSpec(
      Fodder forFodder,
      Fodder varFodder,
      String varName,
      Fodder inFodder,
      Node expr,
      Iterable<IfSpec> conditions,
      @Nullable ForSpec outer) {
    this.forFodder = checkNotNull(forFodder);
    this.varFodder = checkNotNull(varFodder);
    this.varName = checkNotNull(varName);
    this.inFodder = checkNotNull(inFodder);
    this.expr = checkNotNull(expr);
    this.conditions = ImmutableList.copyOf(conditions);
    this.outer = outer;
  }

  public Fodder getForFodder() {
    return forFodder;
  }

  public Fodder getVarFodder() {
    return varFodder;
  }

  public String getVarName() {
    return varName;
  }

  public Fodder getInFodder() {
    return inFodder;
  }

  public Node getExpr() {
    return expr;
  }

  public ImmutableList<IfSpec> getConditions() {
    return conditions;
  }

  public @Nullable ForSpec getOuter() {
    return outer;
  }

  /** Returns this clause and its outer clauses in source order. */
  public ImmutableList<ForSpec> inSourceOrder() {
    ImmutableList.Builder<ForSpec> reversed = ImmutableList.builder();
    for (ForSpec spec = this; spec != null; spec = spec.outer) {
      reversed.add(spec);
    }
    return reversed.build().reverse();
  }
}
