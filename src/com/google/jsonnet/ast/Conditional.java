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

import org.jspecify.annotations.Nullable;

/** {@code if cond then a else b}; the else branch is optional. */
public final class Conditional extends Node {
  private final Node cond;
  private final Fodder thenFodder;
  private final Node branchTrue;
  private final Fodder elseFodder;
  private final @Nullable Node branchFalse;

  public Conditional(
      @Nullable LocationRange location,
      Fodder openFodder,
      Node cond,
      Fodder thenFodder,
      Node branchTrue,
      Fodder elseFodder,
      @Nullable Node branchFalse) {
    super(Kind.CONDITIONAL, location, openFodder);
    this.cond = checkNotNull(cond);
    this.thenFodder = checkNotNull(thenFodder);
    this.branchTrue = checkNotNull(branchTrue);
    this.elseFodder = checkNotNull(elseFodder);
    this.branchFalse = branchFalse;
  }

  public Node getCond() {
    return cond;
  }

  public Fodder getThenFodder() {
    return thenFodder;
  }

  public Node getBranchTrue() {
    return branchTrue;
  }

  public Fodder getElseFodder() {
    return elseFodder;
  }

  public @Nullable Node getBranchFalse() {
    return branchFalse;
  }
}
