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

/** An {@code if cond} clause of a comprehension. */
public final class IfSpec {
  private final Fodder ifFodder;
  private final Node expr;

  public IfSpec(Fodder ifFodder, Node expr) {
    this.ifFodder = checkNotNull(ifFodder);
    this.expr = checkNotNull(expr);
  }

  public Fodder getIfFodder() {
    return ifFodder;
  }

  public Node getExpr() {
    return expr;
  }
}
