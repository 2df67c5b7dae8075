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

/** A unary prefix operation. */
public final class Unary extends Node {
  private final UnaryOp op;
  private final Node expr;

  public Unary(@Nullable LocationRange location, Fodder openFodder, UnaryOp op, Node expr) {
    super(Kind.UNARY, location, openFodder);
    this.op = checkNotNull(op);
    this.expr = checkNotNull(expr);
  }

  public UnaryOp getOp() {
    return op;
  }

  public Node getExpr() {
    return expr;
  }
}
