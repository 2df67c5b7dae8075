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

/** A binary operation. */
public final class Binary extends Node {
  private final Node left;
  private final Fodder opFodder;
  private final BinaryOp op;
  private final Node right;

  public Binary(
      @Nullable LocationRange location,
      Fodder openFodder,
      Node left,
      Fodder opFodder,
      BinaryOp op,
      Node right) {
    super(Kind.BINARY, location, openFodder);
    this.left = checkNotNull(left);
    this.opFodder = checkNotNull(opFodder);
    this.op = checkNotNull(op);
    this.right = checkNotNull(right);
  }

  public Node getLeft() {
    return left;
  }

  public Fodder getOpFodder() {
    return opFodder;
  }

  public BinaryOp getOp() {
    return op;
  }

  public Node getRight() {
    return right;
  }
}
