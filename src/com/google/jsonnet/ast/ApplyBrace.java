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

/** Object extension without {@code +}: {@code left { ... }}. */
public final class ApplyBrace extends Node {
  private final Node left;
  private final Node right;

  public ApplyBrace(@Nullable LocationRange location, Fodder openFodder, Node left, Node right) {
    super(Kind.APPLY_BRACE, location, openFodder);
    this.left = checkNotNull(left);
    this.right = checkNotNull(right);
  }

  public Node getLeft() {
    return left;
  }

  public Node getRight() {
    return right;
  }
}
