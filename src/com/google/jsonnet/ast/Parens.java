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

/** {@code (inner)} */
public final class Parens extends Node {
  private final Node inner;
  private final Fodder closeFodder;

  public Parens(
      @Nullable LocationRange location, Fodder openFodder, Node inner, Fodder closeFodder) {
    super(Kind.PARENS, location, openFodder);
    this.inner = checkNotNull(inner);
    this.closeFodder = checkNotNull(closeFodder);
  }

  public Node getInner() {
    return inner;
  }

  public Fodder getCloseFodder() {
    return closeFodder;
  }
}
