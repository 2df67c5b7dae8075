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

/** {@code assert cond : message; rest} */
public final class Assert extends Node {
  private final Node cond;
  private final Fodder colonFodder;
  private final @Nullable Node message;
  private final Fodder semicolonFodder;
  private final Node rest;

  public Assert(
      @Nullable LocationRange location,
      Fodder openFodder,
      Node cond,
      Fodder colonFodder,
      @Nullable Node message,
      Fodder semicolonFodder,
      Node rest) {
    super(Kind.ASSERT, location, openFodder);
    this.cond = checkNotNull(cond);
    this.colonFodder = checkNotNull(colonFodder);
    this.message = message;
    this.semicolonFodder = checkNotNull(semicolonFodder);
    this.rest = checkNotNull(rest);
  }

  public Node getCond() {
    return cond;
  }

  public Fodder getColonFodder() {
    return colonFodder;
  }

  public @Nullable Node getMessage() {
    return message;
  }

  public Fodder getSemicolonFodder() {
    return semicolonFodder;
  }

  public Node getRest() {
    return rest;
  }
}
