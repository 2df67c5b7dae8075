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

import static com.google.common.base.Preconditions.checkArgument;

import org.jspecify.annotations.Nullable;

/** A reference to a variable. */
public final class Var extends Node {
  private final String id;

  public Var(@Nullable LocationRange location, Fodder openFodder, String id) {
    super(Kind.VAR, location, openFodder);
    checkArgument(!id.isEmpty(), "empty identifier");
    this.id = id;
  }

  public String getId() {
    return id;
  }
}
