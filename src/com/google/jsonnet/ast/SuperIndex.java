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
import static com.google.common.base.Preconditions.checkNotNull;

import org.jspecify.annotations.Nullable;

/** {@code super.id} or {@code super[index]}. */
public final class SuperIndex extends Node {
  private final Fodder dotFodder;
  private final @Nullable Node index;
  private final Fodder idFodder;
  private final @Nullable String id;

  public SuperIndex(
      @Nullable LocationRange location,
      Fodder openFodder,
      Fodder dotFodder,
      @Nullable Node index,
      Fodder idFodder,
      @Nullable String id) {
    super(Kind.SUPER_INDEX, location, openFodder);
    checkArgument((index == null) != (id == null), "exactly one of index and id must be set");
    this.dotFodder = checkNotNull(dotFodder);
    this.index = index;
    this.idFodder = checkNotNull(idFodder);
    this.id = id;
  }

  public Fodder getDotFodder() {
    return dotFodder;
  }

  public @Nullable Node getIndex() {
    return index;
  }

  /** Fodder before the identifier, or before {@code ]} for the bracketed form. */
  public Fodder getIdFodder() {
    return idFodder;
  }

  public @Nullable String getId() {
    return id;
  }
}
