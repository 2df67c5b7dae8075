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

/** {@code index in super} */
public final class InSuper extends Node {
  private final Node index;
  private final Fodder inFodder;
  private final Fodder superFodder;

  public InSuper(
      @Nullable LocationRange location,
      Fodder openFodder,
      Node index,
      Fodder inFodder,
      Fodder superFodder) {
    super(Kind.IN_SUPER, location, openFodder);
    this.index = checkNotNull(index);
    this.inFodder = checkNotNull(inFodder);
    this.superFodder = checkNotNull(superFodder);
  }

  public Node getIndex() {
    return index;
  }

  public Fodder getInFodder() {
    return inFodder;
  }

  public Fodder getSuperFodder() {
    return superFodder;
  }
}
