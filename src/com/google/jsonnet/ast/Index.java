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

/**
 * {@code target.id} or {@code target[index]}. Exactly one of {@link #getId()} and {@link
 * #getIndex()} is set. For the dotted form the bracket fodder slots hold the fodder before the dot
 * and before the identifier.
 */
public final class Index extends Node {
  private final Node target;
  private final Fodder leftBracketFodder;
  private final @Nullable Node index;
  private final Fodder rightBracketFodder;
  private final @Nullable String id;

  public Index(
      @Nullable LocationRange location,
      Fodder openFodder,
      Node target,
      Fodder leftBracketFodder,
      @Nullable Node index,
      Fodder rightBracketFodder,
      @Nullable String id) {
    super(Kind.INDEX, location, openFodder);
    checkArgument((index == null) != (id == null), "exactly one of index and id must be set");
    this.target = checkNotNull(target);
    this.leftBracketFodder = checkNotNull(leftBracketFodder);
    this.index = index;
    this.rightBracketFodder = checkNotNull(rightBracketFodder);
    this.id = id;
  }

  public Node getTarget() {
    return target;
  }

  public Fodder getLeftBracketFodder() {
    return leftBracketFodder;
  }

  public @Nullable Node getIndex() {
    return index;
  }

  public Fodder getRightBracketFodder() {
    return rightBracketFodder;
  }

  public @Nullable String getId() {
    return id;
  }
}
