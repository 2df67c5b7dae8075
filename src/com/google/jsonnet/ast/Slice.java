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

/** {@code target[begin:end:step]}; every bound is optional. */
public final class Slice extends Node {
  private final Node target;
  private final Fodder leftBracketFodder;
  private final @Nullable Node beginIndex;
  private final Fodder endColonFodder;
  private final @Nullable Node endIndex;
  private final Fodder stepColonFodder;
  private final @Nullable Node step;
  private final Fodder rightBracketFodder;

  public Slice(
      @Nullable LocationRange location,
      Fodder openFodder,
      Node target,
      Fodder leftBracketFodder,
      @Nullable Node beginIndex,
      Fodder endColonFodder,
      @Nullable Node endIndex,
      Fodder stepColonFodder,
      @Nullable Node step,
      Fodder rightBracketFodder) {
    super(Kind.SLICE, location, openFodder);
    this.target = checkNotNull(target);
    this.leftBracketFodder = checkNotNull(leftBracketFodder);
    this.beginIndex = beginIndex;
    this.endColonFodder = checkNotNull(endColonFodder);
    this.endIndex = endIndex;
    this.stepColonFodder = checkNotNull(stepColonFodder);
    this.step = step;
    this.rightBracketFodder = checkNotNull(rightBracketFodder);
  }

  public Node getTarget() {
    return target;
  }

  public Fodder getLeftBracketFodder() {
    return leftBracketFodder;
  }

  public @Nullable Node getBeginIndex() {
    return beginIndex;
  }

  public Fodder getEndColonFodder() {
    return endColonFodder;
  }

  public @Nullable Node getEndIndex() {
    return endIndex;
  }

  /** Fodder before the second colon. Non-empty fodder implies the colon was written. */
  public Fodder getStepColonFodder() {
    return stepColonFodder;
  }

  public @Nullable Node getStep() {
    return step;
  }

  public Fodder getRightBracketFodder() {
    return rightBracketFodder;
  }
}
