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

/** Function application: {@code target(args)}, optionally followed by {@code tailstrict}. */
public final class Apply extends Node {
  private final Node target;
  private final Fodder fodderLeft;
  private final Arguments arguments;
  private final boolean trailingComma;
  private final Fodder fodderRight;
  private final Fodder tailStrictFodder;
  private final boolean tailStrict;

  public Apply(
      @Nullable LocationRange location,
      Fodder openFodder,
      Node target,
      Fodder fodderLeft,
      Arguments arguments,
      boolean trailingComma,
      Fodder fodderRight,
      Fodder tailStrictFodder,
      boolean tailStrict) {
    super(Kind.APPLY, location, openFodder);
    this.target = checkNotNull(target);
    this.fodderLeft = checkNotNull(fodderLeft);
    this.arguments = checkNotNull(arguments);
    this.trailingComma = trailingComma;
    this.fodderRight = checkNotNull(fodderRight);
    this.tailStrictFodder = checkNotNull(tailStrictFodder);
    this.tailStrict = tailStrict;
  }

  public Node getTarget() {
    return target;
  }

  public Fodder getFodderLeft() {
    return fodderLeft;
  }

  public Arguments getArguments() {
    return arguments;
  }

  public boolean hasTrailingComma() {
    return trailingComma;
  }

  public Fodder getFodderRight() {
    return fodderRight;
  }

  public Fodder getTailStrictFodder() {
    return tailStrictFodder;
  }

  public boolean isTailStrict() {
    return tailStrict;
  }
}
