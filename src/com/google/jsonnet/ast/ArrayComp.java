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

/** An array comprehension: {@code [body for x in e if c]}. */
public final class ArrayComp extends Node {
  private final Node body;
  private final Fodder trailingCommaFodder;
  private final boolean trailingComma;
  private final ForSpec spec;
  private final Fodder closeFodder;

  public ArrayComp(
      @Nullable LocationRange location,
      Fodder openFodder,
      Node body,
      Fodder trailingCommaFodder,
      boolean trailingComma,
      ForSpec spec,
      Fodder closeFodder) {
    super(Kind.ARRAY_COMP, location, openFodder);
    this.body = checkNotNull(body);
    this.trailingCommaFodder = checkNotNull(trailingCommaFodder);
    this.trailingComma = trailingComma;
    this.spec = checkNotNull(spec);
    this.closeFodder = checkNotNull(closeFodder);
  }

  public Node getBody() {
    return body;
  }

  public Fodder getTrailingCommaFodder() {
    return trailingCommaFodder;
  }

  public boolean hasTrailingComma() {
    return trailingComma;
  }

  /** The innermost {@code for} clause. */
  public ForSpec getSpec() {
    return spec;
  }

  public Fodder getCloseFodder() {
    return closeFodder;
  }
}
