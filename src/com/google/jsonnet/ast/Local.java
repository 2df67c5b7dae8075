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

import com.google.common.collect.ImmutableList;
import org.jspecify.annotations.Nullable;

/**
 * {@code local a = 1, b = 2; body}.
 *
 * <p>The parser never produces a local without bindings. Construction does not reject one so
 * that consumers can be tested against it; they treat it as a broken tree.
 */
public final class Local extends Node {
  private final ImmutableList<LocalBind> binds;
  private final Node body;

  public Local(
      @Nullable LocationRange location, Fodder openFodder, Iterable<LocalBind> binds, Node body) {
    super(Kind.LOCAL, location, openFodder);
    this.binds = ImmutableList.copyOf(binds);
    this.body = checkNotNull(body);
  }

  public ImmutableList<LocalBind> getBinds() {
    return binds;
  }

  public Node getBody() {
    return body;
  }
}
