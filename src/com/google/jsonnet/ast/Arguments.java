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

import com.google.common.collect.ImmutableList;

/** Arguments of an {@link Apply}: all positional arguments precede all named ones. */
public final class Arguments {
  public static final Arguments NONE = new Arguments(ImmutableList.of(), ImmutableList.of());

  private final ImmutableList<CommaSeparatedExpr> positional;
  private final ImmutableList<NamedArgument> named;

  public Arguments(Iterable<CommaSeparatedExpr> positional, Iterable<NamedArgument> named) {
    this.positional = ImmutableList.copyOf(positional);
    this.named = ImmutableList.copyOf(named);
  }

  public ImmutableList<CommaSeparatedExpr> getPositional() {
    return positional;
  }

  public ImmutableList<NamedArgument> getNamed() {
    return named;
  }
}
