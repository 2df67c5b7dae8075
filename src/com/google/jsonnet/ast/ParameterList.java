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

/**
 * A parenthesized parameter list. Shared by function literals and by the function sugar of local
 * bindings and object fields ({@code local f(x) = ...}, {@code f(x): ...}).
 */
public final class ParameterList {
  private final Fodder parenLeftFodder;
  private final ImmutableList<Parameter> parameters;
  private final boolean trailingComma;
  private final Fodder parenRightFodder;

  public ParameterList(
      Fodder parenLeftFodder,
      Iterable<Parameter> parameters,
      boolean trailingComma,
      Fodder parenRightFodder) {
    this.parenLeftFodder = checkNotNull(parenLeftFodder);
    this.parameters = ImmutableList.copyOf(parameters);
    this.trailingComma = trailingComma;
    this.parenRightFodder = checkNotNull(parenRightFodder);
  }

  public static ParameterList of(Parameter... parameters) {
    return new ParameterList(Fodder.EMPTY, ImmutableList.copyOf(parameters), false, Fodder.EMPTY);
  }

  public Fodder getParenLeftFodder() {
    return parenLeftFodder;
  }

  public ImmutableList<Parameter> getParameters() {
    return parameters;
  }

  public boolean hasTrailingComma() {
    return trailingComma;
  }

  public Fodder getParenRightFodder() {
    return parenRightFodder;
  }

  public ParameterList withParameters(Iterable<Parameter> newParameters) {
    return new ParameterList(parenLeftFodder, newParameters, trailingComma, parenRightFodder);
  }
}
