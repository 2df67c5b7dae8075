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

/**
 * One binding of a {@code local} expression or an object local: {@code name = body} or, with
 * function sugar, {@code name(params) = body}.
 */
public final class LocalBind {
  private final Fodder varFodder;
  private final String variable;
  private final Fodder eqFodder;
  private final Node body;
  private final @Nullable ParameterList params;
  private final Fodder closeFodder;
  private final @Nullable LocationRange location;

  public LocalBind(
      Fodder varFodder,
      String variable,
      @Nullable ParameterList params,
      Fodder eqFodder,
      Node body,
      Fodder closeFodder,
      @Nullable LocationRange location) {
    this.varFodder = checkNotNull(varFodder);
    this.variable = checkNotNull(variable);
    this.params = params;
    this.eqFodder = checkNotNull(eqFodder);
    this.body = checkNotNull(body);
    this.closeFodder = checkNotNull(closeFodder);
    this.location = location;
  }

  public Fodder getVarFodder() {
    return varFodder;
  }

  public String getVariable() {
    return variable;
  }

  /** The parameters of a function-sugared binding, or null for a plain binding. */
  public @Nullable ParameterList getParams() {
    return params;
  }

  public Fodder getEqFodder() {
    return eqFodder;
  }

  public Node getBody() {
    return body;
  }

  /** Fodder before the comma or semicolon that ends the binding. */
  public Fodder getCloseFodder() {
    return closeFodder;
  }

  public @Nullable LocationRange getLocation() {
    return location;
  }

  public LocalBind withBody(@Nullable ParameterList newParams, Node newBody) {
    return new LocalBind(varFodder, variable, newParams, eqFodder, newBody, closeFodder, location);
  }
}
