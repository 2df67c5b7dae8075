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

/** A function parameter, optionally with a default argument. */
public final class Parameter {
  private final Fodder nameFodder;
  private final String name;
  private final Fodder eqFodder;
  private final @Nullable Node defaultArg;
  private final Fodder commaFodder;
  private final @Nullable LocationRange location;

  public Parameter(
      Fodder nameFodder,
      String name,
      Fodder eqFodder,
      @Nullable Node defaultArg,
      Fodder commaFodder,
      @Nullable LocationRange location) {
    this.nameFodder = checkNotNull(nameFodder);
    this.name = checkNotNull(name);
    this.eqFodder = checkNotNull(eqFodder);
    this.defaultArg = defaultArg;
    this.commaFodder = checkNotNull(commaFodder);
    this.location = location;
  }

  public static Parameter named(String name) {
    return new Parameter(Fodder.EMPTY, name, Fodder.EMPTY, null, Fodder.EMPTY, null);
  }

  public static Parameter withDefault(String name, Node defaultArg) {
    return new Parameter(Fodder.EMPTY, name, Fodder.EMPTY, defaultArg, Fodder.EMPTY, null);
  }

  public Fodder getNameFodder() {
    return nameFodder;
  }

  public String getName() {
    return name;
  }

  public Fodder getEqFodder() {
    return eqFodder;
  }

  public @Nullable Node getDefaultArg() {
    return defaultArg;
  }

  public Fodder getCommaFodder() {
    return commaFodder;
  }

  public @Nullable LocationRange getLocation() {
    return location;
  }

  /** Returns a copy of this parameter with a different default argument. */
  public Parameter withDefaultArg(@Nullable Node newDefault) {
    return new Parameter(nameFodder, name, eqFodder, newDefault, commaFodder, location);
  }
}
