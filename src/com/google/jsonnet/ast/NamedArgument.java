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

/** A {@code name=value} argument of a function application. */
public final class NamedArgument {
  private final Fodder nameFodder;
  private final String name;
  private final Fodder eqFodder;
  private final Node arg;
  private final Fodder commaFodder;

  public NamedArgument(
      Fodder nameFodder, String name, Fodder eqFodder, Node arg, Fodder commaFodder) {
    this.nameFodder = checkNotNull(nameFodder);
    this.name = checkNotNull(name);
    this.eqFodder = checkNotNull(eqFodder);
    this.arg = checkNotNull(arg);
    this.commaFodder = checkNotNull(commaFodder);
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

  public Node getArg() {
    return arg;
  }

  public Fodder getCommaFodder() {
    return commaFodder;
  }
}
