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

/** An array element or positional argument, with the fodder before its trailing comma. */
public final class CommaSeparatedExpr {
  private final Node expr;
  private final Fodder commaFodder;

  public CommaSeparatedExpr(Node expr, Fodder commaFodder) {
    this.expr = checkNotNull(expr);
    this.commaFodder = checkNotNull(commaFodder);
  }

  public static CommaSeparatedExpr of(Node expr) {
    return new CommaSeparatedExpr(expr, Fodder.EMPTY);
  }

  public Node getExpr() {
    return expr;
  }

  public Fodder getCommaFodder() {
    return commaFodder;
  }
}
