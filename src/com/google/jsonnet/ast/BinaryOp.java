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

/** Binary operators, with the text they are written as. */
public enum BinaryOp {
  MULT("*"),
  DIV("/"),
  PERCENT("%"),
  PLUS("+"),
  MINUS("-"),
  SHIFT_L("<<"),
  SHIFT_R(">>"),
  GREATER(">"),
  GREATER_EQ(">="),
  LESS("<"),
  LESS_EQ("<="),
  IN("in"),
  MANIFEST_EQUAL("=="),
  MANIFEST_UNEQUAL("!="),
  BITWISE_AND("&"),
  BITWISE_XOR("^"),
  BITWISE_OR("|"),
  AND("&&"),
  OR("||");

  private final String symbol;

  BinaryOp(String symbol) {
    this.symbol = symbol;
  }

  public String getSymbol() {
    return symbol;
  }

  @Override
  public String toString() {
    return symbol;
  }
}
