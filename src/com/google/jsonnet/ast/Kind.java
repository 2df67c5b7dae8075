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

/**
 * The closed set of syntax tree node kinds.
 *
 * <p>A raw tree, as produced by the parser, never contains {@link #DESUGARED_OBJECT}. A lowered
 * tree never contains {@link #OBJECT}; its objects have been normalized so that every literal key
 * is a {@link LiteralString}.
 */
public enum Kind {
  APPLY,
  APPLY_BRACE,
  ARRAY,
  ARRAY_COMP,
  ASSERT,
  BINARY,
  CONDITIONAL,
  DESUGARED_OBJECT,
  DOLLAR,
  ERROR,
  FUNCTION,
  IMPORT,
  IMPORT_STR,
  INDEX,
  IN_SUPER,
  LITERAL_BOOLEAN,
  LITERAL_NULL,
  LITERAL_NUMBER,
  LITERAL_STRING,
  LOCAL,
  OBJECT,
  OBJECT_COMP,
  PARENS,
  SELF,
  SLICE,
  SUPER_INDEX,
  UNARY,
  VAR;

  /**
   * Whether the first token of a node of this kind belongs to its leftmost child. Such nodes do
   * not own their open fodder; it is printed by the leftmost child.
   */
  public boolean isLeftRecursive() {
    switch (this) {
      case APPLY:
      case APPLY_BRACE:
      case BINARY:
      case INDEX:
      case IN_SUPER:
      case SLICE:
        return true;
      default:
        return false;
    }
  }
}
