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
 * A string literal.
 *
 * <p>For {@link StringKind#SINGLE} and {@link StringKind#DOUBLE} literals of a raw tree the value
 * still holds the escape sequences as written. Verbatim literals hold the text with the doubled
 * delimiter already collapsed. Block literals hold their lines with the common indentation
 * ({@link #getBlockIndent()}) stripped; {@link #getBlockTermIndent()} is the indentation of the
 * closing {@code |||}.
 */
public final class LiteralString extends Node {
  private final String value;
  private final StringKind stringKind;
  private final String blockIndent;
  private final String blockTermIndent;

  public LiteralString(
      @Nullable LocationRange location,
      Fodder openFodder,
      String value,
      StringKind stringKind,
      String blockIndent,
      String blockTermIndent) {
    super(Kind.LITERAL_STRING, location, openFodder);
    this.value = checkNotNull(value);
    this.stringKind = checkNotNull(stringKind);
    this.blockIndent = checkNotNull(blockIndent);
    this.blockTermIndent = checkNotNull(blockTermIndent);
  }

  public LiteralString(
      @Nullable LocationRange location, Fodder openFodder, String value, StringKind stringKind) {
    this(location, openFodder, value, stringKind, "", "");
  }

  public String getValue() {
    return value;
  }

  public StringKind getStringKind() {
    return stringKind;
  }

  public String getBlockIndent() {
    return blockIndent;
  }

  public String getBlockTermIndent() {
    return blockTermIndent;
  }
}
