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

import com.google.auto.value.AutoValue;

/** A 1-based line and column in a source file. Line 0 means "no position". */
@AutoValue
public abstract class Location implements Comparable<Location> {

  public static Location create(int line, int column) {
    return new AutoValue_Location(line, column);
  }

  public abstract int getLine();

  public abstract int getColumn();

  public boolean isSet() {
    return getLine() != 0;
  }

  @Override
  public int compareTo(Location other) {
    if (getLine() != other.getLine()) {
      return Integer.compare(getLine(), other.getLine());
    }
    return Integer.compare(getColumn(), other.getColumn());
  }

  @Override
  public final String toString() {
    return getLine() + ":" + getColumn();
  }
}
