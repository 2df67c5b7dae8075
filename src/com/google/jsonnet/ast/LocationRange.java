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

/**
 * The span of source text a node was parsed from. Ranges are values: consumers that keep a range
 * beyond the life of a tree copy it rather than holding on to the node.
 */
@AutoValue
public abstract class LocationRange {

  public static LocationRange create(String fileName, Location begin, Location end) {
    return new AutoValue_LocationRange(fileName, begin, end);
  }

  public static LocationRange create(
      String fileName, int beginLine, int beginColumn, int endLine, int endColumn) {
    return create(
        fileName, Location.create(beginLine, beginColumn), Location.create(endLine, endColumn));
  }

  public abstract String getFileName();

  public abstract Location getBegin();

  public abstract Location getEnd();

  public boolean isSet() {
    return getBegin().isSet();
  }

  /** Whether {@code other} lies entirely within this range. Unset ranges contain nothing. */
  public boolean encloses(LocationRange other) {
    if (!isSet() || !other.isSet() || !getFileName().equals(other.getFileName())) {
      return false;
    }
    return getBegin().compareTo(other.getBegin()) <= 0 && other.getEnd().compareTo(getEnd()) <= 0;
  }

  /**
   * Renders the range compactly: {@code file:3:5-9} on a single line, {@code file:(3:5)-(4:1)}
   * across lines.
   */
  @Override
  public final String toString() {
    if (!isSet()) {
      return getFileName();
    }
    String filePrefix = getFileName().isEmpty() ? "" : getFileName() + ":";
    if (getBegin().getLine() == getEnd().getLine()) {
      if (getBegin().getColumn() == getEnd().getColumn()) {
        return filePrefix + getBegin();
      }
      return filePrefix + getBegin() + "-" + getEnd().getColumn();
    }
    return filePrefix + "(" + getBegin() + ")-(" + getEnd() + ")";
  }
}
