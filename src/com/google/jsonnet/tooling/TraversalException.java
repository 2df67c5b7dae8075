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

package com.google.jsonnet.tooling;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.jsonnet.ast.LocationRange;
import java.util.Locale;
import org.jspecify.annotations.Nullable;

/**
 * An aborted walk over a tree. Records which hook failed and where in the source the walk was, so
 * that callers can point users at the offending construct.
 */
public class TraversalException extends Exception {
  private static final long serialVersionUID = 1L;

  /** The traversal hook that was running when the walk was aborted. */
  public enum Phase {
    PRE,
    IN,
    POST;

    @Override
    public String toString() {
      return name().toLowerCase(Locale.ROOT);
    }
  }

  private final Phase phase;
  private final @Nullable LocationRange location;

  public TraversalException(Phase phase, @Nullable LocationRange location, Throwable cause) {
    super(formatMessage(phase, location, cause.getMessage()), cause);
    this.phase = checkNotNull(phase);
    this.location = location;
  }

  public TraversalException(Phase phase, @Nullable LocationRange location, String message) {
    super(formatMessage(phase, location, message));
    this.phase = checkNotNull(phase);
    this.location = location;
  }

  private static String formatMessage(
      Phase phase, @Nullable LocationRange location, @Nullable String detail) {
    StringBuilder sb = new StringBuilder();
    sb.append(phase).append(" error");
    if (location != null && location.isSet()) {
      sb.append(" at ").append(location);
    }
    return sb.append(": ").append(detail).toString();
  }

  public Phase getPhase() {
    return phase;
  }

  /** The location of the node being visited, or null if it was synthesized. */
  public @Nullable LocationRange getLocation() {
    return location;
  }
}
