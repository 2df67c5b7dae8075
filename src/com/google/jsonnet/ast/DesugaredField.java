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
 * A field of a {@link DesugaredObject}. The name is a {@link LiteralString} for fields whose key
 * was written literally and an arbitrary expression for computed keys.
 */
public final class DesugaredField {
  private final Visibility visibility;
  private final Node name;
  private final Node body;
  private final boolean plusSuper;
  private final @Nullable LocationRange location;

  public DesugaredField(
      Visibility visibility,
      Node name,
      Node body,
      boolean plusSuper,
      @Nullable LocationRange location) {
    this.visibility = checkNotNull(visibility);
    this.name = checkNotNull(name);
    this.body = checkNotNull(body);
    this.plusSuper = plusSuper;
    this.location = location;
  }

  public Visibility getVisibility() {
    return visibility;
  }

  public Node getName() {
    return name;
  }

  public Node getBody() {
    return body;
  }

  /** Whether the body is merged with the inherited value ({@code +:}). */
  public boolean isPlusSuper() {
    return plusSuper;
  }

  public @Nullable LocationRange getLocation() {
    return location;
  }

  public DesugaredField withChildren(Node newName, Node newBody) {
    return new DesugaredField(visibility, newName, newBody, plusSuper, location);
  }
}
