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
 * Base class of all syntax tree nodes.
 *
 * <p>Nodes are immutable. Passes that change a tree build a new one and may share untouched
 * subtrees with the input. Node identity is reference identity.
 */
public abstract class Node {
  private final Kind kind;
  private final @Nullable LocationRange location;
  private final Fodder openFodder;

  Node(Kind kind, @Nullable LocationRange location, Fodder openFodder) {
    this.kind = checkNotNull(kind);
    this.location = location;
    this.openFodder = checkNotNull(openFodder);
  }

  public final Kind getKind() {
    return kind;
  }

  /** The source range of the node, or null for nodes synthesized after parsing. */
  public final @Nullable LocationRange getLocation() {
    return location;
  }

  /** Formatting before the first token of the node. */
  public final Fodder getOpenFodder() {
    return openFodder;
  }

  public final boolean isLiteralString() {
    return kind == Kind.LITERAL_STRING;
  }

  public final boolean isDesugaredObject() {
    return kind == Kind.DESUGARED_OBJECT;
  }

  public final boolean isLocal() {
    return kind == Kind.LOCAL;
  }

  public final boolean isVar() {
    return kind == Kind.VAR;
  }

  public final boolean isImport() {
    return kind == Kind.IMPORT;
  }

  @Override
  public String toString() {
    return location == null ? kind.toString() : kind + " " + location;
  }
}
