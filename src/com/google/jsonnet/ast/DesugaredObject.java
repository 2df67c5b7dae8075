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

import com.google.common.collect.ImmutableList;
import org.jspecify.annotations.Nullable;

/**
 * An object after lowering. Its locals are visible to every field body and assertion; its
 * assertions are plain expressions that evaluate to null or fail.
 */
public final class DesugaredObject extends Node {
  private final ImmutableList<LocalBind> locals;
  private final ImmutableList<DesugaredField> fields;
  private final ImmutableList<Node> asserts;

  public DesugaredObject(
      @Nullable LocationRange location,
      Fodder openFodder,
      Iterable<LocalBind> locals,
      Iterable<DesugaredField> fields,
      Iterable<Node> asserts) {
    super(Kind.DESUGARED_OBJECT, location, openFodder);
    this.locals = ImmutableList.copyOf(locals);
    this.fields = ImmutableList.copyOf(fields);
    this.asserts = ImmutableList.copyOf(asserts);
  }

  public ImmutableList<LocalBind> getLocals() {
    return locals;
  }

  public ImmutableList<DesugaredField> getFields() {
    return fields;
  }

  public ImmutableList<Node> getAsserts() {
    return asserts;
  }
}
