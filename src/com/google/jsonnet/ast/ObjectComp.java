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

import com.google.common.collect.ImmutableList;
import org.jspecify.annotations.Nullable;

/** An object comprehension: {@code { [k]: v for x in e }}. */
public final class ObjectComp extends Node {
  private final ImmutableList<ObjectField> fields;
  private final boolean trailingComma;
  private final ForSpec spec;
  private final Fodder closeFodder;

  public ObjectComp(
      @Nullable LocationRange location,
      Fodder openFodder,
      Iterable<ObjectField> fields,
      boolean trailingComma,
      ForSpec spec,
      Fodder closeFodder) {
    super(Kind.OBJECT_COMP, location, openFodder);
    this.fields = ImmutableList.copyOf(fields);
    this.trailingComma = trailingComma;
    this.spec = checkNotNull(spec);
    this.closeFodder = checkNotNull(closeFodder);
  }

  public ImmutableList<ObjectField> getFields() {
    return fields;
  }

  public boolean hasTrailingComma() {
    return trailingComma;
  }

  public ForSpec getSpec() {
    return spec;
  }

  public Fodder getCloseFodder() {
    return closeFodder;
  }
}
