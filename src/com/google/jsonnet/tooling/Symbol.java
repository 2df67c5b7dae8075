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

import com.google.auto.value.AutoValue;
import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import com.google.jsonnet.ast.LocationRange;
import org.jspecify.annotations.Nullable;

/**
 * A name that other code can refer to: a local variable, an object local or an object field.
 *
 * <p>The context is the path of field names from the outermost object down to the object that
 * declares the symbol. It is empty for symbols declared at the top level.
 */
@AutoValue
public abstract class Symbol {

  /** What declared the symbol. */
  public enum Kind {
    /** A binding of a {@code local} expression. */
    LOCAL,
    /** A {@code local} inside an object body. */
    OBJECT_LOCAL,
    /** An object field with a literal name. */
    FIELD
  }

  public static Symbol create(
      String identifier,
      Kind kind,
      ImmutableList<String> context,
      @Nullable LocationRange location) {
    return new AutoValue_Symbol(identifier, kind, context, location);
  }

  public abstract String getIdentifier();

  public abstract Kind getKind();

  public abstract ImmutableList<String> getContext();

  public abstract @Nullable LocationRange getLocation();

  /** The context joined with dots, {@code ""} at the top level. */
  public String getDottedContext() {
    return Joiner.on('.').join(getContext());
  }
}
