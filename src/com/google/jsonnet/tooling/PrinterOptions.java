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

/** Layout switches of the {@link CodePrinter}. */
@AutoValue
public abstract class PrinterOptions {

  /** Whether non-empty arrays get a space inside their brackets: {@code [ 1, 2 ]}. */
  public abstract boolean getPadArrays();

  /** Whether non-empty objects get a space inside their braces: {@code { a: 1 }}. */
  public abstract boolean getPadObjects();

  public static Builder builder() {
    return new AutoValue_PrinterOptions.Builder().setPadArrays(false).setPadObjects(true);
  }

  /** Unpadded arrays and padded objects, the conventional Jsonnet layout. */
  public static PrinterOptions defaults() {
    return builder().build();
  }

  public abstract Builder toBuilder();

  /** Builder for {@link PrinterOptions}. */
  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder setPadArrays(boolean padArrays);

    public abstract Builder setPadObjects(boolean padObjects);

    public abstract PrinterOptions build();
  }
}
