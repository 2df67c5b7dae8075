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

/** The two forms a tree handed to the tooling can take. */
public enum TreeShape {
  /** As parsed: objects are OBJECT nodes that keep their surface syntax. */
  RAW,
  /** After {@link ObjectDesugarer}: objects are DESUGARED_OBJECT nodes. */
  LOWERED
}
