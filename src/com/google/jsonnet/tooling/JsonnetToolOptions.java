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

import static com.google.common.base.Preconditions.checkArgument;

import java.io.Serializable;

/** Options for {@link JsonnetTool}. */
public class JsonnetToolOptions implements Serializable {
  private static final long serialVersionUID = 1L;

  /** Pad non-empty arrays with a space inside the brackets when printing. */
  private boolean padArrays = false;

  /** Pad non-empty objects with a space inside the braces when printing. */
  private boolean padObjects = true;

  /** Deepest nesting a traversal accepts before giving up. */
  private int maxTraversalDepth = NodeTraversal.DEFAULT_MAX_DEPTH;

  /** Check the structure of every parsed tree before running a pass over it. */
  private boolean validateInput = true;

  public boolean getPadArrays() {
    return padArrays;
  }

  public void setPadArrays(boolean padArrays) {
    this.padArrays = padArrays;
  }

  public boolean getPadObjects() {
    return padObjects;
  }

  public void setPadObjects(boolean padObjects) {
    this.padObjects = padObjects;
  }

  public int getMaxTraversalDepth() {
    return maxTraversalDepth;
  }

  public void setMaxTraversalDepth(int maxTraversalDepth) {
    checkArgument(
        maxTraversalDepth > 0, "maxTraversalDepth must be positive: %s", maxTraversalDepth);
    this.maxTraversalDepth = maxTraversalDepth;
  }

  public boolean shouldValidateInput() {
    return validateInput;
  }

  public void setValidateInput(boolean validateInput) {
    this.validateInput = validateInput;
  }

  PrinterOptions toPrinterOptions() {
    return PrinterOptions.builder().setPadArrays(padArrays).setPadObjects(padObjects).build();
  }
}
