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

import com.google.jsonnet.ast.Kind;
import com.google.jsonnet.ast.Local;
import com.google.jsonnet.ast.LocationRange;
import com.google.jsonnet.ast.Node;
import org.jspecify.annotations.Nullable;

/**
 * This class walks a tree and validates that it has the structure the tooling passes rely on. The
 * parser is expected never to produce a tree that fails here, so violations are programming
 * errors rather than user errors.
 */
public final class AstValidator implements NodeTraversal.Callback {

  /** Violation handler */
  public interface ViolationHandler {
    void handleViolation(String message, Node n);
  }

  private final TreeShape shape;
  private final ViolationHandler violationHandler;

  public AstValidator(TreeShape shape, ViolationHandler handler) {
    this.shape = checkNotNull(shape);
    this.violationHandler = checkNotNull(handler);
  }

  public AstValidator(TreeShape shape) {
    this(
        shape,
        new ViolationHandler() {
          @Override
          public void handleViolation(String message, Node n) {
            throw new IllegalStateException(message + ". Reference node: " + n);
          }
        });
  }

  /** Validates every node under {@code root}. */
  public void validate(Node root) throws TraversalException {
    NodeTraversal.traverse(root, this);
  }

  @Override
  public void preVisit(NodeTraversal t, Node n, @Nullable Node parent) {
    validateKind(n);
    if (n.isLocal() && ((Local) n).getBinds().isEmpty()) {
      violation("LOCAL has no binds", n);
    }
    if (parent != null) {
      validateNesting(n, parent);
    }
  }

  private void validateKind(Node n) {
    Kind kind = n.getKind();
    switch (shape) {
      case RAW:
        if (kind == Kind.DESUGARED_OBJECT) {
          violation("Lowered object in a raw tree", n);
        }
        break;
      case LOWERED:
        if (kind == Kind.OBJECT) {
          violation("Raw object in a lowered tree", n);
        }
        break;
    }
  }

  private void validateNesting(Node n, Node parent) {
    LocationRange inner = n.getLocation();
    LocationRange outer = parent.getLocation();
    if (inner == null || outer == null || !inner.isSet() || !outer.isSet()) {
      return;
    }
    if (!outer.encloses(inner)) {
      violation("Location " + inner + " is not within its parent's location " + outer, n);
    }
  }

  private void violation(String message, Node n) {
    violationHandler.handleViolation(message, n);
  }
}
