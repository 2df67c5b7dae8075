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
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import com.google.jsonnet.ast.Node;
import com.google.jsonnet.tooling.TraversalException.Phase;
import java.util.logging.Logger;
import org.jspecify.annotations.Nullable;

/**
 * NodeTraversal walks a tree depth first, using {@link NodeChildren} to find the children of each
 * node, and reports every node to a {@link Callback}.
 *
 * <p>For each node the pre-order hook fires on entry. A leaf then receives the in-order and
 * post-order hooks back to back. An inner node has all of its children but the last traversed,
 * then receives the in-order hook, then has its last child traversed, then receives the post-order
 * hook. The in-order hook therefore separates "all but the last child" from "the last child", and
 * fires exactly once per node.
 *
 * <p>The traversal never changes the tree. A hook failure aborts the walk at once.
 */
public final class NodeTraversal {
  private static final Logger logger = Logger.getLogger(NodeTraversal.class.getName());

  public static final int DEFAULT_MAX_DEPTH = 5000;

  private final Callback callback;
  private final int maxDepth;

  /** Contains the current node */
  private @Nullable Node currentNode;

  private int currentDepth;

  /** Callback for tree-based traversals. Every hook defaults to doing nothing. */
  public interface Callback {
    /**
     * Visits a node before any of its children.
     *
     * @param t The current traversal.
     * @param n The current node.
     * @param parent The parent of the current node, null for the root.
     */
    default void preVisit(NodeTraversal t, Node n, @Nullable Node parent) throws VisitException {}

    /** Visits a node just before its last child, or right before {@link #postVisit} for leaves. */
    default void inVisit(NodeTraversal t, Node n, @Nullable Node parent) throws VisitException {}

    /** Visits a node after all of its children. */
    default void postVisit(NodeTraversal t, Node n, @Nullable Node parent) throws VisitException {}
  }

  /** Callback to visit all nodes in postorder. */
  @FunctionalInterface
  public interface AbstractPostOrderCallbackInterface {
    void visit(NodeTraversal t, Node n, @Nullable Node parent) throws VisitException;
  }

  private NodeTraversal(Callback callback, int maxDepth) {
    this.callback = callback;
    this.maxDepth = maxDepth;
  }

  public static Builder builder() {
    return new Builder();
  }

  /** Traverses a tree with the default depth limit. */
  public static void traverse(Node root, Callback cb) throws TraversalException {
    builder().setCallback(cb).traverse(root);
  }

  /** Traverses a tree, visiting every node in postorder only. */
  public static void traversePostOrder(Node root, AbstractPostOrderCallbackInterface cb)
      throws TraversalException {
    traverse(
        root,
        new Callback() {
          @Override
          public void postVisit(NodeTraversal t, Node n, @Nullable Node parent)
              throws VisitException {
            cb.visit(t, n, parent);
          }
        });
  }

  /** Configures and starts a traversal. */
  public static final class Builder {
    private @Nullable Callback callback;
    private int maxDepth = DEFAULT_MAX_DEPTH;

    private Builder() {}

    @CanIgnoreReturnValue
    public Builder setCallback(Callback callback) {
      this.callback = checkNotNull(callback);
      return this;
    }

    /** Trees nested deeper than this abort the traversal. */
    @CanIgnoreReturnValue
    public Builder setMaxDepth(int maxDepth) {
      checkArgument(maxDepth > 0, "maxDepth must be positive: %s", maxDepth);
      this.maxDepth = maxDepth;
      return this;
    }

    public void traverse(Node root) throws TraversalException {
      checkState(callback != null, "no callback set");
      new NodeTraversal(callback, maxDepth).traverseRoot(checkNotNull(root));
    }
  }

  private void traverseRoot(Node root) throws TraversalException {
    try {
      traverseBranch(root, null, 0);
    } catch (StackOverflowError e) {
      logger.warning("Traversal ran out of stack at depth " + currentDepth);
      Node n = currentNode != null ? currentNode : root;
      throw new TraversalException(
          Phase.PRE, n.getLocation(), "tree too deep to traverse (depth " + currentDepth + ")");
    } finally {
      currentNode = null;
    }
  }

  private void traverseBranch(Node n, @Nullable Node parent, int depth)
      throws TraversalException {
    if (depth > maxDepth) {
      logger.warning("Traversal aborted: depth limit " + maxDepth + " exceeded");
      throw new TraversalException(
          Phase.PRE, n.getLocation(), "maximum traversal depth " + maxDepth + " exceeded");
    }
    currentDepth = depth;
    visit(Phase.PRE, n, parent);

    ImmutableList<Node> children = NodeChildren.children(n);
    if (children.isEmpty()) {
      visit(Phase.IN, n, parent);
      visit(Phase.POST, n, parent);
      return;
    }

    int last = children.size() - 1;
    for (int i = 0; i < last; i++) {
      traverseBranch(children.get(i), n, depth + 1);
    }
    currentDepth = depth;
    visit(Phase.IN, n, parent);

    traverseBranch(children.get(last), n, depth + 1);
    currentDepth = depth;
    visit(Phase.POST, n, parent);
  }

  private void visit(Phase phase, Node n, @Nullable Node parent) throws TraversalException {
    currentNode = n;
    try {
      switch (phase) {
        case PRE:
          callback.preVisit(this, n, parent);
          break;
        case IN:
          callback.inVisit(this, n, parent);
          break;
        case POST:
          callback.postVisit(this, n, parent);
          break;
      }
    } catch (VisitException e) {
      throw new TraversalException(phase, n.getLocation(), e);
    }
  }

  /** The node whose hook is running. */
  public @Nullable Node getCurrentNode() {
    return currentNode;
  }

  /** Nesting depth of the current node; the root is at depth 0. */
  public int getDepth() {
    return currentDepth;
  }
}
