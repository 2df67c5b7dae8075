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

import com.google.common.collect.ImmutableMap;
import com.google.jsonnet.ast.Fodder;
import com.google.jsonnet.ast.FunctionLiteral;
import com.google.jsonnet.ast.Local;
import com.google.jsonnet.ast.LocalBind;
import com.google.jsonnet.ast.Node;
import com.google.jsonnet.ast.Parens;
import com.google.jsonnet.ast.Var;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.jspecify.annotations.Nullable;

/**
 * Inlines local variables. Every {@code local} binding in the tree is captured by name, then each
 * variable reference to a captured name is replaced by the binding's expanded body.
 *
 * <p>Names are not scoped: when several bindings share a name, the last one in source order wins,
 * and references to parameters or comprehension variables of the same name are replaced as well.
 * A reference that would expand into itself is left as it is. Imported bodies are wrapped in
 * parentheses so that they still bind tighter than their surroundings.
 */
public final class VariableExpander extends NodeRewriter {
  private static final Logger logger = Logger.getLogger(VariableExpander.class.getName());

  private final int maxDepth;
  private ImmutableMap<String, Node> captured = ImmutableMap.of();
  private final Set<String> expanding = new HashSet<>();
  private int expandedCount;

  public VariableExpander() {
    this(NodeTraversal.DEFAULT_MAX_DEPTH);
  }

  public VariableExpander(int maxDepth) {
    super(maxDepth);
    this.maxDepth = maxDepth;
  }

  /** Returns a copy of {@code root} with its local variables inlined. */
  public Node expand(Node root) throws TraversalException {
    captured = capture(root, maxDepth);
    expanding.clear();
    expandedCount = 0;
    Node result = rewriteRoot(root);
    if (logger.isLoggable(Level.FINE)) {
      logger.fine(
          "Captured " + captured.size() + " locals, expanded " + expandedCount + " references");
    }
    return result;
  }

  /** Collects the bodies of all local bindings under {@code root}, keyed by variable name. */
  static ImmutableMap<String, Node> capture(Node root, int maxDepth) throws TraversalException {
    Map<String, Node> locals = new LinkedHashMap<>();
    NodeTraversal.builder()
        .setMaxDepth(maxDepth)
        .setCallback(
            new NodeTraversal.Callback() {
              @Override
              public void preVisit(NodeTraversal t, Node n, @Nullable Node parent) {
                if (n.isLocal()) {
                  for (LocalBind bind : ((Local) n).getBinds()) {
                    locals.put(bind.getVariable(), capturedBody(bind));
                  }
                }
              }
            })
        .traverse(root);
    return ImmutableMap.copyOf(locals);
  }

  private static Node capturedBody(LocalBind bind) {
    Node body = bind.getBody();
    if (bind.getParams() != null) {
      return new FunctionLiteral(bind.getLocation(), Fodder.EMPTY, bind.getParams(), body);
    }
    if (body.isImport()) {
      return new Parens(null, Fodder.EMPTY, body, Fodder.EMPTY);
    }
    return body;
  }

  @Override
  protected @Nullable Node replace(Node n) throws TraversalException {
    if (!n.isVar()) {
      return null;
    }
    String id = ((Var) n).getId();
    Node body = captured.get(id);
    if (body == null || !expanding.add(id)) {
      return n;
    }
    try {
      expandedCount++;
      return rewrite(body);
    } finally {
      expanding.remove(id);
    }
  }
}
