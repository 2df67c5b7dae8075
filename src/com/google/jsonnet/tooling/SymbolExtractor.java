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

import com.google.common.collect.ImmutableList;
import com.google.jsonnet.ast.DesugaredField;
import com.google.jsonnet.ast.DesugaredObject;
import com.google.jsonnet.ast.LiteralString;
import com.google.jsonnet.ast.Local;
import com.google.jsonnet.ast.LocalBind;
import com.google.jsonnet.ast.LocationRange;
import com.google.jsonnet.ast.Node;
import com.google.jsonnet.tooling.TraversalException.Phase;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.jspecify.annotations.Nullable;

/**
 * Collects the symbols of a lowered tree in the order they are found.
 *
 * <p>A lowered object contributes its locals, then one field symbol per literal field name, then
 * the symbols inside its field bodies. A field body is searched with the field's name appended to
 * the context. Fields with computed names contribute no symbol, but their names and bodies are
 * still searched. Objects of a raw tree are searched like any other expression and contribute
 * nothing themselves, so callers lower the tree first.
 */
public final class SymbolExtractor {
  private static final Logger logger = Logger.getLogger(SymbolExtractor.class.getName());

  private final int maxDepth;

  public SymbolExtractor() {
    this(NodeTraversal.DEFAULT_MAX_DEPTH);
  }

  public SymbolExtractor(int maxDepth) {
    checkArgument(maxDepth > 0, "maxDepth must be positive: %s", maxDepth);
    this.maxDepth = maxDepth;
  }

  /**
   * Returns the symbols declared anywhere under {@code root}.
   *
   * @throws TraversalException if the tree is nested deeper than the configured limit
   */
  public ImmutableList<Symbol> extract(Node root) throws TraversalException {
    checkNotNull(root);
    ImmutableList.Builder<Symbol> symbols = ImmutableList.builder();
    try {
      visit(root, ImmutableList.of(), 0, symbols);
    } catch (StackOverflowError e) {
      logger.warning("Symbol extraction ran out of stack");
      throw new TraversalException(Phase.PRE, root.getLocation(), "tree too deep to search");
    }
    ImmutableList<Symbol> result = symbols.build();
    if (logger.isLoggable(Level.FINE)) {
      logger.fine("Found " + result.size() + " symbols");
    }
    return result;
  }

  private void visit(
      Node n, ImmutableList<String> context, int depth, ImmutableList.Builder<Symbol> symbols)
      throws TraversalException {
    if (depth > maxDepth) {
      logger.warning("Symbol extraction aborted: depth limit " + maxDepth + " exceeded");
      throw new TraversalException(
          Phase.PRE, n.getLocation(), "maximum traversal depth " + maxDepth + " exceeded");
    }

    switch (n.getKind()) {
      case DESUGARED_OBJECT:
        visitObject((DesugaredObject) n, context, depth, symbols);
        return;
      case LOCAL:
        for (LocalBind bind : ((Local) n).getBinds()) {
          symbols.add(
              Symbol.create(
                  bind.getVariable(),
                  Symbol.Kind.LOCAL,
                  context,
                  locationOf(bind.getLocation(), n)));
        }
        break;
      default:
        break;
    }
    for (Node child : NodeChildren.children(n)) {
      visit(child, context, depth + 1, symbols);
    }
  }

  private void visitObject(
      DesugaredObject object,
      ImmutableList<String> context,
      int depth,
      ImmutableList.Builder<Symbol> symbols)
      throws TraversalException {
    for (LocalBind local : object.getLocals()) {
      symbols.add(
          Symbol.create(
              local.getVariable(),
              Symbol.Kind.OBJECT_LOCAL,
              context,
              locationOf(local.getLocation(), object)));
    }
    for (DesugaredField field : object.getFields()) {
      if (field.getName().isLiteralString()) {
        symbols.add(
            Symbol.create(
                ((LiteralString) field.getName()).getValue(),
                Symbol.Kind.FIELD,
                context,
                locationOf(field.getLocation(), object)));
      }
    }

    for (DesugaredField field : object.getFields()) {
      ImmutableList<String> bodyContext = context;
      if (field.getName().isLiteralString()) {
        bodyContext =
            ImmutableList.<String>builder()
                .addAll(context)
                .add(((LiteralString) field.getName()).getValue())
                .build();
      } else {
        visit(field.getName(), context, depth + 1, symbols);
      }
      visit(field.getBody(), bodyContext, depth + 1, symbols);
    }
    for (LocalBind local : object.getLocals()) {
      for (Node child : NodeChildren.bindChildren(local)) {
        visit(child, context, depth + 1, symbols);
      }
    }
    for (Node assertion : object.getAsserts()) {
      visit(assertion, context, depth + 1, symbols);
    }
  }

  private static @Nullable LocationRange locationOf(@Nullable LocationRange own, Node enclosing) {
    return own != null ? own : enclosing.getLocation();
  }
}
