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

import com.google.jsonnet.ast.Binary;
import com.google.jsonnet.ast.DesugaredField;
import com.google.jsonnet.ast.DesugaredObject;
import com.google.jsonnet.ast.Import;
import com.google.jsonnet.ast.ImportStr;
import com.google.jsonnet.ast.Index;
import com.google.jsonnet.ast.LiteralBoolean;
import com.google.jsonnet.ast.LiteralNumber;
import com.google.jsonnet.ast.LiteralString;
import com.google.jsonnet.ast.LocalBind;
import com.google.jsonnet.ast.LocationRange;
import com.google.jsonnet.ast.Node;
import com.google.jsonnet.ast.Unary;
import com.google.jsonnet.ast.Var;
import java.util.HashMap;
import org.jspecify.annotations.Nullable;

/**
 * DotFormatter prints out a dot file of a syntax tree. For a detailed description of the dot format
 * and visualization tool refer to <a href="http://www.graphviz.org">Graphviz</a>.
 *
 * <p>Every parent to child relation becomes one edge line, written when the parent is left, so the
 * edges of a subtree precede the edges into it. Nodes are named by a label of the form {@code [loc]
 * #key KIND detail}; the key tells apart nodes that would otherwise print the same. The fields of
 * a lowered object are drawn as two edges, object to name and name to body.
 *
 * <p>Typical usage of this class: {@code System.out.print(DotFormatter.toDot(root));}
 *
 * <p>This class is <b>not</b> thread safe and should not be used without proper external
 * synchronization.
 */
public final class DotFormatter implements NodeTraversal.Callback {
  private static final String INDENT = "  ";
  private static final String ARROW = "->";

  // stores the current assignment of node to keys
  private final HashMap<Node, Integer> assignments = new HashMap<>();

  // field names carry no location of their own; they are labeled with their field's
  private final HashMap<Node, LocationRange> fieldNameLocations = new HashMap<>();

  // key count in order to assign a unique key to each node
  private int keyCount = 0;

  // the builder used to generate the dot diagram
  private final StringBuilder builder;

  private DotFormatter(StringBuilder builder) {
    this.builder = builder;
  }

  /**
   * Converts a tree to dot representation.
   *
   * @param root the root of the tree described in the dot formatted string
   * @return the dot representation of the tree
   */
  public static String toDot(Node root) throws TraversalException {
    return toDot(root, NodeTraversal.DEFAULT_MAX_DEPTH);
  }

  static String toDot(Node root, int maxDepth) throws TraversalException {
    StringBuilder builder = new StringBuilder();
    builder.append("digraph {\n");
    NodeTraversal.builder()
        .setCallback(new DotFormatter(builder))
        .setMaxDepth(maxDepth)
        .traverse(root);
    builder.append("}\n");
    return builder.toString();
  }

  /** Creates a DotFormatter purely for testing DotFormatter's internal methods. */
  static DotFormatter newInstanceForTesting() {
    return new DotFormatter(new StringBuilder());
  }

  @Override
  public void preVisit(NodeTraversal t, Node n, @Nullable Node parent) {
    key(n);
    if (n.isDesugaredObject()) {
      for (DesugaredField field : ((DesugaredObject) n).getFields()) {
        if (field.getName().getLocation() == null && field.getLocation() != null) {
          fieldNameLocations.put(field.getName(), field.getLocation());
        }
      }
    }
  }

  @Override
  public void postVisit(NodeTraversal t, Node n, @Nullable Node parent) {
    if (n.isDesugaredObject()) {
      DesugaredObject object = (DesugaredObject) n;
      for (DesugaredField field : object.getFields()) {
        appendEdge(object, field.getName());
        appendEdge(field.getName(), field.getBody());
      }
      for (LocalBind local : object.getLocals()) {
        for (Node child : NodeChildren.bindChildren(local)) {
          appendEdge(object, child);
        }
      }
      for (Node assertion : object.getAsserts()) {
        appendEdge(object, assertion);
      }
      return;
    }
    for (Node child : NodeChildren.children(n)) {
      appendEdge(n, child);
    }
  }

  private void appendEdge(Node from, Node to) {
    builder.append(INDENT);
    builder.append(quote(label(from)));
    builder.append(ARROW);
    builder.append(quote(label(to)));
    builder.append("\n");
  }

  int key(Node n) {
    Integer key = assignments.get(n);
    if (key == null) {
      key = keyCount++;
      assignments.put(n, key);
    }
    return key;
  }

  private String label(Node n) {
    LocationRange location = n.getLocation();
    if (location == null) {
      location = fieldNameLocations.get(n);
    }
    StringBuilder sb = new StringBuilder();
    sb.append('[');
    if (location != null) {
      sb.append(location);
    }
    sb.append("] #").append(key(n)).append(' ').append(n.getKind());
    String detail = detail(n);
    if (detail != null) {
      sb.append(' ').append(detail);
    }
    return sb.toString();
  }

  private static @Nullable String detail(Node n) {
    switch (n.getKind()) {
      case BINARY:
        return ((Binary) n).getOp().getSymbol();
      case UNARY:
        return ((Unary) n).getOp().getSymbol();
      case LITERAL_STRING:
        return ((LiteralString) n).getValue();
      case LITERAL_NUMBER:
        return ((LiteralNumber) n).getOriginalString();
      case LITERAL_BOOLEAN:
        return String.valueOf(((LiteralBoolean) n).getValue());
      case VAR:
        return ((Var) n).getId();
      case IMPORT:
        return ((Import) n).getFile().getValue();
      case IMPORT_STR:
        return ((ImportStr) n).getFile().getValue();
      case INDEX:
        return ((Index) n).getId();
      default:
        return null;
    }
  }

  private static String quote(String label) {
    return "\"" + label.replace("\\", "\\\\").replace("\"", "\\\"") + "\"";
  }
}
