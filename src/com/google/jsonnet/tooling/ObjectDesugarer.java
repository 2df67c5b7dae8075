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

import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ImmutableList;
import com.google.jsonnet.ast.Conditional;
import com.google.jsonnet.ast.DesugaredField;
import com.google.jsonnet.ast.DesugaredObject;
import com.google.jsonnet.ast.ErrorExpression;
import com.google.jsonnet.ast.Fodder;
import com.google.jsonnet.ast.FunctionLiteral;
import com.google.jsonnet.ast.Kind;
import com.google.jsonnet.ast.LiteralNull;
import com.google.jsonnet.ast.LiteralString;
import com.google.jsonnet.ast.LocalBind;
import com.google.jsonnet.ast.Node;
import com.google.jsonnet.ast.ObjectField;
import com.google.jsonnet.ast.ObjectLiteral;
import com.google.jsonnet.ast.ParameterList;
import com.google.jsonnet.ast.StringKind;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.jspecify.annotations.Nullable;

/**
 * Lowers the object literals of a raw tree to {@link DesugaredObject}s.
 *
 * <ul>
 *   <li>{@code a: e} and {@code "a": e} become a field named by the string literal {@code "a"}.
 *       Escape sequences in quoted names are decoded.
 *   <li>{@code [e1]: e2} keeps {@code e1} as the name.
 *   <li>{@code f(x): e} becomes a field whose body is {@code function(x) e}; object locals are
 *       treated the same way.
 *   <li>{@code assert c : m} becomes {@code if c then null else error m}.
 * </ul>
 *
 * All other nodes are copied with their children lowered.
 */
public final class ObjectDesugarer extends NodeRewriter {
  private static final Logger logger = Logger.getLogger(ObjectDesugarer.class.getName());

  static final String DEFAULT_ASSERT_MESSAGE = "Object assertion failed.";

  private int loweredCount;

  public ObjectDesugarer() {
    this(NodeTraversal.DEFAULT_MAX_DEPTH);
  }

  public ObjectDesugarer(int maxDepth) {
    super(maxDepth);
  }

  /** Returns a lowered copy of {@code root}. */
  public Node desugar(Node root) throws TraversalException {
    loweredCount = 0;
    Node result = rewriteRoot(root);
    if (logger.isLoggable(Level.FINE)) {
      logger.fine("Lowered " + loweredCount + " objects");
    }
    return result;
  }

  @Override
  protected @Nullable Node replace(Node n) throws TraversalException {
    if (n.getKind() != Kind.OBJECT) {
      return null;
    }
    loweredCount++;
    ObjectLiteral object = (ObjectLiteral) n;
    ImmutableList.Builder<LocalBind> locals = ImmutableList.builder();
    ImmutableList.Builder<DesugaredField> fields = ImmutableList.builder();
    ImmutableList.Builder<Node> asserts = ImmutableList.builder();
    for (ObjectField member : object.getFields()) {
      switch (member.getKind()) {
        case LOCAL:
          locals.add(
              new LocalBind(
                  Fodder.EMPTY,
                  member.getId(),
                  null,
                  Fodder.EMPTY,
                  lowerBody(member),
                  Fodder.EMPTY,
                  member.getLocation()));
          break;
        case FIELD_ID:
          fields.add(
              new DesugaredField(
                  member.getVisibility(),
                  new LiteralString(null, Fodder.EMPTY, member.getId(), StringKind.DOUBLE),
                  lowerBody(member),
                  member.isSuperSugar(),
                  member.getLocation()));
          break;
        case FIELD_STR:
          fields.add(
              new DesugaredField(
                  member.getVisibility(),
                  lowerName((LiteralString) member.getNameExpr()),
                  lowerBody(member),
                  member.isSuperSugar(),
                  member.getLocation()));
          break;
        case FIELD_EXPR:
          fields.add(
              new DesugaredField(
                  member.getVisibility(),
                  rewrite(member.getNameExpr()),
                  lowerBody(member),
                  member.isSuperSugar(),
                  member.getLocation()));
          break;
        case ASSERT:
          asserts.add(lowerAssert(member));
          break;
      }
    }
    return new DesugaredObject(
        n.getLocation(), n.getOpenFodder(), locals.build(), fields.build(), asserts.build());
  }

  /** Quoted names hold their escape sequences as written; lowered names hold the decoded text. */
  private static LiteralString lowerName(LiteralString name) {
    StringKind kind = name.getStringKind();
    if (kind != StringKind.SINGLE && kind != StringKind.DOUBLE) {
      return name;
    }
    return new LiteralString(
        name.getLocation(), name.getOpenFodder(), unescape(name.getValue()), StringKind.DOUBLE);
  }

  @VisibleForTesting
  static String unescape(String value) {
    StringBuilder sb = new StringBuilder(value.length());
    for (int i = 0; i < value.length(); i++) {
      char c = value.charAt(i);
      if (c != '\\') {
        sb.append(c);
        continue;
      }
      checkArgument(i + 1 < value.length(), "Truncated escape sequence in %s", value);
      char e = value.charAt(++i);
      switch (e) {
        case '"':
        case '\'':
        case '\\':
        case '/':
          sb.append(e);
          break;
        case 'b':
          sb.append('\b');
          break;
        case 'f':
          sb.append('\f');
          break;
        case 'n':
          sb.append('\n');
          break;
        case 'r':
          sb.append('\r');
          break;
        case 't':
          sb.append('\t');
          break;
        case 'u':
          checkArgument(i + 4 < value.length(), "Truncated unicode escape in %s", value);
          try {
            sb.append((char) Integer.parseInt(value.substring(i + 1, i + 5), 16));
          } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("Bad unicode escape in " + value, ex);
          }
          i += 4;
          break;
        default:
          throw new IllegalArgumentException("Unknown escape sequence \\" + e + " in " + value);
      }
    }
    return sb.toString();
  }

  private Node lowerBody(ObjectField member) throws TraversalException {
    Node body = rewrite(member.getBody());
    ParameterList params = member.getParams();
    if (params == null) {
      return body;
    }
    return new FunctionLiteral(member.getLocation(), Fodder.EMPTY, rewriteParams(params), body);
  }

  private Node lowerAssert(ObjectField member) throws TraversalException {
    Node message = member.getMessage();
    Node loweredMessage =
        message != null
            ? rewrite(message)
            : new LiteralString(null, Fodder.EMPTY, DEFAULT_ASSERT_MESSAGE, StringKind.DOUBLE);
    return new Conditional(
        member.getLocation(),
        Fodder.EMPTY,
        rewrite(member.getCondition()),
        Fodder.EMPTY,
        new LiteralNull(null, Fodder.EMPTY),
        Fodder.EMPTY,
        new ErrorExpression(null, Fodder.EMPTY, loweredMessage));
  }
}
