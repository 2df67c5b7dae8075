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

import com.google.common.collect.ImmutableList;
import com.google.jsonnet.ast.Apply;
import com.google.jsonnet.ast.ApplyBrace;
import com.google.jsonnet.ast.ArrayComp;
import com.google.jsonnet.ast.ArrayLiteral;
import com.google.jsonnet.ast.Assert;
import com.google.jsonnet.ast.Binary;
import com.google.jsonnet.ast.CommaSeparatedExpr;
import com.google.jsonnet.ast.Conditional;
import com.google.jsonnet.ast.DesugaredField;
import com.google.jsonnet.ast.DesugaredObject;
import com.google.jsonnet.ast.ErrorExpression;
import com.google.jsonnet.ast.ForSpec;
import com.google.jsonnet.ast.FunctionLiteral;
import com.google.jsonnet.ast.IfSpec;
import com.google.jsonnet.ast.InSuper;
import com.google.jsonnet.ast.Index;
import com.google.jsonnet.ast.Local;
import com.google.jsonnet.ast.LocalBind;
import com.google.jsonnet.ast.NamedArgument;
import com.google.jsonnet.ast.Node;
import com.google.jsonnet.ast.ObjectComp;
import com.google.jsonnet.ast.ObjectField;
import com.google.jsonnet.ast.ObjectLiteral;
import com.google.jsonnet.ast.Parameter;
import com.google.jsonnet.ast.ParameterList;
import com.google.jsonnet.ast.Parens;
import com.google.jsonnet.ast.Slice;
import com.google.jsonnet.ast.SuperIndex;
import com.google.jsonnet.ast.Unary;
import org.jspecify.annotations.Nullable;

/**
 * Lists the child expressions of a node, for raw and lowered trees alike.
 *
 * <p>Children come in left-to-right source order. Objects are the exception: for a raw object the
 * bodies of its locals come first, followed by the names, parameters and values of the remaining
 * members in source order. A lowered object lists its literal field names first (its direct
 * children), then its special children: each field's computed name and body, the bodies of its
 * locals and its assertions.
 */
public final class NodeChildren {

  private NodeChildren() {}

  public static ImmutableList<Node> children(Node n) {
    ImmutableList.Builder<Node> result = ImmutableList.builder();
    switch (n.getKind()) {
      case APPLY:
        {
          Apply apply = (Apply) n;
          result.add(apply.getTarget());
          for (CommaSeparatedExpr arg : apply.getArguments().getPositional()) {
            result.add(arg.getExpr());
          }
          for (NamedArgument arg : apply.getArguments().getNamed()) {
            result.add(arg.getArg());
          }
          break;
        }
      case APPLY_BRACE:
        result.add(((ApplyBrace) n).getLeft(), ((ApplyBrace) n).getRight());
        break;
      case ARRAY:
        for (CommaSeparatedExpr element : ((ArrayLiteral) n).getElements()) {
          result.add(element.getExpr());
        }
        break;
      case ARRAY_COMP:
        result.add(((ArrayComp) n).getBody());
        addSpecs(result, ((ArrayComp) n).getSpec());
        break;
      case ASSERT:
        {
          Assert assertion = (Assert) n;
          result.add(assertion.getCond());
          addIfPresent(result, assertion.getMessage());
          result.add(assertion.getRest());
          break;
        }
      case BINARY:
        result.add(((Binary) n).getLeft(), ((Binary) n).getRight());
        break;
      case CONDITIONAL:
        {
          Conditional conditional = (Conditional) n;
          result.add(conditional.getCond(), conditional.getBranchTrue());
          addIfPresent(result, conditional.getBranchFalse());
          break;
        }
      case DESUGARED_OBJECT:
        result.addAll(directChildren((DesugaredObject) n));
        result.addAll(specialChildren((DesugaredObject) n));
        break;
      case ERROR:
        result.add(((ErrorExpression) n).getExpr());
        break;
      case FUNCTION:
        addDefaults(result, ((FunctionLiteral) n).getParams());
        result.add(((FunctionLiteral) n).getBody());
        break;
      case INDEX:
        result.add(((Index) n).getTarget());
        addIfPresent(result, ((Index) n).getIndex());
        break;
      case IN_SUPER:
        result.add(((InSuper) n).getIndex());
        break;
      case LOCAL:
        for (LocalBind bind : ((Local) n).getBinds()) {
          addBind(result, bind);
        }
        result.add(((Local) n).getBody());
        break;
      case OBJECT:
        addMembers(result, ((ObjectLiteral) n).getFields());
        break;
      case OBJECT_COMP:
        addMembers(result, ((ObjectComp) n).getFields());
        addSpecs(result, ((ObjectComp) n).getSpec());
        break;
      case PARENS:
        result.add(((Parens) n).getInner());
        break;
      case SLICE:
        {
          Slice slice = (Slice) n;
          result.add(slice.getTarget());
          addIfPresent(result, slice.getBeginIndex());
          addIfPresent(result, slice.getEndIndex());
          addIfPresent(result, slice.getStep());
          break;
        }
      case SUPER_INDEX:
        addIfPresent(result, ((SuperIndex) n).getIndex());
        break;
      case UNARY:
        result.add(((Unary) n).getExpr());
        break;
      case DOLLAR:
      case IMPORT:
      case IMPORT_STR:
      case LITERAL_BOOLEAN:
      case LITERAL_NULL:
      case LITERAL_NUMBER:
      case LITERAL_STRING:
      case SELF:
      case VAR:
        break;
      default:
        throw new IllegalStateException("INTERNAL ERROR: Unknown AST: " + n);
    }
    return result.build();
  }

  /** The literal field names of a lowered object. These are the nodes that name symbols. */
  public static ImmutableList<Node> directChildren(DesugaredObject object) {
    ImmutableList.Builder<Node> result = ImmutableList.builder();
    for (DesugaredField field : object.getFields()) {
      if (field.getName().isLiteralString()) {
        result.add(field.getName());
      }
    }
    return result.build();
  }

  /**
   * Children of a lowered object that are not symbols themselves but may contain symbols: computed
   * field names, field bodies, local bodies and assertions.
   */
  public static ImmutableList<Node> specialChildren(DesugaredObject object) {
    ImmutableList.Builder<Node> result = ImmutableList.builder();
    for (DesugaredField field : object.getFields()) {
      if (!field.getName().isLiteralString()) {
        result.add(field.getName());
      }
      result.add(field.getBody());
    }
    for (LocalBind bind : object.getLocals()) {
      addBind(result, bind);
    }
    result.addAll(object.getAsserts());
    return result.build();
  }

  /** Default arguments of a binding's parameters, followed by its body. */
  static ImmutableList<Node> bindChildren(LocalBind bind) {
    ImmutableList.Builder<Node> result = ImmutableList.builder();
    addBind(result, bind);
    return result.build();
  }

  private static void addMembers(
      ImmutableList.Builder<Node> result, ImmutableList<ObjectField> members) {
    for (ObjectField member : members) {
      if (member.getKind() == ObjectField.Kind.LOCAL) {
        addDefaults(result, member.getParams());
        result.add(member.getBody());
      }
    }
    for (ObjectField member : members) {
      switch (member.getKind()) {
        case LOCAL:
          break;
        case ASSERT:
          result.add(member.getCondition());
          addIfPresent(result, member.getMessage());
          break;
        case FIELD_ID:
        case FIELD_STR:
        case FIELD_EXPR:
          addIfPresent(result, member.getNameExpr());
          addDefaults(result, member.getParams());
          result.add(member.getBody());
          break;
      }
    }
  }

  private static void addBind(ImmutableList.Builder<Node> result, LocalBind bind) {
    addDefaults(result, bind.getParams());
    result.add(bind.getBody());
  }

  private static void addDefaults(
      ImmutableList.Builder<Node> result, @Nullable ParameterList params) {
    if (params == null) {
      return;
    }
    for (Parameter param : params.getParameters()) {
      addIfPresent(result, param.getDefaultArg());
    }
  }

  private static void addSpecs(ImmutableList.Builder<Node> result, ForSpec innermost) {
    for (ForSpec spec : innermost.inSourceOrder()) {
      result.add(spec.getExpr());
      for (IfSpec condition : spec.getConditions()) {
        result.add(condition.getExpr());
      }
    }
  }

  private static void addIfPresent(ImmutableList.Builder<Node> result, @Nullable Node n) {
    if (n != null) {
      result.add(n);
    }
  }
}
