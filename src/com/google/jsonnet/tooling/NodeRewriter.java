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

import com.google.common.collect.ImmutableList;
import com.google.jsonnet.ast.Apply;
import com.google.jsonnet.ast.ApplyBrace;
import com.google.jsonnet.ast.Arguments;
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
import com.google.jsonnet.tooling.TraversalException.Phase;
import java.util.logging.Logger;
import org.jspecify.annotations.Nullable;

/**
 * Base class for passes that produce a new tree from an old one. The input tree is never modified:
 * every node on the path to a replacement is copied, with its fodder and location kept. Subtrees
 * without replacements may be shared between the two trees.
 *
 * <p>Subclasses decide what to replace by overriding {@link #replace}.
 */
public abstract class NodeRewriter {
  private static final Logger logger = Logger.getLogger(NodeRewriter.class.getName());

  private final int maxDepth;
  private int depth;

  protected NodeRewriter(int maxDepth) {
    checkArgument(maxDepth > 0, "maxDepth must be positive: %s", maxDepth);
    this.maxDepth = maxDepth;
  }

  /**
   * Returns the node to use in place of {@code n}, or null to keep {@code n} and rewrite its
   * children. Implementations that want the children of their replacement rewritten call {@link
   * #rewrite} on it themselves.
   */
  protected abstract @Nullable Node replace(Node n) throws TraversalException;

  /** Returns the rewritten form of the tree rooted at {@code root}. */
  public final Node rewriteRoot(Node root) throws TraversalException {
    depth = 0;
    try {
      return rewrite(root);
    } catch (StackOverflowError e) {
      logger.warning("Rewrite ran out of stack at depth " + depth);
      throw new TraversalException(Phase.PRE, root.getLocation(), "tree too deep to rewrite");
    }
  }

  protected final Node rewrite(Node n) throws TraversalException {
    if (depth >= maxDepth) {
      logger.warning("Rewrite aborted: depth limit " + maxDepth + " exceeded");
      throw new TraversalException(
          Phase.PRE, n.getLocation(), "maximum traversal depth " + maxDepth + " exceeded");
    }
    depth++;
    try {
      Node replacement = replace(n);
      return replacement != null ? replacement : rewriteChildren(n);
    } finally {
      depth--;
    }
  }

  private @Nullable Node rewriteOrNull(@Nullable Node n) throws TraversalException {
    return n == null ? null : rewrite(n);
  }

  /** Copies {@code n} with every child rewritten. Leaves are returned as they are. */
  protected final Node rewriteChildren(Node n) throws TraversalException {
    switch (n.getKind()) {
      case APPLY:
        {
          Apply apply = (Apply) n;
          Node target = rewrite(apply.getTarget());
          ImmutableList.Builder<CommaSeparatedExpr> positional = ImmutableList.builder();
          for (CommaSeparatedExpr arg : apply.getArguments().getPositional()) {
            positional.add(new CommaSeparatedExpr(rewrite(arg.getExpr()), arg.getCommaFodder()));
          }
          ImmutableList.Builder<NamedArgument> named = ImmutableList.builder();
          for (NamedArgument arg : apply.getArguments().getNamed()) {
            named.add(
                new NamedArgument(
                    arg.getNameFodder(),
                    arg.getName(),
                    arg.getEqFodder(),
                    rewrite(arg.getArg()),
                    arg.getCommaFodder()));
          }
          return new Apply(
              n.getLocation(),
              n.getOpenFodder(),
              target,
              apply.getFodderLeft(),
              new Arguments(positional.build(), named.build()),
              apply.hasTrailingComma(),
              apply.getFodderRight(),
              apply.getTailStrictFodder(),
              apply.isTailStrict());
        }

      case APPLY_BRACE:
        return new ApplyBrace(
            n.getLocation(),
            n.getOpenFodder(),
            rewrite(((ApplyBrace) n).getLeft()),
            rewrite(((ApplyBrace) n).getRight()));

      case ARRAY:
        {
          ArrayLiteral array = (ArrayLiteral) n;
          ImmutableList.Builder<CommaSeparatedExpr> elements = ImmutableList.builder();
          for (CommaSeparatedExpr element : array.getElements()) {
            elements.add(
                new CommaSeparatedExpr(rewrite(element.getExpr()), element.getCommaFodder()));
          }
          return new ArrayLiteral(
              n.getLocation(),
              n.getOpenFodder(),
              elements.build(),
              array.hasTrailingComma(),
              array.getCloseFodder());
        }

      case ARRAY_COMP:
        {
          ArrayComp comp = (ArrayComp) n;
          return new ArrayComp(
              n.getLocation(),
              n.getOpenFodder(),
              rewrite(comp.getBody()),
              comp.getTrailingCommaFodder(),
              comp.hasTrailingComma(),
              rewriteSpec(comp.getSpec()),
              comp.getCloseFodder());
        }

      case ASSERT:
        {
          Assert assertion = (Assert) n;
          return new Assert(
              n.getLocation(),
              n.getOpenFodder(),
              rewrite(assertion.getCond()),
              assertion.getColonFodder(),
              rewriteOrNull(assertion.getMessage()),
              assertion.getSemicolonFodder(),
              rewrite(assertion.getRest()));
        }

      case BINARY:
        {
          Binary binary = (Binary) n;
          return new Binary(
              n.getLocation(),
              n.getOpenFodder(),
              rewrite(binary.getLeft()),
              binary.getOpFodder(),
              binary.getOp(),
              rewrite(binary.getRight()));
        }

      case CONDITIONAL:
        {
          Conditional conditional = (Conditional) n;
          return new Conditional(
              n.getLocation(),
              n.getOpenFodder(),
              rewrite(conditional.getCond()),
              conditional.getThenFodder(),
              rewrite(conditional.getBranchTrue()),
              conditional.getElseFodder(),
              rewriteOrNull(conditional.getBranchFalse()));
        }

      case DESUGARED_OBJECT:
        {
          DesugaredObject object = (DesugaredObject) n;
          ImmutableList.Builder<LocalBind> locals = ImmutableList.builder();
          for (LocalBind local : object.getLocals()) {
            locals.add(rewriteBind(local));
          }
          ImmutableList.Builder<DesugaredField> fields = ImmutableList.builder();
          for (DesugaredField field : object.getFields()) {
            fields.add(field.withChildren(rewrite(field.getName()), rewrite(field.getBody())));
          }
          ImmutableList.Builder<Node> asserts = ImmutableList.builder();
          for (Node assertion : object.getAsserts()) {
            asserts.add(rewrite(assertion));
          }
          return new DesugaredObject(
              n.getLocation(), n.getOpenFodder(), locals.build(), fields.build(), asserts.build());
        }

      case ERROR:
        return new ErrorExpression(
            n.getLocation(), n.getOpenFodder(), rewrite(((ErrorExpression) n).getExpr()));

      case FUNCTION:
        return new FunctionLiteral(
            n.getLocation(),
            n.getOpenFodder(),
            rewriteParams(((FunctionLiteral) n).getParams()),
            rewrite(((FunctionLiteral) n).getBody()));

      case INDEX:
        {
          Index index = (Index) n;
          return new Index(
              n.getLocation(),
              n.getOpenFodder(),
              rewrite(index.getTarget()),
              index.getLeftBracketFodder(),
              rewriteOrNull(index.getIndex()),
              index.getRightBracketFodder(),
              index.getId());
        }

      case IN_SUPER:
        {
          InSuper inSuper = (InSuper) n;
          return new InSuper(
              n.getLocation(),
              n.getOpenFodder(),
              rewrite(inSuper.getIndex()),
              inSuper.getInFodder(),
              inSuper.getSuperFodder());
        }

      case LOCAL:
        {
          Local local = (Local) n;
          ImmutableList.Builder<LocalBind> binds = ImmutableList.builder();
          for (LocalBind bind : local.getBinds()) {
            binds.add(rewriteBind(bind));
          }
          return new Local(
              n.getLocation(), n.getOpenFodder(), binds.build(), rewrite(local.getBody()));
        }

      case OBJECT:
        {
          ObjectLiteral object = (ObjectLiteral) n;
          return new ObjectLiteral(
              n.getLocation(),
              n.getOpenFodder(),
              rewriteFields(object.getFields()),
              object.hasTrailingComma(),
              object.getCloseFodder());
        }

      case OBJECT_COMP:
        {
          ObjectComp comp = (ObjectComp) n;
          return new ObjectComp(
              n.getLocation(),
              n.getOpenFodder(),
              rewriteFields(comp.getFields()),
              comp.hasTrailingComma(),
              rewriteSpec(comp.getSpec()),
              comp.getCloseFodder());
        }

      case PARENS:
        return new Parens(
            n.getLocation(),
            n.getOpenFodder(),
            rewrite(((Parens) n).getInner()),
            ((Parens) n).getCloseFodder());

      case SLICE:
        {
          Slice slice = (Slice) n;
          return new Slice(
              n.getLocation(),
              n.getOpenFodder(),
              rewrite(slice.getTarget()),
              slice.getLeftBracketFodder(),
              rewriteOrNull(slice.getBeginIndex()),
              slice.getEndColonFodder(),
              rewriteOrNull(slice.getEndIndex()),
              slice.getStepColonFodder(),
              rewriteOrNull(slice.getStep()),
              slice.getRightBracketFodder());
        }

      case SUPER_INDEX:
        {
          SuperIndex superIndex = (SuperIndex) n;
          return new SuperIndex(
              n.getLocation(),
              n.getOpenFodder(),
              superIndex.getDotFodder(),
              rewriteOrNull(superIndex.getIndex()),
              superIndex.getIdFodder(),
              superIndex.getId());
        }

      case UNARY:
        return new Unary(
            n.getLocation(),
            n.getOpenFodder(),
            ((Unary) n).getOp(),
            rewrite(((Unary) n).getExpr()));

      case DOLLAR:
      case IMPORT:
      case IMPORT_STR:
      case LITERAL_BOOLEAN:
      case LITERAL_NULL:
      case LITERAL_NUMBER:
      case LITERAL_STRING:
      case SELF:
      case VAR:
        return n;

      default:
        throw new IllegalStateException("INTERNAL ERROR: Unknown AST: " + n);
    }
  }

  protected final LocalBind rewriteBind(LocalBind bind) throws TraversalException {
    return bind.withBody(rewriteParamsOrNull(bind.getParams()), rewrite(bind.getBody()));
  }

  protected final ParameterList rewriteParams(ParameterList params) throws TraversalException {
    ImmutableList.Builder<Parameter> result = ImmutableList.builder();
    for (Parameter param : params.getParameters()) {
      result.add(param.withDefaultArg(rewriteOrNull(param.getDefaultArg())));
    }
    return params.withParameters(result.build());
  }

  protected final @Nullable ParameterList rewriteParamsOrNull(@Nullable ParameterList params)
      throws TraversalException {
    return params == null ? null : rewriteParams(params);
  }

  private ImmutableList<ObjectField> rewriteFields(ImmutableList<ObjectField> fields)
      throws TraversalException {
    ImmutableList.Builder<ObjectField> result = ImmutableList.builder();
    for (ObjectField field : fields) {
      if (field.getKind() == ObjectField.Kind.ASSERT) {
        result.add(
            field.withExprs(
                null, null, rewrite(field.getCondition()), rewriteOrNull(field.getMessage())));
      } else {
        result.add(
            field.withExprs(
                rewriteParamsOrNull(field.getParams()),
                rewriteOrNull(field.getNameExpr()),
                rewrite(field.getBody()),
                null));
      }
    }
    return result.build();
  }

  private ForSpec rewriteSpec(ForSpec spec) throws TraversalException {
    ForSpec outer = spec.getOuter() == null ? null : rewriteSpec(spec.getOuter());
    ImmutableList.Builder<IfSpec> conditions = ImmutableList.builder();
    for (IfSpec condition : spec.getConditions()) {
      conditions.add(new IfSpec(condition.getIfFodder(), rewrite(condition.getExpr())));
    }
    return new ForSpec(
        spec.getForFodder(),
        spec.getVarFodder(),
        spec.getVarName(),
        spec.getInFodder(),
        rewrite(spec.getExpr()),
        conditions.build(),
        outer);
  }
}
