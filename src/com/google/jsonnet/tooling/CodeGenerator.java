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
import static com.google.common.base.Preconditions.checkState;

import com.google.jsonnet.ast.Apply;
import com.google.jsonnet.ast.ApplyBrace;
import com.google.jsonnet.ast.ArrayComp;
import com.google.jsonnet.ast.ArrayLiteral;
import com.google.jsonnet.ast.Assert;
import com.google.jsonnet.ast.Binary;
import com.google.jsonnet.ast.CommaSeparatedExpr;
import com.google.jsonnet.ast.Conditional;
import com.google.jsonnet.ast.ErrorExpression;
import com.google.jsonnet.ast.ForSpec;
import com.google.jsonnet.ast.FunctionLiteral;
import com.google.jsonnet.ast.IfSpec;
import com.google.jsonnet.ast.Import;
import com.google.jsonnet.ast.ImportStr;
import com.google.jsonnet.ast.InSuper;
import com.google.jsonnet.ast.Index;
import com.google.jsonnet.ast.LiteralBoolean;
import com.google.jsonnet.ast.LiteralNumber;
import com.google.jsonnet.ast.LiteralString;
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
import com.google.jsonnet.ast.Var;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * CodeGenerator generates code from a raw syntax tree, sending it to the specified CodeConsumer.
 *
 * <p>Output reproduces the source the tree was parsed from: operators, delimiters and literal
 * spellings are kept as recorded, and layout comes from the fodder. The {@code crowded} flag
 * threaded through {@link #add(Node, boolean)} says whether the previous token would run into the
 * next one without a space.
 */
class CodeGenerator {
  private final CodeConsumer cc;
  private final PrinterOptions options;

  CodeGenerator(CodeConsumer consumer, PrinterOptions options) {
    this.cc = checkNotNull(consumer);
    this.options = checkNotNull(options);
  }

  void add(Node n, boolean crowded) {
    // The open fodder of a left-recursive node is printed by its leftmost child.
    if (!n.getKind().isLeftRecursive()) {
      cc.fill(n.getOpenFodder(), crowded, true);
    }

    switch (n.getKind()) {
      case APPLY:
        addApply((Apply) n, crowded);
        break;

      case APPLY_BRACE:
        add(((ApplyBrace) n).getLeft(), crowded);
        add(((ApplyBrace) n).getRight(), true);
        break;

      case ARRAY:
        {
          ArrayLiteral array = (ArrayLiteral) n;
          cc.append("[");
          boolean first = true;
          for (CommaSeparatedExpr element : array.getElements()) {
            if (!first) {
              cc.append(",");
            }
            add(element.getExpr(), !first || options.getPadArrays());
            cc.fill(element.getCommaFodder(), false, false);
            first = false;
          }
          if (array.hasTrailingComma()) {
            cc.append(",");
          }
          cc.fill(array.getCloseFodder(), !array.getElements().isEmpty(), options.getPadArrays());
          cc.append("]");
          break;
        }

      case ARRAY_COMP:
        {
          ArrayComp comp = (ArrayComp) n;
          cc.append("[");
          add(comp.getBody(), options.getPadArrays());
          cc.fill(comp.getTrailingCommaFodder(), false, false);
          if (comp.hasTrailingComma()) {
            cc.append(",");
          }
          addSpecs(comp.getSpec());
          cc.fill(comp.getCloseFodder(), true, options.getPadArrays());
          cc.append("]");
          break;
        }

      case ASSERT:
        {
          Assert assertion = (Assert) n;
          cc.append("assert");
          add(assertion.getCond(), true);
          if (assertion.getMessage() != null) {
            cc.fill(assertion.getColonFodder(), true, true);
            cc.append(":");
            add(assertion.getMessage(), true);
          }
          cc.fill(assertion.getSemicolonFodder(), false, false);
          cc.append(";");
          add(assertion.getRest(), true);
          break;
        }

      case BINARY:
        {
          Binary binary = (Binary) n;
          add(binary.getLeft(), crowded);
          cc.fill(binary.getOpFodder(), true, true);
          cc.append(binary.getOp().getSymbol());
          add(binary.getRight(), true);
          break;
        }

      case CONDITIONAL:
        {
          Conditional conditional = (Conditional) n;
          cc.append("if");
          add(conditional.getCond(), true);
          cc.fill(conditional.getThenFodder(), true, true);
          cc.append("then");
          add(conditional.getBranchTrue(), true);
          if (conditional.getBranchFalse() != null) {
            cc.fill(conditional.getElseFodder(), true, true);
            cc.append("else");
            add(conditional.getBranchFalse(), true);
          }
          break;
        }

      case DOLLAR:
        cc.append("$");
        break;

      case ERROR:
        cc.append("error");
        add(((ErrorExpression) n).getExpr(), true);
        break;

      case FUNCTION:
        cc.append("function");
        addParams(((FunctionLiteral) n).getParams());
        add(((FunctionLiteral) n).getBody(), true);
        break;

      case IMPORT:
        cc.append("import");
        add(((Import) n).getFile(), true);
        break;

      case IMPORT_STR:
        cc.append("importstr");
        add(((ImportStr) n).getFile(), true);
        break;

      case INDEX:
        {
          Index index = (Index) n;
          add(index.getTarget(), crowded);
          cc.fill(index.getLeftBracketFodder(), false, false);
          if (index.getId() != null) {
            cc.append(".");
            cc.fill(index.getRightBracketFodder(), false, false);
            cc.append(index.getId());
          } else {
            cc.append("[");
            add(index.getIndex(), false);
            cc.fill(index.getRightBracketFodder(), false, false);
            cc.append("]");
          }
          break;
        }

      case SLICE:
        {
          Slice slice = (Slice) n;
          add(slice.getTarget(), crowded);
          cc.fill(slice.getLeftBracketFodder(), false, false);
          cc.append("[");
          if (slice.getBeginIndex() != null) {
            add(slice.getBeginIndex(), false);
          }
          cc.fill(slice.getEndColonFodder(), false, false);
          cc.append(":");
          if (slice.getEndIndex() != null) {
            add(slice.getEndIndex(), false);
          }
          if (slice.getStep() != null || !slice.getStepColonFodder().isEmpty()) {
            cc.fill(slice.getStepColonFodder(), false, false);
            cc.append(":");
            if (slice.getStep() != null) {
              add(slice.getStep(), false);
            }
          }
          cc.fill(slice.getRightBracketFodder(), false, false);
          cc.append("]");
          break;
        }

      case IN_SUPER:
        {
          InSuper inSuper = (InSuper) n;
          add(inSuper.getIndex(), true);
          cc.fill(inSuper.getInFodder(), true, true);
          cc.append("in");
          cc.fill(inSuper.getSuperFodder(), true, true);
          cc.append("super");
          break;
        }

      case LOCAL:
        {
          Local local = (Local) n;
          cc.append("local");
          checkState(!local.getBinds().isEmpty(), "INTERNAL ERROR: local with no binds");
          boolean first = true;
          for (LocalBind bind : local.getBinds()) {
            if (!first) {
              cc.append(",");
            }
            first = false;
            cc.fill(bind.getVarFodder(), true, true);
            cc.append(bind.getVariable());
            if (bind.getParams() != null) {
              addParams(bind.getParams());
            }
            cc.fill(bind.getEqFodder(), true, true);
            cc.append("=");
            add(bind.getBody(), true);
            cc.fill(bind.getCloseFodder(), false, false);
          }
          cc.append(";");
          add(local.getBody(), true);
          break;
        }

      case LITERAL_BOOLEAN:
        cc.append(((LiteralBoolean) n).getValue() ? "true" : "false");
        break;

      case LITERAL_NUMBER:
        cc.append(((LiteralNumber) n).getOriginalString());
        break;

      case LITERAL_STRING:
        addString((LiteralString) n);
        break;

      case LITERAL_NULL:
        cc.append("null");
        break;

      case OBJECT:
        {
          ObjectLiteral object = (ObjectLiteral) n;
          cc.append("{");
          addFields(object.getFields(), options.getPadObjects());
          if (object.hasTrailingComma()) {
            cc.append(",");
          }
          cc.fill(object.getCloseFodder(), !object.getFields().isEmpty(), options.getPadObjects());
          cc.append("}");
          break;
        }

      case OBJECT_COMP:
        {
          ObjectComp comp = (ObjectComp) n;
          cc.append("{");
          addFields(comp.getFields(), options.getPadObjects());
          if (comp.hasTrailingComma()) {
            cc.append(",");
          }
          addSpecs(comp.getSpec());
          cc.fill(comp.getCloseFodder(), true, options.getPadObjects());
          cc.append("}");
          break;
        }

      case PARENS:
        cc.append("(");
        add(((Parens) n).getInner(), false);
        cc.fill(((Parens) n).getCloseFodder(), false, false);
        cc.append(")");
        break;

      case SELF:
        cc.append("self");
        break;

      case SUPER_INDEX:
        {
          SuperIndex superIndex = (SuperIndex) n;
          cc.append("super");
          cc.fill(superIndex.getDotFodder(), false, false);
          if (superIndex.getId() != null) {
            cc.append(".");
            cc.fill(superIndex.getIdFodder(), false, false);
            cc.append(superIndex.getId());
          } else {
            cc.append("[");
            add(superIndex.getIndex(), false);
            cc.fill(superIndex.getIdFodder(), false, false);
            cc.append("]");
          }
          break;
        }

      case VAR:
        cc.append(((Var) n).getId());
        break;

      case UNARY:
        cc.append(((Unary) n).getOp().getSymbol());
        add(((Unary) n).getExpr(), false);
        break;

      default:
        throw new IllegalStateException("INTERNAL ERROR: Unknown AST: " + n);
    }
  }

  private void addApply(Apply apply, boolean crowded) {
    add(apply.getTarget(), crowded);
    cc.fill(apply.getFodderLeft(), false, false);
    cc.append("(");
    boolean first = true;
    for (CommaSeparatedExpr arg : apply.getArguments().getPositional()) {
      if (!first) {
        cc.append(",");
      }
      add(arg.getExpr(), !first);
      cc.fill(arg.getCommaFodder(), false, false);
      first = false;
    }
    for (NamedArgument arg : apply.getArguments().getNamed()) {
      if (!first) {
        cc.append(",");
      }
      cc.fill(arg.getNameFodder(), !first, true);
      cc.append(arg.getName());
      cc.fill(arg.getEqFodder(), false, false);
      cc.append("=");
      add(arg.getArg(), false);
      cc.fill(arg.getCommaFodder(), false, false);
      first = false;
    }
    if (apply.hasTrailingComma()) {
      cc.append(",");
    }
    cc.fill(apply.getFodderRight(), false, false);
    cc.append(")");
    if (apply.isTailStrict()) {
      cc.fill(apply.getTailStrictFodder(), true, true);
      cc.append("tailstrict");
    }
  }

  private void addString(LiteralString literal) {
    String value = literal.getValue();
    switch (literal.getStringKind()) {
      case DOUBLE:
        // Escapes are still in the value as written.
        cc.append("\"");
        cc.append(value);
        cc.append("\"");
        break;
      case SINGLE:
        cc.append("'");
        cc.append(value);
        cc.append("'");
        break;
      case BLOCK:
        {
          // Output always uses \n line endings.
          String text = value.replace("\r", "");
          cc.append("|||\n");
          if (!text.isEmpty() && text.charAt(0) != '\n') {
            cc.append(literal.getBlockIndent());
          }
          for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            cc.append(String.valueOf(c));
            if (c == '\n' && i + 1 < text.length() && text.charAt(i + 1) != '\n') {
              cc.append(literal.getBlockIndent());
            }
          }
          cc.append(literal.getBlockTermIndent());
          cc.append("|||");
          break;
        }
      case VERBATIM_DOUBLE:
        cc.append("@\"");
        cc.append(value.replace("\"", "\"\""));
        cc.append("\"");
        break;
      case VERBATIM_SINGLE:
        cc.append("@'");
        cc.append(value.replace("'", "''"));
        cc.append("'");
        break;
    }
  }

  private void addSpecs(ForSpec spec) {
    if (spec.getOuter() != null) {
      addSpecs(spec.getOuter());
    }
    cc.fill(spec.getForFodder(), true, true);
    cc.append("for");
    cc.fill(spec.getVarFodder(), true, true);
    cc.append(spec.getVarName());
    cc.fill(spec.getInFodder(), true, true);
    cc.append("in");
    add(spec.getExpr(), true);
    for (IfSpec condition : spec.getConditions()) {
      cc.fill(condition.getIfFodder(), true, true);
      cc.append("if");
      add(condition.getExpr(), true);
    }
  }

  private void addParams(ParameterList params) {
    cc.fill(params.getParenLeftFodder(), false, false);
    cc.append("(");
    boolean first = true;
    for (Parameter param : params.getParameters()) {
      if (!first) {
        cc.append(",");
      }
      cc.fill(param.getNameFodder(), !first, true);
      cc.append(param.getName());
      if (param.getDefaultArg() != null) {
        cc.fill(param.getEqFodder(), false, false);
        cc.append("=");
        add(param.getDefaultArg(), false);
      }
      cc.fill(param.getCommaFodder(), false, false);
      first = false;
    }
    if (params.hasTrailingComma()) {
      cc.append(",");
    }
    cc.fill(params.getParenRightFodder(), false, false);
    cc.append(")");
  }

  private void addFieldParams(ObjectField field) {
    if (field.getParams() != null) {
      addParams(field.getParams());
    }
  }

  private void addFields(List<ObjectField> fields, boolean crowded) {
    boolean first = true;
    for (ObjectField field : fields) {
      if (!first) {
        cc.append(",");
      }
      boolean crowdedField = !first || crowded;

      switch (field.getKind()) {
        case LOCAL:
          cc.fill(field.getFodder1(), crowdedField, true);
          cc.append("local");
          cc.fill(field.getFodder2(), true, true);
          cc.append(field.getId());
          addFieldParams(field);
          cc.fill(field.getOpFodder(), true, true);
          cc.append("=");
          add(field.getBody(), true);
          break;

        case FIELD_ID:
          cc.fill(field.getFodder1(), crowdedField, true);
          cc.append(field.getId());
          addFieldRemainder(field);
          break;

        case FIELD_STR:
          add(field.getNameExpr(), crowdedField);
          addFieldRemainder(field);
          break;

        case FIELD_EXPR:
          cc.fill(field.getFodder1(), crowdedField, true);
          cc.append("[");
          add(field.getNameExpr(), false);
          cc.fill(field.getFodder2(), false, false);
          cc.append("]");
          addFieldRemainder(field);
          break;

        case ASSERT:
          cc.fill(field.getFodder1(), crowdedField, true);
          cc.append("assert");
          add(field.getCondition(), true);
          @Nullable Node message = field.getMessage();
          if (message != null) {
            cc.fill(field.getOpFodder(), true, true);
            cc.append(":");
            add(message, true);
          }
          break;
      }

      first = false;
      cc.fill(field.getCommaFodder(), false, false);
    }
  }

  /** Parameters, visibility marker and value, shared by the three kinds of field. */
  private void addFieldRemainder(ObjectField field) {
    addFieldParams(field);
    cc.fill(field.getOpFodder(), false, false);
    if (field.isSuperSugar()) {
      cc.append("+");
    }
    cc.append(field.getVisibility().getMarker());
    add(field.getBody(), true);
  }
}
