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

package com.google.jsonnet.ast;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.List;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * A tree construction helper. Nodes built here carry no location and no fodder, so printing them
 * yields canonical spacing.
 */
public final class Ast {

  private Ast() {}

  public static Var var(String id) {
    return new Var(null, Fodder.EMPTY, id);
  }

  public static Self self() {
    return new Self(null, Fodder.EMPTY);
  }

  public static Dollar dollar() {
    return new Dollar(null, Fodder.EMPTY);
  }

  public static LiteralNull nullLiteral() {
    return new LiteralNull(null, Fodder.EMPTY);
  }

  public static LiteralBoolean bool(boolean value) {
    return new LiteralBoolean(null, Fodder.EMPTY, value);
  }

  public static LiteralNumber number(String text) {
    return new LiteralNumber(null, Fodder.EMPTY, text);
  }

  /** A double-quoted string. The value must already be escaped. */
  public static LiteralString string(String value) {
    return string(value, StringKind.DOUBLE);
  }

  public static LiteralString string(String value, StringKind kind) {
    checkArgument(kind != StringKind.BLOCK, "use block() for text blocks");
    return new LiteralString(null, Fodder.EMPTY, value, kind);
  }

  public static LiteralString block(String value, String blockIndent, String blockTermIndent) {
    return new LiteralString(
        null, Fodder.EMPTY, value, StringKind.BLOCK, blockIndent, blockTermIndent);
  }

  public static Binary binary(Node left, BinaryOp op, Node right) {
    return new Binary(null, Fodder.EMPTY, left, Fodder.EMPTY, op, right);
  }

  public static Unary unary(UnaryOp op, Node expr) {
    return new Unary(null, Fodder.EMPTY, op, expr);
  }

  public static Apply call(Node target, Node... positional) {
    return call(target, ImmutableList.copyOf(positional), ImmutableMap.of());
  }

  public static Apply call(Node target, List<Node> positional, Map<String, Node> named) {
    ImmutableList.Builder<CommaSeparatedExpr> args = ImmutableList.builder();
    for (Node arg : positional) {
      args.add(CommaSeparatedExpr.of(arg));
    }
    ImmutableList.Builder<NamedArgument> namedArgs = ImmutableList.builder();
    for (Map.Entry<String, Node> arg : named.entrySet()) {
      namedArgs.add(
          new NamedArgument(
              Fodder.EMPTY, arg.getKey(), Fodder.EMPTY, arg.getValue(), Fodder.EMPTY));
    }
    return new Apply(
        null,
        Fodder.EMPTY,
        target,
        Fodder.EMPTY,
        new Arguments(args.build(), namedArgs.build()),
        false,
        Fodder.EMPTY,
        Fodder.EMPTY,
        false);
  }

  public static ApplyBrace applyBrace(Node left, Node right) {
    return new ApplyBrace(null, Fodder.EMPTY, left, right);
  }

  public static ArrayLiteral array(Node... elements) {
    ImmutableList.Builder<CommaSeparatedExpr> list = ImmutableList.builder();
    for (Node element : elements) {
      list.add(CommaSeparatedExpr.of(element));
    }
    return new ArrayLiteral(null, Fodder.EMPTY, list.build(), false, Fodder.EMPTY);
  }

  public static ForSpec forSpec(String varName, Node expr, @Nullable ForSpec outer) {
    return new ForSpec(
        Fodder.EMPTY, Fodder.EMPTY, varName, Fodder.EMPTY, expr, ImmutableList.of(), outer);
  }

  public static ArrayComp arrayComp(Node body, ForSpec spec) {
    return new ArrayComp(null, Fodder.EMPTY, body, Fodder.EMPTY, false, spec, Fodder.EMPTY);
  }

  public static Index index(Node target, String id) {
    return new Index(null, Fodder.EMPTY, target, Fodder.EMPTY, null, Fodder.EMPTY, id);
  }

  public static Index index(Node target, Node index) {
    return new Index(null, Fodder.EMPTY, target, Fodder.EMPTY, index, Fodder.EMPTY, null);
  }

  public static Slice slice(
      Node target, @Nullable Node begin, @Nullable Node end, @Nullable Node step) {
    return new Slice(
        null,
        Fodder.EMPTY,
        target,
        Fodder.EMPTY,
        begin,
        Fodder.EMPTY,
        end,
        Fodder.EMPTY,
        step,
        Fodder.EMPTY);
  }

  public static SuperIndex superIndex(String id) {
    return new SuperIndex(null, Fodder.EMPTY, Fodder.EMPTY, null, Fodder.EMPTY, id);
  }

  public static InSuper inSuper(Node index) {
    return new InSuper(null, Fodder.EMPTY, index, Fodder.EMPTY, Fodder.EMPTY);
  }

  public static Parens parens(Node inner) {
    return new Parens(null, Fodder.EMPTY, inner, Fodder.EMPTY);
  }

  public static ErrorExpression error(Node expr) {
    return new ErrorExpression(null, Fodder.EMPTY, expr);
  }

  public static Conditional conditional(Node cond, Node branchTrue, @Nullable Node branchFalse) {
    return new Conditional(
        null, Fodder.EMPTY, cond, Fodder.EMPTY, branchTrue, Fodder.EMPTY, branchFalse);
  }

  public static Assert assertion(Node cond, @Nullable Node message, Node rest) {
    return new Assert(null, Fodder.EMPTY, cond, Fodder.EMPTY, message, Fodder.EMPTY, rest);
  }

  public static ParameterList params(String... names) {
    ImmutableList.Builder<Parameter> params = ImmutableList.builder();
    for (String name : names) {
      params.add(Parameter.named(name));
    }
    return new ParameterList(Fodder.EMPTY, params.build(), false, Fodder.EMPTY);
  }

  public static FunctionLiteral function(ParameterList params, Node body) {
    return new FunctionLiteral(null, Fodder.EMPTY, params, body);
  }

  public static Import importFile(String path) {
    return new Import(null, Fodder.EMPTY, string(path));
  }

  public static ImportStr importStr(String path) {
    return new ImportStr(null, Fodder.EMPTY, string(path));
  }

  public static LocalBind bind(String variable, Node body) {
    return new LocalBind(Fodder.EMPTY, variable, null, Fodder.EMPTY, body, Fodder.EMPTY, null);
  }

  public static LocalBind bind(String variable, ParameterList params, Node body) {
    return new LocalBind(Fodder.EMPTY, variable, params, Fodder.EMPTY, body, Fodder.EMPTY, null);
  }

  public static Local local(LocalBind bind, Node body) {
    return local(ImmutableList.of(bind), body);
  }

  public static Local local(List<LocalBind> binds, Node body) {
    return new Local(null, Fodder.EMPTY, binds, body);
  }

  public static ObjectLiteral object(ObjectField... fields) {
    return new ObjectLiteral(null, Fodder.EMPTY, ImmutableList.copyOf(fields), false, Fodder.EMPTY);
  }

  public static ObjectField field(String id, Node body) {
    return field(id, Visibility.INHERIT, body);
  }

  public static ObjectField field(String id, Visibility visibility, Node body) {
    return ObjectField.withId(
        Fodder.EMPTY, id, null, Fodder.EMPTY, false, visibility, body, Fodder.EMPTY, null);
  }

  public static ObjectField stringField(String name, Node body) {
    return ObjectField.withString(
        string(name), null, Fodder.EMPTY, false, Visibility.INHERIT, body, Fodder.EMPTY, null);
  }

  public static ObjectField computedField(Node name, Node body) {
    return ObjectField.withExpr(
        Fodder.EMPTY,
        name,
        Fodder.EMPTY,
        null,
        Fodder.EMPTY,
        false,
        Visibility.INHERIT,
        body,
        Fodder.EMPTY,
        null);
  }

  public static ObjectField objectLocal(String id, Node body) {
    return ObjectField.local(
        Fodder.EMPTY, Fodder.EMPTY, id, null, Fodder.EMPTY, body, Fodder.EMPTY, null);
  }

  public static ObjectField objectAssert(Node cond, @Nullable Node message) {
    return ObjectField.assertion(Fodder.EMPTY, cond, Fodder.EMPTY, message, Fodder.EMPTY, null);
  }

  public static ObjectComp objectComp(ObjectField field, ForSpec spec) {
    return new ObjectComp(
        null, Fodder.EMPTY, ImmutableList.of(field), false, spec, Fodder.EMPTY);
  }

  public static DesugaredField desugaredField(String name, Node body) {
    return new DesugaredField(Visibility.INHERIT, string(name), body, false, null);
  }

  public static DesugaredObject desugaredObject(DesugaredField... fields) {
    return desugaredObject(ImmutableList.of(), ImmutableList.copyOf(fields), ImmutableList.of());
  }

  public static DesugaredObject desugaredObject(
      List<LocalBind> locals, List<DesugaredField> fields, List<Node> asserts) {
    return new DesugaredObject(null, Fodder.EMPTY, locals, fields, asserts);
  }
}
