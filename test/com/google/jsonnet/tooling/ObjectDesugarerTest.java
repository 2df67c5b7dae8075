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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.jsonnet.ast.Ast;
import com.google.jsonnet.ast.ArrayLiteral;
import com.google.jsonnet.ast.Conditional;
import com.google.jsonnet.ast.DesugaredField;
import com.google.jsonnet.ast.DesugaredObject;
import com.google.jsonnet.ast.ErrorExpression;
import com.google.jsonnet.ast.Fodder;
import com.google.jsonnet.ast.FunctionLiteral;
import com.google.jsonnet.ast.Kind;
import com.google.jsonnet.ast.LiteralString;
import com.google.jsonnet.ast.LocalBind;
import com.google.jsonnet.ast.Node;
import com.google.jsonnet.ast.ObjectField;
import com.google.jsonnet.ast.ObjectLiteral;
import com.google.jsonnet.ast.StringKind;
import com.google.jsonnet.ast.Visibility;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class ObjectDesugarerTest {

  private static Node desugar(Node root) throws TraversalException {
    return new ObjectDesugarer().desugar(root);
  }

  @Test
  public void testFieldNamesBecomeStrings() throws Exception {
    Node one = Ast.number("1");
    Node two = Ast.number("2");
    DesugaredObject object =
        (DesugaredObject)
            desugar(Ast.object(Ast.field("a", Visibility.HIDDEN, one), Ast.stringField("b", two)));

    assertThat(object.getFields()).hasSize(2);
    DesugaredField a = object.getFields().get(0);
    assertThat(((LiteralString) a.getName()).getValue()).isEqualTo("a");
    assertThat(a.getVisibility()).isEqualTo(Visibility.HIDDEN);
    assertThat(a.getBody()).isSameInstanceAs(one);
    DesugaredField b = object.getFields().get(1);
    assertThat(((LiteralString) b.getName()).getValue()).isEqualTo("b");
    assertThat(b.getBody()).isSameInstanceAs(two);
  }

  @Test
  public void testQuotedNamesAreUnescaped() throws Exception {
    DesugaredObject object =
        (DesugaredObject)
            desugar(
                Ast.object(
                    Ast.stringField("a\\\"b", Ast.number("1")),
                    ObjectField.withString(
                        Ast.string("tab\\t\\u0041\\\\", StringKind.SINGLE), null,
                        Fodder.EMPTY, false, Visibility.INHERIT, Ast.number("2"), Fodder.EMPTY,
                        null)));
    assertThat(((LiteralString) object.getFields().get(0).getName()).getValue())
        .isEqualTo("a\"b");
    assertThat(((LiteralString) object.getFields().get(1).getName()).getValue())
        .isEqualTo("tab\tA\\");
  }

  @Test
  public void testVerbatimNamesAreKept() throws Exception {
    LiteralString name = Ast.string("a\\b", StringKind.VERBATIM_DOUBLE);
    DesugaredObject object =
        (DesugaredObject)
            desugar(
                Ast.object(
                    ObjectField.withString(
                        name, null, Fodder.EMPTY, false, Visibility.INHERIT, Ast.number("1"),
                        Fodder.EMPTY, null)));
    assertThat(object.getFields().get(0).getName()).isSameInstanceAs(name);
  }

  @Test
  public void testUnescape() {
    assertThat(ObjectDesugarer.unescape("plain")).isEqualTo("plain");
    assertThat(ObjectDesugarer.unescape("\\'\\/\\n\\r\\b\\f")).isEqualTo("'/\n\r\b\f");
    assertThat(ObjectDesugarer.unescape("\\u00e9")).isEqualTo("\u00e9");
    assertThrows(IllegalArgumentException.class, () -> ObjectDesugarer.unescape("\\q"));
    assertThrows(IllegalArgumentException.class, () -> ObjectDesugarer.unescape("a\\"));
    assertThrows(IllegalArgumentException.class, () -> ObjectDesugarer.unescape("\\u12"));
  }

  @Test
  public void testComputedNameIsKept() throws Exception {
    Node name = Ast.var("k");
    DesugaredObject object =
        (DesugaredObject) desugar(Ast.object(Ast.computedField(name, Ast.number("1"))));
    assertThat(object.getFields().get(0).getName()).isSameInstanceAs(name);
  }

  @Test
  public void testMethodsAndSuperSugar() throws Exception {
    ObjectField method =
        ObjectField.withId(
            Fodder.EMPTY, "f", Ast.params("x"), Fodder.EMPTY, true, Visibility.INHERIT,
            Ast.var("x"), Fodder.EMPTY, null);
    DesugaredObject object = (DesugaredObject) desugar(Ast.object(method));
    DesugaredField f = object.getFields().get(0);
    assertThat(f.isPlusSuper()).isTrue();
    assertThat(f.getBody().getKind()).isEqualTo(Kind.FUNCTION);
    assertThat(((FunctionLiteral) f.getBody()).getParams().getParameters().get(0).getName())
        .isEqualTo("x");
  }

  @Test
  public void testObjectLocals() throws Exception {
    DesugaredObject object =
        (DesugaredObject)
            desugar(
                Ast.object(
                    Ast.objectLocal("l", Ast.number("1")), Ast.field("a", Ast.var("l"))));
    assertThat(object.getLocals()).hasSize(1);
    LocalBind local = object.getLocals().get(0);
    assertThat(local.getVariable()).isEqualTo("l");
    assertThat(local.getBody().getKind()).isEqualTo(Kind.LITERAL_NUMBER);
    assertThat(object.getFields()).hasSize(1);
  }

  @Test
  public void testAssertions() throws Exception {
    Node cond = Ast.var("ok");
    DesugaredObject object =
        (DesugaredObject)
            desugar(
                Ast.object(
                    Ast.objectAssert(cond, null), Ast.objectAssert(cond, Ast.string("custom"))));
    assertThat(object.getAsserts()).hasSize(2);

    Conditional first = (Conditional) object.getAsserts().get(0);
    assertThat(first.getCond()).isSameInstanceAs(cond);
    assertThat(first.getBranchTrue().getKind()).isEqualTo(Kind.LITERAL_NULL);
    ErrorExpression error = (ErrorExpression) first.getBranchFalse();
    assertThat(((LiteralString) error.getExpr()).getValue()).isEqualTo("Object assertion failed.");

    Conditional second = (Conditional) object.getAsserts().get(1);
    ErrorExpression custom = (ErrorExpression) second.getBranchFalse();
    assertThat(((LiteralString) custom.getExpr()).getValue()).isEqualTo("custom");
  }

  @Test
  public void testNestedObjectsAreLoweredAndInputIsUntouched() throws Exception {
    ArrayLiteral input =
        Ast.array(Ast.object(Ast.field("a", Ast.object(Ast.field("b", Ast.number("1"))))));
    ArrayLiteral output = (ArrayLiteral) desugar(input);

    assertThat(output).isNotSameInstanceAs(input);
    assertThat(input.getElements().get(0).getExpr()).isInstanceOf(ObjectLiteral.class);
    DesugaredObject outer = (DesugaredObject) output.getElements().get(0).getExpr();
    assertThat(outer.getFields().get(0).getBody()).isInstanceOf(DesugaredObject.class);

    new AstValidator(TreeShape.LOWERED).validate(output);
  }
}
