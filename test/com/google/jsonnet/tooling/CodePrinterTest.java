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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.jsonnet.ast.Apply;
import com.google.jsonnet.ast.Arguments;
import com.google.jsonnet.ast.Ast;
import com.google.jsonnet.ast.Binary;
import com.google.jsonnet.ast.BinaryOp;
import com.google.jsonnet.ast.CommaSeparatedExpr;
import com.google.jsonnet.ast.Fodder;
import com.google.jsonnet.ast.FodderElement;
import com.google.jsonnet.ast.ForSpec;
import com.google.jsonnet.ast.IfSpec;
import com.google.jsonnet.ast.Local;
import com.google.jsonnet.ast.LocalBind;
import com.google.jsonnet.ast.Node;
import com.google.jsonnet.ast.ObjectField;
import com.google.jsonnet.ast.ObjectLiteral;
import com.google.jsonnet.ast.StringKind;
import com.google.jsonnet.ast.UnaryOp;
import com.google.jsonnet.ast.Var;
import com.google.jsonnet.ast.Visibility;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class CodePrinterTest {

  private static String print(Node root) throws TraversalException {
    return new CodePrinter.Builder(root).build();
  }

  private static String print(Node root, PrinterOptions options) throws TraversalException {
    return new CodePrinter.Builder(root).setOptions(options).build();
  }

  @Test
  public void testPrintWithFodder() throws Exception {
    // // header
    // local x = 1;  // one
    // x
    Node root =
        new Local(
            null,
            Fodder.of(FodderElement.paragraph(0, 0, ImmutableList.of("// header"))),
            ImmutableList.of(Ast.bind("x", Ast.number("1"))),
            new Var(null, Fodder.of(FodderElement.lineEnd(0, 0, "// one")), "x"));
    String code =
        new CodePrinter.Builder(root)
            .setFinalFodder(Fodder.of(FodderElement.lineEnd(0, 0)))
            .build();
    assertThat(code).isEqualTo("// header\nlocal x = 1;  // one\nx\n");
  }

  @Test
  public void testPrintMultiLineObject() throws Exception {
    Fodder newline = Fodder.of(FodderElement.lineEnd(0, 2));
    Node root =
        new ObjectLiteral(
            null,
            Fodder.EMPTY,
            ImmutableList.of(
                ObjectField.withId(
                    newline, "a", null, Fodder.EMPTY, false, Visibility.INHERIT,
                    Ast.number("1"), Fodder.EMPTY, null),
                ObjectField.withId(
                    newline, "b", null, Fodder.EMPTY, false, Visibility.INHERIT,
                    Ast.string("two", StringKind.SINGLE), Fodder.EMPTY, null)),
            true,
            Fodder.of(FodderElement.lineEnd(0, 0)));
    assertThat(print(root)).isEqualTo("{\n  a: 1,\n  b: 'two',\n}");
  }

  @Test
  public void testOpenFodderOfLeftRecursiveNodeIsNotRepeated() throws Exception {
    Node left = new Var(null, Fodder.of(FodderElement.interstitial("/* a */")), "x");
    Node root =
        new Binary(
            null,
            Fodder.of(FodderElement.interstitial("/* a */")),
            left,
            Fodder.EMPTY,
            BinaryOp.PLUS,
            Ast.var("y"));
    assertThat(print(root)).isEqualTo("/* a */ x + y");
  }

  @Test
  public void testNestedObjects() throws Exception {
    Node root =
        Ast.object(
            Ast.field("a", Ast.number("1")),
            Ast.field("b", Ast.object(Ast.field("c", Ast.number("2")))));
    assertThat(print(root)).isEqualTo("{ a: 1, b: { c: 2 } }");
  }

  @Test
  public void testPadding() throws Exception {
    Node object = Ast.object(Ast.field("a", Ast.array(Ast.number("1"), Ast.number("2"))));
    assertThat(print(object)).isEqualTo("{ a: [1, 2] }");
    assertThat(
            print(object, PrinterOptions.builder().setPadArrays(true).setPadObjects(false).build()))
        .isEqualTo("{a: [ 1, 2 ]}");
    assertThat(print(Ast.object())).isEqualTo("{}");
    assertThat(print(Ast.array(), PrinterOptions.builder().setPadArrays(true).build()))
        .isEqualTo("[]");
  }

  @Test
  public void testFieldVariants() throws Exception {
    Node root =
        Ast.object(
            Ast.objectLocal("x", Ast.number("1")),
            Ast.objectAssert(Ast.var("x"), Ast.string("bad")),
            Ast.field("h", Visibility.HIDDEN, Ast.var("x")),
            Ast.field("v", Visibility.VISIBLE, Ast.var("x")),
            Ast.stringField("s", Ast.nullLiteral()),
            Ast.computedField(Ast.var("k"), Ast.self()),
            ObjectField.withId(
                Fodder.EMPTY, "p", null, Fodder.EMPTY, true, Visibility.INHERIT,
                Ast.dollar(), Fodder.EMPTY, null),
            ObjectField.withId(
                Fodder.EMPTY, "f", Ast.params("y"), Fodder.EMPTY, false, Visibility.INHERIT,
                Ast.var("y"), Fodder.EMPTY, null));
    assertThat(print(root))
        .isEqualTo(
            "{ local x = 1, assert x : \"bad\", h:: x, v::: x, \"s\": null, [k]: self,"
                + " p+: $, f(y): y }");
  }

  @Test
  public void testLocalFunctionAndCall() throws Exception {
    Node root =
        Ast.local(
            Ast.bind(
                "f", Ast.params("x", "y"), Ast.binary(Ast.var("x"), BinaryOp.PLUS, Ast.var("y"))),
            Ast.call(
                Ast.var("f"),
                ImmutableList.of(Ast.number("1")),
                ImmutableMap.of("y", Ast.number("2"))));
    assertThat(print(root)).isEqualTo("local f(x, y) = x + y; f(1, y=2)");
  }

  @Test
  public void testMultipleBinds() throws Exception {
    Node root =
        Ast.local(
            ImmutableList.of(Ast.bind("a", Ast.number("1")), Ast.bind("b", Ast.number("2"))),
            Ast.var("a"));
    assertThat(print(root)).isEqualTo("local a = 1, b = 2; a");
  }

  @Test
  public void testTailStrict() throws Exception {
    Node root =
        new Apply(
            null,
            Fodder.EMPTY,
            Ast.var("f"),
            Fodder.EMPTY,
            new Arguments(
                ImmutableList.of(CommaSeparatedExpr.of(Ast.number("1"))), ImmutableList.of()),
            true,
            Fodder.EMPTY,
            Fodder.EMPTY,
            true);
    assertThat(print(root)).isEqualTo("f(1,) tailstrict");
  }

  @Test
  public void testControlFlow() throws Exception {
    assertThat(print(Ast.conditional(Ast.bool(true), Ast.number("1"), Ast.number("2"))))
        .isEqualTo("if true then 1 else 2");
    assertThat(print(Ast.conditional(Ast.bool(false), Ast.number("1"), null)))
        .isEqualTo("if false then 1");
    assertThat(print(Ast.assertion(Ast.var("c"), Ast.string("m"), Ast.var("r"))))
        .isEqualTo("assert c : \"m\"; r");
    assertThat(print(Ast.assertion(Ast.var("c"), null, Ast.var("r")))).isEqualTo("assert c; r");
    assertThat(print(Ast.error(Ast.string("x")))).isEqualTo("error \"x\"");
  }

  @Test
  public void testIndexing() throws Exception {
    assertThat(print(Ast.index(Ast.var("a"), "b"))).isEqualTo("a.b");
    assertThat(print(Ast.index(Ast.var("a"), Ast.number("0")))).isEqualTo("a[0]");
    assertThat(print(Ast.slice(Ast.var("a"), Ast.number("1"), null, null))).isEqualTo("a[1:]");
    assertThat(print(Ast.slice(Ast.var("a"), null, Ast.number("2"), Ast.number("3"))))
        .isEqualTo("a[:2:3]");
    assertThat(print(Ast.superIndex("x"))).isEqualTo("super.x");
    assertThat(print(Ast.applyBrace(Ast.var("a"), Ast.object(Ast.field("b", Ast.number("1"))))))
        .isEqualTo("a { b: 1 }");
  }

  @Test
  public void testComprehensions() throws Exception {
    ForSpec inner = Ast.forSpec("y", Ast.var("ys"), Ast.forSpec("x", Ast.var("xs"), null));
    assertThat(print(Ast.arrayComp(Ast.var("x"), inner))).isEqualTo("[x for x in xs for y in ys]");

    ForSpec filtered =
        new ForSpec(
            Fodder.EMPTY,
            Fodder.EMPTY,
            "k",
            Fodder.EMPTY,
            Ast.var("ks"),
            ImmutableList.of(new IfSpec(Fodder.EMPTY, Ast.var("k"))),
            null);
    assertThat(print(Ast.objectComp(Ast.computedField(Ast.var("k"), Ast.number("1")), filtered)))
        .isEqualTo("{ [k]: 1 for k in ks if k }");
  }

  @Test
  public void testOperatorsAndAtoms() throws Exception {
    assertThat(print(Ast.unary(UnaryOp.NOT, Ast.var("a")))).isEqualTo("!a");
    assertThat(print(Ast.parens(Ast.binary(Ast.number("1"), BinaryOp.MULT, Ast.number("2")))))
        .isEqualTo("(1 * 2)");
    assertThat(print(Ast.function(Ast.params(), Ast.bool(true)))).isEqualTo("function() true");
    assertThat(print(Ast.importFile("a.libsonnet"))).isEqualTo("import \"a.libsonnet\"");
    assertThat(print(Ast.importStr("a.txt"))).isEqualTo("importstr \"a.txt\"");
  }

  @Test
  public void testNumbersKeepTheirSpelling() throws Exception {
    assertThat(print(Ast.number("1.50e+3"))).isEqualTo("1.50e+3");
  }

  @Test
  public void testStringKinds() throws Exception {
    assertThat(print(Ast.string("a\\nb"))).isEqualTo("\"a\\nb\"");
    assertThat(print(Ast.string("it\\'s", StringKind.SINGLE))).isEqualTo("'it\\'s'");
    assertThat(print(Ast.string("say \"hi\"", StringKind.VERBATIM_DOUBLE)))
        .isEqualTo("@\"say \"\"hi\"\"\"");
    assertThat(print(Ast.string("it's", StringKind.VERBATIM_SINGLE))).isEqualTo("@'it''s'");
  }

  @Test
  public void testBlockString() throws Exception {
    assertThat(print(Ast.block("line1\n\nline2\n", "  ", "")))
        .isEqualTo("|||\n  line1\n\n  line2\n|||");
    assertThat(print(Ast.block("a\r\nb\r\n", "    ", "  "))).isEqualTo("|||\n    a\n    b\n  |||");
  }

  @Test
  public void testLocalWithoutBindsIsFatal() throws Exception {
    Node root = Ast.local(ImmutableList.<LocalBind>of(), Ast.number("1"));
    IllegalStateException e = assertThrows(IllegalStateException.class, () -> print(root));
    assertThat(e).hasMessageThat().contains("local with no binds");
  }

  @Test
  public void testLoweredObjectIsFatal() throws Exception {
    Node root = Ast.desugaredObject(Ast.desugaredField("a", Ast.number("1")));
    assertThrows(IllegalStateException.class, () -> print(root));
  }

  @Test
  public void testTreeTooDeepToPrint() {
    Node root = Ast.number("1");
    for (int i = 0; i < 200_000; i++) {
      root = Ast.unary(UnaryOp.MINUS, root);
    }
    Node deep = root;
    TraversalException e = assertThrows(TraversalException.class, () -> print(deep));
    assertThat(e.getPhase()).isEqualTo(TraversalException.Phase.PRE);
    assertThat(e).hasMessageThat().contains("tree too deep to print");
  }
}
