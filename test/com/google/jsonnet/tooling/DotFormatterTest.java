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
import com.google.jsonnet.ast.Ast;
import com.google.jsonnet.ast.BinaryOp;
import com.google.jsonnet.ast.DesugaredField;
import com.google.jsonnet.ast.DesugaredObject;
import com.google.jsonnet.ast.Fodder;
import com.google.jsonnet.ast.LocationRange;
import com.google.jsonnet.ast.Node;
import com.google.jsonnet.ast.StringKind;
import com.google.jsonnet.ast.UnaryOp;
import com.google.jsonnet.ast.Visibility;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class DotFormatterTest {

  /** Tests that keys are assigned sequentially and once per node. */
  @Test
  public void testKeyAssignment() {
    DotFormatter dot = DotFormatter.newInstanceForTesting();
    Node node0 = Ast.self();
    Node node1 = Ast.self();
    assertThat(dot.key(node0)).isEqualTo(0);
    assertThat(dot.key(node1)).isEqualTo(1);
    assertThat(dot.key(node0)).isEqualTo(0);
  }

  /** Tests the formatting (simple tree). */
  @Test
  public void testToDotSimple() throws Exception {
    Node root = Ast.binary(Ast.number("1"), BinaryOp.PLUS, Ast.number("2"));
    assertThat(DotFormatter.toDot(root))
        .isEqualTo(
            "digraph {\n"
                + "  \"[] #0 BINARY +\"->\"[] #1 LITERAL_NUMBER 1\"\n"
                + "  \"[] #0 BINARY +\"->\"[] #2 LITERAL_NUMBER 2\"\n"
                + "}\n");
  }

  @Test
  public void testLeafOnly() throws Exception {
    assertThat(DotFormatter.toDot(Ast.nullLiteral())).isEqualTo("digraph {\n}\n");
  }

  @Test
  public void testChildEdgesPrecedeParentEdges() throws Exception {
    Node root = Ast.unary(UnaryOp.MINUS, Ast.parens(Ast.var("x")));
    assertThat(DotFormatter.toDot(root))
        .isEqualTo(
            "digraph {\n"
                + "  \"[] #1 PARENS\"->\"[] #2 VAR x\"\n"
                + "  \"[] #0 UNARY -\"->\"[] #1 PARENS\"\n"
                + "}\n");
  }

  @Test
  public void testLoweredObjectLinksThroughFieldNames() throws Exception {
    Node root =
        Ast.desugaredObject(
            Ast.desugaredField("a", Ast.number("1")),
            Ast.desugaredField("b", Ast.desugaredObject(Ast.desugaredField("c", Ast.number("2")))));
    String outer = "\"[] #0 DESUGARED_OBJECT\"";
    String a = "\"[] #1 LITERAL_STRING a\"";
    String b = "\"[] #2 LITERAL_STRING b\"";
    String one = "\"[] #3 LITERAL_NUMBER 1\"";
    String inner = "\"[] #4 DESUGARED_OBJECT\"";
    String c = "\"[] #5 LITERAL_STRING c\"";
    String two = "\"[] #6 LITERAL_NUMBER 2\"";
    assertThat(DotFormatter.toDot(root))
        .isEqualTo(
            "digraph {\n"
                + "  " + inner + "->" + c + "\n"
                + "  " + c + "->" + two + "\n"
                + "  " + outer + "->" + a + "\n"
                + "  " + a + "->" + one + "\n"
                + "  " + outer + "->" + b + "\n"
                + "  " + b + "->" + inner + "\n"
                + "}\n");
  }

  @Test
  public void testLoweredObjectLocalsAndAssertsAreLinked() throws Exception {
    Node root =
        Ast.desugaredObject(
            ImmutableList.of(Ast.bind("l", Ast.number("1"))),
            ImmutableList.of(),
            ImmutableList.of(Ast.bool(true)));
    assertThat(DotFormatter.toDot(root))
        .isEqualTo(
            "digraph {\n"
                + "  \"[] #0 DESUGARED_OBJECT\"->\"[] #1 LITERAL_NUMBER 1\"\n"
                + "  \"[] #0 DESUGARED_OBJECT\"->\"[] #2 LITERAL_BOOLEAN true\"\n"
                + "}\n");
  }

  @Test
  public void testFieldNamesUseFieldLocation() throws Exception {
    DesugaredField field =
        new DesugaredField(
            Visibility.INHERIT,
            Ast.string("a"),
            Ast.number("1"),
            false,
            LocationRange.create("f.jsonnet", 1, 3, 1, 7));
    Node root =
        new DesugaredObject(
            LocationRange.create("f.jsonnet", 1, 1, 1, 9),
            Fodder.EMPTY,
            ImmutableList.of(),
            ImmutableList.of(field),
            ImmutableList.of());
    assertThat(DotFormatter.toDot(root))
        .contains(
            "\"[f.jsonnet:1:1-9] #0 DESUGARED_OBJECT\"->\"[f.jsonnet:1:3-7] #1 LITERAL_STRING a\"");
  }

  @Test
  public void testQuotesAreEscaped() throws Exception {
    Node root = Ast.array(Ast.string("say \"hi\"", StringKind.SINGLE));
    assertThat(DotFormatter.toDot(root))
        .isEqualTo("digraph {\n  \"[] #0 ARRAY\"->\"[] #1 LITERAL_STRING say \\\"hi\\\"\"\n}\n");
  }

  @Test
  public void testBackslashesAreEscaped() throws Exception {
    Node root = Ast.array(Ast.string("a\\", StringKind.VERBATIM_DOUBLE));
    assertThat(DotFormatter.toDot(root))
        .isEqualTo("digraph {\n  \"[] #0 ARRAY\"->\"[] #1 LITERAL_STRING a\\\\\"\n}\n");
  }

  @Test
  public void testDepthLimit() {
    Node root = Ast.var("x");
    for (int i = 0; i < 4; i++) {
      root = Ast.parens(root);
    }
    Node deep = root;
    TraversalException e =
        assertThrows(TraversalException.class, () -> DotFormatter.toDot(deep, 2));
    assertThat(e.getPhase()).isEqualTo(TraversalException.Phase.PRE);
  }
}
