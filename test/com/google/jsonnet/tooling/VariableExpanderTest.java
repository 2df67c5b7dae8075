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

import com.google.common.collect.ImmutableList;
import com.google.jsonnet.ast.Ast;
import com.google.jsonnet.ast.BinaryOp;
import com.google.jsonnet.ast.Node;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class VariableExpanderTest {

  private static String expand(Node root) throws TraversalException {
    return new CodePrinter.Builder(new VariableExpander().expand(root)).build();
  }

  @Test
  public void testExpandsReferences() throws Exception {
    Node root =
        Ast.local(
            Ast.bind("a", Ast.number("1")),
            Ast.binary(Ast.var("a"), BinaryOp.PLUS, Ast.var("a")));
    assertThat(expand(root)).isEqualTo("local a = 1; 1 + 1");
  }

  @Test
  public void testExpansionIsTransitive() throws Exception {
    Node root =
        Ast.local(
            ImmutableList.of(
                Ast.bind("a", Ast.number("1")),
                Ast.bind("b", Ast.binary(Ast.var("a"), BinaryOp.PLUS, Ast.number("1")))),
            Ast.var("b"));
    assertThat(expand(root)).isEqualTo("local a = 1, b = 1 + 1; 1 + 1");
  }

  @Test
  public void testImportsAreParenthesized() throws Exception {
    Node root =
        Ast.local(
            Ast.bind("lib", Ast.importFile("lib.libsonnet")), Ast.index(Ast.var("lib"), "x"));
    assertThat(expand(root))
        .isEqualTo("local lib = import \"lib.libsonnet\"; (import \"lib.libsonnet\").x");
  }

  @Test
  public void testCyclesAreLeftAlone() throws Exception {
    Node root = Ast.local(Ast.bind("a", Ast.var("a")), Ast.var("a"));
    assertThat(expand(root)).isEqualTo("local a = a; a");
  }

  @Test
  public void testUnknownVariablesAreKept() throws Exception {
    assertThat(expand(Ast.call(Ast.var("std"), Ast.number("1")))).isEqualTo("std(1)");
  }

  @Test
  public void testInputIsNotModified() throws Exception {
    Node root = Ast.local(Ast.bind("a", Ast.number("1")), Ast.array(Ast.var("a")));
    Node expanded = new VariableExpander().expand(root);
    assertThat(new CodePrinter.Builder(expanded).build()).isEqualTo("local a = 1; [1]");
    assertThat(new CodePrinter.Builder(root).build()).isEqualTo("local a = 1; [a]");
  }

  @Test
  public void testCapture() throws Exception {
    Node one = Ast.number("1");
    Node two = Ast.number("2");
    Node root =
        Ast.local(
            Ast.bind("a", one),
            Ast.array(Ast.local(Ast.bind("b", two), Ast.var("b"))));
    assertThat(VariableExpander.capture(root, 10)).containsExactly("a", one, "b", two).inOrder();
  }
}
