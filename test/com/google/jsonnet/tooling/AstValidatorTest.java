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
import com.google.jsonnet.ast.Binary;
import com.google.jsonnet.ast.BinaryOp;
import com.google.jsonnet.ast.Fodder;
import com.google.jsonnet.ast.LiteralNumber;
import com.google.jsonnet.ast.LocalBind;
import com.google.jsonnet.ast.LocationRange;
import com.google.jsonnet.ast.Node;
import java.util.ArrayList;
import java.util.List;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class AstValidatorTest {
  private final List<String> violations = new ArrayList<>();

  private void validate(Node root, TreeShape shape) throws TraversalException {
    new AstValidator(shape, (message, n) -> violations.add(message)).validate(root);
  }

  private static Node number(String text, LocationRange location) {
    return new LiteralNumber(location, Fodder.EMPTY, text);
  }

  @Test
  public void testValidTrees() throws Exception {
    validate(Ast.object(Ast.field("a", Ast.number("1"))), TreeShape.RAW);
    validate(Ast.desugaredObject(Ast.desugaredField("a", Ast.number("1"))), TreeShape.LOWERED);
    assertThat(violations).isEmpty();
  }

  @Test
  public void testShapeMismatch() throws Exception {
    validate(Ast.array(Ast.desugaredObject()), TreeShape.RAW);
    validate(Ast.array(Ast.object()), TreeShape.LOWERED);
    assertThat(violations)
        .containsExactly("Lowered object in a raw tree", "Raw object in a lowered tree")
        .inOrder();
  }

  @Test
  public void testLocalWithoutBinds() throws Exception {
    validate(Ast.local(ImmutableList.<LocalBind>of(), Ast.number("1")), TreeShape.RAW);
    assertThat(violations).containsExactly("LOCAL has no binds");
  }

  @Test
  public void testChildOutsideParent() throws Exception {
    Node child = number("1", LocationRange.create("f.jsonnet", 2, 1, 2, 2));
    Node inside = number("2", LocationRange.create("f.jsonnet", 1, 5, 1, 6));
    Node root =
        new Binary(
            LocationRange.create("f.jsonnet", 1, 1, 1, 6),
            Fodder.EMPTY,
            child,
            Fodder.EMPTY,
            BinaryOp.PLUS,
            inside);
    validate(root, TreeShape.RAW);
    assertThat(violations).hasSize(1);
    assertThat(violations.get(0)).contains("f.jsonnet:2:1-2 is not within");
  }

  @Test
  public void testSynthesizedNodesAreNotChecked() throws Exception {
    Node root =
        new Binary(
            LocationRange.create("f.jsonnet", 1, 1, 1, 6),
            Fodder.EMPTY,
            Ast.number("1"),
            Fodder.EMPTY,
            BinaryOp.PLUS,
            Ast.number("2"));
    validate(root, TreeShape.RAW);
    assertThat(violations).isEmpty();
  }

  @Test
  public void testDefaultHandlerThrows() {
    Node root = Ast.local(ImmutableList.<LocalBind>of(), Ast.number("1"));
    IllegalStateException e =
        assertThrows(
            IllegalStateException.class, () -> new AstValidator(TreeShape.RAW).validate(root));
    assertThat(e).hasMessageThat().startsWith("LOCAL has no binds");
  }
}
