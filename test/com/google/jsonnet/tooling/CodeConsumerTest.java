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
import com.google.jsonnet.ast.Fodder;
import com.google.jsonnet.ast.FodderElement;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class CodeConsumerTest {

  private static String fill(Fodder fodder, boolean crowded, boolean separateToken) {
    CodePrinter.StringConsumer cc = new CodePrinter.StringConsumer();
    cc.fill(fodder, crowded, separateToken);
    return cc.getCode();
  }

  @Test
  public void testEmptyFodder() {
    assertThat(fill(Fodder.EMPTY, true, true)).isEqualTo(" ");
    assertThat(fill(Fodder.EMPTY, true, false)).isEmpty();
    assertThat(fill(Fodder.EMPTY, false, true)).isEmpty();
    assertThat(fill(Fodder.EMPTY, false, false)).isEmpty();
  }

  @Test
  public void testInterstitial() {
    Fodder fodder = Fodder.of(FodderElement.interstitial("/* c */"));
    assertThat(fill(fodder, false, false)).isEqualTo("/* c */");
    assertThat(fill(fodder, false, true)).isEqualTo("/* c */ ");
    assertThat(fill(fodder, true, false)).isEqualTo(" /* c */");
    assertThat(fill(fodder, true, true)).isEqualTo(" /* c */ ");
  }

  @Test
  public void testConsecutiveInterstitials() {
    Fodder fodder =
        Fodder.of(FodderElement.interstitial("/* a */"), FodderElement.interstitial("/* b */"));
    assertThat(fill(fodder, false, false)).isEqualTo("/* a */ /* b */");
  }

  @Test
  public void testLineEnd() {
    assertThat(fill(Fodder.of(FodderElement.lineEnd(0, 2)), true, true)).isEqualTo("\n  ");
    assertThat(fill(Fodder.of(FodderElement.lineEnd(2, 0, "// x")), true, true))
        .isEqualTo("  // x\n\n\n");
  }

  @Test
  public void testInterstitialAfterLineEndIsNotPrefixed() {
    Fodder fodder =
        Fodder.of(FodderElement.lineEnd(0, 4), FodderElement.interstitial("/* c */"));
    assertThat(fill(fodder, true, true)).isEqualTo("\n    /* c */ ");
  }

  @Test
  public void testParagraph() {
    Fodder fodder =
        Fodder.of(
            FodderElement.lineEnd(0, 4),
            FodderElement.paragraph(1, 2, ImmutableList.of("/* a", "", " * b */")));
    assertThat(fill(fodder, false, true)).isEqualTo("\n    /* a\n\n     * b */\n\n  ");
  }

  @Test
  public void testParagraphAtStart() {
    Fodder fodder = Fodder.of(FodderElement.paragraph(0, 0, ImmutableList.of("# one", "# two")));
    assertThat(fill(fodder, true, true)).isEqualTo("# one\n# two\n");
  }
}
