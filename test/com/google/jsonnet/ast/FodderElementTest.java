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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class FodderElementTest {

  @Test
  public void testParagraphNeedsText() {
    assertThrows(
        IllegalArgumentException.class,
        () -> FodderElement.paragraph(0, 0, ImmutableList.<String>of()));
    assertThrows(
        IllegalArgumentException.class,
        () -> FodderElement.paragraph(0, 0, ImmutableList.of("", "// x")));
  }

  @Test
  public void testLineEndComment() {
    assertThat(FodderElement.lineEnd(1, 2).getComment()).isEmpty();
    assertThat(FodderElement.lineEnd(1, 2, "// x").getComment()).containsExactly("// x");
  }

  @Test
  public void testFodderEquality() {
    Fodder first = Fodder.of(FodderElement.interstitial("/* a */"), FodderElement.lineEnd(0, 2));
    Fodder second =
        Fodder.copyOf(
            ImmutableList.of(FodderElement.interstitial("/* a */"), FodderElement.lineEnd(0, 2)));
    assertThat(first).isEqualTo(second);
    assertThat(first.hashCode()).isEqualTo(second.hashCode());
    assertThat(Fodder.of().isEmpty()).isTrue();
    assertThat(first).isNotEqualTo(Fodder.EMPTY);
  }
}
