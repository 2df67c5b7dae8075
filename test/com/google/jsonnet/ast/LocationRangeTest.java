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

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class LocationRangeTest {

  @Test
  public void testToStringSingleLine() {
    assertThat(LocationRange.create("a.jsonnet", 3, 5, 3, 9).toString())
        .isEqualTo("a.jsonnet:3:5-9");
  }

  @Test
  public void testToStringSinglePosition() {
    assertThat(LocationRange.create("a.jsonnet", 3, 5, 3, 5).toString())
        .isEqualTo("a.jsonnet:3:5");
  }

  @Test
  public void testToStringMultiLine() {
    assertThat(LocationRange.create("a.jsonnet", 3, 5, 4, 1).toString())
        .isEqualTo("a.jsonnet:(3:5)-(4:1)");
  }

  @Test
  public void testToStringWithoutFile() {
    assertThat(LocationRange.create("", 1, 2, 1, 4).toString()).isEqualTo("1:2-4");
  }

  @Test
  public void testUnsetRange() {
    LocationRange range = LocationRange.create("a.jsonnet", 0, 0, 0, 0);
    assertThat(range.isSet()).isFalse();
    assertThat(range.toString()).isEqualTo("a.jsonnet");
  }

  @Test
  public void testEncloses() {
    LocationRange outer = LocationRange.create("f", 1, 1, 3, 1);
    assertThat(outer.encloses(LocationRange.create("f", 1, 5, 2, 2))).isTrue();
    assertThat(outer.encloses(outer)).isTrue();
    assertThat(outer.encloses(LocationRange.create("f", 2, 1, 3, 2))).isFalse();
    assertThat(outer.encloses(LocationRange.create("g", 1, 5, 2, 2))).isFalse();
    assertThat(outer.encloses(LocationRange.create("f", 0, 0, 0, 0))).isFalse();
  }

  @Test
  public void testLocationOrdering() {
    assertThat(Location.create(1, 9)).isLessThan(Location.create(2, 1));
    assertThat(Location.create(2, 3)).isGreaterThan(Location.create(2, 1));
    assertThat(Location.create(2, 3)).isEquivalentAccordingToCompareTo(Location.create(2, 3));
  }
}
