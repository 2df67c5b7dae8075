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

import com.google.common.collect.ImmutableList;
import java.util.Iterator;

/** The ordered formatting that precedes a token. */
public final class Fodder implements Iterable<FodderElement> {
  public static final Fodder EMPTY = new Fodder(ImmutableList.of());

  private final ImmutableList<FodderElement> elements;

  private Fodder(ImmutableList<FodderElement> elements) {
    this.elements = elements;
  }

  public static Fodder of(FodderElement... elements) {
    return elements.length == 0 ? EMPTY : new Fodder(ImmutableList.copyOf(elements));
  }

  public static Fodder copyOf(Iterable<FodderElement> elements) {
    ImmutableList<FodderElement> copy = ImmutableList.copyOf(elements);
    return copy.isEmpty() ? EMPTY : new Fodder(copy);
  }

  public ImmutableList<FodderElement> getElements() {
    return elements;
  }

  public boolean isEmpty() {
    return elements.isEmpty();
  }

  @Override
  public Iterator<FodderElement> iterator() {
    return elements.iterator();
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof Fodder && ((Fodder) o).elements.equals(elements);
  }

  @Override
  public int hashCode() {
    return elements.hashCode();
  }

  @Override
  public String toString() {
    return elements.toString();
  }
}
