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

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;

/**
 * One unit of formatting attached to a token: a comment block, a line ending or an inline
 * comment. Plain spaces between tokens are not recorded; the printer regenerates them.
 */
@AutoValue
public abstract class FodderElement {

  /** The three shapes of fodder. */
  public enum Type {
    /** A run of comment lines, each ending in a newline. */
    PARAGRAPH,
    /** The end of a line, optionally preceded by a comment on that line. */
    LINE_END,
    /** A comment between two tokens of the same line, e.g. a C-style comment. */
    INTERSTITIAL
  }

  public abstract Type getType();

  /** Blank lines following the element. Always 0 for interstitials. */
  public abstract int getBlanks();

  /** Indentation of the line that follows the element. Always 0 for interstitials. */
  public abstract int getIndent();

  /**
   * The comment text. Paragraphs have one entry per line; line ends have zero or one entry;
   * interstitials have exactly one.
   */
  public abstract ImmutableList<String> getComment();

  public static FodderElement paragraph(int blanks, int indent, Iterable<String> lines) {
    ImmutableList<String> comment = ImmutableList.copyOf(lines);
    checkArgument(!comment.isEmpty(), "a paragraph needs at least one line");
    checkArgument(!comment.get(0).isEmpty(), "the first line of a paragraph cannot be empty");
    return new AutoValue_FodderElement(Type.PARAGRAPH, blanks, indent, comment);
  }

  public static FodderElement lineEnd(int blanks, int indent) {
    return new AutoValue_FodderElement(Type.LINE_END, blanks, indent, ImmutableList.of());
  }

  public static FodderElement lineEnd(int blanks, int indent, String comment) {
    return new AutoValue_FodderElement(Type.LINE_END, blanks, indent, ImmutableList.of(comment));
  }

  public static FodderElement interstitial(String comment) {
    return new AutoValue_FodderElement(Type.INTERSTITIAL, 0, 0, ImmutableList.of(comment));
  }
}
