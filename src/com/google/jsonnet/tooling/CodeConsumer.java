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

import com.google.jsonnet.ast.Fodder;
import com.google.jsonnet.ast.FodderElement;

/**
 * Abstracted consumer of the CodeGenerator output. Besides taking tokens, it reproduces the
 * comments, line breaks and indentation recorded as fodder.
 *
 * @see CodeGenerator
 * @see CodePrinter
 */
abstract class CodeConsumer {

  /** Appends a complete token, or whitespace, to the output. */
  abstract void append(String str);

  /**
   * Prints fodder. The two flags decide whether single spaces are added to keep tokens from
   * joining together.
   *
   * <p>The caller passes true for {@code crowded} if the last thing printed would crowd whatever
   * is printed next: after a {@code ,} it is crowded, after a {@code (} it is not. Line ends and
   * paragraphs end on a fresh line, which clears the crowding; an interstitial comment creates it.
   * Once all fodder is printed, a single space follows if {@code separateToken} is set and the
   * output is still crowded.
   */
  void fill(Fodder fodder, boolean crowded, boolean separateToken) {
    int lastIndent = 0;
    for (FodderElement element : fodder) {
      switch (element.getType()) {
        case PARAGRAPH:
          {
            boolean first = true;
            for (String line : element.getComment()) {
              // Empty lines are not indented. The first line already sits at the current indent.
              if (!line.isEmpty()) {
                if (!first) {
                  appendSpaces(lastIndent);
                }
                append(line);
              }
              append("\n");
              first = false;
            }
            appendNewlines(element.getBlanks());
            appendSpaces(element.getIndent());
            lastIndent = element.getIndent();
            crowded = false;
            break;
          }
        case LINE_END:
          if (!element.getComment().isEmpty()) {
            append("  ");
            append(element.getComment().get(0));
          }
          appendNewlines(element.getBlanks() + 1);
          appendSpaces(element.getIndent());
          lastIndent = element.getIndent();
          crowded = false;
          break;
        case INTERSTITIAL:
          if (crowded) {
            append(" ");
          }
          append(element.getComment().get(0));
          crowded = true;
          break;
      }
    }
    if (separateToken && crowded) {
      append(" ");
    }
  }

  private void appendNewlines(int count) {
    for (int i = 0; i < count; i++) {
      append("\n");
    }
  }

  private void appendSpaces(int count) {
    for (int i = 0; i < count; i++) {
      append(" ");
    }
  }
}
