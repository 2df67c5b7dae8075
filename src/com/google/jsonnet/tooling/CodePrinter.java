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

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.errorprone.annotations.CanIgnoreReturnValue;
import com.google.jsonnet.ast.Fodder;
import com.google.jsonnet.ast.Node;
import com.google.jsonnet.tooling.TraversalException.Phase;
import java.util.logging.Logger;

/**
 * CodePrinter prints out a raw syntax tree as source text.
 *
 * <p>With the fodder a parser recorded, the output is the source the tree was parsed from. Trees
 * built without fodder print with the minimal spacing that keeps tokens apart.
 */
public final class CodePrinter {
  private static final Logger logger = Logger.getLogger(CodePrinter.class.getName());

  private CodePrinter() {}

  static class StringConsumer extends CodeConsumer {
    private final StringBuilder code = new StringBuilder(1024);

    @Override
    void append(String str) {
      code.append(str);
    }

    String getCode() {
      return code.toString();
    }
  }

  /** Builder for the source text of a single tree. */
  public static final class Builder {
    private final Node root;
    private PrinterOptions options = PrinterOptions.defaults();
    private Fodder finalFodder = Fodder.EMPTY;

    /**
     * Sets the root node from which to generate the source code.
     *
     * @param node The root node.
     */
    public Builder(Node node) {
      root = checkNotNull(node);
    }

    @CanIgnoreReturnValue
    public Builder setOptions(PrinterOptions options) {
      this.options = checkNotNull(options);
      return this;
    }

    /** Sets the fodder found after the last token, typically the end of the file. */
    @CanIgnoreReturnValue
    public Builder setFinalFodder(Fodder finalFodder) {
      this.finalFodder = checkNotNull(finalFodder);
      return this;
    }

    /**
     * Generates the source code and returns it.
     *
     * @throws IllegalStateException if the tree contains lowered objects or a local without binds
     * @throws TraversalException if the tree is nested too deeply to print
     */
    public String build() throws TraversalException {
      StringConsumer consumer = new StringConsumer();
      try {
        new CodeGenerator(consumer, options).add(root, false);
      } catch (StackOverflowError e) {
        logger.warning("Printing ran out of stack");
        throw new TraversalException(Phase.PRE, root.getLocation(), "tree too deep to print");
      }
      consumer.fill(finalFodder, true, false);
      return consumer.getCode();
    }
  }
}
