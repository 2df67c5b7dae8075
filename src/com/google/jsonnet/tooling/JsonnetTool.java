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

import com.google.common.collect.ImmutableList;
import com.google.jsonnet.ast.Node;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Entry point for the tooling passes. Each operation parses a file with the configured {@link
 * SnippetParser} and runs one pass over the resulting tree.
 *
 * <p>Instances are cheap and hold no state between calls beyond their options.
 */
public final class JsonnetTool {
  private static final Logger logger = Logger.getLogger(JsonnetTool.class.getName());

  private final SnippetParser parser;
  private final JsonnetToolOptions options;

  public JsonnetTool(SnippetParser parser, JsonnetToolOptions options) {
    this.parser = checkNotNull(parser);
    this.options = checkNotNull(options);
  }

  public JsonnetTool(SnippetParser parser) {
    this(parser, new JsonnetToolOptions());
  }

  public JsonnetToolOptions getOptions() {
    return options;
  }

  /** Renders the raw tree of a file as a dot graph. */
  public String dot(String fileName, String source)
      throws SnippetParseException, TraversalException {
    Node root = parse(fileName, source).getRoot();
    return DotFormatter.toDot(root, options.getMaxTraversalDepth());
  }

  /** Lists the symbols of a file, after lowering its objects. */
  public ImmutableList<Symbol> symbols(String fileName, String source)
      throws SnippetParseException, TraversalException {
    Node lowered = lower(parse(fileName, source).getRoot());
    ImmutableList<Symbol> symbols =
        new SymbolExtractor(options.getMaxTraversalDepth()).extract(lowered);
    if (logger.isLoggable(Level.FINE)) {
      logger.fine(fileName + ": " + symbols.size() + " symbols");
    }
    return symbols;
  }

  /** Like {@link #symbols}, rendered as a JSON array. */
  public String symbolsJson(String fileName, String source)
      throws SnippetParseException, TraversalException {
    return SymbolTableJson.toJson(symbols(fileName, source));
  }

  /** Prints a file back out with the configured padding. */
  public String format(String fileName, String source)
      throws SnippetParseException, TraversalException {
    ParseResult result = parse(fileName, source);
    return print(result.getRoot(), result);
  }

  /** Prints a file with every reference to a local variable replaced by its definition. */
  public String expand(String fileName, String source)
      throws SnippetParseException, TraversalException {
    ParseResult result = parse(fileName, source);
    Node expanded = new VariableExpander(options.getMaxTraversalDepth()).expand(result.getRoot());
    return print(expanded, result);
  }

  private ParseResult parse(String fileName, String source)
      throws SnippetParseException, TraversalException {
    checkNotNull(fileName);
    checkNotNull(source);
    if (logger.isLoggable(Level.FINE)) {
      logger.fine("Parsing " + fileName + " (" + source.length() + " chars)");
    }
    ParseResult result = parser.parse(fileName, source);
    validate(result.getRoot(), TreeShape.RAW);
    return result;
  }

  private Node lower(Node root) throws TraversalException {
    Node lowered = new ObjectDesugarer(options.getMaxTraversalDepth()).desugar(root);
    validate(lowered, TreeShape.LOWERED);
    return lowered;
  }

  private void validate(Node root, TreeShape shape) throws TraversalException {
    if (options.shouldValidateInput()) {
      NodeTraversal.builder()
          .setCallback(new AstValidator(shape))
          .setMaxDepth(options.getMaxTraversalDepth())
          .traverse(root);
    }
  }

  private String print(Node root, ParseResult result) throws TraversalException {
    return new CodePrinter.Builder(root)
        .setOptions(options.toPrinterOptions())
        .setFinalFodder(result.getFinalFodder())
        .build();
  }
}
