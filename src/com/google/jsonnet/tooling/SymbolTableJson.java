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

import com.google.gson.stream.JsonWriter;
import com.google.jsonnet.ast.Location;
import com.google.jsonnet.ast.LocationRange;
import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.util.List;
import org.jspecify.annotations.Nullable;

/** Renders a symbol table as an indented JSON array, one object per symbol. */
public final class SymbolTableJson {

  private SymbolTableJson() {}

  public static String toJson(List<Symbol> symbols) {
    StringWriter out = new StringWriter();
    try (JsonWriter jsonWriter = new JsonWriter(out)) {
      jsonWriter.setIndent("  ");
      jsonWriter.beginArray();
      for (Symbol symbol : symbols) {
        jsonWriter.beginObject();
        jsonWriter.name("identifier").value(symbol.getIdentifier());
        jsonWriter.name("kind").value(symbol.getKind().name());
        jsonWriter.name("context").value(symbol.getDottedContext());
        jsonWriter.name("location");
        writeLocation(jsonWriter, symbol.getLocation());
        jsonWriter.endObject();
      }
      jsonWriter.endArray();
      jsonWriter.flush();
    } catch (IOException e) {
      // A StringWriter never fails.
      throw new UncheckedIOException(e);
    }
    return out.toString();
  }

  private static void writeLocation(JsonWriter jsonWriter, @Nullable LocationRange location)
      throws IOException {
    if (location == null) {
      jsonWriter.nullValue();
      return;
    }
    jsonWriter.beginObject();
    jsonWriter.name("file").value(location.getFileName());
    jsonWriter.name("begin");
    writePosition(jsonWriter, location.getBegin());
    jsonWriter.name("end");
    writePosition(jsonWriter, location.getEnd());
    jsonWriter.endObject();
  }

  private static void writePosition(JsonWriter jsonWriter, Location position) throws IOException {
    jsonWriter.beginObject();
    jsonWriter.name("line").value(position.getLine());
    jsonWriter.name("column").value(position.getColumn());
    jsonWriter.endObject();
  }
}
