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
import com.google.jsonnet.ast.LocationRange;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class SymbolTableJsonTest {

  @Test
  public void testEmpty() {
    assertThat(SymbolTableJson.toJson(ImmutableList.of())).isEqualTo("[]");
  }

  @Test
  public void testSymbols() {
    ImmutableList<Symbol> symbols =
        ImmutableList.of(
            Symbol.create(
                "a",
                Symbol.Kind.FIELD,
                ImmutableList.of("b", "c"),
                LocationRange.create("f.jsonnet", 1, 2, 1, 5)),
            Symbol.create("x", Symbol.Kind.LOCAL, ImmutableList.of(), null));
    assertThat(SymbolTableJson.toJson(symbols))
        .isEqualTo(
            "[\n"
                + "  {\n"
                + "    \"identifier\": \"a\",\n"
                + "    \"kind\": \"FIELD\",\n"
                + "    \"context\": \"b.c\",\n"
                + "    \"location\": {\n"
                + "      \"file\": \"f.jsonnet\",\n"
                + "      \"begin\": {\n"
                + "        \"line\": 1,\n"
                + "        \"column\": 2\n"
                + "      },\n"
                + "      \"end\": {\n"
                + "        \"line\": 1,\n"
                + "        \"column\": 5\n"
                + "      }\n"
                + "    }\n"
                + "  },\n"
                + "  {\n"
                + "    \"identifier\": \"x\",\n"
                + "    \"kind\": \"LOCAL\",\n"
                + "    \"context\": \"\",\n"
                + "    \"location\": null\n"
                + "  }\n"
                + "]");
  }
}
