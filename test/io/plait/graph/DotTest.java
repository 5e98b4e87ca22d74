/*
 * Copyright 2018-present Facebook, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License"); you may
 * not use this file except in compliance with the License. You may obtain
 * a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS, WITHOUT
 * WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied. See the
 * License for the specific language governing permissions and limitations
 * under the License.
 */

package io.plait.graph;

import static com.google.common.truth.Truth.assertThat;

import java.io.IOException;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class DotTest {

  @Test
  public void writesSortedNodesAndEdges() throws IOException {
    MutableDirectedGraph<String> graph = new MutableDirectedGraph<>();
    graph.addEdge("app", "core");
    graph.addEdge("app", "gen-headers");

    StringBuilder output = new StringBuilder();
    Dot.builder(graph, "demo")
        .setNodeToTypeName(node -> node.equals("app") ? "program" : "static_library")
        .build()
        .writeOutput(output);

    assertThat(output.toString())
        .isEqualTo(
            "digraph demo {\n"
                + "  \"gen-headers\" [style=filled,color=springgreen3];\n"
                + "  app -> \"gen-headers\";\n"
                + "  app -> core;\n"
                + "  app [style=filled,color=indianred1];\n"
                + "  core [style=filled,color=springgreen3];\n"
                + "}\n");
  }

  @Test
  public void escapesNamesThatAreNotIdentifiers() {
    assertThat(Dot.escape("lib_core")).isEqualTo("lib_core");
    assertThat(Dot.escape("1st")).isEqualTo("\"1st\"");
    assertThat(Dot.escape("a\"b")).isEqualTo("\"a\\\"b\"");
  }

  @Test
  public void unknownTypesGetAStableColor() {
    assertThat(Dot.colorFromType("custom")).isEqualTo("mediumpurple1");
    assertThat(Dot.colorFromType("mystery")).isEqualTo(Dot.colorFromType("mystery"));
    assertThat(Dot.colorFromType("mystery")).startsWith("\"#");
  }
}
