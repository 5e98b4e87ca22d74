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
import static org.junit.Assert.assertThrows;

import io.plait.graph.AbstractAcyclicDepthFirstPostOrderTraversal.CycleException;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class TopologicalSortTest {

  @Test
  public void dependenciesComeFirst() throws CycleException {
    MutableDirectedGraph<String> graph = new MutableDirectedGraph<>();
    graph.addEdge("app", "net");
    graph.addEdge("app", "util");
    graph.addEdge("net", "util");
    graph.addNode("docs");

    assertThat(TopologicalSort.sort(graph))
        .containsExactly("util", "net", "app", "docs")
        .inOrder();
  }

  @Test
  public void independentNodesKeepInsertionOrder() throws CycleException {
    MutableDirectedGraph<String> graph = new MutableDirectedGraph<>();
    graph.addNode("c");
    graph.addNode("a");
    graph.addNode("b");
    assertThat(TopologicalSort.sort(graph)).containsExactly("c", "a", "b").inOrder();
  }

  @Test
  public void cycleIsReportedInFull() {
    MutableDirectedGraph<String> graph = new MutableDirectedGraph<>();
    graph.addEdge("a", "b");
    graph.addEdge("b", "c");
    graph.addEdge("c", "a");
    CycleException e = assertThrows(CycleException.class, () -> TopologicalSort.sort(graph));
    assertThat(e.getCycle()).containsExactly("a", "b", "c", "a").inOrder();
    assertThat(e.getMessage()).isEqualTo("Cycle found: a -> b -> c -> a");
  }
}
