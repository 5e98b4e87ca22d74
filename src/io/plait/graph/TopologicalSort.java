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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.util.Iterator;

public class TopologicalSort {

  private TopologicalSort() {}

  /**
   * Sorts the graph so that every node comes after all nodes it has edges to (sinks first).
   * Among independent nodes, insertion order is kept.
   *
   * @throws AbstractAcyclicDepthFirstPostOrderTraversal.CycleException if the graph has a cycle.
   */
  public static <T> ImmutableList<T> sort(MutableDirectedGraph<T> graph)
      throws AbstractAcyclicDepthFirstPostOrderTraversal.CycleException {
    AbstractAcyclicDepthFirstPostOrderTraversal<T> traversal =
        new AbstractAcyclicDepthFirstPostOrderTraversal<T>() {
          @Override
          protected Iterator<T> findChildren(T node) {
            return graph.getOutgoingNodesFor(node).iterator();
          }
        };
    // Roots first so that cycles without a root are still reached through the full node list.
    ImmutableList<T> sorted =
        traversal.traverse(
            ImmutableList.<T>builder()
                .addAll(graph.getNodesWithNoIncomingEdges())
                .addAll(graph.getNodes())
                .build());

    Preconditions.checkState(
        sorted.size() == graph.getNodeCount(),
        "Expected number of topologically sorted nodes (%s) to be same as number of nodes in "
            + "graph (%s)",
        sorted.size(),
        graph.getNodeCount());
    return sorted;
  }
}
