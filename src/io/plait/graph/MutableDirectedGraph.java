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
import com.google.common.collect.LinkedHashMultimap;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Represents a directed graph with unweighted edges. For a given source and sink node pair, there
 * is at most one directed edge connecting them in the graph. The graph is not required to be
 * connected or acyclic.
 *
 * <p>Nodes and edges are iterated in insertion order, which keeps every traversal over the graph
 * deterministic.
 *
 * @param <T> the type of object stored as nodes in this graph
 */
public final class MutableDirectedGraph<T> {

  /**
   * It is possible to have a node in the graph without any edges, which is why we must maintain a
   * separate collection for nodes in the graph, rather than just using the keySet of {@link
   * #outgoingEdges}.
   */
  private final Set<T> nodes;

  /** Keys are source nodes; values are corresponding sink nodes. */
  private final LinkedHashMultimap<T, T> outgoingEdges;

  /** Keys are sink nodes; values are corresponding source nodes. */
  private final LinkedHashMultimap<T, T> incomingEdges;

  public MutableDirectedGraph() {
    this.nodes = new LinkedHashSet<>();
    this.outgoingEdges = LinkedHashMultimap.create();
    this.incomingEdges = LinkedHashMultimap.create();
  }

  /** @return the number of nodes in the graph */
  public int getNodeCount() {
    return nodes.size();
  }

  /** @return whether the node was newly added */
  public boolean addNode(T node) {
    return nodes.add(Preconditions.checkNotNull(node));
  }

  /** Adds an edge, adding either endpoint as a node if it is not already present. */
  public void addEdge(T source, T sink) {
    addNode(source);
    addNode(sink);
    outgoingEdges.put(source, sink);
    incomingEdges.put(sink, source);
  }

  public Set<T> getOutgoingNodesFor(T source) {
    return Collections.unmodifiableSet(outgoingEdges.get(source));
  }

  public Set<T> getNodes() {
    return Collections.unmodifiableSet(nodes);
  }

  public ImmutableList<T> getNodesWithNoIncomingEdges() {
    ImmutableList.Builder<T> roots = ImmutableList.builder();
    for (T node : nodes) {
      if (!incomingEdges.containsKey(node)) {
        roots.add(node);
      }
    }
    return roots.build();
  }
}
