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

import com.google.common.base.Joiner;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Performs a depth-first, post-order traversal over a DAG.
 *
 * <p>If a cycle is encountered, a {@link CycleException} is thrown by {@link #traverse(Iterable)}.
 *
 * @param <T> the type of node in the graph
 */
public abstract class AbstractAcyclicDepthFirstPostOrderTraversal<T> {

  /**
   * Performs a depth-first, post-order traversal over a DAG.
   *
   * @param initialNodes The nodes from which to perform the traversal. Not allowed to contain
   *     {@code null}.
   * @return the nodes in the order they were explored, every node after all of its children.
   * @throws CycleException if a cycle is found while performing the traversal.
   */
  public ImmutableList<T> traverse(Iterable<? extends T> initialNodes) throws CycleException {
    Set<T> inProgress = new HashSet<>();
    LinkedHashSet<T> explored = new LinkedHashSet<>();

    for (T initialNode : initialNodes) {
      if (explored.contains(initialNode)) {
        continue;
      }

      // The current chain of nodes being explored, innermost first.
      Deque<Explorable> toExplore = new ArrayDeque<>();
      toExplore.add(new Explorable(initialNode));

      while (!toExplore.isEmpty()) {
        Explorable explorable = toExplore.peek();
        T node = explorable.node;

        // This could happen if one of the initial nodes is a dependency of the other.
        if (explored.contains(node)) {
          toExplore.removeFirst();
          continue;
        }

        inProgress.add(node);

        // Find children that need to be explored to add to the stack.
        int stackSize = toExplore.size();
        for (Iterator<T> iter = explorable.children; iter.hasNext(); ) {
          T child = iter.next();
          if (inProgress.contains(child)) {
            throw createCycleException(child, toExplore);
          } else if (!explored.contains(child)) {
            toExplore.addFirst(new Explorable(child));

            // Stop after one child: children are then visited in their declared order and a
            // CycleException holds exactly the nodes on the cycle.
            break;
          }
        }

        if (stackSize == toExplore.size()) {
          // Nothing was added to toExplore, so the current node can be popped off the stack and
          // marked as explored.
          toExplore.removeFirst();
          inProgress.remove(node);
          explored.add(node);
        }
      }
    }

    Preconditions.checkState(inProgress.isEmpty(), "No more nodes should be in progress.");

    return ImmutableList.copyOf(explored);
  }

  /** A node that needs to be explored, paired with a possibly paused iteration of its children. */
  private class Explorable {
    private final T node;
    private final Iterator<T> children;

    Explorable(T node) {
      this.node = Preconditions.checkNotNull(node);
      this.children = findChildren(node);
    }
  }

  /**
   * @return the child nodes of the specified node. Child nodes will be explored in the order in
   *     which they are provided. Not allowed to contain {@code null}.
   */
  protected abstract Iterator<T> findChildren(T node);

  private CycleException createCycleException(T collisionNode, Iterable<Explorable> current) {
    Deque<T> chain = new ArrayDeque<>();
    chain.add(collisionNode);

    boolean foundStartOfCycle = false;
    for (Explorable explorable : current) {
      T node = explorable.node;
      chain.addFirst(node);
      if (collisionNode.equals(node)) {
        foundStartOfCycle = true;
        break;
      }
    }

    Preconditions.checkState(
        foundStartOfCycle,
        "Start of cycle %s should appear in traversal history %s.",
        collisionNode,
        chain);

    return new CycleException(chain);
  }

  @SuppressWarnings("serial")
  public static final class CycleException extends Exception {

    private final ImmutableList<?> nodes;

    private CycleException(Iterable<?> nodes) {
      super("Cycle found: " + Joiner.on(" -> ").join(nodes));
      this.nodes = ImmutableList.copyOf(nodes);
    }

    /** @return the nodes on the cycle, starting and ending with the same node. */
    public ImmutableList<?> getCycle() {
      return nodes;
    }
  }
}
