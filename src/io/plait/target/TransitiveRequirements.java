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

package io.plait.target;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import io.plait.graph.AbstractAcyclicDepthFirstPostOrderTraversal;
import io.plait.graph.AbstractAcyclicDepthFirstPostOrderTraversal.CycleException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/** Collects the requirements and libraries a target inherits through its links. */
public final class TransitiveRequirements {

  private TransitiveRequirements() {}

  /**
   * Returns the targets whose public requirements apply to {@code target}'s own sources: every
   * direct link, public or private, and everything reachable from those through public links, in
   * depth-first pre-order.
   */
  public static ImmutableList<Target> getCompileDependencies(Target target) {
    Set<Target> visited = new LinkedHashSet<>();
    for (Target dep : target.getLinks()) {
      addExported(dep, visited);
    }
    return ImmutableList.copyOf(visited);
  }

  private static void addExported(Target dep, Set<Target> visited) {
    if (!visited.add(dep)) {
      return;
    }
    for (Target next : dep.getPublicLinks()) {
      addExported(next, visited);
    }
  }

  /**
   * @return the requirements for compiling {@code target}'s sources: its own public and private
   *     requirements followed by the public requirements of its compile dependencies.
   */
  public static UsageRequirements getCompileRequirements(Target target) {
    List<UsageRequirements> parts = new ArrayList<>();
    parts.add(target.getPublicRequirements());
    parts.add(target.getPrivateRequirements());
    for (Target dep : getCompileDependencies(target)) {
      parts.add(dep.getPublicRequirements());
    }
    return UsageRequirements.concat(parts, target.getEnvironment().getSeparatedArgFlags());
  }

  /**
   * Returns the library-like targets to link into {@code target}, dependents before their
   * dependencies. Among independent targets declaration order is kept.
   *
   * <p>A shared library is linked as a whole, so only its public links are followed. Static,
   * object and interface libraries are never linked on their own, so their private links are
   * followed too.
   */
  public static ImmutableList<Target> getLinkDependencies(Target target) throws CycleException {
    AbstractAcyclicDepthFirstPostOrderTraversal<Target> traversal =
        new AbstractAcyclicDepthFirstPostOrderTraversal<Target>() {
          @Override
          protected Iterator<Target> findChildren(Target node) {
            return linkChildren(node).reverse().iterator();
          }
        };
    // Reversing a post-order over reversed children gives a topological order that keeps
    // declaration order between siblings.
    return traversal.traverse(linkable(target.getLinks()).reverse()).reverse();
  }

  /**
   * @return the link flags, libraries and library directories for linking {@code target}: its own,
   *     then those of each link dependency. Private requirements of static and object libraries
   *     are included, since whoever links their objects needs them.
   */
  public static UsageRequirements getLinkRequirements(
      Target target, Iterable<Target> linkDependencies) {
    List<UsageRequirements> parts = new ArrayList<>();
    parts.add(linkPart(target.getPublicRequirements()));
    parts.add(linkPart(target.getPrivateRequirements()));
    for (Target dep : linkDependencies) {
      parts.add(linkPart(dep.getPublicRequirements()));
      if (dep.getKind() != TargetKind.SHARED_LIBRARY) {
        parts.add(linkPart(dep.getPrivateRequirements()));
      }
    }
    return UsageRequirements.concat(parts, target.getEnvironment().getSeparatedArgFlags());
  }

  private static ImmutableList<Target> linkChildren(Target node) {
    if (node.getKind() == TargetKind.SHARED_LIBRARY) {
      return linkable(node.getPublicLinks());
    }
    return linkable(node.getLinks());
  }

  private static ImmutableList<Target> linkable(ImmutableSet<Target> targets) {
    ImmutableList.Builder<Target> result = ImmutableList.builder();
    for (Target each : targets) {
      switch (each.getKind()) {
        case STATIC_LIBRARY:
        case SHARED_LIBRARY:
        case OBJECT_LIBRARY:
        case INTERFACE:
          result.add(each);
          break;
        default:
          break;
      }
    }
    return result.build();
  }

  private static UsageRequirements linkPart(UsageRequirements requirements) {
    return UsageRequirements.builder()
        .setLinkFlags(requirements.getLinkFlags())
        .setLinkLibs(requirements.getLinkLibs())
        .setLinkDirs(requirements.getLinkDirs())
        .build();
  }
}
