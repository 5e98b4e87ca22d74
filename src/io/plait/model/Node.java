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

package io.plait.model;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import io.plait.util.Origin;
import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.Set;
import javax.annotation.Nullable;

/**
 * A vertex of the build graph.
 *
 * <p>Nodes are only created through a {@link NodeRegistry}, which guarantees a single instance per
 * identity. Equality is therefore identity.
 */
public abstract class Node {

  private final Origin origin;
  private final Set<Node> explicitDeps = new LinkedHashSet<>();
  private final Set<Node> implicitDeps = new LinkedHashSet<>();
  private final Set<Node> orderOnlyDeps = new LinkedHashSet<>();
  @Nullable private BuildStep producer;

  protected Node(Origin origin) {
    this.origin = origin;
  }

  /** @return the identity of this node within its registry: a path or a name. */
  public abstract String getName();

  public Origin getOrigin() {
    return origin;
  }

  /** @return whether the dependency was newly added. */
  public boolean addExplicitDep(Node dep) {
    return explicitDeps.add(checkDep(dep));
  }

  /** @return whether the dependency was newly added. */
  public boolean addImplicitDep(Node dep) {
    return implicitDeps.add(checkDep(dep));
  }

  /**
   * Adds a dependency that must exist before this node is built but whose changes do not make
   * this node stale, such as a generated header directory.
   *
   * @return whether the dependency was newly added.
   */
  public boolean addOrderOnlyDep(Node dep) {
    return orderOnlyDeps.add(checkDep(dep));
  }

  private Node checkDep(Node dep) {
    Preconditions.checkNotNull(dep);
    Preconditions.checkArgument(dep != this, "%s cannot depend on itself", this);
    return dep;
  }

  public ImmutableList<Node> getExplicitDeps() {
    return ImmutableList.copyOf(explicitDeps);
  }

  public ImmutableList<Node> getImplicitDeps() {
    return ImmutableList.copyOf(implicitDeps);
  }

  public ImmutableList<Node> getOrderOnlyDeps() {
    return ImmutableList.copyOf(orderOnlyDeps);
  }

  public Optional<BuildStep> getProducer() {
    return Optional.ofNullable(producer);
  }

  /** @return whether this node exists before the build runs, i.e. nothing produces it. */
  public boolean isSource() {
    return producer == null;
  }

  /**
   * Records the step that produces this node. A node has at most one producer; setting the same
   * step again is a no-op.
   */
  public void setProducer(BuildStep step) {
    Preconditions.checkNotNull(step);
    Preconditions.checkState(
        producer == null || producer.equals(step),
        "%s already has a producer: %s",
        this,
        producer);
    Preconditions.checkArgument(
        step.getOutputs().contains(this), "%s is not an output of %s", this, step);
    producer = step;
  }

  @Override
  public String toString() {
    return getName();
  }
}
