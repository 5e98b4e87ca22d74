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
import java.nio.file.Path;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * A directory with an explicit member list. Only the declared members count: files that appear in
 * the directory on disk are never part of the graph.
 */
public class DirNode extends Node {

  /** How the directory takes part in the graph; fixed when the node is created. */
  public enum Role {
    /** Up to date when all members are; emitted as a grouping step over the members. */
    TARGET,
    /** Stands for its members when used as an input. */
    SOURCE,
  }

  private final Path path;
  private final Role role;
  private final Set<Node> members = new LinkedHashSet<>();

  DirNode(Path path, Role role, Origin origin) {
    super(origin);
    this.path = path;
    this.role = role;
  }

  public Path getPath() {
    return path;
  }

  public Role getRole() {
    return role;
  }

  /** @return whether the member was newly added. */
  public boolean addMember(Node member) {
    Preconditions.checkArgument(member != this, "%s cannot contain itself", this);
    boolean added = members.add(member);
    if (added && role == Role.TARGET) {
      addExplicitDep(member);
    }
    return added;
  }

  public ImmutableList<Node> getMembers() {
    return ImmutableList.copyOf(members);
  }

  @Override
  public String getName() {
    return path.toString();
  }
}
