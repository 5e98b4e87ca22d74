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
import io.plait.model.DirNode;
import io.plait.model.Node;
import io.plait.util.HumanReadableException;

/** Copies a single file, or the single output of a target, to an exact destination. */
public class InstallAs implements DeferredOperation {

  private final String dest;
  private final Object source;

  public InstallAs(String dest, Object source) {
    this.dest = dest;
    this.source = source;
  }

  @Override
  public ImmutableList<Target> getTargetDependencies() {
    return Install.targetsIn(ImmutableList.of(source));
  }

  @Override
  public ImmutableList<Node> apply(Target owner, Context context) {
    ImmutableList<Node> resolved = context.resolveSources(owner, ImmutableList.of(source));
    if (resolved.size() != 1) {
      throw new HumanReadableException(
          "%s: install_as needs exactly one source file, got %s", owner.getName(), resolved);
    }
    if (resolved.get(0) instanceof DirNode) {
      throw new HumanReadableException(
          "%s: install_as copies single files, %s is a directory",
          owner.getName(),
          resolved.get(0).getName());
    }
    return ImmutableList.of(context.copy(owner, resolved.get(0), dest));
  }

  @Override
  public String toString() {
    return "InstallAs(" + dest + ", " + source + ")";
  }
}
