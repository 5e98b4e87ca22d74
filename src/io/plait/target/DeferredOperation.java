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
import io.plait.model.Node;

/**
 * Work on a target that reads other targets' outputs, so it cannot run until those targets are
 * resolved. Operations are recorded when declared and applied once, after every build target has
 * its outputs.
 */
public interface DeferredOperation {

  /** Targets whose outputs {@link #apply} reads. */
  ImmutableList<Target> getTargetDependencies();

  /** @return the nodes this operation adds to {@code owner}'s outputs. */
  ImmutableList<Node> apply(Target owner, Context context);

  /** What a deferred operation may ask of the resolver. */
  interface Context {

    /**
     * Turns source references (targets, nodes, paths or strings) into nodes. A target stands for
     * its outputs.
     */
    ImmutableList<Node> resolveSources(Target owner, Iterable<?> sources);

    /** Declares a step that copies {@code source} to {@code destination}. */
    Node copy(Target owner, Node source, String destination);
  }
}
