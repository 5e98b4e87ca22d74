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

package io.plait.resolver;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import io.plait.util.HumanReadableException;
import io.plait.util.Origin;
import javax.annotation.Nullable;

/** Targets link, or take sources from, each other in a cycle. */
@SuppressWarnings("serial")
public class DependencyCycleException extends HumanReadableException {

  private final ImmutableList<String> cycle;

  public DependencyCycleException(Iterable<?> cycle, @Nullable Origin origin) {
    super(origin, null, "dependency cycle: " + Joiner.on(" -> ").join(cycle));
    ImmutableList.Builder<String> names = ImmutableList.builder();
    for (Object each : cycle) {
      names.add(each.toString());
    }
    this.cycle = names.build();
  }

  /** @return the target names on the cycle, starting and ending with the same one. */
  public ImmutableList<String> getCycle() {
    return cycle;
  }
}
