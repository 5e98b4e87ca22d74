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

package io.plait.project;

import io.plait.util.immutables.PlaitStyleImmutable;
import org.immutables.value.Value;

/** A declaration whose name was taken, and the name it got instead. */
@Value.Immutable
@PlaitStyleImmutable
abstract class AbstractNameConflict {

  /** {@code target} or {@code environment}. */
  @Value.Parameter
  public abstract String getKind();

  @Value.Parameter
  public abstract String getRequestedName();

  @Value.Parameter
  public abstract String getAssignedName();

  @Override
  public String toString() {
    return getKind() + " " + getRequestedName() + " -> " + getAssignedName();
  }
}
