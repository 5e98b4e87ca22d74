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

package io.plait.subst;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import io.plait.util.Origin;
import javax.annotation.Nullable;

/** Expanding a variable required expanding that same variable again. */
@SuppressWarnings("serial")
public class CircularReferenceException extends SubstitutionException {

  private final ImmutableList<String> chain;

  public CircularReferenceException(Iterable<String> chain, @Nullable Origin origin) {
    super(origin, "circular variable reference: " + Joiner.on(" -> ").join(chain));
    this.chain = ImmutableList.copyOf(chain);
  }

  /** @return the variables in expansion order, starting and ending with the repeated one. */
  public ImmutableList<String> getChain() {
    return chain;
  }
}
