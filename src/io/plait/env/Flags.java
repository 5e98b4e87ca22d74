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

package io.plait.env;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Iterables;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Order-preserving deduplication of command-line flags.
 *
 * <p>Flags that take their argument as the next token ({@code -framework Foo}) are compared as
 * (flag, argument) pairs, so {@code -F a -F b} is kept whole while {@code -F a -F a} collapses.
 */
public final class Flags {

  private Flags() {}

  public static ImmutableList<String> deduplicate(
      Iterable<String> flags, Set<String> separatedArgFlags) {
    Set<List<String>> seen = new LinkedHashSet<>();
    Iterator<String> it = flags.iterator();
    while (it.hasNext()) {
      String flag = it.next();
      if (separatedArgFlags.contains(flag) && it.hasNext()) {
        seen.add(ImmutableList.of(flag, it.next()));
      } else {
        seen.add(ImmutableList.of(flag));
      }
    }
    return ImmutableList.copyOf(Iterables.concat(seen));
  }

  /** @return {@code existing} followed by the flags of {@code added} it does not have yet. */
  public static ImmutableList<String> merge(
      Iterable<String> existing, Iterable<String> added, Set<String> separatedArgFlags) {
    return deduplicate(Iterables.concat(existing, added), separatedArgFlags);
  }
}
