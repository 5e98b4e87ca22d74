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
import com.google.common.collect.Iterables;
import io.plait.env.Flags;
import io.plait.util.immutables.PlaitStyleImmutable;
import java.nio.file.Path;
import java.util.Set;
import org.immutables.value.Value;

/**
 * Include directories, defines and flags that a target needs, either for its own sources or for
 * anything built against it.
 *
 * <p>Every list is ordered and free of duplicates. {@link #merge} keeps the first occurrence of
 * each entry, so merging is associative and gives the same lists no matter how often a requirement
 * set is reached.
 */
@Value.Immutable
@PlaitStyleImmutable
abstract class AbstractUsageRequirements {

  /** Canonical project paths. */
  public abstract ImmutableList<Path> getIncludeDirs();

  /** {@code NAME} or {@code NAME=VALUE}, without the define flag. */
  public abstract ImmutableList<String> getDefines();

  public abstract ImmutableList<String> getCompileFlags();

  public abstract ImmutableList<String> getLinkFlags();

  /** Libraries outside the project, linked by name, e.g. {@code m} or {@code pthread}. */
  public abstract ImmutableList<String> getLinkLibs();

  /** Canonical project paths searched for {@link #getLinkLibs()}. */
  public abstract ImmutableList<Path> getLinkDirs();

  public static UsageRequirements of() {
    return UsageRequirements.builder().build();
  }

  public boolean isEmpty() {
    return getIncludeDirs().isEmpty()
        && getDefines().isEmpty()
        && getCompileFlags().isEmpty()
        && getLinkFlags().isEmpty()
        && getLinkLibs().isEmpty()
        && getLinkDirs().isEmpty();
  }

  /**
   * @param separatedArgFlags flags whose argument is the next token; they are compared together
   *     with that argument.
   * @return these requirements followed by the entries of {@code other} not already present.
   */
  public UsageRequirements merge(UsageRequirements other, Set<String> separatedArgFlags) {
    if (other.isEmpty()) {
      return (UsageRequirements) this;
    }
    return UsageRequirements.builder()
        .setIncludeDirs(union(getIncludeDirs(), other.getIncludeDirs()))
        .setDefines(union(getDefines(), other.getDefines()))
        .setCompileFlags(Flags.merge(getCompileFlags(), other.getCompileFlags(), separatedArgFlags))
        .setLinkFlags(Flags.merge(getLinkFlags(), other.getLinkFlags(), separatedArgFlags))
        .setLinkLibs(union(getLinkLibs(), other.getLinkLibs()))
        .setLinkDirs(union(getLinkDirs(), other.getLinkDirs()))
        .build();
  }

  /** Merges requirement sets left to right. */
  public static UsageRequirements concat(
      Iterable<UsageRequirements> requirements, Set<String> separatedArgFlags) {
    UsageRequirements result = of();
    for (UsageRequirements each : requirements) {
      result = result.merge(each, separatedArgFlags);
    }
    return result;
  }

  private static <T> ImmutableSet<T> union(Iterable<T> first, Iterable<T> second) {
    return ImmutableSet.copyOf(Iterables.concat(first, second));
  }
}
