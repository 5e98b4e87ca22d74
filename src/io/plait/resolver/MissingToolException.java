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

import io.plait.util.HumanReadableException;
import io.plait.util.Origin;
import java.util.Optional;
import javax.annotation.Nullable;

/** A target needs a tool, or a handler for a source suffix, that its environment lacks. */
@SuppressWarnings("serial")
public class MissingToolException extends HumanReadableException {

  @Nullable private final String suffix;
  @Nullable private final String tool;

  private MissingToolException(
      @Nullable Origin origin, @Nullable String suffix, @Nullable String tool, String message) {
    super(origin, null, message);
    this.suffix = suffix;
    this.tool = tool;
  }

  /** No toolchain of the environment knows how to build sources with this suffix. */
  public static MissingToolException noHandler(
      String targetName, String environmentName, String suffix, String source, Origin origin) {
    return new MissingToolException(
        origin,
        suffix,
        null,
        String.format(
            "%s: no tool in environment %s handles %s files (%s)",
            targetName,
            environmentName,
            suffix.isEmpty() ? "suffix-less" : suffix,
            source));
  }

  /** The toolchain maps the suffix to a tool that the environment does not define. */
  public static MissingToolException forSuffix(
      String targetName, String environmentName, String suffix, String tool, Origin origin) {
    return new MissingToolException(
        origin,
        suffix,
        tool,
        String.format(
            "%s: %s files need tool %s, which environment %s does not have",
            targetName,
            suffix,
            tool,
            environmentName));
  }

  /** A step other than compilation, e.g. archiving or linking, needs a missing tool. */
  public static MissingToolException forStep(
      String targetName, String environmentName, String tool, String step, Origin origin) {
    return new MissingToolException(
        origin,
        null,
        tool,
        String.format(
            "%s: %s needs tool %s, which environment %s does not have",
            targetName,
            step,
            tool,
            environmentName));
  }

  /** The environment has no toolchain at all. */
  public static MissingToolException noToolchain(
      String targetName, String environmentName, String step, Origin origin) {
    return new MissingToolException(
        origin,
        null,
        null,
        String.format(
            "%s: %s needs a toolchain, but environment %s has none",
            targetName,
            step,
            environmentName));
  }

  public Optional<String> getSuffix() {
    return Optional.ofNullable(suffix);
  }

  public Optional<String> getTool() {
    return Optional.ofNullable(tool);
  }
}
