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

import com.google.common.collect.ImmutableList;
import io.plait.env.Environment;
import io.plait.env.Toolchain;
import io.plait.subst.Substitution;
import io.plait.target.Target;
import io.plait.util.Origin;

/** Turns a tool's command variable into the command of a build step. */
final class StepCommands {

  private StepCommands() {}

  /** @return {@code $tool.commandVariable} expanded in {@code environment}, in executor syntax. */
  static ImmutableList<String> expand(
      Environment environment, String tool, String commandVariable, Origin origin) {
    return Substitution.expandToSequence(
        "$" + tool + "." + commandVariable, environment.getNamespace(), origin);
  }

  static void checkTool(Target target, Environment environment, String tool, String step) {
    if (!environment.getTool(tool).isPresent()) {
      throw MissingToolException.forStep(
          target.getName(), environment.getName(), tool, step, target.getOrigin());
    }
  }

  /** @return the environment's primary toolchain, or its first one. */
  static Toolchain requireToolchain(Target target, String step) {
    Environment environment = target.getEnvironment();
    ImmutableList<Toolchain> toolchains = environment.getToolchains();
    if (toolchains.isEmpty()) {
      throw MissingToolException.noToolchain(
          target.getName(), environment.getName(), step, target.getOrigin());
    }
    return toolchains.get(0);
  }
}
