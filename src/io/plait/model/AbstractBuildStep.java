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
import com.google.common.collect.ImmutableMap;
import io.plait.util.immutables.PlaitStyleImmutable;
import java.util.Optional;
import org.immutables.value.Value;

/**
 * One invocation of a tool: the producer of its output nodes.
 *
 * <p>{@link #getCommand()} is in executor syntax. It was expanded from the environment's
 * variables, so a {@code $name} left in a token is an executor variable: {@code $in}, {@code
 * $out}, or one of the {@link #getVariables() per-step variables}. Steps with the same environment,
 * tool and command variable share a command, which is what lets a generator emit one rule per
 * environment and tool.
 */
@Value.Immutable
@PlaitStyleImmutable
abstract class AbstractBuildStep {

  /** The environment whose variables produced {@link #getCommand()}. */
  public abstract String getEnvironmentName();

  public abstract String getTool();

  /** The tool variable holding the command template, e.g. {@code objcmd}. */
  public abstract String getCommandVariable();

  public abstract ImmutableList<String> getCommand();

  public abstract ImmutableList<Node> getInputs();

  public abstract ImmutableList<Node> getOutputs();

  /** Values for executor variables that differ from one step to the next. */
  public abstract ImmutableMap<String, ImmutableList<CommandArg>> getVariables();

  /** Depfile location in executor syntax, e.g. {@code $out.d}. */
  public abstract Optional<String> getDepfile();

  /** Depfile format understood by the executor, e.g. {@code gcc}. */
  public abstract Optional<String> getDepsStyle();

  /** Source language for compile steps; empty for every other kind of step. */
  public abstract Optional<String> getLanguage();

  /** Name of the target that declared this step, if any. */
  public abstract Optional<String> getTargetName();

  public boolean isCompile() {
    return getLanguage().isPresent();
  }

  @Value.Check
  protected void check() {
    Preconditions.checkState(!getOutputs().isEmpty(), "a build step needs at least one output");
    Preconditions.checkState(!getCommand().isEmpty(), "a build step needs a command");
    for (Node output : getOutputs()) {
      Preconditions.checkState(
          !getInputs().contains(output), "%s is both an input and an output of its step", output);
    }
  }

  @Override
  public String toString() {
    return getTool() + "." + getCommandVariable() + " -> " + getOutputs();
  }
}
