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

import com.google.common.base.Preconditions;
import io.plait.target.Target;

/**
 * A {@link ToolBuilder} bound to the environment whose variables it uses. Invoking it declares a
 * custom target in that environment.
 *
 * <p>The binding is plain data: {@link Environment#clone(String)} gives the clone its own bound
 * builders, and {@link #rebind(Environment)} returns a new binding. A target declared by {@link
 * #invoke} records the builder and environment it was invoked with, so rebinding later never moves
 * it.
 */
public class BoundBuilder {

  private final ToolBuilder builder;
  private final Environment environment;

  BoundBuilder(ToolBuilder builder, Environment environment) {
    this.builder = builder;
    this.environment = environment;
  }

  public ToolBuilder getBuilder() {
    return builder;
  }

  public Environment getEnvironment() {
    return environment;
  }

  /** @return the same builder bound to {@code environment}; this binding is unchanged. */
  public BoundBuilder rebind(Environment environment) {
    Preconditions.checkArgument(
        environment.getTool(builder.getTool()).isPresent(),
        "environment %s has no tool %s",
        environment.getName(),
        builder.getTool());
    return new BoundBuilder(builder, environment);
  }

  /**
   * Declares a target that runs this builder on {@code sources} to produce {@code output}.
   *
   * @param sources paths, strings, nodes or other targets.
   */
  public Target invoke(String targetName, String output, Object... sources) {
    return environment
        .getProject()
        .builderTarget(targetName, environment, builder, output, sources);
  }

  @Override
  public String toString() {
    return builder.getName() + "@" + environment.getName();
  }
}
