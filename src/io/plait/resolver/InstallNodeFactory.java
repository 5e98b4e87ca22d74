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

import io.plait.env.Environment;
import io.plait.model.BuildStep;
import io.plait.model.FileNode;
import io.plait.model.Node;
import io.plait.model.NodeRegistry;
import io.plait.target.Target;

/** Creates copy steps for install targets, using the environment's {@code install} tool. */
class InstallNodeFactory {

  private final NodeRegistry registry;
  private final OutputNodeFactory outputs;

  InstallNodeFactory(NodeRegistry registry, OutputNodeFactory outputs) {
    this.registry = registry;
    this.outputs = outputs;
  }

  /** @param destination relative to the project root. */
  FileNode createCopy(Target target, Node source, String destination) {
    Environment environment = target.getEnvironment();
    StepCommands.checkTool(target, environment, Environment.INSTALL_TOOL, "installing");
    FileNode copy = outputs.newOutput(target, registry.canonicalize(destination));
    copy.addExplicitDep(source);
    BuildStep step =
        BuildStep.builder()
            .setEnvironmentName(environment.getName())
            .setTool(Environment.INSTALL_TOOL)
            .setCommandVariable(Environment.COPY_COMMAND_VARIABLE)
            .setCommand(
                StepCommands.expand(
                    environment,
                    Environment.INSTALL_TOOL,
                    Environment.COPY_COMMAND_VARIABLE,
                    target.getOrigin()))
            .addInputs(source)
            .addOutputs(copy)
            .setTargetName(target.getName())
            .build();
    copy.setProducer(step);
    return copy;
  }
}
