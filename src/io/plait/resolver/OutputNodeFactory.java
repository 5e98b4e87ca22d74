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
import com.google.common.collect.ImmutableMap;
import io.plait.env.Environment;
import io.plait.env.ToolBuilder;
import io.plait.env.Toolchain;
import io.plait.model.BuildStep;
import io.plait.model.CommandArg;
import io.plait.model.FileNode;
import io.plait.model.Node;
import io.plait.model.NodeRegistry;
import io.plait.subst.Substitution;
import io.plait.target.Target;
import io.plait.target.TargetKind;
import io.plait.target.UsageRequirements;
import io.plait.util.HumanReadableException;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;

/** Creates the primary outputs of library, program and custom targets. */
class OutputNodeFactory {

  static final String LIBRARY_COMMAND = "libcmd";
  static final String PROGRAM_COMMAND = "progcmd";
  static final String SHARED_COMMAND = "sharedcmd";

  static final String LDFLAGS = "ldflags";
  static final String LIBDIRS = "libdirs";
  static final String LIBS = "libs";

  /** Tool name recorded on the steps of command-template targets. */
  static final String COMMAND_TOOL = "command";

  private final NodeRegistry registry;

  OutputNodeFactory(NodeRegistry registry) {
    this.registry = registry;
  }

  /** Archives {@code inputs} into the target's static library. */
  FileNode createStaticLibrary(Target target, List<? extends Node> inputs) {
    Toolchain toolchain = StepCommands.requireToolchain(target, "archiving");
    String tool = toolchain.getArchiverTool();
    StepCommands.checkTool(target, target.getEnvironment(), tool, "archiving");
    String fileName =
        target.getOutputName().orElse(toolchain.getStaticLibraryName(target.getName()));
    return createOutput(target, fileName, tool, LIBRARY_COMMAND, inputs, ImmutableMap.of());
  }

  /**
   * Links a program or shared library.
   *
   * @param inputs objects, then the library files of the link dependencies.
   * @param requirements link flags, library directories and libraries.
   * @param languages the languages of every object linked, which pick the linker.
   */
  FileNode createLinkedOutput(
      Target target,
      List<? extends Node> inputs,
      UsageRequirements requirements,
      Set<String> languages) {
    Toolchain toolchain = StepCommands.requireToolchain(target, "linking");
    String tool = toolchain.getLinkerTool(languages);
    StepCommands.checkTool(target, target.getEnvironment(), tool, "linking");
    boolean shared = target.getKind() == TargetKind.SHARED_LIBRARY;
    String fileName =
        target
            .getOutputName()
            .orElse(
                shared
                    ? toolchain.getSharedLibraryName(target.getName())
                    : toolchain.getProgramName(target.getName()));

    ImmutableList.Builder<CommandArg> ldflags = ImmutableList.builder();
    for (String flag : requirements.getLinkFlags()) {
      ldflags.add(CommandArg.literal(flag));
    }
    ImmutableList.Builder<CommandArg> libdirs = ImmutableList.builder();
    for (Path dir : requirements.getLinkDirs()) {
      libdirs.add(CommandArg.path(toolchain.getLibraryDirFlagPrefix(), dir));
    }
    ImmutableList.Builder<CommandArg> libs = ImmutableList.builder();
    for (String lib : requirements.getLinkLibs()) {
      libs.add(CommandArg.literal(toolchain.getLibraryFlagPrefix() + lib));
    }

    return createOutput(
        target,
        fileName,
        tool,
        shared ? SHARED_COMMAND : PROGRAM_COMMAND,
        inputs,
        ImmutableMap.of(LDFLAGS, ldflags.build(), LIBDIRS, libdirs.build(), LIBS, libs.build()));
  }

  /** Creates the outputs of a builder or command-template target, all made by one step. */
  ImmutableList<Node> createCustomOutputs(Target target, List<? extends Node> inputs) {
    if (target.getDeclaredOutputs().isEmpty()) {
      throw new HumanReadableException("%s declares no outputs", target.getName());
    }
    ImmutableList.Builder<Node> outputs = ImmutableList.builder();
    for (String output : target.getDeclaredOutputs()) {
      FileNode node = newOutput(target, registry.getBuildDir().resolve(output));
      for (Node input : inputs) {
        node.addExplicitDep(input);
      }
      outputs.add(node);
    }
    ImmutableList<Node> outputNodes = outputs.build();

    BuildStep.Builder step =
        BuildStep.builder()
            .addAllInputs(inputs)
            .addAllOutputs(outputNodes)
            .setTargetName(target.getName());
    if (target.getBuilder().isPresent()) {
      ToolBuilder builder = target.getBuilder().get();
      Environment environment = target.getEnvironment();
      StepCommands.checkTool(target, environment, builder.getTool(), builder.getName());
      step.setEnvironmentName(environment.getName())
          .setTool(builder.getTool())
          .setCommandVariable(builder.getCommandVariable())
          .setCommand(
              StepCommands.expand(
                  environment, builder.getTool(), builder.getCommandVariable(), target.getOrigin()))
          .setLanguage(builder.getLanguage())
          .setDepfile(builder.getDepfile())
          .setDepsStyle(builder.getDepsStyle());
    } else {
      String template =
          target
              .getCommand()
              .orElseThrow(
                  () ->
                      new HumanReadableException(
                          "%s has neither a builder nor a command", target.getName()));
      Environment environment = target.getEnvironment();
      step.setEnvironmentName(environment.getName())
          .setTool(COMMAND_TOOL)
          .setCommandVariable(target.getName())
          .setCommand(
              Substitution.expandToSequence(
                  template, environment.getNamespace(), target.getOrigin()));
    }

    BuildStep built = step.build();
    for (Node output : outputNodes) {
      output.setProducer(built);
    }
    return outputNodes;
  }

  private FileNode createOutput(
      Target target,
      String fileName,
      String tool,
      String commandVariable,
      List<? extends Node> inputs,
      ImmutableMap<String, ImmutableList<CommandArg>> variables) {
    Environment environment = target.getEnvironment();
    FileNode output = newOutput(target, registry.getBuildDir().resolve(fileName));
    for (Node input : inputs) {
      output.addExplicitDep(input);
    }
    BuildStep step =
        BuildStep.builder()
            .setEnvironmentName(environment.getName())
            .setTool(tool)
            .setCommandVariable(commandVariable)
            .setCommand(StepCommands.expand(environment, tool, commandVariable, target.getOrigin()))
            .addAllInputs(inputs)
            .addOutputs(output)
            .setVariables(variables)
            .setTargetName(target.getName())
            .build();
    output.setProducer(step);
    return output;
  }

  /** Fails if another step already produces {@code path}. */
  FileNode newOutput(Target target, Path path) {
    FileNode node = registry.file(path, target.getOrigin());
    if (node.getProducer().isPresent()) {
      throw new HumanReadableException(
          "%s: %s is already produced by %s",
          target.getName(),
          node.getPath(),
          node.getProducer().get().getTargetName().orElse(node.getProducer().get().toString()));
    }
    return node;
  }
}
