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

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.hash.Hasher;
import com.google.common.hash.Hashing;
import io.plait.env.Environment;
import io.plait.env.Flags;
import io.plait.env.SourceHandler;
import io.plait.env.ToolConfig;
import io.plait.env.Toolchain;
import io.plait.log.Logger;
import io.plait.model.BuildStep;
import io.plait.model.CommandArg;
import io.plait.model.FileNode;
import io.plait.model.Node;
import io.plait.model.NodeRegistry;
import io.plait.target.Target;
import io.plait.target.UsageRequirements;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Creates the object node, and its compile step, for one source of one target.
 *
 * <p>Objects are cached by source path and by a hash of everything that goes into the compile
 * command. A second target compiling the same source the same way gets the first target's object.
 */
class ObjectNodeFactory {

  private static final Logger LOG = Logger.get(ObjectNodeFactory.class);

  static final String INCLUDES = "includes";
  static final String DEFINES = "defines";
  static final String EXTRA_FLAGS = "extra_flags";

  private final NodeRegistry registry;
  private final Map<String, FileNode> cache = new HashMap<>();

  ObjectNodeFactory(NodeRegistry registry) {
    this.registry = registry;
  }

  /** A source handler and the toolchain it came from. */
  static final class Handler {
    private final Toolchain toolchain;
    private final SourceHandler sourceHandler;

    private Handler(Toolchain toolchain, SourceHandler sourceHandler) {
      this.toolchain = toolchain;
      this.sourceHandler = sourceHandler;
    }

    Toolchain getToolchain() {
      return toolchain;
    }

    SourceHandler getSourceHandler() {
      return sourceHandler;
    }
  }

  /** @return the first handler for {@code suffix} among the environment's toolchains. */
  static Optional<Handler> findHandler(Environment environment, String suffix) {
    for (Toolchain toolchain : environment.getToolchains()) {
      Optional<SourceHandler> handler = toolchain.getSourceHandler(suffix);
      if (handler.isPresent()) {
        return Optional.of(new Handler(toolchain, handler.get()));
      }
    }
    return Optional.empty();
  }

  static boolean isHeader(Environment environment, String suffix) {
    for (Toolchain toolchain : environment.getToolchains()) {
      if (toolchain.isHeaderSuffix(suffix)) {
        return true;
      }
    }
    return false;
  }

  /**
   * @param requirements the target's effective compile requirements.
   * @param orderOnly nodes that must exist before compiling, such as generated headers.
   */
  FileNode createObject(
      Target target,
      FileNode source,
      Handler handler,
      UsageRequirements requirements,
      Iterable<? extends Node> orderOnly) {
    Environment environment = target.getEnvironment();
    SourceHandler sourceHandler = handler.getSourceHandler();
    String tool = sourceHandler.getTool();
    if (!environment.getTool(tool).isPresent()) {
      throw MissingToolException.forSuffix(
          target.getName(), environment.getName(), source.getSuffix(), tool, target.getOrigin());
    }

    ImmutableMap<String, ImmutableList<CommandArg>> variables =
        getVariables(target, handler, requirements);
    ImmutableList<String> command =
        StepCommands.expand(
            environment, tool, sourceHandler.getCommandVariable(), target.getOrigin());

    String key = source.getPath() + "#" + hash(tool, sourceHandler, command, variables);
    FileNode cached = cache.get(key);
    if (cached != null) {
      LOG.verbose("Reusing %s for %s in %s", cached, source, target.getName());
      addOrderOnly(cached, orderOnly);
      return cached;
    }

    FileNode object =
        registry.file(getObjectPath(target, source, handler.getToolchain()), target.getOrigin());
    object.addExplicitDep(source);
    addOrderOnly(object, orderOnly);
    BuildStep step =
        BuildStep.builder()
            .setEnvironmentName(environment.getName())
            .setTool(tool)
            .setCommandVariable(sourceHandler.getCommandVariable())
            .setCommand(command)
            .addInputs(source)
            .addOutputs(object)
            .setVariables(variables)
            .setDepfile(sourceHandler.getDepfile())
            .setDepsStyle(sourceHandler.getDepsStyle())
            .setLanguage(sourceHandler.getLanguage())
            .setTargetName(target.getName())
            .build();
    object.setProducer(step);
    cache.put(key, object);
    return object;
  }

  private ImmutableMap<String, ImmutableList<CommandArg>> getVariables(
      Target target, Handler handler, UsageRequirements requirements) {
    Toolchain toolchain = handler.getToolchain();
    Optional<ToolConfig> toolConfig =
        target.getEnvironment().getTool(handler.getSourceHandler().getTool());

    Set<Path> includeDirs = new LinkedHashSet<>();
    for (String dir : toolConfig.map(ToolConfig::getIncludes).orElse(ImmutableList.of())) {
      includeDirs.add(registry.canonicalize(dir));
    }
    includeDirs.addAll(requirements.getIncludeDirs());
    ImmutableList.Builder<CommandArg> includes = ImmutableList.builder();
    for (Path dir : includeDirs) {
      includes.add(CommandArg.path(toolchain.getIncludeFlagPrefix(), dir));
    }

    Set<String> defineSet = new LinkedHashSet<>();
    defineSet.addAll(toolConfig.map(ToolConfig::getDefines).orElse(ImmutableList.of()));
    defineSet.addAll(requirements.getDefines());
    ImmutableList.Builder<CommandArg> defines = ImmutableList.builder();
    for (String define : defineSet) {
      defines.add(CommandArg.literal(toolchain.getDefineFlagPrefix() + define));
    }

    ImmutableList.Builder<CommandArg> extraFlags = ImmutableList.builder();
    for (String flag :
        Flags.merge(
            toolchain.getCompileFlagsForTargetKind(target.getKind()),
            requirements.getCompileFlags(),
            target.getEnvironment().getSeparatedArgFlags())) {
      extraFlags.add(CommandArg.literal(flag));
    }

    return ImmutableMap.of(
        INCLUDES, includes.build(), DEFINES, defines.build(), EXTRA_FLAGS, extraFlags.build());
  }

  /**
   * Objects go to {@code <build>/obj.<target>/} under the source's path, with generated sources
   * taken relative to the build directory. Two sources differing only in suffix keep it, e.g.
   * {@code foo.c.o} next to {@code foo.o}.
   */
  private Path getObjectPath(Target target, FileNode source, Toolchain toolchain) {
    Path buildDir = registry.getBuildDir();
    Path relative = source.getPath();
    if (relative.startsWith(buildDir) && !relative.equals(buildDir)) {
      relative = buildDir.relativize(relative);
    } else if (relative.isAbsolute()) {
      relative = relative.getRoot().relativize(relative);
    }
    relative = registry.toPath(relative.toString().replace("..", "__"));

    Path dir = buildDir.resolve("obj." + target.getName());
    String fileName = relative.getFileName().toString();
    String suffix = source.getSuffix();
    String stem = fileName.substring(0, fileName.length() - suffix.length());
    Path candidate = dir.resolve(relative).resolveSibling(stem + toolchain.getObjectSuffix());
    if (registry.get(candidate).isPresent()) {
      candidate = dir.resolve(relative).resolveSibling(fileName + toolchain.getObjectSuffix());
    }
    return candidate;
  }

  private static void addOrderOnly(Node object, Iterable<? extends Node> orderOnly) {
    for (Node node : orderOnly) {
      object.addOrderOnlyDep(node);
    }
  }

  private static String hash(
      String tool,
      SourceHandler handler,
      List<String> command,
      Map<String, ImmutableList<CommandArg>> variables) {
    Hasher hasher = Hashing.sha256().newHasher();
    hasher.putString(tool, StandardCharsets.UTF_8).putByte((byte) 0);
    hasher.putString(handler.getCommandVariable(), StandardCharsets.UTF_8).putByte((byte) 0);
    hasher.putString(Joiner.on('\0').join(command), StandardCharsets.UTF_8).putByte((byte) 0);
    for (Map.Entry<String, ImmutableList<CommandArg>> entry : variables.entrySet()) {
      hasher.putString(entry.getKey(), StandardCharsets.UTF_8).putByte((byte) 0);
      for (CommandArg arg : entry.getValue()) {
        hasher.putString(arg.toString(), StandardCharsets.UTF_8).putByte((byte) 0);
      }
    }
    return hasher.hash().toString();
  }
}
