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

package io.plait.generator;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.CharMatcher;
import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Iterables;
import io.plait.io.MoreFiles;
import io.plait.log.Logger;
import io.plait.model.AliasNode;
import io.plait.model.BuildStep;
import io.plait.model.CommandArg;
import io.plait.model.DirNode;
import io.plait.model.Node;
import io.plait.model.NodeRegistry;
import io.plait.model.ValueNode;
import io.plait.project.Project;
import io.plait.target.Target;
import io.plait.util.Escaper;
import io.plait.util.HumanReadableException;
import java.io.IOException;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Writes a Ninja build file for a resolved project.
 *
 * <p>Every build step gets a rule named after its tool, command variable and environment, so two
 * environments never share a rule even when their commands are identical today. Values that vary
 * per step ({@code includes}, {@code defines}, {@code ldflags}, ...) are written as per-build
 * variables, shell-quoted one argument at a time.
 */
public class NinjaGenerator implements Generator {

  private static final Logger LOG = Logger.get(NinjaGenerator.class);

  public static final String NAME = "ninja";

  public static final String DEFAULT_BUILD_FILE = "build.ninja";

  private static final CharMatcher RULE_NAME_CHARS =
      CharMatcher.inRange('a', 'z')
          .or(CharMatcher.inRange('A', 'Z'))
          .or(CharMatcher.inRange('0', '9'))
          .or(CharMatcher.anyOf("_-."));

  private final String buildFileName;

  public NinjaGenerator() {
    this(DEFAULT_BUILD_FILE);
  }

  public NinjaGenerator(String buildFileName) {
    this.buildFileName = buildFileName;
  }

  @Override
  public String getName() {
    return NAME;
  }

  public String getBuildFileName() {
    return buildFileName;
  }

  @Override
  public void generate(Project project, Path outputDir) {
    if (!project.isResolved()) {
      project.resolve();
    }
    OutputPaths paths = new OutputPaths(project.getNodeRegistry(), outputDir);
    String contents = render(project, paths);
    Path buildFile = paths.getOutputDir().resolve(buildFileName);
    writeValues(project.getNodeRegistry());
    try {
      if (MoreFiles.writeIfChanged(buildFile, contents)) {
        LOG.info("Wrote %s for %s", buildFile, project.getName());
      } else {
        LOG.debug("%s is up to date", buildFile);
      }
    } catch (IOException e) {
      throw new GenerateException(e, buildFile);
    }
  }

  /** Value nodes are files whose contents are known now; they are rewritten only on change. */
  private static void writeValues(NodeRegistry registry) {
    for (ValueNode value : registry.getValues()) {
      Path file = registry.toAbsolute(value.getPath());
      try {
        if (MoreFiles.writeIfChanged(file, value.getValue())) {
          LOG.debug("Updated value %s", value.getName());
        }
      } catch (IOException e) {
        throw new GenerateException(e, file);
      }
    }
  }

  @VisibleForTesting
  String render(Project project, Path outputDir) {
    return render(project, new OutputPaths(project.getNodeRegistry(), outputDir));
  }

  private String render(Project project, OutputPaths paths) {
    NinjaWriter writer = new NinjaWriter();
    writer
        .comment("Generated by plait for project " + project.getName() + ". Do not edit.")
        .variable("ninja_required_version", "1.3")
        .variable("builddir", ".")
        .newline();

    ImmutableList<BuildStep> steps = getSteps(project.getNodeRegistry());
    Map<BuildStep, String> ruleNames = writeRules(writer, steps);

    Set<String> declared = new HashSet<>();
    for (BuildStep step : steps) {
      writeBuild(writer, step, ruleNames.get(step), paths);
      for (Node output : step.getOutputs()) {
        declared.add(paths.render(output));
      }
    }

    for (Node node : project.getNodeRegistry().getNodes()) {
      if (node instanceof DirNode && ((DirNode) node).getRole() == DirNode.Role.TARGET) {
        String dir = paths.render(node);
        writer.phony(dir, renderAll(((DirNode) node).getMembers(), paths)).newline();
        declared.add(dir);
      }
    }
    for (AliasNode alias : project.getNodeRegistry().getAliases()) {
      writer.phony(alias.getName(), renderAll(alias.getExplicitDeps(), paths)).newline();
      declared.add(alias.getName());
    }
    for (Target target : project.getTargets()) {
      ImmutableList<Node> outputs = target.getOutputNodes();
      if (outputs.isEmpty() || !declared.add(target.getName())) {
        continue;
      }
      writer.phony(target.getName(), renderAll(outputs, paths)).newline();
    }

    ImmutableList<String> defaults = getDefaults(project, paths);
    if (!defaults.isEmpty()) {
      writer.defaults(defaults);
    }
    return writer.getContents();
  }

  private static ImmutableList<BuildStep> getSteps(NodeRegistry registry) {
    Set<BuildStep> steps = new LinkedHashSet<>();
    for (Node node : registry.getNodes()) {
      node.getProducer().ifPresent(steps::add);
    }
    return ImmutableList.copyOf(steps);
  }

  /**
   * Writes one rule per distinct command. Names take the form {@code tool_cmdvar_env}; a step
   * whose command differs from an existing rule of the same name gets a numbered one.
   */
  private static Map<BuildStep, String> writeRules(NinjaWriter writer, List<BuildStep> steps) {
    Map<RuleKey, String> rules = new LinkedHashMap<>();
    Map<String, Integer> usedNames = new HashMap<>();
    Map<BuildStep, String> result = new HashMap<>();
    for (BuildStep step : steps) {
      RuleKey key = new RuleKey(step);
      String name = rules.get(key);
      if (name == null) {
        String base =
            sanitize(
                step.getTool() + "_" + step.getCommandVariable() + "_" + step.getEnvironmentName());
        int count = usedNames.merge(base, 1, Integer::sum);
        name = count == 1 ? base : base + "_" + count;
        rules.put(key, name);
        writer
            .rule(
                name,
                key.command,
                Optional.of(step.getTool() + " $out"),
                step.getDepfile(),
                step.getDepsStyle())
            .newline();
      }
      result.put(step, name);
    }
    return result;
  }

  private static void writeBuild(
      NinjaWriter writer, BuildStep step, String rule, OutputPaths paths) {
    Set<Node> inputs = new LinkedHashSet<>(expandSourceDirs(step.getInputs()));
    Set<Node> implicit = new LinkedHashSet<>();
    Set<Node> orderOnly = new LinkedHashSet<>();
    for (Node output : step.getOutputs()) {
      implicit.addAll(expandSourceDirs(output.getExplicitDeps()));
      implicit.addAll(expandSourceDirs(output.getImplicitDeps()));
      orderOnly.addAll(expandSourceDirs(output.getOrderOnlyDeps()));
    }
    implicit.removeAll(inputs);
    orderOnly.removeAll(inputs);
    orderOnly.removeAll(implicit);

    Map<String, String> variables = new LinkedHashMap<>();
    for (Map.Entry<String, ImmutableList<CommandArg>> entry : step.getVariables().entrySet()) {
      if (!entry.getValue().isEmpty()) {
        variables.put(
            entry.getKey(), Escaper.joinShellArguments(paths.render(entry.getValue())));
      }
    }

    writer
        .build(
            renderAll(step.getOutputs(), paths),
            rule,
            renderAll(inputs, paths),
            renderAll(implicit, paths),
            renderAll(orderOnly, paths),
            variables)
        .newline();
  }

  /** A source directory stands for its members. */
  private static ImmutableList<Node> expandSourceDirs(Iterable<Node> nodes) {
    ImmutableList.Builder<Node> expanded = ImmutableList.builder();
    for (Node node : nodes) {
      if (node instanceof DirNode && ((DirNode) node).getRole() == DirNode.Role.SOURCE) {
        expanded.addAll(((DirNode) node).getMembers());
      } else {
        expanded.add(node);
      }
    }
    return expanded.build();
  }

  private static ImmutableList<String> getDefaults(Project project, OutputPaths paths) {
    Set<Node> nodes = new LinkedHashSet<>();
    if (project.getDefaults().isEmpty()) {
      for (Target target : project.getTargets()) {
        nodes.addAll(target.getOutputNodes());
      }
    } else {
      for (Object item : project.getDefaults()) {
        if (item instanceof Target) {
          nodes.addAll(((Target) item).getOutputNodes());
        } else if (item instanceof Node) {
          nodes.add((Node) item);
        } else {
          String name = String.valueOf(item);
          Optional<Target> target = project.getTarget(name);
          if (target.isPresent()) {
            nodes.addAll(target.get().getOutputNodes());
          } else {
            NodeRegistry registry = project.getNodeRegistry();
            nodes.add(
                registry
                    .get(registry.toPath(name))
                    .orElseThrow(
                        () ->
                            new HumanReadableException(
                                "default %s is neither a target nor a known file", name)));
          }
        }
      }
    }
    return renderAll(nodes, paths);
  }

  private static ImmutableList<String> renderAll(Iterable<Node> nodes, OutputPaths paths) {
    return ImmutableList.copyOf(Iterables.transform(nodes, paths::render));
  }

  private static String sanitize(String name) {
    return RULE_NAME_CHARS.negate().replaceFrom(name, '_');
  }

  /** What makes two steps share a rule: the same command, depfile and deps style. */
  private static class RuleKey {
    private final String environment;
    private final String tool;
    private final String commandVariable;
    private final String command;
    private final Optional<String> depfile;
    private final Optional<String> depsStyle;

    RuleKey(BuildStep step) {
      this.environment = step.getEnvironmentName();
      this.tool = step.getTool();
      this.commandVariable = step.getCommandVariable();
      this.command =
          Joiner.on(' ')
              .join(Iterables.transform(step.getCommand(), Escaper::escapeCommandToken));
      this.depfile = step.getDepfile();
      this.depsStyle = step.getDepsStyle();
    }

    private ImmutableList<Object> fields() {
      return ImmutableList.of(environment, tool, commandVariable, command, depfile, depsStyle);
    }

    @Override
    public boolean equals(Object other) {
      return other instanceof RuleKey && fields().equals(((RuleKey) other).fields());
    }

    @Override
    public int hashCode() {
      return fields().hashCode();
    }
  }
}
