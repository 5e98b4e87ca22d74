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
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import io.plait.log.Logger;
import io.plait.project.Project;
import io.plait.subst.Namespace;
import io.plait.subst.Substitution;
import io.plait.subst.Value;
import io.plait.util.Escaper;
import io.plait.util.HumanReadableException;
import io.plait.util.Origin;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import javax.annotation.Nullable;

/**
 * A named set of tool namespaces and cross-tool variables, used to turn command templates into
 * concrete commands.
 *
 * <p>Environments are created through {@link Project#createEnvironment}. Clones are deep copies
 * that register themselves with the project, so each clone gets its own build rules.
 */
public class Environment {

  private static final Logger LOG = Logger.get(Environment.class);

  /** Built into every environment: copies files for install steps. */
  public static final String INSTALL_TOOL = "install";

  public static final String COPY_COMMAND_VARIABLE = "copycmd";

  private final Project project;
  private final String name;
  @Nullable private final Toolchain toolchain;
  private final List<Toolchain> additionalToolchains = new ArrayList<>();
  private final Map<String, ToolConfig> tools = new LinkedHashMap<>();
  private final Map<String, Value> variables = new LinkedHashMap<>();
  private final Map<String, BoundBuilder> builders = new LinkedHashMap<>();
  private final Origin origin;

  /**
   * Creates an environment with the install tool and, when a toolchain is given, the toolchain's
   * tools. Callers go through {@link Project#createEnvironment}, which also registers it.
   */
  public Environment(Project project, String name, @Nullable Toolchain toolchain, Origin origin) {
    this(project, name, toolchain, origin, true);
  }

  private Environment(
      Project project,
      String name,
      @Nullable Toolchain toolchain,
      Origin origin,
      boolean setupTools) {
    Preconditions.checkArgument(!name.isEmpty(), "environment name must not be empty");
    this.project = project;
    this.name = name;
    this.toolchain = toolchain;
    this.origin = origin;
    if (setupTools) {
      addTool(INSTALL_TOOL)
          .setCmd("cp")
          .set(COPY_COMMAND_VARIABLE, "$install.cmd $$in $$out");
      if (toolchain != null) {
        toolchain.setup(this);
      }
    }
  }

  public Project getProject() {
    return project;
  }

  public String getName() {
    return name;
  }

  public Origin getOrigin() {
    return origin;
  }

  public Optional<Toolchain> getToolchain() {
    return Optional.ofNullable(toolchain);
  }

  /** @return the primary toolchain followed by any additional ones. */
  public ImmutableList<Toolchain> getToolchains() {
    ImmutableList.Builder<Toolchain> all = ImmutableList.builder();
    if (toolchain != null) {
      all.add(toolchain);
    }
    return all.addAll(additionalToolchains).build();
  }

  /** Adds a toolchain consulted for source suffixes the primary toolchain does not handle. */
  public Environment addToolchain(Toolchain extra) {
    additionalToolchains.add(extra);
    extra.setup(this);
    return this;
  }

  /** @return the separated-argument flags of every toolchain of this environment. */
  public ImmutableSet<String> getSeparatedArgFlags() {
    ImmutableSet.Builder<String> flags = ImmutableSet.builder();
    for (Toolchain each : getToolchains()) {
      flags.addAll(each.getSeparatedArgFlags());
    }
    return flags.build();
  }

  /** Returns the tool's namespace, creating an empty one if needed. */
  public ToolConfig addTool(String toolName) {
    return tools.computeIfAbsent(toolName, ToolConfig::new);
  }

  public Optional<ToolConfig> getTool(String toolName) {
    return Optional.ofNullable(tools.get(toolName));
  }

  public ImmutableMap<String, ToolConfig> getTools() {
    return ImmutableMap.copyOf(tools);
  }

  public Environment set(String variable, Value value) {
    int dot = variable.indexOf('.');
    Preconditions.checkArgument(
        dot < 0 || !tools.containsKey(variable.substring(0, dot)),
        "%s names a tool variable; set it on the tool",
        variable);
    variables.put(variable, Preconditions.checkNotNull(value));
    return this;
  }

  public Environment set(String variable, String value) {
    return set(variable, Value.of(value));
  }

  public Optional<Value> get(String variable) {
    return Optional.ofNullable(variables.get(variable));
  }

  public ImmutableMap<String, Value> getVariables() {
    return ImmutableMap.copyOf(variables);
  }

  /** Makes a builder available as {@link #getBuilder(String)}, bound to this environment. */
  public BoundBuilder addBuilder(ToolBuilder builder) {
    Preconditions.checkArgument(
        tools.containsKey(builder.getTool()),
        "builder %s needs tool %s, which %s does not have",
        builder.getName(),
        builder.getTool(),
        name);
    BoundBuilder bound = new BoundBuilder(builder, this);
    builders.put(builder.getName(), bound);
    return bound;
  }

  public BoundBuilder getBuilder(String builderName) {
    BoundBuilder bound = builders.get(builderName);
    if (bound == null) {
      throw new HumanReadableException(
          "environment %s has no builder named %s (known: %s)",
          name,
          builderName,
          builders.keySet());
    }
    return bound;
  }

  public ImmutableMap<String, BoundBuilder> getBuilders() {
    return ImmutableMap.copyOf(builders);
  }

  /** @return a snapshot of this environment's variables for the substitution engine. */
  public Namespace getNamespace() {
    Namespace.Builder builder = Namespace.builder().putAllVariables(variables);
    for (ToolConfig tool : tools.values()) {
      builder.putTool(tool.getName(), tool.getVariables());
    }
    return builder.build();
  }

  /**
   * Expands a template and renders it as one shell command line, quoting each token separately.
   *
   * @param overrides take precedence over this environment's variables; keys are bare names or
   *     {@code tool.var}.
   */
  public String subst(String template, Map<String, Value> overrides) {
    return Escaper.joinShellArguments(substList(template, overrides));
  }

  public String subst(String template) {
    return subst(template, ImmutableMap.of());
  }

  /** Expands a template into tokens; see {@link Substitution#expandToSequence}. */
  public ImmutableList<String> substList(String template, Map<String, Value> overrides) {
    return Substitution.expandToSequence(
        template, getNamespace().withOverrides(overrides), Origin.capture());
  }

  public ImmutableList<String> substList(String template) {
    return substList(template, ImmutableMap.of());
  }

  /**
   * Deep-copies this environment under a new name and registers the copy with the project. The
   * copy keeps the toolchain reference and gets its own bound builders.
   */
  public Environment clone(String cloneName) {
    Environment copy =
        new Environment(
            project, project.reserveEnvironmentName(cloneName), toolchain, Origin.capture(), false);
    copy.additionalToolchains.addAll(additionalToolchains);
    for (ToolConfig tool : tools.values()) {
      copy.tools.put(tool.getName(), tool.copy());
    }
    copy.variables.putAll(variables);
    for (BoundBuilder bound : builders.values()) {
      copy.builders.put(bound.getBuilder().getName(), new BoundBuilder(bound.getBuilder(), copy));
    }
    project.registerEnvironment(copy);
    LOG.debug("Cloned environment %s as %s", name, copy.getName());
    return copy;
  }

  /** Clones under a generated name of the form {@code <name>-<n>}. */
  @Override
  public Environment clone() {
    return clone(project.nextCloneName(name));
  }

  /**
   * @return a registered clone with the given variables replaced. Keys of the form {@code
   *     tool.var} set a tool variable; other keys set cross-tool variables.
   */
  public Environment override(Map<String, Value> overrides) {
    Environment copy = clone();
    for (Map.Entry<String, Value> entry : overrides.entrySet()) {
      String key = entry.getKey();
      int dot = key.indexOf('.');
      if (dot > 0 && copy.tools.containsKey(key.substring(0, dot))) {
        copy.tools.get(key.substring(0, dot)).set(key.substring(dot + 1), entry.getValue());
      } else {
        copy.variables.put(key, entry.getValue());
      }
    }
    return copy;
  }

  @Override
  public String toString() {
    return "Environment(" + name + ")";
  }
}
