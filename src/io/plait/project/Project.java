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

package io.plait.project;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import io.plait.env.BoundBuilder;
import io.plait.env.Environment;
import io.plait.env.ToolBuilder;
import io.plait.env.Toolchain;
import io.plait.log.Logger;
import io.plait.model.AliasNode;
import io.plait.model.DirNode;
import io.plait.model.FileNode;
import io.plait.model.Node;
import io.plait.model.NodeRegistry;
import io.plait.model.ValueNode;
import io.plait.resolver.Resolver;
import io.plait.target.Install;
import io.plait.target.InstallAs;
import io.plait.target.Target;
import io.plait.target.TargetKind;
import io.plait.util.Origin;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import javax.annotation.Nullable;

/**
 * Everything declared for one build: environments, targets, and the registry holding the single
 * node for each file, directory, alias and value.
 *
 * <p>Names of targets and of environments are unique. Declaring a second one with a taken name
 * renames it ({@code name_1}, {@code name_2}, ...), logs a warning and records the rename in
 * {@link #getNameConflicts()}.
 */
public class Project {

  private static final Logger LOG = Logger.get(Project.class);

  public static final String DEFAULT_BUILD_DIR = "build";

  private final String name;
  private final NodeRegistry registry;
  private final Map<String, Environment> environments = new LinkedHashMap<>();
  private final Map<String, Target> targets = new LinkedHashMap<>();
  private final Map<String, Origin> reservedEnvironmentNames = new LinkedHashMap<>();
  private final Map<AliasNode, List<Object>> aliasMembers = new LinkedHashMap<>();
  private final List<Object> defaults = new ArrayList<>();
  private final List<NameConflict> nameConflicts = new ArrayList<>();
  @Nullable private Resolver resolver;
  @Nullable private RuntimeException resolutionFailure;

  /** @param rootDir absolute; sources and install destinations are relative to it. */
  public Project(String name, Path rootDir) {
    this(name, rootDir, rootDir.getFileSystem().getPath(DEFAULT_BUILD_DIR));
  }

  /** @param buildDir where generated files go, relative to {@code rootDir}. */
  public Project(String name, Path rootDir, Path buildDir) {
    this.name = name;
    this.registry = new NodeRegistry(rootDir, buildDir);
  }

  public String getName() {
    return name;
  }

  public NodeRegistry getNodeRegistry() {
    return registry;
  }

  public Path getRootDir() {
    return registry.getRootDir();
  }

  /** Relative to the root directory. */
  public Path getBuildDir() {
    return registry.getBuildDir();
  }

  public Environment createEnvironment(String envName) {
    return createEnvironment(envName, null);
  }

  /** Creates and registers an environment set up with {@code toolchain}'s tools. */
  public Environment createEnvironment(String envName, @Nullable Toolchain toolchain) {
    Environment environment =
        new Environment(this, reserveEnvironmentName(envName), toolchain, Origin.capture());
    registerEnvironment(environment);
    LOG.debug("Created environment %s with toolchain %s", environment.getName(), toolchain);
    return environment;
  }

  /**
   * Claims an environment name, renaming it if it is already taken.
   *
   * @return the name to use.
   */
  public String reserveEnvironmentName(String requested) {
    String assigned = uniqueName("environment", requested, reservedEnvironmentNames.keySet());
    reservedEnvironmentNames.put(assigned, Origin.capture());
    return assigned;
  }

  /** @return the first unclaimed name of the form {@code <base>-<n>}. */
  public String nextCloneName(String base) {
    int n = 1;
    while (reservedEnvironmentNames.containsKey(base + "-" + n)) {
      n++;
    }
    return base + "-" + n;
  }

  /** Adds an environment whose name was claimed with {@link #reserveEnvironmentName}. */
  public void registerEnvironment(Environment environment) {
    Preconditions.checkArgument(
        environment.getProject() == this, "%s belongs to another project", environment);
    Preconditions.checkArgument(
        reservedEnvironmentNames.containsKey(environment.getName()),
        "environment name %s was not reserved",
        environment.getName());
    Preconditions.checkArgument(
        !environments.containsKey(environment.getName()),
        "environment %s is already registered",
        environment.getName());
    environments.put(environment.getName(), environment);
  }

  public ImmutableList<Environment> getEnvironments() {
    return ImmutableList.copyOf(environments.values());
  }

  public Optional<Environment> getEnvironment(String envName) {
    return Optional.ofNullable(environments.get(envName));
  }

  /** @return the first environment, creating one named {@code default} if there is none. */
  public Environment getDefaultEnvironment() {
    if (environments.isEmpty()) {
      return createEnvironment("default");
    }
    return environments.values().iterator().next();
  }

  public Target staticLibrary(String targetName, Environment env, Object... sources) {
    return addTarget(targetName, TargetKind.STATIC_LIBRARY, env).addSources(sources);
  }

  public Target sharedLibrary(String targetName, Environment env, Object... sources) {
    return addTarget(targetName, TargetKind.SHARED_LIBRARY, env).addSources(sources);
  }

  public Target program(String targetName, Environment env, Object... sources) {
    return addTarget(targetName, TargetKind.PROGRAM, env).addSources(sources);
  }

  public Target objectLibrary(String targetName, Environment env, Object... sources) {
    return addTarget(targetName, TargetKind.OBJECT_LIBRARY, env).addSources(sources);
  }

  /** A target with usage requirements and nothing to build. */
  public Target headerOnlyLibrary(String targetName, Environment env) {
    return addTarget(targetName, TargetKind.INTERFACE, env);
  }

  /**
   * Declares a target that runs a command template. {@code $$in} and {@code $$out} in the
   * template stand for the sources and outputs.
   *
   * @param outputs relative to the build directory.
   */
  public Target command(
      String targetName,
      Environment env,
      String commandTemplate,
      Iterable<String> outputs,
      Object... sources) {
    Target target = addTarget(targetName, TargetKind.CUSTOM, env);
    target.setCommand(commandTemplate);
    for (String output : outputs) {
      target.addOutputs(output);
    }
    return target.addSources(sources);
  }

  /** Declares a target that runs a bound builder; see {@link BoundBuilder#invoke}. */
  public Target builderTarget(
      String targetName,
      Environment env,
      ToolBuilder builder,
      String output,
      Object... sources) {
    return addTarget(targetName, TargetKind.CUSTOM, env)
        .setBuilder(builder)
        .addOutputs(output)
        .addSources(sources);
  }

  /**
   * Copies files, or the outputs of targets, into {@code destDir}. The sources are looked up
   * after every build target is resolved, so targets may be declared later.
   *
   * @param destDir relative to the project root.
   */
  public Target install(String targetName, String destDir, Object... sources) {
    return install(targetName, getDefaultEnvironment(), destDir, sources);
  }

  public Target install(String targetName, Environment env, String destDir, Object... sources) {
    return addTarget(targetName, TargetKind.INSTALL, env)
        .defer(new Install(destDir, Arrays.asList(sources)));
  }

  /** Copies one file, or the single output of a target, to {@code dest}. */
  public Target installAs(String targetName, String dest, Object source) {
    return installAs(targetName, getDefaultEnvironment(), dest, source);
  }

  public Target installAs(String targetName, Environment env, String dest, Object source) {
    return addTarget(targetName, TargetKind.INSTALL, env).defer(new InstallAs(dest, source));
  }

  /** Creates and registers a target, renaming it if its name is taken. */
  private Target addTarget(String requested, TargetKind kind, Environment env) {
    Preconditions.checkArgument(
        env.getProject() == this, "environment %s belongs to another project", env.getName());
    String assigned = uniqueName("target", requested, targets.keySet());
    Target target = new Target(assigned, kind, env, Origin.capture());
    targets.put(assigned, target);
    return target;
  }

  public ImmutableList<Target> getTargets() {
    return ImmutableList.copyOf(targets.values());
  }

  public Optional<Target> getTarget(String targetName) {
    return Optional.ofNullable(targets.get(targetName));
  }

  public FileNode file(String path) {
    return registry.file(registry.toPath(path), Origin.capture());
  }

  /**
   * @param members nodes, or paths relative to the project root; as a target the directory
   *     depends on each of them.
   */
  public DirNode dir(String path, DirNode.Role role, Object... members) {
    DirNode dir = registry.dir(registry.toPath(path), role, Origin.capture());
    for (Object member : members) {
      dir.addMember(toNode(member));
    }
    return dir;
  }

  public ValueNode value(String valueName, String content) {
    return registry.value(valueName, content);
  }

  /**
   * Declares a named group. Members may be nodes, paths or targets; a target's outputs join the
   * group once it is resolved.
   */
  public AliasNode alias(String aliasName, Object... members) {
    AliasNode alias = registry.alias(aliasName, Origin.capture());
    List<Object> list = aliasMembers.computeIfAbsent(alias, a -> new ArrayList<>());
    list.addAll(Arrays.asList(members));
    return alias;
  }

  public ImmutableMap<AliasNode, ImmutableList<Object>> getAliasMembers() {
    ImmutableMap.Builder<AliasNode, ImmutableList<Object>> result = ImmutableMap.builder();
    for (Map.Entry<AliasNode, List<Object>> entry : aliasMembers.entrySet()) {
      result.put(entry.getKey(), ImmutableList.copyOf(entry.getValue()));
    }
    return result.build();
  }

  /** Marks targets or nodes as built by default. Without any, everything is. */
  public Project setDefault(Object... targetsOrNodes) {
    defaults.addAll(Arrays.asList(targetsOrNodes));
    return this;
  }

  public ImmutableList<Object> getDefaults() {
    return ImmutableList.copyOf(defaults);
  }

  public ImmutableList<NameConflict> getNameConflicts() {
    return ImmutableList.copyOf(nameConflicts);
  }

  /**
   * Resolves every target not yet resolved. Calling it again with nothing new does nothing.
   *
   * <p>A failed pass leaves the graph incomplete, so every later call rethrows the same error.
   */
  public void resolve() {
    if (resolutionFailure != null) {
      throw resolutionFailure;
    }
    if (resolver == null) {
      resolver = new Resolver(this);
    }
    try {
      resolver.resolve();
    } catch (RuntimeException e) {
      resolutionFailure = e;
      throw e;
    }
  }

  public Optional<RuntimeException> getResolutionFailure() {
    return Optional.ofNullable(resolutionFailure);
  }

  public boolean isResolved() {
    if (resolutionFailure != null) {
      return false;
    }
    for (Target target : targets.values()) {
      if (!target.isResolved()) {
        return false;
      }
    }
    return true;
  }

  private Node toNode(Object member) {
    if (member instanceof Node) {
      return (Node) member;
    }
    if (member instanceof Path) {
      return registry.file((Path) member, Origin.capture());
    }
    if (member instanceof String) {
      return registry.file(registry.toPath((String) member), Origin.capture());
    }
    throw new IllegalArgumentException("not a node or path: " + member);
  }

  private String uniqueName(String kind, String requested, Set<String> taken) {
    if (!taken.contains(requested)) {
      return requested;
    }
    int n = 1;
    while (taken.contains(requested + "_" + n)) {
      n++;
    }
    String assigned = requested + "_" + n;
    LOG.warn("%s name %s is already taken, renamed to %s", kind, requested, assigned);
    nameConflicts.add(NameConflict.of(kind, requested, assigned));
    return assigned;
  }

  @Override
  public String toString() {
    return "Project(" + name + ")";
  }
}
