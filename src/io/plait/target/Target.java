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

package io.plait.target;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Iterables;
import io.plait.env.Environment;
import io.plait.env.ToolBuilder;
import io.plait.model.Node;
import io.plait.model.NodeRegistry;
import io.plait.util.Origin;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import javax.annotation.Nullable;

/**
 * A declared build artifact: what to build, from which sources, and what it requires of, or
 * exposes to, the targets linked with it.
 *
 * <p>A target is configuration until the resolver has run. Its object and output nodes are only
 * available afterwards; asking for them earlier is an {@link IllegalStateException}.
 */
public class Target {

  private final String name;
  private final TargetKind kind;
  private final Environment environment;
  private final Origin origin;

  private final List<Object> sources = new ArrayList<>();
  private final Set<Target> publicLinks = new LinkedHashSet<>();
  private final Set<Target> privateLinks = new LinkedHashSet<>();
  private final List<String> declaredOutputs = new ArrayList<>();
  private final List<DeferredOperation> deferredOperations = new ArrayList<>();
  private UsageRequirements publicRequirements = UsageRequirements.of();
  private UsageRequirements privateRequirements = UsageRequirements.of();
  @Nullable private String outputName;
  @Nullable private ToolBuilder builder;
  @Nullable private String command;

  private boolean resolved;
  private ImmutableList<Node> objectNodes = ImmutableList.of();
  private final Set<Node> outputNodes = new LinkedHashSet<>();

  /** Targets are created through the factory methods of {@link io.plait.project.Project}. */
  public Target(String name, TargetKind kind, Environment environment, Origin origin) {
    Preconditions.checkArgument(!name.isEmpty(), "target name must not be empty");
    this.name = name;
    this.kind = kind;
    this.environment = environment;
    this.origin = origin;
  }

  public String getName() {
    return name;
  }

  public TargetKind getKind() {
    return kind;
  }

  public Environment getEnvironment() {
    return environment;
  }

  public Origin getOrigin() {
    return origin;
  }

  /**
   * Adds sources: paths or strings (relative to the project root), nodes, or other targets, which
   * stand for their outputs.
   */
  public Target addSources(Object... newSources) {
    checkConfigurable();
    for (Object source : newSources) {
      Preconditions.checkArgument(source != this, "%s cannot be its own source", name);
      sources.add(Preconditions.checkNotNull(source));
    }
    return this;
  }

  public ImmutableList<Object> getSources() {
    return ImmutableList.copyOf(sources);
  }

  /** @return the targets among {@link #getSources()}. */
  public ImmutableList<Target> getSourceTargets() {
    return Install.targetsIn(sources);
  }

  public Target publicIncludes(String... dirs) {
    return addPublic(UsageRequirements.builder().setIncludeDirs(toPaths(dirs)).build());
  }

  public Target publicDefines(String... defines) {
    return addPublic(UsageRequirements.builder().setDefines(Arrays.asList(defines)).build());
  }

  public Target publicCompileFlags(String... flags) {
    return addPublic(UsageRequirements.builder().setCompileFlags(Arrays.asList(flags)).build());
  }

  public Target publicLinkFlags(String... flags) {
    return addPublic(UsageRequirements.builder().setLinkFlags(Arrays.asList(flags)).build());
  }

  public Target publicLinkLibs(String... libs) {
    return addPublic(UsageRequirements.builder().setLinkLibs(Arrays.asList(libs)).build());
  }

  public Target publicLinkDirs(String... dirs) {
    return addPublic(UsageRequirements.builder().setLinkDirs(toPaths(dirs)).build());
  }

  public Target privateIncludes(String... dirs) {
    return addPrivate(UsageRequirements.builder().setIncludeDirs(toPaths(dirs)).build());
  }

  public Target privateDefines(String... defines) {
    return addPrivate(UsageRequirements.builder().setDefines(Arrays.asList(defines)).build());
  }

  public Target privateCompileFlags(String... flags) {
    return addPrivate(UsageRequirements.builder().setCompileFlags(Arrays.asList(flags)).build());
  }

  public Target privateLinkFlags(String... flags) {
    return addPrivate(UsageRequirements.builder().setLinkFlags(Arrays.asList(flags)).build());
  }

  public Target privateLinkLibs(String... libs) {
    return addPrivate(UsageRequirements.builder().setLinkLibs(Arrays.asList(libs)).build());
  }

  public Target privateLinkDirs(String... dirs) {
    return addPrivate(UsageRequirements.builder().setLinkDirs(toPaths(dirs)).build());
  }

  public Target addPublic(UsageRequirements requirements) {
    checkConfigurable();
    publicRequirements =
        publicRequirements.merge(requirements, environment.getSeparatedArgFlags());
    return this;
  }

  public Target addPrivate(UsageRequirements requirements) {
    checkConfigurable();
    privateRequirements =
        privateRequirements.merge(requirements, environment.getSeparatedArgFlags());
    return this;
  }

  public UsageRequirements getPublicRequirements() {
    return publicRequirements;
  }

  public UsageRequirements getPrivateRequirements() {
    return privateRequirements;
  }

  /** Links {@code deps}; their public requirements become part of this target's own. */
  public Target link(Target... deps) {
    return addLinks(publicLinks, deps);
  }

  /** Links {@code deps} without passing their public requirements on to this target's users. */
  public Target linkPrivate(Target... deps) {
    return addLinks(privateLinks, deps);
  }

  public ImmutableSet<Target> getPublicLinks() {
    return ImmutableSet.copyOf(publicLinks);
  }

  public ImmutableSet<Target> getPrivateLinks() {
    return ImmutableSet.copyOf(privateLinks);
  }

  /** @return public links followed by private ones. */
  public ImmutableSet<Target> getLinks() {
    return ImmutableSet.copyOf(Iterables.concat(publicLinks, privateLinks));
  }

  /** Targets that must be resolved before this one. */
  public ImmutableSet<Target> getDependencies() {
    ImmutableSet.Builder<Target> deps = ImmutableSet.builder();
    deps.addAll(getLinks()).addAll(getSourceTargets());
    for (DeferredOperation operation : deferredOperations) {
      deps.addAll(operation.getTargetDependencies());
    }
    return deps.build();
  }

  /** Overrides the toolchain's default file name for this target's primary output. */
  public Target outputName(String fileName) {
    checkConfigurable();
    this.outputName = fileName;
    return this;
  }

  public Optional<String> getOutputName() {
    return Optional.ofNullable(outputName);
  }

  public Target setBuilder(ToolBuilder builder) {
    Preconditions.checkState(kind == TargetKind.CUSTOM, "only custom targets run builders");
    this.builder = builder;
    return this;
  }

  public Optional<ToolBuilder> getBuilder() {
    return Optional.ofNullable(builder);
  }

  /** Sets the command template of a custom target, expanded in this target's environment. */
  public Target setCommand(String commandTemplate) {
    Preconditions.checkState(kind == TargetKind.CUSTOM, "only custom targets run commands");
    this.command = commandTemplate;
    return this;
  }

  public Optional<String> getCommand() {
    return Optional.ofNullable(command);
  }

  /** Adds files a custom target produces, relative to the build directory. */
  public Target addOutputs(String... outputs) {
    checkConfigurable();
    declaredOutputs.addAll(Arrays.asList(outputs));
    return this;
  }

  public ImmutableList<String> getDeclaredOutputs() {
    return ImmutableList.copyOf(declaredOutputs);
  }

  public Target defer(DeferredOperation operation) {
    checkConfigurable();
    deferredOperations.add(operation);
    return this;
  }

  public ImmutableList<DeferredOperation> getDeferredOperations() {
    return ImmutableList.copyOf(deferredOperations);
  }

  public boolean isResolved() {
    return resolved;
  }

  /** The objects compiled from this target's sources. */
  public ImmutableList<Node> getObjectNodes() {
    checkResolved();
    return objectNodes;
  }

  /** The files this target produces, primary output first. */
  public ImmutableList<Node> getOutputNodes() {
    checkResolved();
    return ImmutableList.copyOf(outputNodes);
  }

  /** Called by the resolver once this target's sources are compiled. */
  public void setObjectNodes(Iterable<? extends Node> objects) {
    Preconditions.checkState(!resolved, "%s is already resolved", name);
    objectNodes = ImmutableList.copyOf(objects);
  }

  /** Called by the resolver; adding a node twice keeps one entry. */
  public void addOutputNodes(Iterable<? extends Node> outputs) {
    Preconditions.checkState(!resolved, "%s is already resolved", name);
    Iterables.addAll(outputNodes, outputs);
  }

  /** Called by the resolver once every output, including deferred ones, is known. */
  public void markResolved() {
    resolved = true;
  }

  private Target addLinks(Set<Target> links, Target... deps) {
    checkConfigurable();
    for (Target dep : deps) {
      Preconditions.checkArgument(dep != this, "%s cannot link itself", name);
      links.add(dep);
    }
    return this;
  }

  private ImmutableList<Path> toPaths(String... dirs) {
    NodeRegistry registry = environment.getProject().getNodeRegistry();
    ImmutableList.Builder<Path> paths = ImmutableList.builder();
    for (String dir : dirs) {
      paths.add(registry.canonicalize(dir));
    }
    return paths.build();
  }

  private void checkConfigurable() {
    Preconditions.checkState(!resolved, "%s is already resolved and can no longer change", name);
  }

  private void checkResolved() {
    Preconditions.checkState(resolved, "%s has not been resolved yet", name);
  }

  @Override
  public String toString() {
    return name;
  }
}
