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
import io.plait.util.Origin;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Owns every {@link Node} of one project and hands out a single instance per identity.
 *
 * <p>Files and directories share one namespace keyed by canonical path: the path is normalized and
 * made relative to the project root when it lies under it. Aliases and values are keyed by name.
 */
public class NodeRegistry {

  private static final String VALUES_DIR = ".values";

  private final Path rootDir;
  private final Path buildDir;
  private final Map<Path, Node> pathNodes = new LinkedHashMap<>();
  private final Map<String, AliasNode> aliases = new LinkedHashMap<>();
  private final Map<String, ValueNode> values = new LinkedHashMap<>();
  private final List<Node> allNodes = new ArrayList<>();

  /**
   * @param rootDir absolute path of the project root.
   * @param buildDir where generated files go, relative to {@code rootDir}.
   */
  public NodeRegistry(Path rootDir, Path buildDir) {
    Preconditions.checkArgument(rootDir.isAbsolute(), "root %s must be absolute", rootDir);
    this.rootDir = rootDir.normalize();
    this.buildDir = canonicalize(buildDir);
  }

  public Path getRootDir() {
    return rootDir;
  }

  public Path getBuildDir() {
    return buildDir;
  }

  /** Converts a string to a path on the project's file system. */
  public Path toPath(String path) {
    return rootDir.getFileSystem().getPath(path);
  }

  /**
   * @return the canonical form of {@code path}: normalized, and relative to the project root when
   *     it lies under it.
   */
  public Path canonicalize(Path path) {
    Path p = path;
    if (p.getFileSystem() != rootDir.getFileSystem()) {
      p = toPath(path.toString());
    }
    p = p.normalize();
    if (p.isAbsolute() && p.startsWith(rootDir)) {
      p = rootDir.relativize(p);
    }
    return p;
  }

  public Path canonicalize(String path) {
    return canonicalize(toPath(path));
  }

  /** @return the absolute location of a canonical path. */
  public Path toAbsolute(Path canonicalPath) {
    return rootDir.resolve(canonicalPath);
  }

  public FileNode file(Path path) {
    return file(path, Origin.capture());
  }

  public FileNode file(String path) {
    return file(toPath(path), Origin.capture());
  }

  public FileNode file(Path path, Origin origin) {
    Path key = canonicalize(path);
    Node existing = pathNodes.get(key);
    if (existing != null) {
      Preconditions.checkArgument(
          existing instanceof FileNode,
          "%s is already registered as a %s",
          key,
          existing.getClass().getSimpleName());
      return (FileNode) existing;
    }
    FileNode node = new FileNode(key, origin);
    register(key, node);
    return node;
  }

  public DirNode dir(Path path, DirNode.Role role) {
    return dir(path, role, Origin.capture());
  }

  public DirNode dir(Path path, DirNode.Role role, Origin origin) {
    Path key = canonicalize(path);
    Node existing = pathNodes.get(key);
    if (existing != null) {
      Preconditions.checkArgument(
          existing instanceof DirNode,
          "%s is already registered as a %s",
          key,
          existing.getClass().getSimpleName());
      DirNode dir = (DirNode) existing;
      Preconditions.checkArgument(
          dir.getRole() == role, "%s is already registered with role %s", key, dir.getRole());
      return dir;
    }
    DirNode node = new DirNode(key, role, origin);
    register(key, node);
    return node;
  }

  public AliasNode alias(String name) {
    return alias(name, Origin.capture());
  }

  public AliasNode alias(String name, Origin origin) {
    AliasNode existing = aliases.get(name);
    if (existing != null) {
      return existing;
    }
    AliasNode node = new AliasNode(name, origin);
    aliases.put(name, node);
    allNodes.add(node);
    return node;
  }

  /** Returns the value node with this name, updating its value if it already exists. */
  public ValueNode value(String name, String value) {
    ValueNode existing = values.get(name);
    if (existing != null) {
      existing.setValue(value);
      return existing;
    }
    Path path = buildDir.resolve(VALUES_DIR).resolve(name + ".value");
    ValueNode node = new ValueNode(name, path, value, Origin.capture());
    values.put(name, node);
    allNodes.add(node);
    return node;
  }

  public Optional<Node> get(Path path) {
    return Optional.ofNullable(pathNodes.get(canonicalize(path)));
  }

  public Optional<AliasNode> getAlias(String name) {
    return Optional.ofNullable(aliases.get(name));
  }

  /** @return every node in creation order. */
  public ImmutableList<Node> getNodes() {
    return ImmutableList.copyOf(allNodes);
  }

  public ImmutableList<AliasNode> getAliases() {
    return ImmutableList.copyOf(aliases.values());
  }

  public ImmutableList<ValueNode> getValues() {
    return ImmutableList.copyOf(values.values());
  }

  public int size() {
    return allNodes.size();
  }

  private void register(Path key, Node node) {
    pathNodes.put(key, node);
    allNodes.add(node);
  }
}
