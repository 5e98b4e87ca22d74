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

import com.google.common.collect.ImmutableList;
import io.plait.model.AliasNode;
import io.plait.model.CommandArg;
import io.plait.model.DirNode;
import io.plait.model.FileNode;
import io.plait.model.Node;
import io.plait.model.NodeRegistry;
import io.plait.model.ValueNode;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Renders canonical project paths as seen from a generator's output directory. Paths inside the
 * project become relative to the output directory; paths outside it stay absolute.
 */
class OutputPaths {

  private final NodeRegistry registry;
  private final Path outputDir;

  OutputPaths(NodeRegistry registry, Path outputDir) {
    this.registry = registry;
    this.outputDir = registry.toAbsolute(registry.canonicalize(outputDir)).normalize();
  }

  /** @return the absolute output directory. */
  Path getOutputDir() {
    return outputDir;
  }

  String render(Path canonicalPath) {
    if (canonicalPath.isAbsolute()) {
      return canonicalPath.toString();
    }
    String relative = outputDir.relativize(registry.toAbsolute(canonicalPath)).toString();
    return relative.isEmpty() ? "." : relative;
  }

  String render(String canonicalPath) {
    return render(registry.toPath(canonicalPath));
  }

  /** @return the path of a file, directory or value node; the name of an alias. */
  String render(Node node) {
    Optional<Path> path = getPath(node);
    if (path.isPresent()) {
      return render(path.get());
    }
    return node.getName();
  }

  ImmutableList<String> render(Iterable<CommandArg> args) {
    ImmutableList.Builder<String> rendered = ImmutableList.builder();
    for (CommandArg arg : args) {
      rendered.add(arg.render(this::render));
    }
    return rendered.build();
  }

  Path toAbsolute(Path canonicalPath) {
    return registry.toAbsolute(canonicalPath);
  }

  static Optional<Path> getPath(Node node) {
    if (node instanceof FileNode) {
      return Optional.of(((FileNode) node).getPath());
    } else if (node instanceof DirNode) {
      return Optional.of(((DirNode) node).getPath());
    } else if (node instanceof ValueNode) {
      return Optional.of(((ValueNode) node).getPath());
    } else if (node instanceof AliasNode) {
      return Optional.empty();
    }
    throw new IllegalArgumentException("unknown node type: " + node.getClass().getName());
  }
}
