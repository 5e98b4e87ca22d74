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

import com.google.common.collect.ImmutableList;
import io.plait.model.DirNode;
import io.plait.model.FileNode;
import io.plait.model.Node;
import io.plait.model.ValueNode;
import io.plait.util.HumanReadableException;
import java.nio.file.Path;

/**
 * Copies each source, or each output of a source target, into a directory. A directory source is
 * copied member by member into a subdirectory of the same name.
 */
public class Install implements DeferredOperation {

  private final String destDir;
  private final ImmutableList<Object> sources;

  public Install(String destDir, Iterable<?> sources) {
    this.destDir = destDir;
    this.sources = ImmutableList.copyOf(sources);
  }

  public String getDestDir() {
    return destDir;
  }

  public ImmutableList<Object> getSources() {
    return sources;
  }

  @Override
  public ImmutableList<Target> getTargetDependencies() {
    return targetsIn(sources);
  }

  @Override
  public ImmutableList<Node> apply(Target owner, Context context) {
    ImmutableList.Builder<Node> copies = ImmutableList.builder();
    for (Node source : context.resolveSources(owner, sources)) {
      install(owner, context, source, destDir, copies);
    }
    return copies.build();
  }

  private static void install(
      Target owner, Context context, Node source, String dest, ImmutableList.Builder<Node> copies) {
    if (source instanceof DirNode) {
      DirNode dir = (DirNode) source;
      String subdir = child(dest, dir.getPath().getFileName().toString());
      for (Node member : dir.getMembers()) {
        install(owner, context, member, subdir, copies);
      }
      return;
    }
    copies.add(context.copy(owner, source, child(dest, fileName(owner, source))));
  }

  private static String child(String dir, String name) {
    return dir.isEmpty() ? name : dir + "/" + name;
  }

  static ImmutableList<Target> targetsIn(Iterable<?> sources) {
    ImmutableList.Builder<Target> targets = ImmutableList.builder();
    for (Object source : sources) {
      if (source instanceof Target) {
        targets.add((Target) source);
      }
    }
    return targets.build();
  }

  static String fileName(Target owner, Node source) {
    Path path;
    if (source instanceof FileNode) {
      path = ((FileNode) source).getPath();
    } else if (source instanceof ValueNode) {
      path = ((ValueNode) source).getPath();
    } else {
      throw new HumanReadableException(
          "%s: cannot install %s, it is not a file", owner.getName(), source.getName());
    }
    return path.getFileName().toString();
  }

  @Override
  public String toString() {
    return "Install(" + destDir + ", " + sources + ")";
  }
}
