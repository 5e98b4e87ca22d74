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

import io.plait.graph.Dot;
import io.plait.graph.MutableDirectedGraph;
import io.plait.io.MoreFiles;
import io.plait.log.Logger;
import io.plait.project.Project;
import io.plait.target.Target;
import java.io.IOException;
import java.nio.file.Path;

/** Writes the target graph in Graphviz dot syntax, colored by target kind. */
public class DotGenerator implements Generator {

  private static final Logger LOG = Logger.get(DotGenerator.class);

  public static final String NAME = "dot";

  public static final String FILE_NAME = "targets.dot";

  @Override
  public String getName() {
    return NAME;
  }

  @Override
  public void generate(Project project, Path outputDir) {
    if (!project.isResolved()) {
      project.resolve();
    }
    OutputPaths paths = new OutputPaths(project.getNodeRegistry(), outputDir);
    Path file = paths.getOutputDir().resolve(FILE_NAME);
    StringBuilder output = new StringBuilder();
    try {
      Dot.builder(getTargetGraph(project), project.getName())
          .setNodeToName(Target::getName)
          .setNodeToTypeName(target -> target.getKind().getTypeName())
          .build()
          .writeOutput(output);
      MoreFiles.writeIfChanged(file, output.toString());
    } catch (IOException e) {
      throw new GenerateException(e, file);
    }
    LOG.info("Wrote target graph of %s to %s", project.getName(), file);
  }

  /** Edges point from a target to the targets it depends on. */
  static MutableDirectedGraph<Target> getTargetGraph(Project project) {
    MutableDirectedGraph<Target> graph = new MutableDirectedGraph<>();
    for (Target target : project.getTargets()) {
      graph.addNode(target);
      for (Target dep : target.getDependencies()) {
        graph.addEdge(target, dep);
      }
    }
    return graph;
  }
}
