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
import io.plait.config.GeneratorOptions;
import io.plait.log.Logger;
import io.plait.project.Project;
import java.nio.file.Path;

/** Entry point for front ends: resolves a project once and runs the configured generators. */
public final class BuildFiles {

  private static final Logger LOG = Logger.get(BuildFiles.class);

  /** Utility class: do not instantiate. */
  private BuildFiles() {}

  public static ImmutableList<Generator> getGenerators(GeneratorOptions options) {
    ImmutableList.Builder<Generator> generators = ImmutableList.builder();
    generators.add(new NinjaGenerator(options.getBuildFile()));
    if (options.isCompileCommands()) {
      generators.add(new CompileCommandsGenerator());
    }
    if (options.isDot()) {
      generators.add(new DotGenerator());
    }
    return generators.build();
  }

  /**
   * Resolves {@code project} and writes the build file plus the enabled sidecar files into {@code
   * outputDir}. A resolution error aborts before any file is written.
   *
   * @return the generators that ran, in order.
   */
  public static ImmutableList<Generator> generate(
      Project project, Path outputDir, GeneratorOptions options) {
    project.resolve();
    ImmutableList<Generator> generators = getGenerators(options);
    for (Generator generator : generators) {
      LOG.debug("Running %s generator for %s", generator.getName(), project.getName());
      generator.generate(project, outputDir);
    }
    return generators;
  }
}
