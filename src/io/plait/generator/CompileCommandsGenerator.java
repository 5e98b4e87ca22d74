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

import com.fasterxml.jackson.core.JsonGenerator;
import com.google.common.collect.ImmutableList;
import io.plait.io.MoreFiles;
import io.plait.log.Logger;
import io.plait.model.BuildStep;
import io.plait.model.Node;
import io.plait.model.NodeRegistry;
import io.plait.project.Project;
import io.plait.util.json.ObjectMappers;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.file.Path;
import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.Set;

/**
 * Writes {@code compile_commands.json} for editors and analyzers: one entry per compiled source,
 * with the command fully bound and run from the output directory.
 */
public class CompileCommandsGenerator implements Generator {

  private static final Logger LOG = Logger.get(CompileCommandsGenerator.class);

  public static final String NAME = "compile_commands";

  public static final String FILE_NAME = "compile_commands.json";

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
    ImmutableList<CompilationDatabaseEntry> entries = getEntries(project, paths);
    Path file = paths.getOutputDir().resolve(FILE_NAME);
    try {
      ByteArrayOutputStream outputStream = new ByteArrayOutputStream();
      try (JsonGenerator jsonGen = ObjectMappers.createGenerator(outputStream)) {
        jsonGen.useDefaultPrettyPrinter();
        jsonGen.writeStartArray();
        for (CompilationDatabaseEntry entry : entries) {
          jsonGen.writeObject(entry);
        }
        jsonGen.writeEndArray();
      }
      outputStream.write('\n');
      MoreFiles.writeAtomically(file, outputStream.toByteArray());
    } catch (IOException e) {
      throw new GenerateException(e, file);
    }
    LOG.info("Wrote %d compile commands to %s", entries.size(), file);
  }

  static ImmutableList<CompilationDatabaseEntry> getEntries(Project project, OutputPaths paths) {
    NodeRegistry registry = project.getNodeRegistry();
    Set<BuildStep> steps = new LinkedHashSet<>();
    for (Node node : registry.getNodes()) {
      Optional<BuildStep> producer = node.getProducer();
      if (producer.isPresent() && producer.get().isCompile()) {
        steps.add(producer.get());
      }
    }

    ImmutableList.Builder<CompilationDatabaseEntry> entries = ImmutableList.builder();
    for (BuildStep step : steps) {
      ImmutableList<String> arguments =
          new StepCommandBinder(step, paths).bind(step.getCommand());
      for (Node source : step.getInputs()) {
        Optional<Path> sourcePath = OutputPaths.getPath(source);
        if (!sourcePath.isPresent()) {
          continue;
        }
        entries.add(
            CompilationDatabaseEntry.builder()
                .setDirectory(paths.getOutputDir().toString())
                .setFile(paths.toAbsolute(sourcePath.get()).toString())
                .setArguments(arguments)
                .setOutput(paths.render(step.getOutputs().get(0)))
                .build());
      }
    }
    return entries.build();
  }
}
