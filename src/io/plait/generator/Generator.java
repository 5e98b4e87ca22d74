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

import io.plait.project.Project;
import java.nio.file.Path;

/** Serializes a resolved project into the files some external tool reads. */
public interface Generator {

  /** Short name used in log messages and configuration, e.g. {@code ninja}. */
  String getName();

  /**
   * Writes this generator's files into {@code outputDir}, resolving the project first if it has
   * unresolved targets. Nothing is written when resolution fails.
   *
   * @throws GenerateException if the files cannot be written.
   */
  void generate(Project project, Path outputDir);
}
