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

package io.plait.testutil;

import com.google.common.jimfs.Configuration;
import com.google.common.jimfs.Jimfs;
import io.plait.project.Project;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileSystem;
import java.nio.file.Files;
import java.nio.file.Path;

/** Projects rooted at {@code /work} on an in-memory file system. */
public final class TestProjects {

  public static final String ROOT = "/work";

  private TestProjects() {}

  public static Project newProject(String name) throws IOException {
    FileSystem fileSystem = Jimfs.newFileSystem(Configuration.unix());
    Path root = fileSystem.getPath(ROOT);
    Files.createDirectories(root);
    return new Project(name, root);
  }

  /** Creates empty files, relative to the project root. */
  public static void touch(Project project, String... paths) throws IOException {
    for (String path : paths) {
      Path file = project.getRootDir().resolve(path);
      Files.createDirectories(file.getParent());
      Files.write(file, new byte[0]);
    }
  }

  public static String read(Project project, String path) throws IOException {
    return new String(
        Files.readAllBytes(project.getRootDir().resolve(path)), StandardCharsets.UTF_8);
  }
}
