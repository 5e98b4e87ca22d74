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

import io.plait.util.Origin;
import java.nio.file.Path;

/** A file on disk, either a source or something the build produces. */
public class FileNode extends Node {

  private final Path path;

  FileNode(Path path, Origin origin) {
    super(origin);
    this.path = path;
  }

  /**
   * @return the path relative to the project root, or an absolute path for files outside of it.
   */
  public Path getPath() {
    return path;
  }

  /** @return the file name suffix including the dot, or the empty string. */
  public String getSuffix() {
    String fileName = path.getFileName().toString();
    int dot = fileName.lastIndexOf('.');
    return dot <= 0 ? "" : fileName.substring(dot);
  }

  @Override
  public String getName() {
    return path.toString();
  }
}
