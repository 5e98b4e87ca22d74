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

import io.plait.util.HumanReadableException;
import java.io.IOException;
import java.nio.file.Path;

/** Writing a generated file failed. */
@SuppressWarnings("serial")
public class GenerateException extends HumanReadableException {

  private final Path path;

  public GenerateException(IOException cause, Path path) {
    super(cause, "failed to write %s: %s", path, cause.getMessage());
    this.path = path;
  }

  public Path getPath() {
    return path;
  }
}
