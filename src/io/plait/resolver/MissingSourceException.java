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

package io.plait.resolver;

import io.plait.util.HumanReadableException;
import io.plait.util.Origin;
import java.nio.file.Path;
import javax.annotation.Nullable;

/** A source file that nothing produces is not on disk. */
@SuppressWarnings("serial")
public class MissingSourceException extends HumanReadableException {

  private final Path path;

  public MissingSourceException(Path path, @Nullable String targetName, @Nullable Origin origin) {
    super(
        origin,
        null,
        targetName == null
            ? String.format("source file %s does not exist", path)
            : String.format("source file %s of %s does not exist", path, targetName));
    this.path = path;
  }

  public Path getPath() {
    return path;
  }
}
