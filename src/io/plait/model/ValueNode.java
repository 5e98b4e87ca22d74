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

import com.google.common.base.Preconditions;
import io.plait.util.Origin;
import java.nio.file.Path;

/**
 * A named computed value, such as a configuration hash, that other nodes can depend on.
 *
 * <p>The executor only understands files, so generators materialize the value at {@link
 * #getPath()} and rewrite it only when the value changes.
 */
public class ValueNode extends Node {

  private final String name;
  private final Path path;
  private String value;

  ValueNode(String name, Path path, String value, Origin origin) {
    super(origin);
    this.name = name;
    this.path = path;
    this.value = Preconditions.checkNotNull(value);
  }

  @Override
  public String getName() {
    return name;
  }

  /** @return where the value is materialized, relative to the project root. */
  public Path getPath() {
    return path;
  }

  public String getValue() {
    return value;
  }

  public void setValue(String value) {
    this.value = Preconditions.checkNotNull(value);
  }
}
