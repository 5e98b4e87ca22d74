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

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.google.common.collect.ImmutableList;
import io.plait.util.Escaper;
import io.plait.util.immutables.PlaitStyleImmutable;
import org.immutables.value.Value;

/** One entry of a {@code compile_commands.json} database. */
@Value.Immutable
@PlaitStyleImmutable
@JsonPropertyOrder({"directory", "file", "arguments", "command", "output"})
abstract class AbstractCompilationDatabaseEntry {

  /** Absolute working directory of the command. */
  @JsonProperty("directory")
  public abstract String getDirectory();

  /** Absolute path of the compiled source. */
  @JsonProperty("file")
  public abstract String getFile();

  @JsonProperty("arguments")
  public abstract ImmutableList<String> getArguments();

  @JsonProperty("output")
  public abstract String getOutput();

  @JsonProperty("command")
  @Value.Derived
  public String getCommand() {
    return Escaper.joinShellArguments(getArguments());
  }
}
