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

package io.plait.config;

import io.plait.util.immutables.PlaitStyleImmutable;
import org.immutables.value.Value;

/** Which files {@code BuildFiles} writes, read from the {@code [generate]} section. */
@Value.Immutable
@PlaitStyleImmutable
abstract class AbstractGeneratorOptions {

  public static final String SECTION = "generate";

  @Value.Default
  public boolean isCompileCommands() {
    return true;
  }

  @Value.Default
  public boolean isDot() {
    return false;
  }

  @Value.Default
  public String getBuildFile() {
    return "build.ninja";
  }

  public static GeneratorOptions fromConfig(Config config) {
    GeneratorOptions.Builder builder =
        GeneratorOptions.builder()
            .setCompileCommands(config.getBooleanValue(SECTION, "compile_commands", true))
            .setDot(config.getBooleanValue(SECTION, "dot", false));
    config.getValue(SECTION, "build_file").ifPresent(builder::setBuildFile);
    return builder.build();
  }
}
