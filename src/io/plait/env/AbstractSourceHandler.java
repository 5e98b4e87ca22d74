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

package io.plait.env;

import io.plait.util.immutables.PlaitStyleImmutable;
import java.util.Optional;
import org.immutables.value.Value;

/** How a toolchain compiles sources with one suffix. */
@Value.Immutable
@PlaitStyleImmutable
abstract class AbstractSourceHandler {

  /** The tool whose namespace holds the command, e.g. {@code cc}. */
  public abstract String getTool();

  /** Language name, used to pick a linker and reported in the compile-command database. */
  public abstract String getLanguage();

  /** Tool variable holding the compile command template. */
  @Value.Default
  public String getCommandVariable() {
    return "objcmd";
  }

  /** Depfile written by the compiler, in executor syntax. */
  public abstract Optional<String> getDepfile();

  public abstract Optional<String> getDepsStyle();
}
