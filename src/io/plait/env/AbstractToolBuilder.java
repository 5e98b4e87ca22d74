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

/**
 * A named operation offered by a tool, such as "compile one object" or "archive": which tool
 * variable holds its command, plus what a generator needs to know about its outputs.
 */
@Value.Immutable
@PlaitStyleImmutable
abstract class AbstractToolBuilder {

  @Value.Parameter
  public abstract String getName();

  @Value.Parameter
  public abstract String getTool();

  @Value.Parameter
  public abstract String getCommandVariable();

  /** Set for builders that compile a source language. */
  public abstract Optional<String> getLanguage();

  public abstract Optional<String> getDepfile();

  public abstract Optional<String> getDepsStyle();
}
