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

import io.plait.util.immutables.PlaitStyleImmutable;
import java.nio.file.Path;
import java.util.function.Function;
import org.immutables.value.Value;

/**
 * One argument of a per-step variable. Path arguments keep the path apart from their flag prefix
 * (e.g. {@code -I}) so a generator can rewrite the path relative to its output location.
 */
@Value.Immutable
@PlaitStyleImmutable
abstract class AbstractCommandArg {

  @Value.Parameter
  public abstract String getPrefix();

  @Value.Parameter
  public abstract String getValue();

  @Value.Parameter
  public abstract boolean isPath();

  public static CommandArg literal(String value) {
    return CommandArg.of("", value, false);
  }

  public static CommandArg path(String prefix, Path path) {
    return CommandArg.of(prefix, path.toString(), true);
  }

  /** @param pathRenderer turns a canonical project path into the string to emit. */
  public String render(Function<String, String> pathRenderer) {
    return getPrefix() + (isPath() ? pathRenderer.apply(getValue()) : getValue());
  }

  @Override
  public String toString() {
    return getPrefix() + getValue();
  }
}
