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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import io.plait.util.Escaper;
import java.util.Map;
import java.util.Optional;

/**
 * Appends Ninja statements to an in-memory buffer. Paths and per-build values are escaped here;
 * rule commands are written as given, since their {@code $} references belong to Ninja.
 */
class NinjaWriter {

  private static final String INDENT = "  ";

  private final StringBuilder out = new StringBuilder();

  NinjaWriter comment(String text) {
    for (String line : text.split("\n", -1)) {
      out.append("# ").append(line).append('\n');
    }
    return this;
  }

  NinjaWriter newline() {
    out.append('\n');
    return this;
  }

  /** Writes a top-level variable; {@code $} in the value is escaped. */
  NinjaWriter variable(String key, String value) {
    out.append(key).append(" = ").append(Escaper.escapeNinjaValue(value)).append('\n');
    return this;
  }

  NinjaWriter rule(
      String name,
      String command,
      Optional<String> description,
      Optional<String> depfile,
      Optional<String> deps) {
    out.append("rule ").append(name).append('\n');
    indented("command", command);
    description.ifPresent(value -> indented("description", value));
    depfile.ifPresent(value -> indented("depfile", value));
    deps.ifPresent(value -> indented("deps", value));
    return this;
  }

  /**
   * Writes {@code build outputs: rule inputs | implicit || orderOnly} followed by the per-build
   * variables, whose values are literal.
   */
  NinjaWriter build(
      Iterable<String> outputs,
      String rule,
      Iterable<String> inputs,
      Iterable<String> implicit,
      Iterable<String> orderOnly,
      Map<String, String> variables) {
    out.append("build ");
    appendPaths(outputs);
    out.append(": ").append(rule);
    if (inputs.iterator().hasNext()) {
      out.append(' ');
      appendPaths(inputs);
    }
    if (implicit.iterator().hasNext()) {
      out.append(" | ");
      appendPaths(implicit);
    }
    if (orderOnly.iterator().hasNext()) {
      out.append(" || ");
      appendPaths(orderOnly);
    }
    out.append('\n');
    for (Map.Entry<String, String> variable : variables.entrySet()) {
      indented(variable.getKey(), Escaper.escapeNinjaValue(variable.getValue()));
    }
    return this;
  }

  NinjaWriter phony(String output, Iterable<String> inputs) {
    return build(
        ImmutableList.of(output),
        "phony",
        inputs,
        ImmutableList.of(),
        ImmutableList.of(),
        ImmutableMap.of());
  }

  NinjaWriter defaults(Iterable<String> paths) {
    out.append("default ");
    appendPaths(paths);
    out.append('\n');
    return this;
  }

  String getContents() {
    return out.toString();
  }

  private void indented(String key, String value) {
    out.append(INDENT).append(key).append(" = ").append(value).append('\n');
  }

  private void appendPaths(Iterable<String> paths) {
    boolean first = true;
    for (String path : paths) {
      if (!first) {
        out.append(' ');
      }
      out.append(Escaper.escapeNinjaPath(path));
      first = false;
    }
  }
}
