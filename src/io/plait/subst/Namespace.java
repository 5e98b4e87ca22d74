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

package io.plait.subst;

import com.google.common.collect.ImmutableMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable, layered view of the variables a template is expanded against.
 *
 * <p>Lookup order for a name: call-site overrides (which may be bare or {@code tool.var}), then,
 * for a dotted name whose first part is a tool, that tool's variables only, and otherwise the
 * cross-tool variables.
 */
public final class Namespace {

  private static final Namespace EMPTY =
      new Namespace(ImmutableMap.of(), ImmutableMap.of(), ImmutableMap.of());

  private final ImmutableMap<String, ImmutableMap<String, Value>> tools;
  private final ImmutableMap<String, Value> variables;
  private final ImmutableMap<String, Value> overrides;

  private Namespace(
      ImmutableMap<String, ImmutableMap<String, Value>> tools,
      ImmutableMap<String, Value> variables,
      ImmutableMap<String, Value> overrides) {
    this.tools = tools;
    this.variables = variables;
    this.overrides = overrides;
  }

  public static Namespace empty() {
    return EMPTY;
  }

  public static Builder builder() {
    return new Builder();
  }

  /** @return a namespace where {@code extra} takes precedence over every existing layer. */
  public Namespace withOverrides(Map<String, Value> extra) {
    if (extra.isEmpty()) {
      return this;
    }
    Map<String, Value> merged = new LinkedHashMap<>(overrides);
    merged.putAll(extra);
    return new Namespace(tools, variables, ImmutableMap.copyOf(merged));
  }

  public Optional<Value> lookup(String name) {
    Value override = overrides.get(name);
    if (override != null) {
      return Optional.of(override);
    }
    int dot = name.indexOf('.');
    if (dot > 0) {
      ImmutableMap<String, Value> tool = tools.get(name.substring(0, dot));
      if (tool != null) {
        return Optional.ofNullable(tool.get(name.substring(dot + 1)));
      }
    }
    return Optional.ofNullable(variables.get(name));
  }

  public static class Builder {
    private final Map<String, ImmutableMap<String, Value>> tools = new LinkedHashMap<>();
    private final Map<String, Value> variables = new LinkedHashMap<>();

    private Builder() {}

    public Builder putTool(String name, Map<String, Value> toolVariables) {
      tools.put(name, ImmutableMap.copyOf(toolVariables));
      return this;
    }

    public Builder putVariable(String name, Value value) {
      variables.put(name, value);
      return this;
    }

    public Builder putAllVariables(Map<String, Value> values) {
      variables.putAll(values);
      return this;
    }

    public Namespace build() {
      return new Namespace(
          ImmutableMap.copyOf(tools), ImmutableMap.copyOf(variables), ImmutableMap.of());
    }
  }
}
