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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import io.plait.subst.Value;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * The variables of one tool, such as a compiler or an archiver.
 *
 * <p>The common variables have typed accessors; anything else a tool needs goes through {@link
 * #get(String)} and {@link #set(String, Value)}. Values are immutable, so {@link #copy()} yields a
 * fully independent namespace.
 */
public class ToolConfig {

  public static final String CMD = "cmd";
  public static final String FLAGS = "flags";
  public static final String INCLUDES = "includes";
  public static final String DEFINES = "defines";
  public static final String DEPFLAGS = "depflags";

  private final String name;
  private final Map<String, Value> variables = new LinkedHashMap<>();

  public ToolConfig(String name) {
    Preconditions.checkArgument(
        !name.isEmpty() && name.indexOf('.') < 0, "invalid tool name: '%s'", name);
    this.name = name;
  }

  public String getName() {
    return name;
  }

  public Optional<String> getCmd() {
    return get(CMD).map(Value::asScalar);
  }

  public ToolConfig setCmd(String cmd) {
    return set(CMD, Value.of(cmd));
  }

  public ImmutableList<String> getFlags() {
    return getList(FLAGS);
  }

  public ToolConfig setFlags(Iterable<String> flags) {
    return set(FLAGS, Value.ofList(flags));
  }

  public ToolConfig addFlags(String... flags) {
    return append(FLAGS, ImmutableList.copyOf(flags));
  }

  public ImmutableList<String> getIncludes() {
    return getList(INCLUDES);
  }

  public ToolConfig setIncludes(Iterable<String> includes) {
    return set(INCLUDES, Value.ofList(includes));
  }

  public ImmutableList<String> getDefines() {
    return getList(DEFINES);
  }

  public ToolConfig setDefines(Iterable<String> defines) {
    return set(DEFINES, Value.ofList(defines));
  }

  public ToolConfig setDepflags(String depflags) {
    return set(DEPFLAGS, Value.of(depflags));
  }

  public Optional<Value> get(String variable) {
    return Optional.ofNullable(variables.get(variable));
  }

  /** @return the variable as a list, empty when it is not set. */
  public ImmutableList<String> getList(String variable) {
    Value value = variables.get(variable);
    return value == null ? ImmutableList.of() : value.asList();
  }

  public boolean has(String variable) {
    return variables.containsKey(variable);
  }

  public ToolConfig set(String variable, Value value) {
    Preconditions.checkNotNull(value);
    variables.put(variable, value);
    return this;
  }

  public ToolConfig set(String variable, String value) {
    return set(variable, Value.of(value));
  }

  /** Sets the variable only when it has no value yet. */
  public ToolConfig setDefault(String variable, Value value) {
    variables.putIfAbsent(variable, Preconditions.checkNotNull(value));
    return this;
  }

  /** Appends to a sequence variable, creating it when needed. */
  public ToolConfig append(String variable, Iterable<String> values) {
    Value current = variables.get(variable);
    return set(variable, current == null ? Value.ofList(values) : current.append(values));
  }

  public ImmutableMap<String, Value> getVariables() {
    return ImmutableMap.copyOf(variables);
  }

  public ToolConfig copy() {
    ToolConfig copy = new ToolConfig(name);
    copy.variables.putAll(variables);
    return copy;
  }

  @Override
  public String toString() {
    return name + variables;
  }
}
