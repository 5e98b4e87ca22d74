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

import com.google.common.collect.ImmutableSet;
import io.plait.env.Environment;
import io.plait.env.ToolConfig;
import io.plait.log.Logger;
import io.plait.subst.Value;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Applies configuration values to an environment before any target is declared.
 *
 * <p>Entries of the {@code [env]} section become cross-tool variables. A section named after a
 * tool of the environment sets that tool's variables. A value is read as a list when the variable
 * is {@code flags}, {@code includes} or {@code defines}, when the tool already holds a list under
 * that name, or when {@code [env] list_vars} names it ({@code var} or {@code tool.var}).
 */
public final class EnvironmentDefaults {

  private static final Logger LOG = Logger.get(EnvironmentDefaults.class);

  public static final String ENV_SECTION = "env";
  public static final String LIST_VARS = "list_vars";

  private static final ImmutableSet<String> TOOL_LIST_VARIABLES =
      ImmutableSet.of(ToolConfig.FLAGS, ToolConfig.INCLUDES, ToolConfig.DEFINES);

  private EnvironmentDefaults() {}

  public static void apply(Config config, Environment environment) {
    Set<String> listVars =
        ImmutableSet.copyOf(config.getListWithoutComments(ENV_SECTION, LIST_VARS));

    for (String key : config.get(ENV_SECTION).keySet()) {
      if (key.equals(LIST_VARS)) {
        continue;
      }
      environment.set(key, read(config, ENV_SECTION, key, listVars.contains(key)));
    }

    for (Map.Entry<String, ?> section : config.getSectionToEntries().entrySet()) {
      String sectionName = section.getKey();
      if (sectionName.equals(ENV_SECTION)) {
        continue;
      }
      Optional<ToolConfig> tool = environment.getTool(sectionName);
      if (!tool.isPresent()) {
        LOG.verbose("No tool %s in %s, skipping [%s]", sectionName, environment, sectionName);
        continue;
      }
      for (String key : config.get(sectionName).keySet()) {
        boolean isList =
            TOOL_LIST_VARIABLES.contains(key)
                || listVars.contains(sectionName + "." + key)
                || tool.get().get(key).map(Value::isList).orElse(false);
        tool.get().set(key, read(config, sectionName, key, isList));
      }
    }
    LOG.debug("Applied configuration to %s", environment);
  }

  private static Value read(Config config, String section, String key, boolean isList) {
    if (isList) {
      return Value.ofList(config.getListWithoutComments(section, key));
    }
    return Value.of(config.getValue(section, key).orElse(""));
  }
}
