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

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import io.plait.model.BuildStep;
import io.plait.model.CommandArg;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Replaces the executor variables left in a step's command ({@code $in}, {@code $out}, {@code
 * $out.d} and the step's own variables) with their values, producing the exact argument list the
 * executor would run.
 */
class StepCommandBinder {

  private static final Pattern VARIABLE =
      Pattern.compile("\\$([A-Za-z0-9_-]+(?:\\.d(?![A-Za-z0-9_]))?)");

  private final ImmutableMap<String, ImmutableList<String>> values;

  StepCommandBinder(BuildStep step, OutputPaths paths) {
    ImmutableList.Builder<String> inputs = ImmutableList.builder();
    step.getInputs().forEach(node -> inputs.add(paths.render(node)));
    ImmutableList.Builder<String> outputs = ImmutableList.builder();
    step.getOutputs().forEach(node -> outputs.add(paths.render(node)));
    ImmutableList<String> out = outputs.build();

    Map<String, ImmutableList<String>> bound = new LinkedHashMap<>();
    for (Map.Entry<String, ImmutableList<CommandArg>> entry : step.getVariables().entrySet()) {
      bound.put(entry.getKey(), paths.render(entry.getValue()));
    }
    bound.put("in", inputs.build());
    bound.put("out", out);
    bound.put("out.d", ImmutableList.of(out.get(0) + ".d"));
    this.values = ImmutableMap.copyOf(bound);
  }

  /**
   * A token that is exactly one variable becomes one argument per value; a variable embedded in a
   * longer token is replaced by its values joined with spaces. Unknown names are left alone.
   */
  ImmutableList<String> bind(List<String> command) {
    ImmutableList.Builder<String> args = ImmutableList.builder();
    for (String token : command) {
      Matcher matcher = VARIABLE.matcher(token);
      if (matcher.matches() && values.containsKey(matcher.group(1))) {
        args.addAll(values.get(matcher.group(1)));
        continue;
      }
      StringBuffer result = new StringBuffer();
      matcher.reset();
      while (matcher.find()) {
        ImmutableList<String> value = values.get(matcher.group(1));
        String replacement = value == null ? matcher.group() : Joiner.on(' ').join(value);
        matcher.appendReplacement(result, Matcher.quoteReplacement(replacement));
      }
      matcher.appendTail(result);
      args.add(result.toString());
    }
    return args.build();
  }
}
