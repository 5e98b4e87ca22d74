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

package io.plait.testutil;

import com.google.common.collect.ImmutableMap;
import io.plait.env.AbstractToolchain;
import io.plait.env.Environment;
import io.plait.env.SourceHandler;
import io.plait.subst.Value;

/** A GCC-flavoured toolchain with tools {@code cc}, {@code cxx}, {@code ar} and {@code link}. */
public class FakeToolchain extends AbstractToolchain {

  public static final String OBJCMD_C =
      "$cc.cmd $cc.flags $$includes $$defines $$extra_flags $cc.depflags -c -o $$out $$in";

  public FakeToolchain() {
    super(
        "fake-gcc",
        ImmutableMap.of(
            ".c", handler("cc", "c"),
            ".cc", handler("cxx", "c++"),
            ".cpp", handler("cxx", "c++")));
  }

  private static SourceHandler handler(String tool, String language) {
    return SourceHandler.builder()
        .setTool(tool)
        .setLanguage(language)
        .setDepfile("$out.d")
        .setDepsStyle("gcc")
        .build();
  }

  @Override
  public void setup(Environment environment) {
    environment
        .addTool("cc")
        .setCmd("gcc")
        .set("flags", Value.emptyList())
        .setDepflags("-MMD -MF $$out.d")
        .set("objcmd", OBJCMD_C);
    environment
        .addTool("cxx")
        .setCmd("g++")
        .set("flags", Value.emptyList())
        .setDepflags("-MMD -MF $$out.d")
        .set(
            "objcmd",
            "$cxx.cmd $cxx.flags $$includes $$defines $$extra_flags $cxx.depflags"
                + " -c -o $$out $$in");
    environment
        .addTool("ar")
        .setCmd("ar")
        .set("flags", "rcs")
        .set("libcmd", "$ar.cmd $ar.flags $$out $$in");
    environment
        .addTool("link")
        .setCmd("gcc")
        .set("flags", Value.emptyList())
        .set("sharedflags", "-shared")
        .set("progcmd", "$link.cmd $link.flags $$ldflags -o $$out $$in $$libdirs $$libs")
        .set(
            "sharedcmd",
            "$link.cmd $link.sharedflags $link.flags $$ldflags -o $$out $$in $$libdirs $$libs");
  }
}
