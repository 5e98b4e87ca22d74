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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import io.plait.target.TargetKind;
import java.util.Optional;
import java.util.Set;

/**
 * Unix-style defaults: {@code libfoo.a}, {@code libfoo.so}, {@code -I}/{@code -D}/{@code
 * -L}/{@code -l} and position-independent code for shared libraries. Subclasses supply the source
 * handlers and the tools.
 */
public abstract class AbstractToolchain implements Toolchain {

  private static final ImmutableSet<String> DEFAULT_SEPARATED_ARG_FLAGS =
      ImmutableSet.of(
          "-arch", "-F", "-framework", "-include", "-isystem", "-target", "-x", "-Xlinker");

  private static final ImmutableSet<String> DEFAULT_HEADER_SUFFIXES =
      ImmutableSet.of(".h", ".hh", ".hpp", ".hxx", ".inl");

  private final String name;
  private final ImmutableMap<String, SourceHandler> sourceHandlers;

  protected AbstractToolchain(String name, ImmutableMap<String, SourceHandler> sourceHandlers) {
    this.name = name;
    this.sourceHandlers = sourceHandlers;
  }

  @Override
  public String getName() {
    return name;
  }

  @Override
  public Optional<SourceHandler> getSourceHandler(String suffix) {
    return Optional.ofNullable(sourceHandlers.get(suffix));
  }

  @Override
  public boolean isHeaderSuffix(String suffix) {
    return DEFAULT_HEADER_SUFFIXES.contains(suffix);
  }

  @Override
  public ImmutableSet<String> getSeparatedArgFlags() {
    return DEFAULT_SEPARATED_ARG_FLAGS;
  }

  @Override
  public String getObjectSuffix() {
    return ".o";
  }

  @Override
  public String getStaticLibraryName(String name) {
    return "lib" + name + ".a";
  }

  @Override
  public String getSharedLibraryName(String name) {
    return "lib" + name + ".so";
  }

  @Override
  public String getProgramName(String name) {
    return name;
  }

  @Override
  public String getArchiverTool() {
    return "ar";
  }

  @Override
  public String getLinkerTool(Set<String> languages) {
    return "link";
  }

  @Override
  public ImmutableList<String> getCompileFlagsForTargetKind(TargetKind kind) {
    return kind == TargetKind.SHARED_LIBRARY ? ImmutableList.of("-fPIC") : ImmutableList.of();
  }

  @Override
  public String getIncludeFlagPrefix() {
    return "-I";
  }

  @Override
  public String getDefineFlagPrefix() {
    return "-D";
  }

  @Override
  public String getLibraryDirFlagPrefix() {
    return "-L";
  }

  @Override
  public String getLibraryFlagPrefix() {
    return "-l";
  }

  @Override
  public String toString() {
    return name;
  }
}
