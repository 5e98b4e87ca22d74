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
import com.google.common.collect.ImmutableSet;
import io.plait.target.TargetKind;
import java.util.Optional;
import java.util.Set;

/**
 * Everything the resolver needs to know about a family of compilers and linkers. Implementations
 * carry all tool-specific knowledge; the resolver only consults them.
 */
public interface Toolchain {

  String getName();

  /**
   * Adds this toolchain's tools, with their default variables and command templates, to a newly
   * created environment.
   */
  void setup(Environment environment);

  /** @param suffix file suffix including the dot, e.g. {@code .c}. */
  Optional<SourceHandler> getSourceHandler(String suffix);

  /** Sources with these suffixes are tracked but produce no object file. */
  boolean isHeaderSuffix(String suffix);

  /** Flags whose argument is the next token, e.g. {@code -framework}. */
  ImmutableSet<String> getSeparatedArgFlags();

  /** Suffix of object files, including the dot. */
  String getObjectSuffix();

  String getStaticLibraryName(String name);

  String getSharedLibraryName(String name);

  String getProgramName(String name);

  /** The tool whose {@code libcmd} builds static libraries. */
  String getArchiverTool();

  /**
   * The tool whose {@code progcmd} and {@code sharedcmd} link objects compiled from the given
   * languages.
   */
  String getLinkerTool(Set<String> languages);

  /** Extra compile flags for objects that end up in a target of this kind, e.g. {@code -fPIC}. */
  ImmutableList<String> getCompileFlagsForTargetKind(TargetKind kind);

  String getIncludeFlagPrefix();

  String getDefineFlagPrefix();

  String getLibraryDirFlagPrefix();

  String getLibraryFlagPrefix();
}
