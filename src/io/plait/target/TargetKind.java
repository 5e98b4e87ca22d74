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

package io.plait.target;

import java.util.Locale;

/** What a {@link Target} builds. */
public enum TargetKind {
  STATIC_LIBRARY,
  SHARED_LIBRARY,
  PROGRAM,
  /** Header-only: carries usage requirements, builds nothing. */
  INTERFACE,
  /** Compiles its sources; its objects are its outputs. */
  OBJECT_LIBRARY,
  /** Runs a builder or a command template. */
  CUSTOM,
  /** Copies other targets' outputs; resolved after every other target. */
  INSTALL,
  ;

  /** @return the lowercase name used in graph output, e.g. {@code static_library}. */
  public String getTypeName() {
    return name().toLowerCase(Locale.US);
  }

  /** @return whether other targets link this target's output file. */
  public boolean isLinkable() {
    return this == STATIC_LIBRARY || this == SHARED_LIBRARY;
  }
}
