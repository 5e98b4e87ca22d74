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

package io.plait.util;

import com.google.common.collect.ImmutableList;
import java.util.Objects;
import java.util.Optional;
import javax.annotation.Nullable;

/**
 * The place in the calling program where a node, target or environment was declared. Used to
 * prefix diagnostics with {@code file:line}.
 */
public final class Origin {

  private static final Origin UNKNOWN = new Origin("<unknown>", 0, null);

  /** Packages whose frames belong to the generator itself rather than to its caller. */
  private static final ImmutableList<String> INTERNAL_PREFIXES =
      ImmutableList.of(
          "io.plait.model.",
          "io.plait.target.",
          "io.plait.project.",
          "io.plait.env.",
          "io.plait.resolver.",
          "io.plait.util.Origin",
          "java.",
          "jdk.",
          "sun.");

  private final String file;
  private final int line;
  @Nullable private final String method;

  private Origin(String file, int line, @Nullable String method) {
    this.file = file;
    this.line = line;
    this.method = method;
  }

  public static Origin of(String file, int line) {
    return new Origin(file, line, null);
  }

  public static Origin unknown() {
    return UNKNOWN;
  }

  /** @return the first stack frame of the current thread that is outside the generator core. */
  public static Origin capture() {
    for (StackTraceElement frame : new Throwable().getStackTrace()) {
      if (isInternal(frame.getClassName())) {
        continue;
      }
      String file = frame.getFileName() == null ? frame.getClassName() : frame.getFileName();
      return new Origin(file, Math.max(frame.getLineNumber(), 0), frame.getMethodName());
    }
    return UNKNOWN;
  }

  private static boolean isInternal(String className) {
    for (String prefix : INTERNAL_PREFIXES) {
      if (className.startsWith(prefix)) {
        return true;
      }
    }
    return false;
  }

  public String getFile() {
    return file;
  }

  public int getLine() {
    return line;
  }

  public Optional<String> getMethod() {
    return Optional.ofNullable(method);
  }

  public boolean isKnown() {
    return this != UNKNOWN;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof Origin)) {
      return false;
    }
    Origin that = (Origin) obj;
    return line == that.line && file.equals(that.file) && Objects.equals(method, that.method);
  }

  @Override
  public int hashCode() {
    return Objects.hash(file, line, method);
  }

  /** Formats as {@code file:line}, the form diagnostics are prefixed with. */
  @Override
  public String toString() {
    return file + ":" + line;
  }
}
