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

import java.util.Optional;
import javax.annotation.Nullable;

/**
 * Exception with an error message that can sensibly be displayed to the user without a stacktrace.
 * This exception is meant to be thrown when a build description is incorrect, as opposed to a bug
 * in the generator itself.
 *
 * <p>When an {@link Origin} is attached the message is prefixed with {@code file:line: } so the
 * caller can find the offending declaration.
 */
@SuppressWarnings("serial")
public class HumanReadableException extends RuntimeException {

  @Nullable private final Origin origin;
  private final String rawMessage;

  public HumanReadableException(String humanReadableFormatString, Object... args) {
    this(null, null, format(humanReadableFormatString, args));
  }

  public HumanReadableException(
      @Nullable Throwable cause, String humanReadableFormatString, Object... args) {
    this(null, cause, format(humanReadableFormatString, args));
  }

  /** For subclasses that build their own message and know where the problem was declared. */
  protected HumanReadableException(
      @Nullable Origin origin, @Nullable Throwable cause, String rawMessage) {
    super(prefix(origin) + rawMessage, cause);
    this.origin = origin;
    this.rawMessage = rawMessage;
  }

  private static String format(String format, Object... args) {
    return args.length == 0 ? format : String.format(format, args);
  }

  private static String prefix(@Nullable Origin origin) {
    return origin != null && origin.isKnown() ? origin + ": " : "";
  }

  public Optional<Origin> getOrigin() {
    return Optional.ofNullable(origin);
  }

  /** @return the message without the origin prefix. */
  public String getRawMessage() {
    return rawMessage;
  }

  public String getHumanReadableErrorMessage() {
    return getMessage();
  }
}
