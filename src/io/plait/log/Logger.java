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

package io.plait.log;

import java.util.logging.Level;
import javax.annotation.Nullable;

/**
 * Thin facade over {@link java.util.logging.Logger} with printf-style messages.
 *
 * <p>Arguments are only formatted when the level is enabled, so callers don't need to guard
 * cheap log statements with {@code isXxxEnabled()}.
 */
public class Logger {

  private final java.util.logging.Logger delegate;

  private Logger(java.util.logging.Logger delegate) {
    this.delegate = delegate;
  }

  public static Logger get(Class<?> cls) {
    return get(cls.getName());
  }

  public static Logger get(String name) {
    return new Logger(java.util.logging.Logger.getLogger(name));
  }

  public String getName() {
    return delegate.getName();
  }

  public boolean isVerboseEnabled() {
    return delegate.isLoggable(Level.FINER);
  }

  public boolean isDebugEnabled() {
    return delegate.isLoggable(Level.FINE);
  }

  public boolean isInfoEnabled() {
    return delegate.isLoggable(Level.INFO);
  }

  public void verbose(String format, Object... args) {
    logFormatted(Level.FINER, null, format, args);
  }

  public void verbose(Throwable t, String format, Object... args) {
    logFormatted(Level.FINER, t, format, args);
  }

  public void debug(String format, Object... args) {
    logFormatted(Level.FINE, null, format, args);
  }

  public void debug(Throwable t, String format, Object... args) {
    logFormatted(Level.FINE, t, format, args);
  }

  public void info(String format, Object... args) {
    logFormatted(Level.INFO, null, format, args);
  }

  public void info(Throwable t, String format, Object... args) {
    logFormatted(Level.INFO, t, format, args);
  }

  public void warn(String format, Object... args) {
    logFormatted(Level.WARNING, null, format, args);
  }

  public void warn(Throwable t, String format, Object... args) {
    logFormatted(Level.WARNING, t, format, args);
  }

  public void error(String format, Object... args) {
    logFormatted(Level.SEVERE, null, format, args);
  }

  public void error(Throwable t, String format, Object... args) {
    logFormatted(Level.SEVERE, t, format, args);
  }

  private void logFormatted(
      Level level, @Nullable Throwable thrown, String format, Object... args) {
    if (!delegate.isLoggable(level)) {
      return;
    }
    String message = args.length == 0 ? format : String.format(format, args);
    if (thrown == null) {
      delegate.log(level, message);
    } else {
      delegate.log(level, message, thrown);
    }
  }
}
