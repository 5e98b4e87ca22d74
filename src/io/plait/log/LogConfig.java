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

import java.util.logging.ConsoleHandler;
import java.util.logging.Handler;
import java.util.logging.Level;

/** Installs the console handler used by front ends that embed the generator. */
public class LogConfig {

  static final String ROOT_LOGGER_NAME = "io.plait";

  private static final java.util.logging.Logger ROOT =
      java.util.logging.Logger.getLogger(ROOT_LOGGER_NAME);

  private LogConfig() {}

  /**
   * Replaces any handlers on the {@code io.plait} logger with a single console handler that uses
   * {@link LogFormatter}. Safe to call more than once.
   */
  public static synchronized void setupLogging(Level level) {
    for (Handler handler : ROOT.getHandlers()) {
      ROOT.removeHandler(handler);
    }
    ConsoleHandler console = new ConsoleHandler();
    console.setFormatter(new LogFormatter());
    console.setLevel(level);
    ROOT.addHandler(console);
    ROOT.setLevel(level);
    ROOT.setUseParentHandlers(false);
  }
}
