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

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

/** Collects the records logged to one logger while a test runs. */
public class CapturingLogHandler extends Handler implements AutoCloseable {

  private final Logger logger;
  private final List<LogRecord> records = new ArrayList<>();

  private CapturingLogHandler(Logger logger) {
    this.logger = logger;
  }

  /** Starts capturing records of {@code cls}'s logger; {@link #close()} stops. */
  public static CapturingLogHandler attach(Class<?> cls) {
    Logger logger = Logger.getLogger(cls.getName());
    CapturingLogHandler handler = new CapturingLogHandler(logger);
    handler.setLevel(Level.ALL);
    logger.addHandler(handler);
    return handler;
  }

  @Override
  public synchronized void publish(LogRecord record) {
    records.add(record);
  }

  public synchronized ImmutableList<String> getMessages(Level level) {
    ImmutableList.Builder<String> messages = ImmutableList.builder();
    for (LogRecord record : records) {
      if (record.getLevel().equals(level)) {
        messages.add(record.getMessage());
      }
    }
    return messages.build();
  }

  @Override
  public void flush() {}

  @Override
  public void close() {
    logger.removeHandler(this);
  }
}
