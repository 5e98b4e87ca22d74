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

package io.plait.config;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import io.plait.log.Logger;
import io.plait.util.HumanReadableException;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.ini4j.Ini;
import org.ini4j.Profile;

/** Reads {@link Config}s from {@code .ini} files. */
public final class Configs {

  private static final Logger LOG = Logger.get(Configs.class);

  private Configs() {}

  /** Reads a stack of files; later files override earlier ones. Missing files are skipped. */
  public static Config load(Path... files) throws IOException {
    ImmutableList.Builder<ImmutableMap<String, ImmutableMap<String, String>>> builder =
        ImmutableList.builder();
    for (Path file : files) {
      if (!Files.isRegularFile(file)) {
        LOG.debug("Skipping missing configuration file %s", file);
        continue;
      }
      try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
        ImmutableMap<String, ImmutableMap<String, String>> parsed = read(reader);
        LOG.debug("Loaded a configuration file %s: %s", file, parsed);
        builder.add(parsed);
      }
    }
    return new Config(builder.build());
  }

  public static Config parse(Reader reader) throws IOException {
    return new Config(read(reader));
  }

  private static ImmutableMap<String, ImmutableMap<String, String>> read(Reader reader)
      throws IOException {
    Ini ini = new Ini();
    // Escapes are decoded by Config, which also understands quoting.
    ini.getConfig().setEscape(false);
    ini.load(reader);

    ImmutableMap.Builder<String, ImmutableMap<String, String>> sectionsToEntries =
        ImmutableMap.builder();
    for (String sectionName : ini.keySet()) {
      Profile.Section section = ini.get(sectionName);
      ImmutableMap.Builder<String, String> entries = ImmutableMap.builder();
      for (String propertyName : section.keySet()) {
        List<String> values = section.getAll(propertyName);
        if (values.size() > 1) {
          throw new HumanReadableException(
              "Duplicate definition for %s in [%s].", propertyName, sectionName);
        }
        String value = section.get(propertyName);
        entries.put(propertyName, value == null ? "" : value);
      }
      sectionsToEntries.put(sectionName, entries.build());
    }
    return sectionsToEntries.build();
  }
}
