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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import io.plait.util.HumanReadableException;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Structured representation of data read from a stack of {@code .ini} files, where each file can
 * override values defined by the previous ones.
 */
public class Config {

  private static final Pattern COMMENT = Pattern.compile("^\\s*[#;]");

  private final ImmutableMap<String, ImmutableMap<String, String>> sectionToEntries;

  /** Convenience constructor to create an empty config. */
  public Config() {
    this(ImmutableMap.of());
  }

  public Config(ImmutableMap<String, ImmutableMap<String, String>> sectionToEntries) {
    this.sectionToEntries = sectionToEntries;
  }

  /** Later maps override entries of earlier ones, section by section. */
  public Config(ImmutableList<ImmutableMap<String, ImmutableMap<String, String>>> stack) {
    this(sectionToEntriesFromMaps(stack));
  }

  public ImmutableMap<String, ImmutableMap<String, String>> getSectionToEntries() {
    return sectionToEntries;
  }

  public ImmutableMap<String, String> get(String sectionName) {
    return Optional.ofNullable(sectionToEntries.get(sectionName)).orElse(ImmutableMap.of());
  }

  /**
   * @return An {@link ImmutableList} containing all entries that don't look like comments, or the
   *     empty list if the property is not defined or there are no values.
   */
  public ImmutableList<String> getListWithoutComments(String sectionName, String propertyName) {
    return getOptionalListWithoutComments(sectionName, propertyName).orElse(ImmutableList.of());
  }

  /**
   * ini4j leaves things that look like comments in the values of entries in the file. Generally,
   * we don't want to include these in our parameters, so filter them out where necessary. In an INI
   * file, the comment separator is ";", but some parsers (ini4j included) use "#" too. This method
   * handles both cases.
   *
   * @return an {@link ImmutableList} containing all entries that don't look like comments, or
   *     empty if the property is not defined or has no value.
   */
  public Optional<ImmutableList<String>> getOptionalListWithoutComments(
      String sectionName, String propertyName) {
    Optional<String> rawValue = getRawValue(sectionName, propertyName);
    if (!rawValue.isPresent() || rawValue.get().isEmpty()) {
      return Optional.empty();
    }
    String value = rawValue.get();
    if (COMMENT.matcher(value).find()) {
      return Optional.empty();
    }
    return Optional.of(decodeQuotedParts(value, Optional.of(','), sectionName, propertyName));
  }

  public Optional<String> getValue(String sectionName, String propertyName) {
    Optional<String> rawValue = getRawValue(sectionName, propertyName);
    if (!rawValue.isPresent() || rawValue.get().isEmpty()) {
      return Optional.empty();
    }
    return Optional.of(
        decodeQuotedParts(rawValue.get(), Optional.empty(), sectionName, propertyName).get(0));
  }

  public boolean getBooleanValue(String sectionName, String propertyName, boolean defaultValue) {
    Map<String, String> entries = get(sectionName);
    if (!entries.containsKey(propertyName)) {
      return defaultValue;
    }

    String answer = Preconditions.checkNotNull(entries.get(propertyName));
    switch (answer.toLowerCase(Locale.ROOT)) {
      case "yes":
      case "true":
        return true;

      case "no":
      case "false":
        return false;

      default:
        throw new HumanReadableException(
            "Unknown value for %s in [%s]: %s; should be yes/no true/false!",
            propertyName,
            sectionName,
            answer);
    }
  }

  @Override
  public String toString() {
    return sectionToEntries.toString();
  }

  private static ImmutableMap<String, ImmutableMap<String, String>> sectionToEntriesFromMaps(
      ImmutableList<ImmutableMap<String, ImmutableMap<String, String>>> maps) {
    Map<String, Map<String, String>> sectionToEntries = new LinkedHashMap<>();
    for (ImmutableMap<String, ImmutableMap<String, String>> map : maps) {
      for (Map.Entry<String, ImmutableMap<String, String>> section : map.entrySet()) {
        sectionToEntries
            .computeIfAbsent(section.getKey(), key -> new LinkedHashMap<>())
            .putAll(section.getValue());
      }
    }
    ImmutableMap.Builder<String, ImmutableMap<String, String>> builder = ImmutableMap.builder();
    for (Map.Entry<String, Map<String, String>> entry : sectionToEntries.entrySet()) {
      builder.put(entry.getKey(), ImmutableMap.copyOf(entry.getValue()));
    }
    return builder.build();
  }

  /**
   * Decodes from a string to a list of strings, splitting on separators. The encoded string may
   * contain double quotes. These inhibit the special meaning of characters inside them, except for
   * backslash and double quote. Double quote ends the quoted part, and backslash begins an escape
   * sequence: {@code \\}, {@code \"}, {@code \n}, {@code \r} and {@code \t} are supported.
   *
   * <p>When the splitting character is absent, no splitting is performed and a list containing a
   * single string is returned. Unquoted whitespace is trimmed from the front of values.
   */
  private static ImmutableList<String> decodeQuotedParts(
      String input, Optional<Character> splitChar, String section, String field) {
    ImmutableList.Builder<String> listBuilder = ImmutableList.builder();
    StringBuilder stringBuilder = new StringBuilder();
    boolean inQuotes = false;
    int quoteIndex = 0;
    for (int i = 0; i < input.length(); i++) {
      char c = input.charAt(i);
      if (inQuotes) {
        if (c == '"') {
          inQuotes = false;
          continue;
        } else if (c == '\\') {
          ++i;
          if (i >= input.length()) {
            throw new HumanReadableException(
                "%s:%s: Input ends inside escape sequence: %s",
                section,
                field,
                input.substring(i - 1));
          }
          c = input.charAt(i);
          switch (c) {
            case 'n':
              stringBuilder.append('\n');
              continue;
            case 'r':
              stringBuilder.append('\r');
              continue;
            case 't':
              stringBuilder.append('\t');
              continue;
            case '\\':
            case '"':
              // These characters are added literally.
              break;
            default:
              throw new HumanReadableException(
                  "%s:%s: Invalid escape sequence: %s",
                  section,
                  field,
                  input.substring(i - 1, i + 1));
          }
        }
      } else if (c == '"') {
        quoteIndex = i;
        inQuotes = true;
        continue;
      } else if (splitChar.isPresent() && c == splitChar.get()) {
        listBuilder.add(stringBuilder.toString());
        stringBuilder = new StringBuilder();
        continue;
      } else if (stringBuilder.length() == 0 && (c == ' ' || c == '\t')) {
        // Skip unquoted whitespace before value.
        continue;
      }
      stringBuilder.append(c);
    }

    if (inQuotes) {
      // Show a short sample of the quoted part in the error message.
      int lastIndex = Math.min(quoteIndex + 10, input.length());
      throw new HumanReadableException(
          "%s:%s: Input ends inside quoted string: %s...",
          section,
          field,
          input.substring(quoteIndex, lastIndex));
    }

    listBuilder.add(stringBuilder.toString());
    return listBuilder.build();
  }

  /** @return the value at sectionName, propertyName, without any decoding. */
  private Optional<String> getRawValue(String sectionName, String propertyName) {
    return Optional.ofNullable(get(sectionName).get(propertyName));
  }
}
