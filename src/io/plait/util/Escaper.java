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

import com.google.common.base.CharMatcher;
import com.google.common.base.Joiner;
import com.google.common.collect.Iterables;
import java.util.function.Function;

/** Quoting helpers for POSIX shells and for Ninja build files. */
public final class Escaper {

  /** Utility class: do not instantiate. */
  private Escaper() {}

  private static final CharMatcher BASH_SPECIAL_CHARS =
      CharMatcher.anyOf("<>|!?*[]$\\(){}\"'`&;=#~ \t\n").or(CharMatcher.whitespace());

  /** Same as {@link #BASH_SPECIAL_CHARS} but lets {@code $} through for the executor. */
  private static final CharMatcher BASH_SPECIAL_CHARS_EXCEPT_DOLLAR =
      BASH_SPECIAL_CHARS.and(CharMatcher.isNot('$'));

  private static final CharMatcher NINJA_PATH_SPECIAL_CHARS = CharMatcher.anyOf("$: \n");

  public static final Function<String, String> SHELL_ESCAPER = Escaper::escapeAsShellString;

  /**
   * Quotes a single argument for a POSIX shell. Arguments without special characters are returned
   * unchanged; everything else is single-quoted, with embedded single quotes spliced in.
   */
  public static String escapeAsShellString(String str) {
    if (str.isEmpty()) {
      return "''";
    }
    if (BASH_SPECIAL_CHARS.matchesNoneOf(str)) {
      return str;
    }
    return "'" + str.replace("'", "'\\''") + "'";
  }

  /**
   * Quotes a token of a command template whose {@code $name} references are left for the executor
   * to expand. The token is only quoted when it contains shell-special characters other than
   * {@code $}, in which case double quotes are used so the executor's substitution still lands
   * inside a single shell word.
   */
  public static String escapeCommandToken(String token) {
    if (token.isEmpty()) {
      return "''";
    }
    if (BASH_SPECIAL_CHARS_EXCEPT_DOLLAR.matchesNoneOf(token)) {
      return token;
    }
    if (token.indexOf('$') < 0) {
      return escapeAsShellString(token);
    }
    return "\""
        + token.replace("\\", "\\\\").replace("\"", "\\\"").replace("`", "\\`")
        + "\"";
  }

  /** Joins arguments into one shell command line, quoting each one independently. */
  public static String joinShellArguments(Iterable<String> args) {
    return Joiner.on(' ').join(Iterables.transform(args, SHELL_ESCAPER::apply));
  }

  /** Escapes a path that appears in a Ninja {@code build} line. */
  public static String escapeNinjaPath(String path) {
    if (NINJA_PATH_SPECIAL_CHARS.matchesNoneOf(path)) {
      return path;
    }
    StringBuilder sb = new StringBuilder(path.length() + 8);
    for (int i = 0; i < path.length(); i++) {
      char c = path.charAt(i);
      switch (c) {
        case '$':
          sb.append("$$");
          break;
        case ':':
          sb.append("$:");
          break;
        case ' ':
          sb.append("$ ");
          break;
        case '\n':
          sb.append("$\n");
          break;
        default:
          sb.append(c);
      }
    }
    return sb.toString();
  }

  /** Escapes a literal value assigned to a Ninja variable; only {@code $} is special there. */
  public static String escapeNinjaValue(String value) {
    return value.replace("$", "$$");
  }
}
