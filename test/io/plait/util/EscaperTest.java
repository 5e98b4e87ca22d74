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

import static com.google.common.truth.Truth.assertThat;

import com.google.common.collect.ImmutableList;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class EscaperTest {

  @Test
  public void plainArgumentsAreNotQuoted() {
    assertThat(Escaper.escapeAsShellString("-O2")).isEqualTo("-O2");
    assertThat(Escaper.escapeAsShellString("src/main.c")).isEqualTo("src/main.c");
  }

  @Test
  public void specialCharactersAreSingleQuoted() {
    assertThat(Escaper.escapeAsShellString("a b")).isEqualTo("'a b'");
    assertThat(Escaper.escapeAsShellString("$HOME")).isEqualTo("'$HOME'");
    assertThat(Escaper.escapeAsShellString("it's")).isEqualTo("'it'\\''s'");
    assertThat(Escaper.escapeAsShellString("")).isEqualTo("''");
  }

  @Test
  public void joinQuotesEachArgument() {
    assertThat(Escaper.joinShellArguments(ImmutableList.of("gcc", "-DMSG=hello world", "-c")))
        .isEqualTo("gcc '-DMSG=hello world' -c");
  }

  @Test
  public void commandTokensKeepExecutorVariables() {
    assertThat(Escaper.escapeCommandToken("$out")).isEqualTo("$out");
    assertThat(Escaper.escapeCommandToken("-Wl,-rpath,$out")).isEqualTo("-Wl,-rpath,$out");
    assertThat(Escaper.escapeCommandToken("a b")).isEqualTo("'a b'");
    assertThat(Escaper.escapeCommandToken("--out=\"$out\" x"))
        .isEqualTo("\"--out=\\\"$out\\\" x\"");
  }

  @Test
  public void ninjaPathsEscapeSpacesColonsAndDollars() {
    assertThat(Escaper.escapeNinjaPath("path with spaces/file.c"))
        .isEqualTo("path$ with$ spaces/file.c");
    assertThat(Escaper.escapeNinjaPath("$HOME/file.c")).isEqualTo("$$HOME/file.c");
    assertThat(Escaper.escapeNinjaPath("C:/path/file.c")).isEqualTo("C$:/path/file.c");
    assertThat(Escaper.escapeNinjaPath("plain/file.c")).isEqualTo("plain/file.c");
  }

  @Test
  public void ninjaValuesOnlyEscapeDollars() {
    assertThat(Escaper.escapeNinjaValue("-DPRICE=$5 a:b")).isEqualTo("-DPRICE=$$5 a:b");
  }
}
