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

package io.plait.io;

import static com.google.common.truth.Truth.assertThat;
import static java.nio.charset.StandardCharsets.UTF_8;

import com.google.common.jimfs.Configuration;
import com.google.common.jimfs.Jimfs;
import java.nio.file.FileSystem;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.util.stream.Stream;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class MoreFilesTest {

  private FileSystem fileSystem;

  @Before
  public void setUp() {
    fileSystem = Jimfs.newFileSystem(Configuration.unix());
  }

  @Test
  public void writeAtomicallyCreatesParentsAndLeavesNoTemporaryFile() throws Exception {
    Path file = fileSystem.getPath("/out/nested/build.ninja");
    MoreFiles.writeAtomically(file, "rule cc\n");
    assertThat(new String(Files.readAllBytes(file), UTF_8)).isEqualTo("rule cc\n");
    try (Stream<Path> siblings = Files.list(file.getParent())) {
      assertThat(siblings.count()).isEqualTo(1L);
    }
  }

  @Test
  public void writeIfChangedSkipsIdenticalContents() throws Exception {
    Path file = fileSystem.getPath("/out/version.value");
    assertThat(MoreFiles.writeIfChanged(file, "1.0")).isTrue();
    FileTime epoch = FileTime.fromMillis(0);
    Files.setLastModifiedTime(file, epoch);

    assertThat(MoreFiles.writeIfChanged(file, "1.0")).isFalse();
    assertThat(Files.getLastModifiedTime(file)).isEqualTo(epoch);

    assertThat(MoreFiles.writeIfChanged(file, "2.0")).isTrue();
    assertThat(new String(Files.readAllBytes(file), UTF_8)).isEqualTo("2.0");
  }
}
