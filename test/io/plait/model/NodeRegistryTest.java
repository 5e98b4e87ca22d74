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

package io.plait.model;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.jimfs.Configuration;
import com.google.common.jimfs.Jimfs;
import java.nio.file.FileSystem;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class NodeRegistryTest {

  private FileSystem fileSystem;
  private NodeRegistry registry;

  @Before
  public void setUp() {
    fileSystem = Jimfs.newFileSystem(Configuration.unix());
    registry = new NodeRegistry(fileSystem.getPath("/work"), fileSystem.getPath("build"));
  }

  @Test
  public void sameIdentityYieldsSameInstance() {
    FileNode first = registry.file("src/main.c");
    FileNode second = registry.file("src/./main.c");
    FileNode third = registry.file(fileSystem.getPath("/work/src/main.c"));
    assertThat(second).isSameInstanceAs(first);
    assertThat(third).isSameInstanceAs(first);
    assertThat(registry.alias("all")).isSameInstanceAs(registry.alias("all"));
    assertThat(registry.size()).isEqualTo(2);
  }

  @Test
  public void pathsInsideTheRootAreStoredRelative() {
    assertThat(registry.file("/work/include/a.h").getPath().toString()).isEqualTo("include/a.h");
    assertThat(registry.file("/usr/include/stdio.h").getPath().toString())
        .isEqualTo("/usr/include/stdio.h");
    assertThat(registry.getBuildDir().toString()).isEqualTo("build");
  }

  @Test
  public void pathCannotChangeNodeType() {
    registry.file("gen");
    assertThrows(
        IllegalArgumentException.class,
        () -> registry.dir(fileSystem.getPath("gen"), DirNode.Role.TARGET));
  }

  @Test
  public void directoryRoleIsFixed() {
    registry.dir(fileSystem.getPath("out"), DirNode.Role.TARGET);
    assertThrows(
        IllegalArgumentException.class,
        () -> registry.dir(fileSystem.getPath("out"), DirNode.Role.SOURCE));
  }

  @Test
  public void targetDirectoryDependsOnItsMembers() {
    DirNode dir = registry.dir(fileSystem.getPath("dist"), DirNode.Role.TARGET);
    FileNode member = registry.file("dist/app");
    assertThat(dir.addMember(member)).isTrue();
    assertThat(dir.addMember(member)).isFalse();
    assertThat(dir.getExplicitDeps()).containsExactly(member);

    DirNode sources = registry.dir(fileSystem.getPath("headers"), DirNode.Role.SOURCE);
    sources.addMember(registry.file("headers/a.h"));
    assertThat(sources.getExplicitDeps()).isEmpty();
  }

  @Test
  public void valuesLiveUnderTheBuildDirectoryAndUpdateInPlace() {
    ValueNode value = registry.value("version", "1.0");
    assertThat(value.getPath().toString()).isEqualTo("build/.values/version.value");
    assertThat(registry.value("version", "2.0")).isSameInstanceAs(value);
    assertThat(value.getValue()).isEqualTo("2.0");
  }

  @Test
  public void nodeCannotDependOnItself() {
    FileNode node = registry.file("a.c");
    assertThrows(IllegalArgumentException.class, () -> node.addExplicitDep(node));
  }

  @Test
  public void producerIsSetOnce() {
    FileNode source = registry.file("a.c");
    FileNode object = registry.file("build/a.o");
    BuildStep step =
        BuildStep.builder()
            .setEnvironmentName("default")
            .setTool("cc")
            .setCommandVariable("objcmd")
            .addCommand("gcc", "-c", "$in", "-o", "$out")
            .addInputs(source)
            .addOutputs(object)
            .build();
    object.setProducer(step);
    object.setProducer(step);
    assertThat(object.isSource()).isFalse();
    assertThat(source.isSource()).isTrue();
    assertThat(step.isCompile()).isFalse();

    BuildStep other = BuildStep.copyOf(step).withCommandVariable("other");
    assertThrows(IllegalStateException.class, () -> object.setProducer(other));
  }

  @Test
  public void stepNeedsAnOutput() {
    assertThrows(
        IllegalStateException.class,
        () ->
            BuildStep.builder()
                .setEnvironmentName("default")
                .setTool("cc")
                .setCommandVariable("objcmd")
                .addCommand("gcc")
                .build());
  }

  @Test
  public void pathArgumentsRenderThroughTheGivenFunction() {
    CommandArg include = CommandArg.path("-I", fileSystem.getPath("include"));
    assertThat(include.render(path -> "../" + path)).isEqualTo("-I../include");
    assertThat(CommandArg.literal("-DX").render(path -> "../" + path)).isEqualTo("-DX");
  }
}
