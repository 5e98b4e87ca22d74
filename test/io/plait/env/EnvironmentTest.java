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

package io.plait.env;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import io.plait.project.Project;
import io.plait.subst.MissingVariableException;
import io.plait.subst.Value;
import io.plait.target.Target;
import io.plait.target.TargetKind;
import io.plait.testutil.FakeToolchain;
import io.plait.testutil.TestProjects;
import io.plait.util.HumanReadableException;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class EnvironmentTest {

  private Project project;
  private Environment env;

  @Before
  public void setUp() throws Exception {
    project = TestProjects.newProject("envs");
    env = project.createEnvironment("release", new FakeToolchain());
  }

  @Test
  public void toolchainAndInstallToolsAreSetUp() {
    assertThat(env.getTools().keySet()).containsAtLeast("install", "cc", "cxx", "ar", "link");
    assertThat(env.getTool("cc").get().getCmd()).hasValue("gcc");
    assertThat(env.getToolchain()).isPresent();
  }

  @Test
  public void substExpandsToolVariables() {
    env.getTool("cc").get().setFlags(ImmutableList.of("-O2"));
    env.set("out", "$cc.flags -c");
    assertThat(env.subst("$out")).isEqualTo("-O2 -c");
    assertThat(env.substList("$cc.cmd $cc.flags")).containsExactly("gcc", "-O2").inOrder();
  }

  @Test
  public void substQuotesEachToken() {
    env.set("dir", Value.ofList("has space", "plain"));
    assertThat(env.subst("ls $dir")).isEqualTo("ls 'has space' plain");
  }

  @Test
  public void substOverridesApplyToOneCallOnly() {
    env.getTool("cc").get().setFlags(ImmutableList.of("-O2"));
    assertThat(
            env.subst("$cc.cmd $cc.flags", ImmutableMap.of("cc.flags", Value.ofList("-O0", "-g"))))
        .isEqualTo("gcc -O0 -g");
    assertThat(env.subst("$cc.cmd $cc.flags")).isEqualTo("gcc -O2");
  }

  @Test
  public void missingVariableIsReported() {
    assertThrows(MissingVariableException.class, () -> env.subst("$cc.nothing"));
  }

  @Test
  public void cloneIsIndependentAndRegistered() {
    env.getTool("cc").get().setFlags(ImmutableList.of("-O2"));
    Environment debug = env.clone("debug");
    debug.getTool("cc").get().setFlags(ImmutableList.of("-g"));

    assertThat(env.getTool("cc").get().getFlags()).containsExactly("-O2");
    assertThat(debug.getTool("cc").get().getFlags()).containsExactly("-g");
    assertThat(debug.getToolchain()).isEqualTo(env.getToolchain());
    assertThat(project.getEnvironment("debug")).hasValue(debug);
  }

  @Test
  public void unnamedClonesAreNumbered() {
    assertThat(env.clone().getName()).isEqualTo("release-1");
    assertThat(env.clone().getName()).isEqualTo("release-2");
  }

  @Test
  public void cloneWithTakenNameIsRenamed() {
    Environment copy = env.clone("release");
    assertThat(copy.getName()).isEqualTo("release_1");
    assertThat(project.getNameConflicts()).hasSize(1);
  }

  @Test
  public void overrideSetsToolAndCrossToolVariables() {
    Environment tuned =
        env.override(
            ImmutableMap.of(
                "cc.flags", Value.ofList("-Os"),
                "prefix", Value.of("/opt")));
    assertThat(tuned.getTool("cc").get().getFlags()).containsExactly("-Os");
    assertThat(tuned.get("prefix")).hasValue(Value.of("/opt"));
    assertThat(env.get("prefix")).isEmpty();
    assertThat(env.getTool("cc").get().getFlags()).isEmpty();
  }

  @Test
  public void substListExpandsFunctionsWrittenWithSpaces() {
    env.getTool("cc").get().set("sysdirs", Value.ofList("/opt/a", "/opt/b"));

    assertThat(env.substList("gcc ${prefix(-isystem, cc.sysdirs)} -c"))
        .containsExactly("gcc", "-isystem/opt/a", "-isystem/opt/b", "-c")
        .inOrder();
  }

  @Test
  public void toolVariablesCannotBeSetAsCrossToolVariables() {
    assertThrows(IllegalArgumentException.class, () -> env.set("cc.flags", "-O2"));
  }

  @Test
  public void buildersAreReboundOnClone() {
    env.addTool("protoc").setCmd("protoc").set("gencmd", "$protoc.cmd --cpp_out=. $$in");
    BoundBuilder bound =
        env.addBuilder(ToolBuilder.of("proto", "protoc", "gencmd"));
    assertThat(bound.getEnvironment()).isSameInstanceAs(env);

    Environment other = env.clone("other");
    BoundBuilder cloned = other.getBuilder("proto");
    assertThat(cloned.getEnvironment()).isSameInstanceAs(other);
    assertThat(env.getBuilder("proto").getEnvironment()).isSameInstanceAs(env);

    Target generated = cloned.invoke("messages", "messages.pb.cc", "messages.proto");
    assertThat(generated.getKind()).isEqualTo(TargetKind.CUSTOM);
    assertThat(generated.getEnvironment()).isSameInstanceAs(other);
    assertThat(generated.getDeclaredOutputs()).containsExactly("messages.pb.cc");
  }

  @Test
  public void rebindReturnsANewBinding() {
    env.addTool("protoc").setCmd("protoc").set("gencmd", "$protoc.cmd $$in");
    BoundBuilder bound = env.addBuilder(ToolBuilder.of("proto", "protoc", "gencmd"));
    Environment plain = project.createEnvironment("plain");
    assertThrows(IllegalArgumentException.class, () -> bound.rebind(plain));

    Environment other = env.clone("other");
    BoundBuilder rebound = bound.rebind(other);
    assertThat(rebound.getEnvironment()).isSameInstanceAs(other);
    assertThat(rebound.getBuilder()).isSameInstanceAs(bound.getBuilder());
    assertThat(bound.getEnvironment()).isSameInstanceAs(env);
  }

  @Test
  public void unknownBuilderIsAHumanReadableError() {
    HumanReadableException e =
        assertThrows(HumanReadableException.class, () -> env.getBuilder("nope"));
    assertThat(e.getMessage()).contains("nope");
  }

  @Test
  public void separatedArgFlagsComeFromTheToolchains() {
    assertThat(env.getSeparatedArgFlags()).contains("-framework");
  }
}
