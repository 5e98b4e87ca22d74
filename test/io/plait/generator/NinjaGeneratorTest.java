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

package io.plait.generator;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import io.plait.env.Environment;
import io.plait.model.DirNode;
import io.plait.project.Project;
import io.plait.resolver.MissingSourceException;
import io.plait.target.Target;
import io.plait.testutil.FakeToolchain;
import io.plait.testutil.TestProjects;
import io.plait.util.HumanReadableException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class NinjaGeneratorTest {

  private Project project;
  private Environment env;
  private NinjaGenerator generator;

  @Before
  public void setUp() throws Exception {
    project = TestProjects.newProject("demo");
    env = project.createEnvironment("default", new FakeToolchain());
    generator = new NinjaGenerator();
  }

  @Test
  public void writesRulesAndBuildStatementsRelativeToTheOutputDirectory() throws Exception {
    TestProjects.touch(project, "src/main.c", "include/util.h");
    project.program("hello", env, "src/main.c").privateIncludes("include");
    project.resolve();

    String ninja = generator.render(project, path("build"));

    assertThat(ninja)
        .startsWith(
            "# Generated by plait for project demo. Do not edit.\n"
                + "ninja_required_version = 1.3\n"
                + "builddir = .\n"
                + "\n");
    assertThat(ninja)
        .contains(
            "rule cc_objcmd_default\n"
                + "  command = gcc $includes $defines $extra_flags -MMD -MF $out.d -c -o $out"
                + " $in\n"
                + "  description = cc $out\n"
                + "  depfile = $out.d\n"
                + "  deps = gcc\n");
    assertThat(ninja)
        .contains(
            "rule link_progcmd_default\n"
                + "  command = gcc $ldflags -o $out $in $libdirs $libs\n"
                + "  description = link $out\n\n");
    assertThat(ninja)
        .contains(
            "build obj.hello/src/main.o: cc_objcmd_default ../src/main.c\n"
                + "  includes = -I../include\n\n");
    assertThat(ninja).contains("build hello: link_progcmd_default obj.hello/src/main.o\n\n");
    assertThat(ninja).doesNotContain("build hello: phony");
    assertThat(ninja).endsWith("default hello\n");
  }

  @Test
  public void clonedEnvironmentsGetTheirOwnRules() throws Exception {
    TestProjects.touch(project, "src/main.c");
    Environment debug = env.clone("debug");
    env.getTool("cc").get().setFlags(ImmutableList.of("-O2"));
    debug.getTool("cc").get().setFlags(ImmutableList.of("-g"));
    project.program("app_release", env, "src/main.c");
    project.program("app_debug", debug, "src/main.c");
    project.resolve();

    String ninja = generator.render(project, path(""));

    assertThat(ninja)
        .contains(
            "rule cc_objcmd_default\n"
                + "  command = gcc -O2 $includes $defines $extra_flags -MMD -MF $out.d -c -o"
                + " $out $in\n");
    assertThat(ninja)
        .contains(
            "rule cc_objcmd_debug\n"
                + "  command = gcc -g $includes $defines $extra_flags -MMD -MF $out.d -c -o"
                + " $out $in\n");
    assertThat(ninja)
        .contains(
            "build build/obj.app_release/src/main.o: cc_objcmd_default src/main.c\n");
    assertThat(ninja)
        .contains("build build/obj.app_debug/src/main.o: cc_objcmd_debug src/main.c\n");
    assertThat(ninja).doesNotContain("cc_objcmd_default_2");
  }

  @Test
  public void writesPhonyStatementsForDirectoriesAliasesAndTargets() throws Exception {
    TestProjects.touch(project, "src/main.c", "README", "NEWS");
    Target app = project.program("app", env, "src/main.c");
    project.dir("docs", DirNode.Role.TARGET, "README", "NEWS");
    project.alias("all", app, "README");
    project.resolve();

    String ninja = generator.render(project, path(""));

    assertThat(ninja).contains("build docs: phony README NEWS\n");
    assertThat(ninja).contains("build all: phony build/app README\n");
    assertThat(ninja).contains("build app: phony build/app\n");
    assertThat(ninja).endsWith("default build/app\n");
  }

  @Test
  public void sourceDirectoryStandsForItsMembers() throws Exception {
    TestProjects.touch(project, "gen.py", "templates/a.tmpl", "templates/b.tmpl");
    DirNode templates =
        project.dir("templates", DirNode.Role.SOURCE, "templates/a.tmpl", "templates/b.tmpl");
    project.command(
        "render", env, "python gen.py $$out", ImmutableList.of("out.txt"), "gen.py", templates);
    project.resolve();

    String ninja = generator.render(project, path(""));

    assertThat(ninja)
        .contains(
            "build build/out.txt: command_render_default gen.py templates/a.tmpl"
                + " templates/b.tmpl\n");
  }

  @Test
  public void escapesPathsAndValues() throws Exception {
    TestProjects.touch(project, "src/my file.c", "src/a:b.c");
    project.program("app", env, "src/my file.c", "src/a:b.c").privateDefines("PRICE=$5");
    project.resolve();

    String ninja = generator.render(project, path(""));

    assertThat(ninja)
        .contains("build build/obj.app/src/my$ file.o: cc_objcmd_default src/my$ file.c\n");
    assertThat(ninja)
        .contains("build build/obj.app/src/a$:b.o: cc_objcmd_default src/a$:b.c\n");
    assertThat(ninja).contains("  defines = '-DPRICE=$$5'\n");
  }

  @Test
  public void orderOnlyDependenciesFollowTheDoublePipe() throws Exception {
    TestProjects.touch(project, "gen.py", "src/main.c");
    Target config =
        project.command(
            "config_h", env, "python $$in -o $$out", ImmutableList.of("config.h"), "gen.py");
    project.program("app", env, "src/main.c").linkPrivate(config);
    project.resolve();

    String ninja = generator.render(project, path(""));

    assertThat(ninja)
        .contains(
            "rule command_config_h_default\n"
                + "  command = python $in -o $out\n"
                + "  description = command $out\n\n");
    assertThat(ninja)
        .contains(
            "build build/obj.app/src/main.o: cc_objcmd_default src/main.c || build/config.h\n");
  }

  @Test
  public void explicitDefaultsNameTargetsNodesOrPaths() throws Exception {
    TestProjects.touch(project, "src/main.c", "src/tool.c");
    Target app = project.program("app", env, "src/main.c");
    project.program("tool", env, "src/tool.c");
    project.setDefault(app, "tool", "src/main.c");
    project.resolve();

    String ninja = generator.render(project, path(""));

    assertThat(ninja).endsWith("default build/app build/tool src/main.c\n");
  }

  @Test
  public void unknownDefaultIsAnError() throws Exception {
    TestProjects.touch(project, "src/main.c");
    project.program("app", env, "src/main.c");
    project.setDefault("nothing-here");
    project.resolve();

    HumanReadableException e =
        assertThrows(HumanReadableException.class, () -> generator.render(project, path("")));
    assertThat(e.getMessage()).contains("nothing-here");
  }

  @Test
  public void generateWritesTheBuildFileAndValues() throws Exception {
    TestProjects.touch(project, "src/main.c");
    project.program("app", env, "src/main.c");
    project.value("version", "1.2.3");

    new NinjaGenerator("out.ninja").generate(project, path("build"));

    assertThat(project.isResolved()).isTrue();
    assertThat(TestProjects.read(project, "build/out.ninja"))
        .contains("build app: link_progcmd_default obj.app/src/main.o\n");
    assertThat(TestProjects.read(project, "build/.values/version.value")).isEqualTo("1.2.3");
  }

  @Test
  public void unchangedBuildFileIsNotRewritten() throws Exception {
    TestProjects.touch(project, "src/main.c");
    project.program("app", env, "src/main.c");
    generator.generate(project, path(""));
    Path buildFile = project.getRootDir().resolve(NinjaGenerator.DEFAULT_BUILD_FILE);
    Files.setLastModifiedTime(buildFile, FileTime.fromMillis(0));

    generator.generate(project, path(""));

    assertThat(Files.getLastModifiedTime(buildFile).toMillis()).isEqualTo(0L);
  }

  @Test
  public void failedResolutionStillFailsOnTheNextGenerate() throws Exception {
    project.program("hello", env, "src/missing.c");

    MissingSourceException first =
        assertThrows(MissingSourceException.class, () -> generator.generate(project, path("")));
    assertThat(project.isResolved()).isFalse();
    MissingSourceException second =
        assertThrows(MissingSourceException.class, () -> generator.generate(project, path("")));

    assertThat(second).isSameInstanceAs(first);
    assertThat(project.getResolutionFailure()).hasValue(first);
    assertThat(Files.exists(project.getRootDir().resolve(NinjaGenerator.DEFAULT_BUILD_FILE)))
        .isFalse();
  }

  private Path path(String relative) {
    return project.getNodeRegistry().toPath(relative);
  }
}
