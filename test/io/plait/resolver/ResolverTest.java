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

package io.plait.resolver;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import io.plait.env.AbstractToolchain;
import io.plait.env.BoundBuilder;
import io.plait.env.Environment;
import io.plait.env.SourceHandler;
import io.plait.env.ToolBuilder;
import io.plait.env.Toolchain;
import io.plait.model.BuildStep;
import io.plait.model.CommandArg;
import io.plait.model.DirNode;
import io.plait.model.Node;
import io.plait.project.Project;
import io.plait.target.Target;
import io.plait.testutil.CapturingLogHandler;
import io.plait.testutil.FakeToolchain;
import io.plait.testutil.TestProjects;
import io.plait.util.HumanReadableException;
import java.util.List;
import java.util.logging.Level;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class ResolverTest {

  private Project project;
  private Environment env;

  @Before
  public void setUp() throws Exception {
    project = TestProjects.newProject("demo");
    env = project.createEnvironment("default", new FakeToolchain());
  }

  @Test
  public void programCompilesEachSourceAndLinksTheObjects() throws Exception {
    TestProjects.touch(project, "src/main.c", "src/util.c", "include/util.h");
    Target hello =
        project
            .program("hello", env, "src/main.c", "src/util.c", "include/util.h")
            .privateIncludes("include");

    project.resolve();

    assertThat(names(hello.getObjectNodes()))
        .containsExactly("build/obj.hello/src/main.o", "build/obj.hello/src/util.o")
        .inOrder();
    assertThat(names(hello.getOutputNodes())).containsExactly("build/hello");

    BuildStep compile = hello.getObjectNodes().get(0).getProducer().get();
    assertThat(compile.getTool()).isEqualTo("cc");
    assertThat(compile.getCommandVariable()).isEqualTo("objcmd");
    assertThat(compile.getCommand())
        .containsExactly(
            "gcc", "$includes", "$defines", "$extra_flags", "-MMD", "-MF", "$out.d", "-c", "-o",
            "$out", "$in")
        .inOrder();
    assertThat(names(compile.getInputs())).containsExactly("src/main.c");
    assertThat(compile.getVariables().get("includes"))
        .containsExactly(CommandArg.path("-I", project.getNodeRegistry().toPath("include")));
    assertThat(compile.getDepfile()).hasValue("$out.d");
    assertThat(compile.getDepsStyle()).hasValue("gcc");
    assertThat(compile.getTargetName()).hasValue("hello");

    BuildStep link = hello.getOutputNodes().get(0).getProducer().get();
    assertThat(link.getTool()).isEqualTo("link");
    assertThat(link.getCommandVariable()).isEqualTo("progcmd");
    assertThat(link.getCommand())
        .containsExactly("gcc", "$ldflags", "-o", "$out", "$in", "$libdirs", "$libs")
        .inOrder();
    assertThat(names(link.getInputs()))
        .containsExactly("build/obj.hello/src/main.o", "build/obj.hello/src/util.o")
        .inOrder();
  }

  @Test
  public void resolvingTwiceChangesNothing() throws Exception {
    TestProjects.touch(project, "src/main.c");
    Target hello = project.program("hello", env, "src/main.c");

    project.resolve();
    ImmutableList<Node> outputs = hello.getOutputNodes();
    int size = project.getNodeRegistry().size();
    project.resolve();

    assertThat(hello.getOutputNodes()).isEqualTo(outputs);
    assertThat(project.getNodeRegistry().size()).isEqualTo(size);
    assertThat(project.isResolved()).isTrue();
  }

  @Test
  public void targetsAddedAfterResolvingAreResolvedNextTime() throws Exception {
    TestProjects.touch(project, "src/main.c", "src/tool.c");
    project.program("hello", env, "src/main.c");
    project.resolve();

    Target tool = project.program("tool", env, "src/tool.c");
    assertThat(project.isResolved()).isFalse();
    project.resolve();

    assertThat(names(tool.getOutputNodes())).containsExactly("build/tool");
  }

  @Test
  public void installMayBeDeclaredBeforeTheTargetsItDependsOn() throws Exception {
    TestProjects.touch(project, "src/main.c", "src/util.c", "README");
    Target app = project.program("app", env, "src/main.c");
    Target dist = project.install("dist", "dist/bin", app, "README");
    Target util = project.staticLibrary("util", env, "src/util.c");
    app.link(util);

    project.resolve();

    assertThat(names(dist.getOutputNodes()))
        .containsExactly("dist/bin/app", "dist/bin/README")
        .inOrder();
    BuildStep copy = dist.getOutputNodes().get(0).getProducer().get();
    assertThat(copy.getTool()).isEqualTo(Environment.INSTALL_TOOL);
    assertThat(copy.getCommand()).containsExactly("cp", "$in", "$out").inOrder();
    assertThat(names(copy.getInputs())).containsExactly("build/app");
    assertThat(project.getTargets().indexOf(dist))
        .isLessThan(project.getTargets().indexOf(util));
  }

  @Test
  public void installAsCopiesToAnExactPath() throws Exception {
    TestProjects.touch(project, "src/main.c");
    Target app = project.program("app", env, "src/main.c");
    Target bin = project.installAs("bin", "dist/usr/bin/app-1.0", app);

    project.resolve();

    assertThat(names(bin.getOutputNodes())).containsExactly("dist/usr/bin/app-1.0");
  }

  @Test
  public void installedDirectoryIsCopiedMemberByMember() throws Exception {
    TestProjects.touch(project, "README", "NEWS");
    DirNode docs = project.dir("docs", DirNode.Role.SOURCE, "README", "NEWS");
    Target share = project.install("share", "dist/share", docs);

    project.resolve();

    assertThat(names(share.getOutputNodes()))
        .containsExactly("dist/share/docs/README", "dist/share/docs/NEWS")
        .inOrder();
    BuildStep step = share.getOutputNodes().get(0).getProducer().get();
    assertThat(names(step.getInputs())).containsExactly("README");
  }

  @Test
  public void installAsRejectsADirectory() throws Exception {
    TestProjects.touch(project, "README");
    DirNode docs = project.dir("docs", DirNode.Role.SOURCE, "README");
    project.installAs("docs_copy", "dist/docs", docs);

    HumanReadableException e = assertThrows(HumanReadableException.class, project::resolve);

    assertThat(e.getMessage()).contains("docs is a directory");
  }

  @Test
  public void linkCycleIsReportedWithBothTargets() throws Exception {
    TestProjects.touch(project, "a.c", "b.c");
    Target a = project.staticLibrary("a", env, "a.c");
    Target b = project.staticLibrary("b", env, "b.c");
    a.link(b);
    b.link(a);

    DependencyCycleException e = assertThrows(DependencyCycleException.class, project::resolve);

    assertThat(e.getCycle()).containsAtLeast("a", "b");
    assertThat(e.getCycle().get(0)).isEqualTo(e.getCycle().get(e.getCycle().size() - 1));
    assertThat(e.getHumanReadableErrorMessage()).contains("dependency cycle");
  }

  @Test
  public void missingSourceIsReported() throws Exception {
    project.program("hello", env, "src/missing.c");

    MissingSourceException e = assertThrows(MissingSourceException.class, project::resolve);

    assertThat(e.getPath().toString()).isEqualTo("src/missing.c");
    assertThat(e.getHumanReadableErrorMessage()).contains("hello");
  }

  @Test
  public void unknownSuffixIsReported() throws Exception {
    TestProjects.touch(project, "src/main.f90");
    project.program("hello", env, "src/main.f90");

    MissingToolException e = assertThrows(MissingToolException.class, project::resolve);

    assertThat(e.getSuffix()).hasValue(".f90");
    assertThat(e.getTool()).isEmpty();
    assertThat(e.getHumanReadableErrorMessage()).contains("environment default");
  }

  @Test
  public void environmentWithoutToolchainCannotCompile() throws Exception {
    TestProjects.touch(project, "src/main.c");
    Environment bare = project.createEnvironment("bare");
    project.program("hello", bare, "src/main.c");

    MissingToolException e = assertThrows(MissingToolException.class, project::resolve);

    assertThat(e.getSuffix()).hasValue(".c");
  }

  @Test
  public void toolchainHandlerWhoseToolIsMissingNamesSuffixAndTool() throws Exception {
    TestProjects.touch(project, "src/kernel.cu");
    Toolchain cuda =
        new AbstractToolchain(
            "cuda",
            ImmutableMap.of(
                ".cu", SourceHandler.builder().setTool("nvcc").setLanguage("cuda").build())) {
          @Override
          public void setup(Environment environment) {}
        };
    Environment gpu = project.createEnvironment("gpu", cuda);
    project.program("kernel", gpu, "src/kernel.cu");

    MissingToolException e = assertThrows(MissingToolException.class, project::resolve);

    assertThat(e.getSuffix()).hasValue(".cu");
    assertThat(e.getTool()).hasValue("nvcc");
    assertThat(e.getHumanReadableErrorMessage()).contains(".cu files need tool nvcc");
    assertThat(e.getHumanReadableErrorMessage()).contains("environment gpu");
  }

  @Test
  public void identicalCompilationsShareOneObject() throws Exception {
    TestProjects.touch(project, "src/common.c", "src/a.c", "src/b.c");
    Target a = project.program("a", env, "src/a.c", "src/common.c");
    Target b = project.program("b", env, "src/b.c", "src/common.c");

    project.resolve();

    assertThat(a.getObjectNodes().get(1)).isSameInstanceAs(b.getObjectNodes().get(1));
    assertThat(a.getObjectNodes().get(1).getName()).isEqualTo("build/obj.a/src/common.o");
  }

  @Test
  public void differentFlagsCompileSeparateObjects() throws Exception {
    TestProjects.touch(project, "src/common.c");
    Target a = project.program("a", env, "src/common.c");
    Target b = project.program("b", env, "src/common.c").privateDefines("B");

    project.resolve();

    assertThat(a.getObjectNodes().get(0)).isNotSameInstanceAs(b.getObjectNodes().get(0));
    assertThat(b.getObjectNodes().get(0).getName()).isEqualTo("build/obj.b/src/common.o");
    assertThat(b.getObjectNodes().get(0).getProducer().get().getVariables().get("defines"))
        .containsExactly(CommandArg.literal("-DB"));
  }

  @Test
  public void staticLibraryPassesItsPublicRequirementsToUsers() throws Exception {
    TestProjects.touch(project, "src/util.c", "src/main.c");
    Target util =
        project
            .staticLibrary("util", env, "src/util.c")
            .publicIncludes("include")
            .publicLinkLibs("m");
    Target app = project.program("app", env, "src/main.c").link(util);

    project.resolve();

    assertThat(names(util.getOutputNodes())).containsExactly("build/libutil.a");
    BuildStep archive = util.getOutputNodes().get(0).getProducer().get();
    assertThat(archive.getCommand()).containsExactly("ar", "rcs", "$out", "$in").inOrder();

    BuildStep compile = app.getObjectNodes().get(0).getProducer().get();
    assertThat(compile.getVariables().get("includes"))
        .containsExactly(CommandArg.path("-I", project.getNodeRegistry().toPath("include")));
    BuildStep link = app.getOutputNodes().get(0).getProducer().get();
    assertThat(names(link.getInputs()))
        .containsExactly("build/obj.app/src/main.o", "build/libutil.a")
        .inOrder();
    assertThat(link.getVariables().get("libs")).containsExactly(CommandArg.literal("-lm"));
  }

  @Test
  public void emptyObjectLibraryIsReportedLikeOtherLibraries() throws Exception {
    TestProjects.touch(project, "include/api.h");
    Target objects = project.objectLibrary("objs", env, "include/api.h");
    Target archive = project.staticLibrary("archive", env);

    try (CapturingLogHandler log = CapturingLogHandler.attach(Resolver.class)) {
      project.resolve();

      assertThat(log.getMessages(Level.WARNING))
          .containsAtLeast(
              objects.getOrigin() + ": object_library objs has nothing to build and produces no"
                  + " output",
              archive.getOrigin() + ": static_library archive has nothing to build and produces"
                  + " no output");
    }
    assertThat(objects.getOutputNodes()).isEmpty();
    assertThat(archive.getOutputNodes()).isEmpty();
  }

  @Test
  public void objectLibraryObjectsAreLinkedDirectly() throws Exception {
    TestProjects.touch(project, "src/a.c", "src/main.c");
    Target objs = project.objectLibrary("objs", env, "src/a.c");
    Target app = project.program("app", env, "src/main.c").link(objs);

    project.resolve();

    assertThat(objs.getOutputNodes()).isEqualTo(objs.getObjectNodes());
    BuildStep link = app.getOutputNodes().get(0).getProducer().get();
    assertThat(names(link.getInputs()))
        .containsExactly("build/obj.app/src/main.o", "build/obj.objs/src/a.o")
        .inOrder();
  }

  @Test
  public void sharedLibraryIsCompiledPositionIndependent() throws Exception {
    TestProjects.touch(project, "src/plugin.c");
    Target plugin = project.sharedLibrary("plugin", env, "src/plugin.c");

    project.resolve();

    assertThat(names(plugin.getOutputNodes())).containsExactly("build/libplugin.so");
    BuildStep link = plugin.getOutputNodes().get(0).getProducer().get();
    assertThat(link.getCommandVariable()).isEqualTo("sharedcmd");
    assertThat(link.getCommand()).contains("-shared");
    BuildStep compile = plugin.getObjectNodes().get(0).getProducer().get();
    assertThat(compile.getVariables().get("extra_flags"))
        .containsExactly(CommandArg.literal("-fPIC"));
  }

  @Test
  public void commandTargetOutputsAreOrderOnlyInputsOfItsUsers() throws Exception {
    TestProjects.touch(project, "gen.py", "src/main.c");
    Target gen =
        project.command(
            "config_h", env, "python $$in -o $$out", ImmutableList.of("gen/config.h"), "gen.py");
    Target app = project.program("app", env, "src/main.c").linkPrivate(gen);

    project.resolve();

    assertThat(names(gen.getOutputNodes())).containsExactly("build/gen/config.h");
    BuildStep step = gen.getOutputNodes().get(0).getProducer().get();
    assertThat(step.getTool()).isEqualTo("command");
    assertThat(step.getCommand()).containsExactly("python", "$in", "-o", "$out").inOrder();
    assertThat(names(step.getInputs())).containsExactly("gen.py");

    Node object = app.getObjectNodes().get(0);
    assertThat(names(object.getOrderOnlyDeps())).containsExactly("build/gen/config.h");
    assertThat(names(app.getOutputNodes())).containsExactly("build/app");
  }

  @Test
  public void builderInvocationKeepsItsEnvironmentWhenRebound() throws Exception {
    TestProjects.touch(project, "msgs.proto", "more.proto");
    env.addTool("protoc").setCmd("protoc").set("gencmd", "$protoc.cmd $$in");
    BoundBuilder bound = env.addBuilder(ToolBuilder.of("proto", "protoc", "gencmd"));
    Environment other = env.clone("other");
    other.getTool("protoc").get().setCmd("protoc-other");

    Target msgs = bound.invoke("msgs", "msgs.pb.cc", "msgs.proto");
    BoundBuilder rebound = bound.rebind(other);
    Target more = rebound.invoke("more", "more.pb.cc", "more.proto");
    project.resolve();

    assertThat(bound.getEnvironment()).isSameInstanceAs(env);
    assertThat(env.getBuilder("proto").getEnvironment()).isSameInstanceAs(env);
    assertThat(msgs.getEnvironment()).isSameInstanceAs(env);
    BuildStep msgsStep = msgs.getOutputNodes().get(0).getProducer().get();
    assertThat(msgsStep.getEnvironmentName()).isEqualTo("default");
    assertThat(msgsStep.getCommand()).containsExactly("protoc", "$in").inOrder();
    BuildStep moreStep = more.getOutputNodes().get(0).getProducer().get();
    assertThat(moreStep.getEnvironmentName()).isEqualTo("other");
    assertThat(moreStep.getCommand()).containsExactly("protoc-other", "$in").inOrder();
  }

  @Test
  public void generatedSourcesAreCompiled() throws Exception {
    TestProjects.touch(project, "gen.py", "src/main.c");
    Target gen =
        project.command(
            "version_c", env, "python $$in $$out", ImmutableList.of("version.c"), "gen.py");
    Target app = project.program("app", env, "src/main.c", gen);

    project.resolve();

    assertThat(names(app.getObjectNodes()))
        .containsExactly("build/obj.app/src/main.o", "build/obj.app/version.o")
        .inOrder();
  }

  @Test
  public void aliasCollectsTargetOutputs() throws Exception {
    TestProjects.touch(project, "src/main.c");
    Target app = project.program("app", env, "src/main.c");
    Node all = project.alias("all", app);

    project.resolve();

    assertThat(names(all.getExplicitDeps())).containsExactly("build/app");
  }

  private static ImmutableList<String> names(List<? extends Node> nodes) {
    ImmutableList.Builder<String> names = ImmutableList.builder();
    for (Node node : nodes) {
      names.add(node.getName());
    }
    return names.build();
  }
}
