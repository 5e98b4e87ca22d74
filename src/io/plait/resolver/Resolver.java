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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Iterables;
import io.plait.env.Environment;
import io.plait.graph.AbstractAcyclicDepthFirstPostOrderTraversal.CycleException;
import io.plait.graph.MutableDirectedGraph;
import io.plait.graph.TopologicalSort;
import io.plait.log.Logger;
import io.plait.model.AliasNode;
import io.plait.model.BuildStep;
import io.plait.model.DirNode;
import io.plait.model.FileNode;
import io.plait.model.Node;
import io.plait.model.NodeRegistry;
import io.plait.project.Project;
import io.plait.target.DeferredOperation;
import io.plait.target.Target;
import io.plait.target.TargetKind;
import io.plait.target.TransitiveRequirements;
import io.plait.target.UsageRequirements;
import io.plait.util.HumanReadableException;
import io.plait.util.Origin;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import javax.annotation.Nullable;

/**
 * Turns a project's declared targets into nodes with build steps.
 *
 * <p>Targets are visited in dependency order. The first pass compiles sources and creates the
 * outputs of build targets. The second pass applies deferred operations, such as installs, which
 * read other targets' outputs; by then every build target has them, so declaration order does not
 * matter. Finally every source file an input refers to must exist.
 *
 * <p>Resolving again only handles targets added since the previous run.
 */
public class Resolver implements DeferredOperation.Context {

  private static final Logger LOG = Logger.get(Resolver.class);

  private final Project project;
  private final NodeRegistry registry;
  private final ObjectNodeFactory objectNodeFactory;
  private final OutputNodeFactory outputNodeFactory;
  private final InstallNodeFactory installNodeFactory;
  private final Set<Target> built = new HashSet<>();
  private final Map<Target, ImmutableSet<String>> languages = new HashMap<>();

  public Resolver(Project project) {
    this.project = project;
    this.registry = project.getNodeRegistry();
    this.objectNodeFactory = new ObjectNodeFactory(registry);
    this.outputNodeFactory = new OutputNodeFactory(registry);
    this.installNodeFactory = new InstallNodeFactory(registry, outputNodeFactory);
  }

  /**
   * @throws DependencyCycleException if targets depend on each other in a cycle.
   * @throws MissingToolException if a source or step needs a tool the environment lacks.
   * @throws MissingSourceException if an input file is neither produced nor on disk.
   */
  public void resolve() {
    ImmutableList<Target> order = getBuildOrder();
    int count = 0;
    for (Target target : order) {
      if (!target.isResolved() && !built.contains(target)) {
        resolveBuildTarget(target);
        built.add(target);
        count++;
      }
    }
    for (Target target : order) {
      if (!target.isResolved()) {
        for (DeferredOperation operation : target.getDeferredOperations()) {
          LOG.debug("Applying %s to %s", operation, target.getName());
          target.addOutputNodes(operation.apply(target, this));
        }
        target.markResolved();
      }
    }
    bindAliases();
    checkSources();
    if (count > 0) {
      LOG.info(
          "Resolved %d targets of %s into %d nodes", count, project.getName(), registry.size());
    }
  }

  /** @return every target of the project, each after the targets it depends on. */
  public ImmutableList<Target> getBuildOrder() {
    MutableDirectedGraph<Target> graph = new MutableDirectedGraph<>();
    for (Target target : project.getTargets()) {
      graph.addNode(target);
      for (Target dep : target.getDependencies()) {
        graph.addEdge(target, dep);
      }
    }
    try {
      return TopologicalSort.sort(graph);
    } catch (CycleException e) {
      throw toDependencyCycle(e);
    }
  }

  private void resolveBuildTarget(Target target) {
    LOG.debug("Resolving %s %s", target.getKind().getTypeName(), target.getName());
    switch (target.getKind()) {
      case INTERFACE:
      case INSTALL:
        break;
      case CUSTOM:
        ImmutableList<Node> inputs = resolveSources(target, target.getSources());
        target.addOutputNodes(outputNodeFactory.createCustomOutputs(target, inputs));
        break;
      default:
        resolveCompiledTarget(target);
        break;
    }
    if (target.getDeferredOperations().isEmpty()) {
      target.markResolved();
    }
  }

  private void resolveCompiledTarget(Target target) {
    Environment environment = target.getEnvironment();
    UsageRequirements requirements = TransitiveRequirements.getCompileRequirements(target);
    ImmutableList<Node> orderOnly = getGeneratedInputs(target);

    Set<Node> objects = new LinkedHashSet<>();
    List<Node> linkInputs = new ArrayList<>();
    Set<String> targetLanguages = new TreeSet<>();
    for (Object source : target.getSources()) {
      boolean generated = source instanceof Target;
      for (Node node : resolveSource(target, source)) {
        if (!(node instanceof FileNode)) {
          throw new HumanReadableException(
              "%s: cannot build %s, it is not a file", target.getName(), node.getName());
        }
        FileNode file = (FileNode) node;
        String suffix = file.getSuffix();
        Optional<ObjectNodeFactory.Handler> handler =
            ObjectNodeFactory.findHandler(environment, suffix);
        if (handler.isPresent()) {
          objects.add(
              objectNodeFactory.createObject(target, file, handler.get(), requirements, orderOnly));
          targetLanguages.add(handler.get().getSourceHandler().getLanguage());
        } else if (generated) {
          linkInputs.add(file);
        } else if (!ObjectNodeFactory.isHeader(environment, suffix)) {
          throw MissingToolException.noHandler(
              target.getName(),
              environment.getName(),
              suffix,
              file.getPath().toString(),
              target.getOrigin());
        }
      }
    }
    target.setObjectNodes(objects);
    languages.put(target, ImmutableSet.copyOf(targetLanguages));

    ImmutableList<Node> inputs = ImmutableList.copyOf(Iterables.concat(objects, linkInputs));
    switch (target.getKind()) {
      case OBJECT_LIBRARY:
        if (objects.isEmpty()) {
          warnNoOutput(target);
        }
        target.addOutputNodes(objects);
        break;
      case STATIC_LIBRARY:
        if (inputs.isEmpty()) {
          warnNoOutput(target);
        } else {
          target.addOutputNodes(
              ImmutableList.of(outputNodeFactory.createStaticLibrary(target, inputs)));
        }
        break;
      case SHARED_LIBRARY:
      case PROGRAM:
        resolveLinkedTarget(target, inputs, targetLanguages);
        break;
      default:
        throw new IllegalStateException("not a compiled kind: " + target.getKind());
    }
  }

  private void resolveLinkedTarget(
      Target target, ImmutableList<Node> ownInputs, Set<String> targetLanguages) {
    ImmutableList<Target> deps;
    try {
      deps = TransitiveRequirements.getLinkDependencies(target);
    } catch (CycleException e) {
      throw toDependencyCycle(e);
    }

    Set<Node> inputs = new LinkedHashSet<>(ownInputs);
    List<Node> libraries = new ArrayList<>();
    Set<String> linkLanguages = new TreeSet<>(targetLanguages);
    for (Target dep : deps) {
      linkLanguages.addAll(languages.getOrDefault(dep, ImmutableSet.of()));
      if (dep.getKind() == TargetKind.OBJECT_LIBRARY) {
        inputs.addAll(dep.getObjectNodes());
      } else if (dep.getKind().isLinkable()) {
        libraries.addAll(dep.getOutputNodes());
      }
    }
    if (inputs.isEmpty() && libraries.isEmpty()) {
      warnNoOutput(target);
      return;
    }

    UsageRequirements requirements = TransitiveRequirements.getLinkRequirements(target, deps);
    target.addOutputNodes(
        ImmutableList.of(
            outputNodeFactory.createLinkedOutput(
                target,
                ImmutableList.copyOf(Iterables.concat(inputs, libraries)),
                requirements,
                linkLanguages)));
  }

  /** Outputs of custom targets this target is built against, e.g. generated headers. */
  private ImmutableList<Node> getGeneratedInputs(Target target) {
    ImmutableList.Builder<Node> nodes = ImmutableList.builder();
    for (Target dep : TransitiveRequirements.getCompileDependencies(target)) {
      if (dep.getKind() == TargetKind.CUSTOM) {
        nodes.addAll(dep.getOutputNodes());
      }
    }
    return nodes.build();
  }

  private static void warnNoOutput(Target target) {
    LOG.warn(
        "%s: %s %s has nothing to build and produces no output",
        target.getOrigin(),
        target.getKind().getTypeName(),
        target.getName());
  }

  @Override
  public ImmutableList<Node> resolveSources(Target owner, Iterable<?> sources) {
    ImmutableList.Builder<Node> nodes = ImmutableList.builder();
    for (Object source : sources) {
      nodes.addAll(resolveSource(owner, source));
    }
    return nodes.build();
  }

  @Override
  public Node copy(Target owner, Node source, String destination) {
    return installNodeFactory.createCopy(owner, source, destination);
  }

  private ImmutableList<Node> resolveSource(Target owner, Object source) {
    if (source instanceof Target) {
      Target target = (Target) source;
      if (!target.isResolved()) {
        throw new HumanReadableException(
            "%s uses the outputs of %s, which are only known after installs are resolved",
            owner.getName(),
            target.getName());
      }
      return target.getOutputNodes();
    }
    if (source instanceof Node) {
      return ImmutableList.of((Node) source);
    }
    if (source instanceof Path) {
      return ImmutableList.of(registry.file((Path) source, owner.getOrigin()));
    }
    if (source instanceof String) {
      return ImmutableList.of(
          registry.file(registry.toPath((String) source), owner.getOrigin()));
    }
    throw new HumanReadableException(
        "%s: %s is not a valid source (%s)",
        owner.getName(),
        source,
        source.getClass().getSimpleName());
  }

  private void bindAliases() {
    for (Map.Entry<AliasNode, ImmutableList<Object>> entry :
        project.getAliasMembers().entrySet()) {
      AliasNode alias = entry.getKey();
      for (Object member : entry.getValue()) {
        Iterable<Node> nodes;
        if (member instanceof Target) {
          nodes = ((Target) member).getOutputNodes();
        } else if (member instanceof Node) {
          nodes = ImmutableList.of((Node) member);
        } else if (member instanceof Path) {
          nodes = ImmutableList.of(registry.file((Path) member, alias.getOrigin()));
        } else {
          nodes =
              ImmutableList.of(
                  registry.file(registry.toPath(String.valueOf(member)), alias.getOrigin()));
        }
        for (Node node : nodes) {
          alias.addExplicitDep(node);
        }
      }
    }
  }

  private void checkSources() {
    Set<Node> checked = new HashSet<>();
    for (Node node : registry.getNodes()) {
      Optional<BuildStep> producer = node.getProducer();
      if (producer.isPresent()) {
        for (Node input : producer.get().getInputs()) {
          checkExists(input, producer.get().getTargetName().orElse(null), checked);
        }
      }
      if (node instanceof DirNode) {
        for (Node member : ((DirNode) node).getMembers()) {
          checkExists(member, null, checked);
        }
      }
      if (node instanceof AliasNode) {
        for (Node member : node.getExplicitDeps()) {
          checkExists(member, null, checked);
        }
      }
    }
  }

  private void checkExists(Node node, @Nullable String targetName, Set<Node> checked) {
    if (!(node instanceof FileNode) || !node.isSource() || !checked.add(node)) {
      return;
    }
    Path path = ((FileNode) node).getPath();
    if (!Files.exists(registry.toAbsolute(path))) {
      throw new MissingSourceException(path, targetName, node.getOrigin());
    }
  }

  private static DependencyCycleException toDependencyCycle(CycleException e) {
    ImmutableList<?> cycle = e.getCycle();
    @Nullable Origin origin = cycle.isEmpty() ? null : ((Target) cycle.get(0)).getOrigin();
    return new DependencyCycleException(cycle, origin);
  }
}
