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

package io.plait.graph;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSortedSet;
import java.io.IOException;
import java.util.function.Function;

/** Renders a {@link MutableDirectedGraph} in Graphviz dot syntax. */
public class Dot<T> {

  private static final ImmutableMap<String, String> TYPE_COLORS =
      ImmutableMap.<String, String>builder()
          .put("static_library", "springgreen3")
          .put("shared_library", "olivedrab3")
          .put("program", "indianred1")
          .put("interface", "lightskyblue")
          .put("object_library", "springgreen1")
          .put("custom", "mediumpurple1")
          .put("install", "gold2")
          .build();

  private final MutableDirectedGraph<T> graph;
  private final String graphName;
  private final Function<T, String> nodeToName;
  private final Function<T, String> nodeToTypeName;

  public static <T> Builder<T> builder(MutableDirectedGraph<T> graph, String graphName) {
    return new Builder<>(graph, graphName);
  }

  /**
   * Builder class for Dot output
   *
   * @param <T>
   */
  public static class Builder<T> {

    private final MutableDirectedGraph<T> graph;
    private final String graphName;
    private Function<T, String> nodeToName;
    private Function<T, String> nodeToTypeName;

    private Builder(MutableDirectedGraph<T> graph, String graphName) {
      this.graph = graph;
      this.graphName = graphName;
      nodeToName = Object::toString;
      nodeToTypeName = Object::toString;
    }

    public Builder<T> setNodeToName(Function<T, String> func) {
      nodeToName = func;
      return this;
    }

    public Builder<T> setNodeToTypeName(Function<T, String> func) {
      nodeToTypeName = func;
      return this;
    }

    public Dot<T> build() {
      return new Dot<>(this);
    }
  }

  private Dot(Builder<T> builder) {
    this.graph = builder.graph;
    this.graphName = builder.graphName;
    this.nodeToName = builder.nodeToName;
    this.nodeToTypeName = builder.nodeToTypeName;
  }

  /** Writes out the graph in dot format to the given output */
  public void writeOutput(Appendable output) throws IOException {
    // Sorting the lines to have deterministic output and be able to test this.
    ImmutableSortedSet.Builder<String> lines = ImmutableSortedSet.naturalOrder();
    for (T node : graph.getNodes()) {
      lines.add(printNode(node));
      for (T sink : graph.getOutgoingNodesFor(node)) {
        lines.add(printEdge(node, sink));
      }
    }

    output.append("digraph ").append(escape(graphName)).append(" {\n");
    for (String line : lines.build()) {
      output.append(line);
    }
    output.append("}\n");
  }

  static String escape(String str) {
    // decide if node name should be escaped according to DOT specification
    // https://en.wikipedia.org/wiki/DOT_(graph_description_language)
    boolean needEscape =
        str.isEmpty()
            || !str.chars().allMatch(c -> Character.isLetterOrDigit(c) || c == '_')
            || Character.isDigit(str.charAt(0));
    if (!needEscape) {
      return str;
    }
    return "\"" + str.replace("\\", "\\\\").replace("\"", "\\\"") + "\"";
  }

  public static String colorFromType(String type) {
    String color = TYPE_COLORS.get(type);
    if (color != null) {
      return color;
    }
    int hash = type.hashCode() & Integer.MAX_VALUE;
    int r = 192 + (hash % 64);
    int g = 192 + (hash / 64 % 64);
    int b = 192 + (hash / 4096 % 64);
    return String.format("\"#%02X%02X%02X\"", r, g, b);
  }

  private String printNode(T node) {
    return String.format(
        "  %s [style=filled,color=%s];\n",
        escape(nodeToName.apply(node)),
        colorFromType(nodeToTypeName.apply(node)));
  }

  private String printEdge(T source, T sink) {
    return String.format(
        "  %s -> %s;\n", escape(nodeToName.apply(source)), escape(nodeToName.apply(sink)));
  }
}
