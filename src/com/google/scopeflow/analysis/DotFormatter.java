/*
 * Copyright 2026 The Scopeflow Authors.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package com.google.scopeflow.analysis;

import com.google.scopeflow.analysis.ControlFlowGraph.Branch;
import com.google.scopeflow.analysis.graph.DiGraph.DiGraphEdge;
import com.google.scopeflow.analysis.graph.DiGraph.DiGraphNode;
import com.google.scopeflow.tree.Node;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * Renders a tree in <a href="http://www.graphviz.org">Graphviz</a> dot syntax. Given the control
 * flow graph of one of its scopes, the flow edges are drawn over the tree in red. Edges to the
 * implicit return, and RETURN or RAISE statements, lead to an {@code EXIT} pseudo node. Unreachable
 * control points are gray.
 *
 * <p>{@code System.out.println(DotFormatter.toDot(module, cfg));}
 *
 * <p>Instances are single use and not thread safe.
 */
public final class DotFormatter {
  private static final String INDENT = "  ";
  private static final String EXIT = "EXIT";
  private static final String FLOW_EDGE_STYLE =
      "fontcolor=\"red\", weight=0.01, color=\"red\"";

  private final Map<Node, Integer> keys = new IdentityHashMap<>();
  private final Appendable out;
  private final @Nullable ControlFlowGraph<Node> cfg;
  private final @Nullable AnnotationStore liveness;

  private DotFormatter(
      Appendable out, @Nullable ControlFlowGraph<Node> cfg, @Nullable AnnotationStore liveness) {
    this.out = out;
    this.cfg = cfg;
    this.liveness = liveness;
  }

  /** Renders the tree rooted at {@code n}. */
  public static String toDot(Node n) throws IOException {
    return toDot(n, null);
  }

  /** Renders the tree rooted at {@code n} with the edges of {@code cfg} on top. */
  public static String toDot(Node n, @Nullable ControlFlowGraph<Node> cfg) throws IOException {
    StringBuilder sb = new StringBuilder();
    appendDot(n, cfg, sb);
    return sb.toString();
  }

  /**
   * Like {@link #toDot(Node, ControlFlowGraph)}, and also labels every control point that has
   * {@link NodeAnnotations#LIVE_IN} and {@link NodeAnnotations#LIVE_OUT} annotations in {@code
   * annotations} with them.
   */
  public static String toDotWithAnnotations(
      Node n, ControlFlowGraph<Node> cfg, AnnotationStore annotations) throws IOException {
    StringBuilder sb = new StringBuilder();
    new DotFormatter(sb, cfg, annotations).write(n);
    return sb.toString();
  }

  /** Appends the rendering of the tree rooted at {@code n} to {@code out}. */
  public static void appendDot(Node n, @Nullable ControlFlowGraph<Node> cfg, Appendable out)
      throws IOException {
    new DotFormatter(out, cfg, null).write(n);
  }

  static DotFormatter newInstanceForTesting() {
    return new DotFormatter(new StringBuilder(), null, null);
  }

  private void write(Node root) throws IOException {
    out.append("digraph AST {\n");
    line("node [color=lightblue2, style=filled];");
    writeSubtree(root);
    out.append("}\n");
  }

  private void writeSubtree(Node n) throws IOException {
    int parentKey = key(n);
    for (Node child : n.children()) {
      line(nodeId(parentKey) + " -> " + nodeId(key(child)) + " [weight=1];");
      writeSubtree(child);
    }
    if (cfg != null && cfg.hasNode(n)) {
      writeFlowEdges(n, parentKey);
    }
  }

  private void writeFlowEdges(Node n, int from) throws IOException {
    List<String> edges = new ArrayList<>();
    List<? extends DiGraphEdge<Node, Branch>> outEdges = cfg.getOutEdges(n);
    for (DiGraphEdge<Node, Branch> edge : outEdges) {
      DiGraphNode<Node, Branch> dest = edge.getDestination();
      String to = cfg.isImplicitReturn(dest) ? EXIT : nodeId(key(dest.getValue()));
      edges.add(flowEdge(from, to, edge.getValue().toString()));
    }
    Collections.sort(edges);
    for (String edge : edges) {
      line(edge);
    }
    if (outEdges.isEmpty() && isExit(n)) {
      line(flowEdge(from, EXIT, EXIT));
    }
  }

  private boolean isExit(Node n) {
    for (DiGraphNode<Node, Branch> exit : cfg.getExitNodes()) {
      if (exit.getValue() == n) {
        return true;
      }
    }
    return false;
  }

  /** Returns the key of {@code n}, declaring it on first use. */
  int key(Node n) throws IOException {
    Integer existing = keys.get(n);
    if (existing != null) {
      return existing;
    }
    int key = keys.size();
    keys.put(n, key);
    StringBuilder decl = new StringBuilder(nodeId(key)).append(" [label=\"").append(label(n));
    boolean inCfg = cfg != null && cfg.hasNode(n);
    if (liveness != null
        && inCfg
        && liveness.has(n, NodeAnnotations.LIVE_IN)
        && liveness.has(n, NodeAnnotations.LIVE_OUT)) {
      decl.append("\\nIN: ")
          .append(liveness.get(n, NodeAnnotations.LIVE_IN))
          .append(" OUT: ")
          .append(liveness.get(n, NodeAnnotations.LIVE_OUT));
    }
    decl.append('"');
    if (inCfg && !cfg.isReachable(n)) {
      decl.append(" color=\"gray\"");
    }
    line(decl.append("];").toString());
    return key;
  }

  private void line(String text) throws IOException {
    out.append(INDENT).append(text).append('\n');
  }

  private static String label(Node n) {
    switch (n.getToken()) {
      case NAME:
      case ATTRIBUTE:
      case STRING:
        return n.getToken() + "(" + n.getString().replace("\"", "\\\"") + ")";
      case NUMBER:
        return n.getToken() + "(" + Node.formatNumber(n.getDouble()) + ")";
      default:
        return n.getToken().toString();
    }
  }

  private static String flowEdge(int from, String to, String label) {
    return nodeId(from) + " -> " + to + " [label=\"" + label + "\", " + FLOW_EDGE_STYLE + "];";
  }

  private static String nodeId(int key) {
    return "node" + key;
  }
}
