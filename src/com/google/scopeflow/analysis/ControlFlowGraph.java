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

import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.scopeflow.analysis.graph.GraphReachability;
import com.google.scopeflow.analysis.graph.LinkedDirectedGraph;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.Set;
import org.jspecify.annotations.Nullable;

/**
 * Control flow graph of one scope.
 *
 * <p>Control that runs off the end of the scope goes to the {@link #getImplicitReturn implicit
 * return}, a special node whose value is null. Every branch therefore has an edge: an IF without an
 * else at the end of the scope still has its ON_FALSE edge, to the implicit return. RETURN and RAISE
 * statements are sinks without out edges.
 *
 * <p>A control point from which control can leave the scope, through an edge to the implicit return
 * or by being a RETURN or RAISE, is an {@link #getExitNodes exit node}. Control points that cannot
 * be reached from the entry are kept in the graph without edges into them.
 *
 * @param <N> The instruction type of the control flow graph.
 */
public class ControlFlowGraph<N> extends LinkedDirectedGraph<N, ControlFlowGraph.Branch> {

  /** Stands for leaving the scope. Keyed by the value null. */
  private final DiGraphNode<N, Branch> implicitReturn;

  private final DiGraphNode<N, Branch> entry;

  private final Set<N> exits = new LinkedHashSet<>();

  private @Nullable ImmutableSet<N> reachable;
  private boolean implicitReturnReachable;

  ControlFlowGraph(N entry) {
    this.implicitReturn = createDirectedGraphNode(null);
    this.entry = createNode(entry);
  }

  /**
   * Gets the entry point of the control flow graph. This is the root of the scope, which stands for
   * entering the scope and binding its parameters.
   *
   * @return The entry point.
   */
  public DiGraphNode<N, Branch> getEntry() {
    return entry;
  }

  /** Gets the implicit return node. Its value is null. */
  public DiGraphNode<N, Branch> getImplicitReturn() {
    return implicitReturn;
  }

  public boolean isImplicitReturn(DiGraphNode<N, Branch> node) {
    return node == implicitReturn;
  }

  /** Returns every node except the implicit return, in creation order. */
  public ImmutableList<DiGraphNode<N, Branch>> getControlPoints() {
    ImmutableList.Builder<DiGraphNode<N, Branch>> result = ImmutableList.builder();
    for (DiGraphNode<N, Branch> node : getNodes()) {
      if (node != implicitReturn) {
        result.add(node);
      }
    }
    return result.build();
  }

  /** Marks {@code value} as a node from which control can leave the scope. */
  void addExit(N value) {
    createNode(value);
    exits.add(value);
  }

  /** Connects {@code value} to the implicit return and marks it as an exit. */
  void connectToImplicitReturn(N value, Branch branch) {
    addExit(value);
    connectIfNotFound(value, branch, implicitReturn.getValue());
  }

  /** Computes the nodes reachable from the entry. Must be called once the graph is complete. */
  void computeReachability() {
    ImmutableSet<N> fromEntry =
        new GraphReachability<N, Branch>(this, edge -> edge.getDestination() != implicitReturn)
            .compute(entry.getValue());
    boolean returns = false;
    for (DiGraphEdge<N, Branch> edge : implicitReturn.getInEdges()) {
      returns |= fromEntry.contains(edge.getSource().getValue());
    }
    reachable = fromEntry;
    implicitReturnReachable = returns;
  }

  /** Whether the node of {@code value} can be reached from the entry; null is the implicit return. */
  public boolean isReachable(@Nullable N value) {
    checkState(reachable != null, "Reachability was not computed");
    return value == null ? implicitReturnReachable : reachable.contains(value);
  }

  /** Returns the control points that cannot be reached from the entry, in creation order. */
  public ImmutableList<N> getUnreachableNodes() {
    ImmutableList.Builder<N> unreachable = ImmutableList.builder();
    for (DiGraphNode<N, Branch> node : getControlPoints()) {
      if (!isReachable(node.getValue())) {
        unreachable.add(node.getValue());
      }
    }
    return unreachable.build();
  }

  /** Returns the reachable control points from which control can leave the scope. */
  public ImmutableList<DiGraphNode<N, Branch>> getExitNodes() {
    ImmutableList.Builder<DiGraphNode<N, Branch>> result = ImmutableList.builder();
    for (N exit : exits) {
      if (isReachable(exit)) {
        result.add(getNode(exit));
      }
    }
    return result.build();
  }

  /**
   * Returns the reachable nodes without out edges: the RETURN and RAISE statements, and the implicit
   * return when control can run off the end of the scope.
   */
  public ImmutableList<DiGraphNode<N, Branch>> getSinks() {
    ImmutableList.Builder<DiGraphNode<N, Branch>> sinks = ImmutableList.builder();
    for (DiGraphNode<N, Branch> node : getNodes()) {
      if (node.getOutEdges().isEmpty() && isReachable(node.getValue())) {
        sinks.add(node);
      }
    }
    return sinks.build();
  }

  /**
   * Gets a comparator for the nodes. The default implementation returns {@code null}.
   *
   * @param isForward Whether the comparator sorts the nodes in the direction of the flow.
   * @return a comparator or null (in particular, if not overridden)
   */
  public @Nullable Comparator<DiGraphNode<N, Branch>> getOptionalNodeComparator(
      boolean isForward) {
    return null;
  }

  /** The edge object for the control flow graph. */
  public static enum Branch {
    /** Edge is taken if the condition is true. */
    ON_TRUE,
    /** Edge is taken if the condition is false. */
    ON_FALSE,
    /** Unconditional branch. */
    UNCOND;

    public boolean isConditional() {
      return this == ON_TRUE || this == ON_FALSE;
    }
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder("CFG:\n");
    for (DiGraphEdge<N, Branch> e : getEdges()) {
      sb.append(e.getSource()).append(" -> ").append(e.getValue()).append(" -> ");
      sb.append(e.getDestination() == implicitReturn ? "EXIT" : e.getDestination()).append('\n');
    }
    for (N exit : exits) {
      if (getNode(exit).getOutEdges().isEmpty()) {
        sb.append(exit).append(" -> EXIT\n");
      }
    }
    return sb.toString();
  }
}
