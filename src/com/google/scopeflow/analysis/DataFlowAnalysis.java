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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.primitives.Ints;
import com.google.scopeflow.analysis.ControlFlowGraph.Branch;
import com.google.scopeflow.analysis.graph.DiGraph.DiGraphEdge;
import com.google.scopeflow.analysis.graph.DiGraph.DiGraphNode;
import com.google.scopeflow.analysis.graph.LatticeElement;
import java.util.ArrayDeque;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;
import java.util.Queue;
import java.util.Set;
import org.jspecify.annotations.Nullable;

/**
 * Worklist solver for monotone dataflow problems over a {@link ControlFlowGraph}.
 *
 * <p>An analysis picks a direction, a lattice, a transfer function ({@link #flowThrough}) and a
 * join ({@link #createFlowJoiner}). After {@link #analyze()}, {@link #getFlowState} returns the
 * {@link LinearFlowState} of every graph node at the fixed point. The states belong to the
 * analysis and the graph is left untouched, so several analyses can share one graph. "Upstream"
 * below means predecessors for a forward analysis and successors for a backward one.
 *
 * <p>The implicit return is never visited. A backward analysis sees the boundary state {@link
 * #createEntryLattice()} there; a forward analysis joins the states flowing into it once the fixed
 * point is reached.
 *
 * <p>Lattices have finite height and transfer functions are monotone, so each state grows a bounded
 * number of times. {@link #getMaxSteps()} turns that into a hard limit; hitting it is a bug in the
 * analysis.
 *
 * @param <N> The control flow graph's node value type.
 * @param <L> Lattice element type.
 */
abstract class DataFlowAnalysis<N, L extends LatticeElement> {

  /** Per-node visit allowance used by the default {@link #getMaxSteps()}. */
  static final int MAX_STEPS_PER_NODE = 20000;

  private final ControlFlowGraph<N> cfg;
  private final Worklist<DiGraphNode<N, Branch>> worklist;
  private final Map<DiGraphNode<N, Branch>, LinearFlowState<L>> states = new HashMap<>();
  private int steps;

  DataFlowAnalysis(ControlFlowGraph<N> cfg) {
    this.cfg = cfg;
    this.worklist = new Worklist<>(cfg.getOptionalNodeComparator(isForward()));
  }

  final ControlFlowGraph<N> getCfg() {
    return cfg;
  }

  /** Whether facts flow along edges ({@code true}) or against them. */
  abstract boolean isForward();

  /**
   * Returns a fresh joiner. It sees every upstream state of one node and then produces the merged
   * state. Nodes with a single upstream edge skip the joiner.
   */
  abstract FlowJoiner<L> createFlowJoiner();

  /** Accumulates upstream states into one. */
  interface FlowJoiner<L> {
    void joinFlow(L input);

    L finish();
  }

  /** Transfer function. {@code input} must not be mutated. */
  abstract L flowThrough(N node, L input);

  /** Bottom of the lattice; every state starts here. */
  abstract L createInitialEstimateLattice();

  /**
   * The boundary state: the in-state of the entry of a forward analysis, and the state seen by any
   * node with no upstream edge.
   */
  abstract L createEntryLattice();

  /** Node visits after which {@link #analyze()} gives up. */
  int getMaxSteps() {
    return defaultStepBound(cfg.getNodeCount());
  }

  /** {@link #MAX_STEPS_PER_NODE} visits for every node, saturated at {@link Integer#MAX_VALUE}. */
  static int defaultStepBound(int nodeCount) {
    return Ints.saturatedCast((long) nodeCount * MAX_STEPS_PER_NODE);
  }

  /**
   * A bound for gen/kill problems over {@code facts} facts: every node is visited once up front,
   * and afterwards only when the state of a neighbour grew, which happens at most once per fact and
   * edge. Saturated at {@link Integer#MAX_VALUE}.
   */
  static int propagationStepBound(int nodeCount, int edgeCount, int facts) {
    return Ints.saturatedCast(2 * (nodeCount + (long) edgeCount * (facts + 1L)));
  }

  /** Node visits made by the most recent {@link #analyze()}. */
  final int getStepCount() {
    return steps;
  }

  /**
   * Returns the state of {@code node} computed by the last {@link #analyze()}.
   *
   * @throws IllegalArgumentException if the analysis has not run or the node is not in the graph
   */
  final LinearFlowState<L> getFlowState(DiGraphNode<N, Branch> node) {
    LinearFlowState<L> state = states.get(node);
    checkArgument(state != null, "No flow state for %s", node);
    return state;
  }

  /**
   * Solves the problem from scratch, replacing the states of the previous run.
   *
   * @throws AnalysisInternalError if the solution is not reached within {@link #getMaxSteps()}
   */
  final void analyze() {
    reset();
    int limit = getMaxSteps();
    while (!worklist.isEmpty()) {
      DiGraphNode<N, Branch> node = worklist.poll();
      if (steps++ >= limit) {
        throw new AnalysisInternalError(
            "Dataflow analysis failed to converge; it appears to diverge around "
                + node
                + " after "
                + limit
                + " steps",
            null);
      }
      LinearFlowState<L> state = states.get(node);
      state.stepCount++;
      state.setUpstream(isForward(), mergeUpstream(node));
      L before = state.getDownstream(isForward());
      L after = flowThrough(node.getValue(), state.getUpstream(isForward()));
      state.setDownstream(isForward(), after);
      if (!after.equals(before)) {
        for (DiGraphNode<N, Branch> next : downstreamNodes(node)) {
          if (!cfg.isImplicitReturn(next)) {
            worklist.add(next);
          }
        }
      }
    }
    if (isForward()) {
      LinearFlowState<L> exit = states.get(cfg.getImplicitReturn());
      L joined = mergeUpstream(cfg.getImplicitReturn());
      exit.setUpstream(true, joined);
      exit.setDownstream(true, joined);
    }
  }

  private void reset() {
    steps = 0;
    worklist.clear();
    states.clear();
    for (DiGraphNode<N, Branch> node : cfg.getControlPoints()) {
      states.put(
          node,
          new LinearFlowState<>(createInitialEstimateLattice(), createInitialEstimateLattice()));
      worklist.add(node);
    }
    L boundary = isForward() ? createInitialEstimateLattice() : createEntryLattice();
    states.put(cfg.getImplicitReturn(), new LinearFlowState<>(boundary, boundary));
  }

  private L mergeUpstream(DiGraphNode<N, Branch> node) {
    if (isForward() && node == cfg.getEntry()) {
      return createEntryLattice();
    }
    List<? extends DiGraphEdge<N, Branch>> edges =
        isForward() ? node.getInEdges() : node.getOutEdges();
    if (edges.isEmpty()) {
      return createEntryLattice();
    }
    if (edges.size() == 1) {
      return upstreamState(edges.get(0));
    }
    FlowJoiner<L> joiner = createFlowJoiner();
    for (DiGraphEdge<N, Branch> edge : edges) {
      joiner.joinFlow(upstreamState(edge));
    }
    return joiner.finish();
  }

  private L upstreamState(DiGraphEdge<N, Branch> edge) {
    DiGraphNode<N, Branch> upstream = isForward() ? edge.getSource() : edge.getDestination();
    return states.get(upstream).getDownstream(isForward());
  }

  private List<? extends DiGraphNode<N, Branch>> downstreamNodes(DiGraphNode<N, Branch> node) {
    return isForward() ? cfg.getDirectedSuccNodes(node) : cfg.getDirectedPredNodes(node);
  }

  /** The in and out states of a node. */
  static final class LinearFlowState<L> {
    private int stepCount = 0;
    private L in;
    private L out;

    private LinearFlowState(L in, L out) {
      this.in = checkNotNull(in);
      this.out = checkNotNull(out);
    }

    int getStepCount() {
      return stepCount;
    }

    L getIn() {
      return in;
    }

    L getOut() {
      return out;
    }

    private L getUpstream(boolean forward) {
      return forward ? in : out;
    }

    private L getDownstream(boolean forward) {
      return forward ? out : in;
    }

    private void setUpstream(boolean forward, L value) {
      checkNotNull(value);
      if (forward) {
        in = value;
      } else {
        out = value;
      }
    }

    private void setDownstream(boolean forward, L value) {
      setUpstream(!forward, value);
    }

    @Override
    public String toString() {
      return String.format("IN: %s OUT: %s", in, out);
    }
  }

  /** FIFO or priority queue that holds each element at most once. */
  private static final class Worklist<T> {
    private final Set<T> pending = new HashSet<>();
    private final Queue<T> queue;

    Worklist(@Nullable Comparator<T> order) {
      this.queue = order == null ? new ArrayDeque<>() : new PriorityQueue<>(order);
    }

    boolean isEmpty() {
      return queue.isEmpty();
    }

    T poll() {
      T next = queue.remove();
      pending.remove(next);
      return next;
    }

    void add(T element) {
      if (pending.add(element)) {
        queue.add(element);
      }
    }

    void clear() {
      pending.clear();
      queue.clear();
    }
  }
}
